/*
 * Copyright 2024 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.metaexpr.util;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.metaexpr.errors.InternalTreeError;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Utilities {
    private Utilities() {}

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws. */
    public static void enforce(boolean expression) {
        if (!expression)
            throw new InternalTreeError("Assertion failed");
    }

    /** A custom version of assert.
     * @param expression  When this expression is false, this function throws.
     * @param message     Message for exception when expression is false */
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalTreeError(message);
    }

    /** An object mapper which produces the same output on every run. */
    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .build();
    }

    /** Add a value to a map; the key must not be already present. */
    public static <K, V, VE extends V> VE putNew(Map<K, V> map, K key, VE value) {
        V previous = map.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        if (previous != null)
            throw new InternalTreeError("Key " + key + " already mapped to " + previous + " when adding " + value);
        return value;
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty(), "Removing from empty list");
        return data.remove(data.size() - 1);
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Extracting last element from empty list");
        return data.get(data.size() - 1);
    }
}
