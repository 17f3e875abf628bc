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

package org.metaexpr.equivalence;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.EnumSet;

/** Options of {@link ExprEqualityComparer}.  Each flag makes the comparison
 * skip one attribute which is only useful for debugging. */
public enum EqualityComparerFlags {
    IGNORE_LABEL_NAME,
    IGNORE_LAMBDA_NAME,
    /** Ignore the delegate type of lambdas; their return types are still compared. */
    IGNORE_LAMBDA_TYPE,
    IGNORE_PARAMETER_NAME;

    public static final ImmutableSet<EqualityComparerFlags> DEFAULT =
            Sets.immutableEnumSet(EnumSet.allOf(EqualityComparerFlags.class));
    public static final ImmutableSet<EqualityComparerFlags> NONE = ImmutableSet.of();
}
