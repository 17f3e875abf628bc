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

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.metaexpr.errors.InternalTreeError;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.Bijection;

import javax.annotation.Nullable;
import java.lang.reflect.Executable;
import java.lang.reflect.Member;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** State of one comparison or hash computation.
 * Bound entities (parameters and label targets) have no structure of their own:
 * when comparing they are paired between the two trees on first sight,
 * when hashing they are numbered in the order they are first seen.
 * A context must not be reused. */
public final class EquivalenceContext {
    final Set<EqualityComparerFlags> flags;
    final Bijection<IExprNode, IExprNode> bound;
    final Map<IExprNode, Integer> ordinals;
    final Hasher hasher;

    EquivalenceContext(Set<EqualityComparerFlags> flags) {
        this.flags = flags;
        this.bound = new Bijection<>();
        this.ordinals = new HashMap<>();
        this.hasher = Hashing.murmur3_32_fixed().newHasher();
    }

    public boolean has(EqualityComparerFlags flag) {
        return this.flags.contains(flag);
    }

    /** Check that left and right are bound to each other, pairing them if neither is bound yet. */
    public boolean compareReferenceId(IExprNode left, IExprNode right) {
        return this.bound.pair(left, right);
    }

    /** Compare two scalar attributes. */
    public boolean compare(@Nullable Object left, @Nullable Object right) {
        if (left instanceof IExprNode || right instanceof IExprNode)
            throw new InternalTreeError("Tree nodes must be compared structurally: " + left + " and " + right);
        return Objects.equals(left, right);
    }

    public EquivalenceContext hashReferenceId(IExprNode node) {
        int ordinal = this.ordinals.computeIfAbsent(node, n -> this.ordinals.size() + 1);
        this.hasher.putInt(ordinal);
        return this;
    }

    public EquivalenceContext hash(int value) {
        this.hasher.putInt(value);
        return this;
    }

    public EquivalenceContext hash(boolean value) {
        this.hasher.putBoolean(value);
        return this;
    }

    public EquivalenceContext hash(@Nullable String value) {
        if (value == null)
            return this.hash(0);
        this.hasher.putInt(value.length()).putString(value, StandardCharsets.UTF_8);
        return this;
    }

    public EquivalenceContext hash(@Nullable Enum<?> value) {
        return this.hash(value == null ? -1 : value.ordinal());
    }

    /** Classes hash by name, which is stable across runs. */
    public EquivalenceContext hash(@Nullable Class<?> value) {
        return this.hash(value == null ? null : value.getName());
    }

    public EquivalenceContext hash(@Nullable Member member) {
        if (member == null)
            return this.hash(0);
        this.hash(member.getDeclaringClass()).hash(member.getName());
        if (member instanceof Executable) {
            Class<?>[] parameters = ((Executable) member).getParameterTypes();
            this.hash(parameters.length);
            for (Class<?> parameter : parameters)
                this.hash(parameter);
        }
        return this;
    }

    /** Hash a value using its own hashCode. */
    public EquivalenceContext hashValue(@Nullable Object value) {
        if (value instanceof IExprNode)
            throw new InternalTreeError("Tree nodes must be hashed structurally: " + value);
        return this.hash(Objects.hashCode(value));
    }

    public int toHashCode() {
        return this.hasher.hash().asInt();
    }
}
