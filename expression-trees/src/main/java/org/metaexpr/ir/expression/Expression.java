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

package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.equivalence.ExprEqualityComparer;
import org.metaexpr.errors.EvaluationException;
import org.metaexpr.interpreter.Evaluator;
import org.metaexpr.ir.ExprNode;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.visitors.inner.ContainsNodes;
import org.metaexpr.visitors.inner.Expand;
import org.metaexpr.visitors.inner.FlatNode;
import org.metaexpr.visitors.inner.Flatten;
import org.metaexpr.visitors.inner.ReduceRecursive;
import org.metaexpr.visitors.inner.ReplaceNodes;
import org.metaexpr.visitors.inner.Snapshot;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.util.Map;

/** Base class for all expression nodes.
 * An expression has a static type, the type of the value it produces. */
public abstract class Expression extends ExprNode {
    public final Class<?> type;

    protected Expression(Class<?> type) {
        this.type = type;
    }

    public Class<?> getType() {
        return this.type;
    }

    public abstract ExprKind getKind();

    /** True if this node can be rewritten into simpler nodes by {@link #reduce()}. */
    public boolean canReduce() {
        return false;
    }

    /** Rewrite this node into an equivalent tree made of simpler nodes. */
    public Expression reduce() {
        throw this.error("Node cannot be reduced");
    }

    /** Reduce this node, checking that the reduction produced a different node
     * of a compatible type. */
    public Expression reduceAndCheck() {
        if (!this.canReduce())
            throw this.error("Node cannot be reduced");
        Expression result = this.reduce();
        if (result == this)
            throw this.error("Reduction returned the same node");
        if (!this.type.isAssignableFrom(result.type) && this.type != void.class)
            throw this.error("Reduction changed the type from " + this.type.getSimpleName() +
                    " to " + result.type.getSimpleName());
        return result;
    }

    @Override
    public boolean sameFields(IExprNode other) {
        return this == other;
    }

    /** Inline all invoke, capture, compile and declaration markers. */
    @CheckReturnValue
    public Expression expand() {
        return new Expand().apply(this);
    }

    /** Replace all closure members with constants holding their current values. */
    @CheckReturnValue
    public Expression snapshot() {
        return new Snapshot().apply(this);
    }

    /** True if any of the nodes appears in this tree (compared by reference). */
    public boolean contains(Expression... nodes) {
        return ContainsNodes.contains(this, nodes);
    }

    /** Replace every occurrence of oldNode (by reference) with newNode. */
    @CheckReturnValue
    public Expression replace(Expression oldNode, Expression newNode) {
        return new ReplaceNodes(oldNode, newNode).apply(this);
    }

    @CheckReturnValue
    public Expression replace(Map<? extends Expression, ? extends Expression> replacements) {
        return new ReplaceNodes(replacements).apply(this);
    }

    @CheckReturnValue
    public Expression reduceRecursive() {
        return new ReduceRecursive(false).apply(this);
    }

    /** Reduce only extension nodes, leaving other reducible nodes unchanged. */
    @CheckReturnValue
    public Expression reduceExtensionsRecursive() {
        return new ReduceRecursive(true).apply(this);
    }

    public ImmutableList<FlatNode> flatten() {
        return Flatten.flatten(this);
    }

    /** Evaluate this closed expression now.
     * @throws EvaluationException if evaluation fails. */
    @Nullable
    public Object evaluate() {
        return Evaluator.evaluate(this);
    }

    @Nullable
    public <T> T evaluate(Class<T> clazz) {
        return Evaluator.evaluate(this, clazz);
    }

    /** Structural equality using the default comparer. */
    public boolean equivalent(@Nullable Expression other) {
        return ExprEqualityComparer.DEFAULT.equivalent(this, other);
    }

    /** Hash consistent with {@link #equivalent}. */
    public int structuralHash() {
        return ExprEqualityComparer.DEFAULT.hash(this);
    }
}
