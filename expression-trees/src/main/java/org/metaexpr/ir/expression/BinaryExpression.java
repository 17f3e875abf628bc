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

import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.util.Objects;

public final class BinaryExpression extends Expression {
    public final ExprOpcode opcode;
    public final Expression left;
    public final Expression right;
    /** Method implementing the operator, if not the built-in one. */
    @Nullable
    public final Method method;
    /** Conversion applied to the result of coalescing or compound assignment. */
    @Nullable
    public final LambdaExpression conversion;
    /** Operands are nullable versions of the operator's argument types. */
    public final boolean lifted;
    /** The result of a lifted comparison is nullable instead of boolean. */
    public final boolean liftedToNull;

    public BinaryExpression(Class<?> type, ExprOpcode opcode, Expression left, Expression right,
                            @Nullable Method method, @Nullable LambdaExpression conversion,
                            boolean lifted, boolean liftedToNull) {
        super(type);
        if (!opcode.isBinary)
            throw new IllegalArgumentException(opcode.name() + " is not a binary operator");
        this.opcode = opcode;
        this.left = left;
        this.right = right;
        this.method = method;
        this.conversion = conversion;
        this.lifted = lifted;
        this.liftedToNull = liftedToNull;
    }

    public BinaryExpression(Class<?> type, ExprOpcode opcode, Expression left, Expression right) {
        this(type, opcode, left, right, null, null, false, false);
    }

    public BinaryExpression(ExprOpcode opcode, Expression left, Expression right) {
        this(resultType(opcode, left), opcode, left, right);
    }

    static Class<?> resultType(ExprOpcode opcode, Expression left) {
        if (opcode.isComparison())
            return boolean.class;
        if (opcode == ExprOpcode.ARRAY_INDEX && left.type.isArray())
            return left.type.getComponentType();
        return left.type;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.BINARY;
    }

    @Override
    public boolean canReduce() {
        return this.opcode.isCompoundAssignment();
    }

    /** A compound assignment "left op= right" reduces to "left = left op right". */
    @Override
    public Expression reduce() {
        ExprOpcode base = this.opcode.compoundBase();
        if (base == null)
            return super.reduce();
        Expression operation = new BinaryExpression(this.type, base, this.left, this.right,
                this.method, null, this.lifted, this.liftedToNull);
        return new BinaryExpression(this.type, ExprOpcode.ASSIGN, this.left, operation);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.left.accept(visitor);
        if (this.conversion != null)
            this.conversion.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        BinaryExpression o = other.as(BinaryExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.opcode == o.opcode &&
                this.left == o.left &&
                this.right == o.right &&
                this.conversion == o.conversion &&
                this.lifted == o.lifted &&
                this.liftedToNull == o.liftedToNull &&
                Objects.equals(this.method, o.method);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.opcode == ExprOpcode.ARRAY_INDEX)
            return builder.append(this.left).append("[").append(this.right).append("]");
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.opcode.toString())
                .append(" ")
                .append(this.right)
                .append(")");
    }
}
