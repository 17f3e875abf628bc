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

public final class UnaryExpression extends Expression {
    public final ExprOpcode opcode;
    public final Expression operand;
    /** Method implementing the operator, if not the built-in one. */
    @Nullable
    public final Method method;
    public final boolean lifted;
    public final boolean liftedToNull;

    public UnaryExpression(Class<?> type, ExprOpcode opcode, Expression operand,
                           @Nullable Method method, boolean lifted, boolean liftedToNull) {
        super(type);
        if (opcode.isBinary)
            throw new IllegalArgumentException(opcode.name() + " is not a unary operator");
        this.opcode = opcode;
        this.operand = operand;
        this.method = method;
        this.lifted = lifted;
        this.liftedToNull = liftedToNull;
    }

    public UnaryExpression(Class<?> type, ExprOpcode opcode, Expression operand) {
        this(type, opcode, operand, null, false, false);
    }

    public UnaryExpression(ExprOpcode opcode, Expression operand) {
        this(resultType(opcode, operand), opcode, operand);
    }

    static Class<?> resultType(ExprOpcode opcode, Expression operand) {
        switch (opcode) {
            case QUOTE: return operand.getClass();
            case ARRAY_LENGTH: return int.class;
            case THROW: return void.class;
            case CONVERT:
            case TYPE_AS:
                throw new IllegalArgumentException(opcode.name() + " requires an explicit type");
            default: return operand.type;
        }
    }

    /** Wrap a lambda so that it is treated as a tree value instead of a function. */
    public static UnaryExpression quote(LambdaExpression lambda) {
        return new UnaryExpression(ExprOpcode.QUOTE, lambda);
    }

    public static UnaryExpression convert(Expression operand, Class<?> type) {
        return new UnaryExpression(type, ExprOpcode.CONVERT, operand);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.UNARY;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.operand.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        UnaryExpression o = other.as(UnaryExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.opcode == o.opcode &&
                this.operand == o.operand &&
                this.lifted == o.lifted &&
                this.liftedToNull == o.liftedToNull &&
                Objects.equals(this.method, o.method);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        switch (this.opcode) {
            case CONVERT:
                return builder.append("((").append(this.type).append(")").append(this.operand).append(")");
            case TYPE_AS:
                return builder.append("(").append(this.operand).append(" as ").append(this.type).append(")");
            case QUOTE:
                return builder.append(this.operand);
            case ARRAY_LENGTH:
                return builder.append(this.operand).append(".length");
            case THROW:
            case INCREMENT:
            case DECREMENT:
                return builder.append(this.opcode.toString()).append(" ").append(this.operand);
            default:
                return builder.append("(").append(this.opcode.toString()).append(this.operand).append(")");
        }
    }
}
