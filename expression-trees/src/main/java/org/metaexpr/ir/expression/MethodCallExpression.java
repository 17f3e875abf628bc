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
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/** A call of an instance or static method. */
public final class MethodCallExpression extends Expression {
    /** Receiver; null for static methods. */
    @Nullable
    public final Expression object;
    public final Method method;
    public final ImmutableList<Expression> arguments;

    /** Lambda arguments passed to parameters whose type is a tree type are quoted,
     * the way a compiler building trees quotes nested lambdas. */
    public MethodCallExpression(@Nullable Expression object, Method method, List<? extends Expression> arguments) {
        super(method.getReturnType());
        this.object = object;
        this.method = method;
        ImmutableList.Builder<Expression> builder = ImmutableList.builderWithExpectedSize(arguments.size());
        Class<?>[] parameterTypes = method.getParameterTypes();
        for (int i = 0; i < arguments.size(); i++) {
            Expression argument = arguments.get(i);
            Class<?> parameterType = parameterTypes[Math.min(i, parameterTypes.length - 1)];
            if (argument.is(LambdaExpression.class) && Expression.class.isAssignableFrom(parameterType))
                argument = UnaryExpression.quote(argument.to(LambdaExpression.class));
            builder.add(argument);
        }
        this.arguments = builder.build();
    }

    public MethodCallExpression(@Nullable Expression object, Method method, Expression... arguments) {
        this(object, method, Linq.list(arguments));
    }

    public boolean isStatic() {
        return this.object == null;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.METHOD_CALL;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.object != null)
            this.object.accept(visitor);
        for (Expression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        MethodCallExpression o = other.as(MethodCallExpression.class);
        if (o == null)
            return false;
        return this.object == o.object &&
                Objects.equals(this.method, o.method) &&
                Linq.same(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.object != null)
            builder.append(this.object);
        else
            builder.append(this.method.getDeclaringClass());
        return builder.append(".")
                .append(this.method.getName())
                .append("(")
                .join(", ", this.arguments)
                .append(")");
    }
}
