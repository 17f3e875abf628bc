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
import org.metaexpr.Lambda;
import org.metaexpr.interpreter.CompiledLambda;
import org.metaexpr.interpreter.Interpreter;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/** A lambda: a body abstracted over parameters.
 * The type of a lambda node is the functional interface (delegate type) it implements;
 * the return type is the type of the body. */
public final class LambdaExpression extends Expression {
    public final Expression body;
    public final ImmutableList<ParameterExpression> parameters;
    /** Display name. */
    @Nullable
    public final String name;
    public final boolean tailCall;

    public LambdaExpression(Class<?> delegateType, Expression body, @Nullable String name,
                            boolean tailCall, List<ParameterExpression> parameters) {
        super(delegateType);
        this.body = body;
        this.name = name;
        this.tailCall = tailCall;
        this.parameters = ImmutableList.copyOf(parameters);
    }

    public LambdaExpression(Class<?> delegateType, Expression body, ParameterExpression... parameters) {
        this(delegateType, body, null, false, Linq.list(parameters));
    }

    /** A lambda implementing the standard functional interface for its arity. */
    public LambdaExpression(Expression body, ParameterExpression... parameters) {
        this(defaultDelegateType(parameters.length, body.type == void.class), body, parameters);
    }

    public static Class<?> defaultDelegateType(int parameterCount, boolean isVoid) {
        switch (parameterCount) {
            case 0: return isVoid ? Runnable.class : Supplier.class;
            case 1: return isVoid ? Consumer.class : Function.class;
            case 2: return isVoid ? BiConsumer.class : BiFunction.class;
            case 3: return Lambda.Func3.class;
            case 4: return Lambda.Func4.class;
            default: return CompiledLambda.class;
        }
    }

    public Class<?> getReturnType() {
        return this.body.type;
    }

    /** Compile this closed lambda into a callable function. */
    @CheckReturnValue
    public CompiledLambda compile() {
        return Interpreter.compile(this);
    }

    @Override
    public LambdaExpression expand() {
        return super.expand().to(LambdaExpression.class);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LAMBDA;
    }

    /** The body is visited before the parameters. */
    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.body.accept(visitor);
        for (ParameterExpression parameter: this.parameters)
            parameter.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        LambdaExpression o = other.as(LambdaExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.body == o.body &&
                Objects.equals(this.name, o.name) &&
                this.tailCall == o.tailCall &&
                Linq.same(this.parameters, o.parameters);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(|");
        boolean first = true;
        for (ParameterExpression parameter: this.parameters) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(parameter).append(": ").append(parameter.type);
        }
        return builder.append("| ")
                .append(this.body)
                .append(")");
    }
}
