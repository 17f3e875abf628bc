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

package org.metaexpr.interpreter;

import com.google.common.primitives.Primitives;
import org.metaexpr.errors.EvaluationException;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.MethodCallExpression;

import javax.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.function.Supplier;

/** Computes the value of a closed expression.
 * Constants, field reads and method calls are evaluated directly;
 * anything else is wrapped in a parameterless lambda and interpreted.
 * Every failure is reported as an {@link EvaluationException}. */
public final class Evaluator {
    private Evaluator() {}

    @Nullable
    public static Object evaluate(@Nullable Expression expression) {
        if (expression == null)
            return null;
        try {
            switch (expression.getKind()) {
                case CONSTANT:
                    return expression.to(ConstantExpression.class).value;
                case MEMBER: {
                    MemberExpression member = expression.to(MemberExpression.class);
                    Object target = evaluate(member.expression);
                    if (member.member instanceof Field) {
                        Field field = (Field) member.member;
                        field.trySetAccessible();
                        return field.get(target);
                    }
                    return invoke((Method) member.member, target, new Object[0]);
                }
                case METHOD_CALL: {
                    MethodCallExpression call = expression.to(MethodCallExpression.class);
                    Object target = evaluate(call.object);
                    Object[] arguments = new Object[call.arguments.size()];
                    for (int i = 0; i < arguments.length; i++)
                        arguments[i] = evaluate(call.arguments.get(i));
                    return invoke(call.method, target, arguments);
                }
                default:
                    return new LambdaExpression(Supplier.class, expression).compile().invoke();
            }
        } catch (EvaluationException ex) {
            throw ex;
        } catch (Interpreter.Thrown ex) {
            throw new EvaluationException(expression, ex.getCause());
        } catch (InvocationFailed ex) {
            throw new EvaluationException(expression, ex.getCause());
        } catch (RuntimeException | ReflectiveOperationException ex) {
            throw new EvaluationException(expression, ex);
        }
    }

    /** Evaluate and check that the result is a clazz. */
    @Nullable
    public static <T> T evaluate(@Nullable Expression expression, Class<T> clazz) {
        Object result = evaluate(expression);
        if (result == null)
            return null;
        Class<T> boxed = Primitives.wrap(clazz);
        if (!boxed.isInstance(result))
            throw new EvaluationException("Expected a " + clazz.getSimpleName() + ", got a " +
                    result.getClass().getSimpleName(), expression,
                    new ClassCastException(result.getClass().getName()));
        return boxed.cast(result);
    }

    private static final class InvocationFailed extends Exception {
        InvocationFailed(Throwable cause) {
            super(cause);
        }
    }

    @Nullable
    private static Object invoke(Method method, @Nullable Object target, Object[] arguments)
            throws IllegalAccessException, InvocationFailed {
        Class<?>[] types = method.getParameterTypes();
        for (int i = 0; i < arguments.length && i < types.length; i++)
            arguments[i] = CompiledLambda.adapt(arguments[i], types[i]);
        method.trySetAccessible();
        try {
            return method.invoke(target, arguments);
        } catch (InvocationTargetException ex) {
            throw new InvocationFailed(ex.getCause());
        }
    }
}
