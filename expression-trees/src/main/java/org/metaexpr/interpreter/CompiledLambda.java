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

import org.metaexpr.errors.InternalTreeError;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.ParameterExpression;

import javax.annotation.Nullable;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.Arrays;

/** An executable lambda: a {@link LambdaExpression} together with the
 * variables it closes over. */
public final class CompiledLambda {
    public final LambdaExpression lambda;
    final Scopes<ParameterExpression, Object> closure;

    CompiledLambda(LambdaExpression lambda, Scopes<ParameterExpression, Object> closure) {
        this.lambda = lambda;
        this.closure = closure;
    }

    @Nullable
    public Object invoke(Object... arguments) {
        if (arguments.length != this.lambda.parameters.size())
            throw new IllegalArgumentException("Lambda expects " + this.lambda.parameters.size() +
                    " arguments, got " + arguments.length);
        Scopes<ParameterExpression, Object> scopes = this.closure.capture();
        scopes.newContext();
        for (int i = 0; i < arguments.length; i++)
            scopes.substitute(this.lambda.parameters.get(i), arguments[i]);
        Interpreter interpreter = new Interpreter(scopes);
        try {
            return interpreter.evaluate(this.lambda.body);
        } catch (Interpreter.Jump jump) {
            throw new InternalTreeError("Jump to label " + jump.target + " outside of lambda", this.lambda);
        }
    }

    /** An implementation of the functional interface iface which invokes this lambda. */
    public <T> T as(Class<T> iface) {
        if (!iface.isInterface())
            throw new IllegalArgumentException(iface.getName() + " is not an interface");
        InvocationHandler handler = (proxy, method, args) -> {
            if (method.getDeclaringClass() == Object.class) {
                switch (method.getName()) {
                    case "equals": return proxy == args[0];
                    case "hashCode": return System.identityHashCode(proxy);
                    default: return this.toString();
                }
            }
            if (method.isDefault())
                return InvocationHandler.invokeDefault(proxy, method, args);
            return this.invoke(args == null ? new Object[0] : args);
        };
        return iface.cast(Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[] { iface }, handler));
    }

    /** Convert a value passed where a parameter of type parameterType is expected. */
    @Nullable
    static Object adapt(@Nullable Object value, Class<?> parameterType) {
        if (value instanceof CompiledLambda && parameterType.isInterface() && !parameterType.isInstance(value))
            return ((CompiledLambda) value).as(parameterType);
        return value;
    }

    /** The single abstract method of a functional interface implemented by clazz, or null. */
    @Nullable
    static Method functionalMethod(Class<?> clazz) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            for (Class<?> iface : c.getInterfaces()) {
                Method[] methods = Arrays.stream(iface.getMethods())
                        .filter(m -> Modifier.isAbstract(m.getModifiers()) && !overridesObject(m))
                        .toArray(Method[]::new);
                if (methods.length == 1)
                    return methods[0];
            }
        }
        return null;
    }

    private static boolean overridesObject(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException ex) {
            return false;
        }
    }

    @Override
    public String toString() {
        return this.lambda.toString();
    }
}
