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

import org.metaexpr.Closure;
import org.metaexpr.errors.EvaluationException;

import javax.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;

/** Recognizes the tree shapes produced for captured variables and marker method calls. */
public class Closures {
    private Closures() {}

    /** True if the expression reads a captured variable: a field of a closure class
     * (see {@link Closure}) read from a non-null constant instance. */
    public static boolean isClosureMember(Expression expression) {
        MemberExpression member = expression.as(MemberExpression.class);
        if (member == null || !member.isField())
            return false;
        if (!isClosureClass(member.member.getDeclaringClass()))
            return false;
        if (member.expression == null)
            return false;
        ConstantExpression base = member.expression.as(ConstantExpression.class);
        return base != null && base.value != null;
    }

    static boolean isClosureClass(Class<?> clazz) {
        if (!clazz.isAnnotationPresent(Closure.class))
            return false;
        return clazz.isLocalClass() ||
                clazz.isAnonymousClass() ||
                (clazz.isMemberClass() && Modifier.isPrivate(clazz.getModifiers()));
    }

    /** Read the current value of a captured variable.
     * @param member  A node for which {@link #isClosureMember} is true. */
    @Nullable
    public static Object readField(MemberExpression member) {
        Field field = (Field) member.member;
        Object closure = Objects.requireNonNull(member.expression).to(ConstantExpression.class).value;
        try {
            field.trySetAccessible();
            return field.get(closure);
        } catch (IllegalAccessException | RuntimeException ex) {
            throw new EvaluationException("Could not read captured variable " + field.getName(), member, ex);
        }
    }

    /** True if the call invokes a method with the given name declared by declaringClass,
     * or, when includeSubclasses is set, by a subclass of declaringClass. */
    public static boolean targetsMethod(MethodCallExpression call, Class<?> declaringClass,
                                        String name, boolean includeSubclasses) {
        Method method = call.method;
        if (!method.getName().equals(name))
            return false;
        Class<?> declaring = method.getDeclaringClass();
        if (includeSubclasses)
            return declaringClass.isAssignableFrom(declaring);
        return declaring == declaringClass;
    }

    public static boolean targetsMethod(MethodCallExpression call, Class<?> declaringClass, String name) {
        return targetsMethod(call, declaringClass, name, false);
    }
}
