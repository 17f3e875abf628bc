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

package org.metaexpr;

import org.metaexpr.ir.expression.LambdaExpression;

import javax.annotation.Nullable;

/** Marker methods recognized inside expression trees by {@link org.metaexpr.ir.expression.Expression#expand()}.
 * Called directly, they behave like ordinary functions. */
public final class Expr {
    private Expr() {}

    /** Inside a tree: replaced by a constant holding the current value of the captured variable.
     * Outside a tree: returns its argument. */
    public static int capture(int value) { return value; }

    public static long capture(long value) { return value; }

    public static short capture(short value) { return value; }

    public static byte capture(byte value) { return value; }

    public static char capture(char value) { return value; }

    public static boolean capture(boolean value) { return value; }

    public static float capture(float value) { return value; }

    public static double capture(double value) { return value; }

    @Nullable
    public static <T> T capture(@Nullable T value) { return value; }

    /** Inside a tree: the call is replaced by the body of the target lambda,
     * with the parameters replaced by the arguments.
     * Outside a tree: compiles the target and calls it. */
    @Nullable
    public static Object invoke(LambdaExpression target) {
        return target.compile().invoke();
    }

    @Nullable
    public static Object invoke(LambdaExpression target, @Nullable Object arg0) {
        return target.compile().invoke(arg0);
    }

    @Nullable
    public static Object invoke(LambdaExpression target, @Nullable Object arg0, @Nullable Object arg1) {
        return target.compile().invoke(arg0, arg1);
    }

    @Nullable
    public static Object invoke(LambdaExpression target, @Nullable Object arg0, @Nullable Object arg1,
                                @Nullable Object arg2) {
        return target.compile().invoke(arg0, arg1, arg2);
    }

    @Nullable
    public static Object invoke(LambdaExpression target, @Nullable Object arg0, @Nullable Object arg1,
                                @Nullable Object arg2, @Nullable Object arg3) {
        return target.compile().invoke(arg0, arg1, arg2, arg3);
    }
}
