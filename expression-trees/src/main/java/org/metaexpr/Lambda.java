package org.metaexpr;

import org.metaexpr.ir.expression.LambdaExpression;

/** Declaration helpers.  Both return their argument; inside trees,
 * {@link org.metaexpr.ir.expression.Expression#expand()} replaces calls to them by their argument. */
public final class Lambda {
    private Lambda() {}

    /** A function of three arguments. */
    @FunctionalInterface
    public interface Func3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    /** A function of four arguments. */
    @FunctionalInterface
    public interface Func4<A, B, C, D, R> {
        R apply(A a, B b, C c, D d);
    }

    /** Declares a tree-valued lambda. */
    public static LambdaExpression expr(LambdaExpression expression) {
        return expression;
    }

    /** Declares a function-valued lambda. */
    public static <F> F func(F function) {
        return function;
    }
}
