package org.metaexpr.visitors.inner;

import org.metaexpr.ir.expression.Expression;

import java.util.function.Function;

/** A transformation from expression trees to expression trees. */
public interface IRTransform extends Function<Expression, Expression> {
}
