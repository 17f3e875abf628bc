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

package org.metaexpr.visitors.inner;

import org.metaexpr.Expr;
import org.metaexpr.Lambda;
import org.metaexpr.errors.EvaluationException;
import org.metaexpr.errors.InlineTargetUnresolvedException;
import org.metaexpr.interpreter.Evaluator;
import org.metaexpr.ir.expression.Closures;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.MethodCallExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.Logger;
import org.metaexpr.util.Utilities;
import org.metaexpr.visitors.VisitDecision;

import javax.annotation.Nullable;

/** Inlines the markers of {@link Expr} and {@link Lambda}:
 * <ul>
 *     <li>Expr.capture(variable) becomes a constant holding the current value of the variable</li>
 *     <li>Expr.invoke(target, args) becomes the body of the target lambda, with the parameters
 *     replaced by the (expanded) arguments</li>
 *     <li>variable.compile() on a captured tree becomes the tree itself</li>
 *     <li>Lambda.expr(e) and Lambda.func(e) become e</li>
 * </ul>
 * In addition, a captured variable holding a tree is replaced by that tree.
 * All inserted trees are expanded recursively. */
public class Expand extends InnerRewriteVisitor {
    @Override
    public VisitDecision preorder(MethodCallExpression expression) {
        Expression result;
        if (Closures.targetsMethod(expression, Expr.class, "capture")) {
            result = this.capture(expression);
        } else if (Closures.targetsMethod(expression, Expr.class, "invoke")) {
            result = this.invoke(expression);
        } else if (Closures.targetsMethod(expression, LambdaExpression.class, "compile", true) &&
                expression.object != null &&
                Closures.isClosureMember(expression.object)) {
            result = this.transform(expression.object);
        } else if (Closures.targetsMethod(expression, Lambda.class, "expr") ||
                Closures.targetsMethod(expression, Lambda.class, "func")) {
            result = this.transform(expression.arguments.get(0));
        } else {
            return super.preorder(expression);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Expanded ")
                .append(expression.method.getName())
                .append(": ")
                .appendSupplier(expression::toString)
                .append(" -> ")
                .appendSupplier(result::toString)
                .newline();
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MemberExpression expression) {
        if (!Closures.isClosureMember(expression) || !Expression.class.isAssignableFrom(expression.type))
            return super.preorder(expression);
        Object value = Closures.readField(expression);
        if (!(value instanceof Expression))
            return super.preorder(expression);
        this.map(expression, this.transform((Expression) value));
        return VisitDecision.STOP;
    }

    Expression capture(MethodCallExpression expression) {
        Expression argument = expression.arguments.get(0);
        Utilities.enforce(argument.is(MemberExpression.class),
                "Argument of capture must be a captured variable, not " + argument);
        Object value = Evaluator.evaluate(argument);
        return new ConstantExpression(value, argument.type);
    }

    Expression invoke(MethodCallExpression expression) {
        Expression target = expression.arguments.get(0);
        LambdaExpression lambda = this.resolveTarget(target);
        int argumentCount = expression.arguments.size() - 1;
        Utilities.enforce(lambda.parameters.size() == argumentCount,
                "Lambda " + lambda + " has " + lambda.parameters.size() +
                " parameters, but is invoked with " + argumentCount + " arguments");
        Substitution<Expression, Expression> substitution = new Substitution<>();
        for (int i = 0; i < argumentCount; i++) {
            ParameterExpression parameter = lambda.parameters.get(i);
            substitution.substituteNew(parameter, this.transform(expression.arguments.get(i + 1)));
        }
        Expression body = new ReplaceNodes(substitution).apply(lambda.body);
        return this.transform(body);
    }

    /** Find the lambda denoted by the target of an invoke marker. */
    LambdaExpression resolveTarget(Expression target) {
        LambdaExpression literal = target.as(LambdaExpression.class);
        if (literal != null)
            return literal;
        UnaryExpression unary = target.as(UnaryExpression.class);
        if (unary != null && unary.opcode == ExprOpcode.QUOTE && unary.operand.is(LambdaExpression.class))
            return unary.operand.to(LambdaExpression.class);

        @Nullable Object value;
        try {
            value = Evaluator.evaluate(target);
        } catch (EvaluationException ex) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Could not evaluate invoke target ")
                    .appendSupplier(target::toString)
                    .append(": ")
                    .appendSupplier(ex::getMessage)
                    .newline();
            throw new InlineTargetUnresolvedException(target, ex);
        }
        if (!(value instanceof LambdaExpression))
            throw new InlineTargetUnresolvedException(target, null);
        return (LambdaExpression) value;
    }

    @Override
    public void endVisit() {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Expanded tree: ")
                .appendSupplier(() -> this.lastResult == null ? "" :
                        Flatten.toJson(Flatten.flatten(this.getResult().to(Expression.class))).toString())
                .newline();
        super.endVisit();
    }
}
