package org.metaexpr.visitors.inner;

import org.metaexpr.Closure;
import org.metaexpr.Lambda;
import org.metaexpr.Trees;
import org.metaexpr.errors.InlineTargetUnresolvedException;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.MethodCallExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.junit.Assert;
import org.junit.Test;

import javax.annotation.Nullable;
import java.util.function.Predicate;

import static org.metaexpr.Trees.binary;
import static org.metaexpr.Trees.call;
import static org.metaexpr.Trees.capture;
import static org.metaexpr.Trees.captured;
import static org.metaexpr.Trees.constant;
import static org.metaexpr.Trees.equal;
import static org.metaexpr.Trees.intParam;
import static org.metaexpr.Trees.invoke;
import static org.metaexpr.Trees.lambda;

/** Tests inlining of invoke, capture, compile and declaration markers. */
public class ExpandTests {
    @Closure
    private static final class Locals {
        int value = 42;
        int lower = 10;
        String name = "answer";
        @Nullable
        LambdaExpression inner;
    }

    /** Stand-in for a query API taking both trees and functions. */
    public static final class Query {
        public Query where(LambdaExpression predicate) {
            return this;
        }

        public Query filter(Predicate<Integer> predicate) {
            return this;
        }
    }

    static LambdaExpression isFortyTwo() {
        ParameterExpression x = intParam("x");
        return lambda(equal(x, constant(42)), x);
    }

    static LambdaExpression equalTo(int value) {
        ParameterExpression x = intParam("x");
        return lambda(equal(x, constant(value)), x);
    }

    static LambdaExpression broken() {
        throw new IllegalStateException("no tree today");
    }

    static MethodCallExpression where(Expression query, Expression predicate) {
        return call(query, Query.class, "where", new Class<?>[] { LambdaExpression.class }, predicate);
    }

    static MethodCallExpression filter(Expression query, Expression predicate) {
        return call(query, Query.class, "filter", new Class<?>[] { Predicate.class }, predicate);
    }

    static void assertEquivalent(Expression expected, Expression actual) {
        Assert.assertTrue("Expected " + expected + ", got " + actual, expected.equivalent(actual));
    }

    /** q => q.where(v => v == 42) */
    static LambdaExpression whereFortyTwo() {
        ParameterExpression q = Trees.param(Query.class, "q");
        ParameterExpression v = intParam("v");
        return lambda(where(q, lambda(equal(v, constant(42)), v)), q);
    }

    @Test
    public void testCapture() {
        Locals locals = new Locals();
        LambdaExpression tree = lambda(capture(captured(locals, "value")));
        LambdaExpression expanded = tree.expand();
        ConstantExpression body = expanded.body.to(ConstantExpression.class);
        Assert.assertEquals(42, body.value);
        Assert.assertEquals(int.class, body.type);
    }

    @Test
    public void testCaptureKeepsVariableType() {
        Locals locals = new Locals();
        MethodCallExpression marker = capture(captured(locals, "name"));
        Assert.assertEquals(Object.class, marker.type);
        LambdaExpression expanded = lambda(marker).expand();
        ConstantExpression body = expanded.body.to(ConstantExpression.class);
        Assert.assertEquals("answer", body.value);
        Assert.assertEquals(String.class, body.type);
    }

    @Test
    public void testCaptureIsFrozen() {
        Locals locals = new Locals();
        LambdaExpression tree = lambda(capture(captured(locals, "value")));
        LambdaExpression expanded = tree.expand();
        locals.value = 1337;
        assertEquivalent(lambda(constant(42)), expanded.snapshot());
        Assert.assertEquals(1337, tree.snapshot().to(LambdaExpression.class).body
                .to(MethodCallExpression.class).arguments.get(0).to(ConstantExpression.class).value);
    }

    @Test
    public void testInvokeCapturedTarget() {
        Locals locals = new Locals();
        locals.inner = isFortyTwo();
        ParameterExpression q = Trees.param(Query.class, "q");
        ParameterExpression v = intParam("v");
        LambdaExpression tree = lambda(where(q, lambda(invoke(captured(locals, "inner"), v), v)), q);
        LambdaExpression expanded = tree.expand();
        assertEquivalent(whereFortyTwo(), expanded);
        Assert.assertFalse(expanded.contains(locals.inner.parameters.get(0)));
    }

    @Test
    public void testInvokeBounds() {
        Locals locals = new Locals();
        ParameterExpression a = intParam("a");
        LambdaExpression above = lambda(binary(ExprOpcode.GREATER_THAN, a, capture(captured(locals, "lower"))), a);
        ParameterExpression b = intParam("b");
        LambdaExpression below = lambda(binary(ExprOpcode.LESS_THAN, b, constant(20)), b);
        ParameterExpression x = intParam("x");
        LambdaExpression tree = lambda(binary(ExprOpcode.AND_ALSO, invoke(above, x), invoke(below, x)), x);

        ParameterExpression y = intParam("y");
        LambdaExpression expected = lambda(binary(ExprOpcode.AND_ALSO,
                binary(ExprOpcode.GREATER_THAN, y, constant(10)),
                binary(ExprOpcode.LESS_THAN, y, constant(20))), y);
        assertEquivalent(expected, tree.expand());
    }

    @Test
    public void testNestedInvoke() {
        ParameterExpression y = intParam("y");
        LambdaExpression increment = lambda(Trees.add(y, constant(1)), y);
        ParameterExpression x = intParam("x");
        LambdaExpression doubled = lambda(new BinaryExpression(
                int.class, ExprOpcode.MULTIPLY, invoke(increment, x), constant(2)), x);
        ParameterExpression z = intParam("z");
        LambdaExpression tree = lambda(invoke(doubled, z), z);

        ParameterExpression w = intParam("w");
        LambdaExpression expected = lambda(binary(ExprOpcode.MULTIPLY,
                Trees.add(w, constant(1)), constant(2)), w);
        assertEquivalent(expected, tree.expand());
    }

    @Test
    public void testInvokeMethodResult() {
        ParameterExpression q = Trees.param(Query.class, "q");
        ParameterExpression v = intParam("v");
        Expression target = call(null, ExpandTests.class, "isFortyTwo", new Class<?>[0]);
        LambdaExpression tree = lambda(where(q, lambda(invoke(target, v), v)), q);
        assertEquivalent(whereFortyTwo(), tree.expand());
    }

    @Test
    public void testInvokeMethodResultWithArgument() {
        Locals locals = new Locals();
        ParameterExpression q = Trees.param(Query.class, "q");
        ParameterExpression v = intParam("v");
        Expression target = call(null, ExpandTests.class, "equalTo", new Class<?>[] { int.class },
                captured(locals, "value"));
        LambdaExpression tree = lambda(where(q, lambda(invoke(target, v), v)), q);
        LambdaExpression expanded = tree.expand();
        locals.value = 1337;
        assertEquivalent(whereFortyTwo(), expanded.snapshot());
    }

    @Test
    public void testInvokeQuoted() {
        ParameterExpression v = intParam("v");
        LambdaExpression tree = lambda(invoke(UnaryExpression.quote(isFortyTwo()), v), v);
        ParameterExpression w = intParam("w");
        assertEquivalent(lambda(equal(w, constant(42)), w), tree.expand());
    }

    @Test
    public void testCompileCaptured() {
        Locals locals = new Locals();
        locals.inner = isFortyTwo();
        ParameterExpression q = Trees.param(Query.class, "q");
        Expression compiled = call(captured(locals, "inner"), LambdaExpression.class, "compile", new Class<?>[0]);
        LambdaExpression tree = lambda(filter(q, compiled), q);
        LambdaExpression expanded = tree.expand();

        ParameterExpression r = Trees.param(Query.class, "r");
        assertEquivalent(lambda(filter(r, isFortyTwo()), r), expanded);
        Object query = new Query();
        Assert.assertSame(query, expanded.compile().invoke(query));
    }

    @Test
    public void testSpliceCapturedTree() {
        Locals locals = new Locals();
        locals.inner = isFortyTwo();
        ParameterExpression q = Trees.param(Query.class, "q");
        LambdaExpression tree = lambda(where(q, captured(locals, "inner")), q);
        LambdaExpression expanded = tree.expand();
        assertEquivalent(whereFortyTwo(), expanded);
        UnaryExpression quoted = expanded.body.to(MethodCallExpression.class).arguments.get(0).to(UnaryExpression.class);
        Assert.assertEquals(ExprOpcode.QUOTE, quoted.opcode);
    }

    @Test
    public void testDeclarationHelpers() {
        LambdaExpression inner = isFortyTwo();
        Expression func = call(null, Lambda.class, "func", new Class<?>[] { Object.class }, inner);
        LambdaExpression expanded = lambda(func).expand();
        Assert.assertSame(inner, expanded.body);

        Expression expr = call(null, Lambda.class, "expr", new Class<?>[] { LambdaExpression.class }, inner);
        LambdaExpression unwrapped = lambda(expr).expand();
        assertEquivalent(UnaryExpression.quote(isFortyTwo()), unwrapped.body);
    }

    @Test
    public void testIdempotent() {
        Locals locals = new Locals();
        locals.inner = isFortyTwo();
        ParameterExpression q = Trees.param(Query.class, "q");
        ParameterExpression v = intParam("v");
        LambdaExpression tree = lambda(where(q, lambda(invoke(captured(locals, "inner"), v), v)), q);
        LambdaExpression once = tree.expand();
        LambdaExpression twice = once.expand();
        assertEquivalent(once, twice);
        Assert.assertSame(once, twice);
    }

    @Test
    public void testNothingToExpand() {
        LambdaExpression tree = whereFortyTwo();
        Assert.assertSame(tree, tree.expand());
    }

    @Test
    public void testUnresolvedTarget() {
        ParameterExpression v = intParam("v");
        Expression target = call(null, ExpandTests.class, "broken", new Class<?>[0]);
        LambdaExpression tree = lambda(invoke(target, v), v);
        InlineTargetUnresolvedException ex = Assert.assertThrows(InlineTargetUnresolvedException.class, tree::expand);
        Assert.assertSame(target, ex.node);
        Assert.assertNotNull(ex.getCause());

        Locals locals = new Locals();
        LambdaExpression missing = lambda(invoke(captured(locals, "inner"), v), v);
        Assert.assertThrows(InlineTargetUnresolvedException.class, missing::expand);
    }
}
