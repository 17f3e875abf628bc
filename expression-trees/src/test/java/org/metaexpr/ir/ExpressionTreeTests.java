package org.metaexpr.ir;

import org.metaexpr.Closure;
import org.metaexpr.Expr;
import org.metaexpr.Lambda;
import org.metaexpr.Trees;
import org.metaexpr.errors.InternalTreeError;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.Closures;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.MethodCallExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.Reflection;
import org.junit.Assert;
import org.junit.Test;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.metaexpr.Trees.add;
import static org.metaexpr.Trees.captured;
import static org.metaexpr.Trees.constant;
import static org.metaexpr.Trees.intParam;
import static org.metaexpr.Trees.lambda;

/** Tests for the node classes and the closure recognizer. */
public class ExpressionTreeTests {
    @Closure
    private static final class Locals {
        int value = 42;
        static int shared = 1;
    }

    /** Not a closure class: public. */
    @Closure
    public static final class Visible {
        public int value = 3;
    }

    /** Not a closure class: no annotation. */
    private static final class Plain {
        int value = 3;
    }

    public static final class Sink {
        public static int consume(LambdaExpression tree) {
            return tree.parameters.size();
        }

        public static int apply(Function<Integer, Integer> function) {
            return function.apply(1);
        }
    }

    @Test
    public void testClosureMember() {
        Assert.assertTrue(Closures.isClosureMember(captured(new Locals(), "value")));
        Assert.assertFalse(Closures.isClosureMember(captured(new Visible(), "value")));
        Assert.assertFalse(Closures.isClosureMember(captured(new Plain(), "value")));
        Assert.assertFalse(Closures.isClosureMember(constant(1)));

        Expression nullBase = new MemberExpression(
                new ConstantExpression(null, Locals.class), Reflection.field(Locals.class, "value"));
        Assert.assertFalse(Closures.isClosureMember(nullBase));
        Expression staticField = new MemberExpression(null, Reflection.field(Locals.class, "shared"));
        Assert.assertFalse(Closures.isClosureMember(staticField));
        Expression nonConstantBase = new MemberExpression(
                Trees.param(Locals.class, "l"), Reflection.field(Locals.class, "value"));
        Assert.assertFalse(Closures.isClosureMember(nonConstantBase));
    }

    @Test
    public void testLocalClosureClass() {
        @Closure
        class Captured {
            int count = 5;
        }

        Assert.assertTrue(Closures.isClosureMember(captured(new Captured(), "count")));
        Assert.assertEquals(5, captured(new Captured(), "count").snapshot().to(ConstantExpression.class).value);
    }

    @Test
    public void testTypes() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        Assert.assertEquals(int.class, add(a, b).type);
        Assert.assertEquals(boolean.class, Trees.equal(a, b).type);
        Assert.assertEquals(BiFunction.class, lambda(add(a, b), a, b).type);
        Assert.assertEquals(Supplier.class, lambda(constant("x")).type);
        Assert.assertEquals(int.class, lambda(add(a, b), a, b).getReturnType());
        Assert.assertEquals(String.class, constant("x").type);
        Assert.assertEquals(long.class, constant(1L).type);
        Assert.assertThrows(IllegalArgumentException.class,
                () -> new BinaryExpression(ExprOpcode.NEGATE, a, b));
        Assert.assertThrows(IllegalArgumentException.class,
                () -> new UnaryExpression(ExprOpcode.CONVERT, a));
    }

    @Test
    public void testToString() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        Assert.assertEquals("(|a: int, b: int| (a + b))", lambda(add(a, b), a, b).toString());
        Assert.assertEquals("\"s\"", constant("s").toString());
    }

    @Test
    public void testCompoundAssignmentReduces() {
        ParameterExpression v = intParam("v");
        BinaryExpression compound = new BinaryExpression(ExprOpcode.SUBTRACT_ASSIGN, v, constant(2));
        Assert.assertTrue(compound.canReduce());
        BinaryExpression reduced = compound.reduceAndCheck().to(BinaryExpression.class);
        Assert.assertEquals(ExprOpcode.ASSIGN, reduced.opcode);
        Assert.assertSame(v, reduced.left);
        BinaryExpression operation = reduced.right.to(BinaryExpression.class);
        Assert.assertEquals(ExprOpcode.SUBTRACT, operation.opcode);
        Assert.assertSame(v, operation.left);

        Assert.assertFalse(add(v, v).canReduce());
        Assert.assertThrows(InternalTreeError.class, () -> add(v, v).reduceAndCheck());
    }

    @Test
    public void testAutoQuote() {
        LambdaExpression tree = lambda(constant(1), intParam("x"));
        MethodCallExpression call = Trees.call(null, Sink.class, "consume",
                new Class<?>[] { LambdaExpression.class }, tree);
        UnaryExpression quoted = call.arguments.get(0).to(UnaryExpression.class);
        Assert.assertEquals(ExprOpcode.QUOTE, quoted.opcode);
        Assert.assertSame(tree, quoted.operand);
        Assert.assertEquals(1, call.evaluate());

        MethodCallExpression apply = Trees.call(null, Sink.class, "apply",
                new Class<?>[] { Function.class }, tree);
        Assert.assertSame(tree, apply.arguments.get(0));
        Assert.assertEquals(1, apply.evaluate());
    }

    @Test
    public void testMarkersOutsideTrees() {
        Assert.assertEquals(42, Expr.capture(42));
        Assert.assertEquals("s", Expr.capture("s"));
        ParameterExpression x = intParam("x");
        LambdaExpression increment = lambda(add(x, constant(1)), x);
        Assert.assertEquals(6, Expr.invoke(increment, 5));
        Assert.assertSame(increment, Lambda.expr(increment));
        Function<Integer, Integer> f = Lambda.func(y -> y + 1);
        Assert.assertEquals(Integer.valueOf(3), f.apply(2));
    }

    @Test
    public void testIds() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("a");
        Assert.assertNotEquals(a.getId(), b.getId());
        ParameterExpression unnamed = new ParameterExpression(int.class, null);
        Assert.assertEquals("p" + unnamed.getId(), unnamed.toString());
    }
}
