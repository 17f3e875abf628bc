package org.metaexpr.interpreter;

import org.metaexpr.Closure;
import org.metaexpr.Trees;
import org.metaexpr.errors.EvaluationException;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.InvocationExpression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.Reflection;
import org.junit.Assert;
import org.junit.Test;

import static org.metaexpr.Trees.add;
import static org.metaexpr.Trees.call;
import static org.metaexpr.Trees.captured;
import static org.metaexpr.Trees.constant;
import static org.metaexpr.Trees.intParam;
import static org.metaexpr.Trees.lambda;

public class EvaluatorTests {
    @Closure
    private static final class Locals {
        int value = 42;
        String text = "hello";
    }

    public static final class Box {
        public final String content;

        public Box(String content) {
            this.content = content;
        }

        public String getContent() {
            return this.content;
        }

        public static String fail(String message) throws Exception {
            throw new Exception(message);
        }
    }

    @Test
    public void testDirectForms() {
        Locals locals = new Locals();
        Assert.assertNull(Evaluator.evaluate(null));
        Assert.assertEquals(3, Evaluator.evaluate(constant(3)));
        Assert.assertEquals(42, Evaluator.evaluate(captured(locals, "value")));
        Expression box = new ConstantExpression(new Box("x"));
        Assert.assertEquals("x", Evaluator.evaluate(new MemberExpression(box, "content")));
        Assert.assertEquals("x", Evaluator.evaluate(
                new MemberExpression(box, Reflection.method(Box.class, "getContent"))));
        Assert.assertEquals(5, Evaluator.evaluate(
                call(captured(locals, "text"), String.class, "length", new Class<?>[0])));
    }

    @Test
    public void testCompiledForms() {
        Assert.assertEquals(7, Evaluator.evaluate(add(constant(3), constant(4))));
        Object function = Evaluator.evaluate(lambda(constant(1)));
        Assert.assertTrue(function instanceof CompiledLambda);
        Assert.assertEquals(1, ((CompiledLambda) function).invoke());
    }

    @Test
    public void testTyped() {
        Assert.assertEquals(Integer.valueOf(7), add(constant(3), constant(4)).evaluate(int.class));
        Assert.assertEquals("ab", new BinaryExpression(String.class, ExprOpcode.ADD,
                constant("a"), constant("b")).evaluate(String.class));
        Assert.assertThrows(EvaluationException.class, () -> constant(3).evaluate(String.class));
    }

    @Test
    public void testFreeParameter() {
        ParameterExpression x = intParam("x");
        EvaluationException ex = Assert.assertThrows(EvaluationException.class,
                () -> Evaluator.evaluate(add(x, constant(1))));
        Assert.assertNotNull(ex.getCause());
    }

    @Test
    public void testFailures() {
        Expression fail = call(null, Box.class, "fail", new Class<?>[] { String.class }, constant("nope"));
        EvaluationException ex = Assert.assertThrows(EvaluationException.class, () -> Evaluator.evaluate(fail));
        Assert.assertSame(fail, ex.node);
        Assert.assertEquals(Exception.class, ex.getCause().getClass());
        Assert.assertEquals("nope", ex.getCause().getMessage());

        // Failures inside interpreted code are reported the same way
        Expression nested = Trees.add(new UnaryExpression(
                ExprOpcode.ARRAY_LENGTH, new ConstantExpression(null, int[].class)), constant(1));
        EvaluationException inner = Assert.assertThrows(EvaluationException.class, () -> Evaluator.evaluate(nested));
        Assert.assertTrue(inner.getCause() instanceof NullPointerException);

        LambdaExpression wrongArity = lambda(constant(1), intParam("unused"));
        Assert.assertThrows(EvaluationException.class,
                () -> Evaluator.evaluate(new InvocationExpression(wrongArity)));
    }
}
