package org.metaexpr.interpreter;

import com.google.common.collect.ImmutableList;
import org.metaexpr.Trees;
import org.metaexpr.errors.InternalTreeError;
import org.metaexpr.errors.UnimplementedException;
import org.metaexpr.ir.CatchBlock;
import org.metaexpr.ir.ElementInit;
import org.metaexpr.ir.LabelTarget;
import org.metaexpr.ir.MemberAssignment;
import org.metaexpr.ir.SwitchCase;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.BlockExpression;
import org.metaexpr.ir.expression.ConditionalExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.DefaultExpression;
import org.metaexpr.ir.expression.DynamicExpression;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.GotoExpression;
import org.metaexpr.ir.expression.GotoKind;
import org.metaexpr.ir.expression.IndexExpression;
import org.metaexpr.ir.expression.InvocationExpression;
import org.metaexpr.ir.expression.LabelExpression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.ListInitExpression;
import org.metaexpr.ir.expression.LoopExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.MemberInitExpression;
import org.metaexpr.ir.expression.NewArrayExpression;
import org.metaexpr.ir.expression.NewExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.SwitchExpression;
import org.metaexpr.ir.expression.TryExpression;
import org.metaexpr.ir.expression.TypeTestExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.Reflection;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntBinaryOperator;

import static org.metaexpr.Trees.add;
import static org.metaexpr.Trees.binary;
import static org.metaexpr.Trees.constant;
import static org.metaexpr.Trees.intParam;
import static org.metaexpr.Trees.lambda;

/** Tests for compiling and running lambdas. */
public class InterpreterTests {
    public static final class Counter {
        public int count;
        public final List<String> names = new ArrayList<>();

        public Counter() {}

        public Counter(int count) {
            this.count = count;
        }

        public int next() {
            return ++this.count;
        }
    }

    static Object run(Expression body) {
        return lambda(body).compile().invoke();
    }

    @Test
    public void testArithmetic() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        CompiledLambda f = lambda(binary(ExprOpcode.MULTIPLY, add(a, b), constant(2)), a, b).compile();
        Assert.assertEquals(10, f.invoke(2, 3));
        Assert.assertEquals(7L, run(add(constant(3L), constant(4L))));
        Assert.assertEquals(2.5, run(new BinaryExpression(double.class, ExprOpcode.DIVIDE,
                constant(5.0), constant(2))));
        Assert.assertEquals(1, run(binary(ExprOpcode.MODULO, constant(7), constant(3))));
        Assert.assertEquals(8, run(binary(ExprOpcode.LEFT_SHIFT, constant(1), constant(3))));
        Assert.assertEquals("a1", run(new BinaryExpression(String.class, ExprOpcode.ADD, constant("a"), constant(1))));
        Assert.assertEquals(-5, run(new UnaryExpression(ExprOpcode.NEGATE, constant(5))));
        Assert.assertEquals(~5, run(new UnaryExpression(ExprOpcode.ONES_COMPLEMENT, constant(5))));
    }

    @Test
    public void testComparisonsAndLogic() {
        Assert.assertEquals(true, run(binary(ExprOpcode.LESS_THAN, constant(1), constant(2L))));
        Assert.assertEquals(false, run(binary(ExprOpcode.EQUAL, constant("a"), constant("b"))));
        Assert.assertEquals(true, run(binary(ExprOpcode.EQUAL, constant(2), constant(2.0))));
        Assert.assertEquals(false, run(new UnaryExpression(ExprOpcode.NOT, constant(true))));
        // The right operand is not evaluated
        Expression boom = new UnaryExpression(boolean.class, ExprOpcode.THROW,
                new NewExpression(Reflection.constructor(IllegalStateException.class)));
        Assert.assertEquals(false, run(binary(ExprOpcode.AND_ALSO, constant(false), boom)));
        Assert.assertEquals(true, run(binary(ExprOpcode.OR_ELSE, constant(true), boom)));
        Assert.assertEquals("b", run(binary(ExprOpcode.COALESCE,
                new ConstantExpression(null, String.class), constant("b"))));
    }

    @Test
    public void testConversions() {
        Assert.assertEquals(3L, run(UnaryExpression.convert(constant(3), long.class)));
        Assert.assertEquals(3, run(UnaryExpression.convert(constant(3.7), int.class)));
        Assert.assertEquals("s", run(new UnaryExpression(String.class, ExprOpcode.TYPE_AS, constant("s"))));
        Assert.assertNull(run(new UnaryExpression(Integer.class, ExprOpcode.TYPE_AS, constant("s"))));
        Assert.assertEquals(true, run(new TypeTestExpression(constant("s"), CharSequence.class)));
        Assert.assertEquals(false, run(new TypeTestExpression(constant("s"), CharSequence.class, true)));
        Assert.assertEquals(0, run(new DefaultExpression(int.class)));
        Assert.assertNull(run(new DefaultExpression(String.class)));
    }

    @Test
    public void testBlockAndAssignment() {
        ParameterExpression v = intParam("v");
        Expression block = new BlockExpression(ImmutableList.of(v), ImmutableList.of(
                new BinaryExpression(ExprOpcode.ASSIGN, v, constant(5)),
                new BinaryExpression(ExprOpcode.MULTIPLY_ASSIGN, v, constant(3)),
                v));
        Assert.assertEquals(15, run(block));
        Assert.assertEquals(0, run(new BlockExpression(ImmutableList.of(v), ImmutableList.of(v))));
    }

    @Test
    public void testConditional() {
        ParameterExpression x = intParam("x");
        CompiledLambda sign = lambda(new ConditionalExpression(
                binary(ExprOpcode.LESS_THAN, x, constant(0)), constant("negative"), constant("positive")), x).compile();
        Assert.assertEquals("negative", sign.invoke(-3));
        Assert.assertEquals("positive", sign.invoke(3));
    }

    @Test
    public void testLoop() {
        // sum = 0; i = 0; while (true) { if (i >= 5) break sum; sum += i; i++; }
        ParameterExpression sum = intParam("sum");
        ParameterExpression i = intParam("i");
        LabelTarget exit = new LabelTarget(int.class, "exit");
        Expression body = new BlockExpression(
                new ConditionalExpression(void.class,
                        binary(ExprOpcode.GREATER_THAN_OR_EQUAL, i, constant(5)),
                        new GotoExpression(GotoKind.BREAK, exit, sum),
                        new DefaultExpression(void.class)),
                new BinaryExpression(ExprOpcode.ADD_ASSIGN, sum, i),
                new BinaryExpression(ExprOpcode.ASSIGN, i, add(i, constant(1))));
        Expression block = new BlockExpression(ImmutableList.of(sum, i), ImmutableList.of(
                new LoopExpression(body, exit, null)));
        Assert.assertEquals(10, run(block));
    }

    @Test
    public void testReturnLabel() {
        ParameterExpression x = intParam("x");
        LabelTarget ret = new LabelTarget(String.class, "return");
        Expression body = new BlockExpression(
                new ConditionalExpression(void.class, binary(ExprOpcode.EQUAL, x, constant(0)),
                        new GotoExpression(GotoKind.RETURN, ret, constant("zero")),
                        new DefaultExpression(void.class)),
                new LabelExpression(ret, constant("other")));
        CompiledLambda f = lambda(body, x).compile();
        Assert.assertEquals("zero", f.invoke(0));
        Assert.assertEquals("other", f.invoke(1));
    }

    @Test
    public void testJumpOutOfLambda() {
        LabelTarget nowhere = new LabelTarget("nowhere");
        Assert.assertThrows(InternalTreeError.class,
                () -> run(new GotoExpression(GotoKind.GOTO, nowhere, null)));
    }

    @Test
    public void testClosures() {
        // counter => { n = 0; inc = () => n += 1; inc(); inc(); n }
        ParameterExpression n = intParam("n");
        ParameterExpression inc = Trees.param(LambdaExpression.class, "inc");
        LambdaExpression increment = lambda(new BinaryExpression(ExprOpcode.ADD_ASSIGN, n, constant(1)));
        Expression block = new BlockExpression(ImmutableList.of(n, inc), ImmutableList.of(
                new BinaryExpression(ExprOpcode.ASSIGN, inc, increment),
                new InvocationExpression(inc),
                new InvocationExpression(inc),
                n));
        Assert.assertEquals(2, run(block));

        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        LambdaExpression adder = lambda(lambda(add(a, b), b), a);
        CompiledLambda addFive = (CompiledLambda) adder.compile().invoke(5);
        Assert.assertEquals(8, addFive.invoke(3));
    }

    @Test
    public void testFunctionalInterfaces() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        LambdaExpression sum = lambda(add(a, b), a, b);
        IntBinaryOperator operator = sum.compile().as(IntBinaryOperator.class);
        Assert.assertEquals(7, operator.applyAsInt(3, 4));
        @SuppressWarnings("unchecked")
        BiFunction<Integer, Integer, Integer> function = sum.compile().as(BiFunction.class);
        Assert.assertEquals(Integer.valueOf(9), function.apply(4, 5));
        // Default methods of the interface still work
        Assert.assertEquals(Integer.valueOf(18), function.andThen(x -> x * 2).apply(4, 5));

        Function<Integer, Integer> triple = x -> x * 3;
        ParameterExpression f = Trees.param(Function.class, "f");
        LambdaExpression apply = lambda(new InvocationExpression(f, constant(4)), f);
        Assert.assertEquals(12, apply.compile().invoke(triple));
        Assert.assertThrows(IllegalArgumentException.class, () -> sum.compile().invoke(1));
    }

    @Test
    public void testObjects() {
        Expression counter = new NewExpression(Reflection.constructor(Counter.class, int.class), constant(4));
        Assert.assertEquals(5, run(Trees.call(counter, Counter.class, "next", new Class<?>[0])));
        Assert.assertEquals(4, run(new MemberExpression(counter, "count")));

        Expression init = new MemberInitExpression(new NewExpression(Reflection.constructor(Counter.class)),
                List.of(new MemberAssignment(Reflection.field(Counter.class, "count"), constant(9))));
        Assert.assertEquals(9, ((Counter) run(init)).count);

        Expression list = new ListInitExpression(new NewExpression(Reflection.constructor(ArrayList.class)),
                List.of(new ElementInit(Reflection.method(ArrayList.class, "add", Object.class), constant("a")),
                        new ElementInit(Reflection.method(ArrayList.class, "add", Object.class), constant("b"))));
        Assert.assertEquals(List.of("a", "b"), run(list));
    }

    @Test
    public void testArrays() {
        Expression array = NewArrayExpression.init(int.class, constant(1), constant(2), constant(3));
        Assert.assertArrayEquals(new int[] { 1, 2, 3 }, (int[]) run(array));
        Assert.assertEquals(3, run(new UnaryExpression(ExprOpcode.ARRAY_LENGTH, array)));
        Assert.assertEquals(2, run(new IndexExpression(array, null, List.of(constant(1)))));
        Assert.assertEquals(3, run(binary(ExprOpcode.ARRAY_INDEX, array, constant(2))));
        int[][] grid = (int[][]) run(NewArrayExpression.bounds(int.class, constant(2), constant(3)));
        Assert.assertEquals(2, grid.length);
        Assert.assertEquals(3, grid[0].length);

        ParameterExpression values = Trees.param(int[].class, "values");
        Expression store = new BlockExpression(ImmutableList.of(values), ImmutableList.of(
                new BinaryExpression(ExprOpcode.ASSIGN, values, array),
                new BinaryExpression(ExprOpcode.ASSIGN,
                        new IndexExpression(values, null, List.of(constant(0))), constant(7)),
                values));
        Assert.assertArrayEquals(new int[] { 7, 2, 3 }, (int[]) run(store));
    }

    @Test
    public void testSwitch() {
        ParameterExpression x = intParam("x");
        CompiledLambda name = lambda(new SwitchExpression(String.class, x, constant("many"), null, List.of(
                new SwitchCase(constant("none"), List.of(constant(0))),
                new SwitchCase(constant("few"), List.of(constant(1), constant(2))))), x).compile();
        Assert.assertEquals("none", name.invoke(0));
        Assert.assertEquals("few", name.invoke(2));
        Assert.assertEquals("many", name.invoke(9));
    }

    @Test
    public void testTry() {
        ParameterExpression ex = Trees.param(IllegalStateException.class, "ex");
        Expression boom = new UnaryExpression(String.class, ExprOpcode.THROW,
                new NewExpression(Reflection.constructor(IllegalStateException.class, String.class), constant("boom")));
        Expression handled = new TryExpression(String.class, boom, null, null, List.of(
                new CatchBlock(IllegalStateException.class, ex,
                        Trees.call(ex, IllegalStateException.class, "getMessage", new Class<?>[0]))));
        Assert.assertEquals("boom", run(handled));

        ParameterExpression count = intParam("count");
        Expression withFinally = new BlockExpression(ImmutableList.of(count), ImmutableList.of(
                new TryExpression(int.class, constant(1), new BinaryExpression(ExprOpcode.ASSIGN, count, constant(5)),
                        null, List.of()),
                count));
        Assert.assertEquals(5, run(withFinally));

        Expression unhandled = new TryExpression(String.class, boom, null, null, List.of(
                new CatchBlock(IllegalArgumentException.class, null, constant("wrong"))));
        Assert.assertThrows(IllegalStateException.class, () -> run(unhandled));
    }

    @Test
    public void testUnsupported() {
        Expression dynamic = new DynamicExpression(Object.class, "GetMember", List.of(constant("a")));
        Assert.assertThrows(UnimplementedException.class, () -> run(dynamic));
        Assert.assertThrows(UnimplementedException.class, () -> run(new Trees.Opaque()));
        Assert.assertEquals(6, run(new Trees.Twice(constant(3))));
    }

    @Test
    public void testQuote() {
        LambdaExpression tree = lambda(constant(1));
        Assert.assertSame(tree, run(UnaryExpression.quote(tree)));
        Assert.assertEquals(1, run(new InvocationExpression(UnaryExpression.quote(tree))));
    }
}
