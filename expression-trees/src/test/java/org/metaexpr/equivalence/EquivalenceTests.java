package org.metaexpr.equivalence;

import com.google.common.base.Equivalence;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.metaexpr.Closure;
import org.metaexpr.Trees;
import org.metaexpr.errors.UnrecognizedNodeKindException;
import org.metaexpr.errors.UnsupportedNodeKindException;
import org.metaexpr.ir.CatchBlock;
import org.metaexpr.ir.ElementInit;
import org.metaexpr.ir.LabelTarget;
import org.metaexpr.ir.MemberAssignment;
import org.metaexpr.ir.SwitchCase;
import org.metaexpr.ir.SymbolDocument;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.BlockExpression;
import org.metaexpr.ir.expression.ConditionalExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.DebugInfoExpression;
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
import org.metaexpr.ir.expression.MemberInitExpression;
import org.metaexpr.ir.expression.NewArrayExpression;
import org.metaexpr.ir.expression.NewExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.RuntimeVariablesExpression;
import org.metaexpr.ir.expression.SwitchExpression;
import org.metaexpr.ir.expression.TryExpression;
import org.metaexpr.ir.expression.TypeTestExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.Reflection;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import static org.metaexpr.Trees.add;
import static org.metaexpr.Trees.constant;
import static org.metaexpr.Trees.intParam;
import static org.metaexpr.Trees.lambda;

/** Unit tests for structural equality and hashing of trees. */
public class EquivalenceTests {
    static final ExprEqualityComparer STRICT = new ExprEqualityComparer(EqualityComparerFlags.NONE);

    @FunctionalInterface
    public interface IntOperator {
        int apply(int left, int right);
    }

    public static final class Point {
        public int x;
        public final List<Integer> values = new ArrayList<>();

        public Point() {}
    }

    @Closure
    private static final class Locals {
        int value = 42;
        LambdaExpression inner = equalTo(42);
    }

    static LambdaExpression equalTo(int value) {
        ParameterExpression x = intParam("x");
        return lambda(Trees.equal(x, constant(value)), x);
    }

    static void assertEquivalent(ExprEqualityComparer comparer, Expression left, Expression right) {
        Assert.assertTrue(left + " should be equivalent to " + right, comparer.equivalent(left, right));
        Assert.assertTrue(comparer.equivalent(right, left));
        Assert.assertEquals(comparer.hash(left), comparer.hash(right));
    }

    static void assertEquivalent(Expression left, Expression right) {
        assertEquivalent(ExprEqualityComparer.DEFAULT, left, right);
    }

    static void assertDifferent(ExprEqualityComparer comparer, Expression left, Expression right) {
        Assert.assertFalse(left + " should differ from " + right, comparer.equivalent(left, right));
        Assert.assertFalse(comparer.equivalent(right, left));
    }

    static void assertDifferent(Expression left, Expression right) {
        assertDifferent(ExprEqualityComparer.DEFAULT, left, right);
    }

    /** Two independent builds of the same tree are equivalent. */
    static void assertStable(Supplier<Expression> builder) {
        Expression first = builder.get();
        Expression second = builder.get();
        Assert.assertNotSame(first, second);
        assertEquivalent(first, first);
        assertEquivalent(first, second);
    }

    static LambdaExpression sum(String a, String b) {
        ParameterExpression pa = intParam(a);
        ParameterExpression pb = intParam(b);
        return lambda(add(pa, pb), pa, pb);
    }

    @Test
    public void testAlphaEquivalence() {
        assertEquivalent(sum("a", "b"), sum("c", "d"));
        assertEquivalent(sum("a", "b"), sum("b", "a"));
    }

    @Test
    public void testBindingUse() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        LambdaExpression twice = lambda(add(a, a), a, b);
        assertDifferent(sum("a", "b"), twice);

        ParameterExpression c = intParam("a");
        ParameterExpression d = intParam("b");
        LambdaExpression swapped = lambda(add(d, c), c, d);
        assertDifferent(sum("a", "b"), swapped);
    }

    @Test
    public void testFreeParameters() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("a");
        assertEquivalent(add(a, a), add(a, a));
        // a paired with b on first sight
        assertEquivalent(add(a, a), add(b, b));
        assertDifferent(add(a, a), add(a, b));
    }

    @Test
    public void testParameterNames() {
        assertDifferent(STRICT, sum("a", "b"), sum("c", "d"));
        assertEquivalent(STRICT, sum("a", "b"), sum("a", "b"));
        ExprEqualityComparer names = new ExprEqualityComparer(ImmutableSet.of(EqualityComparerFlags.IGNORE_PARAMETER_NAME));
        assertEquivalent(names, sum("a", "b"), sum("c", "d"));
    }

    @Test
    public void testParameterTypes() {
        ParameterExpression i = intParam("x");
        ParameterExpression l = Trees.param(long.class, "x");
        assertDifferent(lambda(i, i), lambda(l, l));
        ParameterExpression byRef = new ParameterExpression(int.class, "x", true);
        assertDifferent(lambda(i, i), lambda(byRef, byRef));
    }

    @Test
    public void testLambdaType() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        LambdaExpression custom = new LambdaExpression(IntOperator.class, add(a, b), a, b);
        LambdaExpression standard = sum("a", "b");
        Assert.assertEquals(BiFunction.class, standard.type);
        assertEquivalent(custom, standard);

        ExprEqualityComparer withType = new ExprEqualityComparer(ImmutableSet.of(
                EqualityComparerFlags.IGNORE_LAMBDA_NAME,
                EqualityComparerFlags.IGNORE_LABEL_NAME,
                EqualityComparerFlags.IGNORE_PARAMETER_NAME));
        assertDifferent(withType, custom, standard);

        // The return type is compared even when the lambda type is ignored
        ParameterExpression c = intParam("c");
        ParameterExpression d = intParam("d");
        LambdaExpression widened = new LambdaExpression(IntOperator.class,
                UnaryExpression.convert(add(c, d), long.class), c, d);
        assertDifferent(custom, widened);
    }

    @Test
    public void testLambdaName() {
        LambdaExpression f = new LambdaExpression(Supplier.class, constant(1), "f", false, List.of());
        LambdaExpression g = new LambdaExpression(Supplier.class, constant(1), "g", false, List.of());
        assertEquivalent(f, g);
        assertDifferent(STRICT, f, g);
        LambdaExpression tail = new LambdaExpression(Supplier.class, constant(1), "f", true, List.of());
        assertDifferent(f, tail);
    }

    static Expression loop(String breakName, String continueName) {
        LabelTarget exit = new LabelTarget(int.class, breakName);
        LabelTarget next = new LabelTarget(continueName);
        ParameterExpression i = intParam("i");
        Expression body = new ConditionalExpression(void.class,
                Trees.binary(ExprOpcode.LESS_THAN, i, constant(10)),
                new BinaryExpression(int.class, ExprOpcode.ADD_ASSIGN, i, constant(1)),
                new GotoExpression(GotoKind.BREAK, exit, i));
        return new BlockExpression(ImmutableList.of(i), ImmutableList.of(new LoopExpression(body, exit, next)));
    }

    @Test
    public void testLabels() {
        assertEquivalent(loop("exit", "next"), loop("brk", "cont"));
        assertDifferent(STRICT, loop("exit", "next"), loop("brk", "cont"));
        assertEquivalent(STRICT, loop("exit", "next"), loop("exit", "next"));
    }

    @Test
    public void testLabelPairing() {
        LabelTarget l1 = new LabelTarget("l1");
        LabelTarget l2 = new LabelTarget("l2");
        LabelTarget m = new LabelTarget("m");
        Expression two = new BlockExpression(
                new GotoExpression(GotoKind.GOTO, l1, null),
                new GotoExpression(GotoKind.GOTO, l2, null),
                new LabelExpression(l1, null));
        Expression one = new BlockExpression(
                new GotoExpression(GotoKind.GOTO, m, null),
                new GotoExpression(GotoKind.GOTO, m, null),
                new LabelExpression(m, null));
        assertDifferent(two, one);
    }

    @Test
    public void testBlockLocals() {
        Supplier<Expression> block = () -> {
            ParameterExpression v = intParam("v");
            return new BlockExpression(ImmutableList.of(v), ImmutableList.of(
                    new BinaryExpression(ExprOpcode.ASSIGN, v, constant(1)),
                    add(v, constant(2))));
        };
        assertStable(block);
    }

    @Test
    public void testConstants() {
        assertEquivalent(constant(1), constant(1));
        assertDifferent(constant(1), constant(2));
        assertDifferent(constant(1), constant(1L));
        assertEquivalent(new ConstantExpression(null, String.class), new ConstantExpression(null, String.class));
        assertDifferent(new ConstantExpression(null, String.class), new ConstantExpression(null, Object.class));
        assertEquivalent(constant("hello"), constant("hel" + "lo"));
    }

    @Test
    public void testDifferentKinds() {
        assertDifferent(constant(1), intParam("x"));
        assertDifferent(add(constant(1), constant(2)), Trees.binary(ExprOpcode.SUBTRACT, constant(1), constant(2)));
        assertDifferent(new UnaryExpression(ExprOpcode.NEGATE, constant(1)),
                new UnaryExpression(ExprOpcode.UNARY_PLUS, constant(1)));
    }

    @Test
    public void testNull() {
        Assert.assertTrue(ExprEqualityComparer.DEFAULT.equivalent(null, null));
        Assert.assertFalse(ExprEqualityComparer.DEFAULT.equivalent(constant(1), null));
        Assert.assertFalse(ExprEqualityComparer.DEFAULT.equivalent(null, constant(1)));
        Assert.assertEquals(0, ExprEqualityComparer.DEFAULT.hash(null));
    }

    @Test
    public void testAllKinds() {
        Locals locals = new Locals();
        SymbolDocument document = new SymbolDocument("Query.java");
        assertStable(() -> Trees.binary(ExprOpcode.MULTIPLY, constant(2), constant(3)));
        assertStable(() -> new BlockExpression(constant(1), constant("a")));
        assertStable(() -> new ConditionalExpression(constant(true), constant(1), constant(2)));
        assertStable(() -> new DebugInfoExpression(document, 1, 2, 3, 4));
        assertStable(() -> DebugInfoExpression.clear(document));
        assertStable(() -> new DefaultExpression(String.class));
        assertStable(() -> {
            ParameterExpression array = Trees.param(int[].class, "a");
            return lambda(new IndexExpression(array, null, List.of(constant(0))), array);
        });
        assertStable(() -> new InvocationExpression(sum("a", "b"), constant(1), constant(2)));
        assertStable(() -> {
            LabelTarget target = new LabelTarget(int.class, "l");
            return new BlockExpression(
                    new GotoExpression(int.class, GotoKind.RETURN, target, constant(1)),
                    new LabelExpression(target, constant(0)));
        });
        assertStable(() -> new ListInitExpression(
                new NewExpression(Reflection.constructor(ArrayList.class)),
                List.of(new ElementInit(Reflection.method(ArrayList.class, "add", Object.class), constant("x")))));
        assertStable(() -> loop("exit", "next"));
        assertStable(() -> Trees.captured(locals, "value"));
        assertStable(() -> new MemberInitExpression(
                new NewExpression(Reflection.constructor(Point.class)),
                List.of(new MemberAssignment(Reflection.field(Point.class, "x"), constant(3)))));
        assertStable(() -> Trees.call(constant("abc"), String.class, "substring",
                new Class<?>[] { int.class }, constant(1)));
        assertStable(() -> NewArrayExpression.init(int.class, constant(1), constant(2)));
        assertStable(() -> NewArrayExpression.bounds(int.class, constant(3)));
        assertStable(() -> new RuntimeVariablesExpression(List.of(intParam("v"))));
        assertStable(() -> new SwitchExpression(String.class, constant(1), constant("other"), null,
                List.of(new SwitchCase(constant("one"), List.of(constant(1))))));
        assertStable(() -> {
            ParameterExpression ex = Trees.param(RuntimeException.class, "ex");
            return new TryExpression(int.class, constant(1), null, null,
                    List.of(new CatchBlock(RuntimeException.class, ex, constant(2))));
        });
        assertStable(() -> new TypeTestExpression(constant("s"), CharSequence.class));
        assertStable(() -> UnaryExpression.quote(sum("a", "b")));
    }

    @Test
    public void testFieldDifferences() {
        assertDifferent(new DebugInfoExpression(new SymbolDocument("A.java"), 1, 2, 3, 4),
                new DebugInfoExpression(new SymbolDocument("A.java"), 1, 2, 3, 5));
        assertDifferent(NewArrayExpression.init(int.class, constant(3)),
                NewArrayExpression.bounds(int.class, constant(3)));
        assertDifferent(new TypeTestExpression(constant("s"), CharSequence.class),
                new TypeTestExpression(constant("s"), CharSequence.class, true));
        assertDifferent(new TypeTestExpression(constant("s"), CharSequence.class),
                new TypeTestExpression(constant("s"), String.class));
        assertDifferent(Trees.call(constant("abc"), String.class, "substring", new Class<?>[] { int.class }, constant(1)),
                Trees.call(constant("abc"), String.class, "substring", new Class<?>[] { int.class }, constant(2)));
        assertDifferent(Trees.call(constant("abc"), String.class, "toUpperCase", new Class<?>[0]),
                Trees.call(constant("abc"), String.class, "toLowerCase", new Class<?>[0]));
        assertDifferent(new BlockExpression(constant(1), constant(2)), new BlockExpression(constant(2), constant(1)));
        assertDifferent(new SwitchExpression(String.class, constant(1), constant("other"), null,
                        List.of(new SwitchCase(constant("one"), List.of(constant(1))))),
                new SwitchExpression(String.class, constant(1), null, null,
                        List.of(new SwitchCase(constant("one"), List.of(constant(1))))));
    }

    @Test
    public void testSnapshotBeforeComparison() {
        Locals locals = new Locals();
        Expression read = add(Trees.captured(locals, "value"), constant(1));
        assertEquivalent(read, add(constant(42), constant(1)));
        locals.value = 7;
        assertEquivalent(read, add(constant(7), constant(1)));
        assertDifferent(read, add(constant(42), constant(1)));
    }

    @Test
    public void testCapturedTree() {
        Locals locals = new Locals();
        Expression read = lambda(Trees.captured(locals, "inner"));
        assertEquivalent(read, read);
        Assert.assertEquals(read.structuralHash(), read.structuralHash());

        Expression held = lambda(new ConstantExpression(equalTo(42), LambdaExpression.class));
        assertEquivalent(held, held);
        assertEquivalent(read, held);
        assertDifferent(read, lambda(new ConstantExpression(equalTo(43), LambdaExpression.class)));
        assertDifferent(held, lambda(new ConstantExpression(null, LambdaExpression.class)));

        locals.inner = equalTo(43);
        assertDifferent(read, held);
    }

    @Test
    public void testDynamicRejected() {
        Expression left = new DynamicExpression(Object.class, "GetMember", List.of(constant("a")));
        Expression right = new DynamicExpression(Object.class, "GetMember", List.of(constant("a")));
        Assert.assertThrows(UnsupportedNodeKindException.class,
                () -> ExprEqualityComparer.DEFAULT.equivalent(left, right));
        Assert.assertThrows(UnsupportedNodeKindException.class,
                () -> ExprEqualityComparer.DEFAULT.hash(left));
        Assert.assertThrows(UnsupportedNodeKindException.class,
                () -> ExprEqualityComparer.DEFAULT.equivalent(add(constant(1), left), add(constant(1), right)));
    }

    @Test
    public void testExtensionRejected() {
        Expression left = new Trees.Twice(constant(3));
        Expression right = new Trees.Twice(constant(3));
        UnrecognizedNodeKindException ex = Assert.assertThrows(UnrecognizedNodeKindException.class,
                () -> ExprEqualityComparer.DEFAULT.equivalent(left, right));
        Assert.assertSame(left, ex.node);
        Assert.assertThrows(UnrecognizedNodeKindException.class, () -> ExprEqualityComparer.DEFAULT.hash(left));
        assertEquivalent(left.reduceExtensionsRecursive(), right.reduceExtensionsRecursive());
    }

    @Test
    public void testGuavaEquivalence() {
        Equivalence<Expression> equivalence = ExprEqualityComparer.DEFAULT.asEquivalence();
        Assert.assertTrue(equivalence.equivalent(sum("a", "b"), sum("x", "y")));
        Set<Equivalence.Wrapper<Expression>> distinct = new HashSet<>();
        distinct.add(equivalence.wrap(sum("a", "b")));
        distinct.add(equivalence.wrap(sum("c", "d")));
        distinct.add(equivalence.wrap(constant(1)));
        Assert.assertEquals(2, distinct.size());
    }

    @Test
    public void testExpressionConveniences() {
        Assert.assertTrue(sum("a", "b").equivalent(sum("c", "d")));
        Assert.assertEquals(sum("a", "b").structuralHash(), sum("c", "d").structuralHash());
        Assert.assertFalse(sum("a", "b").equivalent(null));
    }
}
