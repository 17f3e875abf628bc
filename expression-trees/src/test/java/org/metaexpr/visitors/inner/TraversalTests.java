package org.metaexpr.visitors.inner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.metaexpr.Closure;
import org.metaexpr.Trees;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.BlockExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.ExprKind;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.metaexpr.Trees.add;
import static org.metaexpr.Trees.captured;
import static org.metaexpr.Trees.constant;
import static org.metaexpr.Trees.intParam;
import static org.metaexpr.Trees.lambda;

/** Tests for contains, replace, reduce, flatten and snapshot. */
public class TraversalTests {
    @Closure
    private static final class Locals {
        int value = 42;
        String name = "x";
    }

    @Test
    public void testContains() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        ConstantExpression one = constant(1);
        LambdaExpression tree = lambda(add(a, one), a, b);
        Assert.assertTrue(tree.contains(one));
        Assert.assertTrue(tree.contains(b));
        Assert.assertTrue(tree.contains(tree));
        Assert.assertTrue(tree.contains(constant(2), one));
        // Reference identity, not structural equality
        Assert.assertFalse(tree.contains(constant(1)));
        Assert.assertFalse(tree.contains());
    }

    @Test
    public void testContainsInsideExtension() {
        ConstantExpression three = constant(3);
        Expression tree = add(new Trees.Twice(three), constant(1));
        Assert.assertTrue(tree.contains(three));
    }

    @Test
    public void testReplace() {
        ParameterExpression a = intParam("a");
        ConstantExpression one = constant(1);
        LambdaExpression tree = lambda(add(a, add(one, one)), a);
        Expression replaced = tree.replace(one, constant(2));
        Assert.assertNotSame(tree, replaced);
        Assert.assertTrue(lambda(add(a, add(constant(2), constant(2))), a).equivalent(replaced));
        Assert.assertFalse(replaced.contains(one));
        // The input is unchanged
        Assert.assertTrue(tree.contains(one));
        Assert.assertSame(tree, tree.replace(constant(1), constant(2)));
    }

    @Test
    public void testReplaceMap() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        Expression tree = add(a, b);
        Expression swapped = tree.replace(ImmutableMap.of(a, b, b, a));
        BinaryExpression binary = swapped.to(BinaryExpression.class);
        Assert.assertSame(b, binary.left);
        Assert.assertSame(a, binary.right);
    }

    @Test
    public void testReplaceDoesNotReduce() {
        ConstantExpression three = constant(3);
        Trees.Twice twice = new Trees.Twice(three);
        Expression tree = add(twice, constant(1));
        Expression replaced = tree.replace(constant(5), constant(6));
        Assert.assertSame(tree, replaced);
        Assert.assertSame(twice, replaced.to(BinaryExpression.class).left);
    }

    static BlockExpression compound() {
        ParameterExpression v = intParam("v");
        return new BlockExpression(ImmutableList.of(v), ImmutableList.of(
                new BinaryExpression(ExprOpcode.ASSIGN, v, constant(1)),
                new BinaryExpression(ExprOpcode.ADD_ASSIGN, v, constant(2)),
                v));
    }

    @Test
    public void testReduceRecursive() {
        BlockExpression block = compound();
        Assert.assertTrue(block.expressions.get(1).canReduce());
        Expression reduced = block.reduceRecursive();
        Assert.assertNotSame(block, reduced);
        BinaryExpression assign = reduced.to(BlockExpression.class).expressions.get(1).to(BinaryExpression.class);
        Assert.assertEquals(ExprOpcode.ASSIGN, assign.opcode);
        Assert.assertEquals(ExprOpcode.ADD, assign.right.to(BinaryExpression.class).opcode);
        Assert.assertEquals(3, lambda(reduced).compile().invoke());
    }

    @Test
    public void testReduceExtensionsOnly() {
        BlockExpression block = compound();
        Assert.assertSame(block, block.reduceExtensionsRecursive());

        Expression tree = add(new Trees.Twice(new Trees.Twice(constant(2))), constant(1));
        for (Expression reduced : List.of(tree.reduceRecursive(), tree.reduceExtensionsRecursive())) {
            Assert.assertFalse(Flatten.flatten(reduced).stream()
                    .anyMatch(n -> n.node().getKind() == ExprKind.EXTENSION));
            Assert.assertEquals(9, lambda(reduced).compile().invoke());
        }
    }

    @Test
    public void testFlatten() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        BinaryExpression sum = add(a, b);
        LambdaExpression tree = lambda(sum, a, b);
        List<FlatNode> nodes = tree.flatten();
        Assert.assertEquals(List.of(
                new FlatNode(tree, 0, 0),
                new FlatNode(sum, 1, 1),
                new FlatNode(a, 2, 2),
                new FlatNode(b, 3, 2),
                new FlatNode(a, 2, 1),
                new FlatNode(b, 3, 1)), nodes);
        Assert.assertEquals(nodes, tree.flatten());
    }

    @Test
    public void testFlattenExtension() {
        Expression tree = add(new Trees.Twice(constant(3)), constant(1));
        List<FlatNode> nodes = Flatten.flatten(tree);
        Assert.assertEquals(3, nodes.size());
        Assert.assertEquals(ExprKind.EXTENSION, nodes.get(1).node().getKind());
    }

    @Test
    public void testFlattenJson() {
        ParameterExpression a = intParam("a");
        ParameterExpression b = intParam("b");
        ArrayNode json = Flatten.toJson(lambda(add(a, b), a, b).flatten());
        Assert.assertEquals(6, json.size());
        JsonNode root = json.get(0);
        Assert.assertEquals(0, root.get("id").asInt());
        Assert.assertEquals(0, root.get("level").asInt());
        Assert.assertEquals("LAMBDA", root.get("kind").asText());
        Assert.assertEquals("java.util.function.BiFunction", root.get("type").asText());
        Assert.assertEquals("PARAMETER", json.get(5).get("kind").asText());
        Assert.assertEquals(3, json.get(5).get("id").asInt());
    }

    @Test
    public void testSnapshot() {
        Locals locals = new Locals();
        Expression tree = add(captured(locals, "value"), constant(1));
        Expression snapshot = tree.snapshot();
        BinaryExpression binary = snapshot.to(BinaryExpression.class);
        ConstantExpression value = binary.left.to(ConstantExpression.class);
        Assert.assertEquals(42, value.value);
        Assert.assertEquals(int.class, value.type);
        Assert.assertSame(snapshot, snapshot.snapshot());

        locals.value = 1337;
        Assert.assertEquals(42, snapshot.to(BinaryExpression.class).left.to(ConstantExpression.class).value);
        Assert.assertEquals(1337, tree.snapshot().to(BinaryExpression.class).left.to(ConstantExpression.class).value);
    }

    @Test
    public void testSnapshotReferenceField() {
        Locals locals = new Locals();
        Expression snapshot = captured(locals, "name").snapshot();
        ConstantExpression constant = snapshot.to(ConstantExpression.class);
        Assert.assertEquals("x", constant.value);
        Assert.assertEquals(String.class, constant.type);
    }

    @Test
    public void testSnapshotKeepsExtensions() {
        Locals locals = new Locals();
        Trees.Twice twice = new Trees.Twice(captured(locals, "value"));
        Expression snapshot = twice.snapshot();
        Assert.assertSame(twice, snapshot);
    }

    @Test
    public void testSnapshotIgnoresOrdinaryFields() {
        Expression tree = captured(new Object() {
            public final int notCaptured = 3;
        }, "notCaptured");
        Assert.assertSame(tree, tree.snapshot());
    }
}
