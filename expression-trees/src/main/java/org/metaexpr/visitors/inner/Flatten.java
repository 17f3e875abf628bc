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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.expression.ExprKind;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.util.Utilities;
import org.metaexpr.visitors.VisitDecision;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/** Records a pre-order traversal of a tree as a list of {@link FlatNode}s.
 * Nodes reachable along several paths, such as lambda parameters, are recorded once per visit.
 * Children of extension nodes are not visited. */
public class Flatten extends InnerVisitor {
    final Map<Expression, Integer> ids;
    final ImmutableList.Builder<FlatNode> nodes;
    int level;

    public Flatten() {
        this.ids = new IdentityHashMap<>();
        this.nodes = ImmutableList.builder();
        this.level = 0;
    }

    @Override
    public VisitDecision preorder(Expression node) {
        int id = this.ids.computeIfAbsent(node, n -> this.ids.size());
        this.nodes.add(new FlatNode(node, id, this.level));
        if (node.getKind() == ExprKind.EXTENSION)
            return VisitDecision.STOP;
        this.level++;
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(Expression node) {
        this.level--;
    }

    public ImmutableList<FlatNode> getNodes() {
        return this.nodes.build();
    }

    public static ImmutableList<FlatNode> flatten(Expression expression) {
        Flatten flatten = new Flatten();
        flatten.traverse(expression);
        return flatten.getNodes();
    }

    /** A JSON array with one object per recorded visit. */
    public static ArrayNode toJson(List<FlatNode> nodes) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (FlatNode node: nodes)
            node.toJson(result.addObject());
        return result;
    }
}
