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

import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.visitors.VisitDecision;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** Checks whether a tree contains any of a set of nodes, compared by reference.
 * Extension nodes are searched through their visible children, without reduction. */
public class ContainsNodes extends InnerVisitor {
    final Set<Expression> targets;
    public boolean found = false;

    public ContainsNodes(Expression... targets) {
        this.targets = Collections.newSetFromMap(new IdentityHashMap<>());
        Collections.addAll(this.targets, targets);
    }

    @Override
    public void startVisit(IExprNode node) {
        super.startVisit(node);
        this.found = false;
    }

    @Override
    public VisitDecision preorder(Expression node) {
        if (this.found)
            return VisitDecision.STOP;
        if (this.targets.contains(node)) {
            this.found = true;
            return VisitDecision.STOP;
        }
        return VisitDecision.CONTINUE;
    }

    public static boolean contains(Expression tree, Expression... targets) {
        ContainsNodes visitor = new ContainsNodes(targets);
        visitor.traverse(tree);
        return visitor.found;
    }
}
