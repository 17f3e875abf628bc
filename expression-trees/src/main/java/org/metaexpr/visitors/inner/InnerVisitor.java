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

import org.metaexpr.ir.CatchBlock;
import org.metaexpr.ir.ElementInit;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.LabelTarget;
import org.metaexpr.ir.MemberAssignment;
import org.metaexpr.ir.MemberBinding;
import org.metaexpr.ir.MemberListBinding;
import org.metaexpr.ir.MemberMemberBinding;
import org.metaexpr.ir.SwitchCase;
import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.BlockExpression;
import org.metaexpr.ir.expression.ConditionalExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.DebugInfoExpression;
import org.metaexpr.ir.expression.DefaultExpression;
import org.metaexpr.ir.expression.DynamicExpression;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.ExtensionExpression;
import org.metaexpr.ir.expression.GotoExpression;
import org.metaexpr.ir.expression.IndexExpression;
import org.metaexpr.ir.expression.InvocationExpression;
import org.metaexpr.ir.expression.LabelExpression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.ListInitExpression;
import org.metaexpr.ir.expression.LoopExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.MemberInitExpression;
import org.metaexpr.ir.expression.MethodCallExpression;
import org.metaexpr.ir.expression.NewArrayExpression;
import org.metaexpr.ir.expression.NewExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.ir.expression.RuntimeVariablesExpression;
import org.metaexpr.ir.expression.SwitchExpression;
import org.metaexpr.ir.expression.TryExpression;
import org.metaexpr.ir.expression.TypeTestExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.IHasId;
import org.metaexpr.util.IWritesLogs;
import org.metaexpr.util.Logger;
import org.metaexpr.util.Utilities;
import org.metaexpr.visitors.VisitDecision;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Depth-first traversal of an expression tree.
 * For each node the traversal calls preorder; if it returns CONTINUE the children
 * are visited between push and pop, and then postorder is called.
 * The default preorder and postorder methods for a node class delegate to
 * the methods for its superclass. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class InnerVisitor implements IWritesLogs, IHasId {
    static final AtomicLong crtId = new AtomicLong();
    final long id;
    /** Nodes whose children are currently being visited, outermost first. */
    protected final List<IExprNode> context;

    protected InnerVisitor() {
        this.id = crtId.getAndIncrement();
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IExprNode node) {
        this.context.add(node);
    }

    public void pop(IExprNode node) {
        IExprNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw node.error("Corrupted visitor context: popping " + node + " instead of " + last);
    }

    @Nullable
    public IExprNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IExprNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /** Visit a whole tree. */
    public void traverse(IExprNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "#" + this.id;
    }

    /************************* PREORDER *****************************/

    public VisitDecision preorder(IExprNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(Expression node) {
        return this.preorder((IExprNode) node);
    }

    public VisitDecision preorder(BinaryExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(BlockExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ConditionalExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ConstantExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(DebugInfoExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(DefaultExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(DynamicExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ExtensionExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(GotoExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(IndexExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(InvocationExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(LabelExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(LambdaExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ListInitExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(LoopExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(MemberExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(MemberInitExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(MethodCallExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(NewArrayExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(NewExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ParameterExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(RuntimeVariablesExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(SwitchExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(TryExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(TypeTestExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(UnaryExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(LabelTarget node) {
        return this.preorder((IExprNode) node);
    }

    public VisitDecision preorder(CatchBlock node) {
        return this.preorder((IExprNode) node);
    }

    public VisitDecision preorder(SwitchCase node) {
        return this.preorder((IExprNode) node);
    }

    public VisitDecision preorder(ElementInit node) {
        return this.preorder((IExprNode) node);
    }

    public VisitDecision preorder(MemberBinding node) {
        return this.preorder((IExprNode) node);
    }

    public VisitDecision preorder(MemberAssignment node) {
        return this.preorder((MemberBinding) node);
    }

    public VisitDecision preorder(MemberListBinding node) {
        return this.preorder((MemberBinding) node);
    }

    public VisitDecision preorder(MemberMemberBinding node) {
        return this.preorder((MemberBinding) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IExprNode ignored) {}

    public void postorder(Expression node) {
        this.postorder((IExprNode) node);
    }

    public void postorder(BinaryExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(BlockExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(ConditionalExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(ConstantExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(DebugInfoExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(DefaultExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(DynamicExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(ExtensionExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(GotoExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(IndexExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(InvocationExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(LabelExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(LambdaExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(ListInitExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(LoopExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(MemberExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(MemberInitExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(MethodCallExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(NewArrayExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(NewExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(ParameterExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(RuntimeVariablesExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(SwitchExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(TryExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(TypeTestExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(UnaryExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(LabelTarget node) {
        this.postorder((IExprNode) node);
    }

    public void postorder(CatchBlock node) {
        this.postorder((IExprNode) node);
    }

    public void postorder(SwitchCase node) {
        this.postorder((IExprNode) node);
    }

    public void postorder(ElementInit node) {
        this.postorder((IExprNode) node);
    }

    public void postorder(MemberBinding node) {
        this.postorder((IExprNode) node);
    }

    public void postorder(MemberAssignment node) {
        this.postorder((MemberBinding) node);
    }

    public void postorder(MemberListBinding node) {
        this.postorder((MemberBinding) node);
    }

    public void postorder(MemberMemberBinding node) {
        this.postorder((MemberBinding) node);
    }
}
