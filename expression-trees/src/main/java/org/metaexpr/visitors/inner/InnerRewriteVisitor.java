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

import com.google.common.collect.ImmutableList;
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
import org.metaexpr.ir.expression.DynamicExpression;
import org.metaexpr.ir.expression.Expression;
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
import org.metaexpr.util.Linq;
import org.metaexpr.util.Logger;
import org.metaexpr.visitors.VisitDecision;

import javax.annotation.Nullable;
import java.util.Objects;

/** Base class for visitors which rewrite expression trees.
 * This class recurses over the structure of the tree, and if any children
 * have changed builds a new version of the node; unchanged nodes are reused,
 * so a rewrite which changes nothing returns the original tree.
 * Leaves and extension nodes are returned unchanged.
 * Classes that extend this should override the preorder methods,
 * or {@link #transform(Expression)} to intercept every expression. */
public abstract class InnerRewriteVisitor extends InnerVisitor implements IRTransform {
    /** Result produced by the last preorder invocation. */
    @Nullable
    protected IExprNode lastResult;

    protected InnerRewriteVisitor() {}

    IExprNode getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public Expression apply(Expression expression) {
        this.startVisit(expression);
        Expression result = this.transform(expression);
        this.endVisit();
        return result;
    }

    /** Replace the 'old' node with the 'newNode' if any of its fields differs. */
    protected void map(IExprNode old, IExprNode newNode) {
        if (old == newNode || old.sameFields(newNode)) {
            this.lastResult = old;
            return;
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(": ")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newNode::toString)
                .newline();
        this.lastResult = newNode;
    }

    @Override
    public VisitDecision preorder(IExprNode node) {
        this.map(node, node);
        return VisitDecision.STOP;
    }

    protected Expression transform(Expression expression) {
        expression.accept(this);
        return this.getResult().to(Expression.class);
    }

    @Nullable
    protected Expression transformN(@Nullable Expression expression) {
        if (expression == null)
            return null;
        return this.transform(expression);
    }

    protected <T extends IExprNode> T transform(T node, Class<T> clazz) {
        if (node instanceof Expression)
            return this.transform((Expression) node).to(clazz);
        node.accept(this);
        return this.getResult().to(clazz);
    }

    @Nullable
    protected <T extends IExprNode> T transformN(@Nullable T node, Class<T> clazz) {
        if (node == null)
            return null;
        return this.transform(node, clazz);
    }

    protected ImmutableList<Expression> transformList(ImmutableList<Expression> expressions) {
        return Linq.map(expressions, e -> this.transform(e));
    }

    protected <T extends IExprNode> ImmutableList<T> transformList(ImmutableList<T> nodes, Class<T> clazz) {
        return Linq.map(nodes, n -> this.transform(n, clazz));
    }

    @Override
    public VisitDecision preorder(BinaryExpression expression) {
        this.push(expression);
        Expression left = this.transform(expression.left);
        LambdaExpression conversion = this.transformN(expression.conversion, LambdaExpression.class);
        Expression right = this.transform(expression.right);
        this.pop(expression);
        Expression result = new BinaryExpression(expression.type, expression.opcode, left, right,
                expression.method, conversion, expression.lifted, expression.liftedToNull);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(BlockExpression expression) {
        this.push(expression);
        ImmutableList<Expression> expressions = this.transformList(expression.expressions);
        ImmutableList<ParameterExpression> variables = this.transformList(expression.variables, ParameterExpression.class);
        this.pop(expression);
        Expression result = new BlockExpression(expression.type, variables, expressions);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(ConditionalExpression expression) {
        this.push(expression);
        Expression test = this.transform(expression.test);
        Expression ifTrue = this.transform(expression.ifTrue);
        Expression ifFalse = this.transform(expression.ifFalse);
        this.pop(expression);
        Expression result = new ConditionalExpression(expression.type, test, ifTrue, ifFalse);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DynamicExpression expression) {
        this.push(expression);
        ImmutableList<Expression> arguments = this.transformList(expression.arguments);
        this.pop(expression);
        Expression result = new DynamicExpression(expression.type, expression.operation, arguments);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(GotoExpression expression) {
        this.push(expression);
        LabelTarget target = this.transform(expression.target, LabelTarget.class);
        Expression value = this.transformN(expression.value);
        this.pop(expression);
        Expression result = new GotoExpression(expression.type, expression.kind, target, value);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(IndexExpression expression) {
        this.push(expression);
        Expression object = this.transform(expression.object);
        ImmutableList<Expression> arguments = this.transformList(expression.arguments);
        this.pop(expression);
        Expression result = new IndexExpression(object, expression.indexer, arguments);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(InvocationExpression expression) {
        this.push(expression);
        Expression function = this.transform(expression.expression);
        ImmutableList<Expression> arguments = this.transformList(expression.arguments);
        this.pop(expression);
        Expression result = new InvocationExpression(expression.type, function, arguments);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LabelExpression expression) {
        this.push(expression);
        LabelTarget target = this.transform(expression.target, LabelTarget.class);
        Expression defaultValue = this.transformN(expression.defaultValue);
        this.pop(expression);
        Expression result = new LabelExpression(target, defaultValue);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LambdaExpression expression) {
        this.push(expression);
        Expression body = this.transform(expression.body);
        ImmutableList<ParameterExpression> parameters = this.transformList(expression.parameters, ParameterExpression.class);
        this.pop(expression);
        Expression result = new LambdaExpression(expression.type, body, expression.name,
                expression.tailCall, parameters);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(ListInitExpression expression) {
        this.push(expression);
        NewExpression newExpression = this.transform(expression.newExpression, NewExpression.class);
        ImmutableList<ElementInit> initializers = this.transformList(expression.initializers, ElementInit.class);
        this.pop(expression);
        Expression result = new ListInitExpression(newExpression, initializers);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(LoopExpression expression) {
        this.push(expression);
        LabelTarget breakLabel = this.transformN(expression.breakLabel, LabelTarget.class);
        LabelTarget continueLabel = this.transformN(expression.continueLabel, LabelTarget.class);
        Expression body = this.transform(expression.body);
        this.pop(expression);
        Expression result = new LoopExpression(body, breakLabel, continueLabel);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MemberExpression expression) {
        this.push(expression);
        Expression object = this.transformN(expression.expression);
        this.pop(expression);
        Expression result = new MemberExpression(object, expression.member);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MemberInitExpression expression) {
        this.push(expression);
        NewExpression newExpression = this.transform(expression.newExpression, NewExpression.class);
        ImmutableList<MemberBinding> bindings = this.transformList(expression.bindings, MemberBinding.class);
        this.pop(expression);
        Expression result = new MemberInitExpression(newExpression, bindings);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MethodCallExpression expression) {
        this.push(expression);
        Expression object = this.transformN(expression.object);
        ImmutableList<Expression> arguments = this.transformList(expression.arguments);
        this.pop(expression);
        Expression result = new MethodCallExpression(object, expression.method, arguments);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(NewArrayExpression expression) {
        this.push(expression);
        ImmutableList<Expression> expressions = this.transformList(expression.expressions);
        this.pop(expression);
        Expression result = new NewArrayExpression(expression.type, expressions, expression.bounds);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(NewExpression expression) {
        this.push(expression);
        ImmutableList<Expression> arguments = this.transformList(expression.arguments);
        this.pop(expression);
        Expression result = new NewExpression(expression.type, expression.constructor,
                arguments, expression.members);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(RuntimeVariablesExpression expression) {
        this.push(expression);
        ImmutableList<ParameterExpression> variables = this.transformList(expression.variables, ParameterExpression.class);
        this.pop(expression);
        Expression result = new RuntimeVariablesExpression(variables);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SwitchExpression expression) {
        this.push(expression);
        Expression switchValue = this.transform(expression.switchValue);
        ImmutableList<SwitchCase> cases = this.transformList(expression.cases, SwitchCase.class);
        Expression defaultBody = this.transformN(expression.defaultBody);
        this.pop(expression);
        Expression result = new SwitchExpression(expression.type, switchValue, defaultBody,
                expression.comparison, cases);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(TryExpression expression) {
        this.push(expression);
        Expression body = this.transform(expression.body);
        ImmutableList<CatchBlock> handlers = this.transformList(expression.handlers, CatchBlock.class);
        Expression finallyBody = this.transformN(expression.finallyBody);
        Expression fault = this.transformN(expression.fault);
        this.pop(expression);
        Expression result = new TryExpression(expression.type, body, finallyBody, fault, handlers);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(TypeTestExpression expression) {
        this.push(expression);
        Expression operand = this.transform(expression.expression);
        this.pop(expression);
        Expression result = new TypeTestExpression(operand, expression.typeOperand, expression.exact);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(UnaryExpression expression) {
        this.push(expression);
        Expression operand = this.transform(expression.operand);
        this.pop(expression);
        Expression result = new UnaryExpression(expression.type, expression.opcode, operand,
                expression.method, expression.lifted, expression.liftedToNull);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CatchBlock block) {
        this.push(block);
        ParameterExpression variable = this.transformN(block.variable, ParameterExpression.class);
        Expression filter = this.transformN(block.filter);
        Expression body = this.transform(block.body);
        this.pop(block);
        this.map(block, new CatchBlock(block.test, variable, body, filter));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SwitchCase switchCase) {
        this.push(switchCase);
        ImmutableList<Expression> testValues = this.transformList(switchCase.testValues);
        Expression body = this.transform(switchCase.body);
        this.pop(switchCase);
        this.map(switchCase, new SwitchCase(body, testValues));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(ElementInit init) {
        this.push(init);
        ImmutableList<Expression> arguments = this.transformList(init.arguments);
        this.pop(init);
        this.map(init, new ElementInit(init.addMethod, arguments));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MemberAssignment binding) {
        this.push(binding);
        Expression expression = this.transform(binding.expression);
        this.pop(binding);
        this.map(binding, new MemberAssignment(binding.member, expression));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MemberListBinding binding) {
        this.push(binding);
        ImmutableList<ElementInit> initializers = this.transformList(binding.initializers, ElementInit.class);
        this.pop(binding);
        this.map(binding, new MemberListBinding(binding.member, initializers));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MemberMemberBinding binding) {
        this.push(binding);
        ImmutableList<MemberBinding> bindings = this.transformList(binding.bindings, MemberBinding.class);
        this.pop(binding);
        this.map(binding, new MemberMemberBinding(binding.member, bindings));
        return VisitDecision.STOP;
    }
}
