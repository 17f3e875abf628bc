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

package org.metaexpr.equivalence;

import com.google.common.base.Equivalence;
import com.google.common.collect.ImmutableSet;
import org.metaexpr.errors.InternalTreeError;
import org.metaexpr.errors.UnrecognizedNodeKindException;
import org.metaexpr.errors.UnsupportedNodeKindException;
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
import org.metaexpr.ir.expression.ExprKind;
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
import org.metaexpr.util.IWritesLogs;
import org.metaexpr.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

import static org.metaexpr.equivalence.EqualityComparerFlags.IGNORE_LABEL_NAME;
import static org.metaexpr.equivalence.EqualityComparerFlags.IGNORE_LAMBDA_NAME;
import static org.metaexpr.equivalence.EqualityComparerFlags.IGNORE_LAMBDA_TYPE;
import static org.metaexpr.equivalence.EqualityComparerFlags.IGNORE_PARAMETER_NAME;

/** Structural equality and hashing of expression trees.
 *
 * <p>Two trees are equivalent if they have the same shape, the same types and
 * the same attributes, up to a consistent renaming of their parameters and labels.
 * Both trees are snapshotted first, so captured variables compare by their current values.
 * Equivalent trees have the same hash.
 *
 * <p>Dynamic nodes are rejected with an {@link UnsupportedNodeKindException};
 * extension nodes must be reduced by the caller, otherwise they are rejected with an
 * {@link UnrecognizedNodeKindException}. */
public final class ExprEqualityComparer implements IWritesLogs {
    public static final ExprEqualityComparer DEFAULT = new ExprEqualityComparer(EqualityComparerFlags.DEFAULT);

    public final ImmutableSet<EqualityComparerFlags> flags;

    public ExprEqualityComparer(Set<EqualityComparerFlags> flags) {
        this.flags = ImmutableSet.copyOf(flags);
    }

    public boolean equivalent(@Nullable Expression x, @Nullable Expression y) {
        if (x == null || y == null)
            return x == y;
        Expression left = x.snapshot();
        Expression right = y.snapshot();
        EquivalenceContext context = new EquivalenceContext(this.flags);
        boolean result = this.compareExpr(context, left, right);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Compared ")
                .appendSupplier(left::toString)
                .append(" and ")
                .appendSupplier(right::toString)
                .append(": ")
                .append(result)
                .newline();
        return result;
    }

    public int hash(@Nullable Expression x) {
        if (x == null)
            return 0;
        EquivalenceContext context = new EquivalenceContext(this.flags);
        return this.hashExpr(context, x.snapshot()).toHashCode();
    }

    /** This comparer as a Guava {@link Equivalence}. */
    public Equivalence<Expression> asEquivalence() {
        ExprEqualityComparer comparer = this;
        return new Equivalence<>() {
            @Override
            protected boolean doEquivalent(Expression a, Expression b) {
                return comparer.equivalent(a, b);
            }

            @Override
            protected int doHash(Expression expression) {
                return comparer.hash(expression);
            }
        };
    }

    //////////////////////////////// Comparison

    <T> boolean compareMany(EquivalenceContext context, List<? extends T> left, List<? extends T> right,
                            CompareFunction<T> compare) {
        if (left.size() != right.size())
            return false;
        for (int i = 0; i < left.size(); i++)
            if (!compare.compare(context, left.get(i), right.get(i)))
                return false;
        return true;
    }

    @FunctionalInterface
    interface CompareFunction<T> {
        boolean compare(EquivalenceContext context, T left, T right);
    }

    boolean compareExprs(EquivalenceContext context, List<? extends Expression> left, List<? extends Expression> right) {
        return this.compareMany(context, left, right, this::compareExpr);
    }

    boolean compareExpr(EquivalenceContext context, @Nullable Expression x, @Nullable Expression y) {
        if (x == null || y == null)
            return x == y;
        if (x.getKind() != y.getKind())
            return false;
        if (x.getKind() == ExprKind.DYNAMIC)
            throw new UnsupportedNodeKindException(x);
        if (x.getKind() == ExprKind.EXTENSION)
            throw new UnrecognizedNodeKindException(x);
        if (!this.compareBase(context, x, y))
            return false;
        return switch (x.getKind()) {
            case BINARY -> this.compareBinary(context, x.to(BinaryExpression.class), y.to(BinaryExpression.class));
            case BLOCK -> this.compareBlock(context, x.to(BlockExpression.class), y.to(BlockExpression.class));
            case CONDITIONAL -> this.compareConditional(
                    context, x.to(ConditionalExpression.class), y.to(ConditionalExpression.class));
            case CONSTANT -> this.compareConstant(
                    context, x.to(ConstantExpression.class), y.to(ConstantExpression.class));
            case DEBUG_INFO -> this.compareDebugInfo(
                    context, x.to(DebugInfoExpression.class), y.to(DebugInfoExpression.class));
            case DEFAULT -> true;
            case GOTO -> this.compareGoto(context, x.to(GotoExpression.class), y.to(GotoExpression.class));
            case INDEX -> this.compareIndex(context, x.to(IndexExpression.class), y.to(IndexExpression.class));
            case INVOCATION -> this.compareInvocation(
                    context, x.to(InvocationExpression.class), y.to(InvocationExpression.class));
            case LABEL -> this.compareLabel(context, x.to(LabelExpression.class), y.to(LabelExpression.class));
            case LAMBDA -> this.compareLambda(context, x.to(LambdaExpression.class), y.to(LambdaExpression.class));
            case LIST_INIT -> this.compareListInit(
                    context, x.to(ListInitExpression.class), y.to(ListInitExpression.class));
            case LOOP -> this.compareLoop(context, x.to(LoopExpression.class), y.to(LoopExpression.class));
            case MEMBER -> this.compareMember(context, x.to(MemberExpression.class), y.to(MemberExpression.class));
            case MEMBER_INIT -> this.compareMemberInit(
                    context, x.to(MemberInitExpression.class), y.to(MemberInitExpression.class));
            case METHOD_CALL -> this.compareMethodCall(
                    context, x.to(MethodCallExpression.class), y.to(MethodCallExpression.class));
            case NEW -> this.compareNew(context, x.to(NewExpression.class), y.to(NewExpression.class));
            case NEW_ARRAY -> this.compareNewArray(
                    context, x.to(NewArrayExpression.class), y.to(NewArrayExpression.class));
            case PARAMETER -> this.compareParameter(
                    context, x.to(ParameterExpression.class), y.to(ParameterExpression.class));
            case RUNTIME_VARIABLES -> this.compareMany(context,
                    x.to(RuntimeVariablesExpression.class).variables,
                    y.to(RuntimeVariablesExpression.class).variables, this::compareExpr);
            case SWITCH -> this.compareSwitch(context, x.to(SwitchExpression.class), y.to(SwitchExpression.class));
            case TRY -> this.compareTry(context, x.to(TryExpression.class), y.to(TryExpression.class));
            case TYPE_TEST -> this.compareTypeTest(
                    context, x.to(TypeTestExpression.class), y.to(TypeTestExpression.class));
            case UNARY -> this.compareUnary(context, x.to(UnaryExpression.class), y.to(UnaryExpression.class));
            case DYNAMIC, EXTENSION -> throw new InternalTreeError("Unexpected node kind " + x.getKind(), x);
        };
    }

    /** Attributes shared by all nodes. */
    boolean compareBase(EquivalenceContext context, Expression x, Expression y) {
        if (x.canReduce() != y.canReduce())
            return false;
        if (x.getKind() == ExprKind.BINARY &&
                x.to(BinaryExpression.class).opcode != y.to(BinaryExpression.class).opcode)
            return false;
        if (x.getKind() == ExprKind.UNARY &&
                x.to(UnaryExpression.class).opcode != y.to(UnaryExpression.class).opcode)
            return false;
        if (x.getKind() == ExprKind.LAMBDA && context.has(IGNORE_LAMBDA_TYPE))
            return true;
        return x.type == y.type;
    }

    boolean compareBinary(EquivalenceContext context, BinaryExpression x, BinaryExpression y) {
        return this.compareExpr(context, x.conversion, y.conversion) &&
                context.compare(x.lifted, y.lifted) &&
                context.compare(x.liftedToNull, y.liftedToNull) &&
                this.compareExpr(context, x.left, y.left) &&
                context.compare(x.method, y.method) &&
                this.compareExpr(context, x.right, y.right);
    }

    boolean compareBlock(EquivalenceContext context, BlockExpression x, BlockExpression y) {
        return this.compareExprs(context, x.expressions, y.expressions) &&
                this.compareExpr(context, x.getResult(), y.getResult()) &&
                this.compareExprs(context, x.variables, y.variables);
    }

    boolean compareConditional(EquivalenceContext context, ConditionalExpression x, ConditionalExpression y) {
        return this.compareExpr(context, x.ifFalse, y.ifFalse) &&
                this.compareExpr(context, x.ifTrue, y.ifTrue) &&
                this.compareExpr(context, x.test, y.test);
    }

    /** Trees held as constant values (for example captured trees after a snapshot)
     * are compared structurally; other nodes by reference. */
    boolean compareConstant(EquivalenceContext context, ConstantExpression x, ConstantExpression y) {
        if (x.value instanceof Expression && y.value instanceof Expression)
            return this.compareExpr(context, (Expression) x.value, (Expression) y.value);
        if (x.value instanceof IExprNode || y.value instanceof IExprNode)
            return x.value == y.value;
        return context.compare(x.value, y.value);
    }

    boolean compareDebugInfo(EquivalenceContext context, DebugInfoExpression x, DebugInfoExpression y) {
        return context.compare(x.document, y.document) &&
                context.compare(x.endColumn, y.endColumn) &&
                context.compare(x.endLine, y.endLine) &&
                context.compare(x.isClear(), y.isClear()) &&
                context.compare(x.startColumn, y.startColumn) &&
                context.compare(x.startLine, y.startLine);
    }

    boolean compareGoto(EquivalenceContext context, GotoExpression x, GotoExpression y) {
        return context.compare(x.kind, y.kind) &&
                this.compareLabelTarget(context, x.target, y.target) &&
                this.compareExpr(context, x.value, y.value);
    }

    boolean compareIndex(EquivalenceContext context, IndexExpression x, IndexExpression y) {
        return this.compareExprs(context, x.arguments, y.arguments) &&
                context.compare(x.indexer, y.indexer) &&
                this.compareExpr(context, x.object, y.object);
    }

    boolean compareInvocation(EquivalenceContext context, InvocationExpression x, InvocationExpression y) {
        return this.compareExprs(context, x.arguments, y.arguments) &&
                this.compareExpr(context, x.expression, y.expression);
    }

    boolean compareLabel(EquivalenceContext context, LabelExpression x, LabelExpression y) {
        return this.compareExpr(context, x.defaultValue, y.defaultValue) &&
                this.compareLabelTarget(context, x.target, y.target);
    }

    boolean compareLambda(EquivalenceContext context, LambdaExpression x, LambdaExpression y) {
        return this.compareExpr(context, x.body, y.body) &&
                (context.has(IGNORE_LAMBDA_NAME) || context.compare(x.name, y.name)) &&
                this.compareExprs(context, x.parameters, y.parameters) &&
                context.compare(x.getReturnType(), y.getReturnType()) &&
                context.compare(x.tailCall, y.tailCall);
    }

    boolean compareListInit(EquivalenceContext context, ListInitExpression x, ListInitExpression y) {
        return this.compareMany(context, x.initializers, y.initializers, this::compareElementInit) &&
                this.compareExpr(context, x.newExpression, y.newExpression);
    }

    boolean compareElementInit(EquivalenceContext context, ElementInit x, ElementInit y) {
        return context.compare(x.addMethod, y.addMethod) &&
                this.compareExprs(context, x.arguments, y.arguments);
    }

    boolean compareLoop(EquivalenceContext context, LoopExpression x, LoopExpression y) {
        return this.compareExpr(context, x.body, y.body) &&
                this.compareLabelTarget(context, x.breakLabel, y.breakLabel) &&
                this.compareLabelTarget(context, x.continueLabel, y.continueLabel);
    }

    boolean compareMember(EquivalenceContext context, MemberExpression x, MemberExpression y) {
        return this.compareExpr(context, x.expression, y.expression) &&
                context.compare(x.member, y.member);
    }

    boolean compareMemberInit(EquivalenceContext context, MemberInitExpression x, MemberInitExpression y) {
        return this.compareMany(context, x.bindings, y.bindings, this::compareMemberBinding) &&
                this.compareExpr(context, x.newExpression, y.newExpression);
    }

    boolean compareMemberBinding(EquivalenceContext context, MemberBinding x, MemberBinding y) {
        if (!context.compare(x.getClass(), y.getClass()) ||
                !context.compare(x.getBindingType(), y.getBindingType()) ||
                !context.compare(x.member, y.member))
            return false;
        return switch (x.getBindingType()) {
            case ASSIGNMENT -> this.compareExpr(context,
                    ((MemberAssignment) x).expression, ((MemberAssignment) y).expression);
            case LIST_BINDING -> this.compareMany(context,
                    ((MemberListBinding) x).initializers, ((MemberListBinding) y).initializers,
                    this::compareElementInit);
            case MEMBER_BINDING -> this.compareMany(context,
                    ((MemberMemberBinding) x).bindings, ((MemberMemberBinding) y).bindings,
                    this::compareMemberBinding);
        };
    }

    boolean compareMethodCall(EquivalenceContext context, MethodCallExpression x, MethodCallExpression y) {
        return this.compareExprs(context, x.arguments, y.arguments) &&
                context.compare(x.method, y.method) &&
                this.compareExpr(context, x.object, y.object);
    }

    boolean compareNewArray(EquivalenceContext context, NewArrayExpression x, NewArrayExpression y) {
        return context.compare(x.bounds, y.bounds) &&
                this.compareExprs(context, x.expressions, y.expressions);
    }

    boolean compareNew(EquivalenceContext context, NewExpression x, NewExpression y) {
        return this.compareExprs(context, x.arguments, y.arguments) &&
                context.compare(x.constructor, y.constructor) &&
                context.compare(x.members, y.members);
    }

    boolean compareParameter(EquivalenceContext context, ParameterExpression x, ParameterExpression y) {
        return context.compareReferenceId(x, y) &&
                context.compare(x.byRef, y.byRef) &&
                (context.has(IGNORE_PARAMETER_NAME) || context.compare(x.name, y.name));
    }

    boolean compareSwitch(EquivalenceContext context, SwitchExpression x, SwitchExpression y) {
        return this.compareMany(context, x.cases, y.cases, this::compareSwitchCase) &&
                context.compare(x.comparison, y.comparison) &&
                this.compareExpr(context, x.defaultBody, y.defaultBody) &&
                this.compareExpr(context, x.switchValue, y.switchValue);
    }

    boolean compareSwitchCase(EquivalenceContext context, SwitchCase x, SwitchCase y) {
        return this.compareExpr(context, x.body, y.body) &&
                this.compareExprs(context, x.testValues, y.testValues);
    }

    boolean compareTry(EquivalenceContext context, TryExpression x, TryExpression y) {
        return this.compareExpr(context, x.body, y.body) &&
                this.compareExpr(context, x.fault, y.fault) &&
                this.compareExpr(context, x.finallyBody, y.finallyBody) &&
                this.compareMany(context, x.handlers, y.handlers, this::compareCatchBlock);
    }

    boolean compareCatchBlock(EquivalenceContext context, CatchBlock x, CatchBlock y) {
        return this.compareExpr(context, x.body, y.body) &&
                this.compareExpr(context, x.filter, y.filter) &&
                context.compare(x.test, y.test) &&
                this.compareExpr(context, x.variable, y.variable);
    }

    boolean compareTypeTest(EquivalenceContext context, TypeTestExpression x, TypeTestExpression y) {
        return context.compare(x.exact, y.exact) &&
                this.compareExpr(context, x.expression, y.expression) &&
                context.compare(x.typeOperand, y.typeOperand);
    }

    boolean compareUnary(EquivalenceContext context, UnaryExpression x, UnaryExpression y) {
        return context.compare(x.lifted, y.lifted) &&
                context.compare(x.liftedToNull, y.liftedToNull) &&
                context.compare(x.method, y.method) &&
                this.compareExpr(context, x.operand, y.operand);
    }

    boolean compareLabelTarget(EquivalenceContext context, @Nullable LabelTarget x, @Nullable LabelTarget y) {
        if (x == null || y == null)
            return x == y;
        return context.compareReferenceId(x, y) &&
                context.compare(x.type, y.type) &&
                (context.has(IGNORE_LABEL_NAME) || context.compare(x.name, y.name));
    }

    //////////////////////////////// Hashing

    <T> EquivalenceContext hashMany(EquivalenceContext context, List<? extends T> list,
                                    BiFunction<EquivalenceContext, T, EquivalenceContext> hash) {
        context.hash(list.size());
        for (T element : list)
            hash.apply(context, element);
        return context;
    }

    EquivalenceContext hashConstant(EquivalenceContext context, ConstantExpression x) {
        if (x.value instanceof Expression)
            return this.hashExpr(context, (Expression) x.value);
        if (x.value instanceof IExprNode)
            return context.hash(System.identityHashCode(x.value));
        return context.hashValue(x.value);
    }

    EquivalenceContext hashExprs(EquivalenceContext context, List<? extends Expression> list) {
        return this.hashMany(context, list, this::hashExpr);
    }

    EquivalenceContext hashExpr(EquivalenceContext context, @Nullable Expression x) {
        if (x == null)
            return context.hash(0);
        if (x.getKind() == ExprKind.DYNAMIC)
            throw new UnsupportedNodeKindException(x);
        if (x.getKind() == ExprKind.EXTENSION)
            throw new UnrecognizedNodeKindException(x);
        this.hashBase(context, x);
        return switch (x.getKind()) {
            case BINARY -> {
                BinaryExpression e = x.to(BinaryExpression.class);
                this.hashExpr(context, e.conversion).hash(e.lifted).hash(e.liftedToNull);
                this.hashExpr(context, e.left).hash(e.method);
                yield this.hashExpr(context, e.right);
            }
            case BLOCK -> {
                BlockExpression e = x.to(BlockExpression.class);
                this.hashExprs(context, e.expressions);
                this.hashExpr(context, e.getResult());
                yield this.hashExprs(context, e.variables);
            }
            case CONDITIONAL -> {
                ConditionalExpression e = x.to(ConditionalExpression.class);
                this.hashExpr(context, e.ifFalse);
                this.hashExpr(context, e.ifTrue);
                yield this.hashExpr(context, e.test);
            }
            case CONSTANT -> this.hashConstant(context, x.to(ConstantExpression.class));
            case DEBUG_INFO -> {
                DebugInfoExpression e = x.to(DebugInfoExpression.class);
                yield context.hashValue(e.document)
                        .hash(e.endColumn)
                        .hash(e.endLine)
                        .hash(e.isClear())
                        .hash(e.startColumn)
                        .hash(e.startLine);
            }
            case DEFAULT -> context;
            case GOTO -> {
                GotoExpression e = x.to(GotoExpression.class);
                context.hash(e.kind);
                this.hashLabelTarget(context, e.target);
                yield this.hashExpr(context, e.value);
            }
            case INDEX -> {
                IndexExpression e = x.to(IndexExpression.class);
                this.hashExprs(context, e.arguments).hash(e.indexer);
                yield this.hashExpr(context, e.object);
            }
            case INVOCATION -> {
                InvocationExpression e = x.to(InvocationExpression.class);
                this.hashExprs(context, e.arguments);
                yield this.hashExpr(context, e.expression);
            }
            case LABEL -> {
                LabelExpression e = x.to(LabelExpression.class);
                this.hashExpr(context, e.defaultValue);
                yield this.hashLabelTarget(context, e.target);
            }
            case LAMBDA -> {
                LambdaExpression e = x.to(LambdaExpression.class);
                this.hashExpr(context, e.body);
                if (!context.has(IGNORE_LAMBDA_NAME))
                    context.hash(e.name);
                this.hashExprs(context, e.parameters);
                yield context.hash(e.getReturnType()).hash(e.tailCall);
            }
            case LIST_INIT -> {
                ListInitExpression e = x.to(ListInitExpression.class);
                this.hashMany(context, e.initializers, this::hashElementInit);
                yield this.hashExpr(context, e.newExpression);
            }
            case LOOP -> {
                LoopExpression e = x.to(LoopExpression.class);
                this.hashExpr(context, e.body);
                this.hashLabelTarget(context, e.breakLabel);
                yield this.hashLabelTarget(context, e.continueLabel);
            }
            case MEMBER -> {
                MemberExpression e = x.to(MemberExpression.class);
                yield this.hashExpr(context, e.expression).hash(e.member);
            }
            case MEMBER_INIT -> {
                MemberInitExpression e = x.to(MemberInitExpression.class);
                this.hashMany(context, e.bindings, this::hashMemberBinding);
                yield this.hashExpr(context, e.newExpression);
            }
            case METHOD_CALL -> {
                MethodCallExpression e = x.to(MethodCallExpression.class);
                this.hashExprs(context, e.arguments).hash(e.method);
                yield this.hashExpr(context, e.object);
            }
            case NEW -> {
                NewExpression e = x.to(NewExpression.class);
                this.hashExprs(context, e.arguments).hash(e.constructor);
                yield this.hashMany(context, e.members, (c, member) -> c.hash(member));
            }
            case NEW_ARRAY -> {
                NewArrayExpression e = x.to(NewArrayExpression.class);
                context.hash(e.bounds);
                yield this.hashExprs(context, e.expressions);
            }
            case PARAMETER -> {
                ParameterExpression e = x.to(ParameterExpression.class);
                context.hash(e.byRef);
                if (!context.has(IGNORE_PARAMETER_NAME))
                    context.hash(e.name);
                yield context;
            }
            case RUNTIME_VARIABLES -> this.hashExprs(context, x.to(RuntimeVariablesExpression.class).variables);
            case SWITCH -> {
                SwitchExpression e = x.to(SwitchExpression.class);
                this.hashMany(context, e.cases, this::hashSwitchCase).hash(e.comparison);
                this.hashExpr(context, e.defaultBody);
                yield this.hashExpr(context, e.switchValue);
            }
            case TRY -> {
                TryExpression e = x.to(TryExpression.class);
                this.hashExpr(context, e.body);
                this.hashExpr(context, e.fault);
                this.hashExpr(context, e.finallyBody);
                yield this.hashMany(context, e.handlers, this::hashCatchBlock);
            }
            case TYPE_TEST -> {
                TypeTestExpression e = x.to(TypeTestExpression.class);
                context.hash(e.exact);
                yield this.hashExpr(context, e.expression).hash(e.typeOperand);
            }
            case UNARY -> {
                UnaryExpression e = x.to(UnaryExpression.class);
                context.hash(e.lifted).hash(e.liftedToNull).hash(e.method);
                yield this.hashExpr(context, e.operand);
            }
            case DYNAMIC, EXTENSION -> throw new InternalTreeError("Unexpected node kind " + x.getKind(), x);
        };
    }

    /** Mirrors {@link #compareBase}.  Parameters hash their ordinal first. */
    EquivalenceContext hashBase(EquivalenceContext context, Expression x) {
        if (x.getKind() == ExprKind.PARAMETER)
            context.hashReferenceId(x);
        context.hash(x.canReduce()).hash(x.getKind());
        if (x.getKind() == ExprKind.BINARY)
            context.hash(x.to(BinaryExpression.class).opcode);
        if (x.getKind() == ExprKind.UNARY)
            context.hash(x.to(UnaryExpression.class).opcode);
        if (x.getKind() == ExprKind.LAMBDA && context.has(IGNORE_LAMBDA_TYPE))
            return context;
        return context.hash(x.type);
    }

    EquivalenceContext hashElementInit(EquivalenceContext context, ElementInit init) {
        context.hash(init.addMethod);
        return this.hashExprs(context, init.arguments);
    }

    EquivalenceContext hashMemberBinding(EquivalenceContext context, MemberBinding binding) {
        context.hash(binding.getClass()).hash(binding.getBindingType()).hash(binding.member);
        return switch (binding.getBindingType()) {
            case ASSIGNMENT -> this.hashExpr(context, ((MemberAssignment) binding).expression);
            case LIST_BINDING -> this.hashMany(context,
                    ((MemberListBinding) binding).initializers, this::hashElementInit);
            case MEMBER_BINDING -> this.hashMany(context,
                    ((MemberMemberBinding) binding).bindings, this::hashMemberBinding);
        };
    }

    EquivalenceContext hashSwitchCase(EquivalenceContext context, SwitchCase switchCase) {
        this.hashExpr(context, switchCase.body);
        return this.hashExprs(context, switchCase.testValues);
    }

    EquivalenceContext hashCatchBlock(EquivalenceContext context, CatchBlock handler) {
        this.hashExpr(context, handler.body);
        this.hashExpr(context, handler.filter);
        context.hash(handler.test);
        return this.hashExpr(context, handler.variable);
    }

    EquivalenceContext hashLabelTarget(EquivalenceContext context, @Nullable LabelTarget target) {
        if (target == null)
            return context.hash(0);
        context.hashReferenceId(target).hash(target.type);
        if (!context.has(IGNORE_LABEL_NAME))
            context.hash(target.name);
        return context;
    }
}
