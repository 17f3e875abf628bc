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

package org.metaexpr.interpreter;

import com.google.common.base.Defaults;
import com.google.common.base.Throwables;
import com.google.common.primitives.Primitives;
import org.metaexpr.errors.EvaluationException;
import org.metaexpr.errors.UnimplementedException;
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
import org.metaexpr.ir.expression.ExprOpcode;
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
import org.metaexpr.ir.expression.SwitchExpression;
import org.metaexpr.ir.expression.TryExpression;
import org.metaexpr.ir.expression.TypeTestExpression;
import org.metaexpr.ir.expression.UnaryExpression;
import org.metaexpr.util.Logger;

import javax.annotation.Nullable;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.util.List;
import java.util.NoSuchElementException;

/** Tree-walking interpreter for expression trees.
 * Variables live in {@link Scopes}; a lambda closes over the scopes active
 * where it is evaluated. */
public final class Interpreter {
    /** Transfer of control to a label. */
    static final class Jump extends RuntimeException {
        final LabelTarget target;
        @Nullable
        final Object value;

        Jump(LabelTarget target, @Nullable Object value) {
            super("jump to " + target, null, false, false);
            this.target = target;
            this.value = value;
        }
    }

    /** Carries a checked exception raised by the interpreted code. */
    static final class Thrown extends RuntimeException {
        Thrown(Throwable cause) {
            super(cause);
        }
    }

    final Scopes<ParameterExpression, Object> scopes;

    Interpreter(Scopes<ParameterExpression, Object> scopes) {
        this.scopes = scopes;
    }

    public static CompiledLambda compile(LambdaExpression lambda) {
        Logger.INSTANCE.belowLevel(Interpreter.class, 2)
                .append("Compiling ")
                .appendSupplier(lambda::toString)
                .newline();
        return new CompiledLambda(lambda, new Scopes<>());
    }

    @Nullable
    public Object evaluate(Expression expression) {
        switch (expression.getKind()) {
            case BINARY: return this.binary(expression.to(BinaryExpression.class));
            case BLOCK: return this.block(expression.to(BlockExpression.class));
            case CONDITIONAL: {
                ConditionalExpression cond = expression.to(ConditionalExpression.class);
                if (Operators.truthy(this.evaluate(cond.test)))
                    return this.evaluate(cond.ifTrue);
                return this.evaluate(cond.ifFalse);
            }
            case CONSTANT: return expression.to(ConstantExpression.class).value;
            case DEBUG_INFO: return null;
            case DEFAULT: return Defaults.defaultValue(expression.type);
            case GOTO: {
                GotoExpression jump = expression.to(GotoExpression.class);
                Object value = jump.value == null ? null : this.evaluate(jump.value);
                throw new Jump(jump.target, value);
            }
            case INDEX: return this.index(expression.to(IndexExpression.class));
            case INVOCATION: return this.invocation(expression.to(InvocationExpression.class));
            case LABEL: {
                LabelExpression label = expression.to(LabelExpression.class);
                return label.defaultValue == null ? null : this.evaluate(label.defaultValue);
            }
            case LAMBDA: return new CompiledLambda(expression.to(LambdaExpression.class), this.scopes.capture());
            case LIST_INIT: {
                ListInitExpression init = expression.to(ListInitExpression.class);
                Object result = this.evaluate(init.newExpression);
                this.initialize(result, init.initializers);
                return result;
            }
            case LOOP: return this.loop(expression.to(LoopExpression.class));
            case MEMBER: {
                MemberExpression member = expression.to(MemberExpression.class);
                Object target = member.expression == null ? null : this.evaluate(member.expression);
                return this.getMember(member, target, member.member);
            }
            case MEMBER_INIT: {
                MemberInitExpression init = expression.to(MemberInitExpression.class);
                Object result = this.evaluate(init.newExpression);
                this.bind(init, result, init.bindings);
                return result;
            }
            case METHOD_CALL: {
                MethodCallExpression call = expression.to(MethodCallExpression.class);
                Object target = call.object == null ? null : this.evaluate(call.object);
                return this.call(call, call.method, target, this.evaluate(call.arguments));
            }
            case NEW: return this.construct(expression.to(NewExpression.class));
            case NEW_ARRAY: return this.newArray(expression.to(NewArrayExpression.class));
            case PARAMETER: {
                ParameterExpression param = expression.to(ParameterExpression.class);
                if (!this.scopes.has(param))
                    throw new EvaluationException("Parameter " + param + " is not bound", param,
                            new NoSuchElementException(param.toString()));
                return this.scopes.get(param);
            }
            case SWITCH: return this.switchExpression(expression.to(SwitchExpression.class));
            case TRY: return this.tryExpression(expression.to(TryExpression.class));
            case TYPE_TEST: {
                TypeTestExpression test = expression.to(TypeTestExpression.class);
                Object value = this.evaluate(test.expression);
                if (test.exact)
                    return value != null && value.getClass() == Primitives.wrap(test.typeOperand);
                return Primitives.wrap(test.typeOperand).isInstance(value);
            }
            case UNARY: return this.unary(expression.to(UnaryExpression.class));
            case EXTENSION:
                if (expression.canReduce())
                    return this.evaluate(expression.reduceAndCheck());
                throw new UnimplementedException("Extension node cannot be reduced", expression);
            case DYNAMIC:
            case RUNTIME_VARIABLES:
            default:
                throw new UnimplementedException(expression);
        }
    }

    Object[] evaluate(List<Expression> expressions) {
        Object[] result = new Object[expressions.size()];
        for (int i = 0; i < result.length; i++)
            result[i] = this.evaluate(expressions.get(i));
        return result;
    }

    @Nullable
    Object binary(BinaryExpression expression) {
        switch (expression.opcode) {
            case AND_ALSO:
                return Operators.truthy(this.evaluate(expression.left)) &&
                        Operators.truthy(this.evaluate(expression.right));
            case OR_ELSE:
                return Operators.truthy(this.evaluate(expression.left)) ||
                        Operators.truthy(this.evaluate(expression.right));
            case COALESCE: {
                Object left = this.evaluate(expression.left);
                return left != null ? left : this.evaluate(expression.right);
            }
            case ASSIGN:
                return this.assign(expression.left, this.evaluate(expression.right));
            default:
                break;
        }
        if (expression.opcode.isCompoundAssignment())
            return this.evaluate(expression.reduce());
        Object left = this.evaluate(expression.left);
        Object right = this.evaluate(expression.right);
        if (expression.method != null)
            return this.call(expression, expression.method, null, new Object[] { left, right });
        Object result = Operators.binary(expression, expression.opcode, left, right);
        if (Operators.isNumeric(result) && !expression.opcode.isComparison())
            return Operators.convert(result, expression.type);
        return result;
    }

    @Nullable
    Object unary(UnaryExpression expression) {
        if (expression.opcode == ExprOpcode.QUOTE)
            return expression.operand;
        Object operand = this.evaluate(expression.operand);
        if (expression.method != null)
            return this.call(expression, expression.method, null, new Object[] { operand });
        switch (expression.opcode) {
            case CONVERT:
                return Operators.convert(operand, expression.type);
            case TYPE_AS:
                return Primitives.wrap(expression.type).isInstance(operand) ? operand : null;
            case THROW:
                if (operand == null)
                    throw new NullPointerException("Cannot throw null");
                throw rethrow((Throwable) operand);
            default:
                return Operators.unary(expression, expression.opcode, operand);
        }
    }

    @Nullable
    Object assign(Expression target, @Nullable Object value) {
        switch (target.getKind()) {
            case PARAMETER:
                this.scopes.assign(target.to(ParameterExpression.class), value);
                return value;
            case MEMBER: {
                MemberExpression member = target.to(MemberExpression.class);
                Object object = member.expression == null ? null : this.evaluate(member.expression);
                this.setMember(member, object, member.member, value);
                return value;
            }
            case INDEX: {
                IndexExpression index = target.to(IndexExpression.class);
                if (index.indexer == null && index.arguments.size() == 1) {
                    Object array = this.evaluate(index.object);
                    Object position = this.evaluate(index.arguments.get(0));
                    Array.set(array, Operators.numeric(position).intValue(), value);
                    return value;
                }
                break;
            }
            case BINARY: {
                BinaryExpression binary = target.to(BinaryExpression.class);
                if (binary.opcode == ExprOpcode.ARRAY_INDEX) {
                    Object array = this.evaluate(binary.left);
                    Object position = this.evaluate(binary.right);
                    Array.set(array, Operators.numeric(position).intValue(), value);
                    return value;
                }
                break;
            }
            default:
                break;
        }
        throw new UnimplementedException("Assignment to " + target.getKind(), target);
    }

    @Nullable
    Object block(BlockExpression block) {
        this.scopes.newContext();
        try {
            for (ParameterExpression variable : block.variables)
                this.scopes.substitute(variable, Defaults.defaultValue(variable.type));
            Object result = null;
            int index = 0;
            while (index < block.expressions.size()) {
                try {
                    result = this.evaluate(block.expressions.get(index));
                    index++;
                } catch (Jump jump) {
                    int label = labelIndex(block, jump.target);
                    if (label < 0)
                        throw jump;
                    result = jump.value;
                    index = label + 1;
                }
            }
            return result;
        } finally {
            this.scopes.popContext();
        }
    }

    static int labelIndex(BlockExpression block, LabelTarget target) {
        for (int i = 0; i < block.expressions.size(); i++) {
            LabelExpression label = block.expressions.get(i).as(LabelExpression.class);
            if (label != null && label.target == target)
                return i;
        }
        return -1;
    }

    @Nullable
    Object loop(LoopExpression loop) {
        while (true) {
            try {
                this.evaluate(loop.body);
            } catch (Jump jump) {
                if (loop.breakLabel != null && jump.target == loop.breakLabel)
                    return jump.value;
                if (loop.continueLabel == null || jump.target != loop.continueLabel)
                    throw jump;
            }
        }
    }

    @Nullable
    Object index(IndexExpression index) {
        Object object = this.evaluate(index.object);
        Object[] arguments = this.evaluate(index.arguments);
        if (index.indexer != null)
            return this.call(index, index.indexer, object, arguments);
        Object result = object;
        for (Object argument : arguments)
            result = Array.get(result, Operators.numeric(argument).intValue());
        return result;
    }

    @Nullable
    Object invocation(InvocationExpression invocation) {
        Object function = this.evaluate(invocation.expression);
        Object[] arguments = this.evaluate(invocation.arguments);
        if (function instanceof CompiledLambda)
            return ((CompiledLambda) function).invoke(arguments);
        if (function instanceof LambdaExpression)
            return compile((LambdaExpression) function).invoke(arguments);
        if (function == null)
            throw new EvaluationException("Invoking null", invocation, new NullPointerException());
        Method method = CompiledLambda.functionalMethod(function.getClass());
        if (method == null)
            throw new UnimplementedException("Invoking a " + function.getClass().getSimpleName(), invocation);
        return this.call(invocation, method, function, arguments);
    }

    @Nullable
    Object construct(NewExpression expression) {
        if (expression.constructor == null)
            return Defaults.defaultValue(expression.type);
        Object[] arguments = this.evaluate(expression.arguments);
        Constructor<?> constructor = expression.constructor;
        Class<?>[] types = constructor.getParameterTypes();
        for (int i = 0; i < arguments.length && i < types.length; i++)
            arguments[i] = CompiledLambda.adapt(arguments[i], types[i]);
        try {
            constructor.trySetAccessible();
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException ex) {
            throw rethrow(ex.getCause());
        } catch (ReflectiveOperationException ex) {
            throw new EvaluationException("Cannot construct " + expression.type.getSimpleName(), expression, ex);
        }
    }

    Object newArray(NewArrayExpression expression) {
        Object[] values = this.evaluate(expression.expressions);
        if (expression.bounds) {
            int[] dimensions = new int[values.length];
            Class<?> element = expression.type;
            for (int i = 0; i < values.length; i++) {
                dimensions[i] = Operators.numeric(values[i]).intValue();
                element = element.getComponentType();
            }
            return Array.newInstance(element, dimensions);
        }
        Object result = Array.newInstance(expression.type.getComponentType(), values.length);
        for (int i = 0; i < values.length; i++)
            Array.set(result, i, values[i]);
        return result;
    }

    @Nullable
    Object switchExpression(SwitchExpression expression) {
        Object value = this.evaluate(expression.switchValue);
        for (SwitchCase switchCase : expression.cases) {
            for (Expression test : switchCase.testValues) {
                Object testValue = this.evaluate(test);
                boolean match;
                if (expression.comparison != null)
                    match = Operators.truthy(this.call(expression, expression.comparison, null,
                            new Object[] { value, testValue }));
                else
                    match = Operators.equal(value, testValue);
                if (match)
                    return this.evaluate(switchCase.body);
            }
        }
        return expression.defaultBody == null ? null : this.evaluate(expression.defaultBody);
    }

    @Nullable
    Object tryExpression(TryExpression expression) {
        try {
            return this.evaluate(expression.body);
        } catch (Jump jump) {
            throw jump;
        } catch (RuntimeException ex) {
            Throwable actual = ex instanceof Thrown ? ex.getCause() : ex;
            for (CatchBlock handler : expression.handlers) {
                if (!handler.test.isInstance(actual))
                    continue;
                this.scopes.newContext();
                try {
                    if (handler.variable != null)
                        this.scopes.substitute(handler.variable, actual);
                    if (handler.filter == null || Operators.truthy(this.evaluate(handler.filter)))
                        return this.evaluate(handler.body);
                } finally {
                    this.scopes.popContext();
                }
            }
            if (expression.fault != null)
                this.evaluate(expression.fault);
            throw ex;
        } finally {
            if (expression.finallyBody != null)
                this.evaluate(expression.finallyBody);
        }
    }

    void initialize(@Nullable Object target, List<ElementInit> initializers) {
        for (ElementInit init : initializers)
            this.call(init, init.addMethod, target, this.evaluate(init.arguments));
    }

    void bind(IExprNode node, @Nullable Object target, List<MemberBinding> bindings) {
        for (MemberBinding binding : bindings) {
            switch (binding.getBindingType()) {
                case ASSIGNMENT: {
                    MemberAssignment assignment = (MemberAssignment) binding;
                    this.setMember(node, target, binding.member, this.evaluate(assignment.expression));
                    break;
                }
                case LIST_BINDING:
                    this.initialize(this.getMember(node, target, binding.member),
                            ((MemberListBinding) binding).initializers);
                    break;
                case MEMBER_BINDING:
                    this.bind(node, this.getMember(node, target, binding.member),
                            ((MemberMemberBinding) binding).bindings);
                    break;
            }
        }
    }

    @Nullable
    Object getMember(IExprNode node, @Nullable Object target, Member member) {
        if (member instanceof Method)
            return this.call(node, (Method) member, target, new Object[0]);
        Field field = (Field) member;
        try {
            field.trySetAccessible();
            return field.get(target);
        } catch (IllegalAccessException ex) {
            throw new EvaluationException("Cannot read field " + field.getName(), node, ex);
        }
    }

    void setMember(IExprNode node, @Nullable Object target, Member member, @Nullable Object value) {
        if (!(member instanceof Field))
            throw new UnimplementedException("Assigning to " + member.getName(), node);
        Field field = (Field) member;
        try {
            field.trySetAccessible();
            field.set(target, CompiledLambda.adapt(value, field.getType()));
        } catch (IllegalAccessException ex) {
            throw new EvaluationException("Cannot write field " + field.getName(), node, ex);
        }
    }

    @Nullable
    Object call(IExprNode node, Method method, @Nullable Object target, Object[] arguments) {
        Class<?>[] types = method.getParameterTypes();
        for (int i = 0; i < arguments.length && i < types.length; i++)
            arguments[i] = CompiledLambda.adapt(arguments[i], types[i]);
        try {
            method.trySetAccessible();
            return method.invoke(target, arguments);
        } catch (InvocationTargetException ex) {
            throw rethrow(ex.getCause());
        } catch (IllegalAccessException ex) {
            throw new EvaluationException("Cannot call " + method.getName(), node, ex);
        }
    }

    static RuntimeException rethrow(Throwable throwable) {
        Throwables.throwIfUnchecked(throwable);
        return new Thrown(throwable);
    }
}
