package org.metaexpr;

import org.metaexpr.ir.expression.BinaryExpression;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.ExprOpcode;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.ExtensionExpression;
import org.metaexpr.ir.expression.LambdaExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.ir.expression.MethodCallExpression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.util.Reflection;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** Shorthands for building trees in tests. */
public final class Trees {
    private Trees() {}

    public static ParameterExpression param(Class<?> type, String name) {
        return new ParameterExpression(type, name);
    }

    public static ParameterExpression intParam(String name) {
        return param(int.class, name);
    }

    public static ConstantExpression constant(Object value) {
        return new ConstantExpression(value);
    }

    public static BinaryExpression binary(ExprOpcode opcode, Expression left, Expression right) {
        return new BinaryExpression(opcode, left, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return binary(ExprOpcode.ADD, left, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return binary(ExprOpcode.EQUAL, left, right);
    }

    public static LambdaExpression lambda(Expression body, ParameterExpression... parameters) {
        return new LambdaExpression(body, parameters);
    }

    /** Read of a captured variable: a field of the closure object. */
    public static MemberExpression captured(Object closure, String field) {
        return new MemberExpression(new ConstantExpression(closure, closure.getClass()), field);
    }

    public static MethodCallExpression call(@Nullable Expression object, Class<?> clazz, String name,
                                            Class<?>[] parameterTypes, Expression... arguments) {
        return new MethodCallExpression(object, Reflection.method(clazz, name, parameterTypes), arguments);
    }

    /** Call of Expr.capture; reference types go through the generic overload. */
    public static MethodCallExpression capture(Expression variable) {
        Class<?> parameterType = variable.type.isPrimitive() ? variable.type : Object.class;
        return call(null, Expr.class, "capture", new Class<?>[] { parameterType }, variable);
    }

    /** Call of Expr.invoke; lambda targets are quoted. */
    public static MethodCallExpression invoke(Expression target, Expression... arguments) {
        Class<?>[] types = new Class<?>[arguments.length + 1];
        types[0] = LambdaExpression.class;
        Expression[] all = new Expression[arguments.length + 1];
        all[0] = target;
        for (int i = 0; i < arguments.length; i++) {
            types[i + 1] = Object.class;
            all[i + 1] = arguments[i];
        }
        return call(null, Expr.class, "invoke", types, all);
    }

    /** An extension node which reduces to operand + operand. */
    public static final class Twice extends ExtensionExpression {
        public final Expression operand;

        public Twice(Expression operand) {
            super(operand.type);
            this.operand = operand;
        }

        @Override
        public boolean canReduce() {
            return true;
        }

        @Override
        public Expression reduce() {
            return add(this.operand, this.operand);
        }

        @Override
        protected void visitChildren(InnerVisitor visitor) {
            this.operand.accept(visitor);
        }
    }

    /** An extension node which cannot be reduced. */
    public static final class Opaque extends ExtensionExpression {
        public Opaque() {
            super(int.class);
        }
    }
}
