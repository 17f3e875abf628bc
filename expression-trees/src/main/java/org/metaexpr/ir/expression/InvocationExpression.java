package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** Applies a lambda or a functional-interface value to arguments. */
public final class InvocationExpression extends Expression {
    public final Expression expression;
    public final ImmutableList<Expression> arguments;

    public InvocationExpression(Class<?> type, Expression expression, List<? extends Expression> arguments) {
        super(type);
        this.expression = expression;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public InvocationExpression(Expression expression, Expression... arguments) {
        this(expression.is(LambdaExpression.class) ?
                expression.to(LambdaExpression.class).getReturnType() : Object.class,
                expression, Linq.list(arguments));
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.INVOCATION;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expression.accept(visitor);
        for (Expression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        InvocationExpression o = other.as(InvocationExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.expression == o.expression &&
                Linq.same(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expression)
                .append("(")
                .join(", ", this.arguments)
                .append(")");
    }
}
