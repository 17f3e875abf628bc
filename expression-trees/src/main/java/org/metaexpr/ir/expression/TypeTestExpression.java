package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

/** expression instanceof typeOperand, or an exact runtime type check. */
public final class TypeTestExpression extends Expression {
    public final Expression expression;
    public final Class<?> typeOperand;
    /** If true the runtime class must be exactly typeOperand. */
    public final boolean exact;

    public TypeTestExpression(Expression expression, Class<?> typeOperand, boolean exact) {
        super(boolean.class);
        this.expression = expression;
        this.typeOperand = typeOperand;
        this.exact = exact;
    }

    public TypeTestExpression(Expression expression, Class<?> typeOperand) {
        this(expression, typeOperand, false);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.TYPE_TEST;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        TypeTestExpression o = other.as(TypeTestExpression.class);
        if (o == null)
            return false;
        return this.expression == o.expression &&
                this.typeOperand == o.typeOperand &&
                this.exact == o.exact;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.expression)
                .append(this.exact ? " is exactly " : " instanceof ")
                .append(this.typeOperand)
                .append(")");
    }
}
