package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

/** The default value of a type: zero for primitives, null otherwise. */
public final class DefaultExpression extends Expression {
    public DefaultExpression(Class<?> type) {
        super(type);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.DEFAULT;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        DefaultExpression o = other.as(DefaultExpression.class);
        if (o == null)
            return false;
        return this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("default(").append(this.type).append(")");
    }
}
