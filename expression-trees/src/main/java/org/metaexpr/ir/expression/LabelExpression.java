package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.LabelTarget;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** Marks the position of a label target.  The value of the expression is the value
 * carried by a jump to the target, or the default value when reached normally. */
public final class LabelExpression extends Expression {
    public final LabelTarget target;
    @Nullable
    public final Expression defaultValue;

    public LabelExpression(LabelTarget target, @Nullable Expression defaultValue) {
        super(target.type);
        this.target = target;
        this.defaultValue = defaultValue;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LABEL;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.target.accept(visitor);
        if (this.defaultValue != null)
            this.defaultValue.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        LabelExpression o = other.as(LabelExpression.class);
        if (o == null)
            return false;
        return this.target == o.target &&
                this.defaultValue == o.defaultValue;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.target).append(":");
        if (this.defaultValue != null)
            builder.append(" ").append(this.defaultValue);
        return builder;
    }
}
