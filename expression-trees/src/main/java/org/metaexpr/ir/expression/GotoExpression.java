package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.LabelTarget;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** An unconditional jump to a label target, optionally carrying a value. */
public final class GotoExpression extends Expression {
    public final GotoKind kind;
    public final LabelTarget target;
    @Nullable
    public final Expression value;

    public GotoExpression(Class<?> type, GotoKind kind, LabelTarget target, @Nullable Expression value) {
        super(type);
        this.kind = kind;
        this.target = target;
        this.value = value;
    }

    public GotoExpression(GotoKind kind, LabelTarget target, @Nullable Expression value) {
        this(void.class, kind, target, value);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.GOTO;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.target.accept(visitor);
        if (this.value != null)
            this.value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        GotoExpression o = other.as(GotoExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.kind == o.kind &&
                this.target == o.target &&
                this.value == o.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.kind.name().toLowerCase())
                .append(" ")
                .append(this.target);
        if (this.value != null)
            builder.append(" ").append(this.value);
        return builder;
    }
}
