package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.LabelTarget;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** Evaluates the body repeatedly until a jump to the break label. */
public final class LoopExpression extends Expression {
    public final Expression body;
    @Nullable
    public final LabelTarget breakLabel;
    @Nullable
    public final LabelTarget continueLabel;

    public LoopExpression(Expression body, @Nullable LabelTarget breakLabel, @Nullable LabelTarget continueLabel) {
        super(breakLabel != null ? breakLabel.type : void.class);
        this.body = body;
        this.breakLabel = breakLabel;
        this.continueLabel = continueLabel;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LOOP;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.breakLabel != null)
            this.breakLabel.accept(visitor);
        if (this.continueLabel != null)
            this.continueLabel.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        LoopExpression o = other.as(LoopExpression.class);
        if (o == null)
            return false;
        return this.body == o.body &&
                this.breakLabel == o.breakLabel &&
                this.continueLabel == o.continueLabel;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("loop {")
                .increase()
                .append(this.body)
                .decrease()
                .newline()
                .append("}");
    }
}
