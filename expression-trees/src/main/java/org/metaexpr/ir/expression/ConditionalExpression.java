package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

/** test ? ifTrue : ifFalse */
public final class ConditionalExpression extends Expression {
    public final Expression test;
    public final Expression ifTrue;
    public final Expression ifFalse;

    public ConditionalExpression(Class<?> type, Expression test, Expression ifTrue, Expression ifFalse) {
        super(type);
        this.test = test;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    public ConditionalExpression(Expression test, Expression ifTrue, Expression ifFalse) {
        this(ifTrue.type, test, ifTrue, ifFalse);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CONDITIONAL;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.test.accept(visitor);
        this.ifTrue.accept(visitor);
        this.ifFalse.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        ConditionalExpression o = other.as(ConditionalExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.test == o.test &&
                this.ifTrue == o.ifTrue &&
                this.ifFalse == o.ifFalse;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.test)
                .append(" ? ")
                .append(this.ifTrue)
                .append(" : ")
                .append(this.ifFalse)
                .append(")");
    }
}
