package org.metaexpr.ir;

import org.metaexpr.ir.expression.Expression;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.lang.reflect.Member;

/** member = expression */
public final class MemberAssignment extends MemberBinding {
    public final Expression expression;

    public MemberAssignment(Member member, Expression expression) {
        super(member);
        this.expression = expression;
    }

    @Override
    public BindingType getBindingType() {
        return BindingType.ASSIGNMENT;
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
        MemberAssignment o = other.as(MemberAssignment.class);
        if (o == null)
            return false;
        return this.member.equals(o.member) &&
                this.expression == o.expression;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.member.getName())
                .append(" = ")
                .append(this.expression);
    }
}
