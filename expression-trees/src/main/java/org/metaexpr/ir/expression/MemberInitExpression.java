package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.MemberBinding;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** Creates an object and initializes some of its members: new T() { a = 1, b = 2 } */
public final class MemberInitExpression extends Expression {
    public final NewExpression newExpression;
    public final ImmutableList<MemberBinding> bindings;

    public MemberInitExpression(NewExpression newExpression, List<? extends MemberBinding> bindings) {
        super(newExpression.type);
        this.newExpression = newExpression;
        this.bindings = ImmutableList.copyOf(bindings);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.MEMBER_INIT;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.newExpression.accept(visitor);
        for (MemberBinding binding: this.bindings)
            binding.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        MemberInitExpression o = other.as(MemberInitExpression.class);
        if (o == null)
            return false;
        return this.newExpression == o.newExpression &&
                Linq.same(this.bindings, o.bindings);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.newExpression)
                .append(" { ")
                .join(", ", this.bindings)
                .append(" }");
    }
}
