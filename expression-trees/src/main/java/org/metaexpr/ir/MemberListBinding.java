package org.metaexpr.ir;

import com.google.common.collect.ImmutableList;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.lang.reflect.Member;
import java.util.List;

/** Adds elements to the collection stored in a member. */
public final class MemberListBinding extends MemberBinding {
    public final ImmutableList<ElementInit> initializers;

    public MemberListBinding(Member member, List<ElementInit> initializers) {
        super(member);
        this.initializers = ImmutableList.copyOf(initializers);
    }

    @Override
    public BindingType getBindingType() {
        return BindingType.LIST_BINDING;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (ElementInit init: this.initializers)
            init.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        MemberListBinding o = other.as(MemberListBinding.class);
        if (o == null)
            return false;
        return this.member.equals(o.member) &&
                Linq.same(this.initializers, o.initializers);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.member.getName())
                .append(" = { ")
                .join(", ", this.initializers)
                .append(" }");
    }
}
