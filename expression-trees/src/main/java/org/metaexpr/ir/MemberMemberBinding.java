package org.metaexpr.ir;

import com.google.common.collect.ImmutableList;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.lang.reflect.Member;
import java.util.List;

/** Initializes the members of the object stored in a member. */
public final class MemberMemberBinding extends MemberBinding {
    public final ImmutableList<MemberBinding> bindings;

    public MemberMemberBinding(Member member, List<? extends MemberBinding> bindings) {
        super(member);
        this.bindings = ImmutableList.copyOf(bindings);
    }

    @Override
    public BindingType getBindingType() {
        return BindingType.MEMBER_BINDING;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (MemberBinding binding: this.bindings)
            binding.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        MemberMemberBinding o = other.as(MemberMemberBinding.class);
        if (o == null)
            return false;
        return this.member.equals(o.member) &&
                Linq.same(this.bindings, o.bindings);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.member.getName())
                .append(" = { ")
                .join(", ", this.bindings)
                .append(" }");
    }
}
