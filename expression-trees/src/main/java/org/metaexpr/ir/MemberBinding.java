package org.metaexpr.ir;

import java.lang.reflect.Member;

/** Initialization of one member of a newly created object in a member-init expression. */
public abstract class MemberBinding extends ExprNode {
    public enum BindingType {
        ASSIGNMENT,
        MEMBER_BINDING,
        LIST_BINDING
    }

    /** A field, or a getter method standing for a property. */
    public final Member member;

    protected MemberBinding(Member member) {
        this.member = member;
    }

    public abstract BindingType getBindingType();
}
