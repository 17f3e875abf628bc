package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.lang.reflect.Constructor;
import java.lang.reflect.Member;
import java.util.List;
import java.util.Objects;

/** A constructor call. */
public final class NewExpression extends Expression {
    /** Null only when creating the default value of a primitive type. */
    @Nullable
    public final Constructor<?> constructor;
    public final ImmutableList<Expression> arguments;
    /** Members initialized by the respective arguments, for record-like types; may be empty. */
    public final ImmutableList<Member> members;

    public NewExpression(Class<?> type, @Nullable Constructor<?> constructor,
                         List<? extends Expression> arguments, List<? extends Member> members) {
        super(type);
        this.constructor = constructor;
        this.arguments = ImmutableList.copyOf(arguments);
        this.members = ImmutableList.copyOf(members);
    }

    public NewExpression(Constructor<?> constructor, Expression... arguments) {
        this(constructor.getDeclaringClass(), constructor, Linq.list(arguments), ImmutableList.of());
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        NewExpression o = other.as(NewExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                Objects.equals(this.constructor, o.constructor) &&
                Linq.same(this.arguments, o.arguments) &&
                this.members.equals(o.members);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("new ")
                .append(this.type)
                .append("(")
                .join(", ", this.arguments)
                .append(")");
    }
}
