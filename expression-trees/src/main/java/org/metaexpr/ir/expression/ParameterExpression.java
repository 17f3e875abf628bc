package org.metaexpr.ir.expression;

import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** A variable bound by a lambda or declared by a block.
 * Parameters are identity-typed: two occurrences refer to the same variable
 * only if they are the same object.  The name is only used for display. */
public final class ParameterExpression extends Expression {
    @Nullable
    public final String name;
    public final boolean byRef;

    public ParameterExpression(Class<?> type, @Nullable String name, boolean byRef) {
        super(type);
        this.name = name;
        this.byRef = byRef;
    }

    public ParameterExpression(Class<?> type, @Nullable String name) {
        this(type, name, false);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.PARAMETER;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name != null ? this.name : "p" + this.id);
    }
}
