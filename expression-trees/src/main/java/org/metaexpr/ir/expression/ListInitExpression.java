package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.ElementInit;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** Creates a collection and adds elements to it: new T() { a, b, c } */
public final class ListInitExpression extends Expression {
    public final NewExpression newExpression;
    public final ImmutableList<ElementInit> initializers;

    public ListInitExpression(NewExpression newExpression, List<ElementInit> initializers) {
        super(newExpression.type);
        this.newExpression = newExpression;
        this.initializers = ImmutableList.copyOf(initializers);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LIST_INIT;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.newExpression.accept(visitor);
        for (ElementInit init: this.initializers)
            init.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        ListInitExpression o = other.as(ListInitExpression.class);
        if (o == null)
            return false;
        return this.newExpression == o.newExpression &&
                Linq.same(this.initializers, o.initializers);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.newExpression)
                .append(" { ")
                .join(", ", this.initializers)
                .append(" }");
    }
}
