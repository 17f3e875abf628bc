package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** A late-bound operation, resolved by name at run time. */
public final class DynamicExpression extends Expression {
    public final String operation;
    public final ImmutableList<Expression> arguments;

    public DynamicExpression(Class<?> type, String operation, List<? extends Expression> arguments) {
        super(type);
        this.operation = operation;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.DYNAMIC;
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
        DynamicExpression o = other.as(DynamicExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.operation.equals(o.operation) &&
                Linq.same(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("dynamic ")
                .append(this.operation)
                .append("(")
                .join(", ", this.arguments)
                .append(")");
    }
}
