package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** Gives read/write access to a set of variables at run time. */
public final class RuntimeVariablesExpression extends Expression {
    public final ImmutableList<ParameterExpression> variables;

    public RuntimeVariablesExpression(List<ParameterExpression> variables) {
        super(List.class);
        this.variables = ImmutableList.copyOf(variables);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.RUNTIME_VARIABLES;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (ParameterExpression variable: this.variables)
            variable.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        RuntimeVariablesExpression o = other.as(RuntimeVariablesExpression.class);
        if (o == null)
            return false;
        return Linq.same(this.variables, o.variables);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("vars(")
                .join(", ", this.variables)
                .append(")");
    }
}
