package org.metaexpr.ir;

import org.metaexpr.ir.expression.Expression;
import org.metaexpr.ir.expression.ParameterExpression;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** A handler of a try expression. */
public final class CatchBlock extends ExprNode {
    /** Exception type handled. */
    public final Class<?> test;
    /** Variable bound to the caught exception. */
    @Nullable
    public final ParameterExpression variable;
    public final Expression body;
    @Nullable
    public final Expression filter;

    public CatchBlock(Class<?> test, @Nullable ParameterExpression variable,
                      Expression body, @Nullable Expression filter) {
        this.test = test;
        this.variable = variable;
        this.body = body;
        this.filter = filter;
    }

    public CatchBlock(Class<?> test, @Nullable ParameterExpression variable, Expression body) {
        this(test, variable, body, null);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.variable != null)
            this.variable.accept(visitor);
        if (this.filter != null)
            this.filter.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        CatchBlock o = other.as(CatchBlock.class);
        if (o == null)
            return false;
        return this.test == o.test &&
                this.variable == o.variable &&
                this.body == o.body &&
                this.filter == o.filter;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("catch (").append(this.test);
        if (this.variable != null)
            builder.append(" ").append(this.variable);
        builder.append(")");
        if (this.filter != null)
            builder.append(" when ").append(this.filter);
        return builder.append(" {")
                .increase()
                .append(this.body)
                .decrease()
                .newline()
                .append("}");
    }
}
