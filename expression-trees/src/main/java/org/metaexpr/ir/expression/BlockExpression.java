package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.util.Utilities;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** A sequence of expressions evaluated in order, with local variables.
 * The value of the block is the value of the last expression. */
public final class BlockExpression extends Expression {
    public final ImmutableList<ParameterExpression> variables;
    public final ImmutableList<Expression> expressions;

    public BlockExpression(Class<?> type, List<ParameterExpression> variables, List<? extends Expression> expressions) {
        super(type);
        Utilities.enforce(!expressions.isEmpty(), "Block must contain at least one expression");
        this.variables = ImmutableList.copyOf(variables);
        this.expressions = ImmutableList.copyOf(expressions);
    }

    public BlockExpression(List<ParameterExpression> variables, List<? extends Expression> expressions) {
        this(Utilities.last(expressions).type, variables, expressions);
    }

    public BlockExpression(Expression... expressions) {
        this(ImmutableList.of(), Linq.list(expressions));
    }

    public Expression getResult() {
        return Utilities.last(this.expressions);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.BLOCK;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression expression: this.expressions)
            expression.accept(visitor);
        for (ParameterExpression variable: this.variables)
            variable.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        BlockExpression o = other.as(BlockExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                Linq.same(this.variables, o.variables) &&
                Linq.same(this.expressions, o.expressions);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("{").increase();
        for (ParameterExpression variable: this.variables)
            builder.append(variable.type).append(" ").append(variable).append(";").newline();
        for (Expression expression: this.expressions)
            builder.append(expression).append(";").newline();
        return builder.decrease().append("}");
    }
}
