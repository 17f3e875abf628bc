package org.metaexpr.ir;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.util.List;

/** One case of a switch expression. */
public final class SwitchCase extends ExprNode {
    public final Expression body;
    public final ImmutableList<Expression> testValues;

    public SwitchCase(Expression body, List<? extends Expression> testValues) {
        this.body = body;
        this.testValues = ImmutableList.copyOf(testValues);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression value: this.testValues)
            value.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        SwitchCase o = other.as(SwitchCase.class);
        if (o == null)
            return false;
        return this.body == o.body &&
                Linq.same(this.testValues, o.testValues);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("case ")
                .join(", ", this.testValues)
                .append(":")
                .increase()
                .append(this.body)
                .decrease();
    }
}
