package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.lang.reflect.Array;
import java.util.List;

/** Creates an array, either from a list of elements or from a list of dimensions. */
public final class NewArrayExpression extends Expression {
    /** The elements, or the dimensions when {@link #bounds} is true. */
    public final ImmutableList<Expression> expressions;
    public final boolean bounds;

    public NewArrayExpression(Class<?> arrayType, List<? extends Expression> expressions, boolean bounds) {
        super(arrayType);
        if (!arrayType.isArray())
            throw new IllegalArgumentException(arrayType.getSimpleName() + " is not an array type");
        this.expressions = ImmutableList.copyOf(expressions);
        this.bounds = bounds;
    }

    /** new elementType[] { elements } */
    public static NewArrayExpression init(Class<?> elementType, Expression... elements) {
        return new NewArrayExpression(Array.newInstance(elementType, 0).getClass(), Linq.list(elements), false);
    }

    /** new elementType[d0][d1]... */
    public static NewArrayExpression bounds(Class<?> elementType, Expression... dimensions) {
        int[] shape = new int[dimensions.length];
        Class<?> type = Array.newInstance(elementType, shape).getClass();
        return new NewArrayExpression(type, Linq.list(dimensions), true);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_ARRAY;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression expression: this.expressions)
            expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        NewArrayExpression o = other.as(NewArrayExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.bounds == o.bounds &&
                Linq.same(this.expressions, o.expressions);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("new ").append(this.type.getComponentType());
        if (this.bounds)
            return builder.append("[").join("][", this.expressions).append("]");
        return builder.append("[] { ")
                .join(", ", this.expressions)
                .append(" }");
    }
}
