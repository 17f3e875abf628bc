package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/** Indexing an array, or an object through an indexer method. */
public final class IndexExpression extends Expression {
    public final Expression object;
    /** Getter used for indexing; null for arrays. */
    @Nullable
    public final Method indexer;
    public final ImmutableList<Expression> arguments;

    public IndexExpression(Expression object, @Nullable Method indexer, List<? extends Expression> arguments) {
        super(indexer != null ? indexer.getReturnType() : elementType(object.type));
        this.object = object;
        this.indexer = indexer;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    static Class<?> elementType(Class<?> arrayType) {
        Class<?> result = arrayType.getComponentType();
        if (result == null)
            throw new IllegalArgumentException("Indexing a " + arrayType.getSimpleName() + " requires an indexer");
        return result;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.INDEX;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.object.accept(visitor);
        for (Expression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        IndexExpression o = other.as(IndexExpression.class);
        if (o == null)
            return false;
        return this.object == o.object &&
                Objects.equals(this.indexer, o.indexer) &&
                Linq.same(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.object)
                .append("[")
                .join(", ", this.arguments)
                .append("]");
    }
}
