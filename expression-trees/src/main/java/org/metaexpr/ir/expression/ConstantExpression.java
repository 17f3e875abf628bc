package org.metaexpr.ir.expression;

import com.google.common.primitives.Primitives;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.util.Objects;

/** A literal value, or a reference to an object held by the tree. */
public final class ConstantExpression extends Expression {
    @Nullable
    public final Object value;

    public ConstantExpression(@Nullable Object value, Class<?> type) {
        super(type);
        this.value = value;
    }

    /** A constant whose type is the runtime type of the value;
     * boxed primitives produce constants of the primitive type. */
    public ConstantExpression(Object value) {
        this(value, Primitives.unwrap(value.getClass()));
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CONSTANT;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        ConstantExpression o = other.as(ConstantExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                Objects.equals(this.value, o.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.value == null)
            return builder.append("null");
        if (this.value instanceof String)
            return builder.append("\"").append(this.value.toString()).append("\"");
        return builder.append(this.value.toString());
    }
}
