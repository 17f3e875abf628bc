package org.metaexpr.ir.expression;

import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

/** Base class for user-defined nodes.
 * Extension nodes are opaque to the equality engine; a subclass that can be expressed
 * with the standard nodes should override {@link #canReduce()} and {@link #reduce()}.
 * Traversals never reduce extension nodes implicitly. */
public abstract class ExtensionExpression extends Expression {
    protected ExtensionExpression(Class<?> type) {
        super(type);
    }

    @Override
    public final ExprKind getKind() {
        return ExprKind.EXTENSION;
    }

    /** Visit the children of this node, if any. */
    protected void visitChildren(InnerVisitor visitor) {}

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.visitChildren(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.getClass().getSimpleName()).append("()");
    }
}
