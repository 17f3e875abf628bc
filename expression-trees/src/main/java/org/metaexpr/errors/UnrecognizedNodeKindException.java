package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

/** Raised by the equality and hash engine for extension nodes.
 * Callers should reduce the tree first, e.g. with {@code reduceExtensionsRecursive}. */
public class UnrecognizedNodeKindException extends BaseExpressionException {
    public static final String KIND = "Unrecognized node kind";

    public UnrecognizedNodeKindException(IExprNode node) {
        super("Extension node " + node.getClass().getSimpleName() +
                " must be reduced before it can be compared or hashed", node);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
