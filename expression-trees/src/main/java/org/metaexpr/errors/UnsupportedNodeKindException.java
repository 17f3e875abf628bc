package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

/** Raised by the equality and hash engine for late-bound (dynamic) nodes.
 * These nodes are never supported; retrying cannot succeed. */
public class UnsupportedNodeKindException extends BaseExpressionException {
    public static final String KIND = "Unsupported node kind";

    public UnsupportedNodeKindException(IExprNode node) {
        super("Dynamic expressions cannot be compared or hashed", node);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
