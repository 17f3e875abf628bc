package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

import javax.annotation.Nullable;

/** Exception signalling a broken internal invariant: a bug in this library. */
public class InternalTreeError extends BaseExpressionException {
    public static final String KIND = "Internal error";

    public InternalTreeError(String message, @Nullable IExprNode node) {
        super(message, node);
    }

    public InternalTreeError(String message) {
        this(message, null);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
