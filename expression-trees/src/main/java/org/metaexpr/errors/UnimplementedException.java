package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

/** A legal tree construct which the interpreter cannot execute. */
public class UnimplementedException extends BaseExpressionException {
    public static final String KIND = "Not yet implemented";

    public UnimplementedException(String message, IExprNode node) {
        super(message, node);
    }

    public UnimplementedException(IExprNode node) {
        this(KIND, node);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
