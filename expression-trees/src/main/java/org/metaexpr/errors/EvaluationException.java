package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

/** A subtree could not be evaluated.  The cause holds the underlying failure. */
public class EvaluationException extends BaseExpressionException {
    public static final String KIND = "Evaluation failed";

    public EvaluationException(String message, IExprNode node, Throwable cause) {
        super(message, node, cause);
    }

    public EvaluationException(IExprNode node, Throwable cause) {
        this("Could not evaluate expression", node, cause);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
