package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

import javax.annotation.Nullable;

/** The target of an invoke marker does not denote a lambda tree. */
public class InlineTargetUnresolvedException extends BaseExpressionException {
    public static final String KIND = "Inline target unresolved";

    public InlineTargetUnresolvedException(IExprNode target, @Nullable Throwable cause) {
        super("Could not evaluate the target of an invoke call to a lambda expression", target, cause);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
