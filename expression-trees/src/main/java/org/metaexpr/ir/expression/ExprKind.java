package org.metaexpr.ir.expression;

/** The kind of an expression node.  Every concrete {@link Expression} class reports exactly one kind;
 * code that must handle all kinds switches over this enum. */
public enum ExprKind {
    BINARY,
    BLOCK,
    CONDITIONAL,
    CONSTANT,
    DEBUG_INFO,
    DEFAULT,
    /** Late-bound call site; not supported by the equality engine. */
    DYNAMIC,
    /** User-defined node, see {@link ExtensionExpression}. */
    EXTENSION,
    GOTO,
    INDEX,
    INVOCATION,
    LABEL,
    LAMBDA,
    LIST_INIT,
    LOOP,
    MEMBER,
    MEMBER_INIT,
    METHOD_CALL,
    NEW,
    NEW_ARRAY,
    PARAMETER,
    RUNTIME_VARIABLES,
    SWITCH,
    TRY,
    TYPE_TEST,
    UNARY
}
