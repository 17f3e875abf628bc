package org.metaexpr.ir.expression;

/** The flavor of a goto expression; only affects printing and comparison. */
public enum GotoKind {
    GOTO,
    RETURN,
    BREAK,
    CONTINUE
}
