package org.metaexpr.visitors;

/** Returned by a visitor's preorder method to decide whether the children of a node are visited. */
public enum VisitDecision {
    /** Do not visit the children, and do not call postorder. */
    STOP,
    /** Visit the children, then call postorder. */
    CONTINUE;

    public boolean stop() {
        return this == STOP;
    }
}
