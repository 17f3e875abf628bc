package org.metaexpr.ir.expression;

import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.SymbolDocument;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

/** Associates a source position with the following expressions. */
public final class DebugInfoExpression extends Expression {
    /** Line number used to mark a cleared sequence point. */
    public static final int CLEAR_LINE = 0xfeefee;

    public final SymbolDocument document;
    public final int startLine;
    public final int startColumn;
    public final int endLine;
    public final int endColumn;

    public DebugInfoExpression(SymbolDocument document, int startLine, int startColumn, int endLine, int endColumn) {
        super(void.class);
        this.document = document;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /** A debug info that clears the current sequence point. */
    public static DebugInfoExpression clear(SymbolDocument document) {
        return new DebugInfoExpression(document, CLEAR_LINE, 0, CLEAR_LINE, 0);
    }

    public boolean isClear() {
        return this.startLine == CLEAR_LINE;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.DEBUG_INFO;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        DebugInfoExpression o = other.as(DebugInfoExpression.class);
        if (o == null)
            return false;
        return this.document.equals(o.document) &&
                this.startLine == o.startLine &&
                this.startColumn == o.startColumn &&
                this.endLine == o.endLine &&
                this.endColumn == o.endColumn;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.isClear())
            return builder.append("#clear(").append(this.document.fileName).append(")");
        return builder.append("#")
                .append(this.document.fileName)
                .append(":")
                .append(this.startLine)
                .append(":")
                .append(this.startColumn)
                .append("-")
                .append(this.endLine)
                .append(":")
                .append(this.endColumn);
    }
}
