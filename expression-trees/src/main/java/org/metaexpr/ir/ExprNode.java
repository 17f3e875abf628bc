package org.metaexpr.ir;

import org.metaexpr.util.IndentStream;

import java.util.concurrent.atomic.AtomicLong;

/** Base class for all tree nodes. */
public abstract class ExprNode implements IExprNode {
    static final AtomicLong nextId = new AtomicLong();
    public final long id;

    protected ExprNode() {
        this.id = nextId.getAndIncrement();
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public String toString() {
        IndentStream stream = new IndentStream(new StringBuilder());
        this.toString(stream);
        return stream.toString();
    }
}
