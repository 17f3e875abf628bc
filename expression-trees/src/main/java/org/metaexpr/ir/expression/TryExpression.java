/*
 * Copyright 2024 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.metaexpr.ir.expression;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.CatchBlock;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.util.List;

/** try { body } catch (...) { ... } finally { ... }
 * The fault block runs only when the body terminates with an exception. */
public final class TryExpression extends Expression {
    public final Expression body;
    public final ImmutableList<CatchBlock> handlers;
    @Nullable
    public final Expression finallyBody;
    @Nullable
    public final Expression fault;

    public TryExpression(Class<?> type, Expression body, @Nullable Expression finallyBody,
                         @Nullable Expression fault, List<CatchBlock> handlers) {
        super(type);
        this.body = body;
        this.finallyBody = finallyBody;
        this.fault = fault;
        this.handlers = ImmutableList.copyOf(handlers);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.TRY;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.body.accept(visitor);
        for (CatchBlock handler: this.handlers)
            handler.accept(visitor);
        if (this.finallyBody != null)
            this.finallyBody.accept(visitor);
        if (this.fault != null)
            this.fault.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        TryExpression o = other.as(TryExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.body == o.body &&
                this.finallyBody == o.finallyBody &&
                this.fault == o.fault &&
                Linq.same(this.handlers, o.handlers);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("try {")
                .increase()
                .append(this.body)
                .decrease()
                .newline()
                .append("}");
        for (CatchBlock handler: this.handlers)
            builder.append(" ").append(handler);
        if (this.fault != null)
            builder.append(" fault {").increase().append(this.fault).decrease().newline().append("}");
        if (this.finallyBody != null)
            builder.append(" finally {").increase().append(this.finallyBody).decrease().newline().append("}");
        return builder;
    }
}
