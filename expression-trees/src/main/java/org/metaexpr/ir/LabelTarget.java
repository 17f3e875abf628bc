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

package org.metaexpr.ir;

import org.metaexpr.util.IIndentStream;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;

/** The destination of a jump.  Label targets are identity-typed:
 * two uses denote the same target only if they reference the same object.
 * The name is only used for display. */
public final class LabelTarget extends ExprNode {
    public final Class<?> type;
    @Nullable
    public final String name;

    public LabelTarget(Class<?> type, @Nullable String name) {
        this.type = type;
        this.name = name;
    }

    public LabelTarget(@Nullable String name) {
        this(void.class, name);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        return this == other;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name != null ? this.name : "L" + this.id);
    }
}
