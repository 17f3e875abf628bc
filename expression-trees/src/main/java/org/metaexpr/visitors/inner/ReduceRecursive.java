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

package org.metaexpr.visitors.inner;

import org.metaexpr.ir.expression.ExprKind;
import org.metaexpr.ir.expression.Expression;

/** Reduces every reducible node, and the result of each reduction, until no reducible nodes remain.
 * With extensionsOnly set, only extension nodes are reduced. */
public class ReduceRecursive extends InnerRewriteVisitor {
    final boolean extensionsOnly;

    public ReduceRecursive(boolean extensionsOnly) {
        this.extensionsOnly = extensionsOnly;
    }

    boolean shouldReduce(Expression expression) {
        if (!expression.canReduce())
            return false;
        return !this.extensionsOnly || expression.getKind() == ExprKind.EXTENSION;
    }

    @Override
    protected Expression transform(Expression expression) {
        if (this.shouldReduce(expression)) {
            Expression reduced = expression.reduceAndCheck();
            this.map(expression, reduced);
            return this.transform(reduced);
        }
        return super.transform(expression);
    }
}
