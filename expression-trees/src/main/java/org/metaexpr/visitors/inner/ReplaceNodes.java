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

import org.metaexpr.ir.expression.Expression;

import java.util.Map;

/** Replaces nodes by reference.  A replacement is inserted as is: it is not visited.
 * Extension nodes are not reduced. */
public class ReplaceNodes extends InnerRewriteVisitor {
    final Substitution<Expression, Expression> replacements;

    public ReplaceNodes(Map<? extends Expression, ? extends Expression> replacements) {
        this.replacements = new Substitution<>(replacements);
    }

    public ReplaceNodes(Expression oldNode, Expression newNode) {
        this.replacements = new Substitution<>();
        this.replacements.substitute(oldNode, newNode);
    }

    @Override
    protected Expression transform(Expression expression) {
        Expression replacement = this.replacements.get(expression);
        if (replacement != null) {
            this.map(expression, replacement);
            return replacement;
        }
        return super.transform(expression);
    }
}
