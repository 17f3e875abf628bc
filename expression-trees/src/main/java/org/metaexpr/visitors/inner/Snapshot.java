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

import org.metaexpr.ir.expression.Closures;
import org.metaexpr.ir.expression.ConstantExpression;
import org.metaexpr.ir.expression.MemberExpression;
import org.metaexpr.visitors.VisitDecision;

/** Replaces every captured variable with a constant holding its current value,
 * typed with the static type of the variable.
 * Extension nodes are not reduced. */
public class Snapshot extends InnerRewriteVisitor {
    @Override
    public VisitDecision preorder(MemberExpression expression) {
        if (!Closures.isClosureMember(expression))
            return super.preorder(expression);
        Object value = Closures.readField(expression);
        this.map(expression, new ConstantExpression(value, expression.type));
        return VisitDecision.STOP;
    }
}
