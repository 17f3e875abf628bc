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

import org.metaexpr.errors.InternalTreeError;
import org.metaexpr.util.ICastable;
import org.metaexpr.util.IHasId;
import org.metaexpr.util.ToIndentableString;
import org.metaexpr.visitors.inner.InnerVisitor;

/** A node of an expression tree: an expression, or one of the auxiliary
 * constructs (label targets, catch blocks, switch cases, bindings) that expressions contain.
 * Nodes are immutable.  They do not override equals and hashCode:
 * two nodes are the same node only if they are the same Java object. */
public interface IExprNode extends ICastable, IHasId, ToIndentableString {
    /** Visit this node and its children in depth-first order. */
    void accept(InnerVisitor visitor);

    /** True if other has the same class and all fields of the two nodes
     * are the same: children are compared by reference, scalars by value. */
    boolean sameFields(IExprNode other);

    default InternalTreeError error(String message) {
        return new InternalTreeError(message, this);
    }
}
