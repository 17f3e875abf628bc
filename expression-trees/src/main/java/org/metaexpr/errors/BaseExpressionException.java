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

package org.metaexpr.errors;

import org.metaexpr.ir.IExprNode;

import javax.annotation.Nullable;

/** Base class for all exceptions raised while processing expression trees. */
public abstract class BaseExpressionException extends RuntimeException {
    /** Node that caused the failure, if known. */
    @Nullable
    public final IExprNode node;

    protected BaseExpressionException(String message, @Nullable IExprNode node, @Nullable Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    protected BaseExpressionException(String message, @Nullable IExprNode node) {
        this(message, node, null);
    }

    public abstract String getErrorKind();

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (this.node != null)
            message += System.lineSeparator() + "in " + this.node;
        return message;
    }
}
