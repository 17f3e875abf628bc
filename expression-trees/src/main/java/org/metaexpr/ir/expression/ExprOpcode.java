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

import javax.annotation.Nullable;

/** Operators of binary and unary expressions. */
public enum ExprOpcode {
    // Binary
    ADD("+", true),
    SUBTRACT("-", true),
    MULTIPLY("*", true),
    DIVIDE("/", true),
    MODULO("%", true),
    POWER("**", true),
    AND("&", true),
    OR("|", true),
    XOR("^", true),
    AND_ALSO("&&", true),
    OR_ELSE("||", true),
    EQUAL("==", true),
    NOT_EQUAL("!=", true),
    LESS_THAN("<", true),
    LESS_THAN_OR_EQUAL("<=", true),
    GREATER_THAN(">", true),
    GREATER_THAN_OR_EQUAL(">=", true),
    LEFT_SHIFT("<<", true),
    RIGHT_SHIFT(">>", true),
    COALESCE("??", true),
    ARRAY_INDEX("[]", true),
    ASSIGN("=", true),
    ADD_ASSIGN("+=", true),
    SUBTRACT_ASSIGN("-=", true),
    MULTIPLY_ASSIGN("*=", true),
    DIVIDE_ASSIGN("/=", true),
    MODULO_ASSIGN("%=", true),
    AND_ASSIGN("&=", true),
    OR_ASSIGN("|=", true),
    XOR_ASSIGN("^=", true),

    // Unary
    NEGATE("-", false),
    UNARY_PLUS("+", false),
    NOT("!", false),
    ONES_COMPLEMENT("~", false),
    CONVERT("(cast)", false),
    TYPE_AS("as", false),
    QUOTE("quote", false),
    ARRAY_LENGTH("length", false),
    THROW("throw", false),
    INCREMENT("inc", false),
    DECREMENT("dec", false);

    public final String text;
    public final boolean isBinary;

    ExprOpcode(String text, boolean isBinary) {
        this.text = text;
        this.isBinary = isBinary;
    }

    /** The operation a compound assignment performs before assigning, or null. */
    @Nullable
    public ExprOpcode compoundBase() {
        switch (this) {
            case ADD_ASSIGN: return ADD;
            case SUBTRACT_ASSIGN: return SUBTRACT;
            case MULTIPLY_ASSIGN: return MULTIPLY;
            case DIVIDE_ASSIGN: return DIVIDE;
            case MODULO_ASSIGN: return MODULO;
            case AND_ASSIGN: return AND;
            case OR_ASSIGN: return OR;
            case XOR_ASSIGN: return XOR;
            default: return null;
        }
    }

    public boolean isCompoundAssignment() {
        return this.compoundBase() != null;
    }

    /** True for operators producing a boolean regardless of their operand types. */
    public boolean isComparison() {
        switch (this) {
            case EQUAL:
            case NOT_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case AND_ALSO:
            case OR_ELSE:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return this.text;
    }
}
