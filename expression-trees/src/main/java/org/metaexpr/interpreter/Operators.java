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

package org.metaexpr.interpreter;

import com.google.common.primitives.Primitives;
import org.metaexpr.errors.UnimplementedException;
import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.expression.ExprOpcode;

import javax.annotation.Nullable;
import java.lang.reflect.Array;
import java.util.Objects;

/** Semantics of the built-in operators on boxed values.
 * Integral operands are promoted to int, then long; floating operands to double. */
final class Operators {
    private Operators() {}

    static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    static boolean isNumeric(@Nullable Object value) {
        return value instanceof Number || value instanceof Character;
    }

    static Number numeric(Object value) {
        if (value instanceof Character)
            return (int) (Character) value;
        return (Number) value;
    }

    static boolean truthy(@Nullable Object value) {
        if (value == null)
            throw new NullPointerException("Boolean value expected, got null");
        return (Boolean) value;
    }

    @Nullable
    static Object binary(IExprNode node, ExprOpcode opcode, @Nullable Object left, @Nullable Object right) {
        switch (opcode) {
            case EQUAL:
                return equal(left, right);
            case NOT_EQUAL:
                return !equal(left, right);
            case LESS_THAN:
                return compare(left, right) < 0;
            case LESS_THAN_OR_EQUAL:
                return compare(left, right) <= 0;
            case GREATER_THAN:
                return compare(left, right) > 0;
            case GREATER_THAN_OR_EQUAL:
                return compare(left, right) >= 0;
            case ARRAY_INDEX:
                return Array.get(Objects.requireNonNull(left), numeric(Objects.requireNonNull(right)).intValue());
            default:
                break;
        }
        if (opcode == ExprOpcode.ADD && (left instanceof String || right instanceof String))
            return String.valueOf(left) + right;
        if (left instanceof Boolean && right instanceof Boolean) {
            boolean l = (Boolean) left;
            boolean r = (Boolean) right;
            switch (opcode) {
                case AND: return l & r;
                case OR: return l | r;
                case XOR: return l ^ r;
                default: break;
            }
        }
        if (!isNumeric(left) || !isNumeric(right))
            throw new UnimplementedException("Operator " + opcode + " applied to " +
                    describe(left) + " and " + describe(right), node);
        Number l = numeric(left);
        Number r = numeric(right);
        if (opcode == ExprOpcode.LEFT_SHIFT || opcode == ExprOpcode.RIGHT_SHIFT) {
            int distance = r.intValue();
            if (l instanceof Long)
                return opcode == ExprOpcode.LEFT_SHIFT ? l.longValue() << distance : l.longValue() >> distance;
            return opcode == ExprOpcode.LEFT_SHIFT ? l.intValue() << distance : l.intValue() >> distance;
        }
        if (isFloating(l) || isFloating(r)) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            switch (opcode) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                case POWER: return Math.pow(a, b);
                default: break;
            }
        } else if (l instanceof Long || r instanceof Long) {
            long a = l.longValue();
            long b = r.longValue();
            switch (opcode) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                case POWER: return (long) Math.pow(a, b);
                case AND: return a & b;
                case OR: return a | b;
                case XOR: return a ^ b;
                default: break;
            }
        } else {
            int a = l.intValue();
            int b = r.intValue();
            switch (opcode) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                case POWER: return (int) Math.pow(a, b);
                case AND: return a & b;
                case OR: return a | b;
                case XOR: return a ^ b;
                default: break;
            }
        }
        throw new UnimplementedException("Operator " + opcode + " applied to " +
                describe(left) + " and " + describe(right), node);
    }

    @Nullable
    static Object unary(IExprNode node, ExprOpcode opcode, @Nullable Object operand) {
        switch (opcode) {
            case UNARY_PLUS:
                return operand;
            case ARRAY_LENGTH:
                return Array.getLength(Objects.requireNonNull(operand));
            case NOT:
                if (operand instanceof Boolean)
                    return !(Boolean) operand;
                break;
            default:
                break;
        }
        if (!isNumeric(operand))
            throw new UnimplementedException("Operator " + opcode + " applied to " + describe(operand), node);
        Number value = numeric(operand);
        if (isFloating(value)) {
            double d = value.doubleValue();
            switch (opcode) {
                case NEGATE: return -d;
                case INCREMENT: return d + 1;
                case DECREMENT: return d - 1;
                default: break;
            }
        } else if (value instanceof Long) {
            long l = value.longValue();
            switch (opcode) {
                case NEGATE: return -l;
                case INCREMENT: return l + 1;
                case DECREMENT: return l - 1;
                case NOT:
                case ONES_COMPLEMENT: return ~l;
                default: break;
            }
        } else {
            int i = value.intValue();
            switch (opcode) {
                case NEGATE: return -i;
                case INCREMENT: return i + 1;
                case DECREMENT: return i - 1;
                case NOT:
                case ONES_COMPLEMENT: return ~i;
                default: break;
            }
        }
        throw new UnimplementedException("Operator " + opcode + " applied to " + describe(operand), node);
    }

    static boolean equal(@Nullable Object left, @Nullable Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            Number l = numeric(left);
            Number r = numeric(right);
            if (isFloating(l) || isFloating(r))
                return l.doubleValue() == r.doubleValue();
            return l.longValue() == r.longValue();
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(@Nullable Object left, @Nullable Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            Number l = numeric(left);
            Number r = numeric(right);
            if (isFloating(l) || isFloating(r))
                return Double.compare(l.doubleValue(), r.doubleValue());
            return Long.compare(l.longValue(), r.longValue());
        }
        return ((Comparable) Objects.requireNonNull(left)).compareTo(Objects.requireNonNull(right));
    }

    /** Numeric conversion to type, or a checked reference cast. */
    @Nullable
    static Object convert(@Nullable Object value, Class<?> type) {
        if (type == void.class)
            return null;
        Class<?> target = Primitives.unwrap(type);
        if (value == null) {
            if (type.isPrimitive())
                throw new NullPointerException("Cannot convert null to " + type.getSimpleName());
            return null;
        }
        if (isNumeric(value) && target.isPrimitive() && target != boolean.class) {
            Number n = numeric(value);
            if (target == int.class) return n.intValue();
            if (target == long.class) return n.longValue();
            if (target == double.class) return n.doubleValue();
            if (target == float.class) return n.floatValue();
            if (target == short.class) return n.shortValue();
            if (target == byte.class) return n.byteValue();
            if (target == char.class) return (char) n.intValue();
        }
        return Primitives.wrap(type).cast(value);
    }

    private static String describe(@Nullable Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
