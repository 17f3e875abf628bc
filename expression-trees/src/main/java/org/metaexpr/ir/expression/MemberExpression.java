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

import org.metaexpr.ir.IExprNode;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Reflection;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;

/** Reads a field, or a property through its getter method. */
public final class MemberExpression extends Expression {
    /** Object whose member is read; null for static members. */
    @Nullable
    public final Expression expression;
    public final Member member;

    public MemberExpression(@Nullable Expression expression, Member member) {
        super(Reflection.memberType(member));
        if (!(member instanceof Field) && !(member instanceof Method))
            throw new IllegalArgumentException("Member " + member + " must be a field or a getter");
        this.expression = expression;
        this.member = member;
    }

    /** Read the field with the given name of the expression's type. */
    public MemberExpression(Expression expression, String fieldName) {
        this(expression, Reflection.field(expression.type, fieldName));
    }

    public boolean isField() {
        return this.member instanceof Field;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.MEMBER;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.expression != null)
            this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        MemberExpression o = other.as(MemberExpression.class);
        if (o == null)
            return false;
        return this.expression == o.expression &&
                this.member.equals(o.member);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.expression != null)
            builder.append(this.expression);
        else
            builder.append(this.member.getDeclaringClass());
        builder.append(".").append(this.member.getName());
        if (!this.isField())
            builder.append("()");
        return builder;
    }
}
