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
import org.metaexpr.ir.IExprNode;
import org.metaexpr.ir.SwitchCase;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/** Selects the first case with a test value equal to the switch value. */
public final class SwitchExpression extends Expression {
    public final Expression switchValue;
    @Nullable
    public final Expression defaultBody;
    /** Static method comparing the switch value with a test value; null means equals. */
    @Nullable
    public final Method comparison;
    public final ImmutableList<SwitchCase> cases;

    public SwitchExpression(Class<?> type, Expression switchValue, @Nullable Expression defaultBody,
                            @Nullable Method comparison, List<SwitchCase> cases) {
        super(type);
        this.switchValue = switchValue;
        this.defaultBody = defaultBody;
        this.comparison = comparison;
        this.cases = ImmutableList.copyOf(cases);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.SWITCH;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.switchValue.accept(visitor);
        for (SwitchCase switchCase: this.cases)
            switchCase.accept(visitor);
        if (this.defaultBody != null)
            this.defaultBody.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        SwitchExpression o = other.as(SwitchExpression.class);
        if (o == null)
            return false;
        return this.type == o.type &&
                this.switchValue == o.switchValue &&
                this.defaultBody == o.defaultBody &&
                Objects.equals(this.comparison, o.comparison) &&
                Linq.same(this.cases, o.cases);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("switch (")
                .append(this.switchValue)
                .append(") {")
                .increase()
                .intercalate(System.lineSeparator(), this.cases);
        if (this.defaultBody != null)
            builder.append("default:").increase().append(this.defaultBody).decrease();
        return builder.decrease().newline().append("}");
    }
}
