package org.metaexpr.ir;

import com.google.common.collect.ImmutableList;
import org.metaexpr.ir.expression.Expression;
import org.metaexpr.util.IIndentStream;
import org.metaexpr.util.Linq;
import org.metaexpr.visitors.VisitDecision;
import org.metaexpr.visitors.inner.InnerVisitor;

import java.lang.reflect.Method;
import java.util.List;

/** A call to an add method used to initialize a collection element. */
public final class ElementInit extends ExprNode {
    public final Method addMethod;
    public final ImmutableList<Expression> arguments;

    public ElementInit(Method addMethod, List<? extends Expression> arguments) {
        this.addMethod = addMethod;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public ElementInit(Method addMethod, Expression... arguments) {
        this(addMethod, Linq.list(arguments));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IExprNode other) {
        ElementInit o = other.as(ElementInit.class);
        if (o == null)
            return false;
        return this.addMethod.equals(o.addMethod) &&
                Linq.same(this.arguments, o.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.addMethod.getName())
                .append("(")
                .join(", ", this.arguments)
                .append(")");
    }
}
