package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import java.util.Arrays;
import java.util.List;

/** Call of a named function. */
public final class CCallExpression extends CExpression {
    public final String function;
    public final List<CExpression> arguments;

    public CCallExpression(String function, List<CExpression> arguments) {
        this.function = function;
        this.arguments = arguments;
    }

    public CCallExpression(String function, CExpression... arguments) {
        this(function, Arrays.asList(arguments));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (CExpression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.function)
                .append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }
}
