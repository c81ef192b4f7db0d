package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

public final class CInitExpression extends CInitializer {
    public final CExpression expression;

    public CInitExpression(CExpression expression) {
        this.expression = expression;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expression);
    }
}
