package org.streamc.streamCompiler.compiler.backend.c.ir.statement;

import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import javax.annotation.Nullable;

public final class CReturnStatement extends CStatement {
    @Nullable
    public final CExpression expression;

    public CReturnStatement(@Nullable CExpression expression) {
        this.expression = expression;
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
    public IIndentStream toString(IIndentStream builder) {
        builder.append("return");
        if (this.expression != null)
            builder.append(" ").append(this.expression);
        return builder.append(";");
    }
}
