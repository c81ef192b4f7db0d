package org.streamc.streamCompiler.compiler.backend.c.ir.statement;

import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import java.util.List;

/** if (condition) { body } without an else branch. */
public final class CIfStatement extends CStatement {
    public final CExpression condition;
    public final List<CStatement> body;

    public CIfStatement(CExpression condition, List<CStatement> body) {
        this.condition = condition;
        this.body = body;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.condition.accept(visitor);
        for (CStatement statement: this.body)
            statement.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("if (").append(this.condition).append(") {").increase();
        for (CStatement statement: this.body)
            builder.append(statement).newline();
        return builder.decrease().append("}");
    }
}
