package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** condition ? positive : negative */
public final class CConditionalExpression extends CExpression {
    public final CExpression condition;
    public final CExpression positive;
    public final CExpression negative;

    public CConditionalExpression(CExpression condition, CExpression positive, CExpression negative) {
        this.condition = condition;
        this.positive = positive;
        this.negative = negative;
    }

    @Override
    public boolean isCompound() {
        return true;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.condition.accept(visitor);
        this.positive.accept(visitor);
        this.negative.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.condition)
                .append(" ? ")
                .append(this.positive)
                .append(" : ")
                .append(this.negative)
                .append(")");
    }
}
