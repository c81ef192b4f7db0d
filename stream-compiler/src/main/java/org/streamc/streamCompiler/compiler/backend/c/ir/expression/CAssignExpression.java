package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** left = right */
public final class CAssignExpression extends CExpression {
    public final CExpression left;
    public final CExpression right;

    public CAssignExpression(CExpression left, CExpression right) {
        this.left = left;
        this.right = right;
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
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.left)
                .append(" = ")
                .append(this.right);
    }
}
