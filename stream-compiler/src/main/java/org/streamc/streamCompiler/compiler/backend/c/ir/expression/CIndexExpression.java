package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** array[index] */
public final class CIndexExpression extends CExpression {
    public final CExpression array;
    public final CExpression index;

    public CIndexExpression(CExpression array, CExpression index) {
        this.array = array;
        this.index = index;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.array.accept(visitor);
        this.index.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.array)
                .append("[")
                .append(this.index)
                .append("]");
    }
}
