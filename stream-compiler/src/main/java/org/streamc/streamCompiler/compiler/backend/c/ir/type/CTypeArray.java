package org.streamc.streamCompiler.compiler.backend.c.ir.type;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** An array with a fixed number of elements. */
public final class CTypeArray extends CType {
    public final CType elementType;
    public final int size;

    public CTypeArray(CType elementType, int size) {
        this.elementType = elementType;
        this.size = size;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.elementType.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.elementType)
                .append("[")
                .append(this.size)
                .append("]");
    }
}
