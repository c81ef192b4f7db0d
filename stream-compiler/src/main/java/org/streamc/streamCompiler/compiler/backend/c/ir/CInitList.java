package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import java.util.List;

/** { init0, init1, ... } */
public final class CInitList extends CInitializer {
    public final List<CInitializer> elements;

    public CInitList(List<CInitializer> elements) {
        this.elements = elements;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (CInitializer element: this.elements)
            element.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("{")
                .joinI(", ", this.elements)
                .append("}");
    }
}
