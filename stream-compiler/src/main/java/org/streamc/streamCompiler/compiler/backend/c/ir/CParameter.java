package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.SCNode;
import org.streamc.util.IIndentStream;

public final class CParameter extends SCNode {
    public final CType type;
    public final String name;

    public CParameter(CType type, String name) {
        this.type = type;
        this.name = name;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.type)
                .append(" ")
                .append(this.name);
    }
}
