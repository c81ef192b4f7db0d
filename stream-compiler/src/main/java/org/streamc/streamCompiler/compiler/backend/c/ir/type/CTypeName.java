package org.streamc.streamCompiler.compiler.backend.c.ir.type;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** A type referred to by a single name: a base type or a typedef. */
public final class CTypeName extends CType {
    public final String name;

    public static final CTypeName VOID = new CTypeName("void");
    public static final CTypeName BOOL = new CTypeName("bool");
    public static final CTypeName SIZE_T = new CTypeName("size_t");

    public CTypeName(String name) {
        this.name = name;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
