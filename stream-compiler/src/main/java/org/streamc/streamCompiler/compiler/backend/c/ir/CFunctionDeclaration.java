package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import java.util.List;

/** A function prototype. */
public final class CFunctionDeclaration extends CDeclaration {
    public final CType returnType;
    public final String name;
    public final List<CParameter> parameters;

    public CFunctionDeclaration(CType returnType, String name, List<CParameter> parameters) {
        this.returnType = returnType;
        this.name = name;
        this.parameters = parameters;
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.returnType.accept(visitor);
        for (CParameter parameter: this.parameters)
            parameter.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.returnType)
                .append(" ")
                .append(this.name)
                .append("(")
                .joinI(", ", this.parameters)
                .append(");");
    }
}
