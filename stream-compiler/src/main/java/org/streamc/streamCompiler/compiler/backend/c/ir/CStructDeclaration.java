package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import java.util.List;

/** struct name { fields }; */
public final class CStructDeclaration extends CDeclaration {
    public final String name;
    public final List<CVariableDeclaration> fields;

    public CStructDeclaration(String name, List<CVariableDeclaration> fields) {
        this.name = name;
        this.fields = fields;
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
        for (CVariableDeclaration field: this.fields)
            field.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("struct ").append(this.name).append(" {").increase();
        for (CVariableDeclaration field: this.fields)
            builder.append(field).newline();
        return builder.decrease().append("};");
    }
}
