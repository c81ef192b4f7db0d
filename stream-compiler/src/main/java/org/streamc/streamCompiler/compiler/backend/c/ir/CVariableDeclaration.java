package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import javax.annotation.Nullable;

/** Variable declaration, also used for struct fields. */
public final class CVariableDeclaration extends CDeclaration {
    public final CStorage storage;
    public final CType type;
    public final String name;
    @Nullable
    public final CInitializer initializer;

    public CVariableDeclaration(CStorage storage, CType type, String name, @Nullable CInitializer initializer) {
        this.storage = storage;
        this.type = type;
        this.name = name;
        this.initializer = initializer;
    }

    public CVariableDeclaration(CType type, String name) {
        this(CStorage.NONE, type, name, null);
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
        this.type.accept(visitor);
        if (this.initializer != null)
            this.initializer.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.storage.toString())
                .append(" ")
                .append(this.type)
                .append(" ")
                .append(this.name);
        if (this.initializer != null)
            builder.append(" = ").append(this.initializer);
        return builder.append(";");
    }
}
