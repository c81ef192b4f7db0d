package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

import java.util.List;

/** A function definition; the local declarations precede all statements. */
public final class CFunctionDefinition extends CDeclaration {
    public final CStorage storage;
    public final CType returnType;
    public final String name;
    public final List<CParameter> parameters;
    public final List<CVariableDeclaration> locals;
    public final List<CStatement> statements;

    public CFunctionDefinition(CStorage storage, CType returnType, String name, List<CParameter> parameters,
                               List<CVariableDeclaration> locals, List<CStatement> statements) {
        this.storage = storage;
        this.returnType = returnType;
        this.name = name;
        this.parameters = parameters;
        this.locals = locals;
        this.statements = statements;
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
        for (CVariableDeclaration local: this.locals)
            local.accept(visitor);
        for (CStatement statement: this.statements)
            statement.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.returnType)
                .append(" ")
                .append(this.name)
                .append("(")
                .joinI(", ", this.parameters)
                .append(") {")
                .increase();
        for (CVariableDeclaration local: this.locals)
            builder.append(local).newline();
        for (CStatement statement: this.statements)
            builder.append(statement).newline();
        return builder.decrease().append("}");
    }
}
