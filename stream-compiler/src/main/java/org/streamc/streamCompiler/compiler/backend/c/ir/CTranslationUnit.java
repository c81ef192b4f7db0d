package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.SCNode;
import org.streamc.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** The contents of one C file. */
public final class CTranslationUnit extends SCNode {
    /** Name of the file, e.g., monitor.c */
    public final String fileName;
    /** Macro used to guard against multiple inclusion; only used for headers. */
    @Nullable
    public final String includeGuard;
    /** Included with angle brackets. */
    public final List<String> systemIncludes;
    /** Included with quotes. */
    public final List<String> localIncludes;
    public final List<CDeclaration> declarations;

    public CTranslationUnit(String fileName, @Nullable String includeGuard,
                            List<String> systemIncludes, List<String> localIncludes,
                            List<CDeclaration> declarations) {
        this.fileName = fileName;
        this.includeGuard = includeGuard;
        this.systemIncludes = systemIncludes;
        this.localIncludes = localIncludes;
        this.declarations = declarations;
    }

    public <T extends CDeclaration> List<T> getDeclarations(Class<T> clazz) {
        List<T> result = new ArrayList<>();
        for (CDeclaration declaration: this.declarations) {
            T t = declaration.as(clazz);
            if (t != null)
                result.add(t);
        }
        return result;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (CDeclaration declaration: this.declarations)
            declaration.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("// ").append(this.fileName).newline();
        for (CDeclaration declaration: this.declarations)
            builder.append(declaration).newline();
        return builder;
    }
}
