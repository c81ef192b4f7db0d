package org.streamc.streamCompiler.compiler.errors;

import org.streamc.streamCompiler.ir.ISCNode;

import javax.annotation.Nullable;

public final class InternalCompilerError extends BaseCompilerException {
    @Nullable
    public final ISCNode node;

    public InternalCompilerError(String message) {
        super(message);
        this.node = null;
    }

    public InternalCompilerError(String message, ISCNode node) {
        super(message + ": " + node);
        this.node = node;
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
