package org.streamc.streamCompiler.compiler.errors;

import javax.annotation.Nullable;

/** An error in the input supplied to the compiler. */
public final class CompilationError extends BaseCompilerException {
    public CompilationError(String message) {
        super(message);
    }

    public CompilationError(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
