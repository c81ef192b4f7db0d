package org.streamc.streamCompiler.compiler.errors;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler. */
public abstract class BaseCompilerException extends RuntimeException {
    protected BaseCompilerException(String message, @Nullable Throwable throwable) {
        super(message, throwable);
    }

    protected BaseCompilerException(String message) {
        this(message, null);
    }

    public abstract String getErrorKind();
}
