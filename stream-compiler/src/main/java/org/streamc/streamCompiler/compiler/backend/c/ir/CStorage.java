package org.streamc.streamCompiler.compiler.backend.c.ir;

/** Storage class specifier of a declaration. */
public enum CStorage {
    NONE(""),
    STATIC("static"),
    EXTERN("extern");

    private final String text;

    CStorage(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
