package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.ir.SCNode;

/** A declaration or definition at file scope, or a local variable. */
public abstract class CDeclaration extends SCNode {
    /** Name of the declared entity. */
    public abstract String getName();
}
