package org.streamc.streamCompiler.compiler.backend.c.ir;

import org.streamc.streamCompiler.ir.SCNode;

/** Initializer of a variable: an expression or a brace-enclosed list. */
public abstract class CInitializer extends SCNode {
}
