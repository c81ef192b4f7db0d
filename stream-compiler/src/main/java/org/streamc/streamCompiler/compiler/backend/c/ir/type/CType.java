package org.streamc.streamCompiler.compiler.backend.c.ir.type;

import org.streamc.streamCompiler.ir.SCNode;

/** A C type, as written in a declaration. */
public abstract class CType extends SCNode {
}
