package org.streamc.streamCompiler.compiler.backend.c.ir.statement;

import org.streamc.streamCompiler.ir.SCNode;

public abstract class CStatement extends SCNode {
}
