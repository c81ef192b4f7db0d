package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CTranslationUnit;

/** The two files generated for a specification, and the layout of the state they declare. */
public record CProgram(CTranslationUnit header, CTranslationUnit implementation, StateLayout layout) {}
