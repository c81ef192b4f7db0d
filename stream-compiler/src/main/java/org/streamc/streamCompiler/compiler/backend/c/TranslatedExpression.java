package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CVariableDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;

import java.util.List;

/**
 * Result of translating one stream expression.
 * @param expression The C expression computing the value.
 * @param locals     Declarations that must precede the expression, in order.
 */
public record TranslatedExpression(CExpression expression, List<CVariableDeclaration> locals) {}
