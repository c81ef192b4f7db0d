package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.ir.SCNode;

public abstract class CExpression extends SCNode {
    /** True if the expression must be parenthesized when used as an operand. */
    public boolean isCompound() {
        return false;
    }
}
