package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** An integer constant.  Unsigned values are stored in two's complement. */
public final class CIntConstant extends CExpression {
    public final long value;
    /** Carries a 'U' suffix. */
    public final boolean unsigned;
    /** Carries a 'LL' suffix. */
    public final boolean longLong;

    public CIntConstant(long value, boolean unsigned, boolean longLong) {
        this.value = value;
        this.unsigned = unsigned;
        this.longLong = longLong;
    }

    public CIntConstant(long value) {
        this(value, false, false);
    }

    public String suffix() {
        return (this.unsigned ? "U" : "") + (this.longLong ? "LL" : "");
    }

    /** Text of the constant in C. */
    public String toCString() {
        if (!this.unsigned && this.value == Long.MIN_VALUE)
            // The literal 9223372036854775808 does not fit in long long
            return "(" + (Long.MIN_VALUE + 1) + this.suffix() + " - 1)";
        String digits = this.unsigned ? Long.toUnsignedString(this.value) : Long.toString(this.value);
        return digits + this.suffix();
    }

    /** Negative constants are parenthesized when used as operands. */
    @Override
    public boolean isCompound() {
        return this.toCString().startsWith("-");
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.toCString());
    }
}
