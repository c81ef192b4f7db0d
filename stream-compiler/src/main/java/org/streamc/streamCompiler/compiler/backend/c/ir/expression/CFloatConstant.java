package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

/** A float or double constant. */
public final class CFloatConstant extends CExpression {
    public final double value;
    /** True for float constants, which carry an 'f' suffix. */
    public final boolean single;

    public CFloatConstant(double value, boolean single) {
        this.value = value;
        this.single = single;
    }

    /** Text of the constant in C. */
    public String toCString() {
        if (Double.isNaN(this.value))
            return "NAN";
        if (Double.isInfinite(this.value))
            return this.value > 0 ? "INFINITY" : "-INFINITY";
        if (this.single)
            return Float.toString((float) this.value) + "f";
        return Double.toString(this.value);
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
