package org.streamc.streamCompiler.compiler.backend.c.ir.expression;

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.IIndentStream;

public final class CBinaryExpression extends CExpression {
    public enum Operator {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        AND("&&"),
        OR("||"),
        BW_AND("&"),
        BW_OR("|"),
        BW_XOR("^"),
        SHIFT_L("<<"),
        SHIFT_R(">>");

        private final String text;

        Operator(String text) {
            this.text = text;
        }

        public boolean isComparison() {
            return switch (this) {
                case EQ, NE, LT, GT, LE, GE -> true;
                default -> false;
            };
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final Operator operator;
    public final CExpression left;
    public final CExpression right;

    public CBinaryExpression(Operator operator, CExpression left, CExpression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public boolean isCompound() {
        return true;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.operator.toString())
                .append(" ")
                .append(this.right)
                .append(")");
    }
}
