/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.streamc.streamCompiler.ir.expression;

/** Primitive operators of the stream language. */
public enum SCOpcode {
    // Unary
    NOT("!", 1),
    ABS("abs", 1),
    SIGN("sign", 1),
    RECIP("recip", 1),
    EXP("exp", 1),
    SQRT("sqrt", 1),
    LOG("log", 1),
    SIN("sin", 1),
    TAN("tan", 1),
    COS("cos", 1),
    ASIN("asin", 1),
    ATAN("atan", 1),
    ACOS("acos", 1),
    SINH("sinh", 1),
    TANH("tanh", 1),
    COSH("cosh", 1),
    ASINH("asinh", 1),
    ATANH("atanh", 1),
    ACOSH("acosh", 1),
    CEILING("ceil", 1),
    FLOOR("floor", 1),
    BW_NOT("~", 1),
    CAST("cast", 1),
    GET_FIELD(".", 1),
    // Binary
    AND("&&", 2),
    OR("||", 2),
    ADD("+", 2),
    SUB("-", 2),
    MUL("*", 2),
    MOD("%", 2),
    DIV("/", 2),
    FDIV("/", 2),
    POW("pow", 2),
    // log(right) / log(left)
    LOGB("logb", 2),
    EQ("==", 2),
    NE("!=", 2),
    LE("<=", 2),
    GE(">=", 2),
    LT("<", 2),
    GT(">", 2),
    BW_AND("&", 2),
    BW_OR("|", 2),
    BW_XOR("^", 2),
    BW_SHIFT_L("<<", 2),
    BW_SHIFT_R(">>", 2),
    INDEX("[]", 2),
    // Ternary
    MUX("?:", 3);

    private final String text;
    public final int arity;

    SCOpcode(String text, int arity) {
        this.text = text;
        this.arity = arity;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LE || this == GE || this == LT || this == GT;
    }
}
