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

package org.streamc.streamCompiler.ir.expression.literal;

import com.fasterxml.jackson.databind.JsonNode;
import org.streamc.streamCompiler.compiler.backend.JsonDecoder;
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

/** An integer constant.  Values of type uint64_t are stored
 * in two's complement, so they may appear negative. */
public final class SCIntLiteral extends SCLiteral {
    public final long value;

    public SCIntLiteral(SCTypeInteger type, long value) {
        super(type);
        this.value = value;
        Utilities.enforce(type.wrap(value) == value,
                "Value " + value + " out of range for " + type);
    }

    public SCIntLiteral(int value) {
        this(SCTypeInteger.INT32, value);
    }

    public SCTypeInteger getIntegerType() {
        return this.type.to(SCTypeInteger.class);
    }

    /** The decimal representation, unsigned where the type is. */
    public String toDecimalString() {
        SCTypeInteger type = this.getIntegerType();
        if (!type.signed)
            return Long.toUnsignedString(this.value);
        return Long.toString(this.value);
    }

    @Override
    public boolean sameValue(SCLiteral other) {
        SCIntLiteral o = other.as(SCIntLiteral.class);
        return o != null && o.value == this.value && this.type.sameType(o.type);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.toDecimalString());
    }

    @SuppressWarnings("unused")
    public static SCIntLiteral fromJson(JsonNode node, JsonDecoder decoder) {
        SCTypeInteger type = fromJsonInner(node, "type", decoder, SCTypeInteger.class);
        String text = Utilities.getProperty(node, "value").asText();
        long value;
        try {
            if (type.signed)
                value = Long.parseLong(text);
            else
                value = Long.parseUnsignedLong(text);
        } catch (NumberFormatException ex) {
            throw new CompilationError("Illegal value " + Utilities.singleQuote(text) + " for type " + type, ex);
        }
        if (type.wrap(value) != value)
            throw new CompilationError("Value " + text + " out of range for type " + type);
        return new SCIntLiteral(type, value);
    }
}
