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
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

/** A float or double constant. */
public final class SCFloatLiteral extends SCLiteral {
    public final double value;

    public SCFloatLiteral(SCTypeFP type, double value) {
        super(type);
        this.value = type.isFloat() ? (float) value : value;
    }

    public SCFloatLiteral(double value) {
        this(SCTypeFP.DOUBLE, value);
    }

    public boolean isFloat() {
        return this.type.to(SCTypeFP.class).isFloat();
    }

    @Override
    public boolean sameValue(SCLiteral other) {
        SCFloatLiteral o = other.as(SCFloatLiteral.class);
        return o != null && Double.compare(o.value, this.value) == 0 && this.type.sameType(o.type);
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
        if (this.isFloat())
            return builder.append(Float.toString((float) this.value));
        return builder.append(Double.toString(this.value));
    }

    @SuppressWarnings("unused")
    public static SCFloatLiteral fromJson(JsonNode node, JsonDecoder decoder) {
        SCTypeFP type = fromJsonInner(node, "type", decoder, SCTypeFP.class);
        double value = Utilities.getProperty(node, "value").asDouble();
        return new SCFloatLiteral(type, value);
    }
}
