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

package org.streamc.streamCompiler.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.streamc.streamCompiler.compiler.backend.JsonDecoder;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.type.IHasType;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import java.util.List;

/** A stream: a circular buffer of values, initialized with 'initial'
 * and extended by one value computed by 'generator' on each tick. */
public final class SCStream extends SCNode implements IHasType {
    public final int streamId;
    public final SCType type;
    public final List<SCLiteral> initial;
    public final SCExpression generator;

    public SCStream(int streamId, SCType type, List<SCLiteral> initial, SCExpression generator) {
        this.streamId = streamId;
        this.type = type;
        this.initial = List.copyOf(initial);
        this.generator = generator;
        Utilities.enforce(!initial.isEmpty(), "Stream " + streamId + " has an empty buffer");
        for (SCLiteral value: initial)
            Utilities.enforce(value.getType().sameType(type),
                    "Initial value " + value + " of stream " + streamId + " does not have type " + type);
        Utilities.enforce(generator.getType().sameType(type),
                "Generator of stream " + streamId + " does not have type " + type);
    }

    /** Number of elements in the buffer of this stream. */
    public int getBufferLength() {
        return this.initial.size();
    }

    @Override
    public SCType getType() {
        return this.type;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        for (SCLiteral value: this.initial)
            value.accept(visitor);
        this.generator.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("stream s")
                .append(this.streamId)
                .append(": ")
                .append(this.type)
                .append(" = [")
                .joinI(", ", this.initial)
                .append("] ++ ")
                .append(this.generator);
    }

    @SuppressWarnings("unused")
    public static SCStream fromJson(JsonNode node, JsonDecoder decoder) {
        int streamId = Utilities.getIntProperty(node, "streamId");
        SCType type = fromJsonInner(node, "type", decoder, SCType.class);
        List<SCLiteral> initial = fromJsonInnerList(node, "initial", decoder, SCLiteral.class);
        SCExpression generator = fromJsonInner(node, "generator", decoder, SCExpression.class);
        return new SCStream(streamId, type, initial, generator);
    }
}
