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

import com.fasterxml.jackson.databind.JsonNode;
import org.streamc.streamCompiler.compiler.backend.JsonDecoder;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

/** Reads the buffer of a stream 'depth' positions behind its current index.
 * The depth never exceeds the buffer length minus one. */
public final class SCDropExpression extends SCExpression {
    public final int depth;
    public final int streamId;

    public SCDropExpression(SCType type, int depth, int streamId) {
        super(type);
        this.depth = depth;
        this.streamId = streamId;
        Utilities.enforce(depth >= 0, "Negative drop depth " + depth);
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
        return builder.append("drop(")
                .append(this.depth)
                .append(", s")
                .append(this.streamId)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static SCDropExpression fromJson(JsonNode node, JsonDecoder decoder) {
        SCType type = fromJsonInner(node, "type", decoder, SCType.class);
        int depth = Utilities.getIntProperty(node, "depth");
        int streamId = Utilities.getIntProperty(node, "streamId");
        return new SCDropExpression(type, depth, streamId);
    }
}
