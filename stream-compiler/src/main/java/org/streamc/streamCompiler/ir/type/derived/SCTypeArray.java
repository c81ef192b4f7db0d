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

package org.streamc.streamCompiler.ir.type.derived;

import com.fasterxml.jackson.databind.JsonNode;
import org.streamc.streamCompiler.compiler.backend.JsonDecoder;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.SCTypeCode;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import java.util.Objects;

/** A fixed-size array. */
public class SCTypeArray extends SCType {
    public final SCType elementType;
    public final int size;

    public SCTypeArray(SCType elementType, int size) {
        super(SCTypeCode.ARRAY);
        this.elementType = elementType;
        this.size = size;
        if (size <= 0)
            this.error("Array size must be positive");
    }

    @Override
    public boolean sameType(SCType other) {
        SCTypeArray array = other.as(SCTypeArray.class);
        if (array == null)
            return false;
        return this.size == array.size && this.elementType.sameType(array.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.elementType.hashCode(), this.size);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.elementType.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Array<")
                .append(this.elementType)
                .append(", ")
                .append(this.size)
                .append(">");
    }

    @SuppressWarnings("unused")
    public static SCTypeArray fromJson(JsonNode node, JsonDecoder decoder) {
        SCType elementType = fromJsonInner(node, "elementType", decoder, SCType.class);
        int size = Utilities.getIntProperty(node, "size");
        return new SCTypeArray(elementType, size);
    }
}
