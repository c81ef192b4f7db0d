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
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import java.util.List;

/** A constant array; one literal per element. */
public final class SCArrayLiteral extends SCLiteral {
    public final List<SCLiteral> elements;

    public SCArrayLiteral(SCTypeArray type, List<SCLiteral> elements) {
        super(type);
        this.elements = List.copyOf(elements);
        Utilities.enforce(elements.size() == type.size,
                "Array literal has " + elements.size() + " elements, expected " + type.size);
        for (SCLiteral e: elements)
            Utilities.enforce(e.getType().sameType(type.elementType),
                    "Array element " + e + " does not have type " + type.elementType);
    }

    @Override
    public boolean sameValue(SCLiteral other) {
        SCArrayLiteral o = other.as(SCArrayLiteral.class);
        if (o == null || o.elements.size() != this.elements.size())
            return false;
        for (int i = 0; i < this.elements.size(); i++)
            if (!this.elements.get(i).sameValue(o.elements.get(i)))
                return false;
        return true;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        for (SCLiteral element: this.elements)
            element.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("[")
                .joinI(", ", this.elements)
                .append("]");
    }

    @SuppressWarnings("unused")
    public static SCArrayLiteral fromJson(JsonNode node, JsonDecoder decoder) {
        SCTypeArray type = fromJsonInner(node, "type", decoder, SCTypeArray.class);
        List<SCLiteral> elements = fromJsonInnerList(node, "elements", decoder, SCLiteral.class);
        return new SCArrayLiteral(type, elements);
    }
}
