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
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import java.util.List;

/** A constant record; the values follow the field declaration order. */
public final class SCStructLiteral extends SCLiteral {
    public final List<SCLiteral> values;

    public SCStructLiteral(SCTypeStruct type, List<SCLiteral> values) {
        super(type);
        this.values = List.copyOf(values);
        Utilities.enforce(values.size() == type.fields.size(),
                "Struct literal has " + values.size() + " values, expected " + type.fields.size());
        int index = 0;
        for (SCTypeStruct.Field field: type.getFields()) {
            SCLiteral value = values.get(index++);
            Utilities.enforce(value.getType().sameType(field.type),
                    "Value " + value + " does not have the type of field " + field.name);
        }
    }

    public SCTypeStruct getStructType() {
        return this.type.to(SCTypeStruct.class);
    }

    @Override
    public boolean sameValue(SCLiteral other) {
        SCStructLiteral o = other.as(SCStructLiteral.class);
        if (o == null || !o.type.sameType(this.type))
            return false;
        for (int i = 0; i < this.values.size(); i++)
            if (!this.values.get(i).sameValue(o.values.get(i)))
                return false;
        return true;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        for (SCLiteral value: this.values)
            value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.getStructType().name)
                .append(" { ")
                .joinI(", ", this.values)
                .append(" }");
    }

    @SuppressWarnings("unused")
    public static SCStructLiteral fromJson(JsonNode node, JsonDecoder decoder) {
        SCTypeStruct type = fromJsonInner(node, "type", decoder, SCTypeStruct.class);
        List<SCLiteral> values = fromJsonInnerList(node, "values", decoder, SCLiteral.class);
        return new SCStructLiteral(type, values);
    }
}
