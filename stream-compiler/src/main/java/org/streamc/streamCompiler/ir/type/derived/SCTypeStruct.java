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
import org.streamc.streamCompiler.ir.SCNode;
import org.streamc.streamCompiler.ir.type.IHasType;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.SCTypeCode;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/** A named record; fields are kept in declaration order. */
public class SCTypeStruct extends SCType {
    public static class Field extends SCNode implements IHasType {
        /** Position within struct */
        public final int index;
        public final String name;
        public final SCType type;

        public Field(String name, int index, SCType type) {
            this.name = name;
            this.index = index;
            this.type = type;
        }

        public String getName() {
            return this.name;
        }

        @Override
        public SCType getType() {
            return this.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.name, this.type.hashCode());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Field that = (Field) o;
            return this.name.equals(that.name) &&
                    this.index == that.index &&
                    this.type.sameType(that.type);
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
            return builder
                    .append(this.name)
                    .append(": ")
                    .append(this.type);
        }

        @SuppressWarnings("unused")
        public static Field fromJson(JsonNode node, JsonDecoder decoder) {
            int index = Utilities.getIntProperty(node, "index");
            String name = Utilities.getStringProperty(node, "name");
            SCType type = fromJsonInner(node, "type", decoder, SCType.class);
            return new Field(name, index, type);
        }
    }

    public final String name;
    public final LinkedHashMap<String, Field> fields;

    public SCTypeStruct(String name, Collection<Field> fields) {
        super(SCTypeCode.STRUCT);
        this.name = name;
        this.fields = new LinkedHashMap<>();
        for (Field f: fields) {
            if (this.hasField(f.getName()))
                this.error("Field name " + f + " is duplicated");
            this.fields.put(f.name, f);
        }
    }

    public boolean hasField(String fieldName) {
        return this.fields.containsKey(fieldName);
    }

    @Nullable
    public Field getField(String name) {
        return this.fields.get(name);
    }

    public Collection<Field> getFields() {
        return this.fields.values();
    }

    @Override
    public boolean sameType(SCType type) {
        SCTypeStruct other = type.as(SCTypeStruct.class);
        if (other == null)
            return false;
        if (!this.name.equals(other.name))
            return false;
        if (this.fields.size() != other.fields.size())
            return false;
        for (String name: this.fields.keySet()) {
            Field otherField = other.getField(name);
            if (otherField == null)
                return false;
            Field field = Objects.requireNonNull(this.getField(name));
            if (!field.equals(otherField))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.fields.hashCode());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Field f: this.fields.values())
            f.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("struct ")
                .append(this.name);
    }

    @SuppressWarnings("unused")
    public static SCTypeStruct fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        List<Field> fields = fromJsonInnerList(node, "fields", decoder, Field.class);
        return new SCTypeStruct(name, fields);
    }
}
