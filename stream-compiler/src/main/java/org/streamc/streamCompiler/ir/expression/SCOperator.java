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
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.util.Utilities;

import javax.annotation.Nullable;

/** An operator applied by a {@link SCApplyExpression}.
 * @param opcode  Operation performed.
 * @param field   Name of the selected field; only used by GET_FIELD. */
public record SCOperator(SCOpcode opcode, @Nullable String field) {
    public SCOperator(SCOpcode opcode) {
        this(opcode, null);
    }

    public static SCOperator getField(String field) {
        return new SCOperator(SCOpcode.GET_FIELD, field);
    }

    public String getFieldName() {
        Utilities.enforce(this.field != null, "Operator " + this.opcode.name() + " has no field");
        return this.field;
    }

    public static SCOperator fromJson(JsonNode node) {
        String name = Utilities.getStringProperty(node, "opcode");
        SCOpcode opcode;
        try {
            opcode = SCOpcode.valueOf(name);
        } catch (IllegalArgumentException ex) {
            throw new CompilationError("Unknown operator " + Utilities.singleQuote(name), ex);
        }
        String field = null;
        if (node.has("field"))
            field = Utilities.getStringProperty(node, "field");
        if (opcode == SCOpcode.GET_FIELD && field == null)
            throw new CompilationError("GET_FIELD operator without a field name");
        return new SCOperator(opcode, field);
    }

    @Override
    public String toString() {
        if (this.field != null)
            return this.opcode.name() + "(" + this.field + ")";
        return this.opcode.name();
    }
}
