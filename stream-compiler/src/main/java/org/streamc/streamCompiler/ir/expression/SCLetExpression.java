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

/** let variable = initializer in body.
 * The type of the expression is the type of the body. */
public final class SCLetExpression extends SCExpression {
    public final String variable;
    public final SCExpression initializer;
    public final SCExpression body;

    public SCLetExpression(String variable, SCExpression initializer, SCExpression body) {
        super(body.getType());
        this.variable = variable;
        this.initializer = initializer;
        this.body = body;
    }

    /** Type of the bound variable. */
    public SCType getVariableType() {
        return this.initializer.getType();
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        this.initializer.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder
                .append("(let ")
                .append(this.variable)
                .append(" = ")
                .append(this.initializer)
                .append(" in ")
                .append(this.body)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static SCLetExpression fromJson(JsonNode node, JsonDecoder decoder) {
        String variable = Utilities.getStringProperty(node, "variable");
        SCExpression initializer = fromJsonInner(node, "initializer", decoder, SCExpression.class);
        SCExpression body = fromJsonInner(node, "body", decoder, SCExpression.class);
        return new SCLetExpression(variable, initializer, body);
    }
}
