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
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBool;
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import java.util.List;

/** Calls the host function 'name' with the values of 'arguments'
 * on every tick where 'guard' holds. */
public final class SCTrigger extends SCNode {
    public final String name;
    public final SCExpression guard;
    public final List<SCExpression> arguments;

    public SCTrigger(String name, SCExpression guard, List<SCExpression> arguments) {
        this.name = name;
        this.guard = guard;
        this.arguments = List.copyOf(arguments);
        Utilities.enforce(guard.getType().is(SCTypeBool.class),
                "Guard of trigger " + name + " is not Boolean");
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.guard.accept(visitor);
        for (SCExpression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("trigger ")
                .append(this.name)
                .append(" when ")
                .append(this.guard)
                .append(" (")
                .joinI(", ", this.arguments)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static SCTrigger fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        SCExpression guard = fromJsonInner(node, "guard", decoder, SCExpression.class);
        List<SCExpression> arguments = fromJsonInnerList(node, "arguments", decoder, SCExpression.class);
        return new SCTrigger(name, guard, arguments);
    }
}
