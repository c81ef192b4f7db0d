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

import java.util.Arrays;
import java.util.List;

/** Application of a primitive operator to its operands. */
public final class SCApplyExpression extends SCExpression {
    public final SCOperator operator;
    public final List<SCExpression> arguments;

    public SCApplyExpression(SCType type, SCOperator operator, List<SCExpression> arguments) {
        super(type);
        this.operator = operator;
        this.arguments = List.copyOf(arguments);
        Utilities.enforce(arguments.size() == operator.opcode().arity,
                "Operator " + operator + " expects " + operator.opcode().arity +
                " arguments, got " + arguments.size());
    }

    public SCApplyExpression(SCType type, SCOperator operator, SCExpression... arguments) {
        this(type, operator, Arrays.asList(arguments));
    }

    public SCApplyExpression(SCType type, SCOpcode opcode, SCExpression... arguments) {
        this(type, new SCOperator(opcode), arguments);
    }

    public SCOpcode getOpcode() {
        return this.operator.opcode();
    }

    public SCExpression getArgument(int index) {
        return this.arguments.get(index);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.type.accept(visitor);
        for (SCExpression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.operator.toString())
                .append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static SCApplyExpression fromJson(JsonNode node, JsonDecoder decoder) {
        SCType type = fromJsonInner(node, "type", decoder, SCType.class);
        SCOperator operator = SCOperator.fromJson(Utilities.getProperty(node, "operator"));
        List<SCExpression> arguments = fromJsonInnerList(node, "arguments", decoder, SCExpression.class);
        return new SCApplyExpression(type, operator, arguments);
    }
}
