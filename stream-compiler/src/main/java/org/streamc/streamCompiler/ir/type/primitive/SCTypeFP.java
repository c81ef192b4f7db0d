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

package org.streamc.streamCompiler.ir.type.primitive;

import com.fasterxml.jackson.databind.JsonNode;
import org.streamc.streamCompiler.compiler.backend.JsonDecoder;
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.type.SCTypeCode;
import org.streamc.util.Utilities;

/** Floating point types: C float and double. */
public class SCTypeFP extends SCTypeBaseType {
    public final int width;

    public static final SCTypeFP FLOAT = new SCTypeFP(32);
    public static final SCTypeFP DOUBLE = new SCTypeFP(64);

    static SCTypeCode getCode(int width) {
        return switch (width) {
            case 32 -> SCTypeCode.FLOAT;
            case 64 -> SCTypeCode.DOUBLE;
            default -> throw new CompilationError("Unexpected floating point width " + width);
        };
    }

    public SCTypeFP(int width) {
        super(getCode(width));
        this.width = width;
    }

    public boolean isFloat() {
        return this.width == 32;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @SuppressWarnings("unused")
    public static SCTypeFP fromJson(JsonNode node, JsonDecoder decoder) {
        int width = Utilities.getIntProperty(node, "width");
        return new SCTypeFP(width);
    }
}
