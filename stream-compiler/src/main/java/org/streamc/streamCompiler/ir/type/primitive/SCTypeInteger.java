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

public class SCTypeInteger extends SCTypeBaseType {
    private final int width;
    public final boolean signed;

    public static final SCTypeInteger INT8 = new SCTypeInteger(8, true);
    public static final SCTypeInteger INT16 = new SCTypeInteger(16, true);
    public static final SCTypeInteger INT32 = new SCTypeInteger(32, true);
    public static final SCTypeInteger INT64 = new SCTypeInteger(64, true);
    public static final SCTypeInteger UINT8 = new SCTypeInteger(8, false);
    public static final SCTypeInteger UINT16 = new SCTypeInteger(16, false);
    public static final SCTypeInteger UINT32 = new SCTypeInteger(32, false);
    public static final SCTypeInteger UINT64 = new SCTypeInteger(64, false);

    public static SCTypeCode getCode(int width, boolean signed) {
        if (signed) {
            switch (width) {
                case 8: return SCTypeCode.INT8;
                case 16: return SCTypeCode.INT16;
                case 32: return SCTypeCode.INT32;
                case 64: return SCTypeCode.INT64;
            }
        } else {
            switch (width) {
                case 8: return SCTypeCode.UINT8;
                case 16: return SCTypeCode.UINT16;
                case 32: return SCTypeCode.UINT32;
                case 64: return SCTypeCode.UINT64;
            }
        }
        throw new CompilationError("Unexpected integer type: " +
                "width=" + width + " signed=" + signed);
    }

    public SCTypeInteger(int width, boolean signed) {
        super(getCode(width, signed));
        this.width = width;
        this.signed = signed;
    }

    public int getWidth() {
        return this.width;
    }

    /** Reduce a value to the range of this type, as a C store would. */
    public long wrap(long value) {
        return switch (this.code) {
            case INT8 -> (byte) value;
            case INT16 -> (short) value;
            case INT32 -> (int) value;
            case UINT8 -> value & 0xFFL;
            case UINT16 -> value & 0xFFFFL;
            case UINT32 -> value & 0xFFFFFFFFL;
            default -> value;
        };
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
    public static SCTypeInteger fromJson(JsonNode node, JsonDecoder decoder) {
        int width = Utilities.getIntProperty(node, "width");
        boolean signed = Utilities.getBooleanProperty(node, "signed");
        return new SCTypeInteger(width, signed);
    }
}
