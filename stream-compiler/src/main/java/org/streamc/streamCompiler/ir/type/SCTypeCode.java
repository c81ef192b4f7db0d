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

package org.streamc.streamCompiler.ir.type;

import javax.annotation.Nullable;

public enum SCTypeCode {
    // Primitive types
    BOOL("bool", "Bool"),
    INT8("int8_t", "Int8"),
    INT16("int16_t", "Int16"),
    INT32("int32_t", "Int32"),
    INT64("int64_t", "Int64"),
    UINT8("uint8_t", "Word8"),
    UINT16("uint16_t", "Word16"),
    UINT32("uint32_t", "Word32"),
    UINT64("uint64_t", "Word64"),
    FLOAT("float", "Float"),
    DOUBLE("double", "Double"),
    // Derived types
    ARRAY(null, "Array"),
    STRUCT(null, "Struct");

    /** Name of the type in C; only defined for primitive types. */
    @Nullable
    public final String cName;
    public final String shortName;

    SCTypeCode(@Nullable String cName, String shortName) {
        this.cName = cName;
        this.shortName = shortName;
    }

    @Override
    public String toString() {
        return this.shortName;
    }
}
