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

import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.SCTypeCode;
import org.streamc.util.IIndentStream;

import java.util.Objects;

/** Base class for the scalar types. */
public abstract class SCTypeBaseType extends SCType {
    protected SCTypeBaseType(SCTypeCode code) {
        super(code);
    }

    /** Name of this type in C. */
    public String cName() {
        return Objects.requireNonNull(this.code.cName);
    }

    @Override
    public boolean sameType(SCType other) {
        return this.code == other.code;
    }

    @Override
    public int hashCode() {
        return this.code.hashCode();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.code.toString());
    }
}
