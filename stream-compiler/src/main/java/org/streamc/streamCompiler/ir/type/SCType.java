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

import org.streamc.streamCompiler.ir.SCNode;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBaseType;

public abstract class SCType extends SCNode {
    public final SCTypeCode code;

    protected SCType(SCTypeCode code) {
        this.code = code;
    }

    /** This is like 'equals', but it always takes a SCType. */
    public abstract boolean sameType(SCType other);

    /** True for arrays and records, which need a declaration of their own in C. */
    public boolean isStructured() {
        return !this.is(SCTypeBaseType.class);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SCType))
            return false;
        return this.sameType((SCType)obj);
    }

    @Override
    public abstract int hashCode();
}
