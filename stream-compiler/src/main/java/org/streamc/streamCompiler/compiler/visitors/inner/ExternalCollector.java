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

package org.streamc.streamCompiler.compiler.visitors.inner;

import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Discovers all external variables referenced by a node, in first reference order. */
public class ExternalCollector extends InnerVisitor {
    final Map<String, SCExternal> externals;

    public ExternalCollector() {
        this.externals = new LinkedHashMap<>();
    }

    @Override
    public void postorder(SCExternExpression expression) {
        SCExternal previous = this.externals.get(expression.name);
        if (previous == null) {
            this.externals.put(expression.name, new SCExternal(expression.name, expression.getType()));
        } else if (!previous.type().sameType(expression.getType())) {
            throw new InternalCompilerError("External " + expression.name + " used with types "
                    + previous.type() + " and " + expression.getType(), expression);
        }
    }

    public List<SCExternal> getExternals() {
        return new ArrayList<>(this.externals.values());
    }

    /** Externals referenced by the given node.  The result accumulates across calls. */
    public List<SCExternal> collect(ISCNode node) {
        this.apply(node);
        return this.getExternals();
    }
}
