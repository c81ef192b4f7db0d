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

import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.util.Linq;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers all types reachable from a node, in the order in which
 * a pre-order traversal first meets them.  Types are deduplicated
 * using {@link SCType#sameType}.
 */
public class TypeCollector extends InnerVisitor {
    final Set<SCType> types;

    public TypeCollector() {
        this.types = new LinkedHashSet<>();
    }

    @Override
    public VisitDecision preorder(SCType type) {
        this.types.add(type);
        return VisitDecision.CONTINUE;
    }

    /** All types found, including scalars. */
    public List<SCType> getTypes() {
        return new ArrayList<>(this.types);
    }

    /** Arrays and structs only; these need declarations in C. */
    public List<SCType> getStructuredTypes() {
        return Linq.where(this.getTypes(), SCType::isStructured);
    }

    public boolean contains(SCType type) {
        return this.types.contains(type);
    }

    /** Types of the given node.  The result accumulates across calls. */
    public List<SCType> collect(ISCNode node) {
        this.apply(node);
        return this.getTypes();
    }
}
