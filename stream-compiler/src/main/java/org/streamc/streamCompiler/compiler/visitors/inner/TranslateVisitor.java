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

import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.util.IndentStream;
import org.streamc.util.IndentStreamBuilder;
import org.streamc.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Base class for visitors that compute a value of type T for each node. */
public abstract class TranslateVisitor<T> extends InnerVisitor {
    static class TranslationMap<T> {
        final Map<Long, T> translation;
        final Map<Long, ISCNode> node;

        TranslationMap() {
            this.translation = new HashMap<>();
            this.node = new HashMap<>();
        }

        public void putNew(ISCNode node, T translation) {
            Utilities.putNew(this.translation, node.getId(), translation);
            Utilities.putNew(this.node, node.getId(), node);
        }

        public T get(ISCNode node) {
            return Utilities.getExists(this.translation, node.getId());
        }

        @Nullable
        public T maybeGet(ISCNode node) {
            return this.translation.get(node.getId());
        }

        public String toString() {
            IndentStream stream = new IndentStreamBuilder();
            stream.append("[").increase();
            for (Map.Entry<Long, T> e: this.translation.entrySet()) {
                ISCNode node = this.node.get(e.getKey());
                stream.append(node.getId())
                        .append(" ")
                        .append(node)
                        .append("=>")
                        .append(e.getValue().toString())
                        .newline();
            }
            return stream.decrease().append("]").toString();
        }

        public void clear() {
            this.translation.clear();
            this.node.clear();
        }

        public boolean containsKey(ISCNode node) {
            return this.translation.containsKey(node.getId());
        }
    }

    final TranslationMap<T> translationMap;

    protected TranslateVisitor() {
        this.translationMap = new TranslationMap<>();
    }

    protected void set(ISCNode node, T translation) {
        if (this.translationMap.containsKey(node)) {
            T old = this.translationMap.get(node);
            if (old != translation)
                throw new InternalCompilerError("Changing value of " + node + " from " +
                        old + " to " + translation, node);
            return;
        }
        this.translationMap.putNew(node, translation);
    }

    public T get(ISCNode node) {
        return this.translationMap.get(node);
    }

    @Nullable
    public T maybeGet(ISCNode node) {
        return this.translationMap.maybeGet(node);
    }

    @Override
    public void startVisit(ISCNode node) {
        super.startVisit(node);
        this.translationMap.clear();
    }
}
