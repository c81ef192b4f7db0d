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
import org.streamc.util.IIndentStream;
import org.streamc.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** A complete specification: streams and triggers, both in declaration order.
 * Visiting a specification visits the streams first, then the triggers. */
public final class SCSpec extends SCNode {
    public final List<SCStream> streams;
    public final List<SCTrigger> triggers;

    public SCSpec(List<SCStream> streams, List<SCTrigger> triggers) {
        this.streams = List.copyOf(streams);
        this.triggers = List.copyOf(triggers);
        Set<Integer> ids = new HashSet<>();
        for (SCStream stream: streams)
            Utilities.enforce(ids.add(stream.streamId), "Duplicate stream id " + stream.streamId);
        Set<String> names = new HashSet<>();
        for (SCTrigger trigger: triggers)
            Utilities.enforce(names.add(trigger.name), "Duplicate trigger " + trigger.name);
    }

    @Nullable
    public SCStream getStream(int streamId) {
        for (SCStream stream: this.streams)
            if (stream.streamId == streamId)
                return stream;
        return null;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (SCStream stream: this.streams)
            stream.accept(visitor);
        for (SCTrigger trigger: this.triggers)
            trigger.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("spec {").increase();
        for (SCStream stream: this.streams)
            builder.append(stream).newline();
        for (SCTrigger trigger: this.triggers)
            builder.append(trigger).newline();
        return builder.decrease().append("}");
    }

    @SuppressWarnings("unused")
    public static SCSpec fromJson(JsonNode node, JsonDecoder decoder) {
        List<SCStream> streams = fromJsonInnerList(node, "streams", decoder, SCStream.class);
        List<SCTrigger> triggers = fromJsonInnerList(node, "triggers", decoder, SCTrigger.class);
        return new SCSpec(streams, triggers);
    }
}
