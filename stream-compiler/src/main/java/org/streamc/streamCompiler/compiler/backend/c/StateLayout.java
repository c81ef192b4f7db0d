package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.util.IIndentStream;
import org.streamc.util.IndentStreamBuilder;
import org.streamc.util.ToIndentableString;
import org.streamc.util.Utilities;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** All static storage of a generated monitor, keyed by stream id and by external name. */
public final class StateLayout implements ToIndentableString {
    /** Circular buffer of a stream and its running index. */
    public record StreamSlot(int streamId, SCType elementType, int capacity, CInitList initializer) {
        public String bufferName() {
            return CNames.buffer(this.streamId);
        }

        public String indexName() {
            return CNames.index(this.streamId);
        }

        public String temporaryName() {
            return CNames.temporary(this.streamId);
        }

        public String generatorName() {
            return CNames.generator(this.streamId);
        }

        /** Position of the element 'depth' ticks in the past, relative to the index. */
        public int offset(int depth) {
            if (depth < 0 || depth >= this.capacity)
                throw new InternalCompilerError("History depth " + depth + " out of range for stream "
                        + this.streamId + " with buffer length " + this.capacity);
            return (this.capacity - depth) % this.capacity;
        }
    }

    final Map<Integer, StreamSlot> streams;
    final Map<String, SCExternal> externals;

    public StateLayout() {
        this.streams = new LinkedHashMap<>();
        this.externals = new LinkedHashMap<>();
    }

    public void addStream(StreamSlot slot) {
        Utilities.putNew(this.streams, slot.streamId(), slot);
    }

    public void addExternal(SCExternal external) {
        Utilities.putNew(this.externals, external.name(), external);
    }

    public StreamSlot getStream(int streamId) {
        StreamSlot slot = this.streams.get(streamId);
        if (slot == null)
            throw new InternalCompilerError("Reference to unknown stream " + streamId);
        return slot;
    }

    public SCExternal getExternal(String name) {
        return Utilities.getExists(this.externals, name);
    }

    public List<StreamSlot> getStreams() {
        return new ArrayList<>(this.streams.values());
    }

    public List<SCExternal> getExternals() {
        return new ArrayList<>(this.externals.values());
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("layout {").increase();
        for (StreamSlot slot: this.streams.values())
            builder.append(slot.bufferName())
                    .append(": ")
                    .append(slot.elementType())
                    .append("[")
                    .append(slot.capacity())
                    .append("], ")
                    .append(slot.indexName())
                    .append(", ")
                    .append(slot.temporaryName())
                    .newline();
        for (SCExternal external: this.externals.values())
            builder.append(external.snapshotName())
                    .append(": ")
                    .append(external.type())
                    .newline();
        return builder.decrease().append("}");
    }

    @Override
    public String toString() {
        return this.toString(new IndentStreamBuilder()).toString();
    }
}
