package org.streamc.simulator;

import org.streamc.simulator.values.ArrayValue;
import org.streamc.simulator.values.IValue;
import org.streamc.streamCompiler.compiler.backend.c.CNames;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The static storage of a simulated program: buffers, indices, snapshots and static constants. */
public class Arena {
    final Map<String, Slot> slots;

    public Arena() {
        this.slots = new LinkedHashMap<>();
    }

    public void allocate(String name, Slot slot) {
        if (this.slots.containsKey(name))
            throw new SimulatorException("Duplicate static variable " + name);
        this.slots.put(name, slot);
    }

    @Nullable
    public Slot maybeGet(String name) {
        return this.slots.get(name);
    }

    public Slot get(String name) {
        Slot result = this.slots.get(name);
        if (result == null)
            throw new SimulatorException("No static variable named " + name);
        return result;
    }

    public IValue getValue(String name) {
        return this.get(name).value;
    }

    /** The circular buffer of a stream. */
    public ArrayValue buffer(int streamId) {
        return this.getValue(CNames.buffer(streamId)).to(ArrayValue.class);
    }

    /** The running index of a stream. */
    public long index(int streamId) {
        return TypeEnvironment.toLong(this.getValue(CNames.index(streamId)));
    }

    public List<String> getNames() {
        return new ArrayList<>(this.slots.keySet());
    }

    @Override
    public String toString() {
        return this.slots.toString();
    }
}
