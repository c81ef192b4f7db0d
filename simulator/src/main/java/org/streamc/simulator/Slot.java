package org.streamc.simulator;

import org.streamc.simulator.values.IValue;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;

/** A typed variable. */
public final class Slot {
    public final CType type;
    IValue value;

    public Slot(CType type, IValue value) {
        this.type = type;
        this.value = value;
    }

    public IValue getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return String.valueOf(this.value);
    }
}
