package org.streamc.simulator.values;

import org.streamc.util.ICastable;

/** A value stored in the memory of a simulated program. */
public interface IValue extends ICastable {
    /** A deep copy; scalars are immutable and return themselves. */
    IValue copy();

    /** Value converted to a C truth value. */
    boolean isTrue();
}
