package org.streamc.simulator.values;

import org.streamc.simulator.SimulatorException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** A fixed-size C array.  Reading an array yields a reference, as with pointer decay. */
public final class ArrayValue implements IValue {
    final IValue[] elements;

    public ArrayValue(List<IValue> elements) {
        this.elements = elements.toArray(new IValue[0]);
    }

    public ArrayValue(IValue... elements) {
        this.elements = elements;
    }

    public int size() {
        return this.elements.length;
    }

    void checkIndex(long index) {
        if (index < 0 || index >= this.elements.length)
            throw new SimulatorException("Index " + index + " out of bounds for array of size "
                    + this.elements.length);
    }

    public IValue get(long index) {
        this.checkIndex(index);
        return this.elements[(int) index];
    }

    public void set(long index, IValue value) {
        this.checkIndex(index);
        this.elements[(int) index] = value;
    }

    @Override
    public ArrayValue copy() {
        List<IValue> copy = new ArrayList<>();
        for (IValue element: this.elements)
            copy.add(element.copy());
        return new ArrayValue(copy);
    }

    @Override
    public boolean isTrue() {
        // A decayed pointer is never null
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(this.elements, ((ArrayValue) o).elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(this.elements);
    }

    @Override
    public String toString() {
        return Arrays.toString(this.elements);
    }
}
