package org.streamc.simulator.values;

/** Any C integer.  Unsigned values up to 32 bits are kept non-negative. */
public final class IntegerValue implements IValue {
    public final long value;

    public IntegerValue(long value) {
        this.value = value;
    }

    @Override
    public IValue copy() {
        return this;
    }

    @Override
    public boolean isTrue() {
        return this.value != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.value == ((IntegerValue) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(this.value);
    }

    @Override
    public String toString() {
        return Long.toString(this.value);
    }
}
