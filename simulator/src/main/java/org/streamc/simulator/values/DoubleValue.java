package org.streamc.simulator.values;

/** A C double. */
public final class DoubleValue implements IValue {
    public final double value;

    public DoubleValue(double value) {
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
        return Double.compare(this.value, ((DoubleValue) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(this.value);
    }

    @Override
    public String toString() {
        return Double.toString(this.value);
    }
}
