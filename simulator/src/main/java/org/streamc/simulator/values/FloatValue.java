package org.streamc.simulator.values;

/** A C float. */
public final class FloatValue implements IValue {
    public final float value;

    public FloatValue(float value) {
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
        return Float.compare(this.value, ((FloatValue) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Float.hashCode(this.value);
    }

    @Override
    public String toString() {
        return this.value + "f";
    }
}
