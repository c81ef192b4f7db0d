package org.streamc.simulator.values;

import org.streamc.simulator.SimulatorException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A value of a C struct; fields are kept in declaration order. */
public final class StructValue implements IValue {
    public final String name;
    final LinkedHashMap<String, IValue> fields;

    public StructValue(String name, LinkedHashMap<String, IValue> fields) {
        this.name = name;
        this.fields = fields;
    }

    public IValue get(String field) {
        IValue result = this.fields.get(field);
        if (result == null)
            throw new SimulatorException("struct " + this.name + " has no field " + field);
        return result;
    }

    public void set(String field, IValue value) {
        if (!this.fields.containsKey(field))
            throw new SimulatorException("struct " + this.name + " has no field " + field);
        this.fields.put(field, value);
    }

    @Override
    public StructValue copy() {
        LinkedHashMap<String, IValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, IValue> e: this.fields.entrySet())
            copy.put(e.getKey(), e.getValue().copy());
        return new StructValue(this.name, copy);
    }

    @Override
    public boolean isTrue() {
        throw new SimulatorException("struct used as a condition");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructValue that = (StructValue) o;
        return this.name.equals(that.name) && this.fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.fields);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.name).append("{");
        boolean first = true;
        for (Map.Entry<String, IValue> e: this.fields.entrySet()) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(e.getKey()).append("=").append(e.getValue());
        }
        return builder.append("}").toString();
    }
}
