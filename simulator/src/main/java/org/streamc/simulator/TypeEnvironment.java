package org.streamc.simulator;

import org.streamc.simulator.values.ArrayValue;
import org.streamc.simulator.values.BoolValue;
import org.streamc.simulator.values.DoubleValue;
import org.streamc.simulator.values.FloatValue;
import org.streamc.simulator.values.IValue;
import org.streamc.simulator.values.IntegerValue;
import org.streamc.simulator.values.StructValue;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStructDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTranslationUnit;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTypedefDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CVariableDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeArray;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeName;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypePointer;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeStruct;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Type declarations of a program, and conversions of values to C types. */
public class TypeEnvironment {
    final Map<String, CType> typedefs;
    final Map<String, CStructDeclaration> structs;

    public TypeEnvironment(CTranslationUnit header) {
        this.typedefs = new HashMap<>();
        this.structs = new HashMap<>();
        for (CTypedefDeclaration typedef: header.getDeclarations(CTypedefDeclaration.class))
            this.typedefs.put(typedef.name, typedef.type);
        for (CStructDeclaration struct: header.getDeclarations(CStructDeclaration.class))
            this.structs.put(struct.name, struct);
    }

    /** Replace typedef names by their definitions. */
    public CType resolve(CType type) {
        CTypeName name = type.as(CTypeName.class);
        if (name != null && this.typedefs.containsKey(name.name))
            return this.resolve(this.typedefs.get(name.name));
        return type;
    }

    public CStructDeclaration getStruct(String name) {
        CStructDeclaration result = this.structs.get(name);
        if (result == null)
            throw new SimulatorException("Unknown struct " + name);
        return result;
    }

    public CType fieldType(String struct, String field) {
        for (CVariableDeclaration f: this.getStruct(struct).fields)
            if (f.name.equals(field))
                return f.type;
        throw new SimulatorException("struct " + struct + " has no field " + field);
    }

    /** Type of the elements of an array or of the target of a pointer. */
    public CType elementType(CType type) {
        CType resolved = this.resolve(type);
        if (resolved.is(CTypeArray.class))
            return resolved.to(CTypeArray.class).elementType;
        if (resolved.is(CTypePointer.class))
            return resolved.to(CTypePointer.class).base;
        throw new SimulatorException("Indexing a value of type " + type);
    }

    /** The value of static storage without initializer. */
    public IValue defaultValue(CType type) {
        CType resolved = this.resolve(type);
        CTypeArray array = resolved.as(CTypeArray.class);
        if (array != null) {
            List<IValue> elements = new ArrayList<>();
            for (int i = 0; i < array.size; i++)
                elements.add(this.defaultValue(array.elementType));
            return new ArrayValue(elements);
        }
        CTypeStruct struct = resolved.as(CTypeStruct.class);
        if (struct != null) {
            LinkedHashMap<String, IValue> fields = new LinkedHashMap<>();
            for (CVariableDeclaration field: this.getStruct(struct.name).fields)
                fields.put(field.name, this.defaultValue(field.type));
            return new StructValue(struct.name, fields);
        }
        return this.convert(new IntegerValue(0), resolved);
    }

    public static long toLong(IValue value) {
        if (value.is(IntegerValue.class))
            return value.to(IntegerValue.class).value;
        if (value.is(BoolValue.class))
            return value.to(BoolValue.class).value ? 1 : 0;
        if (value.is(FloatValue.class))
            return (long) value.to(FloatValue.class).value;
        if (value.is(DoubleValue.class))
            return (long) value.to(DoubleValue.class).value;
        throw new SimulatorException("Not a number: " + value);
    }

    public static double toDouble(IValue value) {
        if (value.is(FloatValue.class))
            return value.to(FloatValue.class).value;
        if (value.is(DoubleValue.class))
            return value.to(DoubleValue.class).value;
        return toLong(value);
    }

    static long wrap(String name, long value) {
        return switch (name) {
            case "int8_t" -> (byte) value;
            case "int16_t" -> (short) value;
            case "int32_t" -> (int) value;
            case "uint8_t" -> value & 0xFFL;
            case "uint16_t" -> value & 0xFFFFL;
            case "uint32_t" -> value & 0xFFFFFFFFL;
            case "int64_t", "uint64_t", "size_t" -> value;
            default -> throw new SimulatorException("Unexpected type " + name);
        };
    }

    /** Convert a value as C does when storing it in an object of the given type.
     * Arrays and structs are copied. */
    public IValue convert(IValue value, CType type) {
        CType resolved = this.resolve(type);
        if (resolved.is(CTypePointer.class))
            return value;
        if (resolved.is(CTypeArray.class)) {
            if (!value.is(ArrayValue.class))
                throw new SimulatorException("Cannot store " + value + " in an array");
            return value.copy();
        }
        if (resolved.is(CTypeStruct.class)) {
            if (!value.is(StructValue.class))
                throw new SimulatorException("Cannot store " + value + " in a struct");
            return value.copy();
        }
        String name = resolved.to(CTypeName.class).name;
        return switch (name) {
            case "bool" -> BoolValue.of(value.isTrue());
            case "float" -> new FloatValue((float) toDouble(value));
            case "double" -> new DoubleValue(toDouble(value));
            default -> new IntegerValue(wrap(name, toLong(value)));
        };
    }
}
