package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeArray;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeName;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypePointer;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeStruct;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBaseType;

/**
 * Maps stream types to C types.
 * Every array type is referred to through a typedef, so that arrays can
 * appear as struct fields, buffer elements and handler parameters
 * with a single spelling.
 */
public final class CTypes {
    private CTypes() {}

    /** Name of the typedef for an array type, e.g. array_int32_3. */
    public static String arrayTypeName(SCTypeArray type) {
        return "array_" + elementTag(type.elementType) + "_" + type.size;
    }

    static String elementTag(SCType type) {
        if (type.is(SCTypeArray.class))
            return arrayTypeName(type.to(SCTypeArray.class));
        if (type.is(SCTypeStruct.class))
            return "struct_" + type.to(SCTypeStruct.class).name;
        String name = type.to(SCTypeBaseType.class).cName();
        if (name.endsWith("_t"))
            name = name.substring(0, name.length() - 2);
        return name;
    }

    /** The C type used for values and variables of the given type. */
    public static CType translate(SCType type) {
        if (type.is(SCTypeBaseType.class))
            return new CTypeName(type.to(SCTypeBaseType.class).cName());
        if (type.is(SCTypeArray.class))
            return new CTypeName(arrayTypeName(type.to(SCTypeArray.class)));
        if (type.is(SCTypeStruct.class))
            return new CTypeStruct(type.to(SCTypeStruct.class).name);
        throw new InternalCompilerError("Unexpected type " + type, type);
    }

    /** The type of an rvalue of the given type: arrays decay to a pointer to their first element. */
    public static CType decay(SCType type) {
        SCTypeArray array = type.as(SCTypeArray.class);
        if (array != null)
            return new CTypePointer(translate(array.elementType));
        return translate(type);
    }

    /** The type of the circular buffer of a stream. */
    public static CType buffer(SCType elementType, int length) {
        return new CTypeArray(translate(elementType), length);
    }

    /** The type underlying the typedef of an array type. */
    public static CType arrayDefinition(SCTypeArray type) {
        return new CTypeArray(translate(type.elementType), type.size);
    }
}
