package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStorage;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStructDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTypedefDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CVariableDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIntConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeName;
import org.streamc.streamCompiler.compiler.visitors.inner.ExpressionTranslator;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.util.IWritesLogs;
import org.streamc.util.Linq;
import org.streamc.util.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Builds the declarations of all static state of a monitor and its {@link StateLayout}. */
public class DeclarationSynthesizer implements IWritesLogs {
    final List<CDeclaration> types;
    /** Names of the types already declared. */
    final Set<String> declared;

    public DeclarationSynthesizer() {
        this.types = new ArrayList<>();
        this.declared = new HashSet<>();
    }

    /**
     * @param spec       Specification compiled.
     * @param types      Types reachable from the specification, in discovery order.
     * @param externals  Externals referenced by the specification.
     */
    public SynthesizedDeclarations synthesize(SCSpec spec, List<SCType> types, List<SCExternal> externals) {
        this.types.clear();
        this.declared.clear();
        for (SCType type: types)
            this.declare(type);

        StateLayout layout = new StateLayout();
        List<CVariableDeclaration> externs = new ArrayList<>();
        List<CVariableDeclaration> snapshots = new ArrayList<>();
        for (SCExternal external: externals) {
            layout.addExternal(external);
            externs.add(new CVariableDeclaration(
                    CStorage.EXTERN, CTypes.translate(external.type()), external.name(), null));
            snapshots.add(new CVariableDeclaration(
                    CStorage.STATIC, CTypes.translate(external.type()), external.snapshotName(), null));
        }

        List<CVariableDeclaration> buffers = new ArrayList<>();
        List<CVariableDeclaration> indices = new ArrayList<>();
        List<CVariableDeclaration> temporaries = new ArrayList<>();
        for (SCStream stream: spec.streams) {
            CInitList init = new CInitList(Linq.map(stream.initial, ExpressionTranslator::initializer));
            StateLayout.StreamSlot slot = new StateLayout.StreamSlot(
                    stream.streamId, stream.type, stream.getBufferLength(), init);
            layout.addStream(slot);
            buffers.add(new CVariableDeclaration(CStorage.STATIC,
                    CTypes.buffer(stream.type, slot.capacity()), slot.bufferName(), init));
            indices.add(new CVariableDeclaration(CStorage.STATIC,
                    CTypeName.SIZE_T, slot.indexName(), new CInitExpression(new CIntConstant(0))));
            temporaries.add(new CVariableDeclaration(CStorage.STATIC,
                    CTypes.translate(stream.type), slot.temporaryName(), null));
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("State layout ")
                .append(layout)
                .newline();
        return new SynthesizedDeclarations(layout, new ArrayList<>(this.types), externs, snapshots, buffers, indices, temporaries);
    }

    /** Declare a type after the types it depends on. */
    void declare(SCType type) {
        SCTypeArray array = type.as(SCTypeArray.class);
        if (array != null) {
            String name = CTypes.arrayTypeName(array);
            if (!this.declared.add(name))
                return;
            this.declare(array.elementType);
            this.types.add(new CTypedefDeclaration(CTypes.arrayDefinition(array), name));
            return;
        }
        SCTypeStruct struct = type.as(SCTypeStruct.class);
        if (struct != null) {
            if (!this.declared.add("struct " + struct.name))
                return;
            List<CVariableDeclaration> fields = new ArrayList<>();
            for (SCTypeStruct.Field field: struct.getFields()) {
                this.declare(field.type);
                fields.add(new CVariableDeclaration(CTypes.translate(field.type), field.name));
            }
            this.types.add(new CStructDeclaration(struct.name, fields));
        }
        // scalar types need no declaration
    }
}
