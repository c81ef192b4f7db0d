package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CVariableDeclaration;

import java.util.List;

/**
 * Declarations of the static state of a monitor.
 * @param layout     Table describing all static storage.
 * @param types      Struct declarations and array typedefs, dependencies first.
 * @param externs    extern declarations of the host variables.
 * @param snapshots  Private copies of the host variables.
 * @param buffers    Circular buffers of the streams.
 * @param indices    Running indices of the buffers.
 * @param temporaries  Next values of the streams, computed before any buffer is written.
 */
public record SynthesizedDeclarations(
        StateLayout layout,
        List<CDeclaration> types,
        List<CVariableDeclaration> externs,
        List<CVariableDeclaration> snapshots,
        List<CVariableDeclaration> buffers,
        List<CVariableDeclaration> indices,
        List<CVariableDeclaration> temporaries) {}
