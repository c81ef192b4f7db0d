/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.streamc.streamCompiler.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.streamc.streamCompiler.compiler.backend.JsonDecoder;
import org.streamc.streamCompiler.compiler.backend.c.CProgram;
import org.streamc.streamCompiler.compiler.backend.c.DeclarationSynthesizer;
import org.streamc.streamCompiler.compiler.backend.c.StepAssembler;
import org.streamc.streamCompiler.compiler.backend.c.SynthesizedDeclarations;
import org.streamc.streamCompiler.compiler.backend.c.ir.CDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTranslationUnit;
import org.streamc.streamCompiler.compiler.errors.CompilerMessages;
import org.streamc.streamCompiler.compiler.visitors.inner.ExternalCollector;
import org.streamc.streamCompiler.compiler.visitors.inner.StreamReferences;
import org.streamc.streamCompiler.compiler.visitors.inner.TypeCollector;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.SCTrigger;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.util.IWritesLogs;
import org.streamc.util.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a stream specification into a pair of C files.
 * The compiler does not change the specification; compiling
 * the same specification twice produces the same text.
 */
public class StreamCompiler implements IWritesLogs {
    static final List<String> HEADER_INCLUDES = List.of("stdint.h", "stdbool.h", "stddef.h");
    static final List<String> IMPLEMENTATION_INCLUDES = List.of(
            "stdint.h", "stdbool.h", "string.h", "stdlib.h", "math.h");

    public final CompilerOptions options;
    public final CompilerMessages messages;

    public StreamCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(options.ioOptions.quiet, options.ioOptions.emitJsonErrors);
    }

    /** Read a specification from its JSON representation. */
    public SCSpec decode(String json) throws JsonProcessingException {
        JsonDecoder decoder = new JsonDecoder();
        return decoder.decode(json, SCSpec.class);
    }

    /** Macro protecting a header against multiple inclusion, e.g. MONITOR_H. */
    public static String includeGuard(String prefix) {
        StringBuilder builder = new StringBuilder();
        if (!prefix.isEmpty() && Character.isDigit(prefix.charAt(0)))
            builder.append("_");
        for (char c: prefix.toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))
                builder.append(Character.toUpperCase(c));
            else
                builder.append('_');
        }
        return builder.append("_H").toString();
    }

    /** Warn about streams that no trigger depends on, directly or through other streams. */
    void warnUnusedStreams(SCSpec spec) {
        StreamReferences references = new StreamReferences();
        Map<Integer, Set<Integer>> reads = new HashMap<>();
        for (SCStream stream: spec.streams)
            reads.put(stream.streamId, references.collect(stream.generator));

        Set<Integer> used = new LinkedHashSet<>();
        Deque<Integer> work = new ArrayDeque<>();
        for (SCTrigger trigger: spec.triggers) {
            work.addAll(references.collect(trigger.guard));
            for (SCExpression argument: trigger.arguments)
                work.addAll(references.collect(argument));
        }
        while (!work.isEmpty()) {
            int streamId = work.pop();
            if (used.add(streamId))
                work.addAll(reads.getOrDefault(streamId, Set.of()));
        }
        for (SCStream stream: spec.streams) {
            if (!used.contains(stream.streamId))
                this.messages.reportWarning("Stream " + stream.streamId + " does not affect any trigger");
        }
    }

    public CProgram compile(SCSpec spec) {
        this.options.validate();
        this.warnUnusedStreams(spec);
        TypeCollector typeCollector = new TypeCollector();
        List<SCType> types = typeCollector.collect(spec);
        ExternalCollector externalCollector = new ExternalCollector();
        List<SCExternal> externals = externalCollector.collect(spec);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Compiling ")
                .append(spec.streams.size())
                .append(" streams, ")
                .append(spec.triggers.size())
                .append(" triggers, ")
                .append(externals.size())
                .append(" externals")
                .newline();

        DeclarationSynthesizer synthesizer = new DeclarationSynthesizer();
        SynthesizedDeclarations declarations = synthesizer.synthesize(spec, types, externals);
        StepAssembler assembler = new StepAssembler(declarations.layout(), this.options.ioOptions.stepName);

        List<CDeclaration> header = new ArrayList<>();
        header.addAll(declarations.types());
        header.addAll(declarations.externs());
        header.addAll(assembler.handlerPrototypes(spec));
        header.add(assembler.stepPrototype());
        String headerFile = this.options.ioOptions.headerFile();
        CTranslationUnit headerUnit = new CTranslationUnit(headerFile,
                includeGuard(this.options.ioOptions.prefix), HEADER_INCLUDES, List.of(), header);

        List<CDeclaration> implementation = new ArrayList<>();
        implementation.addAll(declarations.snapshots());
        implementation.addAll(declarations.buffers());
        implementation.addAll(declarations.indices());
        implementation.addAll(declarations.temporaries());
        implementation.addAll(assembler.generators(spec));
        implementation.add(assembler.step(spec));
        CTranslationUnit implementationUnit = new CTranslationUnit(this.options.ioOptions.implementationFile(),
                null, IMPLEMENTATION_INCLUDES, List.of(headerFile), implementation);
        return new CProgram(headerUnit, implementationUnit, declarations.layout());
    }
}
