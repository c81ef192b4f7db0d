package org.streamc.streamCompiler.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.streamc.streamCompiler.compiler.backend.c.CFileWriter;
import org.streamc.streamCompiler.compiler.backend.c.CProgram;
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.SCTrigger;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCBoolLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

public class StreamCompilerTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    static String resource(String name) throws IOException {
        try (InputStream stream = StreamCompilerTests.class.getResourceAsStream("/" + name)) {
            Objects.requireNonNull(stream, name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static CProgram compile(CompilerOptions options, String resource) throws IOException {
        StreamCompiler compiler = new StreamCompiler(options);
        SCSpec spec = compiler.decode(resource(resource));
        return compiler.compile(spec);
    }

    static final String COUNTER_HEADER = """
            #ifndef MONITOR_H
            #define MONITOR_H

            #include <stdint.h>
            #include <stdbool.h>
            #include <stddef.h>

            extern double temperature;

            void overheat(int32_t overheat_arg0, double overheat_arg1);
            void step(void);

            #endif /* MONITOR_H */
            """;

    static final String COUNTER_IMPLEMENTATION = """
            #include <stdint.h>
            #include <stdbool.h>
            #include <string.h>
            #include <stdlib.h>
            #include <math.h>

            #include "monitor.h"

            static double temperature_cpy;
            static int32_t s0[1] = {0};
            static bool s1[1] = {false};
            static size_t s0_idx = 0;
            static size_t s1_idx = 0;
            static int32_t s0_tmp;
            static bool s1_tmp;

            static int32_t s0_gen(void) {
                return s0[s0_idx] + 1;
            }

            static bool s1_gen(void) {
                return temperature_cpy > 30.0;
            }

            static bool overheat_guard(void) {
                return s1[s1_idx];
            }

            static int32_t overheat_arg0(void) {
                return s0[s0_idx];
            }

            static double overheat_arg1(void) {
                return temperature_cpy;
            }

            void step(void) {
                temperature_cpy = temperature;
                if (overheat_guard()) {
                    overheat(overheat_arg0(), overheat_arg1());
                }
                s0_tmp = s0_gen();
                s1_tmp = s1_gen();
                s0[s0_idx] = s0_tmp;
                s1[s1_idx] = s1_tmp;
                s0_idx = (s0_idx + 1) % 1;
                s1_idx = (s1_idx + 1) % 1;
            }
            """;

    @Test
    public void counterMonitor() throws IOException {
        CProgram program = compile(new CompilerOptions(), "counter.json");
        CFileWriter writer = new CFileWriter(program);
        Assert.assertEquals(COUNTER_HEADER, writer.getHeader());
        Assert.assertEquals(COUNTER_IMPLEMENTATION, writer.getImplementation());
        Assert.assertEquals("monitor.h", program.header().fileName);
        Assert.assertEquals("monitor.c", program.implementation().fileName);
    }

    @Test
    public void outputIsDeterministic() throws IOException {
        CFileWriter first = new CFileWriter(compile(new CompilerOptions(), "counter.json"));
        CFileWriter second = new CFileWriter(compile(new CompilerOptions(), "counter.json"));
        Assert.assertEquals(first.getHeader(), second.getHeader());
        Assert.assertEquals(first.getImplementation(), second.getImplementation());
    }

    @Test
    public void namesComeFromOptions() throws IOException {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.prefix = "engine-monitor";
        options.ioOptions.stepName = "engine_step";
        CFileWriter writer = new CFileWriter(compile(options, "counter.json"));
        String header = writer.getHeader();
        Assert.assertTrue(header, header.startsWith("#ifndef ENGINE_MONITOR_H\n#define ENGINE_MONITOR_H\n"));
        Assert.assertTrue(header, header.contains("void engine_step(void);\n"));
        String implementation = writer.getImplementation();
        Assert.assertTrue(implementation, implementation.contains("#include \"engine-monitor.h\"\n"));
        Assert.assertTrue(implementation, implementation.contains("void engine_step(void) {\n"));
    }

    @Test
    public void includeGuard() {
        Assert.assertEquals("MONITOR_H", StreamCompiler.includeGuard("monitor"));
        Assert.assertEquals("MY_MONITOR_V2_H", StreamCompiler.includeGuard("my.monitor-v2"));
        Assert.assertEquals("_2FAST_H", StreamCompiler.includeGuard("2fast"));
    }

    @Test
    public void illegalStepName() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.stepName = "1step";
        Assert.assertThrows(CompilationError.class, () -> compile(options, "counter.json"));
        options.ioOptions.stepName = "step";
        options.ioOptions.prefix = "out/monitor";
        Assert.assertThrows(CompilationError.class, () -> compile(options, "counter.json"));
    }

    /** s1 reads s0 and feeds the trigger; s2 reads s1 and feeds nothing. */
    static SCSpec chain() {
        SCTypeInteger type = SCTypeInteger.INT32;
        SCStream s0 = new SCStream(0, type, List.of(new SCIntLiteral(0)), new SCDropExpression(type, 0, 0));
        SCStream s1 = new SCStream(1, type, List.of(new SCIntLiteral(0)), new SCDropExpression(type, 0, 0));
        SCStream s2 = new SCStream(2, type, List.of(new SCIntLiteral(0)), new SCDropExpression(type, 0, 1));
        SCTrigger trigger = new SCTrigger("alarm", new SCBoolLiteral(true),
                List.of(new SCDropExpression(type, 0, 1)));
        return new SCSpec(List.of(s0, s1, s2), List.of(trigger));
    }

    @Test
    public void unusedStreamsAreReported() {
        StreamCompiler compiler = new StreamCompiler(new CompilerOptions());
        compiler.compile(chain());
        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals(0, compiler.messages.errorCount());
        Assert.assertEquals(0, compiler.messages.exitCode);
        String text = compiler.messages.toString();
        Assert.assertTrue(text, text.contains("warning: Warning: Stream 2 does not affect any trigger"));
    }

    @Test
    public void quietHidesWarnings() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.quiet = true;
        StreamCompiler compiler = new StreamCompiler(options);
        compiler.compile(chain());
        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals("", compiler.messages.toString());
    }

    @Test
    public void messagesAsJson() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.emitJsonErrors = true;
        StreamCompiler compiler = new StreamCompiler(options);
        compiler.compile(chain());
        Assert.assertTrue(compiler.messages.toJson().isArray());
        Assert.assertEquals(1, compiler.messages.toJson().size());
        Assert.assertTrue(compiler.messages.toJson().get(0).get("warning").asBoolean());
        Assert.assertEquals("Stream 2 does not affect any trigger",
                compiler.messages.toJson().get(0).get("message").asText());
        Assert.assertTrue(compiler.messages.toString().startsWith("["));
    }

    @Test
    public void malformedJson() {
        StreamCompiler compiler = new StreamCompiler(new CompilerOptions());
        Assert.assertThrows(JsonProcessingException.class, () -> compiler.decode("{ \"class\": "));
    }

    @Test
    public void failedHeaderLeavesNoFiles() throws IOException {
        File output = this.folder.newFolder("out");
        File header = new File(output, "monitor.h");
        Assert.assertTrue(header.mkdir());
        CFileWriter writer = new CFileWriter(compile(new CompilerOptions(), "counter.json"));
        Assert.assertThrows(IOException.class, () -> writer.write(output.toPath()));
        Assert.assertTrue(header.isDirectory());
        Assert.assertFalse(new File(output, "monitor.c").exists());
    }

    @Test
    public void failedImplementationRemovesHeader() throws IOException {
        File output = this.folder.newFolder("out");
        File implementation = new File(output, "monitor.c");
        Assert.assertTrue(implementation.mkdir());
        CFileWriter writer = new CFileWriter(compile(new CompilerOptions(), "counter.json"));
        Assert.assertThrows(IOException.class, () -> writer.write(output.toPath()));
        Assert.assertFalse(new File(output, "monitor.h").exists());
        Assert.assertTrue(implementation.isDirectory());
    }
}
