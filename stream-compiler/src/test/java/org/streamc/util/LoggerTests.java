package org.streamc.util;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.CompilerOptions;
import org.streamc.streamCompiler.compiler.StreamCompiler;
import org.streamc.streamCompiler.compiler.errors.CompilationError;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

public class LoggerTests {
    @Test
    public void logsGoToTheDebugStream() throws IOException {
        String spec;
        try (InputStream stream = LoggerTests.class.getResourceAsStream("/counter.json")) {
            Objects.requireNonNull(stream);
            spec = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
        StringBuilder log = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(log);
        int level = Logger.INSTANCE.setLoggingLevel("StepAssembler", 1);
        try {
            StreamCompiler compiler = new StreamCompiler(new CompilerOptions());
            compiler.compile(compiler.decode(spec));
        } finally {
            Logger.INSTANCE.setLoggingLevel("StepAssembler", level);
            Logger.INSTANCE.setDebugStream(previous);
        }
        Assert.assertTrue(log.toString(), log.toString().contains("Step function has "));
        // Other classes keep the default level
        Assert.assertFalse(log.toString(), log.toString().contains("State layout "));
    }

    @Test
    public void unknownClassIsRejected() {
        Assert.assertThrows(CompilationError.class,
                () -> Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1));
        Assert.assertThrows(CompilationError.class,
                () -> Logger.INSTANCE.setLoggingLevel("CNames", 1));
    }

    @Test
    public void blocksAreIndented() {
        IndentStream stream = new IndentStreamBuilder();
        stream.append("a {").increase()
                .append("b").newline()
                .append("c").newline().decrease()
                .append("}");
        Assert.assertEquals("a {\n    b\n    c\n}", stream.toString());
    }
}
