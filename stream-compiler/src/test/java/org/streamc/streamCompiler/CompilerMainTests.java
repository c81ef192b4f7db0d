package org.streamc.streamCompiler;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.streamc.streamCompiler.compiler.errors.CompilerMessages;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;

public class CompilerMainTests {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    File input(String resource) throws IOException {
        File file = this.folder.newFile(resource);
        try (InputStream stream = CompilerMainTests.class.getResourceAsStream("/" + resource)) {
            Objects.requireNonNull(stream, resource);
            Files.writeString(file.toPath(), new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
        return file;
    }

    @Test
    public void generatesBothFiles() throws IOException {
        File output = this.folder.newFolder("out");
        File input = this.input("counter.json");
        CompilerMessages messages = CompilerMain.execute(
                "-o", output.getPath(), "--prefix", "counter", input.getPath());
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
        Assert.assertTrue(messages.isEmpty());
        File header = new File(output, "counter.h");
        File implementation = new File(output, "counter.c");
        Assert.assertTrue(header.exists());
        Assert.assertTrue(implementation.exists());
        String text = Files.readString(implementation.toPath());
        Assert.assertTrue(text, text.contains("#include \"counter.h\"\n"));
        Assert.assertTrue(Files.readString(header.toPath()).startsWith("#ifndef COUNTER_H\n"));
    }

    @Test
    public void invalidSpecificationWritesNothing() throws IOException {
        File output = this.folder.newFolder("out");
        File input = this.input("bad_drop.json");
        CompilerMessages messages = CompilerMain.execute("-o", output.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        String[] files = output.list();
        Assert.assertNotNull(files);
        Assert.assertEquals(0, files.length);
    }

    @Test
    public void missingInputFile() {
        File missing = new File(this.folder.getRoot(), "missing.json");
        CompilerMessages messages = CompilerMain.execute(missing.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
    }

    @Test
    public void malformedInput() throws IOException {
        File input = this.folder.newFile("broken.json");
        Files.writeString(input.toPath(), "{ \"class\": \"SCSpec\", ");
        CompilerMessages messages = CompilerMain.execute("-o", this.folder.getRoot().getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
    }

    @Test
    public void illegalStepName() throws IOException {
        File output = this.folder.newFolder("out");
        File input = this.input("counter.json");
        CompilerMessages messages = CompilerMain.execute(
                "-o", output.getPath(), "--step", "not-an-identifier", input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString(), messages.toString().contains("not-an-identifier"));
    }

    @Test
    public void badArguments() {
        CompilerMessages messages = CompilerMain.execute("--no-such-option");
        Assert.assertEquals(1, messages.exitCode);
        messages = CompilerMain.execute("-T", "StreamCompiler=high", "input.json");
        Assert.assertEquals(1, messages.exitCode);
    }
}
