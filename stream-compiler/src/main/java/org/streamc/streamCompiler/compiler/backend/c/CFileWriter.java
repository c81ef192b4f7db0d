package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.util.IWritesLogs;
import org.streamc.util.Logger;
import org.streamc.util.Utilities;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Writes the header and the implementation file of a program. */
public class CFileWriter implements IWritesLogs {
    final CProgram program;

    public CFileWriter(CProgram program) {
        this.program = program;
    }

    public String getHeader() {
        return ToCVisitor.toCString(this.program.header());
    }

    public String getImplementation() {
        return ToCVisitor.toCString(this.program.implementation());
    }

    /** Write both files in the specified directory.
     * If either file cannot be written neither is left behind. */
    public void write(Path directory) throws IOException {
        // Render both before touching the file system
        String header = this.getHeader();
        String implementation = this.getImplementation();
        Path headerFile = directory.resolve(this.program.header().fileName);
        Path implementationFile = directory.resolve(this.program.implementation().fileName);
        List<Path> started = new ArrayList<>();
        try {
            started.add(headerFile);
            Utilities.writeFile(headerFile, header);
            started.add(implementationFile);
            Utilities.writeFile(implementationFile, implementation);
        } catch (IOException ex) {
            // A path that could not be opened may be an existing directory
            for (Path file: started)
                if (Files.isRegularFile(file))
                    Files.deleteIfExists(file);
            throw ex;
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Wrote ")
                .append(headerFile.toString())
                .append(" and ")
                .append(implementationFile.toString())
                .newline();
    }
}
