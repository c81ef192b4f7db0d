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

package org.streamc.streamCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.streamc.streamCompiler.compiler.CompilerOptions;
import org.streamc.streamCompiler.compiler.StreamCompiler;
import org.streamc.streamCompiler.compiler.backend.c.CFileWriter;
import org.streamc.streamCompiler.compiler.backend.c.CProgram;
import org.streamc.streamCompiler.compiler.errors.BaseCompilerException;
import org.streamc.streamCompiler.compiler.errors.CompilerMessages;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.util.Logger;
import org.streamc.util.Utilities;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the stream compiler. */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    void usage(JCommander commander) {
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("streamc");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (BaseCompilerException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    /** Run compiler, return messages. */
    CompilerMessages run() {
        StreamCompiler compiler = new StreamCompiler(this.options);
        CompilerMessages messages = compiler.messages;
        String inputFile = this.options.ioOptions.inputFile;
        if (inputFile == null) {
            messages.reportProblem(false, "Invalid input", "No input file specified");
            return messages;
        }
        messages.setErrorContext(inputFile);
        if (this.options.ioOptions.verbosity >= 1)
            System.out.println(this.options);

        String json;
        try {
            json = Utilities.readFile(Paths.get(inputFile));
        } catch (IOException e) {
            messages.reportError(e);
            return messages;
        }

        try {
            SCSpec spec = compiler.decode(json);
            CProgram program = compiler.compile(spec);
            Path directory = Paths.get(this.options.ioOptions.outputDirectory);
            CFileWriter writer = new CFileWriter(program);
            writer.write(directory);
            if (this.options.ioOptions.verbosity >= 1)
                System.out.println("Generated " + directory.resolve(program.header().fileName)
                        + " and " + directory.resolve(program.implementation().fileName));
        } catch (JsonProcessingException e) {
            messages.reportError(e);
        } catch (IOException e) {
            messages.reportError(e);
        } catch (BaseCompilerException e) {
            messages.reportError(e);
        } catch (Throwable e) {
            messages.reportError(e);
        }
        return messages;
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages();
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
