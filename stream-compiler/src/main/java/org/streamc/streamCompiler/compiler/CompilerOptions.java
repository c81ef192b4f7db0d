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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Command-line options for the stream compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output directory for the generated files")
        public String outputDirectory = ".";
        @Parameter(names = "--prefix", description = "Base name of the generated .h and .c files")
        public String prefix = "monitor";
        @Parameter(names = "--step", description = "Name of the generated step function")
        public String stepName = "step";
        @Parameter(description = "Input file to compile", required = true)
        @Nullable
        public String inputFile = null;
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;
        @Parameter(names = "-q", description = "Do not print warnings")
        public boolean quiet = false;
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to the error output")
        public boolean emitJsonErrors = false;

        /** Name of the generated header file. */
        public String headerFile() {
            return this.prefix + ".h";
        }

        /** Name of the generated implementation file. */
        public String implementationFile() {
            return this.prefix + ".c";
        }

        @Override
        public String toString() {
            return "IO{" +
                    "loggingLevel=" + this.loggingLevel +
                    ",\n\toutputDirectory=" + Utilities.singleQuote(this.outputDirectory) +
                    ",\n\tprefix=" + Utilities.singleQuote(this.prefix) +
                    ",\n\tstepName=" + Utilities.singleQuote(this.stepName) +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\tquiet=" + this.quiet +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help=true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();

    /** Throws if the options cannot produce valid C code. */
    public void validate() {
        if (!Utilities.isLegalCIdentifier(this.ioOptions.stepName))
            throw new CompilationError("Step function name " + Utilities.singleQuote(this.ioOptions.stepName)
                    + " is not a legal C identifier");
        if (this.ioOptions.prefix.isEmpty() || this.ioOptions.prefix.contains("/")
                || this.ioOptions.prefix.contains("\\"))
            throw new CompilationError("Illegal file prefix " + Utilities.singleQuote(this.ioOptions.prefix));
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                "\n}";
    }
}
