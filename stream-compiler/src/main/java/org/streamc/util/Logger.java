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

package org.streamc.util;

import org.streamc.streamCompiler.compiler.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;

/**
 * Debug logging, enabled separately for each class that implements {@link IWritesLogs}.
 * A message is written when the level of its class is at least the level of the message.
 * Output goes to an {@link IndentStream}, so nested structures print as indented blocks.
 */
public class Logger {
    /** Packages searched for the classes named in {@link #setLoggingLevel(String, int)}. */
    static final String[] PACKAGES = new String[] {
            "org.streamc.streamCompiler.compiler",
            "org.streamc.streamCompiler.compiler.visitors.inner",
            "org.streamc.streamCompiler.compiler.backend",
            "org.streamc.streamCompiler.compiler.backend.c",
            "org.streamc.simulator",
    };

    /** There is only one instance of the logger for the whole program. */
    public static final Logger INSTANCE = new Logger();

    /** Logging level of each class, by simple name. */
    private final Map<String, Integer> levels;
    private IndentStream debugStream;
    private final IIndentStream noStream;

    private Logger() {
        this.levels = new HashMap<>();
        this.debugStream = new IndentStream(System.err);
        this.noStream = new NullIndentStream();
    }

    /** The stream for a message of the given level written by 'module';
     * a stream discarding everything if the level of the module is lower. */
    public IIndentStream belowLevel(IWritesLogs module, int level) {
        if (this.getLoggingLevel(module) >= level)
            return this.debugStream;
        return this.noStream;
    }

    public int getLoggingLevel(IWritesLogs module) {
        return this.levels.getOrDefault(module.getClassName(), 0);
    }

    Class<?> locateClass(String className) {
        for (String pack: PACKAGES) {
            try {
                return Class.forName(pack + "." + className);
            } catch (ClassNotFoundException e) {
                // try the next package
            }
        }
        throw new CompilationError("Class " + className + " not found for setting up logging");
    }

    /** Set the logging level of a class that writes logs.
     * @param className  Simple name of the class.
     * @return The previous level of the class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        Class<?> clazz = this.locateClass(className);
        if (!IWritesLogs.class.isAssignableFrom(clazz))
            throw new CompilationError("Class " + className + " does not write logs");
        Integer previous = this.levels.put(className, level);
        return previous == null ? 0 : previous;
    }

    /** Send the log to another destination; indentation starts again from zero.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable destination) {
        Appendable previous = this.debugStream.getOutputStream();
        this.debugStream = new IndentStream(destination);
        return previous;
    }
}
