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

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes text one nesting level at a time.  Every line is prefixed with
 * {@code depth * amount} spaces when its first character is written, so
 * empty lines carry no trailing whitespace.
 */
public class IndentStream implements IIndentStream {
    private final Appendable stream;
    private final String unit;
    private int depth = 0;
    /** The next character starts a new line. */
    private boolean atLineStart = false;

    public IndentStream(Appendable stream, int amount) {
        Utilities.enforce(amount > 0, "Indentation must be positive");
        this.stream = stream;
        this.unit = " ".repeat(amount);
    }

    public IndentStream(Appendable stream) {
        this(stream, 4);
    }

    public Appendable getOutputStream() {
        return this.stream;
    }

    void write(CharSequence text) {
        try {
            this.stream.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    void startLine() {
        if (!this.atLineStart)
            return;
        this.atLineStart = false;
        for (int i = 0; i < this.depth; i++)
            this.write(this.unit);
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            this.write("\n");
            this.atLineStart = true;
            return this;
        }
        return this.appendFast(String.valueOf(c));
    }

    @Override
    public IIndentStream appendFast(String s) {
        if (s.isEmpty())
            return this;
        this.startLine();
        this.write(s);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.depth++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.depth > 0, "Negative indent");
        this.depth--;
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
