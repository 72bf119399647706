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

package org.frontc.cabs.errors;

/** A range of characters in a source file.
 * Statements and definitions of the tree carry one of these. */
public class SourcePositionRange implements IHasSourcePositionRange {
    /** Used for nodes which do not come from the source, e.g., synthesized blocks. */
    public static final SourcePositionRange INVALID =
            new SourcePositionRange("", SourcePosition.INVALID, SourcePosition.INVALID);

    public final String file;
    public final SourcePosition start;
    public final SourcePosition end;

    public SourcePositionRange(String file, SourcePosition start, SourcePosition end) {
        this.file = file;
        this.start = start;
        this.end = end;
    }

    /** A range covering a single line. */
    public static SourcePositionRange line(String file, int line) {
        return new SourcePositionRange(file, new SourcePosition(line, 1), new SourcePosition(line, 1));
    }

    public boolean isValid() {
        return this.start.isValid() && this.end.isValid();
    }

    @Override
    public String toString() {
        if (this.file.isEmpty())
            return this.start + "--" + this.end;
        return this.file + ":" + this.start + "--" + this.end;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;

        SourcePositionRange that = (SourcePositionRange) o;
        return this.file.equals(that.file) && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        int result = this.file.hashCode();
        result = 31 * result + start.hashCode();
        result = 31 * result + end.hashCode();
        return result;
    }
}
