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

import javax.annotation.Nullable;

public abstract class BaseCompilerException
        extends RuntimeException
        implements IHasSourcePositionRange {
    public final SourcePositionRange range;

    protected BaseCompilerException(String message, SourcePositionRange range, @Nullable Throwable throwable) {
        super(message, throwable);
        this.range = range;
    }

    protected BaseCompilerException(String message, SourcePositionRange range) {
        this(message, range, null);
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    public abstract String getErrorKind();

    /** The message prefixed by the error kind and, if known, the position. */
    public String getFullMessage() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.getErrorKind());
        SourcePositionRange range = this.getPositionRange();
        if (range.isValid())
            builder.append(" at ").append(range);
        builder.append(": ").append(this.getMessage());
        return builder.toString();
    }
}
