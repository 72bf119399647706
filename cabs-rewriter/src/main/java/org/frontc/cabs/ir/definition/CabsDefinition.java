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

package org.frontc.cabs.ir.definition;

import org.frontc.cabs.errors.SourcePositionRange;
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;
import org.frontc.util.IndentStreamBuilder;

import java.util.List;

/** A global or block-local definition. */
public abstract class CabsDefinition extends CabsNode {
    public final SourcePositionRange location;

    protected CabsDefinition(SourcePositionRange location) {
        this.location = location;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.location;
    }

    public abstract CabsDefinition visitChildren(CabsRewriter rewriter);

    /** Print a translation unit, one definition per line. */
    public static String toString(List<CabsDefinition> file) {
        IIndentStream builder = new IndentStreamBuilder();
        for (CabsDefinition definition: file)
            builder.append(definition).newline();
        return builder.toString();
    }
}
