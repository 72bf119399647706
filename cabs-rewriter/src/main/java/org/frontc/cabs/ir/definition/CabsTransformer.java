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

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.errors.SourcePositionRange;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** A rule rewriting a definition pattern into a list of definitions.
 * The contents are patterns, so they are never visited. */
public final class CabsTransformer extends CabsDefinition {
    public final CabsDefinition pattern;
    public final ImmutableList<CabsDefinition> replacement;

    public CabsTransformer(CabsDefinition pattern, ImmutableList<CabsDefinition> replacement,
                           SourcePositionRange location) {
        super(location);
        this.pattern = pattern;
        this.replacement = replacement;
    }

    @Override
    public CabsDefinition visitChildren(CabsRewriter rewriter) {
        return this;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("@transform {").increase()
                .append(this.pattern)
                .decrease().newline()
                .append("} to {").increase();
        for (CabsDefinition definition: this.replacement)
            builder.append(definition).newline();
        return builder.decrease().append("}");
    }
}
