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
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** A rule rewriting an expression pattern; never visited. */
public final class CabsExprTransformer extends CabsDefinition {
    public final CabsExpression pattern;
    public final CabsExpression replacement;

    public CabsExprTransformer(CabsExpression pattern, CabsExpression replacement, SourcePositionRange location) {
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
        return builder.append("@transformExpr { ")
                .append(this.pattern)
                .append(" } to { ")
                .append(this.replacement)
                .append(" }");
    }
}
