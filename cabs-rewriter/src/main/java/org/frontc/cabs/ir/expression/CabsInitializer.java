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

package org.frontc.cabs.ir.expression;

import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** One element of a compound initializer: a designator and the value it initializes. */
public final class CabsInitializer extends CabsNode {
    public final CabsInitWhat what;
    public final CabsInitExpression init;

    public CabsInitializer(CabsInitWhat what, CabsInitExpression init) {
        this.what = what;
        this.init = init;
    }

    public CabsInitializer(CabsInitExpression init) {
        this(CabsNextInit.INSTANCE, init);
    }

    public CabsInitializer visitChildren(CabsRewriter rewriter) {
        CabsInitWhat what = this.what.visitChildren(rewriter);
        CabsInitExpression init = rewriter.rewriteInitExpression(this.init);
        if (what == this.what && init == this.init)
            return this;
        return new CabsInitializer(what, init);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.what);
        if (!this.what.is(CabsNextInit.class))
            builder.append(" = ");
        return builder.append(this.init);
    }
}
