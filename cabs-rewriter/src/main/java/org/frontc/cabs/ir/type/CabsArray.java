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

package org.frontc.cabs.ir.type;

import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsNothing;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

public final class CabsArray extends CabsDeclType {
    public final CabsDeclType inner;
    /** {@link CabsNothing} for arrays without a size. */
    public final CabsExpression size;

    public CabsArray(CabsDeclType inner, CabsExpression size) {
        this.inner = inner;
        this.size = size;
    }

    @Override
    public CabsDeclType visitChildren(CabsRewriter rewriter) {
        CabsDeclType inner = rewriter.rewriteDeclType(this.inner);
        CabsExpression size = rewriter.rewriteExpression(this.size);
        if (inner == this.inner && size == this.size)
            return this;
        return new CabsArray(inner, size);
    }

    @Override
    public IIndentStream toString(IIndentStream builder, String name) {
        this.inner.toString(builder, name);
        return builder.append("[").append(this.size).append("]");
    }
}
