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

import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** [low ... high] */
public final class CabsAtIndexRangeInit extends CabsInitWhat {
    public final CabsExpression low;
    public final CabsExpression high;

    public CabsAtIndexRangeInit(CabsExpression low, CabsExpression high) {
        this.low = low;
        this.high = high;
    }

    @Override
    public CabsInitWhat visitChildren(CabsRewriter rewriter) {
        CabsExpression low = rewriter.rewriteExpression(this.low);
        CabsExpression high = rewriter.rewriteExpression(this.high);
        if (low == this.low && high == this.high)
            return this;
        return new CabsAtIndexRangeInit(low, high);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("[")
                .append(this.low)
                .append(" ... ")
                .append(this.high)
                .append("]");
    }
}
