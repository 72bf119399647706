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

package org.frontc.cabs.ir.statement;

import org.frontc.cabs.errors.SourcePositionRange;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

public final class CabsIf extends CabsStatement {
    public final CabsExpression condition;
    public final CabsStatement positive;
    /** A {@link CabsNop} when there is no else branch. */
    public final CabsStatement negative;

    public CabsIf(CabsExpression condition, CabsStatement positive, CabsStatement negative,
                  SourcePositionRange location) {
        super(location);
        this.condition = condition;
        this.positive = positive;
        this.negative = negative;
    }

    @Override
    public CabsStatement visitChildren(CabsRewriter rewriter) {
        CabsExpression condition = rewriter.rewriteExpression(this.condition);
        CabsStatement positive = rewriter.rewriteStatementSlot(this.positive, this.location);
        CabsStatement negative = rewriter.rewriteStatementSlot(this.negative, this.location);
        if (condition == this.condition && positive == this.positive && negative == this.negative)
            return this;
        return new CabsIf(condition, positive, negative, this.location);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("if (")
                .append(this.condition)
                .append(") ")
                .append(this.positive);
        if (!this.negative.is(CabsNop.class))
            builder.append(" else ").append(this.negative);
        return builder;
    }
}
