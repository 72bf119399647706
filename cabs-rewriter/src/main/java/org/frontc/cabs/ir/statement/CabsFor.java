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

public final class CabsFor extends CabsStatement {
    public final CabsExpression init;
    public final CabsExpression condition;
    public final CabsExpression increment;
    public final CabsStatement body;

    public CabsFor(CabsExpression init, CabsExpression condition, CabsExpression increment,
                   CabsStatement body, SourcePositionRange location) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
    }

    @Override
    public CabsStatement visitChildren(CabsRewriter rewriter) {
        CabsExpression init = rewriter.rewriteExpression(this.init);
        CabsExpression condition = rewriter.rewriteExpression(this.condition);
        CabsExpression increment = rewriter.rewriteExpression(this.increment);
        CabsStatement body = rewriter.rewriteStatementSlot(this.body, this.location);
        if (init == this.init && condition == this.condition &&
                increment == this.increment && body == this.body)
            return this;
        return new CabsFor(init, condition, increment, body, this.location);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("for (")
                .append(this.init)
                .append("; ")
                .append(this.condition)
                .append("; ")
                .append(this.increment)
                .append(") ")
                .append(this.body);
    }
}
