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

import org.frontc.cabs.ir.type.CabsDeclType;
import org.frontc.cabs.ir.type.CabsJustBase;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** Common base for the operators applied to a type: sizeof and alignof. */
public abstract class CabsTypeExpression extends CabsExpression {
    public final CabsSpecifier specifier;
    public final CabsDeclType declType;

    protected CabsTypeExpression(CabsSpecifier specifier, CabsDeclType declType) {
        this.specifier = specifier;
        this.declType = declType;
    }

    public abstract CabsTypeExpression with(CabsSpecifier specifier, CabsDeclType declType);

    public abstract String keyword();

    @Override
    public CabsExpression visitChildren(CabsRewriter rewriter) {
        CabsSpecifier specifier = rewriter.rewriteSpecifier(this.specifier);
        CabsDeclType declType = rewriter.rewriteDeclType(this.declType);
        if (specifier == this.specifier && declType == this.declType)
            return this;
        return this.with(specifier, declType);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.keyword()).append("(").append(this.specifier);
        if (!this.declType.is(CabsJustBase.class))
            builder.append(" ");
        this.declType.toString(builder, "");
        return builder.append(")");
    }
}
