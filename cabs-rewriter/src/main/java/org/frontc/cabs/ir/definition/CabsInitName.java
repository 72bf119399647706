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

import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.ir.expression.CabsInitExpression;
import org.frontc.cabs.ir.expression.CabsNoInit;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.cabs.visitors.NameKind;
import org.frontc.util.IIndentStream;

/** A declared variable with its optional initializer. */
public final class CabsInitName extends CabsNode {
    public final CabsName name;
    public final CabsInitExpression init;

    public CabsInitName(CabsName name, CabsInitExpression init) {
        this.name = name;
        this.init = init;
    }

    public CabsInitName(CabsName name) {
        this(name, CabsNoInit.INSTANCE);
    }

    /** @param specifier  Specifier of the enclosing declaration, already visited. */
    public CabsInitName visitChildren(CabsRewriter rewriter, CabsSpecifier specifier) {
        CabsName name = rewriter.rewriteName(NameKind.VARIABLE, specifier, this.name);
        CabsInitExpression init = rewriter.rewriteInitExpression(this.init);
        if (name == this.name && init == this.init)
            return this;
        return new CabsInitName(name, init);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.name);
        if (!this.init.is(CabsNoInit.class))
            builder.append(" = ").append(this.init);
        return builder;
    }
}
