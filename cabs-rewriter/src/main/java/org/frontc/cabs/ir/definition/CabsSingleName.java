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
import org.frontc.cabs.ir.type.CabsJustBase;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.cabs.visitors.NameKind;
import org.frontc.util.IIndentStream;

/** A single declared name with its own specifier, e.g., a function parameter. */
public final class CabsSingleName extends CabsNode {
    public final CabsSpecifier specifier;
    public final CabsName name;

    public CabsSingleName(CabsSpecifier specifier, CabsName name) {
        this.specifier = specifier;
        this.name = name;
    }

    public CabsSingleName visitChildren(CabsRewriter rewriter) {
        CabsSpecifier specifier = rewriter.rewriteSpecifier(this.specifier);
        CabsName name = rewriter.rewriteName(NameKind.VARIABLE, specifier, this.name);
        if (specifier == this.specifier && name == this.name)
            return this;
        return new CabsSingleName(specifier, name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.specifier);
        if (!this.name.name.isEmpty() || !this.name.declType.is(CabsJustBase.class))
            builder.append(" ");
        return builder.append(this.name);
    }
}
