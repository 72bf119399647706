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

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.ir.CabsAttribute;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

public final class CabsPointer extends CabsDeclType {
    /** Qualifiers of the pointer, e.g., const in "* const p". */
    public final ImmutableList<CabsAttribute> qualifiers;
    public final CabsDeclType inner;

    public CabsPointer(ImmutableList<CabsAttribute> qualifiers, CabsDeclType inner) {
        this.qualifiers = qualifiers;
        this.inner = inner;
    }

    public CabsPointer(CabsDeclType inner) {
        this(ImmutableList.of(), inner);
    }

    /** Only the qualifier arguments are visited, not the qualifiers themselves. */
    @Override
    public CabsDeclType visitChildren(CabsRewriter rewriter) {
        ImmutableList<CabsAttribute> qualifiers = rewriter.rewriteAttributeArguments(this.qualifiers);
        CabsDeclType inner = rewriter.rewriteDeclType(this.inner);
        if (qualifiers == this.qualifiers && inner == this.inner)
            return this;
        return new CabsPointer(qualifiers, inner);
    }

    @Override
    public IIndentStream toString(IIndentStream builder, String name) {
        builder.append("*");
        for (CabsAttribute qualifier: this.qualifiers)
            builder.append(qualifier).append(" ");
        return this.inner.toString(builder, name);
    }
}
