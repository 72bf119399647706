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

/** A parenthesized declarator, with attributes before and after the inner declarator. */
public final class CabsParenType extends CabsDeclType {
    public final ImmutableList<CabsAttribute> preAttributes;
    public final CabsDeclType inner;
    public final ImmutableList<CabsAttribute> postAttributes;

    public CabsParenType(ImmutableList<CabsAttribute> preAttributes, CabsDeclType inner,
                         ImmutableList<CabsAttribute> postAttributes) {
        this.preAttributes = preAttributes;
        this.inner = inner;
        this.postAttributes = postAttributes;
    }

    public CabsParenType(CabsDeclType inner) {
        this(ImmutableList.of(), inner, ImmutableList.of());
    }

    @Override
    public CabsDeclType visitChildren(CabsRewriter rewriter) {
        ImmutableList<CabsAttribute> pre = rewriter.rewriteAttributes(this.preAttributes);
        CabsDeclType inner = rewriter.rewriteDeclType(this.inner);
        ImmutableList<CabsAttribute> post = rewriter.rewriteAttributes(this.postAttributes);
        if (pre == this.preAttributes && inner == this.inner && post == this.postAttributes)
            return this;
        return new CabsParenType(pre, inner, post);
    }

    @Override
    public IIndentStream toString(IIndentStream builder, String name) {
        builder.append("(");
        for (CabsAttribute attribute: this.preAttributes)
            builder.append(attribute).append(" ");
        this.inner.toString(builder, name);
        for (CabsAttribute attribute: this.postAttributes)
            builder.append(" ").append(attribute);
        return builder.append(")");
    }
}
