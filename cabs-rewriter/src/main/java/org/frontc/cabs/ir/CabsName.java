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

package org.frontc.cabs.ir;

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.ir.type.CabsDeclType;
import org.frontc.cabs.ir.type.CabsJustBase;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** A declared name: the identifier, the declarator applied to the base type,
 * and the attributes following the declarator. */
public final class CabsName extends CabsNode {
    public final String name;
    public final CabsDeclType declType;
    public final ImmutableList<CabsAttribute> attributes;

    public CabsName(String name, CabsDeclType declType, ImmutableList<CabsAttribute> attributes) {
        this.name = name;
        this.declType = declType;
        this.attributes = attributes;
    }

    /** A name declared with the base type itself, e.g., the x in "int x". */
    public CabsName(String name) {
        this(name, CabsJustBase.INSTANCE, ImmutableList.of());
    }

    public CabsName withName(String name) {
        if (name.equals(this.name))
            return this;
        return new CabsName(name, this.declType, this.attributes);
    }

    /** Visits the declarator, then the arguments of the attributes;
     * the attribute hook is not invoked for these attributes. */
    public CabsName visitChildren(CabsRewriter rewriter) {
        CabsDeclType declType = rewriter.rewriteDeclType(this.declType);
        ImmutableList<CabsAttribute> attributes = rewriter.rewriteAttributeArguments(this.attributes);
        if (declType == this.declType && attributes == this.attributes)
            return this;
        return new CabsName(this.name, declType, attributes);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        this.declType.toString(builder, this.name);
        for (CabsAttribute attribute: this.attributes)
            builder.append(" ").append(attribute);
        return builder;
    }
}
