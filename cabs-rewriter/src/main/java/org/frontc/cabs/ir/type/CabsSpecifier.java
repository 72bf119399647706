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
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;
import org.frontc.util.Linq;

/** The ordered list of elements preceding the declared names, e.g., "static const int". */
public final class CabsSpecifier extends CabsNode {
    public final ImmutableList<CabsSpecElement> elements;

    public CabsSpecifier(ImmutableList<CabsSpecElement> elements) {
        this.elements = elements;
    }

    public CabsSpecifier(CabsSpecElement... elements) {
        this(ImmutableList.copyOf(elements));
    }

    /** A specifier made of just a type. */
    public static CabsSpecifier of(CabsTypeSpecifier type) {
        return new CabsSpecifier(new CabsSpecType(type));
    }

    public CabsSpecifier visitChildren(CabsRewriter rewriter) {
        ImmutableList<CabsSpecElement> elements = Linq.mapNoCopy(this.elements, e -> e.visitChildren(rewriter));
        if (elements == this.elements)
            return this;
        return new CabsSpecifier(elements);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.joinI(" ", this.elements);
    }
}
