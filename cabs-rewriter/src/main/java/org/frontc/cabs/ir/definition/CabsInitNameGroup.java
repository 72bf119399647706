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

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;
import org.frontc.util.Linq;

/** Several variables sharing one specifier, each with an optional initializer. */
public final class CabsInitNameGroup extends CabsNode {
    public final CabsSpecifier specifier;
    public final ImmutableList<CabsInitName> names;

    public CabsInitNameGroup(CabsSpecifier specifier, ImmutableList<CabsInitName> names) {
        this.specifier = specifier;
        this.names = names;
    }

    public CabsInitNameGroup(CabsSpecifier specifier, CabsInitName... names) {
        this(specifier, ImmutableList.copyOf(names));
    }

    public CabsInitNameGroup visitChildren(CabsRewriter rewriter) {
        CabsSpecifier specifier = rewriter.rewriteSpecifier(this.specifier);
        ImmutableList<CabsInitName> names = Linq.mapNoCopy(this.names, n -> n.visitChildren(rewriter, specifier));
        if (specifier == this.specifier && names == this.names)
            return this;
        return new CabsInitNameGroup(specifier, names);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.specifier);
        if (!this.names.isEmpty())
            builder.append(" ").joinI(", ", this.names);
        return builder;
    }
}
