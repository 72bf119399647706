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
import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.cabs.visitors.NameKind;
import org.frontc.util.IIndentStream;
import org.frontc.util.Linq;

/** Several names sharing one specifier. */
public final class CabsNameGroup extends CabsNode {
    public final CabsSpecifier specifier;
    public final ImmutableList<CabsName> names;

    public CabsNameGroup(CabsSpecifier specifier, ImmutableList<CabsName> names) {
        this.specifier = specifier;
        this.names = names;
    }

    public CabsNameGroup(CabsSpecifier specifier, CabsName... names) {
        this(specifier, ImmutableList.copyOf(names));
    }

    /** @param kind  What the names in the group declare. */
    public CabsNameGroup visitChildren(CabsRewriter rewriter, NameKind kind) {
        CabsSpecifier specifier = rewriter.rewriteSpecifier(this.specifier);
        ImmutableList<CabsName> names = Linq.mapNoCopy(this.names, n -> rewriter.rewriteName(kind, specifier, n));
        if (specifier == this.specifier && names == this.names)
            return this;
        return new CabsNameGroup(specifier, names);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.specifier)
                .append(" ")
                .joinI(", ", this.names);
    }
}
