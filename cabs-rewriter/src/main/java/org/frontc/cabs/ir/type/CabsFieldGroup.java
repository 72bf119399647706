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

/** Fields of a struct or union declared with the same specifier, e.g., "int a, *b;". */
public final class CabsFieldGroup extends CabsNode {
    public final CabsSpecifier specifier;
    public final ImmutableList<CabsField> fields;

    public CabsFieldGroup(CabsSpecifier specifier, ImmutableList<CabsField> fields) {
        this.specifier = specifier;
        this.fields = fields;
    }

    public CabsFieldGroup(CabsSpecifier specifier, CabsField... fields) {
        this(specifier, ImmutableList.copyOf(fields));
    }

    public CabsFieldGroup visitChildren(CabsRewriter rewriter) {
        CabsSpecifier specifier = rewriter.rewriteSpecifier(this.specifier);
        ImmutableList<CabsField> fields = Linq.mapNoCopy(this.fields, f -> f.visitChildren(rewriter, specifier));
        if (specifier == this.specifier && fields == this.fields)
            return this;
        return new CabsFieldGroup(specifier, fields);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.specifier)
                .append(" ")
                .joinI(", ", this.fields)
                .append(";");
    }
}
