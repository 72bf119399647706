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
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;
import org.frontc.util.Linq;

import javax.annotation.Nullable;

public final class CabsEnumType extends CabsTypeSpecifier {
    public final String name;
    /** Null when the enum is only referenced. */
    @Nullable
    public final ImmutableList<CabsEnumItem> items;

    public CabsEnumType(String name, @Nullable ImmutableList<CabsEnumItem> items) {
        this.name = name;
        this.items = items;
    }

    /** The enumerators are visited in a new scope. */
    @Override
    public CabsTypeSpecifier visitChildren(CabsRewriter rewriter) {
        if (this.items == null)
            return this;
        ImmutableList<CabsEnumItem> items = rewriter.inScope(
                () -> Linq.mapNoCopy(this.items, i -> i.visitChildren(rewriter)));
        if (items == this.items)
            return this;
        return new CabsEnumType(this.name, items);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("enum");
        if (!this.name.isEmpty())
            builder.append(" ").append(this.name);
        if (this.items != null)
            builder.append(" { ").joinI(", ", this.items).append(" }");
        return builder;
    }
}
