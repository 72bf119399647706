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

/** Common base for struct and union types. */
public abstract class CabsAggregateType extends CabsTypeSpecifier {
    public final String name;
    /** Null when the type is only referenced, e.g., "struct S *p". */
    @Nullable
    public final ImmutableList<CabsFieldGroup> fields;

    protected CabsAggregateType(String name, @Nullable ImmutableList<CabsFieldGroup> fields) {
        this.name = name;
        this.fields = fields;
    }

    /** Create a type of the same kind with different fields. */
    public abstract CabsAggregateType withFields(ImmutableList<CabsFieldGroup> fields);

    public abstract String keyword();

    @Override
    public CabsTypeSpecifier visitChildren(CabsRewriter rewriter) {
        ImmutableList<CabsFieldGroup> fields = Linq.mapNoCopyOptional(this.fields, g -> g.visitChildren(rewriter));
        if (fields == this.fields)
            return this;
        return this.withFields(this.checkNull(fields));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.keyword());
        if (!this.name.isEmpty())
            builder.append(" ").append(this.name);
        if (this.fields != null) {
            builder.append(" {").increase();
            for (CabsFieldGroup group: this.fields)
                builder.append(group).newline();
            builder.decrease().append("}");
        }
        return builder;
    }
}
