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

import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.cabs.visitors.NameKind;
import org.frontc.util.IIndentStream;

import javax.annotation.Nullable;

/** One field of a struct or union, with an optional bit width. */
public final class CabsField extends CabsNode {
    public final CabsName name;
    @Nullable
    public final CabsExpression width;

    public CabsField(CabsName name, @Nullable CabsExpression width) {
        this.name = name;
        this.width = width;
    }

    public CabsField(CabsName name) {
        this(name, null);
    }

    /** @param specifier  The specifier of the enclosing field group, already visited. */
    public CabsField visitChildren(CabsRewriter rewriter, CabsSpecifier specifier) {
        CabsName name = rewriter.rewriteName(NameKind.FIELD, specifier, this.name);
        CabsExpression width = this.width == null ? null : rewriter.rewriteExpression(this.width);
        if (name == this.name && width == this.width)
            return this;
        return new CabsField(name, width);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.name);
        if (this.width != null)
            builder.append(" : ").append(this.width);
        return builder;
    }
}
