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
import org.frontc.cabs.ir.definition.CabsSingleName;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;
import org.frontc.util.Linq;

/** A function prototype declarator. */
public final class CabsProto extends CabsDeclType {
    public final CabsDeclType inner;
    public final ImmutableList<CabsSingleName> parameters;
    public final boolean variadic;

    public CabsProto(CabsDeclType inner, ImmutableList<CabsSingleName> parameters, boolean variadic) {
        this.inner = inner;
        this.parameters = parameters;
        this.variadic = variadic;
    }

    /** The inner declarator is visited outside the scope of the parameters. */
    @Override
    public CabsDeclType visitChildren(CabsRewriter rewriter) {
        CabsDeclType inner = rewriter.rewriteDeclType(this.inner);
        ImmutableList<CabsSingleName> parameters = rewriter.inScope(
                () -> Linq.mapNoCopy(this.parameters, p -> p.visitChildren(rewriter)));
        if (inner == this.inner && parameters == this.parameters)
            return this;
        return new CabsProto(inner, parameters, this.variadic);
    }

    @Override
    public IIndentStream toString(IIndentStream builder, String name) {
        this.inner.toString(builder, name);
        builder.append("(").joinI(", ", this.parameters);
        if (this.variadic)
            builder.append(this.parameters.isEmpty() ? "..." : ", ...");
        return builder.append(")");
    }
}
