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
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** A GCC attribute: a name and a list of argument expressions. */
public final class CabsAttribute extends CabsNode {
    public final String name;
    public final ImmutableList<CabsExpression> arguments;

    public CabsAttribute(String name, ImmutableList<CabsExpression> arguments) {
        this.name = name;
        this.arguments = arguments;
    }

    public CabsAttribute(String name, CabsExpression... arguments) {
        this(name, ImmutableList.copyOf(arguments));
    }

    public CabsAttribute visitChildren(CabsRewriter rewriter) {
        ImmutableList<CabsExpression> arguments = rewriter.rewriteExpressions(this.arguments);
        if (arguments == this.arguments)
            return this;
        return new CabsAttribute(this.name, arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("__attribute__((").append(this.name);
        if (!this.arguments.isEmpty())
            builder.append("(").joinI(", ", this.arguments).append(")");
        return builder.append("))");
    }
}
