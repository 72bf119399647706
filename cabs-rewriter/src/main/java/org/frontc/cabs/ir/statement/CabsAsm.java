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

package org.frontc.cabs.ir.statement;

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.errors.SourcePositionRange;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;
import org.frontc.util.Linq;

/** An inline assembly statement.  Only the operand expressions are visited. */
public final class CabsAsm extends CabsStatement {
    public final ImmutableList<String> templates;
    public final boolean isVolatile;
    public final ImmutableList<CabsAsmOperand> inputs;
    public final ImmutableList<CabsAsmOperand> outputs;
    public final ImmutableList<String> clobbers;

    public CabsAsm(ImmutableList<String> templates, boolean isVolatile,
                   ImmutableList<CabsAsmOperand> inputs, ImmutableList<CabsAsmOperand> outputs,
                   ImmutableList<String> clobbers, SourcePositionRange location) {
        super(location);
        this.templates = templates;
        this.isVolatile = isVolatile;
        this.inputs = inputs;
        this.outputs = outputs;
        this.clobbers = clobbers;
    }

    @Override
    public CabsStatement visitChildren(CabsRewriter rewriter) {
        ImmutableList<CabsAsmOperand> inputs = Linq.mapNoCopy(this.inputs, o -> o.visitChildren(rewriter));
        ImmutableList<CabsAsmOperand> outputs = Linq.mapNoCopy(this.outputs, o -> o.visitChildren(rewriter));
        if (inputs == this.inputs && outputs == this.outputs)
            return this;
        return new CabsAsm(this.templates, this.isVolatile, inputs, outputs, this.clobbers, this.location);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("__asm__ ");
        if (this.isVolatile)
            builder.append("__volatile__ ");
        builder.append("(");
        boolean first = true;
        for (String template: this.templates) {
            if (!first)
                builder.append(" ");
            first = false;
            builder.append("\"").append(template).append("\"");
        }
        builder.append(" : ").joinI(", ", this.outputs)
                .append(" : ").joinI(", ", this.inputs)
                .append(" : ");
        first = true;
        for (String clobber: this.clobbers) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append("\"").append(clobber).append("\"");
        }
        return builder.append(");");
    }
}
