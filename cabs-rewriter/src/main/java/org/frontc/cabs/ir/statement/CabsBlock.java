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
import org.frontc.cabs.ir.CabsAttribute;
import org.frontc.cabs.ir.CabsNode;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.util.IIndentStream;

/** A compound statement: local labels, attributes, local definitions and statements. */
public final class CabsBlock extends CabsNode {
    /** Labels declared with __label__. */
    public final ImmutableList<String> labels;
    public final ImmutableList<CabsAttribute> attributes;
    public final ImmutableList<CabsDefinition> definitions;
    public final ImmutableList<CabsStatement> statements;

    public CabsBlock(ImmutableList<String> labels, ImmutableList<CabsAttribute> attributes,
                     ImmutableList<CabsDefinition> definitions, ImmutableList<CabsStatement> statements) {
        this.labels = labels;
        this.attributes = attributes;
        this.definitions = definitions;
        this.statements = statements;
    }

    /** A block holding only statements. */
    public static CabsBlock of(ImmutableList<CabsStatement> statements) {
        return new CabsBlock(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), statements);
    }

    public static CabsBlock of(CabsStatement... statements) {
        return of(ImmutableList.copyOf(statements));
    }

    /** All the contents of the block are visited in a new scope; labels are kept. */
    public CabsBlock visitChildren(CabsRewriter rewriter) {
        return rewriter.inScope(() -> {
            ImmutableList<CabsAttribute> attributes = rewriter.rewriteAttributes(this.attributes);
            ImmutableList<CabsDefinition> definitions = rewriter.rewriteDefinitions(this.definitions);
            ImmutableList<CabsStatement> statements = rewriter.rewriteStatements(this.statements);
            if (attributes == this.attributes && definitions == this.definitions && statements == this.statements)
                return this;
            return new CabsBlock(this.labels, attributes, definitions, statements);
        });
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("{").increase();
        if (!this.labels.isEmpty())
            builder.append("__label__ ").joinS(", ", this.labels).append(";").newline();
        for (CabsAttribute attribute: this.attributes)
            builder.append(attribute).append(";").newline();
        for (CabsDefinition definition: this.definitions)
            builder.append(definition).newline();
        for (CabsStatement statement: this.statements)
            builder.append(statement).newline();
        return builder.decrease().append("}");
    }
}
