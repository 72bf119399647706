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

package org.frontc.cabs.visitors;

import org.frontc.cabs.ir.CabsAttribute;
import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsInitExpression;
import org.frontc.cabs.ir.statement.CabsBlock;
import org.frontc.cabs.ir.statement.CabsStatement;
import org.frontc.cabs.ir.type.CabsDeclType;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.ir.type.CabsTypeSpecifier;

import java.util.List;

/**
 * The interface implemented by every pass over the Cabs tree.
 * All hooks are invoked in preorder, before the children of the node are visited;
 * use {@link VisitAction#changeDoChildrenPost} to act after the children.
 * {@link NopCabsVisitor} implements all hooks and leaves the tree unchanged. */
public interface CabsVisitor {
    VisitAction<CabsExpression> visitExpression(CabsExpression expression);

    VisitAction<CabsInitExpression> visitInitExpression(CabsInitExpression init);

    /** Statements can be replaced by any number of statements. */
    VisitAction<List<CabsStatement>> visitStatement(CabsStatement statement);

    VisitAction<CabsBlock> visitBlock(CabsBlock block);

    /** Invoked for each use of a variable; returns the (possibly new) name. */
    String visitVariable(String name);

    /** Definitions can be replaced by any number of definitions. */
    VisitAction<List<CabsDefinition>> visitDefinition(CabsDefinition definition);

    VisitAction<CabsTypeSpecifier> visitTypeSpecifier(CabsTypeSpecifier typeSpecifier);

    VisitAction<CabsDeclType> visitDeclType(CabsDeclType declType);

    /**
     * Invoked for each declared name.
     * @param kind       What the name declares.
     * @param specifier  The specifier of the enclosing declaration, already visited.
     * @param name       Name visited. */
    VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name);

    VisitAction<CabsSpecifier> visitSpecifier(CabsSpecifier specifier);

    /** Attributes can be replaced by any number of attributes,
     * except when they appear as a specifier element. */
    VisitAction<List<CabsAttribute>> visitAttribute(CabsAttribute attribute);

    /** Called when entering a block, a prototype parameter list, or an enum body. */
    void enterScope();

    /** Called when leaving a construct which called {@link #enterScope}. */
    void exitScope();
}
