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

/** A visitor which does nothing to the tree.
 * Passes extend this class and override only the hooks they need. */
@SuppressWarnings("unused")
public class NopCabsVisitor implements CabsVisitor {
    @Override
    public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<CabsInitExpression> visitInitExpression(CabsInitExpression init) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<List<CabsStatement>> visitStatement(CabsStatement statement) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<CabsBlock> visitBlock(CabsBlock block) {
        return VisitAction.doChildren();
    }

    @Override
    public String visitVariable(String name) {
        return name;
    }

    @Override
    public VisitAction<List<CabsDefinition>> visitDefinition(CabsDefinition definition) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<CabsTypeSpecifier> visitTypeSpecifier(CabsTypeSpecifier typeSpecifier) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<CabsDeclType> visitDeclType(CabsDeclType declType) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<CabsSpecifier> visitSpecifier(CabsSpecifier specifier) {
        return VisitAction.doChildren();
    }

    @Override
    public VisitAction<List<CabsAttribute>> visitAttribute(CabsAttribute attribute) {
        return VisitAction.doChildren();
    }

    @Override
    public void enterScope() {}

    @Override
    public void exitScope() {}

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
