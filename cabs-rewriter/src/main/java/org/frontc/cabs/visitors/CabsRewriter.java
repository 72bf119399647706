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

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.errors.InternalCompilerError;
import org.frontc.cabs.errors.SourcePositionRange;
import org.frontc.cabs.ir.CabsAttribute;
import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.ICabsNode;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsInitExpression;
import org.frontc.cabs.ir.statement.CabsBlock;
import org.frontc.cabs.ir.statement.CabsBlockStatement;
import org.frontc.cabs.ir.statement.CabsStatement;
import org.frontc.cabs.ir.type.CabsDeclType;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.ir.type.CabsTypeSpecifier;
import org.frontc.util.IWritesLogs;
import org.frontc.util.Linq;
import org.frontc.util.Logger;
import org.frontc.util.Utilities;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Applies a {@link CabsVisitor} to a Cabs tree.
 * For each node the visitor hook is asked for a {@link VisitAction};
 * depending on the action the children of the node are visited
 * using the node's own {@code visitChildren} rule.
 * A node is rebuilt only if one of its children changes (compared by reference),
 * so rewriting a tree where nothing changes returns the very same tree.
 */
public final class CabsRewriter implements ICabsTransform, IWritesLogs {
    public final CabsVisitor visitor;

    public CabsRewriter(CabsVisitor visitor) {
        this.visitor = visitor;
    }

    /** Visit a translation unit with the specified visitor. */
    public static ImmutableList<CabsDefinition> visitFile(CabsVisitor visitor, ImmutableList<CabsDefinition> file) {
        return new CabsRewriter(visitor).apply(file);
    }

    @Override
    public ImmutableList<CabsDefinition> apply(ImmutableList<CabsDefinition> file) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" on ")
                .append(file.size())
                .append(" definitions")
                .newline();
        ImmutableList<CabsDefinition> result = Linq.mapNoCopyList(file, this::rewriteDefinition);
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Finished ")
                .appendSupplier(this::toString)
                .append(result == file ? ": unchanged" : ": changed")
                .newline();
        return result;
    }

    ////////////////////// Dispatch

    void log(VisitAction<?> action, Object node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .appendSupplier(this.visitor::toString)
                .append(" ")
                .append(action.toString())
                .append(" ")
                .appendSupplier(node::toString)
                .newline();
        if (action.changes()) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .appendSupplier(this.visitor::toString)
                    .append(": ")
                    .appendSupplier(node::toString)
                    .append(" -> ")
                    .appendSupplier(() -> action.getNode().toString())
                    .newline();
        }
    }

    /**
     * Visit a node which always produces exactly one node.
     * @param start     Visitor hook for the node kind.
     * @param children  Rule which visits the children and rebuilds the node.
     * @param node      Node to visit. */
    public <T> T doVisit(Function<T, VisitAction<T>> start, UnaryOperator<T> children, T node) {
        VisitAction<T> action = start.apply(node);
        this.log(action, node);
        switch (action.kind) {
            case SKIP_CHILDREN:
                return node;
            case CHANGE_TO:
                return action.getNode();
            case DO_CHILDREN:
            case CHANGE_DO_CHILDREN_POST:
            default: {
                T pre = action.nodeToVisit(node);
                T post = children.apply(pre);
                T result = action.finish(post);
                if (result == null)
                    throw new InternalCompilerError(this.visitor + " post function returned null for " + node);
                return result;
            }
        }
    }

    /**
     * Visit a node which can be replaced by any number of nodes.
     * @param start     Visitor hook for the node kind.
     * @param children  Rule which visits the children of one node and rebuilds it.
     * @param node      Node to visit. */
    public <T> ImmutableList<T> doVisitList(
            Function<T, VisitAction<List<T>>> start, UnaryOperator<T> children, T node) {
        VisitAction<List<T>> action = start.apply(node);
        this.log(action, node);
        switch (action.kind) {
            case SKIP_CHILDREN:
                return ImmutableList.of(node);
            case CHANGE_TO:
                return ImmutableList.copyOf(action.getNode());
            case DO_CHILDREN:
            case CHANGE_DO_CHILDREN_POST:
            default: {
                ImmutableList<T> pre = ImmutableList.copyOf(action.nodeToVisit(ImmutableList.of(node)));
                ImmutableList<T> post = Linq.mapNoCopy(pre, children);
                List<T> result = action.finish(post);
                if (result == null)
                    throw new InternalCompilerError(this.visitor + " post function returned null for " + node);
                return ImmutableList.copyOf(result);
            }
        }
    }

    /** Run some code between an enterScope and an exitScope call of the visitor.
     * The scope is exited even if the code throws. */
    public <T> T inScope(Supplier<T> body) {
        this.visitor.enterScope();
        try {
            return body.get();
        } finally {
            this.visitor.exitScope();
        }
    }

    ////////////////////// Entry points for each node kind

    public CabsExpression rewriteExpression(CabsExpression expression) {
        return this.doVisit(this.visitor::visitExpression, e -> e.visitChildren(this), expression);
    }

    public ImmutableList<CabsExpression> rewriteExpressions(ImmutableList<CabsExpression> expressions) {
        return Linq.mapNoCopy(expressions, this::rewriteExpression);
    }

    public CabsInitExpression rewriteInitExpression(CabsInitExpression init) {
        return this.doVisit(this.visitor::visitInitExpression, i -> i.visitChildren(this), init);
    }

    public ImmutableList<CabsStatement> rewriteStatement(CabsStatement statement) {
        return this.doVisitList(this.visitor::visitStatement, s -> s.visitChildren(this), statement);
    }

    public ImmutableList<CabsStatement> rewriteStatements(ImmutableList<CabsStatement> statements) {
        return Linq.mapNoCopyList(statements, this::rewriteStatement);
    }

    /**
     * Visit a statement that sits in a position where the grammar allows only one statement,
     * e.g., the branch of an if.  If the statement is rewritten into several statements
     * (or none) the result is wrapped into a new block.
     * @param statement  Statement to visit.
     * @param location   Location for the new block, if one is created. */
    public CabsStatement rewriteStatementSlot(CabsStatement statement, SourcePositionRange location) {
        ImmutableList<CabsStatement> result = this.rewriteStatement(statement);
        if (result.size() == 1)
            return result.get(0);
        return new CabsBlockStatement(CabsBlock.of(result), location);
    }

    public CabsBlock rewriteBlock(CabsBlock block) {
        return this.doVisit(this.visitor::visitBlock, b -> b.visitChildren(this), block);
    }

    public String rewriteVariable(String name) {
        String result = this.visitor.visitVariable(name);
        Utilities.enforce(result != null, this.visitor + " returned a null name for " + name);
        return result;
    }

    public ImmutableList<CabsDefinition> rewriteDefinition(CabsDefinition definition) {
        return this.doVisitList(this.visitor::visitDefinition, d -> d.visitChildren(this), definition);
    }

    public ImmutableList<CabsDefinition> rewriteDefinitions(ImmutableList<CabsDefinition> definitions) {
        return Linq.mapNoCopyList(definitions, this::rewriteDefinition);
    }

    public CabsTypeSpecifier rewriteTypeSpecifier(CabsTypeSpecifier typeSpecifier) {
        return this.doVisit(this.visitor::visitTypeSpecifier, t -> t.visitChildren(this), typeSpecifier);
    }

    public CabsDeclType rewriteDeclType(CabsDeclType declType) {
        return this.doVisit(this.visitor::visitDeclType, d -> d.visitChildren(this), declType);
    }

    /**
     * Visit a declared name.
     * @param kind       What the name declares.
     * @param specifier  Specifier of the declaration, already visited. */
    public CabsName rewriteName(NameKind kind, CabsSpecifier specifier, CabsName name) {
        return this.doVisit(n -> this.visitor.visitName(kind, specifier, n), n -> n.visitChildren(this), name);
    }

    public CabsSpecifier rewriteSpecifier(CabsSpecifier specifier) {
        return this.doVisit(this.visitor::visitSpecifier, s -> s.visitChildren(this), specifier);
    }

    public ImmutableList<CabsAttribute> rewriteAttribute(CabsAttribute attribute) {
        return this.doVisitList(this.visitor::visitAttribute, a -> a.visitChildren(this), attribute);
    }

    /** Visit a list of attributes through the attribute hook; attributes can be removed or added. */
    public ImmutableList<CabsAttribute> rewriteAttributes(ImmutableList<CabsAttribute> attributes) {
        return Linq.mapNoCopyList(attributes, this::rewriteAttribute);
    }

    /** Visit only the arguments of each attribute; the attribute hook is not invoked. */
    public ImmutableList<CabsAttribute> rewriteAttributeArguments(ImmutableList<CabsAttribute> attributes) {
        return Linq.mapNoCopy(attributes, a -> a.visitChildren(this));
    }

    /**
     * Visit an attribute which sits in a position that holds exactly one attribute.
     * @param attribute  Attribute to visit.
     * @param context    Node holding the attribute; used for error reporting.
     * @throws InternalCompilerError if the visitor does not produce exactly one attribute. */
    public CabsAttribute rewriteSingleAttribute(CabsAttribute attribute, ICabsNode context) {
        ImmutableList<CabsAttribute> result = this.rewriteAttribute(attribute);
        if (result.size() != 1)
            throw new InternalCompilerError(this.visitor + " rewrote attribute " + attribute + " into " +
                    result.size() + " attributes, but exactly one is required in " + context, context);
        return result.get(0);
    }

    @Override
    public String toString() {
        return "CabsRewriter(" + this.visitor + ")";
    }
}
