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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The decision taken by a visitor hook before the children of a node are visited.
 * For list-dispatched node kinds (statements, definitions, attributes)
 * the type parameter is a list of nodes.
 *
 * @param <T> Type of the node visited.
 */
public final class VisitAction<T> {
    public enum Kind {
        /** Do not visit the children; return the node as it is. */
        SKIP_CHILDREN,
        /** Replace the node with the given one; the replacement is not visited. */
        CHANGE_TO,
        /** Visit the children; rebuild the node if any of them changes. */
        DO_CHILDREN,
        /** Replace the node, visit the children of the replacement,
         * rebuild it if needed, then apply a function to the result. */
        CHANGE_DO_CHILDREN_POST
    }

    public final Kind kind;
    @Nullable
    private final T node;
    @Nullable
    private final UnaryOperator<T> post;

    private static final VisitAction<?> SKIP = new VisitAction<>(Kind.SKIP_CHILDREN, null, null);
    private static final VisitAction<?> CHILDREN = new VisitAction<>(Kind.DO_CHILDREN, null, null);

    private VisitAction(Kind kind, @Nullable T node, @Nullable UnaryOperator<T> post) {
        this.kind = kind;
        this.node = node;
        this.post = post;
    }

    @SuppressWarnings("unchecked")
    public static <T> VisitAction<T> skipChildren() {
        return (VisitAction<T>) SKIP;
    }

    @SuppressWarnings("unchecked")
    public static <T> VisitAction<T> doChildren() {
        return (VisitAction<T>) CHILDREN;
    }

    public static <T> VisitAction<T> changeTo(T node) {
        return new VisitAction<>(Kind.CHANGE_TO, checkNotNull(node, "changeTo with a null node"), null);
    }

    public static <T> VisitAction<T> changeDoChildrenPost(T node, UnaryOperator<T> post) {
        return new VisitAction<>(Kind.CHANGE_DO_CHILDREN_POST,
                checkNotNull(node, "changeDoChildrenPost with a null node"),
                checkNotNull(post, "changeDoChildrenPost with a null function"));
    }

    /** Replace a list-dispatched node with the given nodes, in order. */
    @SafeVarargs
    public static <T> VisitAction<List<T>> changeToList(T... nodes) {
        return changeTo(ImmutableList.copyOf(nodes));
    }

    /** Remove a list-dispatched node from the enclosing list. */
    public static <T> VisitAction<List<T>> delete() {
        return changeTo(ImmutableList.of());
    }

    public boolean skip() {
        return this.kind == Kind.SKIP_CHILDREN;
    }

    public boolean changes() {
        return this.kind == Kind.CHANGE_TO;
    }

    /** True if the children of the node have to be visited. */
    public boolean visitsChildren() {
        return this.kind == Kind.DO_CHILDREN || this.kind == Kind.CHANGE_DO_CHILDREN_POST;
    }

    /** The replacement node, for CHANGE_TO and CHANGE_DO_CHILDREN_POST. */
    public T getNode() {
        return Objects.requireNonNull(this.node);
    }

    /** The node whose children are visited: the replacement if there is one, else the original. */
    public T nodeToVisit(T original) {
        if (this.kind == Kind.CHANGE_DO_CHILDREN_POST)
            return this.getNode();
        return original;
    }

    /** Apply the post function, if any, to the node built after visiting the children. */
    public T finish(T visited) {
        if (this.post == null)
            return visited;
        return this.post.apply(visited);
    }

    @Override
    public String toString() {
        return this.kind.toString();
    }
}
