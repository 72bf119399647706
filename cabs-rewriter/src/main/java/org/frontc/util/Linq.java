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

package org.frontc.util;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/** Some utility classes inspired by C# Linq. */
public class Linq {
    private Linq() {}

    /**
     * Map a function over a list, but do not copy the list unless necessary.
     * @return The original list if every element is mapped to itself
     *         (compared by reference), a new list holding the results otherwise. */
    public static <T> ImmutableList<T> mapNoCopy(ImmutableList<T> data, UnaryOperator<T> function) {
        @Nullable ImmutableList.Builder<T> builder = null;
        for (int i = 0; i < data.size(); i++) {
            T element = data.get(i);
            T mapped = function.apply(element);
            if (builder == null && mapped != element) {
                builder = ImmutableList.builderWithExpectedSize(data.size());
                builder.addAll(data.subList(0, i));
            }
            if (builder != null)
                builder.add(mapped);
        }
        if (builder == null)
            return data;
        return builder.build();
    }

    /** Same as {@link #mapNoCopy}, for optional lists; null is mapped to null. */
    @Nullable
    public static <T> ImmutableList<T> mapNoCopyOptional(@Nullable ImmutableList<T> data, UnaryOperator<T> function) {
        if (data == null)
            return null;
        return mapNoCopy(data, function);
    }

    /**
     * Map each element of a list to a list of replacements and concatenate the results.
     * An element can be deleted (empty replacement) or expanded into several elements.
     * @return The original list if every element is mapped to a one-element list
     *         holding the element itself, the concatenation of all replacements otherwise. */
    public static <T> ImmutableList<T> mapNoCopyList(
            ImmutableList<T> data, Function<T, ? extends List<T>> function) {
        @Nullable ImmutableList.Builder<T> builder = null;
        for (int i = 0; i < data.size(); i++) {
            T element = data.get(i);
            List<T> mapped = function.apply(element);
            boolean unchanged = mapped.size() == 1 && mapped.get(0) == element;
            if (builder == null && !unchanged) {
                builder = ImmutableList.builder();
                builder.addAll(data.subList(0, i));
            }
            if (builder != null)
                builder.addAll(mapped);
        }
        if (builder == null)
            return data;
        return builder.build();
    }
}
