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
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class LinqTests {
    @Test
    public void testMapNoCopy() {
        ImmutableList<String> data = ImmutableList.of("a", "b", "c");
        Assert.assertSame(data, Linq.mapNoCopy(data, s -> s));
        ImmutableList<String> changed = Linq.mapNoCopy(data, s -> s.equals("b") ? "B" : s);
        Assert.assertEquals(List.of("a", "B", "c"), changed);
        Assert.assertEquals(List.of("a", "b", "c"), data);
        ImmutableList<String> empty = ImmutableList.of();
        Assert.assertSame(empty, Linq.mapNoCopy(empty, String::toUpperCase));
    }

    @Test
    public void testMapNoCopyUsesReferences() {
        String b = "b";
        ImmutableList<String> data = ImmutableList.of("a", b);
        // An equal but distinct object counts as a change
        ImmutableList<String> result = Linq.mapNoCopy(data, s -> new String(s.toCharArray()));
        Assert.assertNotSame(data, result);
        Assert.assertEquals(data, result);
    }

    @Test
    public void testMapNoCopyOptional() {
        Assert.assertNull(Linq.mapNoCopyOptional(null, (String s) -> s));
        ImmutableList<String> data = ImmutableList.of("x");
        Assert.assertSame(data, Linq.mapNoCopyOptional(data, s -> s));
    }

    @Test
    public void testMapNoCopyList() {
        ImmutableList<String> data = ImmutableList.of("a", "b", "c");
        Assert.assertSame(data, Linq.mapNoCopyList(data, s -> ImmutableList.of(s)));
        ImmutableList<String> deleted = Linq.mapNoCopyList(data,
                s -> s.equals("b") ? ImmutableList.of() : ImmutableList.of(s));
        Assert.assertEquals(List.of("a", "c"), deleted);
        ImmutableList<String> expanded = Linq.mapNoCopyList(data,
                s -> s.equals("a") ? ImmutableList.of("a1", "a2") : ImmutableList.of(s));
        Assert.assertEquals(List.of("a1", "a2", "b", "c"), expanded);
        ImmutableList<String> single = Linq.mapNoCopyList(data,
                s -> s.equals("c") ? ImmutableList.of("C") : ImmutableList.of(s));
        Assert.assertEquals(List.of("a", "b", "C"), single);
    }
}
