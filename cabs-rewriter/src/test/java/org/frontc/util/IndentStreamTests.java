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

import org.frontc.cabs.errors.InternalCompilerError;
import org.junit.Assert;
import org.junit.Test;

public class IndentStreamTests {
    @Test
    public void testNesting() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        builder.append("{").increase()
                .append("a;").newline()
                .append("{").increase()
                .append("b;").decrease().newline()
                .append("}").decrease().newline()
                .append("}");
        Assert.assertEquals("{\n    a;\n    {\n        b;\n    }\n}", builder.toString());
    }

    @Test
    public void testRedirect() {
        StringBuilder first = new StringBuilder();
        StringBuilder second = new StringBuilder();
        IndentStream stream = new IndentStream(first);
        stream.append("x").increase();
        Assert.assertSame(first, stream.setOutputStream(second));
        stream.append("y");
        Assert.assertEquals("x\n", first.toString());
        // The nesting depth survives the redirection
        Assert.assertEquals("    y", second.toString());
    }

    @Test
    public void testUnbalancedDecrease() {
        Assert.assertThrows(InternalCompilerError.class, () -> new IndentStreamBuilder().decrease());
    }
}
