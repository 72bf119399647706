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

package org.frontc.cabs.errors;

import org.frontc.cabs.ir.statement.CabsStatement;
import org.frontc.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import static org.frontc.cabs.CabsBuilder.*;

public class CompilerErrorTests {
    @Test
    public void testMessageWithPosition() {
        CabsStatement statement = compute(var("x"));
        InternalCompilerError error = new InternalCompilerError("broken", statement);
        Assert.assertSame(LOCATION, error.getPositionRange());
        Assert.assertEquals("Compiler error at test.c:1:1--1:1: broken", error.getFullMessage());
    }

    @Test
    public void testMessageWithoutPosition() {
        CompilationError error = new CompilationError("bad option");
        Assert.assertFalse(error.getPositionRange().isValid());
        Assert.assertEquals(error.getErrorKind() + ": bad option", error.getFullMessage());
    }

    @Test
    public void testEnforce() {
        Utilities.enforce(true, "not thrown");
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class,
                () -> Utilities.enforce(false, "invariant"));
        Assert.assertTrue(error.getMessage().startsWith("invariant"));
    }
}
