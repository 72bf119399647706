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
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.expression.CabsConstantExpression;
import org.frontc.cabs.ir.expression.CabsConstantKind;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.junit.Assert;
import org.junit.Test;

import static org.frontc.cabs.CabsBuilder.*;

public class CabsPassesTests {
    static class Rename extends NopCabsVisitor {
        final String from;
        final String to;

        Rename(String from, String to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public String visitVariable(String name) {
            return name.equals(this.from) ? this.to : name;
        }
    }

    /** Decrements each positive integer constant by one. */
    static class Decrement extends NopCabsVisitor {
        @Override
        public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
            CabsConstantExpression literal = expression.as(CabsConstantExpression.class);
            if (literal != null && literal.constant.kind == CabsConstantKind.INT) {
                int value = Integer.parseInt(literal.constant.text);
                if (value > 0)
                    return VisitAction.changeTo(constant(value - 1));
            }
            return VisitAction.doChildren();
        }
    }

    /** Counts how many times a transform is applied. */
    static class Counting implements ICabsTransform {
        final ICabsTransform transform;
        int applied = 0;

        Counting(ICabsTransform transform) {
            this.transform = transform;
        }

        @Override
        public ImmutableList<CabsDefinition> apply(ImmutableList<CabsDefinition> file) {
            this.applied++;
            return this.transform.apply(file);
        }
    }

    @Test
    public void testPassesRunInOrder() {
        ImmutableList<CabsDefinition> file = list(declare("v", var("x")));
        CabsPasses passes = new CabsPasses(
                new CabsRewriter(new Rename("x", "y")),
                new CabsRewriter(new Rename("y", "z")));
        Assert.assertEquals("int v = z;", passes.apply(file).get(0).toString());

        CabsPasses reversed = new CabsPasses();
        reversed.add(new Rename("y", "z"));
        reversed.add(new Rename("x", "y"));
        Assert.assertEquals("int v = y;", reversed.apply(file).get(0).toString());
    }

    @Test
    public void testEmptyPassesKeepTree() {
        ImmutableList<CabsDefinition> file = sampleFile();
        Assert.assertSame(file, new CabsPasses().apply(file));
    }

    @Test
    public void testRepeatUntilFixedPoint() {
        ImmutableList<CabsDefinition> file = list(declare("v", constant(3)));
        Counting counting = new Counting(new CabsRewriter(new Decrement()));
        ImmutableList<CabsDefinition> result = new CabsRepeat(counting).apply(file);
        Assert.assertEquals("int v = 0;", result.get(0).toString());
        // Three changes, then one application which changes nothing
        Assert.assertEquals(4, counting.applied);
    }

    @Test
    public void testRepeatOfUnchangedTree() {
        ImmutableList<CabsDefinition> file = sampleFile();
        Counting counting = new Counting(new CabsRewriter(new NopCabsVisitor()));
        Assert.assertSame(file, new CabsRepeat(counting).apply(file));
        Assert.assertEquals(1, counting.applied);
    }

    @Test
    public void testRepeatBound() {
        ImmutableList<CabsDefinition> file = list(declare("v", constant(3)));
        CabsRepeat repeat = new CabsRepeat(new CabsRewriter(new Decrement()), 2);
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class, () -> repeat.apply(file));
        Assert.assertTrue(error.getMessage(), error.getMessage().contains("without convergence"));
    }
}
