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
import org.frontc.cabs.errors.CompilationError;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsVariableExpression;
import org.frontc.cabs.visitors.CabsPasses;
import org.frontc.cabs.visitors.CabsRewriter;
import org.frontc.cabs.visitors.NopCabsVisitor;
import org.frontc.cabs.visitors.VisitAction;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import static org.frontc.cabs.CabsBuilder.*;

public class LoggerTests {
    StringBuilder output = new StringBuilder();
    Appendable previous = System.err;

    static class ReplaceX extends NopCabsVisitor {
        @Override
        public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
            CabsVariableExpression variable = expression.as(CabsVariableExpression.class);
            if (variable != null && variable.name.equals("x"))
                return VisitAction.changeTo(var("y"));
            return VisitAction.doChildren();
        }
    }

    @Before
    public void redirect() {
        this.previous = Logger.INSTANCE.setDebugStream(this.output);
    }

    @After
    public void restore() {
        Logger.INSTANCE.reset();
        Logger.INSTANCE.setDebugStream(this.previous);
    }

    @Test
    public void testNoOutputByDefault() {
        CabsRewriter.visitFile(new ReplaceX(), list(declare("v", var("x"))));
        Assert.assertEquals("", this.output.toString());
    }

    @Test
    public void testReplacementsLogged() {
        Logger.INSTANCE.setLoggingLevel(CabsRewriter.class, 1);
        CabsRewriter.visitFile(new ReplaceX(), list(declare("v", var("x"))));
        String log = this.output.toString();
        Assert.assertTrue(log, log.contains("ReplaceX: x -> y"));
        // Level 4 messages are not produced
        Assert.assertFalse(log, log.contains("DO_CHILDREN"));
    }

    @Test
    public void testDecisionsLogged() {
        int previousLevel = Logger.INSTANCE.setLoggingLevel("CabsRewriter", 4);
        Assert.assertEquals(0, previousLevel);
        Assert.assertEquals(4, Logger.INSTANCE.getLoggingLevel(CabsRewriter.class));
        CabsRewriter.visitFile(new NopCabsVisitor(), list(declare("v", var("x"))));
        String log = this.output.toString();
        Assert.assertTrue(log, log.contains("NopCabsVisitor DO_CHILDREN"));
        Assert.assertTrue(log, log.contains("unchanged"));
    }

    @Test
    public void testPassesLogged() {
        Logger.INSTANCE.setLoggingLevel(CabsPasses.class, 3);
        ImmutableList<CabsDefinition> file = list(declare("v", var("x")));
        new CabsPasses(new CabsRewriter(new ReplaceX())).apply(file);
        String log = this.output.toString();
        Assert.assertTrue(log, log.contains("Executing CabsRewriter(ReplaceX)"));
        Assert.assertTrue(log, log.contains("int v = y;"));
    }

    @Test
    public void testLevelOfNearestConfiguredType() {
        Logger.INSTANCE.setLoggingLevel(IWritesLogs.class, 2);
        Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(CabsRewriter.class));
        Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(CabsPasses.class));
        Logger.INSTANCE.setLoggingLevel(CabsPasses.class, 3);
        Assert.assertEquals(3, Logger.INSTANCE.getLoggingLevel(CabsPasses.class));
        Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(CabsRewriter.class));
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(String.class));
        Assert.assertTrue(Logger.INSTANCE.belowLevel(CabsPasses.class, 4) instanceof NullIndentStream);
    }

    @Test
    public void testUnknownClass() {
        Assert.assertThrows(CompilationError.class,
                () -> Logger.INSTANCE.setLoggingLevel("NoSuchVisitor", 1));
    }
}
