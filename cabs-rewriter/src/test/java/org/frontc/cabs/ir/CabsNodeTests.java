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

package org.frontc.cabs.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.frontc.cabs.errors.InternalCompilerError;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.expression.CabsBinaryOperator;
import org.frontc.cabs.ir.expression.CabsCastExpression;
import org.frontc.cabs.ir.expression.CabsCompoundInit;
import org.frontc.cabs.ir.expression.CabsConstantExpression;
import org.frontc.cabs.ir.expression.CabsConstantKind;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsInFieldInit;
import org.frontc.cabs.ir.expression.CabsInitializer;
import org.frontc.cabs.ir.expression.CabsNextInit;
import org.frontc.cabs.ir.expression.CabsSingleInit;
import org.frontc.cabs.ir.statement.CabsStatement;
import org.frontc.cabs.ir.type.CabsArray;
import org.frontc.cabs.ir.type.CabsJustBase;
import org.frontc.cabs.ir.type.CabsPointer;
import org.frontc.cabs.ir.type.CabsStructType;
import org.junit.Assert;
import org.junit.Test;

import static org.frontc.cabs.CabsBuilder.*;

public class CabsNodeTests {
    @Test
    public void testJsonIsDeterministic() {
        ImmutableList<CabsDefinition> first = sampleFile();
        ImmutableList<CabsDefinition> second = sampleFile();
        for (int i = 0; i < first.size(); i++) {
            Assert.assertNotEquals(first.get(i).getId(), second.get(i).getId());
            Assert.assertEquals(first.get(i).toJson(), second.get(i).toJson());
        }
    }

    @Test
    public void testJsonContents() {
        CabsExpression expression = binary(CabsBinaryOperator.ADD, var("a"), constant(1));
        JsonNode json = expression.toJson();
        Assert.assertEquals("CabsBinaryExpression", json.get("class").asText());
        Assert.assertEquals("ADD", json.get("operator").asText());
        Assert.assertEquals("CabsVariableExpression", json.get("left").get("class").asText());
        Assert.assertEquals("a", json.get("left").get("name").asText());
        Assert.assertEquals("1", json.get("right").get("constant").get("text").asText());
        Assert.assertNull(json.get("id"));
    }

    @Test
    public void testJsonDistinguishesTrees() {
        Assert.assertNotEquals(var("a").toJson(), var("b").toJson());
        Assert.assertNotEquals(
                binary(CabsBinaryOperator.ADD, var("a"), var("b")).toJson(),
                binary(CabsBinaryOperator.SUB, var("a"), var("b")).toJson());
    }

    @Test
    public void testPrintDeclarators() {
        // int *a[10]
        CabsName array = new CabsName("a",
                new CabsPointer(new CabsArray(CabsJustBase.INSTANCE, constant(10))), ImmutableList.of());
        Assert.assertEquals("*a[10]", array.toString());
        CabsExpression cast = new CabsCastExpression(intSpec(), new CabsPointer(CabsJustBase.INSTANCE),
                new CabsSingleInit(var("p")));
        Assert.assertEquals("((int *)p)", cast.toString());
        CabsName attributed = new CabsName("v", CabsJustBase.INSTANCE,
                ImmutableList.of(new CabsAttribute("aligned", constant(8))));
        Assert.assertEquals("v __attribute__((aligned(8)))", attributed.toString());
    }

    @Test
    public void testPrintInitializers() {
        CabsCompoundInit init = new CabsCompoundInit(
                new CabsInitializer(new CabsInFieldInit("x", CabsNextInit.INSTANCE), new CabsSingleInit(constant(1))),
                new CabsInitializer(new CabsSingleInit(new CabsConstantExpression(CabsConstantKind.STRING, "s"))));
        Assert.assertEquals("{ .x = 1, \"s\" }", init.toString());
    }

    @Test
    public void testPrintStatements() {
        CabsStatement statement = compute(assign(var("x"), binary(CabsBinaryOperator.MUL, var("x"), constant(2))));
        Assert.assertEquals("(x = (x * 2));", statement.toString());
        Assert.assertEquals("int g = 1;", sampleFile().get(3).toString());
    }

    @Test
    public void testPositions() {
        CabsStatement statement = compute(var("x"));
        Assert.assertSame(LOCATION, statement.getPositionRange());
        Assert.assertFalse(var("x").getPositionRange().isValid());
        Assert.assertEquals(line(13), sampleFile().get(5).getPositionRange());
    }

    @Test
    public void testCasts() {
        CabsExpression expression = var("x");
        Assert.assertTrue(expression.is(CabsExpression.class));
        Assert.assertNull(expression.as(CabsStructType.class));
        Assert.assertThrows(RuntimeException.class, () -> expression.to(CabsStructType.class));
    }

    @Test
    public void testCheckNull() {
        CabsExpression expression = var("x");
        Assert.assertSame(expression, expression.checkNull(expression));
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class,
                () -> expression.checkNull(null));
        Assert.assertSame(expression, error.cabsNode);
    }
}
