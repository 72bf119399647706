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

package org.frontc.cabs;

import com.google.common.collect.ImmutableList;
import org.frontc.cabs.errors.SourcePositionRange;
import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.definition.CabsDeclaration;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.definition.CabsFunctionDefinition;
import org.frontc.cabs.ir.definition.CabsInitName;
import org.frontc.cabs.ir.definition.CabsInitNameGroup;
import org.frontc.cabs.ir.definition.CabsNameGroup;
import org.frontc.cabs.ir.definition.CabsOnlyTypedef;
import org.frontc.cabs.ir.definition.CabsPragma;
import org.frontc.cabs.ir.definition.CabsSingleName;
import org.frontc.cabs.ir.definition.CabsTypedef;
import org.frontc.cabs.ir.expression.CabsBinaryExpression;
import org.frontc.cabs.ir.expression.CabsBinaryOperator;
import org.frontc.cabs.ir.expression.CabsConstantExpression;
import org.frontc.cabs.ir.expression.CabsConstantKind;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsIndexExpression;
import org.frontc.cabs.ir.expression.CabsNothing;
import org.frontc.cabs.ir.expression.CabsQuestionExpression;
import org.frontc.cabs.ir.expression.CabsSingleInit;
import org.frontc.cabs.ir.expression.CabsTypeSizeof;
import org.frontc.cabs.ir.expression.CabsUnaryExpression;
import org.frontc.cabs.ir.expression.CabsUnaryOperator;
import org.frontc.cabs.ir.expression.CabsVariableExpression;
import org.frontc.cabs.ir.statement.CabsBlock;
import org.frontc.cabs.ir.statement.CabsBlockStatement;
import org.frontc.cabs.ir.statement.CabsBreak;
import org.frontc.cabs.ir.statement.CabsCase;
import org.frontc.cabs.ir.statement.CabsComputation;
import org.frontc.cabs.ir.statement.CabsDefault;
import org.frontc.cabs.ir.statement.CabsFor;
import org.frontc.cabs.ir.statement.CabsIf;
import org.frontc.cabs.ir.statement.CabsNop;
import org.frontc.cabs.ir.statement.CabsReturn;
import org.frontc.cabs.ir.statement.CabsStatement;
import org.frontc.cabs.ir.statement.CabsSwitch;
import org.frontc.cabs.ir.statement.CabsWhile;
import org.frontc.cabs.ir.type.CabsBuiltinType;
import org.frontc.cabs.ir.type.CabsEnumItem;
import org.frontc.cabs.ir.type.CabsEnumType;
import org.frontc.cabs.ir.type.CabsField;
import org.frontc.cabs.ir.type.CabsFieldGroup;
import org.frontc.cabs.ir.type.CabsJustBase;
import org.frontc.cabs.ir.type.CabsPointer;
import org.frontc.cabs.ir.type.CabsProto;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.ir.type.CabsStructType;
import org.frontc.cabs.ir.type.CabsTypeCode;

/** Helpers to build Cabs trees in tests. */
public class CabsBuilder {
    public static final SourcePositionRange LOCATION = SourcePositionRange.line("test.c", 1);

    public static SourcePositionRange line(int line) {
        return SourcePositionRange.line("test.c", line);
    }

    public static CabsVariableExpression var(String name) {
        return new CabsVariableExpression(name);
    }

    public static CabsConstantExpression constant(int value) {
        return new CabsConstantExpression(CabsConstantKind.INT, Integer.toString(value));
    }

    public static CabsBinaryExpression binary(CabsBinaryOperator op, CabsExpression left, CabsExpression right) {
        return new CabsBinaryExpression(op, left, right);
    }

    public static CabsBinaryExpression assign(CabsExpression left, CabsExpression right) {
        return binary(CabsBinaryOperator.ASSIGN, left, right);
    }

    public static CabsComputation compute(CabsExpression expression) {
        return new CabsComputation(expression, LOCATION);
    }

    public static CabsSpecifier intSpec() {
        return CabsSpecifier.of(CabsBuiltinType.get(CabsTypeCode.INT));
    }

    public static CabsDeclaration declare(String name, CabsExpression init) {
        return new CabsDeclaration(new CabsInitNameGroup(intSpec(),
                new CabsInitName(new CabsName(name), new CabsSingleInit(init))), LOCATION);
    }

    public static CabsDeclaration declare(String name) {
        return new CabsDeclaration(new CabsInitNameGroup(intSpec(),
                new CabsInitName(new CabsName(name))), LOCATION);
    }

    public static CabsSingleName parameter(String name) {
        return new CabsSingleName(intSpec(), new CabsName(name));
    }

    public static CabsBlockStatement block(CabsStatement... statements) {
        return new CabsBlockStatement(CabsBlock.of(statements), LOCATION);
    }

    public static CabsFunctionDefinition function(String name, ImmutableList<CabsSingleName> parameters,
                                                  CabsBlock body) {
        CabsName fn = new CabsName(name, new CabsProto(CabsJustBase.INSTANCE, parameters, false),
                ImmutableList.of());
        return new CabsFunctionDefinition(new CabsSingleName(intSpec(), fn), body, LOCATION);
    }

    @SafeVarargs
    public static <T> ImmutableList<T> list(T... elements) {
        return ImmutableList.copyOf(elements);
    }

    /**
     * A translation unit exercising most node kinds:
     * <pre>
     * struct point { int x; int y : 3; };
     * typedef int myint;
     * enum color { RED, GREEN = 2 };
     * int g = 1;
     * int f(int a, int *p) {
     *     int x = a + 1;
     *     if (x > 0) x = x * 2; else return x;
     *     while (x < 10) x++;
     *     for (x = 0; x < 3; x++) { p[x] = sizeof(int); }
     *     switch (x) { case 1: break; default: ; }
     *     return x ? a : g;
     * }
     * #pragma once
     * </pre>
     */
    public static ImmutableList<CabsDefinition> sampleFile() {
        CabsDefinition struct = new CabsOnlyTypedef(CabsSpecifier.of(new CabsStructType("point", list(
                new CabsFieldGroup(intSpec(), new CabsField(new CabsName("x"))),
                new CabsFieldGroup(intSpec(), new CabsField(new CabsName("y"), constant(3)))))), line(1));
        CabsDefinition typedef = new CabsTypedef(new CabsNameGroup(intSpec(), new CabsName("myint")), line(2));
        CabsDefinition enumeration = new CabsOnlyTypedef(CabsSpecifier.of(new CabsEnumType("color", list(
                new CabsEnumItem("RED", CabsNothing.INSTANCE),
                new CabsEnumItem("GREEN", constant(2))))), line(3));
        CabsDefinition global = declare("g", constant(1));

        CabsSingleName a = parameter("a");
        CabsSingleName p = new CabsSingleName(intSpec(),
                new CabsName("p", new CabsPointer(CabsJustBase.INSTANCE), ImmutableList.of()));
        CabsStatement ifStatement = new CabsIf(
                binary(CabsBinaryOperator.GT, var("x"), constant(0)),
                compute(assign(var("x"), binary(CabsBinaryOperator.MUL, var("x"), constant(2)))),
                new CabsReturn(var("x"), line(7)), line(7));
        CabsStatement whileStatement = new CabsWhile(
                binary(CabsBinaryOperator.LT, var("x"), constant(10)),
                compute(new CabsUnaryExpression(CabsUnaryOperator.POSINCR, var("x"))), line(8));
        CabsStatement forStatement = new CabsFor(
                assign(var("x"), constant(0)),
                binary(CabsBinaryOperator.LT, var("x"), constant(3)),
                new CabsUnaryExpression(CabsUnaryOperator.POSINCR, var("x")),
                block(compute(assign(new CabsIndexExpression(var("p"), var("x")),
                        new CabsTypeSizeof(intSpec(), CabsJustBase.INSTANCE)))), line(9));
        CabsStatement switchStatement = new CabsSwitch(var("x"), block(
                new CabsCase(constant(1), new CabsBreak(line(10)), line(10)),
                new CabsDefault(new CabsNop(line(10)), line(10))), line(10));
        CabsStatement returnStatement = new CabsReturn(
                new CabsQuestionExpression(var("x"), var("a"), var("g")), line(11));
        CabsBlock body = new CabsBlock(ImmutableList.of(), ImmutableList.of(),
                list(declare("x", binary(CabsBinaryOperator.ADD, var("a"), constant(1)))),
                list(ifStatement, whileStatement, forStatement, switchStatement, returnStatement));
        CabsDefinition function = function("f", list(a, p), body);
        CabsDefinition pragma = new CabsPragma(var("once"), line(13));
        return list(struct, typedef, enumeration, global, function, pragma);
    }
}
