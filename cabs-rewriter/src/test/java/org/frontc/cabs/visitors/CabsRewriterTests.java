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
import org.frontc.cabs.ir.CabsAttribute;
import org.frontc.cabs.ir.CabsName;
import org.frontc.cabs.ir.definition.CabsDeclaration;
import org.frontc.cabs.ir.definition.CabsDefinition;
import org.frontc.cabs.ir.definition.CabsFunctionDefinition;
import org.frontc.cabs.ir.definition.CabsInitName;
import org.frontc.cabs.ir.definition.CabsInitNameGroup;
import org.frontc.cabs.ir.definition.CabsOnlyTypedef;
import org.frontc.cabs.ir.definition.CabsSingleName;
import org.frontc.cabs.ir.expression.CabsAtIndexRangeInit;
import org.frontc.cabs.ir.expression.CabsBinaryExpression;
import org.frontc.cabs.ir.expression.CabsBinaryOperator;
import org.frontc.cabs.ir.expression.CabsCompoundInit;
import org.frontc.cabs.ir.expression.CabsExpression;
import org.frontc.cabs.ir.expression.CabsInitializer;
import org.frontc.cabs.ir.expression.CabsSingleInit;
import org.frontc.cabs.ir.expression.CabsUnaryExpression;
import org.frontc.cabs.ir.expression.CabsUnaryOperator;
import org.frontc.cabs.ir.expression.CabsVariableExpression;
import org.frontc.cabs.ir.statement.CabsBlock;
import org.frontc.cabs.ir.statement.CabsBlockStatement;
import org.frontc.cabs.ir.statement.CabsComputation;
import org.frontc.cabs.ir.statement.CabsIf;
import org.frontc.cabs.ir.statement.CabsNop;
import org.frontc.cabs.ir.statement.CabsReturn;
import org.frontc.cabs.ir.statement.CabsStatement;
import org.frontc.cabs.ir.type.CabsBuiltinType;
import org.frontc.cabs.ir.type.CabsDeclType;
import org.frontc.cabs.ir.type.CabsJustBase;
import org.frontc.cabs.ir.type.CabsParenType;
import org.frontc.cabs.ir.type.CabsPointer;
import org.frontc.cabs.ir.type.CabsProto;
import org.frontc.cabs.ir.type.CabsSpecAttribute;
import org.frontc.cabs.ir.type.CabsSpecType;
import org.frontc.cabs.ir.type.CabsSpecifier;
import org.frontc.cabs.ir.type.CabsStructType;
import org.frontc.cabs.ir.type.CabsTypeCode;
import org.frontc.cabs.ir.type.CabsTypeSpecifier;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.frontc.cabs.CabsBuilder.*;

public class CabsRewriterTests {
    /** Counts the hooks invoked and tracks the scope depth. */
    static class CountingVisitor extends NopCabsVisitor {
        int variables = 0;
        int expressions = 0;
        int statements = 0;
        int attributes = 0;
        int enters = 0;
        int exits = 0;
        int depth = 0;
        int maxDepth = 0;

        @Override
        public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
            this.expressions++;
            return VisitAction.doChildren();
        }

        @Override
        public VisitAction<List<CabsStatement>> visitStatement(CabsStatement statement) {
            this.statements++;
            return VisitAction.doChildren();
        }

        @Override
        public VisitAction<List<CabsAttribute>> visitAttribute(CabsAttribute attribute) {
            this.attributes++;
            return VisitAction.doChildren();
        }

        @Override
        public String visitVariable(String name) {
            this.variables++;
            return name;
        }

        @Override
        public void enterScope() {
            this.enters++;
            this.depth++;
            this.maxDepth = Math.max(this.maxDepth, this.depth);
        }

        @Override
        public void exitScope() {
            this.exits++;
            this.depth--;
            Assert.assertTrue(this.depth >= 0);
        }
    }

    /** Renames every variable to upper case. */
    static class UpperCase extends NopCabsVisitor {
        @Override
        public String visitVariable(String name) {
            return name.toUpperCase();
        }
    }

    /** Collects the names of the variables used. */
    static class CollectVariables extends NopCabsVisitor {
        final List<String> used = new ArrayList<>();

        @Override
        public String visitVariable(String name) {
            this.used.add(name);
            return name;
        }
    }

    static List<String> variables(ImmutableList<CabsDefinition> file) {
        CollectVariables collect = new CollectVariables();
        CabsRewriter.visitFile(collect, file);
        return collect.used;
    }

    @Test
    public void testNopKeepsTree() {
        ImmutableList<CabsDefinition> file = sampleFile();
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(new NopCabsVisitor(), file);
        Assert.assertSame(file, result);
        for (int i = 0; i < file.size(); i++)
            Assert.assertSame(file.get(i), result.get(i));
        CabsBlock body = file.get(4).to(CabsFunctionDefinition.class).body;
        Assert.assertSame(body, new CabsRewriter(new NopCabsVisitor()).rewriteBlock(body));
    }

    @Test
    public void testVisitsEverything() {
        ImmutableList<CabsDefinition> file = sampleFile();
        CountingVisitor counter = new CountingVisitor();
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(counter, file);
        Assert.assertSame(file, result);
        Assert.assertEquals(17, counter.variables);
        Assert.assertTrue(counter.expressions > counter.variables);
        // if, computation, return, while, computation, for, block, computation,
        // switch, block, case, break, default, nop, return
        Assert.assertEquals(15, counter.statements);
        // enum, prototype of f, body of f, body of for, body of switch
        Assert.assertEquals(5, counter.enters);
        Assert.assertEquals(5, counter.exits);
        Assert.assertEquals(0, counter.depth);
        Assert.assertEquals(2, counter.maxDepth);
    }

    @Test
    public void testSkipChildren() {
        CountingVisitor skipFunctions = new CountingVisitor() {
            @Override
            public VisitAction<List<CabsDefinition>> visitDefinition(CabsDefinition definition) {
                if (definition.is(CabsFunctionDefinition.class))
                    return VisitAction.skipChildren();
                return VisitAction.doChildren();
            }
        };
        ImmutableList<CabsDefinition> file = sampleFile();
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(skipFunctions, file);
        Assert.assertSame(file, result);
        // Only the pragma
        Assert.assertEquals(1, skipFunctions.variables);
        Assert.assertEquals(0, skipFunctions.statements);
        // Only the enum
        Assert.assertEquals(1, skipFunctions.enters);
    }

    @Test
    public void testSkipKeepsNodeEvenIfChildrenWouldChange() {
        UpperCase visitor = new UpperCase() {
            @Override
            public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
                if (expression.is(CabsBinaryExpression.class))
                    return VisitAction.skipChildren();
                return VisitAction.doChildren();
            }
        };
        CabsExpression expression = binary(CabsBinaryOperator.ADD, var("a"), var("b"));
        CabsExpression result = new CabsRewriter(visitor).rewriteExpression(expression);
        Assert.assertSame(expression, result);
    }

    @Test
    public void testChangeToIsNotVisited() {
        UpperCase visitor = new UpperCase() {
            @Override
            public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
                CabsVariableExpression variable = expression.as(CabsVariableExpression.class);
                if (variable != null && variable.name.equals("a"))
                    return VisitAction.changeTo(binary(CabsBinaryOperator.ADD, var("z"), var("w")));
                return VisitAction.doChildren();
            }
        };
        CabsExpression expression = binary(CabsBinaryOperator.MUL, var("a"), var("b"));
        CabsExpression result = new CabsRewriter(visitor).rewriteExpression(expression);
        Assert.assertEquals("((z + w) * B)", result.toString());
    }

    @Test
    public void testChangeDoChildrenPost() {
        UpperCase visitor = new UpperCase() {
            @Override
            public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
                CabsBinaryExpression add = expression.as(CabsBinaryExpression.class);
                if (add != null && add.operator == CabsBinaryOperator.ADD) {
                    CabsExpression replacement = binary(CabsBinaryOperator.SUB, add.left, add.right);
                    return VisitAction.changeDoChildrenPost(replacement,
                            e -> new CabsUnaryExpression(CabsUnaryOperator.MINUS, e));
                }
                return VisitAction.doChildren();
            }
        };
        CabsExpression expression = binary(CabsBinaryOperator.ADD, var("a"), binary(CabsBinaryOperator.ADD, var("b"), var("c")));
        CabsExpression result = new CabsRewriter(visitor).rewriteExpression(expression);
        // The children of the replacement are visited, then the post function is applied
        Assert.assertEquals("(-(A - (-(B - C))))", result.toString());
    }

    @Test
    public void testPostSeesRebuiltNode() {
        List<CabsExpression> seen = new ArrayList<>();
        UpperCase visitor = new UpperCase() {
            @Override
            public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
                if (expression.is(CabsBinaryExpression.class))
                    return VisitAction.changeDoChildrenPost(expression, e -> {
                        seen.add(e);
                        return e;
                    });
                return VisitAction.doChildren();
            }
        };
        CabsExpression expression = binary(CabsBinaryOperator.ADD, var("a"), var("b"));
        CabsExpression result = new CabsRewriter(visitor).rewriteExpression(expression);
        Assert.assertEquals(1, seen.size());
        Assert.assertSame(result, seen.get(0));
        Assert.assertNotSame(expression, result);
        Assert.assertEquals("(A + B)", result.toString());
    }

    @Test
    public void testRenameAllVariables() {
        ImmutableList<CabsDefinition> file = sampleFile();
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(new UpperCase(), file);
        Assert.assertNotSame(file, result);
        List<String> before = variables(file);
        List<String> after = variables(result);
        Assert.assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++)
            Assert.assertEquals(before.get(i).toUpperCase(), after.get(i));
        // Definitions without variables are shared
        for (int i = 0; i < 4; i++)
            Assert.assertSame(file.get(i), result.get(i));
    }

    @Test
    public void testRenameReturningEqualStringRebuilds() {
        // A variable is rebuilt when the hook returns a different object, even if equal
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public String visitVariable(String name) {
                return new String(name.toCharArray());
            }
        };
        CabsExpression expression = var("x");
        CabsExpression result = new CabsRewriter(visitor).rewriteExpression(expression);
        Assert.assertNotSame(expression, result);
        Assert.assertEquals("x", result.toString());
    }

    @Test
    public void testRenameDeclarationsAndUses() {
        NopCabsVisitor rename = new NopCabsVisitor() {
            @Override
            public String visitVariable(String name) {
                return name.equals("x") ? "y" : name;
            }

            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                if (kind == NameKind.VARIABLE && name.name.equals("x"))
                    return VisitAction.changeDoChildrenPost(name.withName("y"), n -> n);
                return VisitAction.doChildren();
            }
        };
        ImmutableList<CabsDefinition> file = list(
                declare("x", constant(0)),
                function("f", list(parameter("a")), CabsBlock.of(
                        compute(assign(var("x"), var("a"))))));
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(rename, file);
        Assert.assertEquals("int y = 0;", result.get(0).toString());
        Assert.assertEquals(List.of("y", "a"), variables(result));
        CabsFunctionDefinition function = result.get(1).to(CabsFunctionDefinition.class);
        Assert.assertSame(file.get(1).to(CabsFunctionDefinition.class).name, function.name);
    }

    @Test
    public void testRenameParameterAndUses() {
        // int x; int f(int x) { return x + 1; }
        NopCabsVisitor rename = new NopCabsVisitor() {
            @Override
            public String visitVariable(String name) {
                return name.equals("x") ? "y" : name;
            }

            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                if (kind == NameKind.VARIABLE && name.name.equals("x"))
                    return VisitAction.changeDoChildrenPost(name.withName("y"), n -> n);
                return VisitAction.doChildren();
            }
        };
        CabsBlock body = CabsBlock.of(
                new CabsReturn(binary(CabsBinaryOperator.ADD, var("x"), constant(1)), LOCATION));
        ImmutableList<CabsDefinition> file = list(
                declare("x"),
                function("f", list(parameter("x")), body));
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(rename, file);

        Assert.assertEquals("int y;", result.get(0).toString());
        CabsFunctionDefinition function = result.get(1).to(CabsFunctionDefinition.class);
        Assert.assertEquals("f", function.name.name.name);
        CabsProto proto = function.name.name.declType.to(CabsProto.class);
        Assert.assertEquals("y", proto.parameters.get(0).name.name);
        CabsReturn ret = function.body.statements.get(0).to(CabsReturn.class);
        Assert.assertEquals("(y + 1)", ret.expression.toString());

        CabsBlock newBody = function.body;
        Assert.assertNotSame(body, newBody);
        Assert.assertSame(body.labels, newBody.labels);
        Assert.assertSame(body.attributes, newBody.attributes);
        Assert.assertSame(body.definitions, newBody.definitions);
    }

    @Test
    public void testChangeDoChildrenPostOnStatementList() {
        CabsStatement original = compute(var("s"));
        CabsStatement first = compute(var("a"));
        CabsStatement second = compute(var("b"));
        List<Integer> postSizes = new ArrayList<>();
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<List<CabsStatement>> visitStatement(CabsStatement statement) {
                if (statement == original)
                    return VisitAction.changeDoChildrenPost(list(first, second), visited -> {
                        postSizes.add(visited.size());
                        return list(visited.get(1), visited.get(0));
                    });
                return VisitAction.doChildren();
            }

            @Override
            public String visitVariable(String name) {
                return name.toUpperCase();
            }
        };
        CabsStatement last = new CabsNop(LOCATION);
        CabsBlock block = CabsBlock.of(original, last);
        CabsBlock result = new CabsRewriter(visitor).rewriteBlock(block);

        // post runs once, on the whole replacement after its children were visited
        Assert.assertEquals(List.of(2), postSizes);
        Assert.assertEquals(3, result.statements.size());
        Assert.assertEquals("B", result.statements.get(0).to(CabsComputation.class).expression.toString());
        Assert.assertEquals("A", result.statements.get(1).to(CabsComputation.class).expression.toString());
        Assert.assertSame(last, result.statements.get(2));
    }

    @Test
    public void testNameKinds() {
        List<String> names = new ArrayList<>();
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                names.add(kind + " " + name.name);
                return VisitAction.doChildren();
            }
        };
        CabsRewriter.visitFile(visitor, sampleFile());
        Assert.assertEquals(List.of(
                "FIELD x", "FIELD y",
                "TYPE myint",
                "VARIABLE g",
                "VARIABLE f", "VARIABLE a", "VARIABLE p",
                "VARIABLE x"), names);
    }

    @Test
    public void testNameHookReceivesVisitedSpecifier() {
        CabsSpecifier longSpec = CabsSpecifier.of(CabsBuiltinType.get(CabsTypeCode.LONG));
        List<CabsSpecifier> specifiers = new ArrayList<>();
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<CabsSpecifier> visitSpecifier(CabsSpecifier specifier) {
                return VisitAction.changeTo(longSpec);
            }

            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                specifiers.add(specifier);
                return VisitAction.doChildren();
            }
        };
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(visitor, list(declare("v", constant(1))));
        Assert.assertEquals(1, specifiers.size());
        Assert.assertSame(longSpec, specifiers.get(0));
        Assert.assertEquals("long v = 1;", result.get(0).toString());
    }

    @Test
    public void testFieldGroupKeepsRebuiltFields() {
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<CabsTypeSpecifier> visitTypeSpecifier(CabsTypeSpecifier type) {
                CabsBuiltinType builtin = type.as(CabsBuiltinType.class);
                if (builtin != null && builtin.code == CabsTypeCode.INT)
                    return VisitAction.changeTo(CabsBuiltinType.get(CabsTypeCode.LONG));
                return VisitAction.doChildren();
            }

            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                if (kind == NameKind.FIELD)
                    return VisitAction.changeTo(name.withName(name.name + "_f"));
                return VisitAction.doChildren();
            }
        };
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(visitor, sampleFile());
        String struct = result.get(0).toString();
        Assert.assertTrue(struct, struct.contains("long x_f;"));
        Assert.assertTrue(struct, struct.contains("long y_f : 3;"));
    }

    @Test
    public void testScopesAroundPrototype() {
        List<String> events = new ArrayList<>();
        NopCabsVisitor visitor = new NopCabsVisitor() {
            int depth = 0;

            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                events.add("name " + name.name + " " + this.depth);
                return VisitAction.doChildren();
            }

            @Override
            public VisitAction<CabsDeclType> visitDeclType(CabsDeclType declType) {
                events.add("decl " + declType.getClass().getSimpleName() + " " + this.depth);
                return VisitAction.doChildren();
            }

            @Override
            public void enterScope() {
                events.add("enter");
                this.depth++;
            }

            @Override
            public void exitScope() {
                events.add("exit");
                this.depth--;
            }
        };
        // int h(int a);
        CabsName h = new CabsName("h", new CabsProto(CabsJustBase.INSTANCE, list(parameter("a")), false),
                ImmutableList.of());
        CabsDefinition declaration = new CabsDeclaration(new CabsInitNameGroup(intSpec(), new CabsInitName(h)), LOCATION);
        CabsRewriter.visitFile(visitor, list(declaration));
        Assert.assertEquals(List.of(
                "name h 0",
                "decl CabsProto 0",
                "decl CabsJustBase 0",
                "enter",
                "name a 1",
                "decl CabsJustBase 1",
                "exit"), events);
    }

    /** Duplicates computations that use the variable "dup" and deletes empty statements. */
    static class DuplicateAndDelete extends NopCabsVisitor {
        @Override
        public VisitAction<List<CabsStatement>> visitStatement(CabsStatement statement) {
            if (statement.is(CabsNop.class))
                return VisitAction.delete();
            CabsComputation computation = statement.as(CabsComputation.class);
            if (computation != null && computation.expression.toString().equals("dup"))
                return VisitAction.changeToList(statement, statement);
            return VisitAction.doChildren();
        }
    }

    @Test
    public void testMultipleStatementsInSlotAreWrapped() {
        CabsStatement dup = compute(var("dup"));
        CabsIf ifStatement = new CabsIf(var("c"), dup, new CabsNop(line(5)), line(5));
        ImmutableList<CabsStatement> result = new CabsRewriter(new DuplicateAndDelete()).rewriteStatement(ifStatement);
        Assert.assertEquals(1, result.size());
        CabsIf rewritten = result.get(0).to(CabsIf.class);

        CabsBlockStatement positive = rewritten.positive.to(CabsBlockStatement.class);
        Assert.assertEquals(list(dup, dup), positive.block.statements);
        Assert.assertTrue(positive.block.labels.isEmpty());
        Assert.assertTrue(positive.block.attributes.isEmpty());
        Assert.assertTrue(positive.block.definitions.isEmpty());
        Assert.assertEquals(line(5), positive.location);

        // The deleted else branch becomes an empty block
        CabsBlockStatement negative = rewritten.negative.to(CabsBlockStatement.class);
        Assert.assertTrue(negative.block.statements.isEmpty());
    }

    @Test
    public void testMultipleStatementsInBlockAreSpliced() {
        CabsStatement dup = compute(var("dup"));
        CabsStatement other = compute(var("other"));
        CabsBlock block = CabsBlock.of(new CabsNop(LOCATION), dup, other, new CabsNop(LOCATION));
        CabsBlock result = new CabsRewriter(new DuplicateAndDelete()).rewriteBlock(block);
        Assert.assertEquals(list(dup, dup, other), result.statements);
    }

    @Test
    public void testSingleReplacementInSlotIsNotWrapped() {
        CabsStatement replacement = compute(var("r"));
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<List<CabsStatement>> visitStatement(CabsStatement statement) {
                if (statement.is(CabsComputation.class))
                    return VisitAction.changeToList(replacement);
                return VisitAction.doChildren();
            }
        };
        CabsIf ifStatement = new CabsIf(var("c"), compute(var("x")), new CabsNop(LOCATION), LOCATION);
        CabsIf result = new CabsRewriter(visitor).rewriteStatement(ifStatement).get(0).to(CabsIf.class);
        Assert.assertSame(replacement, result.positive);
        Assert.assertSame(ifStatement.negative, result.negative);
    }

    @Test
    public void testDeleteDefinitions() {
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<List<CabsDefinition>> visitDefinition(CabsDefinition definition) {
                if (definition.is(CabsOnlyTypedef.class))
                    return VisitAction.delete();
                return VisitAction.doChildren();
            }
        };
        ImmutableList<CabsDefinition> file = sampleFile();
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(visitor, file);
        Assert.assertEquals(4, result.size());
        Assert.assertSame(file.get(1), result.get(0));
        Assert.assertSame(file.get(3), result.get(1));
    }

    @Test
    public void testAttributeInSpecifierMustStaySingle() {
        CountingVisitor visitor = new CountingVisitor() {
            @Override
            public VisitAction<List<CabsAttribute>> visitAttribute(CabsAttribute attribute) {
                return VisitAction.delete();
            }
        };
        CabsSpecifier spec = new CabsSpecifier(
                new CabsSpecAttribute(new CabsAttribute("packed")),
                new CabsSpecType(CabsBuiltinType.get(CabsTypeCode.INT)));
        CabsDefinition local = new CabsDeclaration(new CabsInitNameGroup(spec, new CabsInitName(new CabsName("v"))), LOCATION);
        CabsBlock body = new CabsBlock(ImmutableList.of(), ImmutableList.of(), list(local), ImmutableList.of());
        ImmutableList<CabsDefinition> file = list(function("f", ImmutableList.of(), body));
        try {
            CabsRewriter.visitFile(visitor, file);
            Assert.fail("Expected an exception");
        } catch (InternalCompilerError ex) {
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("packed"));
            Assert.assertNotNull(ex.cabsNode);
        }
        // Scopes are exited while the exception propagates
        Assert.assertEquals(visitor.enters, visitor.exits);
        Assert.assertEquals(0, visitor.depth);
    }

    @Test
    public void testAttributeInSpecifierCanBeReplaced() {
        CabsAttribute aligned = new CabsAttribute("aligned", constant(8));
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<List<CabsAttribute>> visitAttribute(CabsAttribute attribute) {
                return VisitAction.changeToList(aligned);
            }
        };
        CabsSpecifier spec = new CabsSpecifier(new CabsSpecAttribute(new CabsAttribute("packed")));
        CabsSpecifier result = new CabsRewriter(visitor).rewriteSpecifier(spec);
        Assert.assertSame(aligned, result.elements.get(0).to(CabsSpecAttribute.class).attribute);
    }

    @Test
    public void testAttributesOfDeclaratorsAndNames() {
        CountingVisitor visitor = new CountingVisitor() {
            @Override
            public VisitAction<List<CabsAttribute>> visitAttribute(CabsAttribute attribute) {
                super.visitAttribute(attribute);
                return VisitAction.delete();
            }
        };
        CabsAttribute constQualifier = new CabsAttribute("const");
        CabsAttribute aligned = new CabsAttribute("aligned", var("n"));
        CabsDeclType declType = new CabsParenType(list(new CabsAttribute("cdecl")),
                new CabsPointer(list(constQualifier), CabsJustBase.INSTANCE), ImmutableList.of());
        CabsName name = new CabsName("v", declType, list(aligned));
        CabsName result = new CabsRewriter(visitor).rewriteName(NameKind.VARIABLE, intSpec(), name);
        // Only the attribute of the parenthesized declarator goes through the hook
        Assert.assertEquals(1, visitor.attributes);
        // The arguments of the name attributes are still visited
        Assert.assertEquals(1, visitor.variables);
        CabsParenType paren = result.declType.to(CabsParenType.class);
        Assert.assertTrue(paren.preAttributes.isEmpty());
        Assert.assertSame(constQualifier, paren.inner.to(CabsPointer.class).qualifiers.get(0));
        Assert.assertSame(name.attributes, result.attributes);
    }

    @Test
    public void testIndexRangeDesignatorKeepsRewrittenBounds() {
        CabsCompoundInit init = new CabsCompoundInit(
                new CabsInitializer(new CabsAtIndexRangeInit(var("lo"), var("hi")), new CabsSingleInit(var("v"))));
        CabsCompoundInit result = new CabsRewriter(new UpperCase()).rewriteInitExpression(init)
                .to(CabsCompoundInit.class);
        CabsAtIndexRangeInit range = result.initializers.get(0).what.to(CabsAtIndexRangeInit.class);
        Assert.assertEquals("LO", range.low.toString());
        Assert.assertEquals("HI", range.high.toString());
        Assert.assertEquals("{ [LO ... HI] = V }", result.toString());
    }

    @Test
    public void testStructWithoutFieldsIsLeaf() {
        CabsStructType reference = new CabsStructType("s", null);
        CabsTypeSpecifier result = new CabsRewriter(new UpperCase()).rewriteTypeSpecifier(reference);
        Assert.assertSame(reference, result);
    }

    @Test
    public void testFunctionNameVisitedWithoutGroupHook() {
        List<String> names = new ArrayList<>();
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<CabsName> visitName(NameKind kind, CabsSpecifier specifier, CabsName name) {
                names.add(name.name);
                if (name.name.equals("f"))
                    return VisitAction.changeTo(name.withName("g"));
                return VisitAction.doChildren();
            }
        };
        CabsFunctionDefinition function = function("f", list(parameter("a")), CabsBlock.of());
        ImmutableList<CabsDefinition> result = CabsRewriter.visitFile(visitor, list(function));
        // The replacement is not visited, so the parameter is not seen
        Assert.assertEquals(List.of("f"), names);
        CabsSingleName name = result.get(0).to(CabsFunctionDefinition.class).name;
        Assert.assertEquals("g", name.name.name);
        Assert.assertSame(function.body, result.get(0).to(CabsFunctionDefinition.class).body);
    }

    @Test
    public void testNullPostFunctionResult() {
        NopCabsVisitor visitor = new NopCabsVisitor() {
            @Override
            public VisitAction<CabsExpression> visitExpression(CabsExpression expression) {
                return VisitAction.changeDoChildrenPost(expression, e -> null);
            }
        };
        Assert.assertThrows(InternalCompilerError.class,
                () -> new CabsRewriter(visitor).rewriteExpression(var("x")));
    }

    @Test
    public void testNullPayloadRejected() {
        Assert.assertThrows(NullPointerException.class, () -> VisitAction.changeTo(null));
        Assert.assertThrows(NullPointerException.class,
                () -> VisitAction.changeDoChildrenPost(var("x"), null));
    }
}
