/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.templar.irb;

import net.hydromatic.templar.ast.Op;
import net.hydromatic.templar.ast.SourceBranch;
import net.hydromatic.templar.type.CustomType;
import net.hydromatic.templar.type.FunctionType;
import net.hydromatic.templar.type.ListType;
import net.hydromatic.templar.type.PrimitiveType;
import net.hydromatic.templar.type.SetType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static net.hydromatic.templar.irb.IrBBuilder.irB;
import static net.hydromatic.templar.irb.IrBFixtures.INT_TO_INT;
import static net.hydromatic.templar.irb.IrBFixtures.MY_ERROR;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for IR-B nodes and {@link IrBBuilder}. */
public class IrBTest {
  private final IrB.VarReference x = irB.var(PrimitiveType.INT, "x");
  private final IrB.VarReference y = irB.var(PrimitiveType.INT, "y");
  private final IrB.VarReference b = irB.var(PrimitiveType.BOOL, "b");
  private final IrB.VarReference f =
      irB.globalFunction(INT_TO_INT, "f", true);

  @Test void testEquality() {
    final IrB.EqualityComparison e = irB.equal(x, irB.intLiteral(3));
    assertThat(e.type, is(PrimitiveType.BOOL));
    assertThat(e.toString(), is("x == 3"));
    assertThrows(IllegalArgumentException.class, () -> irB.equal(x, b));
    assertThrows(IllegalArgumentException.class, () -> irB.equal(f, f));
  }

  @Test void testOperands() {
    // Operands may be arbitrary expressions
    final IrB.Expr e =
        irB.and(irB.not(b),
            irB.intComparison(irB.intBinaryOp(x, Op.PLUS, y), Op.LT,
                irB.unaryMinus(irB.intLiteral(4))));
    assertThat(e.type, is(PrimitiveType.BOOL));
    assertThat(e.toString(), is("(not b) and ((x + y) < (-4))"));
    assertThat(irB.intBinaryOp(x, Op.MOD, irB.intLiteral(-2)).toString(),
        is("x % (-2)"));
    assertThat(irB.functionCall(f, irB.intBinaryOp(x, Op.TIMES, y))
        .toString(), is("f(x * y)"));

    assertThrows(IllegalArgumentException.class, () -> irB.and(b, x));
    assertThrows(IllegalArgumentException.class, () -> irB.or(x, b));
    assertThrows(IllegalArgumentException.class,
        () -> irB.intBinaryOp(x, Op.AND, y));
  }

  @Test void testFunctionCall() {
    final IrB.FunctionCall call = irB.functionCall(f, x);
    assertThat(call.type, is(PrimitiveType.INT));
    assertThat(call.mayThrow, is(true));

    // A call to a global function that cannot throw does not throw
    final IrB.VarReference g = irB.globalFunction(INT_TO_INT, "g", false);
    assertThat(irB.functionCall(g, x).mayThrow, is(false));

    // A call through a local variable may throw
    final IrB.VarReference h = irB.var(INT_TO_INT, "h");
    assertThat(irB.functionCall(h, x).mayThrow, is(true));

    assertThrows(IllegalArgumentException.class,
        () -> irB.functionCall(f, b));
    assertThrows(IllegalArgumentException.class,
        () -> irB.functionCall(f, x, y));
    assertThrows(IllegalArgumentException.class,
        () -> irB.functionCall(x, y));
  }

  @Test void testCollections() {
    final IrB.SetExpr set =
        irB.set(PrimitiveType.INT,
            ImmutableList.of(irB.intLiteral(1), irB.intLiteral(2)));
    assertThat(set.type, is(SetType.of(PrimitiveType.INT)));
    assertThat(set.toString(), is("{1, 2}"));
    assertThat(irB.set(PrimitiveType.INT, ImmutableList.of()).toString(),
        is("set()"));
    assertThat(irB.intSetSum(set).type, is(PrimitiveType.INT));
    assertThat(irB.in(x, set).toString(), is("x in {1, 2}"));
    assertThrows(IllegalArgumentException.class, () -> irB.intListSum(set));
    assertThrows(IllegalArgumentException.class, () -> irB.in(b, set));
    assertThrows(IllegalArgumentException.class,
        () -> irB.set(PrimitiveType.INT, ImmutableList.of(b)));

    final IrB.VarReference rest =
        irB.var(ListType.of(PrimitiveType.INT), "rest");
    final IrB.ListExpr list =
        irB.list(PrimitiveType.INT, ImmutableList.of(x), rest);
    assertThat(list.toString(), is("[x, *rest]"));
    assertThat(irB.in(y, list).type, is(PrimitiveType.BOOL));
    assertThrows(IllegalArgumentException.class,
        () -> irB.list(PrimitiveType.BOOL, ImmutableList.of(), rest));

    final IrB.ListComprehension comprehension =
        irB.listComprehension(list, y, irB.functionCall(f, y), null, null);
    assertThat(comprehension.type, is(ListType.of(PrimitiveType.INT)));
    assertThat(comprehension.toString(), is("[f(y) for y in [x, *rest]]"));
    final IrB.SetComprehension setComprehension =
        irB.setComprehension(set, y, irB.equal(y, x), null, null);
    assertThat(setComprehension.type, is(SetType.of(PrimitiveType.BOOL)));
    assertThat(setComprehension.toString(),
        is("{y == x for y in {1, 2}}"));

    // A comprehension may not yield functions
    assertThrows(IllegalArgumentException.class,
        () -> irB.listComprehension(list, y, f, null, null));
    // The loop variable must have the element type
    assertThrows(IllegalArgumentException.class,
        () -> irB.setComprehension(set, b, b, null, null));
  }

  @Test void testAttributeAccess() {
    final IrB.VarReference e = irB.var(MY_ERROR, "e");
    assertThat(irB.attributeAccess(e, "code", PrimitiveType.INT).toString(),
        is("e.code"));
    assertThrows(IllegalArgumentException.class,
        () -> irB.attributeAccess(e, "message", PrimitiveType.INT));
    assertThrows(IllegalArgumentException.class,
        () -> irB.attributeAccess(x, "code", PrimitiveType.INT));
  }

  @Test void testStatements() {
    assertThrows(IllegalArgumentException.class,
        () -> irB.assignment(x, b));
    assertThrows(IllegalArgumentException.class,
        () -> irB.assignment(f, f));
    assertThrows(IllegalArgumentException.class,
        () -> irB.assertStmt(x, "x", null));
    assertThrows(IllegalArgumentException.class,
        () -> irB.ifStmt(x, ImmutableList.of(), ImmutableList.of()));

    // Only exceptions may be raised or caught
    assertThrows(IllegalArgumentException.class, () -> irB.raise(x, null));
    assertThrows(IllegalArgumentException.class,
        () -> irB.tryExcept(ImmutableList.of(irB.pass()),
            CustomType.of("Point"), "p", ImmutableList.of(), null, null));

    // A value of the bottom type may be assigned to any variable
    final FunctionType intToBottom =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT),
            PrimitiveType.BOTTOM);
    final IrB.VarReference fail =
        irB.globalFunction(intToBottom, "fail", true);
    assertThat(irB.assignment(b, irB.functionCall(fail, x)).toString(),
        is("b = fail(x)\n"));
  }

  @Test void testFunctionDefn() {
    final IrB.VarReference e = irB.var(MY_ERROR, "e");
    final SourceBranch branch = new SourceBranch("a.py", 3, 4);
    final IrB.FunctionDefn defn =
        irB.functionDefn("g",
            ImmutableList.of(irB.argDecl(PrimitiveType.INT, "y")),
            ImmutableList.of(
                irB.tryExcept(
                    ImmutableList.of(
                        irB.assignment(x, irB.functionCall(f, y), branch)),
                    MY_ERROR, "e",
                    ImmutableList.of(
                        irB.ifStmt(irB.equal(irB.attributeAccess(e, "code",
                                PrimitiveType.INT), irB.intLiteral(0)),
                            ImmutableList.of(irB.raise(e, null)),
                            ImmutableList.of())),
                    null, null),
                irB.returnStmt(x)),
            PrimitiveType.INT);
    final String expected = "def g(y: int) -> int:\n"
        + "  try:\n"
        + "    x = f(y)\n"
        + "  except MyError as e:\n"
        + "    if e.code == 0:\n"
        + "      raise e\n"
        + "  return x\n"
        + "\n";
    assertThat(defn.toString(), is(expected));
    assertThat(defn.toString(), is(defn.toString()));

    final String expectedVerbose = "def g(y: int) -> int:\n"
        + "  try:\n"
        + "    x = f(y)  # branch: a.py:3->4\n"
        + "  except MyError as e:\n"
        + "    if e.code == 0:\n"
        + "      raise e\n"
        + "  return x\n"
        + "\n";
    assertThat(defn.unparse(true), is(expectedVerbose));

    assertThrows(IllegalArgumentException.class,
        () -> irB.functionDefn("h", ImmutableList.of(), ImmutableList.of(),
            PrimitiveType.INT));
  }

  @Test void testModule() {
    final IrB.FunctionDefn defn =
        irB.functionDefn("id",
            ImmutableList.of(irB.argDecl(PrimitiveType.INT, "x")),
            ImmutableList.of(irB.returnStmt(x)), PrimitiveType.INT);
    final IrB.Module module =
        irB.module(ImmutableList.of(defn),
            ImmutableList.of(
                irB.assertStmt(irB.boolLiteral(true), "always", null)),
            ImmutableList.of(MY_ERROR), ImmutableSet.of("id", "MyError"),
            ImmutableList.of(irB.pass()));
    final String expected = "class MyError:\n"
        + "  def __init__(code: int):\n"
        + "    self.code = code\n"
        + "def id(x: int) -> int:\n"
        + "  return x\n"
        + "\n"
        + "assert True\n"
        + "pass\n";
    assertThat(module.toString(), is(expected));
    assertThat(module.functionDefn("id"), sameInstance(defn));
    assertThat(module.functionDefn("missing") == null, is(true));
  }

  @Test void testMatch() {
    final IrB.VarReference t = irB.var(PrimitiveType.TYPE, "t");
    final IrB.VarReference tt = irB.var(PrimitiveType.TYPE, "T");
    final IrB.MatchCase pointerCase =
        irB.matchCase(ImmutableList.of(irB.pointerType(tt)),
            ImmutableList.of("T"), ImmutableList.of(), irB.intLiteral(1),
            null, null);
    final IrB.MatchCase mainCase =
        irB.matchCase(ImmutableList.of(tt), ImmutableList.of("T"),
            ImmutableList.of(), irB.intLiteral(2), null, null);
    assertThat(pointerCase.isMainDefinition(), is(false));
    assertThat(mainCase.isMainDefinition(), is(true));

    final IrB.MatchExpr match =
        irB.match(ImmutableList.of(t),
            ImmutableList.of(pointerCase, mainCase));
    assertThat(match.type, is(PrimitiveType.INT));
    final String expected = "match(t)({\n"
        + "  lambda T:\n"
        + "    Type.pointer(T):\n"
        + "      1,\n"
        + "  lambda T:\n"
        + "    T:\n"
        + "      2,\n"
        + "})";
    assertThat(match.toString(), is(expected));

    final IrB.MatchCase boolCase =
        irB.matchCase(ImmutableList.of(irB.pointerType(tt)),
            ImmutableList.of("T"), ImmutableList.of(), irB.boolLiteral(true),
            null, null);
    // Cases of different types; two main definitions
    assertThrows(IllegalArgumentException.class,
        () -> irB.match(ImmutableList.of(t),
            ImmutableList.of(mainCase, boolCase)));
    assertThrows(IllegalArgumentException.class,
        () -> irB.match(ImmutableList.of(t),
            ImmutableList.of(mainCase, mainCase)));
  }

  @Test void testCopyReturnsSameNodeIfUnchanged() {
    final IrB.Expr sum = irB.intBinaryOp(x, Op.PLUS, y);
    assertThat(((IrB.IntBinaryOpExpr) sum).copy(x, y), sameInstance(sum));
    final IrB.Expr sum2 = ((IrB.IntBinaryOpExpr) sum).copy(y, x);
    assertThat(sum2.toString(), is("y + x"));
    assertThat(((IrB.IntBinaryOpExpr) sum2).operator, is(Op.PLUS));
  }
}

// End IrBTest.java
