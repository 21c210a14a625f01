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
package net.hydromatic.templar.ira;

import net.hydromatic.templar.ast.Op;
import net.hydromatic.templar.type.CustomType;
import net.hydromatic.templar.type.CustomTypeArgDecl;
import net.hydromatic.templar.type.FunctionType;
import net.hydromatic.templar.type.ListType;
import net.hydromatic.templar.type.ParameterPackType;
import net.hydromatic.templar.type.PrimitiveType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static net.hydromatic.templar.ira.IrABuilder.irA;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for IR-A nodes and {@link IrABuilder}. */
public class IrATest {
  private static final FunctionType INT_TO_INT =
      FunctionType.of(ImmutableList.of(PrimitiveType.INT), PrimitiveType.INT);

  private final IrA.VarReference x = irA.var(PrimitiveType.INT, "x");
  private final IrA.VarReference y = irA.var(PrimitiveType.INT, "y");
  private final IrA.VarReference b = irA.var(PrimitiveType.BOOL, "b");
  private final IrA.VarReference t = irA.var(PrimitiveType.TYPE, "t");
  private final IrA.VarReference f = irA.var(INT_TO_INT, "f");

  @Test void testEquality() {
    final IrA.EqualityComparison e = irA.equal(x, y);
    assertThat(e.type, is(PrimitiveType.BOOL));
    assertThat(e.op, is(Op.EQUAL));
    assertThat(e.toString(), is("x == y"));

    // Operands of different types
    assertThrows(IllegalArgumentException.class, () -> irA.equal(x, b));

    // Functions cannot be compared
    final IrA.VarReference g = irA.var(INT_TO_INT, "g");
    assertThrows(IllegalArgumentException.class, () -> irA.equal(f, g));

    // An error-or-void value may be compared with a type
    final IrA.VarReference err =
        irA.var(PrimitiveType.ERROR_OR_VOID, "err");
    assertThat(irA.equal(err, t).type, is(PrimitiveType.BOOL));
  }

  @Test void testStructuralEquality() {
    assertThat(irA.equal(x, y).equals(irA.equal(x, y)), is(true));
    assertThat(irA.equal(x, y).hashCode() == irA.equal(x, y).hashCode(),
        is(true));
    assertThat(irA.equal(x, y).equals(irA.equal(y, x)), is(false));
    assertThat(irA.var(PrimitiveType.INT, "x").equals(x), is(true));
    assertThat(irA.var(PrimitiveType.BOOL, "x").equals(x), is(false));
  }

  @Test void testFunctionCall() {
    final IrA.FunctionCall call = irA.functionCall(f, x);
    assertThat(call.type, is(PrimitiveType.INT));
    assertThat(call.toString(), is("f(x)"));

    // A value of the bottom type may be passed as any argument
    final IrA.VarReference bottom = irA.var(PrimitiveType.BOTTOM, "u");
    assertThat(irA.functionCall(f, bottom).type, is(PrimitiveType.INT));

    // Wrong argument type, wrong number of arguments, no arguments, not a
    // function
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionCall(f, b));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionCall(f, x, y));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionCall(f, ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionCall(x, y));
  }

  @Test void testOperators() {
    assertThat(irA.intBinaryOp(x, Op.DIVIDE, y).toString(), is("x // y"));
    assertThat(irA.intComparison(x, Op.LE, y).type, is(PrimitiveType.BOOL));
    assertThat(irA.not(b).type, is(PrimitiveType.BOOL));
    assertThat(irA.unaryMinus(x).type, is(PrimitiveType.INT));
    assertThrows(IllegalArgumentException.class,
        () -> irA.intBinaryOp(x, Op.LT, y));
    assertThrows(IllegalArgumentException.class,
        () -> irA.intComparison(x, Op.PLUS, y));
    assertThrows(IllegalArgumentException.class, () -> irA.not(x));
    assertThrows(IllegalArgumentException.class, () -> irA.unaryMinus(b));

    final IrA.VarReference ints =
        irA.var(ListType.of(PrimitiveType.INT), "ints");
    final IrA.VarReference bools =
        irA.var(ListType.of(PrimitiveType.BOOL), "bools");
    assertThat(irA.intListSum(ints).type, is(PrimitiveType.INT));
    assertThat(irA.boolListAll(bools).type, is(PrimitiveType.BOOL));
    assertThat(irA.listConcat(ints, ints).type,
        is(ListType.of(PrimitiveType.INT)));
    assertThat(irA.isInList(x, ints).type, is(PrimitiveType.BOOL));
    assertThrows(IllegalArgumentException.class, () -> irA.intListSum(bools));
    assertThrows(IllegalArgumentException.class,
        () -> irA.listConcat(ints, bools));
    assertThrows(IllegalArgumentException.class, () -> irA.isInList(b, ints));
  }

  @Test void testTypeExprs() {
    assertThat(irA.pointerType(t).toString(), is("Type.pointer(t)"));
    assertThat(irA.atomicTypeLiteral("int").toString(), is("Type('int')"));
    assertThrows(IllegalArgumentException.class, () -> irA.pointerType(x));
    assertThrows(IllegalArgumentException.class,
        () -> irA.atomicTypeLiteral(""));
  }

  @Test void testAttributeAccess() {
    final CustomType point =
        CustomType.of("Point", new CustomTypeArgDecl("x", PrimitiveType.INT));
    final IrA.VarReference p = irA.var(point, "p");
    final IrA.AttributeAccessExpr e =
        irA.attributeAccess(p, "x", PrimitiveType.INT);
    assertThat(e.type, is(PrimitiveType.INT));
    assertThat(e.toString(), is("p.x"));

    // No such field; field has a different type; variable is an int
    assertThrows(IllegalArgumentException.class,
        () -> irA.attributeAccess(p, "z", PrimitiveType.INT));
    assertThrows(IllegalArgumentException.class,
        () -> irA.attributeAccess(p, "x", PrimitiveType.BOOL));
    assertThrows(IllegalArgumentException.class,
        () -> irA.attributeAccess(x, "x", PrimitiveType.INT));

    // Attributes of types are not checked
    assertThat(irA.attributeAccess(t, "value", PrimitiveType.INT).type,
        is(PrimitiveType.INT));
  }

  @Test void testMatch() {
    final FunctionType typeToInt =
        FunctionType.of(ImmutableList.of(PrimitiveType.TYPE),
            PrimitiveType.INT);
    final IrA.VarReference h =
        irA.varReference(typeToInt, "h", true, false);
    final IrA.VarReference tt = irA.var(PrimitiveType.TYPE, "T");
    final IrA.MatchCase mainCase =
        irA.matchCase(ImmutableList.of(irA.varPattern(PrimitiveType.TYPE, "T")),
            ImmutableList.of("T"), ImmutableList.of(), irA.functionCall(h, tt));
    final IrA.MatchCase pointerCase =
        irA.matchCase(
            ImmutableList.of(
                irA.pointerTypePattern(
                    irA.varPattern(PrimitiveType.TYPE, "T"))),
            ImmutableList.of("T"), ImmutableList.of(), irA.functionCall(h, tt));
    assertThat(mainCase.isMainDefinition(), is(true));
    assertThat(pointerCase.isMainDefinition(), is(false));

    final IrA.MatchExpr match =
        irA.match(ImmutableList.of(t), ImmutableList.of(pointerCase, mainCase));
    assertThat(match.type, is(PrimitiveType.INT));

    // Two main definitions
    assertThrows(IllegalArgumentException.class,
        () -> irA.match(ImmutableList.of(t),
            ImmutableList.of(mainCase, mainCase)));
    // Wrong number of patterns
    assertThrows(IllegalArgumentException.class,
        () -> irA.match(ImmutableList.of(t, t), ImmutableList.of(mainCase)));
    // No cases
    assertThrows(IllegalArgumentException.class,
        () -> irA.match(ImmutableList.of(t), ImmutableList.of()));

    final String expected = "r = match(t)({\n"
        + "  lambda T:\n"
        + "    Type.pointer(T):\n"
        + "      h(T),\n"
        + "  lambda T:\n"
        + "    T:\n"
        + "      h(T),\n"
        + "})\n";
    assertThat(irA.assignment(irA.var(PrimitiveType.INT, "r"), match)
        .toString(), is(expected));
  }

  @Test void testAssignment() {
    assertThat(irA.assignment(y, irA.functionCall(f, x)).toString(),
        is("y = f(x)\n"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.assignment(b, irA.functionCall(f, x)));

    // The error of a call may be assigned to a second variable
    final IrA.VarReference err =
        irA.var(PrimitiveType.ERROR_OR_VOID, "err");
    assertThat(irA.assignment(y, err, irA.functionCall(f, x)).toString(),
        is("y, err = f(x)\n"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.assignment(y, b, irA.functionCall(f, x)));
    assertThrows(IllegalArgumentException.class,
        () -> irA.assignment(y, err, irA.intBinaryOp(x, Op.PLUS, x)));

    // The expression must have exactly the type of the variable
    final FunctionType intToBottom =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT),
            PrimitiveType.BOTTOM);
    final IrA.VarReference fail = irA.var(intToBottom, "fail");
    assertThrows(IllegalArgumentException.class,
        () -> irA.assignment(y, irA.functionCall(fail, x)));
    final IrA.VarReference u = irA.var(PrimitiveType.BOTTOM, "u");
    assertThat(irA.assignment(u, irA.functionCall(fail, x)).lhs, is(u));
  }

  @Test void testSafeUncheckedCast() {
    final CustomType error = CustomType.exception("MyError", "bad");
    final IrA.VarReference err =
        irA.var(PrimitiveType.ERROR_OR_VOID, "err");
    final IrA.SafeUncheckedCast cast = irA.safeUncheckedCast(err, error);
    assertThat(cast.type, is(error));
    assertThat(cast.var, is(err));

    // Only an error-or-void value may be cast
    assertThrows(IllegalArgumentException.class,
        () -> irA.safeUncheckedCast(t, error));
    assertThrows(IllegalArgumentException.class,
        () -> irA.safeUncheckedCast(x, error));
  }

  @Test void testSetOperations() {
    final ListType intList = ListType.of(PrimitiveType.INT);
    final IrA.VarReference ints = irA.var(intList, "ints");
    final IrA.VarReference ints2 = irA.var(intList, "ints2");
    final IrA.VarReference bools =
        irA.var(ListType.of(PrimitiveType.BOOL), "bools");

    assertThat(irA.setEqual(ints, ints2).type, is(PrimitiveType.BOOL));
    assertThrows(IllegalArgumentException.class,
        () -> irA.setEqual(ints, bools));
    assertThrows(IllegalArgumentException.class, () -> irA.setEqual(x, y));

    assertThat(irA.addToSet(ints, x).type, is(intList));
    assertThrows(IllegalArgumentException.class, () -> irA.addToSet(ints, b));
    assertThrows(IllegalArgumentException.class, () -> irA.addToSet(x, y));

    assertThat(irA.setToList(ints).type, is(intList));
    assertThat(irA.listToSet(bools).type,
        is(ListType.of(PrimitiveType.BOOL)));
    assertThrows(IllegalArgumentException.class, () -> irA.setToList(x));
    assertThrows(IllegalArgumentException.class, () -> irA.listToSet(t));
  }

  @Test void testParameterPackExpansion() {
    final IrA.VarReference pack =
        irA.var(ParameterPackType.of(PrimitiveType.TYPE), "ts");
    final IrA.ParameterPackExpansion expansion =
        irA.parameterPackExpansion(pack);
    assertThat(expansion.type, is(PrimitiveType.TYPE));
    assertThat(expansion.expr, is(pack));

    // A list is not a parameter pack
    final IrA.VarReference types =
        irA.var(ListType.of(PrimitiveType.TYPE), "types");
    assertThrows(IllegalArgumentException.class,
        () -> irA.parameterPackExpansion(types));
    assertThrows(IllegalArgumentException.class,
        () -> irA.parameterPackExpansion(t));
  }

  @Test void testListComprehension() {
    final IrA.VarReference ints =
        irA.var(ListType.of(PrimitiveType.INT), "ints");
    final FunctionType intToBool =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT),
            PrimitiveType.BOOL);
    final IrA.VarReference isOdd = irA.var(intToBool, "is_odd");
    final IrA.ListComprehensionExpr e =
        irA.listComprehension(ints, x, irA.functionCall(isOdd, x));
    assertThat(e.type, is(ListType.of(PrimitiveType.BOOL)));

    // The loop variable must have the element type of the list
    assertThrows(IllegalArgumentException.class,
        () -> irA.listComprehension(ints, b, irA.functionCall(f, x)));
    // The list variable must be a list
    assertThrows(IllegalArgumentException.class,
        () -> irA.listComprehension(y, x, irA.functionCall(f, x)));
  }

  @Test void testStatements() {
    assertThat(irA.assertStmt(b, "must hold").message, is("must hold"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.assertStmt(x, "must hold"));

    final IrA.VarReference err =
        irA.var(PrimitiveType.ERROR_OR_VOID, "err");
    assertThat(irA.checkIfError(err).var, is(err));
    assertThrows(IllegalArgumentException.class, () -> irA.checkIfError(b));

    final IrA.IfStmt ifStmt =
        irA.ifStmt(b, ImmutableList.of(irA.pass()), ImmutableList.of());
    assertThat(ifStmt.ifStmts.size(), is(1));
    assertThat(ifStmt.elseStmts.isEmpty(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> irA.ifStmt(x, ImmutableList.of(irA.pass()),
            ImmutableList.of()));
  }

  @Test void testUnpackingAssignment() {
    final IrA.VarReference ints =
        irA.var(ListType.of(PrimitiveType.INT), "ints");
    final IrA.UnpackingAssignment a =
        irA.unpackingAssignment(ImmutableList.of(x, y), ints, "bad length");
    assertThat(a.lhsList, is(ImmutableList.of(x, y)));
    assertThat(a.errorMessage, is("bad length"));

    // No variables; a variable of the wrong type; not a list
    assertThrows(IllegalArgumentException.class,
        () -> irA.unpackingAssignment(ImmutableList.of(), ints, "e"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.unpackingAssignment(ImmutableList.of(x, b), ints, "e"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.unpackingAssignment(ImmutableList.of(x), y, "e"));
  }

  @Test void testTemplateTypeExprs() {
    final IrA.VarReference args =
        irA.var(ListType.of(PrimitiveType.TYPE), "args");
    final IrA.VarReference ints =
        irA.var(ListType.of(PrimitiveType.INT), "ints");

    assertThat(irA.functionType(t, args).type, is(PrimitiveType.TYPE));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionType(x, args));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionType(t, ints));

    final IrA.TemplateInstantiationExpr instantiation =
        irA.templateInstantiation("std::vector", args);
    assertThat(instantiation.type, is(PrimitiveType.TYPE));
    assertThat(instantiation.templateAtomicCppType, is("std::vector"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.templateInstantiation("std::vector", t));

    final IrA.TemplateMemberAccessExpr access =
        irA.templateMemberAccess(t, "apply", args);
    assertThat(access.type, is(PrimitiveType.TYPE));
    assertThat(access.memberName, is("apply"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.templateMemberAccess(x, "apply", args));
    assertThrows(IllegalArgumentException.class,
        () -> irA.templateMemberAccess(t, "apply", ints));
  }

  @Test void testWrappedTypePatterns() {
    final IrA.VarReferencePattern tp =
        irA.varPattern(PrimitiveType.TYPE, "T");
    final IrA.VarReferencePattern ip = irA.varPattern(PrimitiveType.INT, "n");
    assertThat(irA.pointerTypePattern(tp).type, is(PrimitiveType.TYPE));
    assertThat(irA.referenceTypePattern(tp).type, is(PrimitiveType.TYPE));
    assertThat(irA.rvalueReferenceTypePattern(tp).type,
        is(PrimitiveType.TYPE));
    assertThat(irA.constTypePattern(tp).type, is(PrimitiveType.TYPE));
    assertThat(irA.arrayTypePattern(tp).type, is(PrimitiveType.TYPE));
    assertThat(irA.constTypePattern(irA.pointerTypePattern(tp)).typePattern
        .type, is(PrimitiveType.TYPE));

    // Only a type can be wrapped
    assertThrows(IllegalArgumentException.class,
        () -> irA.pointerTypePattern(ip));
    assertThrows(IllegalArgumentException.class,
        () -> irA.referenceTypePattern(ip));
    assertThrows(IllegalArgumentException.class,
        () -> irA.rvalueReferenceTypePattern(ip));
    assertThrows(IllegalArgumentException.class,
        () -> irA.constTypePattern(ip));
    assertThrows(IllegalArgumentException.class,
        () -> irA.arrayTypePattern(ip));
  }

  @Test void testCompoundPatterns() {
    final ListType typeList = ListType.of(PrimitiveType.TYPE);
    final IrA.VarReferencePattern tp =
        irA.varPattern(PrimitiveType.TYPE, "T");
    final IrA.VarReferencePattern ip = irA.varPattern(PrimitiveType.INT, "n");
    final IrA.VarReferencePattern argsp = irA.varPattern(typeList, "Args");

    assertThat(irA.functionTypePattern(tp, argsp).type,
        is(PrimitiveType.TYPE));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionTypePattern(ip, argsp));
    assertThrows(IllegalArgumentException.class,
        () -> irA.functionTypePattern(tp, tp));

    final IrA.TemplateInstantiationPattern instantiation =
        irA.templateInstantiationPattern("std::tuple",
            ImmutableList.of(tp), argsp);
    assertThat(instantiation.type, is(PrimitiveType.TYPE));
    assertThat(instantiation.listExtractionArg, is(argsp));
    assertThat(
        irA.templateInstantiationPattern("std::tuple", ImmutableList.of(tp),
            null).listExtractionArg == null, is(true));
    assertThrows(IllegalArgumentException.class,
        () -> irA.templateInstantiationPattern("std::tuple",
            ImmutableList.of(ip), null));
    assertThrows(IllegalArgumentException.class,
        () -> irA.templateInstantiationPattern("std::tuple",
            ImmutableList.of(tp), tp));

    final IrA.ListPattern list =
        irA.listPattern(PrimitiveType.TYPE, ImmutableList.of(tp), argsp);
    assertThat(list.type, is(typeList));
    assertThat(list.elemType, is(PrimitiveType.TYPE));
    assertThrows(IllegalArgumentException.class,
        () -> irA.listPattern(PrimitiveType.TYPE, ImmutableList.of(ip),
            null));
    assertThrows(IllegalArgumentException.class,
        () -> irA.listPattern(PrimitiveType.TYPE, ImmutableList.of(tp),
            irA.varPattern(ListType.of(PrimitiveType.INT), "ns")));
  }

  @Test void testReturnStmt() {
    final IrA.VarReference err =
        irA.var(PrimitiveType.ERROR_OR_VOID, "err");
    assertThat(irA.returnStmt(x, null).toString(), is("return x, None\n"));
    assertThat(irA.returnStmt(null, err).toString(), is("return None, err\n"));
    assertThrows(IllegalArgumentException.class,
        () -> irA.returnStmt(null, null));
    assertThrows(IllegalArgumentException.class,
        () -> irA.returnStmt(x, y));
  }

  @Test void testFunctionDefn() {
    final IrA.FunctionDefn defn =
        irA.functionDefn("inc", "Adds one",
            ImmutableList.of(irA.argDecl(PrimitiveType.INT, "x")),
            ImmutableList.of(
                irA.assignment(irA.var(PrimitiveType.INT, "one"),
                    irA.intLiteral(1)),
                irA.assignment(y,
                    irA.intBinaryOp(x, Op.PLUS,
                        irA.var(PrimitiveType.INT, "one"))),
                irA.ifStmt(b, ImmutableList.of(), ImmutableList.of()),
                irA.returnStmt(y, null)),
            PrimitiveType.INT);
    final String expected = "# Adds one\n"
        + "def inc(x: int) -> int:\n"
        + "  one = 1\n"
        + "  y = x + one\n"
        + "  if b:\n"
        + "    pass\n"
        + "  return y, None\n"
        + "\n";
    assertThat(defn.toString(), is(expected));

    // Serialization is deterministic
    assertThat(defn.toString(), is(defn.toString()));

    // In verbose mode, statements carry a comment describing their operands
    assertThat(defn.unparse(true), containsString("y = x + one  # "));

    assertThrows(IllegalArgumentException.class,
        () -> irA.functionDefn("empty", "", ImmutableList.of(),
            ImmutableList.of(), PrimitiveType.INT));
  }

  @Test void testModule() {
    final CustomType error = CustomType.exception("MyError", "bad");
    final IrA.FunctionDefn defn =
        irA.functionDefn("id", "",
            ImmutableList.of(irA.argDecl(PrimitiveType.INT, "x")),
            ImmutableList.of(irA.returnStmt(x, null)), PrimitiveType.INT);
    final IrA.Module module =
        irA.module(
            ImmutableList.of(irA.customTypeDefn(error),
                irA.checkIfErrorDefn(ImmutableMap.of(error, "bad thing")),
                defn, irA.pass()),
            ImmutableSet.of("id"));
    assertThat(module.publicNames.contains("id"), is(true));
    assertThat(module.toString(), containsString("def id(x: int) -> int:\n"));
    assertThat(module.toString(), containsString("class MyError:\n"));

    // Return statements may not occur at the top level
    assertThrows(IllegalArgumentException.class,
        () -> irA.module(ImmutableList.of(irA.returnStmt(x, null)),
            ImmutableSet.of()));
  }
}

// End IrATest.java
