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
import net.hydromatic.templar.type.PrimitiveType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static net.hydromatic.templar.irb.IrBBuilder.irB;
import static net.hydromatic.templar.irb.IrBFixtures.INT_TO_INT;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests for the IR-B {@link Visitor}. */
public class VisitorTest {
  /** Visitor that overrides every handler, checks that each handler
   * receives a node of its own class, and records the classes it saw. */
  private static class ClassRecorder extends Visitor {
    final Set<Class<?>> classes = new LinkedHashSet<>();
    final List<String> names = new ArrayList<>();

    private void on(Class<? extends IrB.Node> expected, IrB.Node node) {
      assertThat(node.getClass() == expected, is(true));
      classes.add(expected);
      names.add(expected.getSimpleName());
    }

    @Override protected void visit(IrB.VarReference varReference) {
      on(IrB.VarReference.class, varReference);
      super.visit(varReference);
    }

    @Override protected void visit(IrB.MatchExpr matchExpr) {
      on(IrB.MatchExpr.class, matchExpr);
      super.visit(matchExpr);
    }

    @Override protected void visit(IrB.MatchCase matchCase) {
      on(IrB.MatchCase.class, matchCase);
      super.visit(matchCase);
    }

    @Override protected void visit(IrB.BoolLiteral boolLiteral) {
      on(IrB.BoolLiteral.class, boolLiteral);
      super.visit(boolLiteral);
    }

    @Override protected void visit(IrB.IntLiteral intLiteral) {
      on(IrB.IntLiteral.class, intLiteral);
      super.visit(intLiteral);
    }

    @Override protected void visit(IrB.AtomicTypeLiteral atomicTypeLiteral) {
      on(IrB.AtomicTypeLiteral.class, atomicTypeLiteral);
      super.visit(atomicTypeLiteral);
    }

    @Override protected void visit(IrB.PointerTypeExpr pointerTypeExpr) {
      on(IrB.PointerTypeExpr.class, pointerTypeExpr);
      super.visit(pointerTypeExpr);
    }

    @Override protected void visit(IrB.ReferenceTypeExpr referenceTypeExpr) {
      on(IrB.ReferenceTypeExpr.class, referenceTypeExpr);
      super.visit(referenceTypeExpr);
    }

    @Override protected void visit(
        IrB.RvalueReferenceTypeExpr rvalueReferenceTypeExpr) {
      on(IrB.RvalueReferenceTypeExpr.class, rvalueReferenceTypeExpr);
      super.visit(rvalueReferenceTypeExpr);
    }

    @Override protected void visit(IrB.ConstTypeExpr constTypeExpr) {
      on(IrB.ConstTypeExpr.class, constTypeExpr);
      super.visit(constTypeExpr);
    }

    @Override protected void visit(IrB.ArrayTypeExpr arrayTypeExpr) {
      on(IrB.ArrayTypeExpr.class, arrayTypeExpr);
      super.visit(arrayTypeExpr);
    }

    @Override protected void visit(IrB.FunctionTypeExpr functionTypeExpr) {
      on(IrB.FunctionTypeExpr.class, functionTypeExpr);
      super.visit(functionTypeExpr);
    }

    @Override protected void visit(
        IrB.TemplateInstantiationExpr templateInstantiation) {
      on(IrB.TemplateInstantiationExpr.class, templateInstantiation);
      super.visit(templateInstantiation);
    }

    @Override protected void visit(
        IrB.TemplateMemberAccessExpr templateMemberAccess) {
      on(IrB.TemplateMemberAccessExpr.class, templateMemberAccess);
      super.visit(templateMemberAccess);
    }

    @Override protected void visit(IrB.ListExpr listExpr) {
      on(IrB.ListExpr.class, listExpr);
      super.visit(listExpr);
    }

    @Override protected void visit(IrB.SetExpr setExpr) {
      on(IrB.SetExpr.class, setExpr);
      super.visit(setExpr);
    }

    @Override protected void visit(IrB.IntListSumExpr intListSumExpr) {
      on(IrB.IntListSumExpr.class, intListSumExpr);
      super.visit(intListSumExpr);
    }

    @Override protected void visit(IrB.IntSetSumExpr intSetSumExpr) {
      on(IrB.IntSetSumExpr.class, intSetSumExpr);
      super.visit(intSetSumExpr);
    }

    @Override protected void visit(IrB.BoolListAllExpr boolListAllExpr) {
      on(IrB.BoolListAllExpr.class, boolListAllExpr);
      super.visit(boolListAllExpr);
    }

    @Override protected void visit(IrB.BoolListAnyExpr boolListAnyExpr) {
      on(IrB.BoolListAnyExpr.class, boolListAnyExpr);
      super.visit(boolListAnyExpr);
    }

    @Override protected void visit(IrB.BoolSetAllExpr boolSetAllExpr) {
      on(IrB.BoolSetAllExpr.class, boolSetAllExpr);
      super.visit(boolSetAllExpr);
    }

    @Override protected void visit(IrB.BoolSetAnyExpr boolSetAnyExpr) {
      on(IrB.BoolSetAnyExpr.class, boolSetAnyExpr);
      super.visit(boolSetAnyExpr);
    }

    @Override protected void visit(IrB.NotExpr notExpr) {
      on(IrB.NotExpr.class, notExpr);
      super.visit(notExpr);
    }

    @Override protected void visit(IrB.IntUnaryMinusExpr unaryMinusExpr) {
      on(IrB.IntUnaryMinusExpr.class, unaryMinusExpr);
      super.visit(unaryMinusExpr);
    }

    @Override protected void visit(IrB.AndExpr andExpr) {
      on(IrB.AndExpr.class, andExpr);
      super.visit(andExpr);
    }

    @Override protected void visit(IrB.OrExpr orExpr) {
      on(IrB.OrExpr.class, orExpr);
      super.visit(orExpr);
    }

    @Override protected void visit(IrB.EqualityComparison equalityComparison) {
      on(IrB.EqualityComparison.class, equalityComparison);
      super.visit(equalityComparison);
    }

    @Override protected void visit(IrB.InExpr inExpr) {
      on(IrB.InExpr.class, inExpr);
      super.visit(inExpr);
    }

    @Override protected void visit(IrB.ListConcatExpr listConcatExpr) {
      on(IrB.ListConcatExpr.class, listConcatExpr);
      super.visit(listConcatExpr);
    }

    @Override protected void visit(IrB.IntComparisonExpr intComparisonExpr) {
      on(IrB.IntComparisonExpr.class, intComparisonExpr);
      super.visit(intComparisonExpr);
    }

    @Override protected void visit(IrB.IntBinaryOpExpr intBinaryOpExpr) {
      on(IrB.IntBinaryOpExpr.class, intBinaryOpExpr);
      super.visit(intBinaryOpExpr);
    }

    @Override protected void visit(IrB.FunctionCall functionCall) {
      on(IrB.FunctionCall.class, functionCall);
      super.visit(functionCall);
    }

    @Override protected void visit(
        IrB.AttributeAccessExpr attributeAccessExpr) {
      on(IrB.AttributeAccessExpr.class, attributeAccessExpr);
      super.visit(attributeAccessExpr);
    }

    @Override protected void visit(IrB.ListComprehension listComprehension) {
      on(IrB.ListComprehension.class, listComprehension);
      super.visit(listComprehension);
    }

    @Override protected void visit(IrB.SetComprehension setComprehension) {
      on(IrB.SetComprehension.class, setComprehension);
      super.visit(setComprehension);
    }

    @Override protected void visit(IrB.PassStmt passStmt) {
      on(IrB.PassStmt.class, passStmt);
      super.visit(passStmt);
    }

    @Override protected void visit(IrB.Assert assertStmt) {
      on(IrB.Assert.class, assertStmt);
      super.visit(assertStmt);
    }

    @Override protected void visit(IrB.Assignment assignment) {
      on(IrB.Assignment.class, assignment);
      super.visit(assignment);
    }

    @Override protected void visit(
        IrB.UnpackingAssignment unpackingAssignment) {
      on(IrB.UnpackingAssignment.class, unpackingAssignment);
      super.visit(unpackingAssignment);
    }

    @Override protected void visit(IrB.ReturnStmt returnStmt) {
      on(IrB.ReturnStmt.class, returnStmt);
      super.visit(returnStmt);
    }

    @Override protected void visit(IrB.IfStmt ifStmt) {
      on(IrB.IfStmt.class, ifStmt);
      super.visit(ifStmt);
    }

    @Override protected void visit(IrB.RaiseStmt raiseStmt) {
      on(IrB.RaiseStmt.class, raiseStmt);
      super.visit(raiseStmt);
    }

    @Override protected void visit(IrB.TryExcept tryExcept) {
      on(IrB.TryExcept.class, tryExcept);
      super.visit(tryExcept);
    }

    @Override protected void visit(IrB.FunctionArgDecl argDecl) {
      on(IrB.FunctionArgDecl.class, argDecl);
      super.visit(argDecl);
    }

    @Override protected void visit(IrB.FunctionDefn functionDefn) {
      on(IrB.FunctionDefn.class, functionDefn);
      super.visit(functionDefn);
    }

    @Override protected void visit(IrB.Module module) {
      on(IrB.Module.class, module);
      super.visit(module);
    }
  }

  @Test void testEveryKindReachesItsOwnHandler() {
    final ClassRecorder recorder = new ClassRecorder();
    IrBFixtures.allKinds().accept(recorder);

    final Set<Class<?>> concreteNodeClasses = new LinkedHashSet<>();
    for (Class<?> c : IrB.class.getClasses()) {
      if (IrB.Node.class.isAssignableFrom(c)
          && !Modifier.isAbstract(c.getModifiers())) {
        concreteNodeClasses.add(c);
      }
    }
    assertThat(ImmutableSet.copyOf(recorder.classes),
        is(ImmutableSet.copyOf(concreteNodeClasses)));
  }

  @Test void testVisitOrder() {
    final IrB.VarReference f = irB.globalFunction(INT_TO_INT, "f", false);
    final IrB.VarReference x = irB.var(PrimitiveType.INT, "x");
    final IrB.VarReference y = irB.var(PrimitiveType.INT, "y");
    final IrB.VarReference b = irB.var(PrimitiveType.BOOL, "b");
    final IrB.FunctionDefn defn =
        irB.functionDefn("g",
            ImmutableList.of(irB.argDecl(PrimitiveType.INT, "x")),
            ImmutableList.of(
                irB.assignment(y, irB.intBinaryOp(irB.functionCall(f, x),
                    Op.PLUS, irB.intLiteral(1))),
                irB.ifStmt(b, ImmutableList.of(irB.returnStmt(x)),
                    ImmutableList.of(irB.pass())),
                irB.returnStmt(y)),
            PrimitiveType.INT);
    final ClassRecorder recorder = new ClassRecorder();
    defn.accept(recorder);
    assertThat(recorder.names,
        is(
            ImmutableList.of("FunctionDefn", "FunctionArgDecl",
                "Assignment", "VarReference", "IntBinaryOpExpr",
                "FunctionCall", "VarReference", "VarReference",
                "IntLiteral",
                "IfStmt", "VarReference", "ReturnStmt", "VarReference",
                "PassStmt",
                "ReturnStmt", "VarReference")));
  }
}

// End VisitorTest.java
