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

/** Visits IR-A trees.
 *
 * <p>There is one {@code visit} method for each kind of node. The default
 * implementations do nothing for leaves and visit the children of other
 * nodes. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends IrA.Node> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(IrA.VarReference varReference) {}

  protected void visit(IrA.MatchExpr matchExpr) {
    matchExpr.matchedVars.forEach(this::accept);
    matchExpr.matchCases.forEach(this::accept);
  }

  protected void visit(IrA.MatchCase matchCase) {
    matchCase.typePatterns.forEach(this::accept);
    matchCase.expr.accept(this);
  }

  protected void visit(IrA.BoolLiteral boolLiteral) {}

  protected void visit(IrA.IntLiteral intLiteral) {}

  protected void visit(IrA.AtomicTypeLiteral atomicTypeLiteral) {}

  protected void visit(IrA.PointerTypeExpr pointerTypeExpr) {
    pointerTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrA.ReferenceTypeExpr referenceTypeExpr) {
    referenceTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrA.RvalueReferenceTypeExpr rvalueReferenceTypeExpr) {
    rvalueReferenceTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrA.ConstTypeExpr constTypeExpr) {
    constTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrA.ArrayTypeExpr arrayTypeExpr) {
    arrayTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrA.FunctionTypeExpr functionTypeExpr) {
    functionTypeExpr.returnTypeExpr.accept(this);
    functionTypeExpr.argListExpr.accept(this);
  }

  protected void visit(IrA.ParameterPackExpansion parameterPackExpansion) {
    parameterPackExpansion.expr.accept(this);
  }

  protected void visit(IrA.TemplateInstantiationExpr instantiation) {
    instantiation.argListExpr.accept(this);
  }

  protected void visit(IrA.TemplateMemberAccessExpr memberAccess) {
    memberAccess.classTypeExpr.accept(this);
    memberAccess.argListExpr.accept(this);
  }

  protected void visit(IrA.ListExpr listExpr) {
    listExpr.elems.forEach(this::accept);
  }

  protected void visit(IrA.AddToSetExpr addToSetExpr) {
    addToSetExpr.lhs.accept(this);
    addToSetExpr.rhs.accept(this);
  }

  protected void visit(IrA.SetToListExpr setToListExpr) {
    setToListExpr.var.accept(this);
  }

  protected void visit(IrA.ListToSetExpr listToSetExpr) {
    listToSetExpr.var.accept(this);
  }

  protected void visit(IrA.FunctionCall functionCall) {
    functionCall.fun.accept(this);
    functionCall.args.forEach(this::accept);
  }

  protected void visit(IrA.EqualityComparison equalityComparison) {
    equalityComparison.lhs.accept(this);
    equalityComparison.rhs.accept(this);
  }

  protected void visit(IrA.SetEqualityComparison setEqualityComparison) {
    setEqualityComparison.lhs.accept(this);
    setEqualityComparison.rhs.accept(this);
  }

  protected void visit(IrA.IsInListExpr isInListExpr) {
    isInListExpr.lhs.accept(this);
    isInListExpr.rhs.accept(this);
  }

  protected void visit(IrA.AttributeAccessExpr attributeAccessExpr) {
    attributeAccessExpr.var.accept(this);
  }

  protected void visit(IrA.NotExpr notExpr) {
    notExpr.var.accept(this);
  }

  protected void visit(IrA.UnaryMinusExpr unaryMinusExpr) {
    unaryMinusExpr.var.accept(this);
  }

  protected void visit(IrA.IntListSumExpr intListSumExpr) {
    intListSumExpr.var.accept(this);
  }

  protected void visit(IrA.BoolListAllExpr boolListAllExpr) {
    boolListAllExpr.var.accept(this);
  }

  protected void visit(IrA.BoolListAnyExpr boolListAnyExpr) {
    boolListAnyExpr.var.accept(this);
  }

  protected void visit(IrA.IntComparisonExpr intComparisonExpr) {
    intComparisonExpr.lhs.accept(this);
    intComparisonExpr.rhs.accept(this);
  }

  protected void visit(IrA.IntBinaryOpExpr intBinaryOpExpr) {
    intBinaryOpExpr.lhs.accept(this);
    intBinaryOpExpr.rhs.accept(this);
  }

  protected void visit(IrA.ListConcatExpr listConcatExpr) {
    listConcatExpr.lhs.accept(this);
    listConcatExpr.rhs.accept(this);
  }

  protected void visit(IrA.IsInstanceExpr isInstanceExpr) {
    isInstanceExpr.var.accept(this);
  }

  protected void visit(IrA.SafeUncheckedCast safeUncheckedCast) {
    safeUncheckedCast.var.accept(this);
  }

  protected void visit(IrA.ListComprehensionExpr listComprehension) {
    listComprehension.listVar.accept(this);
    listComprehension.loopVar.accept(this);
    listComprehension.resultElemExpr.accept(this);
  }

  // patterns

  protected void visit(IrA.VarReferencePattern varReferencePattern) {}

  protected void visit(IrA.AtomicTypeLiteralPattern atomicTypeLiteralPattern) {}

  protected void visit(IrA.PointerTypePattern pointerTypePattern) {
    pointerTypePattern.typePattern.accept(this);
  }

  protected void visit(IrA.ReferenceTypePattern referenceTypePattern) {
    referenceTypePattern.typePattern.accept(this);
  }

  protected void visit(
      IrA.RvalueReferenceTypePattern rvalueReferenceTypePattern) {
    rvalueReferenceTypePattern.typePattern.accept(this);
  }

  protected void visit(IrA.ConstTypePattern constTypePattern) {
    constTypePattern.typePattern.accept(this);
  }

  protected void visit(IrA.ArrayTypePattern arrayTypePattern) {
    arrayTypePattern.typePattern.accept(this);
  }

  protected void visit(IrA.FunctionTypePattern functionTypePattern) {
    functionTypePattern.returnTypePattern.accept(this);
    functionTypePattern.argListPattern.accept(this);
  }

  protected void visit(IrA.TemplateInstantiationPattern pattern) {
    pattern.argPatterns.forEach(this::accept);
    if (pattern.listExtractionArg != null) {
      pattern.listExtractionArg.accept(this);
    }
  }

  protected void visit(IrA.ListPattern listPattern) {
    listPattern.elems.forEach(this::accept);
    if (listPattern.listExtraction != null) {
      listPattern.listExtraction.accept(this);
    }
  }

  // statements

  protected void visit(IrA.PassStmt passStmt) {}

  protected void visit(IrA.Assert anAssert) {
    anAssert.var.accept(this);
  }

  protected void visit(IrA.Assignment assignment) {
    assignment.lhs.accept(this);
    if (assignment.lhs2 != null) {
      assignment.lhs2.accept(this);
    }
    assignment.rhs.accept(this);
  }

  protected void visit(IrA.CheckIfError checkIfError) {
    checkIfError.var.accept(this);
  }

  protected void visit(IrA.UnpackingAssignment unpackingAssignment) {
    unpackingAssignment.lhsList.forEach(this::accept);
    unpackingAssignment.rhs.accept(this);
  }

  protected void visit(IrA.ReturnStmt returnStmt) {
    if (returnStmt.result != null) {
      returnStmt.result.accept(this);
    }
    if (returnStmt.error != null) {
      returnStmt.error.accept(this);
    }
  }

  protected void visit(IrA.IfStmt ifStmt) {
    ifStmt.cond.accept(this);
    ifStmt.ifStmts.forEach(this::accept);
    ifStmt.elseStmts.forEach(this::accept);
  }

  // declarations

  protected void visit(IrA.FunctionArgDecl argDecl) {}

  protected void visit(IrA.FunctionDefn functionDefn) {
    functionDefn.args.forEach(this::accept);
    functionDefn.body.forEach(this::accept);
  }

  protected void visit(IrA.CustomTypeDefn customTypeDefn) {}

  protected void visit(IrA.CheckIfErrorDefn checkIfErrorDefn) {}

  protected void visit(IrA.Module module) {
    module.body.forEach(this::accept);
  }
}

// End Visitor.java
