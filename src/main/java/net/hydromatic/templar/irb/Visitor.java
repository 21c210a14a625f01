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

/** Visits IR-B trees.
 *
 * <p>There is one {@code visit} method for each kind of node. The default
 * implementations do nothing for leaves and visit the children of other
 * nodes, left to right. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends IrB.Node> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(IrB.VarReference varReference) {}

  protected void visit(IrB.MatchExpr matchExpr) {
    matchExpr.matchedExprs.forEach(this::accept);
    matchExpr.matchCases.forEach(this::accept);
  }

  protected void visit(IrB.MatchCase matchCase) {
    matchCase.typePatterns.forEach(this::accept);
    matchCase.expr.accept(this);
  }

  protected void visit(IrB.BoolLiteral boolLiteral) {}

  protected void visit(IrB.IntLiteral intLiteral) {}

  protected void visit(IrB.AtomicTypeLiteral atomicTypeLiteral) {}

  protected void visit(IrB.PointerTypeExpr pointerTypeExpr) {
    pointerTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrB.ReferenceTypeExpr referenceTypeExpr) {
    referenceTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrB.RvalueReferenceTypeExpr rvalueReferenceTypeExpr) {
    rvalueReferenceTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrB.ConstTypeExpr constTypeExpr) {
    constTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrB.ArrayTypeExpr arrayTypeExpr) {
    arrayTypeExpr.typeExpr.accept(this);
  }

  protected void visit(IrB.FunctionTypeExpr functionTypeExpr) {
    functionTypeExpr.returnTypeExpr.accept(this);
    functionTypeExpr.argListExpr.accept(this);
  }

  protected void visit(IrB.TemplateInstantiationExpr templateInstantiation) {
    templateInstantiation.argListExpr.accept(this);
  }

  protected void visit(IrB.TemplateMemberAccessExpr templateMemberAccess) {
    templateMemberAccess.classTypeExpr.accept(this);
    templateMemberAccess.argListExpr.accept(this);
  }

  protected void visit(IrB.ListExpr listExpr) {
    listExpr.elemExprs.forEach(this::accept);
    if (listExpr.listExtractionExpr != null) {
      listExpr.listExtractionExpr.accept(this);
    }
  }

  protected void visit(IrB.SetExpr setExpr) {
    setExpr.elemExprs.forEach(this::accept);
  }

  protected void visit(IrB.IntListSumExpr intListSumExpr) {
    intListSumExpr.expr.accept(this);
  }

  protected void visit(IrB.IntSetSumExpr intSetSumExpr) {
    intSetSumExpr.expr.accept(this);
  }

  protected void visit(IrB.BoolListAllExpr boolListAllExpr) {
    boolListAllExpr.expr.accept(this);
  }

  protected void visit(IrB.BoolListAnyExpr boolListAnyExpr) {
    boolListAnyExpr.expr.accept(this);
  }

  protected void visit(IrB.BoolSetAllExpr boolSetAllExpr) {
    boolSetAllExpr.expr.accept(this);
  }

  protected void visit(IrB.BoolSetAnyExpr boolSetAnyExpr) {
    boolSetAnyExpr.expr.accept(this);
  }

  protected void visit(IrB.NotExpr notExpr) {
    notExpr.expr.accept(this);
  }

  protected void visit(IrB.IntUnaryMinusExpr unaryMinusExpr) {
    unaryMinusExpr.expr.accept(this);
  }

  protected void visit(IrB.AndExpr andExpr) {
    andExpr.lhs.accept(this);
    andExpr.rhs.accept(this);
  }

  protected void visit(IrB.OrExpr orExpr) {
    orExpr.lhs.accept(this);
    orExpr.rhs.accept(this);
  }

  protected void visit(IrB.EqualityComparison equalityComparison) {
    equalityComparison.lhs.accept(this);
    equalityComparison.rhs.accept(this);
  }

  protected void visit(IrB.InExpr inExpr) {
    inExpr.lhs.accept(this);
    inExpr.rhs.accept(this);
  }

  protected void visit(IrB.ListConcatExpr listConcatExpr) {
    listConcatExpr.lhs.accept(this);
    listConcatExpr.rhs.accept(this);
  }

  protected void visit(IrB.IntComparisonExpr intComparisonExpr) {
    intComparisonExpr.lhs.accept(this);
    intComparisonExpr.rhs.accept(this);
  }

  protected void visit(IrB.IntBinaryOpExpr intBinaryOpExpr) {
    intBinaryOpExpr.lhs.accept(this);
    intBinaryOpExpr.rhs.accept(this);
  }

  protected void visit(IrB.FunctionCall functionCall) {
    functionCall.funExpr.accept(this);
    functionCall.args.forEach(this::accept);
  }

  protected void visit(IrB.AttributeAccessExpr attributeAccessExpr) {
    attributeAccessExpr.expr.accept(this);
  }

  protected void visit(IrB.ListComprehension listComprehension) {
    listComprehension.collectionExpr.accept(this);
    listComprehension.loopVar.accept(this);
    listComprehension.resultElemExpr.accept(this);
  }

  protected void visit(IrB.SetComprehension setComprehension) {
    setComprehension.collectionExpr.accept(this);
    setComprehension.loopVar.accept(this);
    setComprehension.resultElemExpr.accept(this);
  }

  // statements

  protected void visit(IrB.PassStmt passStmt) {}

  protected void visit(IrB.Assert assertStmt) {
    assertStmt.expr.accept(this);
  }

  protected void visit(IrB.Assignment assignment) {
    assignment.lhs.accept(this);
    assignment.rhs.accept(this);
  }

  protected void visit(IrB.UnpackingAssignment unpackingAssignment) {
    unpackingAssignment.lhsList.forEach(this::accept);
    unpackingAssignment.rhs.accept(this);
  }

  protected void visit(IrB.ReturnStmt returnStmt) {
    returnStmt.expr.accept(this);
  }

  protected void visit(IrB.IfStmt ifStmt) {
    ifStmt.condExpr.accept(this);
    ifStmt.ifStmts.forEach(this::accept);
    ifStmt.elseStmts.forEach(this::accept);
  }

  protected void visit(IrB.RaiseStmt raiseStmt) {
    raiseStmt.expr.accept(this);
  }

  protected void visit(IrB.TryExcept tryExcept) {
    tryExcept.tryBody.forEach(this::accept);
    tryExcept.exceptBody.forEach(this::accept);
  }

  // declarations

  protected void visit(IrB.FunctionArgDecl argDecl) {}

  protected void visit(IrB.FunctionDefn functionDefn) {
    functionDefn.args.forEach(this::accept);
    functionDefn.body.forEach(this::accept);
  }

  protected void visit(IrB.Module module) {
    module.functionDefns.forEach(this::accept);
    module.assertions.forEach(this::accept);
    module.passStmts.forEach(this::accept);
  }
}

// End Visitor.java
