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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms IR-B trees.
 *
 * <p>The default implementation of each {@code visit} method is the
 * identity: leaves return themselves, and other nodes transform their
 * children and call {@code copy}, which returns the original node if no
 * child changed. A subclass overrides the methods for the kinds of node it
 * wishes to rewrite.
 *
 * <p>A node that is held in a list of its own kind, such as the assertions
 * and pass statements of a {@link IrB.Module}, is transformed by a method
 * that returns that kind.
 *
 * <p>Patterns in a {@link IrB.MatchCase} are not transformed. Custom types
 * and public names of a {@link IrB.Module} are kept as they are. */
public class Shuttle {

  protected <E extends IrB.Node> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // expressions

  protected IrB.VarReference visit(IrB.VarReference varReference) {
    return varReference;
  }

  protected IrB.Expr visit(IrB.MatchExpr matchExpr) {
    return matchExpr.copy(visitList(matchExpr.matchedExprs),
        visitList(matchExpr.matchCases));
  }

  protected IrB.MatchCase visit(IrB.MatchCase matchCase) {
    return matchCase.copy(matchCase.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.BoolLiteral boolLiteral) {
    return boolLiteral;
  }

  protected IrB.Expr visit(IrB.IntLiteral intLiteral) {
    return intLiteral;
  }

  protected IrB.Expr visit(IrB.AtomicTypeLiteral atomicTypeLiteral) {
    return atomicTypeLiteral;
  }

  protected IrB.Expr visit(IrB.PointerTypeExpr pointerTypeExpr) {
    return pointerTypeExpr.copy(pointerTypeExpr.typeExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.ReferenceTypeExpr referenceTypeExpr) {
    return referenceTypeExpr.copy(referenceTypeExpr.typeExpr.accept(this));
  }

  protected IrB.Expr visit(
      IrB.RvalueReferenceTypeExpr rvalueReferenceTypeExpr) {
    return rvalueReferenceTypeExpr.copy(
        rvalueReferenceTypeExpr.typeExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.ConstTypeExpr constTypeExpr) {
    return constTypeExpr.copy(constTypeExpr.typeExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.ArrayTypeExpr arrayTypeExpr) {
    return arrayTypeExpr.copy(arrayTypeExpr.typeExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.FunctionTypeExpr functionTypeExpr) {
    return functionTypeExpr.copy(
        functionTypeExpr.returnTypeExpr.accept(this),
        functionTypeExpr.argListExpr.accept(this));
  }

  protected IrB.Expr visit(
      IrB.TemplateInstantiationExpr templateInstantiation) {
    return templateInstantiation.copy(
        templateInstantiation.argListExpr.accept(this));
  }

  protected IrB.Expr visit(
      IrB.TemplateMemberAccessExpr templateMemberAccess) {
    return templateMemberAccess.copy(
        templateMemberAccess.classTypeExpr.accept(this),
        templateMemberAccess.argListExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.ListExpr listExpr) {
    return listExpr.copy(visitList(listExpr.elemExprs),
        listExpr.listExtractionExpr == null ? null
            : listExpr.listExtractionExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.SetExpr setExpr) {
    return setExpr.copy(visitList(setExpr.elemExprs));
  }

  protected IrB.Expr visit(IrB.IntListSumExpr intListSumExpr) {
    return intListSumExpr.copy(intListSumExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.IntSetSumExpr intSetSumExpr) {
    return intSetSumExpr.copy(intSetSumExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.BoolListAllExpr boolListAllExpr) {
    return boolListAllExpr.copy(boolListAllExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.BoolListAnyExpr boolListAnyExpr) {
    return boolListAnyExpr.copy(boolListAnyExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.BoolSetAllExpr boolSetAllExpr) {
    return boolSetAllExpr.copy(boolSetAllExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.BoolSetAnyExpr boolSetAnyExpr) {
    return boolSetAnyExpr.copy(boolSetAnyExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.NotExpr notExpr) {
    return notExpr.copy(notExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.IntUnaryMinusExpr unaryMinusExpr) {
    return unaryMinusExpr.copy(unaryMinusExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.AndExpr andExpr) {
    return andExpr.copy(andExpr.lhs.accept(this), andExpr.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.OrExpr orExpr) {
    return orExpr.copy(orExpr.lhs.accept(this), orExpr.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.EqualityComparison equalityComparison) {
    return equalityComparison.copy(equalityComparison.lhs.accept(this),
        equalityComparison.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.InExpr inExpr) {
    return inExpr.copy(inExpr.lhs.accept(this), inExpr.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.ListConcatExpr listConcatExpr) {
    return listConcatExpr.copy(listConcatExpr.lhs.accept(this),
        listConcatExpr.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.IntComparisonExpr intComparisonExpr) {
    return intComparisonExpr.copy(intComparisonExpr.lhs.accept(this),
        intComparisonExpr.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.IntBinaryOpExpr intBinaryOpExpr) {
    return intBinaryOpExpr.copy(intBinaryOpExpr.lhs.accept(this),
        intBinaryOpExpr.rhs.accept(this));
  }

  protected IrB.Expr visit(IrB.FunctionCall functionCall) {
    return functionCall.copy(functionCall.funExpr.accept(this),
        visitList(functionCall.args), functionCall.mayThrow);
  }

  protected IrB.Expr visit(IrB.AttributeAccessExpr attributeAccessExpr) {
    return attributeAccessExpr.copy(attributeAccessExpr.expr.accept(this));
  }

  protected IrB.Expr visit(IrB.ListComprehension listComprehension) {
    return listComprehension.copy(
        listComprehension.collectionExpr.accept(this),
        listComprehension.loopVar.accept(this),
        listComprehension.resultElemExpr.accept(this));
  }

  protected IrB.Expr visit(IrB.SetComprehension setComprehension) {
    return setComprehension.copy(setComprehension.collectionExpr.accept(this),
        setComprehension.loopVar.accept(this),
        setComprehension.resultElemExpr.accept(this));
  }

  // statements

  protected IrB.PassStmt visit(IrB.PassStmt passStmt) {
    return passStmt;
  }

  protected IrB.Assert visit(IrB.Assert assertStmt) {
    return assertStmt.copy(assertStmt.expr.accept(this));
  }

  protected IrB.Stmt visit(IrB.Assignment assignment) {
    return assignment.copy(assignment.lhs.accept(this),
        assignment.rhs.accept(this));
  }

  protected IrB.Stmt visit(IrB.UnpackingAssignment unpackingAssignment) {
    return unpackingAssignment.copy(
        visitList(unpackingAssignment.lhsList),
        unpackingAssignment.rhs.accept(this));
  }

  protected IrB.Stmt visit(IrB.ReturnStmt returnStmt) {
    return returnStmt.copy(returnStmt.expr.accept(this));
  }

  protected IrB.Stmt visit(IrB.IfStmt ifStmt) {
    return ifStmt.copy(ifStmt.condExpr.accept(this),
        visitList(ifStmt.ifStmts), visitList(ifStmt.elseStmts));
  }

  protected IrB.Stmt visit(IrB.RaiseStmt raiseStmt) {
    return raiseStmt.copy(raiseStmt.expr.accept(this));
  }

  protected IrB.Stmt visit(IrB.TryExcept tryExcept) {
    return tryExcept.copy(visitList(tryExcept.tryBody),
        visitList(tryExcept.exceptBody));
  }

  // declarations

  protected IrB.FunctionArgDecl visit(IrB.FunctionArgDecl argDecl) {
    return argDecl;
  }

  protected IrB.FunctionDefn visit(IrB.FunctionDefn functionDefn) {
    return functionDefn.copy(visitList(functionDefn.args),
        visitList(functionDefn.body));
  }

  protected IrB.Module visit(IrB.Module module) {
    return module.copy(visitList(module.functionDefns),
        visitList(module.assertions), visitList(module.passStmts));
  }
}

// End Shuttle.java
