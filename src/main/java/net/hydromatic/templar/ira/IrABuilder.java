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
import net.hydromatic.templar.type.ExprType;
import net.hydromatic.templar.type.FunctionType;
import net.hydromatic.templar.type.ListType;
import net.hydromatic.templar.type.ParameterPackType;
import net.hydromatic.templar.type.PrimitiveType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/** Builds IR-A nodes.
 *
 * <p>Each method first checks that its operands have the types that the
 * node requires, and derives the type of the node; then it creates the
 * node. An inconsistent operand throws {@link IllegalArgumentException}. */
public enum IrABuilder {
  /** The singleton instance of the IR-A builder.
   * The short name is convenient for use via 'import static'. */
  irA;

  private static final ListType TYPE_LIST = ListType.of(PrimitiveType.TYPE);

  /** Node kinds that may occur in the body of a module. */
  private static final ImmutableSet<Op> MODULE_ELEMENT_OPS =
      ImmutableSet.of(Op.FUNCTION_DEFN, Op.CUSTOM_TYPE_DEFN,
          Op.CHECK_IF_ERROR_DEFN, Op.ASSIGNMENT, Op.UNPACKING_ASSIGNMENT,
          Op.ASSERT, Op.CHECK_IF_ERROR, Op.PASS);

  private static <T extends IrA.Typed> T checkType(T node, ExprType type) {
    checkArgument(node.type.equals(type), "expected %s to have type %s, was "
        + "%s", node, type, node.type);
    return node;
  }

  private static ListType checkListType(IrA.VarReference var) {
    checkArgument(var.type instanceof ListType,
        "expected %s to be a list, was %s", var, var.type);
    return (ListType) var.type;
  }

  private static void checkListOf(IrA.VarReference var,
      ExprType elementType) {
    checkArgument(var.type.isListOf(elementType),
        "expected %s to have type List[%s], was %s", var, elementType,
        var.type);
  }

  // expressions

  public IrA.VarReference varReference(ExprType type, String name,
      boolean isGlobalFunction, boolean isFunctionThatMayThrow) {
    checkArgument(!name.isEmpty(), "empty variable name");
    return new IrA.VarReference(type, name, isGlobalFunction,
        isFunctionThatMayThrow);
  }

  /** Creates a reference to a local variable. */
  public IrA.VarReference var(ExprType type, String name) {
    return varReference(type, name, false, false);
  }

  public IrA.BoolLiteral boolLiteral(boolean value) {
    return new IrA.BoolLiteral(PrimitiveType.BOOL, value);
  }

  public IrA.IntLiteral intLiteral(long value) {
    return new IrA.IntLiteral(PrimitiveType.INT, value);
  }

  public IrA.AtomicTypeLiteral atomicTypeLiteral(String cppType) {
    checkArgument(!cppType.isEmpty(), "empty type");
    return new IrA.AtomicTypeLiteral(PrimitiveType.TYPE, cppType);
  }

  public IrA.PointerTypeExpr pointerType(IrA.VarReference typeExpr) {
    return new IrA.PointerTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrA.ReferenceTypeExpr referenceType(IrA.VarReference typeExpr) {
    return new IrA.ReferenceTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrA.RvalueReferenceTypeExpr rvalueReferenceType(
      IrA.VarReference typeExpr) {
    return new IrA.RvalueReferenceTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrA.ConstTypeExpr constType(IrA.VarReference typeExpr) {
    return new IrA.ConstTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrA.ArrayTypeExpr arrayType(IrA.VarReference typeExpr) {
    return new IrA.ArrayTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrA.FunctionTypeExpr functionType(IrA.VarReference returnTypeExpr,
      IrA.VarReference argListExpr) {
    return new IrA.FunctionTypeExpr(PrimitiveType.TYPE,
        checkType(returnTypeExpr, PrimitiveType.TYPE),
        checkType(argListExpr, TYPE_LIST));
  }

  public IrA.ParameterPackExpansion parameterPackExpansion(
      IrA.VarReference expr) {
    checkArgument(expr.type instanceof ParameterPackType,
        "expected %s to be a parameter pack, was %s", expr, expr.type);
    return new IrA.ParameterPackExpansion(
        ((ParameterPackType) expr.type).elementType, expr);
  }

  public IrA.TemplateInstantiationExpr templateInstantiation(
      String templateAtomicCppType, IrA.VarReference argListExpr) {
    return new IrA.TemplateInstantiationExpr(PrimitiveType.TYPE,
        templateAtomicCppType, checkType(argListExpr, TYPE_LIST));
  }

  public IrA.TemplateMemberAccessExpr templateMemberAccess(
      IrA.VarReference classTypeExpr, String memberName,
      IrA.VarReference argListExpr) {
    return new IrA.TemplateMemberAccessExpr(PrimitiveType.TYPE,
        checkType(classTypeExpr, PrimitiveType.TYPE), memberName,
        checkType(argListExpr, TYPE_LIST));
  }

  public IrA.ListExpr list(ExprType elemType,
      List<IrA.VarReference> elems) {
    final ListType type = ListType.of(elemType);
    elems.forEach(elem -> checkType(elem, elemType));
    return new IrA.ListExpr(type, elemType, ImmutableList.copyOf(elems));
  }

  public IrA.AddToSetExpr addToSet(IrA.VarReference setExpr,
      IrA.VarReference elemExpr) {
    checkListOf(setExpr, elemExpr.type);
    return new IrA.AddToSetExpr(setExpr.type, setExpr, elemExpr);
  }

  public IrA.SetToListExpr setToList(IrA.VarReference var) {
    return new IrA.SetToListExpr(checkListType(var), var);
  }

  public IrA.ListToSetExpr listToSet(IrA.VarReference var) {
    return new IrA.ListToSetExpr(checkListType(var), var);
  }

  /** Creates a call to a function. A function has at least one
   * argument. */
  public IrA.FunctionCall functionCall(IrA.VarReference fun,
      List<IrA.VarReference> args) {
    checkArgument(fun.type instanceof FunctionType,
        "expected %s to be a function, was %s", fun, fun.type);
    final FunctionType functionType = (FunctionType) fun.type;
    checkArgument(!args.isEmpty(), "call to %s has no arguments", fun);
    checkArgument(args.size() == functionType.argTypes.size(),
        "call to %s has %s arguments, expected %s", fun, args.size(),
        functionType.argTypes.size());
    for (int i = 0; i < args.size(); i++) {
      final ExprType argType = args.get(i).type;
      checkArgument(argType.equals(functionType.argTypes.get(i))
              || argType == PrimitiveType.BOTTOM,
          "argument %s of %s has type %s, expected %s", i, fun, argType,
          functionType.argTypes.get(i));
    }
    return new IrA.FunctionCall(functionType.returnType, fun,
        ImmutableList.copyOf(args));
  }

  public IrA.FunctionCall functionCall(IrA.VarReference fun,
      IrA.VarReference... args) {
    return functionCall(fun, ImmutableList.copyOf(args));
  }

  /** Creates an equality comparison. The operands must have the same type,
   * except that an error-or-void value may be compared with a type;
   * functions cannot be compared. */
  public IrA.EqualityComparison equal(IrA.VarReference lhs,
      IrA.VarReference rhs) {
    checkArgument(lhs.type.equals(rhs.type)
            || lhs.type == PrimitiveType.ERROR_OR_VOID
            && rhs.type == PrimitiveType.TYPE,
        "cannot compare %s (%s) with %s (%s)", lhs, lhs.type, rhs, rhs.type);
    checkArgument(!lhs.type.isFunction(), "cannot compare functions");
    return new IrA.EqualityComparison(PrimitiveType.BOOL, lhs, rhs);
  }

  public IrA.SetEqualityComparison setEqual(IrA.VarReference lhs,
      IrA.VarReference rhs) {
    checkListType(lhs);
    checkType(rhs, lhs.type);
    return new IrA.SetEqualityComparison(PrimitiveType.BOOL, lhs, rhs);
  }

  public IrA.IsInListExpr isInList(IrA.VarReference lhs,
      IrA.VarReference rhs) {
    checkListOf(rhs, lhs.type);
    return new IrA.IsInListExpr(PrimitiveType.BOOL, lhs, rhs);
  }

  /** Creates an access to an attribute. If the variable has a custom type,
   * the attribute must be one of its fields, of the given type. */
  public IrA.AttributeAccessExpr attributeAccess(IrA.VarReference var,
      String attributeName, ExprType type) {
    checkArgument(var.type == PrimitiveType.TYPE
            || var.type instanceof CustomType,
        "cannot access attribute of %s (%s)", var, var.type);
    if (var.type instanceof CustomType) {
      final ExprType fieldType =
          ((CustomType) var.type).fieldType(attributeName);
      checkArgument(type.equals(fieldType), "field %s of %s has type %s, "
          + "expected %s", attributeName, var.type, fieldType, type);
    }
    return new IrA.AttributeAccessExpr(type, var, attributeName);
  }

  public IrA.NotExpr not(IrA.VarReference var) {
    return new IrA.NotExpr(PrimitiveType.BOOL,
        checkType(var, PrimitiveType.BOOL));
  }

  public IrA.UnaryMinusExpr unaryMinus(IrA.VarReference var) {
    return new IrA.UnaryMinusExpr(PrimitiveType.INT,
        checkType(var, PrimitiveType.INT));
  }

  public IrA.IntListSumExpr intListSum(IrA.VarReference var) {
    checkListOf(var, PrimitiveType.INT);
    return new IrA.IntListSumExpr(PrimitiveType.INT, var);
  }

  public IrA.BoolListAllExpr boolListAll(IrA.VarReference var) {
    checkListOf(var, PrimitiveType.BOOL);
    return new IrA.BoolListAllExpr(PrimitiveType.BOOL, var);
  }

  public IrA.BoolListAnyExpr boolListAny(IrA.VarReference var) {
    checkListOf(var, PrimitiveType.BOOL);
    return new IrA.BoolListAnyExpr(PrimitiveType.BOOL, var);
  }

  public IrA.IntComparisonExpr intComparison(IrA.VarReference lhs,
      Op operator, IrA.VarReference rhs) {
    checkArgument(operator.isComparison(), "not a comparison: %s", operator);
    return new IrA.IntComparisonExpr(PrimitiveType.BOOL,
        checkType(lhs, PrimitiveType.INT), checkType(rhs, PrimitiveType.INT),
        operator);
  }

  public IrA.IntBinaryOpExpr intBinaryOp(IrA.VarReference lhs, Op operator,
      IrA.VarReference rhs) {
    checkArgument(operator.isArithmetic(), "not an arithmetic operator: %s",
        operator);
    return new IrA.IntBinaryOpExpr(PrimitiveType.INT,
        checkType(lhs, PrimitiveType.INT), checkType(rhs, PrimitiveType.INT),
        operator);
  }

  public IrA.ListConcatExpr listConcat(IrA.VarReference lhs,
      IrA.VarReference rhs) {
    checkListType(lhs);
    checkType(rhs, lhs.type);
    return new IrA.ListConcatExpr(lhs.type, lhs, rhs);
  }

  public IrA.IsInstanceExpr isInstance(IrA.VarReference var,
      CustomType checkedType) {
    return new IrA.IsInstanceExpr(PrimitiveType.BOOL, var, checkedType);
  }

  /** Creates a cast of an error-or-void variable to a custom type. */
  public IrA.SafeUncheckedCast safeUncheckedCast(IrA.VarReference var,
      CustomType type) {
    return new IrA.SafeUncheckedCast(type,
        checkType(var, PrimitiveType.ERROR_OR_VOID));
  }

  public IrA.ListComprehensionExpr listComprehension(
      IrA.VarReference listVar, IrA.VarReference loopVar,
      IrA.FunctionCall resultElemExpr) {
    checkListOf(listVar, loopVar.type);
    return new IrA.ListComprehensionExpr(ListType.of(resultElemExpr.type),
        listVar, loopVar, resultElemExpr);
  }

  public IrA.MatchCase matchCase(List<? extends IrA.Pattern> typePatterns,
      List<String> matchedVarNames, List<String> matchedVariadicVarNames,
      IrA.FunctionCall expr) {
    return new IrA.MatchCase(ImmutableList.copyOf(typePatterns),
        ImmutableList.copyOf(matchedVarNames),
        ImmutableList.copyOf(matchedVariadicVarNames), expr);
  }

  /** Creates a match expression. Every case has one pattern per matched
   * variable, all cases have the same result type, and at most one case is
   * the main definition. */
  public IrA.MatchExpr match(List<IrA.VarReference> matchedVars,
      List<IrA.MatchCase> matchCases) {
    checkArgument(!matchedVars.isEmpty(), "no matched variables");
    checkArgument(!matchCases.isEmpty(), "no match cases");
    final ExprType type = matchCases.get(0).expr.type;
    int mainDefinitionCount = 0;
    for (IrA.MatchCase matchCase : matchCases) {
      checkArgument(matchCase.typePatterns.size() == matchedVars.size(),
          "case has %s patterns, expected %s", matchCase.typePatterns.size(),
          matchedVars.size());
      checkType(matchCase.expr, type);
      if (matchCase.isMainDefinition()) {
        ++mainDefinitionCount;
      }
    }
    checkArgument(mainDefinitionCount <= 1,
        "match has %s main definitions", mainDefinitionCount);
    return new IrA.MatchExpr(type, ImmutableList.copyOf(matchedVars),
        ImmutableList.copyOf(matchCases));
  }

  // patterns

  public IrA.VarReferencePattern varReferencePattern(ExprType type,
      String name, boolean isGlobalFunction,
      boolean isFunctionThatMayThrow) {
    checkArgument(!name.isEmpty(), "empty variable name");
    return new IrA.VarReferencePattern(type, name, isGlobalFunction,
        isFunctionThatMayThrow);
  }

  /** Creates a pattern that binds a local variable. */
  public IrA.VarReferencePattern varPattern(ExprType type, String name) {
    return varReferencePattern(type, name, false, false);
  }

  public IrA.AtomicTypeLiteralPattern atomicTypeLiteralPattern(
      String cppType) {
    checkArgument(!cppType.isEmpty(), "empty type");
    return new IrA.AtomicTypeLiteralPattern(PrimitiveType.TYPE, cppType);
  }

  public IrA.PointerTypePattern pointerTypePattern(IrA.Pattern pattern) {
    return new IrA.PointerTypePattern(PrimitiveType.TYPE,
        checkType(pattern, PrimitiveType.TYPE));
  }

  public IrA.ReferenceTypePattern referenceTypePattern(IrA.Pattern pattern) {
    return new IrA.ReferenceTypePattern(PrimitiveType.TYPE,
        checkType(pattern, PrimitiveType.TYPE));
  }

  public IrA.RvalueReferenceTypePattern rvalueReferenceTypePattern(
      IrA.Pattern pattern) {
    return new IrA.RvalueReferenceTypePattern(PrimitiveType.TYPE,
        checkType(pattern, PrimitiveType.TYPE));
  }

  public IrA.ConstTypePattern constTypePattern(IrA.Pattern pattern) {
    return new IrA.ConstTypePattern(PrimitiveType.TYPE,
        checkType(pattern, PrimitiveType.TYPE));
  }

  public IrA.ArrayTypePattern arrayTypePattern(IrA.Pattern pattern) {
    return new IrA.ArrayTypePattern(PrimitiveType.TYPE,
        checkType(pattern, PrimitiveType.TYPE));
  }

  public IrA.FunctionTypePattern functionTypePattern(
      IrA.Pattern returnTypePattern, IrA.Pattern argListPattern) {
    return new IrA.FunctionTypePattern(PrimitiveType.TYPE,
        checkType(returnTypePattern, PrimitiveType.TYPE),
        checkType(argListPattern, TYPE_LIST));
  }

  public IrA.TemplateInstantiationPattern templateInstantiationPattern(
      String templateAtomicCppType, List<? extends IrA.Pattern> argPatterns,
      IrA.@Nullable VarReferencePattern listExtractionArg) {
    argPatterns.forEach(arg -> checkType(arg, PrimitiveType.TYPE));
    if (listExtractionArg != null) {
      checkType(listExtractionArg, TYPE_LIST);
    }
    return new IrA.TemplateInstantiationPattern(PrimitiveType.TYPE,
        templateAtomicCppType, ImmutableList.copyOf(argPatterns),
        listExtractionArg);
  }

  public IrA.ListPattern listPattern(ExprType elemType,
      List<? extends IrA.Pattern> elems,
      IrA.@Nullable VarReferencePattern listExtraction) {
    final ListType type = ListType.of(elemType);
    elems.forEach(elem -> checkType(elem, elemType));
    if (listExtraction != null) {
      checkType(listExtraction, type);
    }
    return new IrA.ListPattern(type, elemType, ImmutableList.copyOf(elems),
        listExtraction);
  }

  // statements

  public IrA.PassStmt pass() {
    return new IrA.PassStmt();
  }

  public IrA.Assert assertStmt(IrA.VarReference var, String message) {
    return new IrA.Assert(checkType(var, PrimitiveType.BOOL), message);
  }

  public IrA.Assignment assignment(IrA.VarReference lhs, IrA.Expr rhs) {
    return assignment(lhs, null, rhs);
  }

  /** Creates an assignment. The variable must have the type of the
   * expression. If {@code lhs2} is present, it receives the error-or-void
   * result of a match, call or comprehension. */
  public IrA.Assignment assignment(IrA.VarReference lhs,
      IrA.@Nullable VarReference lhs2, IrA.Expr rhs) {
    checkArgument(lhs.type.equals(rhs.type),
        "cannot assign %s to %s (%s)", rhs.type, lhs, lhs.type);
    if (lhs2 != null) {
      checkType(lhs2, PrimitiveType.ERROR_OR_VOID);
      checkArgument(rhs instanceof IrA.MatchExpr
              || rhs instanceof IrA.FunctionCall
              || rhs instanceof IrA.ListComprehensionExpr,
          "only a match, call or comprehension can yield an error: %s", rhs);
    }
    return new IrA.Assignment(lhs, lhs2, rhs);
  }

  public IrA.CheckIfError checkIfError(IrA.VarReference var) {
    return new IrA.CheckIfError(checkType(var, PrimitiveType.ERROR_OR_VOID));
  }

  public IrA.UnpackingAssignment unpackingAssignment(
      List<IrA.VarReference> lhsList, IrA.VarReference rhs,
      String errorMessage) {
    checkArgument(!lhsList.isEmpty(), "nothing to unpack into");
    final ListType listType = checkListType(rhs);
    lhsList.forEach(lhs -> checkType(lhs, listType.elementType));
    return new IrA.UnpackingAssignment(ImmutableList.copyOf(lhsList), rhs,
        errorMessage);
  }

  /** Creates a return statement. At least one of result and error must be
   * present. */
  public IrA.ReturnStmt returnStmt(IrA.@Nullable VarReference result,
      IrA.@Nullable VarReference error) {
    checkArgument(result != null || error != null,
        "return must have a result or an error");
    if (error != null) {
      checkType(error, PrimitiveType.ERROR_OR_VOID);
    }
    return new IrA.ReturnStmt(result, error);
  }

  public IrA.IfStmt ifStmt(IrA.VarReference cond,
      List<? extends IrA.Stmt> ifStmts, List<? extends IrA.Stmt> elseStmts) {
    return new IrA.IfStmt(checkType(cond, PrimitiveType.BOOL),
        ImmutableList.copyOf(ifStmts), ImmutableList.copyOf(elseStmts));
  }

  // declarations

  public IrA.FunctionArgDecl argDecl(ExprType type, String name) {
    return new IrA.FunctionArgDecl(type, name);
  }

  /** Creates a function definition. The body must not be empty. */
  public IrA.FunctionDefn functionDefn(String name, String description,
      List<IrA.FunctionArgDecl> args, List<? extends IrA.Stmt> body,
      ExprType returnType) {
    checkArgument(!name.isEmpty(), "empty function name");
    checkArgument(!body.isEmpty(), "body of function %s is empty", name);
    return new IrA.FunctionDefn(name, description, ImmutableList.copyOf(args),
        ImmutableList.copyOf(body), returnType);
  }

  public IrA.CustomTypeDefn customTypeDefn(CustomType customType) {
    return new IrA.CustomTypeDefn(customType);
  }

  public IrA.CheckIfErrorDefn checkIfErrorDefn(
      Map<CustomType, String> errorTypesAndMessages) {
    return new IrA.CheckIfErrorDefn(
        ImmutableMap.copyOf(errorTypesAndMessages));
  }

  /** Creates a module. Only definitions, assignments, assertions, error
   * checks and pass statements may occur at the top level. */
  public IrA.Module module(List<? extends IrA.Node> body,
      Iterable<String> publicNames) {
    for (IrA.Node node : body) {
      checkArgument(MODULE_ELEMENT_OPS.contains(node.op),
          "%s cannot occur at the top level of a module", node.op);
    }
    return new IrA.Module(ImmutableList.copyOf(body),
        ImmutableSortedSet.copyOf(publicNames));
  }
}

// End IrABuilder.java
