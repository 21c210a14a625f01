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
import net.hydromatic.templar.type.ExprType;
import net.hydromatic.templar.type.FunctionType;
import net.hydromatic.templar.type.ListType;
import net.hydromatic.templar.type.PrimitiveType;
import net.hydromatic.templar.type.SetType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Builds IR-B nodes.
 *
 * <p>As with the IR-A builder, each method checks its operands and derives
 * the type of the node before creating it; an inconsistent operand throws
 * {@link IllegalArgumentException}. */
public enum IrBBuilder {
  /** The singleton instance of the IR-B builder.
   * The short name is convenient for use via 'import static'. */
  irB;

  private static final ListType TYPE_LIST = ListType.of(PrimitiveType.TYPE);

  private static <E extends IrB.Expr> E checkType(E expr, ExprType type) {
    checkArgument(expr.type.equals(type), "expected %s to have type %s, was "
        + "%s", expr, type, expr.type);
    return expr;
  }

  private static IrB.Expr checkCollectionOf(IrB.Expr expr, boolean set,
      ExprType elementType) {
    final boolean matches = set
        ? expr.type instanceof SetType
            && ((SetType) expr.type).elementType.equals(elementType)
        : expr.type.isListOf(elementType);
    checkArgument(matches, "expected %s to have type %s[%s], was %s", expr,
        set ? "Set" : "List", elementType, expr.type);
    return expr;
  }

  private static void checkNotFunction(IrB.Expr expr) {
    checkArgument(!expr.type.isFunction(),
        "expected %s not to be a function", expr);
  }

  private static void checkExceptionType(ExprType type) {
    checkArgument(type instanceof CustomType
            && ((CustomType) type).isExceptionClass,
        "expected an exception type, was %s", type);
  }

  // expressions

  public IrB.VarReference varReference(ExprType type, String name,
      boolean isGlobalFunction, boolean isFunctionThatMayThrow,
      @Nullable String sourceModule) {
    checkArgument(!name.isEmpty(), "empty variable name");
    checkArgument(sourceModule == null || isGlobalFunction,
        "only a global function may have a source module: %s", name);
    return new IrB.VarReference(type, name, isGlobalFunction,
        isFunctionThatMayThrow, sourceModule);
  }

  /** Creates a reference to a local variable. */
  public IrB.VarReference var(ExprType type, String name) {
    return varReference(type, name, false, false, null);
  }

  /** Creates a reference to a function defined in the current module. */
  public IrB.VarReference globalFunction(FunctionType type, String name,
      boolean mayThrow) {
    return varReference(type, name, true, mayThrow, null);
  }

  public IrB.BoolLiteral boolLiteral(boolean value) {
    return new IrB.BoolLiteral(PrimitiveType.BOOL, value);
  }

  public IrB.IntLiteral intLiteral(long value) {
    return new IrB.IntLiteral(PrimitiveType.INT, value);
  }

  public IrB.AtomicTypeLiteral atomicTypeLiteral(String cppType) {
    checkArgument(!cppType.isEmpty(), "empty type");
    return new IrB.AtomicTypeLiteral(PrimitiveType.TYPE, cppType);
  }

  public IrB.PointerTypeExpr pointerType(IrB.Expr typeExpr) {
    return new IrB.PointerTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrB.ReferenceTypeExpr referenceType(IrB.Expr typeExpr) {
    return new IrB.ReferenceTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrB.RvalueReferenceTypeExpr rvalueReferenceType(IrB.Expr typeExpr) {
    return new IrB.RvalueReferenceTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrB.ConstTypeExpr constType(IrB.Expr typeExpr) {
    return new IrB.ConstTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrB.ArrayTypeExpr arrayType(IrB.Expr typeExpr) {
    return new IrB.ArrayTypeExpr(PrimitiveType.TYPE,
        checkType(typeExpr, PrimitiveType.TYPE));
  }

  public IrB.FunctionTypeExpr functionType(IrB.Expr returnTypeExpr,
      IrB.Expr argListExpr) {
    checkType(returnTypeExpr, PrimitiveType.TYPE);
    checkType(argListExpr, TYPE_LIST);
    return new IrB.FunctionTypeExpr(PrimitiveType.TYPE, returnTypeExpr,
        argListExpr);
  }

  public IrB.TemplateInstantiationExpr templateInstantiation(
      String templateAtomicCppType, IrB.Expr argListExpr) {
    checkArgument(!templateAtomicCppType.isEmpty(), "empty template name");
    checkType(argListExpr, TYPE_LIST);
    return new IrB.TemplateInstantiationExpr(PrimitiveType.TYPE,
        templateAtomicCppType, argListExpr);
  }

  public IrB.TemplateMemberAccessExpr templateMemberAccess(
      IrB.Expr classTypeExpr, String memberName, IrB.Expr argListExpr) {
    checkType(classTypeExpr, PrimitiveType.TYPE);
    checkArgument(!memberName.isEmpty(), "empty member name");
    checkType(argListExpr, TYPE_LIST);
    return new IrB.TemplateMemberAccessExpr(PrimitiveType.TYPE,
        classTypeExpr, memberName, argListExpr);
  }

  /** Creates a list literal. If {@code listExtractionExpr} is not null, it
   * must be a list of the same type; it binds the remaining elements when
   * the list is used as a pattern. */
  public IrB.ListExpr list(ExprType elemType, List<? extends IrB.Expr> elems,
      IrB.@Nullable VarReference listExtractionExpr) {
    final ListType type = ListType.of(elemType);
    for (IrB.Expr elem : elems) {
      checkType(elem, elemType);
    }
    if (listExtractionExpr != null) {
      checkType(listExtractionExpr, type);
    }
    return new IrB.ListExpr(type, elemType, ImmutableList.copyOf(elems),
        listExtractionExpr);
  }

  public IrB.ListExpr list(ExprType elemType,
      List<? extends IrB.Expr> elems) {
    return list(elemType, elems, null);
  }

  public IrB.SetExpr set(ExprType elemType, List<? extends IrB.Expr> elems) {
    for (IrB.Expr elem : elems) {
      checkType(elem, elemType);
    }
    return new IrB.SetExpr(SetType.of(elemType), elemType,
        ImmutableList.copyOf(elems));
  }

  public IrB.IntListSumExpr intListSum(IrB.Expr expr) {
    return new IrB.IntListSumExpr(PrimitiveType.INT,
        checkCollectionOf(expr, false, PrimitiveType.INT));
  }

  public IrB.IntSetSumExpr intSetSum(IrB.Expr expr) {
    return new IrB.IntSetSumExpr(PrimitiveType.INT,
        checkCollectionOf(expr, true, PrimitiveType.INT));
  }

  public IrB.BoolListAllExpr boolListAll(IrB.Expr expr) {
    return new IrB.BoolListAllExpr(PrimitiveType.BOOL,
        checkCollectionOf(expr, false, PrimitiveType.BOOL));
  }

  public IrB.BoolListAnyExpr boolListAny(IrB.Expr expr) {
    return new IrB.BoolListAnyExpr(PrimitiveType.BOOL,
        checkCollectionOf(expr, false, PrimitiveType.BOOL));
  }

  public IrB.BoolSetAllExpr boolSetAll(IrB.Expr expr) {
    return new IrB.BoolSetAllExpr(PrimitiveType.BOOL,
        checkCollectionOf(expr, true, PrimitiveType.BOOL));
  }

  public IrB.BoolSetAnyExpr boolSetAny(IrB.Expr expr) {
    return new IrB.BoolSetAnyExpr(PrimitiveType.BOOL,
        checkCollectionOf(expr, true, PrimitiveType.BOOL));
  }

  /** Creates a call to a function.
   *
   * <p>The function must have a function type, and there must be as many
   * arguments as the type has argument types. Each argument must have the
   * declared type, or be of the bottom type. */
  public IrB.FunctionCall functionCall(IrB.Expr funExpr,
      List<? extends IrB.Expr> args, boolean mayThrow) {
    checkArgument(funExpr.type instanceof FunctionType,
        "expected %s to be a function, was %s", funExpr, funExpr.type);
    final FunctionType functionType = (FunctionType) funExpr.type;
    checkArgument(functionType.argTypes.size() == args.size(),
        "expected %s arguments to %s, got %s",
        functionType.argTypes.size(), funExpr, args.size());
    for (int i = 0; i < args.size(); i++) {
      final IrB.Expr arg = args.get(i);
      final ExprType argType = functionType.argTypes.get(i);
      checkArgument(arg.type.equals(argType)
              || arg.type == PrimitiveType.BOTTOM,
          "argument %s of %s has type %s, expected %s", i, funExpr, arg.type,
          argType);
    }
    return new IrB.FunctionCall(functionType.returnType, funExpr,
        ImmutableList.copyOf(args), mayThrow);
  }

  /** Creates a call to a function; it may throw if the function is a
   * reference to a function that may throw, or is not a global function. */
  public IrB.FunctionCall functionCall(IrB.Expr funExpr, IrB.Expr... args) {
    final boolean mayThrow = !(funExpr instanceof IrB.VarReference)
        || !((IrB.VarReference) funExpr).isGlobalFunction
        || ((IrB.VarReference) funExpr).isFunctionThatMayThrow;
    return functionCall(funExpr, ImmutableList.copyOf(args), mayThrow);
  }

  /** Creates an equality comparison. Both sides must have the same type,
   * which is not a function type; or one side may be
   * {@code ErrorOrVoid} and the other {@code Type}. */
  public IrB.EqualityComparison equal(IrB.Expr lhs, IrB.Expr rhs) {
    checkNotFunction(lhs);
    checkNotFunction(rhs);
    checkArgument(lhs.type.equals(rhs.type)
            || isErrorOrVoidAndType(lhs.type, rhs.type)
            || isErrorOrVoidAndType(rhs.type, lhs.type),
        "cannot compare %s of type %s to %s of type %s", lhs, lhs.type, rhs,
        rhs.type);
    return new IrB.EqualityComparison(PrimitiveType.BOOL, lhs, rhs);
  }

  private static boolean isErrorOrVoidAndType(ExprType t0, ExprType t1) {
    return t0 == PrimitiveType.ERROR_OR_VOID && t1 == PrimitiveType.TYPE;
  }

  /** Creates a test for membership of a list or a set. */
  public IrB.InExpr in(IrB.Expr lhs, IrB.Expr rhs) {
    checkCollectionOf(rhs, rhs.type instanceof SetType, lhs.type);
    return new IrB.InExpr(PrimitiveType.BOOL, lhs, rhs);
  }

  /** Creates an access to an attribute.
   *
   * <p>The expression must be of type {@code Type}, or of a custom type
   * that has a field of that name and type. */
  public IrB.AttributeAccessExpr attributeAccess(IrB.Expr expr,
      String attributeName, ExprType type) {
    checkArgument(!attributeName.isEmpty(), "empty attribute name");
    if (expr.type instanceof CustomType) {
      final ExprType fieldType =
          ((CustomType) expr.type).fieldType(attributeName);
      checkArgument(type.equals(fieldType),
          "type %s has no field %s of type %s", expr.type, attributeName,
          type);
    } else {
      checkType(expr, PrimitiveType.TYPE);
    }
    return new IrB.AttributeAccessExpr(type, expr, attributeName);
  }

  public IrB.AndExpr and(IrB.Expr lhs, IrB.Expr rhs) {
    return new IrB.AndExpr(PrimitiveType.BOOL,
        checkType(lhs, PrimitiveType.BOOL), checkType(rhs, PrimitiveType.BOOL));
  }

  public IrB.OrExpr or(IrB.Expr lhs, IrB.Expr rhs) {
    return new IrB.OrExpr(PrimitiveType.BOOL,
        checkType(lhs, PrimitiveType.BOOL), checkType(rhs, PrimitiveType.BOOL));
  }

  public IrB.NotExpr not(IrB.Expr expr) {
    return new IrB.NotExpr(PrimitiveType.BOOL,
        checkType(expr, PrimitiveType.BOOL));
  }

  public IrB.IntComparisonExpr intComparison(IrB.Expr lhs, Op operator,
      IrB.Expr rhs) {
    checkArgument(operator.isComparison(), "not a comparison: %s", operator);
    return new IrB.IntComparisonExpr(PrimitiveType.BOOL,
        checkType(lhs, PrimitiveType.INT), checkType(rhs, PrimitiveType.INT),
        operator);
  }

  public IrB.IntUnaryMinusExpr unaryMinus(IrB.Expr expr) {
    return new IrB.IntUnaryMinusExpr(PrimitiveType.INT,
        checkType(expr, PrimitiveType.INT));
  }

  public IrB.IntBinaryOpExpr intBinaryOp(IrB.Expr lhs, Op operator,
      IrB.Expr rhs) {
    checkArgument(operator.isArithmetic(), "not arithmetic: %s", operator);
    return new IrB.IntBinaryOpExpr(PrimitiveType.INT,
        checkType(lhs, PrimitiveType.INT), checkType(rhs, PrimitiveType.INT),
        operator);
  }

  public IrB.ListConcatExpr listConcat(IrB.Expr lhs, IrB.Expr rhs) {
    checkArgument(lhs.type instanceof ListType,
        "expected %s to be a list, was %s", lhs, lhs.type);
    checkType(rhs, lhs.type);
    return new IrB.ListConcatExpr(lhs.type, lhs, rhs);
  }

  /** Creates a list comprehension. The loop variable must have the
   * element type of the list; the result may not be a function. */
  public IrB.ListComprehension listComprehension(IrB.Expr listExpr,
      IrB.VarReference loopVar, IrB.Expr resultElemExpr,
      @Nullable SourceBranch loopBodyStartBranch,
      @Nullable SourceBranch loopExitBranch) {
    checkCollectionOf(listExpr, false, loopVar.type);
    checkNotFunction(resultElemExpr);
    return new IrB.ListComprehension(ListType.of(resultElemExpr.type),
        listExpr, loopVar, resultElemExpr, loopBodyStartBranch,
        loopExitBranch);
  }

  /** Creates a set comprehension. The loop variable must have the
   * element type of the set; the result may not be a function. */
  public IrB.SetComprehension setComprehension(IrB.Expr setExpr,
      IrB.VarReference loopVar, IrB.Expr resultElemExpr,
      @Nullable SourceBranch loopBodyStartBranch,
      @Nullable SourceBranch loopExitBranch) {
    checkCollectionOf(setExpr, true, loopVar.type);
    checkNotFunction(resultElemExpr);
    return new IrB.SetComprehension(SetType.of(resultElemExpr.type),
        setExpr, loopVar, resultElemExpr, loopBodyStartBranch,
        loopExitBranch);
  }

  /** Creates a case of a match expression. */
  public IrB.MatchCase matchCase(List<? extends IrB.Expr> typePatterns,
      List<String> matchedVarNames, List<String> matchedVariadicVarNames,
      IrB.Expr expr, @Nullable SourceBranch startBranch,
      @Nullable SourceBranch endBranch) {
    return new IrB.MatchCase(ImmutableList.copyOf(typePatterns),
        ImmutableList.copyOf(matchedVarNames),
        ImmutableList.copyOf(matchedVariadicVarNames), expr, startBranch,
        endBranch);
  }

  /** Creates a match expression.
   *
   * <p>There must be at least one matched expression and at least one case;
   * each case must have one pattern per matched expression; all cases must
   * have results of the same type; at most one case may be the main
   * definition. */
  public IrB.MatchExpr match(List<? extends IrB.Expr> matchedExprs,
      List<IrB.MatchCase> matchCases) {
    checkArgument(!matchedExprs.isEmpty(), "no matched expressions");
    checkArgument(!matchCases.isEmpty(), "no cases");
    final ExprType type = matchCases.get(0).expr.type;
    int mainDefinitionCount = 0;
    for (IrB.MatchCase matchCase : matchCases) {
      checkArgument(matchCase.typePatterns.size() == matchedExprs.size(),
          "case has %s patterns, expected %s", matchCase.typePatterns.size(),
          matchedExprs.size());
      checkArgument(matchCase.expr.type.equals(type),
          "cases have different types: %s and %s", type,
          matchCase.expr.type);
      if (matchCase.isMainDefinition()) {
        ++mainDefinitionCount;
      }
    }
    checkArgument(mainDefinitionCount <= 1,
        "more than one main definition");
    return new IrB.MatchExpr(type, ImmutableList.copyOf(matchedExprs),
        ImmutableList.copyOf(matchCases));
  }

  // statements

  public IrB.PassStmt pass(@Nullable SourceBranch sourceBranch) {
    return new IrB.PassStmt(sourceBranch);
  }

  public IrB.PassStmt pass() {
    return pass(null);
  }

  public IrB.Assert assertStmt(IrB.Expr expr, String message,
      @Nullable SourceBranch sourceBranch) {
    return new IrB.Assert(checkType(expr, PrimitiveType.BOOL), message,
        sourceBranch);
  }

  /** Creates an assignment. The right-hand side must have the type of the
   * variable, or be of the bottom type. */
  public IrB.Assignment assignment(IrB.VarReference lhs, IrB.Expr rhs,
      @Nullable SourceBranch sourceBranch) {
    checkArgument(!lhs.isGlobalFunction, "cannot assign to global function %s",
        lhs);
    checkArgument(lhs.type.equals(rhs.type)
            || rhs.type == PrimitiveType.BOTTOM,
        "cannot assign %s of type %s to %s of type %s", rhs, rhs.type, lhs,
        lhs.type);
    return new IrB.Assignment(lhs, rhs, sourceBranch);
  }

  public IrB.Assignment assignment(IrB.VarReference lhs, IrB.Expr rhs) {
    return assignment(lhs, rhs, null);
  }

  /** Creates an assignment that unpacks a list. The right-hand side must
   * be a list whose element type is the type of each variable. */
  public IrB.UnpackingAssignment unpackingAssignment(
      List<IrB.VarReference> lhsList, IrB.Expr rhs, String errorMessage,
      @Nullable SourceBranch sourceBranch) {
    checkArgument(!lhsList.isEmpty(), "no variables to unpack into");
    for (IrB.VarReference lhs : lhsList) {
      checkCollectionOf(rhs, false, lhs.type);
    }
    return new IrB.UnpackingAssignment(ImmutableList.copyOf(lhsList), rhs,
        errorMessage, sourceBranch);
  }

  public IrB.ReturnStmt returnStmt(IrB.Expr expr,
      @Nullable SourceBranch sourceBranch) {
    return new IrB.ReturnStmt(expr, sourceBranch);
  }

  public IrB.ReturnStmt returnStmt(IrB.Expr expr) {
    return returnStmt(expr, null);
  }

  public IrB.IfStmt ifStmt(IrB.Expr condExpr, List<? extends IrB.Stmt> ifStmts,
      List<? extends IrB.Stmt> elseStmts) {
    return new IrB.IfStmt(checkType(condExpr, PrimitiveType.BOOL),
        ImmutableList.copyOf(ifStmts), ImmutableList.copyOf(elseStmts));
  }

  /** Creates a statement that raises an exception. The expression must be
   * of a custom type that is an exception class. */
  public IrB.RaiseStmt raise(IrB.Expr expr,
      @Nullable SourceBranch sourceBranch) {
    checkExceptionType(expr.type);
    return new IrB.RaiseStmt(expr, sourceBranch);
  }

  public IrB.TryExcept tryExcept(List<? extends IrB.Stmt> tryBody,
      CustomType caughtExceptionType, String caughtExceptionName,
      List<? extends IrB.Stmt> exceptBody,
      @Nullable SourceBranch tryBranch, @Nullable SourceBranch exceptBranch) {
    checkArgument(!tryBody.isEmpty(), "empty try body");
    checkExceptionType(caughtExceptionType);
    checkArgument(!caughtExceptionName.isEmpty(), "empty exception name");
    return new IrB.TryExcept(ImmutableList.copyOf(tryBody),
        caughtExceptionType, caughtExceptionName,
        ImmutableList.copyOf(exceptBody), tryBranch, exceptBranch);
  }

  // declarations

  public IrB.FunctionArgDecl argDecl(ExprType type, String name) {
    return new IrB.FunctionArgDecl(type, name);
  }

  /** Creates a function definition. The body must not be empty. */
  public IrB.FunctionDefn functionDefn(String name,
      List<IrB.FunctionArgDecl> args, List<? extends IrB.Stmt> body,
      ExprType returnType) {
    checkArgument(!name.isEmpty(), "empty function name");
    checkArgument(!body.isEmpty(), "empty body in function %s", name);
    return new IrB.FunctionDefn(name, ImmutableList.copyOf(args),
        ImmutableList.copyOf(body), returnType);
  }

  /** Creates a module. */
  public IrB.Module module(List<IrB.FunctionDefn> functionDefns,
      List<IrB.Assert> assertions, List<CustomType> customTypes,
      Iterable<String> publicNames, List<IrB.PassStmt> passStmts) {
    return new IrB.Module(ImmutableList.copyOf(functionDefns),
        ImmutableList.copyOf(assertions), ImmutableList.copyOf(customTypes),
        ImmutableSortedSet.copyOf(publicNames),
        ImmutableList.copyOf(passStmts));
  }
}

// End IrBBuilder.java
