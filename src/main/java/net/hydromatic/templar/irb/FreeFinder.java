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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Finds free variables in IR-B statements and expressions.
 *
 * <p>A variable is free if it is referenced but not bound by an enclosing
 * construct or by a preceding statement. References to global functions
 * are never free. If a variable is referenced more than once, the result
 * holds the last reference.
 *
 * <p>The following bind names: an assignment (its target), an unpacking
 * assignment (each target), a match case (its matched names, for its
 * patterns and result), a comprehension (its loop variable, for the result
 * element), the "except" clause of a try statement (the caught exception,
 * for the clause's body) and a function definition (its named arguments).
 * Names assigned in a branch of an "if" or "try" statement remain bound
 * after that statement. */
public class FreeFinder extends Visitor {
  private final ImmutableSet<String> boundNames;
  private final Map<String, IrB.VarReference> freeVarsByName;

  private FreeFinder(ImmutableSet<String> boundNames,
      Map<String, IrB.VarReference> freeVarsByName) {
    this.boundNames = boundNames;
    this.freeVarsByName = freeVarsByName;
  }

  private static FreeFinder create() {
    return new FreeFinder(ImmutableSet.of(), new TreeMap<>());
  }

  /** Returns the free variables of a list of statements, keyed by name. */
  public static Map<String, IrB.VarReference> freeVariables(
      List<? extends IrB.Stmt> stmts) {
    final FreeFinder finder = create();
    finder.visitStmts(stmts);
    return finder.result();
  }

  /** Returns the free variables of an expression, keyed by name. */
  public static Map<String, IrB.VarReference> freeVariables(IrB.Expr expr) {
    final FreeFinder finder = create();
    expr.accept(finder);
    return finder.result();
  }

  /** Returns the free variables of the body of a function, keyed by name.
   * The function's arguments are bound. */
  public static Map<String, IrB.VarReference> freeVariables(
      IrB.FunctionDefn functionDefn) {
    final FreeFinder finder = create();
    functionDefn.accept(finder);
    return finder.result();
  }

  private Map<String, IrB.VarReference> result() {
    return ImmutableSortedMap.copyOf(freeVarsByName);
  }

  /** Creates a finder the same as this but with additional bound names. */
  private FreeFinder bind(Iterable<String> names) {
    final ImmutableSet<String> boundNames2 =
        ImmutableSet.<String>builder().addAll(boundNames).addAll(names).build();
    if (boundNames2.size() == boundNames.size()) {
      return this;
    }
    return new FreeFinder(boundNames2, freeVarsByName);
  }

  /** Visits a list of statements. The names bound by each statement are
   * visible to the statements that follow it. */
  private void visitStmts(List<? extends IrB.Stmt> stmts) {
    FreeFinder finder = this;
    for (IrB.Stmt stmt : stmts) {
      stmt.accept(finder);
      finder = finder.bind(boundNames(stmt));
    }
  }

  /** Returns the names that a statement binds for the statements that
   * follow it. */
  static Set<String> boundNames(IrB.Stmt stmt) {
    final Set<String> names = new LinkedHashSet<>();
    addBoundNames(stmt, names);
    return names;
  }

  private static void addBoundNames(IrB.Stmt stmt, Set<String> names) {
    switch (stmt.op) {
    case ASSIGNMENT:
      names.add(((IrB.Assignment) stmt).lhs.name);
      break;
    case UNPACKING_ASSIGNMENT:
      ((IrB.UnpackingAssignment) stmt).lhsList.forEach(v -> names.add(v.name));
      break;
    case IF:
      final IrB.IfStmt ifStmt = (IrB.IfStmt) stmt;
      ifStmt.ifStmts.forEach(s -> addBoundNames(s, names));
      ifStmt.elseStmts.forEach(s -> addBoundNames(s, names));
      break;
    case TRY_EXCEPT:
      final IrB.TryExcept tryExcept = (IrB.TryExcept) stmt;
      tryExcept.tryBody.forEach(s -> addBoundNames(s, names));
      tryExcept.exceptBody.forEach(s -> addBoundNames(s, names));
      break;
    default:
      break;
    }
  }

  @Override protected void visit(IrB.VarReference varReference) {
    if (!varReference.isGlobalFunction
        && !boundNames.contains(varReference.name)) {
      freeVarsByName.put(varReference.name, varReference);
    }
  }

  @Override protected void visit(IrB.Assignment assignment) {
    assignment.rhs.accept(this);
  }

  @Override protected void visit(IrB.UnpackingAssignment unpackingAssignment) {
    unpackingAssignment.rhs.accept(this);
  }

  @Override protected void visit(IrB.IfStmt ifStmt) {
    ifStmt.condExpr.accept(this);
    visitStmts(ifStmt.ifStmts);
    visitStmts(ifStmt.elseStmts);
  }

  @Override protected void visit(IrB.TryExcept tryExcept) {
    visitStmts(tryExcept.tryBody);
    bind(ImmutableList.of(tryExcept.caughtExceptionName))
        .visitStmts(tryExcept.exceptBody);
  }

  @Override protected void visit(IrB.MatchCase matchCase) {
    final FreeFinder finder = bind(matchCase.boundNames());
    matchCase.typePatterns.forEach(finder::accept);
    matchCase.expr.accept(finder);
  }

  @Override protected void visit(IrB.ListComprehension listComprehension) {
    listComprehension.collectionExpr.accept(this);
    listComprehension.resultElemExpr.accept(
        bind(ImmutableList.of(listComprehension.loopVar.name)));
  }

  @Override protected void visit(IrB.SetComprehension setComprehension) {
    setComprehension.collectionExpr.accept(this);
    setComprehension.resultElemExpr.accept(
        bind(ImmutableList.of(setComprehension.loopVar.name)));
  }

  @Override protected void visit(IrB.FunctionDefn functionDefn) {
    final ImmutableList.Builder<String> argNames = ImmutableList.builder();
    for (IrB.FunctionArgDecl arg : functionDefn.args) {
      if (!arg.name.isEmpty()) {
        argNames.add(arg.name);
      }
    }
    bind(argNames.build()).visitStmts(functionDefn.body);
  }
}

// End FreeFinder.java
