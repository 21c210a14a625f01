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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/** Finds free variables in IR-A statements and expressions.
 *
 * <p>A variable is free if it is referenced but not bound within the
 * statements or expression being analyzed. References to global functions
 * are never free.
 *
 * <p>Bindings are held in an immutable set. Entering a construct that binds
 * names creates a new finder with an extended set; the finder of the
 * enclosing scope is unaffected. */
public class FreeFinder extends Visitor {
  private final ImmutableSet<String> boundNames;
  private final SortedMap<String, IrA.VarReference> freeVarsByName;

  private FreeFinder(ImmutableSet<String> boundNames,
      SortedMap<String, IrA.VarReference> freeVarsByName) {
    this.boundNames = boundNames;
    this.freeVarsByName = freeVarsByName;
  }

  /** Returns the free variables of a list of statements, sorted by
   * name. */
  public static ImmutableList<IrA.VarReference> freeVariables(
      List<? extends IrA.Stmt> stmts) {
    final FreeFinder finder = create();
    finder.visitStmts(stmts);
    return finder.result();
  }

  /** Returns the free variables of an expression, sorted by name. */
  public static ImmutableList<IrA.VarReference> freeVariables(IrA.Expr expr) {
    final FreeFinder finder = create();
    expr.accept(finder);
    return finder.result();
  }

  /** Returns the free variables of the body of a function, sorted by name.
   * The function's arguments are bound. */
  public static ImmutableList<IrA.VarReference> freeVariables(
      IrA.FunctionDefn functionDefn) {
    final FreeFinder finder = create();
    functionDefn.accept(finder);
    return finder.result();
  }

  private static FreeFinder create() {
    return new FreeFinder(ImmutableSet.of(), new TreeMap<>());
  }

  private ImmutableList<IrA.VarReference> result() {
    return ImmutableList.copyOf(freeVarsByName.values());
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
  private void visitStmts(List<? extends IrA.Stmt> stmts) {
    FreeFinder finder = this;
    for (IrA.Stmt stmt : stmts) {
      stmt.accept(finder);
      finder = finder.bind(boundNames(stmt));
    }
  }

  /** Returns the names that a statement binds for the statements that
   * follow it. */
  static Set<String> boundNames(IrA.Stmt stmt) {
    final Set<String> names = new LinkedHashSet<>();
    addBoundNames(stmt, names);
    return names;
  }

  private static void addBoundNames(IrA.Stmt stmt, Set<String> names) {
    switch (stmt.op) {
    case ASSIGNMENT:
      final IrA.Assignment assignment = (IrA.Assignment) stmt;
      names.add(assignment.lhs.name);
      if (assignment.lhs2 != null) {
        names.add(assignment.lhs2.name);
      }
      break;
    case UNPACKING_ASSIGNMENT:
      ((IrA.UnpackingAssignment) stmt).lhsList.forEach(v -> names.add(v.name));
      break;
    case IF:
      // Variables assigned in either branch are visible after the "if".
      final IrA.IfStmt ifStmt = (IrA.IfStmt) stmt;
      ifStmt.ifStmts.forEach(s -> addBoundNames(s, names));
      ifStmt.elseStmts.forEach(s -> addBoundNames(s, names));
      break;
    default:
      break;
    }
  }

  private void reference(String name, IrA.VarReference ref) {
    if (!ref.isGlobalFunction && !boundNames.contains(name)) {
      freeVarsByName.put(name, ref);
    }
  }

  @Override protected void visit(IrA.VarReference varReference) {
    reference(varReference.name, varReference);
  }

  @Override protected void visit(IrA.VarReferencePattern pattern) {
    if (!pattern.isGlobalFunction) {
      reference(pattern.name, pattern.toVarReference());
    }
  }

  @Override protected void visit(IrA.Assignment assignment) {
    assignment.rhs.accept(this);
  }

  @Override protected void visit(IrA.UnpackingAssignment unpackingAssignment) {
    unpackingAssignment.rhs.accept(this);
  }

  @Override protected void visit(IrA.IfStmt ifStmt) {
    ifStmt.cond.accept(this);
    visitStmts(ifStmt.ifStmts);
    visitStmts(ifStmt.elseStmts);
  }

  @Override protected void visit(IrA.MatchCase matchCase) {
    final FreeFinder finder = bind(matchCase.boundNames());
    matchCase.typePatterns.forEach(finder::accept);
    matchCase.expr.accept(finder);
  }

  @Override protected void visit(IrA.ListComprehensionExpr listComprehension) {
    listComprehension.listVar.accept(this);
    listComprehension.resultElemExpr.accept(
        bind(ImmutableList.of(listComprehension.loopVar.name)));
  }

  @Override protected void visit(IrA.FunctionDefn functionDefn) {
    final ImmutableList.Builder<String> argNames = ImmutableList.builder();
    for (IrA.FunctionArgDecl arg : functionDefn.args) {
      if (!arg.name.isEmpty()) {
        argNames.add(arg.name);
      }
    }
    bind(argNames.build()).visitStmts(functionDefn.body);
  }
}

// End FreeFinder.java
