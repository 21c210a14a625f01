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
package net.hydromatic.templar.compile;

import net.hydromatic.templar.irb.IrB;
import net.hydromatic.templar.irb.Shuttle;
import net.hydromatic.templar.irb.Visitor;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Recalculates which functions may raise an exception.
 *
 * <p>Front ends conservatively flag references to global functions as
 * "may throw". This pass builds the graph of calls between the functions
 * of a module, and clears the flag on references to functions that neither
 * contain a {@code raise} statement nor call, directly or indirectly, a
 * function that does. It also clears the "may throw" flag of calls made
 * through such references.
 *
 * <p>A public function of an imported module may throw if it contains a
 * {@code raise} statement or a reference to a function that may throw. */
public class CanThrowCalculator {
  private final Map<String, Boolean> functionCanThrow;
  private final Map<String, Map<String, Boolean>> externalFunctionCanThrow;

  private CanThrowCalculator(Map<String, Boolean> functionCanThrow,
      Map<String, Map<String, Boolean>> externalFunctionCanThrow) {
    this.functionCanThrow = ImmutableMap.copyOf(functionCanThrow);
    this.externalFunctionCanThrow =
        ImmutableMap.copyOf(externalFunctionCanThrow);
  }

  /** Recalculates the "may throw" flags in a module.
   *
   * @param module Module
   * @param importedModules Modules that {@code module} may reference,
   *   keyed by module name
   * @return Module with flags recalculated; the same module if there are no
   *   function definitions or nothing changed
   */
  public static IrB.Module recalculate(IrB.Module module,
      Map<String, IrB.Module> importedModules) {
    if (module.functionDefns.isEmpty()) {
      return module;
    }

    final MutableGraph<String> graph =
        GraphBuilder.directed().allowsSelfLoops(true).build();
    final Set<String> containsRaise = new LinkedHashSet<>();
    for (IrB.FunctionDefn functionDefn : module.functionDefns) {
      graph.addNode(functionDefn.name);
      if (containsRaise(functionDefn)) {
        containsRaise.add(functionDefn.name);
      }
    }
    for (IrB.FunctionDefn functionDefn : module.functionDefns) {
      for (String name : referencedGlobalFunctions(functionDefn)) {
        if (graph.nodes().contains(name)) {
          graph.putEdge(functionDefn.name, name);
        }
      }
    }

    // A function can throw if it, or a function that it reaches, contains a
    // raise. "reachableNodes" includes the function itself.
    final Map<String, Boolean> functionCanThrow = new HashMap<>();
    for (String name : graph.nodes()) {
      boolean canThrow = false;
      for (String reachable : Graphs.reachableNodes(graph, name)) {
        if (containsRaise.contains(reachable)) {
          canThrow = true;
          break;
        }
      }
      functionCanThrow.put(name, canThrow);
    }

    final Map<String, Map<String, Boolean>> externalFunctionCanThrow =
        new HashMap<>();
    importedModules.forEach((moduleName, importedModule) -> {
      final Map<String, Boolean> map = new HashMap<>();
      for (IrB.FunctionDefn functionDefn : importedModule.functionDefns) {
        if (importedModule.publicNames.contains(functionDefn.name)) {
          map.put(functionDefn.name,
              containsRaise(functionDefn)
                  || containsReferenceThatMayThrow(functionDefn));
        }
      }
      externalFunctionCanThrow.put(moduleName, map);
    });

    return module.accept(
        new CanThrowCalculator(functionCanThrow, externalFunctionCanThrow)
            .new ApplyShuttle());
  }

  /** Returns whether a function contains a {@code raise} statement. */
  static boolean containsRaise(IrB.FunctionDefn functionDefn) {
    final boolean[] found = {false};
    functionDefn.accept(new Visitor() {
      @Override protected void visit(IrB.RaiseStmt raiseStmt) {
        found[0] = true;
        super.visit(raiseStmt);
      }
    });
    return found[0];
  }

  /** Returns whether a function contains a reference to a function that
   * may throw. */
  static boolean containsReferenceThatMayThrow(
      IrB.FunctionDefn functionDefn) {
    final boolean[] found = {false};
    functionDefn.accept(new Visitor() {
      @Override protected void visit(IrB.VarReference varReference) {
        found[0] |= varReference.isFunctionThatMayThrow;
      }
    });
    return found[0];
  }

  /** Returns the names of the global functions that a function
   * references. */
  static Set<String> referencedGlobalFunctions(
      IrB.FunctionDefn functionDefn) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    functionDefn.accept(new Visitor() {
      @Override protected void visit(IrB.VarReference varReference) {
        if (varReference.isGlobalFunction) {
          names.add(varReference.name);
        }
      }
    });
    return names.build();
  }

  /** Returns whether a global function can throw, or null if it is not
   * known. */
  private @Nullable Boolean canThrow(IrB.VarReference varReference) {
    if (varReference.sourceModule == null) {
      return functionCanThrow.get(varReference.name);
    }
    final Map<String, Boolean> map =
        externalFunctionCanThrow.get(varReference.sourceModule);
    return map == null ? null : map.get(varReference.name);
  }

  /** Shuttle that clears the "may throw" flag of references to, and calls
   * of, functions that cannot throw. */
  private class ApplyShuttle extends Shuttle {
    @Override protected IrB.VarReference visit(
        IrB.VarReference varReference) {
      if (varReference.isFunctionThatMayThrow
          && varReference.isGlobalFunction
          && Boolean.FALSE.equals(canThrow(varReference))) {
        return varReference.withFunctionThatMayThrow(false);
      }
      return varReference;
    }

    @Override protected IrB.Expr visit(IrB.FunctionCall functionCall) {
      final IrB.Expr funExpr = functionCall.funExpr.accept(this);
      boolean mayThrow = functionCall.mayThrow;
      if (mayThrow
          && funExpr instanceof IrB.VarReference
          && ((IrB.VarReference) funExpr).isGlobalFunction
          && !((IrB.VarReference) funExpr).isFunctionThatMayThrow) {
        mayThrow = false;
      }
      return functionCall.copy(funExpr, visitList(functionCall.args),
          mayThrow);
    }
  }
}

// End CanThrowCalculator.java
