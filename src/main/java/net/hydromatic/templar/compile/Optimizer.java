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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.function.BiFunction;

import static java.util.Objects.requireNonNull;

/** Runs a sequence of passes over an IR-B module.
 *
 * <p>The passes are constant folding ({@link Prop#FOLD_CONSTANTS}) and
 * recalculation of which functions can throw
 * ({@link Prop#RECALCULATE_CAN_THROW}), in that order. The sequence runs
 * {@link Prop#PASS_COUNT} times. After each pass, the optimizer calls
 * {@link Tracer#onPass}. */
public class Optimizer {
  public static final String FOLD_CONSTANTS = "foldConstants";
  public static final String RECALCULATE_CAN_THROW = "recalculateCanThrow";

  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  /** Creates an Optimizer. */
  public Optimizer(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an Optimizer with default properties. */
  public Optimizer(Tracer tracer) {
    this(ImmutableMap.of(), tracer);
  }

  /** Optimizes a module.
   *
   * @param module Module
   * @param importedModules Modules that {@code module} may reference,
   *   keyed by module name
   * @return Optimized module
   */
  public IrB.Module optimize(IrB.Module module,
      Map<String, IrB.Module> importedModules) {
    final int passCount = Prop.PASS_COUNT.intValue(propMap);
    IrB.Module m = module;
    for (int i = 0; i < passCount; i++) {
      if (Prop.FOLD_CONSTANTS.booleanValue(propMap)) {
        m = pass(FOLD_CONSTANTS, m, (m2, imports) -> ConstantFolder.fold(m2),
            importedModules);
      }
      if (Prop.RECALCULATE_CAN_THROW.booleanValue(propMap)) {
        m = pass(RECALCULATE_CAN_THROW, m, CanThrowCalculator::recalculate,
            importedModules);
      }
    }
    return m;
  }

  private IrB.Module pass(String passName, IrB.Module module,
      BiFunction<IrB.Module, Map<String, IrB.Module>, IrB.Module> pass,
      Map<String, IrB.Module> importedModules) {
    final IrB.Module module2 = pass.apply(module, importedModules);
    tracer.onPass(passName, module2);
    if (Prop.VERBOSE.booleanValue(propMap)) {
      tracer.onDump(passName, module2.unparse(true));
    }
    return module2;
  }
}

// End Optimizer.java
