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

import net.hydromatic.templar.type.ExprType;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkState;

/** Computes the return type of a list of IR-B statements, and whether the
 * statements always return.
 *
 * <p>Only the last statement of a list is examined. A {@code return}
 * always returns, and its type is the type of the returned expression; a
 * {@code raise} always returns, with no type; an {@code if} or
 * {@code try} statement merges its two branches. Other statements do not
 * return. */
public abstract class ReturnTypes {
  private ReturnTypes() {}

  /** Returns the return type information of a list of statements. */
  public static ReturnTypeInfo returnType(List<? extends IrB.Stmt> stmts) {
    if (stmts.isEmpty()) {
      return ReturnTypeInfo.NONE;
    }
    final IrB.Stmt last = stmts.get(stmts.size() - 1);
    switch (last.op) {
    case RETURN:
      return new ReturnTypeInfo(((IrB.ReturnStmt) last).expr.type, true);
    case RAISE:
      return new ReturnTypeInfo(null, true);
    case IF:
      final IrB.IfStmt ifStmt = (IrB.IfStmt) last;
      return returnType(ifStmt.ifStmts).merge(returnType(ifStmt.elseStmts));
    case TRY_EXCEPT:
      final IrB.TryExcept tryExcept = (IrB.TryExcept) last;
      return returnType(tryExcept.tryBody)
          .merge(returnType(tryExcept.exceptBody));
    case ASSERT:
    case ASSIGNMENT:
    case UNPACKING_ASSIGNMENT:
    case PASS:
      return ReturnTypeInfo.NONE;
    default:
      throw new AssertionError("unexpected statement " + last.op);
    }
  }

  /** Return type of a list of statements, if known, and whether every path
   * through the statements ends in a {@code return} or {@code raise}. */
  public static class ReturnTypeInfo {
    /** Information for statements that do not return. */
    public static final ReturnTypeInfo NONE = new ReturnTypeInfo(null, false);

    public final @Nullable ExprType type;
    public final boolean alwaysReturns;

    public ReturnTypeInfo(@Nullable ExprType type, boolean alwaysReturns) {
      this.type = type;
      this.alwaysReturns = alwaysReturns;
    }

    /** Combines the information of two branches.
     *
     * @throws IllegalStateException if both branches have a type and the
     *   types differ
     */
    public ReturnTypeInfo merge(ReturnTypeInfo other) {
      final ExprType mergedType;
      if (type == null) {
        mergedType = other.type;
      } else {
        checkState(other.type == null || type.equals(other.type),
            "branches return different types: %s and %s", type, other.type);
        mergedType = type;
      }
      return new ReturnTypeInfo(mergedType,
          alwaysReturns && other.alwaysReturns);
    }

    @Override public int hashCode() {
      return Objects.hash(type, alwaysReturns);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ReturnTypeInfo
          && Objects.equals(type, ((ReturnTypeInfo) o).type)
          && alwaysReturns == ((ReturnTypeInfo) o).alwaysReturns;
    }

    @Override public String toString() {
      return "(" + type + ", " + alwaysReturns + ")";
    }
  }
}

// End ReturnTypes.java
