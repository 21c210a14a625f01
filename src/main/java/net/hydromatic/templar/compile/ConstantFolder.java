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

import org.checkerframework.checker.nullness.qual.Nullable;

import static net.hydromatic.templar.irb.IrBBuilder.irB;

/** Shuttle that evaluates operators whose operands are literals.
 *
 * <p>Folds {@code not}, {@code and}, {@code or}, integer negation,
 * integer comparison, integer arithmetic and equality of integer and boolean
 * literals. An
 * {@code and} or {@code or} whose left operand is a literal is simplified
 * even if its right operand is not, because the right operand is not
 * evaluated if the left operand decides the result.
 *
 * <p>Division and modulus by zero, and arithmetic that overflows, are left
 * for the program to evaluate. */
public class ConstantFolder extends Shuttle {
  /** Folds constants in a module. */
  public static IrB.Module fold(IrB.Module module) {
    return module.accept(new ConstantFolder());
  }

  @Override protected IrB.Expr visit(IrB.NotExpr notExpr) {
    final IrB.Expr expr = notExpr.expr.accept(this);
    if (expr instanceof IrB.BoolLiteral) {
      return irB.boolLiteral(!((IrB.BoolLiteral) expr).value);
    }
    return notExpr.copy(expr);
  }

  @Override protected IrB.Expr visit(IrB.AndExpr andExpr) {
    final IrB.Expr lhs = andExpr.lhs.accept(this);
    final IrB.Expr rhs = andExpr.rhs.accept(this);
    if (lhs instanceof IrB.BoolLiteral) {
      return ((IrB.BoolLiteral) lhs).value ? rhs : lhs;
    }
    return andExpr.copy(lhs, rhs);
  }

  @Override protected IrB.Expr visit(IrB.OrExpr orExpr) {
    final IrB.Expr lhs = orExpr.lhs.accept(this);
    final IrB.Expr rhs = orExpr.rhs.accept(this);
    if (lhs instanceof IrB.BoolLiteral) {
      return ((IrB.BoolLiteral) lhs).value ? lhs : rhs;
    }
    return orExpr.copy(lhs, rhs);
  }

  @Override protected IrB.Expr visit(IrB.IntUnaryMinusExpr unaryMinusExpr) {
    final IrB.Expr expr = unaryMinusExpr.expr.accept(this);
    if (expr instanceof IrB.IntLiteral
        && ((IrB.IntLiteral) expr).value != Long.MIN_VALUE) {
      return irB.intLiteral(-((IrB.IntLiteral) expr).value);
    }
    return unaryMinusExpr.copy(expr);
  }

  @Override protected IrB.Expr visit(IrB.EqualityComparison equality) {
    final IrB.Expr lhs = equality.lhs.accept(this);
    final IrB.Expr rhs = equality.rhs.accept(this);
    if (isLiteral(lhs) && isLiteral(rhs)) {
      return irB.boolLiteral(lhs.equals(rhs));
    }
    return equality.copy(lhs, rhs);
  }

  @Override protected IrB.Expr visit(IrB.IntComparisonExpr comparison) {
    final IrB.Expr lhs = comparison.lhs.accept(this);
    final IrB.Expr rhs = comparison.rhs.accept(this);
    if (lhs instanceof IrB.IntLiteral && rhs instanceof IrB.IntLiteral) {
      final int c = Long.compare(((IrB.IntLiteral) lhs).value,
          ((IrB.IntLiteral) rhs).value);
      switch (comparison.operator) {
      case LT:
        return irB.boolLiteral(c < 0);
      case GT:
        return irB.boolLiteral(c > 0);
      case LE:
        return irB.boolLiteral(c <= 0);
      case GE:
        return irB.boolLiteral(c >= 0);
      default:
        throw new AssertionError("unexpected " + comparison.operator);
      }
    }
    return comparison.copy(lhs, rhs);
  }

  @Override protected IrB.Expr visit(IrB.IntBinaryOpExpr binaryOp) {
    final IrB.Expr lhs = binaryOp.lhs.accept(this);
    final IrB.Expr rhs = binaryOp.rhs.accept(this);
    if (lhs instanceof IrB.IntLiteral && rhs instanceof IrB.IntLiteral) {
      final Long value = evaluate(binaryOp, ((IrB.IntLiteral) lhs).value,
          ((IrB.IntLiteral) rhs).value);
      if (value != null) {
        return irB.intLiteral(value);
      }
    }
    return binaryOp.copy(lhs, rhs);
  }

  private static boolean isLiteral(IrB.Expr expr) {
    return expr instanceof IrB.IntLiteral
        || expr instanceof IrB.BoolLiteral;
  }

  /** Evaluates an arithmetic operator; returns null if the result is not
   * defined or does not fit in a {@code long}. Division and modulus round
   * towards negative infinity. */
  private static @Nullable Long evaluate(IrB.IntBinaryOpExpr binaryOp,
      long x, long y) {
    try {
      switch (binaryOp.operator) {
      case PLUS:
        return Math.addExact(x, y);
      case MINUS:
        return Math.subtractExact(x, y);
      case TIMES:
        return Math.multiplyExact(x, y);
      case DIVIDE:
        if (y == 0 || x == Long.MIN_VALUE && y == -1) {
          return null;
        }
        return Math.floorDiv(x, y);
      case MOD:
        return y == 0 ? null : Math.floorMod(x, y);
      default:
        throw new AssertionError("unexpected " + binaryOp.operator);
      }
    } catch (ArithmeticException e) {
      // overflow
      return null;
    }
  }
}

// End ConstantFolder.java
