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

import net.hydromatic.templar.ast.Op;
import net.hydromatic.templar.irb.IrB;
import net.hydromatic.templar.type.PrimitiveType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static net.hydromatic.templar.irb.IrBBuilder.irB;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests for {@link ConstantFolder}. */
public class ConstantFolderTest {
  private final IrB.VarReference x = irB.var(PrimitiveType.INT, "x");
  private final IrB.VarReference b = irB.var(PrimitiveType.BOOL, "b");

  private static IrB.Expr fold(IrB.Expr e) {
    return e.accept(new ConstantFolder());
  }

  private static IrB.IntLiteral i(long value) {
    return irB.intLiteral(value);
  }

  private static IrB.Expr op(IrB.Expr lhs, Op op, IrB.Expr rhs) {
    return irB.intBinaryOp(lhs, op, rhs);
  }

  @Test void testArithmetic() {
    assertThat(fold(op(op(i(2), Op.PLUS, i(3)), Op.TIMES, i(4))),
        is(i(20)));
    assertThat(fold(op(x, Op.PLUS, op(i(2), Op.TIMES, i(3)))).toString(),
        is("x + 6"));
    assertThat(fold(op(i(7), Op.MINUS, i(9))), is(i(-2)));

    // division rounds towards negative infinity
    assertThat(fold(op(i(7), Op.DIVIDE, i(-2))), is(i(-4)));
    assertThat(fold(op(i(7), Op.MOD, i(-2))), is(i(-1)));
    assertThat(fold(op(i(-7), Op.MOD, i(2))), is(i(1)));
  }

  @Test void testNotFolded() {
    final IrB.Expr divideByZero = op(i(5), Op.DIVIDE, i(0));
    assertThat(fold(divideByZero), sameInstance(divideByZero));
    final IrB.Expr modZero = op(i(5), Op.MOD, i(0));
    assertThat(fold(modZero), sameInstance(modZero));

    final IrB.Expr overflow = op(i(Long.MAX_VALUE), Op.PLUS, i(1));
    assertThat(fold(overflow), sameInstance(overflow));
    final IrB.Expr overflow2 = op(i(Long.MIN_VALUE), Op.DIVIDE, i(-1));
    assertThat(fold(overflow2), sameInstance(overflow2));
    final IrB.Expr overflow3 = irB.unaryMinus(i(Long.MIN_VALUE));
    assertThat(fold(overflow3), sameInstance(overflow3));

    final IrB.Expr comparison = irB.intComparison(x, Op.LT, i(3));
    assertThat(fold(comparison), sameInstance(comparison));
  }

  @Test void testUnary() {
    assertThat(fold(irB.unaryMinus(i(3))), is(i(-3)));
    assertThat(fold(irB.unaryMinus(irB.unaryMinus(i(3)))), is(i(3)));
    assertThat(fold(irB.not(irB.boolLiteral(true))),
        is(irB.boolLiteral(false)));
    assertThat(fold(irB.not(b)).toString(), is("not b"));
  }

  @Test void testComparison() {
    assertThat(fold(irB.intComparison(i(2), Op.LT, i(3))),
        is(irB.boolLiteral(true)));
    assertThat(fold(irB.intComparison(i(2), Op.GE, i(3))),
        is(irB.boolLiteral(false)));
    assertThat(fold(irB.equal(i(1), op(i(0), Op.PLUS, i(1)))),
        is(irB.boolLiteral(true)));
    assertThat(fold(irB.equal(irB.boolLiteral(true), irB.boolLiteral(false))),
        is(irB.boolLiteral(false)));
  }

  @Test void testAndOr() {
    final IrB.BoolLiteral t = irB.boolLiteral(true);
    final IrB.BoolLiteral f = irB.boolLiteral(false);
    assertThat(fold(irB.and(t, b)), sameInstance(b));
    assertThat(fold(irB.and(f, b)), is(f));
    assertThat(fold(irB.or(t, b)), is(t));
    assertThat(fold(irB.or(f, b)), sameInstance(b));

    // the right operand alone does not decide the result
    final IrB.Expr and = irB.and(b, t);
    assertThat(fold(and), sameInstance(and));
    assertThat(fold(irB.and(b, irB.not(f))).toString(), is("b and True"));
  }

  @Test void testModule() {
    final IrB.FunctionDefn defn =
        irB.functionDefn("f",
            ImmutableList.of(irB.argDecl(PrimitiveType.INT, "x")),
            ImmutableList.of(
                irB.ifStmt(irB.intComparison(i(1), Op.LT, i(2)),
                    ImmutableList.of(irB.returnStmt(op(x, Op.TIMES,
                        op(i(2), Op.PLUS, i(2))))),
                    ImmutableList.of(irB.returnStmt(x)))),
            PrimitiveType.INT);
    final IrB.Module module =
        irB.module(ImmutableList.of(defn), ImmutableList.of(),
            ImmutableList.of(), ImmutableSet.of("f"), ImmutableList.of());
    final IrB.Module module2 = ConstantFolder.fold(module);
    assertThat(module2.toString(),
        is("def f(x: int) -> int:\n"
            + "  if True:\n"
            + "    return x * 4\n"
            + "  else:\n"
            + "    return x\n"
            + "\n"));
    assertThat(ConstantFolder.fold(module2), sameInstance(module2));
  }
}

// End ConstantFolderTest.java
