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
package net.hydromatic.templar.type;

import net.hydromatic.templar.ast.IrWriter;
import net.hydromatic.templar.ast.SourceBranch;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for types. */
public class TypeTest {
  @Test void testDescribe() {
    assertThat(PrimitiveType.BOOL.toString(), is("bool"));
    assertThat(PrimitiveType.BOTTOM.toString(), is("BottomType"));
    assertThat(PrimitiveType.INT.toString(), is("int"));
    assertThat(PrimitiveType.TYPE.toString(), is("Type"));
    assertThat(PrimitiveType.ERROR_OR_VOID.toString(), is("ErrorOrVoid"));
    assertThat(ListType.of(PrimitiveType.INT).toString(), is("List[int]"));
    assertThat(SetType.of(ListType.of(PrimitiveType.BOOL)).toString(),
        is("Set[List[bool]]"));
    assertThat(ParameterPackType.of(PrimitiveType.TYPE).toString(),
        is("Sequence[Type]"));
    final FunctionType f =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT, PrimitiveType.TYPE),
            PrimitiveType.BOOL);
    assertThat(f.toString(), is("Callable[[int, Type], bool]"));
    assertThat(CustomType.of("Point").toString(), is("Point"));
  }

  @Test void testFunctionTypeEqualityIgnoresArgNames() {
    final FunctionType f1 =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT), PrimitiveType.INT,
            ImmutableList.of("x"));
    final FunctionType f2 =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT), PrimitiveType.INT,
            ImmutableList.of("y"));
    final FunctionType f3 =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT), PrimitiveType.INT);
    assertThat(f1.equals(f2), is(true));
    assertThat(f1.equals(f3), is(true));
    assertThat(f1.hashCode() == f3.hashCode(), is(true));
    assertThat(f1.isFunction(), is(true));
    assertThat(PrimitiveType.INT.isFunction(), is(false));

    final FunctionType f4 =
        FunctionType.of(ImmutableList.of(PrimitiveType.BOOL),
            PrimitiveType.INT);
    assertThat(f1.equals(f4), is(false));
  }

  @Test void testIsListOf() {
    final ListType intList = ListType.of(PrimitiveType.INT);
    assertThat(intList.isListOf(PrimitiveType.INT), is(true));
    assertThat(intList.isListOf(PrimitiveType.BOOL), is(false));
    assertThat(SetType.of(PrimitiveType.INT).isListOf(PrimitiveType.INT),
        is(false));
    assertThat(intList.equals(ListType.of(PrimitiveType.INT)), is(true));
    assertThat(intList.equals(SetType.of(PrimitiveType.INT)), is(false));
  }

  @Test void testInvalidElementTypes() {
    final FunctionType f =
        FunctionType.of(ImmutableList.of(PrimitiveType.INT), PrimitiveType.INT);
    assertThrows(IllegalArgumentException.class, () -> ListType.of(f));
    assertThrows(IllegalArgumentException.class, () -> SetType.of(f));
    assertThrows(IllegalArgumentException.class,
        () -> ParameterPackType.of(ListType.of(PrimitiveType.INT)));
    assertThrows(IllegalArgumentException.class,
        () -> ParameterPackType.of(PrimitiveType.BOTTOM));
  }

  @Test void testCustomType() {
    final CustomType point =
        CustomType.of("Point", new CustomTypeArgDecl("x", PrimitiveType.INT),
            new CustomTypeArgDecl("y", PrimitiveType.INT));
    assertThat(point.fieldType("x"), is(PrimitiveType.INT));
    assertThat(point.fieldType("z"), nullValue());
    assertThat(point.isExceptionClass, is(false));

    // Source branches do not take part in equality.
    final CustomType point2 =
        new CustomType("Point", point.argTypes, false, null,
            ImmutableList.of(new SourceBranch("a.py", 1, 2)));
    assertThat(point.equals(point2), is(true));
    assertThat(point.hashCode() == point2.hashCode(), is(true));

    final CustomType error = CustomType.exception("MyError", "oops");
    assertThat(error.isExceptionClass, is(true));
    assertThat(error.exceptionMessage, is("oops"));
    assertThat(error.equals(CustomType.of("MyError")), is(false));

    // An exception class needs a message, and other types must not have one.
    assertThrows(IllegalArgumentException.class,
        () -> new CustomType("E", ImmutableList.of(), true, null,
            ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> new CustomType("E", ImmutableList.of(), false, "message",
            ImmutableList.of()));
  }

  @Test void testCustomTypeDefinition() {
    final CustomType point =
        CustomType.of("Point", new CustomTypeArgDecl("x", PrimitiveType.INT),
            new CustomTypeArgDecl("y", PrimitiveType.BOOL));
    final String expected = "class Point:\n"
        + "  def __init__(x: int, y: bool):\n"
        + "    self.x = x\n"
        + "    self.y = y\n";
    assertThat(point.unparseDefn(new IrWriter()).toString(), is(expected));

    final String expected2 = "class Empty:\n"
        + "  def __init__():\n"
        + "    pass\n";
    assertThat(CustomType.of("Empty").unparseDefn(new IrWriter()).toString(),
        is(expected2));
  }
}

// End TypeTest.java
