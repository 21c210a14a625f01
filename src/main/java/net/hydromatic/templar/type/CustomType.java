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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Named record type.
 *
 * <p>An exception class has a message, and any other type does not.
 * Constructor source branches are used for coverage only; they do not take
 * part in equality. */
public class CustomType extends BaseType {
  public final String name;
  public final ImmutableList<CustomTypeArgDecl> argTypes;
  public final boolean isExceptionClass;
  public final @Nullable String exceptionMessage;
  public final ImmutableList<SourceBranch> constructorSourceBranches;

  /** Creates a CustomType. */
  public CustomType(String name, List<CustomTypeArgDecl> argTypes,
      boolean isExceptionClass, @Nullable String exceptionMessage,
      List<SourceBranch> constructorSourceBranches) {
    this.name = requireNonNull(name);
    this.argTypes = ImmutableList.copyOf(argTypes);
    this.isExceptionClass = isExceptionClass;
    this.exceptionMessage = exceptionMessage;
    this.constructorSourceBranches =
        ImmutableList.copyOf(constructorSourceBranches);
    checkArgument(!name.isEmpty(), "empty type name");
    checkArgument(isExceptionClass == (exceptionMessage != null),
        "exception message must be present if and only if %s is an "
            + "exception class", name);
  }

  /** Creates a custom type that is not an exception class. */
  public static CustomType of(String name, CustomTypeArgDecl... argTypes) {
    return new CustomType(name, ImmutableList.copyOf(argTypes), false, null,
        ImmutableList.of());
  }

  /** Creates an exception class. */
  public static CustomType exception(String name, String message,
      CustomTypeArgDecl... argTypes) {
    return new CustomType(name, ImmutableList.copyOf(argTypes), true,
        requireNonNull(message), ImmutableList.of());
  }

  /** Returns the type of the field with a given name, or null. */
  public @Nullable ExprType fieldType(String fieldName) {
    for (CustomTypeArgDecl arg : argTypes) {
      if (arg.name.equals(fieldName)) {
        return arg.type;
      }
    }
    return null;
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    return buf.append(name);
  }

  /** Writes the definition of this type, as a class with a constructor. */
  public IrWriter unparseDefn(IrWriter w) {
    w.append("class ").append(name).append(":").newline().indent();
    w.append("def __init__(");
    for (int i = 0; i < argTypes.size(); i++) {
      w.append(i == 0 ? "" : ", ").append(argTypes.get(i).toString());
    }
    w.append("):").newline().indent();
    for (CustomTypeArgDecl arg : argTypes) {
      w.append("self.").append(arg.name).append(" = ").append(arg.name)
          .newline();
    }
    if (argTypes.isEmpty()) {
      w.append("pass").newline();
    }
    return w.outdent().outdent();
  }

  @Override public int hashCode() {
    return Objects.hash(name, argTypes, isExceptionClass, exceptionMessage);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof CustomType
        && name.equals(((CustomType) o).name)
        && argTypes.equals(((CustomType) o).argTypes)
        && isExceptionClass == ((CustomType) o).isExceptionClass
        && Objects.equals(exceptionMessage, ((CustomType) o).exceptionMessage);
  }
}

// End CustomType.java
