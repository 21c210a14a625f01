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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** The type of a function, e.g. {@code Callable[[int, bool], Type]}.
 *
 * <p>Argument names, if present, are for documentation; they do not take
 * part in equality. */
public class FunctionType extends BaseType {
  public final ImmutableList<ExprType> argTypes;
  public final ExprType returnType;
  public final @Nullable ImmutableList<String> argNames;

  private FunctionType(ImmutableList<ExprType> argTypes, ExprType returnType,
      @Nullable ImmutableList<String> argNames) {
    this.argTypes = requireNonNull(argTypes);
    this.returnType = requireNonNull(returnType);
    this.argNames = argNames;
    checkArgument(argNames == null || argNames.size() == argTypes.size(),
        "argument names %s do not match argument types %s", argNames,
        argTypes);
  }

  /** Creates a function type. */
  public static FunctionType of(List<? extends ExprType> argTypes,
      ExprType returnType) {
    return new FunctionType(ImmutableList.copyOf(argTypes), returnType, null);
  }

  /** Creates a function type with named arguments. */
  public static FunctionType of(List<? extends ExprType> argTypes,
      ExprType returnType, List<String> argNames) {
    return new FunctionType(ImmutableList.copyOf(argTypes), returnType,
        ImmutableList.copyOf(argNames));
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    buf.append("Callable[[");
    for (int i = 0; i < argTypes.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      argTypes.get(i).describe(buf);
    }
    return returnType.describe(buf.append("], ")).append(']');
  }

  @Override public int hashCode() {
    return Objects.hash(argTypes, returnType);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionType
        && argTypes.equals(((FunctionType) o).argTypes)
        && returnType.equals(((FunctionType) o).returnType);
  }
}

// End FunctionType.java
