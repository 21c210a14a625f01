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

import com.google.common.collect.ImmutableSet;

import static com.google.common.base.Preconditions.checkArgument;

/** The type of a variadic parameter pack, e.g. {@code Sequence[Type]}. */
public class ParameterPackType extends BaseType {
  private static final ImmutableSet<PrimitiveType> ELEMENT_TYPES =
      ImmutableSet.of(PrimitiveType.BOOL, PrimitiveType.INT,
          PrimitiveType.TYPE, PrimitiveType.ERROR_OR_VOID);

  public final ExprType elementType;

  private ParameterPackType(ExprType elementType) {
    checkArgument(ELEMENT_TYPES.contains(elementType),
        "invalid parameter pack element type %s", elementType);
    this.elementType = elementType;
  }

  /** Creates a parameter pack type. */
  public static ParameterPackType of(ExprType elementType) {
    return new ParameterPackType(elementType);
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    return elementType.describe(buf.append("Sequence[")).append(']');
  }

  @Override public int hashCode() {
    return elementType.hashCode() * 31 + 3;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ParameterPackType
        && elementType.equals(((ParameterPackType) o).elementType);
  }
}

// End ParameterPackType.java
