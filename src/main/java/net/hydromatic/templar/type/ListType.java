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

import static java.util.Objects.requireNonNull;

/** The type of a list value, e.g. {@code List[int]}. */
public class ListType extends BaseType {
  public final ExprType elementType;

  private ListType(ExprType elementType) {
    this.elementType = checkElementType(requireNonNull(elementType));
  }

  /** Creates a list type. */
  public static ListType of(ExprType elementType) {
    return new ListType(elementType);
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    return elementType.describe(buf.append("List[")).append(']');
  }

  @Override public int hashCode() {
    return elementType.hashCode() * 31 + 1;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ListType
        && elementType.equals(((ListType) o).elementType);
  }
}

// End ListType.java
