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

/** Type of an expression in either intermediate representation.
 *
 * <p>The set of implementations is closed: {@link PrimitiveType},
 * {@link FunctionType}, {@link ListType}, {@link SetType},
 * {@link ParameterPackType} and {@link CustomType}.
 *
 * <p>Equality is structural. */
public interface ExprType {
  /** Appends a description of this type to a builder, for example
   * {@code List[int]}, and returns the builder. */
  StringBuilder describe(StringBuilder buf);

  /** Returns whether this is a function type. */
  default boolean isFunction() {
    return this instanceof FunctionType;
  }

  /** Returns whether this is a list of the given element type. */
  default boolean isListOf(ExprType elementType) {
    return this instanceof ListType
        && ((ListType) this).elementType.equals(elementType);
  }
}

// End ExprType.java
