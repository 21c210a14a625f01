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

/** Type that has no components. */
public enum PrimitiveType implements ExprType {
  BOOL("bool"),
  BOTTOM("BottomType"),
  INT("int"),
  /** The type of type expressions, such as {@code Type('int')}. */
  TYPE("Type"),
  /** The type of a value that is either an error or nothing. Used as the
   * second result of an operation that may fail. */
  ERROR_OR_VOID("ErrorOrVoid");

  /** The name in the textual form of the IR, e.g. {@code bool}. */
  public final String moniker;

  PrimitiveType(String moniker) {
    this.moniker = moniker;
  }

  @Override public String toString() {
    return moniker;
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    return buf.append(moniker);
  }
}

// End PrimitiveType.java
