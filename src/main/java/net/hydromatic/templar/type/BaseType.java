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

import static com.google.common.base.Preconditions.checkArgument;

/** Abstract implementation of {@link ExprType} for types that have
 * components. */
abstract class BaseType implements ExprType {
  @Override public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Throws if {@code elementType} may not be the element of a
   * collection. */
  static ExprType checkElementType(ExprType elementType) {
    checkArgument(!elementType.isFunction(),
        "functions cannot be elements of a collection: %s", elementType);
    return elementType;
  }
}

// End BaseType.java
