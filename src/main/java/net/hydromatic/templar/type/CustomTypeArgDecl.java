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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Field of a {@link CustomType}. */
public class CustomTypeArgDecl {
  public final String name;
  public final ExprType type;

  public CustomTypeArgDecl(String name, ExprType type) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    checkArgument(!name.isEmpty(), "empty field name");
  }

  @Override public String toString() {
    return type.describe(new StringBuilder(name).append(": ")).toString();
  }

  @Override public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof CustomTypeArgDecl
        && name.equals(((CustomTypeArgDecl) o).name)
        && type.equals(((CustomTypeArgDecl) o).type);
  }
}

// End CustomTypeArgDecl.java
