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
package net.hydromatic.templar.ast;

import static java.util.Objects.requireNonNull;

/** Node in an intermediate representation. */
public abstract class IrNode {
  public final Op op;

  protected IrNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>Expressions render on a single line; statements and definitions
   * render as one or more lines, each terminated by a newline.
   */
  @Override public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new IrWriter()).toString();
  }

  /** Converts this node into a string, with a given writer. */
  public final String unparse(boolean verbose) {
    return unparse(new IrWriter(verbose)).toString();
  }

  /** Writes this node to a writer, and returns the writer. */
  protected abstract IrWriter unparse(IrWriter w);
}

// End IrNode.java
