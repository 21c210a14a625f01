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

import net.hydromatic.templar.type.ExprType;

import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkState;

/** Writes intermediate representation trees as text, indenting nested
 * blocks by two spaces.
 *
 * <p>In verbose mode, statements are followed by a comment that describes
 * the types of their operands. */
public class IrWriter {
  private final StringBuilder b = new StringBuilder();
  private final boolean verbose;
  private int indent;
  private boolean lineStart = true;

  /** Creates a non-verbose writer. */
  public IrWriter() {
    this(false);
  }

  /** Creates a writer. */
  public IrWriter(boolean verbose) {
    this.verbose = verbose;
  }

  public boolean isVerbose() {
    return verbose;
  }

  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public IrWriter append(String s) {
    if (!s.isEmpty()) {
      if (lineStart) {
        b.append(Strings.repeat("  ", indent));
        lineStart = false;
      }
      b.append(s);
    }
    return this;
  }

  /** Appends a node. */
  public IrWriter append(IrNode node) {
    return node.unparse(this);
  }

  /** Appends a type. */
  public IrWriter append(ExprType type) {
    return append(type.describe(new StringBuilder()).toString());
  }

  /** Appends a list of nodes, separated by a given string. */
  public IrWriter appendAll(Iterable<? extends IrNode> nodes, String sep) {
    String s = "";
    for (IrNode node : nodes) {
      append(s).append(node);
      s = sep;
    }
    return this;
  }

  /** Appends a list of types, separated by ", ". */
  public IrWriter appendTypes(Iterable<? extends ExprType> types) {
    String s = "";
    for (ExprType type : types) {
      append(s).append(type);
      s = ", ";
    }
    return this;
  }

  /** In verbose mode, appends a comment; otherwise does nothing. */
  public IrWriter comment(String s) {
    if (verbose) {
      append("  # ").append(s);
    }
    return this;
  }

  /** Ends the current line. */
  public IrWriter newline() {
    b.append('\n');
    lineStart = true;
    return this;
  }

  /** Increases the indentation of subsequent lines. */
  public IrWriter indent() {
    ++indent;
    return this;
  }

  /** Decreases the indentation of subsequent lines. */
  public IrWriter outdent() {
    checkState(indent > 0, "indent underflow");
    --indent;
    return this;
  }
}

// End IrWriter.java
