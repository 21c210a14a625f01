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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** Transition between two lines of a source file, recorded for coverage.
 *
 * <p>Opaque to the IR: nodes carry it, and transformations pass it through
 * unchanged. A {@code destLine} of -1 means that control leaves the
 * function. */
public class SourceBranch {
  public final String fileName;
  public final int sourceLine;
  public final int destLine;

  /** Creates a SourceBranch. */
  public SourceBranch(String fileName, int sourceLine, int destLine) {
    this.fileName = requireNonNull(fileName);
    this.sourceLine = sourceLine;
    this.destLine = destLine;
  }

  @Override public String toString() {
    return fileName + ":" + sourceLine + "->" + destLine;
  }

  @Override public int hashCode() {
    return Objects.hash(fileName, sourceLine, destLine);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof SourceBranch
        && fileName.equals(((SourceBranch) o).fileName)
        && sourceLine == ((SourceBranch) o).sourceLine
        && destLine == ((SourceBranch) o).destLine;
  }
}

// End SourceBranch.java
