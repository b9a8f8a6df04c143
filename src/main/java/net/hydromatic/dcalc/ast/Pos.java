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
package net.hydromatic.dcalc.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Position of a node in the source program.
 *
 * <p>Besides a file and a range of lines and columns, a position carries the
 * headings of the law articles that the code at that position implements.
 * They are reported when generated code raises an error.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0, ImmutableList.of());

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;
  public final ImmutableList<String> lawHeadings;

  /** Creates a Pos. */
  public Pos(
      String file,
      int startLine,
      int startColumn,
      int endLine,
      int endColumn,
      List<String> lawHeadings) {
    this.file = Objects.requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.lawHeadings = ImmutableList.copyOf(lawHeadings);
  }

  /** Creates a Pos with no law headings. */
  public static Pos of(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    return new Pos(
        file, startLine, startColumn, endLine, endColumn, ImmutableList.of());
  }

  /** Returns a copy of this position with the given law headings. */
  public Pos withLawHeadings(List<String> lawHeadings) {
    return new Pos(
        file, startLine, startColumn, endLine, endColumn, lawHeadings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.file.equals(((Pos) o).file)
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn
            && this.lawHeadings.equals(((Pos) o).lawHeadings);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    if (!lawHeadings.isEmpty()) {
      buf.append(" [").append(String.join(" > ", lawHeadings)).append(']');
    }
    return buf;
  }

  /**
   * Returns a position that spans from the beginning of the earlier of this
   * and another position to the end of the later.
   */
  public Pos plus(Pos pos) {
    if (pos.equals(ZERO)) {
      return this;
    }
    if (this.equals(ZERO)) {
      return pos;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(
        file, startLine, startColumn, endLine, endColumn, lawHeadings);
  }
}

// End Pos.java
