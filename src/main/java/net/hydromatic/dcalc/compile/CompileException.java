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
package net.hydromatic.dcalc.compile;

import static java.lang.String.format;

import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.util.DcalcException;

/**
 * An error occurred during compilation.
 *
 * <p>An error (not a warning) means that an invariant that earlier compiler
 * stages guarantee does not hold. It aborts the compilation unit.
 */
public class CompileException extends RuntimeException
    implements DcalcException {
  private final boolean warning;
  private final Pos pos;

  public CompileException(String message, boolean warning, Pos pos) {
    super(message);
    this.warning = warning;
    this.pos = pos;
  }

  /** Creates an exception for a violated invariant. */
  public static CompileException internal(
      Pos pos, String message, Object... args) {
    return new CompileException(
        "Internal Error: " + format(message, args), false, pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /** Returns whether this is a warning (compilation continues). */
  public boolean isWarning() {
    return warning;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(warning ? " Warning: " : " Error: ")
        .append(getMessage());
  }
}

// End CompileException.java
