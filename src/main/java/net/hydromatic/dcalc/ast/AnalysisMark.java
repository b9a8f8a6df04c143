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

import net.hydromatic.dcalc.compile.CompileException;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mark produced by {@link net.hydromatic.dcalc.compile.Analyzer}.
 *
 * <p>{@link #unpure} is whether the node's value may be absent.
 * {@link #unpureReturn} is whether the result of calling the node's value
 * may be absent; it is set for nodes of function type, and null for all
 * other nodes.
 */
public class AnalysisMark extends Mark {
  public final boolean unpure;
  public final @Nullable Boolean unpureReturn;

  private AnalysisMark(Pos pos, Type type, boolean unpure,
      @Nullable Boolean unpureReturn) {
    super(pos, type);
    this.unpure = unpure;
    this.unpureReturn = unpureReturn;
  }

  /** Creates an AnalysisMark. Throws if {@code unpureReturn} is null and
   * the type is a function type. */
  public static AnalysisMark of(Mark mark, boolean unpure,
      @Nullable Boolean unpureReturn) {
    if (unpureReturn == null && mark.type instanceof FnType) {
      throw CompileException.internal(mark.pos,
          "no pure/unpure return information on a function");
    }
    return new AnalysisMark(mark.pos, mark.type, unpure,
        mark.type instanceof FnType ? unpureReturn : null);
  }

  @Override
  public String toString() {
    return super.toString()
        + (unpure ? " (may be absent)" : " (present)")
        + (unpureReturn == null ? ""
            : unpureReturn ? " returns may be absent" : " returns present");
  }
}

// End AnalysisMark.java
