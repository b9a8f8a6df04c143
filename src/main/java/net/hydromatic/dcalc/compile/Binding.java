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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.dcalc.ast.LcalcBuilder.lcalc;

import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binding of a source variable in an {@link Environment}.
 *
 * <p>{@link #pure} is whether the variable's value is always present.
 * {@link #unpureReturn} is, for a variable of function type, whether the
 * result of calling it may be absent.
 *
 * <p>During translation, a binding also holds the expression that replaces
 * references to the variable in the output, usually a reference to a fresh
 * {@link #target} variable. A variable that is not pure has a target of
 * option type.
 */
public class Binding {
  public final Dcalc.IdPat id;
  public final Lcalc.@Nullable IdPat target;
  public final Lcalc.@Nullable Exp expr;
  public final boolean pure;
  public final @Nullable Boolean unpureReturn;

  private Binding(Dcalc.IdPat id, Lcalc.@Nullable IdPat target,
      Lcalc.@Nullable Exp expr, boolean pure, @Nullable Boolean unpureReturn) {
    this.id = requireNonNull(id);
    this.target = target;
    this.expr = expr;
    this.pure = pure;
    this.unpureReturn = unpureReturn;
  }

  /** Creates a binding for analysis, which has no target. */
  public static Binding of(Dcalc.IdPat id, boolean pure,
      @Nullable Boolean unpureReturn) {
    return new Binding(id, null, null, pure, unpureReturn);
  }

  /** Creates a binding to a target variable. */
  public static Binding of(Dcalc.IdPat id, Lcalc.IdPat target, boolean pure,
      @Nullable Boolean unpureReturn) {
    return new Binding(id, target, lcalc.id(Pos.ZERO, target), pure,
        unpureReturn);
  }

  /** Creates a binding whose references are replaced by an expression. */
  public static Binding of(Dcalc.IdPat id, Lcalc.Exp expr, boolean pure,
      @Nullable Boolean unpureReturn) {
    return new Binding(id, null, expr, pure, unpureReturn);
  }

  @Override
  public String toString() {
    return id + (target == null ? "" : " -> " + target)
        + (pure ? " (present)" : " (may be absent)");
  }
}

// End Binding.java
