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

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.dcalc.ast.Dcalc;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for analysis and translation.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change. So a hoisted expression can keep the
 * environment in which it was found, and be translated in that environment
 * later.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same
   * variable are visited, but after the more obscuring bindings.
   */
  abstract void visit(Consumer<Binding> consumer);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically, burning lots of CPU and memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    getValueMap().forEach((k, v) -> b.append(v).append("\n"));
    return b.toString();
  }

  /** Returns the binding of {@code id} if bound, null if not. */
  public abstract @Nullable Binding getOpt(Dcalc.IdPat id);

  /**
   * Creates an environment that is the same as this environment, plus one
   * more binding.
   */
  public Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /** Returns a map of the visible bindings. */
  public final Map<Dcalc.IdPat, Binding> getValueMap() {
    final Map<Dcalc.IdPat, Binding> valueMap = new HashMap<>();
    visit(binding -> valueMap.putIfAbsent(binding.id, binding));
    return valueMap;
  }

  /**
   * Creates an environment that is the same as this, plus the given bindings.
   */
  public final Environment bindAll(Iterable<Binding> bindings) {
    return Environments.bind(this, bindings);
  }
}

// End Environment.java
