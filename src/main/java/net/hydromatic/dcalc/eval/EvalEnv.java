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
package net.hydromatic.dcalc.eval;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.dcalc.compile.Environment;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Whereas {@link Environment} contains purity information, because it is
 * used for translation, EvalEnv contains only values. Variables are keyed by
 * their binding occurrence, a {@link net.hydromatic.dcalc.ast.Dcalc.IdPat}
 * or a {@link net.hydromatic.dcalc.ast.Lcalc.IdPat}.
 */
public interface EvalEnv {
  /** Returns the value of {@code key} if bound, null if not. */
  @Nullable Object getOpt(Object key);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (key, value).
   */
  default EvalEnv bind(Object key, Object value) {
    return new EvalEnvs.SubEvalEnv(this, key, value);
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same key are
   * visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<Object, Object> consumer);

  /** Returns a map of the values and bindings. */
  default Map<Object, Object> valueMap() {
    final Map<Object, Object> valueMap = new HashMap<>();
    visit(valueMap::putIfAbsent);
    return valueMap;
  }
}

// End EvalEnv.java
