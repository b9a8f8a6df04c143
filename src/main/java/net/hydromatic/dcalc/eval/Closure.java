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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Value that is sufficient for a function to bind its arguments
 * and evaluate its body. */
public class Closure implements Applicable {
  /** Environment for evaluation. Contains the variables "captured" from the
   * environment when the closure was created. */
  private final EvalEnv evalEnv;

  /** Keys of the parameters. */
  private final ImmutableList<Object> params;

  private final Code code;

  public Closure(EvalEnv evalEnv, List<?> params, Code code) {
    this.evalEnv = requireNonNull(evalEnv);
    this.params = ImmutableList.copyOf(params);
    this.code = requireNonNull(code);
  }

  @Override
  public String toString() {
    return "Closure(params = " + params + ")";
  }

  /** Binds argument values to create a new environment for the body. */
  EvalEnv bind(List<Object> args) {
    checkArgument(args.size() == params.size(),
        "expected %s arguments, got %s", params.size(), args.size());
    EvalEnv env = evalEnv;
    for (int i = 0; i < params.size(); i++) {
      env = env.bind(params.get(i), args.get(i));
    }
    return env;
  }

  @Override
  public Object apply(List<Object> args) {
    return code.eval(bind(args));
  }
}

// End Closure.java
