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

import static com.google.common.base.Verify.verifyNotNull;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.compile.BuiltIn;
import net.hydromatic.dcalc.compile.Prop;

/**
 * Evaluates programs.
 *
 * <p>There is an interpreter for each of the calculi. They define the meaning
 * of programs, so that a program and its translation can be checked to
 * compute the same values.
 */
public abstract class Interpreter {
  final String optionEnum;

  Interpreter(String optionEnum) {
    this.optionEnum = optionEnum;
  }

  /** Returns an interpreter for the default calculus, whose options use the
   * default option enumeration. */
  public static DcalcInterpreter dcalc() {
    return dcalc(Prop.OPTION_ENUM.stringValue(ImmutableMap.of()));
  }

  /** Returns an interpreter for the default calculus. */
  public static DcalcInterpreter dcalc(String optionEnum) {
    return new DcalcInterpreter(optionEnum);
  }

  /** Returns an interpreter for the lambda calculus with options. */
  public static LcalcInterpreter lcalc(String optionEnum) {
    return new LcalcInterpreter(optionEnum);
  }

  /** Returns the value of a variable. */
  static Object lookup(EvalEnv env, Object key) {
    return verifyNotNull(env.getOpt(key), "variable %s is not bound", key);
  }

  /** Applies a function value to arguments. */
  static Object apply(Object fn, List<Object> args) {
    return ((Applicable) fn).apply(args);
  }

  /** Returns the value of a built-in operator. */
  static Applicable operator(BuiltIn builtIn, Pos pos) {
    return args -> Codes.apply(builtIn, args, pos);
  }

  /** Returns the value of an assertion whose condition has been
   * evaluated. */
  static Unit assertion(Object condition, Pos pos) {
    if (!(Boolean) condition) {
      throw new Codes.DcalcRuntimeException(
          Codes.RuntimeExn.ASSERTION_FAILED, pos);
    }
    return Unit.INSTANCE;
  }
}

// End Interpreter.java
