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

import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.type.TypeSystem;

/** Helpers for translating programs and expressions. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Translates a program of the default calculus into the lambda calculus
   * with options.
   *
   * <p>Reports lint warnings, analyzed and translated declarations, and hoists
   * to {@code tracer}. If translation fails, gives {@code tracer} the
   * exception, then throws it.
   */
  public static Lcalc.Program translateProgram(Dcalc.Program program,
      Map<Prop, Object> props, Tracer tracer) {
    try {
      if (Prop.LINT.booleanValue(props)) {
        final List<CompileException> warnings = Linter.lint(program);
        if (!warnings.isEmpty()) {
          tracer.onWarnings(warnings);
        }
      }
      final ScopeTranslator scopeTranslator =
          new ScopeTranslator(program.typeSystem,
              Prop.OPTION_ENUM.stringValue(props), tracer);
      Lcalc.Program program2 = scopeTranslator.translateProgram(program);
      if (Prop.CHECK_OUTPUT.booleanValue(props)) {
        OutputChecker.check(program2);
      }
      if (Prop.SIMPLIFY.booleanValue(props)) {
        program2 = Simplifier.simplify(program2);
      }
      tracer.handleCompileException(null);
      return program2;
    } catch (CompileException e) {
      tracer.handleCompileException(e);
      throw e;
    }
  }

  /**
   * Translates an expression in an environment whose bindings say which
   * variables may be absent.
   *
   * <p>The result is an option: {@code Some v} if the expression has value
   * {@code v}, {@code None} if it is empty.
   */
  public static Lcalc.Exp translateExpression(TypeSystem typeSystem,
      Environment env, Dcalc.Exp e, String optionEnum, Tracer tracer) {
    final Dcalc.Exp e2 = Analyzer.analyze(env, e);
    tracer.onAnalysis(e2);
    final Translator translator =
        new Translator(typeSystem, optionEnum, new NameGenerator(""), tracer);
    return translator.translateExpr(env, e2, true);
  }
}

// End Compiles.java
