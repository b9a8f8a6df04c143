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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Op;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates the declarations of a program, threading the environment
 * through the bindings of each scope.
 *
 * <p>The right-hand side of every binding is analyzed and translated as a
 * standalone expression, and its hoists are materialized there; no hoist
 * crosses a binding. A right-hand side that may be absent is unwrapped,
 * raising {@code NoValueProvided} if it is {@code None}.
 *
 * <p>Each declaration has its own {@link NameGenerator}, whose namespace is
 * the declaration's name.
 */
public class ScopeTranslator {
  private final TypeSystem typeSystem;
  private final String optionEnum;
  private final Tracer tracer;

  public ScopeTranslator(TypeSystem typeSystem, String optionEnum,
      Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.optionEnum = requireNonNull(optionEnum);
    this.tracer = requireNonNull(tracer);
  }

  /** Translates a program. */
  public Lcalc.Program translateProgram(Dcalc.Program program) {
    final List<String> inputStructs = new ArrayList<>();
    for (Dcalc.CodeItem item : program.items) {
      if (item instanceof Dcalc.ScopeDef) {
        inputStructs.add(((Dcalc.ScopeDef) item).body.inputStruct);
      }
    }
    final TypeSystem typeSystem2 =
        typeSystem.translateDeclarations(inputStructs, optionEnum);

    Environment env = Environments.empty();
    final List<Lcalc.CodeItem> items = new ArrayList<>();
    for (Dcalc.CodeItem item : program.items) {
      final Translator translator = translator(item.pat.name);
      final Lcalc.CodeItem item2;
      switch (item.op) {
        case TOP_DEF:
          final Dcalc.TopDef topDef = (Dcalc.TopDef) item;
          final Dcalc.Exp exp = analyze(env, topDef.exp);
          final @Nullable Boolean unpureReturn =
              Analyzer.mark(exp).unpureReturn;
          final Lcalc.IdPat pat =
              topPat(item.pat, translator.bindingType(item.pat.type,
                  unpureReturn));
          item2 =
              lcalc.topDef(item.pos, pat, translator.translateOrRaise(env, exp));
          env = env.bind(translator.bind(item.pat, pat, unpureReturn));
          break;

        case SCOPE_DEF:
          final Dcalc.ScopeDef scopeDef = (Dcalc.ScopeDef) item;
          final FnType fnType =
              typeSystem.fnType(
                  typeSystem.lookupStruct(scopeDef.body.inputStruct),
                  typeSystem.lookupStruct(scopeDef.body.outputStruct));
          final Lcalc.IdPat scopePat = topPat(item.pat, fnType);
          item2 =
              lcalc.scopeDef(item.pos, scopePat,
                  translateScopeBody(env, translator, scopeDef.body));
          env = env.bind(Binding.of(item.pat, scopePat, true, false));
          break;

        default:
          throw CompileException.internal(item.pos,
              "unexpected declaration %s", item.op);
      }
      tracer.onTranslation(item2);
      items.add(item2);
    }
    return lcalc.program(typeSystem2, items);
  }

  private Translator translator(String namespace) {
    return new Translator(typeSystem, optionEnum, new NameGenerator(namespace),
        tracer);
  }

  /** Creates the variable of a top-level declaration. It keeps its name, and
   * has no namespace. */
  private static Lcalc.IdPat topPat(Dcalc.IdPat pat, Type type) {
    return lcalc.idPat(pat.name, pat.i, "", type);
  }

  private Dcalc.Exp analyze(Environment env, Dcalc.Exp e) {
    final Dcalc.Exp e2 = Analyzer.analyze(env, e);
    tracer.onAnalysis(e2);
    return e2;
  }

  private Lcalc.ScopeBody translateScopeBody(Environment env,
      Translator translator, Dcalc.ScopeBody body) {
    final Lcalc.IdPat inputPat =
        translator.nameGenerator.fresh(body.inputPat.name,
            translator.translateType(body.inputPat.type));
    final Environment env2 =
        env.bind(Binding.of(body.inputPat, inputPat, true, null));
    return lcalc.scopeBody(body.pos, body.inputStruct, body.outputStruct,
        inputPat, translateLets(env2, translator, body.lets));
  }

  private Lcalc.ScopeLets translateLets(Environment env,
      Translator translator, Dcalc.ScopeLets lets) {
    if (lets instanceof Dcalc.Result) {
      final Dcalc.Exp exp = analyze(env, ((Dcalc.Result) lets).exp);
      return lcalc.result(translator.translateOrRaise(env, exp));
    }
    final Dcalc.ScopeLet let = (Dcalc.ScopeLet) lets;
    checkShape(let);
    final Dcalc.Exp exp = analyze(env, let.exp);
    final @Nullable Boolean unpureReturn = Analyzer.mark(exp).unpureReturn;
    final Lcalc.IdPat pat =
        translator.nameGenerator.fresh(let.pat.name,
            translator.bindingType(let.pat.type, unpureReturn));
    final Lcalc.Exp exp2 = translator.translateOrRaise(env, exp);
    final Environment env2 =
        env.bind(translator.bind(let.pat, pat, unpureReturn));
    return lcalc.scopeLet(let.pos, let.kind, pat, exp2,
        translateLets(env2, translator, let.next));
  }

  /** Checks that the right-hand side of a binding has the shape that its
   * kind requires. A subscope variable is either a context variable, whose
   * definition is a thunk, or an input variable, whose definition is
   * error-on-empty. */
  private static void checkShape(Dcalc.ScopeLet let) {
    switch (let.kind) {
      case SUBSCOPE_VAR_DEFINITION:
        if (let.exp.op == Op.ABS && let.exp.type().isThunk()
            || let.exp.op == Op.ERROR_ON_EMPTY) {
          return;
        }
        throw CompileException.internal(let.pos,
            "found a subscope variable definition that does not satisfy the "
                + "invariants: %s", let.exp);
      default:
        return;
    }
  }
}

// End ScopeTranslator.java
