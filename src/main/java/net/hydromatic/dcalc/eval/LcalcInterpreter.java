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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.compile.BuiltIn;

/**
 * Interpreter for the lambda calculus with options.
 *
 * <p>Evaluation is strict, except for the branches of a conditional, the
 * cases of a match, and the consequence of {@link
 * BuiltIn#HANDLE_DEFAULT_OPT}.
 */
public class LcalcInterpreter extends Interpreter {
  LcalcInterpreter(String optionEnum) {
    super(optionEnum);
  }

  /** Evaluates the declarations of a program, and returns an environment
   * with a binding for each. A scope is bound to a function from its input
   * struct to its output struct. */
  public EvalEnv evalProgram(EvalEnv env, Lcalc.Program program) {
    EvalEnv env2 = env;
    for (Lcalc.CodeItem item : program.items) {
      if (item instanceof Lcalc.TopDef) {
        env2 = env2.bind(item.pat, eval(env2, ((Lcalc.TopDef) item).exp));
      } else {
        final Lcalc.ScopeBody body = ((Lcalc.ScopeDef) item).body;
        env2 = env2.bind(item.pat,
            new Closure(env2, ImmutableList.of(body.inputPat),
                env3 -> evalLets(env3, body.lets)));
      }
    }
    return env2;
  }

  private Object evalLets(EvalEnv env, Lcalc.ScopeLets lets) {
    EvalEnv env2 = env;
    Lcalc.ScopeLets lets2 = lets;
    while (lets2 instanceof Lcalc.ScopeLet) {
      final Lcalc.ScopeLet let = (Lcalc.ScopeLet) lets2;
      env2 = env2.bind(let.pat, eval(env2, let.exp));
      lets2 = let.next;
    }
    return eval(env2, ((Lcalc.Result) lets2).exp);
  }

  /** Evaluates an expression. */
  public Object eval(EvalEnv env, Lcalc.Exp e) {
    switch (e.op) {
      case ID:
        return lookup(env, ((Lcalc.Id) e).idPat);

      case BOOL_LITERAL:
      case INTEGER_LITERAL:
      case DECIMAL_LITERAL:
      case MONEY_LITERAL:
      case DATE_LITERAL:
      case DURATION_LITERAL:
      case UNIT_LITERAL:
        return ((Lcalc.Literal) e).value;

      case OPERATOR:
        return operator(((Lcalc.OpRef) e).builtIn, e.pos);

      case ABS:
        final Lcalc.Abs abs = (Lcalc.Abs) e;
        return new Closure(env, abs.params, env2 -> eval(env2, abs.body));

      case APPLY:
        final Lcalc.Apply apply = (Lcalc.Apply) e;
        if (apply.isCallTo(BuiltIn.HANDLE_DEFAULT_OPT)) {
          return evalHandleDefaultOpt(env, apply);
        }
        final Object fn = eval(env, apply.fn);
        return apply(fn, evalAll(env, apply.args));

      case LET:
        final Lcalc.Let let = (Lcalc.Let) e;
        return eval(env.bind(let.pat, eval(env, let.arg)), let.body);

      case IF:
        final Lcalc.If anIf = (Lcalc.If) e;
        return (Boolean) eval(env, anIf.condition)
            ? eval(env, anIf.ifTrue)
            : eval(env, anIf.ifFalse);

      case MATCH:
        final Lcalc.Match match = (Lcalc.Match) e;
        final Variant variant = (Variant) eval(env, match.exp);
        final Lcalc.Abs matchCase = match.cases.get(variant.constructor);
        return eval(env.bind(matchCase.params.get(0), variant.value),
            matchCase.body);

      case STRUCT:
        final Lcalc.Struct struct = (Lcalc.Struct) e;
        final Map<String, Object> fields = new LinkedHashMap<>();
        struct.fields.forEach((name, field) ->
            fields.put(name, eval(env, field)));
        return StructValue.of(struct.name, fields);

      case STRUCT_ACCESS:
        final Lcalc.StructAccess structAccess = (Lcalc.StructAccess) e;
        return ((StructValue) eval(env, structAccess.exp))
            .get(structAccess.field);

      case TUPLE:
        return ImmutableList.copyOf(evalAll(env, ((Lcalc.Tuple) e).args));

      case TUPLE_ACCESS:
        final Lcalc.TupleAccess tupleAccess = (Lcalc.TupleAccess) e;
        return ((List) eval(env, tupleAccess.exp)).get(tupleAccess.index);

      case INJ:
        final Lcalc.Inj inj = (Lcalc.Inj) e;
        return Variant.of(inj.name, inj.constructor, eval(env, inj.exp));

      case ARRAY:
        return ImmutableList.copyOf(evalAll(env, ((Lcalc.Array) e).args));

      case ASSERT:
        return assertion(eval(env, ((Lcalc.Assert) e).exp), e.pos);

      case RAISE:
        throw new Codes.DcalcRuntimeException(((Lcalc.Raise) e).exn, e.pos);

      default:
        throw new AssertionError("unexpected " + e.op);
    }
  }

  private List<Object> evalAll(EvalEnv env, List<Lcalc.Exp> list) {
    final List<Object> values = new ArrayList<>();
    for (Lcalc.Exp e : list) {
      values.add(eval(env, e));
    }
    return values;
  }

  /** Evaluates "handle_default_opt excepts just cons". The consequence is
   * evaluated only if it is selected. */
  @SuppressWarnings("unchecked")
  private Object evalHandleDefaultOpt(EvalEnv env, Lcalc.Apply apply) {
    final List<Variant> excepts =
        (List<Variant>) eval(env, apply.args.get(0));
    final Variant just = (Variant) eval(env, apply.args.get(1));
    final Lcalc.Exp cons = apply.args.get(2);
    return Codes.handleDefaultOpt(optionEnum, excepts, just,
        () -> (Variant) eval(env, cons), apply.pos);
  }
}

// End LcalcInterpreter.java
