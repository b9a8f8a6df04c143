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
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Pos;

/**
 * Interpreter for the default calculus.
 *
 * <p>An empty value is not a value; evaluating an expression that is empty
 * throws {@link EmptyException}, which enclosing expressions propagate until
 * a default term or an error-on-empty catches it.
 */
public class DcalcInterpreter extends Interpreter {
  DcalcInterpreter(String optionEnum) {
    super(optionEnum);
  }

  /** Evaluates an expression to an option: {@code Some v} if it has value
   * {@code v}, {@code None} if it is empty. */
  public Variant evalOption(EvalEnv env, Dcalc.Exp e) {
    final Object value;
    try {
      value = eval(env, e);
    } catch (EmptyException ex) {
      return Variant.none(optionEnum);
    }
    return Variant.some(optionEnum, value);
  }

  /** Evaluates an expression whose value is required. If it is empty,
   * raises {@code NoValueProvided} at {@code pos}. */
  public Object evalRequired(EvalEnv env, Dcalc.Exp e, Pos pos) {
    try {
      return eval(env, e);
    } catch (EmptyException ex) {
      throw new Codes.DcalcRuntimeException(
          Codes.RuntimeExn.NO_VALUE_PROVIDED, pos);
    }
  }

  /** Evaluates the declarations of a program, and returns an environment
   * with a binding for each. A scope is bound to a function from its input
   * struct to its output struct. */
  public EvalEnv evalProgram(EvalEnv env, Dcalc.Program program) {
    EvalEnv env2 = env;
    for (Dcalc.CodeItem item : program.items) {
      if (item instanceof Dcalc.TopDef) {
        final Dcalc.Exp exp = ((Dcalc.TopDef) item).exp;
        env2 = env2.bind(item.pat, evalRequired(env2, exp, exp.pos));
      } else {
        final Dcalc.ScopeBody body = ((Dcalc.ScopeDef) item).body;
        env2 = env2.bind(item.pat,
            new Closure(env2, ImmutableList.of(body.inputPat),
                env3 -> evalLets(env3, body.lets)));
      }
    }
    return env2;
  }

  private Object evalLets(EvalEnv env, Dcalc.ScopeLets lets) {
    EvalEnv env2 = env;
    Dcalc.ScopeLets lets2 = lets;
    while (lets2 instanceof Dcalc.ScopeLet) {
      final Dcalc.ScopeLet let = (Dcalc.ScopeLet) lets2;
      env2 = env2.bind(let.pat, evalRequired(env2, let.exp, let.exp.pos));
      lets2 = let.next;
    }
    final Dcalc.Exp exp = ((Dcalc.Result) lets2).exp;
    return evalRequired(env2, exp, exp.pos);
  }

  /** Evaluates an expression. Throws {@link EmptyException} if it is
   * empty. */
  public Object eval(EvalEnv env, Dcalc.Exp e) {
    switch (e.op) {
      case ID:
        return lookup(env, ((Dcalc.Id) e).idPat);

      case EMPTY_LITERAL:
        throw EmptyException.INSTANCE;

      case BOOL_LITERAL:
      case INTEGER_LITERAL:
      case DECIMAL_LITERAL:
      case MONEY_LITERAL:
      case DATE_LITERAL:
      case DURATION_LITERAL:
      case UNIT_LITERAL:
        return ((Dcalc.Literal) e).value;

      case OPERATOR:
        return operator(((Dcalc.OpRef) e).builtIn, e.pos);

      case ABS:
        final Dcalc.Abs abs = (Dcalc.Abs) e;
        return new Closure(env, abs.params, env2 -> eval(env2, abs.body));

      case APPLY:
        final Dcalc.Apply apply = (Dcalc.Apply) e;
        final Object fn = eval(env, apply.fn);
        return apply(fn, evalAll(env, apply.args));

      case DEFAULT:
        return evalDefault(env, (Dcalc.Default) e);

      case ERROR_ON_EMPTY:
        return evalRequired(env, ((Dcalc.ErrorOnEmpty) e).exp, e.pos);

      case IF:
        final Dcalc.If anIf = (Dcalc.If) e;
        return (Boolean) eval(env, anIf.condition)
            ? eval(env, anIf.ifTrue)
            : eval(env, anIf.ifFalse);

      case MATCH:
        final Dcalc.Match match = (Dcalc.Match) e;
        final Variant variant = (Variant) eval(env, match.exp);
        final Dcalc.Abs matchCase = match.cases.get(variant.constructor);
        return eval(env.bind(matchCase.params.get(0), variant.value),
            matchCase.body);

      case STRUCT:
        final Dcalc.Struct struct = (Dcalc.Struct) e;
        final Map<String, Object> fields = new LinkedHashMap<>();
        struct.fields.forEach((name, field) ->
            fields.put(name, eval(env, field)));
        return StructValue.of(struct.name, fields);

      case STRUCT_ACCESS:
        final Dcalc.StructAccess structAccess = (Dcalc.StructAccess) e;
        return ((StructValue) eval(env, structAccess.exp))
            .get(structAccess.field);

      case TUPLE:
        return ImmutableList.copyOf(evalAll(env, ((Dcalc.Tuple) e).args));

      case TUPLE_ACCESS:
        final Dcalc.TupleAccess tupleAccess = (Dcalc.TupleAccess) e;
        return ((List) eval(env, tupleAccess.exp)).get(tupleAccess.index);

      case INJ:
        final Dcalc.Inj inj = (Dcalc.Inj) e;
        return Variant.of(inj.name, inj.constructor, eval(env, inj.exp));

      case ARRAY:
        return ImmutableList.copyOf(evalAll(env, ((Dcalc.Array) e).args));

      case ASSERT:
        return assertion(evalRequired(env, ((Dcalc.Assert) e).exp, e.pos),
            e.pos);

      default:
        throw new AssertionError("unexpected " + e.op);
    }
  }

  private List<Object> evalAll(EvalEnv env, List<Dcalc.Exp> list) {
    final List<Object> values = new ArrayList<>();
    for (Dcalc.Exp e : list) {
      values.add(eval(env, e));
    }
    return values;
  }

  /** Evaluates a default term. Every exception is evaluated, in order. */
  private Object evalDefault(EvalEnv env, Dcalc.Default aDefault) {
    final List<Variant> excepts = new ArrayList<>();
    for (Dcalc.Exp except : aDefault.excepts) {
      excepts.add(evalOption(env, except));
    }
    final Variant value =
        Codes.handleDefaultOpt(optionEnum, excepts,
            evalOption(env, aDefault.just),
            () -> evalOption(env, aDefault.cons), aDefault.pos);
    if (!value.isSome()) {
      throw EmptyException.INSTANCE;
    }
    return value.value;
  }

  /** Signals that an expression is empty. It is not an error, and has no
   * stack trace. */
  public static class EmptyException extends RuntimeException {
    public static final EmptyException INSTANCE = new EmptyException();

    private EmptyException() {
      super("empty", null, false, false);
    }
  }
}

// End DcalcInterpreter.java
