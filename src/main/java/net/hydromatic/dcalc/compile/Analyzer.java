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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.AnalysisMark;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Mark;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes, for every node of an expression, whether its value may be
 * absent.
 *
 * <p>A value may be absent if evaluating it may reach a default term, an
 * empty literal, a variable that is bound to an absent value, or a call to a
 * function whose result may be absent. For a node of function type, the
 * analyzer also computes whether the result of calling it may be absent.
 *
 * <p>The result is a copy of the expression whose marks are {@link
 * AnalysisMark}s. The translator relies on these flags: an expression that
 * the analyzer marks present translates in place, with nothing hoisted.
 */
public class Analyzer {
  private final Environment env;

  /** Private constructor. */
  private Analyzer(Environment env) {
    this.env = env;
  }

  /** Analyzes an expression in a given environment. */
  public static Dcalc.Exp analyze(Environment env, Dcalc.Exp e) {
    return new Analyzer(env).analyze(e);
  }

  /** Returns the analysis mark of an expression. Throws if the expression
   * has not been analyzed. */
  public static AnalysisMark mark(Dcalc.Exp e) {
    if (!(e.mark instanceof AnalysisMark)) {
      throw CompileException.internal(e.pos,
          "expression has not been analyzed: %s", e);
    }
    return (AnalysisMark) e.mark;
  }

  /** Returns whether the value of an analyzed expression may be absent. */
  public static boolean mayBeAbsent(Dcalc.Exp e) {
    return mark(e).unpure;
  }

  /** Returns whether the result of calling an analyzed expression of
   * function type may be absent. */
  public static boolean returnMayBeAbsent(Dcalc.Exp e) {
    return Boolean.TRUE.equals(mark(e).unpureReturn);
  }

  /** Returns the return flag for a variable of a given type that has no
   * better information. A thunk's result may be absent, and other types
   * have no return flag. */
  static @Nullable Boolean defaultReturnFlag(Type type) {
    return binderReturnFlag(type, false);
  }

  /** Returns the return flag of a variable bound to a value whose return
   * flag is {@code flag}. The result of forcing a thunk variable is always
   * considered possibly absent. */
  static @Nullable Boolean binderReturnFlag(Type type,
      @Nullable Boolean flag) {
    if (!(type instanceof FnType)) {
      return null;
    }
    return type.isThunk() || Boolean.TRUE.equals(flag);
  }

  private Analyzer bind(Binding binding) {
    return new Analyzer(env.bind(binding));
  }

  private static AnalysisMark mark(Mark mark, boolean unpure,
      @Nullable Boolean unpureReturn) {
    return AnalysisMark.of(mark, unpure, unpureReturn);
  }

  /** Computes the return flag of a node whose function value comes from one
   * of the given analyzed expressions. */
  private static @Nullable Boolean returnFlag(Type type,
      List<Dcalc.Exp> sources) {
    if (!(type instanceof FnType)) {
      return null;
    }
    boolean b = type.isThunk();
    for (Dcalc.Exp source : sources) {
      b |= Boolean.TRUE.equals(mark(source).unpureReturn);
    }
    return b;
  }

  /** Checks that an analyzed expression may be used as a value. A function
   * whose result may be absent, whether a lambda or a variable bound to one,
   * can only be bound or applied. */
  private static Dcalc.Exp checkValue(Dcalc.Exp e) {
    if (returnMayBeAbsent(e) && !e.type().isThunk()) {
      throw CompileException.internal(e.pos,
          "function whose result may be absent is used as a value: %s", e);
    }
    return e;
  }

  private List<Dcalc.Exp> analyzeValues(List<Dcalc.Exp> list) {
    final List<Dcalc.Exp> list2 = new ArrayList<>();
    for (Dcalc.Exp e : list) {
      list2.add(checkValue(analyze(e)));
    }
    return list2;
  }

  private static boolean anyMayBeAbsent(List<Dcalc.Exp> list) {
    for (Dcalc.Exp e : list) {
      if (mayBeAbsent(e)) {
        return true;
      }
    }
    return false;
  }

  private Dcalc.Exp analyze(Dcalc.Exp e) {
    switch (e.op) {
      case ID:
        return analyzeId((Dcalc.Id) e);

      case EMPTY_LITERAL:
        return ((Dcalc.Literal) e).copy(
            mark(e.mark, true, defaultReturnFlag(e.type())));

      case BOOL_LITERAL:
      case INTEGER_LITERAL:
      case DECIMAL_LITERAL:
      case MONEY_LITERAL:
      case DATE_LITERAL:
      case DURATION_LITERAL:
      case UNIT_LITERAL:
        return ((Dcalc.Literal) e).copy(mark(e.mark, false, null));

      case OPERATOR:
        return ((Dcalc.OpRef) e).copy(mark(e.mark, false, false));

      case ABS:
        return analyzeAbs((Dcalc.Abs) e);

      case APPLY:
        return analyzeApply((Dcalc.Apply) e);

      case DEFAULT:
        final Dcalc.Default aDefault = (Dcalc.Default) e;
        final List<Dcalc.Exp> excepts = analyzeValues(aDefault.excepts);
        final Dcalc.Exp just = checkValue(analyze(aDefault.just));
        final Dcalc.Exp cons = checkValue(analyze(aDefault.cons));
        return aDefault.copy(
            mark(e.mark, true,
                returnFlag(e.type(),
                    ImmutableList.<Dcalc.Exp>builder().addAll(excepts)
                        .add(cons).build())),
            excepts, just, cons);

      case ERROR_ON_EMPTY:
        final Dcalc.ErrorOnEmpty errorOnEmpty = (Dcalc.ErrorOnEmpty) e;
        final Dcalc.Exp arg = checkValue(analyze(errorOnEmpty.exp));
        return errorOnEmpty.copy(
            mark(e.mark, false, returnFlag(e.type(), ImmutableList.of(arg))),
            arg);

      case IF:
        final Dcalc.If anIf = (Dcalc.If) e;
        final Dcalc.Exp condition = checkValue(analyze(anIf.condition));
        final Dcalc.Exp ifTrue = checkValue(analyze(anIf.ifTrue));
        final Dcalc.Exp ifFalse = checkValue(analyze(anIf.ifFalse));
        return anIf.copy(
            mark(e.mark,
                anyMayBeAbsent(ImmutableList.of(condition, ifTrue, ifFalse)),
                returnFlag(e.type(), ImmutableList.of(ifTrue, ifFalse))),
            condition, ifTrue, ifFalse);

      case MATCH:
        return analyzeMatch((Dcalc.Match) e);

      case STRUCT:
        final Dcalc.Struct struct = (Dcalc.Struct) e;
        final Map<String, Dcalc.Exp> fields = new LinkedHashMap<>();
        struct.fields.forEach((name, field) ->
            fields.put(name, checkValue(analyze(field))));
        return struct.copy(
            mark(e.mark, anyMayBeAbsent(ImmutableList.copyOf(fields.values())),
                null),
            fields);

      case STRUCT_ACCESS:
        final Dcalc.StructAccess structAccess = (Dcalc.StructAccess) e;
        final Dcalc.Exp structExp = checkValue(analyze(structAccess.exp));
        return structAccess.copy(
            mark(e.mark, mayBeAbsent(structExp),
                returnFlag(e.type(), ImmutableList.of())),
            structExp);

      case TUPLE:
        final Dcalc.Tuple tuple = (Dcalc.Tuple) e;
        final List<Dcalc.Exp> tupleArgs = analyzeValues(tuple.args);
        return tuple.copy(mark(e.mark, anyMayBeAbsent(tupleArgs), null),
            tupleArgs);

      case TUPLE_ACCESS:
        final Dcalc.TupleAccess tupleAccess = (Dcalc.TupleAccess) e;
        final Dcalc.Exp tupleExp = checkValue(analyze(tupleAccess.exp));
        return tupleAccess.copy(
            mark(e.mark, mayBeAbsent(tupleExp),
                returnFlag(e.type(), ImmutableList.of())),
            tupleExp);

      case INJ:
        final Dcalc.Inj inj = (Dcalc.Inj) e;
        final Dcalc.Exp payload = checkValue(analyze(inj.exp));
        return inj.copy(mark(e.mark, mayBeAbsent(payload), null), payload);

      case ARRAY:
        final Dcalc.Array array = (Dcalc.Array) e;
        final List<Dcalc.Exp> elements = analyzeValues(array.args);
        return array.copy(mark(e.mark, anyMayBeAbsent(elements), null),
            elements);

      case ASSERT:
        final Dcalc.Assert anAssert = (Dcalc.Assert) e;
        final Dcalc.Exp assertion = checkValue(analyze(anAssert.exp));
        return anAssert.copy(mark(e.mark, mayBeAbsent(assertion), null),
            assertion);

      default:
        throw CompileException.internal(e.pos, "unexpected expression %s: %s",
            e.op, e);
    }
  }

  private Dcalc.Exp analyzeId(Dcalc.Id id) {
    final Binding binding = env.getOpt(id.idPat);
    if (binding == null) {
      throw CompileException.internal(id.pos,
          "variable %s was not found in the current environment", id.idPat);
    }
    if (id.type() instanceof FnType) {
      // A function is a value; calling it is what may be absent
      return id.copy(mark(id.mark, false, binding.unpureReturn));
    }
    return id.copy(mark(id.mark, !binding.pure, null));
  }

  /** Analyzes an abstraction. Its parameters are bound present. */
  private Dcalc.Abs analyzeAbs(Dcalc.Abs abs) {
    Analyzer analyzer = this;
    for (Dcalc.IdPat param : abs.params) {
      analyzer =
          analyzer.bind(
              Binding.of(param, true, defaultReturnFlag(param.type)));
    }
    final Dcalc.Exp body = checkValue(analyzer.analyze(abs.body));
    return abs.copy(mark(abs.mark, false, mayBeAbsent(body)), body);
  }

  private Dcalc.Exp analyzeApply(Dcalc.Apply apply) {
    switch (apply.fn.op) {
      case ID:
      case ABS:
      case OPERATOR:
        break;
      default:
        throw CompileException.internal(apply.pos,
            "unexpected operator shape in application: %s", apply.fn);
    }

    if (apply.isLet()) {
      final Dcalc.Abs abs = (Dcalc.Abs) apply.fn;
      final Dcalc.IdPat param = abs.params.get(0);
      final Dcalc.Exp arg = analyze(apply.args.get(0));
      final Analyzer analyzer =
          bind(Binding.of(param, true,
              binderReturnFlag(param.type, mark(arg).unpureReturn)));
      final Dcalc.Exp body = checkValue(analyzer.analyze(abs.body));
      final Dcalc.Abs abs2 =
          abs.copy(mark(abs.mark, false, mayBeAbsent(body)), body);
      return apply.copy(
          mark(apply.mark, mayBeAbsent(arg) || mayBeAbsent(body),
              returnFlag(apply.type(), ImmutableList.of(body))),
          abs2, ImmutableList.of(arg));
    }

    final Dcalc.Exp fn = analyze(apply.fn);
    final List<Dcalc.Exp> args = analyzeValues(apply.args);
    final boolean unpure =
        anyMayBeAbsent(args) || mayBeAbsent(fn) || returnMayBeAbsent(fn);
    return apply.copy(
        mark(apply.mark, unpure, returnFlag(apply.type(), ImmutableList.of())),
        fn, args);
  }

  private Dcalc.Exp analyzeMatch(Dcalc.Match match) {
    final Dcalc.Exp exp = checkValue(analyze(match.exp));
    final Map<String, Dcalc.Abs> cases = new LinkedHashMap<>();
    final List<Dcalc.Exp> bodies = new ArrayList<>();
    match.cases.forEach((constructor, abs) -> {
      final Dcalc.Abs abs2 = analyzeAbs(abs);
      cases.put(constructor, abs2);
      bodies.add(abs2.body);
    });
    return match.copy(
        mark(match.mark, mayBeAbsent(exp) || anyMayBeAbsent(bodies),
            returnFlag(match.type(), bodies)),
        exp, cases);
  }
}

// End Analyzer.java
