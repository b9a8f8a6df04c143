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
import static net.hydromatic.dcalc.compile.Analyzer.mayBeAbsent;
import static net.hydromatic.dcalc.compile.Analyzer.returnMayBeAbsent;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Op;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.eval.Codes;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.OptionType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates expressions of the default calculus, after {@link Analyzer
 * analysis}, into the lambda calculus with options.
 *
 * <p>An expression whose value may be absent cannot stay where it is, because
 * the output language has no notion of absence. The translator replaces it
 * with a fresh placeholder variable and records it in a {@link Hoists}
 * table. The {@link Materializer} later wraps the translated expression in
 * one option match per entry, binding the placeholder to the present value
 * and propagating {@code None}.
 *
 * <p>A thunk, that is, a function of type {@code unit -> t}, becomes the
 * option that calling it would produce.
 */
public class Translator {
  final TypeSystem typeSystem;
  final String optionEnum;
  final NameGenerator nameGenerator;
  final Tracer tracer;
  final Materializer materializer;

  public Translator(TypeSystem typeSystem, String optionEnum,
      NameGenerator nameGenerator, Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.optionEnum = requireNonNull(optionEnum);
    this.nameGenerator = requireNonNull(nameGenerator);
    this.tracer = requireNonNull(tracer);
    this.materializer = new Materializer(this);
  }

  /** Translates an expression, and wraps it in its hoists.
   *
   * <p>If {@code appendSome}, the result is an option, and the translated
   * expression is wrapped in {@code Some}. If not, the expression must have
   * produced no hoists, or must already be an option. */
  public Lcalc.Exp translateExpr(Environment env, Dcalc.Exp e,
      boolean appendSome) {
    final Hoisted hoisted = translateAndHoist(env, e);
    return materializer.materialize(e.pos, hoisted.hoists, hoisted.exp,
        appendSome);
  }

  /** Translates an expression that the analyzer marked present. */
  public Lcalc.Exp translatePresent(Environment env, Dcalc.Exp e) {
    final Hoisted hoisted = translateAndHoist(env, e);
    if (!hoisted.hoists.isEmpty()) {
      throw CompileException.internal(e.pos,
          "expression marked present produced hoists %s: %s",
          hoisted.hoists, e);
    }
    return hoisted.exp;
  }

  /** Translates an expression to a value of its translated type. If the
   * value is absent, the output raises {@code NoValueProvided}. */
  public Lcalc.Exp translateOrRaise(Environment env, Dcalc.Exp e) {
    final Hoisted hoisted = translateAndHoist(env, e);
    if (hoisted.hoists.isEmpty()) {
      return hoisted.exp;
    }
    return unwrap(e.pos,
        materializer.materialize(e.pos, hoisted.hoists, hoisted.exp, true));
  }

  /** Returns "match e with None -> raise NoValueProvided | Some x -> x". */
  Lcalc.Exp unwrap(Pos pos, Lcalc.Exp option) {
    final Type type = ((OptionType) option.type).elementType;
    final Lcalc.IdPat x = nameGenerator.fresh("non_empty_argument", type);
    return lcalc.matchOpt(pos, typeSystem, optionEnum, option,
        lcalc.raise(pos, type, Codes.RuntimeExn.NO_VALUE_PROVIDED),
        x, lcalc.id(pos, x));
  }

  /** Wraps an expression in {@code Some}. */
  Lcalc.Exp some(Pos pos, Lcalc.Exp e) {
    return lcalc.some(pos, typeSystem, optionEnum, e);
  }

  Type translateType(Type type) {
    return typeSystem.translate(type);
  }

  /** Returns the translated type of a variable. A variable bound to a
   * function whose result may be absent returns an option. */
  Type bindingType(Type type, @Nullable Boolean unpureReturn) {
    final Type type2 = translateType(type);
    if (type.isThunk()
        || !(type instanceof FnType)
        || !Boolean.TRUE.equals(unpureReturn)) {
      return type2;
    }
    final FnType fnType = (FnType) type2;
    return typeSystem.fnType(fnType.paramTypes,
        typeSystem.optionType(fnType.resultType));
  }

  /** Creates a binding from a source variable to a fresh target variable.
   * A variable of thunk type holds an option, and is not pure. */
  Binding bind(Dcalc.IdPat id, Lcalc.IdPat target,
      @Nullable Boolean unpureReturn) {
    return Binding.of(id, target, !id.type.isThunk(),
        Analyzer.binderReturnFlag(id.type, unpureReturn));
  }

  /** Returns the expression that replaces a reference to a variable. */
  Lcalc.Exp reference(Environment env, Dcalc.Id id) {
    final Binding binding = env.getOpt(id.idPat);
    if (binding == null) {
      throw CompileException.internal(id.pos,
          "variable %s was not found in the current environment", id.idPat);
    }
    if (binding.target != null) {
      return lcalc.id(id.pos, binding.target);
    }
    if (binding.expr == null) {
      throw CompileException.internal(id.pos,
          "variable %s has no translation", id.idPat);
    }
    return binding.expr;
  }

  /** Replaces an expression by a placeholder, and records the hoist. */
  private Hoisted hoist(Environment env, Dcalc.Exp e, Hoists.Kind kind,
      String name) {
    final Lcalc.IdPat x = nameGenerator.fresh(name, translateType(e.type()));
    tracer.onHoist(x, e);
    return new Hoisted(lcalc.id(e.pos, x), Hoists.of(x, kind, e, env));
  }

  /** Translates an expression, replacing the sub-expressions that may be
   * absent with placeholders. */
  public Hoisted translateAndHoist(Environment env, Dcalc.Exp e) {
    switch (e.op) {
      case ID:
        final Dcalc.Id id = (Dcalc.Id) e;
        final Binding binding = env.getOpt(id.idPat);
        if (binding != null
            && !binding.pure
            && !(id.type() instanceof FnType)) {
          return hoist(env, e, Hoists.Kind.VAR, id.idPat.name);
        }
        return Hoisted.of(reference(env, id));

      case EMPTY_LITERAL:
        return hoist(env, e, Hoists.Kind.EMPTY, "empty_literal");

      case BOOL_LITERAL:
      case INTEGER_LITERAL:
      case DECIMAL_LITERAL:
      case MONEY_LITERAL:
      case DATE_LITERAL:
      case DURATION_LITERAL:
      case UNIT_LITERAL:
        return Hoisted.of(
            lcalc.literal(e.pos, e.op, ((Dcalc.Literal) e).value));

      case OPERATOR:
        return Hoisted.of(
            lcalc.opRef(e.pos, translateType(e.type()),
                ((Dcalc.OpRef) e).builtIn));

      case DEFAULT:
        return hoist(env, e, Hoists.Kind.DEFAULT, "default_term");

      case ERROR_ON_EMPTY:
        final Dcalc.ErrorOnEmpty errorOnEmpty = (Dcalc.ErrorOnEmpty) e;
        return Hoisted.of(
            unwrap(e.pos, translateExpr(env, errorOnEmpty.exp, true)));

      case ABS:
        return Hoisted.of(translateAbs(env, (Dcalc.Abs) e));

      case APPLY:
        return translateApply(env, (Dcalc.Apply) e);

      case IF:
        final Dcalc.If anIf = (Dcalc.If) e;
        if (mayBeAbsent(anIf.ifTrue) || mayBeAbsent(anIf.ifFalse)) {
          return hoist(env, e, Hoists.Kind.CONDITIONAL, "conditional");
        }
        final Hoisted condition = translateAndHoist(env, anIf.condition);
        final Hoisted ifTrue = translateAndHoist(env, anIf.ifTrue);
        final Hoisted ifFalse = translateAndHoist(env, anIf.ifFalse);
        return new Hoisted(
            lcalc.ifThenElse(e.pos, condition.exp, ifTrue.exp, ifFalse.exp),
            Hoists.union(e.pos,
                ImmutableList.of(condition.hoists, ifTrue.hoists,
                    ifFalse.hoists)));

      case MATCH:
        final Dcalc.Match match = (Dcalc.Match) e;
        for (Dcalc.Abs abs : match.cases.values()) {
          if (mayBeAbsent(abs.body)) {
            return hoist(env, e, Hoists.Kind.MATCH, "match_result");
          }
        }
        final Hoisted scrutinee = translateAndHoist(env, match.exp);
        return new Hoisted(
            lcalc.match(e.pos, translateType(e.type()), scrutinee.exp,
                match.name, translateCases(env, match, false)),
            scrutinee.hoists);

      case STRUCT:
        final Dcalc.Struct struct = (Dcalc.Struct) e;
        final Map<String, Lcalc.Exp> fields = new LinkedHashMap<>();
        final List<Hoists> fieldHoists = new ArrayList<>();
        struct.fields.forEach((name, field) -> {
          final Hoisted hoisted = translateAndHoist(env, field);
          fields.put(name, hoisted.exp);
          fieldHoists.add(hoisted.hoists);
        });
        return new Hoisted(
            lcalc.struct(e.pos, translateType(e.type()), struct.name, fields),
            Hoists.union(e.pos, fieldHoists));

      case STRUCT_ACCESS:
        final Dcalc.StructAccess structAccess = (Dcalc.StructAccess) e;
        final Hoisted structExp = translateAndHoist(env, structAccess.exp);
        return new Hoisted(
            lcalc.structAccess(e.pos, translateType(e.type()), structExp.exp,
                structAccess.name, structAccess.field),
            structExp.hoists);

      case TUPLE:
        final Dcalc.Tuple tuple = (Dcalc.Tuple) e;
        final Hoisteds tupleArgs = translateAll(env, tuple.args);
        return new Hoisted(lcalc.tuple(e.pos, typeSystem, tupleArgs.exps),
            tupleArgs.hoists(e.pos));

      case TUPLE_ACCESS:
        final Dcalc.TupleAccess tupleAccess = (Dcalc.TupleAccess) e;
        final Hoisted tupleExp = translateAndHoist(env, tupleAccess.exp);
        return new Hoisted(
            lcalc.tupleAccess(e.pos, tupleExp.exp, tupleAccess.index),
            tupleExp.hoists);

      case INJ:
        final Dcalc.Inj inj = (Dcalc.Inj) e;
        final Hoisted payload = translateAndHoist(env, inj.exp);
        return new Hoisted(
            lcalc.inj(e.pos, translateType(e.type()), inj.name,
                inj.constructor, payload.exp),
            payload.hoists);

      case ARRAY:
        final Dcalc.Array array = (Dcalc.Array) e;
        final Hoisteds elements = translateAll(env, array.args);
        return new Hoisted(
            lcalc.array(e.pos, translateType(e.type()), elements.exps),
            elements.hoists(e.pos));

      case ASSERT:
        final Dcalc.Assert anAssert = (Dcalc.Assert) e;
        if (mayBeAbsent(anAssert.exp)) {
          return hoist(env, e, Hoists.Kind.ASSERTION, "assertion");
        }
        final Hoisted assertion = translateAndHoist(env, anAssert.exp);
        return new Hoisted(lcalc.assertion(e.pos, assertion.exp),
            assertion.hoists);

      default:
        throw CompileException.internal(e.pos, "unexpected expression %s: %s",
            e.op, e);
    }
  }

  /** Translates a list of expressions. */
  Hoisteds translateAll(Environment env, List<Dcalc.Exp> list) {
    final Hoisteds hoisteds = new Hoisteds();
    for (Dcalc.Exp e : list) {
      final Hoisted hoisted = translateAndHoist(env, e);
      hoisteds.exps.add(hoisted.exp);
      hoisteds.hoistsList.add(hoisted.hoists);
    }
    return hoisteds;
  }

  /** Translates an abstraction in value position.
   *
   * <p>A thunk becomes the option that calling it would produce; its body
   * is evaluated where the thunk is defined. Any other function keeps its
   * parameters, and returns an option if its result may be absent. */
  Lcalc.Exp translateAbs(Environment env, Dcalc.Abs abs) {
    if (abs.type().isThunk()) {
      final Binding unit =
          Binding.of(abs.params.get(0), lcalc.unitLiteral(abs.pos), true,
              null);
      return translateExpr(env.bind(unit), abs.body, true);
    }
    return translateFunction(env, abs, returnMayBeAbsent(abs));
  }

  /** Translates an abstraction, keeping its parameters. If {@code
   * appendSome}, the body is translated to an option. */
  Lcalc.Abs translateFunction(Environment env, Dcalc.Abs abs,
      boolean appendSome) {
    Environment env2 = env;
    final List<Lcalc.IdPat> params = new ArrayList<>();
    for (Dcalc.IdPat param : abs.params) {
      final Lcalc.IdPat x =
          nameGenerator.fresh(param.name, translateType(param.type));
      params.add(x);
      env2 = env2.bind(bind(param, x, null));
    }
    final Lcalc.Exp body =
        appendSome
            ? translateExpr(env2, abs.body, true)
            : translatePresent(env2, abs.body);
    return lcalc.abs(abs.pos, typeSystem, params, body);
  }

  /** Translates the cases of a match. If {@code appendSome}, each case
   * returns an option. */
  Map<String, Lcalc.Abs> translateCases(Environment env, Dcalc.Match match,
      boolean appendSome) {
    final Map<String, Lcalc.Abs> cases = new LinkedHashMap<>();
    match.cases.forEach((constructor, abs) ->
        cases.put(constructor, translateFunction(env, abs, appendSome)));
    return cases;
  }

  private Hoisted translateApply(Environment env, Dcalc.Apply apply) {
    if (apply.isLet()) {
      return translateLet(env, apply);
    }
    final Dcalc.Exp fn = apply.fn;
    switch (fn.op) {
      case ID:
        final Binding binding = env.getOpt(((Dcalc.Id) fn).idPat);
        if (binding != null && !binding.pure && fn.type().isThunk()) {
          // Forcing a thunk whose value is an option
          if (apply.args.size() != 1
              || apply.args.get(0).op != Op.UNIT_LITERAL) {
            throw CompileException.internal(apply.pos,
                "thunk %s must be applied to unit", fn);
          }
          return hoist(env, apply, Hoists.Kind.VAR,
              ((Dcalc.Id) fn).idPat.name);
        }
        break;

      case OPERATOR:
        final Lcalc.Exp op = translatePresent(env, fn);
        final Hoisteds args = translateAll(env, apply.args);
        return new Hoisted(
            lcalc.apply(apply.pos, translateType(apply.type()), op,
                args.exps),
            args.hoists(apply.pos));

      default:
        break;
    }
    if (!mayBeAbsent(apply)) {
      final List<Lcalc.Exp> args = new ArrayList<>();
      apply.args.forEach(arg -> args.add(translatePresent(env, arg)));
      return Hoisted.of(
          lcalc.apply(apply.pos, translateType(apply.type()),
              translatePresent(env, fn), args));
    }
    return hoist(env, apply, Hoists.Kind.APPLICATION, "function_application");
  }

  /** Translates "let x = arg in body".
   *
   * <p>If neither the argument nor the body produce hoists, the let stays in
   * place. Otherwise the argument becomes a hoist whose placeholder is the
   * let's variable, and comes before the hoists of the body, which may
   * refer to it. */
  private Hoisted translateLet(Environment env, Dcalc.Apply apply) {
    final Dcalc.Abs abs = (Dcalc.Abs) apply.fn;
    final Dcalc.IdPat param = abs.params.get(0);
    final Dcalc.Exp arg = apply.args.get(0);
    final @Nullable Boolean unpureReturn = Analyzer.mark(arg).unpureReturn;
    final Lcalc.IdPat x =
        nameGenerator.fresh(param.name, bindingType(param.type, unpureReturn));
    final Hoisted body =
        translateAndHoist(env.bind(bind(param, x, unpureReturn)), abs.body);
    if (!mayBeAbsent(arg) && body.hoists.isEmpty()) {
      return Hoisted.of(
          lcalc.let(apply.pos, x, translatePresent(env, arg), body.exp));
    }
    tracer.onHoist(x, arg);
    return new Hoisted(body.exp,
        Hoists.of(x, Hoists.Kind.LET, arg, env).plus(apply.pos, body.hoists));
  }

  /** Translated expression and the expressions hoisted out of it. */
  public static class Hoisted {
    public final Lcalc.Exp exp;
    public final Hoists hoists;

    Hoisted(Lcalc.Exp exp, Hoists hoists) {
      this.exp = requireNonNull(exp);
      this.hoists = requireNonNull(hoists);
    }

    static Hoisted of(Lcalc.Exp exp) {
      return new Hoisted(exp, Hoists.empty());
    }

    @Override
    public String toString() {
      return exp + " " + hoists;
    }
  }

  /** Translated list of expressions, and their hoists. */
  static class Hoisteds {
    final List<Lcalc.Exp> exps = new ArrayList<>();
    final List<Hoists> hoistsList = new ArrayList<>();

    Hoists hoists(Pos pos) {
      return Hoists.union(pos, hoistsList);
    }
  }
}

// End Translator.java
