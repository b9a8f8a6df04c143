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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Op;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.eval.Codes;
import net.hydromatic.dcalc.type.OptionType;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.Type;

/**
 * Wraps a translated expression in the expressions that were hoisted out of
 * it.
 *
 * <p>Each hoist becomes
 *
 * <blockquote><pre>match h with
 * | None _ -&gt; None
 * | Some x -&gt; ...</pre></blockquote>
 *
 * <p>where {@code h} is the hoisted expression translated to an option and
 * {@code x} is its placeholder. The first hoist that was discovered is the
 * outermost, so a hoist may refer to the placeholders of the hoists found
 * before it.
 */
public class Materializer {
  private final Translator translator;

  Materializer(Translator translator) {
    this.translator = requireNonNull(translator);
  }

  /** Wraps {@code body} in the given hoists. If {@code appendSome}, first
   * wraps {@code body} in {@code Some}. */
  public Lcalc.Exp materialize(Pos pos, Hoists hoists, Lcalc.Exp body,
      boolean appendSome) {
    Lcalc.Exp acc = appendSome ? translator.some(pos, body) : body;
    final List<Map.Entry<Lcalc.IdPat, Hoists.Hoist>> entries =
        hoists.map.entrySet().asList();
    for (int i = entries.size() - 1; i >= 0; i--) {
      final Map.Entry<Lcalc.IdPat, Hoists.Hoist> entry = entries.get(i);
      acc = wrap(entry.getKey(), entry.getValue(), acc);
    }
    return acc;
  }

  private Lcalc.Exp wrap(Lcalc.IdPat x, Hoists.Hoist hoist, Lcalc.Exp acc) {
    final Dcalc.Exp e = hoist.exp;
    if (hoist.kind == Hoists.Kind.LET && !mayBeAbsent(e)) {
      return lcalc.let(e.pos, x, translator.translatePresent(hoist.env, e),
          acc);
    }
    if (!(acc.type instanceof OptionType)) {
      throw CompileException.internal(e.pos,
          "cannot propagate absence of %s out of %s", e, acc);
    }
    return lcalc.matchOpt(e.pos, translator.typeSystem, translator.optionEnum,
        resolve(x, hoist),
        lcalc.none(e.pos, translator.optionEnum, (OptionType) acc.type),
        x, acc);
  }

  /** Translates a hoisted expression to an option. */
  Lcalc.Exp resolve(Lcalc.IdPat x, Hoists.Hoist hoist) {
    final Environment env = hoist.env;
    final Dcalc.Exp e = hoist.exp;
    switch (hoist.kind) {
      case DEFAULT:
        final Dcalc.Default aDefault = (Dcalc.Default) e;
        final List<Lcalc.Exp> excepts = new ArrayList<>();
        aDefault.excepts.forEach(except ->
            excepts.add(translator.translateExpr(env, except, true)));
        return lcalc.handleDefaultOpt(e.pos, translator.typeSystem, excepts,
            translator.translateExpr(env, aDefault.just, true),
            translator.translateExpr(env, aDefault.cons, true));

      case EMPTY:
        return lcalc.none(e.pos, translator.optionEnum,
            translator.typeSystem.optionType(x.type));

      case VAR:
        final Dcalc.Id id =
            (Dcalc.Id) (e.op == Op.APPLY ? ((Dcalc.Apply) e).fn : e);
        return translator.reference(env, id);

      case APPLICATION:
        return resolveApplication(env, (Dcalc.Apply) e);

      case ASSERTION:
        final Dcalc.Assert anAssert = (Dcalc.Assert) e;
        final Lcalc.IdPat y =
            translator.nameGenerator.fresh("assertion_argument",
                PrimitiveType.BOOL);
        final Type unitOption =
            translator.typeSystem.optionType(PrimitiveType.UNIT);
        return lcalc.matchOpt(e.pos, translator.typeSystem,
            translator.optionEnum,
            translator.translateExpr(env, anAssert.exp, true),
            lcalc.raise(e.pos, unitOption,
                Codes.RuntimeExn.NO_VALUE_PROVIDED),
            y,
            translator.some(e.pos,
                lcalc.assertion(e.pos, lcalc.id(e.pos, y))));

      case LET:
        return translator.translateExpr(env, e, true);

      case CONDITIONAL:
        final Dcalc.If anIf = (Dcalc.If) e;
        final Translator.Hoisted condition =
            translator.translateAndHoist(env, anIf.condition);
        return materialize(e.pos, condition.hoists,
            lcalc.ifThenElse(e.pos, condition.exp,
                translator.translateExpr(env, anIf.ifTrue, true),
                translator.translateExpr(env, anIf.ifFalse, true)),
            false);

      case MATCH:
        final Dcalc.Match match = (Dcalc.Match) e;
        final Translator.Hoisted scrutinee =
            translator.translateAndHoist(env, match.exp);
        final Lcalc.Match match2 =
            lcalc.match(e.pos, translator.typeSystem.optionType(x.type),
                scrutinee.exp, match.name,
                translator.translateCases(env, match, true));
        return materialize(e.pos, scrutinee.hoists, match2, false);

      default:
        throw CompileException.internal(e.pos, "unexpected hoist %s: %s",
            hoist.kind, e);
    }
  }

  /** Translates the application of a function whose result may be absent,
   * or to arguments that may be absent. */
  private Lcalc.Exp resolveApplication(Environment env, Dcalc.Apply apply) {
    final Lcalc.Exp fn = translator.translatePresent(env, apply.fn);
    final Translator.Hoisteds args = translator.translateAll(env, apply.args);
    final Type type = translator.translateType(apply.type());
    final boolean returnMayBeAbsent = returnMayBeAbsent(apply.fn);
    final Lcalc.Exp call =
        lcalc.apply(apply.pos,
            returnMayBeAbsent ? translator.typeSystem.optionType(type) : type,
            fn, args.exps);
    return materialize(apply.pos, args.hoists(apply.pos),
        returnMayBeAbsent ? call : translator.some(apply.pos, call), false);
  }
}

// End Materializer.java
