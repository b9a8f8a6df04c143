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

import static net.hydromatic.dcalc.ast.DcalcBuilder.dcalc;
import static net.hydromatic.dcalc.ast.LcalcBuilder.lcalc;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link Translator} and {@link Materializer}. */
public class TranslatorTest {
  /** Returns a fixture with an empty environment. */
  private static Fixture fixture() {
    return new Fixture(Environments.empty(), Tracers.empty());
  }

  private static Dcalc.Default defaultTerm(Dcalc.Exp just, Dcalc.Exp cons) {
    return dcalc.defaultTerm(ImmutableList.of(), just, cons);
  }

  @Test
  void testDefault() {
    final Fixture f = fixture();
    final Dcalc.Exp e =
        defaultTerm(dcalc.boolLiteral(true), dcalc.intLiteral(9));
    final String expected = "match handle_default_opt [||] (Some true) "
        + "(Some 9) with | None _ -> None "
        + "| Some default_term_1 -> Some default_term_1";
    assertThat(f.translate(e), hasToString(expected));
  }

  /** Two default terms in the same expression each get a placeholder, and
   * the placeholders are distinct. */
  @Test
  void testSiblingDefaults() {
    final Fixture f = fixture();
    final Dcalc.Exp e =
        dcalc.call(f.ts, BuiltIn.PLUS,
            defaultTerm(dcalc.boolLiteral(true), dcalc.intLiteral(1)),
            defaultTerm(dcalc.boolLiteral(true), dcalc.intLiteral(2)));
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.size(), is(2));
    assertThat(hoisted.exp, hasToString("default_term_1 + default_term_2"));
    hoisted.hoists.map.values().forEach(hoist ->
        assertThat(hoist.kind, is(Hoists.Kind.DEFAULT)));
  }

  /** An expression without default terms or empty literals translates to
   * itself, and hoists nothing. */
  @Test
  void testDefaultFreeIsIdentity() {
    final Dcalc.IdPat x = dcalc.idPat(PrimitiveType.INTEGER, "x");
    final Lcalc.IdPat x2 = lcalc.idPat("x", 0, "", PrimitiveType.INTEGER);
    final Fixture f =
        new Fixture(Environments.empty().bind(Binding.of(x, x2, true, null)),
            Tracers.empty());
    final Dcalc.Exp e =
        dcalc.ifThenElse(
            dcalc.call(f.ts, BuiltIn.GT, dcalc.id(x), dcalc.intLiteral(1)),
            dcalc.call(f.ts, BuiltIn.PLUS, dcalc.id(x), dcalc.intLiteral(1)),
            dcalc.intLiteral(0));
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.isEmpty(), is(true));
    assertThat(hoisted.exp, hasToString(e.toString()));
    assertThat(hoisted.exp, hasToString("if x > 1 then x + 1 else 0"));
  }

  @Test
  void testEmpty() {
    final Fixture f = fixture();
    final Dcalc.Exp e = dcalc.emptyLiteral(PrimitiveType.INTEGER);
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.size(), is(1));
    assertThat(hoisted.exp, hasToString("empty_literal_1"));
    assertThat(f.translate(e),
        hasToString("match None with | None _ -> None "
            + "| Some empty_literal_2 -> Some empty_literal_2"));
  }

  /** A variable that may be absent is hoisted, and its references are
   * replaced by a placeholder. */
  @Test
  void testAbsentVariable() {
    final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
    final Lcalc.IdPat y2 =
        lcalc.idPat("y_opt", 0, "",
            new TypeSystem().optionType(PrimitiveType.INTEGER));
    final Fixture f =
        new Fixture(Environments.empty().bind(Binding.of(y, y2, false, null)),
            Tracers.empty());
    final Dcalc.Exp e =
        dcalc.call(f.ts, BuiltIn.TIMES, dcalc.id(y), dcalc.intLiteral(2));
    assertThat(f.translate(e),
        hasToString("match y_opt with | None _ -> None "
            + "| Some y_1 -> Some (y_1 * 2)"));
  }

  /** A "let" whose argument may be absent is hoisted. The placeholder is
   * the let-bound variable. */
  @Test
  void testLet() {
    final Fixture f = fixture();
    final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
    final Dcalc.Exp e =
        dcalc.let(f.ts, y,
            defaultTerm(dcalc.boolLiteral(true), dcalc.intLiteral(2)),
            dcalc.call(f.ts, BuiltIn.PLUS, dcalc.id(y), dcalc.intLiteral(1)));
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.size(), is(1));
    assertThat(hoisted.exp, hasToString("y_1 + 1"));
    assertThat(hoisted.hoists.map.values().iterator().next().kind,
        is(Hoists.Kind.LET));
  }

  /** A "let" whose argument and body are present translates in place. */
  @Test
  void testPresentLet() {
    final Fixture f = fixture();
    final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
    final Dcalc.Exp e =
        dcalc.let(f.ts, y, dcalc.intLiteral(2),
            dcalc.call(f.ts, BuiltIn.PLUS, dcalc.id(y), dcalc.intLiteral(1)));
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.isEmpty(), is(true));
    assertThat(hoisted.exp, hasToString("let y_1 = 2 in y_1 + 1"));
  }

  @Test
  void testErrorOnEmpty() {
    final Fixture f = fixture();
    final Dcalc.Exp e =
        dcalc.errorOnEmpty(Pos.ZERO,
            defaultTerm(dcalc.boolLiteral(true), dcalc.intLiteral(9)));
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.isEmpty(), is(true));
    assertThat(hoisted.exp.toString(),
        containsString("| None _ -> raise NoValueProvided"));
  }

  /** A conditional with a branch that may be absent is hoisted as a
   * whole. */
  @Test
  void testConditional() {
    final Fixture f = fixture();
    final Dcalc.Exp e =
        dcalc.ifThenElse(dcalc.boolLiteral(true), dcalc.intLiteral(1),
            dcalc.emptyLiteral(PrimitiveType.INTEGER));
    final Translator.Hoisted hoisted = f.hoist(e);
    assertThat(hoisted.hoists.size(), is(1));
    assertThat(hoisted.exp, hasToString("conditional_1"));
    assertThat(hoisted.hoists.map.values().iterator().next().kind,
        is(Hoists.Kind.CONDITIONAL));
  }

  @Test
  void testTracer() {
    final List<String> list = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnHoist(Tracers.empty(),
            (x, e) -> list.add(x + " := " + e));
    final Fixture f = new Fixture(Environments.empty(), tracer);
    final Dcalc.Exp e =
        dcalc.call(f.ts, BuiltIn.PLUS,
            defaultTerm(dcalc.boolLiteral(true), dcalc.intLiteral(1)),
            dcalc.emptyLiteral(PrimitiveType.INTEGER));
    f.hoist(e);
    assertThat(list.size(), is(2));
    assertThat(list,
        hasItems("default_term_1 := <true :- 1>",
            "empty_literal_1 := empty"));
  }

  @Test
  void testUnboundVariable() {
    final Fixture f = fixture();
    final Dcalc.IdPat x = dcalc.idPat(PrimitiveType.INTEGER, "x");
    assertThrows(CompileException.class, () -> f.translate(dcalc.id(x)));
  }

  /** Hoists that share a placeholder cannot be merged. */
  @Test
  void testDisjoint() {
    final Lcalc.IdPat x = lcalc.idPat("x", 1, "", PrimitiveType.INTEGER);
    final Hoists h0 =
        Hoists.of(x, Hoists.Kind.EMPTY,
            dcalc.emptyLiteral(PrimitiveType.INTEGER), Environments.empty());
    final Hoists h1 =
        Hoists.of(x, Hoists.Kind.EMPTY,
            dcalc.emptyLiteral(PrimitiveType.INTEGER), Environments.empty());
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Hoists.union(Pos.ZERO, ImmutableList.of(h0, h1)));
    assertThat(e.getMessage(),
        is("Internal Error: Two supposed to be disjoint maps have one "
            + "shared key: x_1"));
  }

  /** Translation environment, and the translator that works in it. */
  private static class Fixture {
    final TypeSystem ts = new TypeSystem();
    final Environment env;
    final Translator translator;

    Fixture(Environment env, Tracer tracer) {
      this.env = env;
      this.translator =
          new Translator(ts, "Option", new NameGenerator(""), tracer);
    }

    Translator.Hoisted hoist(Dcalc.Exp e) {
      return translator.translateAndHoist(env, Analyzer.analyze(env, e));
    }

    Lcalc.Exp translate(Dcalc.Exp e) {
      return translator.translateExpr(env, Analyzer.analyze(env, e), true);
    }
  }
}

// End TranslatorTest.java
