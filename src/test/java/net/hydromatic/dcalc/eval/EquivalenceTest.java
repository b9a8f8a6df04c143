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

import static net.hydromatic.dcalc.ast.DcalcBuilder.dcalc;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.compile.BuiltIn;
import net.hydromatic.dcalc.compile.Compiles;
import net.hydromatic.dcalc.compile.Environments;
import net.hydromatic.dcalc.compile.Tracers;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.TypeSystem;
import org.junit.jupiter.api.Test;

/**
 * Tests that an expression has the same value in the default calculus as
 * its translation has in the lambda calculus with options.
 *
 * <p>Each expression is evaluated twice: by {@link DcalcInterpreter}, where
 * an empty value is {@code None}, and, after translation, by
 * {@link LcalcInterpreter}.
 */
public class EquivalenceTest {
  private static final String OPTION = "Option";

  private final TypeSystem ts = new TypeSystem();

  private static Dcalc.Exp int_(long i) {
    return dcalc.intLiteral(i);
  }

  private static Dcalc.Exp bool(boolean b) {
    return dcalc.boolLiteral(b);
  }

  private static Dcalc.Exp empty() {
    return dcalc.emptyLiteral(PrimitiveType.INTEGER);
  }

  private static Dcalc.Default defaultTerm(List<Dcalc.Exp> excepts,
      Dcalc.Exp just, Dcalc.Exp cons) {
    return dcalc.defaultTerm(excepts, just, cons);
  }

  /** Evaluates an expression both ways, checks that the results are equal,
   * and returns the result. */
  private Variant eval(Dcalc.Exp e) {
    final Variant v0 =
        Interpreter.dcalc(OPTION).evalOption(EvalEnvs.empty(), e);
    final Lcalc.Exp e2 =
        Compiles.translateExpression(ts, Environments.empty(), e, OPTION,
            Tracers.empty());
    final Object v1 = Interpreter.lcalc(OPTION).eval(EvalEnvs.empty(), e2);
    assertThat(v1, is((Object) v0));
    return v0;
  }

  /** Evaluates an expression both ways, and checks that each raises the
   * given exception. */
  private void checkRaises(Dcalc.Exp e, Codes.RuntimeExn exn) {
    final Codes.DcalcRuntimeException x0 =
        assertThrows(Codes.DcalcRuntimeException.class,
            () -> Interpreter.dcalc(OPTION).evalOption(EvalEnvs.empty(), e));
    assertThat(x0.exn(), is(exn));
    final Lcalc.Exp e2 =
        Compiles.translateExpression(ts, Environments.empty(), e, OPTION,
            Tracers.empty());
    final Codes.DcalcRuntimeException x1 =
        assertThrows(Codes.DcalcRuntimeException.class,
            () -> Interpreter.lcalc(OPTION).eval(EvalEnvs.empty(), e2));
    assertThat(x1.exn(), is(exn));
  }

  @Test
  void testLiteral() {
    assertThat(eval(int_(3)), hasToString("Some 3"));
  }

  @Test
  void testEmpty() {
    assertThat(eval(empty()), hasToString("None"));
  }

  @Test
  void testJustification() {
    assertThat(eval(defaultTerm(ImmutableList.of(), bool(true), int_(7))),
        hasToString("Some 7"));
    assertThat(eval(defaultTerm(ImmutableList.of(), bool(false), int_(7))),
        hasToString("None"));
  }

  /** A default whose exceptions and justification all fail is empty, and so
   * is a default that contains it. */
  @Test
  void testNestedDefaults() {
    final Dcalc.Exp inner =
        defaultTerm(ImmutableList.of(), bool(false), int_(1));
    final Dcalc.Exp outer =
        defaultTerm(ImmutableList.of(inner), bool(false), int_(2));
    assertThat(eval(outer), hasToString("None"));
  }

  /** An empty consequence makes the default empty, even though its
   * justification is true. */
  @Test
  void testEmptyConsequence() {
    final Dcalc.Exp e =
        defaultTerm(ImmutableList.of(), bool(true),
            defaultTerm(ImmutableList.of(), bool(false), int_(1)));
    assertThat(eval(e), hasToString("None"));
  }

  /** An empty argument is hoisted ahead of an argument that is evaluated in
   * place. In "error_on_empty(empty) + empty", the source raises
   * NoValueProvided from its left argument, but the translation tests the
   * right argument first and is empty. */
  @Test
  void testHoistedEmptyComesFirst() {
    final Dcalc.Exp e =
        dcalc.call(ts, BuiltIn.PLUS, dcalc.errorOnEmpty(Pos.ZERO, empty()),
            empty());
    final Codes.DcalcRuntimeException x0 =
        assertThrows(Codes.DcalcRuntimeException.class,
            () -> Interpreter.dcalc(OPTION).evalOption(EvalEnvs.empty(), e));
    assertThat(x0.exn(), is(Codes.RuntimeExn.NO_VALUE_PROVIDED));
    final Lcalc.Exp e2 =
        Compiles.translateExpression(ts, Environments.empty(), e, OPTION,
            Tracers.empty());
    assertThat(Interpreter.lcalc(OPTION).eval(EvalEnvs.empty(), e2),
        hasToString("None"));
  }

  @Test
  void testConflict() {
    final Dcalc.Exp e =
        defaultTerm(ImmutableList.of(int_(1), int_(2)), bool(true), int_(3));
    checkRaises(e, Codes.RuntimeExn.CONFLICT_ERROR);
  }

  /** If exactly one exception is present, it wins over the
   * justification. */
  @Test
  void testSingleException() {
    final Dcalc.Exp e =
        defaultTerm(ImmutableList.of(empty(), int_(5)), bool(true), int_(3));
    assertThat(eval(e), hasToString("Some 5"));
  }

  @Test
  void testErrorOnEmpty() {
    final Dcalc.Exp e =
        dcalc.errorOnEmpty(Pos.ZERO,
            defaultTerm(ImmutableList.of(), bool(true), int_(9)));
    assertThat(eval(e), hasToString("Some 9"));

    final Dcalc.Exp e2 =
        dcalc.errorOnEmpty(Pos.ZERO,
            defaultTerm(ImmutableList.of(), bool(false), int_(9)));
    checkRaises(e2, Codes.RuntimeExn.NO_VALUE_PROVIDED);
  }

  /** A branch that is not taken does not make a conditional empty, and does
   * not raise. */
  @Test
  void testUntakenBranch() {
    assertThat(eval(dcalc.ifThenElse(bool(true), int_(1), empty())),
        hasToString("Some 1"));
    assertThat(eval(dcalc.ifThenElse(bool(false), int_(1), empty())),
        hasToString("None"));
    final Dcalc.Exp conflict =
        defaultTerm(ImmutableList.of(int_(1), int_(2)), bool(true), int_(3));
    assertThat(eval(dcalc.ifThenElse(bool(true), int_(4), conflict)),
        hasToString("Some 4"));
    checkRaises(dcalc.ifThenElse(bool(false), int_(4), conflict),
        Codes.RuntimeExn.CONFLICT_ERROR);
  }

  @Test
  void testOperatorWithAbsentArgument() {
    final Dcalc.Exp e =
        dcalc.call(ts, BuiltIn.PLUS,
            defaultTerm(ImmutableList.of(), bool(true), int_(1)),
            defaultTerm(ImmutableList.of(), bool(true), int_(2)));
    assertThat(eval(e), hasToString("Some 3"));

    final Dcalc.Exp e2 = dcalc.call(ts, BuiltIn.PLUS, int_(1), empty());
    assertThat(eval(e2), hasToString("None"));
  }

  @Test
  void testLet() {
    final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
    final Dcalc.Exp e =
        dcalc.let(ts, y, defaultTerm(ImmutableList.of(), bool(true), int_(2)),
            dcalc.call(ts, BuiltIn.PLUS, dcalc.id(y), int_(1)));
    assertThat(eval(e), hasToString("Some 3"));

    final Dcalc.Exp e2 =
        dcalc.let(ts, y, empty(),
            dcalc.call(ts, BuiltIn.PLUS, dcalc.id(y), int_(1)));
    assertThat(eval(e2), hasToString("None"));
  }

  /** A function whose result may be absent, bound by a "let" and then
   * called. */
  @Test
  void testFunctionWithAbsentResult() {
    final Dcalc.IdPat z = dcalc.idPat(PrimitiveType.INTEGER, "z");
    final Dcalc.Abs abs =
        dcalc.abs(ts, z,
            defaultTerm(ImmutableList.of(),
                dcalc.call(ts, BuiltIn.GT, dcalc.id(z), int_(0)),
                dcalc.id(z)));
    final Dcalc.IdPat f = dcalc.idPat(abs.type(), "f");
    assertThat(eval(dcalc.let(ts, f, abs, dcalc.apply(dcalc.id(f), int_(1)))),
        hasToString("Some 1"));
    assertThat(eval(dcalc.let(ts, f, abs, dcalc.apply(dcalc.id(f), int_(0)))),
        hasToString("None"));
  }

  @Test
  void testPresentFunction() {
    final Dcalc.IdPat z = dcalc.idPat(PrimitiveType.INTEGER, "z");
    final Dcalc.Abs abs =
        dcalc.abs(ts, z, dcalc.call(ts, BuiltIn.TIMES, dcalc.id(z), int_(2)));
    final Dcalc.IdPat f = dcalc.idPat(abs.type(), "f");
    assertThat(eval(dcalc.let(ts, f, abs, dcalc.apply(dcalc.id(f), int_(4)))),
        hasToString("Some 8"));
    assertThat(eval(dcalc.let(ts, f, abs, dcalc.apply(dcalc.id(f), empty()))),
        hasToString("None"));
  }

  @Test
  void testThunk() {
    final Dcalc.Abs t0 =
        dcalc.thunk(Pos.ZERO, ts,
            defaultTerm(ImmutableList.of(), bool(false), int_(1)));
    final Dcalc.IdPat t = dcalc.idPat(t0.type(), "t");
    assertThat(eval(dcalc.let(ts, t, t0, dcalc.force(Pos.ZERO, dcalc.id(t)))),
        hasToString("None"));

    final Dcalc.Abs t1 = dcalc.thunk(Pos.ZERO, ts, int_(6));
    assertThat(eval(dcalc.let(ts, t, t1, dcalc.force(Pos.ZERO, dcalc.id(t)))),
        hasToString("Some 6"));
  }

  @Test
  void testAssert() {
    final Dcalc.Exp ok =
        dcalc.assertion(Pos.ZERO,
            defaultTerm(ImmutableList.of(), bool(true), bool(true)));
    assertThat(eval(ok), is(Variant.some(OPTION, Unit.INSTANCE)));

    final Dcalc.Exp fails =
        dcalc.assertion(Pos.ZERO,
            defaultTerm(ImmutableList.of(), bool(true), bool(false)));
    checkRaises(fails, Codes.RuntimeExn.ASSERTION_FAILED);

    final Dcalc.Exp noValue =
        dcalc.assertion(Pos.ZERO, dcalc.emptyLiteral(PrimitiveType.BOOL));
    checkRaises(noValue, Codes.RuntimeExn.NO_VALUE_PROVIDED);
  }

  /** A match whose case may be absent. */
  @Test
  void testMatch() {
    ts.enumType("E",
        ImmutableMap.of("A", PrimitiveType.INTEGER, "B", PrimitiveType.UNIT));
    final Dcalc.IdPat n = dcalc.idPat(PrimitiveType.INTEGER, "n");
    final Dcalc.IdPat u = dcalc.idPat(PrimitiveType.UNIT, "u");
    final ImmutableMap<String, Dcalc.Abs> cases =
        ImmutableMap.of("A",
            dcalc.abs(ts, n,
                defaultTerm(ImmutableList.of(),
                    dcalc.call(ts, BuiltIn.GT, dcalc.id(n), int_(0)),
                    dcalc.id(n))),
            "B", dcalc.abs(ts, u, int_(0)));
    final Dcalc.Exp a1 = dcalc.inj(Pos.ZERO, ts, "E", "A", int_(1));
    final Dcalc.Exp a0 = dcalc.inj(Pos.ZERO, ts, "E", "A", int_(0));
    final Dcalc.Exp b = dcalc.inj(Pos.ZERO, ts, "E", "B", dcalc.unitLiteral());
    assertThat(eval(dcalc.match(Pos.ZERO, ts, a1, cases)),
        hasToString("Some 1"));
    assertThat(eval(dcalc.match(Pos.ZERO, ts, a0, cases)),
        hasToString("None"));
    assertThat(eval(dcalc.match(Pos.ZERO, ts, b, cases)),
        hasToString("Some 0"));
  }

  @Test
  void testStruct() {
    ts.structType("S",
        ImmutableMap.of("a", PrimitiveType.INTEGER, "b", PrimitiveType.INTEGER));
    final Dcalc.Exp e =
        dcalc.struct(Pos.ZERO, ts, "S",
            ImmutableMap.of("a",
                defaultTerm(ImmutableList.of(), bool(true), int_(1)),
                "b", int_(2)));
    assertThat(eval(e),
        is(
            Variant.some(OPTION,
                StructValue.of("S",
                    ImmutableMap.<String, Object>of("a", BigInteger.ONE,
                        "b", BigInteger.valueOf(2))))));

    final Dcalc.Exp e2 =
        dcalc.structAccess(Pos.ZERO, ts, e, "a");
    assertThat(eval(e2), hasToString("Some 1"));
  }

  @Test
  void testDivisionByZero() {
    final Dcalc.Exp e = dcalc.call(ts, BuiltIn.DIVIDE, int_(1), int_(0));
    checkRaises(e, Codes.RuntimeExn.DIVISION_BY_ZERO);
  }
}

// End EquivalenceTest.java
