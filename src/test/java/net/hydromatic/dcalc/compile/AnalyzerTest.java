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
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link Analyzer}. */
public class AnalyzerTest {
  private final TypeSystem ts = new TypeSystem();

  private static Dcalc.Exp analyze(Dcalc.Exp e) {
    return Analyzer.analyze(Environments.empty(), e);
  }

  @Test

  void testLiteralIsPresent() {
    final Dcalc.Exp e = analyze(dcalc.intLiteral(1));
    assertThat(Analyzer.mayBeAbsent(e), is(false));
    assertThat(Analyzer.mark(e).unpureReturn, nullValue());
  }

  @Test

  void testEmptyMayBeAbsent() {
    final Dcalc.Exp e = analyze(dcalc.emptyLiteral(PrimitiveType.INTEGER));
    assertThat(Analyzer.mayBeAbsent(e), is(true));
  }

  /** A default term may be absent even if its justification is the literal
   * {@code true}; the analysis does not look at values. */
  @Test
  void testDefaultMayBeAbsent() {
    final Dcalc.Exp e =
        analyze(
            dcalc.defaultTerm(ImmutableList.of(), dcalc.boolLiteral(true),
                dcalc.intLiteral(1)));
    assertThat(Analyzer.mayBeAbsent(e), is(true));
  }

  @Test

  void testErrorOnEmptyIsPresent() {
    final Dcalc.Exp e =
        analyze(
            dcalc.errorOnEmpty(Pos.ZERO,
                dcalc.defaultTerm(ImmutableList.of(),
                    dcalc.boolLiteral(true), dcalc.intLiteral(1))));
    assertThat(Analyzer.mayBeAbsent(e), is(false));
  }

  @Test

  void testOperatorApplication() {
    final Dcalc.Exp present =
        analyze(
            dcalc.call(ts, BuiltIn.PLUS, dcalc.intLiteral(1),
                dcalc.intLiteral(2)));
    assertThat(Analyzer.mayBeAbsent(present), is(false));

    final Dcalc.Exp absent =
        analyze(
            dcalc.call(ts, BuiltIn.PLUS, dcalc.intLiteral(1),
                dcalc.emptyLiteral(PrimitiveType.INTEGER)));
    assertThat(Analyzer.mayBeAbsent(absent), is(true));
  }

  @Test

  void testVariable() {
    final Dcalc.IdPat x = dcalc.idPat(PrimitiveType.INTEGER, "x");
    final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
    final Environment env =
        Environments.empty()
            .bind(Binding.of(x, true, null))
            .bind(Binding.of(y, false, null));
    assertThat(Analyzer.mayBeAbsent(Analyzer.analyze(env, dcalc.id(x))),
        is(false));
    assertThat(Analyzer.mayBeAbsent(Analyzer.analyze(env, dcalc.id(y))),
        is(true));
  }

  @Test

  void testUnboundVariable() {
    final Dcalc.IdPat x = dcalc.idPat(PrimitiveType.INTEGER, "x");
    final CompileException e =
        assertThrows(CompileException.class, () -> analyze(dcalc.id(x)));
    assertThat(e.getMessage(),
        is("Internal Error: variable x was not found in the current "
            + "environment"));
  }

  /** A function whose body may be absent is a value, but calling it may
   * give an absent result. */
  @Test
  void testAbsentReturn() {
    final Dcalc.IdPat z = dcalc.idPat(PrimitiveType.INTEGER, "z");
    final Dcalc.Abs abs =
        dcalc.abs(ts, z,
            dcalc.defaultTerm(ImmutableList.of(), dcalc.boolLiteral(true),
                dcalc.id(z)));
    final Dcalc.IdPat f = dcalc.idPat(abs.type(), "f");
    final Dcalc.Exp e =
        analyze(dcalc.let(ts, f, abs, dcalc.apply(dcalc.id(f),
            dcalc.intLiteral(1))));
    assertThat(Analyzer.mayBeAbsent(e), is(true));

    final Dcalc.Apply let = (Dcalc.Apply) e;
    assertThat(Analyzer.mayBeAbsent(let.args.get(0)), is(false));
    assertThat(Analyzer.returnMayBeAbsent(let.args.get(0)), is(true));
  }

  /** A variable bound to a function whose result may be absent cannot be
   * passed as an argument; the receiving parameter would assume a present
   * result. */
  @Test
  void testAbsentReturnPassedAsValue() {
    final Dcalc.IdPat z = dcalc.idPat(PrimitiveType.INTEGER, "z");
    final Dcalc.Abs abs =
        dcalc.abs(ts, z,
            dcalc.defaultTerm(ImmutableList.of(),
                dcalc.call(ts, BuiltIn.GT, dcalc.id(z), dcalc.intLiteral(0)),
                dcalc.id(z)));
    final Dcalc.IdPat f = dcalc.idPat(abs.type(), "f");
    final Dcalc.IdPat h = dcalc.idPat(abs.type(), "h");
    final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
    final Dcalc.Abs g =
        dcalc.abs(Pos.ZERO, ts, ImmutableList.of(h, y),
            dcalc.apply(dcalc.id(h), dcalc.id(y)));
    final Dcalc.Exp e =
        dcalc.let(ts, f, abs,
            dcalc.apply(g, dcalc.id(f), dcalc.intLiteral(2)));
    final CompileException x =
        assertThrows(CompileException.class, () -> analyze(e));
    assertThat(x.getMessage(),
        containsString("Internal Error: function whose result may be absent "
            + "is used as a value"));

    // Applying the same variable directly is fine
    final Dcalc.Exp e2 =
        analyze(dcalc.let(ts, f, abs,
            dcalc.apply(dcalc.id(f), dcalc.intLiteral(2))));
    assertThat(Analyzer.mayBeAbsent(e2), is(true));
  }

  /** Forcing a thunk variable may give an absent value, whatever the body
   * of the thunk. */
  @Test
  void testThunk() {
    final Dcalc.Abs thunk =
        dcalc.thunk(Pos.ZERO, ts, dcalc.intLiteral(1));
    final Dcalc.IdPat t = dcalc.idPat(thunk.type(), "t");
    final Dcalc.Exp e =
        analyze(
            dcalc.let(ts, t, thunk,
                dcalc.force(Pos.ZERO, dcalc.id(t))));
    assertThat(Analyzer.mayBeAbsent(e), is(true));
  }

  @Test

  void testUnexpectedApplication() {
    final Dcalc.IdPat z = dcalc.idPat(PrimitiveType.INTEGER, "z");
    final Dcalc.Abs f = dcalc.abs(ts, z, dcalc.id(z));
    final Dcalc.Exp fn = dcalc.ifThenElse(dcalc.boolLiteral(true), f, f);
    final Dcalc.Exp e = dcalc.apply(fn, dcalc.intLiteral(1));
    final CompileException x =
        assertThrows(CompileException.class, () -> analyze(e));
    assertThat(x.getMessage(),
        containsString("unexpected operator shape in application"));
    assertThat(x.isWarning(), is(false));
  }

  @Test

  void testUnanalyzed() {
    final CompileException x =
        assertThrows(CompileException.class,
            () -> Analyzer.mark(dcalc.intLiteral(1)));
    assertThat(x.getMessage(),
        is("Internal Error: expression has not been analyzed: 1"));
  }
}

// End AnalyzerTest.java
