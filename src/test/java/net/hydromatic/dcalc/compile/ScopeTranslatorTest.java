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
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Pos;
import net.hydromatic.dcalc.ast.ScopeLetKind;
import net.hydromatic.dcalc.eval.Applicable;
import net.hydromatic.dcalc.eval.Codes;
import net.hydromatic.dcalc.eval.DcalcInterpreter;
import net.hydromatic.dcalc.eval.EvalEnv;
import net.hydromatic.dcalc.eval.EvalEnvs;
import net.hydromatic.dcalc.eval.Interpreter;
import net.hydromatic.dcalc.eval.StructValue;
import net.hydromatic.dcalc.eval.Variant;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.StructType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopeTranslator}, and for translating whole programs
 * via {@link Compiles}. */
public class ScopeTranslatorTest {
  private static final String OPTION = "Option";

  /** Position of the definition of "v" in scope "C". */
  private static final Pos V_POS = Pos.of("tax.catala_en", 12, 5, 12, 31);

  /** Translates a program with the default properties. */
  private static Lcalc.Program translate(Dcalc.Program program,
      Tracer tracer) {
    return Compiles.translateProgram(program, new HashMap<>(), tracer);
  }

  /** Calls a scope of a program in the default calculus. */
  private static StructValue callDcalc(Dcalc.Program program, String scope,
      StructValue input) {
    final EvalEnv env =
        Interpreter.dcalc(OPTION).evalProgram(EvalEnvs.empty(), program);
    final Object fn = env.getOpt(program.item(scope).pat);
    assertThat(fn, notNullValue());
    return (StructValue) ((Applicable) fn).apply(ImmutableList.of(input));
  }

  /** Calls a scope of a translated program. */
  private static StructValue callLcalc(Lcalc.Program program, String scope,
      StructValue input) {
    final EvalEnv env =
        Interpreter.lcalc(OPTION).evalProgram(EvalEnvs.empty(), program);
    final Object fn = env.getOpt(program.item(scope).pat);
    assertThat(fn, notNullValue());
    return (StructValue) ((Applicable) fn).apply(ImmutableList.of(input));
  }

  private static StructValue struct(String name, Map<String, Object> fields) {
    return StructValue.of(name, fields);
  }

  @Test
  void testScope() {
    final Fixture f = new Fixture();
    final Lcalc.Program program2 = translate(f.program, Tracers.empty());

    // "x" is absent; "y + base" is the value of "z"
    final Applicable noX = args -> {
      throw DcalcInterpreter.EmptyException.INSTANCE;
    };
    assertThat(
        callDcalc(f.program, "A",
            struct("A_in", ImmutableMap.of("x", noX, "y", BigInteger.TEN))),
        is(f.aOut(11)));
    assertThat(
        callLcalc(program2, "A",
            struct("A_in",
                ImmutableMap.of("x", Variant.none(OPTION),
                    "y", BigInteger.TEN))),
        is(f.aOut(11)));

    // "x" is present, and is an exception to the default
    final Applicable x3 = args -> BigInteger.valueOf(3);
    assertThat(
        callDcalc(f.program, "A",
            struct("A_in", ImmutableMap.of("x", x3, "y", BigInteger.TEN))),
        is(f.aOut(3)));
    assertThat(
        callLcalc(program2, "A",
            struct("A_in",
                ImmutableMap.of("x", Variant.some(OPTION, BigInteger.valueOf(3)),
                    "y", BigInteger.TEN))),
        is(f.aOut(3)));
  }

  /** Scope "B" calls scope "A", giving a value to its context variable. */
  @Test
  void testSubscopeCall() {
    final Fixture f = new Fixture();
    final Lcalc.Program program2 = translate(f.program, Tracers.empty());
    final StructValue bIn = struct("B_in", ImmutableMap.of());
    final StructValue expected =
        struct("B_out", ImmutableMap.of("w", BigInteger.valueOf(5)));
    assertThat(callDcalc(f.program, "B", bIn), is(expected));
    assertThat(callLcalc(program2, "B", bIn), is(expected));
  }

  /** A scope variable whose definition is empty raises
   * {@code NoValueProvided} at the position of the definition. */
  @Test
  void testNoValueProvided() {
    final Fixture f = new Fixture();
    final Lcalc.Program program2 = translate(f.program, Tracers.empty());
    final StructValue cIn = struct("C_in", ImmutableMap.of());

    final Codes.DcalcRuntimeException e0 =
        assertThrows(Codes.DcalcRuntimeException.class,
            () -> callDcalc(f.program, "C", cIn));
    assertThat(e0.exn(), is(Codes.RuntimeExn.NO_VALUE_PROVIDED));
    assertThat(e0.pos(), is(V_POS));

    final Codes.DcalcRuntimeException e1 =
        assertThrows(Codes.DcalcRuntimeException.class,
            () -> callLcalc(program2, "C", cIn));
    assertThat(e1.exn(), is(Codes.RuntimeExn.NO_VALUE_PROVIDED));
    assertThat(e1.pos(), is(V_POS));
  }

  /** The translated program declares the option enumeration, and the context
   * variables of input structs have option types. */
  @Test
  void testDeclarations() {
    final Fixture f = new Fixture();
    final Lcalc.Program program2 = translate(f.program, Tracers.empty());
    final TypeSystem ts2 = program2.typeSystem;
    assertThat(ts2.hasEnum(OPTION), is(true));
    assertThat(ts2.fieldType("A_in", "x"), hasToString("integer option"));
    assertThat(ts2.fieldType("A_in", "y"), hasToString("integer"));
    assertThat(f.ts.fieldType("A_in", "x"), hasToString("unit -> integer"));
    assertThat(f.ts.hasEnum(OPTION), is(false));
  }

  @Test
  void testOptionEnumAlreadyDeclared() {
    final Fixture f = new Fixture();
    f.ts.enumType(OPTION,
        ImmutableMap.of("Nothing", PrimitiveType.UNIT,
            "Just", PrimitiveType.INTEGER));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> translate(f.program, Tracers.empty()));
    assertThat(e.getMessage(),
        is("Internal Error: enum Option is already declared"));
  }

  /** Each declaration names its variables in its own namespace. */
  @Test
  void testNamespaces() {
    final Fixture f = new Fixture();
    final Lcalc.Program program2 = translate(f.program, Tracers.empty());
    final Lcalc.ScopeDef a = (Lcalc.ScopeDef) program2.item("A");
    final Lcalc.ScopeDef b = (Lcalc.ScopeDef) program2.item("B");
    assertThat(a.body.inputPat.namespace, is("A"));
    assertThat(b.body.inputPat.namespace, is("B"));
    assertThat(a.body.lets, instanceOf(Lcalc.ScopeLet.class));
    final Lcalc.ScopeLet let = (Lcalc.ScopeLet) a.body.lets;
    assertThat(let.pat, hasToString("x_1"));
    assertThat(let.pat.namespace, is("A"));
    assertThat(let.kind, is(ScopeLetKind.DESTRUCTURING_INPUT_STRUCT));
    assertThat(a.pat.namespace, is(""));
  }

  @Test
  void testTracer() {
    final Fixture f = new Fixture();
    final List<String> translated = new ArrayList<>();
    final List<Lcalc.IdPat> hoisted = new ArrayList<>();
    final List<CompileException> exceptions = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer =
        Tracers.withOnTranslation(tracer, item -> translated.add(item.pat.name));
    tracer = Tracers.withOnHoist(tracer, (x, e) -> hoisted.add(x));
    tracer = Tracers.withOnCompileException(tracer, exceptions::add);
    translate(f.program, tracer);
    assertThat(translated, hasToString("[base, A, B, C]"));
    assertThat(hoisted.isEmpty(), is(false));
    assertThat(exceptions.size(), is(1));
    assertThat(exceptions.get(0), nullValue());
  }

  /** A subscope variable must be defined by a thunk or by error-on-empty. */
  @Test
  void testBadSubscopeDefinition() {
    final TypeSystem ts = new TypeSystem();
    ts.structType("D_in", ImmutableMap.of());
    ts.structType("D_out", ImmutableMap.of("d", PrimitiveType.INTEGER));
    final Dcalc.IdPat dIn = dcalc.idPat(ts.lookupStruct("D_in"), "d_in");
    final Dcalc.IdPat d = dcalc.idPat(PrimitiveType.INTEGER, "d");
    final Dcalc.ScopeLets lets =
        dcalc.scopeLet(Pos.ZERO, ScopeLetKind.SUBSCOPE_VAR_DEFINITION, d,
            dcalc.intLiteral(1),
            dcalc.result(
                dcalc.struct(Pos.ZERO, ts, "D_out",
                    ImmutableMap.of("d", dcalc.id(d)))));
    final Dcalc.IdPat scope =
        dcalc.idPat(ts.fnType(ts.lookupStruct("D_in"),
            ts.lookupStruct("D_out")), "D");
    final Dcalc.Program program =
        dcalc.program(ts,
            ImmutableList.of(
                dcalc.scopeDef(Pos.ZERO, scope,
                    dcalc.scopeBody(Pos.ZERO, "D_in", "D_out", dIn, lets))));
    final List<CompileException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), exceptions::add);
    final CompileException e =
        assertThrows(CompileException.class, () -> translate(program, tracer));
    assertThat(e.getMessage(),
        containsString("found a subscope variable definition that does not "
            + "satisfy the invariants: 1"));
    assertThat(exceptions.size(), is(1));
    assertThat(exceptions.get(0), is(e));
  }

  /** Program with a top-level definition and three scopes.
   *
   * <pre>
   * let base = 1;
   * let scope A = fun (a_in: A_in): A_out ->
   *   let x = a_in.x in
   *   let y = a_in.y in
   *   let z = error_empty &lt;x () | true :- y + base&gt; in
   *   A_out {z = z};
   * let scope B = fun (b_in: B_in): B_out ->
   *   let a_x = fun () -&gt; &lt;true :- 5&gt; in
   *   let a_y = error_empty &lt;true :- 2&gt; in
   *   let a_result = A (A_in {x = a_x; y = a_y}) in
   *   let w = a_result.z in
   *   B_out {w = w};
   * let scope C = fun (c_in: C_in): C_out ->
   *   let v = &lt;false :- 1&gt; in
   *   C_out {v = v}
   * </pre> */
  private static class Fixture {
    final TypeSystem ts = new TypeSystem();
    final Dcalc.Program program;

    Fixture() {
      final Type thunkInt = ts.thunkType(PrimitiveType.INTEGER);
      final StructType aIn =
          ts.structType("A_in",
              ImmutableMap.of("x", thunkInt, "y", PrimitiveType.INTEGER));
      final StructType aOut =
          ts.structType("A_out", ImmutableMap.of("z", PrimitiveType.INTEGER));
      final StructType bIn = ts.structType("B_in", ImmutableMap.of());
      final StructType bOut =
          ts.structType("B_out", ImmutableMap.of("w", PrimitiveType.INTEGER));
      final StructType cIn = ts.structType("C_in", ImmutableMap.of());
      final StructType cOut =
          ts.structType("C_out", ImmutableMap.of("v", PrimitiveType.INTEGER));

      final Dcalc.IdPat base = dcalc.idPat(PrimitiveType.INTEGER, "base");
      final Dcalc.TopDef baseDef =
          dcalc.topDef(Pos.ZERO, base, dcalc.intLiteral(1));

      // Scope A
      final Dcalc.IdPat a = dcalc.idPat(ts.fnType(aIn, aOut), "A");
      final Dcalc.IdPat aInPat = dcalc.idPat(aIn, "a_in");
      final Dcalc.IdPat x = dcalc.idPat(thunkInt, "x");
      final Dcalc.IdPat y = dcalc.idPat(PrimitiveType.INTEGER, "y");
      final Dcalc.IdPat z = dcalc.idPat(PrimitiveType.INTEGER, "z");
      final Dcalc.Exp zDef =
          dcalc.errorOnEmpty(Pos.ZERO,
              dcalc.defaultTerm(
                  ImmutableList.of(dcalc.force(Pos.ZERO, dcalc.id(x))),
                  dcalc.boolLiteral(true),
                  dcalc.call(ts, BuiltIn.PLUS, dcalc.id(y), dcalc.id(base))));
      final Dcalc.ScopeLets aLets =
          dcalc.scopeLet(Pos.ZERO, ScopeLetKind.DESTRUCTURING_INPUT_STRUCT, x,
              dcalc.structAccess(Pos.ZERO, ts, dcalc.id(aInPat), "x"),
              dcalc.scopeLet(Pos.ZERO,
                  ScopeLetKind.DESTRUCTURING_INPUT_STRUCT, y,
                  dcalc.structAccess(Pos.ZERO, ts, dcalc.id(aInPat), "y"),
                  dcalc.scopeLet(Pos.ZERO,
                      ScopeLetKind.SCOPE_VAR_DEFINITION, z, zDef,
                      dcalc.result(
                          dcalc.struct(Pos.ZERO, ts, "A_out",
                              ImmutableMap.of("z", dcalc.id(z)))))));
      final Dcalc.ScopeDef aDef =
          dcalc.scopeDef(Pos.ZERO, a,
              dcalc.scopeBody(Pos.ZERO, "A_in", "A_out", aInPat, aLets));

      // Scope B
      final Dcalc.IdPat b = dcalc.idPat(ts.fnType(bIn, bOut), "B");
      final Dcalc.IdPat bInPat = dcalc.idPat(bIn, "b_in");
      final Dcalc.IdPat aX = dcalc.idPat(thunkInt, "a_x");
      final Dcalc.IdPat aY = dcalc.idPat(PrimitiveType.INTEGER, "a_y");
      final Dcalc.IdPat aResult = dcalc.idPat(aOut, "a_result");
      final Dcalc.IdPat w = dcalc.idPat(PrimitiveType.INTEGER, "w");
      final Dcalc.Exp aXDef =
          dcalc.thunk(Pos.ZERO, ts,
              dcalc.defaultTerm(ImmutableList.of(), dcalc.boolLiteral(true),
                  dcalc.intLiteral(5)));
      final Dcalc.Exp aYDef =
          dcalc.errorOnEmpty(Pos.ZERO,
              dcalc.defaultTerm(ImmutableList.of(), dcalc.boolLiteral(true),
                  dcalc.intLiteral(2)));
      final Dcalc.Exp call =
          dcalc.apply(dcalc.id(a),
              dcalc.struct(Pos.ZERO, ts, "A_in",
                  ImmutableMap.of("x", dcalc.id(aX), "y", dcalc.id(aY))));
      final Dcalc.ScopeLets bLets =
          dcalc.scopeLet(Pos.ZERO, ScopeLetKind.SUBSCOPE_VAR_DEFINITION, aX,
              aXDef,
              dcalc.scopeLet(Pos.ZERO, ScopeLetKind.SUBSCOPE_VAR_DEFINITION,
                  aY, aYDef,
                  dcalc.scopeLet(Pos.ZERO, ScopeLetKind.CALLING_SUBSCOPE,
                      aResult, call,
                      dcalc.scopeLet(Pos.ZERO,
                          ScopeLetKind.DESTRUCTURING_SUBSCOPE_RESULTS, w,
                          dcalc.structAccess(Pos.ZERO, ts, dcalc.id(aResult),
                              "z"),
                          dcalc.result(
                              dcalc.struct(Pos.ZERO, ts, "B_out",
                                  ImmutableMap.of("w", dcalc.id(w))))))));
      final Dcalc.ScopeDef bDef =
          dcalc.scopeDef(Pos.ZERO, b,
              dcalc.scopeBody(Pos.ZERO, "B_in", "B_out", bInPat, bLets));

      // Scope C
      final Dcalc.IdPat c = dcalc.idPat(ts.fnType(cIn, cOut), "C");
      final Dcalc.IdPat cInPat = dcalc.idPat(cIn, "c_in");
      final Dcalc.IdPat v = dcalc.idPat(PrimitiveType.INTEGER, "v");
      final Dcalc.ScopeLets cLets =
          dcalc.scopeLet(V_POS, ScopeLetKind.SCOPE_VAR_DEFINITION, v,
              dcalc.defaultTerm(V_POS, ImmutableList.of(),
                  dcalc.boolLiteral(false), dcalc.intLiteral(1)),
              dcalc.result(
                  dcalc.struct(Pos.ZERO, ts, "C_out",
                      ImmutableMap.of("v", dcalc.id(v)))));
      final Dcalc.ScopeDef cDef =
          dcalc.scopeDef(Pos.ZERO, c,
              dcalc.scopeBody(Pos.ZERO, "C_in", "C_out", cInPat, cLets));

      program =
          dcalc.program(ts, ImmutableList.of(baseDef, aDef, bDef, cDef));
    }

    StructValue aOut(long z) {
      return StructValue.of("A_out",
          ImmutableMap.of("z", BigInteger.valueOf(z)));
    }
  }
}

// End ScopeTranslatorTest.java
