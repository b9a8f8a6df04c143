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
package net.hydromatic.dcalc.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.compile.BuiltIn;
import net.hydromatic.dcalc.eval.Codes;
import net.hydromatic.dcalc.eval.Unit;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.OptionType;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.TupleType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;

/** Builds nodes of the {@link Lcalc lambda calculus with options}. */
public enum LcalcBuilder {
  /** The singleton instance of the lambda calculus builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  lcalc;

  /** Creates a binding occurrence of a variable. */
  public Lcalc.IdPat idPat(String name, int i, String namespace, Type type) {
    return new Lcalc.IdPat(Pos.ZERO, name, i, namespace, type);
  }

  /** Creates a reference to a variable. */
  public Lcalc.Id id(Pos pos, Lcalc.IdPat idPat) {
    return new Lcalc.Id(pos, idPat);
  }

  /** Creates a literal. */
  public Lcalc.Literal literal(Pos pos, Op op, Object value) {
    return new Lcalc.Literal(pos, op, DcalcBuilder.literalType(op), value);
  }

  /** Creates the {@code unit} literal. */
  public Lcalc.Literal unitLiteral(Pos pos) {
    return literal(pos, Op.UNIT_LITERAL, Unit.INSTANCE);
  }

  /** Creates a reference to a built-in operator. */
  public Lcalc.OpRef opRef(Pos pos, Type type, BuiltIn builtIn) {
    return new Lcalc.OpRef(pos, type, builtIn);
  }

  /** Creates an abstraction. */
  public Lcalc.Abs abs(Pos pos, TypeSystem typeSystem,
      List<Lcalc.IdPat> params, Lcalc.Exp body) {
    final FnType type =
        typeSystem.fnType(
            ImmutableList.copyOf(params.stream().map(p -> p.type).iterator()),
            body.type);
    return new Lcalc.Abs(pos, type, ImmutableList.copyOf(params), body);
  }

  /** Creates an application. */
  public Lcalc.Apply apply(Pos pos, Type type, Lcalc.Exp fn,
      List<Lcalc.Exp> args) {
    return new Lcalc.Apply(pos, type, fn, ImmutableList.copyOf(args));
  }

  /** Creates a call to a built-in operator. */
  public Lcalc.Apply call(Pos pos, TypeSystem typeSystem, BuiltIn builtIn,
      List<Lcalc.Exp> args) {
    final FnType fnType =
        builtIn.fnType(typeSystem,
            ImmutableList.copyOf(args.stream().map(a -> a.type).iterator()));
    return apply(pos, fnType.resultType, opRef(pos, fnType, builtIn), args);
  }

  /** Creates a let. */
  public Lcalc.Let let(Pos pos, Lcalc.IdPat pat, Lcalc.Exp arg,
      Lcalc.Exp body) {
    return new Lcalc.Let(pos, pat, arg, body);
  }

  /** Creates a struct value. */
  public Lcalc.Struct struct(Pos pos, Type type, String name,
      Map<String, Lcalc.Exp> fields) {
    return new Lcalc.Struct(pos, type, name, ImmutableMap.copyOf(fields));
  }

  /** Creates an access to a field of a struct. */
  public Lcalc.StructAccess structAccess(Pos pos, Type type, Lcalc.Exp exp,
      String name, String field) {
    return new Lcalc.StructAccess(pos, type, exp, name, field);
  }

  /** Creates a tuple. */
  public Lcalc.Tuple tuple(Pos pos, TypeSystem typeSystem,
      List<Lcalc.Exp> args) {
    final TupleType type =
        typeSystem.tupleType(
            ImmutableList.copyOf(args.stream().map(a -> a.type).iterator()));
    return new Lcalc.Tuple(pos, type, ImmutableList.copyOf(args));
  }

  /** Creates an access to a component of a tuple. */
  public Lcalc.TupleAccess tupleAccess(Pos pos, Lcalc.Exp exp, int index) {
    checkArgument(exp.type instanceof TupleType, "not a tuple: %s", exp);
    final Type type = ((TupleType) exp.type).argTypes.get(index);
    return new Lcalc.TupleAccess(pos, type, exp, index);
  }

  /** Creates an injection into an enumeration. */
  public Lcalc.Inj inj(Pos pos, Type type, String name, String constructor,
      Lcalc.Exp exp) {
    return new Lcalc.Inj(pos, type, name, constructor, exp);
  }

  /** Creates a match on an enumeration. */
  public Lcalc.Match match(Pos pos, Type type, Lcalc.Exp exp, String name,
      Map<String, Lcalc.Abs> cases) {
    return new Lcalc.Match(pos, type, exp, name, ImmutableMap.copyOf(cases));
  }

  /** Creates an array. */
  public Lcalc.Array array(Pos pos, Type type, List<Lcalc.Exp> args) {
    return new Lcalc.Array(pos, type, ImmutableList.copyOf(args));
  }

  /** Creates a conditional. */
  public Lcalc.If ifThenElse(Pos pos, Lcalc.Exp condition, Lcalc.Exp ifTrue,
      Lcalc.Exp ifFalse) {
    return new Lcalc.If(pos, ifTrue.type, condition, ifTrue, ifFalse);
  }

  /** Creates an assertion. */
  public Lcalc.Assert assertion(Pos pos, Lcalc.Exp exp) {
    return new Lcalc.Assert(pos, PrimitiveType.UNIT, exp);
  }

  /** Creates an expression that raises a runtime error. */
  public Lcalc.Raise raise(Pos pos, Type type, Codes.RuntimeExn exn) {
    return new Lcalc.Raise(pos, type, exn);
  }

  // options

  /** Creates "Some e". */
  public Lcalc.Inj some(Pos pos, TypeSystem typeSystem, String optionEnum,
      Lcalc.Exp exp) {
    return inj(pos, typeSystem.optionType(exp.type), optionEnum,
        TypeSystem.SOME, exp);
  }

  /** Creates "None". */
  public Lcalc.Inj none(Pos pos, String optionEnum, OptionType type) {
    return inj(pos, type, optionEnum, TypeSystem.NONE, unitLiteral(pos));
  }

  /** Creates "match e with None _ -> ifNone | Some x -> ifSome". */
  public Lcalc.Match matchOpt(Pos pos, TypeSystem typeSystem,
      String optionEnum, Lcalc.Exp exp, Lcalc.Exp ifNone, Lcalc.IdPat x,
      Lcalc.Exp ifSome) {
    checkArgument(exp.type instanceof OptionType, "not an option: %s", exp);
    final Lcalc.IdPat unit = idPat("_", 0, "", PrimitiveType.UNIT);
    return match(pos, ifSome.type, exp, optionEnum,
        ImmutableMap.of(
            TypeSystem.NONE,
            abs(pos, typeSystem, ImmutableList.of(unit), ifNone),
            TypeSystem.SOME,
            abs(pos, typeSystem, ImmutableList.of(x), ifSome)));
  }

  /** Creates a call to the default-resolution primitive,
   * "handle_default_opt [|e1; ...; en|] just cons". */
  public Lcalc.Apply handleDefaultOpt(Pos pos, TypeSystem typeSystem,
      List<Lcalc.Exp> excepts, Lcalc.Exp just, Lcalc.Exp cons) {
    final Lcalc.Array array =
        array(pos, typeSystem.arrayType(cons.type), excepts);
    return call(pos, typeSystem, BuiltIn.HANDLE_DEFAULT_OPT,
        ImmutableList.of(array, just, cons));
  }

  // program

  /** Creates a binding in the body of a scope. */
  public Lcalc.ScopeLet scopeLet(Pos pos, ScopeLetKind kind, Lcalc.IdPat pat,
      Lcalc.Exp exp, Lcalc.ScopeLets next) {
    return new Lcalc.ScopeLet(pos, kind, pat, exp, next);
  }

  /** Creates the result of the body of a scope. */
  public Lcalc.Result result(Lcalc.Exp exp) {
    return new Lcalc.Result(exp);
  }

  /** Creates the body of a scope. */
  public Lcalc.ScopeBody scopeBody(Pos pos, String inputStruct,
      String outputStruct, Lcalc.IdPat inputPat, Lcalc.ScopeLets lets) {
    return new Lcalc.ScopeBody(pos, inputStruct, outputStruct, inputPat, lets);
  }

  /** Creates a top-level definition. */
  public Lcalc.TopDef topDef(Pos pos, Lcalc.IdPat pat, Lcalc.Exp exp) {
    return new Lcalc.TopDef(pos, pat, exp);
  }

  /** Creates the definition of a scope. */
  public Lcalc.ScopeDef scopeDef(Pos pos, Lcalc.IdPat pat,
      Lcalc.ScopeBody body) {
    return new Lcalc.ScopeDef(pos, pat, body);
  }

  /** Creates a program. */
  public Lcalc.Program program(TypeSystem typeSystem,
      List<? extends Lcalc.CodeItem> items) {
    return new Lcalc.Program(Pos.ZERO, typeSystem,
        ImmutableList.copyOf(items));
  }
}

// End LcalcBuilder.java
