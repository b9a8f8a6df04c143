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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.compile.BuiltIn;
import net.hydromatic.dcalc.eval.Unit;
import net.hydromatic.dcalc.type.EnumType;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.StructType;
import net.hydromatic.dcalc.type.TupleType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;

/** Builds nodes of the {@link Dcalc default calculus}. */
public enum DcalcBuilder {
  /** The singleton instance of the default calculus builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  dcalc;

  /** Returns the type of a literal with a given op. */
  static Type literalType(Op op) {
    switch (op) {
      case BOOL_LITERAL:
        return PrimitiveType.BOOL;
      case INTEGER_LITERAL:
        return PrimitiveType.INTEGER;
      case DECIMAL_LITERAL:
        return PrimitiveType.DECIMAL;
      case MONEY_LITERAL:
        return PrimitiveType.MONEY;
      case DATE_LITERAL:
        return PrimitiveType.DATE;
      case DURATION_LITERAL:
        return PrimitiveType.DURATION;
      case UNIT_LITERAL:
        return PrimitiveType.UNIT;
      default:
        throw new IllegalArgumentException("not a typed literal: " + op);
    }
  }

  /** Creates a binding occurrence of a variable. */
  public Dcalc.IdPat idPat(Type type, String name, int i) {
    return new Dcalc.IdPat(Pos.ZERO, name, i, type);
  }

  /** Creates a binding occurrence of a variable with ordinal 0. */
  public Dcalc.IdPat idPat(Type type, String name) {
    return idPat(type, name, 0);
  }

  /** Creates a reference to a variable. */
  public Dcalc.Id id(Pos pos, Dcalc.IdPat idPat) {
    return new Dcalc.Id(Mark.of(pos, idPat.type), idPat);
  }

  /** Creates a reference to a variable. */
  public Dcalc.Id id(Dcalc.IdPat idPat) {
    return id(Pos.ZERO, idPat);
  }

  /** Creates a literal of a given kind. */
  public Dcalc.Literal literal(Pos pos, Op op, Object value) {
    return new Dcalc.Literal(op, Mark.of(pos, literalType(op)), value);
  }

  /** Creates a {@code bool} literal. */
  public Dcalc.Literal boolLiteral(boolean b) {
    return literal(Pos.ZERO, Op.BOOL_LITERAL, b);
  }

  /** Creates an {@code integer} literal. */
  public Dcalc.Literal intLiteral(long value) {
    return literal(Pos.ZERO, Op.INTEGER_LITERAL, BigInteger.valueOf(value));
  }

  /** Creates an {@code integer} literal. */
  public Dcalc.Literal intLiteral(Pos pos, long value) {
    return literal(pos, Op.INTEGER_LITERAL, BigInteger.valueOf(value));
  }

  /** Creates a {@code decimal} literal. */
  public Dcalc.Literal decimalLiteral(BigDecimal value) {
    return literal(Pos.ZERO, Op.DECIMAL_LITERAL, value);
  }

  /** Creates a {@code money} literal. */
  public Dcalc.Literal moneyLiteral(BigDecimal value) {
    return literal(Pos.ZERO, Op.MONEY_LITERAL, value);
  }

  /** Creates a {@code date} literal. */
  public Dcalc.Literal dateLiteral(LocalDate value) {
    return literal(Pos.ZERO, Op.DATE_LITERAL, value);
  }

  /** Creates a {@code duration} literal. */
  public Dcalc.Literal durationLiteral(Period value) {
    return literal(Pos.ZERO, Op.DURATION_LITERAL, value);
  }

  /** Creates the {@code unit} literal. */
  public Dcalc.Literal unitLiteral() {
    return literal(Pos.ZERO, Op.UNIT_LITERAL, Unit.INSTANCE);
  }

  /** Creates the empty literal, a value of type {@code type} that is absent. */
  public Dcalc.Literal emptyLiteral(Pos pos, Type type) {
    return new Dcalc.Literal(Op.EMPTY_LITERAL, Mark.of(pos, type),
        Unit.INSTANCE);
  }

  /** Creates the empty literal. */
  public Dcalc.Literal emptyLiteral(Type type) {
    return emptyLiteral(Pos.ZERO, type);
  }

  /** Creates a reference to a built-in operator. */
  public Dcalc.OpRef opRef(Pos pos, FnType type, BuiltIn builtIn) {
    return new Dcalc.OpRef(Mark.of(pos, type), builtIn);
  }

  /** Creates a call to a built-in operator. */
  public Dcalc.Apply call(Pos pos, TypeSystem typeSystem, BuiltIn builtIn,
      Dcalc.Exp... args) {
    final List<Dcalc.Exp> argList = ImmutableList.copyOf(args);
    final FnType fnType =
        builtIn.fnType(typeSystem,
            ImmutableList.copyOf(argList.stream().map(Dcalc.Exp::type)
                .iterator()));
    return apply(pos, opRef(pos, fnType, builtIn), argList);
  }

  /** Creates a call to a built-in operator. */
  public Dcalc.Apply call(TypeSystem typeSystem, BuiltIn builtIn,
      Dcalc.Exp... args) {
    return call(Pos.ZERO, typeSystem, builtIn, args);
  }

  /** Creates an abstraction. */
  public Dcalc.Abs abs(Pos pos, TypeSystem typeSystem,
      List<Dcalc.IdPat> params, Dcalc.Exp body) {
    final FnType type =
        typeSystem.fnType(
            ImmutableList.copyOf(params.stream().map(p -> p.type).iterator()),
            body.type());
    return new Dcalc.Abs(Mark.of(pos, type), ImmutableList.copyOf(params),
        body);
  }

  /** Creates an abstraction with one parameter. */
  public Dcalc.Abs abs(TypeSystem typeSystem, Dcalc.IdPat param,
      Dcalc.Exp body) {
    return abs(Pos.ZERO, typeSystem, ImmutableList.of(param), body);
  }

  /** Creates a thunk, "fun () -> body". */
  public Dcalc.Abs thunk(Pos pos, TypeSystem typeSystem, Dcalc.Exp body) {
    return abs(pos, typeSystem,
        ImmutableList.of(idPat(PrimitiveType.UNIT, "_")), body);
  }

  /** Creates an application. */
  public Dcalc.Apply apply(Pos pos, Dcalc.Exp fn, List<Dcalc.Exp> args) {
    checkArgument(fn.type() instanceof FnType, "not a function: %s", fn);
    final FnType fnType = (FnType) fn.type();
    checkArgument(fnType.paramTypes.size() == args.size(),
        "wrong number of arguments to %s", fn);
    return new Dcalc.Apply(Mark.of(pos, fnType.resultType), fn,
        ImmutableList.copyOf(args));
  }

  /** Creates an application. */
  public Dcalc.Apply apply(Dcalc.Exp fn, Dcalc.Exp... args) {
    return apply(Pos.ZERO, fn, ImmutableList.copyOf(args));
  }

  /** Creates an application of a thunk to the unit value, "x ()". */
  public Dcalc.Apply force(Pos pos, Dcalc.Exp thunk) {
    return apply(pos, thunk, ImmutableList.of(unitLiteral()));
  }

  /** Creates a "let", the application of an abstraction of one parameter
   * to one argument. */
  public Dcalc.Apply let(TypeSystem typeSystem, Dcalc.IdPat pat,
      Dcalc.Exp arg, Dcalc.Exp body) {
    return apply(arg.pos, abs(typeSystem, pat, body), ImmutableList.of(arg));
  }

  /** Creates a struct value. */
  public Dcalc.Struct struct(Pos pos, TypeSystem typeSystem, String name,
      Map<String, Dcalc.Exp> fields) {
    final StructType type = typeSystem.lookupStruct(name);
    checkArgument(typeSystem.fields(name).keySet().equals(fields.keySet()),
        "fields of %s must be %s", name, typeSystem.fields(name).keySet());
    return new Dcalc.Struct(Mark.of(pos, type), name,
        ImmutableMap.copyOf(fields));
  }

  /** Creates an access to a field of a struct. */
  public Dcalc.StructAccess structAccess(Pos pos, TypeSystem typeSystem,
      Dcalc.Exp exp, String field) {
    checkArgument(exp.type() instanceof StructType, "not a struct: %s", exp);
    final String name = ((StructType) exp.type()).name;
    return new Dcalc.StructAccess(
        Mark.of(pos, typeSystem.fieldType(name, field)), exp, name, field);
  }

  /** Creates a tuple. */
  public Dcalc.Tuple tuple(Pos pos, TypeSystem typeSystem,
      List<Dcalc.Exp> args) {
    final TupleType type =
        typeSystem.tupleType(
            ImmutableList.copyOf(args.stream().map(Dcalc.Exp::type)
                .iterator()));
    return new Dcalc.Tuple(Mark.of(pos, type), ImmutableList.copyOf(args));
  }

  /** Creates an access to a component of a tuple. */
  public Dcalc.TupleAccess tupleAccess(Pos pos, Dcalc.Exp exp, int index) {
    checkArgument(exp.type() instanceof TupleType, "not a tuple: %s", exp);
    final Type type = ((TupleType) exp.type()).argTypes.get(index);
    return new Dcalc.TupleAccess(Mark.of(pos, type), exp, index);
  }

  /** Creates an injection into an enumeration. */
  public Dcalc.Inj inj(Pos pos, TypeSystem typeSystem, String name,
      String constructor, Dcalc.Exp exp) {
    typeSystem.constructorType(name, constructor);
    return new Dcalc.Inj(Mark.of(pos, typeSystem.lookupEnum(name)), name,
        constructor, exp);
  }

  /** Creates a match on an enumeration. */
  public Dcalc.Match match(Pos pos, TypeSystem typeSystem, Dcalc.Exp exp,
      Map<String, Dcalc.Abs> cases) {
    checkArgument(exp.type() instanceof EnumType, "not an enum: %s", exp);
    final String name = ((EnumType) exp.type()).name;
    checkArgument(
        typeSystem.constructors(name).keySet().equals(cases.keySet()),
        "cases of %s must be %s", name,
        typeSystem.constructors(name).keySet());
    final Type type = cases.values().iterator().next().body.type();
    return new Dcalc.Match(Mark.of(pos, type), exp, name,
        ImmutableMap.copyOf(cases));
  }

  /** Creates an array. */
  public Dcalc.Array array(Pos pos, TypeSystem typeSystem, Type elementType,
      List<Dcalc.Exp> args) {
    return new Dcalc.Array(Mark.of(pos, typeSystem.arrayType(elementType)),
        ImmutableList.copyOf(args));
  }

  /** Creates a conditional. */
  public Dcalc.If ifThenElse(Pos pos, Dcalc.Exp condition, Dcalc.Exp ifTrue,
      Dcalc.Exp ifFalse) {
    return new Dcalc.If(Mark.of(pos, ifTrue.type()), condition, ifTrue,
        ifFalse);
  }

  /** Creates a conditional. */
  public Dcalc.If ifThenElse(Dcalc.Exp condition, Dcalc.Exp ifTrue,
      Dcalc.Exp ifFalse) {
    return ifThenElse(Pos.ZERO, condition, ifTrue, ifFalse);
  }

  /** Creates an assertion. */
  public Dcalc.Assert assertion(Pos pos, Dcalc.Exp exp) {
    return new Dcalc.Assert(Mark.of(pos, PrimitiveType.UNIT), exp);
  }

  /** Creates an error-on-empty. */
  public Dcalc.ErrorOnEmpty errorOnEmpty(Pos pos, Dcalc.Exp exp) {
    return new Dcalc.ErrorOnEmpty(Mark.of(pos, exp.type()), exp);
  }

  /** Creates a default term. */
  public Dcalc.Default defaultTerm(Pos pos, List<Dcalc.Exp> excepts,
      Dcalc.Exp just, Dcalc.Exp cons) {
    return new Dcalc.Default(Mark.of(pos, cons.type()),
        ImmutableList.copyOf(excepts), just, cons);
  }

  /** Creates a default term. */
  public Dcalc.Default defaultTerm(List<Dcalc.Exp> excepts, Dcalc.Exp just,
      Dcalc.Exp cons) {
    return defaultTerm(Pos.ZERO, excepts, just, cons);
  }

  /** Creates a binding in the body of a scope. */
  public Dcalc.ScopeLet scopeLet(Pos pos, ScopeLetKind kind, Dcalc.IdPat pat,
      Dcalc.Exp exp, Dcalc.ScopeLets next) {
    return new Dcalc.ScopeLet(pos, kind, pat, exp, next);
  }

  /** Creates the result of the body of a scope. */
  public Dcalc.Result result(Dcalc.Exp exp) {
    return new Dcalc.Result(exp);
  }

  /** Creates the body of a scope. */
  public Dcalc.ScopeBody scopeBody(Pos pos, String inputStruct,
      String outputStruct, Dcalc.IdPat inputPat, Dcalc.ScopeLets lets) {
    return new Dcalc.ScopeBody(pos, inputStruct, outputStruct, inputPat, lets);
  }

  /** Creates a top-level definition. */
  public Dcalc.TopDef topDef(Pos pos, Dcalc.IdPat pat, Dcalc.Exp exp) {
    return new Dcalc.TopDef(pos, pat, exp);
  }

  /** Creates the definition of a scope. */
  public Dcalc.ScopeDef scopeDef(Pos pos, Dcalc.IdPat pat,
      Dcalc.ScopeBody body) {
    return new Dcalc.ScopeDef(pos, pat, body);
  }

  /** Creates a program. */
  public Dcalc.Program program(TypeSystem typeSystem,
      List<? extends Dcalc.CodeItem> items) {
    return new Dcalc.Program(Pos.ZERO, typeSystem,
        ImmutableList.copyOf(items));
  }
}

// End DcalcBuilder.java
