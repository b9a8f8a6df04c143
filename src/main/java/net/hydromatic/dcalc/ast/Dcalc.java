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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.dcalc.compile.BuiltIn;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;

/**
 * Default calculus.
 *
 * <p>A typed lambda calculus extended with default terms, the empty literal
 * and error-on-empty. It is the input of the translation in {@link
 * net.hydromatic.dcalc.compile.Compiles}. Create nodes using {@link
 * DcalcBuilder#dcalc}.
 *
 * <p>Every expression carries a {@link Mark}; after analysis, an {@link
 * AnalysisMark}.
 */
public class Dcalc {
  private Dcalc() {}

  /**
   * Binding occurrence of a variable.
   *
   * <p>Variables are identified by name and ordinal; earlier stages make sure
   * that two distinct variables never share both.
   */
  public static class IdPat extends AstNode implements Comparable<IdPat> {
    public final String name;
    public final int i;
    public final Type type;

    IdPat(Pos pos, String name, int i, Type type) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
      this.i = i;
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + i;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IdPat
              && ((IdPat) o).name.equals(name)
              && ((IdPat) o).i == i;
    }

    @Override
    public int compareTo(IdPat o) {
      final int c = name.compareTo(o.name);
      return c != 0 ? c : Integer.compare(i, o.i);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(name, i);
    }
  }

  /** Abstract base class of expressions. */
  public abstract static class Exp extends AstNode {
    public final Mark mark;

    Exp(Op op, Mark mark) {
      super(mark.pos, op);
      this.mark = mark;
    }

    /** Returns the static type of this expression. */
    public Type type() {
      return mark.type;
    }

    /** Accepts a visitor, calling the {@code visit} method appropriate to
     * the type of this node. */
    public abstract void accept(Visitor visitor);
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final IdPat idPat;

    Id(Mark mark, IdPat idPat) {
      super(Op.ID, mark);
      this.idPat = requireNonNull(idPat);
    }

    public Id copy(Mark mark) {
      return new Id(mark, idPat);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(idPat.name, idPat.i);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal, including the empty literal. */
  public static class Literal extends Exp {
    public final Object value;

    Literal(Op op, Mark mark, Object value) {
      super(op, mark);
      this.value = requireNonNull(value);
    }

    public Literal copy(Mark mark) {
      return new Literal(op, mark, value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.literal(op, value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a built-in operator. */
  public static class OpRef extends Exp {
    public final BuiltIn builtIn;

    OpRef(Mark mark, BuiltIn builtIn) {
      super(Op.OPERATOR, mark);
      this.builtIn = requireNonNull(builtIn);
    }

    public OpRef copy(Mark mark) {
      return new OpRef(mark, builtIn);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(builtIn.mlName);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Lambda abstraction, "fun x y -> body". */
  public static class Abs extends Exp {
    public final ImmutableList<IdPat> params;
    public final Exp body;

    Abs(Mark mark, ImmutableList<IdPat> params, Exp body) {
      super(Op.ABS, mark);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    public FnType fnType() {
      return (FnType) mark.type;
    }

    public Abs copy(Mark mark, Exp body) {
      return new Abs(mark, params, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("fun");
      params.forEach(p -> w.append(" ").append(p));
      return w.append(" -> ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Application of a function to arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Mark mark, Exp fn, ImmutableList<Exp> args) {
      super(Op.APPLY, mark);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    /** Returns whether this is a "let", that is, the application of a
     * one-parameter abstraction to one argument. */
    public boolean isLet() {
      return fn.op == Op.ABS
          && ((Abs) fn).params.size() == 1
          && args.size() == 1;
    }

    public Apply copy(Mark mark, Exp fn, List<Exp> args) {
      return new Apply(mark, fn, ImmutableList.copyOf(args));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      if (isLet()) {
        final Abs abs = (Abs) fn;
        return w.append("let ").append(abs.params.get(0))
            .append(" = ").append(args.get(0))
            .append(" in ").append(abs.body);
      }
      if (fn.op == Op.OPERATOR
          && ((OpRef) fn).builtIn.infix
          && args.size() == 2) {
        return w.appendArg(args.get(0))
            .append(" ").append(fn).append(" ")
            .appendArg(args.get(1));
      }
      w.appendArg(fn);
      args.forEach(arg -> w.append(" ").appendArg(arg));
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Construction of a struct value. */
  public static class Struct extends Exp {
    public final String name;
    public final ImmutableMap<String, Exp> fields;

    Struct(Mark mark, String name, ImmutableMap<String, Exp> fields) {
      super(Op.STRUCT, mark);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    public Struct copy(Mark mark, Map<String, Exp> fields) {
      return new Struct(mark, name, ImmutableMap.copyOf(fields));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(name).append(" {");
      final String[] sep = {""};
      fields.forEach((field, exp) -> {
        w.append(sep[0]).append(field).append(" = ").append(exp);
        sep[0] = "; ";
      });
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Access to a field of a struct, "e.field". */
  public static class StructAccess extends Exp {
    public final Exp exp;
    public final String name;
    public final String field;

    StructAccess(Mark mark, Exp exp, String name, String field) {
      super(Op.STRUCT_ACCESS, mark);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.field = requireNonNull(field);
    }

    public StructAccess copy(Mark mark, Exp exp) {
      return new StructAccess(mark, exp, name, field);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendArg(exp).append(".").append(field);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple, "(e0, e1)". */
  public static class Tuple extends Exp {
    public final ImmutableList<Exp> args;

    Tuple(Mark mark, ImmutableList<Exp> args) {
      super(Op.TUPLE, mark);
      this.args = requireNonNull(args);
    }

    public Tuple copy(Mark mark, List<Exp> args) {
      return new Tuple(mark, ImmutableList.copyOf(args));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("(").appendAll(args, ", ").append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Access to a component of a tuple, "e.0". */
  public static class TupleAccess extends Exp {
    public final Exp exp;
    public final int index;

    TupleAccess(Mark mark, Exp exp, int index) {
      super(Op.TUPLE_ACCESS, mark);
      this.exp = requireNonNull(exp);
      this.index = index;
    }

    public TupleAccess copy(Mark mark, Exp exp) {
      return new TupleAccess(mark, exp, index);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendArg(exp).append(".").append(Integer.toString(index));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Injection into an enumeration, "Constructor e". */
  public static class Inj extends Exp {
    public final String name;
    public final String constructor;
    public final Exp exp;

    Inj(Mark mark, String name, String constructor, Exp exp) {
      super(Op.INJ, mark);
      this.name = requireNonNull(name);
      this.constructor = requireNonNull(constructor);
      this.exp = requireNonNull(exp);
    }

    public Inj copy(Mark mark, Exp exp) {
      return new Inj(mark, name, constructor, exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(constructor);
      return exp.op == Op.UNIT_LITERAL ? w : w.append(" ").appendArg(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Match on an enumeration. There is one case, an abstraction of one
   * parameter, for each constructor. */
  public static class Match extends Exp {
    public final Exp exp;
    public final String name;
    public final ImmutableMap<String, Abs> cases;

    Match(Mark mark, Exp exp, String name, ImmutableMap<String, Abs> cases) {
      super(Op.MATCH, mark);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.cases = requireNonNull(cases);
    }

    public Match copy(Mark mark, Exp exp, Map<String, Abs> cases) {
      return new Match(mark, exp, name, ImmutableMap.copyOf(cases));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("match ").append(exp).append(" with");
      cases.forEach((constructor, abs) ->
          w.append(" | ").append(constructor).append(" ")
              .append(abs.params.get(0)).append(" -> ").append(abs.body));
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Array, "[|e0; e1|]". */
  public static class Array extends Exp {
    public final ImmutableList<Exp> args;

    Array(Mark mark, ImmutableList<Exp> args) {
      super(Op.ARRAY, mark);
      this.args = requireNonNull(args);
    }

    public Array copy(Mark mark, List<Exp> args) {
      return new Array(mark, ImmutableList.copyOf(args));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("[|").appendAll(args, "; ").append("|]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conditional, "if c then e1 else e2". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Mark mark, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF, mark);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    public If copy(Mark mark, Exp condition, Exp ifTrue, Exp ifFalse) {
      return new If(mark, condition, ifTrue, ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("if ").append(condition)
          .append(" then ").append(ifTrue)
          .append(" else ").append(ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assertion, "assert e". */
  public static class Assert extends Exp {
    public final Exp exp;

    Assert(Mark mark, Exp exp) {
      super(Op.ASSERT, mark);
      this.exp = requireNonNull(exp);
    }

    public Assert copy(Mark mark, Exp exp) {
      return new Assert(mark, exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("assert ").appendArg(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Error-on-empty, "error_on_empty e": the value of {@code e}, or an
   * error if it is absent. */
  public static class ErrorOnEmpty extends Exp {
    public final Exp exp;

    ErrorOnEmpty(Mark mark, Exp exp) {
      super(Op.ERROR_ON_EMPTY, mark);
      this.exp = requireNonNull(exp);
    }

    public ErrorOnEmpty copy(Mark mark, Exp exp) {
      return new ErrorOnEmpty(mark, exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("error_on_empty ").appendArg(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Default term, "&lt;e1, e2 | just :- cons&gt;". */
  public static class Default extends Exp {
    public final ImmutableList<Exp> excepts;
    public final Exp just;
    public final Exp cons;

    Default(Mark mark, ImmutableList<Exp> excepts, Exp just, Exp cons) {
      super(Op.DEFAULT, mark);
      this.excepts = requireNonNull(excepts);
      this.just = requireNonNull(just);
      this.cons = requireNonNull(cons);
    }

    public Default copy(Mark mark, List<Exp> excepts, Exp just, Exp cons) {
      return new Default(mark, ImmutableList.copyOf(excepts), just, cons);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("<");
      if (!excepts.isEmpty()) {
        w.appendAll(excepts, ", ").append(" | ");
      }
      return w.append(just).append(" :- ").append(cons).append(">");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Chain of bindings in the body of a scope; either a {@link ScopeLet}
   * or the final {@link Result}. */
  public abstract static class ScopeLets extends AstNode {
    ScopeLets(Pos pos, Op op) {
      super(pos, op);
    }

    public abstract void accept(Visitor visitor);
  }

  /** Binding of a variable in the body of a scope. */
  public static class ScopeLet extends ScopeLets {
    public final ScopeLetKind kind;
    public final IdPat pat;
    public final Exp exp;
    public final ScopeLets next;

    ScopeLet(Pos pos, ScopeLetKind kind, IdPat pat, Exp exp, ScopeLets next) {
      super(pos, Op.SCOPE_LET);
      this.kind = requireNonNull(kind);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
      this.next = requireNonNull(next);
    }

    public ScopeLet copy(Exp exp, ScopeLets next) {
      return exp == this.exp && next == this.next
          ? this
          : new ScopeLet(pos, kind, pat, exp, next);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let ").append(pat).append(" = ").append(exp)
          .append(" in\n").append(next);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** The expression that ends the body of a scope; it builds the output
   * struct. */
  public static class Result extends ScopeLets {
    public final Exp exp;

    Result(Exp exp) {
      super(exp.pos, Op.RESULT);
      this.exp = exp;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Body of a scope: a function from the input struct to the output
   * struct. */
  public static class ScopeBody extends AstNode {
    public final String inputStruct;
    public final String outputStruct;
    public final IdPat inputPat;
    public final ScopeLets lets;

    ScopeBody(Pos pos, String inputStruct, String outputStruct,
        IdPat inputPat, ScopeLets lets) {
      super(pos, Op.SCOPE_BODY);
      this.inputStruct = requireNonNull(inputStruct);
      this.outputStruct = requireNonNull(outputStruct);
      this.inputPat = requireNonNull(inputPat);
      this.lets = requireNonNull(lets);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("fun (").append(inputPat).append(": ")
          .append(inputStruct).append("): ").append(outputStruct)
          .append(" ->\n").append(lets);
    }

    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Top-level declaration. */
  public abstract static class CodeItem extends AstNode {
    public final IdPat pat;

    CodeItem(Pos pos, Op op, IdPat pat) {
      super(pos, op);
      this.pat = requireNonNull(pat);
    }

    public abstract void accept(Visitor visitor);
  }

  /** Top-level definition, "let x = e". */
  public static class TopDef extends CodeItem {
    public final Exp exp;

    TopDef(Pos pos, IdPat pat, Exp exp) {
      super(pos, Op.TOP_DEF, pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let ").append(pat).append(" = ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Definition of a scope. */
  public static class ScopeDef extends CodeItem {
    public final ScopeBody body;

    ScopeDef(Pos pos, IdPat pat, ScopeBody body) {
      super(pos, Op.SCOPE_DEF, pat);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let scope ").append(pat).append(" = ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Program: a declaration context and a list of declarations. */
  public static class Program extends AstNode {
    public final TypeSystem typeSystem;
    public final ImmutableList<CodeItem> items;

    Program(Pos pos, TypeSystem typeSystem, ImmutableList<CodeItem> items) {
      super(pos, Op.PROGRAM);
      this.typeSystem = requireNonNull(typeSystem);
      this.items = requireNonNull(items);
    }

    /** Returns the declaration with a given name, or throws. */
    public CodeItem item(String name) {
      return items.stream()
          .filter(item -> Objects.equals(item.pat.name, name))
          .findFirst()
          .orElseThrow(() ->
              new IllegalArgumentException("no declaration " + name));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendAll(items, ";\n");
    }

    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Dcalc.java
