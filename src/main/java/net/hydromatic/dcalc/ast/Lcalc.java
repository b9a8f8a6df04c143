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
import net.hydromatic.dcalc.eval.Codes;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;

/**
 * Lambda calculus with options.
 *
 * <p>The output of the translation. It has no default term, no empty literal
 * and no error-on-empty; absence is represented by the "None" constructor of
 * an option enumeration. It adds {@link Let} and {@link Raise}. Create nodes
 * using {@link LcalcBuilder#lcalc}.
 */
public class Lcalc {
  private Lcalc() {}

  /**
   * Binding occurrence of a variable.
   *
   * <p>Variables are identified by namespace, name and ordinal. Each
   * declaration of a program has its own namespace; top-level variables have
   * the empty namespace.
   */
  public static class IdPat extends AstNode implements Comparable<IdPat> {
    public final String name;
    public final int i;
    public final String namespace;
    public final Type type;

    IdPat(Pos pos, String name, int i, String namespace, Type type) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
      this.i = i;
      this.namespace = requireNonNull(namespace);
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, i, namespace);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IdPat
              && ((IdPat) o).name.equals(name)
              && ((IdPat) o).i == i
              && ((IdPat) o).namespace.equals(namespace);
    }

    @Override
    public int compareTo(IdPat o) {
      int c = namespace.compareTo(o.namespace);
      if (c == 0) {
        c = name.compareTo(o.name);
      }
      return c != 0 ? c : Integer.compare(i, o.i);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(name, i);
    }
  }

  /** Abstract base class of expressions. */
  public abstract static class Exp extends AstNode {
    public final Type type;

    Exp(Pos pos, Op op, Type type) {
      super(pos, op);
      this.type = requireNonNull(type);
    }

    /** Accepts a shuttle, calling the {@code visit} method appropriate to
     * the type of this node, and returning the result. */
    public abstract Exp accept(Shuttle shuttle);
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final IdPat idPat;

    Id(Pos pos, IdPat idPat) {
      super(pos, Op.ID, idPat.type);
      this.idPat = requireNonNull(idPat);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(idPat.name, idPat.i);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Literal. */
  public static class Literal extends Exp {
    public final Object value;

    Literal(Pos pos, Op op, Type type, Object value) {
      super(pos, op, type);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.literal(op, value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Reference to a built-in operator. */
  public static class OpRef extends Exp {
    public final BuiltIn builtIn;

    OpRef(Pos pos, Type type, BuiltIn builtIn) {
      super(pos, Op.OPERATOR, type);
      this.builtIn = requireNonNull(builtIn);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(builtIn.mlName);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Lambda abstraction, "fun x y -> body". */
  public static class Abs extends Exp {
    public final ImmutableList<IdPat> params;
    public final Exp body;

    Abs(Pos pos, Type type, ImmutableList<IdPat> params, Exp body) {
      super(pos, Op.ABS, type);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    public Abs copy(Exp body) {
      return body == this.body ? this : new Abs(pos, type, params, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("fun");
      params.forEach(p -> w.append(" ").append(p));
      return w.append(" -> ").append(body);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Application of a function to arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Pos pos, Type type, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY, type);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    /** Returns whether this is a call to a given built-in operator. */
    public boolean isCallTo(BuiltIn builtIn) {
      return fn.op == Op.OPERATOR && ((OpRef) fn).builtIn == builtIn;
    }

    public Apply copy(Exp fn, List<Exp> args) {
      return fn == this.fn && args.equals(this.args)
          ? this
          : new Apply(pos, type, fn, ImmutableList.copyOf(args));
    }

    @Override
    AstWriter unparse(AstWriter w) {
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
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Let, "let x = arg in body". */
  public static class Let extends Exp {
    public final IdPat pat;
    public final Exp arg;
    public final Exp body;

    Let(Pos pos, IdPat pat, Exp arg, Exp body) {
      super(pos, Op.LET, body.type);
      this.pat = requireNonNull(pat);
      this.arg = requireNonNull(arg);
      this.body = requireNonNull(body);
    }

    public Let copy(Exp arg, Exp body) {
      return arg == this.arg && body == this.body
          ? this
          : new Let(pos, pat, arg, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let ").append(pat).append(" = ").append(arg)
          .append(" in ").append(body);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Construction of a struct value. */
  public static class Struct extends Exp {
    public final String name;
    public final ImmutableMap<String, Exp> fields;

    Struct(Pos pos, Type type, String name, ImmutableMap<String, Exp> fields) {
      super(pos, Op.STRUCT, type);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    public Struct copy(Map<String, Exp> fields) {
      return fields.equals(this.fields)
          ? this
          : new Struct(pos, type, name, ImmutableMap.copyOf(fields));
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
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Access to a field of a struct, "e.field". */
  public static class StructAccess extends Exp {
    public final Exp exp;
    public final String name;
    public final String field;

    StructAccess(Pos pos, Type type, Exp exp, String name, String field) {
      super(pos, Op.STRUCT_ACCESS, type);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.field = requireNonNull(field);
    }

    public StructAccess copy(Exp exp) {
      return exp == this.exp
          ? this
          : new StructAccess(pos, type, exp, name, field);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendArg(exp).append(".").append(field);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Tuple, "(e0, e1)". */
  public static class Tuple extends Exp {
    public final ImmutableList<Exp> args;

    Tuple(Pos pos, Type type, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE, type);
      this.args = requireNonNull(args);
    }

    public Tuple copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Tuple(pos, type, ImmutableList.copyOf(args));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("(").appendAll(args, ", ").append(")");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Access to a component of a tuple, "e.0". */
  public static class TupleAccess extends Exp {
    public final Exp exp;
    public final int index;

    TupleAccess(Pos pos, Type type, Exp exp, int index) {
      super(pos, Op.TUPLE_ACCESS, type);
      this.exp = requireNonNull(exp);
      this.index = index;
    }

    public TupleAccess copy(Exp exp) {
      return exp == this.exp ? this : new TupleAccess(pos, type, exp, index);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendArg(exp).append(".").append(Integer.toString(index));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Injection into an enumeration, "Constructor e". */
  public static class Inj extends Exp {
    public final String name;
    public final String constructor;
    public final Exp exp;

    Inj(Pos pos, Type type, String name, String constructor, Exp exp) {
      super(pos, Op.INJ, type);
      this.name = requireNonNull(name);
      this.constructor = requireNonNull(constructor);
      this.exp = requireNonNull(exp);
    }

    public Inj copy(Exp exp) {
      return exp == this.exp
          ? this
          : new Inj(pos, type, name, constructor, exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(constructor);
      return exp.op == Op.UNIT_LITERAL ? w : w.append(" ").appendArg(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Match on an enumeration. There is one case, an abstraction of one
   * parameter, for each constructor. */
  public static class Match extends Exp {
    public final Exp exp;
    public final String name;
    public final ImmutableMap<String, Abs> cases;

    Match(Pos pos, Type type, Exp exp, String name,
        ImmutableMap<String, Abs> cases) {
      super(pos, Op.MATCH, type);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.cases = requireNonNull(cases);
    }

    public Match copy(Exp exp, Map<String, Abs> cases) {
      return exp == this.exp && cases.equals(this.cases)
          ? this
          : new Match(pos, type, exp, name, ImmutableMap.copyOf(cases));
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
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Array, "[|e0; e1|]". */
  public static class Array extends Exp {
    public final ImmutableList<Exp> args;

    Array(Pos pos, Type type, ImmutableList<Exp> args) {
      super(pos, Op.ARRAY, type);
      this.args = requireNonNull(args);
    }

    public Array copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Array(pos, type, ImmutableList.copyOf(args));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("[|").appendAll(args, "; ").append("|]");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Conditional, "if c then e1 else e2". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Type type, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF, type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
              && ifTrue == this.ifTrue
              && ifFalse == this.ifFalse
          ? this
          : new If(pos, type, condition, ifTrue, ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("if ").append(condition)
          .append(" then ").append(ifTrue)
          .append(" else ").append(ifFalse);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Assertion, "assert e". */
  public static class Assert extends Exp {
    public final Exp exp;

    Assert(Pos pos, Type type, Exp exp) {
      super(pos, Op.ASSERT, type);
      this.exp = requireNonNull(exp);
    }

    public Assert copy(Exp exp) {
      return exp == this.exp ? this : new Assert(pos, type, exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("assert ").appendArg(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Raises a runtime error, "raise NoValueProvided". */
  public static class Raise extends Exp {
    public final Codes.RuntimeExn exn;

    Raise(Pos pos, Type type, Codes.RuntimeExn exn) {
      super(pos, Op.RAISE, type);
      this.exn = requireNonNull(exn);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("raise ").append(exn.mlName);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Chain of bindings in the body of a scope; either a {@link ScopeLet}
   * or the final {@link Result}. */
  public abstract static class ScopeLets extends AstNode {
    ScopeLets(Pos pos, Op op) {
      super(pos, op);
    }

    public abstract ScopeLets accept(Shuttle shuttle);
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
    public ScopeLets accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** The expression that ends the body of a scope. */
  public static class Result extends ScopeLets {
    public final Exp exp;

    Result(Exp exp) {
      super(exp.pos, Op.RESULT);
      this.exp = exp;
    }

    public Result copy(Exp exp) {
      return exp == this.exp ? this : new Result(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(exp);
    }

    @Override
    public ScopeLets accept(Shuttle shuttle) {
      return shuttle.visit(this);
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

    public ScopeBody copy(ScopeLets lets) {
      return lets == this.lets
          ? this
          : new ScopeBody(pos, inputStruct, outputStruct, inputPat, lets);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("fun (").append(inputPat).append(": ")
          .append(inputStruct).append("): ").append(outputStruct)
          .append(" ->\n").append(lets);
    }

    public ScopeBody accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Top-level declaration. */
  public abstract static class CodeItem extends AstNode {
    public final IdPat pat;

    CodeItem(Pos pos, Op op, IdPat pat) {
      super(pos, op);
      this.pat = requireNonNull(pat);
    }

    public abstract CodeItem accept(Shuttle shuttle);
  }

  /** Top-level definition, "let x = e". */
  public static class TopDef extends CodeItem {
    public final Exp exp;

    TopDef(Pos pos, IdPat pat, Exp exp) {
      super(pos, Op.TOP_DEF, pat);
      this.exp = requireNonNull(exp);
    }

    public TopDef copy(Exp exp) {
      return exp == this.exp ? this : new TopDef(pos, pat, exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let ").append(pat).append(" = ").append(exp);
    }

    @Override
    public CodeItem accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Definition of a scope. */
  public static class ScopeDef extends CodeItem {
    public final ScopeBody body;

    ScopeDef(Pos pos, IdPat pat, ScopeBody body) {
      super(pos, Op.SCOPE_DEF, pat);
      this.body = requireNonNull(body);
    }

    public ScopeDef copy(ScopeBody body) {
      return body == this.body ? this : new ScopeDef(pos, pat, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let scope ").append(pat).append(" = ").append(body);
    }

    @Override
    public CodeItem accept(Shuttle shuttle) {
      return shuttle.visit(this);
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

    public Program copy(List<CodeItem> items) {
      return items.equals(this.items)
          ? this
          : new Program(pos, typeSystem, ImmutableList.copyOf(items));
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

    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }
}

// End Lcalc.java
