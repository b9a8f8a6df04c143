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

import com.google.common.collect.ImmutableSet;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Shuttle;
import net.hydromatic.dcalc.type.TypeSystem;

/** Validates a translated program, making sure that every {@link Lcalc.Id}
 * is bound and that every struct and enumeration is declared. */
public class OutputChecker extends Shuttle {
  private final ImmutableSet<Lcalc.IdPat> bound;

  private OutputChecker(TypeSystem typeSystem,
      ImmutableSet<Lcalc.IdPat> bound) {
    super(typeSystem);
    this.bound = bound;
  }

  /** Checks a program. Throws if it is not valid. */
  public static void check(Lcalc.Program program) {
    new OutputChecker(program.typeSystem, ImmutableSet.of()).visit(program);
  }

  private OutputChecker bind(Iterable<Lcalc.IdPat> pats) {
    return new OutputChecker(typeSystem,
        ImmutableSet.<Lcalc.IdPat>builder().addAll(bound).addAll(pats)
            .build());
  }

  private OutputChecker bind(Lcalc.IdPat pat) {
    return bind(ImmutableSet.of(pat));
  }

  private void checkStruct(Lcalc.Exp e, String name) {
    if (!typeSystem.hasStruct(name)) {
      throw CompileException.internal(e.pos, "struct %s is not declared: %s",
          name, e);
    }
  }

  private void checkEnum(Lcalc.Exp e, String name) {
    if (!typeSystem.hasEnum(name)) {
      throw CompileException.internal(e.pos, "enum %s is not declared: %s",
          name, e);
    }
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Id id) {
    if (!bound.contains(id.idPat)) {
      throw CompileException.internal(id.pos,
          "variable %s is not bound in the output", id);
    }
    return id;
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Abs abs) {
    abs.body.accept(bind(abs.params));
    return abs;
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Let let) {
    let.arg.accept(this);
    let.body.accept(bind(let.pat));
    return let;
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Struct struct) {
    checkStruct(struct, struct.name);
    return super.visit(struct);
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.StructAccess structAccess) {
    checkStruct(structAccess, structAccess.name);
    return super.visit(structAccess);
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Inj inj) {
    checkEnum(inj, inj.name);
    return super.visit(inj);
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Match match) {
    checkEnum(match, match.name);
    return super.visit(match);
  }

  @Override
  protected Lcalc.ScopeLets visit(Lcalc.ScopeLet scopeLet) {
    scopeLet.exp.accept(this);
    scopeLet.next.accept(bind(scopeLet.pat));
    return scopeLet;
  }

  @Override
  protected Lcalc.ScopeBody visit(Lcalc.ScopeBody scopeBody) {
    scopeBody.lets.accept(bind(scopeBody.inputPat));
    return scopeBody;
  }

  @Override
  protected Lcalc.Program visit(Lcalc.Program program) {
    OutputChecker checker = this;
    for (Lcalc.CodeItem item : program.items) {
      item.accept(checker);
      checker = checker.bind(item.pat);
    }
    return program;
  }
}

// End OutputChecker.java
