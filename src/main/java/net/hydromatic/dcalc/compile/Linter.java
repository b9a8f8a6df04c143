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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Op;
import net.hydromatic.dcalc.ast.ScopeLetKind;
import net.hydromatic.dcalc.ast.Visitor;
import net.hydromatic.dcalc.type.TypeSystem;

/**
 * Finds declarations that a program never uses, and scope variables that
 * are declared but never defined.
 *
 * <p>A struct field is used if it is read or initialized, or if it belongs
 * to the output struct of a scope. An enumeration constructor is used if
 * a value is built with it or a match has a case for it.
 *
 * <p>A scope variable is never defined if its definition is the empty
 * literal, or an "error_on_empty" of a default that has no exceptions and
 * whose justification is {@code false}.
 */
public class Linter extends Visitor {
  private final Set<String> usedFields = new HashSet<>();
  private final Set<String> usedConstructors = new HashSet<>();
  private final List<CompileException> emptyDefinitions = new ArrayList<>();
  private String scopeName = "";

  private Linter() {}

  /** Returns warnings about the unused declarations of a program. */
  public static List<CompileException> lint(Dcalc.Program program) {
    final Linter linter = new Linter();
    linter.visit(program);
    return linter.warnings(program.typeSystem);
  }

  private static String key(String name, String member) {
    return name + "." + member;
  }

  private List<CompileException> warnings(TypeSystem typeSystem) {
    final ImmutableList.Builder<CompileException> warnings =
        ImmutableList.builder();
    warnings.addAll(emptyDefinitions);
    for (String struct : typeSystem.structNames()) {
      for (String field : typeSystem.fields(struct).keySet()) {
        if (!usedFields.contains(key(struct, field))) {
          warnings.add(
              new CompileException("The field \"" + field + "\" of struct \""
                  + struct + "\" is never used; maybe it's unnecessary?",
                  true, typeSystem.structPos(struct)));
        }
      }
    }
    for (String anEnum : typeSystem.enumNames()) {
      for (String constructor : typeSystem.constructors(anEnum).keySet()) {
        if (!usedConstructors.contains(key(anEnum, constructor))) {
          warnings.add(
              new CompileException("The constructor \"" + constructor
                  + "\" of enumeration \"" + anEnum
                  + "\" is never used; maybe it's unnecessary?",
                  true, typeSystem.enumPos(anEnum)));
        }
      }
    }
    return warnings.build();
  }

  /** Returns whether a definition can never have a value. */
  private static boolean isNeverDefined(Dcalc.Exp e) {
    switch (e.op) {
      case EMPTY_LITERAL:
        return true;
      case ERROR_ON_EMPTY:
        final Dcalc.Exp arg = ((Dcalc.ErrorOnEmpty) e).exp;
        if (arg.op == Op.EMPTY_LITERAL) {
          return true;
        }
        if (arg.op != Op.DEFAULT) {
          return false;
        }
        final Dcalc.Default aDefault = (Dcalc.Default) arg;
        return aDefault.excepts.isEmpty()
            && aDefault.just.op == Op.BOOL_LITERAL
            && Boolean.FALSE.equals(((Dcalc.Literal) aDefault.just).value);
      default:
        return false;
    }
  }

  @Override
  protected void visit(Dcalc.Program program) {
    for (Dcalc.CodeItem item : program.items) {
      if (item instanceof Dcalc.ScopeDef) {
        final String outputStruct = ((Dcalc.ScopeDef) item).body.outputStruct;
        program.typeSystem.fields(outputStruct).keySet()
            .forEach(field -> usedFields.add(key(outputStruct, field)));
      }
    }
    super.visit(program);
  }

  @Override
  protected void visit(Dcalc.ScopeDef scopeDef) {
    scopeName = scopeDef.pat.name;
    super.visit(scopeDef);
  }

  @Override
  protected void visit(Dcalc.ScopeLet scopeLet) {
    if (scopeLet.kind == ScopeLetKind.SCOPE_VAR_DEFINITION
        && isNeverDefined(scopeLet.exp)) {
      emptyDefinitions.add(
          new CompileException("The variable \"" + scopeLet.pat.name
              + "\" is declared but never defined in scope \"" + scopeName
              + "\"; did you forget something?", true, scopeLet.pos));
    }
    super.visit(scopeLet);
  }

  @Override
  protected void visit(Dcalc.Struct struct) {
    struct.fields.keySet()
        .forEach(field -> usedFields.add(key(struct.name, field)));
    super.visit(struct);
  }

  @Override
  protected void visit(Dcalc.StructAccess structAccess) {
    usedFields.add(key(structAccess.name, structAccess.field));
    super.visit(structAccess);
  }

  @Override
  protected void visit(Dcalc.Inj inj) {
    usedConstructors.add(key(inj.name, inj.constructor));
    super.visit(inj);
  }

  @Override
  protected void visit(Dcalc.Match match) {
    match.cases.keySet()
        .forEach(constructor ->
            usedConstructors.add(key(match.name, constructor)));
    super.visit(match);
  }
}

// End Linter.java
