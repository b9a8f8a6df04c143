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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.type.TypeSystem;

/** Visits and transforms {@link Lcalc} trees. */
public class Shuttle {
  protected final TypeSystem typeSystem;

  /** Creates a Shuttle. */
  public Shuttle(TypeSystem typeSystem) {
    this.typeSystem = typeSystem;
  }

  protected List<Lcalc.Exp> visitList(List<Lcalc.Exp> nodes) {
    final List<Lcalc.Exp> list = new ArrayList<>();
    for (Lcalc.Exp node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  protected <K> Map<K, Lcalc.Exp> visitMap(Map<K, Lcalc.Exp> nodes) {
    final Map<K, Lcalc.Exp> map = new LinkedHashMap<>();
    nodes.forEach((k, v) -> map.put(k, v.accept(this)));
    return map;
  }

  protected Map<String, Lcalc.Abs> visitCases(Map<String, Lcalc.Abs> cases) {
    final Map<String, Lcalc.Abs> map = new LinkedHashMap<>();
    cases.forEach((k, v) -> map.put(k, (Lcalc.Abs) v.accept(this)));
    return map;
  }

  // expressions

  protected Lcalc.Exp visit(Lcalc.Id id) {
    return id;
  }

  protected Lcalc.Exp visit(Lcalc.Literal literal) {
    return literal;
  }

  protected Lcalc.Exp visit(Lcalc.OpRef opRef) {
    return opRef;
  }

  protected Lcalc.Exp visit(Lcalc.Raise raise) {
    return raise;
  }

  protected Lcalc.Exp visit(Lcalc.Abs abs) {
    return abs.copy(abs.body.accept(this));
  }

  protected Lcalc.Exp visit(Lcalc.Apply apply) {
    return apply.copy(apply.fn.accept(this), visitList(apply.args));
  }

  protected Lcalc.Exp visit(Lcalc.Let let) {
    return let.copy(let.arg.accept(this), let.body.accept(this));
  }

  protected Lcalc.Exp visit(Lcalc.Struct struct) {
    return struct.copy(visitMap(struct.fields));
  }

  protected Lcalc.Exp visit(Lcalc.StructAccess structAccess) {
    return structAccess.copy(structAccess.exp.accept(this));
  }

  protected Lcalc.Exp visit(Lcalc.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Lcalc.Exp visit(Lcalc.TupleAccess tupleAccess) {
    return tupleAccess.copy(tupleAccess.exp.accept(this));
  }

  protected Lcalc.Exp visit(Lcalc.Inj inj) {
    return inj.copy(inj.exp.accept(this));
  }

  protected Lcalc.Exp visit(Lcalc.Match match) {
    return match.copy(match.exp.accept(this), visitCases(match.cases));
  }

  protected Lcalc.Exp visit(Lcalc.Array array) {
    return array.copy(visitList(array.args));
  }

  protected Lcalc.Exp visit(Lcalc.If anIf) {
    return anIf.copy(anIf.condition.accept(this), anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  protected Lcalc.Exp visit(Lcalc.Assert anAssert) {
    return anAssert.copy(anAssert.exp.accept(this));
  }

  // program

  protected Lcalc.ScopeLets visit(Lcalc.ScopeLet scopeLet) {
    return scopeLet.copy(scopeLet.exp.accept(this),
        scopeLet.next.accept(this));
  }

  protected Lcalc.ScopeLets visit(Lcalc.Result result) {
    return result.copy(result.exp.accept(this));
  }

  protected Lcalc.ScopeBody visit(Lcalc.ScopeBody scopeBody) {
    return scopeBody.copy(scopeBody.lets.accept(this));
  }

  protected Lcalc.CodeItem visit(Lcalc.TopDef topDef) {
    return topDef.copy(topDef.exp.accept(this));
  }

  protected Lcalc.CodeItem visit(Lcalc.ScopeDef scopeDef) {
    return scopeDef.copy(scopeDef.body.accept(this));
  }

  protected Lcalc.Program visit(Lcalc.Program program) {
    final List<Lcalc.CodeItem> items = new ArrayList<>();
    program.items.forEach(item -> items.add(item.accept(this)));
    return program.copy(items);
  }
}

// End Shuttle.java
