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

/** Visits {@link Dcalc} trees. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Dcalc.Exp e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Dcalc.Id id) {}

  protected void visit(Dcalc.Literal literal) {}

  protected void visit(Dcalc.OpRef opRef) {}

  protected void visit(Dcalc.Abs abs) {
    abs.body.accept(this);
  }

  protected void visit(Dcalc.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Dcalc.Struct struct) {
    struct.fields.values().forEach(this::accept);
  }

  protected void visit(Dcalc.StructAccess structAccess) {
    structAccess.exp.accept(this);
  }

  protected void visit(Dcalc.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Dcalc.TupleAccess tupleAccess) {
    tupleAccess.exp.accept(this);
  }

  protected void visit(Dcalc.Inj inj) {
    inj.exp.accept(this);
  }

  protected void visit(Dcalc.Match match) {
    match.exp.accept(this);
    match.cases.values().forEach(this::accept);
  }

  protected void visit(Dcalc.Array array) {
    array.args.forEach(this::accept);
  }

  protected void visit(Dcalc.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Dcalc.Assert anAssert) {
    anAssert.exp.accept(this);
  }

  protected void visit(Dcalc.ErrorOnEmpty errorOnEmpty) {
    errorOnEmpty.exp.accept(this);
  }

  protected void visit(Dcalc.Default aDefault) {
    aDefault.excepts.forEach(this::accept);
    aDefault.just.accept(this);
    aDefault.cons.accept(this);
  }

  // program

  protected void visit(Dcalc.ScopeLet scopeLet) {
    scopeLet.exp.accept(this);
    scopeLet.next.accept(this);
  }

  protected void visit(Dcalc.Result result) {
    result.exp.accept(this);
  }

  protected void visit(Dcalc.ScopeBody scopeBody) {
    scopeBody.lets.accept(this);
  }

  protected void visit(Dcalc.TopDef topDef) {
    topDef.exp.accept(this);
  }

  protected void visit(Dcalc.ScopeDef scopeDef) {
    scopeDef.body.accept(this);
  }

  protected void visit(Dcalc.Program program) {
    program.items.forEach(item -> item.accept(this));
  }
}

// End Visitor.java
