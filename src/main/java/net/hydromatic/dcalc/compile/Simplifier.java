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

import static net.hydromatic.dcalc.ast.LcalcBuilder.lcalc;

import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Op;
import net.hydromatic.dcalc.ast.Shuttle;
import net.hydromatic.dcalc.type.TypeSystem;

/**
 * Simplifies translated programs.
 *
 * <p>A match on a constructor that is known, such as
 *
 * <blockquote><pre>match Some e with None _ -&gt; a | Some x -&gt; b</pre>
 * </blockquote>
 *
 * <p>becomes {@code let x = e in b}. The payload is evaluated in both forms,
 * so the rewrite preserves meaning.
 */
public class Simplifier extends Shuttle {
  private Simplifier(TypeSystem typeSystem) {
    super(typeSystem);
  }

  /** Simplifies a program. */
  public static Lcalc.Program simplify(Lcalc.Program program) {
    return new Simplifier(program.typeSystem).visit(program);
  }

  /** Simplifies an expression. */
  public static Lcalc.Exp simplify(TypeSystem typeSystem, Lcalc.Exp e) {
    return e.accept(new Simplifier(typeSystem));
  }

  @Override
  protected Lcalc.Exp visit(Lcalc.Match match) {
    final Lcalc.Exp e = super.visit(match);
    if (e.op != Op.MATCH) {
      return e;
    }
    final Lcalc.Match match2 = (Lcalc.Match) e;
    if (match2.exp.op == Op.INJ) {
      final Lcalc.Inj inj = (Lcalc.Inj) match2.exp;
      final Lcalc.Abs abs = match2.cases.get(inj.constructor);
      if (inj.name.equals(match2.name) && abs != null) {
        return lcalc.let(match2.pos, abs.params.get(0), inj.exp, abs.body);
      }
    }
    return match2;
  }
}

// End Simplifier.java
