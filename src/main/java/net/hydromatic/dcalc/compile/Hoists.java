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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.ast.Pos;

/**
 * Table of expressions that have been hoisted out of their position, keyed by
 * the placeholder variables that replace them.
 *
 * <p>Entries are in the order that they were discovered, and that order is
 * preserved by {@link #union}. The {@link Materializer} wraps the first
 * entry outermost.
 */
public class Hoists {
  private static final Hoists EMPTY = new Hoists(ImmutableMap.of());

  public final ImmutableMap<Lcalc.IdPat, Hoist> map;

  private Hoists(ImmutableMap<Lcalc.IdPat, Hoist> map) {
    this.map = requireNonNull(map);
  }

  /** Returns the empty table. */
  public static Hoists empty() {
    return EMPTY;
  }

  /** Returns a table with one entry. */
  public static Hoists of(Lcalc.IdPat placeholder, Kind kind, Dcalc.Exp exp,
      Environment env) {
    return new Hoists(ImmutableMap.of(placeholder, new Hoist(kind, exp, env)));
  }

  /** Returns the union of tables, which must be disjoint. */
  public static Hoists union(Pos pos, List<Hoists> hoistsList) {
    final Map<Lcalc.IdPat, Hoist> map = new LinkedHashMap<>();
    for (Hoists hoists : hoistsList) {
      hoists.map.forEach((placeholder, hoist) -> {
        if (map.put(placeholder, hoist) != null) {
          throw CompileException.internal(pos,
              "Two supposed to be disjoint maps have one shared key: %s",
              placeholder);
        }
      });
    }
    if (map.isEmpty()) {
      return EMPTY;
    }
    return new Hoists(ImmutableMap.copyOf(map));
  }

  /** Returns the union of this table and another, which must be
   * disjoint. */
  public Hoists plus(Pos pos, Hoists hoists) {
    if (hoists.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return hoists;
    }
    return union(pos, ImmutableList.of(this, hoists));
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public int size() {
    return map.size();
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /** Kind of hoisted expression. */
  public enum Kind {
    /** Default term. */
    DEFAULT,
    /** Empty literal. */
    EMPTY,
    /** Reference to a variable whose value may be absent, or the forcing of
     * a thunk. */
    VAR,
    /** Application of a function whose result may be absent, or to
     * arguments that may be absent. */
    APPLICATION,
    /** Assertion whose argument may be absent. */
    ASSERTION,
    /** Argument of a let; the placeholder is the let's own variable. */
    LET,
    /** Conditional one of whose branches may be absent. */
    CONDITIONAL,
    /** Match one of whose cases may be absent. */
    MATCH
  }

  /** A hoisted expression, and the environment in which it was found. */
  public static class Hoist {
    public final Kind kind;
    public final Dcalc.Exp exp;
    public final Environment env;

    Hoist(Kind kind, Dcalc.Exp exp, Environment env) {
      this.kind = requireNonNull(kind);
      this.exp = requireNonNull(exp);
      this.env = requireNonNull(env);
    }

    @Override
    public String toString() {
      return kind + " " + exp;
    }
  }
}

// End Hoists.java
