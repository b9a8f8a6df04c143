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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import net.hydromatic.dcalc.type.FnType;
import net.hydromatic.dcalc.type.PrimitiveType;
import net.hydromatic.dcalc.type.Type;
import net.hydromatic.dcalc.type.TypeSystem;

/** Built-in operators. */
public enum BuiltIn {
  /** Boolean negation, "not b". */
  NOT("not", 1, false),
  AND("&&", 2, true),
  OR("||", 2, true),
  /** Addition of numbers, and of a duration to a date or a duration. */
  PLUS("+", 2, true),
  /** Subtraction of numbers, and of dates (giving a duration). */
  MINUS("-", 2, true),
  TIMES("*", 2, true),
  /** Division. Dividing integers gives a decimal. */
  DIVIDE("/", 2, true),
  NEGATE("~", 1, false),
  LT("<", 2, true),
  LE("<=", 2, true),
  GT(">", 2, true),
  GE(">=", 2, true),
  EQ("=", 2, true),
  NE("<>", 2, true),
  /** Number of elements of an array. */
  LENGTH("length", 1, false),

  /**
   * Resolves a default at run time, "handle_default_opt exceptions
   * justification consequence".
   *
   * <p>The exceptions are an array of options. If more than one exception
   * is present, raises a conflict; if exactly one is present, returns it;
   * otherwise, if the justification is "Some true" returns the consequence,
   * else "None". The consequence is evaluated only if it is returned.
   */
  HANDLE_DEFAULT_OPT("handle_default_opt", 3, false);

  /** Name of the operator in printed programs. */
  public final String mlName;
  public final int arity;
  /** Whether the operator is printed between its two arguments. */
  public final boolean infix;

  BuiltIn(String mlName, int arity, boolean infix) {
    this.mlName = mlName;
    this.arity = arity;
    this.infix = infix;
  }

  /** Returns the type of the result of applying this operator to arguments
   * of the given types. */
  public Type resultType(List<? extends Type> argTypes) {
    checkArgument(argTypes.size() == arity,
        "operator %s expects %s arguments", mlName, arity);
    final Type t0 = argTypes.get(0);
    switch (this) {
      case NOT:
      case AND:
      case OR:
      case LT:
      case LE:
      case GT:
      case GE:
      case EQ:
      case NE:
        return PrimitiveType.BOOL;
      case MINUS:
        return t0 == PrimitiveType.DATE && argTypes.get(1) == PrimitiveType.DATE
            ? PrimitiveType.DURATION
            : t0;
      case DIVIDE:
        return t0 == PrimitiveType.INTEGER
                || t0 == PrimitiveType.MONEY
                    && argTypes.get(1) == PrimitiveType.MONEY
            ? PrimitiveType.DECIMAL
            : t0;
      case LENGTH:
        return PrimitiveType.INTEGER;
      case HANDLE_DEFAULT_OPT:
        return argTypes.get(2);
      default:
        return t0;
    }
  }

  /** Returns the type of this operator applied to arguments of the given
   * types. */
  public FnType fnType(TypeSystem typeSystem, List<? extends Type> argTypes) {
    return typeSystem.fnType(argTypes, resultType(argTypes));
  }
}

// End BuiltIn.java
