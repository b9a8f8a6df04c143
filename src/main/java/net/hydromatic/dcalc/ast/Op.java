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

/** Sub-types of {@link AstNode}, and operators of {@link
 * net.hydromatic.dcalc.type.Type}. */
public enum Op {
  // identifiers
  ID(true),
  ID_PAT(true),

  // literals
  BOOL_LITERAL(true),
  INTEGER_LITERAL(true),
  DECIMAL_LITERAL(true),
  MONEY_LITERAL(true),
  DATE_LITERAL(true),
  DURATION_LITERAL(true),
  UNIT_LITERAL(true),
  /** The literal that denotes the absence of a value. Occurs in
   * {@link Dcalc}, never in {@link Lcalc}. */
  EMPTY_LITERAL(true),
  /** Reference to a {@link net.hydromatic.dcalc.compile.BuiltIn}. */
  OPERATOR(true),

  // expressions
  ABS,
  APPLY,
  LET,
  STRUCT(true),
  STRUCT_ACCESS(true),
  TUPLE(true),
  TUPLE_ACCESS(true),
  INJ,
  MATCH,
  ARRAY(true),
  IF,
  ASSERT,
  ERROR_ON_EMPTY,
  DEFAULT(true),
  RAISE,

  // program
  SCOPE_LET,
  RESULT,
  SCOPE_BODY,
  TOP_DEF,
  SCOPE_DEF,
  PROGRAM,

  // types
  PRIMITIVE_TYPE,
  FUNCTION_TYPE,
  TUPLE_TYPE,
  ARRAY_TYPE,
  STRUCT_TYPE,
  ENUM_TYPE,
  OPTION_TYPE,
  DUMMY_TYPE;

  /** Whether a node of this kind can be written as an argument without
   * parentheses. */
  public final boolean atom;

  Op() {
    this(false);
  }

  Op(boolean atom) {
    this.atom = atom;
  }

  /** Returns whether this is the op of a literal. */
  public boolean isLiteral() {
    switch (this) {
      case BOOL_LITERAL:
      case INTEGER_LITERAL:
      case DECIMAL_LITERAL:
      case MONEY_LITERAL:
      case DATE_LITERAL:
      case DURATION_LITERAL:
      case UNIT_LITERAL:
      case EMPTY_LITERAL:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
