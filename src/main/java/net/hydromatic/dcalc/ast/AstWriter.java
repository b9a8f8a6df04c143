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

import java.math.BigDecimal;
import java.util.List;

/** Converts {@link AstNode} trees to strings. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, without parentheses. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends a node in argument position, with parentheses unless it is an
   * atom. */
  public AstWriter appendArg(AstNode node) {
    if (node.op.atom) {
      return node.unparse(this);
    }
    b.append('(');
    node.unparse(this);
    b.append(')');
    return this;
  }

  /** Appends a list of nodes, separated by a delimiter. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      nodes.get(i).unparse(this);
    }
    return this;
  }

  /** Appends a literal value. */
  public AstWriter literal(Op op, Object value) {
    switch (op) {
      case DECIMAL_LITERAL:
        b.append(((BigDecimal) value).toPlainString());
        break;
      case MONEY_LITERAL:
        b.append('$').append(((BigDecimal) value).toPlainString());
        break;
      case DATE_LITERAL:
        b.append('|').append(value).append('|');
        break;
      case DURATION_LITERAL:
        b.append('[').append(value).append(']');
        break;
      case EMPTY_LITERAL:
        b.append("empty");
        break;
      default:
        b.append(value);
    }
    return this;
  }

  /** Appends the name of a variable, suffixed with its ordinal if positive. */
  public AstWriter id(String name, int i) {
    b.append(name);
    if (i > 0) {
      b.append('_').append(i);
    }
    return this;
  }
}

// End AstWriter.java
