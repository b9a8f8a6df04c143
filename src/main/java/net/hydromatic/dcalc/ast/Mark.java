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

import net.hydromatic.dcalc.type.Type;

/** Annotation on a {@link Dcalc} node: its position and static type. */
public class Mark {
  public final Pos pos;
  public final Type type;

  protected Mark(Pos pos, Type type) {
    this.pos = requireNonNull(pos);
    this.type = requireNonNull(type);
  }

  /** Creates a Mark. */
  public static Mark of(Pos pos, Type type) {
    return new Mark(pos, type);
  }

  @Override
  public String toString() {
    return type + " at " + pos;
  }
}

// End Mark.java
