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
package net.hydromatic.dcalc.type;

import java.util.function.UnaryOperator;
import net.hydromatic.dcalc.ast.Op;

/** Type. */
public interface Type {
  /** Description of the type, e.g. "{@code integer}", "{@code unit ->
   * money}", "{@code decimal option}". */
  String moniker();

  /** Type operator. */
  Op op();

  /**
   * Returns whether this is a thunk type, that is, a function type with a
   * single {@code unit} parameter.
   *
   * <p>A variable of thunk type models an input that callers may override,
   * and whose value may be absent.
   */
  default boolean isThunk() {
    return false;
  }

  /**
   * Copies this type, applying a given transform to each component type, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform);
}

// End Type.java
