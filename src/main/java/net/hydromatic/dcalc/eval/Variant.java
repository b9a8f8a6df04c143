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
package net.hydromatic.dcalc.eval;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.dcalc.type.TypeSystem;

/**
 * Value of an enumeration type: a constructor and its payload.
 *
 * <p>Options are variants of the option enumeration, whose constructors are
 * {@link TypeSystem#NONE} (with payload {@link Unit#INSTANCE}) and {@link
 * TypeSystem#SOME}.
 */
public class Variant {
  public final String enumName;
  public final String constructor;
  public final Object value;

  private Variant(String enumName, String constructor, Object value) {
    this.enumName = requireNonNull(enumName);
    this.constructor = requireNonNull(constructor);
    this.value = requireNonNull(value);
  }

  /** Creates a variant. */
  public static Variant of(String enumName, String constructor, Object value) {
    return new Variant(enumName, constructor, value);
  }

  /** Creates "Some value". */
  public static Variant some(String optionEnum, Object value) {
    return new Variant(optionEnum, TypeSystem.SOME, value);
  }

  /** Creates "None". */
  public static Variant none(String optionEnum) {
    return new Variant(optionEnum, TypeSystem.NONE, Unit.INSTANCE);
  }

  /** Returns whether this is "Some v". */
  public boolean isSome() {
    return constructor.equals(TypeSystem.SOME);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enumName, constructor, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Variant
            && enumName.equals(((Variant) o).enumName)
            && constructor.equals(((Variant) o).constructor)
            && value.equals(((Variant) o).value);
  }

  @Override
  public String toString() {
    return value == Unit.INSTANCE ? constructor : constructor + " " + value;
  }
}

// End Variant.java
