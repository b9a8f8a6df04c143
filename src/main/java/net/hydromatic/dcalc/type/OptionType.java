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

/**
 * The type of a value that may be absent.
 *
 * <p>Values of this type are injections into the option enumeration, whose
 * constructors are "None" (payload {@code unit}) and "Some" (payload the
 * element type). It occurs only in translated programs.
 */
public class OptionType extends BaseType {
  public final Type elementType;

  OptionType(Type elementType) {
    super(Op.OPTION_TYPE);
    this.elementType = elementType;
  }

  @Override
  public String moniker() {
    final String s = elementType.moniker();
    return (elementType.op() == Op.FUNCTION_TYPE ? "(" + s + ")" : s)
        + " option";
  }

  @Override
  public OptionType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final Type elementType2 = transform.apply(elementType);
    return elementType2 == elementType
        ? this
        : typeSystem.optionType(elementType2);
  }
}

// End OptionType.java
