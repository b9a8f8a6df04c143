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

/** The type of an enumeration value. Constructors are declared in the
 * {@link TypeSystem}. */
public class EnumType extends BaseType {
  public final String name;

  EnumType(String name) {
    super(Op.ENUM_TYPE);
    this.name = name;
  }

  @Override
  public String moniker() {
    return name;
  }

  @Override
  public EnumType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    return this;
  }
}

// End EnumType.java
