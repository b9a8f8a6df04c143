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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import net.hydromatic.dcalc.ast.Op;

/** The type of a tuple value. */
public class TupleType extends BaseType {
  public final ImmutableList<Type> argTypes;

  TupleType(List<? extends Type> argTypes) {
    super(Op.TUPLE_TYPE);
    this.argTypes = ImmutableList.copyOf(argTypes);
  }

  @Override
  public String moniker() {
    return argTypes.stream()
        .map(Type::moniker)
        .collect(Collectors.joining(" * ", "(", ")"));
  }

  @Override
  public TupleType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final List<Type> argTypes2 =
        argTypes.stream()
            .map(transform)
            .collect(Collectors.toList());
    return argTypes2.equals(argTypes) ? this : typeSystem.tupleType(argTypes2);
  }
}

// End TupleType.java
