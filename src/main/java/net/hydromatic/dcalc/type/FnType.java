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

/** The type of a function value. A function may have several parameters. */
public class FnType extends BaseType {
  public final ImmutableList<Type> paramTypes;
  public final Type resultType;

  FnType(List<? extends Type> paramTypes, Type resultType) {
    super(Op.FUNCTION_TYPE);
    this.paramTypes = ImmutableList.copyOf(paramTypes);
    this.resultType = resultType;
  }

  @Override
  public String moniker() {
    final String params =
        paramTypes.size() == 1
            ? paramTypes.get(0).moniker()
            : paramTypes.stream()
                .map(Type::moniker)
                .collect(Collectors.joining(", ", "(", ")"));
    return params + " -> " + resultType.moniker();
  }

  @Override
  public boolean isThunk() {
    return paramTypes.size() == 1 && paramTypes.get(0) == PrimitiveType.UNIT;
  }

  @Override
  public FnType copy(TypeSystem typeSystem, UnaryOperator<Type> transform) {
    final List<Type> paramTypes2 =
        paramTypes.stream()
            .map(transform)
            .collect(Collectors.toList());
    final Type resultType2 = transform.apply(resultType);
    return paramTypes2.equals(paramTypes) && resultType2 == resultType
        ? this
        : typeSystem.fnType(paramTypes2, resultType2);
  }
}

// End FnType.java
