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

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Value of a struct type. */
public class StructValue {
  public final String name;
  public final ImmutableMap<String, Object> fields;

  private StructValue(String name, ImmutableMap<String, Object> fields) {
    this.name = requireNonNull(name);
    this.fields = requireNonNull(fields);
  }

  /** Creates a struct value. */
  public static StructValue of(String name, Map<String, Object> fields) {
    return new StructValue(name, ImmutableMap.copyOf(fields));
  }

  /** Returns the value of a field; throws if there is no such field. */
  public Object get(String field) {
    final Object value = fields.get(field);
    if (value == null) {
      throw new IllegalArgumentException("struct " + name
          + " has no field " + field);
    }
    return value;
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + fields.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof StructValue
            && name.equals(((StructValue) o).name)
            && fields.equals(((StructValue) o).fields);
  }

  @Override
  public String toString() {
    return name + " " + fields;
  }
}

// End StructValue.java
