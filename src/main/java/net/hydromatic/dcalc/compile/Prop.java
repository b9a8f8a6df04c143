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
package net.hydromatic.dcalc.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures the translation.
 *
 * @see Compiles#translateProgram
 */
public enum Prop {
  /**
   * String property "optionEnum" is the name under which the option
   * enumeration is declared in translated programs. Default is "Option".
   */
  OPTION_ENUM("optionEnum", String.class, "Option"),

  /**
   * Boolean property "checkOutput" controls whether to check, after
   * translation, that every variable of the output is bound and every struct
   * and enumeration it uses is declared. Default is true.
   */
  CHECK_OUTPUT("checkOutput", Boolean.class, true),

  /**
   * Boolean property "simplify" controls whether to simplify translated
   * programs, for example by rewriting a match on "Some e" into a let.
   * Default is false.
   */
  SIMPLIFY("simplify", Boolean.class, false),

  /**
   * Boolean property "lint" controls whether to warn about struct fields and
   * enumeration constructors that are never used. Default is true.
   */
  LINT("lint", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Properties keyed by both {@link #name()} and {@link #camelName}. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** Properties sorted by {@link #camelName}. */
  public static final ImmutableList<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = new ArrayList<>(Arrays.asList(values()));
    list.sort(Comparator.comparing((Prop p) -> p.camelName));
    BY_CAMEL_NAME = ImmutableList.copyOf(list);

    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : BY_CAMEL_NAME) {
      b.put(prop.name(), prop);
      b.put(prop.camelName, prop);
    }
    BY_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name or camel name. Never returns null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "property %s not found", propName);
    return prop;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    return value(map, Boolean.class);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    return value(map, String.class);
  }

  private <T> T value(Map<Prop, Object> map, Class<T> requestedType) {
    checkArgument(type == requestedType,
        "property %s has type %s, not %s", camelName, type.getSimpleName(),
        requestedType.getSimpleName());
    final Object o = map.get(this);
    return requestedType.cast(o != null ? o : defaultValue);
  }

  /** Sets the value of a property, or resets it to its default value if
   * {@code value} is null. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    checkArgument(type.isInstance(value),
        "value for property %s must have type %s", camelName,
        type.getSimpleName());
    map.put(this, value);
  }

  /** Sets the value of a property from a string, converting it to the
   * property's type. */
  public void setString(Map<Prop, Object> map, String value) {
    if (type == Boolean.class) {
      checkArgument(value.equals("true") || value.equals("false"),
          "value for property %s must be 'true' or 'false'", camelName);
      set(map, Boolean.valueOf(value));
    } else {
      set(map, value);
    }
  }
}

// End Prop.java
