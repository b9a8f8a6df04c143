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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.OPTION_ENUM.stringValue(map), is("Option"));
    assertThat(Prop.CHECK_OUTPUT.booleanValue(map), is(true));
    assertThat(Prop.SIMPLIFY.booleanValue(map), is(false));
    assertThat(Prop.LINT.booleanValue(map), is(true));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SIMPLIFY.setString(map, "true");
    Prop.OPTION_ENUM.set(map, "Optional");
    assertThat(Prop.SIMPLIFY.booleanValue(map), is(true));
    assertThat(Prop.OPTION_ENUM.stringValue(map), is("Optional"));
    assertThrows(RuntimeException.class,
        () -> Prop.LINT.setString(map, "yes"));
    assertThrows(RuntimeException.class, () -> Prop.LINT.set(map, "true"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.LINT.stringValue(map));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("checkOutput"), is(Prop.CHECK_OUTPUT));
    assertThat(Prop.lookup("CHECK_OUTPUT"), is(Prop.CHECK_OUTPUT));
    assertThrows(RuntimeException.class, () -> Prop.lookup("check_output"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.CHECK_OUTPUT));
  }
}

// End PropTest.java
