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

import static net.hydromatic.dcalc.ast.DcalcBuilder.dcalc;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsInstanceOf.instanceOf;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.type.PrimitiveType;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests for {@link net.hydromatic.dcalc.compile.Environment}. */
public class EnvironmentTest {
  private static Binding present(String name) {
    return Binding.of(dcalc.idPat(PrimitiveType.INTEGER, name), true, null);
  }

  private static Binding absent(String name) {
    return Binding.of(dcalc.idPat(PrimitiveType.INTEGER, name), false, null);
  }

  private static Set<String> names(Environment env) {
    return env.getValueMap().keySet().stream()
        .map(Dcalc.IdPat::toString)
        .collect(Collectors.toSet());
  }

  /**
   * Tests that if you call {@link Environment#bind} twice with the same
   * variable, the binding chain does not get longer.
   */
  @Test
  void testOptimizeSubEnvironment() {
    final Environment e0 =
        Environments.empty()
            .bind(present("a"))
            .bind(present("b"))
            .bind(present("c"));
    assertThat(e0, instanceOf(Environments.SubEnvironment.class));
    final Set<String> nameSet = ImmutableSet.of("a", "b", "c");
    final Set<String> namePlusFooSet =
        ImmutableSet.<String>builder().addAll(nameSet).add("foo").build();
    assertThat(names(e0), is(nameSet));
    assertThat(e0, hasEnvLength(3));

    // Rebind "c", the most recent; still 3 bindings, and "c" is now absent.
    final Environment e1 = e0.bind(absent("c"));
    assertThat(names(e1), is(nameSet));
    assertThat(e1, hasEnvLength(3));
    assertThat(
        e1.getOpt(dcalc.idPat(PrimitiveType.INTEGER, "c")).pure, is(false));

    // Rebind "a", which is not the most recent. The old binding stays in the
    // chain, obscured.
    final Environment e2 = e1.bind(absent("a"));
    assertThat(names(e2), is(nameSet));
    assertThat(e2, hasEnvLength(4));
    assertThat(
        e2.getOpt(dcalc.idPat(PrimitiveType.INTEGER, "a")).pure, is(false));

    // Add "foo". Value count and binding count increase.
    final Environment e3 = e2.bind(present("foo"));
    assertThat(names(e3), is(namePlusFooSet));
    assertThat(e3, hasEnvLength(5));

    // The old environments have not changed.
    assertThat(
        e0.getOpt(dcalc.idPat(PrimitiveType.INTEGER, "c")).pure, is(true));
    assertThat(e0.getOpt(dcalc.idPat(PrimitiveType.INTEGER, "foo")) == null,
        is(true));
  }

  /** Variables with the same name and different ordinals are distinct. */
  @Test
  void testOrdinal() {
    final Dcalc.IdPat x0 = dcalc.idPat(PrimitiveType.INTEGER, "x", 0);
    final Dcalc.IdPat x1 = dcalc.idPat(PrimitiveType.INTEGER, "x", 1);
    final Environment env =
        Environments.empty()
            .bind(Binding.of(x0, true, null))
            .bind(Binding.of(x1, false, null));
    assertThat(env.getOpt(x0).pure, is(true));
    assertThat(env.getOpt(x1).pure, is(false));
    final Set<String> nameSet = ImmutableSet.of("x", "x_1");
    assertThat(names(env), is(nameSet));
  }

  private Matcher<Environment> hasEnvLength(int i) {
    return new CustomTypeSafeMatcher<Environment>("environment depth " + i) {
      @Override
      protected boolean matchesSafely(Environment env) {
        return depth(env) == i;
      }

      private int depth(Environment env) {
        final AtomicInteger c = new AtomicInteger();
        env.visit(b -> c.incrementAndGet());
        return c.get();
      }
    };
  }
}

// End EnvironmentTest.java
