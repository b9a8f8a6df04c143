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

import static net.hydromatic.dcalc.ast.LcalcBuilder.lcalc;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.dcalc.ast.Lcalc;
import net.hydromatic.dcalc.type.Type;

/**
 * Generates unique variables.
 *
 * <p>Keeps track of how many times each given name has been used in a
 * namespace, so that a new occurrence of a name can be given a fresh ordinal.
 * Each declaration has its own namespace, so declarations can be translated
 * independently.
 */
public class NameGenerator {
  private final String namespace;
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  /** Creates a NameGenerator for a given namespace. */
  public NameGenerator(String namespace) {
    this.namespace = namespace;
  }

  /** Returns the namespace. */
  public String namespace() {
    return namespace;
  }

  /** Returns the number of times that "name" has been used, then increments
   * it. The first call for a name returns 1. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .incrementAndGet();
  }

  /** Creates a variable whose name is {@code name} and that is distinct from
   * every other variable created by this generator. */
  public Lcalc.IdPat fresh(String name, Type type) {
    return lcalc.idPat(name, inc(name), namespace, type);
  }
}

// End NameGenerator.java
