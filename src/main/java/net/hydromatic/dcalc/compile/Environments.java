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

import static java.util.Objects.requireNonNull;

import java.util.function.Consumer;
import net.hydromatic.dcalc.ast.Dcalc;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {

  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    for (Binding binding : bindings) {
      env = env.bind(binding);
    }
    return env;
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override
    public String toString() {
      return binding.id + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(Dcalc.IdPat id) {
      for (SubEnvironment e = this;;) {
        if (id.equals(e.binding.id)) {
          return e.binding;
        }
        if (e.parent instanceof SubEnvironment) {
          e = (SubEnvironment) e.parent;
        } else {
          return e.parent.getOpt(id);
        }
      }
    }

    @Override
    public Environment bind(Binding binding) {
      // The new binding will obscure the current environment's binding if it
      // binds the same variable. Bind the parent environment instead, so that
      // obscured bindings can be garbage-collected.
      final Environment env =
          this.binding.id.equals(binding.id) ? parent : this;
      return new SubEnvironment(env, binding);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(Consumer<Binding> consumer) {}

    @Override
    public @Nullable Binding getOpt(Dcalc.IdPat id) {
      return null;
    }
  }
}

// End Environments.java
