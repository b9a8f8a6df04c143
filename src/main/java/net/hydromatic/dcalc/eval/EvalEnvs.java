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

import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link EvalEnv}. */
public class EvalEnvs {
  private EvalEnvs() {}

  /** Returns the empty evaluation environment. */
  public static EvalEnv empty() {
    return EmptyEvalEnv.INSTANCE;
  }

  /** Evaluation environment that has no bindings. */
  private static class EmptyEvalEnv implements EvalEnv {
    static final EmptyEvalEnv INSTANCE = new EmptyEvalEnv();

    @Override
    public @Nullable Object getOpt(Object key) {
      return null;
    }

    @Override
    public void visit(BiConsumer<Object, Object> consumer) {}
  }

  /** Evaluation environment that inherits from a parent environment and adds
   * one binding. */
  static class SubEvalEnv implements EvalEnv {
    private final EvalEnv parentEnv;
    private final Object key;
    private final Object value;

    SubEvalEnv(EvalEnv parentEnv, Object key, Object value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    @Override
    public void visit(BiConsumer<Object, Object> consumer) {
      consumer.accept(key, value);
      parentEnv.visit(consumer);
    }

    @Override
    public @Nullable Object getOpt(Object key) {
      for (SubEvalEnv e = this;;) {
        if (key.equals(e.key)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(key);
        }
      }
    }
  }
}

// End EvalEnvs.java
