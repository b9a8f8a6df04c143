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

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on an analyzed
   * expression, then calls the underlying tracer. */
  public static Tracer withOnAnalysis(Tracer tracer,
      Consumer<Dcalc.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onAnalysis(Dcalc.Exp e) {
        consumer.accept(e);
        super.onAnalysis(e);
      }
    };
  }

  /** Returns a tracer that performs the given action on each hoist,
   * then calls the underlying tracer. */
  public static Tracer withOnHoist(Tracer tracer,
      BiConsumer<Lcalc.IdPat, Dcalc.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onHoist(Lcalc.IdPat placeholder, Dcalc.Exp e) {
        consumer.accept(placeholder, e);
        super.onHoist(placeholder, e);
      }
    };
  }

  /** Returns a tracer that performs the given action on each translated
   * declaration, then calls the underlying tracer. */
  public static Tracer withOnTranslation(Tracer tracer,
      Consumer<Lcalc.CodeItem> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTranslation(Lcalc.CodeItem item) {
        consumer.accept(item);
        super.onTranslation(item);
      }
    };
  }

  public static Tracer withOnWarnings(Tracer tracer,
      Consumer<List<CompileException>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarnings(List<CompileException> warningList) {
        consumer.accept(warningList);
        super.onWarnings(warningList);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onAnalysis(Dcalc.Exp e) {}

    @Override
    public void onHoist(Lcalc.IdPat placeholder, Dcalc.Exp e) {}

    @Override
    public void onTranslation(Lcalc.CodeItem item) {}

    @Override
    public void onWarnings(List<CompileException> warningList) {}

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onAnalysis(Dcalc.Exp e) {
      tracer.onAnalysis(e);
    }

    @Override
    public void onHoist(Lcalc.IdPat placeholder, Dcalc.Exp e) {
      tracer.onHoist(placeholder, e);
    }

    @Override
    public void onTranslation(Lcalc.CodeItem item) {
      tracer.onTranslation(item);
    }

    @Override
    public void onWarnings(List<CompileException> warningList) {
      tracer.onWarnings(warningList);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
