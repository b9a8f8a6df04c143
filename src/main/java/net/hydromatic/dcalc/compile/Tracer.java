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
import net.hydromatic.dcalc.ast.Dcalc;
import net.hydromatic.dcalc.ast.Lcalc;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when an expression has been analyzed; its marks are
   * {@link net.hydromatic.dcalc.ast.AnalysisMark}s. */
  void onAnalysis(Dcalc.Exp e);

  /** Called when an expression is hoisted out of its position and replaced
   * by a reference to a placeholder variable. */
  void onHoist(Lcalc.IdPat placeholder, Dcalc.Exp e);

  /** Called when a declaration has been translated. */
  void onTranslation(Lcalc.CodeItem item);

  /** Called with the list of warnings. */
  void onWarnings(List<CompileException> warningList);

  /**
   * Called with the exception thrown during compilation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
