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
package net.hydromatic.dcalc.ast;

/** Kind of binding in a scope body. */
public enum ScopeLetKind {
  /** Definition of a variable of the scope. */
  SCOPE_VAR_DEFINITION,
  /** Definition of an input variable of a sub-scope, made by the calling
   * scope. */
  SUBSCOPE_VAR_DEFINITION,
  /** Binding of a field of the scope's input struct. */
  DESTRUCTURING_INPUT_STRUCT,
  /** Call of a sub-scope. */
  CALLING_SUBSCOPE,
  /** Binding of a field of the struct returned by a sub-scope. */
  DESTRUCTURING_SUBSCOPE_RESULTS,
  /** Assertion. */
  ASSERTION
}

// End ScopeLetKind.java
