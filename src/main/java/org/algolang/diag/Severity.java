/*
 * Copyright 2025 The algol68-front Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.algolang.diag;

/** The kind of a {@link Diagnostic}. */
public enum Severity {
  /** A malformed token; aborts scanning. */
  LEXICAL,
  /** A bracket or keyword mismatch, or a phrase that cannot be reduced. */
  SYNTAX,
  /** An undeclared or duplicate name, an ill-formed mode, a type or scope error. */
  SEMANTIC,
  /** Reported, but does not prevent later phases from running. */
  WARNING,
  /**
   * An invariant the compiler itself must guarantee has failed; never caused by a correct program
   * in a correct build.
   */
  INTERNAL;

  public boolean isError() {
    return this != WARNING;
  }
}
