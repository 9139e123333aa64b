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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when the compiler detects that one of its own invariants does not hold, e.g. the coercion
 * inserter cannot find a coercion that the mode checker accepted. Phase drivers never catch it.
 */
public class CompilerBug extends RuntimeException {

  @FormatMethod
  public CompilerBug(String fmt, Object... fmtArgs) {
    super("internal consistency check failed: " + String.format(fmt, fmtArgs));
  }
}
