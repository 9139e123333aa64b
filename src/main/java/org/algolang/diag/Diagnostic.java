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

import org.algolang.tree.SourceLine;
import org.jspecify.annotations.Nullable;

/**
 * A single reported problem. {@code line} is null for problems not tied to a source position (e.g.
 * an empty program).
 */
public record Diagnostic(
    Severity severity, @Nullable SourceLine line, int column, String message) {

  @Override
  public String toString() {
    String where = (line == null) ? "" : String.format(" (%s:%s)", line, column);
    return String.format("%s: %s%s", severity, message, where);
  }
}
