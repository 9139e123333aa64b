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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** A DiagnosticSink that keeps every diagnostic it is given, in order. */
public final class DiagnosticList implements DiagnosticSink {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  @Override
  public void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public ImmutableList<Diagnostic> all() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the diagnostics whose severity is an error. */
  public ImmutableList<Diagnostic> errors() {
    return diagnostics.stream()
        .filter(d -> d.severity().isError())
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return diagnostics.stream()
        .filter(d -> !d.severity().isError())
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return diagnostics.toString();
  }
}
