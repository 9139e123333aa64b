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
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.algolang.Options;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.jspecify.annotations.Nullable;

/**
 * Counts and forwards the diagnostics of one compilation. Identical diagnostics at the same
 * position are reported once, and warnings are dropped when the verbosity is {@code QUIET}.
 *
 * <p>Once more than {@link Options#maxErrors} errors have been reported, the next error throws a
 * {@link PhaseAbort} and {@link #budgetExhausted} becomes true, which stops the whole run.
 */
public final class Diagnostics {
  private final DiagnosticSink sink;
  private Options options;
  private int errorCount;
  private int warningCount;
  private boolean budgetExhausted;
  private final Set<Diagnostic> reported = new HashSet<>();

  public Diagnostics(DiagnosticSink sink, Options options) {
    this.sink = Objects.requireNonNull(sink);
    this.options = options;
  }

  /** Pragmats may change the verbosity mid-source. */
  public void setOptions(Options options) {
    this.options = options;
  }

  public int errorCount() {
    return errorCount;
  }

  public int warningCount() {
    return warningCount;
  }

  public boolean budgetExhausted() {
    return budgetExhausted;
  }

  /** Reports an error of the given severity at {@code node}. */
  @FormatMethod
  public void error(Severity severity, @Nullable Node node, String fmt, Object... fmtArgs) {
    if (node == null) {
      report(severity, null, 0, String.format(fmt, fmtArgs));
    } else {
      report(severity, node.line(), node.column(), String.format(fmt, fmtArgs));
    }
  }

  /** Reports an error at a position that has no node, e.g. inside a malformed token. */
  @FormatMethod
  public void errorAt(
      Severity severity, @Nullable SourceLine line, int column, String fmt, Object... fmtArgs) {
    report(severity, line, column, String.format(fmt, fmtArgs));
  }

  @FormatMethod
  public void warning(@Nullable Node node, String fmt, Object... fmtArgs) {
    if (options.verbosity() == Options.Verbosity.QUIET) {
      return;
    }
    error(Severity.WARNING, node, fmt, fmtArgs);
  }

  /** Reports a warning only when the verbosity is {@code VERBOSE}. */
  @FormatMethod
  public void hint(@Nullable Node node, String fmt, Object... fmtArgs) {
    if (options.verbosity() == Options.Verbosity.VERBOSE) {
      error(Severity.WARNING, node, fmt, fmtArgs);
    }
  }

  private void report(Severity severity, @Nullable SourceLine line, int column, String msg) {
    Diagnostic d = new Diagnostic(severity, line, column, msg);
    if (!reported.add(d)) {
      return;
    }
    if (severity.isError()) {
      errorCount++;
    } else {
      warningCount++;
    }
    sink.report(d);
    if (severity.isError() && errorCount > options.maxErrors()) {
      budgetExhausted = true;
      throw new PhaseAbort("too many errors");
    }
  }
}
