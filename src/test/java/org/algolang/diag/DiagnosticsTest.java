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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.algolang.Options;
import org.algolang.tree.SourceLine;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DiagnosticsTest {

  private static final SourceLine LINE = new SourceLine("test.a68", 3, "BEGIN SKIP END");

  private final DiagnosticList sink = new DiagnosticList();

  @Test
  public void countsErrorsAndWarningsSeparately() {
    Diagnostics diagnostics = new Diagnostics(sink, Options.DEFAULT);
    diagnostics.errorAt(Severity.SYNTAX, LINE, 1, "first %s", "error");
    diagnostics.warning(null, "a warning");
    diagnostics.errorAt(Severity.SEMANTIC, LINE, 7, "second error");

    assertThat(diagnostics.errorCount()).isEqualTo(2);
    assertThat(diagnostics.warningCount()).isEqualTo(1);
    assertThat(sink.errors().stream().map(Diagnostic::message))
        .containsExactly("first error", "second error")
        .inOrder();
    assertThat(sink.warnings().get(0).severity()).isEqualTo(Severity.WARNING);
  }

  @Test
  public void identicalDiagnosticsAreReportedOnce() {
    Diagnostics diagnostics = new Diagnostics(sink, Options.DEFAULT);
    diagnostics.errorAt(Severity.SYNTAX, LINE, 5, "missing symbol");
    diagnostics.errorAt(Severity.SYNTAX, LINE, 5, "missing symbol");
    diagnostics.errorAt(Severity.SYNTAX, LINE, 6, "missing symbol");

    assertThat(diagnostics.errorCount()).isEqualTo(2);
    assertThat(sink.all()).hasSize(2);
  }

  @Test
  public void quietDropsWarnings() {
    Options quiet = Options.builder().verbosity(Options.Verbosity.QUIET).build();
    Diagnostics diagnostics = new Diagnostics(sink, quiet);
    diagnostics.warning(null, "dropped");
    diagnostics.hint(null, "dropped too");

    assertThat(diagnostics.warningCount()).isEqualTo(0);
    assertThat(sink.all()).isEmpty();
  }

  @Test
  public void hintsNeedVerbose() {
    Diagnostics diagnostics = new Diagnostics(sink, Options.DEFAULT);
    diagnostics.hint(null, "not shown");
    assertThat(sink.all()).isEmpty();

    diagnostics.setOptions(Options.builder().verbosity(Options.Verbosity.VERBOSE).build());
    diagnostics.hint(null, "shown");
    assertThat(sink.warnings()).hasSize(1);
  }

  @Test
  public void errorBeyondBudgetAborts() {
    Diagnostics diagnostics = new Diagnostics(sink, Options.builder().maxErrors(2).build());
    diagnostics.errorAt(Severity.SEMANTIC, LINE, 1, "one");
    diagnostics.errorAt(Severity.SEMANTIC, LINE, 2, "two");
    assertThat(diagnostics.budgetExhausted()).isFalse();

    assertThrows(
        PhaseAbort.class, () -> diagnostics.errorAt(Severity.SEMANTIC, LINE, 3, "three"));
    assertThat(diagnostics.budgetExhausted()).isTrue();
    assertThat(sink.errors()).hasSize(3);
  }

  @Test
  public void depthGuardReportsTooComplex() {
    Diagnostics diagnostics = new Diagnostics(sink, Options.DEFAULT);
    DepthGuard guard = new DepthGuard(diagnostics, 2);
    guard.enter(null);
    guard.enter(null);
    guard.exit();
    guard.enter(null);
    assertThat(guard.depth()).isEqualTo(2);

    assertThrows(PhaseAbort.class, () -> guard.enter(null));
    assertThat(sink.errors().get(0).message()).isEqualTo(DepthGuard.TOO_COMPLEX);
  }
}
