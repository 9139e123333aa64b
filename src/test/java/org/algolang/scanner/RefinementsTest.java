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

package org.algolang.scanner;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.algolang.Options;
import org.algolang.Session;
import org.algolang.diag.Diagnostic;
import org.algolang.diag.DiagnosticList;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.algolang.testing.Programs;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RefinementsTest {

  private final DiagnosticList sink = new DiagnosticList();
  private final Session session = new Session(Options.DEFAULT, sink);

  private @Nullable Node expand(String... text) {
    List<SourceLine> lines = new ArrayList<>();
    for (String line : text) {
      lines.add(new SourceLine("test.a68", lines.size() + 1, line));
    }
    Node top = new Scanner(session, new FileSystemSourceReader(Path.of("."))).scan(lines);
    return Refinements.expand(session.diagnostics(), top);
  }

  private static String spelling(@Nullable Node p) {
    List<String> symbols = new ArrayList<>();
    for (; p != null; p = p.next()) {
      symbols.add(p.symbol());
    }
    return String.join(" ", symbols);
  }

  private ImmutableList<String> errors() {
    return sink.errors().stream().map(Diagnostic::message).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void programWithoutRefinementsIsUnchanged() {
    assertThat(spelling(expand("BEGIN SKIP END"))).isEqualTo("BEGIN SKIP END");
    assertThat(sink.all()).isEmpty();
  }

  @Test
  public void bodiesReplaceTheirApplications() {
    Node top =
        expand(
            "BEGIN init; print(x) END.",
            "init: INT x = 1; report.",
            "report: print(0).");

    assertThat(spelling(top))
        .isEqualTo("BEGIN INT x = 1 ; print ( 0 ) ; print ( x ) END");
    assertThat(sink.all()).isEmpty();
  }

  @Test
  public void unusedRefinement() {
    expand("BEGIN SKIP END.", "spare: SKIP.");
    assertThat(errors()).containsExactly(Refinements.NOT_APPLIED);
  }

  @Test
  public void refinementAppliedTwice() {
    expand("BEGIN step; step END.", "step: SKIP.");
    assertThat(errors()).contains(Refinements.APPLIED);
  }

  @Test
  public void duplicateDefinition() {
    expand("BEGIN step END.", "step: SKIP.", "step: SKIP.");
    assertThat(errors()).contains(Refinements.DEFINED);
  }

  @Test
  public void expandedProgramCompiles() {
    Programs.Compiled compiled =
        Programs.compile("BEGIN declare; print(sum) END.\ndeclare: INT sum = 1 + 2.\n");
    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.result().succeeded()).isTrue();
  }
}
