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

package org.algolang;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.algolang.check.CoercionInserter;
import org.algolang.check.ModeChecker;
import org.algolang.diag.DiagnosticSink;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.PhaseAbort;
import org.algolang.diag.Severity;
import org.algolang.mode.ModeBuilder;
import org.algolang.parser.BottomUpParser;
import org.algolang.parser.BracketChecker;
import org.algolang.parser.TopDownParser;
import org.algolang.parser.VictalChecker;
import org.algolang.scanner.Refinements;
import org.algolang.scanner.Scanner;
import org.algolang.scanner.SourceReader;
import org.algolang.scope.ScopeChecker;
import org.algolang.taxes.Ranges;
import org.algolang.taxes.TagBinder;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the phases of the front end over one program.
 *
 * <p>The phases are run in order: scanning, refinement expansion, the bracket check, the top-down
 * parser, range set-up, the bottom-up parser, the victal check, mode construction, tag binding,
 * mode checking, coercion insertion and the scope check. A phase that throws {@link PhaseAbort}
 * ends the compilation. Semantic phases run only while no errors have been reported, since each
 * relies on the complete tree of the one before.
 */
public final class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  static final String EMPTY_PROGRAM = "program is empty";

  private record Phase(String name, Runnable body) {}

  private final Session session;
  private final Diagnostics diagnostics;
  private @Nullable Node top;

  private Compiler(Session session) {
    this.session = session;
    this.diagnostics = session.diagnostics();
  }

  /**
   * Compiles the program {@code text}.
   *
   * @param name the file name recorded in each source line, against which included files are
   *     resolved
   * @param reader resolves and reads files named by {@code include} pragmats
   * @param sink receives every diagnostic as it is reported
   */
  public static CompilationResult compile(
      String name, String text, Options options, SourceReader reader, DiagnosticSink sink) {
    ImmutableList.Builder<SourceLine> lines = ImmutableList.builder();
    int number = 1;
    for (String line : Splitter.onPattern("\r?\n").split(text)) {
      lines.add(new SourceLine(name, number++, line));
    }
    return compileLines(lines.build(), options, reader, sink);
  }

  /** Compiles a program that has already been split into lines. */
  public static CompilationResult compileLines(
      List<SourceLine> lines, Options options, SourceReader reader, DiagnosticSink sink) {
    Compiler compiler = new Compiler(new Session(options, sink));
    Node program = compiler.run(lines, reader) ? compiler.top : null;
    Session session = compiler.session;
    return new CompilationResult(
        program,
        session.modes(),
        session.standardEnvironment(),
        session.diagnostics().errorCount(),
        session.diagnostics().warningCount());
  }

  /**
   * Runs {@code body} as the phase {@code name}. Returns false if it was aborted; reported errors
   * alone do not stop it.
   */
  private boolean phase(String name, Runnable body) {
    int errors = diagnostics.errorCount();
    try {
      body.run();
    } catch (PhaseAbort e) {
      logger.warn("{} aborted: {}", name, e.getMessage());
      return false;
    }
    logger.debug("{} finished with {} errors", name, diagnostics.errorCount() - errors);
    return true;
  }

  /** Returns false if a phase was aborted and the tree is unusable. */
  private boolean run(List<SourceLine> lines, SourceReader reader) {
    Scanner scanner = new Scanner(session, reader);
    if (!phase("scanner", () -> top = scanner.scan(lines))) {
      return false;
    }
    if (top == null) {
      diagnostics.error(Severity.SYNTAX, null, EMPTY_PROGRAM);
      return false;
    }
    if (!phase("refinements", () -> top = Refinements.expand(diagnostics, top))) {
      return false;
    }
    boolean parsed =
        phase(
                "bracket checker",
                () -> {
                  BracketChecker.check(diagnostics, top);
                  if (session.options().brackets()) {
                    BracketChecker.substituteBrackets(top);
                  }
                })
            && phase(
                "top-down parser",
                () -> {
                  top.setTable(session.newTable(session.standardEnvironment()));
                  TopDownParser.parse(session, top);
                })
            && phase("ranges", () -> Ranges.preliminary(session, top))
            && phase("bottom-up parser", () -> BottomUpParser.parse(session, top))
            && phase(
                "victal checker",
                () -> {
                  BottomUpParser.checkPictures(session, top);
                  VictalChecker.check(session, top);
                });
    if (!parsed) {
      return false;
    }
    if (diagnostics.errorCount() > 0) {
      return true;
    }
    // Each of these needs a tree without errors.
    ImmutableList<Phase> checks =
        ImmutableList.of(
            new Phase("range finaliser", () -> Ranges.finalise(session, top)),
            new Phase("mode builder", () -> ModeBuilder.build(session, top)),
            new Phase(
                "tag binder",
                () -> {
                  TagBinder.bind(session, top);
                  BottomUpParser.rearrangeGotoLessJumps(top);
                }),
            new Phase("mode checker", () -> ModeChecker.check(session, top)),
            new Phase("coercion inserter", () -> CoercionInserter.insert(session, top)),
            new Phase("scope checker", () -> ScopeChecker.check(session, top)));
    for (Phase check : checks) {
      if (!phase(check.name(), check.body())) {
        return false;
      }
      if (diagnostics.errorCount() > 0) {
        break;
      }
    }
    return true;
  }
}
