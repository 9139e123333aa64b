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
import static org.algolang.tree.Attribute.ASSIGN_SYMBOL;
import static org.algolang.tree.Attribute.BEGIN_SYMBOL;
import static org.algolang.tree.Attribute.BITS_DENOTATION;
import static org.algolang.tree.Attribute.CLOSE_SYMBOL;
import static org.algolang.tree.Attribute.END_SYMBOL;
import static org.algolang.tree.Attribute.EQUALS_SYMBOL;
import static org.algolang.tree.Attribute.GOTO_SYMBOL;
import static org.algolang.tree.Attribute.IDENTIFIER;
import static org.algolang.tree.Attribute.INT_DENOTATION;
import static org.algolang.tree.Attribute.INT_SYMBOL;
import static org.algolang.tree.Attribute.OPEN_SYMBOL;
import static org.algolang.tree.Attribute.OPERATOR;
import static org.algolang.tree.Attribute.REAL_DENOTATION;
import static org.algolang.tree.Attribute.ROW_CHAR_DENOTATION;
import static org.algolang.tree.Attribute.SEMI_SYMBOL;
import static org.algolang.tree.Attribute.SKIP_SYMBOL;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.algolang.Options;
import org.algolang.Session;
import org.algolang.diag.Diagnostic;
import org.algolang.diag.DiagnosticList;
import org.algolang.diag.PhaseAbort;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScannerTest {

  private final DiagnosticList sink = new DiagnosticList();
  private final Session session = new Session(Options.DEFAULT, sink);

  private @Nullable Node scan(String... text) {
    List<SourceLine> lines = new ArrayList<>();
    for (String line : text) {
      lines.add(new SourceLine("test.a68", lines.size() + 1, line));
    }
    return new Scanner(session, new FileSystemSourceReader(Path.of("."))).scan(lines);
  }

  private static ImmutableList<Attribute> attributes(@Nullable Node p) {
    ImmutableList.Builder<Attribute> result = ImmutableList.builder();
    for (; p != null; p = p.next()) {
      result.add(p.attribute());
    }
    return result.build();
  }

  private static ImmutableList<String> symbols(@Nullable Node p) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (; p != null; p = p.next()) {
      result.add(p.symbol());
    }
    return result.build();
  }

  @Test
  public void tokens() {
    Node top = scan("BEGIN INT i := 12 + 2.5; print(\"x\") END");

    assertThat(attributes(top))
        .containsExactly(
            BEGIN_SYMBOL,
            INT_SYMBOL,
            IDENTIFIER,
            ASSIGN_SYMBOL,
            INT_DENOTATION,
            OPERATOR,
            REAL_DENOTATION,
            SEMI_SYMBOL,
            IDENTIFIER,
            OPEN_SYMBOL,
            ROW_CHAR_DENOTATION,
            CLOSE_SYMBOL,
            END_SYMBOL)
        .inOrder();
    assertThat(top.next(2).symbol()).isEqualTo("i");
    assertThat(top.next(4).symbol()).isEqualTo("12");
    assertThat(top.next(10).symbol()).isEqualTo("x");
    assertThat(sink.all()).isEmpty();
  }

  @Test
  public void numbersAndDigitsInTags() {
    Node top = scan("x1 := 2r101 + 1.5e-3 + 12");

    assertThat(attributes(top))
        .containsExactly(
            IDENTIFIER,
            ASSIGN_SYMBOL,
            BITS_DENOTATION,
            OPERATOR,
            REAL_DENOTATION,
            OPERATOR,
            INT_DENOTATION)
        .inOrder();
    assertThat(symbols(top))
        .containsExactly("x1", ":=", "2r101", "+", "1.5e-3", "+", "12")
        .inOrder();
    assertThat(sink.all()).isEmpty();
  }

  @Test
  public void commentsAreDropped() {
    Node top = scan("BEGIN CO a comment CO SKIP # another # END", "COMMENT", "more COMMENT");
    assertThat(attributes(top)).containsExactly(BEGIN_SYMBOL, SKIP_SYMBOL, END_SYMBOL).inOrder();
  }

  @Test
  public void positionsAreRecorded() {
    Node top = scan("BEGIN", "  SKIP", "END");
    Node skip = top.next();
    assertThat(skip.line().number()).isEqualTo(2);
    assertThat(skip.line().fileName()).isEqualTo("test.a68");
    assertThat(top.last().line().number()).isEqualTo(3);
  }

  @Test
  public void goToIsMerged() {
    Node top = scan("GO TO end");
    assertThat(attributes(top)).containsExactly(GOTO_SYMBOL, IDENTIFIER).inOrder();
  }

  @Test
  public void quoteStroppingPragmat() {
    Node top = scan("PR quote PR 'BEGIN' 'INT' x = 1; 'SKIP' 'END'");

    assertThat(attributes(top))
        .containsExactly(
            BEGIN_SYMBOL,
            INT_SYMBOL,
            IDENTIFIER,
            EQUALS_SYMBOL,
            INT_DENOTATION,
            SEMI_SYMBOL,
            SKIP_SYMBOL,
            END_SYMBOL)
        .inOrder();
    assertThat(session.options().stropping()).isEqualTo(Options.Stropping.QUOTE);
  }

  @Test
  public void emptyProgram() {
    assertThat(scan("CO nothing here CO", "")).isNull();
  }

  @Test
  public void unterminatedStringAborts() {
    assertThrows(PhaseAbort.class, () -> scan("BEGIN print(\"abc) END"));
    assertThat(sink.errors().stream().map(Diagnostic::message))
        .containsExactly(Scanner.UNTERMINATED_STRING);
  }

  @Test
  public void unterminatedCommentAborts() {
    assertThrows(PhaseAbort.class, () -> scan("BEGIN SKIP END CO never closed"));
    assertThat(sink.errors().get(0).message()).isEqualTo(Scanner.UNTERMINATED_COMMENT);
  }

  @Test
  public void missingIncludeAborts() {
    assertThrows(PhaseAbort.class, () -> scan("PR include \"no-such-file.a68\" PR", "SKIP"));
    assertThat(sink.errors().get(0).message()).startsWith("error while opening source file");
  }

  @Test
  public void exponentWithoutDigitsAborts() {
    assertThrows(PhaseAbort.class, () -> scan("REAL x = 1e+x"));
    assertThat(sink.errors().get(0).message()).isEqualTo(Scanner.EXPONENT_DIGIT);
  }

  @Test
  public void radixDigitOutOfRangeAborts() {
    assertThrows(PhaseAbort.class, () -> scan("BITS b = 2r102"));
    assertThat(sink.errors().get(0).message())
        .isEqualTo(String.format(Scanner.RADIX_DIGIT, '2', "2"));
  }

  @Test
  public void unsupportedRadixAborts() {
    assertThrows(PhaseAbort.class, () -> scan("BITS b = 3r12"));
    assertThat(sink.errors().get(0).message()).isEqualTo(String.format(Scanner.RADIX, "3"));
  }

  @Test
  public void symbolsOfOperators() {
    Node top = scan("a +:= b ** 2");
    assertThat(symbols(top)).containsExactly("a", "+:=", "b", "**", "2").inOrder();
  }
}
