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

package org.algolang.parser;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BottomUpParserTest {

  @Test
  public void particularProgram() {
    Compiled compiled = Programs.compile("BEGIN INT i = 1, j = 2; print(i+j) END");

    Node program = compiled.program();
    assertThat(program.attribute()).isEqualTo(Attribute.PARTICULAR_PROGRAM);
    assertThat(program.sub().attribute()).isEqualTo(Attribute.ENCLOSED_CLAUSE);
    assertThat(compiled.all(Attribute.DEFINING_IDENTIFIER).stream().map(Node::symbol))
        .containsExactly("i", "j")
        .inOrder();
    assertThat(compiled.all(Attribute.CALL)).hasSize(1);
  }

  @Test
  public void priorities() {
    Compiled compiled = Programs.compile("BEGIN INT x = 1 + 2 * 3; print(x) END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.all(Attribute.FORMULA)).hasSize(2);
    Node outer = compiled.first(Attribute.FORMULA);
    assertThat(outer.child(Attribute.OPERATOR).symbol()).isEqualTo("+");
    assertThat(outer.sub().last().attribute()).isEqualTo(Attribute.FORMULA);
  }

  @Test
  public void userPriority() {
    Compiled compiled =
        Programs.compile(
            "BEGIN PRIO MAX = 9;\n"
                + "  OP MAX = (INT a, b) INT: (a > b | a | b);\n"
                + "  print(1 + 3 MAX 4)\n"
                + "END");

    assertThat(compiled.errors()).isEmpty();
    ImmutableList<Node> formulas = compiled.all(Attribute.FORMULA);
    Node outer =
        formulas.stream()
            .filter(f -> f.child(Attribute.OPERATOR).symbol().equals("+"))
            .findFirst()
            .orElseThrow();
    assertThat(outer.sub().last().attribute()).isEqualTo(Attribute.FORMULA);
    assertThat(outer.sub().last().child(Attribute.OPERATOR).symbol()).isEqualTo("MAX");
  }

  @Test
  public void superfluousSemicolon() {
    Compiled compiled = Programs.compile("BEGIN SKIP; END");
    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.warnings()).contains("skipped superfluous ;");
  }

  @Test
  public void booleanPatternPictures() {
    String message =
        String.format(BottomUpParser.PICTURE_NUMBER, Attribute.BOOLEAN_PATTERN.displayName());

    Compiled two = Programs.compile("BEGIN FORMAT f = $b(\"yes\", \"no\")$; SKIP END");
    assertThat(two.errors()).doesNotContain(message);

    Compiled one = Programs.compile("BEGIN FORMAT f = $b(\"yes\")$; SKIP END");
    assertThat(one.errors()).contains(message);
  }

  @Test
  public void unreducibleDeclaration() {
    Compiled compiled = Programs.compile("BEGIN INT x = ; SKIP END");
    assertThat(compiled.errors()).isNotEmpty();
    assertThat(compiled.result().succeeded()).isFalse();
  }
}
