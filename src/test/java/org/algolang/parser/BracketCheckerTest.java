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

import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BracketCheckerTest {

  @Test
  public void matchedBrackets() {
    Compiled compiled =
        Programs.compile("BEGIN IF TRUE THEN (SKIP) ELSE CASE 1 IN SKIP ESAC FI END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void wrongCloser() {
    Compiled compiled = Programs.compile("BEGIN (1 + 2; SKIP END");

    assertThat(compiled.result().program()).isNull();
    assertThat(compiled.errors()).hasSize(1);
    assertThat(compiled.errors().get(0))
        .isEqualTo(
            "encountered END in line 1 but expected ), check for \"(\" without matching \")\"");
  }

  @Test
  public void missingFi() {
    Compiled compiled = Programs.compile("BEGIN IF TRUE THEN SKIP END");
    assertThat(compiled.errors().get(0)).contains("but expected FI");
    assertThat(compiled.errors().get(0)).contains("\"IF\" without matching \"FI\"");
  }

  @Test
  public void unclosedBegin() {
    Compiled compiled = Programs.compile("BEGIN SKIP");
    assertThat(compiled.errors())
        .containsExactly("incorrect nesting, check for \"BEGIN\" without matching \"END\"");
  }

  @Test
  public void strayCloser() {
    Compiled compiled = Programs.compile("SKIP )");
    assertThat(compiled.errors())
        .containsExactly("incorrect nesting, check for missing or unmatched keyword");
  }

  @Test
  public void substituteBrackets() {
    SourceLine line = new SourceLine("test.a68", 1, "{[SKIP]}");
    Node acco = new Node(Attribute.ACCO_SYMBOL, "{", line, 1);
    Node sub = new Node(Attribute.SUB_SYMBOL, "[", line, 2);
    Node skip = new Node(Attribute.SKIP_SYMBOL, "SKIP", line, 3);
    Node bus = new Node(Attribute.BUS_SYMBOL, "]", line, 7);
    Node occa = new Node(Attribute.OCCA_SYMBOL, "}", line, 8);
    acco.insertAfter(sub);
    sub.insertAfter(skip);
    skip.insertAfter(bus);
    bus.insertAfter(occa);

    BracketChecker.substituteBrackets(acco);

    assertThat(acco.attribute()).isEqualTo(Attribute.OPEN_SYMBOL);
    assertThat(sub.attribute()).isEqualTo(Attribute.OPEN_SYMBOL);
    assertThat(skip.attribute()).isEqualTo(Attribute.SKIP_SYMBOL);
    assertThat(bus.attribute()).isEqualTo(Attribute.CLOSE_SYMBOL);
    assertThat(occa.attribute()).isEqualTo(Attribute.CLOSE_SYMBOL);
  }
}
