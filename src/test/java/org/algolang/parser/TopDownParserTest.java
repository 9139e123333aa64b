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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TopDownParserTest {

  @Test
  public void missingThen() {
    Compiled compiled = Programs.compile("BEGIN IF TRUE FI END");
    assertThat(compiled.result().program()).isNull();
    assertThat(compiled.errors())
        .containsExactly("THEN expected in conditional clause, near IF in line 1");
  }

  @Test
  public void missingIn() {
    Compiled compiled = Programs.compile("BEGIN CASE 1 ESAC END");
    assertThat(compiled.errors())
        .containsExactly("IN expected in enclosed clause, near CASE in line 1");
  }

  @Test
  public void choiceClauses() {
    Compiled compiled =
        Programs.compile(
            "BEGIN INT n = 2;\n"
                + "  IF n > 1 THEN print(1) ELIF n < 0 THEN print(2) ELSE print(3) FI;\n"
                + "  CASE n IN print(4), print(5) OUT print(6) ESAC\n"
                + "END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.all(Attribute.CONDITIONAL_CLAUSE)).hasSize(1);
    assertThat(compiled.all(Attribute.ELIF_PART)).hasSize(1);
    assertThat(compiled.all(Attribute.INTEGER_CASE_CLAUSE)).hasSize(1);
    assertThat(compiled.all(Attribute.ENQUIRY_CLAUSE)).hasSize(3);
  }

  @Test
  public void loopClause() {
    Compiled compiled =
        Programs.compile(
            "BEGIN INT sum := 0;\n"
                + "  FOR i FROM 1 BY 2 TO 9 WHILE sum < 20 DO sum +:= i OD;\n"
                + "  print(sum)\n"
                + "END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.all(Attribute.LOOP_CLAUSE)).hasSize(1);
    assertThat(compiled.first(Attribute.FOR_PART).sub().next().symbol()).isEqualTo("i");
  }
}
