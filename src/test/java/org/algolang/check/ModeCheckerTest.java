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

package org.algolang.check;

import static com.google.common.truth.Truth.assertThat;

import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModeCheckerTest {

  private static String firstError(Compiled compiled) {
    assertThat(compiled.errors()).isNotEmpty();
    return compiled.errors().get(0);
  }

  @Test
  public void standardOperatorIsIdentified() {
    Compiled compiled = Programs.compile("BEGIN INT i = 1, j = 2; print(i + j) END");

    assertThat(compiled.errors()).isEmpty();
    Node formula = compiled.first(Attribute.FORMULA);
    assertThat(formula.mode().toString()).isEqualTo("INT");
    Node op = formula.child(Attribute.OPERATOR);
    assertThat(op.tag().isStandard()).isTrue();
    assertThat(op.tag().mode().toString()).isEqualTo("PROC (INT, INT) INT");
  }

  @Test
  public void undeclaredDyadicOperator() {
    Compiled compiled = Programs.compile("BEGIN BOOL b = TRUE + 1; SKIP END");
    assertThat(firstError(compiled))
        .isEqualTo("dyadic operator BOOL \"+\" INT has not been declared");
  }

  @Test
  public void incompatibleSource() {
    Compiled compiled = Programs.compile("BEGIN INT i := \"abc\"; print(i) END");
    assertThat(firstError(compiled)).contains("cannot be coerced to INT");
  }

  @Test
  public void wrongNumberOfArguments() {
    Compiled compiled =
        Programs.compile("BEGIN PROC f = (INT a) INT: a; print(f(1, 2)) END");
    assertThat(firstError(compiled)).startsWith("incorrect number of arguments for");
  }

  @Test
  public void missingField() {
    Compiled compiled =
        Programs.compile(
            "BEGIN MODE P = STRUCT (INT x, INT y); P p = (1, 2); print(z OF p) END");
    assertThat(firstError(compiled)).endsWith("has no field \"z\"");
  }

  @Test
  public void assigningToAValue() {
    Compiled compiled = Programs.compile("BEGIN INT i = 1; i := 2 END");
    assertThat(firstError(compiled)).contains("does not yield a name");
  }

  @Test
  public void selectionThroughName() {
    Compiled compiled =
        Programs.compile(
            "BEGIN MODE P = STRUCT (INT x, REAL y); P p := (1, 2.0);"
                + " y OF p := 3.5; print(y OF p) END");

    assertThat(compiled.errors()).isEmpty();
    Node selection = compiled.first(Attribute.SELECTION);
    assertThat(selection.mode().toString()).isEqualTo("REF REAL");
  }

  @Test
  public void conditionalClauseIsBalanced() {
    Compiled compiled =
        Programs.compile("BEGIN REAL x = IF TRUE THEN 1 ELSE 2.0 FI; print(x) END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void routineCallYieldsResultMode() {
    Compiled compiled =
        Programs.compile("BEGIN PROC sq = (INT n) INT: n * n; INT k = sq(4); print(k) END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.first(Attribute.CALL).mode().toString()).isEqualTo("INT");
  }

  @Test
  public void routineTextMatchesDeclaredProcMode() {
    Compiled compiled =
        Programs.compile("BEGIN PROC (INT) INT f = (INT x) INT: x * 2; print(f(3)) END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.first(Attribute.ROUTINE_TEXT).mode().toString())
        .isEqualTo("PROC (INT) INT");
  }

  @Test
  public void routineTextAsProcArgument() {
    Compiled compiled =
        Programs.compile(
            "BEGIN PROC apply = (PROC (INT) INT f) INT: f(1);\n"
                + "  print(apply((INT y) INT: y))\n"
                + "END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void routineTextAssignedToProcVariable() {
    Compiled compiled =
        Programs.compile(
            "BEGIN PROC (INT) INT g := (INT x) INT: x;\n"
                + "  g := (INT y) INT: y + 1;\n"
                + "  print(g(2))\n"
                + "END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void boundedFlexDeclarer() {
    Compiled compiled =
        Programs.compile(
            "BEGIN FLEX [1:3] INT f := (1, 2, 3);\n"
                + "  f := (4, 5, 6, 7);\n"
                + "  print(f[1])\n"
                + "END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(
            compiled.all(Attribute.DECLARER).stream()
                .map(d -> String.valueOf(d.mode()))
                .anyMatch(m -> m.equals("FLEX [] INT")))
        .isTrue();
  }

  @Test
  public void deeplyNestedFormulaIsTooComplex() {
    StringBuilder text = new StringBuilder("BEGIN INT x = 1");
    for (int i = 0; i < 3000; i++) {
      text.append(" + 1");
    }
    text.append("; print(x) END");

    Compiled compiled = Programs.compile(text.toString());

    assertThat(compiled.errors()).contains("program is too complex");
    assertThat(compiled.result().succeeded()).isFalse();
  }
}
