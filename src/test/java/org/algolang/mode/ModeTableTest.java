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

package org.algolang.mode;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModeTableTest {

  private final ModeTable table = new ModeTable(null);

  private Mode struct(String... fields) {
    Pack pack = new Pack();
    for (String field : fields) {
      pack.add(table.intMode, field, null);
    }
    return table.add(ModeKind.STRUCT, pack.size(), null, null, pack);
  }

  @Test
  public void standardModes() {
    assertThat(table.intMode.toString()).isEqualTo("INT");
    assertThat(table.longReal.toString()).isEqualTo("LONG REAL");
    assertThat(table.searchStandard(0, "BOOL")).isSameInstanceAs(table.bool);
    assertThat(table.searchStandard(3, "INT")).isSameInstanceAs(table.longLongInt);
    assertThat(table.searchStandard(0, "WIDGET")).isNull();
  }

  @Test
  public void equalShapesShareOneMode() {
    assertThat(table.ref(table.intMode)).isSameInstanceAs(table.refInt);
    assertThat(table.proc(table.real, table.intMode))
        .isSameInstanceAs(table.proc(table.real, table.intMode));
    assertThat(table.union(table.intMode, table.real))
        .isSameInstanceAs(table.union(table.real, table.intMode));
    assertThat(struct("a", "b")).isSameInstanceAs(struct("a", "b"));
    assertThat(struct("a", "b")).isNotSameInstanceAs(struct("a", "c"));
    assertThat(table.proc(table.real, table.intMode).toString()).isEqualTo("PROC (INT) REAL");
  }

  @Test
  public void rowsHaveSlices() {
    Mode matrix = table.addRow(2, table.real, null, false);
    assertThat(matrix.dimension()).isEqualTo(2);
    assertThat(matrix.slice().dimension()).isEqualTo(1);
    assertThat(matrix.slice().slice()).isSameInstanceAs(table.real);
    assertThat(matrix.toString()).isEqualTo("[,] REAL");
  }

  @Test
  public void uniteFlattensSeries() {
    Mode intOrReal = table.union(table.intMode, table.real);
    Mode series =
        table.collection(
            ModeKind.SERIES,
            List.of(table.bool, intOrReal, table.intMode),
            null);
    Mode united = table.unite(series);

    assertThat(united.is(ModeKind.UNION)).isTrue();
    assertThat(united.pack().modes())
        .containsExactly(table.bool, table.intMode, table.real);
    assertThat(table.unite(table.collection(ModeKind.SERIES, List.of(table.real), null)))
        .isSameInstanceAs(table.real);
  }

  @Test
  public void refNeedsSubMode() {
    assertThrows(
        IllegalArgumentException.class, () -> table.add(ModeKind.REF, 0, null, null, null));
  }

  @Test
  public void recursiveModesOfTheSameShapeAreEquivalent() {
    Compiled compiled =
        Programs.compile(
            "BEGIN MODE LIST = STRUCT (INT head, REF LIST tail);\n"
                + "  MODE CHAIN = STRUCT (INT head, REF CHAIN tail);\n"
                + "  LIST a := (1, NIL);\n"
                + "  CHAIN b := a;\n"
                + "  print(head OF b)\n"
                + "END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void recursionThroughRefIsWellFormed() {
    assertThat(Programs.compile("BEGIN MODE A = REF A; SKIP END").errors()).isEmpty();
    assertThat(
            Programs.compile("BEGIN MODE A = STRUCT (B f), B = STRUCT (A g); SKIP END").errors())
        .isEmpty();
    assertThat(Programs.compile("BEGIN MODE A = UNION (INT, A); SKIP END").errors())
        .containsExactly("mode \"A\" is not well-formed");
    assertThat(Programs.compile("BEGIN MODE A = B, B = A; SKIP END").errors())
        .contains("mode \"A\" is not well-formed: it is defined in terms of itself");
  }

  @Test
  public void equivalenceIsSymmetricAndTransitive() {
    Compiled compiled =
        Programs.compile(
            "BEGIN MODE LIST = STRUCT (INT head, REF LIST tail);\n"
                + "  MODE CHAIN = STRUCT (INT head, REF CHAIN tail);\n"
                + "  MODE RING = STRUCT (INT head, REF STRUCT (INT head, REF RING tail) tail);\n"
                + "  LIST a := (1, NIL);\n"
                + "  CHAIN b := a;\n"
                + "  LIST c := b;\n"
                + "  RING d := b;\n"
                + "  LIST e := d;\n"
                + "  print(head OF e)\n"
                + "END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void fieldNamesDistinguishStructures() {
    Compiled compiled =
        Programs.compile(
            "BEGIN MODE P = STRUCT (INT x, INT y), Q = STRUCT (INT u, INT v);\n"
                + "  P p := (1, 2);\n"
                + "  Q q := p;\n"
                + "  SKIP\n"
                + "END");
    assertThat(compiled.errors()).isNotEmpty();
    assertThat(compiled.errors().get(0)).contains("cannot be coerced to");
  }

  @Test
  public void parameterNamesDoNotDistinguishRoutines() {
    Compiled compiled =
        Programs.compile(
            "BEGIN PROC f = (INT a) INT: a;\n"
                + "  PROC g = (INT b) INT: b + 1;\n"
                + "  print(f(1) + g(2))\n"
                + "END");

    assertThat(compiled.errors()).isEmpty();
    ImmutableList<Node> routines = compiled.all(Attribute.ROUTINE_TEXT);
    assertThat(routines).hasSize(2);
    assertThat(Mode.resolve(routines.get(0).mode()))
        .isSameInstanceAs(Mode.resolve(routines.get(1).mode()));
    assertThat(routines.get(0).mode().toString()).isEqualTo("PROC (INT) INT");
  }
}
