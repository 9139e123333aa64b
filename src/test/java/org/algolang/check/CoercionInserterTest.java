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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.algolang.mode.Mode;
import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CoercionInserterTest {

  private static final ImmutableList<Attribute> COERCIONS =
      ImmutableList.of(
          Attribute.DEREFERENCING,
          Attribute.DEPROCEDURING,
          Attribute.UNITING,
          Attribute.WIDENING,
          Attribute.ROWING,
          Attribute.VOIDING);

  /** The nodes below {@code p} with attribute {@code a}. */
  private static ImmutableList<Node> below(Node p, Attribute a) {
    List<Node> found = new ArrayList<>();
    p.sub().forEachInTree(n -> {
      if (n.is(a)) {
        found.add(n);
      }
    });
    return ImmutableList.copyOf(found);
  }

  @Test
  public void wideningInBalancedClause() {
    Compiled compiled =
        Programs.compile("BEGIN REAL x = IF TRUE THEN 1 ELSE 2.0 FI; print(x) END");

    assertThat(compiled.errors()).isEmpty();
    ImmutableList<Node> widenings = compiled.all(Attribute.WIDENING);
    assertThat(widenings).hasSize(1);
    Node widening = widenings.get(0);
    assertThat(widening.mode().toString()).isEqualTo("REAL");
    ImmutableList<Node> denotations = below(widening, Attribute.INT_DENOTATION);
    assertThat(denotations).hasSize(1);
    assertThat(denotations.get(0).symbol()).isEqualTo("1");
    assertThat(below(widening, Attribute.REAL_DENOTATION)).isEmpty();
  }

  @Test
  public void variableIsDereferencedInOperand() {
    Compiled compiled = Programs.compile("BEGIN INT i := 1; INT j = i + 1; print(j) END");

    assertThat(compiled.errors()).isEmpty();
    ImmutableList<Node> derefs = compiled.all(Attribute.DEREFERENCING);
    assertThat(derefs).isNotEmpty();
    Node deref = derefs.get(0);
    assertThat(deref.mode().toString()).isEqualTo("INT");
    assertThat(below(deref, Attribute.IDENTIFIER).get(0).symbol()).isEqualTo("i");
  }

  @Test
  public void assignationIsVoided() {
    Compiled compiled = Programs.compile("BEGIN INT i := 1; i := 2; print(i) END");

    assertThat(compiled.errors()).isEmpty();
    ImmutableList<Node> voidings = compiled.all(Attribute.VOIDING);
    assertThat(voidings).isNotEmpty();
    assertThat(voidings.get(0).mode().toString()).isEqualTo("VOID");
    assertThat(below(voidings.get(0), Attribute.ASSIGNATION)).hasSize(1);
  }

  @Test
  public void wellTypedProgramNeedsNoCoercionForMatchingModes() {
    Compiled compiled = Programs.compile("BEGIN INT i = 1; INT j = i; print(j) END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.all(Attribute.WIDENING)).isEmpty();
    assertThat(compiled.all(Attribute.DEREFERENCING)).isEmpty();
  }

  @Test
  public void eachCoercionNodeIsOneStep() {
    Compiled compiled =
        Programs.compile(
            "BEGIN INT i := 1; REF INT r = i; PROC INT p = INT: 2;\n"
                + "  REAL x = r; REAL y = p; i := p;\n"
                + "  print(x + y)\n"
                + "END");
    assertThat(compiled.errors()).isEmpty();

    ImmutableList<Node> derefs = compiled.all(Attribute.DEREFERENCING);
    ImmutableList<Node> deprocs = compiled.all(Attribute.DEPROCEDURING);
    assertThat(derefs).isNotEmpty();
    assertThat(deprocs).isNotEmpty();
    for (Node n : derefs) {
      Mode from = n.sub().mode();
      assertThat(from.isRef()).isTrue();
      assertThat(n.mode()).isSameInstanceAs(from.sub());
    }
    for (Node n : deprocs) {
      Mode from = n.sub().mode();
      assertThat(from.isParameterlessProc()).isTrue();
      assertThat(n.mode()).isSameInstanceAs(from.sub());
    }
    for (Node n : compiled.all(Attribute.VOIDING)) {
      assertThat(n.mode()).isSameInstanceAs(compiled.result().modes().voidMode);
    }
    for (Attribute a : COERCIONS) {
      for (Node n : compiled.all(a)) {
        assertThat(n.mode()).isNotSameInstanceAs(n.sub().mode());
      }
    }
  }
}
