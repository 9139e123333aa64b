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

import java.util.List;
import org.algolang.Options;
import org.algolang.diag.DiagnosticList;
import org.algolang.diag.Diagnostics;
import org.algolang.mode.Coercibility;
import org.algolang.mode.Deflexing;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeKind;
import org.algolang.mode.ModeTable;
import org.algolang.mode.Strength;
import org.algolang.tree.Attribute;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BalancerTest {

  private final ModeTable table = new ModeTable(null);
  private final DiagnosticList sink = new DiagnosticList();
  private final Balancer balancer =
      new Balancer(table, new Coercibility(table), new Diagnostics(sink, Options.DEFAULT));

  private Mode balance(Mode m) {
    return balancer.balancedMode(m, Strength.STRONG, false, Deflexing.SAFE);
  }

  @Test
  public void balancesToTheWidestComponent() {
    assertThat(balance(table.union(table.intMode, table.real))).isSameInstanceAs(table.real);
    assertThat(balance(table.union(table.refInt, table.real))).isSameInstanceAs(table.real);
  }

  @Test
  public void unrelatedComponentsStayUnited() {
    Mode intOrBool = table.union(table.intMode, table.bool);
    assertThat(balance(intOrBool)).isSameInstanceAs(intOrBool);
  }

  @Test
  public void balancingIsIdempotent() {
    List<Mode> unions =
        List.of(
            table.union(table.intMode, table.real),
            table.union(table.refInt, table.real),
            table.union(table.intMode, table.bool),
            table.union(table.intMode, table.real, table.complex));
    for (Mode m : unions) {
      Mode once = balance(m);
      assertThat(balance(once)).isSameInstanceAs(once);
    }
  }

  @Test
  public void uniqueModeOfAConditionalClause() {
    Mode yields = table.collection(ModeKind.SERIES, List.of(table.intMode, table.real), null);
    Mode once =
        balancer.uniqueMode(
            Soid.of(Strength.STRONG, yields, Attribute.CONDITIONAL_CLAUSE), Deflexing.SAFE);

    assertThat(once).isSameInstanceAs(table.real);
    assertThat(
            balancer.uniqueMode(
                Soid.of(Strength.STRONG, once, Attribute.CONDITIONAL_CLAUSE), Deflexing.SAFE))
        .isSameInstanceAs(once);
    assertThat(sink.all()).isEmpty();
  }
}
