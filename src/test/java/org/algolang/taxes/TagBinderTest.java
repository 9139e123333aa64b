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

package org.algolang.taxes;

import static com.google.common.truth.Truth.assertThat;

import org.algolang.Options;
import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TagBinderTest {

  @Test
  public void appliedIdentifiersAreBound() {
    Compiled compiled = Programs.compile("BEGIN INT x = 1; print(x) END");

    assertThat(compiled.errors()).isEmpty();
    Node defining = compiled.first(Attribute.DEFINING_IDENTIFIER);
    Tag x = compiled.identifier("x").tag();
    assertThat(x).isSameInstanceAs(defining.tag());
    assertThat(x.used()).isTrue();
    assertThat(x.mode().toString()).isEqualTo("INT");
    assertThat(compiled.identifier("print").tag().isStandard()).isTrue();
  }

  @Test
  public void levelsOfRanges() {
    Compiled compiled =
        Programs.compile("BEGIN INT x = 1; PROC f = (INT n) INT: n + x; print(f(2)) END");

    assertThat(compiled.errors()).isEmpty();
    Tag x = compiled.identifier("x").tag();
    Tag n = compiled.identifier("n").tag();
    assertThat(x.table().level()).isEqualTo(2);
    assertThat(n.table().level()).isEqualTo(3);
    assertThat(n.origin()).isEqualTo(Tag.Origin.PARAMETER);
    assertThat(n.table().isWithin(x.table())).isTrue();
  }

  @Test
  public void undeclaredIdentifierIsReportedOnce() {
    Compiled compiled = Programs.compile("BEGIN print(y); print(y) END");
    assertThat(compiled.errors()).containsExactly("tag \"y\" has not been declared properly");
  }

  @Test
  public void multipleDeclaration() {
    Compiled compiled = Programs.compile("BEGIN INT x = 1; REAL x = 2.0; SKIP END");
    assertThat(compiled.errors()).contains("multiple declaration of tag \"x\"");
  }

  @Test
  public void unusedTag() {
    Compiled compiled = Programs.compile("BEGIN INT x = 1; SKIP END");
    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.warnings()).contains("tag \"x\" is not used");
  }

  @Test
  public void unusedTagIsQuietWhenWarningsAreOff() {
    Compiled compiled =
        Programs.compile(
            "BEGIN INT x = 1; SKIP END",
            Options.builder().verbosity(Options.Verbosity.QUIET).build());
    assertThat(compiled.warnings()).isEmpty();
  }

  @Test
  public void hidingStandardIdentifier() {
    Compiled compiled = Programs.compile("BEGIN REAL pi = 3.0; print(pi) END");
    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.warnings()).contains("declaration hides standard \"pi\"");
  }

  @Test
  public void loopIdentifier() {
    Compiled compiled = Programs.compile("BEGIN FOR k TO 3 DO print(k) OD END");
    assertThat(compiled.errors()).isEmpty();
    Tag k = compiled.identifier("k").tag();
    assertThat(k.origin()).isEqualTo(Tag.Origin.LOOP);
    assertThat(k.mode().toString()).isEqualTo("INT");
  }

  @Test
  public void portcheck() {
    Compiled compiled =
        Programs.compile(
            "BEGIN BOOL b = TRUE ANDTH FALSE; print(b) END",
            Options.builder().portcheck(true).build());
    assertThat(compiled.warnings()).contains("ANDTH is not portable");
  }
}
