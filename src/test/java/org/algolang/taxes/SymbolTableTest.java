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
import static org.junit.Assert.assertThrows;

import org.algolang.Options;
import org.algolang.diag.DiagnosticList;
import org.algolang.diag.Diagnostics;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SymbolTableTest {

  private static final SourceLine LINE = new SourceLine("test.a68", 1, "");

  private final DiagnosticList sink = new DiagnosticList();
  private final Diagnostics diagnostics = new Diagnostics(sink, Options.DEFAULT);

  private static Node identifier(String name) {
    return new Node(Attribute.DEFINING_IDENTIFIER, name, LINE, 1);
  }

  private static Node bold(String name) {
    return new Node(Attribute.DEFINING_INDICANT, name, LINE, 1);
  }

  @Test
  public void levels() {
    SymbolTable env = SymbolTable.standardEnvironment();
    SymbolTable outer = env.newRange(1);
    SymbolTable inner = outer.newRange(2);

    assertThat(env.level()).isEqualTo(SymbolTable.PRIMAL_SCOPE);
    assertThat(env.isStandardEnvironment()).isTrue();
    assertThat(inner.level()).isEqualTo(2);
    assertThat(inner.isWithin(outer)).isTrue();
    assertThat(outer.isWithin(inner)).isFalse();
  }

  @Test
  public void findGlobalSearchesOutward() {
    SymbolTable env = SymbolTable.standardEnvironment();
    env.addStandard(TagKind.IDENTIFIER, "pi", null);
    SymbolTable outer = env.newRange(1);
    Tag x = outer.declare(diagnostics, TagKind.IDENTIFIER, identifier("x"), null);
    SymbolTable inner = outer.newRange(2);

    assertThat(inner.findLocal(TagKind.IDENTIFIER, "x")).isNull();
    assertThat(inner.findGlobal(TagKind.IDENTIFIER, "x")).isSameInstanceAs(x);
    assertThat(inner.findGlobal(TagKind.IDENTIFIER, "pi").isStandard()).isTrue();
    assertThat(inner.findGlobal(TagKind.INDICANT, "x")).isNull();
  }

  @Test
  public void identifierIsFoundBeforeLabel() {
    SymbolTable t = SymbolTable.standardEnvironment().newRange(1);
    Tag label = t.declare(diagnostics, TagKind.LABEL, identifier("l"), null);
    SymbolTable inner = t.newRange(2);
    assertThat(inner.findIdentifierOrLabel("l")).isSameInstanceAs(label);

    Tag ident = inner.declare(diagnostics, TagKind.IDENTIFIER, identifier("l"), null);
    assertThat(inner.findIdentifierOrLabel("l")).isSameInstanceAs(ident);
  }

  @Test
  public void clashesInOneRange() {
    SymbolTable t = SymbolTable.standardEnvironment().newRange(1);
    t.declare(diagnostics, TagKind.IDENTIFIER, identifier("x"), null);
    t.declare(diagnostics, TagKind.LABEL, identifier("x"), null);
    t.declare(diagnostics, TagKind.INDICANT, bold("A"), null);
    t.declare(diagnostics, TagKind.PRIORITY, bold("A"), null);

    assertThat(diagnostics.errorCount()).isEqualTo(2);
    assertThat(sink.errors().get(0).message()).isEqualTo("multiple declaration of tag \"x\"");
    assertThat(sink.errors().get(1).message()).isEqualTo("multiple declaration of tag \"A\"");
  }

  @Test
  public void operatorsMayBeOverloaded() {
    SymbolTable t = SymbolTable.standardEnvironment().newRange(1);
    Tag first = t.declare(diagnostics, TagKind.OPERATOR, bold("MAX"), null);
    Tag second = t.declare(diagnostics, TagKind.OPERATOR, bold("MAX"), null);

    assertThat(diagnostics.errorCount()).isEqualTo(0);
    assertThat(t.operators("MAX")).containsExactly(first, second).inOrder();
  }

  @Test
  public void reparent() {
    SymbolTable env = SymbolTable.standardEnvironment();
    SymbolTable a = env.newRange(1);
    SymbolTable b = env.newRange(2);
    b.reparent(a);

    assertThat(b.parent()).isSameInstanceAs(a);
    assertThat(b.level()).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> a.reparent(b));
    assertThrows(IllegalArgumentException.class, () -> env.reparent(a));
  }
}
