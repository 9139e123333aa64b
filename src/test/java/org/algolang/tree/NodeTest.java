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

package org.algolang.tree;

import static com.google.common.truth.Truth.assertThat;
import static org.algolang.tree.Attribute.FORMULA;
import static org.algolang.tree.Attribute.IDENTIFIER;
import static org.algolang.tree.Attribute.OPERATOR;
import static org.algolang.tree.Attribute.SEMI_SYMBOL;
import static org.algolang.tree.Attribute.WILDCARD;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NodeTest {

  private static final SourceLine LINE = new SourceLine("test.a68", 1, "a + b;");

  private Node a;
  private Node plus;
  private Node b;
  private Node semi;

  @Before
  public void setUp() {
    a = new Node(IDENTIFIER, "a", LINE, 1);
    plus = new Node(OPERATOR, "+", LINE, 3);
    b = new Node(IDENTIFIER, "b", LINE, 5);
    semi = new Node(SEMI_SYMBOL, ";", LINE, 6);
    a.insertAfter(plus);
    plus.insertAfter(b);
    b.insertAfter(semi);
  }

  @Test
  public void siblingLinks() {
    assertThat(a.next(2)).isSameInstanceAs(b);
    assertThat(a.next(5)).isNull();
    assertThat(a.last()).isSameInstanceAs(semi);
    assertThat(semi.previous()).isSameInstanceAs(b);
    assertThat(a.whether(IDENTIFIER, OPERATOR, IDENTIFIER)).isTrue();
    assertThat(a.whether(IDENTIFIER, Attribute.not(OPERATOR))).isFalse();
    assertThat(a.whether(IDENTIFIER, OPERATOR, IDENTIFIER, SEMI_SYMBOL, IDENTIFIER)).isFalse();
  }

  @Test
  public void makeSubKeepsIdentityOfFirstNode() {
    Node formula = a.makeSub(b, FORMULA);

    assertThat(formula).isSameInstanceAs(a);
    assertThat(a.attribute()).isEqualTo(FORMULA);
    assertThat(a.next()).isSameInstanceAs(semi);
    assertThat(semi.previous()).isSameInstanceAs(a);

    Node first = a.sub();
    assertThat(first.attribute()).isEqualTo(IDENTIFIER);
    assertThat(first.symbol()).isEqualTo("a");
    assertThat(first.previous()).isNull();
    assertThat(first.next()).isSameInstanceAs(plus);
    assertThat(plus.previous()).isSameInstanceAs(first);
    assertThat(b.next()).isNull();
    assertThat(a.child(OPERATOR)).isSameInstanceAs(plus);
    assertThat(WILDCARD.matches(a)).isTrue();
    assertThat(WILDCARD.matches(semi)).isFalse();
  }

  @Test
  public void unlinkAndReplace() {
    plus.unlink();
    assertThat(a.next()).isSameInstanceAs(b);
    assertThat(b.previous()).isSameInstanceAs(a);

    Node c = new Node(IDENTIFIER, "c", LINE, 5);
    b.replaceWith(c);
    assertThat(a.next()).isSameInstanceAs(c);
    assertThat(semi.previous()).isSameInstanceAs(c);
  }

  @Test
  public void phraseAndTreeWalk() {
    a.makeSub(b, FORMULA);
    assertThat(a.phrase(5)).isEqualTo("formula ;");
    assertThat(a.sub().phrase(2)).isEqualTo("a + ...");

    StringBuilder visited = new StringBuilder();
    a.forEachInTree(n -> visited.append(n.symbol()));
    assertThat(visited.toString()).isEqualTo("aa+b;");
  }
}
