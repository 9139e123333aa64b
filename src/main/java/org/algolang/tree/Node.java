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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.Consumer;
import org.algolang.mode.Mode;
import org.algolang.taxes.SymbolTable;
import org.algolang.taxes.Tag;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree. The scanner links nodes into a flat, doubly linked list of siblings;
 * the parsers then nest them by {@link #makeSub}, which turns a run of siblings into the children
 * of a single node without changing the identity of the first node in the run.
 *
 * <p>Nodes are mutated in place by every later phase: reduction retags them, the tag binder sets
 * {@link #tag} and {@link #table}, the mode checker sets {@link #mode}, and the coercion inserter
 * wraps nodes in coercion nodes.
 */
public final class Node {
  private Attribute attribute;
  private final String symbol;
  private final SourceLine line;
  private final int column;

  private Node next;
  private Node previous;
  private Node sub;

  private SymbolTable table;
  private Mode mode;
  private Tag tag;

  /** Binding priority of an operator occurrence; zero elsewhere. */
  private int priority;

  public Node(Attribute attribute, String symbol, @Nullable SourceLine line, int column) {
    this.attribute = checkNotNull(attribute);
    this.symbol = symbol;
    this.line = line;
    this.column = column;
  }

  /** Returns a shallow copy of {@code other}, including its links. */
  private Node(Node other) {
    this.attribute = other.attribute;
    this.symbol = other.symbol;
    this.line = other.line;
    this.column = other.column;
    this.next = other.next;
    this.previous = other.previous;
    this.sub = other.sub;
    this.table = other.table;
    this.mode = other.mode;
    this.tag = other.tag;
    this.priority = other.priority;
  }

  public Attribute attribute() {
    return attribute;
  }

  public void setAttribute(Attribute attribute) {
    this.attribute = checkNotNull(attribute);
  }

  public boolean is(Attribute attribute) {
    return this.attribute == attribute;
  }

  public boolean isOneOf(Attribute... attributes) {
    for (Attribute a : attributes) {
      if (attribute == a) {
        return true;
      }
    }
    return false;
  }

  /** Returns the source text of this node; for non-terminals, that of its first terminal. */
  public String symbol() {
    return symbol;
  }

  public @Nullable SourceLine line() {
    return line;
  }

  public int column() {
    return column;
  }

  public @Nullable Node next() {
    return next;
  }

  public void setNext(@Nullable Node next) {
    this.next = next;
  }

  public @Nullable Node previous() {
    return previous;
  }

  public void setPrevious(@Nullable Node previous) {
    this.previous = previous;
  }

  public @Nullable Node sub() {
    return sub;
  }

  public void setSub(@Nullable Node sub) {
    this.sub = sub;
  }

  public @Nullable SymbolTable table() {
    return table;
  }

  public void setTable(@Nullable SymbolTable table) {
    this.table = table;
  }

  public @Nullable Mode mode() {
    return mode;
  }

  public void setMode(@Nullable Mode mode) {
    this.mode = mode;
  }

  public @Nullable Tag tag() {
    return tag;
  }

  public void setTag(@Nullable Tag tag) {
    this.tag = tag;
  }

  public int priority() {
    return priority;
  }

  public void setPriority(int priority) {
    this.priority = priority;
  }

  /** Returns the {@code n}-th following sibling, or null if there are fewer. */
  public @Nullable Node next(int n) {
    Node p = this;
    for (int i = 0; i < n && p != null; i++) {
      p = p.next;
    }
    return p;
  }

  /** Returns the first child with the given attribute, or null. */
  public @Nullable Node child(Attribute a) {
    for (Node q = sub; q != null; q = q.next) {
      if (q.attribute == a) {
        return q;
      }
    }
    return null;
  }

  /** Returns the last sibling in this node's list. */
  public Node last() {
    Node p = this;
    while (p.next != null) {
      p = p.next;
    }
    return p;
  }

  /**
   * Returns true if this node and its following siblings match {@code pattern} element by element.
   */
  public boolean whether(Matcher... pattern) {
    Node p = this;
    for (Matcher m : pattern) {
      if (p == null || !m.matches(p)) {
        return false;
      }
      p = p.next;
    }
    return true;
  }

  /**
   * Makes this node (through {@code last}, which must be this node or one of its following
   * siblings) the children of a new node with attribute {@code a}. The new node takes the place of
   * this node: the object identity of {@code this} is preserved, and its previous contents move to
   * a new first child.
   */
  @CanIgnoreReturnValue
  public Node makeSub(Node last, Attribute a) {
    checkNotNull(last);
    Node z = new Node(this);
    z.previous = null;
    if (last == this) {
      z.next = null;
    } else {
      if (next != null) {
        next.previous = z;
      }
      next = last.next;
      if (next != null) {
        next.previous = this;
      }
      last.next = null;
    }
    sub = z;
    attribute = a;
    return this;
  }

  /** Links {@code q} into this node's sibling list directly after this node. */
  public void insertAfter(Node q) {
    q.previous = this;
    q.next = next;
    if (next != null) {
      next.previous = q;
    }
    next = q;
  }

  /**
   * Unlinks this node from its siblings. The node keeps its own links, so a caller walking the
   * list may still step past it; it must not be the first node of a list.
   */
  public void unlink() {
    checkNotNull(previous, "cannot unlink the first node of a list");
    previous.next = next;
    if (next != null) {
      next.previous = previous;
    }
  }

  /** Unlinks this node from its siblings, making {@code replacement} take its place. */
  public void replaceWith(Node replacement) {
    replacement.previous = previous;
    replacement.next = next;
    if (previous != null) {
      previous.next = replacement;
    }
    if (next != null) {
      next.previous = replacement;
    }
  }

  /** Calls {@code action} on this node, its following siblings, and all their descendants. */
  public void forEachInTree(Consumer<Node> action) {
    for (Node p = this; p != null; p = p.next) {
      action.accept(p);
      if (p.sub != null) {
        p.sub.forEachInTree(action);
      }
    }
  }

  /** Returns the source text of this node and up to {@code max - 1} following siblings. */
  public String phrase(int max) {
    StringBuilder sb = new StringBuilder();
    int count = 0;
    for (Node p = this; p != null; p = p.next) {
      if (count == max) {
        sb.append(" ...");
        break;
      }
      if (count > 0) {
        sb.append(' ');
      }
      sb.append(p.attribute.isNonTerminal() ? p.attribute.displayName() : p.symbol);
      count++;
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return attribute.isNonTerminal() ? attribute.displayName() : attribute + " \"" + symbol + "\"";
  }
}
