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

import org.algolang.mode.Mode;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * A declared entity: an identifier, operator, priority, indicant or label, or an anonymous routine
 * text, format text or local generator.
 *
 * <p>The binder fills in the name, mode and defining node; the scope checker later records the
 * scope of the value the tag stands for (and, for routine and format texts, the youngest environ
 * they use) so that uses of the tag can inherit it.
 */
public final class Tag {

  /** How an identifier (or anonymous tag) came into being. */
  public enum Origin {
    DECLARED,
    PARAMETER,
    SPECIFIER,
    LOOP,
    ROUTINE_TEXT,
    FORMAT_TEXT,
    GENERATOR,
    STANDARD
  }

  private final String name;
  private final TagKind kind;
  private @Nullable Node node;
  private final SymbolTable table;
  private Mode mode;
  private int priority;
  private Origin origin = Origin.DECLARED;

  private boolean used;
  private boolean heap;

  /** The unit or routine text that defines the value, if known. */
  private Node body;

  private int scope;
  private boolean scopeAssigned;
  private int youngestEnviron;
  private int contentScope;
  private boolean contentAssigned;

  Tag(String name, TagKind kind, @Nullable Node node, SymbolTable table, @Nullable Mode mode) {
    this.name = name;
    this.kind = kind;
    this.node = node;
    this.table = table;
    this.mode = mode;
    this.scope = table.level();
    this.youngestEnviron = SymbolTable.PRIMAL_SCOPE;
  }

  public String name() {
    return name;
  }

  public TagKind kind() {
    return kind;
  }

  public boolean is(TagKind k) {
    return kind == k;
  }

  /** The defining occurrence; null for tags of the standard environment. */
  public @Nullable Node node() {
    return node;
  }

  /** Moves the defining occurrence to {@code node}, which replaced it during reduction. */
  void setNode(Node node) {
    this.node = node;
  }

  public SymbolTable table() {
    return table;
  }

  public @Nullable Mode mode() {
    return mode;
  }

  public void setMode(@Nullable Mode mode) {
    this.mode = mode;
  }

  /** For PRIORITY tags and dyadic operators, the priority 1..9. */
  public int priority() {
    return priority;
  }

  public void setPriority(int priority) {
    this.priority = priority;
  }

  public Origin origin() {
    return origin;
  }

  public void setOrigin(Origin origin) {
    this.origin = origin;
  }

  public boolean isStandard() {
    return table.isStandardEnvironment();
  }

  public boolean used() {
    return used;
  }

  public void markUsed() {
    this.used = true;
  }

  /** True for names generated on the heap. */
  public boolean heap() {
    return heap;
  }

  public void setHeap(boolean heap) {
    this.heap = heap;
  }

  public @Nullable Node body() {
    return body;
  }

  public void setBody(@Nullable Node body) {
    this.body = body;
  }

  /** The lexical level of the value this tag stands for; valid once {@link #scopeAssigned}. */
  public int scope() {
    return scope;
  }

  public boolean scopeAssigned() {
    return scopeAssigned;
  }

  public void assignScope(int scope) {
    this.scope = scope;
    this.scopeAssigned = true;
  }

  /** For routine and format texts, the deepest level whose declarations the text uses. */
  public int youngestEnviron() {
    return youngestEnviron;
  }

  public void setYoungestEnviron(int youngestEnviron) {
    this.youngestEnviron = youngestEnviron;
  }

  /**
   * For a variable, the scope of the youngest value ever assigned to it, used when the name is
   * dereferenced and yielded.
   */
  public int contentScope() {
    return contentScope;
  }

  public boolean contentAssigned() {
    return contentAssigned;
  }

  public void noteContentScope(int scope) {
    if (!contentAssigned || scope > contentScope) {
      contentScope = scope;
    }
    contentAssigned = true;
  }

  @Override
  public String toString() {
    return kind + " " + name + (mode == null ? "" : " : " + mode);
  }
}
