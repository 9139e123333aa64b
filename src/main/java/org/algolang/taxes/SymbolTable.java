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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.mode.Mode;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * The declarations of one range (lexical level). Each table keeps a separate list per {@link
 * TagKind} and links to the table of the statically enclosing range; the root of that chain is the
 * standard environment.
 */
public final class SymbolTable {
  /** The level of the standard environment, which outlives every other range. */
  public static final int PRIMAL_SCOPE = 0;

  static final String MULTIPLE_TAG = "multiple declaration of tag \"%s\"";

  private @Nullable SymbolTable parent;
  private final int number;
  private final Map<TagKind, List<Tag>> tags = new EnumMap<>(TagKind.class);

  private SymbolTable(@Nullable SymbolTable parent, int number) {
    this.parent = parent;
    this.number = number;
    for (TagKind k : TagKind.values()) {
      tags.put(k, new ArrayList<>());
    }
  }

  /** Returns a new standard environment table. */
  public static SymbolTable standardEnvironment() {
    return new SymbolTable(null, 0);
  }

  /** Returns a new table for a range nested directly inside this one. */
  public SymbolTable newRange(int number) {
    return new SymbolTable(this, number);
  }

  public @Nullable SymbolTable parent() {
    return parent;
  }

  /**
   * Moves this range under {@code newParent}. Ranges are first set up from the bracket structure
   * and later re-linked once routine texts and specified units are known to open lexical levels.
   */
  public void reparent(SymbolTable newParent) {
    checkArgument(parent != null, "cannot reparent the standard environment");
    checkArgument(!newParent.isWithin(this), "reparenting would create a cycle");
    parent = newParent;
  }

  public int level() {
    int level = PRIMAL_SCOPE;
    for (SymbolTable t = parent; t != null; t = t.parent) {
      level++;
    }
    return level;
  }

  /** A serial number, unique within a compilation, used in traces. */
  public int number() {
    return number;
  }

  public boolean isStandardEnvironment() {
    return parent == null;
  }

  /** True if {@code other} is this table or one of the tables enclosing it. */
  public boolean isWithin(SymbolTable other) {
    for (SymbolTable t = this; t != null; t = t.parent) {
      if (t == other) {
        return true;
      }
    }
    return false;
  }

  public ImmutableList<Tag> tags(TagKind kind) {
    return ImmutableList.copyOf(tags.get(kind));
  }

  /**
   * Declares the tag spelled by {@code node}, reporting it if the name is already taken in this
   * range. Identifiers clash with identifiers and labels; indicants with indicants, operators and
   * priorities; operators only with indicants, since operators may be overloaded.
   */
  @CanIgnoreReturnValue
  public Tag declare(Diagnostics diagnostics, TagKind kind, Node node, @Nullable Mode mode) {
    String name = node.symbol();
    switch (kind) {
      case IDENTIFIER, LABEL -> {
        checkUnique(diagnostics, node, name, TagKind.IDENTIFIER);
        checkUnique(diagnostics, node, name, TagKind.LABEL);
      }
      case OPERATOR -> checkUnique(diagnostics, node, name, TagKind.INDICANT);
      case PRIORITY -> {
        checkUnique(diagnostics, node, name, TagKind.PRIORITY);
        checkUnique(diagnostics, node, name, TagKind.INDICANT);
      }
      case INDICANT -> {
        checkUnique(diagnostics, node, name, TagKind.INDICANT);
        checkUnique(diagnostics, node, name, TagKind.OPERATOR);
        checkUnique(diagnostics, node, name, TagKind.PRIORITY);
      }
      case ANONYMOUS -> {}
    }
    Tag tag = new Tag(name, kind, node, this, mode);
    tags.get(kind).add(tag);
    return tag;
  }

  private void checkUnique(Diagnostics diagnostics, Node node, String name, TagKind kind) {
    if (findLocal(kind, name) != null) {
      diagnostics.error(Severity.SEMANTIC, node, MULTIPLE_TAG, name);
    }
  }

  /** Adds an unnamed tag for a routine text, format text or generator at {@code node}. */
  public Tag addAnonymous(Node node, Tag.Origin origin, @Nullable Mode mode) {
    Tag tag = new Tag("", TagKind.ANONYMOUS, node, this, mode);
    tag.setOrigin(origin);
    tags.get(TagKind.ANONYMOUS).add(tag);
    return tag;
  }

  /** Adds a tag of the standard environment, which has no defining node. */
  @CanIgnoreReturnValue
  public Tag addStandard(TagKind kind, String name, @Nullable Mode mode) {
    Tag tag = new Tag(name, kind, null, this, mode);
    tag.setOrigin(Tag.Origin.STANDARD);
    tags.get(kind).add(tag);
    return tag;
  }

  public @Nullable Tag findLocal(TagKind kind, String name) {
    for (Tag t : tags.get(kind)) {
      if (t.name().equals(name)) {
        return t;
      }
    }
    return null;
  }

  /** Searches this table and then each enclosing table. */
  public @Nullable Tag findGlobal(TagKind kind, String name) {
    for (SymbolTable t = this; t != null; t = t.parent) {
      Tag tag = t.findLocal(kind, name);
      if (tag != null) {
        return tag;
      }
    }
    return null;
  }

  /**
   * Searches outward for an identifier or label called {@code name}; within one range an
   * identifier is found before a label.
   */
  public @Nullable Tag findIdentifierOrLabel(String name) {
    for (SymbolTable t = this; t != null; t = t.parent) {
      Tag tag = t.findLocal(TagKind.IDENTIFIER, name);
      if (tag == null) {
        tag = t.findLocal(TagKind.LABEL, name);
      }
      if (tag != null) {
        return tag;
      }
    }
    return null;
  }

  /** Returns the operators called {@code name} declared in this range, in declaration order. */
  public ImmutableList<Tag> operators(String name) {
    return tags.get(TagKind.OPERATOR).stream()
        .filter(t -> t.name().equals(name))
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return "table " + number + " (level " + level() + ")";
  }
}
