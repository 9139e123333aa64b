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

import java.util.HashSet;
import java.util.Set;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * A type descriptor. Modes are created by {@link ModeTable}, which returns an existing mode
 * whenever a structurally equivalent one has already been registered.
 *
 * <p>While the mode graph is being built, two modes may later be proven equivalent; the younger one
 * then gets an {@link #equivalent} link and every lookup must go through {@link #resolve}. Once the
 * mode table is complete each mode also caches its derived forms:
 *
 * <ul>
 *   <li>{@link #deflexed}: the mode with FLEX removed;
 *   <li>{@link #slice}: the mode of an element (for rows), or of a row of one fewer dimension;
 *   <li>{@link #name}: for a REF to a struct, the struct of REFs to its fields; for a REF to a row,
 *       the REF to its element;
 *   <li>{@link #multiple}: for a row of structs, the struct of rows of its fields;
 *   <li>{@link #trim}: for FLEX modes and REF FLEX modes, the mode without the FLEX.
 * </ul>
 */
public final class Mode {
  private final ModeKind kind;
  int dimension;
  private final @Nullable String standardName;
  private final @Nullable Node node;
  Mode sub;
  Pack pack;

  Mode equivalent;
  Mode slice;
  Mode deflexed;
  Mode name;
  Mode multiple;
  Mode trim;

  /** True for rows created only as derived forms. */
  boolean derivate;

  /** True if values of this mode contain rows. */
  boolean hasRows;

  int number;

  Mode(
      ModeKind kind,
      int dimension,
      @Nullable String standardName,
      @Nullable Node node,
      @Nullable Mode sub,
      @Nullable Pack pack) {
    this.kind = kind;
    this.dimension = dimension;
    this.standardName = standardName;
    this.node = node;
    this.sub = sub;
    this.pack = (pack == null) ? new Pack() : pack;
  }

  /** Follows equivalence links to the canonical representative. */
  public static Mode resolve(Mode m) {
    while (m != null && m.equivalent != null && m.equivalent != m) {
      m = m.equivalent;
    }
    return m;
  }

  public ModeKind kind() {
    return kind;
  }

  public boolean is(ModeKind k) {
    return kind == k;
  }

  /**
   * The number of dimensions of a row, the sizety of a standard mode (1 for LONG, -1 for SHORT), or
   * the number of pack entries otherwise.
   */
  public int dimension() {
    return dimension;
  }

  /** The bold word of a standard mode, e.g. {@code "INT"}. */
  public @Nullable String standardName() {
    return standardName;
  }

  /** The declarer, or the defining indicant for an INDICANT mode. */
  public @Nullable Node node() {
    return node;
  }

  public @Nullable Mode sub() {
    return sub;
  }

  public Pack pack() {
    return pack;
  }

  public @Nullable Mode equivalent() {
    return equivalent;
  }

  public @Nullable Mode slice() {
    return slice;
  }

  /** Returns the mode with FLEX removed, or this mode if it has no deflexed form. */
  public Mode deflex() {
    return (deflexed != null) ? deflexed : this;
  }

  public @Nullable Mode name() {
    return name;
  }

  public @Nullable Mode multiple() {
    return multiple;
  }

  public @Nullable Mode trim() {
    return trim;
  }

  public boolean hasRows() {
    return hasRows;
  }

  public int number() {
    return number;
  }

  public boolean isRef() {
    return kind == ModeKind.REF;
  }

  public boolean isRow() {
    return kind == ModeKind.ROW;
  }

  public boolean isFlex() {
    return kind == ModeKind.FLEX;
  }

  public boolean isRefFlex() {
    return kind == ModeKind.REF && sub != null && sub.kind == ModeKind.FLEX;
  }

  /** True for a procedure mode without parameters. */
  public boolean isParameterlessProc() {
    return kind == ModeKind.PROC && pack.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    append(sb, new HashSet<>());
    return sb.toString();
  }

  private void append(StringBuilder sb, Set<Mode> path) {
    if (!path.add(this)) {
      sb.append("...");
      return;
    }
    switch (kind) {
      case STANDARD -> {
        for (int i = 0; i < dimension; i++) {
          sb.append("LONG ");
        }
        for (int i = 0; i > dimension; i--) {
          sb.append("SHORT ");
        }
        sb.append(standardName);
      }
      case INDICANT -> sb.append(node == null ? "?" : node.symbol());
      case REF -> {
        sb.append("REF ");
        sub.append(sb, path);
      }
      case FLEX -> {
        sb.append("FLEX ");
        sub.append(sb, path);
      }
      case ROW -> {
        sb.append('[');
        sb.append(",".repeat(Math.max(0, dimension - 1)));
        sb.append("] ");
        sub.append(sb, path);
      }
      case STRUCT -> {
        sb.append("STRUCT ");
        appendPack(sb, path, true);
      }
      case UNION -> {
        sb.append("UNION ");
        appendPack(sb, path, false);
      }
      case PROC -> {
        sb.append("PROC ");
        if (!pack.isEmpty()) {
          appendPack(sb, path, false);
          sb.append(' ');
        }
        sub.append(sb, path);
      }
      case SERIES, STOWED -> appendPack(sb, path, false);
    }
    path.remove(this);
  }

  private void appendPack(StringBuilder sb, Set<Mode> path, boolean withText) {
    sb.append('(');
    boolean first = true;
    for (Pack.Entry e : pack) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      if (e.mode == null) {
        sb.append('?');
      } else {
        e.mode.append(sb, path);
      }
      if (withText && e.text() != null) {
        sb.append(' ').append(e.text());
      }
    }
    sb.append(')');
  }
}
