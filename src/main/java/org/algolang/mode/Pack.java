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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * An ordered list of (mode, optional field name, defining node) entries. Packs hold the fields of a
 * structured mode, the alternatives of a united mode, the parameters of a procedure mode, and the
 * components of series and stowed modes.
 */
public final class Pack implements Iterable<Pack.Entry> {

  /** One member of a pack. The mode is replaced by its canonical equivalent as modes are merged. */
  public static final class Entry {
    Mode mode;
    private final @Nullable String text;
    private final @Nullable Node node;

    Entry(Mode mode, @Nullable String text, @Nullable Node node) {
      this.mode = mode;
      this.text = text;
      this.node = node;
    }

    public Mode mode() {
      return mode;
    }

    /** The field name, or null for packs without field names. */
    public @Nullable String text() {
      return text;
    }

    public @Nullable Node node() {
      return node;
    }
  }

  private final List<Entry> entries = new ArrayList<>();

  public Pack() {}

  /** Returns a pack holding the given modes, without field names. */
  public static Pack of(Mode... modes) {
    Pack pack = new Pack();
    for (Mode m : modes) {
      pack.add(m, null, null);
    }
    return pack;
  }

  public void add(Mode mode, @Nullable String text, @Nullable Node node) {
    entries.add(new Entry(mode, text, node));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Entry get(int i) {
    return entries.get(i);
  }

  public Mode mode(int i) {
    return entries.get(i).mode;
  }

  public ImmutableList<Mode> modes() {
    return entries.stream().map(e -> e.mode).collect(ImmutableList.toImmutableList());
  }

  /** Returns the entry with the given field name, or null. */
  public @Nullable Entry field(String text) {
    for (Entry e : entries) {
      if (text.equals(e.text)) {
        return e;
      }
    }
    return null;
  }

  /** True if some entry's mode is {@code m} (compared by identity). */
  public boolean contains(Mode m) {
    for (Entry e : entries) {
      if (e.mode == m) {
        return true;
      }
    }
    return false;
  }

  void remove(int i) {
    entries.remove(i);
  }

  /** Replaces each entry's mode by its canonical equivalent. */
  void resolveEquivalents() {
    for (Entry e : entries) {
      e.mode = Mode.resolve(e.mode);
    }
  }

  @Override
  public Iterator<Entry> iterator() {
    return entries.iterator();
  }
}
