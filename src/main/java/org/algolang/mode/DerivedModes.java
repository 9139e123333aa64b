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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completes modes with the forms derived from them: united modes absorb nested unions and lose
 * duplicate components, and each mode gets its {@link Mode#slice}, {@link Mode#name}, {@link
 * Mode#multiple}, {@link Mode#trim} and {@link Mode#deflexed} forms where they exist.
 *
 * <p>Deriving a form may add modes to the table, which may in turn need derived forms; {@link
 * #pass} is repeated until it changes nothing. Modes are looked at through {@link Mode#resolve}
 * since indicants and merged modes may still be referenced.
 */
final class DerivedModes {
  private final ModeTable table;
  private int changes;

  DerivedModes(ModeTable table) {
    this.table = table;
  }

  /** Derives forms for every canonical mode; returns the number of changes made. */
  int pass() {
    changes = 0;
    // The table grows while we iterate.
    for (int i = 0; i < table.size(); i++) {
      Mode m = table.get(i);
      if (m.equivalent == null && !m.is(ModeKind.STANDARD)) {
        derive(m);
      }
    }
    return changes;
  }

  void derive(Mode m) {
    switch (m.kind()) {
      case UNION -> {
        absorb(m);
        contract(m);
      }
      case ROW -> {
        if (m.slice == null) {
          Mode sub = Mode.resolve(m.sub);
          setSlice(m, (m.dimension > 1) ? table.addRow(m.dimension - 1, sub, null, true) : sub);
        }
        rowMultiple(m);
      }
      case FLEX -> {
        Mode row = Mode.resolve(m.sub);
        if (m.slice == null && row.slice != null) {
          setSlice(m, row.slice);
        }
        if (m.trim == null) {
          m.trim = row;
          changes++;
        }
        rowMultiple(m);
      }
      case REF -> {
        name(m);
        Mode sub = Mode.resolve(m.sub);
        if (m.trim == null && sub.isFlex()) {
          m.trim = table.ref(Mode.resolve(sub.sub));
          changes++;
        }
        if (m.multiple == null && sub.multiple != null) {
          m.multiple = nameStruct(Mode.resolve(sub.multiple));
          changes++;
        }
      }
      default -> {}
    }
    hasRows(m);
    if (m.deflexed == null) {
      Mode d = deflex(m);
      if (d != m) {
        m.deflexed = d;
        changes++;
      }
    }
  }

  private void setSlice(Mode m, Mode slice) {
    m.slice = slice;
    changes++;
  }

  private void absorb(Mode m) {
    for (Pack.Entry e : m.pack) {
      if (Mode.resolve(e.mode).is(ModeKind.UNION)) {
        m.pack = ModeTable.absorbUnionPack(m.pack);
        m.dimension = m.pack.size();
        changes++;
        return;
      }
    }
  }

  private void contract(Mode m) {
    Pack pack = m.pack;
    for (int i = 0; i < pack.size(); i++) {
      for (int j = pack.size() - 1; j > i; j--) {
        if (table.prove(pack.mode(i), pack.mode(j))) {
          pack.remove(j);
          changes++;
        }
      }
    }
    m.dimension = pack.size();
  }

  /** REF [] X has name REF X; REF STRUCT (X a) has name STRUCT (REF X a). */
  private void name(Mode m) {
    if (m.name != null) {
      return;
    }
    Mode sub = Mode.resolve(m.sub);
    if (sub.isFlex()) {
      sub = Mode.resolve(sub.sub);
    }
    if (sub.isRow() && sub.slice != null) {
      m.name = table.ref(Mode.resolve(sub.slice));
      changes++;
    } else if (sub.is(ModeKind.STRUCT)) {
      m.name = nameStruct(sub);
      changes++;
    }
  }

  private Mode nameStruct(Mode struct) {
    Pack pack = new Pack();
    for (Pack.Entry e : struct.pack) {
      pack.add(table.ref(Mode.resolve(e.mode)), e.text(), e.node());
    }
    return table.add(ModeKind.STRUCT, pack.size(), null, null, pack);
  }

  /** [] STRUCT (X a) has multiple STRUCT ([] X a); FLEX rows give FLEX rows of fields. */
  private void rowMultiple(Mode m) {
    if (m.multiple != null) {
      return;
    }
    boolean flex = m.isFlex();
    Mode row = flex ? Mode.resolve(m.sub) : m;
    if (!row.isRow()) {
      return;
    }
    Mode element = Mode.resolve(row.sub);
    if (!element.is(ModeKind.STRUCT)) {
      return;
    }
    Pack pack = new Pack();
    for (Pack.Entry e : element.pack) {
      Mode field = table.addRow(row.dimension, Mode.resolve(e.mode), null, true);
      if (flex) {
        field = table.add(ModeKind.FLEX, 0, null, field, null);
      }
      pack.add(field, e.text(), e.node());
    }
    m.multiple = table.add(ModeKind.STRUCT, pack.size(), null, null, pack);
    changes++;
  }

  private void hasRows(Mode m) {
    if (m.hasRows) {
      return;
    }
    boolean rows =
        switch (m.kind()) {
          case ROW, FLEX -> true;
          case STRUCT, UNION -> {
            boolean any = false;
            for (Pack.Entry e : m.pack) {
              any |= Mode.resolve(e.mode).hasRows;
            }
            yield any;
          }
          default -> false;
        };
    if (rows) {
      m.hasRows = true;
      changes++;
    }
  }

  // Deflexing.

  private static boolean containsFlex(Mode m, Set<Mode> visited) {
    m = Mode.resolve(m);
    if (m == null || !visited.add(m)) {
      return false;
    }
    switch (m.kind()) {
      case FLEX:
        return true;
      case ROW:
      case REF:
        return containsFlex(m.sub, visited);
      case PROC:
        if (containsFlex(m.sub, visited)) {
          return true;
        }
        // fall through
      case STRUCT:
      case UNION:
        for (Pack.Entry e : m.pack) {
          if (containsFlex(e.mode, visited)) {
            return true;
          }
        }
        return false;
      default:
        return false;
    }
  }

  /**
   * Returns {@code m} with FLEX removed throughout. Cyclic modes are deflexed by building the new
   * modes unregistered, with each one entered in {@code built} before its components are deflexed;
   * they are added to the table once complete.
   */
  private Mode deflex(Mode m) {
    if (!containsFlex(m, new HashSet<>())) {
      return m;
    }
    Map<Mode, Mode> built = new HashMap<>();
    List<Mode> created = new ArrayList<>();
    Mode d = deflex(m, built, created);
    for (Mode u : created) {
      Mode v = table.register(u);
      if (v != u) {
        u.equivalent = v;
      }
    }
    return Mode.resolve(d);
  }

  private Mode deflex(Mode m, Map<Mode, Mode> built, List<Mode> created) {
    m = Mode.resolve(m);
    if (m.deflexed != null) {
      return m.deflexed;
    }
    Mode d = built.get(m);
    if (d != null) {
      return d;
    }
    if (!containsFlex(m, new HashSet<>())) {
      return m;
    }
    if (m.isFlex()) {
      d = deflex(m.sub, built, created);
      built.put(m, d);
      return d;
    }
    d = new Mode(m.kind(), m.dimension, null, m.node(), null, null);
    d.derivate = true;
    built.put(m, d);
    created.add(d);
    if (m.sub != null) {
      d.sub = deflex(m.sub, built, created);
    }
    for (Pack.Entry e : m.pack) {
      d.pack.add(deflex(e.mode, built, created), e.text(), e.node());
    }
    return d;
  }
}
