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

import static org.algolang.tree.Attribute.DECLARER;
import static org.algolang.tree.Attribute.FLEX_SYMBOL;

import java.util.HashSet;
import java.util.Set;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Checks that declared modes can actually be built.
 *
 * <p>A mode defined in terms of itself must reach itself through a REF, a procedure or a
 * structure. The traversal carries two flags: <i>yin</i> is set once a REF or a parameterless
 * procedure has been passed, <i>yang</i> once a STRUCT has been passed. Returning to the indicant
 * with neither flag set means the mode would contain itself directly, as in {@code MODE A = [1:2]
 * A} or {@code MODE A = UNION (A, INT)}.
 */
final class WellFormedness {
  static final String NOT_WELL_FORMED = "mode \"%s\" is not well-formed";
  static final String MULTIPLE_FIELD = "multiple declaration of field \"%s\"";
  static final String COMPONENT_NUMBER = "%s must have at least two components";
  static final String COMPONENT_RELATED = "%s has firmly related components";
  static final String FLEX_WITHOUT_ROW = "FLEX must be followed by a row, not %s";
  static final String RELATED_TO_VOID = "VOID cannot be a component of %s";

  private final ModeTable table;
  private final Diagnostics diagnostics;

  WellFormedness(ModeTable table, Diagnostics diagnostics) {
    this.table = table;
    this.diagnostics = diagnostics;
  }

  /**
   * Reports the bound indicant {@code z} if its definition contains it in an unbuildable way;
   * returns false if it was reported.
   */
  boolean checkIndicant(Mode z) {
    if (!isWellFormed(z, z.equivalent, false, false, true, new HashSet<>())) {
      diagnostics.error(Severity.SEMANTIC, z.node(), NOT_WELL_FORMED, z.node().symbol());
      return false;
    }
    return true;
  }

  private boolean isWellFormed(
      Mode def, @Nullable Mode z, boolean yin, boolean yang, boolean video, Set<Mode> postulates) {
    if (z == null) {
      return false;
    } else if (z == table.error) {
      // Already reported.
      return true;
    } else if (yin || yang) {
      return z == table.voidMode ? video : true;
    } else if (z == table.voidMode) {
      return video;
    }
    switch (z.kind()) {
      case STANDARD:
        return true;
      case INDICANT:
        if (z == def || postulates.contains(z)) {
          return false;
        }
        postulates.add(z);
        return isWellFormed(def, z.equivalent, yin, yang, video, postulates);
      case REF:
        return isWellFormed(def, z.sub, true, yang, false, postulates);
      case PROC:
        return !z.pack.isEmpty() || isWellFormed(def, z.sub, true, yang, true, postulates);
      case ROW:
      case FLEX:
        return isWellFormed(def, z.sub, yin, yang, false, postulates);
      case STRUCT:
        for (Pack.Entry e : z.pack) {
          if (!isWellFormed(def, e.mode, yin, true, false, postulates)) {
            return false;
          }
        }
        return true;
      case UNION:
        for (Pack.Entry e : z.pack) {
          if (!isWellFormed(def, e.mode, yin, yang, true, postulates)) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  /**
   * Checks the structured and united modes written in the program, once they are canonical:
   * field names must be unique, and a union needs two components none of which is firmly related
   * to another.
   */
  void checkDeclaredModes() {
    Coercibility coercions = new Coercibility(table);
    for (int i = table.standardCount(); i < table.size(); i++) {
      Mode m = table.get(i);
      if (m.equivalent != null || m.node() == null || m.derivate) {
        continue;
      }
      if (m.is(ModeKind.STRUCT)) {
        checkFields(m);
      } else if (m.is(ModeKind.UNION)) {
        checkUnion(coercions, m);
      }
      checkVoid(m);
    }
  }

  private void checkFields(Mode m) {
    Set<String> seen = new HashSet<>();
    for (Pack.Entry e : m.pack) {
      if (e.text() != null && !seen.add(e.text())) {
        diagnostics.error(
            Severity.SEMANTIC, e.node() != null ? e.node() : m.node(), MULTIPLE_FIELD, e.text());
      }
    }
  }

  private void checkUnion(Coercibility coercions, Mode m) {
    if (m.pack.size() < 2) {
      diagnostics.error(Severity.SEMANTIC, m.node(), COMPONENT_NUMBER, m);
      return;
    }
    for (int i = 0; i < m.pack.size(); i++) {
      for (int j = i + 1; j < m.pack.size(); j++) {
        if (coercions.isFirm(m.pack.mode(i), m.pack.mode(j))) {
          diagnostics.error(Severity.SEMANTIC, m.node(), COMPONENT_RELATED, m);
          return;
        }
      }
    }
  }

  /** VOID may be the yield of a procedure or a component of a union, and nothing else. */
  private void checkVoid(Mode m) {
    boolean related =
        switch (m.kind()) {
          case REF, ROW, FLEX -> m.sub == table.voidMode;
          case STRUCT -> m.pack.contains(table.voidMode);
          case PROC -> m.pack.contains(table.voidMode);
          default -> false;
        };
    if (related) {
      diagnostics.error(Severity.SEMANTIC, m.node(), RELATED_TO_VOID, m);
    }
  }

  /** Reports declarers {@code FLEX d} where {@code d} does not declare a row. */
  void checkFlex(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(DECLARER) && p.sub() != null && p.sub().is(FLEX_SYMBOL)) {
        Node d = p.sub().next();
        Mode m = (d == null) ? null : d.mode();
        if (m != null && m != table.error && !m.isRow()) {
          diagnostics.error(Severity.SEMANTIC, p, FLEX_WITHOUT_ROW, m);
        }
      }
      checkFlex(p.sub());
    }
  }
}
