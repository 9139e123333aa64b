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

package org.algolang.check;

import static org.algolang.tree.Attribute.CLOSED_CLAUSE;
import static org.algolang.tree.Attribute.CONDITIONAL_CLAUSE;
import static org.algolang.tree.Attribute.INTEGER_CASE_CLAUSE;
import static org.algolang.tree.Attribute.SERIAL_CLAUSE;
import static org.algolang.tree.Attribute.UNITED_CASE_CLAUSE;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.mode.Coercibility;
import org.algolang.mode.Deflexing;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeKind;
import org.algolang.mode.ModeTable;
import org.algolang.mode.Pack;
import org.algolang.mode.Strength;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Finds a common mode for the yields of a multi-branch construct.
 *
 * <p>The yields of a clause are collected into a SERIES, which is united into a single mode. If
 * the clause allows balancing, the union is narrowed to the one component that every other
 * component can be strongly coerced to; {@code IF c THEN 1 ELSE 2.0 FI} balances to REAL.
 */
final class Balancer {
  static final String NO_UNIQUE_MODE = "construct has no unique mode";

  private final ModeTable modes;
  private final Coercibility coercions;
  private final Diagnostics diagnostics;

  Balancer(ModeTable modes, Coercibility coercions, Diagnostics diagnostics) {
    this.modes = modes;
    this.coercions = coercions;
    this.diagnostics = diagnostics;
  }

  /**
   * A strong context accepts any yields. Elsewhere at least one yield must not be a display,
   * since a display has no mode of its own.
   */
  boolean isBalanced(Node n, List<Mode> yields, Strength strength) {
    if (strength == Strength.STRONG) {
      return true;
    }
    for (Mode m : yields) {
      if (!m.is(ModeKind.STOWED)) {
        return true;
      }
    }
    diagnostics.error(Severity.SEMANTIC, n, NO_UNIQUE_MODE);
    return false;
  }

  /**
   * Returns the component of union {@code m} to which all other components can be coerced, trying
   * increasingly dereferenced candidates. When two candidates qualify, a FLEX one is preferred
   * over its deflexed form. If nothing qualifies {@code m} itself is returned.
   *
   * @param depreffed if true, a candidate is tested in its completely dereferenced form but the
   *     undereferenced component is returned
   */
  Mode balancedMode(Mode m, Strength strength, boolean depreffed, Deflexing deflex) {
    if (modes.isIllFormed(m) || !m.is(ModeKind.UNION)) {
      return m;
    }
    Pack pack = m.pack();
    Mode common = null;
    boolean goOn = true;
    for (int level = 0; goOn; level++) {
      goOn = false;
      for (int i = 0; i < pack.size(); i++) {
        Mode candidate = pack.mode(i);
        if (candidate == modes.hip) {
          continue;
        }
        int k = level;
        for (; k > 0 && Coercibility.isDeprefable(candidate); k--) {
          candidate = Coercibility.deprefOnce(candidate);
        }
        if (k > 0) {
          continue;
        }
        goOn = true;
        Mode to = depreffed ? coercions.deprefCompletely(candidate) : candidate;
        boolean all = true;
        for (int j = 0; j < pack.size() && all; j++) {
          Mode from = pack.mode(j);
          if (i != j && from != to) {
            all = coercions.isCoercible(from, to, strength, deflex);
          }
        }
        if (all) {
          Mode mark = depreffed ? pack.mode(i) : candidate;
          if (common == null) {
            common = mark;
          } else if (candidate.isFlex() && candidate.deflex() == common) {
            common = mark;
          }
        }
      }
    }
    return (common == null) ? m : common;
  }

  private static boolean allowsBalancing(@Nullable Attribute a) {
    return a == CLOSED_CLAUSE
        || a == CONDITIONAL_CLAUSE
        || a == INTEGER_CASE_CLAUSE
        || a == SERIAL_CLAUSE
        || a == UNITED_CASE_CLAUSE;
  }

  /** Reduces a yield to one mode: its series is united and, for clauses, balanced. */
  Mode uniqueMode(Soid z, Deflexing deflex) {
    Mode x = z.mode();
    if (modes.isIllFormed(x)) {
      return modes.error;
    }
    x = modes.unite(x);
    return allowsBalancing(z.attribute())
        ? balancedMode(x, Strength.STRONG, false, deflex)
        : x;
  }

  /** The SERIES of two operand modes, or the mode itself if both are the same. */
  Mode series(Mode u, Mode v) {
    List<Mode> members = new ArrayList<>();
    for (Mode m : ImmutableList.of(u, v)) {
      if (m.is(ModeKind.SERIES)) {
        members.addAll(m.pack().modes());
      } else {
        members.add(m);
      }
    }
    if (members.size() == 1) {
      return members.get(0);
    }
    return modes.collection(ModeKind.SERIES, members, null);
  }

  /**
   * Splices in the components of any component that, after dereferencing, is a union already
   * contained in {@code u}: {@code UNION (REF UNION (A, B), A, B)} becomes {@code UNION (A, B)}.
   */
  Mode absorbRelatedSubsets(Mode u) {
    boolean changed;
    do {
      changed = false;
      List<Mode> members = new ArrayList<>();
      for (Pack.Entry e : u.pack()) {
        Mode n = coercions.deprefCompletely(e.mode());
        if (n != u && n.is(ModeKind.UNION) && coercions.isSubset(n, u, Deflexing.SAFE)) {
          members.addAll(n.pack().modes());
          changed |= n != e.mode();
        } else {
          members.add(e.mode());
        }
      }
      Mode v = modes.unite(modes.collection(ModeKind.SERIES, members, null));
      changed &= v != u;
      u = v;
    } while (changed && u.is(ModeKind.UNION));
    return u;
  }
}
