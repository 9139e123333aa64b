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

import com.google.common.collect.ImmutableList;
import org.algolang.mode.Coercibility;
import org.algolang.mode.Deflexing;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeKind;
import org.algolang.mode.ModeTable;
import org.algolang.mode.Pack;
import org.algolang.mode.Strength;
import org.algolang.taxes.SymbolTable;
import org.algolang.taxes.Tag;
import org.jspecify.annotations.Nullable;

/**
 * Finds the operator declaration that applies to a formula.
 *
 * <p>Operands are coerced firmly to the operator's parameter modes. The ranges are searched from
 * the innermost outward. A dyadic formula that matches nothing is then retried in the standard
 * environment with its operands balanced to a common mode, then with both operands widened along
 * the numeric tower (REAL, LONG REAL, LONG LONG REAL, COMPLEX, LONG COMPLEX, LONG LONG COMPLEX),
 * and finally with the balanced mode dereferenced, which finds {@code REF REAL +:= INT}.
 */
final class OperatorResolver {
  private final ModeTable modes;
  private final Coercibility coercions;
  private final Balancer balancer;
  private final SymbolTable standardEnvironment;

  OperatorResolver(
      ModeTable modes, Coercibility coercions, Balancer balancer, SymbolTable standardEnvironment) {
    this.modes = modes;
    this.coercions = coercions;
    this.balancer = balancer;
    this.standardEnvironment = standardEnvironment;
  }

  /**
   * Returns the operator {@code name} applicable to an operand of mode {@code x}, or to operands
   * {@code x} and {@code y} when {@code y} is not null; null if there is none. The operand modes
   * must be well formed.
   */
  @Nullable Tag find(SymbolTable range, String name, Mode x, @Nullable Mode y) {
    if (y == null) {
      return searchChain(range, name, x, null, Deflexing.SAFE);
    }
    Tag z = searchChain(range, name, x, y, Deflexing.SAFE);
    if (z != null) {
      return z;
    }
    Mode u = modes.unite(balancer.series(x, y));
    Mode v = balancer.balancedMode(u, Strength.STRONG, false, Deflexing.SAFE);
    z = search(standardEnvironment, name, v, v, Deflexing.ALIAS);
    if (z != null) {
      return z;
    }
    for (Mode tower : numericTower()) {
      if (allCoercible(u, tower)) {
        z = search(standardEnvironment, name, tower, tower, Deflexing.ALIAS);
        if (z != null) {
          return z;
        }
      }
    }
    v = balancer.balancedMode(u, Strength.STRONG, true, Deflexing.SAFE);
    return search(standardEnvironment, name, v, v, Deflexing.ALIAS);
  }

  private ImmutableList<Mode> numericTower() {
    return ImmutableList.of(
        modes.real,
        modes.longReal,
        modes.longLongReal,
        modes.complex,
        modes.longComplex,
        modes.longLongComplex);
  }

  private boolean allCoercible(Mode u, Mode target) {
    if (!u.is(ModeKind.UNION)) {
      return coercions.isCoercible(u, target, Strength.STRONG, Deflexing.SAFE);
    }
    for (Pack.Entry e : u.pack()) {
      if (!coercions.isCoercible(e.mode(), target, Strength.STRONG, Deflexing.SAFE)) {
        return false;
      }
    }
    return true;
  }

  private @Nullable Tag searchChain(
      SymbolTable range, String name, Mode x, @Nullable Mode y, Deflexing deflex) {
    for (SymbolTable s = range; s != null; s = s.parent()) {
      Tag z = search(s, name, x, y, deflex);
      if (z != null) {
        return z;
      }
    }
    return null;
  }

  private @Nullable Tag search(
      SymbolTable s, String name, Mode x, @Nullable Mode y, Deflexing deflex) {
    for (Tag t : s.operators(name)) {
      Mode proc = t.mode();
      if (proc == null || !proc.is(ModeKind.PROC)) {
        continue;
      }
      Pack p = proc.pack();
      if (p.isEmpty() || !coercions.isCoercible(x, p.mode(0), Strength.FIRM, deflex)) {
        continue;
      }
      if (p.size() == 1 && y == null) {
        return t;
      } else if (p.size() == 2
          && y != null
          && coercions.isCoercible(y, p.mode(1), Strength.FIRM, deflex)) {
        return t;
      }
    }
    return null;
  }
}
