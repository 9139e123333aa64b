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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import org.algolang.diag.DepthGuard;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether two modes are structurally equivalent.
 *
 * <p>Modes may be recursive (e.g. {@code MODE LIST = STRUCT (INT head, REF LIST tail)}), so a naive
 * structural comparison would not terminate. Instead, before comparing the components of two
 * compound modes we postulate that they are equivalent; if the comparison of the components comes
 * back to the same pair, the postulate is used. Postulates are discarded when the proof that made
 * them returns, whatever its outcome.
 */
final class Equivalence {
  private record Postulate(Mode a, Mode b) {}

  private final Deque<Postulate> postulates = new ArrayDeque<>();
  private final @Nullable DepthGuard guard;
  private final Mode error;

  Equivalence(@Nullable DepthGuard guard, Mode error) {
    this.guard = guard;
    this.error = error;
  }

  /** Returns true if {@code a} and {@code b} can be proven to be equivalent. */
  boolean prove(Mode a, Mode b) {
    int saved = postulates.size();
    try {
      return equivalent(a, b);
    } finally {
      rewind(saved);
    }
  }

  private void rewind(int size) {
    while (postulates.size() > size) {
      postulates.pop();
    }
  }

  private boolean isPostulated(Mode a, Mode b) {
    for (Iterator<Postulate> it = postulates.iterator(); it.hasNext(); ) {
      Postulate p = it.next();
      if ((p.a == a && p.b == b) || (p.a == b && p.b == a)) {
        return true;
      }
    }
    return false;
  }

  private boolean equivalent(@Nullable Mode a, @Nullable Mode b) {
    if (a == null || b == null) {
      return false;
    }
    // Bound indicants and merged modes compare as the mode they stand for.
    a = Mode.resolve(a);
    b = Mode.resolve(b);
    if (a == b) {
      return true;
    } else if (a == error || b == error) {
      return false;
    } else if (a.kind() != b.kind() || a.dimension != b.dimension) {
      return false;
    } else if (a.is(ModeKind.STANDARD)) {
      return false;
    } else if (a.equivalent == b || b.equivalent == a) {
      return true;
    } else if (isPostulated(a, b)) {
      return true;
    } else if (a.is(ModeKind.INDICANT)) {
      return a.node() != null && a.node() == b.node();
    }
    if (guard != null) {
      guard.enter(a.node());
    }
    int saved = postulates.size();
    try {
      // Cyclic REF and ROW chains are possible once indicants are resolved, so every compound
      // comparison is made under a postulate.
      postulates.push(new Postulate(a, b));
      return switch (a.kind()) {
        case REF, ROW, FLEX -> equivalent(a.sub, b.sub);
        case PROC ->
            a.pack.isEmpty()
                ? b.pack.isEmpty() && equivalent(a.sub, b.sub)
                : equivalent(a.sub, b.sub) && packsEquivalent(a.pack, b.pack);
        case STRUCT, SERIES, STOWED -> packsEquivalent(a.pack, b.pack);
        case UNION -> unitedPacksEquivalent(a.pack, b.pack);
        default -> false;
      };
    } finally {
      rewind(saved);
      if (guard != null) {
        guard.exit();
      }
    }
  }

  /** Same length, pairwise equivalent modes and identical field names. */
  private boolean packsEquivalent(Pack s, Pack t) {
    if (s.size() != t.size()) {
      return false;
    }
    for (int i = 0; i < s.size(); i++) {
      if (!equivalent(s.mode(i), t.mode(i))) {
        return false;
      }
      String x = s.get(i).text();
      String y = t.get(i).text();
      if (x == null ? y != null : !x.equals(y)) {
        return false;
      }
    }
    return true;
  }

  /** Each component of either union is equivalent to some component of the other. */
  private boolean unitedPacksEquivalent(Pack s, Pack t) {
    return isSubset(s, t) && isSubset(t, s);
  }

  private boolean isSubset(Pack s, Pack t) {
    for (Pack.Entry p : s) {
      boolean found = false;
      for (Pack.Entry q : t) {
        if (equivalent(p.mode, q.mode)) {
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }
}
