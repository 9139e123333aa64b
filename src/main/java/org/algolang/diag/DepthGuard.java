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

package org.algolang.diag;

import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Bounds the recursion depth of phases whose nesting follows the nesting of the source program
 * (declarers, reductions, mode equivalence), so that a deeply nested program is reported as too
 * complex instead of overflowing the stack.
 *
 * <p>Every {@link #enter} must be paired with an {@link #exit}, normally in a {@code finally}
 * block.
 */
public final class DepthGuard {
  static final String TOO_COMPLEX = "program is too complex";

  private final Diagnostics diagnostics;
  private final int maxDepth;
  private int depth;

  public DepthGuard(Diagnostics diagnostics, int maxDepth) {
    this.diagnostics = diagnostics;
    this.maxDepth = maxDepth;
  }

  /**
   * Increments the depth; if it now exceeds the limit, reports an error at {@code where} and
   * throws {@link PhaseAbort}.
   */
  public void enter(@Nullable Node where) {
    if (++depth > maxDepth) {
      depth = 0;
      diagnostics.error(Severity.SYNTAX, where, TOO_COMPLEX);
      throw new PhaseAbort(TOO_COMPLEX);
    }
  }

  public void exit() {
    if (depth > 0) {
      depth--;
    }
  }

  public int depth() {
    return depth;
  }
}
