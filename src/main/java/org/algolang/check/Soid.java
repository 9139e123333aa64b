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

import org.algolang.mode.Mode;
import org.algolang.mode.Strength;
import org.algolang.tree.Attribute;
import org.jspecify.annotations.Nullable;

/**
 * A strength paired with a mode. As an expectation it is the context a construct is checked in;
 * as a yield it is what the construct delivers, with {@code attribute} naming the clause that
 * produced it when the yield may need balancing.
 *
 * <p>A null mode in an expectation means any mode is acceptable.
 */
record Soid(Strength strength, @Nullable Mode mode, @Nullable Attribute attribute, boolean cast) {

  static Soid of(Strength strength, @Nullable Mode mode) {
    return new Soid(strength, mode, null, false);
  }

  static Soid of(Strength strength, @Nullable Mode mode, @Nullable Attribute attribute) {
    return new Soid(strength, mode, attribute, false);
  }

  /** The expectation of a cast: strong, and exempt from voiding warnings. */
  static Soid cast(Mode mode) {
    return new Soid(Strength.STRONG, mode, null, true);
  }

  Soid withStrength(Strength s) {
    return new Soid(s, mode, attribute, cast);
  }
}
