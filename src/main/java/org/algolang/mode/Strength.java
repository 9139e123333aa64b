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

/**
 * The strength of a syntactic position, which determines the coercions that may be applied to a
 * unit in that position. Each strength allows everything the previous one does.
 */
public enum Strength {
  /** No coercion at all; the modes must be identical. */
  NONE,
  /** Deproceduring. */
  SOFT,
  /** Deproceduring and dereferencing, stopping at a name. */
  WEAK,
  /** Deproceduring and dereferencing. */
  MEEK,
  /** Meek coercions and uniting. */
  FIRM,
  /** Firm coercions, widening, rowing and voiding. */
  STRONG;

  public boolean atLeast(Strength other) {
    return compareTo(other) >= 0;
  }
}
