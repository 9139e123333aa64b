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

/** The shape of a {@link Mode}. */
public enum ModeKind {
  /** A primitive mode such as INT or LONG REAL; its dimension is the sizety. */
  STANDARD,
  /** A reference to a declared indicant, before it is replaced by the mode it stands for. */
  INDICANT,
  REF,
  FLEX,
  /** A row of a given number of dimensions. */
  ROW,
  STRUCT,
  UNION,
  PROC,
  /** The yields of the branches of a clause, before balancing. Internal to the mode checker. */
  SERIES,
  /** The modes of the units of a row display or structure display. Internal to the mode checker. */
  STOWED
}
