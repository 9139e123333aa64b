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

/** How FLEX is treated when two modes are compared for coercibility. */
public enum Deflexing {
  /** Modes are compared by identity. */
  NONE,
  /** Both modes are compared after removing FLEX. */
  FORCE,
  /** Names are equal if identical or if the first deflexes to the second; values as FORCE. */
  ALIAS,
  /** Values are compared after removing FLEX; names only by identity. */
  SAFE,
  /** Used by the coercion inserter once checking has accepted the coercion. */
  SKIP
}
