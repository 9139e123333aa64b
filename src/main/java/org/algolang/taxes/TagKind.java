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

package org.algolang.taxes;

/** The namespace a {@link Tag} belongs to. Each symbol table keeps one list per kind. */
public enum TagKind {
  IDENTIFIER,
  OPERATOR,
  /** A priority declaration for a dyadic operator symbol. */
  PRIORITY,
  /** A mode indicant. */
  INDICANT,
  LABEL,
  /** A routine text, format text or local generator; these have no name but do have a scope. */
  ANONYMOUS
}
