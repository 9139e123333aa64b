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

package org.algolang;

import org.algolang.mode.ModeTable;
import org.algolang.taxes.SymbolTable;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * What a compilation leaves for the back end.
 *
 * @param program the particular program, or null if a phase was aborted before the tree was
 *     complete
 * @param modes every mode the program uses, including those of the standard environment
 * @param standardEnvironment the outermost symbol table
 * @param errorCount the number of errors reported; when zero the program is fully mode checked and
 *     carries explicit coercions
 * @param warningCount the number of warnings reported
 */
public record CompilationResult(
    @Nullable Node program,
    ModeTable modes,
    SymbolTable standardEnvironment,
    int errorCount,
    int warningCount) {

  /** True if the program can be handed to a code generator. */
  public boolean succeeded() {
    return program != null && errorCount == 0;
  }
}
