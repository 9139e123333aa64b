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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import org.algolang.diag.DepthGuard;
import org.algolang.diag.DiagnosticSink;
import org.algolang.diag.Diagnostics;
import org.algolang.mode.ModeTable;
import org.algolang.taxes.StandardEnvironment;
import org.algolang.taxes.SymbolTable;

/**
 * The state shared by all phases of one compilation: the options in force, the diagnostic
 * counters, the symbol interner, the mode table and the standard environment. Every phase receives
 * the session; there is no other mutable state outside the syntax tree.
 */
public final class Session {
  private Options options;
  private final Diagnostics diagnostics;
  private final DepthGuard depthGuard;
  private final Interner<String> symbols = Interners.newStrongInterner();
  private final ModeTable modes;
  private final SymbolTable standardEnvironment;
  private int tableCount;

  public Session(Options options, DiagnosticSink sink) {
    this.options = options;
    this.diagnostics = new Diagnostics(sink, options);
    this.depthGuard = new DepthGuard(diagnostics, options.maxDepth());
    this.modes = new ModeTable(depthGuard);
    this.standardEnvironment = SymbolTable.standardEnvironment();
    StandardEnvironment.populate(standardEnvironment, modes);
  }

  public Options options() {
    return options;
  }

  /** Replaces the options, e.g. when a pragmat switches stropping or warnings. */
  public void setOptions(Options options) {
    this.options = options;
    diagnostics.setOptions(options);
  }

  public Diagnostics diagnostics() {
    return diagnostics;
  }

  public DepthGuard depthGuard() {
    return depthGuard;
  }

  /** Returns the canonical instance of {@code text}, so that equal spellings share storage. */
  public String intern(String text) {
    return symbols.intern(text);
  }

  public ModeTable modes() {
    return modes;
  }

  public SymbolTable standardEnvironment() {
    return standardEnvironment;
  }

  /** Returns a new table for a range nested inside {@code parent}. */
  public SymbolTable newTable(SymbolTable parent) {
    return parent.newRange(++tableCount);
  }
}
