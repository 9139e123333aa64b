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

package org.algolang.testing;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.algolang.CompilationResult;
import org.algolang.Compiler;
import org.algolang.Options;
import org.algolang.diag.Diagnostic;
import org.algolang.diag.DiagnosticList;
import org.algolang.scanner.FileSystemSourceReader;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;

/** Compiles small programs for tests and finds nodes in the result. */
public final class Programs {

  // Static methods only
  private Programs() {}

  /** A compiled program with every diagnostic reported for it. */
  public record Compiled(CompilationResult result, DiagnosticList diagnostics) {

    public Node program() {
      return checkNotNull(result.program(), "compilation was aborted: %s", diagnostics);
    }

    public ImmutableList<String> errors() {
      return diagnostics.errors().stream().map(Diagnostic::message).collect(toImmutableList());
    }

    public ImmutableList<String> warnings() {
      return diagnostics.warnings().stream().map(Diagnostic::message).collect(toImmutableList());
    }

    /** All nodes with attribute {@code a}, in tree order. */
    public ImmutableList<Node> all(Attribute a) {
      List<Node> found = new ArrayList<>();
      program().forEachInTree(n -> {
        if (n.is(a)) {
          found.add(n);
        }
      });
      return ImmutableList.copyOf(found);
    }

    public Node first(Attribute a) {
      ImmutableList<Node> found = all(a);
      checkNotNull(found.isEmpty() ? null : found.get(0), "no %s in program", a);
      return found.get(0);
    }

    /** The first applied occurrence of identifier {@code name}. */
    public Node identifier(String name) {
      return all(Attribute.IDENTIFIER).stream()
          .filter(n -> n.symbol().equals(name))
          .findFirst()
          .orElseThrow(() -> new AssertionError("no identifier " + name));
    }
  }

  public static Compiled compile(String text) {
    return compile(text, Options.DEFAULT);
  }

  public static Compiled compile(String text, Options options) {
    return compile("test.a68", text, options);
  }

  public static Compiled compile(String name, String text, Options options) {
    DiagnosticList sink = new DiagnosticList();
    CompilationResult result =
        Compiler.compile(name, text, options, new FileSystemSourceReader(Path.of(".")), sink);
    return new Compiled(result, sink);
  }
}
