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

package org.algolang.scope;

import static com.google.common.truth.Truth.assertThat;

import org.algolang.Options;
import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScopeCheckerTest {

  @Test
  public void localNameMayNotLeaveRoutine() {
    Compiled compiled =
        Programs.compile("BEGIN PROC f = REF INT: (REF INT x := LOC INT; x); SKIP END");

    assertThat(compiled.errors()).isNotEmpty();
    assertThat(compiled.errors().get(0)).endsWith("could be exported out of its scope");
  }

  @Test
  public void voidRoutineMayUseLocalNames() {
    Compiled compiled = Programs.compile("BEGIN PROC f = VOID: (LOC INT i; i := 1); f END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void globalNameMayLeaveRoutine() {
    Compiled compiled =
        Programs.compile("BEGIN INT g := 0; PROC f = REF INT: g; f := 3; print(g) END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void heapNameMayLeaveRoutine() {
    Compiled compiled =
        Programs.compile("BEGIN PROC f = REF INT: HEAP INT := 7; print(f) END");
    assertThat(compiled.errors()).isEmpty();
  }

  @Test
  public void nameIntoFlexibleRowIsTransient() {
    Compiled compiled =
        Programs.compile(
            "BEGIN FLEX [1:3] INT f := (1, 2, 3); REF INT r = f[1]; print(r) END");
    assertThat(compiled.errors()).contains("attempt at storing a transient name");
  }

  @Test
  public void selfReferenceInDeclaration() {
    Compiled compiled = Programs.compile("BEGIN INT x := x + 1; print(x) END");

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.warnings())
        .contains("identifier x might be used before being initialised");
  }

  @Test
  public void quietModeDropsInitialisationWarning() {
    Options quiet = Options.builder().verbosity(Options.Verbosity.QUIET).build();
    Compiled compiled = Programs.compile("BEGIN INT x := x + 1; print(x) END", quiet);

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.warnings()).isEmpty();
  }
}
