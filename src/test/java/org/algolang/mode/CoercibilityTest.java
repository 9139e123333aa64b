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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class CoercibilityTest {

  private static final ModeTable TABLE = new ModeTable(null);
  private static final Coercibility COERCIONS = new Coercibility(TABLE);

  private static final Mode INT = TABLE.intMode;
  private static final Mode REAL = TABLE.real;
  private static final Mode REF_INT = TABLE.refInt;
  private static final Mode REF_REF_INT = TABLE.ref(TABLE.refInt);
  private static final Mode PROC_INT = TABLE.proc(TABLE.intMode);
  private static final Mode PROC_INT_INT = TABLE.proc(TABLE.intMode, TABLE.intMode);
  private static final Mode INT_OR_REAL = TABLE.union(TABLE.intMode, TABLE.real);

  private static Object[] coercions() {
    return new Object[] {
      new Object[] {REF_INT, INT, Strength.SOFT, false},
      new Object[] {REF_INT, INT, Strength.WEAK, true},
      new Object[] {REF_REF_INT, INT, Strength.MEEK, true},
      new Object[] {REF_REF_INT, REF_INT, Strength.WEAK, true},
      new Object[] {PROC_INT, INT, Strength.SOFT, true},
      new Object[] {PROC_INT_INT, INT, Strength.STRONG, false},
      new Object[] {INT, REAL, Strength.FIRM, false},
      new Object[] {INT, REAL, Strength.STRONG, true},
      new Object[] {REF_INT, REAL, Strength.STRONG, true},
      new Object[] {REAL, INT, Strength.STRONG, false},
      new Object[] {INT, INT_OR_REAL, Strength.MEEK, false},
      new Object[] {INT, INT_OR_REAL, Strength.FIRM, true},
      new Object[] {REF_INT, INT_OR_REAL, Strength.FIRM, true},
      new Object[] {TABLE.bool, INT_OR_REAL, Strength.STRONG, false},
      new Object[] {INT, TABLE.voidMode, Strength.STRONG, true},
      new Object[] {INT, REF_INT, Strength.STRONG, false},
    };
  }

  @Test
  @Parameters(method = "coercions")
  public void isCoercible(Mode from, Mode to, Strength strength, boolean expected) {
    assertWithMessage("%s to %s in a %s position", from, to, strength)
        .that(COERCIONS.isCoercible(from, to, strength, Deflexing.SAFE))
        .isEqualTo(expected);
  }

  @Test
  public void wrongModesAreCoercibleToAnything() {
    assertThat(COERCIONS.isCoercible(TABLE.error, INT, Strength.NONE, Deflexing.SAFE)).isTrue();
    assertThat(COERCIONS.isCoercible(REAL, TABLE.error, Strength.NONE, Deflexing.SAFE)).isTrue();
  }

  @Test
  public void widening() {
    assertThat(COERCIONS.widensTo(INT, REAL)).isSameInstanceAs(REAL);
    assertThat(COERCIONS.widensTo(INT, TABLE.complex)).isSameInstanceAs(REAL);
    assertThat(COERCIONS.isWidenable(INT, TABLE.complex)).isTrue();
    assertThat(COERCIONS.widensTo(REAL, INT)).isNull();
  }

  @Test
  public void dereferencing() {
    assertThat(COERCIONS.deprefCompletely(REF_REF_INT)).isSameInstanceAs(INT);
    assertThat(COERCIONS.deprocCompletely(TABLE.proc(PROC_INT))).isSameInstanceAs(INT);
    assertThat(Coercibility.deprefOnce(INT)).isNull();
    assertThat(COERCIONS.isNonProc(REF_INT)).isTrue();
    assertThat(COERCIONS.isNonProc(TABLE.ref(PROC_INT))).isFalse();
  }

  @Test
  public void firmlyRelated() {
    assertThat(COERCIONS.isFirm(REF_INT, INT)).isTrue();
    assertThat(COERCIONS.isFirm(INT, REAL)).isFalse();
    assertThat(COERCIONS.unitesTo(INT, INT_OR_REAL)).isSameInstanceAs(INT);
    assertThat(COERCIONS.unitesTo(TABLE.bool, INT_OR_REAL)).isNull();
  }
}
