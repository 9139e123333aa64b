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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptionsTest {

  @Test
  public void defaults() {
    assertThat(Options.DEFAULT.stropping()).isEqualTo(Options.Stropping.UPPER);
    assertThat(Options.DEFAULT.brackets()).isFalse();
    assertThat(Options.DEFAULT.verbosity()).isEqualTo(Options.Verbosity.NORMAL);
    assertThat(Options.DEFAULT.maxErrors()).isGreaterThan(0);
  }

  @Test
  public void toBuilderKeepsSettings() {
    Options options =
        Options.builder().stropping(Options.Stropping.QUOTE).portcheck(true).maxDepth(40).build();
    Options copy = options.toBuilder().brackets(true).build();

    assertThat(copy.stropping()).isEqualTo(Options.Stropping.QUOTE);
    assertThat(copy.portcheck()).isTrue();
    assertThat(copy.maxDepth()).isEqualTo(40);
    assertThat(copy.brackets()).isTrue();
    assertThat(options.brackets()).isFalse();
  }

  @Test
  public void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class, () -> Options.builder().maxErrors(0));
    assertThrows(IllegalArgumentException.class, () -> Options.builder().maxDepth(-1));
  }
}
