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

package org.algolang.scanner;

import static com.google.common.truth.Truth.assertThat;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.algolang.Options;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class PragmatOptionsTest {

  private static Object[] verbosities() {
    return new Object[] {
      new Object[] {"nowarnings", Options.Verbosity.QUIET},
      new Object[] {"  QUIET ", Options.Verbosity.QUIET},
      new Object[] {"warnings", Options.Verbosity.NORMAL},
      new Object[] {"verbose", Options.Verbosity.VERBOSE},
    };
  }

  @Test
  @Parameters(method = "verbosities")
  public void verbosity(String items, Options.Verbosity expected) {
    assertThat(PragmatOptions.apply(Options.DEFAULT, items).verbosity()).isEqualTo(expected);
  }

  @Test
  public void severalItems() {
    Options options = PragmatOptions.apply(Options.DEFAULT, " quote brackets portcheck ");
    assertThat(options.stropping()).isEqualTo(Options.Stropping.QUOTE);
    assertThat(options.brackets()).isTrue();
    assertThat(options.portcheck()).isTrue();

    Options back = PragmatOptions.apply(options, "upper nobrackets");
    assertThat(back.stropping()).isEqualTo(Options.Stropping.UPPER);
    assertThat(back.brackets()).isFalse();
    assertThat(back.portcheck()).isTrue();
  }

  @Test
  public void unknownItemsAndFileNamesAreIgnored() {
    Options options = PragmatOptions.apply(Options.DEFAULT, "include \"brackets\" whatever");
    assertThat(options.brackets()).isFalse();
    assertThat(options.verbosity()).isEqualTo(Options.DEFAULT.verbosity());
  }
}
