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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.algolang.testing.Programs;
import org.algolang.testing.Programs.Compiled;
import org.algolang.testing.TestdataScanner;
import org.algolang.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles each program in the .a68 files of the testdata directory and compares the outcome with
 * the comment that follows it.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/resources/org/algolang/testdata");

  /**
   * Each program is followed by a comment "{@code CO EXPECT ... CO}". If the comment says {@code
   * OK} the program must compile without errors (warnings are allowed); otherwise one of the
   * reported errors must contain the comment's text.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\\bCO EXPECT (.*?) CO\\n*", Pattern.DOTALL);

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    String expected = checkNotNull(testProgram.comment(), "No EXPECT comment found").trim();
    Compiled compiled =
        Programs.compile(testProgram.file().toString(), testProgram.code(), Options.DEFAULT);
    if (expected.equals("OK")) {
      assertWithMessage("Unexpected errors in %s", testProgram.name())
          .that(compiled.errors())
          .isEmpty();
      assertWithMessage("Program of %s", testProgram.name())
          .that(compiled.result().succeeded())
          .isTrue();
    } else {
      assertWithMessage("Expected error in %s", testProgram.name())
          .that(compiled.errors().stream().anyMatch(e -> e.contains(expected)))
          .isTrue();
    }
  }

  /** Provides every program in the testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN, ".a68");
    }
  }
}
