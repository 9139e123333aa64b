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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.testing.junit.testparameterinjector.TestParameter.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the test programs found in the files of a testdata directory. Each file holds one or
 * more programs, each followed by a comment matched by a given pattern; the pattern's first group
 * is the comment body. Text after the last comment becomes a program with a null comment.
 */
public class TestdataScanner implements TestParameterValuesProvider {

  /** One program of {@code file} and the comment that follows it. */
  public record TestProgram(String name, Path file, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;
  private final String extension;

  public TestdataScanner(Path dir, Pattern commentPattern, String extension) {
    this.dir = dir;
    this.commentPattern = commentPattern;
    this.extension = extension;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(f -> f.toString().endsWith(extension)).sorted().toList()) {
        split(file, MoreFiles.asCharSource(file, UTF_8).read(), result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  private void split(Path file, String text, ImmutableList.Builder<TestProgram> result) {
    String base = file.getFileName().toString();
    Matcher m = commentPattern.matcher(text);
    int start = 0;
    int index = 0;
    while (m.find()) {
      String name = (index == 0) ? base : base + "#" + index;
      result.add(new TestProgram(name, file, text.substring(start, m.start()), m.group(1)));
      start = m.end();
      index++;
    }
    if (!text.substring(start).isBlank()) {
      result.add(new TestProgram(base + "#" + index, file, text.substring(start), null));
    }
  }
}
