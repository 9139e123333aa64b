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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.file.Path;

/** Reads included files from the file system, relative to the directory of the including file. */
public final class FileSystemSourceReader implements SourceReader {
  private final Path root;

  /** {@code root} is used for files included from a source that has no directory of its own. */
  public FileSystemSourceReader(Path root) {
    this.root = root;
  }

  @Override
  public String resolve(String includingFile, String name) {
    Path dir = Path.of(includingFile).getParent();
    Path base = (dir == null) ? root : dir;
    return base.resolve(name).normalize().toString();
  }

  @Override
  public ImmutableList<String> read(String resolvedName) throws IOException {
    return MoreFiles.asCharSource(Path.of(resolvedName), UTF_8).readLines();
  }
}
