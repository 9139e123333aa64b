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

import com.google.common.collect.ImmutableList;
import java.io.IOException;

/**
 * Supplies the contents of files named by inclusion pragmats. The scanner does no path handling of
 * its own beyond asking the reader to resolve a name relative to the including file, and skipping
 * files whose resolved name it has already seen.
 */
public interface SourceReader {

  /** Returns the name of the file {@code name} as seen from the file {@code includingFile}. */
  String resolve(String includingFile, String name);

  /** Returns the lines of the file with the given resolved name, without line terminators. */
  ImmutableList<String> read(String resolvedName) throws IOException;
}
