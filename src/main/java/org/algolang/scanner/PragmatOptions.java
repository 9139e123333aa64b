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

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import java.util.Iterator;
import org.algolang.Options;

/**
 * Applies the option items of a pragmat to the options in force. Items are case insensitive and
 * separated by white space; items this front end does not know are ignored, and the file name
 * after {@code include} or {@code read} is skipped since inclusion has already been done.
 */
final class PragmatOptions {
  private static final Splitter ITEMS = Splitter.onPattern("\\s+").omitEmptyStrings();

  private PragmatOptions() {}

  static Options apply(Options options, String text) {
    Options.Builder b = options.toBuilder();
    for (Iterator<String> it = ITEMS.split(text).iterator(); it.hasNext(); ) {
      String item = Ascii.toLowerCase(it.next());
      switch (item) {
        case "upper" -> b.stropping(Options.Stropping.UPPER);
        case "quote", "quotestropping" -> b.stropping(Options.Stropping.QUOTE);
        case "brackets" -> b.brackets(true);
        case "nobrackets" -> b.brackets(false);
        case "portcheck" -> b.portcheck(true);
        case "noportcheck" -> b.portcheck(false);
        case "nowarnings", "quiet" -> b.verbosity(Options.Verbosity.QUIET);
        case "warnings" -> b.verbosity(Options.Verbosity.NORMAL);
        case "verbose" -> b.verbosity(Options.Verbosity.VERBOSE);
        case "reductions" -> b.reductionTrace(true);
        case "include", "read" -> {
          if (it.hasNext()) {
            it.next();
          }
        }
        default -> {}
      }
    }
    return b.build();
  }
}
