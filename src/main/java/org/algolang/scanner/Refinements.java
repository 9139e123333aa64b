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

import java.util.LinkedHashMap;
import java.util.Map;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Expands stepwise refinements. A program with refinements has the form
 *
 * <pre>
 *   main text . name: body . name: body . ...
 * </pre>
 *
 * and each refinement body replaces the single occurrence of its name, in the main text or in
 * another body that has been substituted already. A program without such a trailing list is left
 * as it is.
 */
public final class Refinements {
  static final String EMPTY = "empty refinement at end of source";
  static final String EMPTY_BODY = "refinement %s has an empty body";
  static final String EXPECTED_POINT = "expected .";
  static final String DEFINED = "refinement is already defined";
  static final String APPLIED = "refinement is applied more than once";
  static final String NOT_APPLIED = "refinement is not applied";
  static final String INVALID = "invalid refinement";

  private static final class Refinement {
    final Node defined;
    Node begin;
    Node end;
    int applications;

    Refinement(Node defined) {
      this.defined = defined;
    }
  }

  private final Diagnostics diagnostics;
  private final Map<String, Refinement> refinements = new LinkedHashMap<>();

  private Refinements(Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  /** Expands the refinements of the program starting at {@code top}; returns the new first node. */
  public static @Nullable Node expand(Diagnostics diagnostics, @Nullable Node top) {
    Refinements r = new Refinements(diagnostics);
    Node main = r.mainPoint(top);
    if (main == null || main.next() == null) {
      return top;
    }
    int errors = diagnostics.errorCount();
    if (!r.collect(main.next())) {
      return top;
    }
    return r.substitute(top, errors);
  }

  private static boolean isTerminator(Node p) {
    return p.whether(Attribute.POINT_SYMBOL, Attribute.IDENTIFIER, Attribute.COLON_SYMBOL);
  }

  private @Nullable Node mainPoint(@Nullable Node top) {
    for (Node p = top; p != null; p = p.next()) {
      if (isTerminator(p)) {
        return p;
      }
    }
    return null;
  }

  /** Reads the definitions starting at {@code p}; returns false if the list is malformed. */
  private boolean collect(Node p) {
    while (p != null && p.whether(Attribute.IDENTIFIER, Attribute.COLON_SYMBOL)) {
      Refinement r = new Refinement(p);
      p = p.next(2);
      if (p == null) {
        diagnostics.error(Severity.SYNTAX, null, EMPTY);
        return false;
      }
      r.begin = p;
      while (p != null && !p.is(Attribute.POINT_SYMBOL)) {
        r.end = p;
        p = p.next();
      }
      if (p == null) {
        diagnostics.error(Severity.SYNTAX, r.defined, EXPECTED_POINT);
        return false;
      }
      p = p.next();
      if (r.end == null) {
        diagnostics.error(Severity.SYNTAX, r.defined, EMPTY_BODY, r.defined.symbol());
      } else if (refinements.containsKey(r.defined.symbol())) {
        diagnostics.error(Severity.SYNTAX, r.defined, DEFINED);
      } else {
        refinements.put(r.defined.symbol(), r);
      }
    }
    if (p != null) {
      diagnostics.error(Severity.SYNTAX, p, INVALID);
    }
    return true;
  }

  private @Nullable Node substitute(Node top, int errorsBefore) {
    Node first = top;
    Node p = top;
    Node lastMain = null;
    while (p != null && !p.is(Attribute.POINT_SYMBOL)) {
      Refinement y = p.is(Attribute.IDENTIFIER) ? refinements.get(p.symbol()) : null;
      if (y == null) {
        lastMain = p;
        p = p.next();
        continue;
      }
      if (++y.applications > 1) {
        diagnostics.error(Severity.SYNTAX, y.defined, APPLIED);
        lastMain = p;
        p = p.next();
        continue;
      }
      Node before = p.previous();
      Node after = p.next();
      if (before != null) {
        before.setNext(y.begin);
      } else {
        first = y.begin;
      }
      y.begin.setPrevious(before);
      if (after != null) {
        after.setPrevious(y.end);
      }
      y.end.setNext(after);
      p = y.begin;
    }
    if (p == null) {
      diagnostics.error(Severity.SYNTAX, lastMain, EXPECTED_POINT);
    } else if (lastMain != null) {
      lastMain.setNext(null);
    } else {
      first = null;
    }
    if (diagnostics.errorCount() == errorsBefore) {
      for (Refinement r : refinements.values()) {
        if (r.applications == 0) {
          diagnostics.error(Severity.SYNTAX, r.defined, NOT_APPLIED);
        }
      }
    }
    return first;
  }
}
