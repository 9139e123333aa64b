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

package org.algolang.parser;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.Consumer;
import org.algolang.Session;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Matcher;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The reduction primitive of the bottom-up parser, shared by the reducers of each phrase family.
 *
 * <p>{@link #reduce} matches a run of siblings against a pattern of {@link Matcher}s and, on
 * success, nests the run under its first node, which is retagged with the result attribute. Most
 * reductions are written as families of alternatives tried in order on the same node; since a
 * successful reduction retags the node, at most one alternative of a family applies unless a later
 * pattern starts with the result of an earlier one.
 */
final class Reducer {
  private static final Logger logger = LoggerFactory.getLogger(Reducer.class);

  static final String MISSING_SYMBOL = "syntax error: possibly a missing symbol nearby";
  static final String MISSING_SEPARATOR = "syntax error: possibly a missing separator nearby";
  static final String WRONG_SEPARATOR = "syntax error: possibly a wrong separator nearby";
  static final String CLAUSE_WITHOUT_VALUE = "clause does not yield a value";
  static final String FEATURE_UNSUPPORTED = "unsupported feature %s";

  final Session session;
  final Diagnostics diagnostics;
  private final boolean trace;

  Reducer(Session session) {
    this.session = session;
    this.diagnostics = session.diagnostics();
    this.trace = session.options().reductionTrace();
  }

  /**
   * If {@code p} and its following siblings match {@code pattern}, runs {@code action} on {@code
   * p} and then nests the matched run under {@code p} with attribute {@code result}. Returns true
   * if the reduction was made.
   */
  @CanIgnoreReturnValue
  boolean reduce(
      @Nullable Node p, @Nullable Consumer<Node> action, Attribute result, Matcher... pattern) {
    if (p == null) {
      return false;
    }
    Node tail = null;
    Node q = p;
    for (Matcher m : pattern) {
      if (q == null || !m.matches(q)) {
        return false;
      }
      tail = q;
      q = q.next();
    }
    if (trace && logger.isTraceEnabled()) {
      logger.trace("{}: {}<-{}", lineNumber(p), result.displayName(), phrase(p, tail));
    }
    if (action != null) {
      action.accept(p);
    }
    p.makeSub(tail, result);
    return true;
  }

  /** Shorthand for {@link #reduce} without an action. */
  @CanIgnoreReturnValue
  boolean reduce(@Nullable Node p, Attribute result, Matcher... pattern) {
    return reduce(p, null, result, pattern);
  }

  /** Inserts a new node with attribute {@code a} after {@code p}, at the position of {@code p}. */
  static Node padNode(Node p, Attribute a) {
    Node q = new Node(a, p.symbol(), p.line(), p.column());
    q.setTable(p.table());
    p.insertAfter(q);
    return q;
  }

  private static int lineNumber(Node p) {
    return (p.line() == null) ? 0 : p.line().number();
  }

  private static String phrase(Node head, Node tail) {
    StringBuilder sb = new StringBuilder();
    for (Node q = head; q != null; q = q.next()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(q.attribute().displayName());
      if (q == tail) {
        break;
      }
    }
    return sb.toString();
  }

  // Actions that report a repaired error; each reports at the node after the one it is given.

  private static Node after(Node p) {
    return (p.next() != null) ? p.next() : p;
  }

  void missingSymbol(Node p) {
    diagnostics.error(Severity.SYNTAX, after(p), MISSING_SYMBOL);
  }

  void missingSeparator(Node p) {
    diagnostics.error(Severity.SYNTAX, after(p), MISSING_SEPARATOR);
  }

  void wrongSeparator(Node p) {
    diagnostics.error(Severity.SYNTAX, after(p), WRONG_SEPARATOR);
  }

  void emptyClause(Node p) {
    diagnostics.error(Severity.SYNTAX, p, CLAUSE_WITHOUT_VALUE);
  }

  void notSupported(Node p) {
    diagnostics.error(Severity.SYNTAX, p, FEATURE_UNSUPPORTED, p.symbol());
  }
}
