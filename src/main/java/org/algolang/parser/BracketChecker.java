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

import org.algolang.diag.Diagnostics;
import org.algolang.diag.PhaseAbort;
import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Checks that brackets and bracketing keywords are properly matched before any parsing is
 * attempted, so that the parsers can rely on it. On a mismatch the diagnostic names every kind of
 * bracket whose openers and closers do not balance.
 */
public final class BracketChecker {
  static final String PARENTHESIS = "incorrect nesting, check for %s";
  static final String PARENTHESIS_2 = "encountered %s in line %d but expected %s, check for %s";
  static final String MISSING_KEYWORDS = "missing or unmatched keyword";

  private final Diagnostics diagnostics;
  private final Node top;

  private BracketChecker(Diagnostics diagnostics, Node top) {
    this.diagnostics = diagnostics;
    this.top = top;
  }

  /** Throws {@link PhaseAbort} after reporting, if the brackets from {@code top} do not match. */
  public static void check(Diagnostics diagnostics, @Nullable Node top) {
    if (top == null) {
      return;
    }
    BracketChecker checker = new BracketChecker(diagnostics, top);
    if (checker.parse(top) != null) {
      diagnostics.error(Severity.SYNTAX, top, PARENTHESIS, MISSING_KEYWORDS);
      throw new PhaseAbort("unmatched brackets");
    }
  }

  /**
   * Makes {@code [ ]} and <code>{ }</code> ordinary parentheses, for programs that use them as
   * alternatives.
   */
  public static void substituteBrackets(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      substituteBrackets(p.sub());
      switch (p.attribute()) {
        case ACCO_SYMBOL, SUB_SYMBOL -> p.setAttribute(Attribute.OPEN_SYMBOL);
        case OCCA_SYMBOL, BUS_SYMBOL -> p.setAttribute(Attribute.CLOSE_SYMBOL);
        default -> {}
      }
    }
  }

  private static @Nullable Attribute closerOf(Attribute a) {
    return switch (a) {
      case BEGIN_SYMBOL -> Attribute.END_SYMBOL;
      case OPEN_SYMBOL -> Attribute.CLOSE_SYMBOL;
      case ACCO_SYMBOL -> Attribute.OCCA_SYMBOL;
      case FORMAT_OPEN_SYMBOL -> Attribute.FORMAT_CLOSE_SYMBOL;
      case SUB_SYMBOL -> Attribute.BUS_SYMBOL;
      case IF_SYMBOL -> Attribute.FI_SYMBOL;
      case CASE_SYMBOL -> Attribute.ESAC_SYMBOL;
      case DO_SYMBOL -> Attribute.OD_SYMBOL;
      default -> null;
    };
  }

  private static boolean isCloser(Attribute a) {
    return switch (a) {
      case END_SYMBOL, OCCA_SYMBOL, CLOSE_SYMBOL, FORMAT_CLOSE_SYMBOL, BUS_SYMBOL, FI_SYMBOL,
          ESAC_SYMBOL, OD_SYMBOL -> true;
      default -> false;
    };
  }

  /** Returns the unmatched closer that ends the sequence starting at {@code p}, or null. */
  private @Nullable Node parse(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (isCloser(p.attribute())) {
        return p;
      }
      Attribute ket = closerOf(p.attribute());
      if (ket == null) {
        continue;
      }
      Node q = parse(p.next());
      if (q != null && q.is(ket)) {
        p = q;
      } else if (q == null) {
        diagnostics.error(Severity.SYNTAX, p, PARENTHESIS, diagnose());
        throw new PhaseAbort("unmatched brackets");
      } else {
        int line = (q.line() == null) ? 0 : q.line().number();
        diagnostics.error(
            Severity.SYNTAX,
            p,
            PARENTHESIS_2,
            q.attribute().displayName(),
            line,
            ket.displayName(),
            diagnose());
        throw new PhaseAbort("unmatched brackets");
      }
    }
    return null;
  }

  /** Counts each kind of bracket over the whole program and names the unbalanced ones. */
  private String diagnose() {
    int begins = 0;
    int opens = 0;
    int formatOpens = 0;
    int formatDelims = 0;
    int accos = 0;
    int subs = 0;
    int ifs = 0;
    int cases = 0;
    int dos = 0;
    for (Node p = top; p != null; p = p.next()) {
      switch (p.attribute()) {
        case BEGIN_SYMBOL -> begins++;
        case END_SYMBOL -> begins--;
        case OPEN_SYMBOL -> opens++;
        case CLOSE_SYMBOL -> opens--;
        case ACCO_SYMBOL -> accos++;
        case OCCA_SYMBOL -> accos--;
        case FORMAT_DELIMITER_SYMBOL -> formatDelims = 1 - formatDelims;
        case FORMAT_OPEN_SYMBOL -> formatOpens++;
        case FORMAT_CLOSE_SYMBOL -> formatOpens--;
        case SUB_SYMBOL -> subs++;
        case BUS_SYMBOL -> subs--;
        case IF_SYMBOL -> ifs++;
        case FI_SYMBOL -> ifs--;
        case CASE_SYMBOL -> cases++;
        case ESAC_SYMBOL -> cases--;
        case DO_SYMBOL -> dos++;
        case OD_SYMBOL -> dos--;
        default -> {}
      }
    }
    StringBuilder sb = new StringBuilder();
    unmatched(sb, begins, "BEGIN", "END");
    unmatched(sb, opens, "(", ")");
    unmatched(sb, formatOpens, "(", ")");
    unmatched(sb, formatDelims, "$", "$");
    unmatched(sb, accos, "{", "}");
    unmatched(sb, subs, "[", "]");
    unmatched(sb, ifs, "IF", "FI");
    unmatched(sb, cases, "CASE", "ESAC");
    unmatched(sb, dos, "DO", "OD");
    return (sb.length() > 0) ? sb.toString() : MISSING_KEYWORDS;
  }

  private static void unmatched(StringBuilder sb, int n, String bra, String ket) {
    if (n == 0) {
      return;
    }
    if (sb.length() > 0) {
      sb.append(" and ");
    }
    sb.append(
        String.format("\"%s\" without matching \"%s\"", n > 0 ? bra : ket, n > 0 ? ket : bra));
  }
}
