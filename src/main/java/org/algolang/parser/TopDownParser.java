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

import org.algolang.Session;
import org.algolang.diag.DepthGuard;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.PhaseAbort;
import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Branches out the control structure of a program: every bracketed construct ({@code BEGIN ..
 * END}, {@code ( .. )}, {@code IF .. FI}, {@code CASE .. ESAC}, loops, format texts) becomes one
 * node whose children are its parts. Each part is itself a node tagged with the keyword that opens
 * it, e.g. an {@code IF} node holds an {@code IF}, a {@code THEN} and an {@code ELSE} part.
 *
 * <p>After this pass every range of the program is a subtree, so symbol tables can be attached
 * before bottom-up parsing starts.
 */
public final class TopDownParser {
  static final String EXPECTED_NEAR = "%s expected in %s, near %s in line %d";
  static final String UNBALANCED_KEYWORD =
      "missing or unbalanced keyword in %s, near %s in line %d";
  static final String KEYWORD = "check for missing or unmatched keyword in clause starting at %s";

  private final Diagnostics diagnostics;
  private final DepthGuard guard;

  private TopDownParser(Session session) {
    this.diagnostics = session.diagnostics();
    this.guard = session.depthGuard();
  }

  /** Branches out the program starting at {@code p}; throws {@link PhaseAbort} on a mismatch. */
  public static void parse(Session session, @Nullable Node p) {
    if (p == null) {
      return;
    }
    TopDownParser parser = new TopDownParser(session);
    parser.series(p);
    parser.loops(p);
    parser.untils(p);
    parser.formats(p);
  }

  private PhaseAbort diagnose(Node start, @Nullable Node where, @Nullable Attribute clause,
      @Nullable Attribute expected) {
    Node issue = (where != null) ? where : start;
    String clauseName = (clause == null) ? "construct" : clause.displayName();
    int line = (start.line() == null) ? 0 : start.line().number();
    if (expected != null) {
      diagnostics.error(Severity.SYNTAX, issue, EXPECTED_NEAR, expected.displayName(), clauseName,
          start.symbol(), line);
    } else {
      diagnostics.error(Severity.SYNTAX, issue, UNBALANCED_KEYWORD, clauseName, start.symbol(),
          line);
    }
    return new PhaseAbort("unbalanced keywords");
  }

  private Node exhausted(@Nullable Node p, Node start) {
    if (p == null) {
      diagnostics.error(Severity.SYNTAX, start, KEYWORD, start.symbol());
      throw new PhaseAbort("tokens exhausted");
    }
    return p;
  }

  static boolean isUnitTerminator(Node p) {
    return switch (p.attribute()) {
      case BUS_SYMBOL, CLOSE_SYMBOL, END_SYMBOL, SEMI_SYMBOL, EXIT_SYMBOL, COMMA_SYMBOL,
          THEN_BAR_SYMBOL, ELSE_BAR_SYMBOL, THEN_SYMBOL, ELIF_SYMBOL, ELSE_SYMBOL, FI_SYMBOL,
          IN_SYMBOL, OUT_SYMBOL, OUSE_SYMBOL, ESAC_SYMBOL, EDOC_SYMBOL, OCCA_SYMBOL -> true;
      default -> false;
    };
  }

  static boolean isLoopKeyword(@Nullable Node p) {
    return p != null
        && p.isOneOf(
            Attribute.FOR_SYMBOL,
            Attribute.FROM_SYMBOL,
            Attribute.BY_SYMBOL,
            Attribute.TO_SYMBOL,
            Attribute.DOWNTO_SYMBOL,
            Attribute.WHILE_SYMBOL,
            Attribute.DO_SYMBOL);
  }

  // Loop clauses.

  /**
   * Returns how many symbols to skip for a declarer or operator that may precede a loop clause in
   * a cast or formula, e.g. {@code VOID} in {@code VOID (DO .. OD)}; zero if there is none.
   */
  private static int loopCastFormula(Node p) {
    if (p.isOneOf(
        Attribute.VOID_SYMBOL,
        Attribute.INT_SYMBOL,
        Attribute.REF_SYMBOL,
        Attribute.OPERATOR,
        Attribute.BOLD_TAG)) {
      return 1;
    } else if (p.whether(Attribute.UNION_SYMBOL, Attribute.OPEN_SYMBOL)) {
      return 2;
    } else if (p.isOneOf(Attribute.OPEN_SYMBOL, Attribute.SUB_SYMBOL)) {
      int k = 0;
      while (p != null && p.isOneOf(Attribute.OPEN_SYMBOL, Attribute.SUB_SYMBOL)) {
        p = p.next();
        k++;
      }
      return (p != null && p.whether(Attribute.UNION_SYMBOL, Attribute.OPEN_SYMBOL)) ? k : 0;
    }
    return 0;
  }

  private @Nullable Node skipLoopUnit(@Nullable Node p) {
    if (isLoopKeyword(p)) {
      p = loop(p);
    }
    while (p != null) {
      int k = loopCastFormula(p);
      if (k != 0) {
        while (p != null && k != 0) {
          p = p.next(k);
          k = (p == null) ? 0 : loopCastFormula(p);
        }
        if (isLoopKeyword(p)) {
          p = loop(p);
        }
      } else if (isLoopKeyword(p) || p.is(Attribute.OD_SYMBOL)) {
        return p;
      } else if (p.is(Attribute.COLON_SYMBOL)) {
        p = p.next();
        if (isLoopKeyword(p)) {
          p = loop(p);
        }
      } else if (p.isOneOf(Attribute.SEMI_SYMBOL, Attribute.COMMA_SYMBOL, Attribute.EXIT_SYMBOL)) {
        return p;
      } else {
        p = p.next();
      }
    }
    return null;
  }

  private @Nullable Node skipLoopSeries(@Nullable Node p) {
    boolean more;
    do {
      p = skipLoopUnit(p);
      more =
          p != null
              && p.isOneOf(
                  Attribute.SEMI_SYMBOL,
                  Attribute.EXIT_SYMBOL,
                  Attribute.COMMA_SYMBOL,
                  Attribute.COLON_SYMBOL);
      if (more) {
        p = p.next();
      }
    } while (p != null && more);
    return p;
  }

  /** Makes a LOOP_CLAUSE of the loop starting at {@code p}; returns the node after it. */
  private @Nullable Node loop(Node p) {
    guard.enter(p);
    try {
      Node start = p;
      Node q = p;
      if (q.is(Attribute.FOR_SYMBOL)) {
        q = exhausted(q.next(), start);
        if (q.is(Attribute.IDENTIFIER)) {
          q.setAttribute(Attribute.DEFINING_IDENTIFIER);
        } else {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, Attribute.IDENTIFIER);
        }
        q = exhausted(q.next(), start);
        if (q.is(Attribute.DO_SYMBOL)) {
          q.setAttribute(Attribute.ALT_DO_SYMBOL);
        } else if (!q.isOneOf(
            Attribute.FROM_SYMBOL,
            Attribute.BY_SYMBOL,
            Attribute.TO_SYMBOL,
            Attribute.DOWNTO_SYMBOL,
            Attribute.WHILE_SYMBOL)) {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, null);
        }
      }
      if (q.is(Attribute.FROM_SYMBOL)) {
        start = q;
        q = exhausted(skipLoopUnit(q.next()), start);
        if (q.is(Attribute.DO_SYMBOL)) {
          q.setAttribute(Attribute.ALT_DO_SYMBOL);
        } else if (!q.isOneOf(
            Attribute.BY_SYMBOL,
            Attribute.TO_SYMBOL,
            Attribute.DOWNTO_SYMBOL,
            Attribute.WHILE_SYMBOL)) {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, null);
        }
        start.makeSub(q.previous(), Attribute.FROM_SYMBOL);
      }
      if (q.is(Attribute.BY_SYMBOL)) {
        start = q;
        q = exhausted(skipLoopSeries(q.next()), start);
        if (q.is(Attribute.DO_SYMBOL)) {
          q.setAttribute(Attribute.ALT_DO_SYMBOL);
        } else if (!q.isOneOf(
            Attribute.TO_SYMBOL, Attribute.DOWNTO_SYMBOL, Attribute.WHILE_SYMBOL)) {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, null);
        }
        start.makeSub(q.previous(), Attribute.BY_SYMBOL);
      }
      if (q.isOneOf(Attribute.TO_SYMBOL, Attribute.DOWNTO_SYMBOL)) {
        start = q;
        q = exhausted(skipLoopSeries(q.next()), start);
        if (q.is(Attribute.DO_SYMBOL)) {
          q.setAttribute(Attribute.ALT_DO_SYMBOL);
        } else if (!q.is(Attribute.WHILE_SYMBOL)) {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, null);
        }
        start.makeSub(q.previous(), Attribute.TO_SYMBOL);
      }
      if (q.is(Attribute.WHILE_SYMBOL)) {
        start = q;
        q = exhausted(skipLoopSeries(q.next()), start);
        if (q.is(Attribute.DO_SYMBOL)) {
          q.setAttribute(Attribute.ALT_DO_SYMBOL);
        } else {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, Attribute.DO_SYMBOL);
        }
        start.makeSub(q.previous(), Attribute.WHILE_SYMBOL);
      }
      if (q.isOneOf(Attribute.DO_SYMBOL, Attribute.ALT_DO_SYMBOL)) {
        Attribute k = q.attribute();
        start = q;
        q = exhausted(skipLoopSeries(q.next()), start);
        if (!q.is(Attribute.OD_SYMBOL)) {
          throw diagnose(start, q, Attribute.LOOP_CLAUSE, Attribute.OD_SYMBOL);
        }
        start.makeSub(q, k);
      }
      Node after = start.next();
      p.makeSub(start, Attribute.LOOP_CLAUSE);
      return after;
    } finally {
      guard.exit();
    }
  }

  private void loops(@Nullable Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.sub() != null) {
        loops(q.sub());
      }
    }
    Node q = p;
    while (q != null) {
      q = isLoopKeyword(q) ? loop(q) : q.next();
    }
  }

  private void untils(@Nullable Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.sub() != null) {
        untils(q.sub());
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(Attribute.UNTIL_SYMBOL)) {
        Node u = q.last();
        q.makeSub((u == q) ? q : u.previous(), Attribute.UNTIL_SYMBOL);
        return;
      }
    }
  }

  // Everything but loops.

  private @Nullable Node series(@Nullable Node p) {
    boolean more = true;
    while (more) {
      more = false;
      p = skipUnit(p);
      if (p != null
          && p.isOneOf(Attribute.SEMI_SYMBOL, Attribute.EXIT_SYMBOL, Attribute.COMMA_SYMBOL)) {
        more = true;
        p = p.next();
      }
    }
    return p;
  }

  private @Nullable Node skipUnit(@Nullable Node p) {
    while (p != null && !isUnitTerminator(p)) {
      switch (p.attribute()) {
        case BEGIN_SYMBOL -> p = enclosed(p, Attribute.END_SYMBOL, Attribute.ENCLOSED_CLAUSE);
        case SUB_SYMBOL -> p = enclosed(p, Attribute.BUS_SYMBOL, null);
        case ACCO_SYMBOL -> p = enclosed(p, Attribute.OCCA_SYMBOL, Attribute.ENCLOSED_CLAUSE);
        case CODE_SYMBOL -> p = code(p);
        case OPEN_SYMBOL -> p = open(p);
        case IF_SYMBOL -> p = conditional(p);
        case CASE_SYMBOL -> p = caseClause(p);
        default -> p = p.next();
      }
    }
    return p;
  }

  /** Branches a simple bracket pair such as {@code BEGIN .. END} or {@code [ .. ]}. */
  private @Nullable Node enclosed(Node open, Attribute close, @Nullable Attribute clause) {
    guard.enter(open);
    try {
      Node closer = series(open.next());
      if (closer == null || !closer.is(close)) {
        throw diagnose(open, closer, clause, close);
      }
      open.makeSub(closer, open.attribute());
      return open.next();
    } finally {
      guard.exit();
    }
  }

  private @Nullable Node code(Node codeP) {
    Node edoc = series(codeP.next());
    if (edoc == null || !edoc.is(Attribute.EDOC_SYMBOL)) {
      diagnostics.error(Severity.SYNTAX, codeP, KEYWORD, codeP.symbol());
      throw new PhaseAbort("unbalanced keywords");
    }
    codeP.makeSub(edoc, Attribute.CODE_SYMBOL);
    return codeP.next();
  }

  private @Nullable Node open(Node openP) {
    guard.enter(openP);
    try {
      Node thenBar = series(openP.next());
      if (thenBar != null && thenBar.is(Attribute.CLOSE_SYMBOL)) {
        openP.makeSub(thenBar, Attribute.OPEN_SYMBOL);
        return openP.next();
      }
      if (thenBar == null || !thenBar.is(Attribute.THEN_BAR_SYMBOL)) {
        throw diagnose(openP, thenBar, Attribute.ENCLOSED_CLAUSE, null);
      }
      openP.makeSub(thenBar.previous(), Attribute.OPEN_SYMBOL);
      Node elifBar = series(thenBar.next());
      if (elifBar != null && elifBar.is(Attribute.CLOSE_SYMBOL)) {
        thenBar.makeSub(elifBar.previous(), Attribute.THEN_BAR_SYMBOL);
        openP.makeSub(elifBar, Attribute.OPEN_SYMBOL);
        return openP.next();
      }
      if (elifBar != null && elifBar.is(Attribute.THEN_BAR_SYMBOL)) {
        Node close = series(elifBar.next());
        if (close == null || !close.is(Attribute.CLOSE_SYMBOL)) {
          throw diagnose(openP, elifBar, Attribute.ENCLOSED_CLAUSE, Attribute.CLOSE_SYMBOL);
        }
        thenBar.makeSub(elifBar.previous(), Attribute.THEN_BAR_SYMBOL);
        elifBar.makeSub(close.previous(), Attribute.THEN_BAR_SYMBOL);
        openP.makeSub(close, Attribute.OPEN_SYMBOL);
        return openP.next();
      }
      if (elifBar != null && elifBar.is(Attribute.ELSE_BAR_SYMBOL)) {
        Node after = open(elifBar);
        thenBar.makeSub(elifBar.previous(), Attribute.THEN_BAR_SYMBOL);
        openP.makeSub(elifBar, Attribute.OPEN_SYMBOL);
        return after;
      }
      throw diagnose(openP, elifBar, Attribute.ENCLOSED_CLAUSE, Attribute.CLOSE_SYMBOL);
    } finally {
      guard.exit();
    }
  }

  private @Nullable Node conditional(Node ifP) {
    guard.enter(ifP);
    try {
      Node thenP = series(ifP.next());
      if (thenP == null || !thenP.is(Attribute.THEN_SYMBOL)) {
        throw diagnose(ifP, thenP, Attribute.CONDITIONAL_CLAUSE, Attribute.THEN_SYMBOL);
      }
      ifP.makeSub(thenP.previous(), Attribute.IF_SYMBOL);
      Node elifP = series(thenP.next());
      if (elifP != null && elifP.is(Attribute.FI_SYMBOL)) {
        thenP.makeSub(elifP.previous(), Attribute.THEN_SYMBOL);
        ifP.makeSub(elifP, Attribute.IF_SYMBOL);
        return ifP.next();
      }
      if (elifP != null && elifP.is(Attribute.ELSE_SYMBOL)) {
        Node fiP = series(elifP.next());
        if (fiP == null || !fiP.is(Attribute.FI_SYMBOL)) {
          throw diagnose(ifP, fiP, Attribute.CONDITIONAL_CLAUSE, Attribute.FI_SYMBOL);
        }
        thenP.makeSub(elifP.previous(), Attribute.THEN_SYMBOL);
        elifP.makeSub(fiP.previous(), Attribute.ELSE_SYMBOL);
        ifP.makeSub(fiP, Attribute.IF_SYMBOL);
        return ifP.next();
      }
      if (elifP != null && elifP.is(Attribute.ELIF_SYMBOL)) {
        Node after = conditional(elifP);
        thenP.makeSub(elifP.previous(), Attribute.THEN_SYMBOL);
        ifP.makeSub(elifP, Attribute.IF_SYMBOL);
        return after;
      }
      throw diagnose(ifP, elifP, Attribute.CONDITIONAL_CLAUSE, Attribute.FI_SYMBOL);
    } finally {
      guard.exit();
    }
  }

  private @Nullable Node caseClause(Node caseP) {
    guard.enter(caseP);
    try {
      Node inP = series(caseP.next());
      if (inP == null || !inP.is(Attribute.IN_SYMBOL)) {
        throw diagnose(caseP, inP, Attribute.ENCLOSED_CLAUSE, Attribute.IN_SYMBOL);
      }
      caseP.makeSub(inP.previous(), Attribute.CASE_SYMBOL);
      Node ouseP = series(inP.next());
      if (ouseP != null && ouseP.is(Attribute.ESAC_SYMBOL)) {
        inP.makeSub(ouseP.previous(), Attribute.IN_SYMBOL);
        caseP.makeSub(ouseP, Attribute.CASE_SYMBOL);
        return caseP.next();
      }
      if (ouseP != null && ouseP.is(Attribute.OUT_SYMBOL)) {
        Node esacP = series(ouseP.next());
        if (esacP == null || !esacP.is(Attribute.ESAC_SYMBOL)) {
          throw diagnose(caseP, esacP, Attribute.ENCLOSED_CLAUSE, Attribute.ESAC_SYMBOL);
        }
        inP.makeSub(ouseP.previous(), Attribute.IN_SYMBOL);
        ouseP.makeSub(esacP.previous(), Attribute.OUT_SYMBOL);
        caseP.makeSub(esacP, Attribute.CASE_SYMBOL);
        return caseP.next();
      }
      if (ouseP != null && ouseP.is(Attribute.OUSE_SYMBOL)) {
        Node after = caseClause(ouseP);
        inP.makeSub(ouseP.previous(), Attribute.IN_SYMBOL);
        caseP.makeSub(ouseP, Attribute.CASE_SYMBOL);
        return after;
      }
      throw diagnose(caseP, ouseP, Attribute.ENCLOSED_CLAUSE, Attribute.ESAC_SYMBOL);
    } finally {
      guard.exit();
    }
  }

  // Format texts.

  private @Nullable Node formatOpen(Node openP) {
    Node close = skipFormat(openP.next());
    if (close == null || !close.is(Attribute.FORMAT_CLOSE_SYMBOL)) {
      throw diagnose(openP, close, null, Attribute.FORMAT_CLOSE_SYMBOL);
    }
    openP.makeSub(close, Attribute.FORMAT_OPEN_SYMBOL);
    return openP.next();
  }

  private @Nullable Node skipFormat(@Nullable Node p) {
    while (p != null) {
      if (p.is(Attribute.FORMAT_OPEN_SYMBOL)) {
        p = formatOpen(p);
      } else if (p.isOneOf(Attribute.FORMAT_CLOSE_SYMBOL, Attribute.FORMAT_DELIMITER_SYMBOL)) {
        return p;
      } else {
        p = p.next();
      }
    }
    return null;
  }

  private void formats(@Nullable Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.sub() != null) {
        formats(q.sub());
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(Attribute.FORMAT_DELIMITER_SYMBOL)) {
        Node f = q.next();
        while (f != null && !f.is(Attribute.FORMAT_DELIMITER_SYMBOL)) {
          f = f.is(Attribute.FORMAT_OPEN_SYMBOL) ? formatOpen(f) : f.next();
        }
        if (f == null) {
          throw diagnose(q, null, Attribute.FORMAT_TEXT, Attribute.FORMAT_DELIMITER_SYMBOL);
        }
        q.makeSub(f, Attribute.FORMAT_DELIMITER_SYMBOL);
      }
    }
  }
}
