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

package org.algolang.taxes;

import org.algolang.Session;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Attaches a {@link SymbolTable} to every node.
 *
 * <p>Ranges are set up twice. Before bottom-up parsing only the bracket structure is known, so
 * {@link #preliminary} opens a range for each {@code BEGIN}, {@code (}, {@code IF}, {@code CASE},
 * loop part and format text; the reducer records declarations and labels in these tables. Once
 * the tree is reduced, {@link #finalise} opens the ranges of routine texts and specified units and
 * re-links every range to its lexically enclosing one.
 */
public final class Ranges {
  private final Session session;

  private Ranges(Session session) {
    this.session = session;
  }

  /** Sets up ranges below {@code p}, whose table must already be set. */
  public static void preliminary(Session session, Node p) {
    new Ranges(session).preliminary(p);
  }

  /** Re-links ranges after the bottom-up parser has reduced {@code p}. */
  public static void finalise(Session session, Node p) {
    new Ranges(session).finalise(p);
  }

  private SymbolTable newRange(SymbolTable s) {
    return session.newTable(s);
  }

  private void open(Node q, SymbolTable s) {
    q.sub().setTable(s);
    preliminary(q.sub());
  }

  private void preliminary(Node p) {
    SymbolTable s = p.table();
    for (Node q = p; q != null; q = q.next()) {
      q.setTable(s);
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.sub() == null) {
        continue;
      }
      switch (q.attribute()) {
        case BEGIN_SYMBOL, DO_SYMBOL, ALT_DO_SYMBOL, FORMAT_DELIMITER_SYMBOL, ACCO_SYMBOL ->
            open(q, newRange(s));
        case OPEN_SYMBOL -> q = choices(q, s, Attribute.THEN_BAR_SYMBOL, Attribute.THEN_BAR_SYMBOL);
        case IF_SYMBOL -> q = choices(q, s, Attribute.THEN_SYMBOL, Attribute.ELSE_SYMBOL);
        case CASE_SYMBOL -> q = choices(q, s, Attribute.IN_SYMBOL, Attribute.OUT_SYMBOL);
        case UNTIL_SYMBOL -> open(q, newRange(s));
        case WHILE_SYMBOL -> {
          SymbolTable u = newRange(s);
          open(q, u);
          if (q.next() != null && q.next().is(Attribute.ALT_DO_SYMBOL)) {
            q = q.next();
            open(q, newRange(u));
          }
        }
        default -> open(q, s);
      }
      if (q == null) {
        break;
      }
    }
  }

  /**
   * Handles a choice clause such as {@code IF .. THEN .. ELSE .. FI}: the enquiry shares the
   * enclosing range and each alternative opens a range of its own. A trailing {@code ELIF} or
   * {@code |:} was branched out under the opener's attribute. Returns the last node handled.
   */
  private @Nullable Node choices(Node q, SymbolTable s, Attribute in, Attribute out) {
    Attribute opener = q.attribute();
    if (q.next() == null || !q.next().is(in)) {
      open(q, newRange(s));
      return q;
    }
    open(q, s);
    q = q.next();
    open(q, newRange(s));
    Node r = q.next();
    if (r == null) {
      return null;
    }
    if (r.sub() != null && (r.is(out) || r.is(opener))) {
      open(r, newRange(s));
      return r;
    }
    return q;
  }

  /**
   * Returns whether {@code p} opens a range. Routine texts and specified units are included, as are
   * the alternatives of choice clauses; enquiries share the range of their clause.
   */
  public static boolean isNewLexicalLevel(Node p) {
    return switch (p.attribute()) {
      case ALT_DO_PART, BRIEF_ELIF_IF_PART, BRIEF_INTEGER_OUSE_PART, BRIEF_UNITED_OUSE_PART,
          CHOICE, CLOSED_CLAUSE, CONDITIONAL_CLAUSE, DO_PART, ELIF_PART, ELSE_PART, FORMAT_TEXT,
          INTEGER_CASE_CLAUSE, INTEGER_CHOICE_CLAUSE, INTEGER_IN_PART, INTEGER_OUT_PART, OUT_PART,
          ROUTINE_TEXT, SPECIFIED_UNIT, THEN_PART, UNTIL_PART, UNITED_CASE_CLAUSE, UNITED_CHOICE,
          UNITED_IN_PART, UNITED_OUSE_PART, WHILE_PART -> true;
      default -> false;
    };
  }

  private void flood(@Nullable Node p, SymbolTable s) {
    for (; p != null; p = p.next()) {
      p.setTable(s);
      if (!p.isOneOf(Attribute.ROUTINE_TEXT, Attribute.SPECIFIED_UNIT) && p.sub() != null) {
        if (isNewLexicalLevel(p)) {
          relink(p.sub(), s);
        } else {
          flood(p.sub(), s);
        }
      }
    }
  }

  private static void relink(Node sub, SymbolTable s) {
    if (sub.table() != s) {
      sub.table().reparent(s);
    }
  }

  private void finalise(Node p) {
    SymbolTable s = p.table();
    for (Node q = p; q != null; q = q.next()) {
      if (q.isOneOf(Attribute.ROUTINE_TEXT, Attribute.SPECIFIED_UNIT)) {
        flood(q.sub(), newRange(s));
      }
      if (q.sub() != null) {
        if (isNewLexicalLevel(q)) {
          relink(q.sub(), s);
          finalise(q.sub());
          if (q.is(Attribute.WHILE_PART)
              && q.next() != null
              && q.next().is(Attribute.ALT_DO_PART)) {
            SymbolTable whileRange = q.sub().table();
            q.setTable(s);
            q = q.next();
            relink(q.sub(), whileRange);
            finalise(q.sub());
          }
        } else {
          q.sub().setTable(s);
          finalise(q.sub());
        }
      }
      q.setTable(s);
    }
    // A loop identifier belongs to the range of the WHILE part, or else of the DO part.
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(Attribute.FOR_PART)) {
        Node identifier = q.sub().next();
        for (Node r = q.next(); r != null; r = r.next()) {
          if (r.isOneOf(Attribute.WHILE_PART, Attribute.ALT_DO_PART)) {
            identifier.setTable(r.sub().table());
            break;
          }
        }
      }
    }
  }
}
