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

import static org.algolang.tree.Attribute.*;

import org.algolang.Session;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.taxes.SymbolTable;
import org.algolang.taxes.Tag;
import org.algolang.taxes.TagKind;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Finds the declarations in a phrase before it is reduced and enters them in the phrase's symbol
 * table. Bold tags can only be told apart as indicants or operators, and {@code =} as an operator
 * or a defining symbol, once the declarations of the range are known.
 *
 * <p>Defining occurrences are retagged ({@code DEFINING_IDENTIFIER}, {@code DEFINING_INDICANT},
 * {@code DEFINING_OPERATOR}); the {@code =} of a declaration temporarily becomes {@code
 * ALT_EQUALS_SYMBOL} so it is not taken for an operator.
 */
final class TagExtractor {
  static final String UNDECLARED_TAG = "tag \"%s\" has not been declared properly";
  static final String INVALID_PRIORITY = "priority must be from 1 to 9";
  static final String INVALID_OPERATOR_TAG = "invalid operator tag";
  static final String EQUALS_EXPECTED = "= expected";
  static final String MIXED_DECLARATION = "possibly mixed identity and variable declaration";

  static final int MAX_PRIORITY = 9;

  private final Session session;
  private final Diagnostics diagnostics;

  TagExtractor(Session session) {
    this.session = session;
    this.diagnostics = session.diagnostics();
  }

  private static @Nullable Node skipUnit(@Nullable Node q) {
    for (; q != null; q = q.next()) {
      if (q.isOneOf(COMMA_SYMBOL, SEMI_SYMBOL, EXIT_SYMBOL)) {
        return q;
      }
    }
    return null;
  }

  private static @Nullable Node next(@Nullable Node q) {
    return (q == null) ? null : q.next();
  }

  private static boolean is(@Nullable Node q, Attribute a) {
    return q != null && q.is(a);
  }

  /** Returns INDICANT, OPERATOR or null for the innermost range that declares {@code name}. */
  private static @Nullable Attribute findDefinition(@Nullable SymbolTable table, String name) {
    for (SymbolTable t = table; t != null; t = t.parent()) {
      boolean indicant = t.findLocal(TagKind.INDICANT, name) != null;
      boolean operator = t.findLocal(TagKind.OPERATOR, name) != null;
      if (indicant) {
        return INDICANT;
      } else if (operator) {
        return OPERATOR;
      }
    }
    return null;
  }

  /** Classifies each bold tag of the phrase as an indicant or an operator. */
  void elaborateBoldTags(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(BOLD_TAG)) {
        Attribute a = findDefinition(q.table(), q.symbol());
        if (a == null) {
          diagnostics.error(Severity.SYNTAX, q, UNDECLARED_TAG, q.symbol());
        } else {
          q.setAttribute(a);
        }
      }
    }
  }

  /** Skips {@code () REF [] FLEX ..}, then a {@code STRUCT} or {@code UNION} pack or a PROC. */
  private static @Nullable Node skipPackDeclarer(@Nullable Node p) {
    while (p != null
        && p.isOneOf(
            SUB_SYMBOL, OPEN_SYMBOL, REF_SYMBOL, FLEX_SYMBOL, SHORT_SYMBOL, LONG_SYMBOL)) {
      p = p.next();
    }
    if (p != null && p.isOneOf(STRUCT_SYMBOL, UNION_SYMBOL)) {
      return p.next();
    } else if (p != null && p.is(PROC_SYMBOL)) {
      return skipPackDeclarer(p.next());
    }
    return p;
  }

  private Tag declare(Node p, TagKind kind, Node q) {
    Tag tag = p.table().declare(diagnostics, kind, q, null);
    q.setTag(tag);
    return tag;
  }

  /** {@code MODE A = .., B = ..}. */
  void indicants(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.is(MODE_SYMBOL)) {
        q = q.next();
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null && q.whether(BOLD_TAG, EQUALS_SYMBOL)) {
          declare(p, TagKind.INDICANT, q);
          q.setAttribute(DEFINING_INDICANT);
          q = q.next();
          q.setAttribute(ALT_EQUALS_SYMBOL);
          q = next(skipPackDeclarer(q.next()));
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  private int priority(Node q) {
    int k;
    try {
      k = Integer.parseInt(q.symbol());
    } catch (NumberFormatException e) {
      k = -1;
    }
    if (k < 1 || k > MAX_PRIORITY) {
      diagnostics.error(Severity.SYNTAX, q, INVALID_PRIORITY);
      k = MAX_PRIORITY;
    }
    return k;
  }

  /**
   * The scanner cannot separate an operator from a following {@code =}, as in {@code PRIO +=5} or
   * {@code OP ?= = ..}. Replaces {@code q} by a defining operator without the {@code =} and
   * inserts an {@code =} after it; returns the new operator node.
   */
  private Node splitEquals(Node q) {
    String text = q.symbol();
    Node op =
        new Node(
            DEFINING_OPERATOR,
            session.intern(text.substring(0, text.length() - 1)),
            q.line(),
            q.column());
    op.setTable(q.table());
    q.replaceWith(op);
    Node equals = new Node(ALT_EQUALS_SYMBOL, session.intern("="), q.line(), q.column());
    equals.setTable(q.table());
    op.insertAfter(equals);
    return op;
  }

  private static boolean endsInEquals(Node q) {
    String s = q.symbol();
    return s.length() > 1 && s.endsWith("=");
  }

  /** Removes the node after {@code q}, for operator tags like {@code ++} that scan as two. */
  private void dropSecondOperator(Node q) {
    diagnostics.error(Severity.SYNTAX, q, INVALID_OPERATOR_TAG);
    q.next().unlink();
  }

  /** {@code PRIO X = .., Y = ..}. */
  void priorities(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.is(PRIO_SYMBOL)) {
        q = q.next();
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null && q.whether(OPERATOR, OPERATOR)) {
          dropSecondOperator(q);
          q = priorityDefinition(p, q);
        } else if (q != null
            && (q.whether(BOLD_TAG, EQUALS_SYMBOL, INT_DENOTATION)
                || q.whether(OPERATOR, EQUALS_SYMBOL, INT_DENOTATION)
                || q.whether(EQUALS_SYMBOL, EQUALS_SYMBOL, INT_DENOTATION))) {
          q = priorityDefinition(p, q);
        } else if (q != null
            && (q.whether(BOLD_TAG, INT_DENOTATION)
                || q.whether(OPERATOR, INT_DENOTATION)
                || q.whether(EQUALS_SYMBOL, INT_DENOTATION))) {
          if (endsInEquals(q)) {
            q = priorityDefinition(p, splitEquals(q));
          } else {
            diagnostics.error(Severity.SYNTAX, q, EQUALS_EXPECTED);
          }
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  /** Handles {@code op = digit} starting at {@code y}; returns the node after the priority. */
  private @Nullable Node priorityDefinition(Node p, Node y) {
    y.setAttribute(DEFINING_OPERATOR);
    Node q = y.next();
    if (q == null) {
      return null;
    }
    q.setAttribute(ALT_EQUALS_SYMBOL);
    q = q.next();
    if (q == null) {
      return null;
    }
    int k = priority(q);
    q.setAttribute(PRIORITY);
    declare(p, TagKind.PRIORITY, y).setPriority(k);
    return q.next();
  }

  /** {@code OP [plan] X = .., Y = ..}. */
  void operators(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.is(OP_SYMBOL)) {
        q = q.next();
        continue;
      }
      if (is(q.next(), OPEN_SYMBOL)) {
        q = skipPackDeclarer(q.next());
      }
      if (q == null) {
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null && q.whether(OPERATOR, OPERATOR)) {
          q.setAttribute(DEFINING_OPERATOR);
          declare(p, TagKind.OPERATOR, q);
          dropSecondOperator(q);
          q = q.next();
          if (q != null) {
            q.setAttribute(ALT_EQUALS_SYMBOL);
          }
          q = skipUnit(q);
        } else if (q != null
            && (q.whether(OPERATOR, EQUALS_SYMBOL)
                || q.whether(BOLD_TAG, EQUALS_SYMBOL)
                || q.whether(EQUALS_SYMBOL, EQUALS_SYMBOL))) {
          q.setAttribute(DEFINING_OPERATOR);
          declare(p, TagKind.OPERATOR, q);
          q = q.next();
          q.setAttribute(ALT_EQUALS_SYMBOL);
          q = skipUnit(q);
        } else if (q != null && q.isOneOf(OPERATOR, BOLD_TAG, EQUALS_SYMBOL)) {
          if (endsInEquals(q)) {
            q = splitEquals(q);
            declare(p, TagKind.OPERATOR, q);
            q = skipUnit(q.next());
          } else {
            diagnostics.error(Severity.SYNTAX, q, EQUALS_EXPECTED);
          }
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  /** Labels {@code l:}, only in phrases that can be serial clauses. */
  void labels(Node p, Attribute expect) {
    if (expect != SERIAL_CLAUSE && expect != ENQUIRY_CLAUSE && expect != SOME_CLAUSE) {
      return;
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.whether(IDENTIFIER, COLON_SYMBOL)) {
        declare(p, TagKind.LABEL, q);
        q.setAttribute(DEFINING_IDENTIFIER);
      }
    }
  }

  /** {@code MOID x = .., y = ..}. */
  private void identities(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.whether(DECLARER, IDENTIFIER, EQUALS_SYMBOL)) {
        q = q.next();
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null && q.whether(IDENTIFIER, EQUALS_SYMBOL)) {
          definingIdentifier(p, q);
          q = q.next();
          q.setAttribute(ALT_EQUALS_SYMBOL);
          q = skipUnit(q);
        } else if (q != null && q.whether(IDENTIFIER, ASSIGN_SYMBOL)) {
          diagnostics.error(Severity.SYNTAX, q, MIXED_DECLARATION);
          definingIdentifier(p, q);
          q = q.next();
          q.setAttribute(ALT_EQUALS_SYMBOL);
          q = skipUnit(q);
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  /** {@code MOID x [:= ..], y [:= ..]}. */
  private void variables(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.whether(DECLARER, IDENTIFIER)) {
        q = q.next();
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null && q.is(IDENTIFIER)) {
          if (q.whether(IDENTIFIER, EQUALS_SYMBOL)) {
            diagnostics.error(Severity.SYNTAX, q, MIXED_DECLARATION);
            q.next().setAttribute(ASSIGN_SYMBOL);
          }
          definingIdentifier(p, q);
          q = skipUnit(q);
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  /** {@code PROC x = .., y = ..}. */
  private void procIdentities(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.whether(PROC_SYMBOL, IDENTIFIER, EQUALS_SYMBOL)) {
        q = q.next();
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null
            && (q.whether(IDENTIFIER, EQUALS_SYMBOL) || q.whether(IDENTIFIER, ASSIGN_SYMBOL))) {
          if (q.next().is(ASSIGN_SYMBOL)) {
            diagnostics.error(Severity.SYNTAX, q, MIXED_DECLARATION);
          }
          definingIdentifier(p, q);
          q = q.next();
          q.setAttribute(ALT_EQUALS_SYMBOL);
          q = skipUnit(q);
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  /** {@code PROC x [:= ..], y [:= ..]}. */
  private void procVariables(Node p) {
    Node q = p;
    while (q != null) {
      if (!q.whether(PROC_SYMBOL, IDENTIFIER)) {
        q = q.next();
        continue;
      }
      boolean z = true;
      do {
        q = q.next();
        if (q != null && q.whether(IDENTIFIER, ASSIGN_SYMBOL)) {
          definingIdentifier(p, q);
          q = skipUnit(q.next());
        } else if (q != null && q.whether(IDENTIFIER, EQUALS_SYMBOL)) {
          diagnostics.error(Severity.SYNTAX, q, MIXED_DECLARATION);
          definingIdentifier(p, q);
          q = q.next();
          q.setAttribute(ASSIGN_SYMBOL);
          q = skipUnit(q);
        } else {
          z = false;
        }
      } while (z && is(q, COMMA_SYMBOL));
    }
  }

  private void definingIdentifier(Node p, Node q) {
    declare(p, TagKind.IDENTIFIER, q);
    q.setAttribute(DEFINING_IDENTIFIER);
  }

  /**
   * Enters identifier declarations, settles the meaning of {@code =}, marks {@code LOC} and {@code
   * HEAP} qualifiers and gives each applied operator its priority.
   */
  void declarations(Node p) {
    identities(p);
    variables(p);
    procIdentities(p);
    procVariables(p);
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(EQUALS_SYMBOL)) {
        q.setAttribute(OPERATOR);
      } else if (q.is(ALT_EQUALS_SYMBOL)) {
        q.setAttribute(EQUALS_SYMBOL);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.whether(LOC_SYMBOL, DECLARER, DEFINING_IDENTIFIER)
          || q.whether(HEAP_SYMBOL, DECLARER, DEFINING_IDENTIFIER)
          || q.whether(LOC_SYMBOL, PROC_SYMBOL, DEFINING_IDENTIFIER)
          || q.whether(HEAP_SYMBOL, PROC_SYMBOL, DEFINING_IDENTIFIER)) {
        q.makeSub(q, QUALIFIER);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(OPERATOR)) {
        if (q.table().findGlobal(TagKind.OPERATOR, q.symbol()) != null) {
          Tag prio = q.table().findGlobal(TagKind.PRIORITY, q.symbol());
          q.setPriority(prio != null ? prio.priority() : 0);
        } else {
          diagnostics.error(Severity.SYNTAX, q, UNDECLARED_TAG, q.symbol());
          q.setPriority(1);
        }
      }
    }
  }
}
