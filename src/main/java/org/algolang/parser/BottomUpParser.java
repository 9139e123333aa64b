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
import org.algolang.diag.DepthGuard;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.PhaseAbort;
import org.algolang.diag.Severity;
import org.algolang.taxes.SymbolTable;
import org.algolang.taxes.Tag;
import org.algolang.taxes.TagKind;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Reduces the tree branched out by {@link TopDownParser} to a particular program.
 *
 * <p>Each bracketed subtree is a phrase that is reduced on its own, from the inside out: first the
 * bold tags are classified and declarers reduced, then the tags declared in the phrase are entered
 * in its symbol table, then nested phrases are reduced, and finally the phrase itself is reduced
 * from primaries up to clauses. A phrase that does not reduce to a single node is repaired by
 * {@link ErrorRecovery}.
 */
public final class BottomUpParser {
  static final String SUPERFLUOUS = "skipped superfluous %s";
  static final String NO_PRIORITY = "operator \"%s\" has no priority";
  static final String PICTURE_NUMBER = "%s must have two pictures";
  static final String UNDECLARED_BOLD_TAG = "undeclared bold tag";
  static final String ERRONEOUS_DECLARATION = "erroneous declaration";

  /** Errors in one phrase beyond which its repair is no longer reported. */
  static final int MAX_ERRORS = 8;

  /** Priority given to operators in monadic position; above any dyadic priority. */
  private static final int MONADIC_PRIORITY = TagExtractor.MAX_PRIORITY + 1;

  private final Diagnostics diagnostics;
  private final DepthGuard guard;
  private final Reducer r;
  private final TagExtractor tags;
  private final DeclarerReducer declarers;
  private final FormatReducer formats;
  private final ErrorRecovery recovery;
  private final ClauseReducer clauses;

  private BottomUpParser(Session session) {
    this.diagnostics = session.diagnostics();
    this.guard = session.depthGuard();
    this.r = new Reducer(session);
    this.tags = new TagExtractor(session);
    this.declarers = new DeclarerReducer(r, this);
    this.formats = new FormatReducer(r);
    this.recovery = new ErrorRecovery(r);
    this.clauses = new ClauseReducer(r, recovery);
  }

  /**
   * Reduces the program starting at {@code p}, whose nodes must have symbol tables. Throws {@link
   * PhaseAbort} if the program cannot be reduced far enough for checking to continue.
   */
  public static void parse(Session session, @Nullable Node p) {
    if (p == null) {
      return;
    }
    BottomUpParser parser = new BottomUpParser(session);
    parser.ignoreSuperfluousSemicolons(p);
    parser.particularProgram(p);
  }

  private static boolean isSemicolonLess(Node p) {
    return p.isOneOf(
        BUS_SYMBOL,
        CLOSE_SYMBOL,
        END_SYMBOL,
        SEMI_SYMBOL,
        EXIT_SYMBOL,
        THEN_BAR_SYMBOL,
        ELSE_BAR_SYMBOL,
        THEN_SYMBOL,
        ELIF_SYMBOL,
        ELSE_SYMBOL,
        FI_SYMBOL,
        IN_SYMBOL,
        OUT_SYMBOL,
        OUSE_SYMBOL,
        ESAC_SYMBOL,
        EDOC_SYMBOL,
        OCCA_SYMBOL,
        OD_SYMBOL,
        UNTIL_SYMBOL);
  }

  /** Removes semicolons before closing symbols, as in {@code FI; OD}, with a warning. */
  private void ignoreSuperfluousSemicolons(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      ignoreSuperfluousSemicolons(p.sub());
      Node next = p.next();
      if (next != null && next.is(SEMI_SYMBOL) && next.next() == null) {
        diagnostics.warning(next, SUPERFLUOUS, next.attribute().displayName());
        p.setNext(null);
      } else if (p.is(SEMI_SYMBOL)
          && next != null
          && isSemicolonLess(next)
          && p.previous() != null) {
        diagnostics.warning(p, SUPERFLUOUS, p.attribute().displayName());
        p.unlink();
      }
    }
  }

  private void particularProgram(Node p) {
    int errors = diagnostics.errorCount();
    tags.labels(p, SERIAL_CLAUSE);
    for (Node q = p; q != null; q = q.next()) {
      if (q.sub() != null) {
        reduceSubordinate(q, SOME_CLAUSE);
      }
      labelSequence(q);
    }
    for (Node q = p; q != null; q = q.next()) {
      enclosedClause(q);
    }
    r.reduce(p, PARTICULAR_PROGRAM, LABEL, ENCLOSED_CLAUSE);
    r.reduce(p, PARTICULAR_PROGRAM, ENCLOSED_CLAUSE);
    if (p.sub() == null || p.next() != null) {
      recovery.recover(p, PARTICULAR_PROGRAM, diagnostics.errorCount() - errors > MAX_ERRORS);
    }
  }

  private void labelSequence(Node q) {
    boolean z;
    do {
      z = r.reduce(q, LABEL, DEFINING_IDENTIFIER, COLON_SYMBOL);
      z |= r.reduce(q, LABEL, LABEL, DEFINING_IDENTIFIER, COLON_SYMBOL);
    } while (z);
  }

  private void enclosedClause(Node q) {
    r.reduce(q, PARALLEL_CLAUSE, PAR_SYMBOL, COLLATERAL_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, PARALLEL_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, CLOSED_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, COLLATERAL_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, CONDITIONAL_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, INTEGER_CASE_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, UNITED_CASE_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, LOOP_CLAUSE);
    r.reduce(q, ENCLOSED_CLAUSE, CODE_CLAUSE);
  }

  /**
   * Reduces the phrase one level down from {@code p}. Even if that fails, {@code p} takes the
   * attribute of the repaired phrase, so the enclosing phrase can go on.
   */
  void reduceSubordinate(Node p, Attribute expect) {
    Node sub = p.sub();
    if (sub == null) {
      return;
    }
    guard.enter(p);
    try {
      boolean ok = reducePhrase(sub, expect);
      p.setAttribute(sub.attribute());
      if (ok) {
        p.setSub(sub.sub());
      }
    } finally {
      guard.exit();
    }
  }

  private static boolean isDeclarerPack(Attribute expect) {
    return switch (expect) {
      case STRUCTURE_PACK, PARAMETER_PACK, FORMAL_DECLARERS, UNION_PACK, SPECIFIER -> true;
      default -> false;
    };
  }

  /** Reduces the phrase starting at {@code p}; returns false if it had to be repaired. */
  private boolean reducePhrase(Node p, Attribute expect) {
    int errors = diagnostics.errorCount();
    boolean declarerPack = isDeclarerPack(expect);
    tags.indicants(p);
    if (!declarerPack) {
      tags.priorities(p);
      tags.operators(p);
    }
    int before = diagnostics.errorCount();
    tags.elaborateBoldTags(p);
    if (diagnostics.errorCount() > before) {
      throw new PhaseAbort(UNDECLARED_BOLD_TAG);
    }
    declarers.reduce(p, expect);
    if (!declarerPack) {
      before = diagnostics.errorCount();
      tags.declarations(p);
      if (diagnostics.errorCount() > before) {
        throw new PhaseAbort(ERRONEOUS_DECLARATION);
      }
      tags.labels(p, expect);
      for (Node q = p; q != null; q = q.next()) {
        if (q.sub() != null) {
          deeperClauses(q);
        }
      }
      statements(p, expect);
      rightToLeft(p);
      clauses.constructs(p, expect);
      clauses.controlStructure(p, expect);
    }
    if (p.sub() == null || p.next() != null) {
      recovery.recover(p, expect, diagnostics.errorCount() - errors > MAX_ERRORS);
      return false;
    }
    return true;
  }

  private void deeperClauses(Node p) {
    switch (p.attribute()) {
      case FORMAT_DELIMITER_SYMBOL, FORMAT_OPEN_SYMBOL -> reduceSubordinate(p, FORMAT_TEXT);
      case OPEN_SYMBOL -> {
        if (p.next() != null && p.next().is(THEN_BAR_SYMBOL)) {
          reduceSubordinate(p, ENQUIRY_CLAUSE);
        } else if (p.previous() != null && p.previous().is(PAR_SYMBOL)) {
          reduceSubordinate(p, COLLATERAL_CLAUSE);
        }
      }
      case IF_SYMBOL, ELIF_SYMBOL, CASE_SYMBOL, OUSE_SYMBOL, WHILE_SYMBOL, UNTIL_SYMBOL,
          ELSE_BAR_SYMBOL, ACCO_SYMBOL ->
          reduceSubordinate(p, ENQUIRY_CLAUSE);
      case BEGIN_SYMBOL, THEN_BAR_SYMBOL -> reduceSubordinate(p, SOME_CLAUSE);
      case THEN_SYMBOL, ELSE_SYMBOL, OUT_SYMBOL, DO_SYMBOL, ALT_DO_SYMBOL, CODE_SYMBOL ->
          reduceSubordinate(p, SERIAL_CLAUSE);
      case IN_SYMBOL -> reduceSubordinate(p, COLLATERAL_CLAUSE);
      case LOOP_CLAUSE -> reduceSubordinate(p, ENCLOSED_CLAUSE);
      case FOR_SYMBOL, FROM_SYMBOL, BY_SYMBOL, TO_SYMBOL, DOWNTO_SYMBOL ->
          reduceSubordinate(p, UNIT);
      default -> {}
    }
  }

  // Primaries, secondaries, formulae and tertiaries.

  private void statements(Node p, Attribute expect) {
    primaryBits(p, expect);
    if (expect == ENCLOSED_CLAUSE) {
      return;
    }
    primaries(p, expect);
    if (expect == FORMAT_TEXT) {
      formats.reduce(p);
    } else {
      secondaries(p);
      formulae(p);
      tertiaries(p);
    }
  }

  private static final Attribute[] DENOTATIONS = {
    INT_DENOTATION, REAL_DENOTATION, BITS_DENOTATION
  };

  private void primaryBits(Node p, Attribute expect) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.whether(IDENTIFIER, OF_SYMBOL)) {
        q.setAttribute(FIELD_IDENTIFIER);
      }
      r.reduce(q, NIHIL, NIL_SYMBOL);
      r.reduce(q, SKIP, SKIP_SYMBOL);
      r.reduce(q, SELECTOR, FIELD_IDENTIFIER, OF_SYMBOL);
      // A jump without GOTO is recognised once the labels are known.
      r.reduce(q, JUMP, GOTO_SYMBOL, IDENTIFIER);
      for (Attribute d : DENOTATIONS) {
        r.reduce(q, DENOTATION, LONGETY, d);
        r.reduce(q, DENOTATION, SHORTETY, d);
      }
      for (Attribute d : DENOTATIONS) {
        r.reduce(q, DENOTATION, d);
      }
      r.reduce(q, DENOTATION, ROW_CHAR_DENOTATION);
      r.reduce(q, DENOTATION, TRUE_SYMBOL);
      r.reduce(q, DENOTATION, FALSE_SYMBOL);
      r.reduce(q, DENOTATION, EMPTY_SYMBOL);
      if (expect == SERIAL_CLAUSE || expect == ENQUIRY_CLAUSE || expect == SOME_CLAUSE) {
        labelSequence(q);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      enclosedClause(q);
    }
  }

  private void primaries(Node p, Attribute expect) {
    Node q = p;
    while (q != null) {
      boolean forward = true;
      r.reduce(q, PRIMARY, IDENTIFIER);
      r.reduce(q, PRIMARY, DENOTATION);
      r.reduce(q, CAST, DECLARER, ENCLOSED_CLAUSE);
      r.reduce(q, CAST, VOID_SYMBOL, ENCLOSED_CLAUSE);
      r.reduce(q, ASSERTION, ASSERT_SYMBOL, ENCLOSED_CLAUSE);
      r.reduce(q, PRIMARY, CAST);
      r.reduce(q, PRIMARY, ENCLOSED_CLAUSE);
      r.reduce(q, PRIMARY, FORMAT_TEXT);
      // Calls are reduced as slices; the mode checker tells them apart.
      boolean z;
      do {
        z = false;
        Node x = q.next();
        if (q.is(PRIMARY) && x != null && x.isOneOf(OPEN_SYMBOL, SUB_SYMBOL)) {
          reduceSubordinate(x, GENERIC_ARGUMENT);
          z = r.reduce(q, SLICE, PRIMARY, GENERIC_ARGUMENT);
          z |= r.reduce(q, PRIMARY, SLICE);
        }
      } while (z);
      // Now that calls and slices are known, the remaining ( .. ) are clauses.
      if (q.is(OPEN_SYMBOL) && q.sub() != null) {
        reduceSubordinate(q, SOME_CLAUSE);
        r.reduce(q, ENCLOSED_CLAUSE, CLOSED_CLAUSE);
        r.reduce(q, ENCLOSED_CLAUSE, COLLATERAL_CLAUSE);
        r.reduce(q, ENCLOSED_CLAUSE, CONDITIONAL_CLAUSE);
        r.reduce(q, ENCLOSED_CLAUSE, INTEGER_CASE_CLAUSE);
        r.reduce(q, ENCLOSED_CLAUSE, UNITED_CASE_CLAUSE);
        if (q.previous() != null) {
          q = q.previous();
          forward = false;
        }
      }
      if (expect == FORMAT_TEXT) {
        for (Node f = p; f != null; f = f.next()) {
          r.reduce(f, DYNAMIC_REPLICATOR, FORMAT_ITEM_N, ENCLOSED_CLAUSE);
          r.reduce(f, GENERAL_PATTERN, FORMAT_ITEM_G, ENCLOSED_CLAUSE);
          r.reduce(f, FORMAT_PATTERN, FORMAT_ITEM_F, ENCLOSED_CLAUSE);
        }
      }
      if (forward) {
        q = q.next();
      }
    }
  }

  private void secondaries(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, SECONDARY, PRIMARY);
      r.reduce(q, GENERATOR, LOC_SYMBOL, DECLARER);
      r.reduce(q, GENERATOR, HEAP_SYMBOL, DECLARER);
      r.reduce(q, SECONDARY, GENERATOR);
    }
    // Selections associate to the right: a OF b OF c.
    boolean z;
    do {
      z = false;
      for (Node q = p.last(); q != null; q = q.previous()) {
        z |= r.reduce(q, SELECTION, SELECTOR, SECONDARY);
        z |= r.reduce(q, SECONDARY, SELECTION);
        if (q == p) {
          break;
        }
      }
    } while (z);
  }

  private static boolean operatorWithPriority(Node q, int k) {
    Node op = q.next();
    return op != null && op.is(OPERATOR) && op.priority() == k;
  }

  private static final Attribute[] OPERANDS = {SECONDARY, MONADIC_FORMULA, FORMULA};

  private void formulae(Node p) {
    Node q = p;
    while (q != null) {
      q = q.isOneOf(OPERATOR, SECONDARY) ? reduceDyadic(q, 0) : q.next();
    }
    for (int k = TagExtractor.MAX_PRIORITY; k >= 0; k--) {
      for (q = p; q != null; q = q.next()) {
        if (!operatorWithPriority(q, k)) {
          continue;
        }
        if (q.isOneOf(SECONDARY, MONADIC_FORMULA)) {
          Attribute left = q.attribute();
          for (Attribute right : OPERANDS) {
            Node op = q.next();
            if (r.reduce(q, FORMULA, left, OPERATOR, right) && k == 0) {
              diagnostics.error(Severity.SYNTAX, op, NO_PRIORITY, op.symbol());
            }
          }
        }
        boolean z;
        do {
          z = false;
          for (Attribute right : OPERANDS) {
            if (operatorWithPriority(q, k)) {
              Node op = q.next();
              if (r.reduce(q, FORMULA, FORMULA, OPERATOR, right)) {
                z = true;
                if (k == 0) {
                  diagnostics.error(Severity.SYNTAX, op, NO_PRIORITY, op.symbol());
                }
              }
            }
          }
        } while (z);
      }
    }
  }

  /**
   * Marks the operators of the formula starting at {@code p} that stand in monadic position and
   * reduces their monadic formulae. Works by precedence climbing over priorities {@code u} and
   * up; returns the node after the operand at priority {@code u}.
   */
  private @Nullable Node reduceDyadic(@Nullable Node p, int u) {
    if (u > TagExtractor.MAX_PRIORITY) {
      if (p == null) {
        return null;
      }
      if (p.is(OPERATOR)) {
        Node q = p;
        q.setPriority(MONADIC_PRIORITY);
        while (q.next() != null && q.next().is(OPERATOR)) {
          q = q.next();
          q.setPriority(MONADIC_PRIORITY);
        }
        r.reduce(q, MONADIC_FORMULA, OPERATOR, SECONDARY);
        while (q != p) {
          q = q.previous();
          r.reduce(q, MONADIC_FORMULA, OPERATOR, MONADIC_FORMULA);
        }
      }
      return p.next();
    }
    p = reduceDyadic(p, u + 1);
    while (p != null && p.is(OPERATOR) && p.priority() == u) {
      p = reduceDyadic(p.next(), u + 1);
    }
    return p;
  }

  private void tertiaries(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, TERTIARY, NIHIL);
      r.reduce(q, FORMULA, MONADIC_FORMULA);
      r.reduce(q, TERTIARY, FORMULA);
      r.reduce(q, TERTIARY, SECONDARY);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, IDENTITY_RELATION, TERTIARY, IS_SYMBOL, TERTIARY);
      r.reduce(q, IDENTITY_RELATION, TERTIARY, ISNT_SYMBOL, TERTIARY);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, AND_FUNCTION, TERTIARY, ANDF_SYMBOL, TERTIARY);
      r.reduce(q, AND_FUNCTION, TERTIARY, ANDTH_SYMBOL, TERTIARY);
      r.reduce(q, OR_FUNCTION, TERTIARY, ORF_SYMBOL, TERTIARY);
      r.reduce(q, OR_FUNCTION, TERTIARY, OREL_SYMBOL, TERTIARY);
    }
  }

  private static final Attribute[] SOURCES = {
    ASSIGNATION,
    IDENTITY_RELATION,
    AND_FUNCTION,
    OR_FUNCTION,
    JUMP,
    SKIP,
    TERTIARY,
    ROUTINE_TEXT
  };

  /** Assignations and routine texts, which associate to the right. */
  private void rightToLeft(Node p) {
    for (Node q = p.last(); q != null; q = q.previous()) {
      switch (q.attribute()) {
        case TERTIARY -> {
          for (Attribute source : SOURCES) {
            r.reduce(q, ASSIGNATION, TERTIARY, ASSIGN_SYMBOL, source);
          }
        }
        case PARAMETER_PACK -> {
          for (Attribute yield : new Attribute[] {DECLARER, VOID_SYMBOL}) {
            for (Attribute body : SOURCES) {
              r.reduce(q, ROUTINE_TEXT, PARAMETER_PACK, yield, COLON_SYMBOL, body);
            }
          }
        }
        case DECLARER, VOID_SYMBOL -> {
          if (q.previous() == null || !q.previous().is(PARAMETER_PACK)) {
            for (Attribute body : SOURCES) {
              r.reduce(q, ROUTINE_TEXT, q.attribute(), COLON_SYMBOL, body);
            }
          }
        }
        default -> {}
      }
      if (q == p) {
        break;
      }
    }
  }

  // Checks and rearrangements once the tree is reduced.

  /** Checks that every boolean pattern has either no pictures or two. */
  public static void checkPictures(Session session, @Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(BOOLEAN_PATTERN)) {
        int k = countPictures(p.sub());
        if (k != 0 && k != 2) {
          session
              .diagnostics()
              .error(Severity.SYNTAX, p, PICTURE_NUMBER, p.attribute().displayName());
        }
      } else {
        checkPictures(session, p.sub());
      }
    }
  }

  private static int countPictures(@Nullable Node p) {
    int k = 0;
    for (; p != null; p = p.next()) {
      if (p.is(PICTURE)) {
        k++;
      }
      k += countPictures(p.sub());
    }
    return k;
  }

  private static boolean isLabel(Node identifier) {
    SymbolTable table = identifier.table();
    Tag tag = (table == null) ? null : table.findIdentifierOrLabel(identifier.symbol());
    return tag != null && tag.is(TagKind.LABEL);
  }

  /**
   * Turns applied identifiers that name labels into jumps. Must run after the tags of all ranges
   * have been collected.
   */
  public static void rearrangeGotoLessJumps(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case UNIT -> collapse(p.sub(), TERTIARY, SECONDARY, PRIMARY);
        case TERTIARY -> collapse(p.sub(), SECONDARY, PRIMARY);
        case SECONDARY -> collapse(p.sub(), PRIMARY);
        case PRIMARY -> {
          Node q = p.sub();
          if (q != null && q.is(IDENTIFIER) && isLabel(q)) {
            q.makeSub(q, JUMP);
          }
        }
        default -> {}
      }
      rearrangeGotoLessJumps(p.sub());
    }
  }

  /**
   * If {@code top} heads a chain of single nodes with the given attributes ending in a label
   * identifier, makes {@code top} a jump to it.
   */
  private static void collapse(@Nullable Node top, Attribute... chain) {
    if (top == null || !top.is(chain[0])) {
      return;
    }
    Node q = top.sub();
    for (int i = 1; i < chain.length; i++) {
      if (q == null || !q.is(chain[i])) {
        return;
      }
      q = q.sub();
    }
    if (q != null && q.is(IDENTIFIER) && isLabel(q)) {
      top.setAttribute(JUMP);
      top.setSub(q);
    }
  }
}
