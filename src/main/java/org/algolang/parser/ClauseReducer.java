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

import org.algolang.diag.CompilerBug;
import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;

/**
 * Reduces the phrases above tertiaries: units, declarations, argument and bounds lists, serial,
 * enquiry and collateral clauses, and finally the enclosed clauses assembled from their parts.
 */
final class ClauseReducer {
  static final String LABELED_UNIT_MUST_FOLLOW = "EXIT must be followed by a labeled unit";
  static final String LABEL_BEFORE_DECLARATION = "declaration must not follow a label";

  private final Reducer r;
  private final ErrorRecovery recovery;

  ClauseReducer(Reducer r, ErrorRecovery recovery) {
    this.r = r;
    this.recovery = recovery;
  }

  /**
   * Guesses whether an unreduced phrase is a serial or a collateral clause from the separators it
   * contains.
   */
  static Attribute serialOrCollateral(Node p) {
    int semis = 0;
    int commas = 0;
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(COMMA_SYMBOL)) {
        commas++;
      } else if (q.isOneOf(SEMI_SYMBOL, EXIT_SYMBOL)) {
        semis++;
      }
    }
    if (semis == 0 && commas > 0) {
      return COLLATERAL_CLAUSE;
    } else if (commas == 0) {
      return SERIAL_CLAUSE;
    }
    return (semis >= commas) ? SERIAL_CLAUSE : COLLATERAL_CLAUSE;
  }

  void constructs(Node p, Attribute expect) {
    basicDeclarations(p);
    units(p);
    recovery.erroneousUnits(p);
    if (expect == UNIT) {
      return;
    }
    if (expect == GENERIC_ARGUMENT) {
      genericArguments(p);
    } else if (expect == BOUNDS) {
      bounds(p);
    } else {
      declarationLists(p);
      if (expect != DECLARATION_LIST) {
        labels(p);
        if (expect == SOME_CLAUSE) {
          expect = serialOrCollateral(p);
        }
        switch (expect) {
          case SERIAL_CLAUSE -> serialClauses(p);
          case ENQUIRY_CLAUSE -> enquiryClauses(p);
          case COLLATERAL_CLAUSE -> collateralClauses(p);
          case ARGUMENT -> arguments(p);
          default -> {}
        }
      }
    }
  }

  void controlStructure(Node p, Attribute expect) {
    enclosedClauseBits(p, expect);
    enclosedClauses(p);
  }

  private void basicDeclarations(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, PRIORITY_DECLARATION, PRIO_SYMBOL, DEFINING_OPERATOR, EQUALS_SYMBOL, PRIORITY);
      r.reduce(q, MODE_DECLARATION, MODE_SYMBOL, DEFINING_INDICANT, EQUALS_SYMBOL, DECLARER);
      r.reduce(q, MODE_DECLARATION, MODE_SYMBOL, DEFINING_INDICANT, EQUALS_SYMBOL, VOID_SYMBOL);
      r.reduce(
          q, PROCEDURE_DECLARATION, PROC_SYMBOL, DEFINING_IDENTIFIER, EQUALS_SYMBOL, ROUTINE_TEXT);
      r.reduce(
          q,
          PROCEDURE_VARIABLE_DECLARATION,
          PROC_SYMBOL,
          DEFINING_IDENTIFIER,
          ASSIGN_SYMBOL,
          ROUTINE_TEXT);
      r.reduce(
          q,
          PROCEDURE_VARIABLE_DECLARATION,
          QUALIFIER,
          PROC_SYMBOL,
          DEFINING_IDENTIFIER,
          ASSIGN_SYMBOL,
          ROUTINE_TEXT);
      r.reduce(
          q,
          BRIEF_OPERATOR_DECLARATION,
          OP_SYMBOL,
          DEFINING_OPERATOR,
          EQUALS_SYMBOL,
          ROUTINE_TEXT);
      // PROC f = .. with a missing or wrong symbol for the equals sign.
      r.reduce(q, r::missingSymbol, PROCEDURE_DECLARATION, PROC_SYMBOL, WILDCARD, ROUTINE_TEXT);
    }
    for (Node q = p; q != null; q = q.next()) {
      boolean z;
      do {
        z = false;
        switch (q.attribute()) {
          case PRIORITY_DECLARATION ->
              z = r.reduce(
                  q,
                  PRIORITY_DECLARATION,
                  PRIORITY_DECLARATION,
                  COMMA_SYMBOL,
                  DEFINING_OPERATOR,
                  EQUALS_SYMBOL,
                  PRIORITY);
          case MODE_DECLARATION ->
              z = r.reduce(
                      q,
                      MODE_DECLARATION,
                      MODE_DECLARATION,
                      COMMA_SYMBOL,
                      DEFINING_INDICANT,
                      EQUALS_SYMBOL,
                      DECLARER)
                  || r.reduce(
                      q,
                      MODE_DECLARATION,
                      MODE_DECLARATION,
                      COMMA_SYMBOL,
                      DEFINING_INDICANT,
                      EQUALS_SYMBOL,
                      VOID_SYMBOL);
          case PROCEDURE_DECLARATION ->
              z = r.reduce(
                      q,
                      PROCEDURE_DECLARATION,
                      PROCEDURE_DECLARATION,
                      COMMA_SYMBOL,
                      DEFINING_IDENTIFIER,
                      EQUALS_SYMBOL,
                      ROUTINE_TEXT)
                  || r.reduce(
                      q,
                      r::missingSymbol,
                      PROCEDURE_DECLARATION,
                      PROCEDURE_DECLARATION,
                      COMMA_SYMBOL,
                      WILDCARD,
                      ROUTINE_TEXT);
          case PROCEDURE_VARIABLE_DECLARATION ->
              z = r.reduce(
                  q,
                  PROCEDURE_VARIABLE_DECLARATION,
                  PROCEDURE_VARIABLE_DECLARATION,
                  COMMA_SYMBOL,
                  DEFINING_IDENTIFIER,
                  ASSIGN_SYMBOL,
                  ROUTINE_TEXT);
          case BRIEF_OPERATOR_DECLARATION ->
              z = r.reduce(
                  q,
                  BRIEF_OPERATOR_DECLARATION,
                  BRIEF_OPERATOR_DECLARATION,
                  COMMA_SYMBOL,
                  DEFINING_OPERATOR,
                  EQUALS_SYMBOL,
                  ROUTINE_TEXT);
          default -> {}
        }
      } while (z);
    }
  }

  private static final Attribute[] UNIT_KINDS = {
    ASSIGNATION,
    IDENTITY_RELATION,
    AND_FUNCTION,
    OR_FUNCTION,
    ROUTINE_TEXT,
    JUMP,
    SKIP,
    TERTIARY,
    ASSERTION
  };

  private void units(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(OPERATOR) && q.symbol().equals("~")) {
        q.setAttribute(SKIP);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      for (Attribute a : UNIT_KINDS) {
        r.reduce(q, UNIT, a);
      }
    }
  }

  /** Trimmers and subscripts in {@code a[..]}. */
  private void genericArguments(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(UNIT)) {
        for (Attribute colon : new Attribute[] {COLON_SYMBOL, DOTDOT_SYMBOL}) {
          r.reduce(q, TRIMMER, UNIT, colon, UNIT, AT_SYMBOL, UNIT);
          r.reduce(q, TRIMMER, UNIT, colon, UNIT);
          r.reduce(q, TRIMMER, UNIT, colon, AT_SYMBOL, UNIT);
          r.reduce(q, TRIMMER, UNIT, colon);
        }
      } else if (q.isOneOf(COLON_SYMBOL, DOTDOT_SYMBOL)) {
        Attribute colon = q.attribute();
        r.reduce(q, TRIMMER, colon, UNIT, AT_SYMBOL, UNIT);
        r.reduce(q, TRIMMER, colon, UNIT);
        r.reduce(q, TRIMMER, colon, AT_SYMBOL, UNIT);
        r.reduce(q, TRIMMER, colon);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, TRIMMER, AT_SYMBOL, UNIT);
    }
    // Empty positions, as in a[, 1], become empty trimmers.
    for (Node q = p; q != null && q.next() != null; q = q.next()) {
      Node next = q.next();
      if (q.is(COMMA_SYMBOL)) {
        if (!next.isOneOf(UNIT, TRIMMER)) {
          Reducer.padNode(q, TRIMMER);
        }
      } else if (next.is(COMMA_SYMBOL) && !q.isOneOf(UNIT, TRIMMER)) {
        Reducer.padNode(q, TRIMMER);
      }
    }
    Node q = p.next();
    if (q == null) {
      throw new CompilerBug("erroneous parser state in %s", p.phrase(4));
    }
    r.reduce(q, GENERIC_ARGUMENT_LIST, UNIT);
    r.reduce(q, GENERIC_ARGUMENT_LIST, TRIMMER);
    boolean z;
    do {
      z = r.reduce(q, GENERIC_ARGUMENT_LIST, GENERIC_ARGUMENT_LIST, COMMA_SYMBOL, UNIT);
      z |= r.reduce(q, GENERIC_ARGUMENT_LIST, GENERIC_ARGUMENT_LIST, COMMA_SYMBOL, TRIMMER);
      z |= r.reduce(q, r::missingSeparator, GENERIC_ARGUMENT_LIST, GENERIC_ARGUMENT_LIST, UNIT);
      z |= r.reduce(q, r::missingSeparator, GENERIC_ARGUMENT_LIST, GENERIC_ARGUMENT_LIST, TRIMMER);
    } while (z);
  }

  private void bounds(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, BOUND, UNIT, COLON_SYMBOL, UNIT);
      r.reduce(q, BOUND, UNIT, DOTDOT_SYMBOL, UNIT);
      r.reduce(q, BOUND, UNIT);
    }
    Node q = p.next();
    if (q == null) {
      return;
    }
    if (q.is(BOUND)) {
      r.reduce(q, BOUNDS_LIST, BOUND);
    } else if (q.is(COMMA_SYMBOL)) {
      r.reduce(q, FORMAL_BOUNDS_LIST, COMMA_SYMBOL);
    } else if (q.isOneOf(COLON_SYMBOL, DOTDOT_SYMBOL)) {
      r.reduce(q, ALT_FORMAL_BOUNDS_LIST, q.attribute());
    }
    boolean z;
    do {
      z = false;
      if (q.is(BOUNDS_LIST)) {
        z = r.reduce(q, BOUNDS_LIST, BOUNDS_LIST, COMMA_SYMBOL, BOUND);
        z |= r.reduce(q, r::missingSeparator, BOUNDS_LIST, BOUNDS_LIST, BOUND);
      } else if (q.is(FORMAL_BOUNDS_LIST)) {
        z = r.reduce(q, FORMAL_BOUNDS_LIST, FORMAL_BOUNDS_LIST, COMMA_SYMBOL);
        z |= r.reduce(q, ALT_FORMAL_BOUNDS_LIST, FORMAL_BOUNDS_LIST, COLON_SYMBOL);
        z |= r.reduce(q, ALT_FORMAL_BOUNDS_LIST, FORMAL_BOUNDS_LIST, DOTDOT_SYMBOL);
      } else if (q.is(ALT_FORMAL_BOUNDS_LIST)) {
        z = r.reduce(q, FORMAL_BOUNDS_LIST, ALT_FORMAL_BOUNDS_LIST, COMMA_SYMBOL);
      }
    } while (z);
  }

  private void arguments(Node p) {
    Node q = p.next();
    if (q == null) {
      return;
    }
    r.reduce(q, ARGUMENT_LIST, UNIT);
    boolean z;
    do {
      z = r.reduce(q, ARGUMENT_LIST, ARGUMENT_LIST, COMMA_SYMBOL, UNIT);
      z |= r.reduce(q, r::missingSeparator, ARGUMENT_LIST, ARGUMENT_LIST, UNIT);
    } while (z);
  }

  private static final Attribute[] DECLARATION_KINDS = {
    MODE_DECLARATION,
    PRIORITY_DECLARATION,
    BRIEF_OPERATOR_DECLARATION,
    OPERATOR_DECLARATION,
    IDENTITY_DECLARATION,
    PROCEDURE_DECLARATION,
    PROCEDURE_VARIABLE_DECLARATION,
    VARIABLE_DECLARATION
  };

  private void declarationLists(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, IDENTITY_DECLARATION, DECLARER, DEFINING_IDENTIFIER, EQUALS_SYMBOL, UNIT);
      r.reduce(
          q,
          VARIABLE_DECLARATION,
          QUALIFIER,
          DECLARER,
          DEFINING_IDENTIFIER,
          ASSIGN_SYMBOL,
          UNIT);
      r.reduce(q, VARIABLE_DECLARATION, QUALIFIER, DECLARER, DEFINING_IDENTIFIER);
      r.reduce(q, VARIABLE_DECLARATION, DECLARER, DEFINING_IDENTIFIER, ASSIGN_SYMBOL, UNIT);
      r.reduce(q, VARIABLE_DECLARATION, DECLARER, DEFINING_IDENTIFIER);
    }
    for (Node q = p; q != null; q = q.next()) {
      boolean z;
      do {
        z = false;
        if (q.is(IDENTITY_DECLARATION)) {
          z = r.reduce(
              q,
              IDENTITY_DECLARATION,
              IDENTITY_DECLARATION,
              COMMA_SYMBOL,
              DEFINING_IDENTIFIER,
              EQUALS_SYMBOL,
              UNIT);
        } else if (q.is(VARIABLE_DECLARATION)) {
          z = r.reduce(
              q,
              VARIABLE_DECLARATION,
              VARIABLE_DECLARATION,
              COMMA_SYMBOL,
              DEFINING_IDENTIFIER,
              ASSIGN_SYMBOL,
              UNIT);
          if (!q.whether(
              VARIABLE_DECLARATION, COMMA_SYMBOL, DEFINING_IDENTIFIER, ASSIGN_SYMBOL, UNIT)) {
            z |= r.reduce(
                q,
                VARIABLE_DECLARATION,
                VARIABLE_DECLARATION,
                COMMA_SYMBOL,
                DEFINING_IDENTIFIER);
          }
        }
      } while (z);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, OPERATOR_DECLARATION, OPERATOR_PLAN, DEFINING_OPERATOR, EQUALS_SYMBOL, UNIT);
      boolean z;
      do {
        z = r.reduce(
            q,
            OPERATOR_DECLARATION,
            OPERATOR_DECLARATION,
            COMMA_SYMBOL,
            DEFINING_OPERATOR,
            EQUALS_SYMBOL,
            UNIT);
      } while (z);
    }
    for (Node q = p; q != null; q = q.next()) {
      for (Attribute a : DECLARATION_KINDS) {
        r.reduce(q, DECLARATION_LIST, a);
      }
      boolean z;
      do {
        z = r.reduce(q, DECLARATION_LIST, DECLARATION_LIST, COMMA_SYMBOL, DECLARATION_LIST);
      } while (z);
    }
  }

  private void labels(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, LABELED_UNIT, LABEL, UNIT);
      r.reduce(q, SPECIFIED_UNIT, SPECIFIER, COLON_SYMBOL, UNIT);
    }
  }

  /** Reports misplaced EXITs and declarations that follow a label. */
  private void precheckSerialClause(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(EXIT_SYMBOL) && (q.next() == null || !q.next().is(LABELED_UNIT))) {
        r.diagnostics.error(Severity.SYNTAX, q, LABELED_UNIT_MUST_FOLLOW);
      }
    }
    boolean labelSeen = false;
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(LABELED_UNIT)) {
        labelSeen = true;
      } else if (q.is(DECLARATION_LIST) && labelSeen) {
        r.diagnostics.error(Severity.SYNTAX, q, LABEL_BEFORE_DECLARATION);
      }
    }
  }

  /**
   * Reduces the series after the opening symbol {@code p}. The series becomes {@code serial}
   * once it ends in a unit, and an initialiser series while it ends in declarations.
   */
  private void series(Node q, Attribute serial, boolean allowLabels) {
    r.reduce(q, serial, UNIT);
    if (allowLabels) {
      r.reduce(q, serial, LABELED_UNIT);
    }
    r.reduce(q, INITIALISER_SERIES, DECLARATION_LIST);
    boolean z;
    do {
      z = false;
      if (q.isOneOf(serial, INITIALISER_SERIES)) {
        Attribute head = q.attribute();
        z = r.reduce(q, serial, head, SEMI_SYMBOL, UNIT);
        if (allowLabels) {
          if (head == serial) {
            z |= r.reduce(q, serial, head, EXIT_SYMBOL, LABELED_UNIT);
          }
          z |= r.reduce(q, serial, head, SEMI_SYMBOL, LABELED_UNIT);
        }
        z |= r.reduce(q, INITIALISER_SERIES, head, SEMI_SYMBOL, DECLARATION_LIST);
        if (allowLabels) {
          z |= r.reduce(q, r::wrongSeparator, serial, head, COMMA_SYMBOL, UNIT);
          z |= r.reduce(q, r::wrongSeparator, serial, head, COMMA_SYMBOL, LABELED_UNIT);
          z |= r.reduce(
              q, r::wrongSeparator, INITIALISER_SERIES, head, COMMA_SYMBOL, DECLARATION_LIST);
        }
        z |= r.reduce(q, r::missingSeparator, serial, head, UNIT);
        if (allowLabels) {
          z |= r.reduce(q, r::missingSeparator, serial, head, LABELED_UNIT);
        }
        z |= r.reduce(q, r::missingSeparator, INITIALISER_SERIES, head, DECLARATION_LIST);
      }
    } while (z);
  }

  private void serialClauses(Node p) {
    if (p.next() != null) {
      precheckSerialClause(p);
      series(p.next(), SERIAL_CLAUSE, true);
    }
  }

  private void enquiryClauses(Node p) {
    if (p.next() != null) {
      series(p.next(), ENQUIRY_CLAUSE, false);
    }
  }

  private void collateralClauses(Node p) {
    Node q = p.next();
    if (q == null) {
      return;
    }
    if (q.is(UNIT)) {
      r.reduce(q, UNIT_LIST, UNIT);
      boolean z;
      do {
        z = r.reduce(q, UNIT_LIST, UNIT_LIST, COMMA_SYMBOL, UNIT);
        z |= r.reduce(q, r::missingSeparator, UNIT_LIST, UNIT_LIST, UNIT);
      } while (z);
    } else if (q.is(SPECIFIED_UNIT)) {
      r.reduce(q, SPECIFIED_UNIT_LIST, SPECIFIED_UNIT);
      boolean z;
      do {
        z = r.reduce(q, SPECIFIED_UNIT_LIST, SPECIFIED_UNIT_LIST, COMMA_SYMBOL, SPECIFIED_UNIT);
        z |= r.reduce(
            q, r::missingSeparator, SPECIFIED_UNIT_LIST, SPECIFIED_UNIT_LIST, SPECIFIED_UNIT);
      } while (z);
    }
  }

  /** Reduces the parts of enclosed clauses: {@code IF} with its enquiry, {@code THEN} part etc. */
  private void enclosedClauseBits(Node p, Attribute expect) {
    if (p.sub() != null) {
      return;
    }
    switch (p.attribute()) {
      case FOR_SYMBOL -> r.reduce(p, FOR_PART, FOR_SYMBOL, DEFINING_IDENTIFIER);
      case OPEN_SYMBOL -> openBits(p, expect);
      case SUB_SYMBOL -> {
        if (expect == GENERIC_ARGUMENT) {
          genericArgument(p, SUB_SYMBOL, BUS_SYMBOL);
        } else if (expect == BOUNDS) {
          boundsBits(p, SUB_SYMBOL, BUS_SYMBOL);
        }
      }
      case BEGIN_SYMBOL -> {
        r.reduce(p, COLLATERAL_CLAUSE, BEGIN_SYMBOL, UNIT_LIST, END_SYMBOL);
        r.reduce(p, COLLATERAL_CLAUSE, BEGIN_SYMBOL, END_SYMBOL);
        r.reduce(p, CLOSED_CLAUSE, BEGIN_SYMBOL, SERIAL_CLAUSE, END_SYMBOL);
        r.reduce(
            p, r::emptyClause, CLOSED_CLAUSE, BEGIN_SYMBOL, INITIALISER_SERIES, END_SYMBOL);
      }
      case FORMAT_DELIMITER_SYMBOL -> {
        r.reduce(
            p,
            FORMAT_TEXT,
            FORMAT_DELIMITER_SYMBOL,
            PICTURE_LIST,
            FORMAT_DELIMITER_SYMBOL);
        r.reduce(p, FORMAT_TEXT, FORMAT_DELIMITER_SYMBOL, FORMAT_DELIMITER_SYMBOL);
      }
      case FORMAT_OPEN_SYMBOL ->
          r.reduce(p, COLLECTION, FORMAT_OPEN_SYMBOL, PICTURE_LIST, FORMAT_CLOSE_SYMBOL);
      case CODE_SYMBOL -> r.reduce(p, CODE_CLAUSE, CODE_SYMBOL, SERIAL_CLAUSE, EDOC_SYMBOL);
      case IF_SYMBOL -> {
        r.reduce(p, IF_PART, IF_SYMBOL, ENQUIRY_CLAUSE);
        r.reduce(p, r::emptyClause, IF_PART, IF_SYMBOL, INITIALISER_SERIES);
      }
      case THEN_SYMBOL -> {
        r.reduce(p, THEN_PART, THEN_SYMBOL, SERIAL_CLAUSE);
        r.reduce(p, r::emptyClause, THEN_PART, THEN_SYMBOL, INITIALISER_SERIES);
      }
      case ELSE_SYMBOL -> {
        r.reduce(p, ELSE_PART, ELSE_SYMBOL, SERIAL_CLAUSE);
        r.reduce(p, r::emptyClause, ELSE_PART, ELSE_SYMBOL, INITIALISER_SERIES);
      }
      case ELIF_SYMBOL -> r.reduce(p, ELIF_IF_PART, ELIF_SYMBOL, ENQUIRY_CLAUSE);
      case CASE_SYMBOL -> {
        r.reduce(p, CASE_PART, CASE_SYMBOL, ENQUIRY_CLAUSE);
        r.reduce(p, r::emptyClause, CASE_PART, CASE_SYMBOL, INITIALISER_SERIES);
      }
      case IN_SYMBOL -> {
        r.reduce(p, INTEGER_IN_PART, IN_SYMBOL, UNIT_LIST);
        r.reduce(p, UNITED_IN_PART, IN_SYMBOL, SPECIFIED_UNIT_LIST);
      }
      case OUT_SYMBOL -> {
        r.reduce(p, OUT_PART, OUT_SYMBOL, SERIAL_CLAUSE);
        r.reduce(p, r::emptyClause, OUT_PART, OUT_SYMBOL, INITIALISER_SERIES);
      }
      case OUSE_SYMBOL -> r.reduce(p, OUSE_CASE_PART, OUSE_SYMBOL, ENQUIRY_CLAUSE);
      case THEN_BAR_SYMBOL -> {
        r.reduce(p, CHOICE, THEN_BAR_SYMBOL, SERIAL_CLAUSE);
        r.reduce(p, INTEGER_CHOICE_CLAUSE, THEN_BAR_SYMBOL, UNIT_LIST);
        r.reduce(p, UNITED_CHOICE, THEN_BAR_SYMBOL, SPECIFIED_UNIT_LIST);
        r.reduce(p, UNITED_CHOICE, THEN_BAR_SYMBOL, SPECIFIED_UNIT);
        r.reduce(p, r::emptyClause, CHOICE, THEN_BAR_SYMBOL, INITIALISER_SERIES);
      }
      case ELSE_BAR_SYMBOL -> {
        r.reduce(p, ELSE_OPEN_PART, ELSE_BAR_SYMBOL, ENQUIRY_CLAUSE);
        r.reduce(p, r::emptyClause, ELSE_OPEN_PART, ELSE_BAR_SYMBOL, INITIALISER_SERIES);
      }
      case FROM_SYMBOL -> r.reduce(p, FROM_PART, FROM_SYMBOL, UNIT);
      case BY_SYMBOL -> r.reduce(p, BY_PART, BY_SYMBOL, UNIT);
      case TO_SYMBOL -> r.reduce(p, TO_PART, TO_SYMBOL, UNIT);
      case DOWNTO_SYMBOL -> r.reduce(p, TO_PART, DOWNTO_SYMBOL, UNIT);
      case WHILE_SYMBOL -> {
        r.reduce(p, WHILE_PART, WHILE_SYMBOL, ENQUIRY_CLAUSE);
        r.reduce(p, r::emptyClause, WHILE_PART, WHILE_SYMBOL, INITIALISER_SERIES);
      }
      case UNTIL_SYMBOL -> {
        r.reduce(p, UNTIL_PART, UNTIL_SYMBOL, ENQUIRY_CLAUSE);
        r.reduce(p, r::emptyClause, UNTIL_PART, UNTIL_SYMBOL, INITIALISER_SERIES);
      }
      case DO_SYMBOL -> doPart(p, DO_PART, DO_SYMBOL);
      case ALT_DO_SYMBOL -> doPart(p, ALT_DO_PART, ALT_DO_SYMBOL);
      default -> {}
    }
  }

  private void openBits(Node p, Attribute expect) {
    switch (expect) {
      case ENQUIRY_CLAUSE -> r.reduce(p, OPEN_PART, OPEN_SYMBOL, ENQUIRY_CLAUSE);
      case ARGUMENT -> {
        r.reduce(p, ARGUMENT, OPEN_SYMBOL, CLOSE_SYMBOL);
        r.reduce(p, ARGUMENT, OPEN_SYMBOL, ARGUMENT_LIST, CLOSE_SYMBOL);
        r.reduce(p, r::emptyClause, ARGUMENT, OPEN_SYMBOL, INITIALISER_SERIES, CLOSE_SYMBOL);
      }
      case GENERIC_ARGUMENT -> genericArgument(p, OPEN_SYMBOL, CLOSE_SYMBOL);
      case BOUNDS -> boundsBits(p, OPEN_SYMBOL, CLOSE_SYMBOL);
      default -> {
        r.reduce(p, CLOSED_CLAUSE, OPEN_SYMBOL, SERIAL_CLAUSE, CLOSE_SYMBOL);
        r.reduce(p, COLLATERAL_CLAUSE, OPEN_SYMBOL, UNIT_LIST, CLOSE_SYMBOL);
        r.reduce(p, COLLATERAL_CLAUSE, OPEN_SYMBOL, CLOSE_SYMBOL);
        r.reduce(p, r::emptyClause, CLOSED_CLAUSE, OPEN_SYMBOL, INITIALISER_SERIES, CLOSE_SYMBOL);
      }
    }
  }

  private void genericArgument(Node p, Attribute open, Attribute close) {
    if (p.whether(open, close)) {
      Reducer.padNode(p, TRIMMER);
      r.reduce(p, GENERIC_ARGUMENT, open, TRIMMER, close);
    }
    r.reduce(p, GENERIC_ARGUMENT, open, GENERIC_ARGUMENT_LIST, close);
  }

  private void boundsBits(Node p, Attribute open, Attribute close) {
    r.reduce(p, FORMAL_BOUNDS, open, close);
    r.reduce(p, BOUNDS, open, BOUNDS_LIST, close);
    r.reduce(p, FORMAL_BOUNDS, open, FORMAL_BOUNDS_LIST, close);
    r.reduce(p, FORMAL_BOUNDS, open, ALT_FORMAL_BOUNDS_LIST, close);
  }

  private void doPart(Node p, Attribute part, Attribute keyword) {
    r.reduce(p, part, keyword, SERIAL_CLAUSE, UNTIL_PART, OD_SYMBOL);
    r.reduce(p, part, keyword, SERIAL_CLAUSE, OD_SYMBOL);
    r.reduce(p, part, keyword, UNTIL_PART, OD_SYMBOL);
  }

  /** The loop parts that may follow each other, in order, before the DO part. */
  private static final Attribute[] LOOP_PARTS = {FOR_PART, FROM_PART, BY_PART, TO_PART, WHILE_PART};

  /** Assembles whole clauses from the parts reduced by {@link #enclosedClauseBits}. */
  private void enclosedClauses(Node p) {
    if (p.sub() == null) {
      return;
    }
    switch (p.attribute()) {
      case OPEN_PART ->
          briefChoices(p, CONDITIONAL_CLAUSE, INTEGER_CASE_CLAUSE, UNITED_CASE_CLAUSE);
      case ELSE_OPEN_PART ->
          briefChoices(p, BRIEF_ELIF_IF_PART, BRIEF_INTEGER_OUSE_PART, BRIEF_UNITED_OUSE_PART);
      case IF_PART -> {
        r.reduce(p, CONDITIONAL_CLAUSE, IF_PART, THEN_PART, ELSE_PART, FI_SYMBOL);
        r.reduce(p, CONDITIONAL_CLAUSE, IF_PART, THEN_PART, ELIF_PART);
        r.reduce(p, CONDITIONAL_CLAUSE, IF_PART, THEN_PART, FI_SYMBOL);
      }
      case ELIF_IF_PART -> {
        r.reduce(p, ELIF_PART, ELIF_IF_PART, THEN_PART, ELSE_PART, FI_SYMBOL);
        r.reduce(p, ELIF_PART, ELIF_IF_PART, THEN_PART, FI_SYMBOL);
        r.reduce(p, ELIF_PART, ELIF_IF_PART, THEN_PART, ELIF_PART);
      }
      case CASE_PART -> caseParts(p, CASE_PART, INTEGER_CASE_CLAUSE, UNITED_CASE_CLAUSE);
      case OUSE_CASE_PART -> caseParts(p, OUSE_CASE_PART, INTEGER_OUT_PART, UNITED_OUSE_PART);
      case FOR_PART, FROM_PART, BY_PART, TO_PART, WHILE_PART -> loopClause(p);
      case DO_PART -> r.reduce(p, LOOP_CLAUSE, DO_PART);
      default -> {}
    }
  }

  /** {@code ( .. | .. | .. )} and its {@code |:} continuation. */
  private void briefChoices(Node p, Attribute conditional, Attribute integer, Attribute united) {
    Attribute head = p.attribute();
    r.reduce(p, conditional, head, CHOICE, CHOICE, CLOSE_SYMBOL);
    r.reduce(p, conditional, head, CHOICE, CLOSE_SYMBOL);
    r.reduce(p, conditional, head, CHOICE, BRIEF_ELIF_IF_PART);
    r.reduce(p, integer, head, INTEGER_CHOICE_CLAUSE, CHOICE, CLOSE_SYMBOL);
    r.reduce(p, integer, head, INTEGER_CHOICE_CLAUSE, CLOSE_SYMBOL);
    r.reduce(p, integer, head, INTEGER_CHOICE_CLAUSE, BRIEF_INTEGER_OUSE_PART);
    r.reduce(p, united, head, UNITED_CHOICE, CHOICE, CLOSE_SYMBOL);
    r.reduce(p, united, head, UNITED_CHOICE, CLOSE_SYMBOL);
    r.reduce(p, united, head, UNITED_CHOICE, BRIEF_UNITED_OUSE_PART);
  }

  private void caseParts(Node p, Attribute head, Attribute integer, Attribute united) {
    r.reduce(p, integer, head, INTEGER_IN_PART, OUT_PART, ESAC_SYMBOL);
    r.reduce(p, integer, head, INTEGER_IN_PART, ESAC_SYMBOL);
    r.reduce(p, integer, head, INTEGER_IN_PART, INTEGER_OUT_PART);
    r.reduce(p, united, head, UNITED_IN_PART, OUT_PART, ESAC_SYMBOL);
    r.reduce(p, united, head, UNITED_IN_PART, ESAC_SYMBOL);
    r.reduce(p, united, head, UNITED_IN_PART, UNITED_OUSE_PART);
  }

  /**
   * Reduces a loop starting with any of its optional parts. The parts must appear in the order
   * FOR, FROM, BY, TO, WHILE and the loop must end in a DO part.
   */
  private void loopClause(Node p) {
    int first = -1;
    for (int i = 0; i < LOOP_PARTS.length; i++) {
      if (p.is(LOOP_PARTS[i])) {
        first = i;
      }
    }
    Node q = p;
    int k = first;
    while (q.next() != null && !q.next().is(ALT_DO_PART)) {
      Node next = q.next();
      int j = k + 1;
      while (j < LOOP_PARTS.length && !next.is(LOOP_PARTS[j])) {
        j++;
      }
      if (j == LOOP_PARTS.length) {
        return;
      }
      k = j;
      q = next;
    }
    if (q.next() != null) {
      p.makeSub(q.next(), LOOP_CLAUSE);
    }
  }
}
