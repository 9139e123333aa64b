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

import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Matcher;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Repairs phrases that did not reduce. A phrase that is left with more than one node is reported
 * once and then nested under its first node with the attribute the parser most likely expected,
 * so that the enclosing phrase can still reduce and does not produce a second diagnostic for the
 * same mistake.
 */
final class ErrorRecovery {
  static final String INVALID_SEQUENCE = "%s expected, not a sequence starting with \"%s\"";
  static final String SYNTAX_EXPECTED = "%s expected";

  private static final Matcher ANY = node -> true;

  private final Reducer r;

  ErrorRecovery(Reducer r) {
    this.r = r;
  }

  /**
   * Reports that {@code p} and its siblings did not reduce to {@code expect}, unless {@code
   * suppress}, and nests them under {@code p} with a plausible attribute.
   */
  void recover(@Nullable Node p, Attribute expect, boolean suppress) {
    if (p == null) {
      return;
    }
    if (!suppress) {
      if (expect == SOME_CLAUSE) {
        expect = ClauseReducer.serialOrCollateral(p);
      }
      r.diagnostics.error(
          Severity.SYNTAX, p, INVALID_SEQUENCE, expect.displayName(), p.phrase(4));
    }
    Attribute guess = guess(p, expect);
    if (guess != null) {
      p.makeSub(p.last(), guess);
    }
  }

  private static @Nullable Attribute guess(Node p, Attribute expect) {
    return switch (p.attribute()) {
      case BEGIN_SYMBOL, OPEN_SYMBOL ->
          switch (expect) {
            case ARGUMENT, COLLATERAL_CLAUSE, PARAMETER_PACK, STRUCTURE_PACK, UNION_PACK -> expect;
            case ENQUIRY_CLAUSE -> OPEN_PART;
            case FORMAL_DECLARERS -> FORMAL_DECLARERS;
            default -> CLOSED_CLAUSE;
          };
      case FORMAT_DELIMITER_SYMBOL -> (expect == FORMAT_TEXT) ? FORMAT_TEXT : otherwise(expect);
      case CODE_SYMBOL -> CODE_CLAUSE;
      case THEN_BAR_SYMBOL, CHOICE -> CHOICE;
      case IF_SYMBOL, IF_PART -> IF_PART;
      case THEN_SYMBOL, THEN_PART -> THEN_PART;
      case ELSE_SYMBOL, ELSE_PART -> ELSE_PART;
      case ELIF_SYMBOL, ELIF_IF_PART -> ELIF_IF_PART;
      case CASE_SYMBOL, CASE_PART -> CASE_PART;
      case OUT_SYMBOL, OUT_PART -> OUT_PART;
      case OUSE_SYMBOL, OUSE_CASE_PART -> OUSE_CASE_PART;
      case FOR_SYMBOL, FOR_PART -> FOR_PART;
      case FROM_SYMBOL, FROM_PART -> FROM_PART;
      case BY_SYMBOL, BY_PART -> BY_PART;
      case TO_SYMBOL, DOWNTO_SYMBOL, TO_PART -> TO_PART;
      case WHILE_SYMBOL, WHILE_PART -> WHILE_PART;
      case UNTIL_SYMBOL, UNTIL_PART -> UNTIL_PART;
      case DO_SYMBOL, DO_PART -> DO_PART;
      case ALT_DO_SYMBOL, ALT_DO_PART -> ALT_DO_PART;
      default -> otherwise(expect);
    };
  }

  private static @Nullable Attribute otherwise(Attribute expect) {
    return expect.isNonTerminal() ? expect : null;
  }

  /**
   * Reduces some common mistakes to units: selection from something that is not a secondary, and
   * identity relations whose operands are not tertiaries.
   */
  void erroneousUnits(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      if (q.whether(SELECTOR, not(SECONDARY))) {
        r.diagnostics.error(Severity.SYNTAX, q.next(), SYNTAX_EXPECTED, SECONDARY.displayName());
        r.reduce(q, UNIT, SELECTOR, WILDCARD);
      }
      for (Attribute relation : new Attribute[] {IS_SYMBOL, ISNT_SYMBOL}) {
        if (q.whether(ANY, relation, ANY) && !q.whether(TERTIARY, relation, TERTIARY)) {
          r.diagnostics.error(Severity.SYNTAX, q.next(), SYNTAX_EXPECTED, TERTIARY.displayName());
          r.reduce(q, UNIT, WILDCARD, relation, WILDCARD);
        }
      }
    }
  }
}
