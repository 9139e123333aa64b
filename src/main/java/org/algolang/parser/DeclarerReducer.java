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
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Reduces declarers: lengtheties, standard indicants, {@code REF}, {@code PROC}, {@code FLEX},
 * rows, and the packs of {@code STRUCT}, {@code UNION} and routine texts. Bold tags must already
 * have been classified as indicants or operators.
 */
final class DeclarerReducer {
  static final String EXPECTED = "%s expected";

  private final Reducer r;
  private final BottomUpParser parser;

  DeclarerReducer(Reducer r, BottomUpParser parser) {
    this.r = r;
    this.parser = parser;
  }

  void reduce(Node p, Attribute expect) {
    lengtheties(p);
    indicants(p);
    smallDeclarers(p);
    declarerLists(p);
    rowProcOpDeclarers(p);
    switch (expect) {
      case STRUCTURE_PACK -> structPack(p);
      case PARAMETER_PACK -> parameterPack(p);
      case FORMAL_DECLARERS -> formalDeclarerPack(p);
      case UNION_PACK -> unionPack(p);
      case SPECIFIER -> specifiers(p);
      default -> {
        for (Node q = p; q != null; q = q.next()) {
          if (q.whether(OPEN_SYMBOL, COLON_SYMBOL)
              && expect != GENERIC_ARGUMENT
              && expect != BOUNDS) {
            parser.reduceSubordinate(q, SPECIFIER);
          }
          if (q.whether(OPEN_SYMBOL, DECLARER, COLON_SYMBOL)
              || q.whether(OPEN_SYMBOL, VOID_SYMBOL, COLON_SYMBOL)) {
            parser.reduceSubordinate(q, PARAMETER_PACK);
          }
        }
      }
    }
  }

  private void lengtheties(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, LONGETY, LONG_SYMBOL);
      r.reduce(q, SHORTETY, SHORT_SYMBOL);
      boolean z = true;
      while (z) {
        z = r.reduce(q, LONGETY, LONGETY, LONG_SYMBOL);
        z |= r.reduce(q, SHORTETY, SHORTETY, SHORT_SYMBOL);
      }
    }
  }

  private static final Attribute[] STANDARD_INDICANTS = {
    INT_SYMBOL,
    REAL_SYMBOL,
    BITS_SYMBOL,
    BYTES_SYMBOL,
    COMPLEX_SYMBOL,
    COMPL_SYMBOL,
    BOOL_SYMBOL,
    CHAR_SYMBOL,
    FORMAT_SYMBOL,
    STRING_SYMBOL,
    FILE_SYMBOL,
    CHANNEL_SYMBOL,
    SEMA_SYMBOL,
    PIPE_SYMBOL
  };

  private void indicants(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      for (Attribute a : STANDARD_INDICANTS) {
        r.reduce(q, INDICANT, a);
      }
    }
  }

  /** Returns whether {@code indicant} may be lengthened or shortened, as in {@code LONG REAL}. */
  private static boolean isSizable(Node indicant) {
    Node s = indicant.sub();
    return s != null
        && s.isOneOf(
            INT_SYMBOL, REAL_SYMBOL, BITS_SYMBOL, BYTES_SYMBOL, COMPLEX_SYMBOL, COMPL_SYMBOL);
  }

  private void smallDeclarers(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      for (Attribute sizety : new Attribute[] {LONGETY, SHORTETY}) {
        if (q.whether(sizety, INDICANT)) {
          if (!isSizable(q.next())) {
            r.diagnostics.error(Severity.SYNTAX, q.next(), EXPECTED, "appropriate declarer");
          }
          r.reduce(q, DECLARER, sizety, INDICANT);
        }
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, DECLARER, INDICANT);
    }
  }

  /**
   * Returns whether a bracketed phrase consists only of bounds-like symbols, so that {@code
   * PROC (..)} or {@code (..) INT} must be read as bounds rather than as a pack of declarers.
   */
  static boolean isFormalBounds(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case OPEN_SYMBOL, CLOSE_SYMBOL, SUB_SYMBOL, BUS_SYMBOL, COMMA_SYMBOL, COLON_SYMBOL,
            DOTDOT_SYMBOL, INT_DENOTATION, IDENTIFIER, OPERATOR -> {
          if (!isFormalBounds(p.sub())) {
            return false;
          }
        }
        default -> {
          return false;
        }
      }
    }
    return true;
  }

  private void declarerLists(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      Node next = q.next();
      if (next == null || next.sub() == null) {
        continue;
      }
      switch (q.attribute()) {
        case STRUCT_SYMBOL -> {
          parser.reduceSubordinate(next, STRUCTURE_PACK);
          r.reduce(q, DECLARER, STRUCT_SYMBOL, STRUCTURE_PACK);
        }
        case UNION_SYMBOL -> {
          parser.reduceSubordinate(next, UNION_PACK);
          r.reduce(q, DECLARER, UNION_SYMBOL, UNION_PACK);
        }
        case PROC_SYMBOL, OP_SYMBOL -> {
          if (next.is(OPEN_SYMBOL) && !isFormalBounds(next.sub())) {
            parser.reduceSubordinate(next, FORMAL_DECLARERS);
          }
        }
        default -> {}
      }
    }
  }

  /** Reduces {@code [..] DECL} or {@code FLEX [..] DECL}, after reducing the bounds. */
  private boolean rowDeclarer(Node q, Node bounds, boolean flex) {
    parser.reduceSubordinate(bounds, BOUNDS);
    if (flex) {
      return r.reduce(q, DECLARER, FLEX_SYMBOL, BOUNDS, DECLARER)
          | r.reduce(q, DECLARER, FLEX_SYMBOL, FORMAL_BOUNDS, DECLARER);
    }
    return r.reduce(q, DECLARER, BOUNDS, DECLARER) | r.reduce(q, DECLARER, FORMAL_BOUNDS, DECLARER);
  }

  private void rowProcOpDeclarers(Node p) {
    boolean z = true;
    while (z) {
      z = false;
      for (Node q = p; q != null; q = q.next()) {
        z |= r.reduce(q, DECLARER, FLEX_SYMBOL, DECLARER);
        if (q.whether(FLEX_SYMBOL, SUB_SYMBOL, DECLARER) && q.next().sub() != null) {
          z |= rowDeclarer(q, q.next(), true);
        }
        if (q.whether(FLEX_SYMBOL, OPEN_SYMBOL, DECLARER)
            && q.next().sub() != null
            && !q.whether(FLEX_SYMBOL, OPEN_SYMBOL, DECLARER, COLON_SYMBOL)) {
          z |= rowDeclarer(q, q.next(), true);
        }
        if (q.whether(SUB_SYMBOL, DECLARER) && q.sub() != null) {
          z |= rowDeclarer(q, q, false);
        }
        if (q.whether(OPEN_SYMBOL, DECLARER) && q.sub() != null) {
          // In (INT i) () INT: the first pack is a parameter pack, the second one bounds.
          if (!q.whether(OPEN_SYMBOL, DECLARER, COLON_SYMBOL) || isFormalBounds(q.sub())) {
            z |= rowDeclarer(q, q, false);
          }
        }
      }
      for (Node q = p; q != null; q = q.next()) {
        switch (q.attribute()) {
          case REF_SYMBOL -> z |= r.reduce(q, DECLARER, REF_SYMBOL, DECLARER);
          case PROC_SYMBOL -> {
            z |= r.reduce(q, DECLARER, PROC_SYMBOL, DECLARER);
            z |= r.reduce(q, DECLARER, PROC_SYMBOL, FORMAL_DECLARERS, DECLARER);
            z |= r.reduce(q, DECLARER, PROC_SYMBOL, VOID_SYMBOL);
            z |= r.reduce(q, DECLARER, PROC_SYMBOL, FORMAL_DECLARERS, VOID_SYMBOL);
          }
          case OP_SYMBOL -> {
            z |= r.reduce(q, OPERATOR_PLAN, OP_SYMBOL, FORMAL_DECLARERS, DECLARER);
            z |= r.reduce(q, OPERATOR_PLAN, OP_SYMBOL, FORMAL_DECLARERS, VOID_SYMBOL);
          }
          default -> {}
        }
      }
    }
  }

  private void structPack(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, STRUCTURED_FIELD, DECLARER, IDENTIFIER);
        z |= r.reduce(q, STRUCTURED_FIELD, STRUCTURED_FIELD, COMMA_SYMBOL, IDENTIFIER);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, STRUCTURED_FIELD_LIST, STRUCTURED_FIELD);
        z |=
            r.reduce(
                q,
                STRUCTURED_FIELD_LIST,
                STRUCTURED_FIELD_LIST,
                COMMA_SYMBOL,
                STRUCTURED_FIELD);
        z |=
            r.reduce(
                q,
                r::missingSeparator,
                STRUCTURED_FIELD_LIST,
                STRUCTURED_FIELD_LIST,
                STRUCTURED_FIELD);
        z |=
            r.reduce(
                q,
                r::wrongSeparator,
                STRUCTURED_FIELD_LIST,
                STRUCTURED_FIELD_LIST,
                SEMI_SYMBOL,
                STRUCTURED_FIELD);
      }
    }
    r.reduce(p, STRUCTURE_PACK, OPEN_SYMBOL, STRUCTURED_FIELD_LIST, CLOSE_SYMBOL);
  }

  private void parameterPack(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, PARAMETER, DECLARER, IDENTIFIER);
        z |= r.reduce(q, PARAMETER, PARAMETER, COMMA_SYMBOL, IDENTIFIER);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, PARAMETER_LIST, PARAMETER);
        z |= r.reduce(q, PARAMETER_LIST, PARAMETER_LIST, COMMA_SYMBOL, PARAMETER);
      }
    }
    r.reduce(p, PARAMETER_PACK, OPEN_SYMBOL, PARAMETER_LIST, CLOSE_SYMBOL);
  }

  private void formalDeclarerPack(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, FORMAL_DECLARERS_LIST, DECLARER);
        z |= r.reduce(q, FORMAL_DECLARERS_LIST, FORMAL_DECLARERS_LIST, COMMA_SYMBOL, DECLARER);
        z |=
            r.reduce(
                q, r::missingSeparator, FORMAL_DECLARERS_LIST, FORMAL_DECLARERS_LIST, DECLARER);
      }
    }
    r.reduce(p, FORMAL_DECLARERS, OPEN_SYMBOL, FORMAL_DECLARERS_LIST, CLOSE_SYMBOL);
  }

  private void unionPack(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, UNION_DECLARER_LIST, DECLARER);
        z |= r.reduce(q, UNION_DECLARER_LIST, VOID_SYMBOL);
        z |= r.reduce(q, UNION_DECLARER_LIST, UNION_DECLARER_LIST, COMMA_SYMBOL, DECLARER);
        z |= r.reduce(q, UNION_DECLARER_LIST, UNION_DECLARER_LIST, COMMA_SYMBOL, VOID_SYMBOL);
        z |=
            r.reduce(q, r::missingSeparator, UNION_DECLARER_LIST, UNION_DECLARER_LIST, DECLARER);
        z |=
            r.reduce(
                q, r::missingSeparator, UNION_DECLARER_LIST, UNION_DECLARER_LIST, VOID_SYMBOL);
      }
    }
    r.reduce(p, UNION_PACK, OPEN_SYMBOL, UNION_DECLARER_LIST, CLOSE_SYMBOL);
  }

  private void specifiers(Node p) {
    r.reduce(p, SPECIFIER, OPEN_SYMBOL, DECLARER, IDENTIFIER, CLOSE_SYMBOL);
    r.reduce(p, SPECIFIER, OPEN_SYMBOL, DECLARER, CLOSE_SYMBOL);
    r.reduce(p, SPECIFIER, OPEN_SYMBOL, VOID_SYMBOL, CLOSE_SYMBOL);
  }
}
