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
 * Reduces the items of a format text to pictures: frames, moulds and patterns, then picture lists.
 * Each family is reduced over the whole phrase before the next one starts, since the larger
 * patterns are built from the smaller ones.
 */
final class FormatReducer {
  static final String COMMA_MUST_SEPARATE = "a comma must separate %s and %s";

  private final Reducer r;

  FormatReducer(Reducer r) {
    this.r = r;
  }

  void reduce(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, REPLICATOR, STATIC_REPLICATOR);
      r.reduce(q, REPLICATOR, DYNAMIC_REPLICATOR);
    }
    cPatterns(p);
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, RADIX_FRAME, REPLICATOR, FORMAT_ITEM_R);
    }
    insertions(p);
    frames(p);
    stringPatterns(p);
    moulds(p);
    realPatterns(p);
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, COMPLEX_PATTERN, REAL_PATTERN, FORMAT_I_FRAME, REAL_PATTERN);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, BITS_PATTERN, RADIX_FRAME, INTEGRAL_MOULD);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, INTEGRAL_PATTERN, SIGN_MOULD, INTEGRAL_MOULD);
      r.reduce(q, INTEGRAL_PATTERN, INTEGRAL_MOULD);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, BOOLEAN_PATTERN, FORMAT_ITEM_B, COLLECTION);
      r.reduce(q, CHOICE_PATTERN, FORMAT_ITEM_C, COLLECTION);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, BOOLEAN_PATTERN, FORMAT_ITEM_B);
      r.reduce(q, GENERAL_PATTERN, FORMAT_ITEM_G);
    }
    ambiguousPatterns(p);
    for (Node q = p; q != null; q = q.next()) {
      for (Attribute a : PATTERNS) {
        r.reduce(q, PATTERN, a);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, PICTURE, INSERTION);
      r.reduce(q, PICTURE, PATTERN);
      r.reduce(q, PICTURE, COLLECTION);
      r.reduce(q, PICTURE, REPLICATOR, COLLECTION);
    }
    for (Node q = p; q != null; q = q.next()) {
      if (q.is(PICTURE)) {
        r.reduce(q, PICTURE_LIST, PICTURE);
        boolean z = true;
        while (z) {
          z = r.reduce(q, PICTURE_LIST, PICTURE_LIST, COMMA_SYMBOL, PICTURE);
          // Ambiguous patterns were rejected above, so the comma may be omitted.
          z |= r.reduce(q, PICTURE_LIST, PICTURE_LIST, PICTURE);
        }
      }
    }
  }

  private static final Attribute[] PATTERNS = {
    GENERAL_PATTERN,
    INTEGRAL_PATTERN,
    REAL_PATTERN,
    COMPLEX_PATTERN,
    BITS_PATTERN,
    STRING_PATTERN,
    BOOLEAN_PATTERN,
    CHOICE_PATTERN,
    FORMAT_PATTERN,
    STRING_C_PATTERN,
    INTEGRAL_C_PATTERN,
    FIXED_C_PATTERN,
    FLOAT_C_PATTERN
  };

  /** C-style patterns such as {@code %5d}, {@code %-8.3f} and {@code %s}. */
  private void cPatterns(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, STRING_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_S);
      r.reduce(q, STRING_C_PATTERN, FORMAT_ITEM_ESCAPE, REPLICATOR, FORMAT_ITEM_S);
      r.reduce(
          q, STRING_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_PLUS, REPLICATOR, FORMAT_ITEM_S);
      r.reduce(
          q, STRING_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_MINUS, REPLICATOR, FORMAT_ITEM_S);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, INTEGRAL_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_D);
      r.reduce(q, INTEGRAL_C_PATTERN, FORMAT_ITEM_ESCAPE, REPLICATOR, FORMAT_ITEM_D);
      r.reduce(q, INTEGRAL_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_PLUS, FORMAT_ITEM_D);
      r.reduce(
          q, INTEGRAL_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_PLUS, REPLICATOR, FORMAT_ITEM_D);
      r.reduce(q, INTEGRAL_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_MINUS, FORMAT_ITEM_D);
      r.reduce(
          q, INTEGRAL_C_PATTERN, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_MINUS, REPLICATOR, FORMAT_ITEM_D);
    }
    for (Node q = p; q != null; q = q.next()) {
      realCPattern(q, FIXED_C_PATTERN, FORMAT_ITEM_F);
    }
    for (Node q = p; q != null; q = q.next()) {
      realCPattern(q, FLOAT_C_PATTERN, FORMAT_ITEM_E);
    }
  }

  /**
   * Reduces {@code % [sign] [width] [. precision] letter}. The unsigned forms are tried first, then
   * those with a {@code +} and with a {@code -} flag.
   */
  private void realCPattern(Node q, Attribute result, Attribute letter) {
    r.reduce(q, result, FORMAT_ITEM_ESCAPE, letter);
    r.reduce(q, result, FORMAT_ITEM_ESCAPE, REPLICATOR, letter);
    r.reduce(q, result, FORMAT_ITEM_ESCAPE, FORMAT_ITEM_POINT, REPLICATOR, letter);
    r.reduce(q, result, FORMAT_ITEM_ESCAPE, REPLICATOR, FORMAT_ITEM_POINT, REPLICATOR, letter);
    for (Attribute sign : new Attribute[] {FORMAT_ITEM_PLUS, FORMAT_ITEM_MINUS}) {
      r.reduce(q, result, FORMAT_ITEM_ESCAPE, sign, REPLICATOR, letter);
      r.reduce(q, result, FORMAT_ITEM_ESCAPE, sign, letter);
      r.reduce(q, result, FORMAT_ITEM_ESCAPE, sign, FORMAT_ITEM_POINT, REPLICATOR, letter);
      r.reduce(
          q, result, FORMAT_ITEM_ESCAPE, sign, REPLICATOR, FORMAT_ITEM_POINT, REPLICATOR, letter);
    }
  }

  private void insertions(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, INSERTION, FORMAT_ITEM_X);
      r.reduce(q, r::notSupported, INSERTION, FORMAT_ITEM_Y);
      r.reduce(q, INSERTION, FORMAT_ITEM_L);
      r.reduce(q, INSERTION, FORMAT_ITEM_P);
      r.reduce(q, INSERTION, FORMAT_ITEM_Q);
      r.reduce(q, INSERTION, FORMAT_ITEM_K);
      r.reduce(q, INSERTION, LITERAL);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, INSERTION, REPLICATOR, INSERTION);
    }
    for (Node q = p; q != null; q = q.next()) {
      while (r.reduce(q, INSERTION, INSERTION, INSERTION)) {}
    }
  }

  private void frames(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, FORMAT_A_FRAME, REPLICATOR, FORMAT_ITEM_S, FORMAT_ITEM_A);
      r.reduce(q, FORMAT_Z_FRAME, REPLICATOR, FORMAT_ITEM_S, FORMAT_ITEM_Z);
      r.reduce(q, FORMAT_D_FRAME, REPLICATOR, FORMAT_ITEM_S, FORMAT_ITEM_D);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, FORMAT_A_FRAME, FORMAT_ITEM_S, FORMAT_ITEM_A);
      r.reduce(q, FORMAT_Z_FRAME, FORMAT_ITEM_S, FORMAT_ITEM_Z);
      r.reduce(q, FORMAT_D_FRAME, FORMAT_ITEM_S, FORMAT_ITEM_D);
      r.reduce(q, FORMAT_E_FRAME, FORMAT_ITEM_S, FORMAT_ITEM_E);
      r.reduce(q, FORMAT_POINT_FRAME, FORMAT_ITEM_S, FORMAT_ITEM_POINT);
      r.reduce(q, FORMAT_I_FRAME, FORMAT_ITEM_S, FORMAT_ITEM_I);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, FORMAT_A_FRAME, REPLICATOR, FORMAT_ITEM_A);
      r.reduce(q, FORMAT_Z_FRAME, REPLICATOR, FORMAT_ITEM_Z);
      r.reduce(q, FORMAT_D_FRAME, REPLICATOR, FORMAT_ITEM_D);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, FORMAT_A_FRAME, FORMAT_ITEM_A);
      r.reduce(q, FORMAT_Z_FRAME, FORMAT_ITEM_Z);
      r.reduce(q, FORMAT_D_FRAME, FORMAT_ITEM_D);
      r.reduce(q, FORMAT_E_FRAME, FORMAT_ITEM_E);
      r.reduce(q, FORMAT_POINT_FRAME, FORMAT_ITEM_POINT);
      r.reduce(q, FORMAT_I_FRAME, FORMAT_ITEM_I);
    }
    for (Node q = p; q != null; q = q.next()) {
      for (Attribute frame :
          new Attribute[] {
            FORMAT_A_FRAME,
            FORMAT_Z_FRAME,
            FORMAT_D_FRAME,
            FORMAT_E_FRAME,
            FORMAT_POINT_FRAME,
            FORMAT_I_FRAME
          }) {
        r.reduce(q, frame, INSERTION, frame);
      }
    }
  }

  private void stringPatterns(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, STRING_PATTERN, REPLICATOR, FORMAT_A_FRAME);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, STRING_PATTERN, FORMAT_A_FRAME);
    }
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, STRING_PATTERN, STRING_PATTERN, STRING_PATTERN);
        z |= r.reduce(q, STRING_PATTERN, STRING_PATTERN, INSERTION, STRING_PATTERN);
      }
    }
  }

  /** Integral moulds, sign moulds and exponent frames. */
  private void moulds(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, INTEGRAL_MOULD, FORMAT_Z_FRAME);
      r.reduce(q, INTEGRAL_MOULD, FORMAT_D_FRAME);
    }
    for (Node q = p; q != null; q = q.next()) {
      boolean z = true;
      while (z) {
        z = r.reduce(q, INTEGRAL_MOULD, INTEGRAL_MOULD, INTEGRAL_MOULD);
        z |= r.reduce(q, INTEGRAL_MOULD, INTEGRAL_MOULD, INSERTION);
      }
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, SIGN_MOULD, INTEGRAL_MOULD, FORMAT_ITEM_PLUS);
      r.reduce(q, SIGN_MOULD, INTEGRAL_MOULD, FORMAT_ITEM_MINUS);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, SIGN_MOULD, FORMAT_ITEM_PLUS);
      r.reduce(q, SIGN_MOULD, FORMAT_ITEM_MINUS);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, EXPONENT_FRAME, FORMAT_E_FRAME, SIGN_MOULD, INTEGRAL_MOULD);
      r.reduce(q, EXPONENT_FRAME, FORMAT_E_FRAME, INTEGRAL_MOULD);
    }
  }

  private void realPatterns(Node p) {
    for (Node q = p; q != null; q = q.next()) {
      fraction(q, SIGN_MOULD, INTEGRAL_MOULD);
    }
    for (Node q = p; q != null; q = q.next()) {
      fraction(q, SIGN_MOULD);
    }
    for (Node q = p; q != null; q = q.next()) {
      fraction(q, INTEGRAL_MOULD);
      r.reduce(q, REAL_PATTERN, FORMAT_POINT_FRAME, INTEGRAL_MOULD, EXPONENT_FRAME);
      r.reduce(q, REAL_PATTERN, FORMAT_POINT_FRAME, INTEGRAL_MOULD);
    }
    for (Node q = p; q != null; q = q.next()) {
      r.reduce(q, REAL_PATTERN, SIGN_MOULD, INTEGRAL_MOULD, EXPONENT_FRAME);
      r.reduce(q, REAL_PATTERN, INTEGRAL_MOULD, EXPONENT_FRAME);
    }
  }

  /** Reduces {@code prefix . [digits] [exponent]}, longest alternative first. */
  private void fraction(Node q, Attribute... prefix) {
    r.reduce(q, REAL_PATTERN, concat(prefix, FORMAT_POINT_FRAME, INTEGRAL_MOULD, EXPONENT_FRAME));
    r.reduce(q, REAL_PATTERN, concat(prefix, FORMAT_POINT_FRAME, INTEGRAL_MOULD));
    r.reduce(q, REAL_PATTERN, concat(prefix, FORMAT_POINT_FRAME, EXPONENT_FRAME));
    r.reduce(q, REAL_PATTERN, concat(prefix, FORMAT_POINT_FRAME));
  }

  private static Attribute[] concat(Attribute[] prefix, Attribute... rest) {
    Attribute[] result = new Attribute[prefix.length + rest.length];
    System.arraycopy(prefix, 0, result, 0, prefix.length);
    System.arraycopy(rest, 0, result, prefix.length, rest.length);
    return result;
  }

  /**
   * Integral, real, complex and bits patterns that follow each other without a comma could be read
   * in more than one way, e.g. {@code +d.2d +d.2d}; such neighbours must be separated.
   */
  private void ambiguousPatterns(Node p) {
    @Nullable Node last = null;
    for (Node q = p; q != null; q = q.next()) {
      switch (q.attribute()) {
        case INTEGRAL_PATTERN, REAL_PATTERN, COMPLEX_PATTERN, BITS_PATTERN -> {
          if (last != null) {
            r.diagnostics.error(
                Severity.SYNTAX,
                q,
                COMMA_MUST_SEPARATE,
                last.attribute().displayName(),
                q.attribute().displayName());
          }
          last = q;
        }
        case COMMA_SYMBOL -> last = null;
        default -> {}
      }
    }
  }
}
