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
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Checks that declarers have the right kind of bounds for where they occur. Generators, variable
 * and mode declarations need actual bounds ({@code [1:n]}); parameters, casts, identity
 * declarations and routine yields need formal ones ({@code []}); the declarer after REF is virtual
 * and may not have bounds at all.
 */
public final class VictalChecker {
  private enum Victal {
    ACTUAL,
    FORMAL,
    VIRTUAL
  }

  private static final String EXPECTED = "%s expected";

  private final Diagnostics diagnostics;

  private VictalChecker(Session session) {
    this.diagnostics = session.diagnostics();
  }

  public static void check(Session session, @Nullable Node p) {
    new VictalChecker(session).checkTree(p);
  }

  private void expected(Node p, String what) {
    diagnostics.error(Severity.SYNTAX, p, EXPECTED, what);
  }

  private boolean checkDeclarer(@Nullable Node p, Victal x) {
    if (p == null) {
      return false;
    }
    switch (p.attribute()) {
      case DECLARER:
        return checkDeclarer(p.sub(), x);
      case LONGETY, SHORTETY, VOID_SYMBOL, INDICANT:
        return true;
      case REF_SYMBOL:
        return checkDeclarer(p.next(), Victal.VIRTUAL);
      case FLEX_SYMBOL:
        return checkDeclarer(p.next(), x);
      case BOUNDS:
        checkTree(p.sub());
        if (x == Victal.FORMAL) {
          expected(p, "formal bounds");
          checkDeclarer(p.next(), x);
          return true;
        } else if (x == Victal.VIRTUAL) {
          expected(p, "virtual bounds");
          checkDeclarer(p.next(), x);
          return true;
        }
        return checkDeclarer(p.next(), x);
      case FORMAL_BOUNDS:
        checkTree(p.sub());
        if (x == Victal.ACTUAL) {
          expected(p, "actual bounds");
          checkDeclarer(p.next(), x);
          return true;
        }
        return checkDeclarer(p.next(), x);
      case STRUCT_SYMBOL:
        return checkStructurePack(p.next(), x);
      case UNION_SYMBOL:
        if (!checkUnionPack(p.next(), Victal.FORMAL)) {
          expected(p, "formal declarer pack");
        }
        return true;
      case PROC_SYMBOL:
        Node q = p.next();
        if (q != null && q.is(FORMAL_DECLARERS)) {
          if (!checkFormalPack(q.sub(), Victal.FORMAL)) {
            expected(q, "formal declarer");
          }
          q = q.next();
        }
        if (!checkDeclarer(q, Victal.FORMAL)) {
          expected(p, "formal declarer");
        }
        return true;
      default:
        return false;
    }
  }

  private boolean checkFormalPack(@Nullable Node p, Victal x) {
    boolean z = true;
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FORMAL_DECLARERS, FORMAL_DECLARERS_LIST -> z &= checkFormalPack(p.sub(), x);
        case OPEN_SYMBOL, CLOSE_SYMBOL, COMMA_SYMBOL -> {}
        case DECLARER -> z &= checkDeclarer(p.sub(), x);
        default -> {}
      }
    }
    return z;
  }

  private boolean checkRoutinePack(@Nullable Node p, Victal x) {
    boolean z = true;
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case PARAMETER_PACK, PARAMETER_LIST, PARAMETER -> z &= checkRoutinePack(p.sub(), x);
        case DECLARER -> z &= checkDeclarer(p.sub(), x);
        default -> {}
      }
    }
    return z;
  }

  private boolean checkStructurePack(@Nullable Node p, Victal x) {
    boolean z = true;
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case STRUCTURE_PACK, STRUCTURED_FIELD_LIST, STRUCTURED_FIELD ->
            z &= checkStructurePack(p.sub(), x);
        case DECLARER -> z &= checkDeclarer(p.sub(), x);
        default -> {}
      }
    }
    return z;
  }

  private boolean checkUnionPack(@Nullable Node p, Victal x) {
    boolean z = true;
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case UNION_PACK, UNION_DECLARER_LIST -> z &= checkUnionPack(p.sub(), x);
        case DECLARER -> z &= checkDeclarer(p.sub(), Victal.FORMAL);
        default -> {}
      }
    }
    return z;
  }

  private void checkTree(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case MODE_DECLARATION, VARIABLE_DECLARATION -> {
          checkTree(p.sub());
          Node declarer = p.child(DECLARER);
          if (declarer != null && !checkDeclarer(declarer, Victal.ACTUAL)) {
            expected(declarer, "actual declarer");
          }
        }
        case IDENTITY_DECLARATION -> {
          checkTree(p.sub());
          Node declarer = p.child(DECLARER);
          if (declarer != null && !checkDeclarer(declarer, Victal.FORMAL)) {
            expected(declarer, "formal declarer");
          }
        }
        case GENERATOR -> {
          if (!checkDeclarer(p.sub().next(), Victal.ACTUAL)) {
            expected(p, "actual declarer");
          }
        }
        case ROUTINE_TEXT -> {
          Node q = p.sub();
          if (q.is(PARAMETER_PACK)) {
            if (!checkRoutinePack(q.sub(), Victal.FORMAL)) {
              expected(q, "formal declarers");
            }
            q = q.next();
          }
          if (!checkDeclarer(q, Victal.FORMAL)) {
            expected(q, "formal declarer");
          }
          checkTree(q.next());
        }
        case OPERATOR_PLAN -> {
          Node q = p.sub().next();
          if (q != null && q.is(FORMAL_DECLARERS)) {
            if (!checkFormalPack(q.sub(), Victal.FORMAL)) {
              expected(q, "formal declarers");
            }
            q = q.next();
          }
          if (!checkDeclarer(q, Victal.FORMAL)) {
            expected(p, "formal declarer");
          }
        }
        case CAST -> {
          Node q = p.sub();
          if (!checkDeclarer(q, Victal.FORMAL)) {
            expected(q, "formal declarer");
          }
          checkTree(q.next());
        }
        // Declarers are checked where they occur, with the right victality.
        case DECLARER -> {}
        default -> checkTree(p.sub());
      }
    }
  }
}
