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

package org.algolang.scope;

import static org.algolang.tree.Attribute.*;

import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.algolang.Session;
import org.algolang.diag.DepthGuard;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeKind;
import org.algolang.mode.ModeTable;
import org.algolang.taxes.SymbolTable;
import org.algolang.taxes.Tag;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static scope checker.
 *
 * <p>While walking a unit the checker collects, for each constituent that can deliver a name or a
 * routine, the lexical level that value could have come from. Wherever such a value is stored
 * (assignation, identity and variable declarations, argument passing, the yield of a routine text)
 * a level deeper than the destination's is reported, as is any transient name: a name referring
 * into a flexible row, which does not survive a later assignation to that row.
 *
 * <p>Routine and format texts are first given a "youngest environment", the deepest level of any
 * free identifier, operator or row-bearing indicant they use. A procedure or format declared from
 * such a text inherits that level, so a use of the declared identifier is checked without walking
 * the text again.
 *
 * <p>A variable also remembers the deepest level of any name assigned to it, so that dereferencing
 * it reports {@code REF INT x := LOC INT; x} yielded out of the range of the generator.
 */
public final class ScopeChecker {
  private static final Logger logger = LoggerFactory.getLogger(ScopeChecker.class);

  static final String TRANSIENT_NAME = "attempt at storing a transient name";
  static final String EXPORTED = "value from %s could be exported out of its scope";
  static final String EXPORTED_MODE = "%s value from %s could be exported out of its scope";
  static final String UNINITIALISED = "identifier %s might be used before being initialised";

  /** A level paired with whether the value is a transient name. */
  private record Tuple(int level, boolean isTransient) {
    static final Tuple PRIMAL = new Tuple(SymbolTable.PRIMAL_SCOPE, false);
  }

  private record Scope(Node where, Tuple tuple) {}

  private final Diagnostics diagnostics;
  private final DepthGuard guard;
  private final ModeTable modes;
  /** Nodes already reported; a construct gets at most one scope diagnostic. */
  private final Set<Node> reported = Sets.newIdentityHashSet();

  private ScopeChecker(Session session) {
    this.diagnostics = session.diagnostics();
    this.guard = session.depthGuard();
    this.modes = session.modes();
  }

  /** Checks program {@code p}, in which coercions have been inserted. */
  public static void check(Session session, Node p) {
    ScopeChecker checker = new ScopeChecker(session);
    checker.youngestEnvirons(p);
    checker.bindScopeToTags(p);
    Node clause = p.is(PARTICULAR_PROGRAM) ? p.child(ENCLOSED_CLAUSE) : p;
    if (clause != null) {
      checker.enclosed(clause, null);
    }
    logger.debug("{} scope diagnostics", checker.reported.size());
  }

  private static int level(Node p) {
    return p.table().level();
  }

  private static int level(Tag t) {
    return t.table().level();
  }

  private static void add(@Nullable List<Scope> s, Node p, Tuple t) {
    if (s != null) {
      s.add(new Scope(p, t));
    }
  }

  private static void add(@Nullable List<Scope> s, Node p, int level) {
    add(s, p, new Tuple(level, false));
  }

  /** Reports the values in {@code s} younger than level {@code dest}. */
  private void check(List<Scope> s, boolean transients, int dest) {
    if (transients) {
      for (Scope e : s) {
        if (e.tuple().isTransient()) {
          diagnostics.error(Severity.SEMANTIC, e.where(), TRANSIENT_NAME);
          reported.add(e.where());
        }
      }
    }
    for (Scope e : s) {
      if (dest < e.tuple().level() && !reported.contains(e.where())) {
        Node where = e.where();
        String what = where.attribute().displayName();
        if (where.mode() == null) {
          diagnostics.error(Severity.SEMANTIC, where, EXPORTED, what);
        } else {
          diagnostics.error(Severity.SEMANTIC, where, EXPORTED_MODE, where.mode(), what);
        }
        reported.add(where);
      }
    }
  }

  private void checkAll(List<Scope> s, boolean transients, List<Scope> destinations) {
    for (Scope d : destinations) {
      check(s, transients, d.tuple().level());
    }
  }

  private static Tuple youngestOutside(List<Scope> s, int threshold) {
    Tuple z = Tuple.PRIMAL;
    for (Scope e : s) {
      if (e.tuple().level() > z.level() && e.tuple().level() <= threshold) {
        z = e.tuple();
      }
    }
    return z;
  }

  private static Tuple youngest(List<Scope> s) {
    return youngestOutside(s, Integer.MAX_VALUE);
  }

  private void checkIdentifierUsage(Tag t, Node unit) {
    if (unit.is(IDENTIFIER) && unit.tag() == t && !t.mode().is(ModeKind.PROC)) {
      diagnostics.warning(unit, UNINITIALISED, unit.symbol());
    }
    for (Node q = unit.sub(); q != null; q = q.next()) {
      checkIdentifierUsage(t, q);
    }
  }

  // Youngest environments of routine and format texts.

  private void declarerElements(@Nullable Node p, List<Scope> r, boolean noRef) {
    if (p == null) {
      return;
    }
    switch (p.attribute()) {
      case BOUNDS -> gatherForYoungest(p.sub(), r);
      case INDICANT -> {
        Mode m = p.mode();
        if (m != null && p.tag() != null && m.hasRows() && noRef) {
          add(r, p, level(p.tag()));
        }
      }
      case REF_SYMBOL -> declarerElements(p.next(), r, false);
      case PROC_SYMBOL, UNION_SYMBOL -> {}
      default -> {
        declarerElements(p.sub(), r, noRef);
        declarerElements(p.next(), r, noRef);
      }
    }
  }

  private void gatherForYoungest(@Nullable Node p, List<Scope> s) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(ROUTINE_TEXT, FORMAT_TEXT)
          && p.tag() != null
          && p.tag().youngestEnviron() == SymbolTable.PRIMAL_SCOPE) {
        List<Scope> t = new ArrayList<>();
        gatherForYoungest(p.sub(), t);
        p.tag().setYoungestEnviron(youngestOutside(t, level(p)).level());
        s.addAll(t);
      } else if (p.isOneOf(IDENTIFIER, OPERATOR)) {
        Tag t = p.tag();
        if (t != null && level(t) != SymbolTable.PRIMAL_SCOPE) {
          add(s, p, level(t));
        }
      } else if (p.is(DECLARER)) {
        declarerElements(p.sub(), s, true);
      } else {
        gatherForYoungest(p.sub(), s);
      }
    }
  }

  private void youngestEnvirons(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(ROUTINE_TEXT, FORMAT_TEXT) && p.tag() != null) {
        List<Scope> s = new ArrayList<>();
        gatherForYoungest(p.sub(), s);
        p.tag().setYoungestEnviron(youngestOutside(s, level(p)).level());
      } else {
        youngestEnvirons(p.sub());
      }
    }
  }

  private static Node unwrap(Node p) {
    while (p.isOneOf(UNIT, TERTIARY, SECONDARY, PRIMARY) && p.sub() != null) {
      p = p.sub();
    }
    return p;
  }

  private void bindScopeToTag(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(DEFINING_IDENTIFIER)) {
        Node source = p.next(2);
        Tag t = p.tag();
        if (source != null && t != null) {
          Node text = unwrap(source);
          boolean bound =
              (p.mode() == modes.format) ? text.is(FORMAT_TEXT) : text.is(ROUTINE_TEXT);
          if (bound && text.tag() != null) {
            t.assignScope(text.tag().youngestEnviron());
          }
        }
        return;
      }
      bindScopeToTag(p.sub());
    }
  }

  private void bindScopeToTags(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(PROCEDURE_DECLARATION, IDENTITY_DECLARATION)) {
        bindScopeToTag(p.sub());
      } else {
        bindScopeToTags(p.sub());
      }
    }
  }

  // Declarations.

  private void bounds(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT)) {
        statement(p, null);
      } else {
        bounds(p.sub());
      }
    }
  }

  private void declarer(@Nullable Node p) {
    if (p == null) {
      return;
    }
    switch (p.attribute()) {
      case BOUNDS -> bounds(p.sub());
      case INDICANT, PROC_SYMBOL, UNION_SYMBOL -> {}
      case REF_SYMBOL -> declarer(p.next());
      default -> {
        declarer(p.sub());
        declarer(p.next());
      }
    }
  }

  private void identityDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case DECLARER -> {}
        case DEFINING_IDENTIFIER -> {
          Node unit = p.next(2);
          Tag t = p.tag();
          List<Scope> s = new ArrayList<>();
          if (t != null && t.mode() != null && !t.mode().is(ModeKind.PROC)) {
            checkIdentifierUsage(t, unit);
          }
          statement(unit, s);
          check(s, true, level(p));
          int z = youngest(s).level();
          if (t != null && z < level(p)) {
            t.assignScope(z);
          }
          return;
        }
        default -> identityDeclaration(p.sub());
      }
    }
  }

  private void variableDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case DECLARER -> declarer(p.sub());
        case DEFINING_IDENTIFIER -> {
          if (p.whether(DEFINING_IDENTIFIER, ASSIGN_SYMBOL, UNIT)) {
            Node unit = p.next(2);
            Tag t = p.tag();
            List<Scope> s = new ArrayList<>();
            if (t != null && t.mode() != null) {
              checkIdentifierUsage(t, unit);
            }
            statement(unit, s);
            check(s, true, level(p));
            if (t != null) {
              t.noteContentScope(youngest(s).level());
            }
          }
          return;
        }
        default -> variableDeclaration(p.sub());
      }
    }
  }

  private void procDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(DEFINING_IDENTIFIER, DEFINING_OPERATOR)) {
        List<Scope> s = new ArrayList<>();
        statement(p.next(2), s);
        check(s, false, level(p));
        return;
      }
      procDeclaration(p.sub());
    }
  }

  private void declarationList(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case IDENTITY_DECLARATION -> identityDeclaration(p.sub());
        case VARIABLE_DECLARATION -> variableDeclaration(p.sub());
        case MODE_DECLARATION -> declarer(p.sub());
        case PRIORITY_DECLARATION -> {}
        case PROCEDURE_DECLARATION,
            PROCEDURE_VARIABLE_DECLARATION,
            BRIEF_OPERATOR_DECLARATION,
            OPERATOR_DECLARATION -> procDeclaration(p.sub());
        default -> declarationList(p.sub());
      }
    }
  }

  private void arguments(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT)) {
        List<Scope> s = new ArrayList<>();
        statement(p, s);
        check(s, true, level(p));
      } else {
        arguments(p.sub());
      }
    }
  }

  // Units.

  private static boolean isCoercion(@Nullable Node p) {
    return p != null
        && p.isOneOf(
            DEPROCEDURING, DEREFERENCING, UNITING, ROWING, WIDENING, VOIDING, PROCEDURING);
  }

  /** A name referring into a flexible row. */
  private static boolean isTransientRow(Mode m) {
    return m.isRef() && m.sub().isFlex();
  }

  private static boolean isTransientSelection(Mode m) {
    while (m.isRef()) {
      m = m.sub();
    }
    return m.isFlex();
  }

  private void coercion(Node p, @Nullable List<Scope> s) {
    if (!isCoercion(p)) {
      statement(p, s);
      return;
    }
    switch (p.attribute()) {
      case VOIDING, DEPROCEDURING -> coercion(p.sub(), null);
      case DEREFERENCING -> {
        coercion(p.sub(), null);
        Node q = unwrap(p.sub());
        Tag t = q.tag();
        if (q.is(IDENTIFIER) && t != null && t.contentAssigned() && p.mode().isRef()) {
          add(s, p, t.contentScope());
        }
      }
      case ROWING -> {
        coercion(p.sub(), s);
        if (isTransientRow(p.sub().mode())) {
          add(s, p, new Tuple(level(p), true));
        }
      }
      case PROCEDURING -> {
        Node q = p.sub().sub();
        if (q.is(GOTO_SYMBOL)) {
          q = q.next();
        }
        if (q.tag() != null) {
          add(s, q, level(q.tag()));
        }
      }
      default -> coercion(p.sub(), s);
    }
  }

  private void statement(@Nullable Node p, @Nullable List<Scope> s) {
    if (p == null) {
      return;
    }
    guard.enter(p);
    try {
      scopeOf(p, s);
    } finally {
      guard.exit();
    }
  }

  private void scopeOf(Node p, @Nullable List<Scope> s) {
    if (isCoercion(p)) {
      coercion(p, s);
      return;
    }
    switch (p.attribute()) {
      case PRIMARY, SECONDARY, TERTIARY, UNIT -> statement(p.sub(), s);
      case DENOTATION, NIHIL -> add(s, p, Tuple.PRIMAL);
      case IDENTIFIER -> identifier(p, s);
      case ENCLOSED_CLAUSE -> enclosed(p.sub(), s);
      case CALL -> {
        List<Scope> x = new ArrayList<>();
        statement(p.sub(), x);
        check(x, false, level(p));
        arguments(p.sub().next());
      }
      case SLICE -> slice(p, s);
      case FORMAT_TEXT -> {
        List<Scope> x = new ArrayList<>();
        formatText(p.sub(), x);
        add(s, p, youngest(x));
      }
      case CAST -> {
        List<Scope> x = new ArrayList<>();
        enclosed(p.sub().next(), x);
        check(x, false, level(p));
        add(s, p, youngest(x));
      }
      case SELECTION -> {
        Node secondary = p.sub().next();
        List<Scope> x = new ArrayList<>();
        statement(secondary, x);
        check(x, false, level(p));
        if (isTransientSelection(secondary.mode())) {
          add(s, p, new Tuple(level(p), true));
        }
        add(s, p, youngest(x));
      }
      case GENERATOR -> {
        add(s, p, p.sub().is(LOC_SYMBOL) ? level(p) : SymbolTable.PRIMAL_SCOPE);
        declarer(p.sub().next().sub());
      }
      case FORMULA -> formula(p);
      case ASSIGNATION -> assignation(p, s);
      case ROUTINE_TEXT -> routineText(p, s);
      case IDENTITY_RELATION, AND_FUNCTION, OR_FUNCTION -> {
        List<Scope> n = new ArrayList<>();
        statement(p.sub(), n);
        statement(p.sub().next(2), n);
        check(n, false, level(p));
      }
      case ASSERTION -> {
        List<Scope> n = new ArrayList<>();
        enclosed(p.sub().next(), n);
        check(n, false, level(p));
      }
      default -> {}
    }
  }

  private void identifier(Node p, @Nullable List<Scope> s) {
    Tag t = p.tag();
    Mode m = p.mode();
    if (t == null || m == null) {
      return;
    }
    if (m.isRef()) {
      if (t.origin() == Tag.Origin.PARAMETER) {
        add(s, p, level(t) - 1);
      } else if (t.heap()) {
        add(s, p, Tuple.PRIMAL);
      } else if (t.scopeAssigned()) {
        add(s, p, t.scope());
      } else {
        add(s, p, level(t));
      }
    } else if ((m.is(ModeKind.PROC) || m == modes.format) && t.scopeAssigned()) {
      add(s, p, t.scope());
    }
  }

  private void slice(Node p, @Nullable List<Scope> s) {
    Node primary = p.sub();
    List<Scope> x = new ArrayList<>();
    Mode m = primary.mode();
    if (m.isRef()) {
      if (primary.is(PRIMARY) && primary.sub().is(SLICE)) {
        statement(primary, s);
      } else {
        statement(primary, x);
        check(x, false, level(p));
      }
      if (m.sub().isFlex()) {
        add(s, primary, new Tuple(level(p), true));
      }
      bounds(primary.next().sub());
    }
    if (p.mode().isRef()) {
      add(s, p, youngest(x));
    }
  }

  private void assignation(Node p, @Nullable List<Scope> s) {
    Node destination = p.sub();
    Node source = destination.next(2);
    List<Scope> ns = new ArrayList<>();
    List<Scope> nd = new ArrayList<>();
    statement(destination.sub(), nd);
    statement(source, ns);
    checkAll(ns, true, nd);
    Node q = unwrap(destination);
    if (q.is(IDENTIFIER) && q.tag() != null) {
      q.tag().noteContentScope(youngest(ns).level());
    }
    add(s, p, youngest(nd).level());
  }

  private void routineText(Node p, @Nullable List<Scope> s) {
    Node q = p.sub();
    Node declarer = q.is(PARAMETER_PACK) ? q.next() : q;
    List<Scope> x = new ArrayList<>();
    statement(declarer.next(2), x);
    check(x, true, level(p));
    if (p.tag() != null) {
      add(s, p, p.tag().youngestEnviron());
    }
  }

  private void operand(Node p, List<Scope> s) {
    switch (p.attribute()) {
      case MONADIC_FORMULA -> operand(p.sub().next(), s);
      case FORMULA -> formula(p);
      case SECONDARY -> statement(p.sub(), s);
      default -> {}
    }
  }

  /** Operands may not be transient names; a formula itself yields no name of its own. */
  private void formula(Node p) {
    Node q = p.sub();
    List<Scope> left = new ArrayList<>();
    operand(q, left);
    check(left, true, level(p));
    if (q.next() != null) {
      List<Scope> right = new ArrayList<>();
      operand(q.next(2), right);
      check(right, true, level(p));
    }
  }

  private void formatText(@Nullable Node p, List<Scope> s) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FORMAT_PATTERN, DYNAMIC_REPLICATOR -> enclosed(p.sub().next(), s);
        case GENERAL_PATTERN -> {
          if (p.sub().next() != null) {
            enclosed(p.sub().next(), s);
          }
        }
        default -> formatText(p.sub(), s);
      }
    }
  }

  // Clauses.

  private void statementList(@Nullable Node p, @Nullable List<Scope> s) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT)) {
        statement(p, s);
      } else {
        statementList(p.sub(), s);
      }
    }
  }

  private void serial(@Nullable Node p, @Nullable List<Scope> s, boolean terminator) {
    if (p == null) {
      return;
    }
    switch (p.attribute()) {
      case INITIALISER_SERIES -> {
        serial(p.sub(), s, false);
        serial(p.next(), s, terminator);
      }
      case DECLARATION_LIST -> declarationList(p.sub());
      case LABEL, SEMI_SYMBOL, EXIT_SYMBOL -> serial(p.next(), s, terminator);
      case SERIAL_CLAUSE, ENQUIRY_CLAUSE -> {
        Node next = p.next();
        boolean yields = next == null || next.isOneOf(EXIT_SYMBOL, END_SYMBOL, CLOSE_SYMBOL);
        serial(p.sub(), s, yields);
        serial(next, s, terminator);
      }
      case LABELED_UNIT -> serial(p.sub(), s, terminator);
      case UNIT -> statement(p, terminator ? s : null);
      default -> {}
    }
  }

  private void closed(@Nullable Node p, @Nullable List<Scope> s) {
    for (; p != null; p = p.next()) {
      if (p.is(SERIAL_CLAUSE)) {
        serial(p, s, true);
        return;
      } else if (!p.isOneOf(OPEN_SYMBOL, BEGIN_SYMBOL)) {
        return;
      }
    }
  }

  private void collateral(Node p, @Nullable List<Scope> s) {
    if (!(p.whether(BEGIN_SYMBOL, END_SYMBOL) || p.whether(OPEN_SYMBOL, CLOSE_SYMBOL))) {
      statementList(p, s);
    }
  }

  private void conditional(Node p, @Nullable List<Scope> s) {
    serial(p.sub().next(), null, true);
    p = p.next();
    serial(p.sub().next(), s, true);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(ELSE_PART, CHOICE)) {
      serial(p.sub().next(), s, true);
    } else if (p.isOneOf(ELIF_PART, BRIEF_ELIF_IF_PART)) {
      conditional(p.sub(), s);
    }
  }

  private void caseClause(Node p, @Nullable List<Scope> s) {
    List<Scope> n = new ArrayList<>();
    serial(p.sub().next(), n, true);
    check(n, false, level(p));
    p = p.next();
    statementList(p.sub().next(), s);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(OUT_PART, CHOICE)) {
      serial(p.sub().next(), s, true);
    } else if (p.isOneOf(
        INTEGER_OUT_PART, BRIEF_INTEGER_OUSE_PART, UNITED_OUSE_PART, BRIEF_UNITED_OUSE_PART)) {
      caseClause(p.sub(), s);
    }
  }

  private void loop(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FROM_PART, BY_PART, TO_PART -> statement(p.sub().next(), null);
        case WHILE_PART -> serial(p.sub().next(), null, true);
        case DO_PART, ALT_DO_PART -> {
          Node q = p.sub().next();
          if (q != null && q.is(SERIAL_CLAUSE)) {
            serial(q, null, true);
            q = q.next();
          }
          if (q != null && q.is(UNTIL_PART)) {
            serial(q.sub().next(), null, true);
          }
          return;
        }
        default -> {}
      }
    }
  }

  private void enclosed(Node p, @Nullable List<Scope> s) {
    switch (p.attribute()) {
      case ENCLOSED_CLAUSE -> enclosed(p.sub(), s);
      case CLOSED_CLAUSE -> closed(p.sub(), s);
      case COLLATERAL_CLAUSE -> collateral(p.sub(), s);
      case PARALLEL_CLAUSE -> collateral(p.sub().next().sub(), s);
      case CONDITIONAL_CLAUSE -> conditional(p.sub(), s);
      case INTEGER_CASE_CLAUSE, UNITED_CASE_CLAUSE -> caseClause(p.sub(), s);
      case LOOP_CLAUSE -> loop(p.sub());
      default -> {}
    }
  }
}
