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

package org.algolang.check;

import static org.algolang.tree.Attribute.*;

import org.algolang.Session;
import org.algolang.diag.CompilerBug;
import org.algolang.diag.DepthGuard;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.mode.Coercibility;
import org.algolang.mode.Deflexing;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeKind;
import org.algolang.mode.ModeTable;
import org.algolang.mode.Pack;
import org.algolang.taxes.Tag;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes the coercions found by {@link ModeChecker} explicit in the tree.
 *
 * <p>Each coercion becomes a node (DEREFERENCING, DEPROCEDURING, UNITING, WIDENING, ROWING,
 * VOIDING or PROCEDURING) wrapped around the coerced construct, whose mode is the mode after that
 * coercion. A construct coerced several times gets one node per step, the first step innermost:
 * {@code REF REF INT} used as {@code REAL} becomes WIDENING(DEREFERENCING(DEREFERENCING(..))).
 *
 * <p>Only a program without mode errors may be passed in; a coercion that the checker accepted but
 * that cannot be built is a {@link CompilerBug}.
 */
public final class CoercionInserter {
  private static final Logger logger = LoggerFactory.getLogger(CoercionInserter.class);

  static final String NO_NAME_REQUIRED = "context does not require a name";

  private final Diagnostics diagnostics;
  private final DepthGuard guard;
  private final ModeTable modes;
  private final Coercibility coercions;
  private int inserted;

  private CoercionInserter(Session session) {
    this.diagnostics = session.diagnostics();
    this.guard = session.depthGuard();
    this.modes = session.modes();
    this.coercions = new Coercibility(modes);
  }

  /** Inserts the coercions of program {@code p}, which has been mode checked without errors. */
  public static void insert(Session session, Node p) {
    CoercionInserter inserter = new CoercionInserter(session);
    Node clause = p.is(PARTICULAR_PROGRAM) ? p.child(ENCLOSED_CLAUSE) : p;
    if (clause == null) {
      throw new CompilerBug("program has no enclosed clause");
    }
    inserter.enclosed(clause, inserter.modes.voidMode);
    logger.debug("inserted {} coercions", inserter.inserted);
  }

  // Coercion nodes.

  private void coercion(Node n, Attribute a, Mode m) {
    Mode old = n.mode();
    n.makeSub(n, a);
    n.setMode(coercions.deprefRows(old, m));
    inserted++;
  }

  /** Coerces {@code n}, which yields {@code p}, to {@code q}. */
  private void strong(Node n, Mode p, Mode q) {
    if (q == modes.voidMode && p != modes.voidMode) {
      voiding(n, p);
    } else {
      depreffing(n, p, q);
    }
  }

  private void voiding(Node n, Mode p) {
    switch (n.attribute()) {
      case ASSIGNATION, IDENTITY_RELATION, GENERATOR, CAST, DENOTATION -> {
        coercion(n, VOIDING, modes.voidMode);
      }
      case SELECTION, SLICE, ROUTINE_TEXT, FORMULA, CALL, IDENTIFIER -> {
        // A procedure yielded here is called before its value is discarded.
        Mode z = p;
        while (!coercions.isNonProc(z)) {
          if (z.isRef()) {
            coercion(n, DEREFERENCING, z.sub());
          } else if (z.isParameterlessProc()) {
            coercion(n, DEPROCEDURING, z.sub());
          }
          z = z.sub();
        }
        if (z != modes.voidMode) {
          coercion(n, VOIDING, modes.voidMode);
        }
      }
      default -> coercion(n, VOIDING, modes.voidMode);
    }
  }

  private void depreffing(Node n, Mode p, Mode q) {
    if (p.deflex() == q.deflex()) {
      return;
    } else if (q == modes.simplout && coercions.isPrintable(p)) {
      coercion(n, UNITING, q);
    } else if (q == modes.rowSimplout && coercions.isPrintable(p)) {
      coercion(n, UNITING, modes.simplout);
      coercion(n, ROWING, modes.rowSimplout);
    } else if (q == modes.simplin && coercions.isReadable(p)) {
      coercion(n, UNITING, q);
    } else if (q == modes.rowSimplin && coercions.isReadable(p)) {
      coercion(n, UNITING, modes.simplin);
      coercion(n, ROWING, modes.rowSimplin);
    } else if (q == modes.rows && coercions.isRowsType(p)) {
      coercion(n, UNITING, modes.rows);
      n.setMode(modes.rows);
    } else if (coercions.isWidenable(p, q)) {
      widening(n, p, q);
    } else if (coercions.isUnitable(p, coercions.derow(q), Deflexing.SAFE)) {
      uniting(n, q);
    } else if (coercions.isRefRow(q) && coercions.isStrongName(p, q)) {
      refRowing(n, p, q);
    } else if (q.slice() != null && coercions.isStrongSlice(p, q)) {
      rowing(n, p, q);
    } else if (q.isFlex() && coercions.isStrongSlice(p, q)) {
      rowing(n, p, q);
    } else if (p.isRef()) {
      coercion(n, DEREFERENCING, p.sub());
      depreffing(n, p.sub(), q);
    } else if (p.isParameterlessProc()) {
      coercion(n, DEPROCEDURING, p.sub());
      depreffing(n, p.sub(), q);
    } else if (p != q) {
      throw new CompilerBug("no coercion from %s to %s at %s", p, q, n);
    }
  }

  private void widening(Node n, Mode p, Mode q) {
    Mode z = coercions.widensTo(p, q);
    if (z == null) {
      throw new CompilerBug("%s does not widen to %s", p, q);
    }
    coercion(n, WIDENING, z);
    if (z != q) {
      widening(n, z, q);
    }
  }

  private void uniting(Node n, Mode q) {
    Mode u = coercions.derow(q);
    coercion(n, UNITING, u);
    if (q.isRow() || q.isFlex()) {
      rowing(n, u, q);
    }
  }

  private void rowing(Node n, Mode p, Mode q) {
    if (p.deflex() == q.deflex()) {
      return;
    } else if (coercions.isWidenable(p, q)) {
      widening(n, p, q);
    } else if (q.slice() != null) {
      rowing(n, p, q.slice());
      coercion(n, ROWING, q);
    } else if (q.isFlex()) {
      rowing(n, p, q.sub());
    } else if (coercions.isRefRow(q)) {
      refRowing(n, p, q);
    }
  }

  private void refRowing(Node n, Mode p, Mode q) {
    if (p.deflex() == q.deflex()) {
      return;
    } else if (coercions.isWidenable(p, q)) {
      widening(n, p, q);
    } else if (coercions.isRefRow(q)) {
      refRowing(n, p, q.name());
      coercion(n, ROWING, q);
    }
  }

  // Units.

  private void unit(@Nullable Node p, Mode q) {
    if (p == null) {
      return;
    }
    guard.enter(p);
    try {
      coerceUnit(p, q);
    } finally {
      guard.exit();
    }
  }

  private void coerceUnit(Node p, Mode q) {
    switch (p.attribute()) {
      case UNIT, TERTIARY, SECONDARY, PRIMARY -> {
        unit(p.sub(), q);
        p.setMode(p.sub().mode());
      }
      case CALL -> {
        call(p.sub());
        strong(p, p.mode(), q);
      }
      case SLICE -> {
        Node primary = p.sub();
        unit(primary.sub(), primary.mode());
        indexer(primary.next().sub());
        strong(p, p.mode(), q);
      }
      case CAST -> {
        Node d = p.sub();
        declarer(d.sub());
        enclosed(d.next(), d.mode());
        strong(p, p.mode(), q);
      }
      case DENOTATION, IDENTIFIER -> strong(p, p.mode(), q);
      case FORMAT_TEXT -> {
        formatText(p.sub());
        strong(p, p.mode(), q);
      }
      case ENCLOSED_CLAUSE -> enclosed(p, q);
      case SELECTION -> {
        Node secondary = p.sub().next();
        unit(secondary.sub(), secondary.mode());
        strong(p, p.mode(), q);
      }
      case GENERATOR -> {
        declarer(p.sub());
        strong(p, p.mode(), q);
      }
      case NIHIL -> {
        if (!q.isRef() && q != modes.voidMode) {
          diagnostics.error(Severity.SEMANTIC, p, NO_NAME_REQUIRED);
        }
        p.setMode(coercions.deprefRows(p.mode(), q));
      }
      case FORMULA -> {
        formula(p.sub());
        strong(p, p.mode(), q);
      }
      case JUMP -> {
        if (q == modes.procVoid) {
          p.makeSub(p, PROCEDURING);
          inserted++;
        }
        p.setMode(coercions.deprefRows(p.mode(), q));
      }
      case SKIP -> p.setMode(coercions.deprefRows(p.mode(), q));
      case ASSIGNATION -> {
        Node destination = p.sub();
        unit(destination.sub(), destination.mode());
        unit(destination.next(2), destination.mode().sub());
        strong(p, p.mode(), q);
        p.setMode(coercions.deprefRows(p.mode(), q));
      }
      case IDENTITY_RELATION -> {
        Node ln = p.sub();
        Node rn = ln.next(2);
        unit(ln.sub(), ln.mode());
        unit(rn.sub(), rn.mode());
        strong(p, p.mode(), q);
      }
      case ROUTINE_TEXT -> {
        routineText(p.sub());
        strong(p, p.mode(), q);
      }
      case AND_FUNCTION, OR_FUNCTION -> {
        Node ln = p.sub();
        unit(ln.sub(), modes.bool);
        unit(ln.next(2).sub(), modes.bool);
        strong(p, p.mode(), q);
      }
      case ASSERTION -> {
        enclosed(p.sub().next(), modes.bool);
        strong(p, p.mode(), q);
      }
      default -> throw new CompilerBug("cannot coerce %s", p);
    }
  }

  /** {@code p} is the primary of a call, whose mode is the procedure called. */
  private void call(Node p) {
    Mode proc = p.mode();
    unit(p.sub(), proc);
    argumentList(p.next().sub(), proc.pack(), new int[1]);
  }

  private void argumentList(@Nullable Node p, Pack parameters, int[] i) {
    for (; p != null; p = p.next()) {
      if (p.is(ARGUMENT_LIST)) {
        argumentList(p.sub(), parameters, i);
      } else if (p.is(UNIT)) {
        unit(p, parameters.mode(i[0]++));
      } else if (p.is(TRIMMER)) {
        i[0]++;
      }
    }
  }

  private void meekInt(Node p) {
    unit(p, modes.intMode);
  }

  private void indexer(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(TRIMMER)) {
        for (Node q = p.sub(); q != null; q = q.next()) {
          if (q.is(UNIT)) {
            meekInt(q);
          }
        }
      } else if (p.is(UNIT)) {
        meekInt(p);
      } else {
        indexer(p.sub());
      }
    }
  }

  // Formulas.

  /** {@code p} is the first child of a formula. */
  private void formula(Node p) {
    if (p.is(MONADIC_FORMULA) && p.next() == null) {
      monadicFormula(p.sub());
      return;
    }
    Node op = p.next();
    Tag t = op.tag();
    if (t == null || t.mode() == null) {
      throw new CompilerBug("operator %s is not bound", op.symbol());
    }
    Pack operands = t.mode().pack();
    operand(p, operands.mode(0));
    operand(op.next(), operands.mode(1));
  }

  /** {@code p} is the operator of a monadic formula. */
  private void monadicFormula(Node p) {
    Tag t = p.tag();
    if (t == null || t.mode() == null) {
      throw new CompilerBug("operator %s is not bound", p.symbol());
    }
    p.setMode(t.mode());
    operand(p.next(), t.mode().pack().mode(0));
  }

  private void operand(Node p, Mode q) {
    guard.enter(p);
    try {
      coerceOperand(p, q);
    } finally {
      guard.exit();
    }
  }

  private void coerceOperand(Node p, Mode q) {
    switch (p.attribute()) {
      case MONADIC_FORMULA -> {
        monadicFormula(p.sub());
        if (p.mode() != q) {
          p.makeSub(p, FORMULA);
          strong(p, p.mode(), q);
          p.makeSub(p, TERTIARY);
        }
        p.setMode(coercions.deprefRows(p.mode(), q));
      }
      case FORMULA -> {
        formula(p.sub());
        strong(p, p.mode(), q);
        p.setMode(coercions.deprefRows(p.mode(), q));
      }
      case SECONDARY -> {
        unit(p.sub(), q);
        p.setMode(p.sub().mode());
      }
      default -> throw new CompilerBug("%s is not an operand", p);
    }
  }

  // Declarations.

  private void declarer(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(BOUNDS)) {
        bounds(p.sub());
      } else {
        declarer(p.sub());
      }
    }
  }

  private void bounds(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT)) {
        meekInt(p);
      } else {
        bounds(p.sub());
      }
    }
  }

  private void routineText(Node p) {
    if (p.is(PARAMETER_PACK)) {
      p = p.next();
    }
    unit(p.next(2), p.mode());
  }

  private void declarationList(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case IDENTITY_DECLARATION -> identityDeclaration(p.sub());
        case VARIABLE_DECLARATION -> variableDeclaration(p.sub());
        case MODE_DECLARATION -> declarer(p.sub());
        case PROCEDURE_DECLARATION, PROCEDURE_VARIABLE_DECLARATION -> procDeclaration(p.sub());
        case BRIEF_OPERATOR_DECLARATION, OPERATOR_DECLARATION -> operatorDeclaration(p.sub());
        default -> declarationList(p.sub());
      }
    }
  }

  private void identityDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case DECLARER -> declarer(p.sub());
        case DEFINING_IDENTIFIER -> {
          unit(p.next(2), p.mode());
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
            unit(p.next(2), p.mode().sub());
          }
          return;
        }
        default -> variableDeclaration(p.sub());
      }
    }
  }

  private void procDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(ROUTINE_TEXT)) {
        routineText(p.sub());
      } else {
        procDeclaration(p.sub());
      }
    }
  }

  /** Brief declarations carry a routine text; others a unit of the plan's mode. */
  private void operatorDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(DEFINING_OPERATOR)) {
        Node source = p.next(2);
        if (source.is(ROUTINE_TEXT)) {
          routineText(source.sub());
        } else {
          unit(source, p.mode());
        }
        return;
      }
      operatorDeclaration(p.sub());
    }
  }

  private void formatText(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FORMAT_PATTERN -> enclosed(p.sub().next(), modes.format);
        case GENERAL_PATTERN -> {
          if (p.sub().next() != null) {
            enclosed(p.sub().next(), modes.rowInt);
          }
        }
        case DYNAMIC_REPLICATOR -> enclosed(p.sub().next(), modes.intMode);
        default -> formatText(p.sub());
      }
    }
  }

  // Clauses.

  private void enclosed(Node p, Mode q) {
    switch (p.attribute()) {
      case ENCLOSED_CLAUSE -> enclosed(p.sub(), q);
      case CLOSED_CLAUSE -> serial(p.sub().next(), q, true);
      case COLLATERAL_CLAUSE -> collateral(p.sub(), q);
      case PARALLEL_CLAUSE -> collateral(p.sub().next().sub(), q);
      case CONDITIONAL_CLAUSE -> conditional(p.sub(), q);
      case INTEGER_CASE_CLAUSE -> integerCase(p.sub(), q);
      case UNITED_CASE_CLAUSE -> unitedCase(p.sub(), q);
      case LOOP_CLAUSE -> loop(p.sub());
      case CODE_CLAUSE -> {}
      default -> throw new CompilerBug("%s is not an enclosed clause", p);
    }
    p.setMode(coercions.deprefRows(p.mode(), q));
  }

  private void collateral(Node p, Mode q) {
    if (p.whether(BEGIN_SYMBOL, END_SYMBOL) || p.whether(OPEN_SYMBOL, CLOSE_SYMBOL)) {
      return;
    }
    Node list = p.next();
    if (q.is(ModeKind.STRUCT)) {
      structDisplay(list.sub(), q.pack(), new int[1]);
    } else if (q.isFlex()) {
      unitList(list.sub(), q.sub().slice());
    } else if (q.isRow()) {
      unitList(list.sub(), q.slice());
    } else {
      unitList(list.sub(), q);
    }
  }

  private void unitList(@Nullable Node p, Mode q) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT_LIST)) {
        unitList(p.sub(), q);
      } else if (p.is(UNIT)) {
        unit(p, q);
      }
    }
  }

  private void structDisplay(@Nullable Node p, Pack fields, int[] i) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT_LIST)) {
        structDisplay(p.sub(), fields, i);
      } else if (p.is(UNIT)) {
        unit(p, fields.mode(i[0]++));
      }
    }
  }

  /** Mirrors the walk of the mode checker: only yielding units are coerced to {@code q}. */
  private void serial(@Nullable Node p, Mode q, boolean k) {
    if (p == null) {
      return;
    }
    switch (p.attribute()) {
      case INITIALISER_SERIES -> {
        serial(p.sub(), q, false);
        serial(p.next(), q, k);
      }
      case DECLARATION_LIST -> declarationList(p.sub());
      case LABEL, SEMI_SYMBOL, EXIT_SYMBOL -> serial(p.next(), q, k);
      case SERIAL_CLAUSE, ENQUIRY_CLAUSE -> {
        Node next = p.next();
        boolean yields =
            next == null || next.isOneOf(EXIT_SYMBOL, END_SYMBOL, CLOSE_SYMBOL, OCCA_SYMBOL);
        serial(p.sub(), q, yields);
        serial(next, q, k);
      }
      case LABELED_UNIT -> serial(p.sub(), q, k);
      case UNIT -> {
        unit(p, k ? q : modes.voidMode);
        serial(p.next(), q, k);
      }
      default -> {}
    }
  }

  private void conditional(Node p, Mode q) {
    serial(p.sub().next(), modes.bool, true);
    p = p.next();
    serial(p.sub().next(), q, true);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(ELSE_PART, CHOICE)) {
      serial(p.sub().next(), q, true);
    } else if (p.isOneOf(ELIF_PART, BRIEF_ELIF_IF_PART)) {
      conditional(p.sub(), q);
    }
  }

  private void integerCase(Node p, Mode q) {
    serial(p.sub().next(), modes.intMode, true);
    p = p.next();
    unitList(p.sub().next(), q);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(OUT_PART, CHOICE)) {
      serial(p.sub().next(), q, true);
    } else if (p.isOneOf(INTEGER_OUT_PART, BRIEF_INTEGER_OUSE_PART)) {
      integerCase(p.sub(), q);
    }
  }

  /** The united mode of the enquiry was left on the CASE symbol by the mode checker. */
  private void unitedCase(Node p, Mode q) {
    serial(p.sub().next(), p.sub().mode(), true);
    p = p.next();
    specifiedUnitList(p.sub().next(), q);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(OUT_PART, CHOICE)) {
      serial(p.sub().next(), q, true);
    } else if (p.isOneOf(UNITED_OUSE_PART, BRIEF_UNITED_OUSE_PART)) {
      unitedCase(p.sub(), q);
    }
  }

  private void specifiedUnitList(@Nullable Node p, Mode q) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(SPECIFIED_UNIT_LIST, SPECIFIED_UNIT)) {
        specifiedUnitList(p.sub(), q);
      } else if (p.is(UNIT)) {
        unit(p, q);
      }
    }
  }

  private void loop(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FROM_PART, BY_PART, TO_PART -> meekInt(p.sub().next());
        case WHILE_PART -> serial(p.sub().next(), modes.bool, true);
        case DO_PART, ALT_DO_PART -> {
          Node q = p.sub().next();
          if (q != null && q.is(SERIAL_CLAUSE)) {
            serial(q, modes.voidMode, true);
            q = q.next();
          }
          if (q != null && q.is(UNTIL_PART)) {
            serial(q.sub().next(), modes.bool, true);
          }
        }
        default -> {}
      }
    }
  }
}
