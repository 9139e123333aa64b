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

import com.google.common.base.Ascii;
import java.util.ArrayList;
import java.util.List;
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
import org.algolang.mode.Strength;
import org.algolang.taxes.Tag;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that every unit of a program yields a mode acceptable to its context.
 *
 * <p>The tree is walked top-down with an expectation: a strength, and the mode the context wants
 * (or null where any mode will do). Each construct reports what it yields, and its parent decides
 * whether that yield can be coerced to what it expected. Clauses with several branches yield a
 * SERIES of their branch modes, which is balanced where it is used. Every checked node is given
 * the mode it yields, and formulas are bound to their operators; {@link CoercionInserter} later
 * relies on both.
 *
 * <p>A construct that cannot be given a proper mode yields the error mode, which is coercible to
 * anything, so each mistake is reported once.
 */
public final class ModeChecker {
  private static final Logger logger = LoggerFactory.getLogger(ModeChecker.class);

  static final String CANNOT_COERCE = "%s cannot be coerced to %s in %s %s";
  static final String CANNOT_COERCE_IN_CONTEXT = "%s cannot be coerced to %s in %s context";
  static final String ARGUMENT_NUMBER = "incorrect number of arguments for %s";
  static final String INDEXER_NUMBER = "incorrect number of indexers for %s";
  static final String INVALID_OPERAND = "%s construct is an invalid operand";
  static final String MODE_SPECIFICATION =
      "%s construct must yield a routine, row or structured value";
  static final String FIELD_SELECTION = "field selection from %s needs OF";
  static final String NO_COMPONENT = "%s is neither component nor subset of %s";
  static final String NO_DYADIC = "dyadic operator %s \"%s\" %s has not been declared";
  static final String NO_MONADIC = "monadic operator \"%s\" %s has not been declared";
  static final String MONADIC_NOMAD = "monadic operator \"%s\" cannot start with any of \"%s\"";
  static final String NO_FIELD = "%s has no field \"%s\"";
  static final String NO_NAME = "%s %s does not yield a name";
  static final String NO_ROW_OR_PROC = "%s %s does not yield a row or procedure";
  static final String NO_STRUCT = "%s %s does not yield a structured value";
  static final String NO_UNION = "%s is not a united mode";
  static final String PARTIAL_PARAMETRISATION = "partial parametrisation is not supported";
  static final String UNINTENDED = "possibly unintended %s %s in %s %s";
  static final String VOIDED = "value of %s %s will be voided";

  /** Monadic operators may not start with these characters, which begin dyadic ones. */
  static final String NOMADS = "></=*";

  private final Diagnostics diagnostics;
  private final DepthGuard guard;
  private final ModeTable modes;
  private final Coercibility coercions;
  private final Balancer balancer;
  private final OperatorResolver operators;

  private ModeChecker(Session session) {
    this.diagnostics = session.diagnostics();
    this.guard = session.depthGuard();
    this.modes = session.modes();
    this.coercions = new Coercibility(modes);
    this.balancer = new Balancer(modes, coercions, diagnostics);
    this.operators =
        new OperatorResolver(modes, coercions, balancer, session.standardEnvironment());
  }

  /** Checks program {@code p}, whose tags are bound; the program node gets the mode it yields. */
  public static void check(Session session, Node p) {
    ModeChecker checker = new ModeChecker(session);
    Node clause = p.is(PARTICULAR_PROGRAM) ? p.child(ENCLOSED_CLAUSE) : p;
    if (clause == null) {
      throw new CompilerBug("program has no enclosed clause");
    }
    Soid y = checker.enclosed(clause, Soid.of(Strength.STRONG, checker.modes.voidMode));
    p.setMode(y.mode());
    logger.debug("program yields {}", y.mode());
  }

  /** The yields of the units of a clause, in source order. */
  private static final class Yields {
    final List<Node> where = new ArrayList<>();
    final List<Mode> modes = new ArrayList<>();

    void add(Node p, Soid y) {
      where.add(p);
      modes.add(y.mode());
    }

    int size() {
      return modes.size();
    }
  }

  private Mode collect(Yields r, ModeKind kind) {
    return modes.collection(kind, r.modes, r.where);
  }

  // Context.

  private boolean coercibleInContext(Soid y, Soid x, Deflexing deflex) {
    if (y.strength() != x.strength()) {
      return false;
    } else if (y.mode() == x.mode()) {
      return true;
    }
    return coercions.isCoercible(y.mode(), x.mode(), x.strength(), deflex);
  }

  private void cannotCoerce(
      Node p, Mode from, Mode to, Strength context, Deflexing deflex, @Nullable Attribute a) {
    String what = modeErrorText(from, to, context, deflex);
    String strength = Ascii.toLowerCase(context.name());
    if (a == null) {
      diagnostics.error(Severity.SEMANTIC, p, CANNOT_COERCE_IN_CONTEXT, what, to, strength);
    } else {
      diagnostics.error(Severity.SEMANTIC, p, CANNOT_COERCE, what, to, strength, a.displayName());
    }
  }

  /** For a SERIES, names only the components that are at fault. */
  private String modeErrorText(Mode from, Mode to, Strength context, Deflexing deflex) {
    if (!from.is(ModeKind.SERIES)) {
      return from.toString();
    }
    List<String> culprits = new ArrayList<>();
    addCulprits(from, to, context, deflex, culprits);
    return culprits.isEmpty() ? from.toString() : String.join(" and ", culprits);
  }

  private void addCulprits(
      Mode series, Mode to, Strength context, Deflexing deflex, List<String> culprits) {
    for (Pack.Entry e : series.pack()) {
      if (e.mode().is(ModeKind.SERIES)) {
        addCulprits(e.mode(), to, context, deflex, culprits);
      } else if (!coercions.isCoercible(e.mode(), to, context, deflex)) {
        culprits.add(e.mode().toString());
      }
    }
  }

  private void warnForVoiding(Node p, Soid x, Soid y) {
    if (x.cast() || x.mode() != modes.voidMode) {
      return;
    }
    Mode m = y.mode();
    if (m == modes.error || m == modes.voidMode || !coercions.isNonProc(m)) {
      return;
    }
    if (p.is(FORMULA)) {
      // Reported even when quiet.
      diagnostics.error(Severity.WARNING, p, VOIDED, m, p.attribute().displayName());
    } else {
      diagnostics.warning(p, VOIDED, m, p.attribute().displayName());
    }
  }

  /** Warns for a generator where a value was expected, as in {@code REF INT i = LOC REF INT}. */
  private void semanticPitfall(@Nullable Node p, Mode m, Attribute context) {
    if (p == null) {
      return;
    } else if (p.is(GENERATOR)) {
      diagnostics.warning(
          p, UNINTENDED, p.mode(), GENERATOR.displayName(), m, context.displayName());
    } else if (p.isOneOf(UNIT, TERTIARY, SECONDARY, PRIMARY)) {
      semanticPitfall(p.sub(), m, context);
    }
  }

  // Units.

  private Soid unit(Node p, Soid x) {
    guard.enter(p);
    try {
      Soid y = checkUnit(p, x);
      p.setMode(y.mode());
      return y;
    } finally {
      guard.exit();
    }
  }

  private Soid checkUnit(Node p, Soid x) {
    Soid y;
    switch (p.attribute()) {
      case UNIT, TERTIARY, SECONDARY, PRIMARY -> {
        return unit(p.sub(), x);
      }
      case SLICE, CALL -> {
        y = specification(p, x);
        warnForVoiding(p, x, y);
      }
      case CAST -> {
        y = cast(p, x);
        warnForVoiding(p, x, y);
      }
      case DENOTATION -> {
        y = Soid.of(x.strength(), p.sub().mode());
        warnForVoiding(p, x, y);
      }
      case IDENTIFIER -> {
        y = Soid.of(x.strength(), (p.mode() == null) ? modes.error : p.mode());
        warnForVoiding(p, x, y);
      }
      case ENCLOSED_CLAUSE -> y = enclosed(p, x);
      case FORMAT_TEXT -> {
        formatText(p.sub());
        y = Soid.of(x.strength(), modes.format);
        warnForVoiding(p, x, y);
      }
      case GENERATOR -> {
        declarer(p.sub());
        y = Soid.of(x.strength(), p.sub().mode());
        warnForVoiding(p, x, y);
      }
      case SELECTION -> {
        y = selection(p.sub(), x);
        warnForVoiding(p, x, y);
      }
      case NIHIL, JUMP, SKIP -> y = Soid.of(Strength.STRONG, modes.hip);
      case FORMULA -> {
        y = formula(p.sub(), x);
        if (!y.mode().isRef()) {
          warnForVoiding(p, x, y);
        }
      }
      case ASSIGNATION -> y = assignation(p.sub(), x);
      case IDENTITY_RELATION -> {
        y = identityRelation(p.sub(), x);
        warnForVoiding(p, x, y);
      }
      case ROUTINE_TEXT -> {
        routineText(p.sub());
        y = Soid.of(x.strength(), p.mode());
        warnForVoiding(p, x, y);
      }
      case ASSERTION -> {
        assertion(p.sub());
        y = Soid.of(Strength.STRONG, modes.voidMode);
      }
      case AND_FUNCTION, OR_FUNCTION -> {
        y = boolFunction(p.sub(), x);
        warnForVoiding(p, x, y);
      }
      default -> throw new CompilerBug("cannot check the mode of %s", p);
    }
    return y;
  }

  private Soid cast(Node p, Soid x) {
    Node d = p.sub();
    declarer(d.sub());
    Soid w = Soid.cast(d.mode());
    Soid y = enclosed(d.next(), w);
    if (!coercibleInContext(y, w, Deflexing.SAFE)) {
      cannotCoerce(d.next(), y.mode(), w.mode(), Strength.STRONG, Deflexing.SAFE, ENCLOSED_CLAUSE);
    }
    return Soid.of(x.strength(), d.mode());
  }

  private void assertion(Node p) {
    Soid w = Soid.of(Strength.STRONG, modes.bool);
    Soid y = enclosed(p.next(), w).withStrength(w.strength());
    if (!coercibleInContext(y, w, Deflexing.NONE)) {
      cannotCoerce(p.next(), y.mode(), w.mode(), Strength.MEEK, Deflexing.NONE, ENCLOSED_CLAUSE);
    }
  }

  private void meekInt(Node p) {
    Soid x = Soid.of(Strength.STRONG, modes.intMode);
    Soid y = unit(p, x);
    if (!coercibleInContext(y, x, Deflexing.SAFE)) {
      cannotCoerce(p, y.mode(), x.mode(), Strength.MEEK, Deflexing.SAFE, null);
    }
  }

  /**
   * A primary followed by a bracketed list: a call if the primary yields a procedure, a slice if it
   * yields a row. The parser cannot tell the two apart, so the node is renamed here.
   */
  private Soid specification(Node p, Soid x) {
    Node primary = p.sub();
    Soid d = unit(primary, Soid.of(Strength.WEAK, null));
    Mode ori = balancer.uniqueMode(d, Deflexing.SAFE);
    Mode m = coercions.deprefCompletely(ori);
    if (m.is(ModeKind.PROC)) {
      p.setAttribute(CALL);
      return call(primary, m, x);
    } else if (m.isRow() || m.isFlex()) {
      p.setAttribute(SLICE);
      return slice(primary, ori, x);
    } else if (m.is(ModeKind.STRUCT)) {
      diagnostics.error(Severity.SEMANTIC, p, FIELD_SELECTION, m);
    } else if (!modes.isIllFormed(m)) {
      diagnostics.error(Severity.SYNTAX, p, MODE_SPECIFICATION, m);
    }
    return Soid.of(x.strength(), modes.error);
  }

  private Soid call(Node primary, Mode n, Soid x) {
    primary.setMode(n);
    Node arguments = primary.next();
    arguments.setAttribute(ARGUMENT);
    Yields r = new Yields();
    argumentList(r, arguments.sub(), n.pack());
    if (r.size() != n.pack().size()) {
      diagnostics.error(Severity.SEMANTIC, primary, ARGUMENT_NUMBER, n);
      return Soid.of(x.strength(), n.sub());
    }
    Mode d = collect(r, ModeKind.STOWED);
    if (!coercions.isCoercible(d, n, Strength.STRONG, Deflexing.ALIAS)) {
      cannotCoerce(primary, d, n, Strength.STRONG, Deflexing.ALIAS, ARGUMENT);
    }
    return Soid.of(x.strength(), n.sub());
  }

  private void argumentList(Yields r, @Nullable Node p, Pack parameters) {
    for (; p != null; p = p.next()) {
      if (p.is(GENERIC_ARGUMENT_LIST)) {
        p.setAttribute(ARGUMENT_LIST);
      }
      if (p.is(ARGUMENT_LIST)) {
        argumentList(r, p.sub(), parameters);
      } else if (p.is(UNIT)) {
        int i = r.size();
        Mode m = (i < parameters.size()) ? parameters.mode(i) : null;
        r.add(p, unit(p, Soid.of(Strength.STRONG, m)));
      } else if (p.is(TRIMMER)) {
        diagnostics.error(Severity.SEMANTIC, p, PARTIAL_PARAMETRISATION);
        r.add(p, Soid.of(Strength.STRONG, modes.error));
      }
    }
  }

  private Soid slice(Node primary, Mode ori, Soid x) {
    Mode n = ori;
    for (int i = 0;
        i < modes.size() && ((n.isRef() && !coercions.isRefRow(n)) || n.isParameterlessProc());
        i++) {
      n = n.sub();
    }
    boolean isRef = coercions.isRefRow(n);
    if (n.deflex().slice() == null && !isRef) {
      if (!modes.isIllFormed(n)) {
        diagnostics.error(
            Severity.SEMANTIC, primary, NO_ROW_OR_PROC, n, primary.sub().attribute().displayName());
      }
      return Soid.of(x.strength(), modes.error);
    }
    primary.setMode(n);
    int[] counts = new int[2];
    indexer(primary.next().sub(), counts);
    int subs = counts[0];
    int trims = counts[1];
    int rowdim = isRef ? n.sub().deflex().dimension() : n.deflex().dimension();
    if (subs + trims != rowdim) {
      diagnostics.error(Severity.SEMANTIC, primary, INDEXER_NUMBER, n);
      return Soid.of(x.strength(), modes.error);
    }
    Mode m = n;
    for (int i = 0; i < subs; i++) {
      if (isRef) {
        m = m.name();
      } else {
        m = (m.isFlex() ? m.sub() : m).slice();
      }
      if (m == null) {
        throw new CompilerBug("%s cannot be subscripted %d times", n, subs);
      }
    }
    return Soid.of(x.strength(), (trims > 0 && m.trim() != null) ? m.trim() : m);
  }

  /** Counts subscripts in {@code counts[0]} and trimmers in {@code counts[1]}. */
  private void indexer(@Nullable Node p, int[] counts) {
    for (; p != null; p = p.next()) {
      if (p.is(TRIMMER)) {
        counts[1]++;
        trimmer(p.sub());
      } else if (p.is(UNIT)) {
        counts[0]++;
        meekInt(p);
      } else {
        indexer(p.sub(), counts);
      }
    }
  }

  private void trimmer(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT)) {
        meekInt(p);
      }
    }
  }

  /** {@code p} is the SELECTOR; the secondary follows it. */
  private Soid selection(Node p, Soid x) {
    Node secondary = p.next();
    Soid d = unit(secondary.sub(), Soid.of(Strength.WEAK, null));
    Mode ori = balancer.uniqueMode(d, Deflexing.SAFE);
    Mode n = ori;
    Pack fields = null;
    for (int i = 0; i < modes.size() && fields == null; i++) {
      if (n.is(ModeKind.STRUCT)) {
        fields = n.pack();
      } else if (n.isRef()
          && (n.sub().isRow() || n.sub().isFlex())
          && n.multiple() != null) {
        fields = n.multiple().pack();
      } else if ((n.isRow() || n.isFlex()) && n.multiple() != null) {
        fields = n.multiple().pack();
      } else if (n.isRef() && coercions.isNameStruct(n)) {
        fields = n.name().pack();
      } else if (Coercibility.isDeprefable(n)) {
        n = n.sub();
      } else {
        break;
      }
    }
    if (fields == null) {
      if (!modes.isIllFormed(d.mode())) {
        diagnostics.error(
            Severity.SEMANTIC,
            secondary.sub(),
            NO_STRUCT,
            ori,
            secondary.sub().attribute().displayName());
      }
      return Soid.of(x.strength(), modes.error);
    }
    secondary.setMode(n);
    String name = p.sub().symbol();
    Pack.Entry field = fields.field(name);
    if (field != null) {
      p.setMode(field.mode());
      return Soid.of(x.strength(), field.mode());
    }
    Mode str = n;
    while (str.isRef()) {
      str = str.sub();
    }
    if (str.isFlex()) {
      str = str.sub();
    }
    if (str.isRow()) {
      str = str.sub();
    }
    diagnostics.error(Severity.SEMANTIC, p, NO_FIELD, str, name);
    return Soid.of(x.strength(), modes.error);
  }

  // Formulas.

  /** Checks an operand, which is a secondary or a (monadic) formula, and records its mode. */
  private Mode operand(Node p, Soid x) {
    guard.enter(p);
    try {
      Soid y;
      if (p.is(MONADIC_FORMULA)) {
        y = monadicFormula(p.sub(), x);
      } else if (p.is(FORMULA)) {
        y = formula(p.sub(), x);
      } else {
        y = unit(p.sub(), Soid.of(Strength.FIRM, null));
      }
      Mode u = balancer.uniqueMode(y, Deflexing.SAFE);
      p.setMode(u);
      return u;
    } finally {
      guard.exit();
    }
  }

  /** {@code p} is the left operand, followed by the operator and the right operand if dyadic. */
  private Soid formula(Node p, Soid x) {
    Mode u = operand(p, x);
    Node op = p.next();
    if (op == null) {
      return Soid.of(x.strength(), u);
    }
    Node q = op.next();
    Mode v = operand(q, x);
    if (modes.isIllFormed(u) || modes.isIllFormed(v)) {
      return Soid.of(x.strength(), modes.error);
    } else if (u == modes.hip) {
      diagnostics.error(Severity.SEMANTIC, p, INVALID_OPERAND, u);
      return Soid.of(x.strength(), modes.error);
    } else if (v == modes.hip) {
      diagnostics.error(Severity.SEMANTIC, q, INVALID_OPERAND, v);
      return Soid.of(x.strength(), modes.error);
    }
    Tag t = operators.find(op.table(), op.symbol(), u, v);
    op.setTag(t);
    if (t == null) {
      diagnostics.error(Severity.SEMANTIC, op, NO_DYADIC, u, op.symbol(), v);
      op.setMode(modes.error);
      return Soid.of(x.strength(), modes.error);
    }
    op.setMode(t.mode());
    return Soid.of(x.strength(), t.mode().sub());
  }

  /** {@code p} is the operator; the operand follows it. */
  private Soid monadicFormula(Node p, Soid x) {
    Soid e = Soid.of(Strength.FIRM, null);
    Mode u = balancer.uniqueMode(formula(p.next(), e), Deflexing.SAFE);
    if (modes.isIllFormed(u)) {
      return Soid.of(x.strength(), modes.error);
    } else if (u == modes.hip) {
      diagnostics.error(Severity.SEMANTIC, p.next(), INVALID_OPERAND, u);
      return Soid.of(x.strength(), modes.error);
    }
    Tag t = null;
    if (!p.symbol().isEmpty() && NOMADS.indexOf(p.symbol().charAt(0)) >= 0) {
      diagnostics.error(Severity.SYNTAX, p, MONADIC_NOMAD, p.symbol(), NOMADS);
    } else {
      t = operators.find(p.table(), p.symbol(), u, null);
      if (t == null) {
        diagnostics.error(Severity.SEMANTIC, p, NO_MONADIC, p.symbol(), u);
      }
    }
    p.setTag(t);
    if (t == null) {
      p.setMode(modes.error);
      return Soid.of(x.strength(), modes.error);
    }
    p.setMode(t.mode());
    return Soid.of(x.strength(), t.mode().sub());
  }

  // Tertiaries and units.

  private Soid assignation(Node p, Soid x) {
    Soid tmp = unit(p, Soid.of(Strength.SOFT, null));
    Mode ori = balancer.uniqueMode(tmp, Deflexing.SAFE);
    Mode name = coercions.deprocCompletely(ori);
    if (!name.isRef()) {
      if (!modes.isIllFormed(name)) {
        diagnostics.error(
            Severity.SEMANTIC, p, NO_NAME, ori, p.sub().attribute().displayName());
      }
      return Soid.of(x.strength(), modes.error);
    }
    p.setMode(name);
    Soid w = Soid.of(Strength.STRONG, name.sub());
    Node source = p.next(2);
    Soid value = unit(source, w);
    if (!coercibleInContext(value, w, Deflexing.FORCE)) {
      cannotCoerce(p, value.mode(), w.mode(), Strength.STRONG, Deflexing.FORCE, UNIT);
      return Soid.of(x.strength(), modes.error);
    }
    return Soid.of(x.strength(), name);
  }

  private Soid identityRelation(Node ln, Soid x) {
    Node rn = ln.next(2);
    Soid e = Soid.of(Strength.SOFT, null);
    Soid l = unit(ln.sub(), e);
    Soid r = unit(rn.sub(), e);
    Mode oril = balancer.uniqueMode(l, Deflexing.SAFE);
    Mode orir = balancer.uniqueMode(r, Deflexing.SAFE);
    Mode lhs = coercions.deprocCompletely(oril);
    Mode rhs = coercions.deprocCompletely(orir);
    if (!modes.isIllFormed(lhs) && lhs != modes.hip && !lhs.isRef()) {
      diagnostics.error(
          Severity.SEMANTIC, ln, NO_NAME, oril, ln.sub().attribute().displayName());
      lhs = modes.error;
    }
    if (!modes.isIllFormed(rhs) && rhs != modes.hip && !rhs.isRef()) {
      diagnostics.error(
          Severity.SEMANTIC, rn, NO_NAME, orir, rn.sub().attribute().displayName());
      rhs = modes.error;
    }
    if (lhs == modes.hip && rhs == modes.hip) {
      diagnostics.error(Severity.SEMANTIC, ln, Balancer.NO_UNIQUE_MODE);
    }
    if (coercions.isCoercible(lhs, rhs, Strength.STRONG, Deflexing.SAFE)) {
      lhs = rhs;
    } else if (coercions.isCoercible(rhs, lhs, Strength.STRONG, Deflexing.SAFE)) {
      rhs = lhs;
    } else {
      cannotCoerce(ln.next(), rhs, lhs, Strength.SOFT, Deflexing.SKIP, TERTIARY);
      lhs = modes.error;
      rhs = modes.error;
    }
    ln.setMode(lhs);
    rn.setMode(rhs);
    return Soid.of(x.strength(), modes.bool);
  }

  private Soid boolFunction(Node ln, Soid x) {
    Node rn = ln.next(2);
    Soid e = Soid.of(Strength.STRONG, modes.bool);
    Soid l = unit(ln.sub(), e);
    if (!coercibleInContext(l, e, Deflexing.SAFE)) {
      cannotCoerce(ln, l.mode(), e.mode(), Strength.MEEK, Deflexing.SAFE, TERTIARY);
    }
    Soid r = unit(rn.sub(), e);
    if (!coercibleInContext(r, e, Deflexing.SAFE)) {
      cannotCoerce(rn, r.mode(), e.mode(), Strength.MEEK, Deflexing.SAFE, TERTIARY);
    }
    ln.setMode(modes.bool);
    rn.setMode(modes.bool);
    return Soid.of(x.strength(), modes.bool);
  }

  /** {@code p} is the first child of a routine text; the body must yield the result mode. */
  private void routineText(Node p) {
    if (p.is(PARAMETER_PACK)) {
      declarer(p.sub());
      p = p.next();
    }
    declarer(p.sub());
    Soid w = Soid.of(Strength.STRONG, p.mode());
    Node body = p.next(2);
    Soid y = unit(body, w);
    if (!coercibleInContext(y, w, Deflexing.FORCE)) {
      cannotCoerce(body, y.mode(), w.mode(), Strength.STRONG, Deflexing.FORCE, UNIT);
    }
  }

  private void formatText(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FORMAT_PATTERN -> formatItem(p, modes.format);
        case GENERAL_PATTERN -> {
          if (p.sub().next() != null) {
            formatItem(p, modes.rowInt);
          }
        }
        case DYNAMIC_REPLICATOR -> formatItem(p, modes.intMode);
        default -> formatText(p.sub());
      }
    }
  }

  private void formatItem(Node p, Mode m) {
    Soid x = Soid.of(Strength.STRONG, m);
    Soid y = enclosed(p.sub().next(), x);
    if (!coercibleInContext(y, x, Deflexing.SAFE)) {
      cannotCoerce(p, y.mode(), m, Strength.STRONG, Deflexing.SAFE, ENCLOSED_CLAUSE);
    }
  }

  // Declarations.

  /** Checks the bounds of the declarers in {@code p} and its siblings. */
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

  private void declarationList(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case IDENTITY_DECLARATION -> identityDeclaration(p.sub());
        case VARIABLE_DECLARATION -> variableDeclaration(p.sub());
        case MODE_DECLARATION -> declarer(p.sub());
        case PROCEDURE_DECLARATION, PROCEDURE_VARIABLE_DECLARATION -> procDeclaration(p.sub());
        case BRIEF_OPERATOR_DECLARATION -> briefOperatorDeclaration(p.sub());
        case OPERATOR_DECLARATION -> operatorDeclaration(p.sub());
        default -> declarationList(p.sub());
      }
    }
  }

  private void identityDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case DECLARER -> declarer(p.sub());
        case DEFINING_IDENTIFIER -> {
          Soid x = Soid.of(Strength.STRONG, p.mode());
          Node source = p.next(2);
          Soid y = unit(source, x);
          if (!coercibleInContext(y, x, Deflexing.SAFE)) {
            cannotCoerce(source, y.mode(), x.mode(), Strength.STRONG, Deflexing.SAFE, UNIT);
          } else if (x.mode() != y.mode()) {
            semanticPitfall(source, x.mode(), IDENTITY_DECLARATION);
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
            Soid x = Soid.of(Strength.STRONG, p.mode().sub());
            Node source = p.next(2);
            Soid y = unit(source, x);
            if (!coercibleInContext(y, x, Deflexing.FORCE)) {
              cannotCoerce(p, y.mode(), x.mode(), Strength.STRONG, Deflexing.FORCE, UNIT);
            } else if (x.mode() != y.mode()) {
              semanticPitfall(source, x.mode(), VARIABLE_DECLARATION);
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
      if (p.is(ROUTINE_TEXT)) {
        routineText(p.sub());
      } else {
        procDeclaration(p.sub());
      }
    }
  }

  private void briefOperatorDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(DEFINING_OPERATOR)) {
        Node text = p.next(2);
        if (p.mode() != text.mode()) {
          cannotCoerce(
              text, text.mode(), p.mode(), Strength.STRONG, Deflexing.SKIP, ROUTINE_TEXT);
        }
        routineText(text.sub());
        return;
      }
      briefOperatorDeclaration(p.sub());
    }
  }

  private void operatorDeclaration(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      if (p.is(DEFINING_OPERATOR)) {
        Soid x = Soid.of(Strength.STRONG, p.mode());
        Node source = p.next(2);
        Soid y = unit(source, x);
        if (!coercibleInContext(y, x, Deflexing.SAFE)) {
          cannotCoerce(source, y.mode(), x.mode(), Strength.STRONG, Deflexing.SAFE, UNIT);
        }
        return;
      }
      operatorDeclaration(p.sub());
    }
  }

  // Clauses.

  private Soid enclosed(Node p, Soid x) {
    Soid y =
        switch (p.attribute()) {
          case ENCLOSED_CLAUSE -> enclosed(p.sub(), x);
          case CLOSED_CLAUSE -> closed(p.sub(), x);
          case PARALLEL_CLAUSE -> {
            Node c = p.sub().next();
            collateral(c.sub(), x);
            c.setMode(modes.voidMode);
            yield Soid.of(Strength.STRONG, modes.voidMode);
          }
          case COLLATERAL_CLAUSE -> collateral(p.sub(), x);
          case CONDITIONAL_CLAUSE -> conditional(p.sub(), x);
          case INTEGER_CASE_CLAUSE -> integerCase(p.sub(), x);
          case UNITED_CASE_CLAUSE -> unitedCase(p.sub(), x);
          case LOOP_CLAUSE -> {
            loop(p.sub());
            yield Soid.of(Strength.STRONG, modes.voidMode);
          }
          // Code clauses are opaque.
          case CODE_CLAUSE -> Soid.of(x.strength(), modes.hip);
          default -> throw new CompilerBug("%s is not an enclosed clause", p);
        };
    p.setMode(y.mode());
    return y;
  }

  private Soid closed(@Nullable Node p, Soid x) {
    for (; p != null; p = p.next()) {
      if (p.is(SERIAL_CLAUSE)) {
        Soid y = serialUnits(p, x, SERIAL_CLAUSE);
        p.setMode(y.mode());
        return y;
      }
    }
    throw new CompilerBug("closed clause without serial clause");
  }

  private Soid collateral(Node p, Soid x) {
    if (p.whether(BEGIN_SYMBOL, END_SYMBOL) || p.whether(OPEN_SYMBOL, CLOSE_SYMBOL)) {
      return Soid.of(
          Strength.STRONG, (x.strength() == Strength.STRONG) ? modes.vacuum : modes.undefined);
    }
    Node list = p.next();
    Soid y = unitList(list, x);
    list.setMode(y.mode());
    p.setMode(y.mode());
    return y;
  }

  /** A row or structure display yields a STOWED of its units' yields. */
  private Soid unitList(Node p, Soid x) {
    Yields r = new Yields();
    Mode m = x.mode();
    if (m != null && m.isFlex()) {
      unitList(r, p.sub(), Soid.of(x.strength(), m.sub().slice()));
    } else if (m != null && m.isRow()) {
      unitList(r, p.sub(), Soid.of(x.strength(), m.slice()));
    } else if (m != null && m.is(ModeKind.STRUCT)) {
      structDisplay(r, p.sub(), m.pack());
    } else {
      unitList(r, p.sub(), x);
    }
    return Soid.of(Strength.STRONG, collect(r, ModeKind.STOWED));
  }

  private void unitList(Yields r, @Nullable Node p, Soid x) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT_LIST)) {
        unitList(r, p.sub(), x);
      } else if (p.is(UNIT)) {
        r.add(p, unit(p, x));
      }
    }
  }

  private void structDisplay(Yields r, @Nullable Node p, Pack fields) {
    for (; p != null; p = p.next()) {
      if (p.is(UNIT_LIST)) {
        structDisplay(r, p.sub(), fields);
      } else if (p.is(UNIT)) {
        int i = r.size();
        Mode m = (i < fields.size()) ? fields.mode(i) : null;
        r.add(p, unit(p, Soid.of(Strength.STRONG, m)));
      }
    }
  }

  /**
   * Checks the phrases of a serial clause. Only the last unit of the clause, and units followed by
   * EXIT, yield its value ({@code k} true); all others are voided.
   */
  private void serial(Yields r, @Nullable Node p, Soid x, boolean k) {
    if (p == null) {
      return;
    }
    switch (p.attribute()) {
      case INITIALISER_SERIES -> {
        serial(r, p.sub(), x, false);
        serial(r, p.next(), x, k);
      }
      case DECLARATION_LIST -> declarationList(p.sub());
      case LABEL, SEMI_SYMBOL, EXIT_SYMBOL -> serial(r, p.next(), x, k);
      case SERIAL_CLAUSE, ENQUIRY_CLAUSE -> {
        Node next = p.next();
        if (next != null) {
          boolean yields = next.isOneOf(EXIT_SYMBOL, END_SYMBOL, CLOSE_SYMBOL, OCCA_SYMBOL);
          serial(r, p.sub(), x, yields);
          serial(r, next, x, k);
        } else {
          serial(r, p.sub(), x, true);
        }
      }
      case LABELED_UNIT -> serial(r, p.sub(), x, k);
      case UNIT -> {
        Soid y = unit(p, k ? x : Soid.of(Strength.STRONG, modes.voidMode));
        if (p.next() != null) {
          serial(r, p.next(), x, k);
        } else if (k) {
          r.add(p, y);
        }
      }
      default -> {}
    }
  }

  private Soid serialUnits(Node p, Soid x, Attribute a) {
    Yields r = new Yields();
    serial(r, p.sub(), x, true);
    if (r.size() > 0 && balancer.isBalanced(p, r.modes, x.strength())) {
      return Soid.of(x.strength(), collect(r, ModeKind.SERIES), a);
    }
    return Soid.of(x.strength(), (x.mode() != null) ? x.mode() : modes.error);
  }

  private Soid enquiry(Node p, Mode m) {
    Soid x = Soid.of(Strength.STRONG, m);
    Soid y = serialUnits(p, x, ENQUIRY_CLAUSE);
    p.setMode(y.mode());
    if (!coercibleInContext(y, x, Deflexing.SAFE)) {
      cannotCoerce(p, y.mode(), m, Strength.MEEK, Deflexing.SAFE, ENQUIRY_CLAUSE);
    }
    return y;
  }

  /** The yield of a clause whose branches were collected in {@code r}. */
  private Soid balance(Node p, Yields r, Soid x, Attribute a) {
    if (!balancer.isBalanced(p, r.modes, x.strength())) {
      return (x.mode() != null)
          ? Soid.of(x.strength(), x.mode(), a)
          : Soid.of(x.strength(), modes.error);
    }
    return Soid.of(x.strength(), collect(r, ModeKind.SERIES), a);
  }

  private Soid conditional(Node p, Soid x) {
    Yields r = new Yields();
    conditionalParts(r, p, x);
    return balance(p, r, x, CONDITIONAL_CLAUSE);
  }

  /** {@code p} is the IF part; THEN and ELSE or ELIF parts follow. */
  private void conditionalParts(Yields r, Node p, Soid x) {
    enquiry(p.sub().next(), modes.bool);
    p = p.next();
    serial(r, p.sub().next(), x, true);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(ELSE_PART, CHOICE)) {
      serial(r, p.sub().next(), x, true);
    } else if (p.isOneOf(ELIF_PART, BRIEF_ELIF_IF_PART)) {
      conditionalParts(r, p.sub(), x);
    }
  }

  private Soid integerCase(Node p, Soid x) {
    Yields r = new Yields();
    integerCaseParts(r, p, x);
    return balance(p, r, x, INTEGER_CASE_CLAUSE);
  }

  private void integerCaseParts(Yields r, Node p, Soid x) {
    enquiry(p.sub().next(), modes.intMode);
    p = p.next();
    unitList(r, p.sub().next(), x);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(OUT_PART, CHOICE)) {
      serial(r, p.sub().next(), x, true);
    } else if (p.isOneOf(INTEGER_OUT_PART, BRIEF_INTEGER_OUSE_PART)) {
      integerCaseParts(r, p.sub(), x);
    }
  }

  private Soid unitedCase(Node p, Soid x) {
    Yields r = new Yields();
    unitedCaseParts(r, p, x);
    return balance(p, r, x, UNITED_CASE_CLAUSE);
  }

  /**
   * The union a conformity clause selects on comes from its enquiry, or from its specifiers if the
   * enquiry yields nothing definite. It is stored on the CASE symbol for coercion.
   */
  private void unitedCaseParts(Yields r, Node p, Soid x) {
    Node enquiry = p.sub().next();
    Soid y = serialUnits(enquiry, Soid.of(Strength.STRONG, null), ENQUIRY_CLAUSE);
    enquiry.setMode(y.mode());
    Mode u = coercions.deprefCompletely(modes.unite(coercions.deprefCompletely(y.mode())));
    List<Mode> specified = new ArrayList<>();
    specifiedModes(p.next().sub().next(), specified);
    Mode v = modes.unite(modes.collection(ModeKind.SERIES, specified, null));
    Mode w;
    if (u == modes.hip) {
      w = v;
    } else if (u.is(ModeKind.UNION)) {
      boolean uv = allFirmlyRelated(components(u), components(v));
      boolean vu = allFirmlyRelated(components(v), components(u));
      w = (uv == vu) ? u : balancer.absorbRelatedSubsets(u);
    } else {
      if (!modes.isIllFormed(u)) {
        diagnostics.error(Severity.SEMANTIC, enquiry, NO_UNION, u);
      }
      return;
    }
    p.sub().setMode(w);
    p = p.next();
    specifiedUnitList(r, p.sub().next(), x, w);
    p = p.next();
    if (p == null) {
      return;
    }
    if (p.isOneOf(OUT_PART, CHOICE)) {
      serial(r, p.sub().next(), x, true);
    } else if (p.isOneOf(UNITED_OUSE_PART, BRIEF_UNITED_OUSE_PART)) {
      unitedCaseParts(r, p.sub(), x);
    }
  }

  private static List<Mode> components(Mode m) {
    return m.is(ModeKind.UNION) ? m.pack().modes() : List.of(m);
  }

  /** True if every mode of {@code v} is firmly related to some mode of {@code u}. */
  private boolean allFirmlyRelated(List<Mode> u, List<Mode> v) {
    for (Mode b : v) {
      boolean k = false;
      for (Mode a : u) {
        k |= coercions.isFirm(a, b);
      }
      if (!k) {
        return false;
      }
    }
    return true;
  }

  private void specifiedModes(@Nullable Node p, List<Mode> specified) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(SPECIFIED_UNIT_LIST, SPECIFIED_UNIT)) {
        specifiedModes(p.sub(), specified);
      } else if (p.is(SPECIFIER)) {
        specified.add(p.sub().next().mode());
      }
    }
  }

  private void specifiedUnitList(Yields r, @Nullable Node p, Soid x, Mode u) {
    for (; p != null; p = p.next()) {
      if (p.isOneOf(SPECIFIED_UNIT_LIST, SPECIFIED_UNIT)) {
        specifiedUnitList(r, p.sub(), x, u);
      } else if (p.is(SPECIFIER)) {
        Mode m = p.sub().next().mode();
        if (!coercions.isUnitable(m, u, Deflexing.SAFE)) {
          diagnostics.error(Severity.SEMANTIC, p, NO_COMPONENT, m, u);
        }
      } else if (p.is(UNIT)) {
        r.add(p, unit(p, x));
      }
    }
  }

  private void loop(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case FROM_PART, BY_PART, TO_PART -> {
          Node u = p.sub().next();
          Soid x = Soid.of(Strength.STRONG, modes.intMode);
          Soid y = unit(u, x);
          if (!coercibleInContext(y, x, Deflexing.SAFE)) {
            cannotCoerce(u, y.mode(), x.mode(), Strength.MEEK, Deflexing.SAFE, ENQUIRY_CLAUSE);
          }
        }
        case WHILE_PART -> enquiry(p.sub().next(), modes.bool);
        case DO_PART, ALT_DO_PART -> {
          Node q = p.sub().next();
          if (q != null && q.is(SERIAL_CLAUSE)) {
            serial(new Yields(), q, Soid.of(Strength.STRONG, modes.voidMode), true);
            q = q.next();
          }
          if (q != null && q.is(UNTIL_PART)) {
            enquiry(q.sub().next(), modes.bool);
          }
        }
        default -> {}
      }
    }
  }
}
