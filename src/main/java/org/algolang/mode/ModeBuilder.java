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

package org.algolang.mode;

import static org.algolang.tree.Attribute.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.algolang.Session;
import org.algolang.diag.CompilerBug;
import org.algolang.diag.DepthGuard;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.taxes.SymbolTable;
import org.algolang.taxes.Tag;
import org.algolang.taxes.TagKind;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the mode graph of a program.
 *
 * <ol>
 *   <li>Every declarer, routine text, operator plan, generator and denotation gets its mode, and
 *       so do the defining occurrences of identifiers and operators. An indicant in a declarer
 *       gets an INDICANT mode that stands for its definition.
 *   <li>Each INDICANT mode is bound to the mode of its definition. Indicants defined in terms of
 *       each other only ({@code MODE A = B, B = A}) are reported and bound to the error mode;
 *       the other declared modes are checked for well-formedness.
 *   <li>Derived forms are added and equivalent modes merged, repeatedly, until neither changes
 *       anything.
 *   <li>All references to merged modes, in the mode table and in the tree, are replaced by their
 *       canonical representative.
 * </ol>
 */
public final class ModeBuilder {
  private static final Logger logger = LoggerFactory.getLogger(ModeBuilder.class);

  static final String CYCLIC_MODE =
      "mode \"%s\" is not well-formed: it is defined in terms of itself";

  /** The derivation and merging of modes always settles well within this many rounds. */
  private static final int MAX_CYCLES = 16;

  private final ModeTable table;
  private final Diagnostics diagnostics;
  private final DepthGuard guard;

  /** For each defining indicant, the mode of the declarer it is defined as. */
  private final Map<Node, Mode> definitions = new HashMap<>();

  private ModeBuilder(Session session) {
    this.table = session.modes();
    this.diagnostics = session.diagnostics();
    this.guard = session.depthGuard();
  }

  /** Builds the modes of the program {@code p}. */
  public static void build(Session session, Node p) {
    ModeBuilder builder = new ModeBuilder(session);
    builder.collect(p);
    builder.bindIndicants();
    builder.settle();
    builder.track(p, session.standardEnvironment());
    WellFormedness checks = new WellFormedness(builder.table, builder.diagnostics);
    checks.checkFlex(p);
    checks.checkDeclaredModes();
  }

  // Modes of the tree.

  private void collect(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case DECLARER -> declarer(p);
        case ROUTINE_TEXT -> routineText(p);
        case OPERATOR_PLAN -> operatorPlan(p);
        case VOID_SYMBOL -> p.setMode(table.voidMode);
        case GENERATOR -> {
          Mode m = table.ref(declarer(p.sub().next()));
          p.setMode(m);
          p.sub().setMode(m);
        }
        case DENOTATION -> denotation(p);
        case SPECIFIER -> specifier(p);
        case FOR_PART -> p.sub().next().setMode(table.intMode);
        default -> {}
      }
      collect(p.sub());
      declaration(p);
    }
  }

  /** Gives the defining occurrences directly below declaration {@code p} their modes. */
  private void declaration(Node p) {
    Attribute a = p.attribute();
    for (Node q = p.sub(); q != null; q = q.next()) {
      if (q.is(DEFINING_IDENTIFIER) || q.is(DEFINING_OPERATOR)) {
        Mode m =
            switch (a) {
              case IDENTITY_DECLARATION -> declarerMode(p);
              case VARIABLE_DECLARATION -> table.ref(declarerMode(p));
              case PROCEDURE_DECLARATION, BRIEF_OPERATOR_DECLARATION -> valueMode(q);
              case PROCEDURE_VARIABLE_DECLARATION -> table.ref(valueMode(q));
              case OPERATOR_DECLARATION -> planMode(p);
              default -> null;
            };
        if (m != null) {
          q.setMode(m);
        }
      } else if (q.is(DEFINING_INDICANT) && a == MODE_DECLARATION) {
        Node d = q.next(2);
        definitions.put(q, (d == null || d.mode() == null) ? table.error : d.mode());
        q.setMode(table.add(ModeKind.INDICANT, 0, q, null, null));
      }
    }
  }

  /** The mode of the first declarer of a declaration list such as {@code INT i, j}. */
  private Mode declarerMode(Node declaration) {
    for (Node q = declaration; q != null; q = q.sub()) {
      Node d = q.child(DECLARER);
      if (d != null) {
        return declarer(d);
      }
      if (q.sub() == null || !q.sub().is(declaration.attribute())) {
        break;
      }
    }
    return table.error;
  }

  private Mode planMode(Node declaration) {
    for (Node q = declaration; q != null; q = q.sub()) {
      Node plan = q.child(OPERATOR_PLAN);
      if (plan != null) {
        return operatorPlan(plan);
      }
    }
    return table.error;
  }

  /** The mode of the routine text in {@code PROC f = ..} or {@code OP + = ..}. */
  private Mode valueMode(Node defining) {
    Node value = defining.next(2);
    return (value != null && value.is(ROUTINE_TEXT)) ? routineText(value) : table.error;
  }

  Mode declarer(Node p) {
    if (p.mode() != null) {
      return p.mode();
    }
    guard.enter(p);
    try {
      Mode m = shape(p, p.sub());
      p.setMode(m);
      return m;
    } finally {
      guard.exit();
    }
  }

  private Mode declarerOrVoid(@Nullable Node p) {
    if (p == null) {
      return table.error;
    } else if (p.is(VOID_SYMBOL)) {
      p.setMode(table.voidMode);
      return table.voidMode;
    }
    return declarer(p);
  }

  private Mode shape(Node p, @Nullable Node q) {
    if (q == null) {
      return table.error;
    }
    switch (q.attribute()) {
      case LONGETY, SHORTETY:
        return indicant(sizety(q), q.next());
      case INDICANT:
        return indicant(0, q);
      case REF_SYMBOL:
        return table.ref(declarer(q.next()));
      case FLEX_SYMBOL:
        {
          Node r = q.next();
          Mode row =
              (r != null && (r.is(BOUNDS) || r.is(FORMAL_BOUNDS)))
                  ? table.addRow(dimensions(r), declarer(r.next()), p, false)
                  : (r == null) ? table.error : declarer(r);
          return table.add(ModeKind.FLEX, 0, p, row, null);
        }
      case BOUNDS, FORMAL_BOUNDS:
        return table.addRow(dimensions(q), declarer(q.next()), p, false);
      case STRUCT_SYMBOL:
        {
          Pack pack = new Pack();
          fields(q.next(), null, pack);
          return table.add(ModeKind.STRUCT, pack.size(), p, null, pack);
        }
      case UNION_SYMBOL:
        {
          Pack pack = new Pack();
          components(q.next(), pack);
          return table.add(ModeKind.UNION, pack.size(), p, null, pack);
        }
      case PROC_SYMBOL:
        {
          Pack pack = new Pack();
          Node r = q.next();
          if (r != null && r.is(FORMAL_DECLARERS)) {
            components(r.sub(), pack);
            r = r.next();
          }
          return table.add(ModeKind.PROC, pack.size(), p, declarerOrVoid(r), pack);
        }
      default:
        return table.error;
    }
  }

  /** The number of LONGs (positive) or SHORTs (negative) in a LONGETY or SHORTETY. */
  static int sizety(Node p) {
    int[] k = {0};
    p.sub().forEachInTree(
        q -> {
          if (q.is(LONG_SYMBOL)) {
            k[0]++;
          } else if (q.is(SHORT_SYMBOL)) {
            k[0]--;
          }
        });
    return k[0];
  }

  private Mode indicant(int sizety, @Nullable Node q) {
    if (q == null) {
      return table.error;
    }
    if (q.sub() != null) {
      Mode m = table.searchStandard(sizety, q.sub().symbol());
      return (m == null) ? table.error : m;
    }
    SymbolTable t = q.table();
    Tag tag = (t == null) ? null : t.findGlobal(TagKind.INDICANT, q.symbol());
    if (tag == null || tag.node() == null) {
      return table.error;
    }
    return table.add(ModeKind.INDICANT, 0, tag.node(), null, null);
  }

  /** Counts the dimensions of bounds {@code [1:n, 1:m]} or formal bounds {@code [,]}. */
  private static int dimensions(Node bounds) {
    int[] commas = {0};
    countCommas(bounds.sub(), commas);
    return commas[0] + 1;
  }

  private static void countCommas(@Nullable Node p, int[] commas) {
    for (; p != null; p = p.next()) {
      if (p.is(COMMA_SYMBOL)) {
        commas[0]++;
      } else if (p.isOneOf(BOUNDS_LIST, FORMAL_BOUNDS_LIST, ALT_FORMAL_BOUNDS_LIST)) {
        countCommas(p.sub(), commas);
      }
    }
  }

  /** Adds the fields of a structure pack; field names become FIELD_IDENTIFIERs. */
  private @Nullable Mode fields(@Nullable Node p, @Nullable Mode current, Pack pack) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case STRUCTURE_PACK, STRUCTURED_FIELD_LIST, STRUCTURED_FIELD ->
            current = fields(p.sub(), current, pack);
        case DECLARER -> current = declarer(p);
        case IDENTIFIER, FIELD_IDENTIFIER -> {
          p.setAttribute(FIELD_IDENTIFIER);
          p.setMode(current);
          pack.add(current == null ? table.error : current, p.symbol(), p);
        }
        default -> {}
      }
    }
    return current;
  }

  /** Adds the declarers of a union pack or a formal declarer pack. */
  private void components(@Nullable Node p, Pack pack) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case UNION_PACK, UNION_DECLARER_LIST, FORMAL_DECLARERS, FORMAL_DECLARERS_LIST ->
            components(p.sub(), pack);
        case DECLARER -> pack.add(declarer(p), null, p);
        case VOID_SYMBOL -> {
          p.setMode(table.voidMode);
          pack.add(table.voidMode, null, p);
        }
        default -> {}
      }
    }
  }

  /**
   * Adds the parameters of a parameter pack; each parameter identifier gets its mode. Parameter
   * names are not part of the routine's mode.
   */
  private @Nullable Mode parameters(@Nullable Node p, @Nullable Mode current, Pack pack) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case PARAMETER_PACK, PARAMETER_LIST, PARAMETER ->
            current = parameters(p.sub(), current, pack);
        case DECLARER -> current = declarer(p);
        case IDENTIFIER, DEFINING_IDENTIFIER -> {
          Mode m = (current == null) ? table.error : current;
          p.setMode(m);
          pack.add(m, null, p);
        }
        default -> {}
      }
    }
    return current;
  }

  private Mode routineText(Node p) {
    if (p.mode() != null) {
      return p.mode();
    }
    Pack pack = new Pack();
    Node q = p.sub();
    if (q.is(PARAMETER_PACK)) {
      parameters(q, null, pack);
      q = q.next();
    }
    Mode m = table.add(ModeKind.PROC, pack.size(), null, declarerOrVoid(q), pack);
    p.setMode(m);
    return m;
  }

  private Mode operatorPlan(Node p) {
    if (p.mode() != null) {
      return p.mode();
    }
    Pack pack = new Pack();
    Node q = p.sub().next();
    if (q != null && q.is(FORMAL_DECLARERS)) {
      components(q.sub(), pack);
      q = q.next();
    }
    Mode m = table.add(ModeKind.PROC, pack.size(), null, declarerOrVoid(q), pack);
    p.setMode(m);
    return m;
  }

  private void specifier(Node p) {
    Node q = p.sub().next();
    Mode m = declarerOrVoid(q);
    p.setMode(m);
    if (q != null && q.next() != null && q.next().is(IDENTIFIER)) {
      q.next().setMode(m);
    }
  }

  private void denotation(Node p) {
    Node q = p.sub();
    int sizety = 0;
    if (q.isOneOf(LONGETY, SHORTETY)) {
      sizety = sizety(q);
      q = q.next();
    }
    Mode m =
        switch (q.attribute()) {
          case INT_DENOTATION -> table.searchStandard(sizety, "INT");
          case REAL_DENOTATION -> table.searchStandard(sizety, "REAL");
          case BITS_DENOTATION -> table.searchStandard(sizety, "BITS");
          case ROW_CHAR_DENOTATION ->
              q.symbol().length() == 1 ? table.charMode : table.rowChar;
          case TRUE_SYMBOL, FALSE_SYMBOL -> table.bool;
          case EMPTY_SYMBOL -> table.voidMode;
          default -> table.error;
        };
    p.setMode(m);
    q.setMode(m);
  }

  // Indicants.

  private void bindIndicants() {
    List<Mode> indicants = new ArrayList<>();
    for (Mode m : table) {
      if (m.is(ModeKind.INDICANT) && m.equivalent == null) {
        indicants.add(m);
      }
    }
    Set<Mode> cyclic = new HashSet<>();
    for (Mode m : indicants) {
      if (isCyclic(m)) {
        cyclic.add(m);
        diagnostics.error(Severity.SEMANTIC, m.node(), CYCLIC_MODE, m.node().symbol());
      }
    }
    for (Mode m : indicants) {
      Mode def = definitions.get(m.node());
      m.equivalent = (def == null || cyclic.contains(m)) ? table.error : def;
    }
    WellFormedness checks = new WellFormedness(table, diagnostics);
    // An ill-formed indicant stands for the error mode, so that deriving forms terminates.
    for (Mode m : indicants) {
      if (!cyclic.contains(m) && m.equivalent != table.error && !checks.checkIndicant(m)) {
        m.equivalent = table.error;
      }
    }
  }

  /** True if following the chain of definitions from {@code m} leads back to {@code m}. */
  private boolean isCyclic(Mode m) {
    Set<Node> visited = new HashSet<>();
    Mode z = m;
    while (z != null && z.is(ModeKind.INDICANT) && visited.add(z.node())) {
      z = definitions.get(z.node());
      if (z == m) {
        return true;
      }
    }
    return false;
  }

  // Derived modes and equivalence.

  private void settle() {
    DerivedModes derived = new DerivedModes(table);
    int cycles = 0;
    boolean changed = true;
    while (changed) {
      if (++cycles > MAX_CYCLES) {
        throw new CompilerBug("modes do not settle after %d cycles", MAX_CYCLES);
      }
      int k = derived.pass();
      int merged = merge();
      logger.debug("mode cycle {}: {} derivations, {} merges", cycles, k, merged);
      changed = k + merged > 0;
    }
    table.seal(derived);
  }

  /** Links each mode that is equivalent to an older one to that older mode. */
  private int merge() {
    int merged = 0;
    for (int i = 0; i < table.size(); i++) {
      Mode a = table.get(i);
      if (!isMergeable(a)) {
        continue;
      }
      for (int j = i + 1; j < table.size(); j++) {
        Mode b = table.get(j);
        if (isMergeable(b) && a.kind() == b.kind() && table.prove(a, b)) {
          b.equivalent = a;
          merged++;
        }
      }
    }
    return merged;
  }

  private static boolean isMergeable(Mode m) {
    return m.equivalent == null && !m.is(ModeKind.STANDARD) && !m.is(ModeKind.INDICANT);
  }

  /** Replaces every reference to a merged mode by its canonical representative. */
  private void track(Node p, SymbolTable standardEnvironment) {
    for (Mode m : table) {
      m.sub = Mode.resolve(m.sub);
      m.pack.resolveEquivalents();
      m.slice = Mode.resolve(m.slice);
      m.deflexed = Mode.resolve(m.deflexed);
      m.name = Mode.resolve(m.name);
      m.multiple = Mode.resolve(m.multiple);
      m.trim = Mode.resolve(m.trim);
    }
    p.forEachInTree(
        q -> {
          if (q.mode() != null) {
            q.setMode(Mode.resolve(q.mode()));
          }
        });
    for (TagKind kind : TagKind.values()) {
      for (Tag t : standardEnvironment.tags(kind)) {
        if (t.mode() != null) {
          t.setMode(Mode.resolve(t.mode()));
        }
      }
    }
  }
}
