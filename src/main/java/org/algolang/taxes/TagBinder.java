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

package org.algolang.taxes;

import static org.algolang.tree.Attribute.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.algolang.Session;
import org.algolang.diag.Diagnostics;
import org.algolang.diag.Severity;
import org.algolang.mode.Coercibility;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeKind;
import org.algolang.mode.ModeTable;
import org.algolang.mode.Pack;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes the symbol tables once modes are known, and binds every applied occurrence of a tag to
 * its declaration.
 *
 * <p>The declarations found while parsing get their modes here; the identifiers that are only
 * declared once ranges are final (parameters, specifiers and loop identifiers) are entered, as are
 * anonymous tags for routine texts, format texts and local generators. Applied identifiers are then
 * searched outward from their range; an identifier that cannot be found is reported once and
 * declared with the error mode, so that its other uses are not reported again.
 */
public final class TagBinder {
  private static final Logger logger = LoggerFactory.getLogger(TagBinder.class);

  static final String UNDECLARED_TAG = "tag \"%s\" has not been declared properly";
  static final String UNDECLARED_LABEL = "label \"%s\" has not been declared";
  static final String OPERAND_NUMBER = "operator \"%s\" must have one or two operands";
  static final String MONADIC_NOMAD = "monadic operator \"%s\" cannot start with any of \"%s\"";
  static final String NO_PRIORITY = "dyadic operator \"%s\" has no priority declaration";
  static final String FIRMLY_RELATED = "operator \"%s\" %s is firmly related to \"%s\" %s";
  static final String TAG_UNUSED = "tag \"%s\" is not used";
  static final String HIDES = "declaration hides a declaration of \"%s\" in an outer range";
  static final String HIDES_STANDARD = "declaration hides standard \"%s\"";
  static final String JUMP_FROM_ROUTINE = "jump to \"%s\" leaves the routine text";
  static final String NOT_PORTABLE = "%s is not portable";

  /** Monadic operators may not start with these characters, which begin dyadic ones. */
  static final String NOMADS = "></=*";

  private final Session session;
  private final Diagnostics diagnostics;
  private final ModeTable modes;
  private final SymbolTable standardEnvironment;

  private TagBinder(Session session) {
    this.session = session;
    this.diagnostics = session.diagnostics();
    this.modes = session.modes();
    this.standardEnvironment = session.standardEnvironment();
  }

  /** Completes and binds the tags of program {@code p}, whose modes have been built. */
  public static void bind(Session session, Node p) {
    TagBinder b = new TagBinder(session);
    b.definingOccurrences(p);
    b.implicitDeclarations(p);
    b.taxTags(p);
    b.anonymousTags(p);
    b.bindApplied(p);
    Set<SymbolTable> tables = tables(p);
    Coercibility coercions = new Coercibility(b.modes);
    for (SymbolTable t : tables) {
      b.firmlyRelatedOperators(coercions, t);
      b.hiding(t);
    }
    b.jumpsFromRoutines(p, null);
    for (SymbolTable t : tables) {
      b.unusedTags(t);
    }
    if (session.options().portcheck()) {
      b.portcheck(p);
    }
    logger.debug("bound tags in {} ranges", tables.size());
  }

  /** The tables of all ranges of {@code p}, outer ranges first. */
  static Set<SymbolTable> tables(Node p) {
    Set<SymbolTable> tables = new LinkedHashSet<>();
    p.forEachInTree(
        q -> {
          if (q.table() != null && !q.table().isStandardEnvironment()) {
            tables.add(q.table());
          }
        });
    return tables;
  }

  // Declarations.

  /**
   * Reduction moves a defining occurrence that starts a phrase (as in {@code lab: ..}) into a new
   * node; the tag follows it.
   */
  private void definingOccurrences(Node p) {
    p.forEachInTree(
        q -> {
          if (q.isOneOf(DEFINING_IDENTIFIER, DEFINING_INDICANT, DEFINING_OPERATOR)
              && q.tag() != null) {
            q.tag().setNode(q);
          }
        });
  }

  private Tag declare(Node q, TagKind kind, @Nullable Mode mode, Tag.Origin origin) {
    Tag tag = q.table().declare(diagnostics, kind, q, mode);
    tag.setOrigin(origin);
    q.setAttribute(DEFINING_IDENTIFIER);
    q.setTag(tag);
    return tag;
  }

  /** Parameters, specifiers and loop identifiers. */
  private void implicitDeclarations(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case PARAMETER -> {
          for (Node q = p.sub(); q != null; q = q.next()) {
            if (q.is(IDENTIFIER)) {
              declare(q, TagKind.IDENTIFIER, q.mode(), Tag.Origin.PARAMETER);
            }
          }
        }
        case SPECIFIER -> {
          Node q = p.sub().next(2);
          if (q != null && q.is(IDENTIFIER)) {
            declare(q, TagKind.IDENTIFIER, q.mode(), Tag.Origin.SPECIFIER);
          }
        }
        case FOR_PART -> {
          Node q = p.sub().next();
          if (q != null && q.tag() == null) {
            declare(q, TagKind.IDENTIFIER, modes.intMode, Tag.Origin.LOOP);
          }
        }
        default -> {}
      }
      implicitDeclarations(p.sub());
    }
  }

  /** Gives declared tags their modes, bodies and heap qualifiers, and checks operators. */
  private void taxTags(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      Attribute a = p.attribute();
      for (Node q = p.sub(); q != null; q = q.next()) {
        Tag tag = q.tag();
        if (tag == null || !q.isOneOf(DEFINING_IDENTIFIER, DEFINING_OPERATOR)) {
          continue;
        }
        switch (a) {
          case IDENTITY_DECLARATION -> {
            Node value = q.next(2);
            tag.setMode(q.mode());
            tag.setBody(value);
            tag.setHeap(isHeapGenerator(value));
          }
          case VARIABLE_DECLARATION, PROCEDURE_VARIABLE_DECLARATION -> {
            tag.setMode(q.mode());
            if (isHeap(p)) {
              tag.setHeap(true);
            } else if (q.mode() != null && q.mode().sub() != null) {
              q.table().addAnonymous(q, Tag.Origin.GENERATOR, q.mode().sub());
            }
            Node assign = q.next();
            if (assign != null && assign.is(ASSIGN_SYMBOL)) {
              tag.setBody(assign.next());
            }
          }
          case PROCEDURE_DECLARATION -> {
            tag.setMode(q.mode());
            tag.setBody(q.next(2));
          }
          case OPERATOR_DECLARATION, BRIEF_OPERATOR_DECLARATION -> {
            tag.setMode(q.mode());
            tag.setBody(q.next(2));
            checkOperator(q, tag);
          }
          default -> {}
        }
      }
      taxTags(p.sub());
    }
  }

  /** True if the first qualifier of a variable declaration list is HEAP. */
  private static boolean isHeap(Node declaration) {
    for (Node q = declaration; q != null; q = q.sub()) {
      Node qualifier = q.child(QUALIFIER);
      if (qualifier != null) {
        return qualifier.sub() != null && qualifier.sub().is(HEAP_SYMBOL);
      }
      if (q.sub() == null || !q.sub().is(declaration.attribute())) {
        break;
      }
    }
    return false;
  }

  /** True if {@code unit} is, apart from wrapping phrases, a HEAP generator. */
  private static boolean isHeapGenerator(@Nullable Node unit) {
    Node q = unit;
    while (q != null && !q.is(GENERATOR) && q.sub() != null && q.sub().next() == null) {
      q = q.sub();
    }
    return q != null && q.is(GENERATOR) && q.sub().is(HEAP_SYMBOL);
  }

  private void checkOperator(Node q, Tag tag) {
    Mode m = tag.mode();
    if (m == null || !m.is(ModeKind.PROC)) {
      return;
    }
    int operands = m.pack().size();
    if (operands == 1) {
      if (NOMADS.indexOf(q.symbol().charAt(0)) >= 0) {
        diagnostics.error(Severity.SEMANTIC, q, MONADIC_NOMAD, q.symbol(), NOMADS);
      }
    } else if (operands == 2) {
      Tag prio = q.table().findGlobal(TagKind.PRIORITY, q.symbol());
      if (prio == null) {
        diagnostics.error(Severity.SEMANTIC, q, NO_PRIORITY, q.symbol());
      } else {
        tag.setPriority(prio.priority());
        prio.markUsed();
      }
    } else {
      diagnostics.error(Severity.SEMANTIC, q, OPERAND_NUMBER, q.symbol());
    }
  }

  private void anonymousTags(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case ROUTINE_TEXT -> {
          Tag tag = p.table().addAnonymous(p, Tag.Origin.ROUTINE_TEXT, p.mode());
          tag.markUsed();
          p.setTag(tag);
        }
        case FORMAT_TEXT -> {
          Tag tag = p.table().addAnonymous(p, Tag.Origin.FORMAT_TEXT, modes.format);
          tag.markUsed();
          p.setTag(tag);
        }
        case GENERATOR -> {
          if (p.sub().is(LOC_SYMBOL) && p.mode() != null) {
            p.setTag(p.table().addAnonymous(p, Tag.Origin.GENERATOR, p.mode().sub()));
          }
        }
        default -> {}
      }
      anonymousTags(p.sub());
    }
  }

  // Applied occurrences.

  private void bindApplied(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case IDENTIFIER -> bindIdentifier(p);
        case INDICANT -> {
          if (p.sub() == null && p.table() != null) {
            Tag tag = p.table().findGlobal(TagKind.INDICANT, p.symbol());
            if (tag != null) {
              tag.markUsed();
              p.setTag(tag);
            }
          }
        }
        case OPERATOR -> markOperatorsUsed(p);
        default -> {}
      }
      bindApplied(p.sub());
    }
  }

  private void bindIdentifier(Node p) {
    SymbolTable table = p.table();
    if (table == null) {
      return;
    }
    boolean jump = p.previous() != null && p.previous().is(GOTO_SYMBOL);
    Tag tag =
        jump
            ? table.findGlobal(TagKind.LABEL, p.symbol())
            : table.findIdentifierOrLabel(p.symbol());
    if (tag == null && !jump) {
      tag = lengthened(p.symbol());
    }
    if (tag == null) {
      diagnostics.error(
          Severity.SEMANTIC, p, jump ? UNDECLARED_LABEL : UNDECLARED_TAG, p.symbol());
      tag = table.declare(diagnostics, TagKind.IDENTIFIER, p, modes.error);
    }
    tag.markUsed();
    p.setTag(tag);
    if (tag.mode() != null) {
      p.setMode(tag.mode());
    }
  }

  /**
   * Returns a standard routine or constant for a name such as {@code longsqrt} or {@code
   * longlongpi}, made from the one without the LONG or SHORT prefixes; null if there is none.
   */
  private @Nullable Tag lengthened(String name) {
    int sizety = 0;
    String base = name;
    while (true) {
      if (base.startsWith("long")) {
        sizety++;
        base = base.substring(4);
      } else if (base.startsWith("short")) {
        sizety--;
        base = base.substring(5);
      } else {
        break;
      }
    }
    if (sizety == 0) {
      return null;
    }
    Tag t = standardEnvironment.findLocal(TagKind.IDENTIFIER, base);
    Mode m = (t == null || t.mode() == null) ? null : lengthen(t.mode(), sizety);
    return (m == null) ? null : standardEnvironment.addStandard(TagKind.IDENTIFIER, name, m);
  }

  private @Nullable Mode lengthen(Mode m, int sizety) {
    if (m.is(ModeKind.STANDARD)) {
      String name = m.standardName();
      if (name.equals("INT") || name.equals("REAL") || name.equals("BITS")) {
        return modes.searchStandard(m.dimension() + sizety, name);
      }
      return m;
    } else if (m.is(ModeKind.PROC)) {
      Mode result = lengthen(m.sub(), sizety);
      Mode[] parameters = new Mode[m.pack().size()];
      for (int i = 0; i < parameters.length; i++) {
        parameters[i] = lengthen(m.pack().mode(i), sizety);
        if (parameters[i] == null) {
          return null;
        }
      }
      return (result == null) ? null : modes.proc(result, parameters);
    }
    return null;
  }

  private static void markOperatorsUsed(Node p) {
    for (SymbolTable t = p.table(); t != null; t = t.parent()) {
      List<Tag> ops = t.operators(p.symbol());
      if (!ops.isEmpty()) {
        ops.forEach(Tag::markUsed);
        return;
      }
    }
  }

  // Checks.

  /**
   * Two operators in one range are firmly related if they have the same symbol and number of
   * operands, and each operand of one is firmly related to the corresponding operand of the other;
   * an application could then not choose between them.
   */
  private void firmlyRelatedOperators(Coercibility coercions, SymbolTable t) {
    List<Tag> ops = t.tags(TagKind.OPERATOR);
    for (int i = 0; i < ops.size(); i++) {
      Tag s = ops.get(i);
      for (int j = i + 1; j < ops.size(); j++) {
        Tag u = ops.get(j);
        if (s.name().equals(u.name()) && isFirmlyRelated(coercions, s.mode(), u.mode())) {
          diagnostics.error(
              Severity.SEMANTIC, u.node(), FIRMLY_RELATED, u.name(), u.mode(), s.name(), s.mode());
        }
      }
    }
  }

  private static boolean isFirmlyRelated(
      Coercibility coercions, @Nullable Mode a, @Nullable Mode b) {
    if (a == null || b == null || !a.is(ModeKind.PROC) || !b.is(ModeKind.PROC)) {
      return false;
    }
    Pack p = a.pack();
    Pack q = b.pack();
    if (p.size() != q.size()) {
      return false;
    }
    for (int i = 0; i < p.size(); i++) {
      if (!coercions.isFirm(p.mode(i), q.mode(i))) {
        return false;
      }
    }
    return true;
  }

  private void hiding(SymbolTable t) {
    SymbolTable outer = t.parent();
    if (outer == null) {
      return;
    }
    for (TagKind kind : new TagKind[] {TagKind.IDENTIFIER, TagKind.INDICANT}) {
      for (Tag tag : t.tags(kind)) {
        Tag hidden = outer.findGlobal(kind, tag.name());
        if (hidden == null || tag.node() == null) {
          continue;
        }
        if (hidden.isStandard()) {
          diagnostics.warning(tag.node(), HIDES_STANDARD, tag.name());
        } else {
          diagnostics.hint(tag.node(), HIDES, tag.name());
        }
      }
    }
  }

  /** Jumps out of a routine text must unwind the routine's frames. */
  private void jumpsFromRoutines(@Nullable Node p, @Nullable SymbolTable routine) {
    for (; p != null; p = p.next()) {
      if (p.is(ROUTINE_TEXT) && p.sub() != null) {
        jumpsFromRoutines(p.sub(), p.sub().table());
        continue;
      }
      if (p.is(IDENTIFIER) && p.tag() != null && p.tag().is(TagKind.LABEL)) {
        Tag label = p.tag();
        if (routine != null && !label.table().isWithin(routine)) {
          diagnostics.hint(p, JUMP_FROM_ROUTINE, label.name());
        }
      }
      jumpsFromRoutines(p.sub(), routine);
    }
  }

  private void unusedTags(SymbolTable t) {
    for (TagKind kind :
        new TagKind[] {TagKind.OPERATOR, TagKind.PRIORITY, TagKind.IDENTIFIER, TagKind.INDICANT}) {
      for (Tag tag : t.tags(kind)) {
        if (!tag.used()
            && tag.node() != null
            && tag.origin() != Tag.Origin.PARAMETER
            && tag.origin() != Tag.Origin.LOOP) {
          diagnostics.warning(tag.node(), TAG_UNUSED, tag.name());
        }
      }
    }
  }

  private void portcheck(@Nullable Node p) {
    for (; p != null; p = p.next()) {
      switch (p.attribute()) {
        case ANDTH_SYMBOL, OREL_SYMBOL, DOWNTO_SYMBOL ->
            diagnostics.warning(p, NOT_PORTABLE, p.symbol());
        case CODE_CLAUSE, ASSERTION, PARALLEL_CLAUSE, UNTIL_PART ->
            diagnostics.warning(p, NOT_PORTABLE, p.attribute().displayName());
        default -> {}
      }
      portcheck(p.sub());
    }
  }
}
