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

import org.jspecify.annotations.Nullable;

/**
 * Predicates on modes that decide which coercions apply: whether a value of one mode can be coerced
 * to another in a context of a given strength, and the single steps (dereferencing, widening,
 * uniting, rowing) that make up such a coercion.
 *
 * <p>Modes can be cyclic ({@code MODE A = REF A}), so every loop that follows sub modes is bounded
 * by the size of the mode table.
 */
public final class Coercibility {
  private final ModeTable table;

  public Coercibility(ModeTable table) {
    this.table = table;
  }

  public ModeTable table() {
    return table;
  }

  private int bound() {
    return table.size() + 1;
  }

  /** Compares two modes, treating FLEX as directed by {@code deflex}. */
  public boolean isEqual(Mode p, Mode q, Deflexing deflex) {
    switch (deflex) {
      case FORCE:
        return p.deflex() == q.deflex();
      case ALIAS:
        if (p.isRef() && q.isRef()) {
          return p == q || p.deflex() == q;
        } else if (!p.isRef() && !q.isRef()) {
          return p.deflex() == q.deflex();
        }
        break;
      case SAFE:
        if (!p.isRef() && !q.isRef()) {
          return p.deflex() == q.deflex();
        }
        break;
      default:
        break;
    }
    return p == q;
  }

  /** True for names and for procedures without parameters. */
  public static boolean isDeprefable(Mode p) {
    return p.isRef() || p.isParameterlessProc();
  }

  /** Dereferences or deprocedures once; a REF FLEX yields the row it refers to. */
  public static @Nullable Mode deprefOnce(Mode p) {
    if (p.isRefFlex()) {
      return p.sub.sub;
    } else if (p.isRef() || p.isParameterlessProc()) {
      return p.sub;
    }
    return null;
  }

  public Mode deprefCompletely(Mode p) {
    for (int i = 0; i < bound() && isDeprefable(p); i++) {
      p = deprefOnce(p);
    }
    return p;
  }

  public Mode deprocCompletely(Mode p) {
    for (int i = 0; i < bound() && p.isParameterlessProc(); i++) {
      p = p.sub;
    }
    return p;
  }

  /** If {@code q} is ROWS, the completely dereferenced {@code p}; otherwise {@code q}. */
  public Mode deprefRows(Mode p, Mode q) {
    return (q == table.rows) ? deprefCompletely(p) : q;
  }

  /** Strips rows and FLEX. */
  public Mode derow(Mode p) {
    for (int i = 0; i < bound() && (p.isRow() || p.isFlex()); i++) {
      p = p.sub;
    }
    return p;
  }

  /** True for rows, and for unions all of whose components are rows. */
  public boolean isRowsType(Mode p) {
    switch (p.kind()) {
      case ROW:
      case FLEX:
        return true;
      case UNION:
        for (Pack.Entry e : p.pack) {
          if (!isRowsType(e.mode)) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  private boolean isProcRefFileVoidOrFormat(Mode p) {
    return p == table.procRefFileVoid || p == table.format;
  }

  private boolean isTransputMode(Mode p, boolean write) {
    if (p == table.intMode
        || p == table.longInt
        || p == table.longLongInt
        || p == table.real
        || p == table.longReal
        || p == table.longLongReal
        || p == table.bool
        || p == table.charMode
        || p == table.bits
        || p == table.longBits
        || p == table.longLongBits
        || p == table.complex
        || p == table.longComplex
        || p == table.longLongComplex
        || p == table.rowChar
        || p == table.string) {
      return true;
    } else if (p.is(ModeKind.UNION) || p.is(ModeKind.STRUCT)) {
      for (Pack.Entry e : p.pack) {
        if (!isTransputMode(e.mode, write) && !isProcRefFileVoidOrFormat(e.mode)) {
          return false;
        }
      }
      return true;
    } else if (p.isFlex()) {
      return p.sub == table.rowChar || (write && isTransputMode(p.sub, true));
    } else if (p.isRow()) {
      return isTransputMode(p.sub, write) || isProcRefFileVoidOrFormat(p.sub);
    }
    return false;
  }

  public boolean isPrintable(Mode p) {
    return isProcRefFileVoidOrFormat(p) || isTransputMode(p, true);
  }

  public boolean isReadable(Mode p) {
    return isProcRefFileVoidOrFormat(p) || (p.isRef() && isTransputMode(p.sub, false));
  }

  /** The component of union {@code u} that {@code m} unites to, or null. */
  public @Nullable Mode unitesTo(Mode m, Mode u) {
    if (u == table.simplin || u == table.simplout) {
      return m;
    }
    Mode v = null;
    for (Pack.Entry e : u.pack) {
      // Prefer [] to [] over [] to FLEX [].
      if (m == e.mode) {
        v = e.mode;
      } else if (v == null && m.deflex() == e.mode.deflex()) {
        v = e.mode;
      }
    }
    return v;
  }

  private boolean isInPack(Mode u, Pack v, Deflexing deflex) {
    for (Pack.Entry e : v) {
      if (isEqual(u, e.mode, deflex)) {
        return true;
      }
    }
    return false;
  }

  /** True if every component of union {@code p} is a component of union {@code q}. */
  public boolean isSubset(Mode p, Mode q, Deflexing deflex) {
    for (Pack.Entry e : p.pack) {
      if (!isInPack(e.mode, q.pack, deflex)) {
        return false;
      }
    }
    return true;
  }

  /** True if {@code p} can be united to union {@code q}. */
  public boolean isUnitable(Mode p, Mode q, Deflexing deflex) {
    if (!q.is(ModeKind.UNION)) {
      return false;
    }
    return p.is(ModeKind.UNION) ? isSubset(p, q, deflex) : isInPack(p, q.pack, deflex);
  }

  public boolean isSoftlyCoercible(Mode p, Mode q, Deflexing deflex) {
    for (int i = 0; i < bound(); i++) {
      if (isEqual(p, q, deflex)) {
        return true;
      } else if (!p.isParameterlessProc()) {
        return false;
      }
      p = p.sub;
    }
    return false;
  }

  /** Weak and meek paths differ only in where they may stop, which identity already decides. */
  public boolean isMeeklyCoercible(Mode p, Mode q, Deflexing deflex) {
    for (int i = 0; i < bound(); i++) {
      if (isEqual(p, q, deflex)) {
        return true;
      } else if (!isDeprefable(p)) {
        return false;
      }
      p = deprefOnce(p);
    }
    return false;
  }

  public boolean isFirmlyCoercible(Mode p, Mode q, Deflexing deflex) {
    for (int i = 0; i < bound(); i++) {
      if (isEqual(p, q, deflex)) {
        return true;
      } else if (q == table.rows && isRowsType(p)) {
        return true;
      } else if (isUnitable(p, q, deflex)) {
        return true;
      } else if (!isDeprefable(p)) {
        return false;
      }
      p = deprefOnce(p);
    }
    return false;
  }

  /** True if either mode is firmly coercible to the other. */
  public boolean isFirm(Mode p, Mode q) {
    return isFirmlyCoercible(p, q, Deflexing.SAFE) || isFirmlyCoercible(q, p, Deflexing.SAFE);
  }

  /**
   * Returns the mode that {@code p} widens to on the way to {@code q}, or null if {@code p} does
   * not widen towards {@code q}.
   */
  public @Nullable Mode widensTo(Mode p, Mode q) {
    ModeTable t = table;
    if (p == t.intMode) {
      if (q == t.longInt
          || q == t.longLongInt
          || q == t.longReal
          || q == t.longLongReal
          || q == t.longComplex
          || q == t.longLongComplex) {
        return t.longInt;
      } else if (q == t.real || q == t.complex) {
        return t.real;
      }
    } else if (p == t.longInt) {
      if (q == t.longLongInt) {
        return t.longLongInt;
      } else if (q == t.longReal
          || q == t.longLongReal
          || q == t.longComplex
          || q == t.longLongComplex) {
        return t.longReal;
      }
    } else if (p == t.longLongInt) {
      if (q == t.longLongReal || q == t.longLongComplex) {
        return t.longLongReal;
      }
    } else if (p == t.real) {
      if (q == t.longReal || q == t.longLongReal || q == t.longComplex || q == t.longLongComplex) {
        return t.longReal;
      } else if (q == t.complex) {
        return t.complex;
      }
    } else if (p == t.complex) {
      if (q == t.longComplex || q == t.longLongComplex) {
        return t.longComplex;
      }
    } else if (p == t.longReal) {
      if (q == t.longLongReal || q == t.longLongComplex) {
        return t.longLongReal;
      } else if (q == t.longComplex) {
        return t.longComplex;
      }
    } else if (p == t.longComplex) {
      if (q == t.longLongComplex) {
        return t.longLongComplex;
      }
    } else if (p == t.longLongReal) {
      if (q == t.longLongComplex) {
        return t.longLongComplex;
      }
    } else if (p == t.bits || p == t.longBits || p == t.longLongBits) {
      if (p == t.bits && (q == t.longBits || q == t.longLongBits)) {
        return t.longBits;
      } else if (p == t.longBits && q == t.longLongBits) {
        return t.longLongBits;
      } else if (q == t.rowBool) {
        return t.rowBool;
      } else if (q == t.flexRowBool) {
        return t.flexRowBool;
      }
    } else if (p == t.bytes || p == t.longBytes) {
      if (q == t.rowChar) {
        return t.rowChar;
      } else if (q == t.string) {
        return t.string;
      }
    }
    return null;
  }

  public boolean isWidenable(Mode p, Mode q) {
    for (Mode z = widensTo(p, q); z != null; z = widensTo(z, q)) {
      if (z == q) {
        return true;
      }
    }
    return false;
  }

  /** True for a name of a row, e.g. REF [] INT or REF FLEX [] CHAR. */
  public boolean isRefRow(Mode p) {
    return p.name != null && p.sub != null && p.sub.deflex().isRow();
  }

  /** True for a name of a struct, e.g. REF COMPLEX. */
  public boolean isNameStruct(Mode p) {
    return p.name != null && p.sub != null && p.sub.deflex().is(ModeKind.STRUCT);
  }

  /** True if name {@code p} can be rowed, possibly repeatedly, to {@code q}. */
  public boolean isStrongName(Mode p, Mode q) {
    for (int i = 0; i < bound(); i++) {
      if (p == q) {
        return true;
      } else if (!isRefRow(q)) {
        return false;
      }
      q = q.name;
    }
    return false;
  }

  /** True if {@code p} can be widened or rowed, possibly repeatedly, to {@code q}. */
  public boolean isStrongSlice(Mode p, Mode q) {
    for (int i = 0; i < bound(); i++) {
      if (p == q || isWidenable(p, q)) {
        return true;
      } else if (q.slice != null) {
        q = q.slice;
      } else if (q.isFlex()) {
        q = q.sub;
      } else if (isRefRow(q)) {
        return isStrongName(p, q);
      } else {
        return false;
      }
    }
    return false;
  }

  public boolean isStronglyCoercible(Mode p, Mode q, Deflexing deflex) {
    // The order of these tests matters.
    for (int i = 0; i < bound(); i++) {
      if (isEqual(p, q, deflex)) {
        return true;
      } else if (q == table.voidMode) {
        return true;
      } else if ((q == table.simplin || q == table.rowSimplin) && isReadable(p)) {
        return true;
      } else if (q == table.rows && isRowsType(p)) {
        return true;
      } else if (isUnitable(p, derow(q), deflex)) {
        return true;
      } else if (isRefRow(q) && isStrongName(p, q)) {
        return true;
      } else if (q.slice != null && isStrongSlice(p, q)) {
        return true;
      } else if (q.isFlex() && isStrongSlice(p, q)) {
        return true;
      } else if (isWidenable(p, q)) {
        return true;
      } else if (isDeprefable(p)) {
        p = deprefOnce(p);
      } else if (q == table.simplout || q == table.rowSimplout) {
        return isPrintable(p);
      } else {
        return false;
      }
    }
    return false;
  }

  private boolean basicCoercions(Mode p, Mode q, Strength c, Deflexing deflex) {
    if (isEqual(p, q, deflex)) {
      return true;
    }
    return switch (c) {
      case NONE -> p == q;
      case SOFT -> isSoftlyCoercible(p, q, deflex);
      case WEAK, MEEK -> isMeeklyCoercible(p, q, deflex);
      case FIRM -> isFirmlyCoercible(p, q, deflex);
      case STRONG -> isStronglyCoercible(p, q, deflex);
    };
  }

  /** A row or structure display is coercible componentwise, in a strong position only. */
  private boolean isCoercibleStowed(Mode p, Mode q, Strength c, Deflexing deflex) {
    if (c != Strength.STRONG) {
      return false;
    } else if (q == table.voidMode) {
      return true;
    } else if (q.isFlex() || q.isRow()) {
      Mode slice = q.isFlex() ? q.sub.slice : q.slice;
      if (slice == null) {
        return false;
      }
      for (Pack.Entry e : p.pack) {
        if (!isCoercible(e.mode, slice, c, deflex)) {
          return false;
        }
      }
      return true;
    } else if (q.is(ModeKind.PROC) || q.is(ModeKind.STRUCT)) {
      if (p.pack.size() != q.pack.size()) {
        return false;
      }
      for (int i = 0; i < p.pack.size(); i++) {
        if (!isCoercible(p.pack.mode(i), q.pack.mode(i), c, deflex)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  private boolean isCoercibleSeries(Mode p, Mode q, Strength c, Deflexing deflex) {
    if (c == Strength.NONE) {
      return false;
    } else if (p.is(ModeKind.SERIES) && p.pack.isEmpty()) {
      return false;
    } else if (q.is(ModeKind.SERIES) && q.pack.isEmpty()) {
      return false;
    }
    for (Pack.Entry e : p.pack) {
      if (e.mode != null && !isCoercible(e.mode, q, c, deflex)) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if a value of mode {@code p} can be coerced to mode {@code q} in a position of strength
   * {@code c}. Modes that are already wrong are coercible to anything, so that one mistake is not
   * reported again.
   */
  public boolean isCoercible(
      @Nullable Mode p, @Nullable Mode q, Strength c, Deflexing deflex) {
    if (table.isIllFormed(p) || table.isIllFormed(q)) {
      return true;
    } else if (isEqual(p, q, deflex)) {
      return true;
    } else if (p == table.hip) {
      return true;
    } else if (p.is(ModeKind.STOWED)) {
      return isCoercibleStowed(p, q, c, deflex);
    } else if (p.is(ModeKind.SERIES)) {
      return isCoercibleSeries(p, q, c, deflex);
    } else if (p == table.vacuum && q.deflex().isRow()) {
      return true;
    }
    return basicCoercions(p, q, c, deflex);
  }

  /** True for a mode that, after dereferencing, is voided without deproceduring. */
  public boolean isNonProc(Mode p) {
    for (int i = 0; i < bound(); i++) {
      if (p.isParameterlessProc()) {
        return false;
      } else if (!p.isRef()) {
        return true;
      }
      p = p.sub;
    }
    return true;
  }
}
