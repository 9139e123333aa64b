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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.algolang.diag.DepthGuard;
import org.algolang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * All the modes of one compilation. A mode is only added if no equivalent mode is already present,
 * so (once indicants have been resolved) modes can be compared by identity.
 *
 * <p>The table starts out holding the modes of the standard environment, which are also available
 * as fields. The special modes ({@link #hip}, {@link #vacuum}, {@link #error}, ...) are not modes
 * of any value; they stand for the mode of constructs that adapt to their context, or for a mode
 * that could not be determined.
 */
public final class ModeTable implements Iterable<Mode> {
  private final List<Mode> modes = new ArrayList<>();
  private final Map<String, Mode> standards = new HashMap<>();
  private final Equivalence equivalence;
  private @Nullable DerivedModes derivations;
  private final int standardCount;

  /** The mode of SKIP, NIL and jumps, which is coercible to any mode. */
  public final Mode hip;

  /** The mode of an empty row display {@code ()}. */
  public final Mode vacuum;

  /** The mode of a construct that has already been reported as wrong. */
  public final Mode error;

  public final Mode undefined;

  /** The mode of the items of a format text. */
  public final Mode collitem;

  /** Any row, as accepted by the standard operators UPB and LWB. */
  public final Mode rows;

  /** Any value that can be read or printed. */
  public final Mode simplin;

  public final Mode simplout;

  public final Mode voidMode;
  public final Mode intMode;
  public final Mode longInt;
  public final Mode longLongInt;
  public final Mode real;
  public final Mode longReal;
  public final Mode longLongReal;
  public final Mode bits;
  public final Mode longBits;
  public final Mode longLongBits;
  public final Mode bytes;
  public final Mode longBytes;
  public final Mode bool;
  public final Mode charMode;
  public final Mode file;
  public final Mode channel;
  public final Mode format;

  /** STRUCT (REAL re, REAL im) and its longer variants. */
  public final Mode complex;

  public final Mode longComplex;
  public final Mode longLongComplex;
  public final Mode sema;
  public final Mode pipe;

  public final Mode refInt;
  public final Mode refReal;
  public final Mode refBool;
  public final Mode refChar;
  public final Mode refFile;
  public final Mode rowInt;
  public final Mode rowReal;
  public final Mode rowBool;
  public final Mode flexRowBool;
  public final Mode rowChar;

  /** STRING, that is FLEX [] CHAR. */
  public final Mode string;

  public final Mode refString;
  public final Mode rowString;
  public final Mode procVoid;
  public final Mode procRefFileVoid;
  public final Mode rowSimplin;
  public final Mode rowSimplout;

  public ModeTable(@Nullable DepthGuard guard) {
    hip = special("HIP");
    undefined = special("UNDEFINED");
    error = special("ERROR");
    vacuum = special("VACUUM");
    collitem = special("COLLITEM");
    rows = special("ROWS");
    simplin = special("SIMPLIN");
    simplout = special("SIMPLOUT");
    equivalence = new Equivalence(guard, error);

    voidMode = standard(0, "VOID");
    intMode = standard(0, "INT");
    longInt = standard(1, "INT");
    longLongInt = standard(2, "INT");
    real = standard(0, "REAL");
    longReal = standard(1, "REAL");
    longLongReal = standard(2, "REAL");
    bits = standard(0, "BITS");
    longBits = standard(1, "BITS");
    longLongBits = standard(2, "BITS");
    bytes = standard(0, "BYTES");
    longBytes = standard(1, "BYTES");
    bool = standard(0, "BOOL");
    charMode = standard(0, "CHAR");
    file = standard(0, "FILE");
    channel = standard(0, "CHANNEL");
    format = standard(0, "FORMAT");

    refInt = ref(intMode);
    refReal = ref(real);
    refBool = ref(bool);
    refChar = ref(charMode);
    refFile = ref(file);
    rowInt = addRow(1, intMode, null, false);
    rowReal = addRow(1, real, null, false);
    rowBool = addRow(1, bool, null, false);
    flexRowBool = add(ModeKind.FLEX, 0, null, rowBool, null);
    rowChar = addRow(1, charMode, null, false);
    string = add(ModeKind.FLEX, 0, null, rowChar, null);
    string.slice = charMode;
    standard(0, "STRING").equivalent = string;
    refString = ref(string);
    rowString = addRow(1, string, null, false);

    complex = complexStruct(0, real);
    longComplex = complexStruct(1, longReal);
    longLongComplex = complexStruct(2, longLongReal);

    Pack semaPack = new Pack();
    semaPack.add(refInt, null, null);
    sema = add(ModeKind.STRUCT, 1, null, null, semaPack);
    standard(0, "SEMA").equivalent = sema;
    Pack pipePack = new Pack();
    pipePack.add(intMode, "pid", null);
    pipePack.add(refFile, "write", null);
    pipePack.add(refFile, "read", null);
    pipe = add(ModeKind.STRUCT, 3, null, null, pipePack);
    standard(0, "PIPE").equivalent = pipe;

    procVoid = proc(voidMode);
    procRefFileVoid = proc(voidMode, refFile);
    rowSimplin = addRow(1, simplin, null, false);
    rowSimplout = addRow(1, simplout, null, false);
    standardCount = modes.size();
  }

  private Mode special(String name) {
    Mode m = new Mode(ModeKind.STANDARD, 0, name, null, null, null);
    m.number = modes.size();
    modes.add(m);
    return m;
  }

  private Mode standard(int sizety, String name) {
    Mode m = special(name);
    m.dimension = sizety;
    standards.put(standardKey(sizety, name), m);
    return m;
  }

  private Mode complexStruct(int sizety, Mode component) {
    Pack pack = new Pack();
    pack.add(component, "re", null);
    pack.add(component, "im", null);
    Mode m = add(ModeKind.STRUCT, 2, null, null, pack);
    standard(sizety, "COMPLEX").equivalent = m;
    standard(sizety, "COMPL").equivalent = m;
    return m;
  }

  private static String standardKey(int sizety, String name) {
    return sizety + " " + name;
  }

  /**
   * Returns the standard mode with the given bold word and number of LONGs (negative for SHORTs).
   * If there is no such mode, the nearest shorter (or longer, for SHORT) one is returned; null if
   * the bold word is not a standard mode at all.
   */
  public @Nullable Mode searchStandard(int sizety, String name) {
    for (int k = sizety; ; k += (k < 0) ? 1 : -1) {
      Mode m = standards.get(standardKey(k, name));
      if (m != null || k == 0) {
        return m;
      }
    }
  }

  /**
   * Returns a mode of the given shape, either a newly created one or an existing equivalent one.
   */
  @CanIgnoreReturnValue
  public Mode add(
      ModeKind kind, int dim, @Nullable Node node, @Nullable Mode sub, @Nullable Pack pack) {
    checkArgument(
        sub != null || (kind != ModeKind.REF && kind != ModeKind.FLEX && kind != ModeKind.ROW),
        "%s mode needs a sub mode",
        kind);
    Mode m = new Mode(kind, dim, null, node, sub, pack);
    m.hasRows = (kind == ModeKind.ROW);
    return register(m);
  }

  /** Adds {@code u} unless an equivalent mode is already present. */
  Mode register(Mode u) {
    for (Mode m : modes) {
      if (!m.is(ModeKind.STANDARD) && m.equivalent == null && equivalence.prove(m, u)) {
        return m;
      }
    }
    u.number = modes.size();
    modes.add(u);
    if (derivations != null) {
      derivations.derive(u);
    }
    return u;
  }

  /**
   * From now on, modes added to the table get their derived forms as they are added. Called once
   * the modes of the declarers have been built.
   */
  void seal(DerivedModes derivations) {
    this.derivations = derivations;
  }

  /** Adds a row mode, and the rows of fewer dimensions that are its slices. */
  public Mode addRow(int dim, Mode sub, @Nullable Node node, boolean derivate) {
    Mode q = add(ModeKind.ROW, dim, node, sub, null);
    q.derivate |= derivate;
    q.slice = (dim > 1) ? addRow(dim - 1, sub, node, derivate) : sub;
    return q;
  }

  public Mode ref(Mode sub) {
    return add(ModeKind.REF, 0, null, sub, null);
  }

  public Mode proc(Mode result, Mode... parameters) {
    Pack pack = Pack.of(parameters);
    return add(ModeKind.PROC, pack.size(), null, result, pack);
  }

  public Mode union(Mode... members) {
    Pack pack = Pack.of(members);
    return add(ModeKind.UNION, pack.size(), null, null, pack);
  }

  /**
   * Returns a SERIES or STOWED mode holding the yields of a clause's units. Such modes only live
   * for the duration of a check and are not entered in the table.
   */
  public Mode collection(ModeKind kind, List<Mode> members, @Nullable List<Node> where) {
    checkArgument(
        kind == ModeKind.SERIES || kind == ModeKind.STOWED, "%s is not a collection", kind);
    Pack pack = new Pack();
    for (int i = 0; i < members.size(); i++) {
      pack.add(members.get(i), null, (where == null) ? null : where.get(i));
    }
    Mode m = new Mode(kind, pack.size(), null, null, null, pack);
    m.number = -1;
    return m;
  }

  /**
   * Makes a united mode from a SERIES: nested series and unions are spliced in and duplicates
   * dropped. A single component is returned as such; anything other than a SERIES is returned
   * unchanged.
   */
  public Mode unite(@Nullable Mode m) {
    if (m == null) {
      return error;
    } else if (!m.is(ModeKind.SERIES)) {
      return m;
    } else if (m.pack.size() == 1 && m.pack.mode(0).is(ModeKind.UNION)) {
      return m.pack.mode(0);
    }
    Pack pack = flattenSeries(m.pack);
    pack = absorbUnionPack(pack);
    for (int i = 0; i < pack.size(); i++) {
      for (int j = pack.size() - 1; j > i; j--) {
        if (pack.mode(i) == pack.mode(j) || prove(pack.mode(i), pack.mode(j))) {
          pack.remove(j);
        }
      }
    }
    if (pack.size() == 1) {
      return pack.mode(0);
    }
    return add(ModeKind.UNION, pack.size(), null, null, pack);
  }

  private static Pack flattenSeries(Pack series) {
    Pack z = new Pack();
    for (Pack.Entry e : series) {
      if (e.mode.is(ModeKind.SERIES)) {
        for (Pack.Entry f : flattenSeries(e.mode.pack)) {
          z.add(f.mode, null, f.node());
        }
      } else {
        z.add(e.mode, null, e.node());
      }
    }
    return z;
  }

  /** True if the modes can be proven equivalent. */
  public boolean prove(Mode a, Mode b) {
    return equivalence.prove(a, b);
  }

  public int size() {
    return modes.size();
  }

  /** The number of modes that belong to the standard environment. */
  public int standardCount() {
    return standardCount;
  }

  public Mode get(int i) {
    return modes.get(i);
  }

  public ImmutableList<Mode> modes() {
    return ImmutableList.copyOf(modes);
  }

  /** True if {@code m} is {@link #error} or {@link #undefined}, or has such a component. */
  public boolean isIllFormed(@Nullable Mode m) {
    if (m == null || m == error || m == undefined) {
      return true;
    }
    for (Pack.Entry e : m.pack) {
      if (e.mode == null || e.mode == error || e.mode == undefined) {
        return true;
      }
    }
    return false;
  }

  /** Returns a pack in which the components of nested unions have been spliced in. */
  public static Pack absorbUnionPack(Pack u) {
    boolean goOn;
    do {
      goOn = false;
      Pack z = new Pack();
      for (Pack.Entry t : u) {
        Mode m = Mode.resolve(t.mode);
        if (m != null && m.is(ModeKind.UNION)) {
          goOn = true;
          for (Pack.Entry s : m.pack) {
            z.add(s.mode, null, s.node());
          }
        } else {
          z.add(t.mode, null, t.node());
        }
      }
      u = z;
    } while (goOn);
    return u;
  }

  @Override
  public Iterator<Mode> iterator() {
    return modes().iterator();
  }
}
