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

import com.google.common.collect.ImmutableList;
import org.algolang.mode.Mode;
import org.algolang.mode.ModeTable;

/**
 * Declares the priorities, operators and routines of the standard environment. Standard modes
 * need no indicant tags; the mode builder finds them in the {@link ModeTable} by name.
 */
public final class StandardEnvironment {
  private final SymbolTable env;
  private final ModeTable m;

  private StandardEnvironment(SymbolTable env, ModeTable m) {
    this.env = env;
    this.m = m;
  }

  public static void populate(SymbolTable env, ModeTable modes) {
    StandardEnvironment s = new StandardEnvironment(env, modes);
    s.priorities();
    s.arithmetic();
    s.booleans();
    s.characters();
    s.bits();
    s.complexes();
    s.rows();
    s.routines();
  }

  private void prio(String name, int priority) {
    env.addStandard(TagKind.PRIORITY, name, null).setPriority(priority);
  }

  private void op(String name, Mode result, Mode... operands) {
    env.addStandard(TagKind.OPERATOR, name, m.proc(result, operands));
  }

  private void ident(String name, Mode mode) {
    env.addStandard(TagKind.IDENTIFIER, name, mode);
  }

  private void priorities() {
    for (String s :
        ImmutableList.of(
            "+:=", "-:=", "*:=", "/:=", "%:=", "%*:=", "+=:", "PLUSAB", "MINUSAB", "TIMESAB",
            "DIVAB", "OVERAB", "MODAB", "PLUSTO")) {
      prio(s, 1);
    }
    prio("OR", 2);
    for (String s : ImmutableList.of("AND", "&", "XOR")) {
      prio(s, 3);
    }
    for (String s : ImmutableList.of("=", "/=", "~=", "^=", "EQ", "NE")) {
      prio(s, 4);
    }
    for (String s : ImmutableList.of("<", "<=", ">", ">=", "LT", "LE", "GT", "GE")) {
      prio(s, 5);
    }
    prio("+", 6);
    prio("-", 6);
    for (String s : ImmutableList.of("*", "/", "OVER", "%", "MOD", "%*", "ELEM")) {
      prio(s, 7);
    }
    for (String s :
        ImmutableList.of("**", "SHL", "SHR", "UP", "DOWN", "^", "ELEMS", "LWB", "UPB")) {
      prio(s, 8);
    }
    prio("I", 9);
    prio("+*", 9);
  }

  private void comparisons(Mode a, boolean ordered) {
    for (String s : ImmutableList.of("=", "/=", "~=", "^=", "EQ", "NE")) {
      op(s, m.bool, a, a);
    }
    if (ordered) {
      for (String s : ImmutableList.of("<", "<=", ">", ">=", "LT", "LE", "GT", "GE")) {
        op(s, m.bool, a, a);
      }
    }
  }

  private void assigningOperators(Mode a, boolean divides) {
    Mode ref = m.ref(a);
    for (String s : ImmutableList.of("+:=", "PLUSAB", "-:=", "MINUSAB", "*:=", "TIMESAB")) {
      op(s, ref, ref, a);
    }
    if (divides) {
      op("/:=", ref, ref, a);
      op("DIVAB", ref, ref, a);
    }
  }

  private void arithmetic() {
    ImmutableList<Mode> ints = ImmutableList.of(m.intMode, m.longInt, m.longLongInt);
    ImmutableList<Mode> reals = ImmutableList.of(m.real, m.longReal, m.longLongReal);
    for (int k = 0; k < 3; k++) {
      Mode i = ints.get(k);
      Mode r = reals.get(k);
      for (Mode a : ImmutableList.of(i, r)) {
        op("+", a, a);
        op("-", a, a);
        op("ABS", a, a);
        op("SIGN", m.intMode, a);
        op("+", a, a, a);
        op("-", a, a, a);
        op("*", a, a, a);
        op("**", a, a, m.intMode);
        op("UP", a, a, m.intMode);
        comparisons(a, true);
      }
      op("/", r, i, i);
      op("/", r, r, r);
      for (String s : ImmutableList.of("OVER", "%", "MOD", "%*")) {
        op(s, i, i, i);
      }
      op("ODD", m.bool, i);
      op("ENTIER", i, r);
      op("ROUND", i, r);
      assigningOperators(i, false);
      assigningOperators(r, true);
      for (String s : ImmutableList.of("%:=", "OVERAB", "%*:=", "MODAB")) {
        op(s, m.ref(i), m.ref(i), i);
      }
      if (k < 2) {
        op("LENG", ints.get(k + 1), i);
        op("LENG", reals.get(k + 1), r);
        op("SHORTEN", i, ints.get(k + 1));
        op("SHORTEN", r, reals.get(k + 1));
      }
    }
  }

  private void booleans() {
    op("NOT", m.bool, m.bool);
    op("~", m.bool, m.bool);
    op("ABS", m.intMode, m.bool);
    for (String s : ImmutableList.of("AND", "&", "OR", "XOR")) {
      op(s, m.bool, m.bool, m.bool);
    }
    comparisons(m.bool, false);
  }

  private void characters() {
    op("ABS", m.intMode, m.charMode);
    op("REPR", m.charMode, m.intMode);
    comparisons(m.charMode, true);
    comparisons(m.string, true);
    op("+", m.string, m.charMode, m.charMode);
    op("+", m.string, m.string, m.string);
    op("+", m.string, m.string, m.charMode);
    op("+", m.string, m.charMode, m.string);
    op("*", m.string, m.intMode, m.string);
    op("*", m.string, m.string, m.intMode);
    op("*", m.string, m.intMode, m.charMode);
    op("ELEM", m.charMode, m.intMode, m.string);
    op("+:=", m.refString, m.refString, m.string);
    op("PLUSAB", m.refString, m.refString, m.string);
    op("+:=", m.refString, m.refString, m.charMode);
    op("*:=", m.refString, m.refString, m.intMode);
    op("+=:", m.refString, m.string, m.refString);
    op("PLUSTO", m.refString, m.string, m.refString);
  }

  private void bits() {
    for (Mode b : ImmutableList.of(m.bits, m.longBits, m.longLongBits)) {
      op("NOT", b, b);
      op("~", b, b);
      for (String s : ImmutableList.of("AND", "&", "OR", "XOR")) {
        op(s, b, b, b);
      }
      op("SHL", b, b, m.intMode);
      op("SHR", b, b, m.intMode);
      op("ELEM", m.bool, m.intMode, b);
      comparisons(b, false);
    }
    op("BIN", m.bits, m.intMode);
    op("ABS", m.intMode, m.bits);
    op("LENG", m.longBits, m.bits);
    op("SHORTEN", m.bits, m.longBits);
  }

  private void complexes() {
    ImmutableList<Mode> reals = ImmutableList.of(m.real, m.longReal, m.longLongReal);
    ImmutableList<Mode> complexes = ImmutableList.of(m.complex, m.longComplex, m.longLongComplex);
    for (int k = 0; k < 3; k++) {
      Mode r = reals.get(k);
      Mode c = complexes.get(k);
      op("RE", r, c);
      op("IM", r, c);
      op("ABS", r, c);
      op("ARG", r, c);
      op("CONJ", c, c);
      op("+", c, c);
      op("-", c, c);
      for (String s : ImmutableList.of("+", "-", "*", "/")) {
        op(s, c, c, c);
      }
      op("**", c, c, m.intMode);
      op("I", c, r, r);
      op("+*", c, r, r);
      comparisons(c, false);
      assigningOperators(c, true);
    }
    op("I", m.complex, m.intMode, m.intMode);
  }

  private void rows() {
    for (String s : ImmutableList.of("LWB", "UPB", "ELEMS")) {
      op(s, m.intMode, m.rows);
      op(s, m.intMode, m.intMode, m.rows);
    }
  }

  private void routines() {
    Mode realFunction = m.proc(m.real, m.real);
    for (String s :
        ImmutableList.of("sqrt", "exp", "ln", "log", "sin", "cos", "tan", "arcsin", "arccos")) {
      ident(s, realFunction);
    }
    ident("arctan", realFunction);
    ident("longsqrt", m.proc(m.longReal, m.longReal));
    ident("pi", m.real);
    ident("longpi", m.longReal);
    ident("maxint", m.intMode);
    ident("maxreal", m.real);
    ident("smallreal", m.real);
    ident("random", m.proc(m.real));
    ident("nextrandom", m.proc(m.real, m.refInt));
    ident("errorchar", m.charMode);
    ident("blank", m.charMode);
    ident("flip", m.charMode);
    ident("flop", m.charMode);
    ident("nullcharacter", m.charMode);
    ident("newlinechar", m.charMode);

    ident("standin", m.refFile);
    ident("standout", m.refFile);
    ident("standback", m.refFile);
    ident("standerror", m.refFile);
    ident("standinchannel", m.channel);
    ident("standoutchannel", m.channel);

    Mode layout = m.procRefFileVoid;
    for (String s : ImmutableList.of("newline", "newpage", "space", "backspace")) {
      ident(s, layout);
    }
    ident("print", m.proc(m.voidMode, m.rowSimplout));
    ident("write", m.proc(m.voidMode, m.rowSimplout));
    ident("printf", m.proc(m.voidMode, m.rowSimplout));
    ident("writef", m.proc(m.voidMode, m.rowSimplout));
    ident("read", m.proc(m.voidMode, m.rowSimplin));
    ident("readf", m.proc(m.voidMode, m.rowSimplin));
    ident("put", m.proc(m.voidMode, m.refFile, m.rowSimplout));
    ident("get", m.proc(m.voidMode, m.refFile, m.rowSimplin));
    ident("putf", m.proc(m.voidMode, m.refFile, m.rowSimplout));
    ident("getf", m.proc(m.voidMode, m.refFile, m.rowSimplin));

    Mode number =
        m.union(m.intMode, m.longInt, m.longLongInt, m.real, m.longReal, m.longLongReal);
    ident("whole", m.proc(m.string, number, m.intMode));
    ident("fixed", m.proc(m.string, number, m.intMode, m.intMode));
    ident("float", m.proc(m.string, number, m.intMode, m.intMode, m.intMode));
    ident("stop", m.procVoid);
  }
}
