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

package org.algolang.scanner;

import com.google.common.collect.ImmutableMap;
import org.algolang.tree.Attribute;
import org.jspecify.annotations.Nullable;

/** The reserved bold words and the fixed symbols, with the attribute each one scans to. */
public final class Keywords {

  private static final ImmutableMap<String, Attribute> KEYWORDS =
      ImmutableMap.<String, Attribute>builder()
          .put("DOWNTO", Attribute.DOWNTO_SYMBOL)
          .put("UNTIL", Attribute.UNTIL_SYMBOL)
          .put("CODE", Attribute.CODE_SYMBOL)
          .put("EDOC", Attribute.EDOC_SYMBOL)
          .put("ANDF", Attribute.ANDF_SYMBOL)
          .put("ORF", Attribute.ORF_SYMBOL)
          .put("ANDTH", Attribute.ANDTH_SYMBOL)
          .put("THEF", Attribute.ANDTH_SYMBOL)
          .put("OREL", Attribute.OREL_SYMBOL)
          .put("ELSF", Attribute.OREL_SYMBOL)
          .put(".", Attribute.POINT_SYMBOL)
          .put("..", Attribute.DOTDOT_SYMBOL)
          .put("{", Attribute.ACCO_SYMBOL)
          .put("}", Attribute.OCCA_SYMBOL)
          .put(":", Attribute.COLON_SYMBOL)
          .put("|", Attribute.THEN_BAR_SYMBOL)
          .put("|:", Attribute.ELSE_BAR_SYMBOL)
          .put("[", Attribute.SUB_SYMBOL)
          .put("]", Attribute.BUS_SYMBOL)
          .put("(", Attribute.OPEN_SYMBOL)
          .put(")", Attribute.CLOSE_SYMBOL)
          .put(",", Attribute.COMMA_SYMBOL)
          .put(";", Attribute.SEMI_SYMBOL)
          .put("@", Attribute.AT_SYMBOL)
          .put("AT", Attribute.AT_SYMBOL)
          .put("$", Attribute.FORMAT_DELIMITER_SYMBOL)
          .put("#", Attribute.STYLE_II_COMMENT_SYMBOL)
          .put(":=", Attribute.ASSIGN_SYMBOL)
          .put("=:", Attribute.ASSIGN_TO_SYMBOL)
          .put(":=:", Attribute.IS_SYMBOL)
          .put("IS", Attribute.IS_SYMBOL)
          .put(":/=:", Attribute.ISNT_SYMBOL)
          .put("ISNT", Attribute.ISNT_SYMBOL)
          .put("BY", Attribute.BY_SYMBOL)
          .put("OP", Attribute.OP_SYMBOL)
          .put("PRIO", Attribute.PRIO_SYMBOL)
          .put("CO", Attribute.STYLE_I_COMMENT_SYMBOL)
          .put("COMMENT", Attribute.BOLD_COMMENT_SYMBOL)
          .put("PR", Attribute.STYLE_I_PRAGMAT_SYMBOL)
          .put("PRAGMAT", Attribute.BOLD_PRAGMAT_SYMBOL)
          .put("BEGIN", Attribute.BEGIN_SYMBOL)
          .put("END", Attribute.END_SYMBOL)
          .put("GO", Attribute.GO_SYMBOL)
          .put("TO", Attribute.TO_SYMBOL)
          .put("GOTO", Attribute.GOTO_SYMBOL)
          .put("IF", Attribute.IF_SYMBOL)
          .put("THEN", Attribute.THEN_SYMBOL)
          .put("ELIF", Attribute.ELIF_SYMBOL)
          .put("ELSE", Attribute.ELSE_SYMBOL)
          .put("FI", Attribute.FI_SYMBOL)
          .put("CASE", Attribute.CASE_SYMBOL)
          .put("IN", Attribute.IN_SYMBOL)
          .put("OUSE", Attribute.OUSE_SYMBOL)
          .put("OUT", Attribute.OUT_SYMBOL)
          .put("ESAC", Attribute.ESAC_SYMBOL)
          .put("FOR", Attribute.FOR_SYMBOL)
          .put("FROM", Attribute.FROM_SYMBOL)
          .put("WHILE", Attribute.WHILE_SYMBOL)
          .put("DO", Attribute.DO_SYMBOL)
          .put("OD", Attribute.OD_SYMBOL)
          .put("EXIT", Attribute.EXIT_SYMBOL)
          .put("PAR", Attribute.PAR_SYMBOL)
          .put("ASSERT", Attribute.ASSERT_SYMBOL)
          .put("TRUE", Attribute.TRUE_SYMBOL)
          .put("FALSE", Attribute.FALSE_SYMBOL)
          .put("EMPTY", Attribute.EMPTY_SYMBOL)
          .put("SKIP", Attribute.SKIP_SYMBOL)
          .put("NIL", Attribute.NIL_SYMBOL)
          .put("MODE", Attribute.MODE_SYMBOL)
          .put("PROC", Attribute.PROC_SYMBOL)
          .put("STRUCT", Attribute.STRUCT_SYMBOL)
          .put("UNION", Attribute.UNION_SYMBOL)
          .put("REF", Attribute.REF_SYMBOL)
          .put("FLEX", Attribute.FLEX_SYMBOL)
          .put("LOC", Attribute.LOC_SYMBOL)
          .put("HEAP", Attribute.HEAP_SYMBOL)
          .put("OF", Attribute.OF_SYMBOL)
          .put("LONG", Attribute.LONG_SYMBOL)
          .put("SHORT", Attribute.SHORT_SYMBOL)
          .put("VOID", Attribute.VOID_SYMBOL)
          .put("INT", Attribute.INT_SYMBOL)
          .put("REAL", Attribute.REAL_SYMBOL)
          .put("BOOL", Attribute.BOOL_SYMBOL)
          .put("CHAR", Attribute.CHAR_SYMBOL)
          .put("BITS", Attribute.BITS_SYMBOL)
          .put("BYTES", Attribute.BYTES_SYMBOL)
          .put("STRING", Attribute.STRING_SYMBOL)
          .put("COMPLEX", Attribute.COMPLEX_SYMBOL)
          .put("COMPL", Attribute.COMPL_SYMBOL)
          .put("FILE", Attribute.FILE_SYMBOL)
          .put("CHANNEL", Attribute.CHANNEL_SYMBOL)
          .put("FORMAT", Attribute.FORMAT_SYMBOL)
          .put("SEMA", Attribute.SEMA_SYMBOL)
          .put("PIPE", Attribute.PIPE_SYMBOL)
          .buildOrThrow();

  private Keywords() {}

  /** Returns the attribute of a reserved word or fixed symbol, or null. */
  public static @Nullable Attribute find(String text) {
    return KEYWORDS.get(text);
  }
}
