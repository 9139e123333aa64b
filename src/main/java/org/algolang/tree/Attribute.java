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

package org.algolang.tree;

import com.google.common.base.Ascii;

/**
 * The kind of a syntax tree node. Scanning produces only terminal attributes (symbols, tags and
 * denotations); the parsers retag nodes with non-terminal attributes as they reduce phrases.
 *
 * <p>Attributes also serve as the elements of reduction patterns (see {@link #matches}), where
 * {@link #WILDCARD} matches any non-terminal.
 */
public enum Attribute implements Matcher {
  /** Pattern element only; matches any non-terminal. */
  WILDCARD,

  // Symbols, tags and denotations.
  ACCO_SYMBOL("{"),
  ALT_DO_SYMBOL("DO"),
  ALT_EQUALS_SYMBOL("="),
  ANDF_SYMBOL("ANDF"),
  ANDTH_SYMBOL("ANDTH"),
  ASSERT_SYMBOL("ASSERT"),
  ASSIGN_SYMBOL(":="),
  ASSIGN_TO_SYMBOL("=:"),
  AT_SYMBOL("@"),
  BEGIN_SYMBOL("BEGIN"),
  BITS_DENOTATION,
  BITS_SYMBOL("BITS"),
  BOLD_COMMENT_SYMBOL("COMMENT"),
  BOLD_PRAGMAT_SYMBOL("PRAGMAT"),
  BOLD_TAG,
  BOOL_SYMBOL("BOOL"),
  BUS_SYMBOL("]"),
  BY_SYMBOL("BY"),
  BYTES_SYMBOL("BYTES"),
  CASE_SYMBOL("CASE"),
  CHANNEL_SYMBOL("CHANNEL"),
  CHAR_SYMBOL("CHAR"),
  CLOSE_SYMBOL(")"),
  CODE_SYMBOL("CODE"),
  COLON_SYMBOL(":"),
  COMMA_SYMBOL(","),
  COMPL_SYMBOL("COMPL"),
  COMPLEX_SYMBOL("COMPLEX"),
  DO_SYMBOL("DO"),
  DOTDOT_SYMBOL(".."),
  DOWNTO_SYMBOL("DOWNTO"),
  EDOC_SYMBOL("EDOC"),
  ELIF_SYMBOL("ELIF"),
  ELSE_BAR_SYMBOL("|:"),
  ELSE_SYMBOL("ELSE"),
  EMPTY_SYMBOL("EMPTY"),
  END_SYMBOL("END"),
  EQUALS_SYMBOL("="),
  ESAC_SYMBOL("ESAC"),
  EXIT_SYMBOL("EXIT"),
  FALSE_SYMBOL("FALSE"),
  FI_SYMBOL("FI"),
  FILE_SYMBOL("FILE"),
  FLEX_SYMBOL("FLEX"),
  FOR_SYMBOL("FOR"),
  FORMAT_CLOSE_SYMBOL(")"),
  FORMAT_DELIMITER_SYMBOL("$"),
  FORMAT_ITEM_A("a"),
  FORMAT_ITEM_B("b"),
  FORMAT_ITEM_C("c"),
  FORMAT_ITEM_D("d"),
  FORMAT_ITEM_E("e"),
  FORMAT_ITEM_ESCAPE("%"),
  FORMAT_ITEM_F("f"),
  FORMAT_ITEM_G("g"),
  FORMAT_ITEM_H("h"),
  FORMAT_ITEM_I("i"),
  FORMAT_ITEM_J("j"),
  FORMAT_ITEM_K("k"),
  FORMAT_ITEM_L("l"),
  FORMAT_ITEM_M("m"),
  FORMAT_ITEM_MINUS("-"),
  FORMAT_ITEM_N("n"),
  FORMAT_ITEM_O("o"),
  FORMAT_ITEM_P("p"),
  FORMAT_ITEM_PLUS("+"),
  FORMAT_ITEM_POINT("."),
  FORMAT_ITEM_Q("q"),
  FORMAT_ITEM_R("r"),
  FORMAT_ITEM_S("s"),
  FORMAT_ITEM_T("t"),
  FORMAT_ITEM_U("u"),
  FORMAT_ITEM_V("v"),
  FORMAT_ITEM_W("w"),
  FORMAT_ITEM_X("x"),
  FORMAT_ITEM_Y("y"),
  FORMAT_ITEM_Z("z"),
  FORMAT_OPEN_SYMBOL("("),
  FORMAT_SYMBOL("FORMAT"),
  FROM_SYMBOL("FROM"),
  GO_SYMBOL("GO"),
  GOTO_SYMBOL("GOTO"),
  HEAP_SYMBOL("HEAP"),
  IDENTIFIER,
  IF_SYMBOL("IF"),
  IN_SYMBOL("IN"),
  INT_DENOTATION,
  INT_SYMBOL("INT"),
  IS_SYMBOL(":=:"),
  ISNT_SYMBOL(":/=:"),
  LITERAL,
  LOC_SYMBOL("LOC"),
  LONG_SYMBOL("LONG"),
  MODE_SYMBOL("MODE"),
  NIL_SYMBOL("NIL"),
  OCCA_SYMBOL("}"),
  OD_SYMBOL("OD"),
  OF_SYMBOL("OF"),
  OP_SYMBOL("OP"),
  OPEN_SYMBOL("("),
  OPERATOR,
  OREL_SYMBOL("OREL"),
  ORF_SYMBOL("ORF"),
  OUSE_SYMBOL("OUSE"),
  OUT_SYMBOL("OUT"),
  PAR_SYMBOL("PAR"),
  PIPE_SYMBOL("PIPE"),
  POINT_SYMBOL("."),
  PRIO_SYMBOL("PRIO"),
  PROC_SYMBOL("PROC"),
  REAL_DENOTATION,
  REAL_SYMBOL("REAL"),
  REF_SYMBOL("REF"),
  ROW_CHAR_DENOTATION,
  SEMA_SYMBOL("SEMA"),
  SEMI_SYMBOL(";"),
  SHORT_SYMBOL("SHORT"),
  SKIP_SYMBOL("SKIP"),
  STATIC_REPLICATOR,
  STRING_SYMBOL("STRING"),
  STRUCT_SYMBOL("STRUCT"),
  STYLE_I_COMMENT_SYMBOL("CO"),
  STYLE_I_PRAGMAT_SYMBOL("PR"),
  STYLE_II_COMMENT_SYMBOL("#"),
  SUB_SYMBOL("["),
  THEN_BAR_SYMBOL("|"),
  THEN_SYMBOL("THEN"),
  TO_SYMBOL("TO"),
  TRUE_SYMBOL("TRUE"),
  UNION_SYMBOL("UNION"),
  UNTIL_SYMBOL("UNTIL"),
  VOID_SYMBOL("VOID"),
  WHILE_SYMBOL("WHILE"),

  // Non-terminals; ALT_DO_PART must remain the first of these (see isNonTerminal).
  ALT_DO_PART,
  ALT_FORMAL_BOUNDS_LIST,
  AND_FUNCTION,
  ARGUMENT,
  ARGUMENT_LIST,
  ASSERTION,
  ASSIGNATION,
  BOOLEAN_PATTERN,
  BITS_PATTERN,
  BOUND,
  BOUNDS,
  BOUNDS_LIST,
  BRIEF_ELIF_IF_PART,
  BRIEF_INTEGER_OUSE_PART,
  BRIEF_OPERATOR_DECLARATION,
  BRIEF_UNITED_OUSE_PART,
  BY_PART,
  CALL,
  CASE_PART,
  CAST,
  CHAR_C_PATTERN,
  CHOICE,
  CHOICE_PATTERN,
  CLOSED_CLAUSE,
  CODE_CLAUSE,
  COLLATERAL_CLAUSE,
  COLLECTION,
  COMPLEX_PATTERN,
  CONDITIONAL_CLAUSE,
  DECLARATION_LIST,
  DECLARER,
  DEFINING_IDENTIFIER,
  DEFINING_INDICANT,
  DEFINING_OPERATOR,
  DENOTATION,
  DEPROCEDURING,
  DEREFERENCING,
  DO_PART,
  DYNAMIC_REPLICATOR,
  ELIF_IF_PART,
  ELIF_PART,
  ELSE_OPEN_PART,
  ELSE_PART,
  ENCLOSED_CLAUSE,
  ENQUIRY_CLAUSE,
  EXPONENT_FRAME,
  FIELD,
  FIELD_IDENTIFIER,
  FIXED_C_PATTERN,
  FLOAT_C_PATTERN,
  FOR_PART,
  FORMAL_BOUNDS,
  FORMAL_BOUNDS_LIST,
  FORMAL_DECLARERS,
  FORMAL_DECLARERS_LIST,
  FORMAT_A_FRAME,
  FORMAT_D_FRAME,
  FORMAT_E_FRAME,
  FORMAT_I_FRAME,
  FORMAT_PATTERN,
  FORMAT_POINT_FRAME,
  FORMAT_TEXT,
  FORMAT_Z_FRAME,
  FORMULA,
  FROM_PART,
  GENERAL_C_PATTERN,
  GENERAL_PATTERN,
  GENERATOR,
  GENERIC_ARGUMENT,
  GENERIC_ARGUMENT_LIST,
  IDENTITY_DECLARATION,
  IDENTITY_RELATION,
  IF_PART,
  INDICANT,
  INITIALISER_SERIES,
  INSERTION,
  INTEGER_CASE_CLAUSE,
  INTEGER_CHOICE_CLAUSE,
  INTEGER_IN_PART,
  INTEGER_OUT_PART,
  INTEGRAL_C_PATTERN,
  INTEGRAL_MOULD,
  INTEGRAL_PATTERN,
  JUMP,
  LABEL,
  LABELED_UNIT,
  LONGETY,
  LOOP_CLAUSE,
  LOOP_IDENTIFIER,
  MODE_DECLARATION,
  MONADIC_FORMULA,
  NIHIL,
  OPEN_PART,
  OPERATOR_DECLARATION,
  OPERATOR_PLAN,
  OR_FUNCTION,
  OUSE_CASE_PART,
  OUSE_PART,
  OUT_PART,
  PARALLEL_CLAUSE,
  PARAMETER,
  PARAMETER_IDENTIFIER,
  PARAMETER_LIST,
  PARAMETER_PACK,
  PARTICULAR_PROGRAM,
  PATTERN,
  PICTURE,
  PICTURE_LIST,
  PRIMARY,
  PRIORITY,
  PRIORITY_DECLARATION,
  PROCEDURE_DECLARATION,
  PROCEDURE_VARIABLE_DECLARATION,
  PROCEDURING,
  QUALIFIER,
  RADIX_FRAME,
  REAL_PATTERN,
  REPLICATOR,
  ROUTINE_TEXT,
  ROWING,
  SECONDARY,
  SELECTION,
  SELECTOR,
  SERIAL_CLAUSE,
  SHORTETY,
  SIGN_MOULD,
  SKIP,
  SLICE,
  SOME_CLAUSE,
  SPECIFIED_UNIT,
  SPECIFIED_UNIT_LIST,
  SPECIFIER,
  SPECIFIER_IDENTIFIER,
  STRING_C_PATTERN,
  STRING_PATTERN,
  STRUCTURE_PACK,
  STRUCTURED_FIELD,
  STRUCTURED_FIELD_LIST,
  TERTIARY,
  THEN_PART,
  TO_PART,
  TRIMMER,
  UNION_DECLARER_LIST,
  UNION_PACK,
  UNIT,
  UNIT_LIST,
  UNITED_CASE_CLAUSE,
  UNITED_CHOICE,
  UNITED_IN_PART,
  UNITED_OUSE_PART,
  UNITING,
  UNTIL_PART,
  VARIABLE_DECLARATION,
  VOIDING,
  WHILE_PART,
  WIDENING;

  /** The source spelling of a symbol, or null for tags, denotations and non-terminals. */
  private final String spelling;

  Attribute() {
    this.spelling = null;
  }

  Attribute(String spelling) {
    this.spelling = spelling;
  }

  /** True for attributes that can only be produced by reduction. */
  public boolean isNonTerminal() {
    return compareTo(ALT_DO_PART) >= 0;
  }

  /**
   * Returns a readable name for diagnostics: the spelling for symbols (e.g. {@code "BEGIN"}), and
   * lower case words otherwise (e.g. {@code "serial clause"}).
   */
  public String displayName() {
    if (spelling != null) {
      return spelling;
    }
    return Ascii.toLowerCase(name()).replace('_', ' ');
  }

  @Override
  public boolean matches(Node node) {
    return (this == WILDCARD) ? node.attribute().isNonTerminal() : node.attribute() == this;
  }

  /** Returns a Matcher that accepts any node whose attribute is not {@code attribute}. */
  public static Matcher not(Attribute attribute) {
    return node -> !attribute.matches(node);
  }
}
