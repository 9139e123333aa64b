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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.algolang.Options;
import org.algolang.Session;
import org.algolang.diag.PhaseAbort;
import org.algolang.diag.Severity;
import org.algolang.tree.Attribute;
import org.algolang.tree.Node;
import org.algolang.tree.SourceLine;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns source lines into a linked list of token nodes.
 *
 * <p>Scanning starts with a preprocessing pass that splices in the files named by {@code include}
 * and {@code read} pragmat items. The lines of an included file are inserted before the line that
 * holds the pragmat, keeping their own file name and line numbers; a file whose name already occurs
 * among the lines is not included again.
 *
 * <p>The tokeniser then reads symbols according to the stropping regime in force, which pragmats
 * may change mid-source. Format texts are scanned by a recursive call, since inside {@code $ ... $}
 * letters are format items, except within the clauses of dynamic replicators and the {@code n},
 * {@code f}, {@code g} and {@code h} items.
 *
 * <p>Any lexical error is reported and ends scanning with a {@link PhaseAbort}.
 */
public final class Scanner {
  private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

  static final String UNTERMINATED_STRING = "unterminated string";
  static final String UNTERMINATED_COMMENT = "unterminated comment";
  static final String UNTERMINATED_PRAGMAT = "unterminated pragmat";
  static final String LONG_STRING = "string exceeds end of line";
  static final String UNWORTHY_CHARACTER = "unworthy character %s";
  static final String QUOTED_BOLD_TAG = "error in quoted bold tag";
  static final String INVALID_OPERATOR_TAG = "invalid operator tag";
  static final String INCORRECT_FILENAME = "incorrect filename";
  static final String SOURCE_FILE_OPEN = "error while opening source file \"%s\"";
  static final String FILE_INCLUDE_CTRL = "control characters in include file";
  static final String PRAGMENT = "error in pragment";
  static final String TRAILING = "ignoring trailing character \"_\" in %s";
  static final String EXPONENT_DIGIT = "invalid exponent digit";
  static final String RADIX = "radix %s must be 2, 4, 8 or 16";
  static final String RADIX_DIGIT = "digit \"%s\" is not valid in radix %s";

  private static final char STOP = '\0';
  private static final String MONADS = "%^&+-~!?";
  private static final String NOMADS = "></=*";
  private static final CharMatcher SPACE = CharMatcher.anyOf(" \t\n\r\f\u000b");
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
  private static final CharMatcher CONTROL =
      CharMatcher.javaIsoControl().and(CharMatcher.isNot('\t')).and(CharMatcher.isNot('\r'));

  private final Session session;
  private final SourceReader reader;
  private List<SourceLine> lines;

  // The read position: line index, column, and the current line with its terminator.
  private int li;
  private int ci;
  private String cur;

  private final StringBuilder sym = new StringBuilder();
  private Attribute att;
  private int startLine;
  private int startColumn;
  private boolean stopped;
  private Node last;
  private Node first;

  public Scanner(Session session, SourceReader reader) {
    this.session = session;
    this.reader = reader;
  }

  /**
   * Scans a program and returns its first token, or null if the program has no tokens. The
   * returned list is flat: every node's {@code sub} is null.
   */
  public @Nullable Node scan(List<SourceLine> source) {
    lines = new ArrayList<>(source);
    if (!lines.isEmpty() && lines.get(0).number() == 1 && lines.get(0).text().startsWith("#!")) {
      lines.remove(0);
    }
    includeFiles();
    concatenateLines();
    li = 0;
    ci = 0;
    cur = lines.isEmpty() ? null : lineText(0);
    first = null;
    last = null;
    stopped = false;
    tokenise(0, false);
    logger.debug("scanned {} lines", lines.size());
    return first;
  }

  /** The lines after inclusion, for diagnostics that need the full text. */
  public ImmutableList<SourceLine> lines() {
    return ImmutableList.copyOf(lines);
  }

  private String lineText(int i) {
    return lines.get(i).text() + "\n";
  }

  @FormatMethod
  private PhaseAbort lexicalError(
      @Nullable SourceLine line, int column, String fmt, Object... fmtArgs) {
    session.diagnostics().errorAt(Severity.LEXICAL, line, column, fmt, fmtArgs);
    return new PhaseAbort("lexical error");
  }

  private boolean quoteStropping() {
    return session.options().stropping() == Options.Stropping.QUOTE;
  }

  // Preprocessing.

  /** A mutable position used by the preprocessor, which runs before the tokeniser. */
  private static final class Pos {
    int line;
    int col;

    Pos(int line, int col) {
      this.line = line;
      this.col = col;
    }
  }

  private char at(Pos p) {
    String s = lines.get(p.line).text();
    return (p.col < s.length()) ? s.charAt(p.col) : '\n';
  }

  /** Advances to the next character, crossing lines; returns false at the end of the source. */
  private boolean advance(Pos p) {
    if (p.col < lines.get(p.line).text().length()) {
      p.col++;
      return true;
    }
    p.line++;
    p.col = 0;
    return p.line < lines.size();
  }

  /** True if {@code word} is written as a bold word at {@code p} under the regime in force. */
  private boolean isBold(Pos p, String word) {
    String s = lines.get(p.line).text();
    if (quoteStropping()) {
      int end = p.col + 1 + word.length();
      return s.startsWith("'" + word, p.col) && end < s.length() && s.charAt(end) == '\'';
    }
    int end = p.col + word.length();
    return s.startsWith(word, p.col) && (end >= s.length() || !Ascii.isUpperCase(s.charAt(end)));
  }

  private int boldLength(String word) {
    return quoteStropping() ? word.length() + 2 : word.length();
  }

  private boolean skipString(Pos p) {
    while (advance(p)) {
      if (at(p) == '"') {
        Pos q = new Pos(p.line, p.col);
        if (!advance(q) || at(q) != '"') {
          advance(p);
          return true;
        }
        advance(p);
      }
    }
    return false;
  }

  private boolean skipToBold(Pos p, String word) {
    do {
      if (isBold(p, word)) {
        p.col += boldLength(word);
        return true;
      }
    } while (advance(p));
    return false;
  }

  private boolean skipComment(Pos p, Attribute delim) {
    if (delim == Attribute.STYLE_II_COMMENT_SYMBOL) {
      while (advance(p)) {
        if (at(p) == '#') {
          advance(p);
          return true;
        }
      }
      return false;
    }
    String word = (delim == Attribute.BOLD_COMMENT_SYMBOL) ? "COMMENT" : "CO";
    p.col += boldLength(word);
    return skipToBold(p, word);
  }

  /** Skips to the end of a pragmat; if {@code blankOnly}, only white space may come first. */
  private boolean skipPragmat(Pos p, String word, boolean blankOnly) {
    do {
      if (isBold(p, word)) {
        p.col += boldLength(word);
        return true;
      } else if (blankOnly && !SPACE.matches(at(p))) {
        throw lexicalError(lines.get(p.line), p.col + 1, PRAGMENT);
      }
    } while (advance(p));
    return false;
  }

  private void includeFiles() {
    boolean again = true;
    while (again && !lines.isEmpty()) {
      again = includeNextFile();
    }
  }

  /** Performs the first inclusion that has not been done yet; returns false if there is none. */
  private boolean includeNextFile() {
    Pos p = new Pos(0, 0);
    do {
      SourceLine startLine = lines.get(p.line);
      int startCol = p.col + 1;
      char ch = at(p);
      if (ch == '"') {
        if (!skipString(p)) {
          throw lexicalError(startLine, startCol, UNTERMINATED_STRING);
        }
        p.col--;
      } else if (isBold(p, "COMMENT") || isBold(p, "CO") || ch == '#') {
        Attribute delim;
        if (isBold(p, "COMMENT")) {
          delim = Attribute.BOLD_COMMENT_SYMBOL;
        } else if (ch == '#') {
          delim = Attribute.STYLE_II_COMMENT_SYMBOL;
        } else {
          delim = Attribute.STYLE_I_COMMENT_SYMBOL;
        }
        if (!skipComment(p, delim)) {
          throw lexicalError(startLine, startCol, UNTERMINATED_COMMENT);
        }
        p.col--;
      } else if (isBold(p, "PRAGMAT") || isBold(p, "PR")) {
        String word = isBold(p, "PRAGMAT") ? "PRAGMAT" : "PR";
        p.col += boldLength(word);
        if (includePragmat(p, word, startLine, startCol)) {
          return true;
        }
        p.col--;
      } else if (Ascii.isUpperCase(ch)) {
        // Skip the whole bold word so that e.g. REPR is not taken for PR.
        while (Ascii.isUpperCase(at(p))) {
          p.col++;
        }
        p.col--;
      }
    } while (advance(p));
    return false;
  }

  /**
   * Handles a pragmat whose opening word ends at {@code p}. Returns true if it included a file;
   * otherwise leaves {@code p} after the pragmat.
   */
  private boolean includePragmat(Pos p, String word, SourceLine startLine, int startCol) {
    while (SPACE.matches(at(p))) {
      if (!advance(p)) {
        throw lexicalError(startLine, startCol, UNTERMINATED_PRAGMAT);
      }
    }
    StringBuilder item = new StringBuilder();
    while (Ascii.isLowerCase(at(p)) || Ascii.isUpperCase(at(p))) {
      item.append(at(p));
      p.col++;
    }
    String name = Ascii.toLowerCase(item.toString());
    if (!name.equals("include") && !name.equals("read")) {
      if (!skipPragmat(p, word, false)) {
        throw lexicalError(startLine, startCol, UNTERMINATED_PRAGMAT);
      }
      return false;
    }
    String s = lines.get(p.line).text();
    int k = p.col;
    while (k < s.length() && SPACE.matches(s.charAt(k))) {
      k++;
    }
    if (k >= s.length() || (s.charAt(k) != '"' && s.charAt(k) != '\'')) {
      throw lexicalError(startLine, startCol, INCORRECT_FILENAME);
    }
    char delim = s.charAt(k++);
    StringBuilder fileName = new StringBuilder();
    while (true) {
      if (k >= s.length()) {
        throw lexicalError(startLine, startCol, INCORRECT_FILENAME);
      } else if (s.charAt(k) == delim) {
        if (k + 1 < s.length() && s.charAt(k + 1) == delim) {
          fileName.append(delim);
          k += 2;
        } else {
          break;
        }
      } else if (CONTROL.matches(s.charAt(k))) {
        throw lexicalError(startLine, startCol, INCORRECT_FILENAME);
      } else {
        fileName.append(s.charAt(k++));
      }
    }
    p.col = k + 1;
    if (!skipPragmat(p, word, true)) {
      throw lexicalError(startLine, startCol, UNTERMINATED_PRAGMAT);
    }
    if (fileName.length() == 0) {
      throw lexicalError(startLine, startCol, INCORRECT_FILENAME);
    }
    int insertAt = Math.min(p.line, lines.size() - 1);
    String resolved = reader.resolve(lines.get(insertAt).fileName(), fileName.toString());
    for (SourceLine line : lines) {
      if (line.fileName().equals(resolved)) {
        return false;
      }
    }
    ImmutableList<String> text;
    try {
      text = reader.read(resolved);
    } catch (IOException e) {
      logger.debug("cannot read {}", resolved, e);
      throw lexicalError(startLine, startCol, SOURCE_FILE_OPEN, resolved);
    }
    List<SourceLine> included = new ArrayList<>();
    for (String t : text) {
      if (CONTROL.matchesAnyOf(t)) {
        throw lexicalError(startLine, startCol, FILE_INCLUDE_CTRL);
      }
      included.add(new SourceLine(resolved, included.size() + 1, t));
    }
    if (included.isEmpty()) {
      included.add(new SourceLine(resolved, 1, ""));
    }
    lines.addAll(insertAt, included);
    logger.debug("included {} ({} lines)", resolved, included.size());
    return true;
  }

  /** Joins each line that ends in a backslash with the line after it. */
  private void concatenateLines() {
    for (int i = lines.size() - 2; i >= 0; i--) {
      SourceLine l = lines.get(i);
      if (l.text().endsWith("\\")) {
        SourceLine n = lines.get(i + 1);
        String joined = l.text().substring(0, l.text().length() - 1) + n.text();
        lines.set(i, new SourceLine(l.fileName(), l.number(), joined));
        lines.set(i + 1, new SourceLine(n.fileName(), n.number(), ""));
      }
    }
  }

  // Tokenising.

  private char current() {
    return (cur == null || li >= lines.size()) ? STOP : cur.charAt(ci);
  }

  /**
   * Moves to the next character. With {@code allowTypo}, white space is skipped, so that
   * identifiers and denotations may contain spaces.
   */
  private char nextChar(boolean allowTypo) {
    while (true) {
      if (cur == null || li >= lines.size()) {
        return STOP;
      }
      if (ci >= cur.length() - 1) {
        li++;
        if (li >= lines.size()) {
          return STOP;
        }
        cur = lineText(li);
        ci = 0;
      } else {
        ci++;
      }
      char ch = cur.charAt(ci);
      if (!allowTypo || !SPACE.matches(ch)) {
        return ch;
      }
    }
  }

  private record State(int li, int ci, String cur) {}

  private State save() {
    return new State(li, ci, cur);
  }

  private char restore(State s) {
    li = s.li;
    ci = s.ci;
    cur = s.cur;
    return current();
  }

  private SourceLine startSourceLine() {
    return lines.get(Math.min(startLine, lines.size() - 1));
  }

  private String exponentChars() {
    return quoteStropping() ? "E\\" : "eE";
  }

  private boolean isExpChar(char ch) {
    boolean ret = false;
    State s = save();
    if (exponentChars().indexOf(ch) >= 0) {
      ch = nextChar(true);
      ret = "+-0123456789".indexOf(ch) >= 0;
    }
    restore(s);
    return ret;
  }

  private boolean isRadixChar(char ch) {
    boolean ret = false;
    State s = save();
    if (quoteStropping() ? ch == 'R' : ch == 'r') {
      ch = nextChar(true);
      ret = (quoteStropping() ? "0123456789ABCDEF" : "0123456789abcdef").indexOf(ch) >= 0;
    }
    restore(s);
    return ret;
  }

  private boolean isDecimalPoint(char ch) {
    boolean ret = false;
    State s = save();
    if (ch == '.') {
      ch = nextChar(true);
      if (exponentChars().indexOf(ch) >= 0) {
        ch = nextChar(true);
        ret = "+-0123456789".indexOf(ch) >= 0;
      } else {
        ret = DIGIT.matches(ch);
      }
    }
    restore(s);
    return ret;
  }

  private char scanDigits(char c) {
    while (DIGIT.matches(c)) {
      sym.append(c);
      c = nextChar(true);
    }
    return c;
  }

  private char scanExponentPart(char c) {
    sym.append('e');
    c = nextChar(true);
    if (c == '+' || c == '-') {
      sym.append(c);
      c = nextChar(true);
    }
    if (!DIGIT.matches(c)) {
      throw lexicalError(startSourceLine(), startColumn + 1, EXPONENT_DIGIT);
    }
    return scanDigits(c);
  }

  private void checkRadixDigit(String radix, char digit) {
    int base = (radix.length() <= 2) ? Integer.parseInt(radix) : 0;
    if (base != 2 && base != 4 && base != 8 && base != 16) {
      throw lexicalError(startSourceLine(), startColumn + 1, RADIX, radix);
    }
    if (Character.digit(digit, 16) >= base) {
      throw lexicalError(startSourceLine(), startColumn + 1, RADIX_DIGIT, digit, radix);
    }
  }

  private static @Nullable Attribute formatItem(char ch) {
    switch (Ascii.toLowerCase(ch)) {
      case '/':
        return Attribute.FORMAT_ITEM_L;
      case '+':
        return Attribute.FORMAT_ITEM_PLUS;
      case '-':
        return Attribute.FORMAT_ITEM_MINUS;
      case '.':
        return Attribute.FORMAT_ITEM_POINT;
      case '%':
        return Attribute.FORMAT_ITEM_ESCAPE;
      default:
        char lower = Ascii.toLowerCase(ch);
        if (lower >= 'a' && lower <= 'z') {
          return Attribute.valueOf("FORMAT_ITEM_" + Ascii.toUpperCase(lower));
        }
        return null;
    }
  }

  /** Reads the next token into {@link #sym} and {@link #att}; {@code att} is null for symbols. */
  private void nextToken(boolean inFormat) {
    sym.setLength(0);
    att = null;
    char c = current();
    while (c != STOP && SPACE.matches(c)) {
      c = nextChar(false);
    }
    startLine = li;
    startColumn = ci;
    if (c == STOP) {
      stopped = true;
      return;
    }
    if (inFormat) {
      String items =
          quoteStropping() ? "/%+-.ABCDEFGHIJKLMNOPQRSTUVWXYZ" : "/%+-.abcdefghijklmnopqrstuvwxyz";
      if (items.indexOf(c) >= 0) {
        sym.append(c);
        att = formatItem(c);
        nextChar(false);
        return;
      } else if (DIGIT.matches(c)) {
        scanDigits(c);
        att = Attribute.STATIC_REPLICATOR;
        return;
      }
    }
    if (Ascii.isUpperCase(c)) {
      if (quoteStropping()) {
        while (Ascii.isUpperCase(c) || DIGIT.matches(c) || c == '_') {
          sym.append(c);
          c = nextChar(true);
        }
        att = Attribute.IDENTIFIER;
      } else {
        while (Ascii.isUpperCase(c) || c == '_') {
          sym.append(c);
          c = nextChar(false);
        }
        att = Attribute.BOLD_TAG;
      }
    } else if (c == '\'') {
      c = nextChar(false);
      while (Ascii.isUpperCase(c) || DIGIT.matches(c) || c == '_') {
        sym.append(c);
        c = nextChar(true);
      }
      if (sym.length() == 0 || c != '\'') {
        throw lexicalError(startSourceLine(), startColumn + 1, QUOTED_BOLD_TAG);
      }
      att = Attribute.BOLD_TAG;
      nextChar(false);
    } else if (Ascii.isLowerCase(c)) {
      while (Ascii.isLowerCase(c) || DIGIT.matches(c) || c == '_') {
        sym.append(c);
        c = nextChar(true);
      }
      att = Attribute.IDENTIFIER;
    } else if (c == '.') {
      if (isDecimalPoint(c)) {
        sym.append("0.");
        c = nextChar(true);
        c = scanDigits(c);
        if (isExpChar(c)) {
          scanExponentPart(c);
        }
        att = Attribute.REAL_DENOTATION;
      } else {
        c = nextChar(true);
        if (c == '.') {
          sym.append("..");
          nextChar(false);
        } else {
          sym.append('.');
        }
      }
    } else if (DIGIT.matches(c)) {
      c = scanDigits(c);
      if (isDecimalPoint(c)) {
        c = nextChar(true);
        if (isExpChar(c)) {
          sym.append(".0");
          scanExponentPart(c);
        } else {
          sym.append('.');
          c = scanDigits(c);
          if (isExpChar(c)) {
            scanExponentPart(c);
          }
        }
        att = Attribute.REAL_DENOTATION;
      } else if (isExpChar(c)) {
        scanExponentPart(c);
        att = Attribute.REAL_DENOTATION;
      } else if (isRadixChar(c)) {
        String radix = sym.toString();
        sym.append('r');
        c = nextChar(true);
        String digits = quoteStropping() ? "0123456789ABCDEF" : "0123456789abcdef";
        while (digits.indexOf(c) >= 0) {
          checkRadixDigit(radix, c);
          sym.append(Ascii.toLowerCase(c));
          c = nextChar(true);
        }
        att = Attribute.BITS_DENOTATION;
      } else {
        att = Attribute.INT_DENOTATION;
      }
    } else if (c == '"') {
      scanString();
      att = inFormat ? Attribute.LITERAL : Attribute.ROW_CHAR_DENOTATION;
    } else if ("#$()[]{},;@".indexOf(c) >= 0) {
      sym.append(c);
      nextChar(false);
    } else if (c == '|' || (c == '!' && quoteStropping())) {
      sym.append('|');
      c = nextChar(false);
      if (c == ':') {
        sym.append(':');
        nextChar(false);
      }
    } else if (c == ':') {
      scanColon();
    } else if (c == '=') {
      scanEquals();
    } else if (MONADS.indexOf(c) >= 0 || NOMADS.indexOf(c) >= 0) {
      scanOperator(c);
    } else {
      String shown = CONTROL.matches(c) ? String.format("\\x%02x", (int) c) : "\"" + c + "\"";
      throw lexicalError(startSourceLine(), startColumn + 1, UNWORTHY_CHARACTER, shown);
    }
  }

  private void scanString() {
    boolean stop = false;
    while (!stop) {
      char c = nextChar(false);
      while (c != '"' && c != STOP) {
        if (c == '\n') {
          throw lexicalError(startSourceLine(), startColumn + 1, LONG_STRING);
        }
        sym.append(c);
        c = nextChar(false);
      }
      if (c == STOP) {
        throw lexicalError(startSourceLine(), startColumn + 1, UNTERMINATED_STRING);
      }
      c = nextChar(false);
      if (c == '"') {
        sym.append('"');
      } else {
        stop = true;
      }
    }
  }

  private void scanColon() {
    sym.append(':');
    char c = nextChar(false);
    if (c == '=') {
      sym.append(c);
      if ((c = nextChar(false)) == ':') {
        sym.append(c);
        nextChar(false);
      }
    } else if (c == '/') {
      sym.append(c);
      if ((c = nextChar(false)) == '=') {
        sym.append(c);
        if ((c = nextChar(false)) == ':') {
          sym.append(c);
          nextChar(false);
        }
      }
    }
  }

  private void scanEquals() {
    sym.append('=');
    char c = nextChar(false);
    if (NOMADS.indexOf(c) >= 0) {
      sym.append(c);
      c = nextChar(false);
    }
    if (c == '=') {
      sym.append(c);
      if (nextChar(false) == ':') {
        sym.append(':');
        if (nextChar(false) == '=') {
          sym.append('=');
          nextChar(false);
        }
      }
    } else if (c == ':') {
      sym.append(c);
      if (nextChar(false) == '=') {
        sym.append('=');
        nextChar(false);
      } else if (!sym.toString().equals("=:") && !sym.toString().equals("==:")) {
        throw lexicalError(startSourceLine(), startColumn + 1, INVALID_OPERATOR_TAG);
      }
    }
    att = sym.toString().equals("=") ? Attribute.EQUALS_SYMBOL : Attribute.OPERATOR;
  }

  private void scanOperator(char c) {
    sym.append(c);
    c = nextChar(false);
    if (NOMADS.indexOf(c) >= 0) {
      sym.append(c);
      c = nextChar(false);
    }
    if (c == '=') {
      sym.append(c);
      if (nextChar(false) == ':') {
        sym.append(':');
        c = nextChar(false);
        if (sym.length() < 4 && c == '=') {
          sym.append('=');
          nextChar(false);
        }
      }
    } else if (c == ':') {
      sym.append(c);
      if (nextChar(false) == '=') {
        sym.append('=');
        nextChar(false);
      } else if (!sym.substring(1).equals("=:")) {
        throw lexicalError(startSourceLine(), startColumn + 1, INVALID_OPERATOR_TAG);
      }
    }
    att = Attribute.OPERATOR;
  }

  /** Skips a comment or pragmat whose opening symbol has been read; returns its text. */
  private String pragment(Attribute type) {
    boolean pragmat =
        type == Attribute.STYLE_I_PRAGMAT_SYMBOL || type == Attribute.BOLD_PRAGMAT_SYMBOL;
    String word =
        switch (type) {
          case STYLE_I_COMMENT_SYMBOL -> "CO";
          case BOLD_COMMENT_SYMBOL -> "COMMENT";
          case STYLE_I_PRAGMAT_SYMBOL -> "PR";
          case BOLD_PRAGMAT_SYMBOL -> "PRAGMAT";
          default -> "#";
        };
    boolean bold = !word.equals("#");
    String term = (bold && quoteStropping()) ? "'" + word + "'" : word;
    SourceLine start = startSourceLine();
    StringBuilder buf = new StringBuilder();
    char c = current();
    while (true) {
      if (c == STOP) {
        throw lexicalError(
            start, startColumn + 1, pragmat ? UNTERMINATED_PRAGMAT : UNTERMINATED_COMMENT);
      }
      if (pragmat && (c == '"' || (c == '\'' && !quoteStropping()))) {
        char delim = c;
        buf.append(c);
        c = nextChar(false);
        while (true) {
          if (c == '\n' || c == STOP) {
            throw lexicalError(start, startColumn + 1, LONG_STRING);
          } else if (c == delim) {
            buf.append(delim);
            c = nextChar(false);
            if (c != delim) {
              break;
            }
            c = nextChar(false);
          } else {
            buf.append(c);
            c = nextChar(false);
          }
        }
        continue;
      }
      buf.append(CONTROL.matches(c) && c != '\n' ? ' ' : c);
      c = nextChar(false);
      if (endsWithTerminator(buf, term, bold, c)) {
        return buf.substring(0, buf.length() - term.length());
      }
    }
  }

  /** Under upper stropping a bold terminator must not be part of a longer bold word. */
  private boolean endsWithTerminator(StringBuilder buf, String term, boolean bold, char next) {
    int n = buf.length() - term.length();
    if (n < 0 || !buf.substring(n).equals(term)) {
      return false;
    } else if (!bold || quoteStropping()) {
      return true;
    }
    return (n == 0 || !Ascii.isUpperCase(buf.charAt(n - 1))) && !Ascii.isUpperCase(next);
  }

  private void addNode(Attribute a, String text) {
    Node q = new Node(a, session.intern(text), startSourceLine(), startColumn + 1);
    q.setPrevious(last);
    if (last != null) {
      last.setNext(q);
    } else {
      first = q;
    }
    last = q;
  }

  private static boolean opensNestedClause(Attribute a) {
    return switch (a) {
      case OPEN_SYMBOL, BEGIN_SYMBOL, PAR_SYMBOL, IF_SYMBOL, CASE_SYMBOL, FOR_SYMBOL, FROM_SYMBOL,
          BY_SYMBOL, TO_SYMBOL, DOWNTO_SYMBOL, WHILE_SYMBOL, DO_SYMBOL, SUB_SYMBOL, ACCO_SYMBOL ->
          true;
      default -> false;
    };
  }

  private static boolean closesNestedClause(Attribute a) {
    return switch (a) {
      case CLOSE_SYMBOL, END_SYMBOL, FI_SYMBOL, ESAC_SYMBOL, OD_SYMBOL, BUS_SYMBOL, OCCA_SYMBOL ->
          true;
      default -> false;
    };
  }

  private void tokenise(int level, boolean inFormat) {
    while (!stopped) {
      nextToken(inFormat);
      if (stopped) {
        return;
      }
      Attribute a = att;
      boolean isString = a == Attribute.ROW_CHAR_DENOTATION || a == Attribute.LITERAL;
      if (sym.length() == 0 && !isString) {
        continue;
      }
      String text = sym.toString();
      boolean makeNode = true;
      boolean trailing = false;
      Attribute kw = (a == Attribute.IDENTIFIER || isString) ? null : Keywords.find(text);
      if (kw == null) {
        if (a == null) {
          throw lexicalError(startSourceLine(), startColumn + 1, INVALID_OPERATOR_TAG);
        }
        if (a == Attribute.IDENTIFIER) {
          text = Ascii.toLowerCase(text);
        }
        if (!isString) {
          while (text.length() > 1 && text.endsWith("_")) {
            trailing = true;
            text = text.substring(0, text.length() - 1);
          }
        }
      } else if (kw == Attribute.TO_SYMBOL && last != null && last.is(Attribute.GO_SYMBOL)) {
        mergeGoTo();
        makeNode = false;
      } else {
        if (a == null || a == Attribute.BOLD_TAG) {
          a = kw;
        }
        if (a == Attribute.STYLE_I_COMMENT_SYMBOL
            || a == Attribute.STYLE_II_COMMENT_SYMBOL
            || a == Attribute.BOLD_COMMENT_SYMBOL) {
          pragment(a);
          makeNode = false;
        } else if (a == Attribute.STYLE_I_PRAGMAT_SYMBOL || a == Attribute.BOLD_PRAGMAT_SYMBOL) {
          String items = pragment(a);
          session.setOptions(PragmatOptions.apply(session.options(), items));
          makeNode = false;
        }
      }
      if (makeNode) {
        addNode(a, text);
        if (trailing) {
          session.diagnostics().warning(last, TRAILING, a.displayName());
        }
      }
      if (!redirect(level, inFormat, a)) {
        return;
      }
    }
  }

  private void mergeGoTo() {
    Node go = last;
    Node gotoNode = new Node(Attribute.GOTO_SYMBOL, "GOTO", go.line(), go.column());
    Node previous = go.previous();
    gotoNode.setPrevious(previous);
    if (previous != null) {
      previous.setNext(gotoNode);
    } else {
      first = gotoNode;
    }
    last = gotoNode;
  }

  /**
   * Switches between format and clause scanning after a token with attribute {@code a}; returns
   * false if the current recursion level has ended.
   */
  private boolean redirect(int level, boolean inFormat, Attribute a) {
    boolean brackets = session.options().brackets();
    if (inFormat && a == Attribute.FORMAT_DELIMITER_SYMBOL) {
      return false;
    } else if (!inFormat && a == Attribute.FORMAT_DELIMITER_SYMBOL) {
      tokenise(level + 1, true);
    } else if (inFormat && opensNestedClause(a)) {
      Node z = last.previous();
      if (z != null
          && z.isOneOf(
              Attribute.FORMAT_ITEM_N,
              Attribute.FORMAT_ITEM_G,
              Attribute.FORMAT_ITEM_H,
              Attribute.FORMAT_ITEM_F)) {
        tokenise(level, false);
      } else if (a == Attribute.OPEN_SYMBOL
          || (brackets && (a == Attribute.SUB_SYMBOL || a == Attribute.ACCO_SYMBOL))) {
        last.setAttribute(Attribute.FORMAT_OPEN_SYMBOL);
      }
    } else if (!inFormat && level > 0 && opensNestedClause(a)) {
      tokenise(level + 1, false);
    } else if (!inFormat && level > 0 && closesNestedClause(a)) {
      return false;
    } else if (inFormat
        && (a == Attribute.CLOSE_SYMBOL
            || (brackets && (a == Attribute.BUS_SYMBOL || a == Attribute.OCCA_SYMBOL)))) {
      last.setAttribute(Attribute.FORMAT_CLOSE_SYMBOL);
    }
    return true;
  }
}
