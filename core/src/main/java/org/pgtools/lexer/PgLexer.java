/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pgtools.lexer;

import org.pgtools.syntax.Token;
import org.pgtools.syntax.TokenKind;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Splits PostgreSQL source text into {@link Token}s.
 *
 * <p>The lexer is total: every character of the input ends up in exactly
 * one token, trivia included, and malformed input never stops it. A string,
 * quoted identifier, dollar-quoted string or block comment that is still
 * open at end of input becomes one of the {@code UNTERMINATED_*} kinds
 * running to the end of the input; a character that cannot start a token
 * becomes an {@link TokenKind#INVALID} token of its own.
 *
 * <p>A dollar-quoted string closes only at the first occurrence of exactly
 * the same delimiter, so in
 *
 * <blockquote><pre>$a$ x $b$ y $a$</pre></blockquote>
 *
 * <p>the whole text is one token and {@code $b$} is part of its body.
 */
public class PgLexer {
  private final String source;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private int pos;

  private PgLexer(String source) {
    this.source = requireNonNull(source, "source");
  }

  /** Tokenizes a source text. */
  public static ImmutableList<Token> tokenize(String source) {
    final PgLexer lexer = new PgLexer(source);
    lexer.run();
    return lexer.tokens.build();
  }

  private void run() {
    final int length = source.length();
    while (pos < length) {
      final int start = pos;
      final TokenKind kind = scan();
      assert pos > start : "lexer made no progress at " + start;
      tokens.add(new Token(kind, start, source.substring(start, pos)));
    }
  }

  /** Scans one token starting at {@link #pos}, advances {@link #pos} past
   * it, and returns its kind. */
  private TokenKind scan() {
    final char c = source.charAt(pos);
    switch (c) {
    case ' ':
    case '\t':
    case '\n':
    case '\r':
    case '\f':
    case '\u000B':
      while (pos < source.length() && isWhitespace(source.charAt(pos))) {
        ++pos;
      }
      return TokenKind.WHITESPACE;

    case '\'':
      return quoted('\'', false, TokenKind.STRING_LITERAL,
          TokenKind.UNTERMINATED_STRING);

    case '"':
      return quoted('"', false, TokenKind.QUOTED_IDENTIFIER,
          TokenKind.UNTERMINATED_QUOTED_IDENTIFIER);

    case '$':
      return dollar();

    case '(':
      ++pos;
      return TokenKind.LEFT_PAREN;
    case ')':
      ++pos;
      return TokenKind.RIGHT_PAREN;
    case '[':
      ++pos;
      return TokenKind.LEFT_BRACKET;
    case ']':
      ++pos;
      return TokenKind.RIGHT_BRACKET;
    case ',':
      ++pos;
      return TokenKind.COMMA;
    case ';':
      ++pos;
      return TokenKind.SEMICOLON;

    case ':':
      if (lookingAt("::")) {
        pos += 2;
        return TokenKind.DOUBLE_COLON;
      }
      if (lookingAt(":=")) {
        pos += 2;
        return TokenKind.ASSIGN;
      }
      ++pos;
      return TokenKind.COLON;

    case '.':
      if (isDigit(charAt(pos + 1))) {
        return number();
      }
      ++pos;
      return TokenKind.DOT;

    default:
      break;
    }

    if (c == '-' && lookingAt("--")) {
      return lineComment();
    }
    if (c == '/' && lookingAt("/*")) {
      return blockComment();
    }
    if (isOperatorChar(c)) {
      return operator();
    }
    if (isDigit(c)) {
      return number();
    }
    if (isIdentifierStart(c)) {
      final TokenKind prefixed = prefixedString(c);
      if (prefixed != null) {
        return prefixed;
      }
      return word();
    }
    pos += Character.charCount(source.codePointAt(pos));
    return TokenKind.INVALID;
  }

  private TokenKind lineComment() {
    pos += 2;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\n' || c == '\r') {
        break;
      }
      ++pos;
    }
    return TokenKind.LINE_COMMENT;
  }

  /** Scans a block comment. PostgreSQL allows block comments to nest. */
  private TokenKind blockComment() {
    pos += 2;
    int depth = 1;
    while (pos < source.length()) {
      if (lookingAt("/*")) {
        ++depth;
        pos += 2;
      } else if (lookingAt("*/")) {
        pos += 2;
        if (--depth == 0) {
          return TokenKind.BLOCK_COMMENT;
        }
      } else {
        ++pos;
      }
    }
    return TokenKind.UNTERMINATED_COMMENT;
  }

  /** Scans a string or identifier delimited by {@code quote}, where a
   * doubled quote stands for itself. {@link #pos} is at the opening quote. */
  private TokenKind quoted(char quote, boolean backslashEscapes,
      TokenKind kind, TokenKind unterminatedKind) {
    ++pos;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (backslashEscapes && c == '\\') {
        pos = Math.min(pos + 2, source.length());
        continue;
      }
      ++pos;
      if (c == quote) {
        if (charAt(pos) == quote) {
          ++pos;
          continue;
        }
        return kind;
      }
    }
    return unterminatedKind;
  }

  /** Handles the prefixed forms {@code E'..'}, {@code B'..'},
   * {@code X'..'}, {@code N'..'}, {@code U&'..'} and {@code U&".."}.
   * Returns null, without moving, if the word at {@link #pos} is not one of
   * them. */
  private @Nullable TokenKind prefixedString(char c) {
    final char next = charAt(pos + 1);
    switch (c) {
    case 'e':
    case 'E':
      if (next == '\'') {
        ++pos;
        return quoted('\'', true, TokenKind.STRING_LITERAL,
            TokenKind.UNTERMINATED_STRING);
      }
      return null;
    case 'b':
    case 'B':
    case 'x':
    case 'X':
      if (next == '\'') {
        ++pos;
        return quoted('\'', false, TokenKind.BIT_STRING_LITERAL,
            TokenKind.UNTERMINATED_STRING);
      }
      return null;
    case 'n':
    case 'N':
      if (next == '\'') {
        ++pos;
        return quoted('\'', false, TokenKind.STRING_LITERAL,
            TokenKind.UNTERMINATED_STRING);
      }
      return null;
    case 'u':
    case 'U':
      if (next == '&') {
        final char third = charAt(pos + 2);
        if (third == '\'') {
          pos += 2;
          return quoted('\'', false, TokenKind.STRING_LITERAL,
              TokenKind.UNTERMINATED_STRING);
        }
        if (third == '"') {
          pos += 2;
          return quoted('"', false, TokenKind.QUOTED_IDENTIFIER,
              TokenKind.UNTERMINATED_QUOTED_IDENTIFIER);
        }
      }
      return null;
    default:
      return null;
    }
  }

  /** Scans a token that starts with '$': a positional parameter, a
   * dollar-quoted string, or a stray '$'. */
  private TokenKind dollar() {
    if (isDigit(charAt(pos + 1))) {
      ++pos;
      while (isDigit(charAt(pos))) {
        ++pos;
      }
      return TokenKind.PARAMETER;
    }
    final String delimiter = dollarDelimiter(pos);
    if (delimiter == null) {
      ++pos;
      return TokenKind.INVALID;
    }
    final int close = source.indexOf(delimiter, pos + delimiter.length());
    if (close < 0) {
      pos = source.length();
      return TokenKind.UNTERMINATED_DOLLAR_STRING;
    }
    pos = close + delimiter.length();
    return TokenKind.DOLLAR_STRING_LITERAL;
  }

  /** Returns the dollar-quote delimiter (such as "$$" or "$body$") that
   * starts at {@code i}, or null if there is none. The tag is
   * identifier-shaped and may not contain '$'. */
  private @Nullable String dollarDelimiter(int i) {
    int j = i + 1;
    if (j < source.length() && isIdentifierStart(source.charAt(j))) {
      ++j;
      while (j < source.length() && isTagPart(source.charAt(j))) {
        ++j;
      }
    }
    if (j < source.length() && source.charAt(j) == '$') {
      return source.substring(i, j + 1);
    }
    return null;
  }

  /** Returns the delimiter that opens a dollar-quoted token's text, for
   * example "$body$" for "$body$ select 1 $body$". */
  public static String openingDelimiter(String tokenText) {
    final int end = tokenText.indexOf('$', 1);
    return end < 0 ? tokenText : tokenText.substring(0, end + 1);
  }

  private TokenKind number() {
    if (charAt(pos) == '0') {
      final char radix = Character.toLowerCase(charAt(pos + 1));
      if ((radix == 'x' && isHexDigit(charAt(pos + 2)))
          || (radix == 'o' && isOctalDigit(charAt(pos + 2)))
          || (radix == 'b' && isBinaryDigit(charAt(pos + 2)))) {
        pos += 2;
        while (isHexDigit(charAt(pos)) || charAt(pos) == '_') {
          ++pos;
        }
        return TokenKind.NUMERIC_LITERAL;
      }
    }
    digits();
    if (charAt(pos) == '.' && charAt(pos + 1) != '.') {
      ++pos;
      digits();
    }
    final char e = charAt(pos);
    if (e == 'e' || e == 'E') {
      int j = pos + 1;
      if (charAt(j) == '+' || charAt(j) == '-') {
        ++j;
      }
      if (isDigit(charAt(j))) {
        pos = j;
        digits();
      }
    }
    return TokenKind.NUMERIC_LITERAL;
  }

  private void digits() {
    while (isDigit(charAt(pos))
        || charAt(pos) == '_' && isDigit(charAt(pos + 1))) {
      ++pos;
    }
  }

  private TokenKind word() {
    final int start = pos;
    ++pos;
    while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
      ++pos;
    }
    return PgKeywords.isKeyword(source.substring(start, pos))
        ? TokenKind.KEYWORD
        : TokenKind.IDENTIFIER;
  }

  /** Scans an operator, following the rules of PostgreSQL's scanner: the
   * longest run of operator characters that does not contain the start of
   * a comment, with trailing '+' and '-' removed unless the operator
   * contains one of the characters {@code ~ ! @ # % ^ & | ` ?}. */
  private TokenKind operator() {
    final int start = pos;
    int end = pos;
    while (end < source.length() && isOperatorChar(source.charAt(end))) {
      if (end > start
          && (source.startsWith("--", end) || source.startsWith("/*", end))) {
        break;
      }
      ++end;
    }
    if (end - start > 1) {
      boolean special = false;
      for (int i = start; i < end; i++) {
        if ("~!@#%^&|`?".indexOf(source.charAt(i)) >= 0) {
          special = true;
          break;
        }
      }
      if (!special) {
        while (end - start > 1
            && (source.charAt(end - 1) == '+'
                || source.charAt(end - 1) == '-')) {
          --end;
        }
      }
    }
    pos = end;
    if (end - start == 2 && source.startsWith("=>", start)) {
      return TokenKind.ASSIGN;
    }
    return TokenKind.OPERATOR;
  }

  private boolean lookingAt(String s) {
    return source.startsWith(s, pos);
  }

  /** Returns the character at {@code i}, or NUL past the end of input. */
  private char charAt(int i) {
    return i < source.length() ? source.charAt(i) : '\0';
  }

  static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f'
        || c == '\u000B';
  }

  static boolean isOperatorChar(char c) {
    return "+-*/<>=~!@#%^&|`?".indexOf(c) >= 0;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isOctalDigit(char c) {
    return c >= '0' && c <= '7';
  }

  private static boolean isBinaryDigit(char c) {
    return c == '0' || c == '1';
  }

  /** PostgreSQL treats every non-ASCII character as a letter. */
  static boolean isIdentifierStart(char c) {
    return c >= 0x80
        || (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || c == '_';
  }

  static boolean isIdentifierPart(char c) {
    return isTagPart(c) || c == '$';
  }

  private static boolean isTagPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
