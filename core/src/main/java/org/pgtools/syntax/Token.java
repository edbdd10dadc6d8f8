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
package org.pgtools.syntax;

import org.pgtools.util.TextRange;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Leaf of a concrete syntax tree: one lexical token with its exact text.
 *
 * <p>Tokens are immutable. The lexer produces them in source order and
 * without gaps, so a token's range always starts where the previous one
 * ends.
 */
public final class Token extends SyntaxElement {
  private final TokenKind kind;
  private final int start;
  private final String text;

  public Token(TokenKind kind, int start, String text) {
    this.kind = requireNonNull(kind, "kind");
    this.start = start;
    this.text = requireNonNull(text, "text");
  }

  public TokenKind kind() {
    return kind;
  }

  @Override public TextRange range() {
    return TextRange.of(start, start + text.length());
  }

  public int start() {
    return start;
  }

  public int end() {
    return start + text.length();
  }

  @Override public String text() {
    return text;
  }

  @Override public boolean isToken() {
    return true;
  }

  /** Returns whether this token is whitespace or a comment. */
  public boolean isTrivia() {
    return kind.isTrivia();
  }

  /** Returns whether this token is a keyword or an unquoted identifier
   * whose text equals {@code word}, ignoring case. Non-reserved keywords can
   * be lexed as either, so both are accepted. */
  public boolean isWord(String word) {
    return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER)
        && text.equalsIgnoreCase(word);
  }

  /** Returns the upper-case text of a keyword token, or null if this token
   * is not a keyword. */
  public @Nullable String keyword() {
    return kind == TokenKind.KEYWORD ? text.toUpperCase(Locale.ROOT) : null;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof Token
        && kind == ((Token) obj).kind
        && start == ((Token) obj).start
        && text.equals(((Token) obj).text);
  }

  @Override public int hashCode() {
    return (kind.hashCode() * 31 + start) * 31 + text.hashCode();
  }

  @Override public String toString() {
    return kind + "@" + range() + " " + quote(text);
  }

  static String quote(String text) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
      case '\n':
        b.append("\\n");
        break;
      case '\r':
        b.append("\\r");
        break;
      case '\t':
        b.append("\\t");
        break;
      case '"':
      case '\\':
        b.append('\\').append(c);
        break;
      default:
        b.append(c);
      }
    }
    return b.append('"').toString();
  }
}
