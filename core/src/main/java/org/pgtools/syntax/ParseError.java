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

import org.pgtools.lexer.PgLexer;
import org.pgtools.util.TextRange;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static org.pgtools.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Diagnostic attached to a {@link SyntaxTree}.
 *
 * <p>Errors are values, not exceptions: a document with errors still has a
 * complete, lossless tree.
 */
public final class ParseError implements Comparable<ParseError> {
  private final TextRange range;
  private final String message;
  private final Origin origin;
  private final int statementIndex;

  public ParseError(TextRange range, String message, Origin origin,
      int statementIndex) {
    this.range = requireNonNull(range, "range");
    this.message = requireNonNull(message, "message");
    this.origin = requireNonNull(origin, "origin");
    this.statementIndex = statementIndex;
  }

  /** Creates an error for a lexical defect, or returns null if a token is
   * well-formed. */
  public static @Nullable ParseError lexical(Token token, int statementIndex) {
    final String message;
    switch (token.kind()) {
    case UNTERMINATED_STRING:
      message = RESOURCE.unterminatedString().str();
      break;
    case UNTERMINATED_QUOTED_IDENTIFIER:
      message = RESOURCE.unterminatedQuotedIdentifier().str();
      break;
    case UNTERMINATED_DOLLAR_STRING:
      message = RESOURCE.unterminatedDollarString(
          PgLexer.openingDelimiter(token.text())).str();
      break;
    case UNTERMINATED_COMMENT:
      message = RESOURCE.unterminatedComment().str();
      break;
    case INVALID:
      message = RESOURCE.invalidCharacter(token.text()).str();
      break;
    default:
      return null;
    }
    return new ParseError(token.range(), message, Origin.LEXER,
        statementIndex);
  }

  /** Returns the range of source text the error refers to. It is empty if
   * the error is at a position rather than at a token, such as an
   * unexpected end of input. */
  public TextRange range() {
    return range;
  }

  public String message() {
    return message;
  }

  public Origin origin() {
    return origin;
  }

  /** Returns the index of the statement the error belongs to. */
  public int statementIndex() {
    return statementIndex;
  }

  @Override public int compareTo(ParseError o) {
    final int c = range.compareTo(o.range);
    if (c != 0) {
      return c;
    }
    return origin.compareTo(o.origin);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ParseError
        && range.equals(((ParseError) obj).range)
        && message.equals(((ParseError) obj).message)
        && origin == ((ParseError) obj).origin
        && statementIndex == ((ParseError) obj).statementIndex;
  }

  @Override public int hashCode() {
    return Objects.hash(range, message, origin, statementIndex);
  }

  @Override public String toString() {
    return origin + " error at " + range + ": " + message;
  }

  /** Which stage of parsing detected an error. */
  public enum Origin {
    LEXER,
    ORACLE
  }
}
