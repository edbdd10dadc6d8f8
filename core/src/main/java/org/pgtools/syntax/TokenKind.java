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

/**
 * Enumerates the lexical kinds of {@link Token}.
 *
 * <p>Each kind belongs to exactly one {@link Category}. Use the category
 * when the precise form does not matter, for instance to decide whether a
 * token can stand for an identifier:
 *
 * <blockquote><pre>
 * if (token.kind().category() == TokenKind.Category.LITERAL) ...
 * </pre></blockquote>
 */
public enum TokenKind {
  /** Run of spaces, tabs, newlines, carriage returns and form feeds. */
  WHITESPACE(Category.WHITESPACE),
  /** {@code --} comment, up to but not including the end of line. */
  LINE_COMMENT(Category.COMMENT),
  /** {@code /* ... *&#47;} comment; may nest. */
  BLOCK_COMMENT(Category.COMMENT),

  /** Word that appears in the PostgreSQL keyword list. */
  KEYWORD(Category.KEYWORD),
  /** Unquoted word that is not a keyword. */
  IDENTIFIER(Category.IDENTIFIER),
  /** {@code "..."} or {@code U&"..."}. */
  QUOTED_IDENTIFIER(Category.IDENTIFIER),

  /** {@code '...'}, {@code E'...'}, {@code N'...'} or {@code U&'...'}. */
  STRING_LITERAL(Category.LITERAL),
  /** {@code B'...'} or {@code X'...'}. */
  BIT_STRING_LITERAL(Category.LITERAL),
  /** {@code $tag$ ... $tag$}. */
  DOLLAR_STRING_LITERAL(Category.LITERAL),
  /** Integer, decimal or floating-point constant. */
  NUMERIC_LITERAL(Category.LITERAL),
  /** Positional parameter, {@code $1}. */
  PARAMETER(Category.LITERAL),

  /** Operator such as {@code +}, {@code <>} or {@code @>}. */
  OPERATOR(Category.OPERATOR),

  SEMICOLON(Category.PUNCTUATION),
  COMMA(Category.PUNCTUATION),
  LEFT_PAREN(Category.PUNCTUATION),
  RIGHT_PAREN(Category.PUNCTUATION),
  LEFT_BRACKET(Category.PUNCTUATION),
  RIGHT_BRACKET(Category.PUNCTUATION),
  DOT(Category.PUNCTUATION),
  COLON(Category.PUNCTUATION),
  /** {@code ::}, the PostgreSQL cast. */
  DOUBLE_COLON(Category.PUNCTUATION),
  /** {@code :=} or {@code =>}, used for named arguments. */
  ASSIGN(Category.PUNCTUATION),

  /** Quoted string that is still open at end of input. */
  UNTERMINATED_STRING(Category.ERROR),
  /** Quoted identifier that is still open at end of input. */
  UNTERMINATED_QUOTED_IDENTIFIER(Category.ERROR),
  /** Dollar-quoted string whose closing tag never appears. */
  UNTERMINATED_DOLLAR_STRING(Category.ERROR),
  /** Block comment that is still open at end of input. */
  UNTERMINATED_COMMENT(Category.ERROR),
  /** Character that cannot start any token. */
  INVALID(Category.ERROR);

  private final Category category;

  TokenKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  /** Returns whether tokens of this kind are trivia, that is, whitespace
   * or comments. An unterminated comment is trivia too, because the grammar
   * never sees it. */
  public boolean isTrivia() {
    return category == Category.WHITESPACE
        || category == Category.COMMENT
        || this == UNTERMINATED_COMMENT;
  }

  /** Returns whether this kind represents a lexical defect. */
  public boolean isError() {
    return category == Category.ERROR;
  }

  /** Coarse grouping of token kinds. */
  public enum Category {
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    LITERAL,
    PUNCTUATION,
    WHITESPACE,
    COMMENT,
    ERROR
  }
}
