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
package org.pgtools.split;

import org.pgtools.syntax.Token;
import org.pgtools.syntax.TokenKind;
import org.pgtools.util.TextRange;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Contiguous slice of a document's token stream that is parsed as one SQL
 * statement.
 *
 * <p>A range owns its leading trivia, its terminating semicolon (if any) and
 * the trivia after that semicolon. Ranges of a document are sorted, do not
 * overlap, and together contain every token.
 */
public final class StatementRange {
  private final int index;
  private final ImmutableList<Token> tokens;
  private final TextRange range;

  StatementRange(int index, List<Token> tokens, TextRange range) {
    Preconditions.checkArgument(!tokens.isEmpty(), "empty statement range");
    this.index = index;
    this.tokens = ImmutableList.copyOf(tokens);
    this.range = range;
  }

  /** Returns the ordinal of this range in its document, starting at 0. */
  public int index() {
    return index;
  }

  /** Returns the tokens of this range, trivia included. */
  public ImmutableList<Token> tokens() {
    return tokens;
  }

  /** Returns the range of document text covered by this statement. */
  public TextRange range() {
    return range;
  }

  public int start() {
    return range.start();
  }

  /** Returns the text of this statement, exactly as in the document. */
  public String text() {
    final StringBuilder b = new StringBuilder(range.length());
    for (Token token : tokens) {
      b.append(token.text());
    }
    return b.toString();
  }

  /** Returns whether this range contains nothing but trivia and
   * semicolons. */
  public boolean isEmptyStatement() {
    for (Token token : tokens) {
      if (!token.isTrivia() && token.kind() != TokenKind.SEMICOLON) {
        return false;
      }
    }
    return true;
  }

  /** Returns the first semicolon that ends this statement, or null if the
   * statement runs to the end of the document unterminated. */
  public @Nullable Token terminator() {
    final int i = terminatorIndex();
    return i < 0 ? null : tokens.get(i);
  }

  /** Returns the index within {@link #tokens()} of the first top-level
   * semicolon, or -1. A range has at most one top-level terminator followed
   * by trivia and folded empty statements, so this is the first semicolon
   * after the last significant non-semicolon token. */
  int terminatorIndex() {
    int lastSignificant = -1;
    for (int i = 0; i < tokens.size(); i++) {
      final Token token = tokens.get(i);
      if (!token.isTrivia() && token.kind() != TokenKind.SEMICOLON) {
        lastSignificant = i;
      }
    }
    for (int i = lastSignificant + 1; i < tokens.size(); i++) {
      if (tokens.get(i).kind() == TokenKind.SEMICOLON) {
        return i;
      }
    }
    return -1;
  }

  /** Returns the text that the grammar oracle should see: this statement
   * up to, but not including, its terminator. It is a prefix of
   * {@link #text()}, so offsets within it are offsets within the
   * statement. */
  public String oracleText() {
    final int end = terminatorIndex();
    return end < 0 ? text() : prefix(end);
  }

  private String prefix(int tokenCount) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < tokenCount; i++) {
      b.append(tokens.get(i).text());
    }
    return b.toString();
  }

  @Override public String toString() {
    return "statement #" + index + " " + range;
  }
}
