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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Partitions a token stream into {@link StatementRange}s.
 *
 * <p>A statement ends at a top-level semicolon. Semicolons inside strings,
 * quoted identifiers, comments and dollar-quoted bodies are already hidden
 * inside single tokens by the lexer, so only two constructs need attention
 * here:
 *
 * <ul>
 * <li>a SQL-standard function body, {@code BEGIN ATOMIC ... END}, whose
 * semicolons belong to the body; {@code CASE ... END} pairs inside the body
 * are counted so that only the matching {@code END} closes it;
 * <li>runs of semicolons. A semicolon that follows a terminated statement,
 * with only trivia in between, is folded into that statement rather than
 * forming an empty statement of its own.
 * </ul>
 *
 * <p>Leading trivia attaches to the first statement; trivia after a
 * terminator attaches to the statement it terminates. A document that holds
 * only trivia yields one range, and an empty document yields none.
 */
public class StatementSplitter {
  private final List<Token> tokens;
  private final ImmutableList.Builder<StatementRange> ranges =
      ImmutableList.builder();
  private int rangeCount;

  private StatementSplitter(List<Token> tokens) {
    this.tokens = tokens;
  }

  /** Splits a token stream into statements. */
  public static ImmutableList<StatementRange> split(List<Token> tokens) {
    final StatementSplitter splitter = new StatementSplitter(tokens);
    splitter.run();
    return splitter.ranges.build();
  }

  private void run() {
    int start = 0;
    boolean terminated = false;
    boolean inAtomicBody = false;
    int caseDepth = 0;
    @Nullable Token previous = null;
    for (int i = 0; i < tokens.size(); i++) {
      final Token token = tokens.get(i);
      if (token.isTrivia()) {
        continue;
      }
      if (terminated && token.kind() != TokenKind.SEMICOLON) {
        add(start, i);
        start = i;
        terminated = false;
        previous = null;
      }
      if (inAtomicBody) {
        if (token.isWord("CASE")) {
          ++caseDepth;
        } else if (token.isWord("END")) {
          if (caseDepth > 0) {
            --caseDepth;
          } else {
            inAtomicBody = false;
          }
        }
      } else if (token.kind() == TokenKind.SEMICOLON) {
        terminated = true;
      } else if (token.isWord("ATOMIC")
          && previous != null
          && previous.isWord("BEGIN")) {
        inAtomicBody = true;
        caseDepth = 0;
      }
      previous = token;
    }
    if (start < tokens.size()) {
      add(start, tokens.size());
    }
  }

  private void add(int start, int end) {
    final List<Token> slice = tokens.subList(start, end);
    final TextRange range =
        TextRange.of(slice.get(0).start(), slice.get(slice.size() - 1).end());
    ranges.add(new StatementRange(rangeCount++, slice, range));
  }
}
