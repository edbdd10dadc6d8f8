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
package org.pgtools.test;

import org.pgtools.lexer.PgLexer;
import org.pgtools.oracle.GrammarOracle;
import org.pgtools.oracle.StructuralNode;
import org.pgtools.oracle.StructuralResult;
import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.Token;
import org.pgtools.syntax.TokenKind;
import org.pgtools.util.TextRange;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Grammar oracle for tests that do not depend on a real SQL grammar.
 *
 * <p>A statement is accepted unless it contains the word {@code BOGUS}, in
 * which case the failure is reported at that word, with the structure of
 * the text before it as the partial result. An accepted statement is a
 * {@link SyntaxKind#SELECT_STMT} whose children are one
 * {@link SyntaxKind#IDENTIFIER} per identifier token and one
 * {@link SyntaxKind#LITERAL} per numeric literal.
 */
public class WordGrammarOracle implements GrammarOracle {
  public final AtomicInteger callCount = new AtomicInteger();

  @Override public StructuralResult parse(String statementText) {
    callCount.incrementAndGet();
    final List<Token> tokens = PgLexer.tokenize(statementText);
    for (Token token : tokens) {
      if (token.isWord("BOGUS")) {
        final String prefix = statementText.substring(0, token.start());
        final StructuralNode partial = prefix.trim().isEmpty()
            ? null
            : structure(PgLexer.tokenize(prefix));
        return StructuralResult.failure("unexpected BOGUS", token.start(),
            partial);
      }
    }
    return StructuralResult.success(structure(tokens));
  }

  private static StructuralNode structure(List<Token> tokens) {
    final StructuralNode.Builder root =
        StructuralNode.builder("SELECT", SyntaxKind.SELECT_STMT);
    int i = 0;
    for (Token token : tokens) {
      if (token.isTrivia()) {
        continue;
      }
      root.cover(token.range());
      if (token.kind() == TokenKind.IDENTIFIER) {
        root.field("f" + i++,
            StructuralNode.builder("IDENTIFIER", SyntaxKind.IDENTIFIER)
                .span(token.range())
                .build());
      } else if (token.kind() == TokenKind.NUMERIC_LITERAL) {
        root.field("f" + i++,
            StructuralNode.builder("LITERAL", SyntaxKind.LITERAL)
                .span(TextRange.of(token.start(), token.end()))
                .build());
      }
    }
    return root.build();
  }
}
