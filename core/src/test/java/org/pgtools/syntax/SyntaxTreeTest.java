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
import org.pgtools.parser.PgParser;
import org.pgtools.split.StatementSplitter;
import org.pgtools.test.WordGrammarOracle;
import org.pgtools.util.TextRange;

import org.apache.calcite.util.Litmus;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit test for the queries on {@link SyntaxTree}.
 */
class SyntaxTreeTest {
  private static final String SQL = "SELECT a;\n  SELECT b, c;";

  private static SyntaxTree parse(String sql) {
    final PgParser.Config config = PgParser.config()
        .withOracle(new WordGrammarOracle())
        .withParallelism(1)
        .withValidate(true);
    return PgParser.create(config).parse(sql);
  }

  private static List<SyntaxKind> kinds(List<SyntaxNode> nodes) {
    final List<SyntaxKind> kinds = new ArrayList<>();
    for (SyntaxNode node : nodes) {
      kinds.add(node.kind());
    }
    return kinds;
  }

  @Test void testStatements() {
    final SyntaxTree tree = parse(SQL);
    assertThat(tree.statements(), hasSize(2));
    assertThat(tree.statementRanges(), hasSize(2));
    assertThat(tree.statements().get(0).text(), is("SELECT a;\n  "));
    assertThat(tree.statements().get(1).text(), is("SELECT b, c;"));
    assertThat(tree.hasErrors(), is(false));
    assertThat(tree.root().text(), is(SQL));
    assertThat(tree.isValid(Litmus.IGNORE), is(true));
  }

  @Test void testTokenAt() {
    final SyntaxTree tree = parse(SQL);
    assertThat(tree.tokenAt(0).text(), is("SELECT"));
    assertThat(tree.tokenAt(5).text(), is("SELECT"));
    assertThat(tree.tokenAt(7).text(), is("a"));
    assertThat(tree.tokenAt(8).kind(), is(TokenKind.SEMICOLON));
    assertThat(tree.tokenAt(10).kind(), is(TokenKind.WHITESPACE));
    assertThat(tree.tokenAt(SQL.length()).text(), is(";"));
    assertThrows(IllegalArgumentException.class, () -> tree.tokenAt(-1));
    assertThrows(IllegalArgumentException.class,
        () -> tree.tokenAt(SQL.length() + 1));
  }

  @Test void testCoveringNode() {
    final SyntaxTree tree = parse(SQL);
    assertThat(tree.coveringNode(7).kind(), is(SyntaxKind.IDENTIFIER));
    assertThat(tree.coveringNode(7).text(), is("a"));
    assertThat(tree.coveringNode(6).kind(), is(SyntaxKind.SELECT_STMT));
    assertThat(tree.coveringNode(22).text(), is("c"));
    assertThat(tree.coveringNode(SQL.length()).kind(),
        is(SyntaxKind.SELECT_STMT));
  }

  @Test void testPathTo() {
    final SyntaxTree tree = parse(SQL);
    assertThat(kinds(tree.pathTo(19)),
        is(List.of(SyntaxKind.SOURCE_FILE, SyntaxKind.SELECT_STMT,
            SyntaxKind.IDENTIFIER)));
    assertThat(kinds(tree.pathTo(20)),
        is(List.of(SyntaxKind.SOURCE_FILE, SyntaxKind.SELECT_STMT)));
  }

  @Test void testStatementAt() {
    final SyntaxTree tree = parse(SQL);
    assertThat(tree.statementAt(3), sameInstance(tree.statements().get(0)));
    assertThat(tree.statementAt(11), sameInstance(tree.statements().get(0)));
    assertThat(tree.statementAt(12), sameInstance(tree.statements().get(1)));
    assertThat(tree.statementAt(SQL.length()),
        sameInstance(tree.statements().get(1)));
  }

  @Test void testDump() {
    final String dump = parse("SELECT a;").dump();
    assertThat(dump,
        is("SOURCE_FILE@0..9\n"
            + "  SELECT_STMT@0..9\n"
            + "    KEYWORD@0..6 \"SELECT\"\n"
            + "    WHITESPACE@6..7 \" \"\n"
            + "    IDENTIFIER@7..8\n"
            + "      IDENTIFIER@7..8 \"a\"\n"
            + "    SEMICOLON@8..9 \";\"\n"));
  }

  @Test void testText() {
    final SyntaxTree tree = parse(SQL);
    final SyntaxNode statement = tree.statements().get(1);
    assertThat(tree.text(statement), is(statement.text()));
    assertThat(tree.text(statement.tokens().get(0)), is("SELECT"));
  }

  @Test void testEmptyDocument() {
    final SyntaxTree tree = parse("");
    assertThat(tree.statements(), hasSize(0));
    assertThat(tree.tokens(), hasSize(0));
    assertThat(tree.root().range(), is(TextRange.EMPTY));
    assertThat(tree.tokenAt(0), nullValue());
    assertThat(tree.coveringNode(0), sameInstance(tree.root()));
    assertThat(tree.statementAt(0), nullValue());
    assertThat(tree.isValid(Litmus.IGNORE), is(true));
  }

  /** A tree whose token stream does not match its leaves is invalid. */
  @Test void testInvalid() {
    final SyntaxTree good = parse(SQL);
    final ImmutableList<Token> otherTokens = PgLexer.tokenize(SQL);
    final SyntaxTree bad = new SyntaxTree(SQL, good.root(), otherTokens,
        StatementSplitter.split(otherTokens), good.errors());
    assertThat(bad.isValid(Litmus.IGNORE), is(false));

    final SyntaxTree truncated = new SyntaxTree(SQL + " ", good.root(),
        good.tokens(), good.statementRanges(), good.errors());
    assertThat(truncated.isValid(Litmus.IGNORE), is(false));
    final AssertionError e = assertThrows(AssertionError.class,
        () -> truncated.isValid(Litmus.THROW));
    assertThat(e.getMessage(), notNullValue());
    assertThat(e.getMessage(), containsString("source at 25"));
  }
}
