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
package org.pgtools.parser;

import org.pgtools.oracle.GrammarOracle;
import org.pgtools.runtime.ParseCancelledException;
import org.pgtools.syntax.ParseError;
import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;
import org.pgtools.test.WordGrammarOracle;
import org.pgtools.util.TextRange;

import org.apache.calcite.util.CancelFlag;
import org.apache.calcite.util.Litmus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit test for {@link PgParser}.
 */
class PgParserTest {
  private static final PgParser.Config WORDS = PgParser.config()
      .withOracle(new WordGrammarOracle())
      .withParallelism(1)
      .withValidate(true);

  private static final PgParser.Config POSTGRES =
      PgParser.config().withValidate(true);

  private static List<SyntaxKind> kinds(SyntaxTree tree) {
    final List<SyntaxKind> kinds = new ArrayList<>();
    for (SyntaxNode node : tree.statements()) {
      kinds.add(node.kind());
    }
    return kinds;
  }

  @Test void testTwoStatements() {
    final SyntaxTree tree = PgParser.create(POSTGRES).parse("SELECT 1; SELECT 2;");
    assertThat(kinds(tree),
        is(List.of(SyntaxKind.SELECT_STMT, SyntaxKind.SELECT_STMT)));
    assertThat(tree.hasErrors(), is(false));
    assertThat(tree.isValid(Litmus.IGNORE), is(true));
  }

  @Test void testAcceptanceScenarios() {
    final PgParser parser = PgParser.create(POSTGRES);

    final SyntaxTree select = parser.parse("SELECT 1;");
    assertThat(kinds(select), is(List.of(SyntaxKind.SELECT_STMT)));
    assertThat(select.hasErrors(), is(false));
    assertThat(select.root().text(), is("SELECT 1;"));

    final SyntaxTree incomplete = parser.parse("SELECT 1 FROM");
    assertThat(kinds(incomplete), is(List.of(SyntaxKind.ERROR)));
    assertThat(incomplete.errors(), hasSize(1));
    assertThat(incomplete.errors().get(0).range(), is(TextRange.empty(13)));
    assertThat(incomplete.statements().get(0).tokens(), hasSize(5));

    final SyntaxTree function = parser.parse("CREATE FUNCTION f() RETURNS int "
        + "AS $body$ SELECT 1; $body$ LANGUAGE sql;");
    assertThat(kinds(function), is(List.of(SyntaxKind.CREATE_STMT)));
    assertThat(function.errors(), hasSize(0));

    final SyntaxTree twoSemicolons = parser.parse("SELECT ;; SELECT 1;");
    assertThat(kinds(twoSemicolons),
        is(List.of(SyntaxKind.ERROR, SyntaxKind.SELECT_STMT)));
    assertThat(twoSemicolons.errors(), hasSize(1));
    assertThat(twoSemicolons.errors().get(0).statementIndex(), is(0));

    final SyntaxTree empty = parser.parse("");
    assertThat(empty.statements(), hasSize(0));
    assertThat(empty.tokens(), hasSize(0));
    assertThat(empty.errors(), hasSize(0));
  }

  @Test void testSyntaxError() {
    final String sql = "SELECT 1 FROM;";
    final SyntaxTree tree = PgParser.create(POSTGRES).parse(sql);
    assertThat(kinds(tree), is(List.of(SyntaxKind.ERROR)));
    assertThat(tree.errors(), hasSize(1));
    final ParseError error = tree.errors().get(0);
    assertThat(error.origin(), is(ParseError.Origin.ORACLE));
    assertThat(error.statementIndex(), is(0));
    assertThat(error.range().start(), greaterThanOrEqualTo(9));
    assertThat(error.range().start(), lessThanOrEqualTo(13));
    assertThat(tree.root().text(), is(sql));
  }

  /** Semicolons inside a dollar-quoted body do not split the statement. */
  @Test void testDollarQuotedBody() {
    final String sql = "CREATE FUNCTION f() RETURNS int AS $$\n"
        + "  SELECT 1; SELECT 2;\n"
        + "$$ LANGUAGE sql;\n";
    final SyntaxTree tree = PgParser.create(WORDS).parse(sql);
    assertThat(tree.statements(), hasSize(1));
    assertThat(tree.root().text(), is(sql));
  }

  @Test void testExtraSemicolons() {
    final SyntaxTree tree =
        PgParser.create(WORDS).parse("SELECT ;; SELECT 1;");
    assertThat(tree.statements(), hasSize(2));
  }

  @Test void testLexicalError() {
    final SyntaxTree tree = PgParser.create(WORDS).parse("SELECT 'abc");
    assertThat(tree.errors(), hasSize(1));
    final ParseError error = tree.errors().get(0);
    assertThat(error.origin(), is(ParseError.Origin.LEXER));
    assertThat(error.range(), is(TextRange.of(7, 11)));
    assertThat(error.message(), is("Unterminated quoted string"));
    // The oracle accepted the statement; the error does not change the node
    assertThat(kinds(tree), is(List.of(SyntaxKind.SELECT_STMT)));
  }

  /** An error in one statement does not affect its neighbors. */
  @Test void testErrorIsolation() {
    final String sql = "SELECT a; SELECT BOGUS b; SELECT c;";
    final SyntaxTree tree = PgParser.create(WORDS).parse(sql);
    assertThat(kinds(tree),
        is(
            List.of(SyntaxKind.SELECT_STMT, SyntaxKind.ERROR,
                SyntaxKind.SELECT_STMT)));
    assertThat(tree.errors(), hasSize(1));
    assertThat(tree.errors().get(0).statementIndex(), is(1));
    assertThat(tree.errors().get(0).range(), is(TextRange.of(17, 22)));
    assertThat(tree.root().text(), is(sql));
  }

  /** Parsing the text of a tree gives the same tree, including error
   * nodes and their partial structure. */
  @Test void testIdempotent() {
    final String[] documents = {
        "SELECT a, 1 FROM t; UPDATE t SET x = 2",
        "SELECT a FROM t WHERE; SELECT 1 2;\n-- trailing\n",
        "  SELECT ;; CREATE TABLE t (a int PRIMARY KEY); SELECT 'open",
        "BEGIN; COMMIT",
    };
    final PgParser parser = PgParser.create(POSTGRES);
    for (String sql : documents) {
      final SyntaxTree tree = parser.parse(sql);
      final SyntaxTree again = parser.parse(tree.root().text());
      assertThat(sql, again.dump(), is(tree.dump()));
      assertThat(sql, again.errors(), is(tree.errors()));
    }

    final PgParser words = PgParser.create(WORDS);
    final SyntaxTree tree = words.parse("SELECT a b BOGUS c; SELECT d;");
    assertThat(kinds(tree),
        is(List.of(SyntaxKind.ERROR, SyntaxKind.SELECT_STMT)));
    assertThat(tree.statements().get(0).childNodes().isEmpty(), is(false));
    final SyntaxTree again = words.parse(tree.root().text());
    assertThat(again.dump(), is(tree.dump()));
    assertThat(again.errors(), is(tree.errors()));
  }

  /** PostgreSQL statements outside Calcite's grammar parse without
   * errors. */
  @Test void testPostgresStatements() {
    final String[] statements = {
        "CREATE TABLE t (id int PRIMARY KEY, name text NOT NULL)",
        "CREATE INDEX i ON t (a)",
        "ALTER TABLE t ADD COLUMN c int",
        "DROP TABLE t",
        "INSERT INTO t (a) VALUES (1) RETURNING id",
        "SELECT now() - interval '1 day'",
        "CREATE FUNCTION f() RETURNS int AS $$ SELECT 1; $$ LANGUAGE sql",
    };
    final SyntaxKind[] expected = {
        SyntaxKind.CREATE_STMT, SyntaxKind.CREATE_STMT, SyntaxKind.ALTER_STMT,
        SyntaxKind.DROP_STMT, SyntaxKind.INSERT_STMT, SyntaxKind.SELECT_STMT,
        SyntaxKind.CREATE_STMT,
    };
    final PgParser parser = PgParser.create(POSTGRES);
    for (int i = 0; i < statements.length; i++) {
      final String sql = statements[i] + ";\n";
      final SyntaxTree tree = parser.parse(sql);
      assertThat(sql, tree.errors(), hasSize(0));
      assertThat(sql, kinds(tree), is(List.of(expected[i])));
      assertThat(sql, tree.root().text(), is(sql));
    }
  }

  /** Transaction control statements are statements, alone or between
   * queries. */
  @Test void testTransactionControl() {
    final PgParser parser = PgParser.create(POSTGRES);
    final SyntaxTree tree = parser.parse("BEGIN; COMMIT; ROLLBACK;");
    assertThat(tree.errors(), hasSize(0));
    assertThat(kinds(tree),
        is(
            List.of(SyntaxKind.UTILITY_STMT, SyntaxKind.UTILITY_STMT,
                SyntaxKind.UTILITY_STMT)));
    assertThat(tree.isValid(Litmus.THROW), is(true));

    final SyntaxTree mixed = parser.parse("SELECT 1; BEGIN; SELECT 2;");
    assertThat(mixed.errors(), hasSize(0));
    assertThat(kinds(mixed),
        is(
            List.of(SyntaxKind.SELECT_STMT, SyntaxKind.UTILITY_STMT,
                SyntaxKind.SELECT_STMT)));
    assertThat(mixed.isValid(Litmus.THROW), is(true));
  }

  /** Whatever the input, the tree reproduces it exactly. */
  @Test void testLosslessRandom() {
    final String[] fragments = {
        "SELECT", " ", "a", "1.5", ";", ",", "(", ")", "'x'", "'", "\"q\"",
        "\"", "$$", "$1", "--c\n", "/*", "*/", "\n", "BEGIN", "ATOMIC",
        "END", "CASE", "BOGUS", "+", "::", "{", "é", "E'\\''", "$t$"
    };
    final Random random = new Random(42);
    final PgParser parser = PgParser.create(WORDS);
    for (int i = 0; i < 500; i++) {
      final StringBuilder b = new StringBuilder();
      final int n = random.nextInt(30);
      for (int j = 0; j < n; j++) {
        b.append(fragments[random.nextInt(fragments.length)]);
      }
      final String sql = b.toString();
      final SyntaxTree tree = parser.parse(sql);
      assertThat(sql, tree.root().text(), is(sql));
      assertThat(sql, tree.isValid(Litmus.IGNORE), is(true));
    }
  }

  @Test void testCalciteTreesAreValid() {
    final String[] statements = {
        "SELECT a, b AS c FROM t WHERE x = 1 ORDER BY a LIMIT 3",
        "select count(*) from \"S\".t group by a having count(*) > 1",
        "INSERT INTO t (a, b) VALUES (1, 'x')",
        "UPDATE t SET a = a + 1, b = DEFAULT WHERE c IS NULL",
        "DELETE FROM t WHERE a IN (SELECT b FROM u)",
        "SELECT 1 UNION ALL SELECT 2",
        "WITH w AS (SELECT 1 AS a) SELECT a FROM w",
        "SELECT CAST(a AS varchar(10)), CASE WHEN a THEN 1 ELSE 2 END FROM t",
        "SELECT * FROM t JOIN u ON t.a = u.a LEFT JOIN v USING (b)",
        "CREATE TABLE t (a int, b varchar(20))",
        "SELECT FROM WHERE",
        "SELECT (1",
    };
    final PgParser parser = PgParser.create(POSTGRES);
    for (String sql : statements) {
      final SyntaxTree tree = parser.parse(sql + ";\n");
      assertThat(sql, tree.root().text(), is(sql + ";\n"));
      assertThat(sql, tree.isValid(Litmus.IGNORE), is(true));
      assertThat(sql, tree.statements(), hasSize(1));
    }
  }

  @Test void testCancelledBeforeStart() {
    final CancelFlag flag = new CancelFlag(new AtomicBoolean(true));
    assertThrows(ParseCancelledException.class,
        () -> PgParser.create(WORDS).parse("SELECT 1", flag));
  }

  @Test void testCancelledDuringParse() {
    final CancelFlag flag = new CancelFlag(new AtomicBoolean());
    final WordGrammarOracle words = new WordGrammarOracle();
    final GrammarOracle oracle = text -> {
      flag.requestCancel();
      return words.parse(text);
    };
    final PgParser parser = PgParser.create(WORDS.withOracle(oracle));
    final ParseCancelledException e =
        assertThrows(ParseCancelledException.class,
            () -> parser.parse("SELECT 1; SELECT 2; SELECT 3;", flag));
    assertThat(e.getMessage(), is("Parse of document was cancelled"));
  }

  /** Parsing on a thread pool gives the same tree as parsing on the calling
   * thread. */
  @Test void testParallel() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      b.append("SELECT a").append(i).append(", ").append(i)
          .append(i % 7 == 3 ? " BOGUS" : "").append(";\n");
    }
    final String sql = b.toString();
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final SyntaxTree parallel =
          PgParser.create(WORDS.withExecutor(executor)).parse(sql);
      final SyntaxTree sequential = PgParser.create(WORDS).parse(sql);
      assertThat(parallel.dump(), is(sequential.dump()));
      assertThat(parallel.errors(), is(sequential.errors()));
      assertThat(parallel.statements(), hasSize(40));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test void testSharedExecutor() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < 10; i++) {
      b.append("SELECT x").append(i).append(";");
    }
    final SyntaxTree tree =
        PgParser.create(WORDS.withParallelism(4)).parse(b.toString());
    assertThat(tree.statements(), hasSize(10));
    assertThat(tree.hasErrors(), is(false));
  }

  /** Without an executor, statements run on a pool of the configured
   * parallelism. */
  @Test void testParallelismSizesPool() {
    final Set<String> threads = ConcurrentHashMap.newKeySet();
    final WordGrammarOracle words = new WordGrammarOracle();
    final GrammarOracle oracle = text -> {
      threads.add(Thread.currentThread().getName());
      return words.parse(text);
    };
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      b.append("SELECT x").append(i).append(";");
    }
    final SyntaxTree tree = PgParser.create(
        WORDS.withOracle(oracle).withParallelism(3)).parse(b.toString());
    assertThat(tree.statements(), hasSize(40));
    assertThat(threads.isEmpty(), is(false));
    assertThat(threads.size(), lessThanOrEqualTo(3));
    for (String thread : threads) {
      assertThat(thread, startsWith("pgtools-parser-3-"));
    }
  }

  /** An oracle that throws produces an error node, not an exception. */
  @Test void testOracleThrows() {
    final GrammarOracle oracle = text -> {
      throw new IllegalStateException("boom");
    };
    final SyntaxTree tree =
        PgParser.create(WORDS.withOracle(oracle)).parse("SELECT 1;");
    assertThat(kinds(tree), is(List.of(SyntaxKind.ERROR)));
    assertThat(tree.errors(), hasSize(1));
    assertThat(tree.errors().get(0).message(),
        is("Grammar oracle failed: boom"));
  }

  @Test void testEmptyDocument() {
    final SyntaxTree tree = PgParser.create(WORDS).parse("");
    assertThat(tree.statements(), hasSize(0));
    assertThat(tree.hasErrors(), is(false));
    assertThat(tree.root().range(), is(TextRange.EMPTY));
  }

  @Test void testTriviaOnlyDocument() {
    final WordGrammarOracle oracle = new WordGrammarOracle();
    final SyntaxTree tree =
        PgParser.create(WORDS.withOracle(oracle)).parse("  -- c\n");
    assertThat(kinds(tree), is(List.of(SyntaxKind.EMPTY_STATEMENT)));
    assertThat(oracle.callCount.get(), is(0));
  }

  @Test void testConfig() {
    final PgParser.Config config = PgParser.config();
    assertThat(config.parallelism(), greaterThanOrEqualTo(1));
    assertThat(config.withParallelism(3).parallelism(), is(3));
    assertThrows(IllegalArgumentException.class,
        () -> config.withParallelism(0));
    assertThat(PgParser.create(config).getConfig(), is(config));
  }

  @Test void testErrorMessageContainsToken() {
    final SyntaxTree tree = PgParser.create(POSTGRES).parse("SELECT 1 2");
    assertThat(tree.errors(), hasSize(1));
    assertThat(tree.errors().get(0).message(), containsString("2"));
    assertThat(tree.errors().get(0).range(), is(TextRange.of(9, 10)));
  }
}
