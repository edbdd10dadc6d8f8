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

import org.pgtools.lexer.PgLexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

/**
 * Unit test for {@link StatementSplitter}.
 */
class StatementSplitterTest {
  private static List<StatementRange> split(String sql) {
    return StatementSplitter.split(PgLexer.tokenize(sql));
  }

  private static List<String> texts(String sql) {
    final List<String> texts = new ArrayList<>();
    for (StatementRange range : split(sql)) {
      texts.add(range.text());
    }
    return texts;
  }

  @Test void testTwoStatements() {
    assertThat(texts("SELECT 1; SELECT 2;"),
        is(List.of("SELECT 1; ", "SELECT 2;")));
  }

  @Test void testEmptyDocument() {
    assertThat(split(""), hasSize(0));
  }

  @Test void testTriviaOnly() {
    final List<StatementRange> ranges = split("  -- nothing\n");
    assertThat(ranges, hasSize(1));
    assertThat(ranges.get(0).isEmptyStatement(), is(true));
  }

  @Test void testUnterminatedLast() {
    final List<StatementRange> ranges = split("SELECT 1; SELECT 2");
    assertThat(ranges, hasSize(2));
    assertThat(ranges.get(1).terminator(), nullValue());
    assertThat(ranges.get(1).oracleText(), is("SELECT 2"));
  }

  /** Extra semicolons fold into the preceding statement. */
  @Test void testExtraSemicolons() {
    assertThat(texts("SELECT ;; SELECT 1;"),
        is(List.of("SELECT ;; ", "SELECT 1;")));
    final StatementRange first = split("SELECT ;; SELECT 1;").get(0);
    assertThat(first.terminator(), notNullValue());
    assertThat(first.terminator().start(), is(7));
    assertThat(first.oracleText(), is("SELECT "));
  }

  @Test void testLeadingSemicolon() {
    final List<StatementRange> ranges = split("; SELECT 1");
    assertThat(ranges, hasSize(2));
    assertThat(ranges.get(0).isEmptyStatement(), is(true));
    assertThat(ranges.get(1).text(), is("SELECT 1"));
  }

  @Test void testSemicolonInsideLiterals() {
    assertThat(texts("SELECT ';', $$;$$, \";\" /* ; */; SELECT 2"),
        hasSize(2));
  }

  @Test void testBeginAtomic() {
    final String sql = "CREATE FUNCTION f() RETURNS int LANGUAGE sql\n"
        + "BEGIN ATOMIC\n"
        + "  SELECT CASE WHEN true THEN 1 ELSE 2 END;\n"
        + "  SELECT 2;\n"
        + "END;\n"
        + "SELECT 3;";
    final List<String> texts = texts(sql);
    assertThat(texts, hasSize(2));
    assertThat(texts.get(1), is("SELECT 3;"));
  }

  /** Ranges partition the document: contiguous, in order, and covering
   * every character. */
  @Test void testPartition() {
    final String sql = "  SELECT 1 ; ;\n-- c\nUPDATE t SET a = 1; x";
    int offset = 0;
    int index = 0;
    for (StatementRange range : split(sql)) {
      assertThat(range.index(), is(index++));
      assertThat(range.start(), is(offset));
      offset = range.range().end();
    }
    assertThat(offset, is(sql.length()));
  }

  @Test void testOracleTextExcludesTrailingTrivia() {
    final StatementRange range = split("SELECT 1 ; -- done\n").get(0);
    assertThat(range.oracleText(), is("SELECT 1 "));
    assertThat(range.text(), is("SELECT 1 ; -- done\n"));
  }
}
