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
package org.pgtools.oracle;

import org.pgtools.syntax.SyntaxKind;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit test for {@link FallbackGrammarOracle}.
 */
class FallbackGrammarOracleTest {
  private static final StructuralResult SELECT = StructuralResult.success(
      StructuralNode.builder("SELECT", SyntaxKind.SELECT_STMT).build());

  private static final StructuralResult DROP = StructuralResult.success(
      StructuralNode.builder("Drop", SyntaxKind.DROP_STMT).build());

  private static final StructuralResult FIRST_FAILURE =
      StructuralResult.failure("first", 3, null);

  private static final StructuralResult SECOND_FAILURE =
      StructuralResult.failure("second", 7, null);

  @Test void testPrimaryAccepts() {
    final AtomicInteger fallbackCalls = new AtomicInteger();
    final GrammarOracle oracle = new FallbackGrammarOracle(text -> SELECT,
        text -> {
          fallbackCalls.incrementAndGet();
          return DROP;
        });
    assertThat(oracle.parse("x"), sameInstance(SELECT));
    assertThat(fallbackCalls.get(), is(0));
  }

  @Test void testFallbackAccepts() {
    final GrammarOracle oracle =
        new FallbackGrammarOracle(text -> FIRST_FAILURE, text -> DROP);
    assertThat(oracle.parse("x"), sameInstance(DROP));
  }

  /** If both reject, the primary's failure is reported. */
  @Test void testBothReject() {
    final GrammarOracle oracle = new FallbackGrammarOracle(
        text -> FIRST_FAILURE, text -> SECOND_FAILURE);
    final StructuralResult result = oracle.parse("x");
    assertThat(result.message(), is("first"));
    assertThat(result.errorOffset(), is(3));
  }

  /** The production oracle accepts PostgreSQL that only the fallback
   * understands, and keeps Calcite's structure where Calcite succeeds. */
  @Test void testCreate() {
    final FallbackGrammarOracle oracle = FallbackGrammarOracle.create();
    final StructuralResult select = oracle.parse("SELECT a FROM t");
    assertThat(select.root().tag(), is("SELECT"));
    assertThat(select.root().children().isEmpty(), is(false));
    final StructuralResult index = oracle.parse("CREATE INDEX i ON t (a)");
    assertThat(index.isSuccess(), is(true));
    assertThat(index.root().kind(), is(SyntaxKind.CREATE_STMT));
  }
}
