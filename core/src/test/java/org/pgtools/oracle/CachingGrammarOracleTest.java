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
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit test for {@link CachingGrammarOracle}.
 */
class CachingGrammarOracleTest {
  @Test void testCachesByText() {
    final AtomicInteger calls = new AtomicInteger();
    final GrammarOracle delegate = text -> {
      calls.incrementAndGet();
      return StructuralResult.success(
          StructuralNode.builder(SyntaxKind.SELECT_STMT).build());
    };
    final CachingGrammarOracle oracle = new CachingGrammarOracle(delegate, 10);
    final StructuralResult r1 = oracle.parse("SELECT 1");
    final StructuralResult r2 = oracle.parse("SELECT 1");
    oracle.parse("SELECT 2");
    assertThat(r2, sameInstance(r1));
    assertThat(calls.get(), is(2));
    assertThat(oracle.size(), is(2L));
    assertThat(oracle.delegate(), sameInstance(delegate));
  }

  @Test void testPropagatesUncheckedException() {
    final CachingGrammarOracle oracle = new CachingGrammarOracle(text -> {
      throw new IllegalStateException("boom");
    }, 10);
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> oracle.parse("x"));
    assertThat(e.getMessage(), is("boom"));
  }
}
