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

import org.pgtools.util.PgToolsTrace;

import org.slf4j.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Grammar oracle that asks a second oracle about the statements a first
 * oracle rejects.
 *
 * <p>The primary oracle usually reports richer structure, and the fallback
 * accepts more of the language. A statement is valid if either accepts it.
 * If both reject it, the primary's failure is returned, with its offset and
 * partial structure.
 */
public class FallbackGrammarOracle implements GrammarOracle {
  private static final Logger LOGGER = PgToolsTrace.getOracleTracer();

  private final GrammarOracle primary;
  private final GrammarOracle fallback;

  public FallbackGrammarOracle(GrammarOracle primary, GrammarOracle fallback) {
    this.primary = requireNonNull(primary, "primary");
    this.fallback = requireNonNull(fallback, "fallback");
  }

  /** Creates the PostgreSQL oracle: Calcite's Babel grammar, falling back
   * to JSqlParser. */
  public static FallbackGrammarOracle create() {
    return new FallbackGrammarOracle(CalciteGrammarOracle.create(),
        new JSqlParserGrammarOracle());
  }

  public GrammarOracle primary() {
    return primary;
  }

  public GrammarOracle fallback() {
    return fallback;
  }

  @Override public StructuralResult parse(String statementText) {
    final StructuralResult result = primary.parse(statementText);
    if (result.isSuccess()) {
      return result;
    }
    final StructuralResult second = fallback.parse(statementText);
    if (second.isSuccess()) {
      LOGGER.debug("fallback oracle accepted statement as {}",
          second.root().tag());
      return second;
    }
    return result;
  }
}
