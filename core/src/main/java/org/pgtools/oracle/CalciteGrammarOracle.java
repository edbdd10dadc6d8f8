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

import org.pgtools.config.PgToolsSystemProperty;
import org.pgtools.util.PgToolsTrace;

import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.avatica.util.Quoting;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.SqlParserPos;
import org.apache.calcite.sql.parser.babel.SqlBabelParserImpl;
import org.apache.calcite.sql.validate.SqlConformanceEnum;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import static org.pgtools.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Grammar oracle backed by Calcite's Babel parser, configured to read
 * PostgreSQL's lexical conventions: double-quoted identifiers, unquoted
 * names folded to lower case, and the lenient Babel conformance.
 *
 * <p>A statement the parser accepts is converted to {@link StructuralNode}s
 * by {@link SqlNodeConverter}. A statement it rejects becomes a failure
 * whose offset is the position of the offending token, or the end of the
 * text if the parser ran out of input. If partial recovery is enabled and
 * the offending token is inside the text, the prefix before it is parsed
 * again, and if that succeeds its structure is attached to the failure.
 *
 * <p>Instances are immutable and thread-safe; each call creates its own
 * parser.
 */
public class CalciteGrammarOracle implements GrammarOracle {
  private static final Logger LOGGER = PgToolsTrace.getOracleTracer();

  /** Parser configuration for PostgreSQL. */
  public static final SqlParser.Config POSTGRES_CONFIG = SqlParser.config()
      .withParserFactory(SqlBabelParserImpl.FACTORY)
      .withConformance(SqlConformanceEnum.BABEL)
      .withQuoting(Quoting.DOUBLE_QUOTE)
      .withUnquotedCasing(Casing.TO_LOWER)
      .withQuotedCasing(Casing.UNCHANGED)
      .withCaseSensitive(true);

  private static final String EOF_TOKEN = "<EOF>\"";

  private final SqlParser.Config parserConfig;
  private final boolean partialRecovery;

  public CalciteGrammarOracle(SqlParser.Config parserConfig,
      boolean partialRecovery) {
    this.parserConfig = requireNonNull(parserConfig, "parserConfig");
    this.partialRecovery = partialRecovery;
  }

  /** Creates an oracle with the PostgreSQL configuration, and partial
   * recovery as set by {@link PgToolsSystemProperty#PARTIAL_RECOVERY}. */
  public static CalciteGrammarOracle create() {
    return new CalciteGrammarOracle(POSTGRES_CONFIG,
        PgToolsSystemProperty.PARTIAL_RECOVERY.value());
  }

  /** Returns a copy of this oracle with a given partial recovery
   * setting. */
  public CalciteGrammarOracle withPartialRecovery(boolean partialRecovery) {
    return partialRecovery == this.partialRecovery
        ? this
        : new CalciteGrammarOracle(parserConfig, partialRecovery);
  }

  @Override public StructuralResult parse(String statementText) {
    final LineMap lineMap = new LineMap(statementText);
    try {
      final SqlNode node = parseStmt(statementText);
      return StructuralResult.success(
          new SqlNodeConverter(lineMap).convert(node));
    } catch (SqlParseException e) {
      final int offset = errorOffset(e, lineMap);
      final String message = firstLine(e.getMessage());
      LOGGER.debug("oracle rejected statement at offset {}: {}", offset,
          message);
      return StructuralResult.failure(message, offset,
          partial(statementText, offset));
    } catch (SqlNodeConverter.UnmappedTagException e) {
      LOGGER.warn("unmapped oracle tag {} in statement [{}]", e.tag,
          statementText);
      return StructuralResult.failure(e.getMessage(), 0, null);
    } catch (RuntimeException e) {
      LOGGER.warn("grammar oracle failed on statement [{}]", statementText,
          e);
      return StructuralResult.failure(
          RESOURCE.oracleFailed(String.valueOf(e.getMessage())).str(), 0,
          null);
    }
  }

  private SqlNode parseStmt(String sql) throws SqlParseException {
    return SqlParser.create(sql, parserConfig).parseStmt();
  }

  /** Returns the structure of the text before a failure offset, or null if
   * recovery is disabled, there is no such prefix, or the parser rejects it
   * too. */
  private @Nullable StructuralNode partial(String statementText, int offset) {
    if (!partialRecovery
        || offset >= statementText.length()
        || statementText.substring(0, offset).trim().isEmpty()) {
      return null;
    }
    final String prefix = statementText.substring(0, offset);
    try {
      return new SqlNodeConverter(new LineMap(prefix))
          .convert(parseStmt(prefix));
    } catch (SqlParseException | RuntimeException e) {
      LOGGER.trace("no partial structure for prefix [{}]: {}", prefix,
          e.getMessage());
      return null;
    }
  }

  /** Returns the offset at which the parser gave up. If the tokens the
   * parser could not accept run up to end of input, the error is reported
   * at the end of the text. */
  static int errorOffset(SqlParseException e, LineMap lineMap) {
    if (firstLine(e.getMessage()).contains(EOF_TOKEN)) {
      return lineMap.length();
    }
    final SqlParserPos pos = e.getPos();
    if (pos == null) {
      return lineMap.length();
    }
    final int offset = lineMap.offset(pos.getLineNum(), pos.getColumnNum());
    return offset < 0 ? lineMap.length() : offset;
  }

  private static String firstLine(@Nullable String message) {
    if (message == null || message.isEmpty()) {
      return RESOURCE.syntaxError("unknown").str();
    }
    final int newline = message.indexOf('\n');
    final String line = newline < 0 ? message : message.substring(0, newline);
    return line.trim();
  }
}
