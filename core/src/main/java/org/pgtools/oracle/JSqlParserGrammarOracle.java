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

import org.pgtools.lexer.PgLexer;
import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.Token;
import org.pgtools.syntax.TokenKind;
import org.pgtools.util.PgToolsTrace;
import org.pgtools.util.TextRange;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.ExplainStatement;
import net.sf.jsqlparser.statement.SetStatement;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.Values;
import net.sf.jsqlparser.statement.update.Update;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.pgtools.util.Static.RESOURCE;

/**
 * Grammar oracle backed by JSqlParser, which accepts much of the
 * PostgreSQL DDL and DML that Calcite's grammar does not: table
 * constraints, {@code CREATE INDEX}, {@code CREATE FUNCTION},
 * {@code ALTER TABLE}, {@code DROP}, {@code INSERT ... RETURNING} and
 * unqualified interval literals.
 *
 * <p>JSqlParser does not report where the parts of a statement are, so a
 * success carries a single node: the statement, tagged with the simple
 * name of JSqlParser's statement class, spanning the whole text. Its kind
 * is chosen by {@link #kind(Statement)}.
 *
 * <p>Before the text is handed over, comments are blanked and each
 * dollar-quoted string is replaced by a single-quoted string of the same
 * length. Line breaks are kept, so the positions JSqlParser reports are
 * positions in the original text.
 *
 * <p>Instances are immutable and thread-safe; each call creates its own
 * parser.
 */
public class JSqlParserGrammarOracle implements GrammarOracle {
  private static final Logger LOGGER = PgToolsTrace.getOracleTracer();

  private static final Pattern POSITION =
      Pattern.compile("line (\\d+), column (\\d+)");

  private static final String EOF_TOKEN = "<EOF>";

  private static final String EXPECTING = "Was expecting";

  @Override public StructuralResult parse(String statementText) {
    final String text = normalize(statementText);
    final Statement statement;
    try {
      statement = CCJSqlParserUtil.parse(text);
    } catch (JSQLParserException e) {
      final String detail = detail(e);
      final String message = firstLine(detail);
      final int offset = errorOffset(detail, new LineMap(statementText));
      LOGGER.debug("JSqlParser rejected statement at offset {}: {}", offset,
          message);
      return StructuralResult.failure(message, offset, null);
    } catch (RuntimeException e) {
      LOGGER.warn("JSqlParser failed on statement [{}]", statementText, e);
      return StructuralResult.failure(
          RESOURCE.oracleFailed(String.valueOf(e.getMessage())).str(), 0,
          null);
    }
    if (statement == null) {
      return StructuralResult.failure(RESOURCE.syntaxError("empty").str(),
          statementText.length(), null);
    }
    final String tag = statement.getClass().getSimpleName();
    return StructuralResult.success(
        StructuralNode.builder(tag, kind(statement))
            .span(TextRange.of(0, statementText.length()))
            .build());
  }

  /** Returns the syntax kind of a statement that JSqlParser has
   * accepted. */
  static SyntaxKind kind(Statement statement) {
    if (statement instanceof SetOperationList) {
      return SyntaxKind.SET_OPERATION;
    } else if (statement instanceof Values) {
      return SyntaxKind.VALUES;
    } else if (statement instanceof Select) {
      return SyntaxKind.SELECT_STMT;
    } else if (statement instanceof Insert) {
      return SyntaxKind.INSERT_STMT;
    } else if (statement instanceof Update) {
      return SyntaxKind.UPDATE_STMT;
    } else if (statement instanceof Delete) {
      return SyntaxKind.DELETE_STMT;
    } else if (statement instanceof Merge) {
      return SyntaxKind.MERGE_STMT;
    } else if (statement instanceof ExplainStatement) {
      return SyntaxKind.EXPLAIN_STMT;
    } else if (statement instanceof SetStatement) {
      return SyntaxKind.SET_STMT;
    }
    return kind(statement.getClass().getSimpleName());
  }

  /** Returns the syntax kind for the simple name of a JSqlParser statement
   * class that has no explicit rule. */
  static SyntaxKind kind(String tag) {
    if (tag.startsWith("Create")) {
      return SyntaxKind.CREATE_STMT;
    } else if (tag.startsWith("Alter")) {
      return SyntaxKind.ALTER_STMT;
    } else if (tag.startsWith("Drop")) {
      return SyntaxKind.DROP_STMT;
    }
    return SyntaxKind.UTILITY_STMT;
  }

  /** Blanks comments and turns dollar-quoted strings into single-quoted
   * strings, keeping every line break and the length of the text. */
  static String normalize(String statementText) {
    StringBuilder b = null;
    for (Token token : PgLexer.tokenize(statementText)) {
      final TokenKind kind = token.kind();
      if (kind != TokenKind.DOLLAR_STRING_LITERAL
          && kind.category() != TokenKind.Category.COMMENT
          && kind != TokenKind.UNTERMINATED_COMMENT) {
        continue;
      }
      if (b == null) {
        b = new StringBuilder(statementText);
      }
      final int end = token.end();
      for (int i = token.start(); i < end; i++) {
        final char c = b.charAt(i);
        if (c != '\n' && c != '\r') {
          b.setCharAt(i, ' ');
        }
      }
      if (kind == TokenKind.DOLLAR_STRING_LITERAL) {
        b.setCharAt(token.start(), '\'');
        b.setCharAt(end - 1, '\'');
      }
    }
    return b == null ? statementText : b.toString();
  }

  /** Returns the message of the innermost exception in a cause chain that
   * has one; JSqlParser wraps the parser's own exception. */
  private static String detail(JSQLParserException e) {
    String detail = RESOURCE.syntaxError("unknown").str();
    for (@Nullable Throwable t = e; t != null; t = t.getCause()) {
      final String message = t.getMessage();
      if (message != null && !message.trim().isEmpty()) {
        detail = message;
      }
    }
    return detail;
  }

  private static String firstLine(String message) {
    final String trimmed = message.trim();
    final int newline = trimmed.indexOf('\n');
    return newline < 0 ? trimmed : trimmed.substring(0, newline).trim();
  }

  /** Returns the offset at which JSqlParser gave up: the position of the
   * token it encountered, or the end of the text if that token is the end
   * of input or the message has no position. The list of expected tokens
   * that may follow is ignored. */
  static int errorOffset(String message, LineMap lineMap) {
    final int expecting = message.indexOf(EXPECTING);
    final String encountered =
        expecting < 0 ? message : message.substring(0, expecting);
    if (encountered.contains(EOF_TOKEN)) {
      return lineMap.length();
    }
    final Matcher matcher = POSITION.matcher(encountered);
    if (!matcher.find()) {
      return lineMap.length();
    }
    final int offset = lineMap.offset(Integer.parseInt(matcher.group(1)),
        Integer.parseInt(matcher.group(2)));
    return offset < 0 ? lineMap.length() : offset;
  }
}
