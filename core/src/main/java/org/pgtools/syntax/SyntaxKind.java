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

import java.util.EnumSet;
import java.util.Set;

/**
 * Enumerates the kinds of {@link SyntaxNode}.
 *
 * <p>This is the stable vocabulary of the tree. The grammar oracle has its
 * own, larger vocabulary of node tags; {@link
 * org.pgtools.oracle.OracleKindMapping} maps every oracle tag onto one of
 * these values. A few kinds never come from the oracle: {@link
 * #SOURCE_FILE}, {@link #ERROR} and {@link #EMPTY_STATEMENT} are made by the
 * tree builder, and the clause kinds are introduced when the oracle's result
 * is normalized.
 *
 * <p>To test for a family of kinds, use {@link #belongsTo}:
 *
 * <blockquote><pre>
 * if (node.kind().belongsTo(SyntaxKind.STATEMENT)) ...
 * </pre></blockquote>
 */
public enum SyntaxKind {
  /** Root of a document. Its children are statement nodes. */
  SOURCE_FILE(Category.ROOT),

  /** Statement the oracle rejected. Contains every token of the statement,
   * and possibly one node holding the structure of a valid prefix. */
  ERROR(Category.RECOVERY),

  /** Statement with no significant tokens: only trivia or semicolons. */
  EMPTY_STATEMENT(Category.RECOVERY),

  // statements and queries

  SELECT_STMT(Category.STATEMENT),
  INSERT_STMT(Category.STATEMENT),
  UPDATE_STMT(Category.STATEMENT),
  DELETE_STMT(Category.STATEMENT),
  MERGE_STMT(Category.STATEMENT),
  CALL_STMT(Category.STATEMENT),
  /** UNION, INTERSECT or EXCEPT. */
  SET_OPERATION(Category.STATEMENT),
  /** VALUES list, as a statement or as the source of an INSERT. */
  VALUES(Category.STATEMENT),
  /** Query with a WITH clause. */
  WITH_QUERY(Category.STATEMENT),
  /** ORDER BY, LIMIT or OFFSET applied to something other than a plain
   * SELECT. */
  ORDER_BY_QUERY(Category.STATEMENT),
  /** {@code TABLE t}. */
  TABLE_QUERY(Category.STATEMENT),
  EXPLAIN_STMT(Category.STATEMENT),
  SET_STMT(Category.STATEMENT),
  CREATE_STMT(Category.STATEMENT),
  ALTER_STMT(Category.STATEMENT),
  DROP_STMT(Category.STATEMENT),
  /** Any other statement: transaction control, TRUNCATE, DESCRIBE and
   * DDL that is not CREATE, ALTER or DROP. */
  UTILITY_STMT(Category.STATEMENT),

  // clauses

  /** Output list of a SELECT. */
  TARGET_LIST(Category.CLAUSE),
  /** One entry of a {@link #TARGET_LIST}. */
  TARGET_ENTRY(Category.CLAUSE),
  FROM_CLAUSE(Category.CLAUSE),
  WHERE_CLAUSE(Category.CLAUSE),
  GROUP_BY_CLAUSE(Category.CLAUSE),
  HAVING_CLAUSE(Category.CLAUSE),
  WINDOW_CLAUSE(Category.CLAUSE),
  ORDER_BY_CLAUSE(Category.CLAUSE),
  OFFSET_CLAUSE(Category.CLAUSE),
  LIMIT_CLAUSE(Category.CLAUSE),
  /** SET list of an UPDATE. */
  SET_CLAUSE(Category.CLAUSE),
  /** {@code column = expression} within a {@link #SET_CLAUSE}. */
  ASSIGNMENT(Category.CLAUSE),
  /** Parenthesized column list of an INSERT. */
  COLUMN_LIST(Category.CLAUSE),
  /** One named query of a WITH clause. */
  WITH_ITEM(Category.CLAUSE),
  /** Sort key with DESC, NULLS FIRST or NULLS LAST. */
  SORT_ITEM(Category.CLAUSE),
  /** CUBE, ROLLUP or GROUPING SETS. */
  GROUPING_SET(Category.CLAUSE),
  /** PRECEDING or FOLLOWING bound of a window frame. */
  WINDOW_BOUND(Category.CLAUSE),

  // expressions

  IDENTIFIER(Category.EXPRESSION),
  LITERAL(Category.EXPRESSION),
  /** Positional parameter, such as {@code $1} or {@code ?}. */
  PARAMETER(Category.EXPRESSION),
  /** {@code expression AS name}. */
  ALIAS(Category.EXPRESSION),
  FUNCTION_CALL(Category.EXPRESSION),
  /** Call to an operator or a special form that is not a function. */
  OPERATOR_CALL(Category.EXPRESSION),
  CAST_EXPR(Category.EXPRESSION),
  CASE_EXPR(Category.EXPRESSION),
  ROW_EXPR(Category.EXPRESSION),
  INTERVAL_EXPR(Category.EXPRESSION),
  /** Scalar sub-query. */
  SUBQUERY(Category.EXPRESSION),
  /** Named argument, {@code name => value}. */
  NAMED_ARGUMENT(Category.EXPRESSION),
  /** {@code DEFAULT} in a VALUES list or SET clause. */
  DEFAULT_EXPR(Category.EXPRESSION),
  /** Data type in a cast or a column definition. */
  TYPE_NAME(Category.EXPRESSION),
  JOIN_EXPR(Category.EXPRESSION),
  /** Table-valued item of a FROM clause other than a name or a join:
   * LATERAL, UNNEST, TABLESAMPLE, a table function and so forth. */
  TABLE_EXPR(Category.EXPRESSION),

  /** List of nodes that has no more specific role. */
  LIST(Category.LIST);

  /** Kinds that represent a whole statement. */
  public static final Set<SyntaxKind> STATEMENT = of(Category.STATEMENT);

  /** Kinds that represent a clause of a statement. */
  public static final Set<SyntaxKind> CLAUSE = of(Category.CLAUSE);

  /** Kinds that represent an expression. */
  public static final Set<SyntaxKind> EXPRESSION = of(Category.EXPRESSION);

  /** Kinds that can be the root of a statement subtree. */
  public static final Set<SyntaxKind> STATEMENT_ROOT;

  static {
    final EnumSet<SyntaxKind> kinds = EnumSet.copyOf(STATEMENT);
    kinds.add(ERROR);
    kinds.add(EMPTY_STATEMENT);
    STATEMENT_ROOT = kinds;
  }

  private final Category category;

  SyntaxKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  /** Returns whether this kind belongs to a given family, such as
   * {@link #STATEMENT}. */
  public boolean belongsTo(Set<SyntaxKind> family) {
    return family.contains(this);
  }

  private static Set<SyntaxKind> of(Category category) {
    final EnumSet<SyntaxKind> kinds = EnumSet.noneOf(SyntaxKind.class);
    for (SyntaxKind kind : values()) {
      if (kind.category == category) {
        kinds.add(kind);
      }
    }
    return kinds;
  }

  /** Coarse grouping of node kinds. */
  public enum Category {
    ROOT,
    RECOVERY,
    STATEMENT,
    CLAUSE,
    EXPRESSION,
    LIST
  }
}
