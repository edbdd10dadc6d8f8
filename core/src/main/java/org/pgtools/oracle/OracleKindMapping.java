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

import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.util.Litmus;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the node tags of the Calcite grammar oracle onto {@link SyntaxKind}.
 *
 * <p>A tag is the name of a {@link SqlKind}. The table is derived once, for
 * every value of {@link SqlKind}, by applying these rules in order:
 *
 * <ol>
 * <li>an explicit entry for the tag;
 * <li>{@link SqlKind#DDL}: {@code CREATE_*} to {@link SyntaxKind#CREATE_STMT},
 * {@code ALTER_*} to {@link SyntaxKind#ALTER_STMT}, {@code DROP_*} to
 * {@link SyntaxKind#DROP_STMT}, anything else to
 * {@link SyntaxKind#UTILITY_STMT};
 * <li>{@link SqlKind#SET_QUERY} to {@link SyntaxKind#SET_OPERATION};
 * <li>{@link SqlKind#AGGREGATE} and {@link SqlKind#FUNCTION} to
 * {@link SyntaxKind#FUNCTION_CALL};
 * <li>{@link SqlKind#EXPRESSION} to {@link SyntaxKind#OPERATOR_CALL}.
 * </ol>
 *
 * <p>{@link SqlKind#EXPRESSION} is defined as the complement of a fixed list
 * of kinds and of the other categories, so the table is complete provided
 * every kind on that list has an explicit entry. {@link #isComplete} checks
 * this.
 */
public abstract class OracleKindMapping {
  private OracleKindMapping() {}

  private static final ImmutableMap<String, SyntaxKind> EXPLICIT = explicit();

  private static final ImmutableMap<String, SyntaxKind> MAP = derive();

  private static ImmutableMap<String, SyntaxKind> explicit() {
    final Map<String, SyntaxKind> map = new HashMap<>();

    // statements
    put(map, SyntaxKind.SELECT_STMT, SqlKind.SELECT);
    put(map, SyntaxKind.INSERT_STMT, SqlKind.INSERT);
    put(map, SyntaxKind.UPDATE_STMT, SqlKind.UPDATE);
    put(map, SyntaxKind.DELETE_STMT, SqlKind.DELETE);
    put(map, SyntaxKind.MERGE_STMT, SqlKind.MERGE);
    put(map, SyntaxKind.CALL_STMT, SqlKind.PROCEDURE_CALL);
    put(map, SyntaxKind.VALUES, SqlKind.VALUES);
    put(map, SyntaxKind.WITH_QUERY, SqlKind.WITH);
    put(map, SyntaxKind.WITH_ITEM, SqlKind.WITH_ITEM);
    put(map, SyntaxKind.ORDER_BY_QUERY, SqlKind.ORDER_BY);
    put(map, SyntaxKind.TABLE_QUERY, SqlKind.EXPLICIT_TABLE);
    put(map, SyntaxKind.EXPLAIN_STMT, SqlKind.EXPLAIN);
    put(map, SyntaxKind.SET_STMT, SqlKind.SET_OPTION);
    put(map, SyntaxKind.UTILITY_STMT, SqlKind.DESCRIBE_SCHEMA,
        SqlKind.DESCRIBE_TABLE);
    // Transaction control, parsed by the PostgreSQL extensions of the
    // Babel grammar; named so that the table does not depend on which
    // release declares them.
    put(map, SyntaxKind.UTILITY_STMT, "BEGIN", "COMMIT", "ROLLBACK",
        "SAVEPOINT", "RELEASE_SAVEPOINT", "DISCARD", "SHOW");

    // expressions
    put(map, SyntaxKind.IDENTIFIER, SqlKind.IDENTIFIER);
    put(map, SyntaxKind.LITERAL, SqlKind.LITERAL, SqlKind.LITERAL_CHAIN);
    put(map, SyntaxKind.PARAMETER, SqlKind.DYNAMIC_PARAM);
    put(map, SyntaxKind.ALIAS, SqlKind.AS);
    put(map, SyntaxKind.JOIN_EXPR, SqlKind.JOIN);
    put(map, SyntaxKind.CAST_EXPR, SqlKind.CAST);
    put(map, SyntaxKind.CASE_EXPR, SqlKind.CASE);
    put(map, SyntaxKind.ROW_EXPR, SqlKind.ROW);
    put(map, SyntaxKind.SUBQUERY, SqlKind.SCALAR_QUERY);
    put(map, SyntaxKind.INTERVAL_EXPR, SqlKind.INTERVAL,
        SqlKind.INTERVAL_QUALIFIER);
    put(map, SyntaxKind.NAMED_ARGUMENT, SqlKind.ARGUMENT_ASSIGNMENT);
    put(map, SyntaxKind.DEFAULT_EXPR, SqlKind.DEFAULT);
    put(map, SyntaxKind.FUNCTION_CALL, SqlKind.OTHER_FUNCTION,
        SqlKind.POSITION, SqlKind.TRIM, SqlKind.FLOOR, SqlKind.CEIL,
        SqlKind.TIMESTAMP_ADD, SqlKind.TIMESTAMP_DIFF, SqlKind.EXTRACT,
        SqlKind.JDBC_FN);
    put(map, SyntaxKind.OPERATOR_CALL, SqlKind.RUNNING, SqlKind.FINAL,
        SqlKind.LAST, SqlKind.FIRST, SqlKind.PREV, SqlKind.NEXT,
        SqlKind.FILTER, SqlKind.WITHIN_GROUP, SqlKind.IGNORE_NULLS,
        SqlKind.RESPECT_NULLS, SqlKind.SEPARATOR, SqlKind.ITEM,
        SqlKind.SKIP_TO_FIRST, SqlKind.SKIP_TO_LAST,
        SqlKind.JSON_VALUE_EXPRESSION);
    put(map, SyntaxKind.TABLE_EXPR, SqlKind.EXTEND, SqlKind.LATERAL,
        SqlKind.COLLECTION_TABLE, SqlKind.TABLESAMPLE, SqlKind.UNNEST,
        SqlKind.TABLE_REF, SqlKind.SNAPSHOT, SqlKind.PIVOT, SqlKind.UNPIVOT,
        SqlKind.MATCH_RECOGNIZE);

    // clauses
    put(map, SyntaxKind.SORT_ITEM, SqlKind.DESCENDING, SqlKind.NULLS_FIRST,
        SqlKind.NULLS_LAST);
    put(map, SyntaxKind.GROUPING_SET, SqlKind.CUBE, SqlKind.ROLLUP,
        SqlKind.GROUPING_SETS);
    put(map, SyntaxKind.WINDOW_BOUND, SqlKind.PRECEDING, SqlKind.FOLLOWING);
    return ImmutableMap.copyOf(map);
  }

  private static void put(Map<String, SyntaxKind> map, SyntaxKind syntaxKind,
      SqlKind... sqlKinds) {
    for (SqlKind sqlKind : sqlKinds) {
      map.put(sqlKind.name(), syntaxKind);
    }
  }

  private static void put(Map<String, SyntaxKind> map, SyntaxKind syntaxKind,
      String... tags) {
    for (String tag : tags) {
      map.put(tag, syntaxKind);
    }
  }

  private static ImmutableMap<String, SyntaxKind> derive() {
    final Map<String, SyntaxKind> map = new HashMap<>(EXPLICIT);
    for (SqlKind sqlKind : SqlKind.values()) {
      final SyntaxKind kind = rule(sqlKind);
      if (kind != null) {
        map.put(sqlKind.name(), kind);
      }
    }
    return ImmutableMap.copyOf(map);
  }

  private static @Nullable SyntaxKind rule(SqlKind sqlKind) {
    final SyntaxKind explicit = EXPLICIT.get(sqlKind.name());
    if (explicit != null) {
      return explicit;
    }
    if (SqlKind.DDL.contains(sqlKind)) {
      final String name = sqlKind.name();
      if (name.startsWith("CREATE_")) {
        return SyntaxKind.CREATE_STMT;
      } else if (name.startsWith("ALTER_")) {
        return SyntaxKind.ALTER_STMT;
      } else if (name.startsWith("DROP_")) {
        return SyntaxKind.DROP_STMT;
      }
      return SyntaxKind.UTILITY_STMT;
    }
    if (SqlKind.SET_QUERY.contains(sqlKind)) {
      return SyntaxKind.SET_OPERATION;
    }
    if (SqlKind.AGGREGATE.contains(sqlKind)
        || SqlKind.FUNCTION.contains(sqlKind)) {
      return SyntaxKind.FUNCTION_CALL;
    }
    if (SqlKind.EXPRESSION.contains(sqlKind)) {
      return SyntaxKind.OPERATOR_CALL;
    }
    return null;
  }

  /** Returns the syntax kind for an oracle tag, or null if the tag is not
   * known. */
  public static @Nullable SyntaxKind lookup(String tag) {
    return MAP.get(tag);
  }

  /** Returns the syntax kind for an oracle node kind. */
  public static @Nullable SyntaxKind lookup(SqlKind sqlKind) {
    return MAP.get(sqlKind.name());
  }

  /** Returns the oracle tags that have no mapping, in alphabetical
   * order. */
  public static ImmutableSortedSet<String> unmapped() {
    final ImmutableSortedSet.Builder<String> b =
        ImmutableSortedSet.naturalOrder();
    for (SqlKind sqlKind : SqlKind.values()) {
      if (!MAP.containsKey(sqlKind.name())) {
        b.add(sqlKind.name());
      }
    }
    return b.build();
  }

  /** Checks that every oracle tag has a mapping. */
  public static boolean isComplete(Litmus litmus) {
    final ImmutableSortedSet<String> unmapped = unmapped();
    if (!unmapped.isEmpty()) {
      return litmus.fail("oracle tags with no syntax kind: {}", unmapped);
    }
    return litmus.succeed();
  }
}
