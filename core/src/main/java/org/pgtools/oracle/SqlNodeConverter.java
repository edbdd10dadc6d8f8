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

import org.pgtools.runtime.PgToolsException;
import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.TokenKind;
import org.pgtools.util.TextRange;

import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlDelete;
import org.apache.calcite.sql.SqlDynamicParam;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlInsert;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlUpdate;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static org.pgtools.util.Static.RESOURCE;

/**
 * Converts a Calcite parse tree into {@link StructuralNode}s.
 *
 * <p>Calcite's tree is an abstract one: keywords are not nodes, and some
 * clauses are plain fields of their statement. The converter makes the
 * clauses explicit (so that a WHERE condition becomes a
 * {@link SyntaxKind#WHERE_CLAUSE} whose leading keyword is {@code WHERE}),
 * folds {@link SqlOrderBy} into the query it sorts, and drops the symbol
 * literals that Calcite uses as flags.
 */
class SqlNodeConverter {
  private final LineMap lineMap;

  SqlNodeConverter(LineMap lineMap) {
    this.lineMap = lineMap;
  }

  /** Converts a statement.
   *
   * @throws UnmappedTagException if a node has a kind with no mapping */
  StructuralNode convert(SqlNode node) {
    final StructuralNode root = node(node);
    if (root == null) {
      throw new UnmappedTagException(node.getKind().name());
    }
    return root;
  }

  private @Nullable StructuralNode node(@Nullable SqlNode node) {
    if (node == null) {
      return null;
    }
    if (node instanceof SqlNodeList) {
      return list((SqlNodeList) node);
    }
    if (node instanceof SqlLiteral
        && ((SqlLiteral) node).getTypeName() == SqlTypeName.SYMBOL) {
      return null;
    }
    if (node instanceof SqlOrderBy) {
      return orderBy((SqlOrderBy) node);
    }
    if (node instanceof SqlSelect) {
      return select((SqlSelect) node).build();
    }
    if (node instanceof SqlInsert) {
      return insert((SqlInsert) node);
    }
    if (node instanceof SqlUpdate) {
      return update((SqlUpdate) node);
    }
    if (node instanceof SqlDelete) {
      return delete((SqlDelete) node);
    }
    if (node instanceof SqlJoin) {
      return join((SqlJoin) node);
    }
    if (node instanceof SqlCall) {
      return call((SqlCall) node);
    }
    return leaf(node);
  }

  private StructuralNode.Builder builder(SqlNode node) {
    final String tag = node.getKind().name();
    final SyntaxKind kind = OracleKindMapping.lookup(tag);
    if (kind == null) {
      throw new UnmappedTagException(tag);
    }
    return StructuralNode.builder(tag, kind).span(span(node));
  }

  private @Nullable TextRange span(SqlNode node) {
    return lineMap.span(node.getParserPosition());
  }

  private StructuralNode leaf(SqlNode node) {
    if (node instanceof SqlDataTypeSpec) {
      return StructuralNode.builder(SyntaxKind.TYPE_NAME)
          .span(span(node))
          .build();
    }
    final StructuralNode.Builder b = builder(node);
    if (node instanceof SqlIdentifier) {
      b.expect(TokenKind.Category.IDENTIFIER);
    } else if (node instanceof SqlLiteral) {
      b.expect(TokenKind.Category.LITERAL);
    } else if (node instanceof SqlDynamicParam) {
      b.expect(TokenKind.Category.LITERAL);
    }
    return b.build();
  }

  private @Nullable StructuralNode list(SqlNodeList list) {
    if (list.isEmpty()) {
      return null;
    }
    final StructuralNode.Builder b =
        StructuralNode.builder("NODE_LIST", SyntaxKind.LIST).span(span(list));
    addItems(b, list);
    return b.build();
  }

  private void addItems(StructuralNode.Builder b, List<? extends @Nullable SqlNode> list) {
    int i = 0;
    for (SqlNode item : list) {
      b.field("item" + i++, node(item));
    }
  }

  private StructuralNode call(SqlCall call) {
    final StructuralNode.Builder b = builder(call);
    final List<? extends @Nullable SqlNode> operands = call.getOperandList();
    for (int i = 0; i < operands.size(); i++) {
      b.field("operand" + i, node(operands.get(i)));
    }
    return b.build();
  }

  private StructuralNode.Builder select(SqlSelect select) {
    final StructuralNode.Builder b = builder(select);
    b.field("selectList", targetList(select.getSelectList()));
    b.field("from",
        clause(SyntaxKind.FROM_CLAUSE, select.getFrom(), "FROM"));
    b.field("where",
        clause(SyntaxKind.WHERE_CLAUSE, select.getWhere(), "WHERE"));
    b.field("groupBy",
        listClause(SyntaxKind.GROUP_BY_CLAUSE, select.getGroup(),
            "GROUP BY"));
    b.field("having",
        clause(SyntaxKind.HAVING_CLAUSE, select.getHaving(), "HAVING"));
    b.field("window",
        listClause(SyntaxKind.WINDOW_CLAUSE, select.getWindowList(),
            "WINDOW"));
    b.field("orderBy",
        listClause(SyntaxKind.ORDER_BY_CLAUSE, select.getOrderList(),
            "ORDER BY"));
    b.field("offset",
        clause(SyntaxKind.OFFSET_CLAUSE, select.getOffset(), "OFFSET"));
    b.field("fetch",
        clause(SyntaxKind.LIMIT_CLAUSE, select.getFetch(), "LIMIT",
            "FETCH FIRST", "FETCH NEXT"));
    return b;
  }

  /** Folds ORDER BY, OFFSET and FETCH into the query they apply to. If the
   * query is a SELECT, the result is a SELECT; otherwise it keeps the
   * query's kind. */
  private StructuralNode orderBy(SqlOrderBy orderBy) {
    final StructuralNode.Builder b;
    if (orderBy.query instanceof SqlSelect) {
      b = select((SqlSelect) orderBy.query);
    } else {
      final StructuralNode query = node(orderBy.query);
      b = query == null
          ? builder(orderBy)
          : StructuralNode.builder(SyntaxKind.ORDER_BY_QUERY)
              .span(query.span())
              .field("query", query);
    }
    b.cover(span(orderBy));
    final StructuralNode order =
        listClause(SyntaxKind.ORDER_BY_CLAUSE, orderBy.orderList, "ORDER BY");
    final StructuralNode offset =
        clause(SyntaxKind.OFFSET_CLAUSE, orderBy.offset, "OFFSET");
    final StructuralNode fetch =
        clause(SyntaxKind.LIMIT_CLAUSE, orderBy.fetch, "LIMIT",
            "FETCH FIRST", "FETCH NEXT");
    for (StructuralNode node : new StructuralNode[] {order, offset, fetch}) {
      if (node != null) {
        b.cover(node.span());
      }
    }
    return b.field("orderBy", order)
        .field("offset", offset)
        .field("fetch", fetch)
        .build();
  }

  private StructuralNode insert(SqlInsert insert) {
    final StructuralNode.Builder b = builder(insert);
    b.field("target", node(insert.getTargetTable()));
    final SqlNodeList columns = insert.getTargetColumnList();
    if (columns != null && !columns.isEmpty()) {
      final StructuralNode.Builder c =
          StructuralNode.builder(SyntaxKind.COLUMN_LIST).span(span(columns));
      addItems(c, columns);
      b.field("columns", c.build());
    }
    b.field("source", node(insert.getSource()));
    return b.build();
  }

  private StructuralNode update(SqlUpdate update) {
    final StructuralNode.Builder b = builder(update);
    b.field("target", node(update.getTargetTable()));
    b.field("alias", node(update.getAlias()));
    final SqlNodeList columns = update.getTargetColumnList();
    final SqlNodeList values = update.getSourceExpressionList();
    if (!columns.isEmpty()) {
      final StructuralNode.Builder set =
          StructuralNode.builder(SyntaxKind.SET_CLAUSE).leadingKeywords("SET");
      for (int i = 0; i < columns.size(); i++) {
        final StructuralNode.Builder assignment =
            StructuralNode.builder(SyntaxKind.ASSIGNMENT);
        final StructuralNode column = node(columns.get(i));
        final StructuralNode value =
            i < values.size() ? node(values.get(i)) : null;
        if (column != null) {
          assignment.cover(column.span());
        }
        if (value != null) {
          assignment.cover(value.span());
        }
        set.field("assignment" + i,
            assignment.field("column", column).field("value", value).build());
      }
      b.field("set", set.build());
    }
    b.field("where",
        clause(SyntaxKind.WHERE_CLAUSE, update.getCondition(), "WHERE"));
    return b.build();
  }

  private StructuralNode delete(SqlDelete delete) {
    return builder(delete)
        .field("target", node(delete.getTargetTable()))
        .field("alias", node(delete.getAlias()))
        .field("where",
            clause(SyntaxKind.WHERE_CLAUSE, delete.getCondition(), "WHERE"))
        .build();
  }

  private StructuralNode join(SqlJoin join) {
    final @Nullable SqlNode condition = join.getCondition();
    return builder(join)
        .field("left", node(join.getLeft()))
        .field("right", node(join.getRight()))
        .field("condition", node(condition))
        .build();
  }

  private @Nullable StructuralNode targetList(SqlNodeList list) {
    if (list.isEmpty()) {
      return null;
    }
    final StructuralNode.Builder b =
        StructuralNode.builder(SyntaxKind.TARGET_LIST).span(span(list));
    int i = 0;
    for (SqlNode item : list) {
      final StructuralNode expr = node(item);
      if (expr != null) {
        b.field("entry" + i++,
            StructuralNode.builder(SyntaxKind.TARGET_ENTRY)
                .span(expr.span())
                .field("expr", expr)
                .build());
      }
    }
    return b.build();
  }

  private @Nullable StructuralNode clause(SyntaxKind kind,
      @Nullable SqlNode node, String... keywords) {
    final StructuralNode expr = node(node);
    if (expr == null) {
      return null;
    }
    return StructuralNode.builder(kind)
        .span(expr.span())
        .leadingKeywords(keywords)
        .field("expr", expr)
        .build();
  }

  private @Nullable StructuralNode listClause(SyntaxKind kind,
      @Nullable SqlNodeList list, String... keywords) {
    if (list == null || list.isEmpty()) {
      return null;
    }
    final StructuralNode.Builder b = StructuralNode.builder(kind)
        .span(span(list))
        .leadingKeywords(keywords);
    addItems(b, list);
    return b.build();
  }

  /** Thrown when the oracle reports a node kind that has no
   * {@link SyntaxKind}. */
  static class UnmappedTagException extends PgToolsException {
    private static final long serialVersionUID = -6513140374516432811L;

    final String tag;

    UnmappedTagException(String tag) {
      super(RESOURCE.unmappedNodeTag(tag).str(), null);
      this.tag = tag;
    }
  }
}
