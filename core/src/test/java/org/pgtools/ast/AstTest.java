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
package org.pgtools.ast;

import org.pgtools.oracle.GrammarOracle;
import org.pgtools.oracle.StructuralNode;
import org.pgtools.oracle.StructuralResult;
import org.pgtools.parser.PgParser;
import org.pgtools.syntax.ParseError;
import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.SyntaxTree;
import org.pgtools.util.TextRange;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import static java.util.Objects.requireNonNull;

/**
 * Tests for the typed view of syntax trees.
 */
class AstTest {
  private static final PgParser POSTGRES =
      PgParser.create(PgParser.config().withValidate(true));

  private static Statement first(SyntaxTree tree) {
    final List<Statement> statements = tree.ast().statements();
    assertThat(statements, hasSize(1));
    return statements.get(0);
  }

  private static Statement parse(String sql) {
    return first(POSTGRES.parse(sql));
  }

  /** Parses with an oracle that always returns the same result. */
  private static Statement parse(String sql, StructuralResult result) {
    final GrammarOracle oracle = text -> result;
    return first(
        PgParser.create(
            PgParser.config().withOracle(oracle).withValidate(true))
            .parse(sql));
  }

  @Test void testSelect() {
    final Statement statement =
        parse("SELECT a, b AS c FROM t WHERE x = 1 ORDER BY a LIMIT 3");
    assertThat(statement, instanceOf(SelectStatement.class));
    assertThat(statement.keyword(), is("SELECT"));
    final SelectStatement select = (SelectStatement) statement;
    assertThat(select.isDistinct(), is(false));

    final TargetList targetList = requireNonNull(select.targetList());
    final List<TargetEntry> entries = targetList.entries();
    assertThat(entries, hasSize(2));
    assertThat(entries.get(0).alias(), nullValue());
    assertThat(requireNonNull(entries.get(0).value()).text(), is("a"));
    final Identifier alias = requireNonNull(entries.get(1).alias());
    assertThat(alias.simpleName(), is("c"));

    final FromClause from = requireNonNull(select.from());
    assertThat(from.text(), is("FROM t"));
    assertThat(requireNonNull(from.source()).text(), is("t"));

    final ConditionClause where = requireNonNull(select.where());
    assertThat(where.text(), is("WHERE x = 1"));
    assertThat(requireNonNull(where.condition()).text(), is("x = 1"));

    assertThat(select.orderBy(), notNullValue());
    final LimitClause limit = requireNonNull(select.limit());
    assertThat(limit.isOffset(), is(false));
    assertThat(requireNonNull(limit.value()).text(), is("3"));
    assertThat(select.groupBy(), nullValue());
    assertThat(select.having(), nullValue());
  }

  @Test void testDistinct() {
    final SelectStatement select =
        (SelectStatement) parse("SELECT DISTINCT a FROM t");
    assertThat(select.isDistinct(), is(true));
  }

  @Test void testInsert() {
    final Statement statement =
        parse("INSERT INTO t (a, b) VALUES (1, 'x')");
    assertThat(statement, instanceOf(InsertStatement.class));
    final InsertStatement insert = (InsertStatement) statement;
    assertThat(requireNonNull(insert.table()).simpleName(), is("t"));
    final ColumnList columns = requireNonNull(insert.columns());
    assertThat(columns.columns(), hasSize(2));
    assertThat(columns.columns().get(1).simpleName(), is("b"));
    assertThat(requireNonNull(insert.source()).kind(),
        is(SyntaxKind.VALUES));
  }

  @Test void testUpdate() {
    final Statement statement = parse("UPDATE t SET a = 1, b = c WHERE d");
    assertThat(statement, instanceOf(UpdateStatement.class));
    final UpdateStatement update = (UpdateStatement) statement;
    assertThat(requireNonNull(update.table()).simpleName(), is("t"));
    final List<Assignment> assignments =
        requireNonNull(update.set()).assignments();
    assertThat(assignments, hasSize(2));
    assertThat(requireNonNull(assignments.get(0).column()).simpleName(),
        is("a"));
    assertThat(requireNonNull(assignments.get(0).value()).text(), is("1"));
    assertThat(requireNonNull(assignments.get(1).value()).text(), is("c"));
    assertThat(update.where(), notNullValue());
  }

  @Test void testDelete() {
    final Statement statement = parse("DELETE FROM t WHERE a = 1");
    assertThat(statement, instanceOf(DeleteStatement.class));
    final DeleteStatement delete = (DeleteStatement) statement;
    assertThat(requireNonNull(delete.table()).simpleName(), is("t"));
    assertThat(requireNonNull(delete.where()).text(), is("WHERE a = 1"));
  }

  @Test void testIdentifierNames() {
    final SelectStatement select =
        (SelectStatement) parse("SELECT x FROM \"My\"\"S\".Tab");
    final Expression source =
        requireNonNull(requireNonNull(select.from()).source());
    assertThat(source, instanceOf(Identifier.class));
    final Identifier identifier = (Identifier) source;
    assertThat(identifier.names(), is(List.of("My\"S", "tab")));
    assertThat(identifier.simpleName(), is("tab"));
    assertThat(identifier.isQuoted(), is(true));
  }

  @Test void testFunctionCall() {
    final SelectStatement select =
        (SelectStatement) parse("SELECT count(a) FROM t");
    final Expression value = requireNonNull(
        requireNonNull(select.targetList()).entries().get(0).value());
    assertThat(value, instanceOf(FunctionCall.class));
    final FunctionCall call = (FunctionCall) value;
    assertThat(call.name(), is("count"));
    assertThat(call.arguments(), hasSize(1));
    assertThat(call.arguments().get(0).text(), is("a"));
  }

  @Test void testIsInside() {
    final String sql = "SELECT a FROM t WHERE b = 1";
    final SyntaxTree tree = POSTGRES.parse(sql);
    final int b = sql.indexOf('b');
    assertThat(Ast.isInside(tree, b, SyntaxKind.WHERE_CLAUSE), is(true));
    assertThat(Ast.isInside(tree, 7, SyntaxKind.WHERE_CLAUSE), is(false));
    assertThat(Ast.isInside(tree, 7, SyntaxKind.TARGET_LIST), is(true));
    assertThat(Ast.enclosing(tree, b, SyntaxKind.SELECT_STMT),
        is(tree.statements().get(0)));
  }

  @Test void testDdlObjectType() {
    final String view = "CREATE OR REPLACE VIEW v AS SELECT 1";
    final Statement statement = parse(view,
        StructuralResult.success(
            StructuralNode.builder("CREATE_VIEW", SyntaxKind.CREATE_STMT)
                .span(TextRange.of(0, view.length()))
                .build()));
    assertThat(statement, instanceOf(DdlStatement.class));
    assertThat(((DdlStatement) statement).objectType(), is("VIEW"));

    final String table = "DROP TABLE IF EXISTS t";
    final Statement drop = parse(table,
        StructuralResult.success(
            StructuralNode.builder("DROP_TABLE", SyntaxKind.DROP_STMT)
                .span(TextRange.of(0, table.length()))
                .build()));
    assertThat(((DdlStatement) drop).objectType(), is("TABLE"));
  }

  @Test void testErrorStatement() {
    final String sql = "SELECT a b c";
    final StructuralNode partial =
        StructuralNode.builder("SELECT", SyntaxKind.SELECT_STMT)
            .span(TextRange.of(0, 10))
            .field("selectList",
                StructuralNode.builder(SyntaxKind.TARGET_LIST)
                    .span(TextRange.of(7, 10))
                    .build())
            .build();
    final Statement statement = parse(sql,
        StructuralResult.failure("unexpected c", 11, partial));
    assertThat(statement, instanceOf(ErrorStatement.class));
    assertThat(statement.isError(), is(true));
    final ErrorStatement error = (ErrorStatement) statement;
    final Statement recovered = requireNonNull(error.partial());
    assertThat(recovered, instanceOf(SelectStatement.class));
    assertThat(recovered.text(), is("SELECT a b"));
    assertThat(((SelectStatement) recovered).targetList(), notNullValue());
    final List<ParseError> errors = error.errors();
    assertThat(errors, hasSize(1));
    assertThat(errors.get(0).range(), is(TextRange.of(11, 12)));
  }

  @Test void testEmptyStatement() {
    final List<Statement> statements =
        POSTGRES.parse("  ").ast().statements();
    assertThat(statements, hasSize(1));
    assertThat(statements.get(0).isEmpty(), is(true));
    assertThat(statements.get(0).keyword(), nullValue());
  }

  @Test void testWrap() {
    final SyntaxTree tree = POSTGRES.parse("SELECT 1 FROM t");
    assertThat(Ast.wrap(tree, tree.root()), instanceOf(SourceFile.class));
    final AstNode statement = Ast.wrap(tree, tree.statements().get(0));
    assertThat(statement, instanceOf(SelectStatement.class));
    final SelectStatement select = (SelectStatement) statement;
    final Expression value = requireNonNull(
        requireNonNull(select.targetList()).entries().get(0).value());
    assertThat(value, instanceOf(Literal.class));
    assertThat(requireNonNull(((Literal) value).token()).text(), is("1"));
  }
}
