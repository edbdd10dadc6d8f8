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

import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for the typed view of a syntax tree.
 */
public abstract class Ast {
  private Ast() {}

  /** Wraps a node in the most specific AST class for its kind. */
  public static AstNode wrap(SyntaxTree tree, SyntaxNode node) {
    switch (node.kind()) {
    case SOURCE_FILE:
      return new SourceFile(tree, node);
    case TARGET_LIST:
      return new TargetList(tree, node);
    case TARGET_ENTRY:
      return new TargetEntry(tree, node);
    case FROM_CLAUSE:
      return new FromClause(tree, node);
    case WHERE_CLAUSE:
    case HAVING_CLAUSE:
      return new ConditionClause(tree, node);
    case GROUP_BY_CLAUSE:
    case ORDER_BY_CLAUSE:
    case WINDOW_CLAUSE:
      return new ListClause(tree, node);
    case LIMIT_CLAUSE:
    case OFFSET_CLAUSE:
      return new LimitClause(tree, node);
    case SET_CLAUSE:
      return new SetClause(tree, node);
    case ASSIGNMENT:
      return new Assignment(tree, node);
    case COLUMN_LIST:
      return new ColumnList(tree, node);
    default:
      if (node.kind().belongsTo(SyntaxKind.STATEMENT_ROOT)) {
        return statement(tree, node);
      }
      return expression(tree, node);
    }
  }

  /** Wraps a statement node. */
  public static Statement statement(SyntaxTree tree, SyntaxNode node) {
    switch (node.kind()) {
    case SELECT_STMT:
      return new SelectStatement(tree, node);
    case INSERT_STMT:
      return new InsertStatement(tree, node);
    case UPDATE_STMT:
      return new UpdateStatement(tree, node);
    case DELETE_STMT:
      return new DeleteStatement(tree, node);
    case CREATE_STMT:
    case ALTER_STMT:
    case DROP_STMT:
      return new DdlStatement(tree, node);
    case SET_OPERATION:
      return new SetOperation(tree, node);
    case ERROR:
      return new ErrorStatement(tree, node);
    default:
      return new Statement(tree, node);
    }
  }

  /** Wraps an expression node. Any node can be viewed as an expression;
   * kinds with no specific class get {@link Expression}. */
  public static Expression expression(SyntaxTree tree, SyntaxNode node) {
    switch (node.kind()) {
    case IDENTIFIER:
      return new Identifier(tree, node);
    case LITERAL:
      return new Literal(tree, node);
    case FUNCTION_CALL:
      return new FunctionCall(tree, node);
    case ALIAS:
      return new Alias(tree, node);
    default:
      return new Expression(tree, node);
    }
  }

  /** Returns whether an offset is inside a node of a given kind. */
  public static boolean isInside(SyntaxTree tree, int offset,
      SyntaxKind kind) {
    return enclosing(tree, offset, kind) != null;
  }

  /** Returns the innermost node of a given kind that covers an offset, or
   * null. */
  public static @Nullable SyntaxNode enclosing(SyntaxTree tree, int offset,
      SyntaxKind kind) {
    SyntaxNode found = null;
    for (SyntaxNode node : tree.pathTo(offset)) {
      if (node.kind() == kind) {
        found = node;
      }
    }
    return found;
  }
}
