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
import org.pgtools.syntax.Token;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Typed view of a SELECT statement or query. */
public class SelectStatement extends Statement {
  public SelectStatement(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  public @Nullable TargetList targetList() {
    final SyntaxNode node = child(SyntaxKind.TARGET_LIST);
    return node == null ? null : new TargetList(tree, node);
  }

  public @Nullable FromClause from() {
    final SyntaxNode node = child(SyntaxKind.FROM_CLAUSE);
    return node == null ? null : new FromClause(tree, node);
  }

  public @Nullable ConditionClause where() {
    final SyntaxNode node = child(SyntaxKind.WHERE_CLAUSE);
    return node == null ? null : new ConditionClause(tree, node);
  }

  public @Nullable ListClause groupBy() {
    final SyntaxNode node = child(SyntaxKind.GROUP_BY_CLAUSE);
    return node == null ? null : new ListClause(tree, node);
  }

  public @Nullable ConditionClause having() {
    final SyntaxNode node = child(SyntaxKind.HAVING_CLAUSE);
    return node == null ? null : new ConditionClause(tree, node);
  }

  public @Nullable ListClause orderBy() {
    final SyntaxNode node = child(SyntaxKind.ORDER_BY_CLAUSE);
    return node == null ? null : new ListClause(tree, node);
  }

  public @Nullable LimitClause limit() {
    final SyntaxNode node = child(SyntaxKind.LIMIT_CLAUSE);
    return node == null ? null : new LimitClause(tree, node);
  }

  public @Nullable LimitClause offset() {
    final SyntaxNode node = child(SyntaxKind.OFFSET_CLAUSE);
    return node == null ? null : new LimitClause(tree, node);
  }

  /** Returns whether the statement has {@code DISTINCT} directly after
   * {@code SELECT}. */
  public boolean isDistinct() {
    boolean afterSelect = false;
    for (Token token : syntax.significantTokens()) {
      if (afterSelect) {
        return token.isWord("DISTINCT");
      }
      afterSelect = token.isWord("SELECT");
    }
    return false;
  }
}
