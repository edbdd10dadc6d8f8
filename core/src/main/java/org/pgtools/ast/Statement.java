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

/**
 * Typed view of a statement.
 *
 * <p>Statement kinds without a more specific class, such as
 * {@link SyntaxKind#VALUES} or {@link SyntaxKind#UTILITY_STMT}, are viewed
 * as plain statements.
 */
public class Statement extends AstNode {
  public Statement(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  /** Returns the upper-case text of the first keyword, such as
   * {@code SELECT}, or null if the statement does not start with one. */
  public @Nullable String keyword() {
    final Token token = firstToken();
    return token == null ? null : token.keyword();
  }

  public boolean isError() {
    return kind() == SyntaxKind.ERROR;
  }

  public boolean isEmpty() {
    return kind() == SyntaxKind.EMPTY_STATEMENT;
  }
}
