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

import java.util.List;

/** {@code column = value} in the SET clause of an UPDATE. */
public class Assignment extends AstNode {
  public Assignment(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  public @Nullable Identifier column() {
    final SyntaxNode node = child(SyntaxKind.IDENTIFIER);
    return node == null ? null : new Identifier(tree, node);
  }

  /** Returns the value assigned; the expression after the column. */
  public @Nullable Expression value() {
    final List<Expression> expressions = expressions();
    return expressions.size() < 2 ? null : expressions.get(1);
  }
}
