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
import org.pgtools.util.TextRange;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Typed view of a {@link SyntaxNode}.
 *
 * <p>An AST node is a thin wrapper; it holds no state of its own, and is
 * created on demand. Accessors for optional parts return null when the
 * part is missing, which is normal in incomplete or erroneous code.
 */
public abstract class AstNode {
  protected final SyntaxTree tree;
  protected final SyntaxNode syntax;

  protected AstNode(SyntaxTree tree, SyntaxNode syntax) {
    this.tree = requireNonNull(tree, "tree");
    this.syntax = requireNonNull(syntax, "syntax");
  }

  public SyntaxTree tree() {
    return tree;
  }

  /** Returns the underlying concrete node. */
  public SyntaxNode syntax() {
    return syntax;
  }

  public SyntaxKind kind() {
    return syntax.kind();
  }

  public TextRange range() {
    return syntax.range();
  }

  /** Returns the source text of this node, trivia included. */
  public String text() {
    return syntax.text();
  }

  /** Returns the first child node of a given kind, or null. */
  protected @Nullable SyntaxNode child(SyntaxKind kind) {
    return syntax.firstChild(kind);
  }

  /** Returns the first child node whose kind is in a family, or null. */
  protected @Nullable SyntaxNode child(Set<SyntaxKind> family) {
    for (SyntaxNode child : syntax.childNodes()) {
      if (child.kind().belongsTo(family)) {
        return child;
      }
    }
    return null;
  }

  /** Returns the first child expression, or null. A parenthesized query
   * used as a value also counts as an expression. */
  protected @Nullable Expression expression() {
    for (SyntaxNode child : syntax.childNodes()) {
      if (child.kind().belongsTo(SyntaxKind.EXPRESSION)
          || child.kind().belongsTo(SyntaxKind.STATEMENT)) {
        return Ast.expression(tree, child);
      }
    }
    return null;
  }

  /** Returns all child expressions, in source order. */
  protected List<Expression> expressions() {
    final List<Expression> list = new ArrayList<>();
    for (SyntaxNode child : syntax.childNodes()) {
      if (child.kind().belongsTo(SyntaxKind.EXPRESSION)
          || child.kind().belongsTo(SyntaxKind.STATEMENT)
          || child.kind() == SyntaxKind.SORT_ITEM) {
        list.add(Ast.expression(tree, child));
      }
    }
    return list;
  }

  /** Returns the first significant token of this node, or null. */
  public @Nullable Token firstToken() {
    return syntax.firstSignificantToken();
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "(" + syntax + ")";
  }
}
