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

import org.pgtools.util.TextRange;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Interior node of a concrete syntax tree.
 *
 * <p>A node's children are tokens and nodes in source order. The range of a
 * node is exactly the cover of its children, and its text is the
 * concatenation of their text, so every node reproduces its slice of the
 * source byte for byte.
 *
 * <p>Nodes are immutable and may be shared between threads.
 */
public final class SyntaxNode extends SyntaxElement {
  private final SyntaxKind kind;
  private final ImmutableList<SyntaxElement> children;
  private final TextRange range;

  SyntaxNode(SyntaxKind kind, List<? extends SyntaxElement> children,
      TextRange range) {
    this.kind = requireNonNull(kind, "kind");
    this.children = ImmutableList.copyOf(children);
    this.range = range;
  }

  /** Creates a node whose range is the cover of its children.
   * The children must be non-empty and contiguous. */
  static SyntaxNode of(SyntaxKind kind, List<? extends SyntaxElement> children) {
    final TextRange range =
        TextRange.of(children.get(0).range().start(),
            children.get(children.size() - 1).range().end());
    return new SyntaxNode(kind, children, range);
  }

  public SyntaxKind kind() {
    return kind;
  }

  @Override public TextRange range() {
    return range;
  }

  @Override public boolean isToken() {
    return false;
  }

  @Override public String text() {
    final StringBuilder b = new StringBuilder(range.length());
    for (Token token : tokens()) {
      b.append(token.text());
    }
    return b.toString();
  }

  /** Returns the direct children of this node, tokens and nodes, in source
   * order. */
  public ImmutableList<SyntaxElement> children() {
    return children;
  }

  /** Returns the direct children of this node that are nodes. */
  public List<SyntaxNode> childNodes() {
    final List<SyntaxNode> list = new ArrayList<>();
    for (SyntaxElement child : children) {
      if (!child.isToken()) {
        list.add(child.asNode());
      }
    }
    return list;
  }

  /** Returns the first direct child node of a given kind, or null. */
  public @Nullable SyntaxNode firstChild(SyntaxKind kind) {
    for (SyntaxElement child : children) {
      if (!child.isToken() && child.asNode().kind == kind) {
        return child.asNode();
      }
    }
    return null;
  }

  /** Returns the direct child nodes of a given kind. */
  public List<SyntaxNode> childrenOfKind(SyntaxKind kind) {
    final List<SyntaxNode> list = new ArrayList<>();
    for (SyntaxNode child : childNodes()) {
      if (child.kind == kind) {
        list.add(child);
      }
    }
    return list;
  }

  /** Returns every token under this node, in source order. */
  public List<Token> tokens() {
    final List<Token> list = new ArrayList<>();
    collectTokens(list);
    return list;
  }

  private void collectTokens(List<Token> list) {
    for (SyntaxElement child : children) {
      if (child.isToken()) {
        list.add(child.asToken());
      } else {
        child.asNode().collectTokens(list);
      }
    }
  }

  /** Returns the tokens under this node that are not trivia. */
  public List<Token> significantTokens() {
    final List<Token> list = new ArrayList<>();
    for (Token token : tokens()) {
      if (!token.isTrivia()) {
        list.add(token);
      }
    }
    return list;
  }

  /** Returns the first token under this node that is not trivia, or null. */
  public @Nullable Token firstSignificantToken() {
    for (Token token : tokens()) {
      if (!token.isTrivia()) {
        return token;
      }
    }
    return null;
  }

  /** Returns this node and every node below it, in pre-order. */
  public List<SyntaxNode> descendants() {
    final List<SyntaxNode> list = new ArrayList<>();
    collectNodes(list);
    return list;
  }

  private void collectNodes(List<SyntaxNode> list) {
    list.add(this);
    for (SyntaxElement child : children) {
      if (!child.isToken()) {
        child.asNode().collectNodes(list);
      }
    }
  }

  /** Writes an indented rendering of this subtree to a builder. */
  void dump(StringBuilder b, int indent) {
    indent(b, indent).append(kind).append('@').append(range).append('\n');
    for (SyntaxElement child : children) {
      if (child.isToken()) {
        indent(b, indent + 1).append(child).append('\n');
      } else {
        child.asNode().dump(b, indent + 1);
      }
    }
  }

  private static StringBuilder indent(StringBuilder b, int indent) {
    for (int i = 0; i < indent; i++) {
      b.append("  ");
    }
    return b;
  }

  @Override public String toString() {
    return kind + "@" + range;
  }
}
