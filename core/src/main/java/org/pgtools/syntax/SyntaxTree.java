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

import org.pgtools.ast.SourceFile;
import org.pgtools.split.StatementRange;
import org.pgtools.util.TextRange;

import org.apache.calcite.util.Litmus;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Lossless concrete syntax tree of a SQL document.
 *
 * <p>The tree owns the source text, the token stream, the statement ranges,
 * the {@link SyntaxKind#SOURCE_FILE} root and the errors found while
 * parsing. Every character of the source belongs to exactly one token, and
 * the leaves of the tree, read left to right, are exactly the token stream;
 * so {@code tree.root().text()} equals the source. {@link #isValid} checks
 * these properties.
 *
 * <p>A tree is immutable and safe to share between threads.
 */
public final class SyntaxTree {
  private final String source;
  private final SyntaxNode root;
  private final ImmutableList<Token> tokens;
  private final ImmutableList<StatementRange> statements;
  private final ImmutableList<ParseError> errors;

  public SyntaxTree(String source, SyntaxNode root, List<Token> tokens,
      List<StatementRange> statements, List<ParseError> errors) {
    this.source = requireNonNull(source, "source");
    this.root = requireNonNull(root, "root");
    this.tokens = ImmutableList.copyOf(tokens);
    this.statements = ImmutableList.copyOf(statements);
    this.errors = ImmutableList.copyOf(errors);
  }

  public String source() {
    return source;
  }

  public SyntaxNode root() {
    return root;
  }

  /** Returns the token stream, trivia included. */
  public ImmutableList<Token> tokens() {
    return tokens;
  }

  /** Returns the statement ranges, in source order. */
  public ImmutableList<StatementRange> statementRanges() {
    return statements;
  }

  /** Returns the statement nodes, in source order; one per statement
   * range. */
  public List<SyntaxNode> statements() {
    return root.childNodes();
  }

  /** Returns the errors of all statements, sorted by position. */
  public ImmutableList<ParseError> errors() {
    return errors;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Returns the text of an element, taken from the source. */
  public String text(SyntaxElement element) {
    return element.range().substring(source);
  }

  /** Returns the typed view of this tree. */
  public SourceFile ast() {
    return new SourceFile(this, root);
  }

  /** Returns the token at an offset, or null if the document is empty.
   *
   * <p>The token at {@code offset} is the one whose range contains it,
   * start inclusive and end exclusive; an offset at the end of the document
   * returns the last token. */
  public @Nullable Token tokenAt(int offset) {
    checkOffset(offset);
    if (tokens.isEmpty()) {
      return null;
    }
    int lo = 0;
    int hi = tokens.size() - 1;
    while (lo < hi) {
      final int mid = (lo + hi + 1) >>> 1;
      if (tokens.get(mid).start() <= offset) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return tokens.get(lo);
  }

  /** Returns the smallest node that covers an offset.
   *
   * <p>A node covers an offset if the offset is within its range, start
   * inclusive and end exclusive. At the end of the document, the nodes
   * that end there cover it. */
  public SyntaxNode coveringNode(int offset) {
    final List<SyntaxNode> path = pathTo(offset);
    return path.get(path.size() - 1);
  }

  /** Returns the nodes that cover an offset, from the root down to the
   * smallest. */
  public List<SyntaxNode> pathTo(int offset) {
    checkOffset(offset);
    final List<SyntaxNode> path = new ArrayList<>();
    SyntaxNode node = root;
    for (;;) {
      path.add(node);
      final SyntaxNode child = childCovering(node, offset);
      if (child == null) {
        return path;
      }
      node = child;
    }
  }

  private @Nullable SyntaxNode childCovering(SyntaxNode node, int offset) {
    SyntaxNode touching = null;
    for (SyntaxElement child : node.children()) {
      final TextRange range = child.range();
      if (range.start() <= offset && offset < range.end()) {
        return child.isToken() ? null : child.asNode();
      }
      if (range.end() == offset && offset == source.length()
          && !child.isToken()) {
        touching = child.asNode();
      }
    }
    return touching;
  }

  /** Returns the statement node that contains an offset, or null if the
   * document is empty. */
  public @Nullable SyntaxNode statementAt(int offset) {
    final List<SyntaxNode> path = pathTo(offset);
    return path.size() > 1 ? path.get(1) : null;
  }

  private void checkOffset(int offset) {
    Preconditions.checkArgument(offset >= 0 && offset <= source.length(),
        "offset %s out of range [0, %s]", offset, source.length());
  }

  /** Returns an indented rendering of the tree, one element per line. */
  public String dump() {
    final StringBuilder b = new StringBuilder();
    root.dump(b, 0);
    return b.toString();
  }

  /** Checks the structural invariants of this tree: the tokens partition
   * the source, the leaves are the tokens, every node's range is the cover
   * of its children, and there is one statement node per statement
   * range. */
  public boolean isValid(Litmus litmus) {
    int offset = 0;
    for (Token token : tokens) {
      if (token.start() != offset || token.text().isEmpty()) {
        return litmus.fail("token {} is not contiguous at {}", token, offset);
      }
      offset = token.end();
    }
    if (offset != source.length()) {
      return litmus.fail("tokens end at {}, source at {}", offset,
          source.length());
    }
    final List<Token> leaves = root.tokens();
    if (leaves.size() != tokens.size()) {
      return litmus.fail("tree has {} leaves, stream has {} tokens",
          leaves.size(), tokens.size());
    }
    for (int i = 0; i < leaves.size(); i++) {
      if (leaves.get(i) != tokens.get(i)) {
        return litmus.fail("leaf {} is {}, expected {}", i, leaves.get(i),
            tokens.get(i));
      }
    }
    if (root.kind() != SyntaxKind.SOURCE_FILE
        || !root.range().equals(TextRange.of(0, source.length()))) {
      return litmus.fail("bad root {}", root);
    }
    for (SyntaxNode node : root.descendants()) {
      if (!isValidNode(node, litmus)) {
        return false;
      }
    }
    final List<SyntaxNode> statementNodes = statements();
    if (statementNodes.size() != statements.size()
        || statementNodes.size() != root.children().size()) {
      return litmus.fail("{} statement nodes for {} statement ranges",
          statementNodes.size(), statements.size());
    }
    for (int i = 0; i < statements.size(); i++) {
      final SyntaxNode node = statementNodes.get(i);
      if (!node.kind().belongsTo(SyntaxKind.STATEMENT_ROOT)) {
        return litmus.fail("statement node {} has kind {}", i, node.kind());
      }
      if (!node.range().equals(statements.get(i).range())) {
        return litmus.fail("statement node {} covers {}, range is {}", i,
            node.range(), statements.get(i).range());
      }
    }
    return litmus.succeed();
  }

  private static boolean isValidNode(SyntaxNode node, Litmus litmus) {
    final List<SyntaxElement> children = node.children();
    if (children.isEmpty()) {
      return node.kind() == SyntaxKind.SOURCE_FILE
          ? litmus.succeed()
          : litmus.fail("node {} has no children", node);
    }
    int offset = node.range().start();
    for (SyntaxElement child : children) {
      if (child.range().start() != offset) {
        return litmus.fail("child {} of {} is not contiguous", child, node);
      }
      offset = child.range().end();
    }
    if (offset != node.range().end()) {
      return litmus.fail("children of {} end at {}", node, offset);
    }
    return litmus.succeed();
  }

  @Override public String toString() {
    return "SyntaxTree(" + statements.size() + " statements, "
        + errors.size() + " errors)";
  }
}
