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

import org.pgtools.oracle.StructuralNode;
import org.pgtools.oracle.StructuralResult;
import org.pgtools.split.StatementRange;
import org.pgtools.util.PgToolsTrace;
import org.pgtools.util.TextRange;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the lossless subtree of one statement from its tokens and the
 * grammar oracle's verdict.
 *
 * <p>Building happens in two passes. The first pass <em>places</em> each
 * structural node on a run of token indexes:
 *
 * <ul>
 * <li>a node with a span takes the significant tokens that overlap it;
 * <li>a node without a span takes the cover of its placed children, or else
 * the next unclaimed significant token of its expected category;
 * <li>a node with leading keywords grows backwards over a matching keyword
 * sequence;
 * <li>a child that falls outside its parent or overlaps an earlier sibling
 * is discarded, and its tokens become leaves of the parent.
 * </ul>
 *
 * <p>The second pass <em>materializes</em> placements into
 * {@link SyntaxNode}s, attaching every token not claimed by a child as a
 * leaf of the innermost placement that contains it. The statement node is
 * stretched to cover the whole range, so its leading trivia, its terminator
 * and the trivia after it belong to it.
 *
 * <p>A root whose kind is not a statement kind is wrapped in a
 * {@link SyntaxKind#UTILITY_STMT} node.
 *
 * <p>If the oracle rejected the statement, the statement node is an
 * {@link SyntaxKind#ERROR} node holding every token, plus, if the oracle
 * reported one, the structure of the valid prefix.
 */
public class TreeBuilder {
  private static final Logger LOGGER = PgToolsTrace.getTreeBuilderTracer();

  private final List<Token> tokens;
  private final int base;
  private final int index;

  private TreeBuilder(StatementRange range) {
    this.tokens = range.tokens();
    this.base = range.start();
    this.index = range.index();
  }

  /** Builds the subtree of a statement. */
  public static StatementTree build(StatementRange range,
      StructuralResult result) {
    final TreeBuilder builder = new TreeBuilder(range);
    if (result.isSuccess()) {
      return new StatementTree(range, builder.success(result.root()),
          ImmutableList.of());
    }
    return builder.failure(range, result);
  }

  /** Builds the subtree of a statement that has no significant tokens. */
  public static StatementTree empty(StatementRange range) {
    return new StatementTree(range,
        SyntaxNode.of(SyntaxKind.EMPTY_STATEMENT, range.tokens()),
        ImmutableList.of());
  }

  /** Returns a copy of a statement subtree with a different error list. */
  public static StatementTree withErrors(StatementTree tree,
      List<ParseError> errors) {
    return new StatementTree(tree.range(), tree.node(), errors);
  }

  /** Assembles statement subtrees under a {@link SyntaxKind#SOURCE_FILE}
   * root. */
  public static SyntaxNode assemble(List<StatementTree> statements) {
    final List<SyntaxNode> children = new ArrayList<>();
    for (StatementTree statement : statements) {
      children.add(statement.node());
    }
    if (children.isEmpty()) {
      return new SyntaxNode(SyntaxKind.SOURCE_FILE, children, TextRange.EMPTY);
    }
    return SyntaxNode.of(SyntaxKind.SOURCE_FILE, children);
  }

  private SyntaxNode success(StructuralNode root) {
    final boolean statement = root.kind().belongsTo(SyntaxKind.STATEMENT_ROOT);
    Placement placement = place(root, 0, tokens.size());
    if (placement == null) {
      // Nothing aligned; keep the kind, flatten the structure.
      placement = new Placement(
          statement ? root.kind() : SyntaxKind.UTILITY_STMT, 0, tokens.size(),
          ImmutableList.of());
    } else if (statement) {
      placement = placement.stretch(0, tokens.size());
    } else {
      LOGGER.debug("wrapping {} root of statement {} in {}", root.kind(),
          index, SyntaxKind.UTILITY_STMT);
      placement = new Placement(SyntaxKind.UTILITY_STMT, 0, tokens.size(),
          ImmutableList.of(placement));
    }
    return materialize(placement);
  }

  private StatementTree failure(StatementRange range,
      StructuralResult result) {
    final int errorOffset = base + result.errorOffset();
    final int errorToken = significantAtOrAfter(errorOffset);
    final TextRange errorRange;
    if (errorToken < 0 || isTerminator(range, errorToken)) {
      errorRange = TextRange.empty(clampToStatement(range, errorOffset));
    } else {
      errorRange = tokens.get(errorToken).range();
    }
    final List<Placement> children = new ArrayList<>();
    final StructuralNode partial = result.partial();
    final int limit = errorToken < 0 ? tokens.size() : errorToken;
    if (partial != null && limit > 0) {
      final Placement p = place(partial, 0, limit);
      if (p != null) {
        children.add(p);
      }
    }
    final SyntaxNode node = materialize(
        new Placement(SyntaxKind.ERROR, 0, tokens.size(), children));
    final ParseError error =
        new ParseError(errorRange, result.message(), ParseError.Origin.ORACLE,
            range.index());
    return new StatementTree(range, node, ImmutableList.of(error));
  }

  private static boolean isTerminator(StatementRange range, int tokenIndex) {
    return range.tokens().get(tokenIndex) == range.terminator();
  }

  /** Clamps an offset to the end of the statement's last significant
   * non-terminator token. */
  private int clampToStatement(StatementRange range, int offset) {
    int end = range.start();
    final Token terminator = range.terminator();
    for (Token token : tokens) {
      if (token == terminator) {
        break;
      }
      if (!token.isTrivia()) {
        end = token.end();
      }
    }
    return Math.min(offset, end);
  }

  /** Returns the index of the first significant token that ends after an
   * offset, or -1. */
  private int significantAtOrAfter(int offset) {
    for (int i = 0; i < tokens.size(); i++) {
      final Token token = tokens.get(i);
      if (!token.isTrivia() && token.end() > offset) {
        return i;
      }
    }
    return -1;
  }

  /** Places a structural node within the token window {@code [lo, hi)}.
   * Returns null if the node cannot be aligned with any token. */
  private @Nullable Placement place(StructuralNode node, int lo, int hi) {
    int from = -1;
    int to = -1;
    final TextRange span = node.span();
    if (span != null) {
      final TextRange docSpan = span.shift(base);
      for (int i = lo; i < hi; i++) {
        final Token token = tokens.get(i);
        if (token.isTrivia()
            || token.end() <= docSpan.start()
            || token.start() >= docSpan.end()) {
          continue;
        }
        if (from < 0) {
          from = i;
        }
        to = i + 1;
      }
    }

    // Children with a span may appear anywhere in the window; children
    // without one consume tokens left to right.
    final int windowLo = from >= 0 ? from : lo;
    final int windowHi = from >= 0 ? to : hi;
    int cursor = windowLo;
    final List<Placement> children = new ArrayList<>();
    for (StructuralNode child : node.children()) {
      final Placement p = child.span() != null
          ? place(child, windowLo, windowHi)
          : place(child, cursor, windowHi);
      if (p != null) {
        children.add(p);
        cursor = Math.max(cursor, p.to);
      }
    }

    if (from < 0) {
      final TokenKind.Category expected = node.expectedCategory();
      if (!children.isEmpty()) {
        from = Integer.MAX_VALUE;
        for (Placement child : children) {
          from = Math.min(from, child.from);
          to = Math.max(to, child.to);
        }
      } else if (expected != null) {
        final int i = nextOfCategory(expected, lo, hi);
        if (i < 0) {
          LOGGER.trace("cannot align {} in tokens [{}, {})", node, lo, hi);
          return null;
        }
        from = i;
        to = i + 1;
      } else {
        LOGGER.trace("cannot align {} in tokens [{}, {})", node, lo, hi);
        return null;
      }
    }

    from = extendOverKeywords(node, from, lo);
    return new Placement(node.kind(), from, to, clip(children, from, to));
  }

  private int nextOfCategory(TokenKind.Category category, int lo, int hi) {
    for (int i = lo; i < hi; i++) {
      final TokenKind.Category c = tokens.get(i).kind().category();
      if (c == category
          || category == TokenKind.Category.IDENTIFIER
          && c == TokenKind.Category.KEYWORD) {
        return i;
      }
    }
    return -1;
  }

  /** Moves {@code from} back over the first matching leading keyword
   * sequence, not before {@code lo}. */
  private int extendOverKeywords(StructuralNode node, int from, int lo) {
    for (List<String> words : node.leadingKeywords()) {
      int i = from;
      boolean matched = true;
      for (int w = words.size() - 1; w >= 0 && matched; w--) {
        i = previousSignificant(i, lo);
        matched = i >= 0 && tokens.get(i).isWord(words.get(w));
      }
      if (matched) {
        return i;
      }
    }
    return from;
  }

  private int previousSignificant(int i, int lo) {
    for (int j = i - 1; j >= lo; j--) {
      if (!tokens.get(j).isTrivia()) {
        return j;
      }
    }
    return -1;
  }

  /** Sorts children and discards those outside {@code [from, to)} or
   * overlapping an earlier child. */
  private static List<Placement> clip(List<Placement> children, int from,
      int to) {
    final List<Placement> sorted = new ArrayList<>(children);
    sorted.sort(Comparator.comparingInt((Placement p) -> p.from)
        .thenComparingInt(p -> -p.to));
    final List<Placement> kept = new ArrayList<>();
    int end = from;
    for (Placement child : sorted) {
      if (child.from < end || child.to > to) {
        LOGGER.trace("discarding misaligned {} [{}, {}) in [{}, {})",
            child.kind, child.from, child.to, from, to);
        continue;
      }
      kept.add(child);
      end = child.to;
    }
    return kept;
  }

  private SyntaxNode materialize(Placement p) {
    final List<SyntaxElement> elements = new ArrayList<>();
    int i = p.from;
    for (Placement child : p.children) {
      while (i < child.from) {
        elements.add(tokens.get(i++));
      }
      elements.add(materialize(child));
      i = child.to;
    }
    while (i < p.to) {
      elements.add(tokens.get(i++));
    }
    return SyntaxNode.of(p.kind, elements);
  }

  /** Run of token indexes {@code [from, to)} assigned to a node. */
  private static final class Placement {
    final SyntaxKind kind;
    final int from;
    final int to;
    final List<Placement> children;

    Placement(SyntaxKind kind, int from, int to, List<Placement> children) {
      this.kind = kind;
      this.from = from;
      this.to = to;
      this.children = children;
    }

    Placement stretch(int from, int to) {
      return new Placement(kind, Math.min(from, this.from),
          Math.max(to, this.to), children);
    }
  }
}
