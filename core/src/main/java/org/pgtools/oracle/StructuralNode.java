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

import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.TokenKind;
import org.pgtools.util.TextRange;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Node of the structure a {@link GrammarOracle} reports for a statement.
 *
 * <p>A structural node has no tokens. It carries an oracle tag, the
 * {@link SyntaxKind} the tag maps to, named child fields in the order the
 * oracle reports them, and a hint of where it sits in the statement text:
 *
 * <ul>
 * <li>{@link #span()}, a range relative to the start of the statement, if
 * the oracle knows one;
 * <li>{@link #leadingKeywords()}, keyword sequences that may precede the
 * span and belong to the node (for example {@code GROUP BY} before the
 * grouping keys);
 * <li>{@link #expectedCategory()}, the category of the single token a node
 * without a span consumes.
 * </ul>
 *
 * <p>The tree builder treats all of these as hints; it never trusts a span
 * that disagrees with the token stream.
 */
public final class StructuralNode {
  private final String tag;
  private final SyntaxKind kind;
  private final @Nullable TextRange span;
  private final ImmutableList<Field> fields;
  private final ImmutableList<ImmutableList<String>> leadingKeywords;
  private final TokenKind.@Nullable Category expectedCategory;

  private StructuralNode(Builder b) {
    this.tag = b.tag;
    this.kind = b.kind;
    this.span = b.span;
    this.fields = ImmutableList.copyOf(b.fields);
    this.leadingKeywords = ImmutableList.copyOf(b.leadingKeywords);
    this.expectedCategory = b.expectedCategory;
  }

  /** Creates a builder. */
  public static Builder builder(String tag, SyntaxKind kind) {
    return new Builder(tag, kind);
  }

  /** Creates a builder with the tag and kind of a syntax kind, for nodes
   * that the oracle adapter introduces rather than the oracle. */
  public static Builder builder(SyntaxKind kind) {
    return new Builder(kind.name(), kind);
  }

  /** Returns the oracle's name for this node. */
  public String tag() {
    return tag;
  }

  public SyntaxKind kind() {
    return kind;
  }

  /** Returns the range of the node, relative to the start of the statement
   * text, or null if the oracle does not know it. */
  public @Nullable TextRange span() {
    return span;
  }

  public ImmutableList<Field> fields() {
    return fields;
  }

  /** Returns the child nodes, in field order. */
  public List<StructuralNode> children() {
    final List<StructuralNode> list = new ArrayList<>();
    for (Field field : fields) {
      list.add(field.node);
    }
    return list;
  }

  /** Returns the keyword sequences, each one upper-case words, any one of
   * which may immediately precede this node's span and belongs to it. */
  public ImmutableList<ImmutableList<String>> leadingKeywords() {
    return leadingKeywords;
  }

  public TokenKind.@Nullable Category expectedCategory() {
    return expectedCategory;
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    unparse(b);
    return b.toString();
  }

  private void unparse(StringBuilder b) {
    b.append(tag);
    if (span != null) {
      b.append('@').append(span);
    }
    if (!fields.isEmpty()) {
      b.append('(');
      for (int i = 0; i < fields.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(fields.get(i).name).append('=');
        fields.get(i).node.unparse(b);
      }
      b.append(')');
    }
  }

  /** Named child of a structural node. */
  public static final class Field {
    public final String name;
    public final StructuralNode node;

    Field(String name, StructuralNode node) {
      this.name = requireNonNull(name, "name");
      this.node = requireNonNull(node, "node");
    }
  }

  /** Builder for {@link StructuralNode}. */
  public static final class Builder {
    private final String tag;
    private final SyntaxKind kind;
    private @Nullable TextRange span;
    private final List<Field> fields = new ArrayList<>();
    private final List<ImmutableList<String>> leadingKeywords =
        new ArrayList<>();
    private TokenKind.@Nullable Category expectedCategory;

    private Builder(String tag, SyntaxKind kind) {
      this.tag = requireNonNull(tag, "tag");
      this.kind = requireNonNull(kind, "kind");
    }

    public Builder span(@Nullable TextRange span) {
      this.span = span;
      return this;
    }

    /** Widens the span to include another range. A null range is
     * ignored. */
    public Builder cover(@Nullable TextRange range) {
      if (range != null) {
        span = span == null ? range : span.cover(range);
      }
      return this;
    }

    /** Adds a child field. A null node is ignored, so that optional parts
     * of a statement can be passed through unconditionally. */
    public Builder field(String name, @Nullable StructuralNode node) {
      if (node != null) {
        fields.add(new Field(name, node));
      }
      return this;
    }

    /** Adds leading keyword alternatives, each a space-separated sequence
     * such as {@code "GROUP BY"}. */
    public Builder leadingKeywords(String... alternatives) {
      for (String alternative : alternatives) {
        leadingKeywords.add(
            ImmutableList.copyOf(
                Splitter.on(' ').omitEmptyStrings().split(alternative)));
      }
      return this;
    }

    public Builder expect(TokenKind.@Nullable Category category) {
      this.expectedCategory = category;
      return this;
    }

    public StructuralNode build() {
      return new StructuralNode(this);
    }
  }
}
