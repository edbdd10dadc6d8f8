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

/**
 * Element of a concrete syntax tree: either a {@link Token} (leaf) or a
 * {@link SyntaxNode}.
 */
public abstract class SyntaxElement {
  SyntaxElement() {
  }

  /** Returns the range of source text covered by this element. */
  public abstract TextRange range();

  /** Returns the exact source text of this element, including any trivia
   * it contains. */
  public abstract String text();

  /** Returns whether this element is a leaf token. */
  public abstract boolean isToken();

  /** Casts this element to a token.
   *
   * @throws ClassCastException if this element is a node */
  public Token asToken() {
    return (Token) this;
  }

  /** Casts this element to a node.
   *
   * @throws ClassCastException if this element is a token */
  public SyntaxNode asNode() {
    return (SyntaxNode) this;
  }
}
