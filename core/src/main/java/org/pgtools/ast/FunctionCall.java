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

import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;
import org.pgtools.syntax.Token;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;

/** Call to a function or an aggregate, such as {@code count(*)}. */
public class FunctionCall extends Expression {
  public FunctionCall(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  /** Returns the function name as written before the opening parenthesis,
   * lower case, or null. */
  public @Nullable String name() {
    final List<Token> tokens = syntax.significantTokens();
    final StringBuilder b = new StringBuilder();
    for (Token token : tokens) {
      switch (token.kind()) {
      case LEFT_PAREN:
        return b.length() == 0 ? null : b.toString();
      case DOT:
        b.append('.');
        break;
      default:
        b.append(token.text().toLowerCase(Locale.ROOT));
      }
    }
    return null;
  }

  public List<Expression> arguments() {
    return expressions();
  }
}
