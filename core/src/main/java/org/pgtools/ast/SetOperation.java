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

import org.pgtools.syntax.SyntaxElement;
import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;
import org.pgtools.syntax.Token;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/** Typed view of UNION, INTERSECT or EXCEPT. */
public class SetOperation extends Statement {
  public SetOperation(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  /** Returns the queries combined by the operator. */
  public List<Statement> operands() {
    final List<Statement> list = new ArrayList<>();
    for (SyntaxNode child : syntax.childNodes()) {
      if (child.kind().belongsTo(SyntaxKind.STATEMENT)) {
        list.add(Ast.statement(tree, child));
      }
    }
    return list;
  }

  /** Returns the operator, upper case, or null. */
  public @Nullable String operator() {
    for (SyntaxElement child : syntax.children()) {
      if (child.isToken()) {
        final Token token = child.asToken();
        if (token.isWord("UNION") || token.isWord("INTERSECT")
            || token.isWord("EXCEPT")) {
          return token.keyword();
        }
      }
    }
    return null;
  }
}
