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

import org.pgtools.syntax.ParseError;
import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/** Typed view of a statement the grammar oracle rejected. */
public class ErrorStatement extends Statement {
  public ErrorStatement(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  /** Returns the structure recovered from the valid prefix of the
   * statement, or null. */
  public @Nullable Statement partial() {
    final List<SyntaxNode> children = syntax.childNodes();
    return children.isEmpty() ? null : Ast.statement(tree, children.get(0));
  }

  /** Returns the errors reported within this statement. */
  public List<ParseError> errors() {
    final List<ParseError> list = new ArrayList<>();
    for (ParseError error : tree.errors()) {
      if (range().contains(error.range())) {
        list.add(error);
      }
    }
    return list;
  }
}
