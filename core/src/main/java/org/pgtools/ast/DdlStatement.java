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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Typed view of a CREATE, ALTER or DROP statement. */
public class DdlStatement extends Statement {
  /** Words that may appear between {@code CREATE} and the object type. */
  private static final ImmutableSet<String> MODIFIERS =
      ImmutableSet.of("OR", "REPLACE", "TEMP", "TEMPORARY", "UNLOGGED",
          "GLOBAL", "LOCAL", "UNIQUE", "MATERIALIZED", "RECURSIVE",
          "TRUSTED", "PROCEDURAL", "DEFAULT", "CONSTRAINT", "FOREIGN");

  public DdlStatement(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  /** Returns the type of object the statement acts on, upper case, such
   * as {@code TABLE} or {@code FUNCTION}; null if it cannot be found. */
  public @Nullable String objectType() {
    final List<Token> tokens = syntax.significantTokens();
    for (int i = 1; i < tokens.size(); i++) {
      final String keyword = tokens.get(i).keyword();
      if (keyword == null) {
        return null;
      }
      if (!MODIFIERS.contains(keyword)) {
        return keyword;
      }
    }
    return null;
  }
}
