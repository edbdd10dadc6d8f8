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

import org.pgtools.split.StatementRange;

import com.google.common.collect.ImmutableList;

import java.util.List;

/** Subtree of one statement, with the errors found while building it. */
public final class StatementTree {
  private final StatementRange range;
  private final SyntaxNode node;
  private final ImmutableList<ParseError> errors;

  StatementTree(StatementRange range, SyntaxNode node,
      List<ParseError> errors) {
    this.range = range;
    this.node = node;
    this.errors = ImmutableList.copyOf(errors);
  }

  public StatementRange range() {
    return range;
  }

  public SyntaxNode node() {
    return node;
  }

  public ImmutableList<ParseError> errors() {
    return errors;
  }

  @Override public String toString() {
    return range + " " + node.kind();
  }
}
