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

import org.pgtools.syntax.SyntaxKind;
import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/** Output list of a SELECT. */
public class TargetList extends AstNode {
  public TargetList(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  public List<TargetEntry> entries() {
    final List<TargetEntry> list = new ArrayList<>();
    for (SyntaxNode node : syntax.childrenOfKind(SyntaxKind.TARGET_ENTRY)) {
      list.add(new TargetEntry(tree, node));
    }
    return list;
  }
}
