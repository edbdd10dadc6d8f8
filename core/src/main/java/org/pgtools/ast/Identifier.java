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
import org.pgtools.syntax.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Possibly qualified name, such as {@code s."T".c}. */
public class Identifier extends Expression {
  public Identifier(SyntaxTree tree, SyntaxNode syntax) {
    super(tree, syntax);
  }

  /** Returns the parts of the name, normalized the way PostgreSQL does:
   * unquoted parts folded to lower case, quoted parts with quotes
   * removed. {@code *} is returned as is. */
  public List<String> names() {
    final List<String> names = new ArrayList<>();
    for (Token token : syntax.significantTokens()) {
      switch (token.kind()) {
      case IDENTIFIER:
      case KEYWORD:
        names.add(token.text().toLowerCase(Locale.ROOT));
        break;
      case QUOTED_IDENTIFIER:
        names.add(unquote(token.text()));
        break;
      case OPERATOR:
        if (token.text().equals("*")) {
          names.add("*");
        }
        break;
      default:
        break;
      }
    }
    return names;
  }

  /** Returns the last part of the name. */
  public String simpleName() {
    final List<String> names = names();
    return names.isEmpty() ? "" : names.get(names.size() - 1);
  }

  /** Returns whether the name has a quoted part. */
  public boolean isQuoted() {
    for (Token token : syntax.significantTokens()) {
      if (token.kind() == TokenKind.QUOTED_IDENTIFIER) {
        return true;
      }
    }
    return false;
  }

  private static String unquote(String text) {
    int start = text.indexOf('"') + 1;
    return text.substring(start, text.length() - 1).replace("\"\"", "\"");
  }
}
