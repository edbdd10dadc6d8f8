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
package org.pgtools.runtime;

import static org.apache.calcite.runtime.Resources.BaseMessage;
import static org.apache.calcite.runtime.Resources.ExInst;
import static org.apache.calcite.runtime.Resources.Inst;

/**
 * Compiler-checked resources for the parsing layer.
 */
public interface PgToolsResource {
  @BaseMessage("Unterminated quoted string")
  Inst unterminatedString();

  @BaseMessage("Unterminated quoted identifier")
  Inst unterminatedQuotedIdentifier();

  @BaseMessage("Unterminated dollar-quoted string; expected closing {0}")
  Inst unterminatedDollarString(String a0);

  @BaseMessage("Unterminated /* comment")
  Inst unterminatedComment();

  @BaseMessage("Invalid character ''{0}''")
  Inst invalidCharacter(String a0);

  @BaseMessage("Syntax error: {0}")
  Inst syntaxError(String a0);

  @BaseMessage("Grammar oracle produced unknown node tag ''{0}''")
  Inst unmappedNodeTag(String a0);

  @BaseMessage("Grammar oracle failed: {0}")
  Inst oracleFailed(String a0);

  @BaseMessage("Parse of document was cancelled")
  ExInst<ParseCancelledException> parseCancelled();

  @BaseMessage("Parse of statement {0,number,#} failed unexpectedly")
  ExInst<PgToolsException> statementParseFailed(int a0);
}
