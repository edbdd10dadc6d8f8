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

import org.pgtools.util.TextRange;

import org.apache.calcite.sql.parser.SqlParserPos;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the line and column positions that the Calcite parser and
 * JSqlParser report into character offsets.
 *
 * <p>Lines and columns are 1-based; a tab counts as one column. A line ends
 * at {@code \n}, at {@code \r}, or at {@code \r\n}, the same way the
 * parser's character stream counts them.
 */
class LineMap {
  private final int length;
  private final int[] lineStarts;

  LineMap(String text) {
    this.length = text.length();
    final List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '\r') {
        if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
          ++i;
        }
        starts.add(i + 1);
      } else if (c == '\n') {
        starts.add(i + 1);
      }
    }
    lineStarts = new int[starts.size()];
    for (int i = 0; i < lineStarts.length; i++) {
      lineStarts[i] = starts.get(i);
    }
  }

  /** Returns the offset of a line and column, or -1 if the position is
   * outside the text. */
  int offset(int line, int column) {
    if (line < 1 || line > lineStarts.length || column < 1) {
      return -1;
    }
    final int offset = lineStarts[line - 1] + column - 1;
    return offset <= length ? offset : -1;
  }

  /** Converts a parser position, whose end column is inclusive, to a range,
   * or returns null if the position is unknown or inconsistent. */
  @Nullable TextRange span(@Nullable SqlParserPos pos) {
    if (pos == null || pos.getLineNum() <= 0) {
      return null;
    }
    final int start = offset(pos.getLineNum(), pos.getColumnNum());
    final int last = offset(pos.getEndLineNum(), pos.getEndColumnNum());
    if (start < 0 || last < start || last >= length) {
      return null;
    }
    return TextRange.of(start, last + 1);
  }

  int length() {
    return length;
  }
}
