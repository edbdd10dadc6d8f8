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
package org.pgtools.util;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Half-open range of character offsets {@code [start, end)} in a source
 * text.
 *
 * <p>Offsets are {@code char} indexes into the Java string that holds the
 * document. Ranges are immutable values.
 */
public final class TextRange implements Comparable<TextRange> {
  public static final TextRange EMPTY = new TextRange(0, 0);

  private final int start;
  private final int end;

  private TextRange(int start, int end) {
    this.start = start;
    this.end = end;
  }

  /** Creates a range. */
  public static TextRange of(int start, int end) {
    Preconditions.checkArgument(start >= 0 && start <= end,
        "invalid range [%s, %s)", start, end);
    if (start == 0 && end == 0) {
      return EMPTY;
    }
    return new TextRange(start, end);
  }

  /** Creates an empty range at a given offset. */
  public static TextRange empty(int offset) {
    return of(offset, offset);
  }

  public int start() {
    return start;
  }

  public int end() {
    return end;
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /** Returns whether {@code offset} lies in this range. The end offset
   * counts as contained, so that a cursor placed just after a token is
   * considered to touch it. */
  public boolean contains(int offset) {
    return start <= offset && offset <= end;
  }

  /** Returns whether this range contains the whole of another range. */
  public boolean contains(TextRange range) {
    return start <= range.start && range.end <= end;
  }

  /** Returns the smallest range covering this range and another. */
  public TextRange cover(TextRange range) {
    return of(Math.min(start, range.start), Math.max(end, range.end));
  }

  /** Returns this range moved by {@code delta} characters. */
  public TextRange shift(int delta) {
    return of(start + delta, end + delta);
  }

  /** Returns the text of this range within {@code source}. */
  public String substring(String source) {
    return source.substring(start, end);
  }

  @Override public int compareTo(TextRange o) {
    int c = Integer.compare(start, o.start);
    return c != 0 ? c : Integer.compare(end, o.end);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof TextRange
        && start == ((TextRange) obj).start
        && end == ((TextRange) obj).end;
  }

  @Override public int hashCode() {
    return start * 31 + end;
  }

  @Override public String toString() {
    return start + ".." + end;
  }
}
