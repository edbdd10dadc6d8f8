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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of asking a {@link GrammarOracle} to parse one statement.
 *
 * <p>Either a success, with the root of the statement's structure, or a
 * failure, with a message, the offset (relative to the start of the
 * statement text) at which the oracle gave up, and optionally the structure
 * of the longest prefix the oracle could accept.
 */
public final class StructuralResult {
  private final @Nullable StructuralNode root;
  private final @Nullable String message;
  private final int errorOffset;
  private final @Nullable StructuralNode partial;

  private StructuralResult(@Nullable StructuralNode root,
      @Nullable String message, int errorOffset,
      @Nullable StructuralNode partial) {
    this.root = root;
    this.message = message;
    this.errorOffset = errorOffset;
    this.partial = partial;
  }

  public static StructuralResult success(StructuralNode root) {
    return new StructuralResult(requireNonNull(root, "root"), null, -1, null);
  }

  public static StructuralResult failure(String message, int errorOffset,
      @Nullable StructuralNode partial) {
    Preconditions.checkArgument(errorOffset >= 0, "negative error offset");
    return new StructuralResult(null, requireNonNull(message, "message"),
        errorOffset, partial);
  }

  public boolean isSuccess() {
    return root != null;
  }

  /** Returns the root of a successful result.
   *
   * @throws IllegalStateException if this is a failure */
  public StructuralNode root() {
    if (root == null) {
      throw new IllegalStateException("not a successful result");
    }
    return root;
  }

  /** Returns the failure message.
   *
   * @throws IllegalStateException if this is a success */
  public String message() {
    if (message == null) {
      throw new IllegalStateException("not a failure");
    }
    return message;
  }

  /** Returns the offset of a failure, relative to the start of the
   * statement text; -1 for a success. */
  public int errorOffset() {
    return errorOffset;
  }

  /** Returns the structure of a valid prefix of a failed statement, or
   * null. */
  public @Nullable StructuralNode partial() {
    return partial;
  }

  @Override public String toString() {
    return root != null
        ? "success " + root
        : "failure at " + errorOffset + ": " + message;
  }
}
