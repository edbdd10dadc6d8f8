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

import org.pgtools.config.PgToolsSystemProperty;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all exceptions originating from the parsing layer.
 *
 * <p>Syntax errors in user input are never reported this way; they become
 * {@link org.pgtools.syntax.ParseError}s attached to the tree.
 */
public class PgToolsException extends RuntimeException {
  private static final long serialVersionUID = 4120571307262046315L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(PgToolsException.class);

  /**
   * Creates a PgToolsException.
   *
   * @param message error message
   * @param cause   underlying cause
   */
  public PgToolsException(String message, @Nullable Throwable cause) {
    super(message, cause);
    LOGGER.trace("PgToolsException", this);
    if (PgToolsSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }
}
