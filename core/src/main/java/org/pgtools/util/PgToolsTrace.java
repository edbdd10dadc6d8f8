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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains all of the {@link Logger tracers} used within the parsing layer.
 *
 * <h2>Note to developers</h2>
 *
 * <p>Please ensure that every tracer used in pgtools is added to this class
 * as a method called <code>get<i>Component</i>Tracer</code>. The javadoc
 * in this file is the primary source of information on what tracers are
 * available and what each level reports.
 *
 * <p>In the class where the tracer is used, create a <em>private</em>
 * <em>static final</em> member called <code>LOGGER</code>.
 */
public abstract class PgToolsTrace {
  private PgToolsTrace() {}

  /**
   * The "org.pgtools.parser" tracer reports document parses. DEBUG prints
   * one line per document with statement and error counts; TRACE prints
   * each statement range as it is dispatched.
   */
  public static Logger getParserTracer() {
    return LoggerFactory.getLogger("org.pgtools.parser");
  }

  /**
   * The "org.pgtools.oracle" tracer reports calls to the grammar oracle.
   * DEBUG prints rejected statements with the oracle's message; WARN reports
   * unexpected oracle failures and unmapped node tags.
   */
  public static Logger getOracleTracer() {
    return LoggerFactory.getLogger("org.pgtools.oracle");
  }

  /**
   * The "org.pgtools.syntax" tracer reports tree construction. TRACE prints
   * structural nodes that could not be aligned with tokens and were
   * flattened into their parent.
   */
  public static Logger getTreeBuilderTracer() {
    return LoggerFactory.getLogger("org.pgtools.syntax");
  }
}
