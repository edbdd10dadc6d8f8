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

import org.junit.jupiter.api.Test;

import static org.pgtools.util.Static.RESOURCE;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests that the messages in {@link PgToolsResource} are well-formed.
 */
class PgToolsResourceTest {
  @Test void testMessages() {
    assertThat(RESOURCE.unterminatedString().str(),
        is("Unterminated quoted string"));
    assertThat(RESOURCE.unterminatedDollarString("$tag$").str(),
        is("Unterminated dollar-quoted string; expected closing $tag$"));
    assertThat(RESOURCE.invalidCharacter("{").str(),
        is("Invalid character '{'"));
    assertThat(RESOURCE.statementParseFailed(1200).str(),
        is("Parse of statement 1200 failed unexpectedly"));
  }

  @Test void testExceptions() {
    assertThat(RESOURCE.parseCancelled().ex(),
        instanceOf(ParseCancelledException.class));
    final Exception cause = new IllegalStateException("x");
    final PgToolsException e = RESOURCE.statementParseFailed(3).ex(cause);
    assertThat(e.getMessage(), is("Parse of statement 3 failed unexpectedly"));
    assertThat(e.getCause(), sameInstance(cause));
  }
}
