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

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * Grammar oracle that remembers the results of another oracle, keyed by
 * statement text.
 *
 * <p>Results are immutable, so a cached result can be shared by any number
 * of documents and threads. Editors re-parse mostly unchanged text, so most
 * statements hit the cache.
 */
public class CachingGrammarOracle implements GrammarOracle {
  private final GrammarOracle delegate;
  private final LoadingCache<String, StructuralResult> cache;

  public CachingGrammarOracle(GrammarOracle delegate, long maximumSize) {
    this.delegate = requireNonNull(delegate, "delegate");
    this.cache = CacheBuilder.newBuilder()
        .maximumSize(maximumSize)
        .build(CacheLoader.from(delegate::parse));
  }

  public GrammarOracle delegate() {
    return delegate;
  }

  /** Returns the number of results currently cached. */
  public long size() {
    return cache.size();
  }

  @Override public StructuralResult parse(String statementText) {
    try {
      return cache.getUnchecked(statementText);
    } catch (UncheckedExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw e;
    }
  }
}
