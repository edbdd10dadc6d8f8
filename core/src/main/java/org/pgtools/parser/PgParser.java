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
package org.pgtools.parser;

import org.pgtools.config.PgToolsSystemProperty;
import org.pgtools.lexer.PgLexer;
import org.pgtools.oracle.CachingGrammarOracle;
import org.pgtools.oracle.FallbackGrammarOracle;
import org.pgtools.oracle.GrammarOracle;
import org.pgtools.oracle.StructuralResult;
import org.pgtools.runtime.ParseCancelledException;
import org.pgtools.split.StatementRange;
import org.pgtools.split.StatementSplitter;
import org.pgtools.syntax.ParseError;
import org.pgtools.syntax.StatementTree;
import org.pgtools.syntax.SyntaxNode;
import org.pgtools.syntax.SyntaxTree;
import org.pgtools.syntax.Token;
import org.pgtools.syntax.TreeBuilder;
import org.pgtools.util.PgToolsTrace;

import org.apache.calcite.util.CancelFlag;
import org.apache.calcite.util.Litmus;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apiguardian.api.API;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.pgtools.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Parses SQL documents into lossless {@link SyntaxTree}s.
 *
 * <p>A document is lexed, split into statements, and each statement is
 * checked by the {@link GrammarOracle} and built into a subtree. Statements
 * are independent, so they are parsed as separate tasks on an executor;
 * their subtrees are assembled in source order, so the result does not
 * depend on which task finishes first. A statement the oracle rejects
 * becomes an {@link org.pgtools.syntax.SyntaxKind#ERROR} node and does not
 * affect its neighbors.
 *
 * <p>A parse can be cancelled through a {@link CancelFlag}. The flag is
 * checked before and after each oracle call; once it is set, the parse
 * abandons its remaining work and throws {@link ParseCancelledException}.
 * A cancelled parse never returns a partial tree.
 *
 * <p>Typical use:
 *
 * <blockquote><pre>
 * PgParser parser = PgParser.create();
 * SyntaxTree tree = parser.parse("SELECT 1; SELECT 2;");
 * for (ParseError error : tree.errors()) { ... }
 * </pre></blockquote>
 *
 * <p>A parser is immutable and thread-safe.
 */
@API(since = "0.1", status = API.Status.EXPERIMENTAL)
public class PgParser {
  private static final Logger LOGGER = PgToolsTrace.getParserTracer();

  /** Pools shared by parsers that do not supply their own executor, one
   * per parallelism. Threads are daemons and time out when idle, so the
   * pools never need to be shut down. */
  private static final LoadingCache<Integer, ExecutorService> POOLS =
      CacheBuilder.newBuilder().build(CacheLoader.from(PgParser::newPool));

  private static ExecutorService newPool(int parallelism) {
    final ThreadPoolExecutor pool =
        new ThreadPoolExecutor(parallelism, parallelism, 60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("pgtools-parser-" + parallelism + "-%d")
                .build());
    pool.allowCoreThreadTimeOut(true);
    return pool;
  }

  private final Config config;

  private PgParser(Config config) {
    this.config = config;
  }

  /** Creates a parser with the default configuration. */
  public static PgParser create() {
    return new PgParser(Config.DEFAULT);
  }

  /** Creates a parser with a given configuration. */
  public static PgParser create(Config config) {
    return new PgParser(requireNonNull(config, "config"));
  }

  /** Returns the default configuration. */
  public static Config config() {
    return Config.DEFAULT;
  }

  public Config getConfig() {
    return config;
  }

  /** Parses a document. */
  public SyntaxTree parse(String text) {
    return parse(text, new CancelFlag(new AtomicBoolean()));
  }

  /** Parses a document, abandoning the parse if a flag is set.
   *
   * @throws ParseCancelledException if the flag is set before the parse
   * completes */
  public SyntaxTree parse(String text, CancelFlag cancelFlag) {
    requireNonNull(text, "text");
    checkCancel(cancelFlag);
    final ImmutableList<Token> tokens = PgLexer.tokenize(text);
    final ImmutableList<StatementRange> ranges =
        StatementSplitter.split(tokens);
    LOGGER.trace("{} tokens, {} statements", tokens.size(), ranges.size());

    final ExecutorService executor = executor(ranges.size());
    final List<Future<StatementTree>> futures = new ArrayList<>();
    try {
      for (StatementRange range : ranges) {
        LOGGER.trace("dispatching {}", range);
        futures.add(
            executor.submit(() -> parseStatement(range, cancelFlag)));
      }
      final List<StatementTree> statements = new ArrayList<>();
      for (Future<StatementTree> future : futures) {
        statements.add(join(future));
      }
      checkCancel(cancelFlag);
      return assemble(text, tokens, ranges, statements);
    } finally {
      for (Future<StatementTree> future : futures) {
        future.cancel(false);
      }
    }
  }

  private ExecutorService executor(int statementCount) {
    final ExecutorService executor = config.executor();
    if (executor != null) {
      return executor;
    }
    if (config.parallelism() <= 1 || statementCount <= 1) {
      return MoreExecutors.newDirectExecutorService();
    }
    return POOLS.getUnchecked(config.parallelism());
  }

  private static StatementTree join(Future<StatementTree> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw RESOURCE.parseCancelled().ex(e);
    } catch (CancellationException e) {
      throw RESOURCE.parseCancelled().ex(e);
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof ParseCancelledException) {
        throw (ParseCancelledException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException(cause);
    }
  }

  /** Parses one statement. Runs on an executor thread. */
  private StatementTree parseStatement(StatementRange range,
      CancelFlag cancelFlag) {
    if (range.isEmptyStatement()) {
      return withLexicalErrors(range, TreeBuilder.empty(range));
    }
    checkCancel(cancelFlag);
    StructuralResult result;
    try {
      result = config.oracle().parse(range.oracleText());
    } catch (RuntimeException e) {
      LOGGER.warn("grammar oracle threw on {}", range, e);
      result = StructuralResult.failure(
          RESOURCE.oracleFailed(String.valueOf(e.getMessage())).str(), 0,
          null);
    }
    checkCancel(cancelFlag);
    final StatementTree tree;
    try {
      tree = TreeBuilder.build(range, result);
    } catch (RuntimeException e) {
      throw RESOURCE.statementParseFailed(range.index()).ex(e);
    }
    return withLexicalErrors(range, tree);
  }

  /** Adds errors for malformed tokens. Lexical errors are reported even if
   * the oracle accepted the statement. */
  private static StatementTree withLexicalErrors(StatementRange range,
      StatementTree tree) {
    List<ParseError> lexical = null;
    for (Token token : range.tokens()) {
      final ParseError error = ParseError.lexical(token, range.index());
      if (error != null) {
        if (lexical == null) {
          lexical = new ArrayList<>(tree.errors());
        }
        lexical.add(error);
      }
    }
    return lexical == null ? tree : TreeBuilder.withErrors(tree, lexical);
  }

  private SyntaxTree assemble(String text, List<Token> tokens,
      List<StatementRange> ranges, List<StatementTree> statements) {
    final SyntaxNode root = TreeBuilder.assemble(statements);
    final List<ParseError> errors = new ArrayList<>();
    for (StatementTree statement : statements) {
      errors.addAll(statement.errors());
    }
    Collections.sort(errors);
    final SyntaxTree tree = new SyntaxTree(text, root, tokens, ranges, errors);
    if (config.validate()) {
      tree.isValid(Litmus.THROW);
    }
    LOGGER.debug("parsed {} statements with {} errors", ranges.size(),
        errors.size());
    return tree;
  }

  private static void checkCancel(CancelFlag cancelFlag) {
    if (cancelFlag.isCancelRequested()) {
      throw RESOURCE.parseCancelled().ex();
    }
  }

  /** Configuration for a {@link PgParser}.
   *
   * <p>Immutable. Each {@code withXxx} method returns a copy with one
   * property changed. */
  public static final class Config {
    /** Default configuration: a caching oracle that tries Calcite, then
     * JSqlParser; parallelism and validation as set by
     * {@link PgToolsSystemProperty}. */
    public static final Config DEFAULT =
        new Config(defaultOracle(), null,
            PgToolsSystemProperty.PARSER_PARALLELISM.value(),
            PgToolsSystemProperty.DEBUG.value());

    private final GrammarOracle oracle;
    private final @Nullable ExecutorService executor;
    private final int parallelism;
    private final boolean validate;

    private Config(GrammarOracle oracle, @Nullable ExecutorService executor,
        int parallelism, boolean validate) {
      this.oracle = requireNonNull(oracle, "oracle");
      this.executor = executor;
      this.parallelism = parallelism;
      this.validate = validate;
    }

    private static GrammarOracle defaultOracle() {
      final GrammarOracle oracle = FallbackGrammarOracle.create();
      final int cacheSize = PgToolsSystemProperty.ORACLE_CACHE_SIZE.value();
      return cacheSize > 0
          ? new CachingGrammarOracle(oracle, cacheSize)
          : oracle;
    }

    public GrammarOracle oracle() {
      return oracle;
    }

    /** Returns the executor on which statements are parsed, or null to use
     * a shared pool of {@link #parallelism()} threads (or the calling
     * thread, if parallelism is 1). */
    public @Nullable ExecutorService executor() {
      return executor;
    }

    /** Returns the number of statements parsed at once when there is no
     * configured executor. */
    public int parallelism() {
      return parallelism;
    }

    /** Returns whether each tree is checked with
     * {@link SyntaxTree#isValid} before it is returned. */
    public boolean validate() {
      return validate;
    }

    public Config withOracle(GrammarOracle oracle) {
      return new Config(oracle, executor, parallelism, validate);
    }

    public Config withExecutor(@Nullable ExecutorService executor) {
      return new Config(oracle, executor, parallelism, validate);
    }

    public Config withParallelism(int parallelism) {
      if (parallelism < 1) {
        throw new IllegalArgumentException("parallelism must be positive: "
            + parallelism);
      }
      return new Config(oracle, executor, parallelism, validate);
    }

    public Config withValidate(boolean validate) {
      return new Config(oracle, executor, parallelism, validate);
    }
  }
}
