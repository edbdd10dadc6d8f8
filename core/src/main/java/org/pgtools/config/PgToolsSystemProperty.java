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
package org.pgtools.config;

import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A system property that configures the parsing layer.
 *
 * <p>Properties live in the "pgtools" root namespace. Values are read once,
 * from the JVM system properties merged with an optional
 * {@code pgtools.properties} file on the class path; system properties win.
 *
 * @param <T> the type of the property value
 */
public final class PgToolsSystemProperty<T> {
  private static final Properties PROPERTIES = loadProperties();

  /**
   * Whether to run in debug mode.
   *
   * <p>In debug mode every tree built by the parser is checked against the
   * tree invariants, and a violation throws.
   */
  public static final PgToolsSystemProperty<Boolean> DEBUG =
      booleanProperty("pgtools.debug", false);

  /**
   * Default number of threads used to send statements to the grammar
   * oracle; a parser configured with a different parallelism uses a pool of
   * that size instead.
   *
   * <p>The default is the number of available processors. A value of 1
   * parses statements on the calling thread.
   */
  public static final PgToolsSystemProperty<Integer> PARSER_PARALLELISM =
      intProperty("pgtools.parser.parallelism",
          Runtime.getRuntime().availableProcessors(), v -> v > 0);

  /**
   * Whether, when the grammar oracle rejects a statement in the middle, the
   * oracle is asked to parse the prefix before the offending token so that
   * the error node can carry some structure.
   */
  public static final PgToolsSystemProperty<Boolean> PARTIAL_RECOVERY =
      booleanProperty("pgtools.parser.partial.recovery", true);

  /**
   * Maximum number of statement texts whose oracle results are cached.
   * Zero disables the cache.
   */
  public static final PgToolsSystemProperty<Integer> ORACLE_CACHE_SIZE =
      intProperty("pgtools.parser.oracle.cache.size", 1_024, v -> v >= 0);

  private static PgToolsSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    // Note that "" -> true (convenient for command-lines flags like '-Dflag')
    return new PgToolsSystemProperty<>(key,
        v -> v == null ? defaultValue
            : "".equals(v) || Boolean.parseBoolean(v));
  }

  /**
   * Returns the value of the system property with the specified name as
   * {@code int}. If the property is not defined, cannot be parsed as an int,
   * or does not satisfy the checker, returns {@code defaultValue}.
   */
  private static PgToolsSystemProperty<Integer> intProperty(String key,
      int defaultValue, IntPredicate valueChecker) {
    return new PgToolsSystemProperty<>(key, v -> {
      if (v == null) {
        return defaultValue;
      }
      try {
        int intVal = Integer.parseInt(v.trim());
        return valueChecker.test(intVal) ? intVal : defaultValue;
      } catch (NumberFormatException nfe) {
        return defaultValue;
      }
    });
  }

  private static Properties loadProperties() {
    final Properties fileProperties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        PgToolsSystemProperty.class.getClassLoader());
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream("pgtools.properties")) {
      if (stream != null) {
        fileProperties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from pgtools.properties file",
          e);
    }

    final Properties allProperties = new Properties();
    Stream.concat(
        fileProperties.entrySet().stream(),
        System.getProperties().entrySet().stream())
        .forEach(prop -> {
          String key = (String) prop.getKey();
          if (key.startsWith("pgtools.")) {
            allProperties.setProperty(key, String.valueOf(prop.getValue()));
          }
        });
    return allProperties;
  }

  private final String key;
  private final T value;

  private PgToolsSystemProperty(String key,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.key = key;
    this.value = valueParser.apply(PROPERTIES.getProperty(key));
  }

  /** Returns the name of this property. */
  public String key() {
    return key;
  }

  /**
   * Returns the value of this property.
   *
   * @return the value of this property, or its default value if the
   * property is not set
   */
  public T value() {
    return value;
  }
}
