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
package org.pgtools.lexer;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

import java.util.Locale;

/**
 * PostgreSQL key words, as listed in appendix C of the PostgreSQL manual.
 *
 * <p>The lexer classifies a word as {@link
 * org.pgtools.syntax.TokenKind#KEYWORD} if it appears here, whether or not
 * it is reserved. Reserved words are tracked separately because only they
 * can never be used as a bare column name.
 */
public abstract class PgKeywords {
  private PgKeywords() {}

  private static final ImmutableSet<String> RESERVED = words(
      "ALL ANALYSE ANALYZE AND ANY ARRAY AS ASC ASYMMETRIC BOTH CASE CAST "
      + "CHECK COLLATE COLUMN CONSTRAINT CREATE CURRENT_CATALOG CURRENT_DATE "
      + "CURRENT_ROLE CURRENT_TIME CURRENT_TIMESTAMP CURRENT_USER DEFAULT "
      + "DEFERRABLE DESC DISTINCT DO ELSE END EXCEPT FALSE FETCH FOR FOREIGN "
      + "FROM GRANT GROUP HAVING IN INITIALLY INTERSECT INTO LATERAL LEADING "
      + "LIMIT LOCALTIME LOCALTIMESTAMP NOT NULL OFFSET ON ONLY OR ORDER "
      + "PLACING PRIMARY REFERENCES RETURNING SELECT SESSION_USER SOME "
      + "SYMMETRIC SYSTEM_USER TABLE THEN TO TRAILING TRUE UNION UNIQUE USER "
      + "USING VARIADIC WHEN WHERE WINDOW WITH");

  private static final ImmutableSet<String> NON_RESERVED = words(
      "ABORT ABSENT ABSOLUTE ACCESS ACTION ADD ADMIN AFTER AGGREGATE ALSO "
      + "ALTER ALWAYS ASENSITIVE ASSERTION ASSIGNMENT AT ATOMIC ATTACH "
      + "ATTRIBUTE AUTHORIZATION BACKWARD BEFORE BEGIN BETWEEN BIGINT BINARY "
      + "BIT BOOLEAN BREADTH BY CACHE CALL CALLED CASCADE CASCADED CATALOG "
      + "CHAIN CHAR CHARACTER CHARACTERISTICS CHECKPOINT CLASS CLOSE CLUSTER "
      + "COALESCE COLLATION COLUMNS COMMENT COMMENTS COMMIT COMMITTED "
      + "COMPRESSION CONCURRENTLY CONDITIONAL CONFIGURATION CONFLICT "
      + "CONNECTION CONSTRAINTS CONTENT CONTINUE CONVERSION COPY COST CROSS "
      + "CSV CUBE CURRENT CURRENT_SCHEMA CURSOR CYCLE DATA DATABASE DAY "
      + "DEALLOCATE DEC DECIMAL DECLARE DEFAULTS DEFERRED DEFINER DELETE "
      + "DELIMITER DELIMITERS DEPENDS DEPTH DETACH DICTIONARY DISABLE DISCARD "
      + "DOCUMENT DOMAIN DOUBLE DROP EACH EMPTY ENABLE ENCODING ENCRYPTED "
      + "ENFORCED ENUM ERROR ESCAPE EVENT EXCLUDE EXCLUDING EXCLUSIVE EXECUTE "
      + "EXISTS EXPLAIN EXPRESSION EXTENSION EXTERNAL EXTRACT FAMILY FILTER "
      + "FINALIZE FIRST FLOAT FOLLOWING FORCE FORMAT FORWARD FREEZE FULL "
      + "FUNCTION FUNCTIONS GENERATED GLOBAL GRANTED GREATEST GROUPING GROUPS "
      + "HANDLER HEADER HOLD HOUR IDENTITY IF ILIKE IMMEDIATE IMMUTABLE "
      + "IMPLICIT IMPORT INCLUDE INCLUDING INCREMENT INDENT INDEX INDEXES "
      + "INHERIT INHERITS INLINE INNER INOUT INPUT INSENSITIVE INSERT INSTEAD "
      + "INT INTEGER INTERVAL INVOKER IS ISNULL ISOLATION JOIN JSON "
      + "JSON_ARRAY JSON_ARRAYAGG JSON_EXISTS JSON_OBJECT JSON_OBJECTAGG "
      + "JSON_QUERY JSON_SCALAR JSON_SERIALIZE JSON_TABLE JSON_VALUE KEEP KEY "
      + "KEYS LABEL LANGUAGE LARGE LAST LEAKPROOF LEAST LEFT LEVEL LIKE "
      + "LISTEN LOAD LOCAL LOCATION LOCK LOCKED LOGGED MAPPING MATCH MATCHED "
      + "MATERIALIZED MAXVALUE MERGE MERGE_ACTION METHOD MINUTE MINVALUE MODE "
      + "MONTH MOVE NAME NAMES NATIONAL NATURAL NCHAR NESTED NEW NEXT NFC "
      + "NFD NFKC NFKD NO NONE NORMALIZE NORMALIZED NOTHING NOTIFY NOTNULL "
      + "NOWAIT NULLIF NULLS NUMERIC OBJECT OBJECTS OF OFF OIDS OLD OMIT "
      + "OPERATOR OPTION OPTIONS ORDINALITY OTHERS OUT OUTER OVER OVERLAPS "
      + "OVERLAY OVERRIDING OWNED OWNER PARALLEL PARAMETER PARSER PARTIAL "
      + "PARTITION PASSING PASSWORD PATH PERIOD PLAN PLANS POLICY POSITION "
      + "PRECEDING PRECISION PREPARE PREPARED PRESERVE PRIOR PRIVILEGES "
      + "PROCEDURAL PROCEDURE PROCEDURES PROGRAM PUBLICATION QUOTE QUOTES "
      + "RANGE READ REAL REASSIGN RECURSIVE REF REFERENCING REFRESH REINDEX "
      + "RELATIVE RELEASE RENAME REPEATABLE REPLACE REPLICA RESET RESTART "
      + "RESTRICT RETURN RETURNS REVOKE RIGHT ROLE ROLLBACK ROLLUP ROUTINE "
      + "ROUTINES ROW ROWS RULE SAVEPOINT SCALAR SCHEMA SCHEMAS SCROLL SEARCH "
      + "SECOND SECURITY SEQUENCE SEQUENCES SERIALIZABLE SERVER SESSION SET "
      + "SETOF SETS SHARE SHOW SIMILAR SIMPLE SKIP SMALLINT SNAPSHOT SOURCE "
      + "SQL STABLE STANDALONE START STATEMENT STATISTICS STDIN STDOUT "
      + "STORAGE STORED STRICT STRING STRIP SUBSCRIPTION SUBSTRING SUPPORT "
      + "SYSID SYSTEM TABLES TABLESAMPLE TABLESPACE TARGET TEMP TEMPLATE "
      + "TEMPORARY TEXT TIES TIME TIMESTAMP TRANSACTION TRANSFORM TREAT "
      + "TRIGGER TRIM TRUNCATE TRUSTED TYPE TYPES UESCAPE UNBOUNDED "
      + "UNCOMMITTED UNCONDITIONAL UNENCRYPTED UNKNOWN UNLISTEN UNLOGGED "
      + "UNTIL UPDATE VACUUM VALID VALIDATE VALIDATOR VALUE VALUES VARCHAR "
      + "VARYING VERBOSE VERSION VIEW VIEWS VIRTUAL VOLATILE WHITESPACE "
      + "WITHIN WITHOUT WORK WRAPPER WRITE XML XMLATTRIBUTES XMLCONCAT "
      + "XMLELEMENT XMLEXISTS XMLFOREST XMLNAMESPACES XMLPARSE XMLPI "
      + "XMLROOT XMLSERIALIZE XMLTABLE YEAR YES ZONE");

  private static final ImmutableSet<String> ALL =
      ImmutableSet.<String>builder().addAll(RESERVED).addAll(NON_RESERVED)
          .build();

  private static ImmutableSet<String> words(String s) {
    return ImmutableSet.copyOf(
        Splitter.on(' ').omitEmptyStrings().split(s));
  }

  /** Returns whether a word is a PostgreSQL key word, ignoring case. */
  public static boolean isKeyword(String word) {
    return ALL.contains(word.toUpperCase(Locale.ROOT));
  }

  /** Returns whether a word is a reserved PostgreSQL key word, ignoring
   * case. */
  public static boolean isReserved(String word) {
    return RESERVED.contains(word.toUpperCase(Locale.ROOT));
  }
}
