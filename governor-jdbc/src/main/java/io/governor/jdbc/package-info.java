/**
 * JDBC persistence for the governor.
 *
 * <p>Each store has an H2-compatible base class whose conditional writes rely on
 * rows-affected counts, and a PostgreSQL subclass that folds the write and the
 * read-back into one statement with {@code ON CONFLICT} / {@code RETURNING}.
 * {@link io.governor.jdbc.dialect.JdbcDialects} picks the right set from a JDBC URL.
 *
 * <p>Schemas ship as classpath resources {@code /schema/h2.sql} and
 * {@code /schema/postgresql.sql}.
 */
package io.governor.jdbc;
