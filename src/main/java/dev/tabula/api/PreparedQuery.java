/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

import dev.tabula.api.query.Statement;

/**
 * A compiled statement bound to the storage's connection, reusable through {@link
 * Storage#execute(PreparedQuery)} until closed.
 *
 * <p>Parameters are re-read on every execution, so a prepared insert of an object picks up the
 * object's current field values. Holding an open query keeps the storage's connection open.
 *
 * @param <R> result type
 */
public interface PreparedQuery<R> extends AutoCloseable {
  /**
   * SQL text with one {@code ?} per parameter.
   *
   * @return compiled SQL
   */
  String sql();

  /**
   * Number of positional parameters bound per execution.
   *
   * @return parameter count
   */
  int parameterCount();

  /**
   * Description this query was compiled from.
   *
   * @return statement
   */
  Statement<R> statement();

  boolean isClosed();

  /** Finalizes the statement and releases the connection reference. Idempotent. */
  @Override
  void close();
}
