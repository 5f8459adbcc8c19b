/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

/**
 * Canonical error codes carried by every {@link StorageException}.
 *
 * <p>The first group describes failures detected by Tabula itself; the last three are raised when
 * the database engine rejects an operation and always carry the engine's own diagnostic.
 */
public enum ErrorCode {
  /** A read-one query matched no row. */
  NOT_FOUND,

  /** A value required to be non-null was absent. */
  VALUE_IS_NULL,

  /** A column referenced by a query or foreign key is not registered in the schema. */
  COLUMN_NOT_FOUND,

  /** No migration is registered for the current/target version pair. */
  MIGRATION_NOT_FOUND,

  /** The declared schema is inconsistent or an operation is impossible for a table's shape. */
  INVALID_SCHEMA,

  /** Generic engine failure (syntax error, I/O error, misuse). */
  ENGINE_ERROR,

  /** The engine rejected a write because of a constraint (unique, not null, foreign key, check). */
  CONSTRAINT_VIOLATION,

  /** The database file was busy or locked by another connection. */
  DATABASE_BUSY;

  /**
   * Whether this code reports a failure raised by the database engine.
   *
   * @return {@code true} for engine-originated codes
   */
  public boolean isEngineError() {
    return this == ENGINE_ERROR || this == CONSTRAINT_VIOLATION || this == DATABASE_BUSY;
  }
}
