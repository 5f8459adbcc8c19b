/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

import dev.tabula.api.query.Assignment;
import dev.tabula.api.query.Clause;
import dev.tabula.api.query.Expression;
import dev.tabula.api.query.Statement;
import dev.tabula.api.query.Tuple;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ColumnInfo;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to one SQLite database described by a {@link dev.tabula.api.schema.Schema}.
 *
 * <p>Every operation runs synchronously on the calling thread over a single logical connection.
 * Failures surface as {@link StorageException}; engine failures carry one of {@link
 * ErrorCode#ENGINE_ERROR}, {@link ErrorCode#CONSTRAINT_VIOLATION} or {@link
 * ErrorCode#DATABASE_BUSY} together with the engine's message. Nothing is retried.
 */
public interface Storage extends AutoCloseable {

  // --- schema ---

  /**
   * Reconciles every declared table and index with the database.
   *
   * <p>Each table receives exactly one {@link SyncResult}. With {@code preserve} set, rows are
   * copied through a backup table whenever a table has to be rebuilt and preservation is possible.
   * Declared indexes are created if missing and reported as {@link SyncResult#ALREADY_IN_SYNC}.
   *
   * @param preserve keep existing rows across rebuilds where possible
   * @return outcome per table and index name, in declaration order
   */
  Map<String, SyncResult> syncSchema(boolean preserve);

  /** {@link #syncSchema(boolean)} without data preservation. */
  default Map<String, SyncResult> syncSchema() {
    return syncSchema(false);
  }

  /**
   * Computes what {@link #syncSchema(boolean)} would do without executing any DDL.
   *
   * @param preserve same meaning as for {@link #syncSchema(boolean)}
   * @return predicted outcome per table and index name
   */
  Map<String, SyncResult> syncSchemaSimulate(boolean preserve);

  /**
   * Checks whether a table exists in the database.
   *
   * @param tableName table name
   * @return {@code true} if present in {@code sqlite_master}
   */
  boolean tableExists(String tableName);

  /**
   * Live column descriptors of a table, read fresh from {@code PRAGMA table_xinfo}.
   *
   * @param tableName table name
   * @return columns in table order; empty if the table does not exist
   */
  List<ColumnInfo> tableInfo(String tableName);

  /**
   * Renames a table in the database with {@code ALTER TABLE ... RENAME TO}. The model is not
   * changed.
   */
  void renameTable(String from, String to);

  /**
   * Renames the table mapped to {@code type} in the model only; no SQL is executed.
   *
   * @param type mapped type
   * @param newName name used from now on in generated SQL
   */
  void renameTable(Class<?> type, String newName);

  String tableName(Class<?> type);

  /**
   * Name of a registered column.
   *
   * @param column column instance
   * @return name, or empty if the column is not registered in this storage's schema
   */
  Optional<String> findColumnName(Column<?, ?> column);

  // --- versioning ---

  /**
   * Registers the procedure that moves the database from version {@code from} to {@code to}. A
   * later registration for the same pair replaces the earlier one.
   */
  void registerMigration(int from, int to, Migration migration);

  /**
   * Runs the migration registered for {@code (userVersion(), targetVersion)} on one held
   * connection. The procedure is responsible for updating {@code PRAGMA user_version}.
   *
   * @param targetVersion version to reach in a single hop
   * @throws StorageException with {@link ErrorCode#MIGRATION_NOT_FOUND} if no procedure matches
   */
  void migrateTo(int targetVersion);

  /** Current {@code PRAGMA user_version}. */
  int userVersion();

  void setUserVersion(int version);

  /** SQLite library version, for example {@code 3.45.3}. */
  String engineVersion();

  // --- reads ---

  /**
   * Reads one object by primary key.
   *
   * @throws StorageException with {@link ErrorCode#NOT_FOUND} when no row matches
   */
  <T> T get(Class<T> type, Object... ids);

  <T> Optional<T> getOptional(Class<T> type, Object... ids);

  /** Reads one object by primary key, or {@code null} when no row matches. */
  <T> T getOrNull(Class<T> type, Object... ids);

  <T> List<T> getAll(Class<T> type, Clause... clauses);

  /**
   * Lazily iterates mapped rows. Close the cursor if iteration may stop early.
   *
   * @return open cursor
   */
  <T> RowCursor<T> iterate(Class<T> type, Clause... clauses);

  <R> List<R> select(Expression<R> expression, Clause... clauses);

  List<Tuple> select(List<Expression<?>> expressions, Clause... clauses);

  /** {@code COUNT(*)} over the table mapped to {@code type}. */
  long count(Class<?> type, Clause... clauses);

  /** {@code COUNT(expression)}: rows where the expression is not null. */
  long count(Expression<?> expression, Clause... clauses);

  /** {@code AVG(expression)}, {@code 0.0} when there is no non-null value. */
  double avg(Expression<?> expression, Clause... clauses);

  <F> Optional<F> max(Expression<F> expression, Clause... clauses);

  <F> Optional<F> min(Expression<F> expression, Clause... clauses);

  /** {@code SUM(expression)}, empty when there is no non-null value. */
  Optional<Double> sum(Expression<?> expression, Clause... clauses);

  /** {@code TOTAL(expression)}, {@code 0.0} when there is no non-null value. */
  double total(Expression<?> expression, Clause... clauses);

  Optional<String> groupConcat(Expression<?> expression, Clause... clauses);

  Optional<String> groupConcat(Expression<?> expression, String separator, Clause... clauses);

  // --- writes ---

  /**
   * Inserts {@code object}, letting the engine assign the key on rowid tables.
   *
   * @return rowid of the new row
   * @throws StorageException with {@link ErrorCode#INVALID_SCHEMA} if the table's key makes a plain
   *     insert ambiguous; use {@link #replace(Object)} or {@link #insert(Object, List)}
   */
  <T> long insert(T object);

  /**
   * Inserts exactly the listed columns of {@code object}.
   *
   * @return rowid of the new row
   * @throws StorageException with {@link ErrorCode#VALUE_IS_NULL} if a {@code NOT NULL} column
   *     holds {@code null}
   */
  <T> long insert(T object, List<Column<T, ?>> columns);

  /** Inserts all objects in one statement; an empty list does nothing. */
  <T> void insertRange(Class<T> type, List<T> objects);

  /** {@code REPLACE INTO} with every writable column, keys included. */
  <T> void replace(T object);

  <T> void replaceRange(Class<T> type, List<T> objects);

  /** Updates all non-key columns of the row identified by {@code object}'s key. */
  <T> void update(T object);

  void updateAll(List<Assignment<?>> assignments, Clause... clauses);

  <T> void remove(Class<T> type, Object... ids);

  <T> void removeAll(Class<T> type, Clause... clauses);

  /**
   * Checks whether any row of another table references {@code object} through a declared foreign
   * key.
   *
   * @throws StorageException with {@link ErrorCode#VALUE_IS_NULL} if a referenced value is null
   */
  <T> boolean hasDependentRows(T object);

  // --- debugging ---

  /** Renders {@code object} as {@code { column : 'value', ... }}. */
  <T> String dump(T object);

  /**
   * Renders the SQL of a statement.
   *
   * @param parametrized {@code true} for {@code ?} placeholders, {@code false} to inline literals
   */
  String dump(Statement<?> statement, boolean parametrized);

  /** SQL text of a prepared query. */
  String dump(PreparedQuery<?> query);

  // --- prepared statements ---

  /**
   * Compiles and prepares a statement for repeated execution.
   *
   * @return open prepared query; close it when done
   */
  <R> PreparedQuery<R> prepare(Statement<R> statement);

  /**
   * Binds, steps and extracts a prepared query.
   *
   * @throws IllegalStateException if the query was closed
   */
  <R> R execute(PreparedQuery<R> query);

  // --- transactions ---

  /**
   * Runs {@code work} inside a transaction on the held connection. Commits when it returns {@code
   * true}; rolls back when it returns {@code false} or throws.
   *
   * @return whether the transaction committed
   */
  boolean transaction(TransactionWork work);

  /** Releases the permanently held connection of in-memory databases. */
  @Override
  void close();
}
