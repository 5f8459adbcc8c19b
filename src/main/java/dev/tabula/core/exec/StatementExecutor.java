/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import dev.tabula.api.query.Expression;
import dev.tabula.api.query.Statement;
import dev.tabula.api.query.Tuple;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one execution of a prepared query: bind, step, extract.
 *
 * <p>Reads step with {@link PreparedStatement#executeQuery()} and consume only the rows their
 * statement kind needs; writes step with {@link PreparedStatement#executeUpdate()}. Result sets are
 * closed on every path. Errors propagate unchanged and are never retried.
 */
public final class StatementExecutor {
  private final Schema schema;

  public StatementExecutor(Schema schema) {
    this.schema = schema;
  }

  @SuppressWarnings("unchecked")
  public <R> R execute(PreparedQueryImpl<R> query) throws SQLException {
    Statement<R> statement = query.statement();
    if (statement instanceof Statement.InsertColumns<?> insert) {
      requireNotNullValues(insert);
    }
    query.bind();
    PreparedStatement handle = query.handle();
    if (statement instanceof Statement.Get<?> get) {
      return (R) readOne(handle, schema.table(get.type()), get.required());
    }
    if (statement instanceof Statement.GetAll<?> getAll) {
      return (R) readAll(handle, schema.table(getAll.type()));
    }
    if (statement instanceof Statement.Select<?> select) {
      return (R) readValues(handle, select.expression());
    }
    if (statement instanceof Statement.SelectTuples select) {
      return (R) readTuples(handle, select.expressions());
    }
    if (statement instanceof Statement.SelectValue<?> select) {
      return (R) readFirstValue(handle, select.expression());
    }
    handle.executeUpdate();
    if (statement instanceof Statement.Insert<?> || statement instanceof Statement.InsertColumns<?>) {
      return (R) Long.valueOf(lastInsertRowid(query));
    }
    return null;
  }

  private static <T> T readOne(PreparedStatement handle, Table<T> table, boolean required)
      throws SQLException {
    try (ResultSet rows = handle.executeQuery()) {
      if (rows.next()) {
        return RowExtractor.object(table, rows);
      }
    }
    if (required) {
      throw new StorageException(ErrorCode.NOT_FOUND, "no row in " + table.name() + " for key");
    }
    return null;
  }

  private static <T> List<T> readAll(PreparedStatement handle, Table<T> table)
      throws SQLException {
    List<T> result = new ArrayList<>();
    try (ResultSet rows = handle.executeQuery()) {
      while (rows.next()) {
        result.add(RowExtractor.object(table, rows));
      }
    }
    return result;
  }

  private static <V> List<V> readValues(PreparedStatement handle, Expression<V> expression)
      throws SQLException {
    List<V> result = new ArrayList<>();
    try (ResultSet rows = handle.executeQuery()) {
      while (rows.next()) {
        result.add(RowExtractor.value(expression, rows, 1));
      }
    }
    return result;
  }

  private static List<Tuple> readTuples(
      PreparedStatement handle, List<Expression<?>> expressions) throws SQLException {
    List<Tuple> result = new ArrayList<>();
    try (ResultSet rows = handle.executeQuery()) {
      while (rows.next()) {
        result.add(RowExtractor.tuple(expressions, rows));
      }
    }
    return result;
  }

  private static <V> V readFirstValue(PreparedStatement handle, Expression<V> expression)
      throws SQLException {
    try (ResultSet rows = handle.executeQuery()) {
      if (rows.next()) {
        return RowExtractor.value(expression, rows, 1);
      }
      return null;
    }
  }

  private static long lastInsertRowid(PreparedQueryImpl<?> query) throws SQLException {
    try (java.sql.Statement statement = query.connection().createStatement();
        ResultSet rows = statement.executeQuery("SELECT last_insert_rowid()")) {
      return rows.next() ? rows.getLong(1) : 0L;
    }
  }

  private static <T> void requireNotNullValues(Statement.InsertColumns<T> insert) {
    for (Column<T, ?> column : insert.columns()) {
      if (column.isNotNull() && column.read(insert.object()) == null) {
        throw new StorageException(
            ErrorCode.VALUE_IS_NULL, "column " + column.name() + " is NOT NULL but value is null");
      }
    }
  }
}
