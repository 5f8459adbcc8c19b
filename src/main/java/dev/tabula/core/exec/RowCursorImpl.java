/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import dev.tabula.api.RowCursor;
import dev.tabula.api.schema.Table;
import dev.tabula.core.SqlErrorCodes;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.NoSuchElementException;

/** Streams mapped rows from an open query; owns and finalizes it. */
public final class RowCursorImpl<T> implements RowCursor<T> {
  private final Table<T> table;
  private final PreparedQueryImpl<?> query;
  private final ResultSet rows;
  private boolean fetched;
  private boolean hasRow;
  private boolean closed;

  private RowCursorImpl(Table<T> table, PreparedQueryImpl<?> query, ResultSet rows) {
    this.table = table;
    this.query = query;
    this.rows = rows;
  }

  /**
   * Binds and starts {@code query}. The cursor takes ownership; the query is closed on failure.
   *
   * @param table table whose columns the query selects
   * @param query prepared select
   * @return open cursor
   * @throws SQLException if binding or stepping fails
   */
  public static <T> RowCursorImpl<T> open(Table<T> table, PreparedQueryImpl<?> query)
      throws SQLException {
    try {
      query.bind();
      return new RowCursorImpl<>(table, query, query.handle().executeQuery());
    } catch (SQLException | RuntimeException e) {
      query.close();
      throw e;
    }
  }

  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    if (!fetched) {
      try {
        hasRow = rows.next();
      } catch (SQLException e) {
        close();
        throw SqlErrorCodes.translate("iterate", e);
      }
      fetched = true;
      if (!hasRow) {
        close();
      }
    }
    return hasRow;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    fetched = false;
    try {
      return RowExtractor.object(table, rows);
    } catch (SQLException e) {
      close();
      throw SqlErrorCodes.translate("iterate", e);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      rows.close();
    } catch (SQLException e) {
      throw SqlErrorCodes.translate("iterate.close", e);
    } finally {
      query.close();
    }
  }
}
