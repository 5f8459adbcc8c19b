/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import dev.tabula.api.query.Expression;
import dev.tabula.api.query.Tuple;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.Table;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Rebuilds typed results from the current row of a {@link ResultSet}. */
public final class RowExtractor {

  private RowExtractor() {}

  /**
   * Builds an object from a row selected with the table's columns in declaration order.
   *
   * @param table mapped table
   * @param rows cursor positioned on a row
   * @return new instance with every column written
   * @throws SQLException if a column cannot be read
   */
  public static <T> T object(Table<T> table, ResultSet rows) throws SQLException {
    T object = table.newInstance();
    List<Column<T, ?>> columns = table.columns();
    for (int i = 0; i < columns.size(); i++) {
      readInto(object, columns.get(i), rows, i + 1);
    }
    return object;
  }

  /** Reads a single value at a 1-based result column. */
  public static <R> R value(Expression<R> expression, ResultSet rows, int index)
      throws SQLException {
    return expression.codec().read(rows, index);
  }

  public static Tuple tuple(List<Expression<?>> expressions, ResultSet rows) throws SQLException {
    List<Object> values = new ArrayList<>(expressions.size());
    for (int i = 0; i < expressions.size(); i++) {
      values.add(value(expressions.get(i), rows, i + 1));
    }
    return new Tuple(values);
  }

  private static <T, F> void readInto(T object, Column<T, F> column, ResultSet rows, int index)
      throws SQLException {
    column.write(object, column.codec().read(rows, index));
  }
}
