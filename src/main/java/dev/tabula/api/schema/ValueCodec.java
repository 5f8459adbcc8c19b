/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Moves one Java value type across the JDBC boundary.
 *
 * <p>A codec knows the SQL storage type it declares in DDL, how to bind a value to a parameter
 * index, how to read it back from a result column, and how to render it as an inline SQL literal.
 * Codecs for primitive types read SQL {@code NULL} as the type's zero value; codecs for reference
 * types read it as {@code null}.
 *
 * @param <F> Java value type
 */
public interface ValueCodec<F> {
  /**
   * Declared SQL type used in {@code CREATE TABLE} and compared against the live schema.
   *
   * @return type name such as {@code INTEGER} or {@code TEXT}
   */
  String sqlType();

  /**
   * Java type handled by this codec.
   *
   * @return primitive or reference class
   */
  Class<F> javaType();

  /**
   * Whether the Java type is primitive and therefore cannot represent absence.
   *
   * @return {@code true} for primitive types
   */
  default boolean primitive() {
    return javaType().isPrimitive();
  }

  /**
   * Binds {@code value} at a 1-based parameter index.
   *
   * @param statement target statement
   * @param index parameter position, starting at 1
   * @param value value to bind; {@code null} binds SQL {@code NULL}
   * @throws SQLException if the driver rejects the value
   */
  void bind(PreparedStatement statement, int index, F value) throws SQLException;

  /**
   * Reads the value at a 1-based result column.
   *
   * @param rows cursor positioned on a row
   * @param index result column, starting at 1
   * @return decoded value
   * @throws SQLException if the driver cannot read the column
   */
  F read(ResultSet rows, int index) throws SQLException;

  /**
   * Renders {@code value} as a SQL literal for unparametrized dumps and {@code DEFAULT} clauses.
   *
   * @param value value, may be {@code null}
   * @return SQL literal text
   */
  String literal(F value);

  /**
   * Renders {@code value} for human-readable dumps.
   *
   * @param value value, may be {@code null}
   * @return printable text
   */
  default String print(F value) {
    return String.valueOf(value);
  }

  /**
   * Binds a value whose type was erased at the call site.
   *
   * @param statement target statement
   * @param index parameter position, starting at 1
   * @param value value produced for this codec's column
   * @throws SQLException if the driver rejects the value
   */
  @SuppressWarnings("unchecked")
  default void bindUnchecked(PreparedStatement statement, int index, Object value)
      throws SQLException {
    bind(statement, index, (F) value);
  }

  /**
   * Renders an erased value as a SQL literal.
   *
   * @param value value produced for this codec's column
   * @return SQL literal text
   */
  @SuppressWarnings("unchecked")
  default String literalUnchecked(Object value) {
    return literal((F) value);
  }

  /**
   * Prints an erased value.
   *
   * @param value value produced for this codec's column
   * @return printable text
   */
  @SuppressWarnings("unchecked")
  default String printUnchecked(Object value) {
    return print((F) value);
  }
}
