/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ValueCodec;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * One positional parameter of a compiled statement. The value is read when the slot is bound, not
 * when it is compiled, so re-executing a prepared statement sees current object state.
 */
public interface ParameterSlot {

  Object value();

  ValueCodec<?> codec();

  default void bind(PreparedStatement statement, int index) throws SQLException {
    codec().bindUnchecked(statement, index, value());
  }

  default String literal() {
    return codec().literalUnchecked(value());
  }

  static ParameterSlot constant(Object value, ValueCodec<?> codec) {
    Object coerced = Values.coerce(value, codec.javaType());
    return new ParameterSlot() {
      @Override
      public Object value() {
        return coerced;
      }

      @Override
      public ValueCodec<?> codec() {
        return codec;
      }

      @Override
      public String toString() {
        return "const(" + coerced + ")";
      }
    };
  }

  static <T> ParameterSlot field(T object, Column<T, ?> column) {
    return new ParameterSlot() {
      @Override
      public Object value() {
        return column.read(object);
      }

      @Override
      public ValueCodec<?> codec() {
        return column.codec();
      }

      @Override
      public String toString() {
        return "field(" + column.name() + ")";
      }
    };
  }
}
