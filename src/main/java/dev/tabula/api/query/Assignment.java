/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.Column;
import java.util.Objects;

/**
 * {@code column = value} inside the {@code SET} list of an {@code updateAll}.
 *
 * @param column target column; always rendered unqualified
 * @param value new value
 * @param <F> value type
 */
public record Assignment<F>(Column<?, F> column, Expression<F> value) {

  public Assignment {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
  }

  public static <F> Assignment<F> set(Column<?, F> column, F value) {
    return new Assignment<>(column, new Value<>(value, column.codec()));
  }

  public static <F> Assignment<F> set(Column<?, F> column, Expression<F> value) {
    return new Assignment<>(column, value);
  }
}
