/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.ValueCodec;

/**
 * A value-producing node in a statement description: a column, a bound value, or a function call.
 *
 * @param <R> Java type of the produced value
 */
public interface Expression<R> {
  /**
   * Codec used to bind or read values of this expression.
   *
   * @return codec for {@code R}
   */
  ValueCodec<R> codec();
}
