/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.ValueCodec;
import java.util.List;

/**
 * A SQL function call such as {@code COUNT(*)} or {@code GROUP_CONCAT(name, ',')}.
 *
 * @param name function name as emitted
 * @param arguments arguments in order; empty with {@code star} for {@code COUNT(*)}
 * @param star emit {@code *} instead of arguments
 * @param codec codec of the result
 * @param <R> result type
 */
public record FunctionCall<R>(
    String name, List<Expression<?>> arguments, boolean star, ValueCodec<R> codec)
    implements Expression<R> {

  public FunctionCall {
    arguments = List.copyOf(arguments);
  }
}
