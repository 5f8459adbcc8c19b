/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.ValueCodecs;
import java.util.List;

/** Aggregate function calls. Results that can be {@code NULL} read through nullable codecs. */
public final class Aggregates {

  private Aggregates() {}

  /** {@code COUNT(*)}. */
  public static FunctionCall<Long> count() {
    return new FunctionCall<>("COUNT", List.of(), true, ValueCodecs.LONG);
  }

  /** {@code COUNT(expression)}: non-null values only. */
  public static FunctionCall<Long> count(Expression<?> expression) {
    return new FunctionCall<>("COUNT", List.of(expression), false, ValueCodecs.LONG);
  }

  public static FunctionCall<Double> avg(Expression<?> expression) {
    return new FunctionCall<>("AVG", List.of(expression), false, ValueCodecs.DOUBLE);
  }

  public static <F> FunctionCall<F> max(Expression<F> expression) {
    return new FunctionCall<>(
        "MAX", List.of(expression), false, ValueCodecs.nullable(expression.codec()));
  }

  public static <F> FunctionCall<F> min(Expression<F> expression) {
    return new FunctionCall<>(
        "MIN", List.of(expression), false, ValueCodecs.nullable(expression.codec()));
  }

  /** {@code SUM(expression)}; {@code NULL} over an empty set. */
  public static FunctionCall<Double> sum(Expression<?> expression) {
    return new FunctionCall<>("SUM", List.of(expression), false, ValueCodecs.DOUBLE);
  }

  /** {@code TOTAL(expression)}; {@code 0.0} over an empty set. */
  public static FunctionCall<Double> total(Expression<?> expression) {
    return new FunctionCall<>("TOTAL", List.of(expression), false, ValueCodecs.DOUBLE);
  }

  public static FunctionCall<String> groupConcat(Expression<?> expression) {
    return new FunctionCall<>("GROUP_CONCAT", List.of(expression), false, ValueCodecs.STRING);
  }

  public static FunctionCall<String> groupConcat(Expression<?> expression, String separator) {
    return new FunctionCall<>(
        "GROUP_CONCAT",
        List.of(expression, new Value<>(separator, ValueCodecs.STRING)),
        false,
        ValueCodecs.STRING);
  }
}
