/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.ValueCodecs;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Factories for {@link Condition}s.
 *
 * <p>Constant operands become {@link Value} nodes bound with the codec of the expression they are
 * compared against.
 */
public final class Conditions {

  private Conditions() {}

  public static <F> Condition eq(Expression<F> left, F value) {
    return binary(left, "=", value);
  }

  public static <F> Condition eq(Expression<F> left, Expression<F> right) {
    return new Condition.Binary(left, "=", right);
  }

  public static <F> Condition ne(Expression<F> left, F value) {
    return binary(left, "!=", value);
  }

  public static <F> Condition ne(Expression<F> left, Expression<F> right) {
    return new Condition.Binary(left, "!=", right);
  }

  public static <F> Condition lt(Expression<F> left, F value) {
    return binary(left, "<", value);
  }

  public static <F> Condition le(Expression<F> left, F value) {
    return binary(left, "<=", value);
  }

  public static <F> Condition gt(Expression<F> left, F value) {
    return binary(left, ">", value);
  }

  public static <F> Condition ge(Expression<F> left, F value) {
    return binary(left, ">=", value);
  }

  public static Condition like(Expression<String> left, String pattern) {
    return new Condition.Binary(left, "LIKE", new Value<>(pattern, ValueCodecs.STRING));
  }

  public static <F> Condition in(Expression<F> left, Collection<? extends F> values) {
    return new Condition.In(left, values(left, values), false);
  }

  public static <F> Condition notIn(Expression<F> left, Collection<? extends F> values) {
    return new Condition.In(left, values(left, values), true);
  }

  public static Condition isNull(Expression<?> operand) {
    return new Condition.NullCheck(Objects.requireNonNull(operand, "operand"), false);
  }

  public static Condition isNotNull(Expression<?> operand) {
    return new Condition.NullCheck(Objects.requireNonNull(operand, "operand"), true);
  }

  public static Condition and(Condition left, Condition right) {
    return new Condition.Logical(left, "AND", right);
  }

  public static Condition or(Condition left, Condition right) {
    return new Condition.Logical(left, "OR", right);
  }

  public static Condition not(Condition inner) {
    return new Condition.Not(Objects.requireNonNull(inner, "inner"));
  }

  /** Constant operand bound with the codec of {@code like}. */
  public static <F> Value<F> value(Expression<F> like, F value) {
    return new Value<>(value, like.codec());
  }

  private static <F> Condition binary(Expression<F> left, String operator, F value) {
    Objects.requireNonNull(left, "left");
    return new Condition.Binary(left, operator, new Value<>(value, left.codec()));
  }

  private static <F> List<Expression<?>> values(
      Expression<F> left, Collection<? extends F> values) {
    Objects.requireNonNull(left, "left");
    List<Expression<?>> result = new ArrayList<>(values.size());
    for (F value : values) {
      result.add(new Value<>(value, left.codec()));
    }
    return result;
  }
}
