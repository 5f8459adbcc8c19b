/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import java.util.List;

/**
 * A boolean predicate used by {@code WHERE} and {@code HAVING}. Build instances with {@link
 * Conditions}.
 */
public interface Condition {

  /** {@code left <op> right}. */
  record Binary(Expression<?> left, String operator, Expression<?> right) implements Condition {}

  /** {@code left [NOT] IN (values...)}. */
  record In(Expression<?> left, List<Expression<?>> values, boolean negated)
      implements Condition {
    public In {
      values = List.copyOf(values);
    }
  }

  /** {@code operand IS [NOT] NULL}. */
  record NullCheck(Expression<?> operand, boolean negated) implements Condition {}

  /** {@code NOT (inner)}. */
  record Not(Condition inner) implements Condition {}

  /** {@code (left) AND|OR (right)}. */
  record Logical(Condition left, String operator, Condition right) implements Condition {}
}
