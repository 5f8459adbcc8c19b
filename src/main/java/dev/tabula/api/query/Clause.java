/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import java.util.List;
import java.util.Objects;

/**
 * A trailing clause of a select, update or delete. Build instances with {@link Clauses}.
 *
 * <p>Clauses are always emitted in the order {@code WHERE, GROUP BY, HAVING, ORDER BY, LIMIT,
 * OFFSET}, whatever order they are passed in. At most one {@code Where}, {@code GroupBy} and {@code
 * Limit} may appear; several {@code OrderBy} terms are joined in the order given.
 */
public interface Clause {

  record Where(Condition condition) implements Clause {
    public Where {
      Objects.requireNonNull(condition, "condition");
    }
  }

  record OrderBy(Expression<?> expression, boolean descending) implements Clause {
    public OrderBy {
      Objects.requireNonNull(expression, "expression");
    }

    public OrderBy desc() {
      return new OrderBy(expression, true);
    }

    public OrderBy asc() {
      return new OrderBy(expression, false);
    }
  }

  record GroupBy(List<Expression<?>> expressions, Condition having) implements Clause {
    public GroupBy {
      if (expressions == null || expressions.isEmpty()) {
        throw new IllegalArgumentException("GROUP BY needs at least one expression");
      }
      expressions = List.copyOf(expressions);
    }

    public GroupBy having(Condition condition) {
      return new GroupBy(expressions, Objects.requireNonNull(condition, "condition"));
    }
  }

  /** {@code LIMIT count [OFFSET offset]}; both values are bound as parameters. */
  record Limit(long count, Long offset) implements Clause {}
}
