/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import java.util.List;

/** Factories for {@link Clause}s. */
public final class Clauses {

  private Clauses() {}

  public static Clause.Where where(Condition condition) {
    return new Clause.Where(condition);
  }

  public static Clause.OrderBy orderBy(Expression<?> expression) {
    return new Clause.OrderBy(expression, false);
  }

  public static Clause.GroupBy groupBy(Expression<?>... expressions) {
    return new Clause.GroupBy(List.of(expressions), null);
  }

  public static Clause.Limit limit(long count) {
    return new Clause.Limit(count, null);
  }

  public static Clause.Limit limit(long count, long offset) {
    return new Clause.Limit(count, offset);
  }
}
