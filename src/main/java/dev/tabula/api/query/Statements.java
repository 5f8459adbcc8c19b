/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.Column;
import java.util.Arrays;
import java.util.List;

/** Factories for {@link Statement}s, typically passed to {@code Storage.prepare}. */
public final class Statements {

  private Statements() {}

  public static <T> Statement<T> get(Class<T> type, Object... ids) {
    return new Statement.Get<>(type, Arrays.asList(ids), true);
  }

  public static <T> Statement<T> getOrNull(Class<T> type, Object... ids) {
    return new Statement.Get<>(type, Arrays.asList(ids), false);
  }

  public static <T> Statement<List<T>> getAll(Class<T> type, Clause... clauses) {
    return new Statement.GetAll<>(type, List.of(clauses));
  }

  public static <R> Statement<List<R>> select(Expression<R> expression, Clause... clauses) {
    return new Statement.Select<>(expression, List.of(clauses));
  }

  public static Statement<List<Tuple>> select(List<Expression<?>> expressions, Clause... clauses) {
    return new Statement.SelectTuples(expressions, List.of(clauses));
  }

  /** First value of {@code expression} over rows of {@code from}; for aggregates. */
  public static <R> Statement<R> value(Expression<R> expression, Class<?> from, Clause... clauses) {
    return new Statement.SelectValue<>(expression, from, List.of(clauses));
  }

  public static <T> Statement<Long> insert(T object) {
    return new Statement.Insert<>(typeOf(object), object);
  }

  public static <T> Statement<Long> insert(T object, List<Column<T, ?>> columns) {
    return new Statement.InsertColumns<>(typeOf(object), object, columns);
  }

  public static <T> Statement<Void> insertRange(Class<T> type, List<T> objects) {
    return new Statement.InsertRange<>(type, objects, false);
  }

  public static <T> Statement<Void> replace(T object) {
    return new Statement.Replace<>(typeOf(object), object);
  }

  public static <T> Statement<Void> replaceRange(Class<T> type, List<T> objects) {
    return new Statement.InsertRange<>(type, objects, true);
  }

  public static <T> Statement<Void> update(T object) {
    return new Statement.Update<>(typeOf(object), object);
  }

  public static Statement<Void> updateAll(List<Assignment<?>> assignments, Clause... clauses) {
    return new Statement.UpdateAll(assignments, List.of(clauses));
  }

  public static <T> Statement<Void> remove(Class<T> type, Object... ids) {
    return new Statement.Remove<>(type, Arrays.asList(ids));
  }

  public static <T> Statement<Void> removeAll(Class<T> type, Clause... clauses) {
    return new Statement.RemoveAll<>(type, List.of(clauses));
  }

  @SuppressWarnings("unchecked")
  private static <T> Class<T> typeOf(T object) {
    if (object == null) {
      throw new NullPointerException("object");
    }
    return (Class<T>) object.getClass();
  }
}
