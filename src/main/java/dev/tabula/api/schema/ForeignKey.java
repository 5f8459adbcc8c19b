/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import java.util.List;
import java.util.Objects;

/**
 * {@code FOREIGN KEY (columns) REFERENCES target (references)} declared on the table owning {@code
 * columns}.
 *
 * @param <T> owning object type
 */
public final class ForeignKey<T> {
  private final List<Column<T, ?>> columns;
  private final List<Column<?, ?>> references;
  private final Action onDelete;
  private final Action onUpdate;

  private ForeignKey(
      List<Column<T, ?>> columns, List<Column<?, ?>> references, Action onDelete, Action onUpdate) {
    this.columns = List.copyOf(columns);
    this.references = List.copyOf(references);
    this.onDelete = onDelete;
    this.onUpdate = onUpdate;
  }

  /**
   * Single-column key; the value types of both sides must agree.
   *
   * @param column referencing column of the owning table
   * @param target referenced column
   * @return foreign key without actions
   */
  public static <T, F> ForeignKey<T> of(Column<T, F> column, Column<?, F> target) {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(target, "target");
    return new ForeignKey<>(List.of(column), List.of(target), Action.NO_ACTION, Action.NO_ACTION);
  }

  /**
   * Multi-column key.
   *
   * @param columns referencing columns of the owning table
   * @param references referenced columns, same length and order
   * @return foreign key without actions
   */
  public static <T> ForeignKey<T> of(List<Column<T, ?>> columns, List<Column<?, ?>> references) {
    if (columns.isEmpty() || columns.size() != references.size()) {
      throw new IllegalArgumentException("foreign key needs matching, non-empty column lists");
    }
    return new ForeignKey<>(columns, references, Action.NO_ACTION, Action.NO_ACTION);
  }

  public ForeignKey<T> onDelete(Action action) {
    return new ForeignKey<>(columns, references, Objects.requireNonNull(action), onUpdate);
  }

  public ForeignKey<T> onUpdate(Action action) {
    return new ForeignKey<>(columns, references, onDelete, Objects.requireNonNull(action));
  }

  public List<Column<T, ?>> columns() {
    return columns;
  }

  public List<Column<?, ?>> references() {
    return references;
  }

  public Action onDelete() {
    return onDelete;
  }

  public Action onUpdate() {
    return onUpdate;
  }

  /** Referential action. */
  public enum Action {
    NO_ACTION("NO ACTION"),
    RESTRICT("RESTRICT"),
    SET_NULL("SET NULL"),
    SET_DEFAULT("SET DEFAULT"),
    CASCADE("CASCADE");

    private final String sql;

    Action(String sql) {
      this.sql = sql;
    }

    public String sql() {
      return sql;
    }
  }
}
