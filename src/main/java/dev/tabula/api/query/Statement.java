/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.Column;
import java.util.List;
import java.util.Objects;

/**
 * Structured description of one SQL statement. Compiled by the storage into SQL text with
 * positional parameters, see {@code Storage.prepare}. Build instances with {@link Statements}.
 *
 * @param <R> Java type produced by executing the statement
 */
public interface Statement<R> {

  /** Read one row by primary key. {@code required} turns a miss into {@code NOT_FOUND}. */
  record Get<T>(Class<T> type, List<Object> ids, boolean required) implements Statement<T> {
    public Get {
      Objects.requireNonNull(type, "type");
      ids = List.copyOf(ids);
    }
  }

  record GetAll<T>(Class<T> type, List<Clause> clauses) implements Statement<List<T>> {
    public GetAll {
      Objects.requireNonNull(type, "type");
      clauses = List.copyOf(clauses);
    }
  }

  /** Single-expression select; one element per row. */
  record Select<R>(Expression<R> expression, List<Clause> clauses)
      implements Statement<List<R>> {
    public Select {
      Objects.requireNonNull(expression, "expression");
      clauses = List.copyOf(clauses);
    }
  }

  /** Multi-expression select; one {@link Tuple} per row. */
  record SelectTuples(List<Expression<?>> expressions, List<Clause> clauses)
      implements Statement<List<Tuple>> {
    public SelectTuples {
      if (expressions == null || expressions.isEmpty()) {
        throw new IllegalArgumentException("select needs at least one expression");
      }
      expressions = List.copyOf(expressions);
      clauses = List.copyOf(clauses);
    }
  }

  /**
   * Select producing the first row's single value, or {@code null} when there is no row.
   *
   * @param from table to select from when {@code expression} references no column (such as {@code
   *     COUNT(*)}); may be {@code null}
   */
  record SelectValue<R>(Expression<R> expression, Class<?> from, List<Clause> clauses)
      implements Statement<R> {
    public SelectValue {
      Objects.requireNonNull(expression, "expression");
      clauses = List.copyOf(clauses);
    }
  }

  /** Plain insert; produces the new rowid. */
  record Insert<T>(Class<T> type, T object) implements Statement<Long> {
    public Insert {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(object, "object");
    }
  }

  /** Insert binding exactly {@code columns}; produces the new rowid. */
  record InsertColumns<T>(Class<T> type, T object, List<Column<T, ?>> columns)
      implements Statement<Long> {
    public InsertColumns {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(object, "object");
      if (columns == null || columns.isEmpty()) {
        throw new IllegalArgumentException("explicit insert needs at least one column");
      }
      columns = List.copyOf(columns);
    }
  }

  /** Multi-row insert, or {@code REPLACE} when {@code replace} is set. */
  record InsertRange<T>(Class<T> type, List<T> objects, boolean replace)
      implements Statement<Void> {
    public InsertRange {
      Objects.requireNonNull(type, "type");
      objects = List.copyOf(objects);
    }
  }

  /** {@code REPLACE INTO} with every writable column. */
  record Replace<T>(Class<T> type, T object) implements Statement<Void> {
    public Replace {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(object, "object");
    }
  }

  record Update<T>(Class<T> type, T object) implements Statement<Void> {
    public Update {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(object, "object");
    }
  }

  record UpdateAll(List<Assignment<?>> assignments, List<Clause> clauses)
      implements Statement<Void> {
    public UpdateAll {
      if (assignments == null || assignments.isEmpty()) {
        throw new IllegalArgumentException("update needs at least one assignment");
      }
      assignments = List.copyOf(assignments);
      clauses = List.copyOf(clauses);
    }
  }

  record Remove<T>(Class<T> type, List<Object> ids) implements Statement<Void> {
    public Remove {
      Objects.requireNonNull(type, "type");
      ids = List.copyOf(ids);
    }
  }

  record RemoveAll<T>(Class<T> type, List<Clause> clauses) implements Statement<Void> {
    public RemoveAll {
      Objects.requireNonNull(type, "type");
      clauses = List.copyOf(clauses);
    }
  }
}
