/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import java.util.List;
import java.util.Objects;

/**
 * A named index over columns of one table, created with {@code CREATE [UNIQUE] INDEX IF NOT
 * EXISTS} during schema sync.
 *
 * @param name index name
 * @param unique whether the index enforces uniqueness
 * @param columns indexed columns, all from the same table
 */
public record Index(String name, boolean unique, List<Column<?, ?>> columns) {

  public Index {
    Objects.requireNonNull(name, "name");
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("index " + name + " needs at least one column");
    }
    columns = List.copyOf(columns);
  }

  public static Index on(String name, Column<?, ?>... columns) {
    return new Index(name, false, List.of(columns));
  }

  public static Index uniqueOn(String name, Column<?, ?>... columns) {
    return new Index(name, true, List.of(columns));
  }
}
