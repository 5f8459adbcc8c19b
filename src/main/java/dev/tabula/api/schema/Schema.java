/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The declared model: ordered tables plus indexes.
 *
 * <p>Every {@link Column} instance belongs to exactly one table, which lets statements resolve the
 * owning table of any column they reference.
 */
public final class Schema {
  private final List<Table<?>> tables;
  private final List<Index> indexes;
  private final Map<Class<?>, Table<?>> byType;
  private final Map<Column<?, ?>, Table<?>> byColumn;

  private Schema(
      List<Table<?>> tables,
      List<Index> indexes,
      Map<Class<?>, Table<?>> byType,
      Map<Column<?, ?>, Table<?>> byColumn) {
    this.tables = List.copyOf(tables);
    this.indexes = List.copyOf(indexes);
    this.byType = byType;
    this.byColumn = byColumn;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Table<?>> tables() {
    return tables;
  }

  public List<Index> indexes() {
    return indexes;
  }

  /**
   * Table mapped to {@code type}.
   *
   * @throws StorageException with {@link ErrorCode#INVALID_SCHEMA} if the type is not mapped
   */
  @SuppressWarnings("unchecked")
  public <T> Table<T> table(Class<T> type) {
    Table<?> table = byType.get(type);
    if (table == null) {
      throw new StorageException(
          ErrorCode.INVALID_SCHEMA, "type is not mapped: " + (type == null ? null : type.getName()));
    }
    return (Table<T>) table;
  }

  public Optional<Table<?>> tableNamed(String name) {
    for (Table<?> table : tables) {
      if (table.name().equalsIgnoreCase(name)) {
        return Optional.of(table);
      }
    }
    return Optional.empty();
  }

  /** Table owning this exact column instance. */
  public Optional<Table<?>> tableOf(Column<?, ?> column) {
    return Optional.ofNullable(byColumn.get(column));
  }

  /** Assembles a schema and checks cross-table references. */
  public static final class Builder {
    private final List<Table<?>> tables = new ArrayList<>();
    private final List<Index> indexes = new ArrayList<>();

    private Builder() {}

    public Builder table(Table<?> table) {
      tables.add(Objects.requireNonNull(table, "table"));
      return this;
    }

    public Builder index(Index index) {
      indexes.add(Objects.requireNonNull(index, "index"));
      return this;
    }

    /**
     * Validates and freezes the schema.
     *
     * @return schema
     * @throws StorageException with {@link ErrorCode#INVALID_SCHEMA} on duplicate or dangling
     *     references
     */
    public Schema build() {
      Map<Class<?>, Table<?>> byType = new HashMap<>();
      Map<Column<?, ?>, Table<?>> byColumn = new IdentityHashMap<>();
      Set<String> names = new HashSet<>();
      for (Table<?> table : tables) {
        if (!names.add(table.name().toLowerCase(Locale.ROOT))) {
          throw invalid("duplicate table " + table.name());
        }
        if (byType.put(table.type(), table) != null) {
          throw invalid("type " + table.type().getName() + " is mapped twice");
        }
        for (Column<?, ?> column : table.columns()) {
          Table<?> previous = byColumn.put(column, table);
          if (previous != null) {
            throw invalid(
                "column " + column.name() + " is registered in " + previous.name() + " and "
                    + table.name());
          }
        }
      }
      for (Table<?> table : tables) {
        for (ForeignKey<?> foreignKey : table.foreignKeys()) {
          Table<?> target = null;
          for (Column<?, ?> reference : foreignKey.references()) {
            Table<?> owner = byColumn.get(reference);
            if (owner == null) {
              throw invalid(
                  "foreign key of " + table.name() + " references unmapped column "
                      + reference.name());
            }
            if (target != null && target != owner) {
              throw invalid("foreign key of " + table.name() + " references several tables");
            }
            target = owner;
          }
        }
      }
      Set<String> indexNames = new HashSet<>();
      for (Index index : indexes) {
        if (!indexNames.add(index.name().toLowerCase(Locale.ROOT))) {
          throw invalid("duplicate index " + index.name());
        }
        Table<?> owner = null;
        for (Column<?, ?> column : index.columns()) {
          Table<?> table = byColumn.get(column);
          if (table == null) {
            throw invalid("index " + index.name() + " uses unmapped column " + column.name());
          }
          if (owner != null && owner != table) {
            throw invalid("index " + index.name() + " spans several tables");
          }
          owner = table;
        }
      }
      return new Schema(tables, indexes, byType, byColumn);
    }

    private static StorageException invalid(String message) {
      return new StorageException(ErrorCode.INVALID_SCHEMA, message);
    }
  }
}
