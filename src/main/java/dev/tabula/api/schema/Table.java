/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps one Java type onto one SQLite table.
 *
 * <p>Tables are validated once by {@link Builder#build()}. Apart from {@link #renameTo(String)},
 * which only changes the name Tabula uses in generated SQL, a built table is immutable.
 *
 * @param <T> mapped object type
 */
public final class Table<T> {
  private volatile String name;
  private final Class<T> type;
  private final Supplier<T> factory;
  private final List<Column<T, ?>> columns;
  private final List<Column<T, ?>> primaryKey;
  private final boolean compositeKey;
  private final List<ForeignKey<T>> foreignKeys;
  private final boolean withoutRowid;
  private final String insertRestriction;

  private Table(Builder<T> builder, List<Column<T, ?>> primaryKey, String insertRestriction) {
    this.name = builder.name;
    this.type = builder.type;
    this.factory = builder.factory;
    this.columns = List.copyOf(builder.columns);
    this.primaryKey = List.copyOf(primaryKey);
    this.compositeKey = !builder.compositeKey.isEmpty();
    this.foreignKeys = List.copyOf(builder.foreignKeys);
    this.withoutRowid = builder.withoutRowid;
    this.insertRestriction = insertRestriction;
  }

  public static <T> Builder<T> builder(String name, Class<T> type, Supplier<T> factory) {
    return new Builder<>(name, type, factory);
  }

  public String name() {
    return name;
  }

  /**
   * Changes the name used for this table in generated SQL. The database is not touched.
   *
   * @param newName new table name
   */
  public void renameTo(String newName) {
    if (newName == null || newName.isBlank()) {
      throw new IllegalArgumentException("table name must not be blank");
    }
    this.name = newName.trim();
  }

  public Class<T> type() {
    return type;
  }

  public T newInstance() {
    return factory.get();
  }

  public List<Column<T, ?>> columns() {
    return columns;
  }

  public Optional<Column<T, ?>> column(String columnName) {
    for (Column<T, ?> column : columns) {
      if (column.name().equalsIgnoreCase(columnName)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  /** Whether {@code column} is this exact registered instance. */
  public boolean owns(Column<?, ?> column) {
    for (Column<T, ?> own : columns) {
      if (own == column) {
        return true;
      }
    }
    return false;
  }

  /** Primary key columns in key order; empty if the table has no primary key. */
  public List<Column<T, ?>> primaryKey() {
    return primaryKey;
  }

  /** Whether the primary key is declared as a table constraint. */
  public boolean hasCompositeKey() {
    return compositeKey;
  }

  public boolean isPrimaryKey(Column<?, ?> column) {
    for (Column<T, ?> key : primaryKey) {
      if (key == column) {
        return true;
      }
    }
    return false;
  }

  public List<ForeignKey<T>> foreignKeys() {
    return foreignKeys;
  }

  public boolean withoutRowid() {
    return withoutRowid;
  }

  /**
   * Why a plain {@code insert(object)} is not allowed for this table, if it is not.
   *
   * @return reason, or empty when plain inserts are allowed
   */
  public Optional<String> insertRestriction() {
    return Optional.ofNullable(insertRestriction);
  }

  /** Columns bound by a plain insert: all non-generated columns, minus the key on rowid tables. */
  public List<Column<T, ?>> insertColumns() {
    List<Column<T, ?>> result = new ArrayList<>();
    for (Column<T, ?> column : columns) {
      if (column.isGenerated()) {
        continue;
      }
      if (!withoutRowid && isPrimaryKey(column)) {
        continue;
      }
      result.add(column);
    }
    return result;
  }

  /** Columns that can be written: everything except generated columns. */
  public List<Column<T, ?>> writableColumns() {
    List<Column<T, ?>> result = new ArrayList<>();
    for (Column<T, ?> column : columns) {
      if (!column.isGenerated()) {
        result.add(column);
      }
    }
    return result;
  }

  /** Columns set by an update: writable columns that are not part of the key. */
  public List<Column<T, ?>> updateColumns() {
    List<Column<T, ?>> result = new ArrayList<>();
    for (Column<T, ?> column : writableColumns()) {
      if (!isPrimaryKey(column)) {
        result.add(column);
      }
    }
    return result;
  }

  /**
   * The declared schema in {@code PRAGMA table_xinfo} shape. Key columns of a {@code WITHOUT
   * ROWID} table report {@code NOT NULL}, as SQLite enforces it there.
   *
   * @return one entry per column in declaration order
   */
  public List<ColumnInfo> tableInfo() {
    List<ColumnInfo> result = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      Column<T, ?> column = columns.get(i);
      int pk = primaryKey.indexOf(column) + 1;
      result.add(
          new ColumnInfo(
              i,
              column.name(),
              column.sqlType(),
              column.isNotNull() || (withoutRowid && pk > 0),
              column.defaultValue(),
              pk,
              column.generated().hidden()));
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public String toString() {
    return "Table[" + name + " -> " + type.getSimpleName() + "]";
  }

  /** Collects and validates a table declaration. */
  public static final class Builder<T> {
    private final String name;
    private final Class<T> type;
    private final Supplier<T> factory;
    private final List<Column<T, ?>> columns = new ArrayList<>();
    private final List<Column<T, ?>> compositeKey = new ArrayList<>();
    private final List<ForeignKey<T>> foreignKeys = new ArrayList<>();
    private boolean withoutRowid;

    private Builder(String name, Class<T> type, Supplier<T> factory) {
      this.name = name == null ? null : name.trim();
      this.type = Objects.requireNonNull(type, "type");
      this.factory = Objects.requireNonNull(factory, "factory");
    }

    public Builder<T> column(Column<T, ?> column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    /** Declares {@code PRIMARY KEY (columns...)} as a table constraint. */
    @SafeVarargs
    public final Builder<T> primaryKey(Column<T, ?>... keyColumns) {
      if (!compositeKey.isEmpty()) {
        throw new IllegalStateException("primary key already declared for " + name);
      }
      compositeKey.addAll(List.of(keyColumns));
      return this;
    }

    public Builder<T> foreignKey(ForeignKey<T> foreignKey) {
      foreignKeys.add(Objects.requireNonNull(foreignKey, "foreignKey"));
      return this;
    }

    public Builder<T> withoutRowid() {
      this.withoutRowid = true;
      return this;
    }

    /**
     * Validates the declaration.
     *
     * @return immutable table
     * @throws StorageException with {@link ErrorCode#INVALID_SCHEMA} if the declaration is
     *     inconsistent
     */
    public Table<T> build() {
      if (name == null || name.isEmpty()) {
        throw invalid("table name must not be blank");
      }
      if (columns.isEmpty()) {
        throw invalid("table " + name + " declares no columns");
      }
      Set<String> names = new HashSet<>();
      List<Column<T, ?>> columnKeys = new ArrayList<>();
      for (Column<T, ?> column : columns) {
        if (!names.add(column.name().toLowerCase(Locale.ROOT))) {
          throw invalid("duplicate column " + name + "." + column.name());
        }
        if (column.codec() == null) {
          throw invalid(
              "column " + name + "." + column.name() + " has unsupported type "
                  + column.type().getName());
        }
        if (column.isPrimaryKey()) {
          columnKeys.add(column);
        }
        if (column.isGenerated() && column.defaultValue() != null) {
          throw invalid("generated column " + name + "." + column.name() + " cannot have a default");
        }
        if (column.isGenerated() && column.isPrimaryKey()) {
          throw invalid("generated column " + name + "." + column.name() + " cannot be a key");
        }
      }
      if (columnKeys.size() > 1) {
        throw invalid("table " + name + " marks several columns as primary key; use primaryKey(...)");
      }
      if (!columnKeys.isEmpty() && !compositeKey.isEmpty()) {
        throw invalid("table " + name + " declares both a column and a table primary key");
      }
      for (Column<T, ?> key : compositeKey) {
        if (!containsInstance(columns, key)) {
          throw invalid("primary key column " + key.name() + " is not a column of " + name);
        }
        if (key.isGenerated()) {
          throw invalid("generated column " + name + "." + key.name() + " cannot be a key");
        }
      }
      List<Column<T, ?>> key = compositeKey.isEmpty() ? columnKeys : compositeKey;
      for (Column<T, ?> column : columns) {
        if (!column.isAutoincrement()) {
          continue;
        }
        if (withoutRowid || !compositeKey.isEmpty() || !isInteger(column)) {
          throw invalid(
              "AUTOINCREMENT on " + name + "." + column.name()
                  + " requires an INTEGER PRIMARY KEY on a rowid table");
        }
      }
      if (withoutRowid && key.isEmpty()) {
        throw invalid("WITHOUT ROWID table " + name + " must declare a primary key");
      }
      for (ForeignKey<T> foreignKey : foreignKeys) {
        for (Column<T, ?> column : foreignKey.columns()) {
          if (!containsInstance(columns, column)) {
            throw invalid("foreign key column " + column.name() + " is not a column of " + name);
          }
        }
      }
      return new Table<>(this, key, insertRestriction(key));
    }

    private String insertRestriction(List<Column<T, ?>> key) {
      if (withoutRowid) {
        return null;
      }
      if (key.size() > 1) {
        return "table " + name + " has a composite primary key; use replace or an explicit"
            + " column list";
      }
      if (key.size() == 1) {
        Column<T, ?> column = key.get(0);
        if (!isInteger(column) && column.defaultValue() == null) {
          return "table " + name + " has a non-integer primary key without default; use replace"
              + " or an explicit column list";
        }
      }
      return null;
    }

    private static boolean isInteger(Column<?, ?> column) {
      return "INTEGER".equalsIgnoreCase(column.sqlType());
    }

    private static boolean containsInstance(List<? extends Column<?, ?>> list, Column<?, ?> c) {
      for (Column<?, ?> candidate : list) {
        if (candidate == c) {
          return true;
        }
      }
      return false;
    }

    private static StorageException invalid(String message) {
      return new StorageException(ErrorCode.INVALID_SCHEMA, message);
    }
  }
}
