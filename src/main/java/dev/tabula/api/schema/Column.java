/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import dev.tabula.api.query.Expression;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Declares one column of a mapped table.
 *
 * <p>Columns are immutable: every constraint method returns a new instance. The instance finally
 * passed to {@link Table.Builder#column(Column)} is the one that identifies the column in queries,
 * so keep a reference to it.
 *
 * <pre>{@code
 * static final Column<User, Long> ID =
 *     Column.of("id", long.class, User::getId, User::setId).primaryKey();
 * static final Column<User, String> NAME =
 *     Column.of("name", String.class, User::getName, User::setName).notNull();
 * }</pre>
 *
 * <p>Primitive value types are always {@code NOT NULL}; reference types are nullable unless {@link
 * #notNull()} is declared.
 *
 * @param <T> mapped object type
 * @param <F> value type
 */
public final class Column<T, F> implements Expression<F> {
  private final String name;
  private final Class<F> type;
  private final ValueCodec<F> codec;
  private final FieldAccessor<T, F> accessor;
  private final String sqlTypeOverride;
  private final boolean primaryKey;
  private final boolean autoincrement;
  private final boolean notNull;
  private final boolean unique;
  private final String defaultValue;
  private final Generated generated;
  private final String generatedExpression;

  private Column(
      String name,
      Class<F> type,
      ValueCodec<F> codec,
      FieldAccessor<T, F> accessor,
      String sqlTypeOverride,
      boolean primaryKey,
      boolean autoincrement,
      boolean notNull,
      boolean unique,
      String defaultValue,
      Generated generated,
      String generatedExpression) {
    this.name = name;
    this.type = type;
    this.codec = codec;
    this.accessor = accessor;
    this.sqlTypeOverride = sqlTypeOverride;
    this.primaryKey = primaryKey;
    this.autoincrement = autoincrement;
    this.notNull = notNull;
    this.unique = unique;
    this.defaultValue = defaultValue;
    this.generated = generated;
    this.generatedExpression = generatedExpression;
  }

  /**
   * Declares a column accessed through a getter and setter.
   *
   * @param name column name
   * @param type value type; must have a {@link ValueCodec}
   * @param getter reads the field
   * @param setter writes the field
   * @return column without constraints
   */
  public static <T, F> Column<T, F> of(
      String name, Class<F> type, Function<T, F> getter, BiConsumer<T, F> setter) {
    return of(name, type, Accessors.of(getter, setter));
  }

  /**
   * Declares a column with an explicit accessor.
   *
   * @param name column name
   * @param type value type; must have a {@link ValueCodec}
   * @param accessor field accessor
   * @return column without constraints
   */
  public static <T, F> Column<T, F> of(String name, Class<F> type, FieldAccessor<T, F> accessor) {
    Objects.requireNonNull(type, "type");
    return new Column<>(
        requireName(name),
        type,
        ValueCodecs.find(type).orElse(null),
        Objects.requireNonNull(accessor, "accessor"),
        null,
        false,
        false,
        false,
        false,
        null,
        Generated.NONE,
        null);
  }

  /**
   * Declares a column with a custom codec.
   *
   * @param name column name
   * @param codec codec for the value type
   * @param accessor field accessor
   * @return column without constraints
   */
  public static <T, F> Column<T, F> of(String name, ValueCodec<F> codec, FieldAccessor<T, F> accessor) {
    Objects.requireNonNull(codec, "codec");
    return new Column<>(
        requireName(name),
        codec.javaType(),
        codec,
        Objects.requireNonNull(accessor, "accessor"),
        null,
        false,
        false,
        false,
        false,
        null,
        Generated.NONE,
        null);
  }

  public Column<T, F> primaryKey() {
    return new Column<>(
        name, type, codec, accessor, sqlTypeOverride, true, autoincrement, notNull, unique,
        defaultValue, generated, generatedExpression);
  }

  /** Marks an {@code INTEGER PRIMARY KEY} as {@code AUTOINCREMENT}; implies {@link #primaryKey()}. */
  public Column<T, F> autoincrement() {
    return new Column<>(
        name, type, codec, accessor, sqlTypeOverride, true, true, notNull, unique, defaultValue,
        generated, generatedExpression);
  }

  public Column<T, F> notNull() {
    return new Column<>(
        name, type, codec, accessor, sqlTypeOverride, primaryKey, autoincrement, true, unique,
        defaultValue, generated, generatedExpression);
  }

  public Column<T, F> unique() {
    return new Column<>(
        name, type, codec, accessor, sqlTypeOverride, primaryKey, autoincrement, notNull, true,
        defaultValue, generated, generatedExpression);
  }

  /**
   * Sets a literal default rendered through the column's codec.
   *
   * @param value default value
   * @return copy with the default
   */
  public Column<T, F> defaultValue(F value) {
    if (codec == null) {
      throw new IllegalStateException("column " + name + " has no value codec");
    }
    return defaultExpression(codec.literal(value));
  }

  /**
   * Sets a raw SQL default expression such as {@code CURRENT_TIMESTAMP}.
   *
   * @param expression SQL expression text
   * @return copy with the default
   */
  public Column<T, F> defaultExpression(String expression) {
    Objects.requireNonNull(expression, "expression");
    return new Column<>(
        name, type, codec, accessor, sqlTypeOverride, primaryKey, autoincrement, notNull, unique,
        expression.trim(), generated, generatedExpression);
  }

  /**
   * Declares the column as {@code GENERATED ALWAYS AS (expression)}.
   *
   * @param expression SQL expression over other columns of the table
   * @param kind {@link Generated#VIRTUAL} or {@link Generated#STORED}
   * @return copy with the generation clause
   */
  public Column<T, F> generatedAlways(String expression, Generated kind) {
    Objects.requireNonNull(expression, "expression");
    if (kind == null || kind == Generated.NONE) {
      throw new IllegalArgumentException("generated kind must be VIRTUAL or STORED");
    }
    return new Column<>(
        name, type, codec, accessor, sqlTypeOverride, primaryKey, autoincrement, notNull, unique,
        defaultValue, kind, expression);
  }

  /**
   * Overrides the SQL type derived from the value codec.
   *
   * @param sqlType declared type text
   * @return copy with the override
   */
  public Column<T, F> sqlType(String sqlType) {
    return new Column<>(
        name, type, codec, accessor, requireName(sqlType), primaryKey, autoincrement, notNull,
        unique, defaultValue, generated, generatedExpression);
  }

  public String name() {
    return name;
  }

  public Class<F> type() {
    return type;
  }

  @Override
  public ValueCodec<F> codec() {
    return codec;
  }

  public FieldAccessor<T, F> accessor() {
    return accessor;
  }

  /** Declared SQL type: the override if present, otherwise the codec's storage type. */
  public String sqlType() {
    if (sqlTypeOverride != null) {
      return sqlTypeOverride;
    }
    return codec == null ? null : codec.sqlType();
  }

  public boolean isPrimaryKey() {
    return primaryKey;
  }

  public boolean isAutoincrement() {
    return autoincrement;
  }

  public boolean isNotNull() {
    return notNull || type.isPrimitive();
  }

  public boolean isUnique() {
    return unique;
  }

  /** Default expression text, or {@code null}. */
  public String defaultValue() {
    return defaultValue;
  }

  public Generated generated() {
    return generated;
  }

  public String generatedExpression() {
    return generatedExpression;
  }

  public boolean isGenerated() {
    return generated != Generated.NONE;
  }

  public F read(T object) {
    return accessor.read(object);
  }

  public void write(T object, F value) {
    accessor.write(object, value);
  }

  @Override
  public String toString() {
    return "Column[" + name + "]";
  }

  private static String requireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    return value.trim();
  }
}
