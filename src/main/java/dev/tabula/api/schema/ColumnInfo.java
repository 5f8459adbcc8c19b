/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

/**
 * One column as reported by {@code PRAGMA table_xinfo}, or as rendered from a declared {@link
 * Table} in the same shape.
 *
 * @param cid column ordinal
 * @param name column name
 * @param type declared type text
 * @param notNull whether a NOT NULL constraint is present
 * @param defaultValue default expression text, {@code null} if none
 * @param pk 1-based position in the primary key, 0 if not a key column
 * @param hidden 0 ordinary, 2 virtual generated, 3 stored generated
 */
public record ColumnInfo(
    int cid, String name, String type, boolean notNull, String defaultValue, int pk, int hidden) {

  public boolean primaryKey() {
    return pk > 0;
  }

  public boolean generated() {
    return hidden != 0;
  }
}
