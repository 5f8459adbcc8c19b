/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ForeignKey;
import dev.tabula.api.schema.Index;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import dev.tabula.core.exec.Identifiers;
import java.util.List;
import java.util.regex.Pattern;

/** DDL text for declared tables, columns and indexes. */
final class TableDdl {
  private static final Pattern LITERAL_DEFAULT =
      Pattern.compile(
          "(?i)[-+]?(\\d+(\\.\\d*)?|\\.\\d+)(e[-+]?\\d+)?"
              + "|'([^']|'')*'"
              + "|x'[0-9a-f]*'"
              + "|null|true|false|current_time|current_date|current_timestamp");

  private TableDdl() {}

  /**
   * {@code CREATE TABLE} for {@code table} under {@code name}, which differs from the table's own
   * name when building a backup copy.
   */
  static String createTable(Schema schema, Table<?> table, String name) {
    StringBuilder sql = new StringBuilder(128);
    sql.append("CREATE TABLE ").append(Identifiers.quote(name)).append(" (");
    List<? extends Column<?, ?>> columns = table.columns();
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(columnDefinition(columns.get(i), !table.hasCompositeKey()));
    }
    if (table.hasCompositeKey()) {
      sql.append(", PRIMARY KEY ");
      appendNames(sql, table.primaryKey());
    }
    for (ForeignKey<?> foreignKey : table.foreignKeys()) {
      Table<?> target = schema.tableOf(foreignKey.references().get(0)).orElseThrow();
      sql.append(", FOREIGN KEY ");
      appendNames(sql, foreignKey.columns());
      sql.append(" REFERENCES ").append(Identifiers.quote(target.name()));
      appendNames(sql, foreignKey.references());
      if (foreignKey.onUpdate() != ForeignKey.Action.NO_ACTION) {
        sql.append(" ON UPDATE ").append(foreignKey.onUpdate().sql());
      }
      if (foreignKey.onDelete() != ForeignKey.Action.NO_ACTION) {
        sql.append(" ON DELETE ").append(foreignKey.onDelete().sql());
      }
    }
    sql.append(')');
    if (table.withoutRowid()) {
      sql.append(" WITHOUT ROWID");
    }
    return sql.toString();
  }

  static String addColumn(String table, Column<?, ?> column) {
    return "ALTER TABLE "
        + Identifiers.quote(table)
        + " ADD COLUMN "
        + columnDefinition(column, false);
  }

  static String dropColumn(String table, String column) {
    return "ALTER TABLE " + Identifiers.quote(table) + " DROP COLUMN " + Identifiers.quote(column);
  }

  static String dropTable(String table) {
    return "DROP TABLE " + Identifiers.quote(table);
  }

  static String renameTable(String from, String to) {
    return "ALTER TABLE " + Identifiers.quote(from) + " RENAME TO " + Identifiers.quote(to);
  }

  /** {@code INSERT INTO target (cols) SELECT cols FROM source}. */
  static String copyRows(String target, String source, List<String> columns) {
    StringBuilder names = new StringBuilder();
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        names.append(", ");
      }
      names.append(Identifiers.quote(columns.get(i)));
    }
    return "INSERT INTO "
        + Identifiers.quote(target)
        + " ("
        + names
        + ") SELECT "
        + names
        + " FROM "
        + Identifiers.quote(source);
  }

  static String createIndex(Index index, String table) {
    StringBuilder sql = new StringBuilder(64);
    sql.append(index.unique() ? "CREATE UNIQUE INDEX" : "CREATE INDEX")
        .append(" IF NOT EXISTS ")
        .append(Identifiers.quote(index.name()))
        .append(" ON ")
        .append(Identifiers.quote(table))
        .append(' ');
    appendNames(sql, index.columns());
    return sql.toString();
  }

  static String columnDefinition(Column<?, ?> column, boolean inlineKey) {
    StringBuilder sql = new StringBuilder(48);
    sql.append(Identifiers.quote(column.name())).append(' ').append(column.sqlType());
    if (inlineKey && column.isPrimaryKey()) {
      sql.append(" PRIMARY KEY");
      if (column.isAutoincrement()) {
        sql.append(" AUTOINCREMENT");
      }
    }
    if (column.isUnique()) {
      sql.append(" UNIQUE");
    }
    if (column.isNotNull()) {
      sql.append(" NOT NULL");
    }
    if (column.defaultValue() != null) {
      sql.append(" DEFAULT ").append(renderDefault(column.defaultValue()));
    }
    if (column.isGenerated()) {
      sql.append(" GENERATED ALWAYS AS (")
          .append(column.generatedExpression())
          .append(") ")
          .append(column.generated().name());
    }
    return sql.toString();
  }

  /** Literals are written bare (ADD COLUMN rejects parenthesized defaults); expressions in parens. */
  static String renderDefault(String text) {
    return LITERAL_DEFAULT.matcher(text).matches() ? text : "(" + text + ")";
  }

  private static void appendNames(StringBuilder sql, List<? extends Column<?, ?>> columns) {
    sql.append('(');
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(Identifiers.quote(columns.get(i).name()));
    }
    sql.append(')');
  }
}
