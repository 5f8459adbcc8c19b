/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import dev.tabula.api.SyncResult;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ColumnInfo;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link SchemaStatus} to the live database.
 *
 * <p>A failing DDL statement aborts immediately; earlier statements stay applied. During a backup
 * cycle the source rows are only dropped after they were copied, so a failure leaves them either in
 * the source table or in the backup. The declared model is never modified.
 *
 * <p>Table rebuilds run with foreign key enforcement suspended, so dropping the old table neither
 * cascades into child tables nor fails on their references. Enforcement is restored afterwards.
 */
final class SchemaSynchronizer {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private final Schema schema;

  SchemaSynchronizer(Schema schema) {
    this.schema = schema;
  }

  SyncResult apply(Connection c, Table<?> table, SchemaStatus status, boolean preserve)
      throws SQLException {
    switch (status.result()) {
      case ALREADY_IN_SYNC:
        break;
      case NEW_TABLE_CREATED:
        execute(c, TableDdl.createTable(schema, table, table.name()));
        break;
      case NEW_COLUMNS_ADDED:
        addColumns(c, table, status.columnsToAdd());
        break;
      case OLD_COLUMNS_REMOVED:
      case NEW_COLUMNS_ADDED_AND_OLD_COLUMNS_REMOVED:
        if (status.nativeDrop()) {
          for (ColumnInfo excess : status.excessColumns()) {
            execute(c, TableDdl.dropColumn(table.name(), excess.name()));
          }
          addColumns(c, table, status.columnsToAdd());
        } else {
          withForeignKeysSuspended(c, table.name(), true, () -> backupCycle(c, table));
        }
        break;
      case DROPPED_AND_RECREATED:
        if (preserve && status.attemptToPreserve()) {
          withForeignKeysSuspended(c, table.name(), true, () -> backupCycle(c, table));
        } else {
          withForeignKeysSuspended(
              c,
              table.name(),
              false,
              () -> {
                execute(c, TableDdl.dropTable(table.name()));
                execute(c, TableDdl.createTable(schema, table, table.name()));
              });
        }
        break;
      default:
        throw new IllegalStateException("unexpected sync result " + status.result());
    }
    return status.result();
  }

  private void addColumns(Connection c, Table<?> table, List<Column<?, ?>> columns)
      throws SQLException {
    for (Column<?, ?> column : columns) {
      execute(c, TableDdl.addColumn(table.name(), column));
    }
  }

  /** Create a backup with the declared shape, copy common columns, drop source, rename backup. */
  void backupCycle(Connection c, Table<?> table) throws SQLException {
    String source = table.name();
    String backup = freeBackupName(c, source);
    List<ColumnInfo> live = SchemaInspector.tableXinfo(c, source);
    Map<String, ColumnInfo> liveByName = new HashMap<>();
    for (ColumnInfo info : live) {
      liveByName.put(info.name().toLowerCase(Locale.ROOT), info);
    }
    List<String> common = new ArrayList<>();
    for (Column<?, ?> column : table.columns()) {
      ColumnInfo info = liveByName.get(column.name().toLowerCase(Locale.ROOT));
      if (info != null && !info.generated() && !column.isGenerated()) {
        common.add(column.name());
      }
    }
    LOG.info(
        "(tabula) op=backupCycle table={} backup={} copiedColumns={}", source, backup, common);
    execute(c, TableDdl.createTable(schema, table, backup));
    if (!common.isEmpty()) {
      execute(c, TableDdl.copyRows(backup, source, common));
    }
    execute(c, TableDdl.dropTable(source));
    execute(c, TableDdl.renameTable(backup, source));
  }

  /**
   * Runs {@code rebuild} with {@code PRAGMA foreign_keys} off when it was on, then checks the
   * references touching {@code table}. A preserving rebuild keeps every row, so violations found
   * afterwards fail the sync; after a destructive drop they are only logged.
   */
  private static void withForeignKeysSuspended(
      Connection c, String table, boolean strict, Rebuild rebuild) throws SQLException {
    if (!foreignKeysEnabled(c)) {
      rebuild.run();
      return;
    }
    execute(c, "PRAGMA foreign_keys=OFF");
    try {
      if (foreignKeysEnabled(c)) {
        // the pragma is a no-op while a transaction is open
        throw new StorageException(
            ErrorCode.INVALID_SCHEMA,
            "cannot rebuild table "
                + table
                + " inside a transaction while foreign keys are enforced");
      }
      rebuild.run();
      List<String> violations = foreignKeyViolations(c, table);
      if (!violations.isEmpty()) {
        LOG.warn(
            "(tabula) op=foreignKeyCheck table={} violations={} strict={}",
            table,
            violations,
            strict);
        if (strict) {
          throw new StorageException(
              ErrorCode.CONSTRAINT_VIOLATION,
              "foreign key check failed after rebuilding " + table + ": " + violations);
        }
      }
    } finally {
      execute(c, "PRAGMA foreign_keys=ON");
    }
  }

  static boolean foreignKeysEnabled(Connection c) throws SQLException {
    try (Statement st = c.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA foreign_keys")) {
      return rs.next() && rs.getInt(1) == 1;
    }
  }

  /** Rows of {@code PRAGMA foreign_key_check} whose child or parent table is {@code table}. */
  private static List<String> foreignKeyViolations(Connection c, String table)
      throws SQLException {
    List<String> violations = new ArrayList<>();
    try (Statement st = c.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA foreign_key_check")) {
      while (rs.next()) {
        String child = rs.getString(1);
        String parent = rs.getString(3);
        if (table.equalsIgnoreCase(child) || table.equalsIgnoreCase(parent)) {
          violations.add(child + "#" + rs.getLong(2) + "->" + parent);
        }
      }
    }
    return violations;
  }

  @FunctionalInterface
  private interface Rebuild {
    void run() throws SQLException;
  }

  static String freeBackupName(Connection c, String table) throws SQLException {
    String base = table + "_backup";
    if (!SchemaInspector.tableExists(c, base)) {
      return base;
    }
    for (int suffix = 1; ; suffix++) {
      String candidate = base + suffix;
      if (!SchemaInspector.tableExists(c, candidate)) {
        return candidate;
      }
    }
  }

  static void execute(Connection c, String sql) throws SQLException {
    LOG.debug("(tabula) op=ddl sql={}", sql);
    try (Statement st = c.createStatement()) {
      st.execute(sql);
    }
  }
}
