/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.SyncResult;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ColumnInfo;
import java.util.List;

/**
 * Classification of one table plus the details the synchronizer needs to act on it.
 *
 * @param result outcome
 * @param attemptToPreserve whether a rebuild may copy rows; cleared when a column that cannot be
 *     filled for existing rows is being added
 * @param nativeDrop whether excess columns may be dropped with {@code DROP COLUMN}
 * @param columnsToAdd declared columns missing from the live table, in declaration order
 * @param excessColumns live columns that are not declared, in table order
 */
record SchemaStatus(
    SyncResult result,
    boolean attemptToPreserve,
    boolean nativeDrop,
    List<Column<?, ?>> columnsToAdd,
    List<ColumnInfo> excessColumns) {

  SchemaStatus {
    columnsToAdd = List.copyOf(columnsToAdd);
    excessColumns = List.copyOf(excessColumns);
  }

  static SchemaStatus of(SyncResult result) {
    return new SchemaStatus(result, true, false, List.of(), List.of());
  }
}
