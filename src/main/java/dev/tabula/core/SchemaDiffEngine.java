/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.SyncResult;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ColumnInfo;
import dev.tabula.api.schema.Generated;
import dev.tabula.api.schema.Table;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a declared table with its live counterpart and picks exactly one {@link SyncResult}.
 *
 * <p>Only catalog reads are issued, so the same classification backs both real and simulated
 * synchronization. Structural changes to existing columns and additions that cannot be appended
 * always escalate to {@link SyncResult#DROPPED_AND_RECREATED}.
 */
final class SchemaDiffEngine {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private final DropColumnSupport dropColumnSupport;

  SchemaDiffEngine(DropColumnSupport dropColumnSupport) {
    this.dropColumnSupport = Objects.requireNonNull(dropColumnSupport, "dropColumnSupport");
  }

  SchemaStatus classify(Connection c, Table<?> table, boolean preserve) throws SQLException {
    if (!SchemaInspector.tableExists(c, table.name())) {
      return SchemaStatus.of(SyncResult.NEW_TABLE_CREATED);
    }
    List<ColumnInfo> live = SchemaInspector.tableXinfo(c, table.name());
    Map<String, ColumnInfo> liveByName = new HashMap<>();
    for (ColumnInfo info : live) {
      liveByName.put(key(info.name()), info);
    }
    List<ColumnInfo> declared = table.tableInfo();
    Set<String> declaredNames = new HashSet<>();
    List<Column<?, ?>> columnsToAdd = new ArrayList<>();
    boolean recreate = false;
    for (int i = 0; i < declared.size(); i++) {
      ColumnInfo wanted = declared.get(i);
      declaredNames.add(key(wanted.name()));
      ColumnInfo actual = liveByName.get(key(wanted.name()));
      if (actual == null) {
        columnsToAdd.add(table.columns().get(i));
      } else if (!sameShape(wanted, actual)) {
        LOG.debug(
            "(tabula) op=classify table={} column={} declared={} live={}",
            table.name(),
            wanted.name(),
            wanted,
            actual);
        recreate = true;
      }
    }
    List<ColumnInfo> excess = new ArrayList<>();
    for (ColumnInfo info : live) {
      if (!declaredNames.contains(key(info.name()))) {
        excess.add(info);
      }
    }

    boolean nativeDrop = !excess.isEmpty() && dropColumnSupport.available(c);
    if (!excess.isEmpty() && !preserve && !nativeDrop) {
      recreate = true;
    }

    boolean attemptToPreserve = true;
    for (Column<?, ?> column : columnsToAdd) {
      if (column.generated() == Generated.STORED) {
        recreate = true;
      } else if (column.isPrimaryKey() || column.isUnique()) {
        recreate = true;
      } else if (!column.isGenerated() && column.isNotNull() && column.defaultValue() == null) {
        recreate = true;
        attemptToPreserve = false;
      }
    }

    SyncResult result;
    if (recreate) {
      result = SyncResult.DROPPED_AND_RECREATED;
    } else if (!excess.isEmpty() && !columnsToAdd.isEmpty()) {
      result = SyncResult.NEW_COLUMNS_ADDED_AND_OLD_COLUMNS_REMOVED;
    } else if (!excess.isEmpty()) {
      result = SyncResult.OLD_COLUMNS_REMOVED;
    } else if (!columnsToAdd.isEmpty()) {
      result = SyncResult.NEW_COLUMNS_ADDED;
    } else {
      result = SyncResult.ALREADY_IN_SYNC;
    }
    return new SchemaStatus(result, attemptToPreserve, nativeDrop, columnsToAdd, excess);
  }

  /** Type, NOT NULL, default text, key membership and generated kind must all agree. */
  static boolean sameShape(ColumnInfo declared, ColumnInfo live) {
    return normalize(declared.type()).equalsIgnoreCase(normalize(live.type()))
        && declared.notNull() == live.notNull()
        && Objects.equals(trimToNull(declared.defaultValue()), trimToNull(live.defaultValue()))
        && declared.primaryKey() == live.primaryKey()
        && declared.hidden() == live.hidden();
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String type) {
    return type == null ? "" : type.trim();
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
