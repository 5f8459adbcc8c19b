/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/** Whether {@code ALTER TABLE ... DROP COLUMN} may be used. */
public enum DropColumnSupport {
  /** Detect from the engine version (3.35.0 introduced the statement). */
  AUTO,
  /** Always use native drops. */
  NATIVE,
  /** Never use native drops; rebuild tables instead. */
  UNAVAILABLE;

  static final int[] NATIVE_DROP_SINCE = {3, 35, 0};

  boolean available(Connection connection) throws SQLException {
    switch (this) {
      case NATIVE:
        return true;
      case UNAVAILABLE:
        return false;
      default:
        return atLeast(SchemaInspector.engineVersion(connection), NATIVE_DROP_SINCE);
    }
  }

  static DropColumnSupport parse(String value) {
    if (value == null) {
      return AUTO;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(
          "schema.dropColumn must be one of auto|native|unavailable, got " + value, e);
    }
  }

  static boolean atLeast(String version, int[] minimum) {
    String[] parts = version.trim().split("\\.");
    for (int i = 0; i < minimum.length; i++) {
      int part = 0;
      if (i < parts.length) {
        try {
          part = Integer.parseInt(parts[i]);
        } catch (NumberFormatException e) {
          return false;
        }
      }
      if (part != minimum[i]) {
        return part > minimum[i];
      }
    }
    return true;
  }
}
