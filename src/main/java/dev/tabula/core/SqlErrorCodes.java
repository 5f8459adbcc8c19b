/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import java.sql.SQLException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility that maps JDBC {@link SQLException} instances to Tabula {@link ErrorCode}s. */
public final class SqlErrorCodes {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;
  private static final int SQLITE_CONSTRAINT = 19;

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception into one of the engine {@link ErrorCode}s.
   *
   * <p>The SQLite driver reports extended result codes as the vendor code; the primary code is its
   * low byte.
   *
   * @param e SQL exception thrown by the SQLite driver
   * @return mapped {@link ErrorCode}, defaulting to {@link ErrorCode#ENGINE_ERROR}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.ENGINE_ERROR;
    }
    int primary = e.getErrorCode() & 0xFF;
    if (primary == SQLITE_CONSTRAINT) {
      return ErrorCode.CONSTRAINT_VIOLATION;
    }
    if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
      return ErrorCode.DATABASE_BUSY;
    }
    String state = e.getSQLState();
    if (state != null && state.startsWith("23")) {
      return ErrorCode.CONSTRAINT_VIOLATION;
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("constraint failed") || lower.contains("sqlite_constraint")) {
        return ErrorCode.CONSTRAINT_VIOLATION;
      }
      if (lower.contains("database is locked")
          || lower.contains("database table is locked")
          || lower.contains("sqlite_busy")
          || lower.contains("sqlite_locked")) {
        return ErrorCode.DATABASE_BUSY;
      }
    }
    return ErrorCode.ENGINE_ERROR;
  }

  /**
   * Classifies {@code e}, logs it, and wraps it for callers.
   *
   * @param op operation name used in the log line
   * @param e engine failure
   * @return exception carrying the classified code, the engine message and {@code e} as cause
   */
  public static StorageException translate(String op, SQLException e) {
    ErrorCode code = classify(e);
    LOG.warn(
        "(tabula) code={} op={} message={} sqlState={} vendor={}",
        code,
        op,
        e.getMessage(),
        e.getSQLState(),
        e.getErrorCode());
    return new StorageException(code, e.getMessage(), e);
  }
}
