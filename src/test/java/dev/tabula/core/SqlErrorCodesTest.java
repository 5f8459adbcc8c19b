/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SqlErrorCodes}. */
final class SqlErrorCodesTest {

  @Test
  void extendedConstraintCodeMapsToConstraintViolation() {
    // SQLITE_CONSTRAINT_PRIMARYKEY
    SQLException sql = new SQLException("[SQLITE_CONSTRAINT_PRIMARYKEY]", null, 1555);
    assertEquals(ErrorCode.CONSTRAINT_VIOLATION, SqlErrorCodes.classify(sql));
  }

  @Test
  void busyAndLockedMapToDatabaseBusy() {
    assertEquals(
        ErrorCode.DATABASE_BUSY, SqlErrorCodes.classify(new SQLException("busy", null, 5)));
    assertEquals(
        ErrorCode.DATABASE_BUSY, SqlErrorCodes.classify(new SQLException("locked", null, 6)));
  }

  @Test
  void integrityStateMapsWithoutVendorCode() {
    SQLException sql = new SQLException("check failed", "23000", 0);
    assertEquals(ErrorCode.CONSTRAINT_VIOLATION, SqlErrorCodes.classify(sql));
  }

  @Test
  void messageFallbackMapsWhenStateAndVendorMissing() {
    assertEquals(
        ErrorCode.CONSTRAINT_VIOLATION,
        SqlErrorCodes.classify(new SQLException("UNIQUE constraint failed: users.email")));
    assertEquals(
        ErrorCode.DATABASE_BUSY,
        SqlErrorCodes.classify(new SQLException("[SQLITE_BUSY] The database file is locked")));
  }

  @Test
  void anythingElseIsAnEngineError() {
    assertEquals(
        ErrorCode.ENGINE_ERROR,
        SqlErrorCodes.classify(new SQLException("no such table: ghosts", null, 1)));
    assertEquals(ErrorCode.ENGINE_ERROR, SqlErrorCodes.classify(null));
  }

  @Test
  void translateKeepsMessageAndCause() {
    SQLException sql = new SQLException("UNIQUE constraint failed: users.id", null, 2067);

    StorageException e = SqlErrorCodes.translate("insert", sql);

    assertEquals(ErrorCode.CONSTRAINT_VIOLATION, e.errorCode());
    assertEquals(sql.getMessage(), e.getMessage());
    assertSame(sql, e.getCause());
    assertTrue(e.errorCode().isEngineError());
    assertFalse(ErrorCode.NOT_FOUND.isEngineError());
  }
}
