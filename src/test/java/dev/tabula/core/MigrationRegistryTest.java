/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.Migration;
import dev.tabula.api.StorageException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MigrationRegistryTest {
  private Connection connection;

  @BeforeEach
  void setUp() throws SQLException {
    connection = mock(Connection.class);
    Statement st = mock(Statement.class);
    ResultSet rs = mock(ResultSet.class);
    when(connection.createStatement()).thenReturn(st);
    when(st.executeQuery(anyString())).thenReturn(rs);
    when(rs.next()).thenReturn(true);
    when(rs.getInt(1)).thenReturn(2);
  }

  @Test
  void laterRegistrationReplacesEarlier() {
    MigrationRegistry registry = new MigrationRegistry();
    Migration first = c -> {};
    Migration second = c -> {};

    registry.register(1, 2, first);
    registry.register(1, 2, second);

    assertEquals(1, registry.size());
    assertSame(second, registry.find(1, 2).orElseThrow());
    assertTrue(registry.find(2, 1).isEmpty());
  }

  @Test
  void migrateStartsFromCurrentUserVersion() throws SQLException {
    MigrationRegistry registry = new MigrationRegistry();
    Migration hop = mock(Migration.class);
    Migration unrelated = mock(Migration.class);
    registry.register(2, 5, hop);
    registry.register(1, 5, unrelated);

    registry.migrate(connection, 5);

    verify(hop).migrate(connection);
    verify(unrelated, never()).migrate(connection);
  }

  @Test
  void missingHopIsReported() throws SQLException {
    MigrationRegistry registry = new MigrationRegistry();
    registry.register(1, 5, c -> {});

    StorageException e =
        assertThrows(StorageException.class, () -> registry.migrate(connection, 5));

    assertEquals(ErrorCode.MIGRATION_NOT_FOUND, e.errorCode());
  }

  @Test
  void migrationFailurePropagates() {
    MigrationRegistry registry = new MigrationRegistry();
    registry.register(
        2,
        3,
        c -> {
          throw new SQLException("no such table: old", "HY000", 1);
        });

    assertThrows(SQLException.class, () -> registry.migrate(connection, 3));
  }
}
