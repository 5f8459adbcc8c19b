/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A single-hop version migration registered with {@link Storage#registerMigration(int, int,
 * Migration)}.
 *
 * <p>The procedure receives the storage's held connection and owns every schema change for the hop,
 * including writing {@code PRAGMA user_version} if it wants the version bumped.
 */
@FunctionalInterface
public interface Migration {
  /**
   * Applies the migration.
   *
   * @param connection connection held for the duration of {@link Storage#migrateTo(int)}; do not
   *     close it
   * @throws SQLException if any statement fails
   */
  void migrate(Connection connection) throws SQLException;
}
