/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.Migration;
import dev.tabula.api.StorageException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Single-hop migrations keyed by {@code (from, to)}; owned by one storage. */
final class MigrationRegistry {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private final Map<VersionHop, Migration> migrations = new HashMap<>();

  synchronized void register(int from, int to, Migration migration) {
    Objects.requireNonNull(migration, "migration");
    Migration previous = migrations.put(new VersionHop(from, to), migration);
    if (previous != null) {
      LOG.debug("(tabula) op=registerMigration from={} to={} replaced=true", from, to);
    }
  }

  synchronized Optional<Migration> find(int from, int to) {
    return Optional.ofNullable(migrations.get(new VersionHop(from, to)));
  }

  synchronized int size() {
    return migrations.size();
  }

  /**
   * Runs the migration from the database's current {@code user_version} to {@code target}.
   *
   * @param c connection held for the whole call
   * @param target version to reach
   * @throws StorageException with {@link ErrorCode#MIGRATION_NOT_FOUND} if nothing is registered
   * @throws SQLException if reading the version or the migration itself fails
   */
  void migrate(Connection c, int target) throws SQLException {
    int current = SchemaInspector.userVersion(c);
    Migration migration =
        find(current, target)
            .orElseThrow(
                () ->
                    new StorageException(
                        ErrorCode.MIGRATION_NOT_FOUND,
                        "no migration registered from version " + current + " to " + target));
    LOG.info("(tabula) op=migrate from={} to={}", current, target);
    migration.migrate(c);
  }

  private record VersionHop(int from, int to) {}
}
