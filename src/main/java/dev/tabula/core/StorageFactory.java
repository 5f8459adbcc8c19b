/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.Storage;
import dev.tabula.api.schema.Schema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/** Builds {@link Storage} instances from configuration. */
public final class StorageFactory {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private StorageFactory() {}

  /**
   * Loads {@code path} (writing the default template when missing), applies its logging block and
   * opens storage.
   *
   * @param path config file, usually {@code config/tabula.json5}
   * @param schema declared model
   * @return open storage
   */
  public static Storage fromConfigFile(Path path, Schema schema) {
    Config config = Config.loadOrWriteDefault(path);
    LogbackConfigurator.configure(config.log());
    return open(config, schema);
  }

  /**
   * Opens storage for {@code schema}. In-memory databases keep their connection until the storage
   * is closed; file databases open it on demand.
   *
   * @param config validated configuration
   * @param schema declared model
   * @return open storage
   */
  public static Storage open(Config config, Schema schema) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(schema, "schema");
    Config.Db db = config.db();
    if (!db.inMemory()) {
      createParentDirectory(Path.of(db.file()));
    }
    DataSource dataSource =
        SlowQueryDataSource.wrap(sqliteDataSource(db), config.log().slowQueryMs());
    DropColumnSupport dropColumn = DropColumnSupport.parse(config.schema().dropColumn());
    try {
      ConnectionHolder connections = new ConnectionHolder(dataSource, db.inMemory());
      LOG.info(
          "(tabula) op=open file={} journalMode={} foreignKeys={} dropColumn={}",
          db.file(),
          db.journalMode(),
          db.foreignKeys(),
          dropColumn);
      return new StorageImpl(schema, connections, dropColumn);
    } catch (SQLException e) {
      throw SqlErrorCodes.translate("open", e);
    }
  }

  static SQLiteDataSource sqliteDataSource(Config.Db db) {
    SQLiteConfig sqlite = new SQLiteConfig();
    sqlite.setBusyTimeout((int) db.busyTimeoutMs());
    sqlite.enforceForeignKeys(db.foreignKeys());
    sqlite.setJournalMode(
        SQLiteConfig.JournalMode.valueOf(db.journalMode().toUpperCase(Locale.ROOT)));
    SQLiteDataSource dataSource = new SQLiteDataSource(sqlite);
    dataSource.setUrl(db.jdbcUrl());
    return dataSource;
  }

  private static void createParentDirectory(Path file) {
    Path parent = file.toAbsolutePath().getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException e) {
      throw new RuntimeException("Failed to create database directory: " + parent, e);
    }
  }
}
