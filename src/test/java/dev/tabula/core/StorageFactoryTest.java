/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.Storage;
import dev.tabula.api.StorageException;
import dev.tabula.api.SyncResult;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ForeignKey;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import dev.tabula.core.TestModel.Post;
import dev.tabula.core.TestModel.User;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StorageFactoryTest {
  @TempDir Path tempDir;

  private static Schema schema() {
    Column<User, Long> userId = TestModel.userId();
    Column<Post, Long> postUser =
        Column.of("user_id", long.class, Post::getUserId, Post::setUserId);
    Table<Post> posts =
        Table.builder("posts", Post.class, Post::new)
            .column(Column.of("id", long.class, Post::getId, Post::setId).primaryKey())
            .column(postUser)
            .column(Column.of("title", String.class, Post::getTitle, Post::setTitle))
            .foreignKey(ForeignKey.of(postUser, userId))
            .build();
    return TestModel.schemaOf(
        TestModel.users(userId, TestModel.userName(), TestModel.userEmail()), posts);
  }

  @Test
  void inMemoryStoragesAreIndependentAndKeepData() {
    try (Storage first = StorageFactory.open(Config.defaults(Config.IN_MEMORY), schema());
        Storage second = StorageFactory.open(Config.defaults(Config.IN_MEMORY), schema())) {
      Map<String, SyncResult> results = first.syncSchema(true);
      assertEquals(SyncResult.NEW_TABLE_CREATED, results.get("users"));

      first.insert(new User(0, "ann", null));
      first.insert(new User(0, "bob", null));

      assertEquals(2, first.count(User.class));
      assertTrue(second.tableInfo("users").isEmpty());
    }
  }

  @Test
  void foreignKeysAreEnforcedWhenConfigured() {
    try (Storage storage = StorageFactory.open(Config.defaults(Config.IN_MEMORY), schema())) {
      storage.syncSchema(true);

      StorageException e =
          assertThrows(StorageException.class, () -> storage.insert(new Post(0, 99, "orphan")));
      assertEquals(ErrorCode.CONSTRAINT_VIOLATION, e.errorCode());
    }
  }

  @Test
  void fileDatabaseCreatesParentDirectory() {
    Path file = tempDir.resolve("nested").resolve("app.db");
    try (Storage storage = StorageFactory.open(Config.defaults(file.toString()), schema())) {
      storage.syncSchema(true);
      assertTrue(storage.engineVersion().startsWith("3."));
    }
    assertTrue(Files.exists(file));
  }

  @Test
  void fromConfigFileUsesConfiguredDatabase() throws IOException {
    Path db = tempDir.resolve("configured.db");
    Path configPath = tempDir.resolve("config").resolve("tabula.json5");
    Files.createDirectories(configPath.getParent());
    Files.writeString(
        configPath,
        "{\n"
            + "  db: { file: \"" + db.toString().replace("\\", "\\\\") + "\", journalMode: \"DELETE\" },\n"
            + "  log: { level: \"INFO\", slowQueryMs: 0 },\n"
            + "}\n",
        StandardCharsets.UTF_8);

    try (Storage storage = StorageFactory.fromConfigFile(configPath, schema())) {
      storage.syncSchema(true);
      assertTrue(storage.tableExists("posts"));
    }
    assertTrue(Files.exists(db));
    assertTrue(Files.exists(configPath.resolveSibling("tabula.json5.example")));
  }
}
