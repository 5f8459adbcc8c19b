/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import static dev.tabula.api.query.Clauses.limit;
import static dev.tabula.api.query.Clauses.orderBy;
import static dev.tabula.api.query.Clauses.where;
import static dev.tabula.api.query.Conditions.eq;
import static dev.tabula.api.query.Conditions.gt;
import static dev.tabula.api.query.Conditions.like;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.PreparedQuery;
import dev.tabula.api.RowCursor;
import dev.tabula.api.StorageException;
import dev.tabula.api.query.Aggregates;
import dev.tabula.api.query.Assignment;
import dev.tabula.api.query.Statements;
import dev.tabula.api.query.Tuple;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ForeignKey;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import dev.tabula.core.TestModel.Post;
import dev.tabula.core.TestModel.User;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StorageImplTest {
  static final class Setting {
    private String key;
    private String value;

    Setting() {}

    Setting(String key, String value) {
      this.key = key;
      this.value = value;
    }

    String getKey() {
      return key;
    }

    void setKey(String key) {
      this.key = key;
    }

    String getValue() {
      return value;
    }

    void setValue(String value) {
      this.value = value;
    }
  }

  static final class Item {
    private int id;
    private String name;

    Item() {}

    Item(int id, String name) {
      this.id = id;
      this.name = name;
    }

    int getId() {
      return id;
    }

    void setId(int id) {
      this.id = id;
    }

    String getName() {
      return name;
    }

    void setName(String name) {
      this.name = name;
    }
  }

  @TempDir Path tempDir;

  private final Column<User, Long> userId = TestModel.userId();
  private final Column<User, String> userName = TestModel.userName();
  private final Column<User, String> userEmail = TestModel.userEmail();
  private final Column<User, Integer> userAge = TestModel.userAge();
  private final Column<Post, Long> postId =
      Column.of("id", long.class, Post::getId, Post::setId).primaryKey();
  private final Column<Post, Long> postUser =
      Column.of("user_id", long.class, Post::getUserId, Post::setUserId);
  private final Column<Post, String> postTitle =
      Column.of("title", String.class, Post::getTitle, Post::setTitle).notNull();
  private final Column<Setting, String> settingKey =
      Column.of("key", String.class, Setting::getKey, Setting::setKey).primaryKey();
  private final Column<Setting, String> settingValue =
      Column.of("value", String.class, Setting::getValue, Setting::setValue).notNull();
  private final Column<Item, Integer> itemId =
      Column.of("id", int.class, Item::getId, Item::setId).primaryKey();
  private final Column<Item, String> itemName =
      Column.of("name", String.class, Item::getName, Item::setName);

  private ConnectionHolder connections;
  private StorageImpl storage;

  @BeforeEach
  void setUp() throws Exception {
    Table<User> users = TestModel.users(userId, userName, userEmail, userAge);
    Table<Post> posts =
        Table.builder("posts", Post.class, Post::new)
            .column(postId)
            .column(postUser)
            .column(postTitle)
            .foreignKey(ForeignKey.of(postUser, userId).onDelete(ForeignKey.Action.CASCADE))
            .build();
    Table<Setting> settings =
        Table.builder("settings", Setting.class, Setting::new)
            .column(settingKey)
            .column(settingValue)
            .build();
    Table<Item> items =
        Table.builder("items", Item.class, Item::new).column(itemId).column(itemName).build();
    Schema schema =
        Schema.builder().table(users).table(posts).table(settings).table(items).build();
    connections = new ConnectionHolder(TestModel.dataSource(tempDir.resolve("app.db")), false);
    storage = new StorageImpl(schema, connections, DropColumnSupport.AUTO);
    storage.syncSchema(false);
  }

  @AfterEach
  void tearDown() {
    storage.close();
  }

  private User user(String name, String email, Integer age) {
    User user = new User(0, name, email);
    user.setAge(age);
    return user;
  }

  @Test
  void insertedRowReadsBackFieldForField() {
    long id = storage.insert(user("ann", "ann@example.com", 31));

    User loaded = storage.get(User.class, id);

    assertEquals(1L, id);
    assertEquals(id, loaded.getId());
    assertEquals("ann", loaded.getName());
    assertEquals("ann@example.com", loaded.getEmail());
    assertEquals(31, loaded.getAge());
    assertEquals(0, connections.references());
  }

  @Test
  void replaceWritesTheKeyAndOverwrites() {
    storage.replace(new User(7, "bob", null));
    storage.replace(new User(7, "bobby", "b@example.com"));

    User loaded = storage.get(User.class, 7);
    assertEquals("bobby", loaded.getName());
    assertEquals("b@example.com", loaded.getEmail());
    assertNull(loaded.getAge());
    assertEquals(1, storage.count(User.class));
  }

  @Test
  void missingRowDependsOnLookupKind() {
    StorageException e = assertThrows(StorageException.class, () -> storage.get(User.class, 42L));
    assertEquals(ErrorCode.NOT_FOUND, e.errorCode());
    assertEquals(Optional.empty(), storage.getOptional(User.class, 42L));
    assertNull(storage.getOrNull(User.class, 42L));
  }

  @Test
  void wrongKeyArityIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> storage.get(User.class, 1L, 2L));
  }

  @Test
  void keysOutsideTheColumnTypeAreRejected() {
    storage.replace(new Item(1, "one"));

    assertThrows(
        IllegalArgumentException.class, () -> storage.getOrNull(Item.class, 4294967297L));
    assertThrows(IllegalArgumentException.class, () -> storage.getOrNull(Item.class, 1.9d));
    assertThrows(IllegalArgumentException.class, () -> storage.getOrNull(User.class, 1.5d));
    assertEquals("one", storage.get(Item.class, 1L).getName());
    assertEquals("one", storage.get(Item.class, 1.0d).getName());
  }

  @Test
  void removeWithOverflowingKeyDeletesNothing() {
    storage.replace(new Item(1, "one"));

    assertThrows(IllegalArgumentException.class, () -> storage.remove(Item.class, 4294967297L));
    assertThrows(IllegalArgumentException.class, () -> storage.remove(Item.class, 1.9d));
    assertEquals(1, storage.count(Item.class));
  }

  @Test
  void updateAndRemove() {
    long id = storage.insert(user("ann", null, 20));
    User ann = storage.get(User.class, id);
    ann.setEmail("new@example.com");

    storage.update(ann);
    assertEquals("new@example.com", storage.get(User.class, id).getEmail());

    storage.remove(User.class, id);
    assertFalse(storage.getOptional(User.class, id).isPresent());
  }

  @Test
  void bulkWritesHonourWhere() {
    storage.insertRange(
        User.class,
        List.of(user("ann", null, 20), user("amy", null, 25), user("bob", null, 30)));
    storage.insertRange(User.class, List.of());

    storage.updateAll(List.of(Assignment.set(userAge, 99)), where(like(userName, "a%")));
    assertEquals(2, storage.count(User.class, where(eq(userAge, 99))));

    storage.removeAll(User.class, where(gt(userAge, 50)));
    assertEquals(List.of("bob"), storage.select(userName));
  }

  @Test
  void updateAllRejectsNonWhereClauses() {
    assertThrows(
        IllegalArgumentException.class,
        () -> storage.updateAll(List.of(Assignment.set(userAge, 1)), limit(1)));
  }

  @Test
  void replaceRangeUpserts() {
    storage.replaceRange(Setting.class, List.of(new Setting("a", "1"), new Setting("b", "2")));
    storage.replaceRange(Setting.class, List.of(new Setting("a", "3")));

    assertEquals("3", storage.get(Setting.class, "a").getValue());
    assertEquals(2, storage.count(Setting.class));
  }

  @Test
  void plainInsertIsRejectedForTextKeyWithoutDefault() {
    StorageException e =
        assertThrows(StorageException.class, () -> storage.insert(new Setting("a", "1")));
    assertEquals(ErrorCode.INVALID_SCHEMA, e.errorCode());

    storage.insert(new Setting("a", "1"), List.of(settingKey, settingValue));
    assertEquals("1", storage.get(Setting.class, "a").getValue());
  }

  @Test
  void explicitInsertChecksNotNullColumns() {
    StorageException e =
        assertThrows(
            StorageException.class,
            () -> storage.insert(new Setting("a", null), List.of(settingKey, settingValue)));
    assertEquals(ErrorCode.VALUE_IS_NULL, e.errorCode());
    assertEquals(0, connections.references());
  }

  @Test
  void duplicateKeyIsAConstraintViolation() {
    storage.insert(new Setting("a", "1"), List.of(settingKey, settingValue));

    StorageException e =
        assertThrows(
            StorageException.class,
            () -> storage.insert(new Setting("a", "2"), List.of(settingKey, settingValue)));
    assertEquals(ErrorCode.CONSTRAINT_VIOLATION, e.errorCode());
    assertEquals(0, connections.references());
  }

  @Test
  void readsHonourClauses() {
    storage.insertRange(
        User.class,
        List.of(user("cat", null, 40), user("ann", null, 20), user("bob", null, 30)));

    List<User> page = storage.getAll(User.class, orderBy(userName), limit(2, 1));
    assertEquals(List.of("bob", "cat"), page.stream().map(User::getName).toList());

    List<Tuple> rows =
        storage.select(List.of(userName, userAge), where(gt(userAge, 25)), orderBy(userAge).desc());
    assertEquals(new Tuple(List.of("cat", 40)), rows.get(0));
    assertEquals(2, rows.size());
  }

  @Test
  void aggregatesOverEmptyAndFilledTables() {
    assertEquals(0L, storage.count(User.class));
    assertEquals(0.0d, storage.avg(userAge));
    assertEquals(Optional.empty(), storage.max(userAge));
    assertEquals(Optional.empty(), storage.sum(userAge));
    assertEquals(0.0d, storage.total(userAge));
    assertEquals(Optional.empty(), storage.groupConcat(userName));

    storage.insertRange(
        User.class, List.of(user("ann", null, 20), user("bob", null, 40), user("cy", null, null)));

    assertEquals(2L, storage.count(userAge));
    assertEquals(30.0d, storage.avg(userAge));
    assertEquals(Optional.of(40), storage.max(userAge));
    assertEquals(Optional.of(20), storage.min(userAge));
    assertEquals(Optional.of(60.0d), storage.sum(userAge));
    assertEquals(60.0d, storage.total(userAge));
    assertEquals(Optional.of("ann|bob"), storage.groupConcat(userName, "|", where(gt(userAge, 0))));
  }

  @Test
  void cursorStreamsRowsAndReleasesConnection() {
    storage.insertRange(User.class, List.of(user("ann", null, 1), user("bob", null, 2)));

    List<String> names = new ArrayList<>();
    try (RowCursor<User> cursor = storage.iterate(User.class, orderBy(userName))) {
      assertEquals(1, connections.references());
      while (cursor.hasNext()) {
        names.add(cursor.next().getName());
      }
    }
    assertEquals(List.of("ann", "bob"), names);
    assertEquals(0, connections.references());
  }

  @Test
  void preparedQueryIsReusableAndSeesCurrentObjectState() {
    User draft = user("first", null, null);
    try (PreparedQuery<Long> insert = storage.prepare(Statements.insert(draft))) {
      assertEquals(3, insert.parameterCount());
      long first = storage.execute(insert);
      draft.setName("second");
      long second = storage.execute(insert);

      assertEquals("first", storage.get(User.class, first).getName());
      assertEquals("second", storage.get(User.class, second).getName());
    }
    assertEquals(0, connections.references());
  }

  @Test
  void closedPreparedQueryCannotRun() {
    PreparedQuery<Long> count =
        storage.prepare(Statements.value(Aggregates.count(), User.class));
    assertEquals(0L, storage.execute(count));
    count.close();
    count.close();

    assertTrue(count.isClosed());
    assertThrows(IllegalStateException.class, () -> storage.execute(count));
  }

  @Test
  void dependentRowsFollowForeignKeys() {
    long ann = storage.insert(user("ann", null, null));
    long bob = storage.insert(user("bob", null, null));
    storage.insert(new Post(0, ann, "hello"));

    assertTrue(storage.hasDependentRows(storage.get(User.class, ann)));
    assertFalse(storage.hasDependentRows(storage.get(User.class, bob)));
    assertFalse(storage.hasDependentRows(new Setting("a", "1")));
  }

  @Test
  void dumpsObjectsAndStatements() {
    User ann = new User(1, "ann", null);

    assertEquals("{ id : '1', name : 'ann', email : 'null', age : 'null' }", storage.dump(ann));
    assertEquals(
        "SELECT \"users\".\"name\" FROM \"users\" WHERE \"users\".\"id\" = 1",
        storage.dump(Statements.select(userName, where(eq(userId, 1L))), false));
    assertEquals(
        "SELECT \"users\".\"name\" FROM \"users\" WHERE \"users\".\"id\" = ?",
        storage.dump(Statements.select(userName, where(eq(userId, 1L))), true));
  }

  @Test
  void transactionCommitsOrRollsBack() {
    assertTrue(storage.transaction(() -> {
      storage.insert(user("kept", null, null));
      return true;
    }));
    assertFalse(storage.transaction(() -> {
      storage.insert(user("dropped", null, null));
      return false;
    }));
    assertThrows(
        IllegalStateException.class,
        () ->
            storage.transaction(
                () -> {
                  storage.insert(user("failed", null, null));
                  throw new IllegalStateException("boom");
                }));

    assertEquals(List.of("kept"), storage.select(userName));
    assertEquals(0, connections.references());
  }

  @Test
  void columnNamesResolveOnlyForRegisteredInstances() {
    assertEquals(Optional.of("name"), storage.findColumnName(userName));
    assertEquals(Optional.empty(), storage.findColumnName(TestModel.userName()));

    StorageException e =
        assertThrows(StorageException.class, () -> storage.select(TestModel.userName()));
    assertEquals(ErrorCode.COLUMN_NOT_FOUND, e.errorCode());
  }

  @Test
  void modelRenamePointsStatementsAtNewTable() {
    storage.renameTable("users", "people");
    storage.renameTable(User.class, "people");

    assertEquals("people", storage.tableName(User.class));
    assertTrue(storage.tableExists("people"));
    storage.insert(user("ann", null, null));
    assertEquals(1, storage.count(User.class));
    assertThrows(StorageException.class, () -> storage.renameTable(User.class, "posts"));
  }

  @Test
  void userVersionPragma() {
    assertEquals(0, storage.userVersion());
    storage.setUserVersion(3);
    assertEquals(3, storage.userVersion());
    assertTrue(storage.engineVersion().startsWith("3."));
  }

  @Test
  void migrateRunsRegisteredHopOnHeldConnection() {
    storage.registerMigration(
        0,
        1,
        c -> {
          try (java.sql.Statement st = c.createStatement()) {
            st.execute("CREATE TABLE audit(id INTEGER PRIMARY KEY)");
            st.execute("PRAGMA user_version = 1");
          }
        });

    storage.migrateTo(1);

    assertTrue(storage.tableExists("audit"));
    assertEquals(1, storage.userVersion());
    StorageException e = assertThrows(StorageException.class, () -> storage.migrateTo(2));
    assertEquals(ErrorCode.MIGRATION_NOT_FOUND, e.errorCode());
    assertEquals(0, connections.references());
  }
}
