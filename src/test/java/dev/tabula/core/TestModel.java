/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.sqlite.SQLiteDataSource;

/** Mapped test types and SQLite helpers shared by the core tests. */
final class TestModel {
  private TestModel() {}

  static final class User {
    private long id;
    private String name;
    private String email;
    private Integer age;

    User() {}

    User(long id, String name, String email) {
      this.id = id;
      this.name = name;
      this.email = email;
    }

    long getId() {
      return id;
    }

    void setId(long id) {
      this.id = id;
    }

    String getName() {
      return name;
    }

    void setName(String name) {
      this.name = name;
    }

    String getEmail() {
      return email;
    }

    void setEmail(String email) {
      this.email = email;
    }

    Integer getAge() {
      return age;
    }

    void setAge(Integer age) {
      this.age = age;
    }
  }

  static final class Post {
    private long id;
    private long userId;
    private String title;

    Post() {}

    Post(long id, long userId, String title) {
      this.id = id;
      this.userId = userId;
      this.title = title;
    }

    long getId() {
      return id;
    }

    void setId(long id) {
      this.id = id;
    }

    long getUserId() {
      return userId;
    }

    void setUserId(long userId) {
      this.userId = userId;
    }

    String getTitle() {
      return title;
    }

    void setTitle(String title) {
      this.title = title;
    }
  }

  static Column<User, Long> userId() {
    return Column.of("id", Long.class, User::getId, User::setId).primaryKey();
  }

  static Column<User, String> userName() {
    return Column.of("name", String.class, User::getName, User::setName).notNull();
  }

  static Column<User, String> userEmail() {
    return Column.of("email", String.class, User::getEmail, User::setEmail);
  }

  static Column<User, Integer> userAge() {
    return Column.of("age", Integer.class, User::getAge, User::setAge);
  }

  @SafeVarargs
  static Table<User> users(Column<User, ?>... columns) {
    Table.Builder<User> builder = Table.builder("users", User.class, User::new);
    for (Column<User, ?> column : columns) {
      builder.column(column);
    }
    return builder.build();
  }

  static Schema schemaOf(Table<?>... tables) {
    Schema.Builder builder = Schema.builder();
    for (Table<?> table : tables) {
      builder.table(table);
    }
    return builder.build();
  }

  static SQLiteDataSource dataSource(Path file) {
    SQLiteDataSource dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
    return dataSource;
  }

  static SQLiteDataSource enforcingDataSource(Path file) {
    SQLiteDataSource dataSource = dataSource(file);
    dataSource.setEnforceForeignKeys(true);
    return dataSource;
  }

  static StorageImpl storage(Path file, Schema schema, DropColumnSupport dropColumn)
      throws SQLException {
    return new StorageImpl(schema, new ConnectionHolder(dataSource(file), false), dropColumn);
  }

  static void exec(Path file, String... sql) throws SQLException {
    try (Connection c = dataSource(file).getConnection();
        Statement st = c.createStatement()) {
      for (String statement : sql) {
        st.execute(statement);
      }
    }
  }

  static long countRows(Path file, String table) throws SQLException {
    try (Connection c = dataSource(file).getConnection();
        Statement st = c.createStatement();
        var rows = st.executeQuery("SELECT COUNT(*) FROM \"" + table + "\"")) {
      rows.next();
      return rows.getLong(1);
    }
  }
}
