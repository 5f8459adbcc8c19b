/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.Migration;
import dev.tabula.api.PreparedQuery;
import dev.tabula.api.RowCursor;
import dev.tabula.api.Storage;
import dev.tabula.api.StorageException;
import dev.tabula.api.SyncResult;
import dev.tabula.api.TransactionWork;
import dev.tabula.api.query.Aggregates;
import dev.tabula.api.query.Assignment;
import dev.tabula.api.query.Clause;
import dev.tabula.api.query.Clauses;
import dev.tabula.api.query.Condition;
import dev.tabula.api.query.Conditions;
import dev.tabula.api.query.Expression;
import dev.tabula.api.query.Statement;
import dev.tabula.api.query.Tuple;
import dev.tabula.api.query.Value;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.ColumnInfo;
import dev.tabula.api.schema.ForeignKey;
import dev.tabula.api.schema.Index;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import dev.tabula.core.exec.PreparedQueryImpl;
import dev.tabula.core.exec.RowCursorImpl;
import dev.tabula.core.exec.SerializerContext;
import dev.tabula.core.exec.SqlSerializer;
import dev.tabula.core.exec.StatementExecutor;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link Storage} over one reference-counted SQLite connection. */
public final class StorageImpl implements Storage {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private final Schema schema;
  private final ConnectionHolder connections;
  private final SchemaDiffEngine diffEngine;
  private final SchemaSynchronizer synchronizer;
  private final MigrationRegistry migrations = new MigrationRegistry();
  private final SqlSerializer serializer;
  private final StatementExecutor executor;

  /**
   * Creates a new instance.
   *
   * @param schema declared model
   * @param connections connection owner; closed by {@link #close()}
   * @param dropColumnSupport native {@code DROP COLUMN} policy for schema sync
   */
  public StorageImpl(
      Schema schema, ConnectionHolder connections, DropColumnSupport dropColumnSupport) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.diffEngine = new SchemaDiffEngine(dropColumnSupport);
    this.synchronizer = new SchemaSynchronizer(schema);
    this.serializer = new SqlSerializer(schema);
    this.executor = new StatementExecutor(schema);
  }

  // --- schema ---

  @Override
  public Map<String, SyncResult> syncSchema(boolean preserve) {
    return withConnection(
        "syncSchema",
        c -> {
          Map<String, SyncResult> results = new LinkedHashMap<>();
          for (Table<?> table : schema.tables()) {
            SchemaStatus status = diffEngine.classify(c, table, preserve);
            SyncResult result = synchronizer.apply(c, table, status, preserve);
            LOG.info(
                "(tabula) op=syncSchema table={} result={} preserve={}",
                table.name(),
                result.name(),
                preserve);
            results.put(table.name(), result);
          }
          for (Index index : schema.indexes()) {
            Table<?> owner = schema.tableOf(index.columns().get(0)).orElseThrow();
            SchemaSynchronizer.execute(c, TableDdl.createIndex(index, owner.name()));
            results.put(index.name(), SyncResult.ALREADY_IN_SYNC);
          }
          return results;
        });
  }

  @Override
  public Map<String, SyncResult> syncSchemaSimulate(boolean preserve) {
    return withConnection(
        "syncSchemaSimulate",
        c -> {
          Map<String, SyncResult> results = new LinkedHashMap<>();
          for (Table<?> table : schema.tables()) {
            SyncResult result = diffEngine.classify(c, table, preserve).result();
            LOG.debug(
                "(tabula) op=syncSchemaSimulate table={} result={}", table.name(), result.name());
            results.put(table.name(), result);
          }
          for (Index index : schema.indexes()) {
            results.put(index.name(), SyncResult.ALREADY_IN_SYNC);
          }
          return results;
        });
  }

  @Override
  public boolean tableExists(String tableName) {
    return withConnection("tableExists", c -> SchemaInspector.tableExists(c, tableName));
  }

  @Override
  public List<ColumnInfo> tableInfo(String tableName) {
    return withConnection("tableInfo", c -> SchemaInspector.tableXinfo(c, tableName));
  }

  @Override
  public void renameTable(String from, String to) {
    withConnection(
        "renameTable",
        c -> {
          SchemaSynchronizer.execute(c, TableDdl.renameTable(from, to));
          return null;
        });
  }

  @Override
  public void renameTable(Class<?> type, String newName) {
    Table<?> table = schema.table(type);
    Optional<Table<?>> clash = schema.tableNamed(newName);
    if (clash.isPresent() && clash.get() != table) {
      throw new StorageException(
          ErrorCode.INVALID_SCHEMA, "another mapped table is already named " + newName);
    }
    String previous = table.name();
    table.renameTo(newName);
    LOG.debug("(tabula) op=renameTable.model from={} to={}", previous, table.name());
  }

  @Override
  public String tableName(Class<?> type) {
    return schema.table(type).name();
  }

  @Override
  public Optional<String> findColumnName(Column<?, ?> column) {
    return schema.tableOf(column).map(table -> column.name());
  }

  // --- versioning ---

  @Override
  public void registerMigration(int from, int to, Migration migration) {
    migrations.register(from, to, migration);
  }

  @Override
  public void migrateTo(int targetVersion) {
    withConnection(
        "migrateTo",
        c -> {
          migrations.migrate(c, targetVersion);
          return null;
        });
  }

  @Override
  public int userVersion() {
    return withConnection("userVersion", SchemaInspector::userVersion);
  }

  @Override
  public void setUserVersion(int version) {
    withConnection(
        "setUserVersion",
        c -> {
          SchemaInspector.setUserVersion(c, version);
          return null;
        });
  }

  @Override
  public String engineVersion() {
    return withConnection("engineVersion", SchemaInspector::engineVersion);
  }

  // --- reads ---

  @Override
  public <T> T get(Class<T> type, Object... ids) {
    return run("get", new Statement.Get<>(type, Arrays.asList(ids), true));
  }

  @Override
  public <T> Optional<T> getOptional(Class<T> type, Object... ids) {
    return Optional.ofNullable(getOrNull(type, ids));
  }

  @Override
  public <T> T getOrNull(Class<T> type, Object... ids) {
    return run("getOrNull", new Statement.Get<>(type, Arrays.asList(ids), false));
  }

  @Override
  public <T> List<T> getAll(Class<T> type, Clause... clauses) {
    return run("getAll", new Statement.GetAll<>(type, List.of(clauses)));
  }

  @Override
  public <T> RowCursor<T> iterate(Class<T> type, Clause... clauses) {
    Table<T> table = schema.table(type);
    PreparedQueryImpl<List<T>> query =
        prepareInternal("iterate", new Statement.GetAll<>(type, List.of(clauses)));
    try {
      return RowCursorImpl.open(table, query);
    } catch (SQLException e) {
      throw SqlErrorCodes.translate("iterate", e);
    }
  }

  @Override
  public <R> List<R> select(Expression<R> expression, Clause... clauses) {
    return run("select", new Statement.Select<>(expression, List.of(clauses)));
  }

  @Override
  public List<Tuple> select(List<Expression<?>> expressions, Clause... clauses) {
    return run("select", new Statement.SelectTuples(expressions, List.of(clauses)));
  }

  @Override
  public long count(Class<?> type, Clause... clauses) {
    Long count =
        run("count", new Statement.SelectValue<>(Aggregates.count(), type, List.of(clauses)));
    return count == null ? 0L : count;
  }

  @Override
  public long count(Expression<?> expression, Clause... clauses) {
    Long count = aggregate("count", Aggregates.count(expression), clauses);
    return count == null ? 0L : count;
  }

  @Override
  public double avg(Expression<?> expression, Clause... clauses) {
    Double avg = aggregate("avg", Aggregates.avg(expression), clauses);
    return avg == null ? 0.0d : avg;
  }

  @Override
  public <F> Optional<F> max(Expression<F> expression, Clause... clauses) {
    return Optional.ofNullable(aggregate("max", Aggregates.max(expression), clauses));
  }

  @Override
  public <F> Optional<F> min(Expression<F> expression, Clause... clauses) {
    return Optional.ofNullable(aggregate("min", Aggregates.min(expression), clauses));
  }

  @Override
  public Optional<Double> sum(Expression<?> expression, Clause... clauses) {
    return Optional.ofNullable(aggregate("sum", Aggregates.sum(expression), clauses));
  }

  @Override
  public double total(Expression<?> expression, Clause... clauses) {
    Double total = aggregate("total", Aggregates.total(expression), clauses);
    return total == null ? 0.0d : total;
  }

  @Override
  public Optional<String> groupConcat(Expression<?> expression, Clause... clauses) {
    return Optional.ofNullable(
        aggregate("groupConcat", Aggregates.groupConcat(expression), clauses));
  }

  @Override
  public Optional<String> groupConcat(
      Expression<?> expression, String separator, Clause... clauses) {
    return Optional.ofNullable(
        aggregate("groupConcat", Aggregates.groupConcat(expression, separator), clauses));
  }

  private <R> R aggregate(String op, Expression<R> call, Clause... clauses) {
    return run(op, new Statement.SelectValue<>(call, null, List.of(clauses)));
  }

  // --- writes ---

  @Override
  public <T> long insert(T object) {
    return run("insert", new Statement.Insert<>(typeOf(object), object));
  }

  @Override
  public <T> long insert(T object, List<Column<T, ?>> columns) {
    return run("insert", new Statement.InsertColumns<>(typeOf(object), object, columns));
  }

  @Override
  public <T> void insertRange(Class<T> type, List<T> objects) {
    if (objects.isEmpty()) {
      return;
    }
    run("insertRange", new Statement.InsertRange<>(type, objects, false));
  }

  @Override
  public <T> void replace(T object) {
    run("replace", new Statement.Replace<>(typeOf(object), object));
  }

  @Override
  public <T> void replaceRange(Class<T> type, List<T> objects) {
    if (objects.isEmpty()) {
      return;
    }
    run("replaceRange", new Statement.InsertRange<>(type, objects, true));
  }

  @Override
  public <T> void update(T object) {
    run("update", new Statement.Update<>(typeOf(object), object));
  }

  @Override
  public void updateAll(List<Assignment<?>> assignments, Clause... clauses) {
    run("updateAll", new Statement.UpdateAll(assignments, List.of(clauses)));
  }

  @Override
  public <T> void remove(Class<T> type, Object... ids) {
    run("remove", new Statement.Remove<>(type, Arrays.asList(ids)));
  }

  @Override
  public <T> void removeAll(Class<T> type, Clause... clauses) {
    run("removeAll", new Statement.RemoveAll<>(type, List.of(clauses)));
  }

  @Override
  public <T> boolean hasDependentRows(T object) {
    Table<T> table = schema.table(typeOf(object));
    for (Table<?> source : schema.tables()) {
      for (ForeignKey<?> foreignKey : source.foreignKeys()) {
        if (schema.tableOf(foreignKey.references().get(0)).orElse(null) != table) {
          continue;
        }
        Condition where = null;
        for (int i = 0; i < foreignKey.columns().size(); i++) {
          Column<?, ?> referencing = foreignKey.columns().get(i);
          Column<?, ?> referenced = foreignKey.references().get(i);
          if (!table.owns(referenced)) {
            throw new StorageException(
                ErrorCode.COLUMN_NOT_FOUND,
                "column " + referenced.name() + " is not registered in " + table.name());
          }
          Object value = readField(referenced, object);
          if (value == null) {
            throw new StorageException(
                ErrorCode.VALUE_IS_NULL,
                "referenced column " + table.name() + "." + referenced.name() + " is null");
          }
          Condition match = new Condition.Binary(referencing, "=", valueFor(referencing, value));
          where = where == null ? match : Conditions.and(where, match);
        }
        Long dependents =
            run(
                "hasDependentRows",
                new Statement.SelectValue<>(
                    Aggregates.count(), source.type(), List.of(Clauses.where(where))));
        if (dependents != null && dependents > 0) {
          return true;
        }
      }
    }
    return false;
  }

  // --- debugging ---

  @Override
  public <T> String dump(T object) {
    Table<T> table = schema.table(typeOf(object));
    StringBuilder out = new StringBuilder("{ ");
    List<Column<T, ?>> columns = table.columns();
    for (int i = 0; i < columns.size(); i++) {
      Column<T, ?> column = columns.get(i);
      if (i > 0) {
        out.append(", ");
      }
      out.append(column.name())
          .append(" : '")
          .append(column.codec().printUnchecked(column.read(object)))
          .append('\'');
    }
    return out.append(" }").toString();
  }

  @Override
  public String dump(Statement<?> statement, boolean parametrized) {
    return serializer.compile(statement, new SerializerContext(false, parametrized)).sql();
  }

  @Override
  public String dump(PreparedQuery<?> query) {
    return query.sql();
  }

  // --- prepared statements ---

  @Override
  public <R> PreparedQuery<R> prepare(Statement<R> statement) {
    return prepareInternal("prepare", statement);
  }

  @Override
  public <R> R execute(PreparedQuery<R> query) {
    if (!(query instanceof PreparedQueryImpl<R> impl)) {
      throw new IllegalArgumentException("query was not prepared by this storage");
    }
    if (impl.isClosed()) {
      throw new IllegalStateException("prepared query is closed: " + impl.sql());
    }
    try {
      return executor.execute(impl);
    } catch (SQLException e) {
      throw SqlErrorCodes.translate("execute", e);
    }
  }

  // --- transactions ---

  @Override
  public boolean transaction(TransactionWork work) {
    Objects.requireNonNull(work, "work");
    try (ConnectionHolder.Ref ref = connections.acquire()) {
      Connection c = ref.connection();
      c.setAutoCommit(false);
      boolean committed = false;
      try {
        if (work.run()) {
          c.commit();
          committed = true;
        } else {
          c.rollback();
        }
      } catch (RuntimeException e) {
        try {
          c.rollback();
        } catch (SQLException rollbackError) {
          e.addSuppressed(rollbackError);
        }
        throw e;
      } finally {
        c.setAutoCommit(true);
      }
      LOG.debug("(tabula) op=transaction committed={}", committed);
      return committed;
    } catch (SQLException e) {
      throw SqlErrorCodes.translate("transaction", e);
    }
  }

  @Override
  public void close() {
    connections.close();
  }

  // --- plumbing ---

  private <R> R run(String op, Statement<R> statement) {
    try (PreparedQueryImpl<R> query = prepareInternal(op, statement)) {
      return executor.execute(query);
    } catch (SQLException e) {
      throw SqlErrorCodes.translate(op, e);
    }
  }

  private <R> PreparedQueryImpl<R> prepareInternal(String op, Statement<R> statement) {
    var compiled = serializer.compile(statement, SerializerContext.PARAMETRIZED);
    try {
      return PreparedQueryImpl.prepare(statement, compiled, connections.acquire());
    } catch (SQLException e) {
      throw SqlErrorCodes.translate(op, e);
    }
  }

  private <T> T withConnection(String op, SqlWork<T> work) {
    try (ConnectionHolder.Ref ref = connections.acquire()) {
      return work.apply(ref.connection());
    } catch (SQLException e) {
      throw SqlErrorCodes.translate(op, e);
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> Class<T> typeOf(T object) {
    Objects.requireNonNull(object, "object");
    return (Class<T>) object.getClass();
  }

  @SuppressWarnings("unchecked")
  private static Object readField(Column<?, ?> column, Object object) {
    return ((Column<Object, ?>) column).read(object);
  }

  @SuppressWarnings("unchecked")
  private static <F> Value<F> valueFor(Column<?, F> column, Object value) {
    return new Value<>((F) value, column.codec());
  }

  /**
   * JDBC work against the held connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  private interface SqlWork<T> {
    T apply(Connection c) throws SQLException;
  }
}
