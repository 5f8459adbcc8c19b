/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import dev.tabula.api.PreparedQuery;
import dev.tabula.api.query.Statement;
import dev.tabula.core.ConnectionHolder;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JDBC-backed {@link PreparedQuery}; owns its statement and one connection reference. */
public final class PreparedQueryImpl<R> implements PreparedQuery<R> {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private final Statement<R> statement;
  private final CompiledSql compiled;
  private final PreparedStatement prepared;
  private final ConnectionHolder.Ref connection;
  private boolean closed;

  private PreparedQueryImpl(
      Statement<R> statement,
      CompiledSql compiled,
      PreparedStatement prepared,
      ConnectionHolder.Ref connection) {
    this.statement = statement;
    this.compiled = compiled;
    this.prepared = prepared;
    this.connection = connection;
  }

  /**
   * Prepares compiled SQL on the referenced connection. On failure the reference is released.
   *
   * @param statement description the SQL was compiled from
   * @param compiled SQL and slots
   * @param connection connection reference now owned by the query
   * @return open query
   * @throws SQLException if the engine rejects the SQL
   */
  public static <R> PreparedQueryImpl<R> prepare(
      Statement<R> statement, CompiledSql compiled, ConnectionHolder.Ref connection)
      throws SQLException {
    try {
      PreparedStatement prepared = connection.connection().prepareStatement(compiled.sql());
      LOG.debug("(tabula) op=prepare sql={} params={}", compiled.sql(), compiled.slots().size());
      return new PreparedQueryImpl<>(statement, compiled, prepared, connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
  }

  /**
   * Clears previous parameters and binds every slot at its 1-based position.
   *
   * @throws SQLException if the driver rejects a value
   */
  void bind() throws SQLException {
    ensureOpen();
    prepared.clearParameters();
    List<ParameterSlot> slots = compiled.slots();
    for (int i = 0; i < slots.size(); i++) {
      slots.get(i).bind(prepared, i + 1);
    }
  }

  PreparedStatement handle() {
    ensureOpen();
    return prepared;
  }

  Connection connection() {
    return connection.connection();
  }

  List<ParameterSlot> slots() {
    return compiled.slots();
  }

  @Override
  public String sql() {
    return compiled.sql();
  }

  @Override
  public int parameterCount() {
    return compiled.slots().size();
  }

  @Override
  public Statement<R> statement() {
    return statement;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      prepared.close();
    } catch (SQLException e) {
      LOG.warn(
          "(tabula) op={} message={} sqlState={} vendor={} phase=close",
          "prepared.finalize",
          e.getMessage(),
          e.getSQLState(),
          e.getErrorCode(),
          e);
    } finally {
      connection.close();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("prepared query is closed: " + compiled.sql());
    }
  }
}
