/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference-counted owner of the storage's single JDBC connection.
 *
 * <p>The connection is opened by the first {@link #acquire()} and closed when the last {@link Ref}
 * is released. Holders created with {@code keepOpen} (in-memory databases, whose contents live only
 * as long as their connection) open immediately and keep the connection until {@link #close()}.
 */
public final class ConnectionHolder implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("tabula");

  private final DataSource dataSource;
  private final boolean keepOpen;
  private Connection connection;
  private int references;
  private Ref permanent;

  /**
   * Creates a holder.
   *
   * @param dataSource connection source
   * @param keepOpen hold one reference until {@link #close()}
   * @throws SQLException if {@code keepOpen} is set and the connection cannot be opened
   */
  public ConnectionHolder(DataSource dataSource, boolean keepOpen) throws SQLException {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.keepOpen = keepOpen;
    if (keepOpen) {
      this.permanent = acquire();
    }
  }

  /**
   * Takes a reference, opening the connection if none is open.
   *
   * @return reference; close it exactly once
   * @throws SQLException if opening the connection fails
   */
  public synchronized Ref acquire() throws SQLException {
    if (connection == null) {
      connection = dataSource.getConnection();
      LOG.debug("(tabula) op=connection.open keepOpen={}", keepOpen);
    }
    references++;
    return new Ref(connection);
  }

  /** Current reference count. */
  public synchronized int references() {
    return references;
  }

  public synchronized boolean isOpen() {
    return connection != null;
  }

  private synchronized void release() {
    if (references == 0) {
      return;
    }
    references--;
    if (references == 0 && connection != null) {
      Connection closing = connection;
      connection = null;
      try {
        closing.close();
        LOG.debug("(tabula) op=connection.close");
      } catch (SQLException e) {
        LOG.warn(
            "(tabula) op={} message={} sqlState={} vendor={} phase=close",
            "connection.release",
            e.getMessage(),
            e.getSQLState(),
            e.getErrorCode(),
            e);
      }
    }
  }

  /** Drops the permanent reference of a {@code keepOpen} holder. */
  @Override
  public void close() {
    Ref held;
    synchronized (this) {
      held = permanent;
      permanent = null;
    }
    if (held != null) {
      held.close();
    }
  }

  /** One counted use of the connection. */
  public final class Ref implements AutoCloseable {
    private final Connection connection;
    private boolean released;

    private Ref(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      return connection;
    }

    @Override
    public void close() {
      synchronized (ConnectionHolder.this) {
        if (released) {
          return;
        }
        released = true;
      }
      release();
    }
  }
}
