/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link DataSource} so that every {@code execute*} call slower than a threshold is logged
 * at WARN with code {@code DB_SLOW_QUERY}.
 */
final class SlowQueryDataSource implements DataSource {
  static final String CODE = "DB_SLOW_QUERY";
  private static final int MAX_SQL_LENGTH = 160;

  private final DataSource delegate;
  private final long thresholdMs;
  private final Logger logger;

  private SlowQueryDataSource(DataSource delegate, long thresholdMs, Logger logger) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.thresholdMs = thresholdMs;
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  static DataSource wrap(DataSource delegate, long thresholdMs) {
    return wrap(delegate, thresholdMs, LoggerFactory.getLogger("tabula"));
  }

  /**
   * Returns {@code delegate} unchanged when the threshold is not positive.
   *
   * @param delegate data source to time
   * @param thresholdMs latency budget in milliseconds
   * @param logger destination for slow-query warnings
   * @return timed data source
   */
  static DataSource wrap(DataSource delegate, long thresholdMs, Logger logger) {
    if (thresholdMs <= 0 || delegate instanceof SlowQueryDataSource) {
      return delegate;
    }
    return new SlowQueryDataSource(delegate, thresholdMs, logger);
  }

  @Override
  public Connection getConnection() throws SQLException {
    return timedConnection(delegate.getConnection());
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    return timedConnection(delegate.getConnection(username, password));
  }

  private Connection timedConnection(Connection connection) {
    ConnectionHandler handler = new ConnectionHandler(connection);
    Connection proxy =
        (Connection)
            Proxy.newProxyInstance(
                Connection.class.getClassLoader(), new Class<?>[] {Connection.class}, handler);
    handler.proxy = proxy;
    return proxy;
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) {
      return iface.cast(this);
    }
    return delegate.unwrap(iface);
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) throws SQLException {
    return iface.isInstance(this) || delegate.isWrapperFor(iface);
  }

  @Override
  public PrintWriter getLogWriter() throws SQLException {
    return delegate.getLogWriter();
  }

  @Override
  public void setLogWriter(PrintWriter out) throws SQLException {
    delegate.setLogWriter(out);
  }

  @Override
  public void setLoginTimeout(int seconds) throws SQLException {
    delegate.setLoginTimeout(seconds);
  }

  @Override
  public int getLoginTimeout() throws SQLException {
    return delegate.getLoginTimeout();
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    return delegate.getParentLogger();
  }

  static String abbreviate(String sql) {
    if (sql == null) {
      return "<unknown>";
    }
    String normalized = sql.replaceAll("\\s+", " ").trim();
    if (normalized.length() <= MAX_SQL_LENGTH) {
      return normalized;
    }
    return normalized.substring(0, MAX_SQL_LENGTH - 3) + "...";
  }

  private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      throw e.getCause();
    }
  }

  private final class ConnectionHandler implements InvocationHandler {
    private final Connection target;
    private Connection proxy;

    private ConnectionHandler(Connection target) {
      this.target = target;
    }

    @Override
    public Object invoke(Object self, Method method, Object[] args) throws Throwable {
      switch (method.getName()) {
        case "equals":
          return self == args[0];
        case "hashCode":
          return System.identityHashCode(self);
        default:
          break;
      }
      Object result = SlowQueryDataSource.invoke(target, method, args);
      if (result instanceof Statement statement) {
        String sql = args != null && args.length > 0 && args[0] instanceof String s ? s : null;
        Class<?> type =
            statement instanceof PreparedStatement ? PreparedStatement.class : Statement.class;
        return Proxy.newProxyInstance(
            type.getClassLoader(),
            new Class<?>[] {type},
            new StatementHandler(statement, proxy, sql));
      }
      return result;
    }
  }

  private final class StatementHandler implements InvocationHandler {
    private final Statement target;
    private final Connection connection;
    private final String preparedSql;

    private StatementHandler(Statement target, Connection connection, String preparedSql) {
      this.target = target;
      this.connection = connection;
      this.preparedSql = preparedSql;
    }

    @Override
    public Object invoke(Object self, Method method, Object[] args) throws Throwable {
      String name = method.getName();
      switch (name) {
        case "equals":
          return self == args[0];
        case "hashCode":
          return System.identityHashCode(self);
        case "getConnection":
          return connection;
        default:
          break;
      }
      if (!name.startsWith("execute")) {
        return SlowQueryDataSource.invoke(target, method, args);
      }
      long startNs = System.nanoTime();
      try {
        return SlowQueryDataSource.invoke(target, method, args);
      } finally {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        if (elapsedMs >= thresholdMs) {
          String sql =
              args != null && args.length > 0 && args[0] instanceof String s ? s : preparedSql;
          logger.warn(
              "(tabula) code={} op={} elapsedMs={} thresholdMs={} sql={}",
              CODE,
              name,
              elapsedMs,
              thresholdMs,
              abbreviate(sql));
        }
      }
    }
  }
}
