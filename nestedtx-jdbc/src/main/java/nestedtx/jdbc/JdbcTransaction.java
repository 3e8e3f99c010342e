package nestedtx.jdbc;

import nestedtx.spi.SqlTransaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SqlTransaction} over a JDBC {@link Connection} in manual-commit mode.
 *
 * <p>Savepoints are created through {@link Connection#setSavepoint(String)}, so the driver
 * renders its own savepoint syntax. Transactions begun by {@link JdbcTransactionSource} own their
 * connection: on {@link #release()} auto-commit is restored and the connection is closed, handing
 * it back to the pool. Transactions wrapping an {@linkplain #external(Connection) external}
 * connection leave it open.
 *
 * <p>Application code reaches the connection through {@link #connection()} and must not call
 * {@code commit}, {@code rollback} or the savepoint methods itself; they belong to the
 * coordinator, which serializes them.
 */
public final class JdbcTransaction implements SqlTransaction {
  private final Connection connection;
  private final boolean ownsConnection;
  private final Map<String, Savepoint> savepoints = new HashMap<>();

  private JdbcTransaction(Connection connection, boolean ownsConnection) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.ownsConnection = ownsConnection;
  }

  static JdbcTransaction owning(Connection connection) {
    return new JdbcTransaction(connection, true);
  }

  /**
   * Wraps a connection whose transaction was opened and will be closed by the caller.
   * The connection must already be in manual-commit mode.
   */
  public static JdbcTransaction external(Connection connection) {
    return new JdbcTransaction(connection, false);
  }

  /**
   * Returns the connection the transaction runs on.
   */
  public Connection connection() {
    return connection;
  }

  @Override
  public void savepoint(String name) throws SQLException {
    savepoints.put(name, connection.setSavepoint(name));
  }

  @Override
  public void releaseSavepoint(String name) throws SQLException {
    connection.releaseSavepoint(require(name));
    savepoints.remove(name);
  }

  @Override
  public void rollbackToSavepoint(String name) throws SQLException {
    connection.rollback(require(name));
    savepoints.remove(name);
  }

  @Override
  public void commit() throws SQLException {
    connection.commit();
    savepoints.clear();
  }

  @Override
  public void rollback() throws SQLException {
    try {
      connection.rollback();
    } finally {
      savepoints.clear();
    }
  }

  @Override
  public void release() throws SQLException {
    if (!ownsConnection) {
      return;
    }
    try {
      connection.setAutoCommit(true);
    } finally {
      connection.close();
    }
  }

  private Savepoint require(String name) throws SQLException {
    Savepoint savepoint = savepoints.get(name);
    if (savepoint == null) {
      throw new SQLException("Unknown savepoint: " + name);
    }
    return savepoint;
  }
}
