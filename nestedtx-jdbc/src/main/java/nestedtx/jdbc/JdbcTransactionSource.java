package nestedtx.jdbc;

import nestedtx.spi.TransactionSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link TransactionSource} that opens each transaction on a fresh connection from a
 * {@link ConnectionProvider}, with auto-commit disabled.
 */
public final class JdbcTransactionSource implements TransactionSource {
  private final ConnectionProvider connectionProvider;

  public JdbcTransactionSource(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  @Override
  public JdbcTransaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return JdbcTransaction.owning(connection);
  }
}
