package nestedtx.jdbc;

import nestedtx.NoActiveTransactionException;
import nestedtx.TransactionAlreadyActiveException;
import nestedtx.TransactionCoordinator;
import nestedtx.TransactionException;
import nestedtx.TxCallback;
import nestedtx.TxScope;
import nestedtx.TxWork;
import nestedtx.spi.TxObserver;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Nested transaction management for plain JDBC. Wraps a {@link TransactionCoordinator} whose
 * real transactions are connections obtained from a {@link ConnectionProvider}.
 *
 * <pre>{@code
 * var txManager = new JdbcTransactionManager(dataSource);
 *
 * txManager.runIn(TxScope.empty(), scope -> {
 *     Connection conn = txManager.currentConnection(scope);
 *     insertOrder(conn, order);
 *     txManager.runIn(scope, inner -> insertAudit(txManager.currentConnection(inner), order));
 * });
 * }</pre>
 *
 * @see TransactionCoordinator
 * @see JdbcTransaction
 */
public final class JdbcTransactionManager {
  private final TransactionCoordinator coordinator;

  public JdbcTransactionManager(DataSource dataSource) {
    this(ConnectionProvider.of(dataSource));
  }

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this(connectionProvider, TxObserver.NOOP);
  }

  /**
   * @param connectionProvider source of connections for outermost transactions
   * @param observer           statement listener; {@code null} defaults to {@link TxObserver#NOOP}
   */
  public JdbcTransactionManager(ConnectionProvider connectionProvider, TxObserver observer) {
    this.coordinator = new TransactionCoordinator(new JdbcTransactionSource(connectionProvider), observer);
  }

  /**
   * Returns the underlying coordinator.
   */
  public TransactionCoordinator coordinator() {
    return coordinator;
  }

  /** @see TransactionCoordinator#start(TxScope) */
  public TxScope start(TxScope scope) {
    return coordinator.start(scope);
  }

  /** @see TransactionCoordinator#commit(TxScope) */
  public TxScope commit(TxScope scope) {
    return coordinator.commit(scope);
  }

  /** @see TransactionCoordinator#rollback(TxScope) */
  public TxScope rollback(TxScope scope) {
    return coordinator.rollback(scope);
  }

  /** @see TransactionCoordinator#runIn(TxScope, TxWork) */
  public <E extends Exception> void runIn(TxScope scope, TxWork<E> work) throws E {
    coordinator.runIn(scope, work);
  }

  /** @see TransactionCoordinator#callIn(TxScope, TxCallback) */
  public <T, E extends Exception> T callIn(TxScope scope, TxCallback<T, E> callback) throws E {
    return coordinator.callIn(scope, callback);
  }

  /**
   * Brings a connection with an already open transaction under coordination. The connection is
   * committed or rolled back by the outermost {@link #commit}/{@link #rollback} on the returned
   * scope but never closed; it stays owned by the caller.
   *
   * @throws IllegalArgumentException           if {@code connection} is {@code null} or in
   *                                            auto-commit mode
   * @throws TransactionAlreadyActiveException if {@code scope} already carries a transaction
   */
  public TxScope adopt(TxScope scope, Connection connection) {
    if (connection == null) {
      throw new IllegalArgumentException("No transaction provided");
    }
    if (coordinator.isActive(scope)) {
      throw new TransactionAlreadyActiveException();
    }
    boolean autoCommit;
    try {
      autoCommit = connection.getAutoCommit();
    } catch (SQLException e) {
      throw new TransactionException("Failed to inspect connection", e);
    }
    if (autoCommit) {
      throw new IllegalArgumentException("Connection is in auto-commit mode");
    }
    return coordinator.adopt(scope, JdbcTransaction.external(connection));
  }

  /**
   * Returns the transaction active in {@code scope}, or {@code null} if there is none.
   */
  public JdbcTransaction getActive(TxScope scope) {
    return (JdbcTransaction) coordinator.getActive(scope);
  }

  /**
   * Returns the connection of the transaction active in {@code scope}. The same connection is
   * returned at every nesting depth.
   *
   * @throws NoActiveTransactionException if {@code scope} carries no active transaction
   */
  public Connection currentConnection(TxScope scope) {
    JdbcTransaction transaction = getActive(scope);
    if (transaction == null) {
      throw new NoActiveTransactionException();
    }
    return transaction.connection();
  }

  /** @see TransactionCoordinator#isActive(TxScope) */
  public boolean isActive(TxScope scope) {
    return coordinator.isActive(scope);
  }

  /** @see TransactionCoordinator#depth(TxScope) */
  public int depth(TxScope scope) {
    return coordinator.depth(scope);
  }
}
