package nestedtx.spi;

import java.sql.SQLException;

/**
 * Opens real database transactions for a {@link nestedtx.TransactionCoordinator}.
 *
 * <p>Called once per outermost scope; nested scopes reuse the transaction through savepoints.
 */
@FunctionalInterface
public interface TransactionSource {

  /**
   * Begins a new real transaction.
   *
   * @return an open transaction, exclusively owned by the caller
   * @throws SQLException if the transaction cannot be started
   */
  SqlTransaction begin() throws SQLException;
}
