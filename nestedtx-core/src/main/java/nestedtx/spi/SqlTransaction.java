package nestedtx.spi;

import java.sql.SQLException;

/**
 * A real database transaction as seen by the coordinator.
 *
 * <p>Implementations need not be thread-safe: the coordinator serializes every call it makes
 * on a given transaction. Savepoint names are opaque identifiers chosen by the coordinator
 * ({@code SP1}, {@code SP2}, ...) and are never reused within one transaction.
 *
 * @see TransactionSource
 */
public interface SqlTransaction {

  /**
   * Creates a savepoint ({@code SAVEPOINT name}).
   */
  void savepoint(String name) throws SQLException;

  /**
   * Releases a savepoint, keeping its changes ({@code RELEASE SAVEPOINT name}).
   */
  void releaseSavepoint(String name) throws SQLException;

  /**
   * Discards all changes made after the savepoint ({@code ROLLBACK TO SAVEPOINT name}).
   * The savepoint must not be released afterwards.
   */
  void rollbackToSavepoint(String name) throws SQLException;

  /**
   * Commits the real transaction.
   */
  void commit() throws SQLException;

  /**
   * Rolls back the real transaction.
   */
  void rollback() throws SQLException;

  /**
   * Returns the underlying resource once the transaction has been finalized.
   * Called exactly once, after {@link #commit()} or {@link #rollback()}.
   */
  default void release() throws SQLException {
  }
}
