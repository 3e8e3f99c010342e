package nestedtx;

/**
 * Thrown by {@link TransactionCoordinator#adopt} when the scope already carries a transaction.
 */
public final class TransactionAlreadyActiveException extends IllegalStateException {
  public TransactionAlreadyActiveException() {
    super("Transaction already active");
  }
}
