package nestedtx;

/**
 * Thrown when an operation requires a transaction but the scope carries none, either because
 * none was started or because it has already been committed or rolled back.
 */
public final class NoActiveTransactionException extends IllegalStateException {
  public NoActiveTransactionException() {
    super("No active transaction");
  }
}
