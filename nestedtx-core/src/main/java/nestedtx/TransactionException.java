package nestedtx;

/**
 * Unchecked exception wrapping driver errors raised while beginning, committing or rolling back
 * a transaction, or while creating, releasing or rolling back to a savepoint.
 */
public class TransactionException extends RuntimeException {
  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
