package nestedtx;

/**
 * Value-returning unit of work executed by {@link TransactionCoordinator#callIn}.
 *
 * @param <T> result type
 * @param <E> checked exception the callback may throw
 */
@FunctionalInterface
public interface TxCallback<T, E extends Exception> {
  T call(TxScope scope) throws E;
}
