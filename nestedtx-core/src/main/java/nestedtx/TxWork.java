package nestedtx;

/**
 * Unit of work executed inside a transaction scope by {@link TransactionCoordinator#runIn}.
 *
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface TxWork<E extends Exception> {
  void execute(TxScope scope) throws E;
}
