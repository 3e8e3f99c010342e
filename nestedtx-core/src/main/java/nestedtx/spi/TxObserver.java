package nestedtx.spi;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Observability hook notified of every transaction-control statement the coordinator issues.
 *
 * <p>The {@link #NOOP} instance discards all notifications. Implementations must be thread-safe;
 * exceptions they throw are logged by the coordinator and otherwise ignored.
 *
 * @see nestedtx.LoggingTxObserver
 */
public interface TxObserver {

  /**
   * No-op instance that discards all notifications.
   */
  TxObserver NOOP = new Noop();

  /**
   * Called after a statement completed successfully.
   *
   * @param kind          statement kind
   * @param sql           rendered statement text, e.g. {@code SAVEPOINT SP2}
   * @param durationNanos time spent in the driver call
   */
  void statementExecuted(StatementKind kind, String sql, long durationNanos);

  /**
   * Called after a statement failed.
   *
   * @param kind    statement kind
   * @param sql     rendered statement text
   * @param failure the driver error
   */
  default void statementFailed(StatementKind kind, String sql, Throwable failure) {
  }

  /**
   * Called once a real transaction has been finalized.
   *
   * @param committed     {@code true} for a successful commit, {@code false} for a rollback
   * @param durationNanos time from begin (or adoption) to finalization
   */
  default void transactionCompleted(boolean committed, long durationNanos) {
  }

  /**
   * Combines observers into one that notifies each of them in order.
   * {@link #NOOP} entries are dropped.
   */
  static TxObserver composite(List<? extends TxObserver> observers) {
    Objects.requireNonNull(observers, "observers");
    List<TxObserver> delegates = observers.stream()
        .map(o -> Objects.requireNonNull(o, "observer"))
        .filter(o -> o != NOOP)
        .map(TxObserver.class::cast)
        .toList();
    if (delegates.isEmpty()) {
      return NOOP;
    }
    if (delegates.size() == 1) {
      return delegates.get(0);
    }
    return new Composite(delegates);
  }

  /**
   * Default no-op implementation.
   */
  final class Noop implements TxObserver {
    @Override
    public void statementExecuted(StatementKind kind, String sql, long durationNanos) {
    }
  }

  /**
   * Fans notifications out to several observers. A failing delegate does not prevent the
   * remaining ones from being notified; the first failure is rethrown with the rest suppressed.
   */
  final class Composite implements TxObserver {
    private final List<TxObserver> delegates;

    private Composite(List<TxObserver> delegates) {
      this.delegates = delegates;
    }

    @Override
    public void statementExecuted(StatementKind kind, String sql, long durationNanos) {
      forEach(o -> o.statementExecuted(kind, sql, durationNanos));
    }

    @Override
    public void statementFailed(StatementKind kind, String sql, Throwable failure) {
      forEach(o -> o.statementFailed(kind, sql, failure));
    }

    @Override
    public void transactionCompleted(boolean committed, long durationNanos) {
      forEach(o -> o.transactionCompleted(committed, durationNanos));
    }

    private void forEach(Consumer<TxObserver> action) {
      RuntimeException first = null;
      for (TxObserver delegate : delegates) {
        try {
          action.accept(delegate);
        } catch (RuntimeException e) {
          if (first == null) first = e;
          else first.addSuppressed(e);
        }
      }
      if (first != null) throw first;
    }
  }
}
