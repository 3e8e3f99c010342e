package nestedtx;

import nestedtx.spi.SqlTransaction;
import nestedtx.spi.StatementKind;
import nestedtx.spi.TransactionSource;
import nestedtx.spi.TxObserver;

import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps re-entrant transaction requests onto one real transaction plus savepoints.
 *
 * <p>The first {@link #start} in a call chain begins a real transaction and binds it into the
 * returned {@link TxScope}. Every further {@code start} on a scope derived from it creates a
 * savepoint instead. {@link #commit} and {@link #rollback} release or roll back to the innermost
 * savepoint; once no savepoint is left they finalize the real transaction and return a scope
 * without the binding.
 *
 * <pre>{@code
 * var coordinator = new TransactionCoordinator(transactionSource);
 *
 * coordinator.runIn(TxScope.empty(), scope -> {
 *     orders.insert(scope, order);
 *     coordinator.runIn(scope, inner -> audit.record(inner, order)); // savepoint
 * });
 * }</pre>
 *
 * <p>Thread-safe. Scopes derived from one {@code start} may be used from several threads; the
 * savepoint bookkeeping of a transaction is serialized, but statements the application runs on
 * the shared connection are not.
 *
 * @see TxScope
 * @see TransactionSource
 * @see TxObserver
 */
public final class TransactionCoordinator {
  private static final Logger logger = Logger.getLogger(TransactionCoordinator.class.getName());

  private final TransactionSource transactionSource;
  private final TxObserver observer;

  /**
   * Creates a coordinator with no observer.
   *
   * @param transactionSource opens real transactions for outermost scopes
   */
  public TransactionCoordinator(TransactionSource transactionSource) {
    this(transactionSource, TxObserver.NOOP);
  }

  /**
   * Creates a coordinator that reports every statement to {@code observer}.
   *
   * @param transactionSource opens real transactions for outermost scopes
   * @param observer          statement listener; {@code null} defaults to {@link TxObserver#NOOP}
   */
  public TransactionCoordinator(TransactionSource transactionSource, TxObserver observer) {
    this.transactionSource = Objects.requireNonNull(transactionSource, "transactionSource");
    this.observer = observer == null ? TxObserver.NOOP : observer;
  }

  /**
   * Starts a transaction scope.
   *
   * <p>Without an active transaction in {@code scope}, begins a real transaction and returns a
   * new scope carrying it. Otherwise creates the next savepoint and returns {@code scope} itself.
   *
   * @param scope the caller's scope; use {@link TxScope#empty()} at the top of a call chain
   * @return the scope to pass to nested calls and to {@link #commit}/{@link #rollback}
   * @throws TransactionException if the transaction or savepoint cannot be created; nothing
   *                              needs to be undone in that case
   */
  public TxScope start(TxScope scope) {
    Objects.requireNonNull(scope, "scope");
    TxHandle handle = scope.find(this);
    if (handle != null) {
      synchronized (handle.lock()) {
        if (!handle.isFinalized()) {
          String name = handle.nextSavepointName();
          execute(handle.transaction(), StatementKind.SAVEPOINT, name);
          handle.pushSavepoint(name);
          return scope;
        }
      }
    }
    long started = System.nanoTime();
    SqlTransaction transaction;
    try {
      transaction = transactionSource.begin();
    } catch (SQLException e) {
      notifyFailed(StatementKind.BEGIN, StatementKind.BEGIN.sql(null), e);
      throw new TransactionException("Failed to begin transaction", e);
    }
    if (transaction == null) {
      throw new IllegalStateException("TransactionSource returned no transaction");
    }
    notifyExecuted(StatementKind.BEGIN, StatementKind.BEGIN.sql(null), System.nanoTime() - started);
    return scope.with(this, new TxHandle(transaction, started));
  }

  /**
   * Commits the innermost transaction scope.
   *
   * <p>Releases the innermost savepoint and returns {@code scope}, or, when no savepoint is open,
   * commits the real transaction and returns a scope without it. If the real commit fails the
   * transaction stays active so the caller can still {@link #rollback} it.
   *
   * @throws NoActiveTransactionException if {@code scope} carries no active transaction
   * @throws TransactionException         if the driver call fails
   */
  public TxScope commit(TxScope scope) {
    TxHandle handle = requireActive(scope);
    synchronized (handle.lock()) {
      if (handle.isFinalized()) {
        throw new NoActiveTransactionException();
      }
      if (handle.depth() > 0) {
        String name = handle.innermostSavepoint();
        execute(handle.transaction(), StatementKind.RELEASE_SAVEPOINT, name);
        handle.popSavepoint();
        return scope;
      }
      execute(handle.transaction(), StatementKind.COMMIT, null);
      finish(handle, true);
    }
    return scope.without(this);
  }

  /**
   * Rolls back the innermost transaction scope.
   *
   * <p>Rolls back to the innermost savepoint and returns {@code scope}, or, when no savepoint is
   * open, rolls back the real transaction and returns a scope without it. The real transaction is
   * finalized even when its rollback fails.
   *
   * @throws NoActiveTransactionException if {@code scope} carries no active transaction
   * @throws TransactionException         if the driver call fails
   */
  public TxScope rollback(TxScope scope) {
    TxHandle handle = requireActive(scope);
    synchronized (handle.lock()) {
      if (handle.isFinalized()) {
        throw new NoActiveTransactionException();
      }
      if (handle.depth() > 0) {
        String name = handle.innermostSavepoint();
        execute(handle.transaction(), StatementKind.ROLLBACK_TO_SAVEPOINT, name);
        handle.popSavepoint();
        return scope;
      }
      try {
        execute(handle.transaction(), StatementKind.ROLLBACK, null);
      } finally {
        finish(handle, false);
      }
    }
    return scope.without(this);
  }

  /**
   * Runs {@code work} in a transaction scope: commits when it returns normally, rolls back when
   * it throws.
   *
   * <p>The exception thrown by {@code work} always wins: if the subsequent rollback fails too,
   * that failure is logged and attached to it as suppressed. A failing commit is rolled back and
   * rethrown the same way.
   *
   * @throws E                   whatever {@code work} throws
   * @throws TransactionException if the scope cannot be started or committed
   */
  public <E extends Exception> void runIn(TxScope scope, TxWork<E> work) throws E {
    Objects.requireNonNull(work, "work");
    callIn(scope, s -> {
      work.execute(s);
      return null;
    });
  }

  /**
   * Like {@link #runIn}, returning the callback's result after a successful commit.
   */
  public <T, E extends Exception> T callIn(TxScope scope, TxCallback<T, E> callback) throws E {
    Objects.requireNonNull(callback, "callback");
    TxScope active = start(scope);
    T result;
    try {
      result = callback.call(active);
    } catch (Throwable t) {
      rollbackAfterFailure(active, t);
      throw t;
    }
    try {
      commit(active);
    } catch (RuntimeException e) {
      rollbackAfterFailure(active, e);
      throw e;
    }
    return result;
  }

  /**
   * Brings an externally opened transaction under this coordinator as the root of
   * {@code scope}; nested {@link #start} calls then create savepoints in it.
   *
   * @param scope       a scope without an active transaction of this coordinator
   * @param transaction the open transaction; finalized and released by this coordinator
   * @return a new scope carrying {@code transaction}
   * @throws IllegalArgumentException           if {@code transaction} is {@code null}
   * @throws TransactionAlreadyActiveException if {@code scope} already carries a transaction
   */
  public TxScope adopt(TxScope scope, SqlTransaction transaction) {
    Objects.requireNonNull(scope, "scope");
    if (transaction == null) {
      throw new IllegalArgumentException("No transaction provided");
    }
    if (scope.find(this) != null) {
      throw new TransactionAlreadyActiveException();
    }
    return scope.with(this, new TxHandle(transaction, System.nanoTime()));
  }

  /**
   * Returns the real transaction active in {@code scope}, whatever the nesting depth,
   * or {@code null} if there is none.
   */
  public SqlTransaction getActive(TxScope scope) {
    Objects.requireNonNull(scope, "scope");
    TxHandle handle = scope.find(this);
    return handle == null ? null : handle.transaction();
  }

  /**
   * Returns {@code true} if {@code scope} carries an active transaction of this coordinator.
   */
  public boolean isActive(TxScope scope) {
    return getActive(scope) != null;
  }

  /**
   * Returns the number of open savepoints of the transaction active in {@code scope};
   * {@code 0} means the next commit or rollback finalizes the real transaction.
   *
   * @throws NoActiveTransactionException if {@code scope} carries no active transaction
   */
  public int depth(TxScope scope) {
    TxHandle handle = requireActive(scope);
    synchronized (handle.lock()) {
      if (handle.isFinalized()) {
        throw new NoActiveTransactionException();
      }
      return handle.depth();
    }
  }

  private TxHandle requireActive(TxScope scope) {
    Objects.requireNonNull(scope, "scope");
    TxHandle handle = scope.find(this);
    if (handle == null) {
      throw new NoActiveTransactionException();
    }
    return handle;
  }

  private void execute(SqlTransaction transaction, StatementKind kind, String savepoint) {
    String sql = kind.sql(savepoint);
    long started = System.nanoTime();
    try {
      switch (kind) {
        case SAVEPOINT -> transaction.savepoint(savepoint);
        case RELEASE_SAVEPOINT -> transaction.releaseSavepoint(savepoint);
        case ROLLBACK_TO_SAVEPOINT -> transaction.rollbackToSavepoint(savepoint);
        case COMMIT -> transaction.commit();
        case ROLLBACK -> transaction.rollback();
        default -> throw new IllegalArgumentException("Not a statement on an open transaction: " + kind);
      }
    } catch (SQLException e) {
      notifyFailed(kind, sql, e);
      throw new TransactionException("Failed to execute " + sql, e);
    }
    notifyExecuted(kind, sql, System.nanoTime() - started);
  }

  // Caller holds the handle lock.
  private void finish(TxHandle handle, boolean committed) {
    handle.markFinalized();
    long duration = System.nanoTime() - handle.startedNanos();
    runSafely("transactionCompleted", () -> observer.transactionCompleted(committed, duration));
    try {
      handle.transaction().release();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to release finalized transaction", e);
    }
  }

  private void rollbackAfterFailure(TxScope scope, Throwable primary) {
    try {
      rollback(scope);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Rollback after failed transaction scope also failed", e);
      primary.addSuppressed(e);
    }
  }

  private void notifyExecuted(StatementKind kind, String sql, long durationNanos) {
    runSafely("statementExecuted", () -> observer.statementExecuted(kind, sql, durationNanos));
  }

  private void notifyFailed(StatementKind kind, String sql, Throwable failure) {
    runSafely("statementFailed", () -> observer.statementFailed(kind, sql, failure));
  }

  private void runSafely(String phase, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      logger.log(Level.WARNING, "TxObserver." + phase + " failed", ex);
    }
  }
}
