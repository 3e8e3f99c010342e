package nestedtx;

import nestedtx.spi.SqlTransaction;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable state of one real transaction: the transaction itself plus its stack of open
 * savepoints. Shared by every scope derived from the one that started it.
 *
 * <p>All mutators must be called while holding {@link #lock()}.
 */
final class TxHandle {
  private final SqlTransaction transaction;
  private final long startedNanos;
  private final Object lock = new Object();
  private final Deque<String> savepoints = new ArrayDeque<>();
  private long sequence;
  private volatile boolean finalized;

  TxHandle(SqlTransaction transaction, long startedNanos) {
    this.transaction = transaction;
    this.startedNanos = startedNanos;
  }

  SqlTransaction transaction() {
    return transaction;
  }

  long startedNanos() {
    return startedNanos;
  }

  Object lock() {
    return lock;
  }

  int depth() {
    return savepoints.size();
  }

  /** Name the next savepoint would get. Does not reserve it. */
  String nextSavepointName() {
    return "SP" + (sequence + 1);
  }

  void pushSavepoint(String name) {
    sequence++;
    savepoints.push(name);
  }

  String innermostSavepoint() {
    return savepoints.peek();
  }

  void popSavepoint() {
    savepoints.pop();
  }

  boolean isFinalized() {
    return finalized;
  }

  void markFinalized() {
    finalized = true;
  }
}
