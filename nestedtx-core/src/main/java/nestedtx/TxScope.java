package nestedtx;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Immutable, per-call-chain value carrying the active transaction of each coordinator.
 *
 * <p>Pass the scope returned by {@link TransactionCoordinator#start} down to nested calls as an
 * ordinary argument. Bindings are keyed by coordinator identity, so several coordinators (for
 * example one per database) can share one scope without interfering. Deriving a new scope copies
 * the binding table only; the transaction handles themselves are shared by reference.
 *
 * <pre>{@code
 * TxScope scope = coordinator.start(TxScope.empty());
 * try {
 *     repository.save(scope, order);
 *     scope = coordinator.commit(scope);
 * } catch (RuntimeException e) {
 *     coordinator.rollback(scope);
 *     throw e;
 * }
 * }</pre>
 */
public final class TxScope {
  private static final TxScope EMPTY = new TxScope(Collections.emptyMap());

  private final Map<Object, TxHandle> bindings;

  private TxScope(Map<Object, TxHandle> bindings) {
    this.bindings = bindings;
  }

  /**
   * Returns the scope with no active transaction.
   */
  public static TxScope empty() {
    return EMPTY;
  }

  /**
   * Returns {@code true} if no coordinator has a live transaction in this scope.
   */
  public boolean isEmpty() {
    for (TxHandle handle : bindings.values()) {
      if (!handle.isFinalized()) {
        return false;
      }
    }
    return true;
  }

  /** Live handle bound to {@code key}, or {@code null}. Finalized handles count as absent. */
  TxHandle find(Object key) {
    TxHandle handle = bindings.get(key);
    if (handle == null || handle.isFinalized()) {
      return null;
    }
    return handle;
  }

  TxScope with(Object key, TxHandle handle) {
    Map<Object, TxHandle> copy = new IdentityHashMap<>(bindings);
    copy.put(key, handle);
    return new TxScope(Collections.unmodifiableMap(copy));
  }

  TxScope without(Object key) {
    if (!bindings.containsKey(key)) {
      return this;
    }
    if (bindings.size() == 1) {
      return EMPTY;
    }
    Map<Object, TxHandle> copy = new IdentityHashMap<>(bindings);
    copy.remove(key);
    return new TxScope(Collections.unmodifiableMap(copy));
  }

  @Override
  public String toString() {
    int live = 0;
    for (TxHandle handle : bindings.values()) {
      if (!handle.isFinalized()) live++;
    }
    return "TxScope{activeTransactions=" + live + "}";
  }
}
