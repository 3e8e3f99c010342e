package nestedtx.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import nestedtx.spi.StatementKind;
import nestedtx.spi.TxObserver;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link TxObserver}.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code nestedtx.statement} tagged {@code kind}: duration of each transaction-control
 *       statement ({@code begin}, {@code savepoint}, {@code release_savepoint},
 *       {@code rollback_to_savepoint}, {@code commit}, {@code rollback})</li>
 *   <li>{@code nestedtx.transaction} tagged {@code outcome}: lifetime of real transactions,
 *       from begin to {@code commit} or {@code rollback}</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code nestedtx.statement.failures} tagged {@code kind}: statements rejected by the
 *       driver</li>
 * </ul>
 *
 * @see TxObserver
 */
public final class MicrometerTxObserver implements TxObserver, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<StatementKind, Timer> statementTimers = new EnumMap<>(StatementKind.class);
  private final Map<StatementKind, Counter> failureCounters = new EnumMap<>(StatementKind.class);
  private final Timer committed;
  private final Timer rolledBack;
  private volatile boolean closed;

  /**
   * Creates an observer with the default metric name prefix {@code "nestedtx"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerTxObserver(MeterRegistry registry) {
    this(registry, "nestedtx");
  }

  /**
   * Creates an observer with a custom metric name prefix, for applications that coordinate
   * transactions on several databases.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.tx"})
   */
  public MicrometerTxObserver(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (StatementKind kind : StatementKind.values()) {
      statementTimers.put(kind, Timer.builder(namePrefix + ".statement")
          .description("Transaction-control statement duration")
          .tag("kind", kind.tagValue())
          .register(registry));
      failureCounters.put(kind, Counter.builder(namePrefix + ".statement.failures")
          .description("Transaction-control statements that failed")
          .tag("kind", kind.tagValue())
          .register(registry));
    }
    this.committed = Timer.builder(namePrefix + ".transaction")
        .description("Real transaction lifetime")
        .tag("outcome", "commit")
        .register(registry);
    this.rolledBack = Timer.builder(namePrefix + ".transaction")
        .description("Real transaction lifetime")
        .tag("outcome", "rollback")
        .register(registry);
  }

  @Override
  public void statementExecuted(StatementKind kind, String sql, long durationNanos) {
    if (closed) return;
    statementTimers.get(kind).record(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void statementFailed(StatementKind kind, String sql, Throwable failure) {
    if (closed) return;
    failureCounters.get(kind).increment();
  }

  @Override
  public void transactionCompleted(boolean committed, long durationNanos) {
    if (closed) return;
    (committed ? this.committed : rolledBack).record(durationNanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Removes all meters registered by this observer from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(statementTimers.values());
    meters.addAll(failureCounters.values());
    meters.add(committed);
    meters.add(rolledBack);

    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
