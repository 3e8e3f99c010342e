package nestedtx;

import nestedtx.spi.StatementKind;
import nestedtx.spi.TxObserver;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxObserver} that writes every transaction-control statement to
 * {@code java.util.logging}.
 *
 * <p>Statements are logged at the configured level ({@link Level#FINE} by default) together with
 * their duration; failures are always logged at {@link Level#WARNING}.
 */
public final class LoggingTxObserver implements TxObserver {
  private static final Logger DEFAULT_LOGGER = Logger.getLogger(LoggingTxObserver.class.getName());

  private final Logger logger;
  private final Level level;

  public LoggingTxObserver() {
    this(DEFAULT_LOGGER, Level.FINE);
  }

  public LoggingTxObserver(Level level) {
    this(DEFAULT_LOGGER, level);
  }

  public LoggingTxObserver(Logger logger, Level level) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.level = Objects.requireNonNull(level, "level");
  }

  /** Level used for successful statements and completed transactions. */
  public Level level() {
    return level;
  }

  @Override
  public void statementExecuted(StatementKind kind, String sql, long durationNanos) {
    if (logger.isLoggable(level)) {
      logger.log(level, sql + " (" + TimeUnit.NANOSECONDS.toMicros(durationNanos) + " us)");
    }
  }

  @Override
  public void statementFailed(StatementKind kind, String sql, Throwable failure) {
    logger.log(Level.WARNING, sql + " failed", failure);
  }

  @Override
  public void transactionCompleted(boolean committed, long durationNanos) {
    if (logger.isLoggable(level)) {
      logger.log(level, "Transaction " + (committed ? "committed" : "rolled back") + " after "
          + TimeUnit.NANOSECONDS.toMillis(durationNanos) + " ms");
    }
  }
}
