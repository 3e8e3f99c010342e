package nestedtx.benchmark;

import com.zaxxer.hikari.HikariDataSource;
import nestedtx.TxScope;
import nestedtx.jdbc.JdbcTransactionManager;
import org.openjdk.jmh.annotations.*;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.concurrent.TimeUnit;

/**
 * Measures transaction throughput (ops/sec) with one insert per scope, for an outermost
 * transaction alone and with {@code nesting} savepoint levels below it.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar NestedTransactionBenchmark}
 * <p>MySQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=mysql NestedTransactionBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class NestedTransactionBenchmark {

  private HikariDataSource dataSource;
  private JdbcTransactionManager txManager;

  @Param({"h2"})
  private String database;

  @Param({"0", "1", "4"})
  private int nesting;

  @Setup(Level.Trial)
  public void setup() {
    dataSource = BenchmarkDataSourceFactory.create(database, "bench_nested");
    BenchmarkDataSourceFactory.truncate(dataSource);
    txManager = new JdbcTransactionManager(dataSource);
  }

  @Benchmark
  public void commitNested() throws SQLException {
    txManager.runIn(TxScope.empty(), scope -> insertNested(scope, 0));
  }

  @Benchmark
  public void rollbackInnermost() throws SQLException {
    txManager.runIn(TxScope.empty(), scope -> {
      insert(scope, 0);
      try {
        txManager.runIn(scope, inner -> {
          insert(inner, 1);
          throw new IllegalStateException("discard");
        });
      } catch (IllegalStateException expected) {
        // outer scope keeps its row
      }
    });
  }

  private void insertNested(TxScope scope, int depth) throws SQLException {
    insert(scope, depth);
    if (depth < nesting) {
      txManager.runIn(scope, inner -> insertNested(inner, depth + 1));
    }
  }

  private void insert(TxScope scope, int depth) throws SQLException {
    try (PreparedStatement ps = txManager.currentConnection(scope).prepareStatement(
        "INSERT INTO bench_row (depth, payload) VALUES (?, ?)")) {
      ps.setInt(1, depth);
      ps.setString(2, "bench");
      ps.executeUpdate();
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }
}
