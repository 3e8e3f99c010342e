package nestedtx.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.Statement;

/**
 * Creates a pooled {@link HikariDataSource} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory) and {@code "mysql"} (external server).
 * MySQL connection details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}: default {@code jdbc:mysql://localhost:3306/nestedtx_bench}</li>
 *   <li>{@code bench.mysql.user}: default {@code root}</li>
 *   <li>{@code bench.mysql.password}: default empty</li>
 * </ul>
 */
final class BenchmarkDataSourceFactory {

  private static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS bench_row (" +
          "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
          "depth INT NOT NULL," +
          "payload VARCHAR(255) NOT NULL" +
          ")";

  static HikariDataSource create(String database, String dbName) {
    HikariConfig config = new HikariConfig();
    switch (database) {
      case "h2" -> config.setJdbcUrl("jdbc:h2:mem:" + dbName + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
      case "mysql" -> {
        config.setJdbcUrl(System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/nestedtx_bench"));
        config.setUsername(System.getProperty("bench.mysql.user", "root"));
        config.setPassword(System.getProperty("bench.mysql.password", ""));
      }
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    }
    config.setPoolName("bench-" + database);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);

    HikariDataSource dataSource = new HikariDataSource(config);
    execute(dataSource, CREATE_TABLE, "Failed to initialize benchmark schema");
    return dataSource;
  }

  static void truncate(HikariDataSource dataSource) {
    execute(dataSource, "TRUNCATE TABLE bench_row", "Failed to truncate benchmark table");
  }

  private static void execute(HikariDataSource dataSource, String sql, String errorMessage) {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
    } catch (Exception e) {
      throw new RuntimeException(errorMessage, e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
