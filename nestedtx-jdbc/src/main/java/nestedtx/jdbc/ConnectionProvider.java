package nestedtx.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Provides JDBC connections for new outermost transactions.
 *
 * <p>The returned connection is owned by the transaction opened on it and closed when that
 * transaction is finalized.
 *
 * @see JdbcTransactionSource
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;

    /**
     * Returns a provider delegating to {@link DataSource#getConnection()}.
     */
    static ConnectionProvider of(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        return dataSource::getConnection;
    }
}
