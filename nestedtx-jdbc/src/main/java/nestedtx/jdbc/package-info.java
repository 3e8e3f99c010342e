/**
 * JDBC binding for the nested transaction coordinator.
 *
 * <p>{@link nestedtx.jdbc.JdbcTransactionManager} is the entry point for plain JDBC code.
 * {@link nestedtx.jdbc.JdbcTransactionSource} opens one manual-commit connection per outermost
 * scope; {@link nestedtx.jdbc.JdbcTransaction} maps savepoints onto
 * {@link java.sql.Savepoint}s of that connection.
 *
 * @see nestedtx.jdbc.JdbcTransactionManager
 * @see nestedtx.jdbc.ConnectionProvider
 */
package nestedtx.jdbc;
