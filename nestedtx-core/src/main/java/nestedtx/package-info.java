/**
 * Root API for nestedtx: nested transactions over a single database transaction.
 *
 * <h2>Core Design</h2>
 * <p>Callers obtain a {@link nestedtx.TxScope} from
 * {@link nestedtx.TransactionCoordinator#start} and pass it down as an ordinary argument. The
 * first start in a call chain begins a real transaction; starts on a scope that already carries
 * one create savepoints ({@code SP1}, {@code SP2}, ...). Commit and rollback undo this in reverse:
 * inner scopes release or roll back to their savepoint, the outermost one finalizes the real
 * transaction and clears the binding.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>nestedtx-core</b>: coordinator, scope, SPIs (zero external deps)</li>
 *   <li><b>nestedtx-jdbc</b>: JDBC binding on
 *       {@code java.sql.Connection} savepoints</li>
 *   <li><b>nestedtx-micrometer</b>: statement and transaction metrics</li>
 *   <li><b>nestedtx-spring-boot-starter</b>: auto-configuration from a {@code DataSource}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var txManager = new JdbcTransactionManager(dataSource);
 *
 * txManager.runIn(TxScope.empty(), scope -> {
 *     insertOrder(txManager.currentConnection(scope), order);
 *     try {
 *         txManager.runIn(scope, inner -> reserveStock(txManager.currentConnection(inner), order));
 *     } catch (OutOfStockException e) {
 *         // only the reservation was rolled back
 *     }
 * });
 * }</pre>
 *
 * @see nestedtx.TransactionCoordinator
 * @see nestedtx.TxScope
 */
package nestedtx;
