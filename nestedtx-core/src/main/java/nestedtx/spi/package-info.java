/**
 * Service Provider Interfaces (SPI) connecting the coordinator to a database and to
 * observability backends.
 *
 * <p>{@link nestedtx.spi.TransactionSource} and {@link nestedtx.spi.SqlTransaction} abstract
 * the driver; {@link nestedtx.spi.TxObserver} receives every transaction-control statement.
 *
 * @see nestedtx.spi.TransactionSource
 * @see nestedtx.spi.SqlTransaction
 * @see nestedtx.spi.TxObserver
 */
package nestedtx.spi;
