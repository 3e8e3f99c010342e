/**
 * Spring Boot auto-configuration for nested transaction management.
 *
 * <p>{@link nestedtx.spring.boot.NestedTxAutoConfiguration} exposes a
 * {@link nestedtx.jdbc.JdbcTransactionManager} bound to the application's
 * {@link javax.sql.DataSource}, configured from {@code nestedtx.*} application properties.
 *
 * @see nestedtx.spring.boot.NestedTxAutoConfiguration
 * @see nestedtx.spring.boot.NestedTxProperties
 */
package nestedtx.spring.boot;
