package nestedtx.spring.boot;

import nestedtx.LoggingTxObserver;
import nestedtx.TransactionCoordinator;
import nestedtx.jdbc.ConnectionProvider;
import nestedtx.jdbc.JdbcTransactionManager;
import nestedtx.spi.TxObserver;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Level;

/**
 * Auto-configuration for nested transaction management.
 *
 * <p>Wires a {@link JdbcTransactionManager} on the application's {@link DataSource}. Every
 * {@link TxObserver} bean in the context is notified of the statements it issues.
 *
 * @see NestedTxProperties
 * @see NestedTxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TransactionCoordinator.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(NestedTxProperties.class)
public class NestedTxAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ConnectionProvider connectionProvider(DataSource dataSource) {
    return ConnectionProvider.of(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "nestedtx.logging", name = "enabled", havingValue = "true")
  public LoggingTxObserver loggingTxObserver(NestedTxProperties props) {
    return new LoggingTxObserver(Level.parse(props.getLogging().getLevel()));
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcTransactionManager jdbcTransactionManager(ConnectionProvider connectionProvider,
      ObjectProvider<TxObserver> observerProvider) {
    TxObserver observer = TxObserver.composite(observerProvider.orderedStream().toList());
    return new JdbcTransactionManager(connectionProvider, observer);
  }
}
