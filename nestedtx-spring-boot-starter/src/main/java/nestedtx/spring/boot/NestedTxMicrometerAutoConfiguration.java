package nestedtx.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import nestedtx.micrometer.MicrometerTxObserver;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerTxObserver} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code nestedtx.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link NestedTxAutoConfiguration} so the observer is composed into the
 * transaction manager.
 */
@AutoConfiguration(before = NestedTxAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerTxObserver.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "nestedtx.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(NestedTxProperties.class)
public class NestedTxMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean
  public MicrometerTxObserver micrometerTxObserver(MeterRegistry meterRegistry, NestedTxProperties props) {
    return new MicrometerTxObserver(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
