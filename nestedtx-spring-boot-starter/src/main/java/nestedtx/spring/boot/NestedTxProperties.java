package nestedtx.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for nested transaction management.
 *
 * @see NestedTxAutoConfiguration
 */
@ConfigurationProperties(prefix = "nestedtx")
public class NestedTxProperties {

    private final Logging logging = new Logging();
    private final Metrics metrics = new Metrics();

    public Logging getLogging() {
        return logging;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Logging {
        /**
         * Whether every transaction-control statement is logged.
         */
        private boolean enabled = false;

        /**
         * {@link java.util.logging.Level} name used for statement messages.
         */
        private String level = "FINE";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "nestedtx";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
