package com.opssentinel.service;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable process settings of the Ops Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configured through Kubernetes Deployment env vars, Docker
 * {@code -e} flags, or a shell environment. Detection and response tuning
 * lives in the YAML file loaded by
 * {@link com.opssentinel.core.config.ConfigLoader}.
 * </p>
 *
 * <h3>Optional integrations</h3>
 * <ul>
 * <li>Kafka notifications are enabled when {@code KAFKA_BOOTSTRAP_SERVERS} is
 * set.</li>
 * <li>The JSON-lines audit trail is enabled when {@code AUDIT_DIR} is
 * set.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Sentinel configuration
    // ---------------------------------------------------------------
    private final String sentinelConfigPath;

    // ---------------------------------------------------------------
    // Metrics source
    // ---------------------------------------------------------------
    private final String metricsSourceUrl;
    private final Duration metricsSourceTimeout;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaAlertTopic;
    private final String kafkaExecutionTopic;

    // ---------------------------------------------------------------
    // Audit / Health
    // ---------------------------------------------------------------
    private final String auditDir;
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.metricsSourceUrl = b.metricsSourceUrl;
        this.metricsSourceTimeout = b.metricsSourceTimeout;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaExecutionTopic = b.kafkaExecutionTopic;
        this.auditDir = b.auditDir;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @throws IllegalStateException    if a numeric env var cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .sentinelConfigPath(env("SENTINEL_CONFIG_PATH", ""))
                    .metricsSourceUrl(env("METRICS_SOURCE_URL", "http://localhost:5000/api/metrics"))
                    .metricsSourceTimeout(Duration.ofMillis(parseLongEnv("METRICS_SOURCE_TIMEOUT_MS", "5000")))
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", ""))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "sentinel-alerts"))
                    .kafkaExecutionTopic(env("KAFKA_EXECUTION_TOPIC", "sentinel-executions"))
                    .auditDir(env("AUDIT_DIR", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    public boolean isKafkaEnabled() {
        return !kafkaBootstrapServers.isBlank();
    }

    /**
     * Build Kafka producer {@link Properties} for the notification sink.
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "1");
        props.setProperty("linger.ms", "50");
        props.setProperty("client.id", "ops-sentinel");
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.ByteArraySerializer");
        return props;
    }

    public boolean isAuditEnabled() {
        return !auditDir.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    public String getMetricsSourceUrl() {
        return metricsSourceUrl;
    }

    public Duration getMetricsSourceTimeout() {
        return metricsSourceTimeout;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaExecutionTopic() {
        return kafkaExecutionTopic;
    }

    public String getAuditDir() {
        return auditDir;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}. {@link #build()} checks the
     * port range, the timeout and the required names.
     */
    public static class Builder {
        private String sentinelConfigPath = "";
        private String metricsSourceUrl = "http://localhost:5000/api/metrics";
        private Duration metricsSourceTimeout = Duration.ofSeconds(5);
        private String kafkaBootstrapServers = "";
        private String kafkaAlertTopic = "sentinel-alerts";
        private String kafkaExecutionTopic = "sentinel-executions";
        private String auditDir = "";
        private int healthPort = 8080;

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        public Builder metricsSourceUrl(String v) {
            this.metricsSourceUrl = v;
            return this;
        }

        public Builder metricsSourceTimeout(Duration v) {
            this.metricsSourceTimeout = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaExecutionTopic(String v) {
            this.kafkaExecutionTopic = v;
            return this;
        }

        public Builder auditDir(String v) {
            this.auditDir = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(sentinelConfigPath, "sentinelConfigPath required");
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(auditDir, "auditDir required");
            Objects.requireNonNull(metricsSourceTimeout, "metricsSourceTimeout required");
            requireNonBlank(metricsSourceUrl, "metricsSourceUrl");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaExecutionTopic, "kafkaExecutionTopic");

            if (metricsSourceTimeout.isZero() || metricsSourceTimeout.isNegative()) {
                throw new IllegalArgumentException(
                        "metricsSourceTimeout must be positive, got: " + metricsSourceTimeout);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "sentinelConfigPath='" + sentinelConfigPath + '\'' +
                ", metricsSourceUrl='" + metricsSourceUrl + '\'' +
                ", metricsSourceTimeout=" + metricsSourceTimeout +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaExecutionTopic='" + kafkaExecutionTopic + '\'' +
                ", auditDir='" + auditDir + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
