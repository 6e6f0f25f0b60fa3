package com.opssentinel.core.config;

import com.opssentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-sentinel.yml");

        MonitoringConfig monitoring = config.getMonitoring();
        assertThat(monitoring.getPollIntervalSeconds()).isEqualTo(15);
        assertThat(monitoring.getStatisticalThreshold()).isEqualTo(2.5);
        assertThat(monitoring.getMaxAlertsPerMinute()).isEqualTo(4);
        assertThat(monitoring.isEnableAutoResponse()).isFalse();
        assertThat(monitoring.getMonitoredMetrics()).containsExactly("error_rate", "avg_latency_ms");
        // unspecified keys keep their defaults
        assertThat(monitoring.getCorrelationThreshold()).isEqualTo(0.8);
        assertThat(monitoring.getAlertCooldownSeconds()).isEqualTo(300);

        assertThat(config.getResponse().approvalSeverityLevel()).isEqualTo(Severity.HIGH);

        assertThat(config.getThresholds()).hasSize(2);
        ThresholdRule successRate = config.getThresholds().get(1);
        assertThat(successRate.getMetric()).isEqualTo("success_rate");
        assertThat(successRate.isBelow()).isTrue();
        assertThat(successRate.getMedium()).isEqualTo(80.0);
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadBundledDefaults() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getMonitoring().getPollIntervalSeconds()).isEqualTo(30);
        assertThat(config.getMonitoring().getMonitoredMetrics())
                .containsExactlyElementsOf(MonitoringConfig.DEFAULT_METRICS);
        assertThat(config.getThresholds()).extracting(ThresholdRule::getMetric)
                .containsExactly("error_rate", "avg_latency_ms", "success_rate", "data_source_health_score");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String path = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> ConfigLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("pollIntervalSeconds")
                .hasMessageContaining("correlationThreshold")
                .hasMessageContaining("urgent")
                .hasMessageContaining("non-increasing");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("duplicate-keys-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should wrap YAML syntax errors")
    void shouldWrapSyntaxErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("malformed-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("malformed-sentinel.yml");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        SentinelConfig config = ConfigLoader.fromClasspath("empty-sentinel.yml");

        assertThat(config.getMonitoring().getPollIntervalSeconds()).isEqualTo(30);
        assertThat(config.getThresholds()).hasSize(4);
    }

    @Test
    @DisplayName("Should prefer an existing override path over the classpath")
    void shouldPreferOverridePath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.yml");
        Files.writeString(file, "monitoring:\n  pollIntervalSeconds: 5\n");

        SentinelConfig config = ConfigLoader.load(file.toString());

        assertThat(config.getMonitoring().getPollIntervalSeconds()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should fall back to the classpath when the override path does not exist")
    void shouldFallBackWhenOverrideMissing(@TempDir Path dir) {
        SentinelConfig config = ConfigLoader.load(dir.resolve("nope.yml").toString());

        assertThat(config.getMonitoring().getPollIntervalSeconds()).isEqualTo(30);
    }
}
