package com.opssentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should build with defaults and keep optional sinks disabled")
    void shouldBuildWithDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getMetricsSourceUrl()).isEqualTo("http://localhost:5000/api/metrics");
        assertThat(config.getMetricsSourceTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getKafkaAlertTopic()).isEqualTo("sentinel-alerts");
        assertThat(config.isKafkaEnabled()).isFalse();
        assertThat(config.isAuditEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should enable Kafka and audit when configured")
    void shouldEnableOptionalSinks() {
        ServiceConfig config = new ServiceConfig.Builder()
                .kafkaBootstrapServers("broker:9092")
                .auditDir("/var/lib/sentinel")
                .build();

        assertThat(config.isKafkaEnabled()).isTrue();
        assertThat(config.isAuditEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should build producer properties with string keys and byte values")
    void shouldBuildProducerProperties() {
        Properties props = new ServiceConfig.Builder()
                .kafkaBootstrapServers("broker:9092")
                .build()
                .kafkaProducerProperties();

        assertThat(props.getProperty("bootstrap.servers")).isEqualTo("broker:9092");
        assertThat(props.getProperty("key.serializer")).endsWith("StringSerializer");
        assertThat(props.getProperty("value.serializer")).endsWith("ByteArraySerializer");
        assertThat(props.getProperty("acks")).isEqualTo("1");
    }

    @Test
    @DisplayName("Should reject an out-of-range health port")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a non-positive timeout and blank names")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().metricsSourceTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("metricsSourceTimeout");
        assertThatThrownBy(() -> new ServiceConfig.Builder().metricsSourceUrl(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("metricsSourceUrl");
        assertThatThrownBy(() -> new ServiceConfig.Builder().kafkaExecutionTopic("").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
