package com.opssentinel.service;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.Severity;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for {@link KafkaNotificationSink}.
 */
class KafkaNotificationSinkTest {

    private MockProducer<String, byte[]> producer;
    private KafkaNotificationSink sink;

    @BeforeEach
    void setUp() {
        producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
        sink = new KafkaNotificationSink(producer, new RecordSerializer(), "alerts", "executions");
    }

    @Test
    @DisplayName("Should publish alerts keyed by alert id")
    void shouldPublishAlert() {
        AnomalyAlert alert = alert();

        sink.notifyAlert(alert);

        assertThat(producer.history()).singleElement().satisfies(record -> {
            assertThat(record.topic()).isEqualTo("alerts");
            assertThat(record.key()).isEqualTo(alert.getId());
            assertThat(new String(record.value(), StandardCharsets.UTF_8))
                    .contains("\"metric_name\":\"error_rate\"")
                    .contains("\"severity\":\"CRITICAL\"")
                    .contains("\"timestamp\":\"2026-01-01T00:00:00Z\"");
        });
    }

    @Test
    @DisplayName("Should not throw when the broker rejects a record")
    void shouldTolerateSendFailure() {
        MockProducer<String, byte[]> manual = new MockProducer<>(false, new StringSerializer(),
                new ByteArraySerializer());
        KafkaNotificationSink failing = new KafkaNotificationSink(manual, new RecordSerializer(), "alerts",
                "executions");

        failing.notifyAlert(alert());

        assertThatCode(() -> manual.errorNext(new RuntimeException("broker down"))).doesNotThrowAnyException();
        assertThat(manual.history()).extracting(ProducerRecord::topic).containsExactly("alerts");
    }

    @Test
    @DisplayName("Should flush and close the producer")
    void shouldCloseProducer() {
        sink.close();

        assertThat(producer.closed()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyAlert alert() {
        return AnomalyAlert.builder()
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .anomalyType(AnomalyType.THRESHOLD)
                .metricName("error_rate")
                .severity(Severity.CRITICAL)
                .actualValue(25.0)
                .expectedValue(20.0)
                .deviationScore(0.25)
                .message("critical threshold breached for error_rate")
                .build();
    }
}
