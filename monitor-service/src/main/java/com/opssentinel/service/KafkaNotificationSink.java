package com.opssentinel.service;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.spi.NotificationSink;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link NotificationSink} that publishes alerts and executions to Kafka as
 * JSON.
 *
 * <p>
 * Alerts are keyed by alert id and executions by execution id, so every
 * update of one execution lands on the same partition. Sends are
 * asynchronous; delivery failures are logged from the producer callback.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaNotificationSink implements NotificationSink, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaNotificationSink.class);

    private final Producer<String, byte[]> producer;
    private final RecordSerializer serializer;
    private final String alertTopic;
    private final String executionTopic;

    public KafkaNotificationSink(Producer<String, byte[]> producer, RecordSerializer serializer,
            String alertTopic, String executionTopic) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.alertTopic = Objects.requireNonNull(alertTopic, "alertTopic must not be null");
        this.executionTopic = Objects.requireNonNull(executionTopic, "executionTopic must not be null");
    }

    @Override
    public void notifyAlert(AnomalyAlert alert) {
        send(alertTopic, alert.getId(), serializer.toBytes(alert));
    }

    @Override
    public void notifyExecution(ResponseExecution execution) {
        send(executionTopic, execution.getId(), serializer.toBytes(execution));
    }

    private void send(String topic, String key, byte[] value) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, value);
        producer.send(record, (metadata, exception) -> {
            if (exception != null) {
                LOG.error("Failed to publish {} to topic {}: {}", key, topic, exception.getMessage());
            } else {
                LOG.debug("Published {} to {}-{}@{}", key, metadata.topic(), metadata.partition(),
                        metadata.offset());
            }
        });
    }

    @Override
    public void close() {
        producer.flush();
        producer.close(Duration.ofSeconds(5));
        LOG.info("Kafka notification sink closed");
    }
}
