package com.opssentinel.service;

import com.opssentinel.core.config.ConfigLoader;
import com.opssentinel.core.config.SentinelConfig;
import com.opssentinel.core.control.SentinelControl;
import com.opssentinel.core.monitoring.MonitoringEngine;
import com.opssentinel.core.response.InMemoryControlPlane;
import com.opssentinel.core.response.ResponseEngine;
import com.opssentinel.core.spi.LoggingNotificationSink;
import com.opssentinel.core.spi.NotificationSink;
import com.opssentinel.core.spi.PersistenceStore;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for the Ops Sentinel service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   HTTP metrics endpoint
 *     → MonitoringEngine (poll, detect, throttle, queue)
 *     → ResponseEngine (validate, gate, execute, roll back)
 *     → audit trail (JSON lines) / Kafka notifications
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via
 * {@link ServiceConfig}; detection and response tuning from the YAML file
 * resolved by {@link ConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class OpsSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(OpsSentinelService.class);

    private OpsSentinelService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig serviceConfig = ServiceConfig.fromEnvironment();
        LOG.info("Starting Ops Sentinel with config: {}", serviceConfig);

        SentinelConfig config = ConfigLoader.load(serviceConfig.getSentinelConfigPath());
        LOG.info("Loaded sentinel configuration: {}", config);

        // 2. Adapters
        RecordSerializer serializer = new RecordSerializer();
        PersistenceStore persistence = createPersistence(serviceConfig, serializer);
        NotificationSink notifications = createNotifications(serviceConfig, serializer);

        // 3. Engines
        ResponseEngine responseEngine = ResponseEngine
                .withDefaultHandlers(new InMemoryControlPlane(), config.getResponse().approvalSeverityLevel())
                .historyCapacity(config.getResponse().getExecutionHistorySize())
                .persistence(persistence)
                .notifications(notifications)
                .build();

        MonitoringEngine monitoringEngine = MonitoringEngine.builder()
                .config(config)
                .metricsSource(new HttpMetricsSource(serviceConfig.getMetricsSourceUrl(),
                        serviceConfig.getMetricsSourceTimeout()))
                .responseEngine(responseEngine)
                .persistence(persistence)
                .notifications(notifications)
                .build();

        SentinelControl control = new SentinelControl(monitoringEngine, responseEngine);

        // 4. Health server (for K8s probes)
        HealthServer healthServer = new HealthServer(control, serializer);
        healthServer.start(serviceConfig.getHealthPort());

        // 5. Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Ops Sentinel");
            control.stopMonitoring();
            healthServer.stop();
            if (notifications instanceof KafkaNotificationSink kafkaSink) {
                kafkaSink.close();
            }
        }, "sentinel-shutdown"));

        // 6. Run; the scheduler threads are daemons, so block the main thread
        control.startMonitoring();
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Main thread interrupted, exiting");
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static PersistenceStore createPersistence(ServiceConfig config, RecordSerializer serializer) {
        if (!config.isAuditEnabled()) {
            LOG.info("AUDIT_DIR not set, audit trail disabled");
            return PersistenceStore.noop();
        }
        return new JsonLinesPersistenceStore(Path.of(config.getAuditDir()), serializer);
    }

    static NotificationSink createNotifications(ServiceConfig config, RecordSerializer serializer) {
        if (!config.isKafkaEnabled()) {
            LOG.info("KAFKA_BOOTSTRAP_SERVERS not set, notifications go to the log only");
            return new LoggingNotificationSink();
        }
        LOG.info("Publishing notifications to Kafka at {}", config.getKafkaBootstrapServers());
        return new KafkaNotificationSink(new KafkaProducer<>(config.kafkaProducerProperties()), serializer,
                config.getKafkaAlertTopic(), config.getKafkaExecutionTopic());
    }
}
