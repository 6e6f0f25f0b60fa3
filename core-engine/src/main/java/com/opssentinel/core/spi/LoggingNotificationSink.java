package com.opssentinel.core.spi;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NotificationSink} that writes records to the application log.
 * High and critical alerts are logged at WARN, everything else at INFO.
 *
 * @since 1.0.0
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notifyAlert(AnomalyAlert alert) {
        if (alert.getSeverity().isAtLeast(Severity.HIGH)) {
            LOG.warn("ALERT [{}] {} {}: {}", alert.getSeverity().label(), alert.getAnomalyType().label(),
                    alert.getMetricName(), alert.getMessage());
        } else {
            LOG.info("ALERT [{}] {} {}: {}", alert.getSeverity().label(), alert.getAnomalyType().label(),
                    alert.getMetricName(), alert.getMessage());
        }
    }

    @Override
    public void notifyExecution(ResponseExecution execution) {
        LOG.info("EXECUTION {} action={} anomaly={} status={}", execution.getId(), execution.getActionId(),
                execution.getAnomalyId(), execution.getStatus().label());
    }
}
