package com.opssentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A response action waiting for human sign-off.
 *
 * @since 1.0.0
 */
public final class ApprovalRequest {

    private final String executionId;
    private final String actionName;
    private final String actionDescription;
    private final String anomalyMetric;
    private final Severity anomalySeverity;
    private final String anomalyMessage;
    private final Instant requestedAt;

    public ApprovalRequest(ResponseExecution execution, ResponseAction action, AnomalyAlert alert,
            Instant requestedAt) {
        Objects.requireNonNull(execution, "execution must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(alert, "alert must not be null");
        this.executionId = execution.getId();
        this.actionName = action.getName();
        this.actionDescription = action.getDescription();
        this.anomalyMetric = alert.getMetricName();
        this.anomalySeverity = alert.getSeverity();
        this.anomalyMessage = alert.getMessage();
        this.requestedAt = Objects.requireNonNull(requestedAt, "requestedAt must not be null");
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getActionName() {
        return actionName;
    }

    public String getActionDescription() {
        return actionDescription;
    }

    public String getAnomalyMetric() {
        return anomalyMetric;
    }

    public Severity getAnomalySeverity() {
        return anomalySeverity;
    }

    public String getAnomalyMessage() {
        return anomalyMessage;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    @Override
    public String toString() {
        return "ApprovalRequest{" +
                "executionId='" + executionId + '\'' +
                ", actionName='" + actionName + '\'' +
                ", anomalySeverity=" + anomalySeverity +
                ", requestedAt=" + requestedAt +
                '}';
    }
}
