package com.opssentinel.core.config;

import com.opssentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the response engine.
 *
 * <pre>
 * response:
 *   approvalSeverity: critical
 *   executionRetentionHours: 24
 *   executionHistorySize: 1000
 * </pre>
 *
 * @since 1.0.0
 */
public class ResponseConfig {

    /** Alerts at or above this severity gate their risky actions behind approval. */
    private String approvalSeverity = "critical";

    /** Completed executions older than this are dropped by the cleanup job. */
    private int executionRetentionHours = 24;

    /** Cleaned up executions kept for lookup. */
    private int executionHistorySize = 1000;

    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            Severity.fromString(approvalSeverity);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (executionRetentionHours <= 0) {
            errors.add("executionRetentionHours must be > 0, got: " + executionRetentionHours);
        }
        if (executionHistorySize < 0) {
            errors.add("executionHistorySize must be >= 0, got: " + executionHistorySize);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid response configuration: " + String.join("; ", errors));
        }
    }

    /**
     * @return {@link #getApprovalSeverity()} parsed as a {@link Severity}
     */
    public Severity approvalSeverityLevel() {
        return Severity.fromString(approvalSeverity);
    }

    public String getApprovalSeverity() {
        return approvalSeverity;
    }

    public void setApprovalSeverity(String approvalSeverity) {
        this.approvalSeverity = approvalSeverity;
    }

    public int getExecutionRetentionHours() {
        return executionRetentionHours;
    }

    public void setExecutionRetentionHours(int executionRetentionHours) {
        this.executionRetentionHours = executionRetentionHours;
    }

    public int getExecutionHistorySize() {
        return executionHistorySize;
    }

    public void setExecutionHistorySize(int executionHistorySize) {
        this.executionHistorySize = executionHistorySize;
    }

    @Override
    public String toString() {
        return "ResponseConfig{" +
                "approvalSeverity='" + approvalSeverity + '\'' +
                ", executionRetentionHours=" + executionRetentionHours +
                ", executionHistorySize=" + executionHistorySize +
                '}';
    }
}
