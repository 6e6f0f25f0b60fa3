package com.opssentinel.core.control;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ApprovalRequest;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.monitoring.MonitoringEngine;
import com.opssentinel.core.monitoring.MonitoringStatus;
import com.opssentinel.core.monitoring.MonitoringStatusReport;
import com.opssentinel.core.response.ResponseEngine;
import com.opssentinel.core.response.ResponseStatistics;
import com.opssentinel.core.response.RollbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thin control surface over the monitoring and response engines, consumed
 * by whatever API layer fronts the service.
 *
 * <p>
 * Read operations never throw: under partial failure they return a
 * best-effort answer.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelControl {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelControl.class);

    private final MonitoringEngine monitoringEngine;
    private final ResponseEngine responseEngine;

    public SentinelControl(MonitoringEngine monitoringEngine, ResponseEngine responseEngine) {
        this.monitoringEngine = Objects.requireNonNull(monitoringEngine, "monitoringEngine must not be null");
        this.responseEngine = Objects.requireNonNull(responseEngine, "responseEngine must not be null");
    }

    // ---------------------------------------------------------------
    // Monitoring
    // ---------------------------------------------------------------

    public void startMonitoring() {
        monitoringEngine.start();
    }

    public void stopMonitoring() {
        monitoringEngine.stop();
    }

    public MonitoringStatusReport getMonitoringStatus() {
        return monitoringEngine.getStatusReport();
    }

    public List<AnomalyAlert> getRecentAnomalies(int limit) {
        return monitoringEngine.getRecentAnomalies(limit);
    }

    public int clearAlerts(int olderThanMinutes) {
        return monitoringEngine.clearAlerts(olderThanMinutes);
    }

    // ---------------------------------------------------------------
    // Response
    // ---------------------------------------------------------------

    /**
     * Manually run the response engine for an alert.
     */
    public List<ResponseExecution> processAnomaly(AnomalyAlert alert) {
        return responseEngine.processAnomaly(alert);
    }

    public List<ApprovalRequest> getPendingApprovals() {
        return responseEngine.getPendingApprovals();
    }

    public boolean approvePendingAction(String executionId, boolean approved, String approver) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(approver, "approver must not be null");
        return responseEngine.approvePendingAction(executionId, approved, approver);
    }

    public RollbackResult rollbackExecution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return responseEngine.rollbackExecution(executionId);
    }

    public ResponseStatistics getResponseStatistics() {
        return responseEngine.getResponseStatistics();
    }

    public Optional<ResponseExecution> getExecution(String executionId) {
        return responseEngine.getExecution(executionId);
    }

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------

    /**
     * Summary used by health endpoints. {@code status} is {@code UP} when the
     * engine is healthy, {@code DEGRADED} otherwise.
     */
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        try {
            MonitoringStatusReport report = monitoringEngine.getStatusReport();
            boolean healthy = monitoringEngine.isHealthy();
            health.put("status", healthy ? "UP" : "DEGRADED");
            health.put("monitoring", report.getStatus().label());
            health.put("poll_loop_alive", report.isPollLoopAlive());
            health.put("active_alerts", report.getActiveAlerts());
            health.put("pending_approvals", responseEngine.getPendingApprovals().size());
            health.put("last_successful_poll", report.getStatistics().get("last_successful_poll"));
        } catch (RuntimeException e) {
            LOG.warn("Failed to assemble health summary: {}", e.getMessage());
            health.put("status", "DEGRADED");
            health.put("error", e.getMessage());
        }
        return health;
    }

    /**
     * @return {@code true} when monitoring runs and its poll loop is alive
     */
    public boolean isReady() {
        return monitoringEngine.getStatus() == MonitoringStatus.RUNNING && monitoringEngine.isPollLoopAlive();
    }
}
