package com.opssentinel.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the monitoring engine and its detectors.
 *
 * <p>
 * Expected YAML structure (all keys optional):
 * </p>
 *
 * <pre>
 * monitoring:
 *   pollIntervalSeconds: 30
 *   statisticalThreshold: 2.0
 *   correlationThreshold: 0.8
 *   maxAlertsPerMinute: 10
 *   enableAutoResponse: true
 *   monitoredMetrics: [error_rate, avg_latency_ms]
 * </pre>
 *
 * @since 1.0.0
 */
public class MonitoringConfig {

    public static final List<String> DEFAULT_METRICS = List.of(
            "error_rate", "avg_latency_ms", "total_cost", "total_traces",
            "success_rate", "data_source_health_score");

    private int pollIntervalSeconds = 30;
    private double statisticalThreshold = 2.0;
    private double correlationThreshold = 0.8;
    private int maxAlertsPerMinute = 10;
    private boolean enableAutoResponse = true;
    private List<String> monitoredMetrics = new ArrayList<>(DEFAULT_METRICS);

    // --- History ---
    private int historyCapacity = 1000;
    private int historyWindowMinutes = 60;

    // --- Detector tuning ---
    private int minHistoryPoints = 5;
    private int patternWindow = 5;
    private double patternMultiplier = 3.0;

    // --- Alert throttling / queue ---
    private int alertCooldownSeconds = 300;
    private int alertQueueCapacity = 500;
    private int alertRetentionMinutes = 1440;

    // --- Self-monitoring ---
    private int healthCheckIntervalSeconds = 300;
    private int maxErrorsBeforeWarning = 10;
    private int stopTimeoutSeconds = 10;

    /**
     * Validate value ranges.
     *
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        requirePositive(errors, "pollIntervalSeconds", pollIntervalSeconds);
        requirePositive(errors, "maxAlertsPerMinute", maxAlertsPerMinute);
        requirePositive(errors, "historyCapacity", historyCapacity);
        requirePositive(errors, "historyWindowMinutes", historyWindowMinutes);
        requirePositive(errors, "alertQueueCapacity", alertQueueCapacity);
        requirePositive(errors, "alertRetentionMinutes", alertRetentionMinutes);
        requirePositive(errors, "healthCheckIntervalSeconds", healthCheckIntervalSeconds);
        requirePositive(errors, "stopTimeoutSeconds", stopTimeoutSeconds);

        if (statisticalThreshold <= 0) {
            errors.add("statisticalThreshold must be > 0, got: " + statisticalThreshold);
        }
        if (correlationThreshold <= 0 || correlationThreshold > 1) {
            errors.add("correlationThreshold must be in (0, 1], got: " + correlationThreshold);
        }
        if (minHistoryPoints < 2) {
            errors.add("minHistoryPoints must be >= 2, got: " + minHistoryPoints);
        }
        if (patternWindow < 2) {
            errors.add("patternWindow must be >= 2, got: " + patternWindow);
        }
        if (patternMultiplier <= 1) {
            errors.add("patternMultiplier must be > 1, got: " + patternMultiplier);
        }
        if (alertCooldownSeconds < 0) {
            errors.add("alertCooldownSeconds must be >= 0, got: " + alertCooldownSeconds);
        }
        if (maxErrorsBeforeWarning < 0) {
            errors.add("maxErrorsBeforeWarning must be >= 0, got: " + maxErrorsBeforeWarning);
        }
        if (monitoredMetrics == null || monitoredMetrics.isEmpty()) {
            errors.add("monitoredMetrics must not be empty");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid monitoring configuration: " + String.join("; ", errors));
        }
    }

    private static void requirePositive(List<String> errors, String name, int value) {
        if (value <= 0) {
            errors.add(name + " must be > 0, got: " + value);
        }
    }

    /**
     * Summary of the operator-facing options, as reported by the status
     * endpoint.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("poll_interval_seconds", pollIntervalSeconds);
        summary.put("statistical_threshold", statisticalThreshold);
        summary.put("correlation_threshold", correlationThreshold);
        summary.put("max_alerts_per_minute", maxAlertsPerMinute);
        summary.put("enable_auto_response", enableAutoResponse);
        summary.put("monitored_metrics", List.copyOf(monitoredMetrics));
        summary.put("alert_cooldown_seconds", alertCooldownSeconds);
        return summary;
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(int pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public double getStatisticalThreshold() {
        return statisticalThreshold;
    }

    public void setStatisticalThreshold(double statisticalThreshold) {
        this.statisticalThreshold = statisticalThreshold;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public void setCorrelationThreshold(double correlationThreshold) {
        this.correlationThreshold = correlationThreshold;
    }

    public int getMaxAlertsPerMinute() {
        return maxAlertsPerMinute;
    }

    public void setMaxAlertsPerMinute(int maxAlertsPerMinute) {
        this.maxAlertsPerMinute = maxAlertsPerMinute;
    }

    public boolean isEnableAutoResponse() {
        return enableAutoResponse;
    }

    public void setEnableAutoResponse(boolean enableAutoResponse) {
        this.enableAutoResponse = enableAutoResponse;
    }

    public List<String> getMonitoredMetrics() {
        return monitoredMetrics;
    }

    public void setMonitoredMetrics(List<String> monitoredMetrics) {
        this.monitoredMetrics = monitoredMetrics != null ? new ArrayList<>(monitoredMetrics) : new ArrayList<>();
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getHistoryWindowMinutes() {
        return historyWindowMinutes;
    }

    public void setHistoryWindowMinutes(int historyWindowMinutes) {
        this.historyWindowMinutes = historyWindowMinutes;
    }

    public int getMinHistoryPoints() {
        return minHistoryPoints;
    }

    public void setMinHistoryPoints(int minHistoryPoints) {
        this.minHistoryPoints = minHistoryPoints;
    }

    public int getPatternWindow() {
        return patternWindow;
    }

    public void setPatternWindow(int patternWindow) {
        this.patternWindow = patternWindow;
    }

    public double getPatternMultiplier() {
        return patternMultiplier;
    }

    public void setPatternMultiplier(double patternMultiplier) {
        this.patternMultiplier = patternMultiplier;
    }

    public int getAlertCooldownSeconds() {
        return alertCooldownSeconds;
    }

    public void setAlertCooldownSeconds(int alertCooldownSeconds) {
        this.alertCooldownSeconds = alertCooldownSeconds;
    }

    public int getAlertQueueCapacity() {
        return alertQueueCapacity;
    }

    public void setAlertQueueCapacity(int alertQueueCapacity) {
        this.alertQueueCapacity = alertQueueCapacity;
    }

    public int getAlertRetentionMinutes() {
        return alertRetentionMinutes;
    }

    public void setAlertRetentionMinutes(int alertRetentionMinutes) {
        this.alertRetentionMinutes = alertRetentionMinutes;
    }

    public int getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public void setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
    }

    public int getMaxErrorsBeforeWarning() {
        return maxErrorsBeforeWarning;
    }

    public void setMaxErrorsBeforeWarning(int maxErrorsBeforeWarning) {
        this.maxErrorsBeforeWarning = maxErrorsBeforeWarning;
    }

    public int getStopTimeoutSeconds() {
        return stopTimeoutSeconds;
    }

    public void setStopTimeoutSeconds(int stopTimeoutSeconds) {
        this.stopTimeoutSeconds = stopTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "MonitoringConfig" + summary();
    }
}
