package com.opssentinel.core.monitoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort snapshot of the monitoring engine for status endpoints.
 *
 * @since 1.0.0
 */
public final class MonitoringStatusReport {

    private final MonitoringStatus status;
    private final Map<String, Object> config;
    private final Map<String, Object> statistics;
    private final int activeAlerts;
    private final Map<String, Integer> metricHistorySize;
    private final boolean pollLoopAlive;

    MonitoringStatusReport(MonitoringStatus status, Map<String, Object> config, Map<String, Object> statistics,
            int activeAlerts, Map<String, Integer> metricHistorySize, boolean pollLoopAlive) {
        this.status = status;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        this.activeAlerts = activeAlerts;
        this.metricHistorySize = Collections.unmodifiableMap(new LinkedHashMap<>(metricHistorySize));
        this.pollLoopAlive = pollLoopAlive;
    }

    public MonitoringStatus getStatus() {
        return status;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public Map<String, Object> getStatistics() {
        return statistics;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    public Map<String, Integer> getMetricHistorySize() {
        return metricHistorySize;
    }

    public boolean isPollLoopAlive() {
        return pollLoopAlive;
    }

    @Override
    public String toString() {
        return "MonitoringStatusReport{" +
                "status=" + status +
                ", activeAlerts=" + activeAlerts +
                ", pollLoopAlive=" + pollLoopAlive +
                ", statistics=" + statistics +
                '}';
    }
}
