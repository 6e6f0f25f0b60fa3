package com.opssentinel.core.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters of the monitoring engine.
 *
 * <p>
 * Written by the poll thread with atomic operations and read by any thread
 * through {@link #snapshot()}.
 * </p>
 *
 * <h3>Exposed Counters</h3>
 * <ul>
 * <li>{@code total_checks}: poll cycles started</li>
 * <li>{@code failed_checks}: cycles skipped because the metrics source
 * failed</li>
 * <li>{@code anomalies_detected}: candidate alerts from all detectors</li>
 * <li>{@code alerts_generated}: alerts that passed throttling</li>
 * <li>{@code suppressed_by_cooldown} / {@code rate_limited}: throttled
 * candidates</li>
 * <li>{@code dropped_from_queue}: alerts evicted from a full queue</li>
 * <li>{@code auto_responses_triggered}: alerts handed to the response
 * engine</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MonitoringStatistics {

    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong failedChecks = new AtomicLong();
    private final AtomicLong consecutiveFailures = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong alertsGenerated = new AtomicLong();
    private final AtomicLong suppressedByCooldown = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong droppedFromQueue = new AtomicLong();
    private final AtomicLong autoResponsesTriggered = new AtomicLong();
    private final AtomicLong detectorErrors = new AtomicLong();
    private final AtomicLong persistenceErrors = new AtomicLong();
    private final AtomicLong jobFailures = new AtomicLong();
    private final AtomicLong restarts = new AtomicLong();
    private final AtomicLong detectionNanos = new AtomicLong();
    private final AtomicLong timedCycles = new AtomicLong();
    private final AtomicReference<Instant> lastCheck = new AtomicReference<>();
    private final AtomicReference<Instant> lastSuccessfulPoll = new AtomicReference<>();

    void checkStarted(Instant at) {
        totalChecks.incrementAndGet();
        lastCheck.set(at);
    }

    /**
     * @return the number of consecutive failures, including this one
     */
    long checkFailed() {
        failedChecks.incrementAndGet();
        return consecutiveFailures.incrementAndGet();
    }

    void checkSucceeded(Instant at, long detectionTimeNanos) {
        consecutiveFailures.set(0);
        lastSuccessfulPoll.set(at);
        detectionNanos.addAndGet(detectionTimeNanos);
        timedCycles.incrementAndGet();
    }

    void anomaliesDetected(int count) {
        anomaliesDetected.addAndGet(count);
    }

    void alertGenerated() {
        alertsGenerated.incrementAndGet();
    }

    void suppressedByCooldown() {
        suppressedByCooldown.incrementAndGet();
    }

    void rateLimited() {
        rateLimited.incrementAndGet();
    }

    void droppedFromQueue() {
        droppedFromQueue.incrementAndGet();
    }

    void autoResponseTriggered() {
        autoResponsesTriggered.incrementAndGet();
    }

    void detectorError() {
        detectorErrors.incrementAndGet();
    }

    void persistenceError() {
        persistenceErrors.incrementAndGet();
    }

    void jobFailed() {
        jobFailures.incrementAndGet();
    }

    void restarted() {
        restarts.incrementAndGet();
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public long getTotalChecks() {
        return totalChecks.get();
    }

    public long getFailedChecks() {
        return failedChecks.get();
    }

    public long getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.get();
    }

    public long getAlertsGenerated() {
        return alertsGenerated.get();
    }

    public long getSuppressedByCooldown() {
        return suppressedByCooldown.get();
    }

    public long getRateLimited() {
        return rateLimited.get();
    }

    public long getDroppedFromQueue() {
        return droppedFromQueue.get();
    }

    public long getAutoResponsesTriggered() {
        return autoResponsesTriggered.get();
    }

    public long getDetectorErrors() {
        return detectorErrors.get();
    }

    public long getPersistenceErrors() {
        return persistenceErrors.get();
    }

    public long getJobFailures() {
        return jobFailures.get();
    }

    public long getRestarts() {
        return restarts.get();
    }

    public Instant getLastCheck() {
        return lastCheck.get();
    }

    public Instant getLastSuccessfulPoll() {
        return lastSuccessfulPoll.get();
    }

    /**
     * @return mean detection time of successful cycles in milliseconds
     */
    public double getAverageDetectionTimeMillis() {
        long cycles = timedCycles.get();
        return cycles == 0 ? 0.0 : detectionNanos.get() / 1_000_000.0 / cycles;
    }

    /**
     * @return copy of every counter keyed by its snake_case name
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("total_checks", getTotalChecks());
        snapshot.put("failed_checks", getFailedChecks());
        snapshot.put("consecutive_failures", getConsecutiveFailures());
        snapshot.put("anomalies_detected", getAnomaliesDetected());
        snapshot.put("alerts_generated", getAlertsGenerated());
        snapshot.put("suppressed_by_cooldown", getSuppressedByCooldown());
        snapshot.put("rate_limited", getRateLimited());
        snapshot.put("dropped_from_queue", getDroppedFromQueue());
        snapshot.put("auto_responses_triggered", getAutoResponsesTriggered());
        snapshot.put("detector_errors", getDetectorErrors());
        snapshot.put("persistence_errors", getPersistenceErrors());
        snapshot.put("job_failures", getJobFailures());
        snapshot.put("restarts", getRestarts());
        snapshot.put("avg_detection_time_ms", getAverageDetectionTimeMillis());
        snapshot.put("last_check", getLastCheck());
        snapshot.put("last_successful_poll", getLastSuccessfulPoll());
        return snapshot;
    }
}
