package com.opssentinel.core.monitoring;

import com.opssentinel.core.config.MonitoringConfig;
import com.opssentinel.core.config.SentinelConfig;
import com.opssentinel.core.detection.AnomalyDetector;
import com.opssentinel.core.detection.DetectorFactory;
import com.opssentinel.core.history.MetricHistoryStore;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.MetricPoint;
import com.opssentinel.core.response.ResponseEngine;
import com.opssentinel.core.spi.LoggingNotificationSink;
import com.opssentinel.core.spi.MetricsSource;
import com.opssentinel.core.spi.MetricsSourceException;
import com.opssentinel.core.spi.NotificationSink;
import com.opssentinel.core.spi.PersistenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Owns the poll loop: fetches metrics, runs the detectors, throttles the
 * resulting alerts, queues them and hands them to the response engine.
 *
 * <h3>Poll cycle</h3>
 * <ol>
 * <li>Fetch the monitored metrics from the {@link MetricsSource}; a failure
 * skips the cycle.</li>
 * <li>Run every detector against the history, each isolated from the
 * others' failures.</li>
 * <li>Append the snapshot to the history.</li>
 * <li>Order candidates by severity, then deviation score, and apply the
 * per-metric cooldown and the global rate limit. Of several detectors
 * flagging the same metric in one cycle only the most severe alert
 * survives; the rest fall under the cooldown.</li>
 * <li>Enqueue, optionally auto-respond, then persist and notify.</li>
 * </ol>
 *
 * <h3>Scheduling</h3>
 * <p>
 * One {@link ScheduledExecutorService} runs the poll task at a fixed delay
 * plus two maintenance jobs: a health check and an hourly cleanup. Every
 * {@value #RESTART_EVERY_FAILURES}th consecutive failed poll re-schedules
 * the poll task. {@link #stop()} lets an in-flight cycle finish and waits a
 * bounded time for it.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringEngine.class);

    static final int RESTART_EVERY_FAILURES = 5;
    static final int STALE_POLL_INTERVALS = 3;
    static final Duration CLEANUP_INTERVAL = Duration.ofHours(1);

    private final SentinelConfig config;
    private final MonitoringConfig monitoring;
    private final MetricsSource metricsSource;
    private final List<AnomalyDetector> detectors;
    private final ResponseEngine responseEngine;
    private final PersistenceStore persistence;
    private final NotificationSink notifications;
    private final Clock clock;
    private final MetricHistoryStore history;
    private final AlertThrottle throttle;
    private final AlertQueue queue;
    private final MonitoringStatistics statistics = new MonitoringStatistics();
    private final Supplier<ScheduledExecutorService> schedulerFactory;

    private final Object lifecycleLock = new Object();
    private volatile MonitoringStatus status = MonitoringStatus.STOPPED;
    private volatile Instant startedAt;
    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> cleanupTask;

    private MonitoringEngine(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config must not be null");
        this.monitoring = config.getMonitoring();
        this.metricsSource = Objects.requireNonNull(builder.metricsSource, "metricsSource must not be null");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.detectors = builder.detectors != null
                ? List.copyOf(builder.detectors)
                : DetectorFactory.createAll(config, clock);
        this.responseEngine = builder.responseEngine;
        this.persistence = builder.persistence != null ? builder.persistence : PersistenceStore.noop();
        this.notifications = builder.notifications != null ? builder.notifications : new LoggingNotificationSink();
        this.history = builder.history != null
                ? builder.history
                : new MetricHistoryStore(monitoring.getHistoryCapacity(),
                        Duration.ofMinutes(monitoring.getHistoryWindowMinutes()), clock);
        this.throttle = new AlertThrottle(Duration.ofSeconds(monitoring.getAlertCooldownSeconds()),
                monitoring.getMaxAlertsPerMinute());
        this.queue = new AlertQueue(monitoring.getAlertQueueCapacity());
        this.schedulerFactory = builder.schedulerFactory != null
                ? builder.schedulerFactory
                : MonitoringEngine::newScheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start polling. Does nothing when already running.
     *
     * @throws IllegalStateException if the scheduler cannot be created
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (status == MonitoringStatus.RUNNING) {
                LOG.info("Monitoring already running");
                return;
            }
            ScheduledExecutorService created;
            try {
                created = schedulerFactory.get();
            } catch (RuntimeException e) {
                throw new IllegalStateException("Failed to create monitoring scheduler", e);
            }
            if (created == null) {
                throw new IllegalStateException("Scheduler factory returned null");
            }
            scheduler = created;
            startedAt = clock.instant();

            long healthSeconds = monitoring.getHealthCheckIntervalSeconds();
            pollTask = scheduler.scheduleWithFixedDelay(this::pollJob, 0,
                    monitoring.getPollIntervalSeconds(), TimeUnit.SECONDS);
            healthTask = scheduler.scheduleAtFixedRate(this::healthJob, healthSeconds, healthSeconds,
                    TimeUnit.SECONDS);
            cleanupTask = scheduler.scheduleAtFixedRate(this::cleanupJob, CLEANUP_INTERVAL.toSeconds(),
                    CLEANUP_INTERVAL.toSeconds(), TimeUnit.SECONDS);
            status = MonitoringStatus.RUNNING;
            LOG.info("Monitoring started: polling {} metric(s) every {}s", monitoring.getMonitoredMetrics().size(),
                    monitoring.getPollIntervalSeconds());
        }
    }

    /**
     * Stop polling. An in-flight cycle completes; the call waits at most
     * {@code stopTimeoutSeconds} for it. Does nothing when already stopped.
     */
    public void stop() {
        ScheduledExecutorService stopping;
        synchronized (lifecycleLock) {
            if (status == MonitoringStatus.STOPPED) {
                return;
            }
            status = MonitoringStatus.STOPPED;
            cancel(pollTask);
            cancel(healthTask);
            cancel(cleanupTask);
            stopping = scheduler;
            scheduler = null;
        }

        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(monitoring.getStopTimeoutSeconds(), TimeUnit.SECONDS)) {
                LOG.warn("Poll cycle did not finish within {}s, interrupting", monitoring.getStopTimeoutSeconds());
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping.shutdownNow();
        }
        LOG.info("Monitoring stopped");
    }

    public MonitoringStatus getStatus() {
        return status;
    }

    public boolean isPollLoopAlive() {
        ScheduledFuture<?> task = pollTask;
        return status == MonitoringStatus.RUNNING && task != null && !task.isDone();
    }

    // ---------------------------------------------------------------
    // Poll cycle
    // ---------------------------------------------------------------

    private void pollJob() {
        try {
            runPollCycle();
        } catch (RuntimeException e) {
            statistics.jobFailed();
            long failures = statistics.checkFailed();
            LOG.error("Poll cycle failed ({} consecutive)", failures, e);
            restartOnRepeatedFailure(failures);
        }
    }

    /**
     * Run one poll cycle synchronously.
     *
     * @return the alerts that passed throttling, in processing order
     */
    List<AnomalyAlert> runPollCycle() {
        Instant now = clock.instant();
        statistics.checkStarted(now);

        Map<String, Double> raw;
        try {
            raw = metricsSource.getMetrics(monitoring.pollInterval());
            if (raw == null) {
                throw new MetricsSourceException("Metrics source returned no data");
            }
        } catch (MetricsSourceException e) {
            long failures = statistics.checkFailed();
            LOG.error("Skipping poll cycle, metrics source failed ({} consecutive): {}", failures, e.getMessage());
            restartOnRepeatedFailure(failures);
            return List.of();
        }

        long detectionStart = System.nanoTime();
        Map<String, Double> snapshot = monitoredSnapshot(raw);
        List<AnomalyAlert> candidates = detect(snapshot);
        for (Map.Entry<String, Double> entry : snapshot.entrySet()) {
            history.append(new MetricPoint(now, entry.getKey(), entry.getValue(), metricsSource.name()));
        }
        statistics.checkSucceeded(now, System.nanoTime() - detectionStart);
        statistics.anomaliesDetected(candidates.size());

        candidates.sort(Comparator
                .comparing((AnomalyAlert a) -> a.getSeverity().rank()).reversed()
                .thenComparing(Comparator.comparingDouble(AnomalyAlert::getDeviationScore).reversed()));

        List<AnomalyAlert> accepted = new ArrayList<>();
        for (AnomalyAlert alert : candidates) {
            switch (throttle.evaluate(alert, now)) {
                case ACCEPTED -> {
                    publish(alert);
                    accepted.add(alert);
                }
                case COOLDOWN -> {
                    statistics.suppressedByCooldown();
                    LOG.debug("Suppressed {} alert for {} (cooldown)", alert.getAnomalyType().label(),
                            alert.getMetricName());
                }
                case RATE_LIMITED -> {
                    statistics.rateLimited();
                    LOG.warn("Rate limit of {} alerts/minute reached, dropped alert for {}",
                            monitoring.getMaxAlertsPerMinute(), alert.getMetricName());
                }
            }
        }

        if (!candidates.isEmpty()) {
            LOG.info("Poll cycle: {} candidate(s), {} alert(s) raised", candidates.size(), accepted.size());
        }
        return accepted;
    }

    private Map<String, Double> monitoredSnapshot(Map<String, Double> raw) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        for (String metric : monitoring.getMonitoredMetrics()) {
            Double value = raw.get(metric);
            if (value == null) {
                continue;
            }
            if (!Double.isFinite(value)) {
                LOG.debug("Ignoring non-finite value {} for {}", value, metric);
                continue;
            }
            snapshot.put(metric, value);
        }
        return snapshot;
    }

    private List<AnomalyAlert> detect(Map<String, Double> snapshot) {
        List<AnomalyAlert> candidates = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                candidates.addAll(detector.detect(snapshot, history));
            } catch (RuntimeException e) {
                statistics.detectorError();
                LOG.error("{} detector failed", detector.type().label(), e);
            }
        }
        return candidates;
    }

    private void publish(AnomalyAlert alert) {
        statistics.alertGenerated();
        queue.offer(alert).ifPresent(dropped -> statistics.droppedFromQueue());

        if (monitoring.isEnableAutoResponse() && responseEngine != null) {
            try {
                responseEngine.processAnomaly(alert);
                if (alert.isAutoResponseTriggered()) {
                    statistics.autoResponseTriggered();
                }
            } catch (RuntimeException e) {
                LOG.error("Auto response failed for alert {}", alert.getId(), e);
            }
        }

        // the persisted and notified record carries the auto-response outcome
        try {
            persistence.persistAlert(alert);
        } catch (RuntimeException e) {
            statistics.persistenceError();
            LOG.warn("Failed to persist alert {}: {}", alert.getId(), e.getMessage());
        }
        try {
            notifications.notifyAlert(alert);
        } catch (RuntimeException e) {
            LOG.warn("Failed to notify alert {}: {}", alert.getId(), e.getMessage());
        }
    }

    private void restartOnRepeatedFailure(long consecutiveFailures) {
        if (consecutiveFailures % RESTART_EVERY_FAILURES != 0) {
            return;
        }
        synchronized (lifecycleLock) {
            if (status != MonitoringStatus.RUNNING || scheduler == null) {
                return;
            }
            LOG.warn("{} consecutive poll failures, re-scheduling the poll task", consecutiveFailures);
            cancel(pollTask);
            long interval = monitoring.getPollIntervalSeconds();
            pollTask = scheduler.scheduleWithFixedDelay(this::pollJob, interval, interval, TimeUnit.SECONDS);
            statistics.restarted();
        }
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    private void healthJob() {
        try {
            runHealthCheck();
        } catch (RuntimeException e) {
            statistics.jobFailed();
            LOG.error("Health check failed", e);
        }
    }

    /**
     * Log a warning when polling is stale or errors pile up.
     *
     * @return {@code true} if no problem was found
     */
    boolean runHealthCheck() {
        boolean healthy = true;
        if (isPollStale()) {
            healthy = false;
            LOG.warn("Monitoring health: last successful poll at {} is older than {} poll intervals",
                    statistics.getLastSuccessfulPoll(), STALE_POLL_INTERVALS);
        }
        long errors = statistics.getConsecutiveFailures();
        if (errors > monitoring.getMaxErrorsBeforeWarning()) {
            healthy = false;
            LOG.warn("Monitoring health: {} consecutive failed check(s) exceed the warning limit of {}", errors,
                    monitoring.getMaxErrorsBeforeWarning());
        }
        if (healthy) {
            LOG.debug("Monitoring health check passed");
        }
        return healthy;
    }

    private boolean isPollStale() {
        if (status != MonitoringStatus.RUNNING) {
            return false;
        }
        Instant reference = statistics.getLastSuccessfulPoll() != null
                ? statistics.getLastSuccessfulPoll()
                : startedAt;
        Duration staleAfter = monitoring.pollInterval().multipliedBy(STALE_POLL_INTERVALS);
        return reference != null && reference.plus(staleAfter).isBefore(clock.instant());
    }

    /**
     * @return {@code true} when running with fresh polls, or stopped
     */
    public boolean isHealthy() {
        return !isPollStale() && statistics.getConsecutiveFailures() <= monitoring.getMaxErrorsBeforeWarning();
    }

    private void cleanupJob() {
        try {
            runCleanup();
        } catch (RuntimeException e) {
            statistics.jobFailed();
            LOG.error("Cleanup failed", e);
        }
    }

    void runCleanup() {
        int alerts = clearAlerts(monitoring.getAlertRetentionMinutes());
        int executions = 0;
        if (responseEngine != null) {
            executions = responseEngine.cleanupCompletedExecutions(
                    Duration.ofHours(config.getResponse().getExecutionRetentionHours()));
        }
        LOG.debug("Cleanup removed {} alert(s) and {} execution(s)", alerts, executions);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public MonitoringStatusReport getStatusReport() {
        return new MonitoringStatusReport(status, monitoring.summary(), statistics.snapshot(), queue.size(),
                history.sizes(), isPollLoopAlive());
    }

    /**
     * @return up to {@code limit} queued alerts, newest first
     */
    public List<AnomalyAlert> getRecentAnomalies(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return queue.recent(limit);
    }

    /**
     * Remove queued alerts older than the given age.
     *
     * @return number of alerts removed
     */
    public int clearAlerts(int olderThanMinutes) {
        if (olderThanMinutes < 0) {
            throw new IllegalArgumentException("olderThanMinutes must be >= 0, got: " + olderThanMinutes);
        }
        int removed = queue.removeOlderThan(clock.instant().minus(Duration.ofMinutes(olderThanMinutes)));
        if (removed > 0) {
            LOG.info("Cleared {} alert(s) older than {} minute(s)", removed, olderThanMinutes);
        }
        return removed;
    }

    public AlertQueue getAlertQueue() {
        return queue;
    }

    public MetricHistoryStore getHistory() {
        return history;
    }

    public MonitoringStatistics getStatistics() {
        return statistics;
    }

    public SentinelConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static ScheduledExecutorService newScheduler() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "sentinel-monitor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newScheduledThreadPool(2, factory);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link MonitoringEngine}. {@code config} and
     * {@code metricsSource} are required. Without explicit detectors the
     * standard chain from {@link DetectorFactory} is used; without a response
     * engine alerts are only queued.
     */
    public static final class Builder {
        private SentinelConfig config;
        private MetricsSource metricsSource;
        private List<AnomalyDetector> detectors;
        private ResponseEngine responseEngine;
        private PersistenceStore persistence;
        private NotificationSink notifications;
        private Clock clock;
        private MetricHistoryStore history;
        private Supplier<ScheduledExecutorService> schedulerFactory;

        private Builder() {
        }

        public Builder config(SentinelConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricsSource(MetricsSource metricsSource) {
            this.metricsSource = metricsSource;
            return this;
        }

        public Builder detectors(List<AnomalyDetector> detectors) {
            this.detectors = detectors;
            return this;
        }

        public Builder responseEngine(ResponseEngine responseEngine) {
            this.responseEngine = responseEngine;
            return this;
        }

        public Builder persistence(PersistenceStore persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder notifications(NotificationSink notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder history(MetricHistoryStore history) {
            this.history = history;
            return this;
        }

        public Builder schedulerFactory(Supplier<ScheduledExecutorService> schedulerFactory) {
            this.schedulerFactory = schedulerFactory;
            return this;
        }

        public MonitoringEngine build() {
            return new MonitoringEngine(this);
        }
    }
}
