package com.opssentinel.core.detection;

import com.opssentinel.core.history.MetricHistoryStore;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Z-score outlier detector.
 *
 * <p>
 * For every metric with at least {@code minHistoryPoints} historical points
 * the detector computes the sample mean and sample standard deviation of the
 * retained history and flags the current value when
 * {@code |value - mean| / stddev > threshold}. Metrics whose history has no
 * variance are skipped.
 * </p>
 *
 * <h3>Severity</h3>
 * <p>
 * Derived from the z-score: {@code >= 4.0} critical, {@code >= 3.0} high,
 * {@code >= 2.5} medium, otherwise low. For the metrics in
 * {@link #SENSITIVE_METRICS} the cut-offs are scaled by
 * {@value #SENSITIVE_SCALE}.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetector.class);

    static final double CRITICAL_Z = 4.0;
    static final double HIGH_Z = 3.0;
    static final double MEDIUM_Z = 2.5;

    /** Metrics that escalate at lower z-scores. */
    static final Set<String> SENSITIVE_METRICS = Set.of("error_rate", "success_rate", "data_source_health_score");
    static final double SENSITIVE_SCALE = 0.8;

    private final double threshold;
    private final int minHistoryPoints;
    private final Clock clock;

    /**
     * @param threshold        z-score a value must exceed to be flagged
     * @param minHistoryPoints minimum history size before the metric is scored
     * @param clock            time source for alert timestamps
     */
    public StatisticalDetector(double threshold, int minHistoryPoints, Clock clock) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        if (minHistoryPoints < 2) {
            throw new IllegalArgumentException("minHistoryPoints must be >= 2, got: " + minHistoryPoints);
        }
        this.threshold = threshold;
        this.minHistoryPoints = minHistoryPoints;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<AnomalyAlert> detect(Map<String, Double> snapshot, MetricHistoryStore history) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(history, "history must not be null");

        List<AnomalyAlert> alerts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : snapshot.entrySet()) {
            String metric = entry.getKey();
            double value = entry.getValue();

            List<Double> values = history.values(metric);
            if (values.size() < minHistoryPoints) {
                LOG.trace("Metric '{}' has {} point(s), need {} - skipping", metric, values.size(), minHistoryPoints);
                continue;
            }

            double mean = mean(values);
            double stddev = sampleStdDev(values, mean);
            if (stddev == 0) {
                LOG.trace("Metric '{}' has no variance - skipping", metric);
                continue;
            }

            double z = Math.abs(value - mean) / stddev;
            if (z <= threshold) {
                continue;
            }

            Severity severity = severityFor(metric, z);
            LOG.debug("Statistical anomaly: {}={} mean={} stddev={} z={}", metric, value, mean, stddev, z);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("mean", mean);
            context.put("std_dev", stddev);
            context.put("z_score", z);
            context.put("threshold", threshold);
            context.put("history_points", values.size());
            context.put("detection_method", "z_score");

            alerts.add(AnomalyAlert.builder()
                    .timestamp(clock.instant())
                    .anomalyType(AnomalyType.STATISTICAL)
                    .metricName(metric)
                    .severity(severity)
                    .actualValue(value)
                    .expectedValue(mean)
                    .deviationScore(z)
                    .message(String.format(
                            "Statistical anomaly in %s: %.2f (expected %.2f ± %.2f, z=%.2f)",
                            metric, value, mean, stddev, z))
                    .contextData(context)
                    .build());
        }
        return alerts;
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.STATISTICAL;
    }

    static Severity severityFor(String metric, double z) {
        double scale = SENSITIVE_METRICS.contains(metric) ? SENSITIVE_SCALE : 1.0;
        if (z >= CRITICAL_Z * scale) {
            return Severity.CRITICAL;
        }
        if (z >= HIGH_Z * scale) {
            return Severity.HIGH;
        }
        if (z >= MEDIUM_Z * scale) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    static double sampleStdDev(List<Double> values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }
}
