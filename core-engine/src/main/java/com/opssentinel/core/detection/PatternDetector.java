package com.opssentinel.core.detection;

import com.opssentinel.core.history.MetricHistoryStore;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.MetricPoint;
import com.opssentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rapid-increase pattern detector.
 *
 * <p>
 * The examined sequence is the last {@code window - 1} historical points
 * followed by the current value. The detector fires when the sequence is
 * non-decreasing and {@code last / max(first, 0.001)} exceeds the
 * multiplier. The ratio is reported as the deviation score.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PatternDetector.class);

    /** Floor applied to the first value so a zero baseline does not divide by zero. */
    static final double MIN_BASE = 0.001;

    private final int window;
    private final double multiplier;
    private final Clock clock;

    public PatternDetector(int window, double multiplier, Clock clock) {
        if (window < 2) {
            throw new IllegalArgumentException("window must be >= 2, got: " + window);
        }
        if (multiplier <= 1) {
            throw new IllegalArgumentException("multiplier must be > 1, got: " + multiplier);
        }
        this.window = window;
        this.multiplier = multiplier;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<AnomalyAlert> detect(Map<String, Double> snapshot, MetricHistoryStore history) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(history, "history must not be null");

        List<AnomalyAlert> alerts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : snapshot.entrySet()) {
            String metric = entry.getKey();
            List<MetricPoint> previous = history.recent(metric, window - 1);
            if (previous.size() < window - 1) {
                continue;
            }

            List<Double> sequence = new ArrayList<>(window);
            for (MetricPoint point : previous) {
                sequence.add(point.getValue());
            }
            sequence.add(entry.getValue());

            if (!isNonDecreasing(sequence)) {
                continue;
            }
            double first = sequence.get(0);
            double last = sequence.get(sequence.size() - 1);
            double ratio = last / Math.max(first, MIN_BASE);
            if (ratio <= multiplier) {
                continue;
            }

            Severity severity = ratio > 2 * multiplier ? Severity.HIGH : Severity.MEDIUM;
            LOG.debug("Rapid increase in {}: {} -> {} (ratio {})", metric, first, last, ratio);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("pattern", "rapid_increase");
            context.put("sequence", List.copyOf(sequence));
            context.put("ratio", ratio);
            context.put("multiplier", multiplier);
            context.put("detection_method", "monotonic_ratio");

            alerts.add(AnomalyAlert.builder()
                    .timestamp(clock.instant())
                    .anomalyType(AnomalyType.PATTERN)
                    .metricName(metric)
                    .severity(severity)
                    .actualValue(last)
                    .expectedValue(first)
                    .deviationScore(ratio)
                    .message(String.format("Rapid increase in %s: %.2f -> %.2f over %d points (%.1fx)",
                            metric, first, last, sequence.size(), ratio))
                    .contextData(context)
                    .build());
        }
        return alerts;
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.PATTERN;
    }

    static boolean isNonDecreasing(List<Double> sequence) {
        for (int i = 1; i < sequence.size(); i++) {
            if (sequence.get(i) < sequence.get(i - 1)) {
                return false;
            }
        }
        return true;
    }
}
