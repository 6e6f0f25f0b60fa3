package com.opssentinel.core.detection;

import com.opssentinel.core.config.ThresholdRule;
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
import java.util.Optional;

/**
 * Static threshold detector.
 *
 * <p>
 * Each metric has at most one {@link ThresholdRule}. Its levels are checked
 * from critical down to low and the first strictly breached level decides
 * the severity, so one metric produces at most one alert per snapshot.
 * History is not consulted.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    private final Map<String, ThresholdRule> rules = new LinkedHashMap<>();
    private final Clock clock;

    /**
     * @param rules validated threshold rules; a later rule for the same metric
     *              replaces an earlier one
     * @param clock time source for alert timestamps
     */
    public ThresholdDetector(List<ThresholdRule> rules, Clock clock) {
        Objects.requireNonNull(rules, "rules must not be null");
        for (ThresholdRule rule : rules) {
            rule.validate();
            if (this.rules.put(rule.getMetric(), rule) != null) {
                LOG.warn("Duplicate threshold rule for metric '{}' - keeping the last one", rule.getMetric());
            }
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<AnomalyAlert> detect(Map<String, Double> snapshot, MetricHistoryStore history) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        List<AnomalyAlert> alerts = new ArrayList<>();
        for (Map.Entry<String, Double> entry : snapshot.entrySet()) {
            ThresholdRule rule = rules.get(entry.getKey());
            if (rule == null) {
                continue;
            }
            evaluate(rule, entry.getValue()).ifPresent(alerts::add);
        }
        return alerts;
    }

    /**
     * @return the severity assigned to {@code value} under {@code rule}, or
     *         {@code null} if no level is breached
     */
    static Severity classify(ThresholdRule rule, double value) {
        for (Map.Entry<Severity, Double> level : rule.levels().entrySet()) {
            if (rule.isBreached(value, level.getValue())) {
                return level.getKey();
            }
        }
        return null;
    }

    private Optional<AnomalyAlert> evaluate(ThresholdRule rule, double value) {
        Map<Severity, Double> levels = rule.levels();
        Severity severity = classify(rule, value);
        if (severity == null) {
            return Optional.empty();
        }
        double level = levels.get(severity);
        double deviation = level == 0 ? 0 : Math.abs(value - level) / Math.abs(level);

        LOG.debug("Threshold breached: {}={} {} {} ({})", rule.getMetric(), value, rule.operator(), level,
                severity.label());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("threshold_type", severity.label());
        context.put("operator", rule.operator());
        levels.forEach((s, v) -> context.put(s.label() + "_threshold", v));
        context.put("detection_method", "static_threshold");

        return Optional.of(AnomalyAlert.builder()
                .timestamp(clock.instant())
                .anomalyType(AnomalyType.THRESHOLD)
                .metricName(rule.getMetric())
                .severity(severity)
                .actualValue(value)
                .expectedValue(level)
                .deviationScore(deviation)
                .message(String.format("%s threshold breached for %s: %.2f %s %.2f",
                        severity.label(), rule.getMetric(), value, rule.operator(), level))
                .contextData(context)
                .build());
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.THRESHOLD;
    }
}
