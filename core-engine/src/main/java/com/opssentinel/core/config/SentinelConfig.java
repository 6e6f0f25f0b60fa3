package com.opssentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Top-level POJO for the sentinel YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * monitoring:
 *   pollIntervalSeconds: 30
 * response:
 *   approvalSeverity: critical
 * thresholds:
 *   - metric: error_rate
 *     direction: above
 *     critical: 20
 *     high: 10
 *     medium: 5
 * </pre>
 *
 * <p>
 * When {@code thresholds} is omitted the built-in
 * {@link ThresholdRule#defaults()} apply. Call {@link #validate()} after
 * loading.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private MonitoringConfig monitoring = new MonitoringConfig();
    private ResponseConfig response = new ResponseConfig();
    private List<ThresholdRule> thresholds = ThresholdRule.defaults();

    public MonitoringConfig getMonitoring() {
        return monitoring;
    }

    public void setMonitoring(MonitoringConfig monitoring) {
        this.monitoring = monitoring != null ? monitoring : new MonitoringConfig();
    }

    public ResponseConfig getResponse() {
        return response;
    }

    public void setResponse(ResponseConfig response) {
        this.response = response != null ? response : new ResponseConfig();
    }

    /**
     * @return unmodifiable list of threshold rules
     */
    public List<ThresholdRule> getThresholds() {
        return Collections.unmodifiableList(thresholds);
    }

    /**
     * Set the threshold rules (used by SnakeYAML during deserialization).
     * {@code null} restores the defaults.
     */
    public void setThresholds(List<ThresholdRule> thresholds) {
        this.thresholds = thresholds != null ? new ArrayList<>(thresholds) : ThresholdRule.defaults();
    }

    /**
     * Validate every section, collecting all errors into one exception.
     *
     * @throws IllegalStateException if any section is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            monitoring.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            response.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        for (int i = 0; i < thresholds.size(); i++) {
            ThresholdRule rule = Objects.requireNonNull(thresholds.get(i),
                    "Threshold rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "monitoring=" + monitoring +
                ", response=" + response +
                ", thresholds=" + thresholds +
                '}';
    }
}
