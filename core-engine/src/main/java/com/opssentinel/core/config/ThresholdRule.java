package com.opssentinel.core.config;

import com.opssentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Static per-metric threshold rule loaded from configuration.
 *
 * <p>
 * A rule carries up to four levels, one per {@link Severity}. Direction
 * {@code above} means larger values are worse ({@code value > level});
 * direction {@code below} means smaller values are worse
 * ({@code value < level}).
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization. Validation
 * requires the levels to be ordered so that a worse value can never map to a
 * milder severity.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdRule {

    public static final String ABOVE = "above";
    public static final String BELOW = "below";

    /** Metric the rule applies to. */
    private String metric;

    /** "above" or "below". */
    private String direction = ABOVE;

    private Double critical;
    private Double high;
    private Double medium;
    private Double low;

    public ThresholdRule() {
    }

    public ThresholdRule(String metric, String direction, Double critical, Double high, Double medium) {
        this.metric = metric;
        setDirection(direction);
        this.critical = critical;
        this.high = high;
        this.medium = medium;
    }

    /**
     * Built-in rules used when the configuration declares none.
     */
    public static List<ThresholdRule> defaults() {
        List<ThresholdRule> rules = new ArrayList<>();
        rules.add(new ThresholdRule("error_rate", ABOVE, 20.0, 10.0, 5.0));
        rules.add(new ThresholdRule("avg_latency_ms", ABOVE, 10_000.0, 5_000.0, 2_000.0));
        rules.add(new ThresholdRule("success_rate", BELOW, 50.0, 70.0, 85.0));
        rules.add(new ThresholdRule("data_source_health_score", BELOW, 50.0, 70.0, 85.0));
        return rules;
    }

    // ---------------------------------------------------------------
    // Evaluation helpers
    // ---------------------------------------------------------------

    /**
     * Configured levels from most to least severe.
     *
     * @return ordered map of severity to level; absent levels are skipped
     */
    public Map<Severity, Double> levels() {
        Map<Severity, Double> levels = new LinkedHashMap<>();
        if (critical != null) {
            levels.put(Severity.CRITICAL, critical);
        }
        if (high != null) {
            levels.put(Severity.HIGH, high);
        }
        if (medium != null) {
            levels.put(Severity.MEDIUM, medium);
        }
        if (low != null) {
            levels.put(Severity.LOW, low);
        }
        return levels;
    }

    /**
     * @return {@code true} if {@code value} is strictly worse than {@code level}
     */
    public boolean isBreached(double value, double level) {
        return isBelow() ? value < level : value > level;
    }

    public boolean isBelow() {
        return BELOW.equals(direction);
    }

    /**
     * @return comparison operator as shown in alert messages
     */
    public String operator() {
        return isBelow() ? "<" : ">";
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate required fields and level ordering.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (metric == null || metric.isBlank()) {
            errors.add("Threshold rule 'metric' is required");
        }
        if (!ABOVE.equals(direction) && !BELOW.equals(direction)) {
            errors.add("Threshold rule '" + metric + "' has unknown direction '" + direction
                    + "'. Supported: above, below");
        }

        Map<Severity, Double> levels = levels();
        if (levels.isEmpty()) {
            errors.add("Threshold rule '" + metric + "' requires at least one level");
        }

        Double previous = null;
        for (Map.Entry<Severity, Double> entry : levels.entrySet()) {
            double level = entry.getValue();
            if (Double.isNaN(level)) {
                errors.add("Threshold rule '" + metric + "' has a NaN " + entry.getKey().label() + " level");
            } else if (previous != null && (isBelow() ? level < previous : level > previous)) {
                errors.add("Threshold rule '" + metric + "' levels must be "
                        + (isBelow() ? "non-decreasing" : "non-increasing")
                        + " from critical to low");
            }
            previous = level;
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ThresholdRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getDirection() {
        return direction;
    }

    /**
     * Set the direction, normalised to lowercase.
     */
    public void setDirection(String direction) {
        this.direction = direction != null ? direction.toLowerCase(Locale.ROOT) : null;
    }

    public Double getCritical() {
        return critical;
    }

    public void setCritical(Double critical) {
        this.critical = critical;
    }

    public Double getHigh() {
        return high;
    }

    public void setHigh(Double high) {
        this.high = high;
    }

    public Double getMedium() {
        return medium;
    }

    public void setMedium(Double medium) {
        this.medium = medium;
    }

    public Double getLow() {
        return low;
    }

    public void setLow(Double low) {
        this.low = low;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdRule that))
            return false;
        return Objects.equals(metric, that.metric) && Objects.equals(direction, that.direction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, direction);
    }

    @Override
    public String toString() {
        return "ThresholdRule{" +
                "metric='" + metric + '\'' +
                ", direction='" + direction + '\'' +
                ", critical=" + critical +
                ", high=" + high +
                ", medium=" + medium +
                ", low=" + low +
                '}';
    }
}
