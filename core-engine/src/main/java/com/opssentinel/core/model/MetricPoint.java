package com.opssentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of a named metric.
 *
 * <p>
 * Instances are immutable and are created by the monitoring engine once per
 * poll cycle for every monitored metric.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricPoint {

    private final Instant timestamp;
    private final String metricName;
    private final double value;
    private final String source;

    /**
     * @param timestamp  observation time; must not be {@code null}
     * @param metricName metric name; must not be {@code null}
     * @param value      observed value
     * @param source     name of the metrics source; may be {@code null}
     */
    public MetricPoint(Instant timestamp, String metricName, double value, String source) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.value = value;
        this.source = source;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && metricName.equals(that.metricName)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, metricName, value, source);
    }

    @Override
    public String toString() {
        return "MetricPoint{" +
                "metricName='" + metricName + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                ", source='" + source + '\'' +
                '}';
    }
}
