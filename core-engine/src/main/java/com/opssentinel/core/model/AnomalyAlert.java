package com.opssentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Alert emitted when a detector classifies a metric observation as anomalous.
 *
 * <p>
 * Every field is fixed at construction except the two response-tracking
 * fields ({@code autoResponseTriggered} and {@code responseActions}), which
 * the response engine fills in through {@link #markAutoResponse(List)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code anomalyType}, {@code metricName} and
 * {@code severity} are required; the id and timestamp are generated when
 * omitted.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyAlert {

    private final String id;
    private final Instant timestamp;
    private final AnomalyType anomalyType;
    private final String metricName;
    private final Severity severity;
    private final double actualValue;
    private final double expectedValue;
    private final double deviationScore;
    private final String message;

    /** Unmodifiable copy of the evidence the detector collected. */
    private final Map<String, Object> contextData;

    private volatile boolean autoResponseTriggered;
    private volatile List<String> responseActions = List.of();

    private AnomalyAlert(Builder builder) {
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.id = builder.id != null ? builder.id : newId(anomalyType, metricName);
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.actualValue = builder.actualValue;
        this.expectedValue = builder.expectedValue;
        this.deviationScore = builder.deviationScore;
        this.message = builder.message;
        this.contextData = builder.contextData != null
                ? new LinkedHashMap<>(builder.contextData)
                : new LinkedHashMap<>();
    }

    /**
     * Mint a unique alert id of the form {@code <prefix>_<metric>_<uuid>}.
     */
    public static String newId(AnomalyType type, String metricName) {
        return type.idPrefix() + "_" + metricName + "_" + UUID.randomUUID();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyAlert} instances.
     */
    public static class Builder {
        private String id;
        private Instant timestamp;
        private AnomalyType anomalyType;
        private String metricName;
        private Severity severity;
        private double actualValue;
        private double expectedValue;
        private double deviationScore;
        private String message;
        private Map<String, Object> contextData;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder actualValue(double actualValue) {
            this.actualValue = actualValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviationScore(double deviationScore) {
            this.deviationScore = deviationScore;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder contextData(Map<String, Object> contextData) {
            this.contextData = contextData;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link AnomalyAlert}
         * @throws NullPointerException if {@code anomalyType}, {@code metricName}
         *                              or {@code severity} is {@code null}
         */
        public AnomalyAlert build() {
            return new AnomalyAlert(this);
        }
    }

    // ---------------------------------------------------------------
    // Response tracking
    // ---------------------------------------------------------------

    /**
     * Record that the response engine created executions for this alert.
     *
     * @param executionIds ids of the {@link ResponseExecution}s created,
     *                     including those awaiting approval
     */
    public void markAutoResponse(List<String> executionIds) {
        Objects.requireNonNull(executionIds, "executionIds must not be null");
        this.responseActions = Collections.unmodifiableList(new ArrayList<>(executionIds));
        this.autoResponseTriggered = true;
    }

    public boolean isAutoResponseTriggered() {
        return autoResponseTriggered;
    }

    /**
     * @return ids of the executions created for this alert
     */
    public List<String> getResponseActions() {
        return responseActions;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public String getMetricName() {
        return metricName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getActualValue() {
        return actualValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getDeviationScore() {
        return deviationScore;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return unmodifiable view of the detector's evidence
     */
    public Map<String, Object> getContextData() {
        return Collections.unmodifiableMap(contextData);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyAlert that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AnomalyAlert{" +
                "id='" + id + '\'' +
                ", type=" + anomalyType +
                ", metricName='" + metricName + '\'' +
                ", severity=" + severity +
                ", actualValue=" + actualValue +
                ", expectedValue=" + expectedValue +
                ", deviationScore=" + deviationScore +
                ", timestamp=" + timestamp +
                '}';
    }
}
