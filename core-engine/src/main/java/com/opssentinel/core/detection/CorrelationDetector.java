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

/**
 * Cross-metric signature detector.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li><b>error_rate_latency_mismatch</b>: {@code error_rate > 20} while
 * {@code avg_latency_ms < 1000}, i.e. requests failing fast. Emitted as a
 * high alert on the synthetic metric
 * {@value #ERROR_LATENCY_METRIC}.</li>
 * <li><b>cost_efficiency_degradation</b>: cost per trace above three times
 * the mean of the last {@value #COST_BASELINE_POINTS} historical cost per
 * trace values. Emitted as a medium alert on {@value #COST_PER_TRACE_METRIC}.</li>
 * </ul>
 *
 * <p>
 * The context of every alert cites each contributing metric. When both
 * metrics of a rule have at least {@value #MIN_PAIRED_POINTS} paired
 * historical points, the Pearson coefficient of that history is attached and
 * {@code historically_correlated} tells whether {@code |r|} reaches the
 * configured correlation threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationDetector.class);

    public static final String ERROR_LATENCY_METRIC = "error_rate_latency_correlation";
    public static final String COST_PER_TRACE_METRIC = "cost_per_trace";

    static final double ERROR_RATE_LIMIT = 20.0;
    static final double FAST_LATENCY_MS = 1000.0;
    static final double COST_RATIO_LIMIT = 3.0;
    static final int COST_BASELINE_POINTS = 5;
    static final int MIN_PAIRED_POINTS = 5;

    private final double correlationThreshold;
    private final Clock clock;

    public CorrelationDetector(double correlationThreshold, Clock clock) {
        if (correlationThreshold <= 0 || correlationThreshold > 1) {
            throw new IllegalArgumentException(
                    "correlationThreshold must be in (0, 1], got: " + correlationThreshold);
        }
        this.correlationThreshold = correlationThreshold;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<AnomalyAlert> detect(Map<String, Double> snapshot, MetricHistoryStore history) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(history, "history must not be null");

        List<AnomalyAlert> alerts = new ArrayList<>();
        checkErrorLatencyMismatch(snapshot, history, alerts);
        checkCostEfficiency(snapshot, history, alerts);
        return alerts;
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.CORRELATION;
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    private void checkErrorLatencyMismatch(Map<String, Double> snapshot, MetricHistoryStore history,
            List<AnomalyAlert> alerts) {
        Double errorRate = snapshot.get("error_rate");
        Double latency = snapshot.get("avg_latency_ms");
        if (errorRate == null || latency == null) {
            return;
        }
        if (errorRate <= ERROR_RATE_LIMIT || latency >= FAST_LATENCY_MS) {
            return;
        }

        LOG.debug("Error/latency mismatch: error_rate={} avg_latency_ms={}", errorRate, latency);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("correlation_type", "error_rate_latency_mismatch");
        context.put("error_rate", errorRate);
        context.put("avg_latency_ms", latency);
        addHistoricalCorrelation(context, history.values("error_rate"), history.values("avg_latency_ms"));
        context.put("detection_method", "correlation");

        alerts.add(AnomalyAlert.builder()
                .timestamp(clock.instant())
                .anomalyType(AnomalyType.CORRELATION)
                .metricName(ERROR_LATENCY_METRIC)
                .severity(Severity.HIGH)
                .actualValue(errorRate)
                .expectedValue(latency)
                .deviationScore(errorRate / Math.max(latency / 1000.0, 1.0))
                .message(String.format(
                        "Unusual correlation: high error rate (%.1f%%) with low latency (%.0fms) suggests fast failures",
                        errorRate, latency))
                .contextData(context)
                .build());
    }

    private void checkCostEfficiency(Map<String, Double> snapshot, MetricHistoryStore history,
            List<AnomalyAlert> alerts) {
        Double cost = snapshot.get("total_cost");
        Double traces = snapshot.get("total_traces");
        if (cost == null || traces == null || traces <= 0) {
            return;
        }

        List<Double> costHistory = positive(history.values("total_cost"));
        List<Double> traceHistory = positive(history.values("total_traces"));
        if (costHistory.size() < COST_BASELINE_POINTS || traceHistory.size() < COST_BASELINE_POINTS) {
            return;
        }

        List<Double> costTail = tail(costHistory, COST_BASELINE_POINTS);
        List<Double> traceTail = tail(traceHistory, COST_BASELINE_POINTS);
        double sum = 0;
        for (int i = 0; i < COST_BASELINE_POINTS; i++) {
            sum += costTail.get(i) / traceTail.get(i);
        }
        double baseline = sum / COST_BASELINE_POINTS;
        double costPerTrace = cost / traces;
        if (costPerTrace <= baseline * COST_RATIO_LIMIT) {
            return;
        }

        LOG.debug("Cost efficiency degraded: {} per trace vs baseline {}", costPerTrace, baseline);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("correlation_type", "cost_efficiency_degradation");
        context.put("current_cost_per_trace", costPerTrace);
        context.put("historical_avg_cost_per_trace", baseline);
        context.put("total_cost", cost);
        context.put("total_traces", traces);
        addHistoricalCorrelation(context, history.values("total_cost"), history.values("total_traces"));
        context.put("detection_method", "correlation");

        alerts.add(AnomalyAlert.builder()
                .timestamp(clock.instant())
                .anomalyType(AnomalyType.CORRELATION)
                .metricName(COST_PER_TRACE_METRIC)
                .severity(Severity.MEDIUM)
                .actualValue(costPerTrace)
                .expectedValue(baseline)
                .deviationScore(costPerTrace / baseline)
                .message(String.format("Cost efficiency anomaly: %.6f per trace vs historical avg %.6f",
                        costPerTrace, baseline))
                .contextData(context)
                .build());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void addHistoricalCorrelation(Map<String, Object> context, List<Double> xs, List<Double> ys) {
        int pairs = Math.min(xs.size(), ys.size());
        if (pairs < MIN_PAIRED_POINTS) {
            return;
        }
        double r = pearson(tail(xs, pairs), tail(ys, pairs));
        if (Double.isNaN(r)) {
            return;
        }
        context.put("historical_correlation", r);
        context.put("historically_correlated", Math.abs(r) >= correlationThreshold);
    }

    /**
     * Pearson correlation coefficient of two equally sized samples.
     *
     * @return the coefficient, or {@code NaN} when either sample has no
     *         variance
     */
    static double pearson(List<Double> xs, List<Double> ys) {
        int n = xs.size();
        double meanX = StatisticalDetector.mean(xs);
        double meanY = StatisticalDetector.mean(ys);
        double cov = 0;
        double varX = 0;
        double varY = 0;
        for (int i = 0; i < n; i++) {
            double dx = xs.get(i) - meanX;
            double dy = ys.get(i) - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) {
            return Double.NaN;
        }
        return cov / Math.sqrt(varX * varY);
    }

    private static List<Double> positive(List<Double> values) {
        return values.stream().filter(v -> v > 0).toList();
    }

    private static List<Double> tail(List<Double> values, int count) {
        return values.subList(values.size() - count, values.size());
    }
}
