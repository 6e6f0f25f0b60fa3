package com.opssentinel.core.detection;

import com.opssentinel.core.MutableClock;
import com.opssentinel.core.history.MetricHistoryStore;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.MetricPoint;
import com.opssentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CorrelationDetector}.
 */
class CorrelationDetectorTest {

    private MutableClock clock;
    private MetricHistoryStore history;
    private CorrelationDetector detector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        history = new MetricHistoryStore(100, Duration.ofHours(1), clock);
        detector = new CorrelationDetector(0.8, clock);
    }

    @Test
    @DisplayName("Should flag a high error rate with low latency")
    void shouldFlagFastFailures() {
        List<AnomalyAlert> alerts = detector.detect(Map.of("error_rate", 25.0, "avg_latency_ms", 400.0), history);

        assertThat(alerts).hasSize(1);
        AnomalyAlert alert = alerts.get(0);
        assertThat(alert.getAnomalyType()).isEqualTo(AnomalyType.CORRELATION);
        assertThat(alert.getMetricName()).isEqualTo(CorrelationDetector.ERROR_LATENCY_METRIC);
        assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alert.getContextData())
                .containsEntry("correlation_type", "error_rate_latency_mismatch")
                .containsEntry("error_rate", 25.0)
                .containsEntry("avg_latency_ms", 400.0)
                .doesNotContainKey("historical_correlation");
    }

    @Test
    @DisplayName("Should NOT flag at the error rate or latency boundaries")
    void shouldNotFlagAtBoundaries() {
        assertThat(detector.detect(Map.of("error_rate", 20.0, "avg_latency_ms", 400.0), history)).isEmpty();
        assertThat(detector.detect(Map.of("error_rate", 25.0, "avg_latency_ms", 1000.0), history)).isEmpty();
        assertThat(detector.detect(Map.of("error_rate", 25.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should attach the historical correlation once enough pairs exist")
    void shouldAttachHistoricalCorrelation() {
        record("error_rate", 1, 2, 3, 4, 5);
        record("avg_latency_ms", 10, 20, 30, 40, 50);

        List<AnomalyAlert> alerts = detector.detect(Map.of("error_rate", 30.0, "avg_latency_ms", 100.0), history);

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat((Double) alert.getContextData().get("historical_correlation")).isCloseTo(1.0, within(1e-9));
            assertThat(alert.getContextData()).containsEntry("historically_correlated", true);
        });
    }

    @Test
    @DisplayName("Should flag cost per trace above three times its baseline")
    void shouldFlagCostEfficiencyDegradation() {
        record("total_cost", 1, 1, 1, 1, 1);
        record("total_traces", 10, 10, 10, 10, 10);

        List<AnomalyAlert> alerts = detector.detect(Map.of("total_cost", 4.0, "total_traces", 10.0), history);

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getMetricName()).isEqualTo(CorrelationDetector.COST_PER_TRACE_METRIC);
            assertThat(alert.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(alert.getActualValue()).isCloseTo(0.4, within(1e-9));
            assertThat(alert.getExpectedValue()).isCloseTo(0.1, within(1e-9));
        });
    }

    @Test
    @DisplayName("Should NOT flag cost per trace within three times its baseline")
    void shouldNotFlagModestCostIncrease() {
        record("total_cost", 1, 1, 1, 1, 1);
        record("total_traces", 10, 10, 10, 10, 10);

        assertThat(detector.detect(Map.of("total_cost", 2.9, "total_traces", 10.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should skip the cost rule without traces or enough history")
    void shouldSkipCostRuleWithoutData() {
        record("total_cost", 1, 1, 1);
        record("total_traces", 10, 10, 10);

        assertThat(detector.detect(Map.of("total_cost", 100.0, "total_traces", 10.0), history)).isEmpty();
        assertThat(detector.detect(Map.of("total_cost", 100.0, "total_traces", 0.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should compute Pearson correlation and NaN without variance")
    void shouldComputePearson() {
        assertThat(CorrelationDetector.pearson(List.of(1.0, 2.0, 3.0), List.of(3.0, 2.0, 1.0)))
                .isCloseTo(-1.0, within(1e-12));
        assertThat(CorrelationDetector.pearson(List.of(1.0, 1.0, 1.0), List.of(3.0, 2.0, 1.0))).isNaN();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void record(String metric, double... values) {
        for (double value : values) {
            history.append(new MetricPoint(clock.instant(), metric, value, "test"));
        }
    }
}
