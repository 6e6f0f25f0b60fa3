package com.opssentinel.core.detection;

import com.opssentinel.core.MutableClock;
import com.opssentinel.core.config.ThresholdRule;
import com.opssentinel.core.history.MetricHistoryStore;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdDetector}.
 */
class ThresholdDetectorTest {

    private MutableClock clock;
    private MetricHistoryStore history;
    private ThresholdDetector detector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        history = new MetricHistoryStore();
        detector = new ThresholdDetector(ThresholdRule.defaults(), clock);
    }

    @Test
    @DisplayName("Should fire a critical alert when error rate exceeds the critical level")
    void shouldFireCriticalAboveLevel() {
        List<AnomalyAlert> alerts = detector.detect(Map.of("error_rate", 25.0), history);

        assertThat(alerts).hasSize(1);
        AnomalyAlert alert = alerts.get(0);
        assertThat(alert.getAnomalyType()).isEqualTo(AnomalyType.THRESHOLD);
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getExpectedValue()).isEqualTo(20.0);
        assertThat(alert.getDeviationScore()).isCloseTo(0.25, within(1e-9));
        assertThat(alert.getMessage()).startsWith("critical threshold breached for error_rate");
        assertThat(alert.getContextData())
                .containsEntry("threshold_type", "critical")
                .containsEntry("critical_threshold", 20.0)
                .containsEntry("detection_method", "static_threshold");
    }

    @ParameterizedTest(name = "{0}={1} -> {2}")
    @CsvSource({
            "error_rate, 20.0, HIGH",
            "error_rate, 10.5, HIGH",
            "error_rate, 6.0, MEDIUM",
            "avg_latency_ms, 12000, CRITICAL",
            "avg_latency_ms, 2500, MEDIUM",
            "success_rate, 49, CRITICAL",
            "success_rate, 60, HIGH",
            "success_rate, 70, MEDIUM",
            "data_source_health_score, 65, HIGH"
    })
    @DisplayName("Should pick the most severe strictly breached level")
    void shouldClassifyFirstBreachedLevel(String metric, double value, Severity expected) {
        List<AnomalyAlert> alerts = detector.detect(Map.of(metric, value), history);

        assertThat(alerts).singleElement()
                .extracting(AnomalyAlert::getSeverity)
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("Should NOT fire at or inside the mildest level")
    void shouldNotFireInsideLevels() {
        assertThat(detector.detect(Map.of("error_rate", 5.0), history)).isEmpty();
        assertThat(detector.detect(Map.of("success_rate", 85.0), history)).isEmpty();
        assertThat(detector.detect(Map.of("avg_latency_ms", 800.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should ignore metrics without a rule")
    void shouldIgnoreUnruledMetrics() {
        assertThat(detector.detect(Map.of("total_cost", 1_000_000.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should never assign a milder severity to a worse value")
    void shouldBeMonotonic() {
        ThresholdRule rule = new ThresholdRule("error_rate", ThresholdRule.ABOVE, 20.0, 10.0, 5.0);
        int previousRank = 0;
        for (double value = 0; value <= 40; value += 0.5) {
            Severity severity = ThresholdDetector.classify(rule, value);
            int rank = severity == null ? 0 : severity.rank();
            assertThat(rank).as("rank at %s", value).isGreaterThanOrEqualTo(previousRank);
            previousRank = rank;
        }
    }

    @Test
    @DisplayName("Should keep the last rule when a metric is declared twice")
    void shouldKeepLastDuplicateRule() {
        ThresholdDetector duplicate = new ThresholdDetector(List.of(
                new ThresholdRule("error_rate", ThresholdRule.ABOVE, 20.0, 10.0, 5.0),
                new ThresholdRule("error_rate", ThresholdRule.ABOVE, 90.0, 80.0, 70.0)), clock);

        assertThat(duplicate.detect(Map.of("error_rate", 25.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should report zero deviation for a zero level")
    void shouldReportZeroDeviationForZeroLevel() {
        ThresholdDetector zero = new ThresholdDetector(List.of(
                new ThresholdRule("error_rate", ThresholdRule.ABOVE, null, null, 0.0)), clock);

        List<AnomalyAlert> alerts = zero.detect(Map.of("error_rate", 3.0), history);

        assertThat(alerts).singleElement()
                .extracting(AnomalyAlert::getDeviationScore)
                .isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject invalid rules at construction")
    void shouldRejectInvalidRules() {
        List<ThresholdRule> rules = List.of(new ThresholdRule("error_rate", ThresholdRule.ABOVE, 5.0, 10.0, null));

        assertThatThrownBy(() -> new ThresholdDetector(rules, clock))
                .isInstanceOf(IllegalStateException.class);
    }
}
