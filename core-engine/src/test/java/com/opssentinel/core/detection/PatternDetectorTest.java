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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PatternDetector}.
 */
class PatternDetectorTest {

    private MutableClock clock;
    private MetricHistoryStore history;
    private PatternDetector detector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        history = new MetricHistoryStore(100, Duration.ofHours(1), clock);
        detector = new PatternDetector(5, 3.0, clock);
    }

    @Test
    @DisplayName("Should flag a monotonic rise just above the multiplier as medium")
    void shouldFlagRiseAboveMultiplier() {
        record("avg_latency_ms", 100, 100, 200, 200);

        List<AnomalyAlert> alerts = detector.detect(Map.of("avg_latency_ms", 301.0), history);

        assertThat(alerts).hasSize(1);
        AnomalyAlert alert = alerts.get(0);
        assertThat(alert.getAnomalyType()).isEqualTo(AnomalyType.PATTERN);
        assertThat(alert.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(alert.getExpectedValue()).isEqualTo(100.0);
        assertThat(alert.getActualValue()).isEqualTo(301.0);
        assertThat(alert.getContextData())
                .containsEntry("pattern", "rapid_increase")
                .containsEntry("sequence", List.of(100.0, 100.0, 200.0, 200.0, 301.0));
    }

    @Test
    @DisplayName("Should NOT flag a rise of exactly the multiplier")
    void shouldNotFlagRiseAtMultiplier() {
        record("avg_latency_ms", 100, 100, 200, 200);

        assertThat(detector.detect(Map.of("avg_latency_ms", 300.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should escalate to high above twice the multiplier")
    void shouldEscalateAboveDoubleMultiplier() {
        record("avg_latency_ms", 100, 150, 200, 400);

        assertThat(detector.detect(Map.of("avg_latency_ms", 601.0), history))
                .singleElement()
                .extracting(AnomalyAlert::getSeverity)
                .isEqualTo(Severity.HIGH);
        assertThat(detector.detect(Map.of("avg_latency_ms", 600.0), history))
                .singleElement()
                .extracting(AnomalyAlert::getSeverity)
                .isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should NOT flag a sequence that dips")
    void shouldNotFlagNonMonotonicSequence() {
        record("avg_latency_ms", 100, 300, 200, 400);

        assertThat(detector.detect(Map.of("avg_latency_ms", 1_000.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should need a full window of history")
    void shouldNeedFullWindow() {
        record("avg_latency_ms", 100, 200, 300);

        assertThat(detector.detect(Map.of("avg_latency_ms", 1_000.0), history)).isEmpty();
    }

    @Test
    @DisplayName("Should use only the most recent window of history")
    void shouldUseMostRecentWindow() {
        record("total_cost", 500, 1, 1, 1, 1);

        assertThat(detector.detect(Map.of("total_cost", 4.0), history)).hasSize(1);
    }

    @Test
    @DisplayName("Should floor a zero baseline instead of dividing by zero")
    void shouldFloorZeroBaseline() {
        record("total_cost", 0, 0, 0, 0);

        List<AnomalyAlert> alerts = detector.detect(Map.of("total_cost", 1.0), history);

        assertThat(alerts).singleElement()
                .satisfies(alert -> {
                    assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
                    assertThat(alert.getDeviationScore()).isEqualTo(1.0 / PatternDetector.MIN_BASE);
                });
    }

    @Test
    @DisplayName("Should reject invalid construction arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new PatternDetector(1, 3.0, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PatternDetector(5, 1.0, clock))
                .isInstanceOf(IllegalArgumentException.class);
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
