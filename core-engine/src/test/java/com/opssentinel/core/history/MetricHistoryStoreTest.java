package com.opssentinel.core.history;

import com.opssentinel.core.MutableClock;
import com.opssentinel.core.model.MetricPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link MetricHistoryStore}.
 */
class MetricHistoryStoreTest {

    private MutableClock clock;
    private MetricHistoryStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        store = new MetricHistoryStore(3, Duration.ofMinutes(10), clock);
    }

    @Test
    @DisplayName("Should evict the oldest point when capacity is exceeded")
    void shouldEvictOldestWhenFull() {
        for (int i = 1; i <= 5; i++) {
            append("error_rate", i);
        }

        assertThat(store.values("error_rate")).containsExactly(3.0, 4.0, 5.0);
        assertThat(store.size("error_rate")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should return the most recent points oldest first")
    void shouldReturnRecentOldestFirst() {
        append("error_rate", 1);
        append("error_rate", 2);
        append("error_rate", 3);

        List<MetricPoint> recent = store.recent("error_rate", 2);

        assertThat(recent).extracting(MetricPoint::getValue).containsExactly(2.0, 3.0);
        assertThat(store.recent("error_rate", 0)).isEmpty();
        assertThat(store.recent("unknown", 5)).isEmpty();
    }

    @Test
    @DisplayName("Should drop points older than the retention window")
    void shouldEvictExpiredPoints() {
        append("error_rate", 1);
        clock.advance(Duration.ofMinutes(6));
        append("error_rate", 2);
        clock.advance(Duration.ofMinutes(6));

        assertThat(store.values("error_rate")).containsExactly(2.0);
    }

    @Test
    @DisplayName("Should filter points by time window")
    void shouldFilterByWindow() {
        append("avg_latency_ms", 100);
        clock.advance(Duration.ofMinutes(3));
        append("avg_latency_ms", 200);

        assertThat(store.recent("avg_latency_ms", Duration.ofMinutes(1)))
                .extracting(MetricPoint::getValue)
                .containsExactly(200.0);
    }

    @Test
    @DisplayName("Should keep metrics in separate buffers and report sizes sorted by name")
    void shouldReportSizesPerMetric() {
        append("total_cost", 1);
        append("error_rate", 1);
        append("error_rate", 2);

        assertThat(store.sizes()).containsExactly(
                entry("error_rate", 2),
                entry("total_cost", 1));
    }

    @Test
    @DisplayName("Should reject non-positive capacity and retention")
    void shouldRejectInvalidBounds() {
        assertThatThrownBy(() -> new MetricHistoryStore(0, Duration.ofMinutes(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricHistoryStore(10, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void append(String metric, double value) {
        store.append(new MetricPoint(clock.instant(), metric, value, "test"));
    }
}
