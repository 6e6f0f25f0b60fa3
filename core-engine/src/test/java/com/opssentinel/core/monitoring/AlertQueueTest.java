package com.opssentinel.core.monitoring;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertQueue}.
 */
class AlertQueueTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("Should drop the oldest alert when full")
    void shouldDropOldestWhenFull() {
        AlertQueue queue = new AlertQueue(2);
        AnomalyAlert first = alert("a", T0);
        AnomalyAlert second = alert("b", T0);
        AnomalyAlert third = alert("c", T0);

        assertThat(queue.offer(first)).isEmpty();
        assertThat(queue.offer(second)).isEmpty();
        assertThat(queue.offer(third)).contains(first);
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.poll()).contains(second);
    }

    @Test
    @DisplayName("Should list recent alerts newest first")
    void shouldListNewestFirst() {
        AlertQueue queue = new AlertQueue(10);
        AnomalyAlert older = alert("a", T0);
        AnomalyAlert newer = alert("b", T0.plusSeconds(1));
        queue.offer(older);
        queue.offer(newer);

        assertThat(queue.recent(5)).containsExactly(newer, older);
        assertThat(queue.recent(1)).containsExactly(newer);
    }

    @Test
    @DisplayName("Should remove alerts older than the cutoff")
    void shouldRemoveOlderThanCutoff() {
        AlertQueue queue = new AlertQueue(10);
        queue.offer(alert("a", T0));
        queue.offer(alert("b", T0.plusSeconds(120)));

        assertThat(queue.removeOlderThan(T0.plusSeconds(60))).isEqualTo(1);
        assertThat(queue.recent(10)).extracting(AnomalyAlert::getMetricName).containsExactly("b");
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new AlertQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyAlert alert(String metric, Instant timestamp) {
        return AnomalyAlert.builder()
                .timestamp(timestamp)
                .anomalyType(AnomalyType.THRESHOLD)
                .metricName(metric)
                .severity(Severity.MEDIUM)
                .build();
    }
}
