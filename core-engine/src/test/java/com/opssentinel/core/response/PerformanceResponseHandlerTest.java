package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PerformanceResponseHandler}.
 */
class PerformanceResponseHandlerTest {

    private InMemoryControlPlane controlPlane;
    private PerformanceResponseHandler handler;

    @BeforeEach
    void setUp() {
        controlPlane = new InMemoryControlPlane();
        handler = new PerformanceResponseHandler(controlPlane, Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should claim latency, throughput and success-rate alerts only")
    void shouldClaimPerformanceMetrics() {
        assertThat(handler.canHandle(alert("avg_latency_ms", Severity.HIGH, 6000, 2000))).isTrue();
        assertThat(handler.canHandle(alert("total_traces", Severity.HIGH, 500, 100))).isTrue();
        assertThat(handler.canHandle(alert("success_rate", Severity.HIGH, 60, 85))).isTrue();
        assertThat(handler.canHandle(alert("error_rate", Severity.HIGH, 25, 20))).isFalse();
    }

    @Test
    @DisplayName("Should propose latency optimization gated only at the approval severity")
    void shouldProposeLatencyOptimization() {
        List<ResponseAction> high = handler.getResponseActions(alert("avg_latency_ms", Severity.HIGH, 6000, 5000));
        List<ResponseAction> critical = handler.getResponseActions(
                alert("avg_latency_ms", Severity.CRITICAL, 12000, 10000));

        assertThat(high).singleElement().satisfies(action -> {
            assertThat(action.getActionType()).isEqualTo(PerformanceResponseHandler.LATENCY_OPTIMIZATION);
            assertThat(action.isRequiresApproval()).isFalse();
            assertThat(action.getValidationChecks()).contains("check_system_load", "check_cache_availability");
        });
        assertThat(critical).singleElement()
                .extracting(ResponseAction::isRequiresApproval)
                .isEqualTo(true);
        assertThat(handler.getResponseActions(alert("avg_latency_ms", Severity.LOW, 2100, 2000))).isEmpty();
    }

    @Test
    @DisplayName("Should propose load balancing only beyond twice the expected volume")
    void shouldProposeLoadBalancing() {
        assertThat(handler.getResponseActions(alert("total_traces", Severity.CRITICAL, 201, 100)))
                .singleElement()
                .satisfies(action -> {
                    assertThat(action.getActionType()).isEqualTo(PerformanceResponseHandler.LOAD_BALANCING);
                    assertThat(action.isRequiresApproval()).isFalse();
                });
        assertThat(handler.getResponseActions(alert("total_traces", Severity.CRITICAL, 200, 100))).isEmpty();
    }

    @Test
    @DisplayName("Should propose failure recovery below an 85 success rate")
    void shouldProposeFailureRecovery() {
        assertThat(handler.getResponseActions(alert("success_rate", Severity.HIGH, 80, 85)))
                .extracting(ResponseAction::getActionType)
                .containsExactly(PerformanceResponseHandler.FAILURE_RECOVERY);
        assertThat(handler.getResponseActions(alert("success_rate", Severity.LOW, 85, 90))).isEmpty();
    }

    @Test
    @DisplayName("Should refuse latency optimization under heavy system load")
    void shouldRejectUnderHeavyLoad() {
        AnomalyAlert alert = alert("avg_latency_ms", Severity.HIGH, 6000, 5000);
        ResponseAction action = handler.getResponseActions(alert).get(0);

        assertThat(handler.validateAction(action, alert).isValid()).isTrue();
        controlPlane.setSystemLoad(0.95);

        ValidationResult result = handler.validateAction(action, alert);
        assertThat(result.isValid()).isFalse();
        assertThat(result.getReason()).isEqualTo("System load too high to perform optimization");
    }

    @Test
    @DisplayName("Should refuse failure recovery when the fallback model is gone")
    void shouldRejectWithoutFallbackModel() {
        AnomalyAlert alert = alert("success_rate", Severity.HIGH, 60, 85);
        ResponseAction action = handler.getResponseActions(alert).get(0);
        controlPlane.setModelAvailable(PerformanceResponseHandler.FALLBACK_MODEL, false);

        assertThat(handler.validateAction(action, alert).getReason()).isEqualTo("Fallback model not available");
    }

    @Test
    @DisplayName("Should fail an action type it does not own")
    void shouldFailUnknownActionType() {
        AnomalyAlert alert = alert("avg_latency_ms", Severity.HIGH, 6000, 5000);
        ResponseAction foreign = ResponseAction.builder()
                .name("Foreign")
                .handlerId(PerformanceResponseHandler.ID)
                .actionType("cost_optimization")
                .build();

        ActionResult result = handler.executeAction(foreign, alert);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Unknown action type: cost_optimization");
        assertThat(handler.supportsRollback(foreign)).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyAlert alert(String metric, Severity severity, double actual, double expected) {
        return AnomalyAlert.builder()
                .anomalyType(AnomalyType.THRESHOLD)
                .metricName(metric)
                .severity(severity)
                .actualValue(actual)
                .expectedValue(expected)
                .build();
    }
}
