package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.AnomalyType;
import com.opssentinel.core.model.ApprovalRequest;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ApprovalGateway}.
 */
class ApprovalGatewayTest {

    private ApprovalGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new ApprovalGateway();
    }

    @Test
    @DisplayName("Should hand out a pending request exactly once")
    void shouldClaimOnce() {
        ApprovalRequest request = request();
        gateway.register(request);

        assertThat(gateway.isPending(request.getExecutionId())).isTrue();
        assertThat(gateway.claim(request.getExecutionId())).contains(request);
        assertThat(gateway.claim(request.getExecutionId())).isEmpty();
        assertThat(gateway.size()).isZero();
    }

    @Test
    @DisplayName("Should list pending requests oldest first")
    void shouldListInRegistrationOrder() {
        ApprovalRequest first = request();
        ApprovalRequest second = request();
        gateway.register(first);
        gateway.register(second);

        assertThat(gateway.pending()).containsExactly(first, second);
    }

    @Test
    @DisplayName("Should reject a second request for the same execution")
    void shouldRejectDuplicateRegistration() {
        ApprovalRequest request = request();
        gateway.register(request);

        assertThatThrownBy(() -> gateway.register(request))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(request.getExecutionId());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ApprovalRequest request() {
        AnomalyAlert alert = AnomalyAlert.builder()
                .anomalyType(AnomalyType.THRESHOLD)
                .metricName("error_rate")
                .severity(Severity.CRITICAL)
                .actualValue(25.0)
                .build();
        ResponseAction action = ResponseAction.builder()
                .name("Enable Error Recovery")
                .handlerId("error_recovery")
                .actionType("error_recovery")
                .requiresApproval(true)
                .build();
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        return new ApprovalRequest(new ResponseExecution(alert, action, now), action, alert, now);
    }
}
