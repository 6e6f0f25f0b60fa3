package com.opssentinel.core.response;

import com.opssentinel.core.detection.CorrelationDetector;
import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handles error-rate and data-source health anomalies.
 *
 * <ul>
 * <li>{@code error_recovery}: restart unhealthy services, open the circuit
 * breaker, extend timeouts and degrade gracefully when the error rate is
 * above 15. Gated at the approval severity.</li>
 * <li>{@code data_source_recovery}: reconnect data sources and enable
 * fallbacks when the health score is below 70. Never gated.</li>
 * </ul>
 *
 * <p>
 * The error/latency correlation signature counts as an error-rate anomaly.
 * </p>
 *
 * @since 1.0.0
 */
public class ErrorRecoveryResponseHandler extends AbstractResponseHandler {

    public static final String ID = "error_recovery";

    static final String ERROR_RECOVERY = "error_recovery";
    static final String DATA_SOURCE_RECOVERY = "data_source_recovery";

    static final double ERROR_RATE_LIMIT = 15.0;
    static final double HEALTH_SCORE_FLOOR = 70.0;

    private static final Set<String> ERROR_METRICS = Set.of("error_rate", CorrelationDetector.ERROR_LATENCY_METRIC);

    public ErrorRecoveryResponseHandler(ControlPlane controlPlane, Severity approvalSeverity) {
        super(controlPlane, approvalSeverity);
    }

    @Override
    public String handlerId() {
        return ID;
    }

    @Override
    protected Set<String> supportedActionTypes() {
        return Set.of(ERROR_RECOVERY, DATA_SOURCE_RECOVERY);
    }

    @Override
    public boolean canHandle(AnomalyAlert alert) {
        return ERROR_METRICS.contains(alert.getMetricName())
                || alert.getMetricName().equals("data_source_health_score");
    }

    @Override
    public List<ResponseAction> getResponseActions(AnomalyAlert alert) {
        List<ResponseAction> actions = new ArrayList<>();

        if (ERROR_METRICS.contains(alert.getMetricName()) && alert.getActualValue() > ERROR_RATE_LIMIT) {
            Map<String, Object> switches = new LinkedHashMap<>();
            switches.put("services.restart_unhealthy", true);
            switches.put("circuit_breaker.enabled", true);
            switches.put("timeouts.extended", true);
            switches.put("degradation.graceful", true);
            actions.add(action(ERROR_RECOVERY, switches, 30)
                    .name("Enable Error Recovery")
                    .description("Restart unhealthy services and enable circuit breaking with graceful degradation")
                    .validationChecks("check_service_restart_safety")
                    .requiresApproval(approvalRequired(alert))
                    .build());
        }

        if (alert.getMetricName().equals("data_source_health_score") && alert.getActualValue() < HEALTH_SCORE_FLOOR) {
            Map<String, Object> switches = new LinkedHashMap<>();
            switches.put("data_sources.reconnect", true);
            switches.put("data_sources.refresh_auth", true);
            switches.put("data_sources.fallback_enabled", true);
            switches.put("data_sources.query_frequency", "reduced");
            actions.add(action(DATA_SOURCE_RECOVERY, switches, 45)
                    .name("Data Source Recovery")
                    .description("Reconnect unhealthy data sources and enable fallback sources")
                    .validationChecks("check_fallback_sources")
                    .requiresApproval(false)
                    .build());
        }

        return actions;
    }

    @Override
    public ValidationResult validateAction(ResponseAction action, AnomalyAlert alert) {
        List<String> checks = action.getValidationChecks();
        if (checks.contains("check_service_restart_safety") && !controlPlane.isHealthy(ControlPlane.SERVICE_RESTART)) {
            return ValidationResult.invalid("Service restart not safe at this time");
        }
        if (checks.contains("check_fallback_sources") && !controlPlane.isHealthy(ControlPlane.FALLBACK_SOURCES)) {
            return ValidationResult.invalid("No fallback data sources available");
        }
        return ValidationResult.ok();
    }
}
