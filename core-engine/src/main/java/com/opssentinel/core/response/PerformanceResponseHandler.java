package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handles latency, throughput and success-rate anomalies.
 *
 * <ul>
 * <li>{@code latency_optimization}: caching on, reduced model complexity,
 * shorter timeouts. Gated at the approval severity.</li>
 * <li>{@code load_balancing}: rate limiting and circuit breaker when the
 * trace volume is more than twice the expected value. Never gated.</li>
 * <li>{@code failure_recovery}: retries and a fallback model when the
 * success rate drops below 85. Gated at the approval severity.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PerformanceResponseHandler extends AbstractResponseHandler {

    public static final String ID = "performance";

    static final String LATENCY_OPTIMIZATION = "latency_optimization";
    static final String LOAD_BALANCING = "load_balancing";
    static final String FAILURE_RECOVERY = "failure_recovery";

    static final double MAX_SYSTEM_LOAD = 0.9;
    static final double SUCCESS_RATE_FLOOR = 85.0;
    static final String FALLBACK_MODEL = "gemini-1.5-flash";

    private static final Set<String> METRICS = Set.of("avg_latency_ms", "total_traces", "success_rate");

    public PerformanceResponseHandler(ControlPlane controlPlane, Severity approvalSeverity) {
        super(controlPlane, approvalSeverity);
    }

    @Override
    public String handlerId() {
        return ID;
    }

    @Override
    protected Set<String> supportedActionTypes() {
        return Set.of(LATENCY_OPTIMIZATION, LOAD_BALANCING, FAILURE_RECOVERY);
    }

    @Override
    public boolean canHandle(AnomalyAlert alert) {
        return METRICS.contains(alert.getMetricName());
    }

    @Override
    public List<ResponseAction> getResponseActions(AnomalyAlert alert) {
        List<ResponseAction> actions = new ArrayList<>();
        String metric = alert.getMetricName();

        if (metric.equals("avg_latency_ms") && alert.getSeverity().isAtLeast(Severity.MEDIUM)) {
            Map<String, Object> switches = new LinkedHashMap<>();
            switches.put("caching.enabled", true);
            switches.put("model.complexity", "reduced");
            switches.put("timeout.factor", 0.8);
            actions.add(action(LATENCY_OPTIMIZATION, switches, 30)
                    .name("Enable Latency Optimization")
                    .description("Temporarily reduce model complexity and enable caching to reduce latency")
                    .validationChecks("check_system_load", "check_cache_availability")
                    .requiresApproval(approvalRequired(alert))
                    .build());
        }

        if (metric.equals("total_traces") && alert.getActualValue() > alert.getExpectedValue() * 2) {
            Map<String, Object> switches = new LinkedHashMap<>();
            switches.put("rate_limit.enabled", true);
            switches.put("rate_limit.requests_per_minute", Math.min(100.0, alert.getExpectedValue() * 1.5));
            switches.put("circuit_breaker.enabled", true);
            actions.add(action(LOAD_BALANCING, switches, 60)
                    .name("Enable Load Balancing")
                    .description("Distribute traffic load and apply rate limiting")
                    .validationChecks("check_load_balancer_health")
                    .requiresApproval(false)
                    .build());
        }

        if (metric.equals("success_rate") && alert.getActualValue() < SUCCESS_RATE_FLOOR) {
            Map<String, Object> switches = new LinkedHashMap<>();
            switches.put("retry.enabled", true);
            switches.put("retry.max_attempts", 3);
            switches.put("fallback.enabled", true);
            switches.put("fallback.model", FALLBACK_MODEL);
            actions.add(action(FAILURE_RECOVERY, switches, 45)
                    .name("Enable Failure Recovery")
                    .description("Enable retry logic and fallback model")
                    .validationChecks("check_fallback_model_availability")
                    .requiresApproval(approvalRequired(alert))
                    .build());
        }

        return actions;
    }

    @Override
    public ValidationResult validateAction(ResponseAction action, AnomalyAlert alert) {
        List<String> checks = action.getValidationChecks();
        if (checks.contains("check_system_load") && controlPlane.systemLoad() > MAX_SYSTEM_LOAD) {
            return ValidationResult.invalid("System load too high to perform optimization");
        }
        if (checks.contains("check_cache_availability") && !controlPlane.isHealthy(ControlPlane.CACHE)) {
            return ValidationResult.invalid("Cache system not available");
        }
        if (checks.contains("check_load_balancer_health") && !controlPlane.isHealthy(ControlPlane.LOAD_BALANCER)) {
            return ValidationResult.invalid("Load balancer not healthy");
        }
        if (checks.contains("check_fallback_model_availability")
                && !controlPlane.isModelAvailable(FALLBACK_MODEL)) {
            return ValidationResult.invalid("Fallback model not available");
        }
        return ValidationResult.ok();
    }
}
