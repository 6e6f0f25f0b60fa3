package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handles cost anomalies by switching to a cheaper model, shrinking the
 * context window and throttling requests. Only high and critical alerts
 * get an action; it is gated at the approval severity.
 *
 * @since 1.0.0
 */
public class CostResponseHandler extends AbstractResponseHandler {

    public static final String ID = "cost";

    static final String COST_OPTIMIZATION = "cost_optimization";
    static final String TARGET_MODEL = "gemini-1.5-flash";

    private static final Set<String> METRICS = Set.of("total_cost", "cost_per_trace");

    public CostResponseHandler(ControlPlane controlPlane, Severity approvalSeverity) {
        super(controlPlane, approvalSeverity);
    }

    @Override
    public String handlerId() {
        return ID;
    }

    @Override
    protected Set<String> supportedActionTypes() {
        return Set.of(COST_OPTIMIZATION);
    }

    @Override
    public boolean canHandle(AnomalyAlert alert) {
        return METRICS.contains(alert.getMetricName());
    }

    @Override
    public List<ResponseAction> getResponseActions(AnomalyAlert alert) {
        if (!alert.getSeverity().isAtLeast(Severity.HIGH)) {
            return List.of();
        }
        Map<String, Object> switches = new LinkedHashMap<>();
        switches.put("model.active", TARGET_MODEL);
        switches.put("context_window", "reduced");
        switches.put("caching.aggressive", true);
        switches.put("throttling.enabled", true);
        return List.of(action(COST_OPTIMIZATION, switches, 60)
                .name("Enable Cost Optimization")
                .description("Switch to a cheaper model, reduce context window and throttle requests")
                .param("target_model", TARGET_MODEL)
                .validationChecks("check_cheaper_model_availability")
                .requiresApproval(approvalRequired(alert))
                .build());
    }

    @Override
    public ValidationResult validateAction(ResponseAction action, AnomalyAlert alert) {
        if (action.getValidationChecks().contains("check_cheaper_model_availability")) {
            Object target = action.getParams().get("target_model");
            if (!controlPlane.isModelAvailable(target != null ? target.toString() : null)) {
                return ValidationResult.invalid("Target cheaper model not available");
            }
        }
        return ValidationResult.ok();
    }
}
