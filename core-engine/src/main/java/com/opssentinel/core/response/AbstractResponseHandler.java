package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for handlers whose actions flip {@link ControlPlane} switches.
 *
 * <p>
 * Every action carries the switches to set under the {@value #SWITCHES}
 * parameter and its planned duration under {@value #DURATION_MINUTES}.
 * Execution applies the switches and records their previous values under
 * {@value #PREVIOUS_SWITCHES} in the result data. Switches are held under
 * the action id, so rollback releases only this action's hold: a switch
 * another action still holds keeps that action's value.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractResponseHandler implements ResponseHandler {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractResponseHandler.class);

    public static final String SWITCHES = "switches";
    public static final String DURATION_MINUTES = "duration_minutes";
    public static final String PREVIOUS_SWITCHES = "previous_switches";

    protected final ControlPlane controlPlane;
    private final Severity approvalSeverity;

    protected AbstractResponseHandler(ControlPlane controlPlane, Severity approvalSeverity) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane must not be null");
        this.approvalSeverity = Objects.requireNonNull(approvalSeverity, "approvalSeverity must not be null");
    }

    /**
     * @return action types this handler knows how to execute
     */
    protected abstract Set<String> supportedActionTypes();

    /**
     * Whether a risky action for {@code alert} must wait for human approval.
     */
    protected boolean approvalRequired(AnomalyAlert alert) {
        return alert.getSeverity().isAtLeast(approvalSeverity);
    }

    /**
     * Start an action builder pre-filled with this handler's id.
     */
    protected ResponseAction.Builder action(String actionType, Map<String, Object> switches, int durationMinutes) {
        return ResponseAction.builder()
                .handlerId(handlerId())
                .actionType(actionType)
                .param(SWITCHES, Map.copyOf(switches))
                .param(DURATION_MINUTES, durationMinutes);
    }

    @Override
    public ActionResult executeAction(ResponseAction action, AnomalyAlert alert) {
        if (!supportedActionTypes().contains(action.getActionType())) {
            return ActionResult.failure("Unknown action type: " + action.getActionType());
        }
        Map<String, Object> switches = switchesOf(action);
        LOG.info("Executing {} for anomaly {} via {}", action.getActionType(), alert.getId(), handlerId());
        Map<String, Object> previous = controlPlane.apply(action.getId(), switches);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action_type", action.getActionType());
        data.put("applied_switches", switches);
        data.put(PREVIOUS_SWITCHES, previous);
        data.put(DURATION_MINUTES, action.getParams().getOrDefault(DURATION_MINUTES, 30));
        return ActionResult.success(data);
    }

    @Override
    public boolean supportsRollback(ResponseAction action) {
        return supportedActionTypes().contains(action.getActionType());
    }

    @Override
    public ActionResult rollbackAction(ResponseAction action, ResponseExecution execution) {
        Object previous = execution.getResultData().get(PREVIOUS_SWITCHES);
        if (!(previous instanceof Map<?, ?> map)) {
            return ActionResult.failure("Execution " + execution.getId() + " has no recorded switch state");
        }
        List<String> names = new ArrayList<>();
        map.keySet().forEach(k -> names.add(String.valueOf(k)));
        Map<String, Object> restored = controlPlane.release(action.getId(), names);
        if (restored.isEmpty() && !names.isEmpty()) {
            return ActionResult.failure("Execution " + execution.getId() + " no longer holds any switch");
        }
        LOG.info("Rolled back {} of execution {}", action.getActionType(), execution.getId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("restored_switches", restored);
        return ActionResult.success(data);
    }

    private static Map<String, Object> switchesOf(ResponseAction action) {
        Map<String, Object> switches = new LinkedHashMap<>();
        if (action.getParams().get(SWITCHES) instanceof Map<?, ?> map) {
            map.forEach((k, v) -> switches.put(String.valueOf(k), v));
        }
        return switches;
    }
}
