package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.ResponseExecution;

import java.util.List;

/**
 * Remediates one class of anomalies through one or more
 * {@link ResponseAction}s.
 *
 * <p>
 * The {@link ResponseEngine} asks every registered handler whether it
 * {@link #canHandle(AnomalyAlert) can handle} an alert; several handlers may
 * claim the same alert and all of them contribute actions.
 * </p>
 *
 * <p>
 * Implementations should be fast. A long remediation is triggered and
 * reported, never awaited. Any {@link RuntimeException} thrown by a handler
 * fails only the action being processed.
 * </p>
 *
 * @since 1.0.0
 */
public interface ResponseHandler {

    /**
     * @return stable identifier, recorded on every action this handler
     *         proposes
     */
    String handlerId();

    boolean canHandle(AnomalyAlert alert);

    /**
     * @return proposed actions for the alert, possibly empty
     */
    List<ResponseAction> getResponseActions(AnomalyAlert alert);

    /**
     * Safety check run before the action is executed or queued for approval.
     */
    ValidationResult validateAction(ResponseAction action, AnomalyAlert alert);

    ActionResult executeAction(ResponseAction action, AnomalyAlert alert);

    /**
     * @return {@code true} if {@link #rollbackAction} can reverse the action
     */
    default boolean supportsRollback(ResponseAction action) {
        return false;
    }

    /**
     * Reverse a successfully executed action.
     *
     * @param action    the executed action
     * @param execution its execution record, including the result data written
     *                  by {@link #executeAction}
     */
    default ActionResult rollbackAction(ResponseAction action, ResponseExecution execution) {
        return ActionResult.failure("Rollback not supported by handler " + handlerId());
    }
}
