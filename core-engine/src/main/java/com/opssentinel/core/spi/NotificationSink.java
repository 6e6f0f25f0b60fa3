package com.opssentinel.core.spi;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseExecution;

/**
 * Fire-and-forget dispatch of alert and execution records to operators.
 * Failures are logged by the caller and never escalate.
 *
 * @since 1.0.0
 */
public interface NotificationSink {

    void notifyAlert(AnomalyAlert alert);

    void notifyExecution(ResponseExecution execution);
}
