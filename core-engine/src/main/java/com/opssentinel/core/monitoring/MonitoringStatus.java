package com.opssentinel.core.monitoring;

import java.util.Locale;

/**
 * Lifecycle state of the {@link MonitoringEngine}.
 *
 * @since 1.0.0
 */
public enum MonitoringStatus {
    STOPPED,
    RUNNING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
