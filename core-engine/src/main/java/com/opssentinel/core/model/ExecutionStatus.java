package com.opssentinel.core.model;

import java.util.Locale;

/**
 * States of a {@link ResponseExecution}.
 *
 * <pre>
 * PENDING ──► EXECUTING ──► SUCCESS ──► ROLLED_BACK
 *    │  │          │
 *    │  └► REQUIRES_APPROVAL ──► EXECUTING
 *    │             │                └──► FAILED
 *    └─────────────┴─────────────────► FAILED
 * </pre>
 *
 * @since 1.0.0
 */
public enum ExecutionStatus {

    PENDING,
    EXECUTING,
    SUCCESS,
    FAILED,
    REQUIRES_APPROVAL,
    ROLLED_BACK;

    /**
     * @param target the requested next state
     * @return {@code true} if moving from this state to {@code target} is legal
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == EXECUTING || target == REQUIRES_APPROVAL || target == FAILED;
            case REQUIRES_APPROVAL -> target == EXECUTING || target == FAILED;
            case EXECUTING -> target == SUCCESS || target == FAILED;
            case SUCCESS -> target == ROLLED_BACK;
            case FAILED, ROLLED_BACK -> false;
        };
    }

    /**
     * {@code SUCCESS} counts as completed even though it may still be rolled
     * back.
     */
    public boolean isCompleted() {
        return this == SUCCESS || this == FAILED || this == ROLLED_BACK;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
