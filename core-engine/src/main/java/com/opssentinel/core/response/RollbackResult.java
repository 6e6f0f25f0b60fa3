package com.opssentinel.core.response;

/**
 * Outcome of {@link ResponseEngine#rollbackExecution(String)}. A refused or
 * failed rollback carries the reason instead of throwing.
 *
 * @since 1.0.0
 */
public final class RollbackResult {

    private final boolean rolledBack;
    private final String reason;

    private RollbackResult(boolean rolledBack, String reason) {
        this.rolledBack = rolledBack;
        this.reason = reason;
    }

    static RollbackResult success() {
        return new RollbackResult(true, "Rolled back");
    }

    static RollbackResult failed(String reason) {
        return new RollbackResult(false, reason);
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "RollbackResult{rolledBack=" + rolledBack + ", reason='" + reason + "'}";
    }
}
