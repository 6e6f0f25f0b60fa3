package com.opssentinel.core.response;

import java.util.Objects;

/**
 * Outcome of a handler's safety check on a proposed action.
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, "Validation passed");

    private final boolean valid;
    private final String reason;

    private ValidationResult(boolean valid, String reason) {
        this.valid = valid;
        this.reason = reason;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isValid() {
        return valid;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", reason='" + reason + "'}";
    }
}
