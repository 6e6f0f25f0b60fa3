package com.opssentinel.core.response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of executing or rolling back an action.
 *
 * <p>
 * A successful result carries handler-specific data that the response engine
 * copies into the execution's result data. A failed result carries an error
 * message.
 * </p>
 *
 * @since 1.0.0
 */
public final class ActionResult {

    private final boolean success;
    private final Map<String, Object> data;
    private final String error;

    private ActionResult(boolean success, Map<String, Object> data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static ActionResult success(Map<String, Object> data) {
        Objects.requireNonNull(data, "data must not be null");
        return new ActionResult(true, Collections.unmodifiableMap(new LinkedHashMap<>(data)), null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, Map.of(), Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success ? "ActionResult{success, data=" + data + "}" : "ActionResult{failed, error='" + error + "'}";
    }
}
