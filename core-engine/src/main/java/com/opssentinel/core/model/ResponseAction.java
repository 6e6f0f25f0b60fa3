package com.opssentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A remediation step proposed by a response handler.
 *
 * <p>
 * Actions are stateless templates: the handler declares what it would do and
 * the response engine tracks what actually happened in a
 * {@link ResponseExecution}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResponseAction {

    private final String id;
    private final String name;
    private final String description;
    private final String handlerId;
    private final String actionType;
    private final boolean requiresApproval;
    private final Map<String, Object> params;
    private final List<String> validationChecks;

    private ResponseAction(Builder builder) {
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType must not be null");
        this.handlerId = Objects.requireNonNull(builder.handlerId, "handlerId must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.id = builder.id != null ? builder.id : actionType + "_" + UUID.randomUUID();
        this.description = builder.description;
        this.requiresApproval = builder.requiresApproval;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.validationChecks = List.copyOf(builder.validationChecks);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ResponseAction}. {@code actionType},
     * {@code handlerId} and {@code name} are required.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String handlerId;
        private String actionType;
        private boolean requiresApproval;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private List<String> validationChecks = List.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder handlerId(String handlerId) {
            this.handlerId = handlerId;
            return this;
        }

        public Builder actionType(String actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder requiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
            return this;
        }

        public Builder param(String key, Object value) {
            this.params.put(key, value);
            return this;
        }

        public Builder validationChecks(String... checks) {
            this.validationChecks = List.of(checks);
            return this;
        }

        public ResponseAction build() {
            return new ResponseAction(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getHandlerId() {
        return handlerId;
    }

    public String getActionType() {
        return actionType;
    }

    public boolean isRequiresApproval() {
        return requiresApproval;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public List<String> getValidationChecks() {
        return validationChecks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResponseAction that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ResponseAction{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", handlerId='" + handlerId + '\'' +
                ", requiresApproval=" + requiresApproval +
                '}';
    }
}
