package com.opssentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Tracks one dispatch of a {@link ResponseAction} for one {@link AnomalyAlert}.
 *
 * <p>
 * Status changes go through {@link #transitionTo(ExecutionStatus, Instant)},
 * which enforces the table in {@link ExecutionStatus#canTransitionTo}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All accessors are synchronized on the instance. The response engine
 * guarantees a single writer per execution; readers (statistics, status
 * endpoints) may run concurrently and always see a consistent state.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseExecution {

    private final String id;
    private final String anomalyId;
    private final String actionId;
    private final String handlerId;
    private final Instant startedAt;

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant completedAt;
    private final Map<String, Object> resultData = new LinkedHashMap<>();
    private ImpactAssessment impactAssessment;
    private boolean rollbackExecuted;
    private String approvedBy;
    private Duration executionDuration;

    /**
     * Create a new execution in state {@link ExecutionStatus#PENDING}.
     *
     * @param alert     the anomaly being remediated
     * @param action    the action being dispatched
     * @param startedAt creation time
     */
    public ResponseExecution(AnomalyAlert alert, ResponseAction action, Instant startedAt) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(action, "action must not be null");
        this.id = "exec_" + UUID.randomUUID();
        this.anomalyId = alert.getId();
        this.actionId = action.getId();
        this.handlerId = action.getHandlerId();
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    // ---------------------------------------------------------------
    // State machine
    // ---------------------------------------------------------------

    /**
     * Move to {@code target}.
     *
     * @param target next state
     * @param at     time of the transition, recorded as completion time for
     *               {@code SUCCESS} and {@code FAILED}
     * @throws IllegalStateException if the transition is not legal
     */
    public synchronized void transitionTo(ExecutionStatus target, Instant at) {
        Objects.requireNonNull(target, "target must not be null");
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition for execution " + id
                    + ": " + status + " -> " + target);
        }
        status = target;
        if (target == ExecutionStatus.SUCCESS || target == ExecutionStatus.FAILED) {
            completedAt = at;
        } else if (target == ExecutionStatus.ROLLED_BACK) {
            rollbackExecuted = true;
        }
    }

    /**
     * Fail the execution with a reason stored under {@code error} in the
     * result data.
     */
    public synchronized void fail(String reason, Instant at) {
        resultData.put("error", reason);
        transitionTo(ExecutionStatus.FAILED, at);
    }

    public synchronized void putResult(String key, Object value) {
        resultData.put(key, value);
    }

    public synchronized void putAllResults(Map<String, Object> values) {
        resultData.putAll(values);
    }

    public synchronized void setImpactAssessment(ImpactAssessment impactAssessment) {
        this.impactAssessment = impactAssessment;
    }

    public synchronized void setApprovedBy(String approvedBy) {
        this.approvedBy = approvedBy;
    }

    public synchronized void setExecutionDuration(Duration executionDuration) {
        this.executionDuration = executionDuration;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public String getActionId() {
        return actionId;
    }

    public String getHandlerId() {
        return handlerId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * @return a snapshot copy of the result data
     */
    public synchronized Map<String, Object> getResultData() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resultData));
    }

    public synchronized ImpactAssessment getImpactAssessment() {
        return impactAssessment;
    }

    public synchronized boolean isRollbackExecuted() {
        return rollbackExecuted;
    }

    public synchronized String getApprovedBy() {
        return approvedBy;
    }

    public synchronized Duration getExecutionDuration() {
        return executionDuration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResponseExecution that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public synchronized String toString() {
        return "ResponseExecution{" +
                "id='" + id + '\'' +
                ", anomalyId='" + anomalyId + '\'' +
                ", actionId='" + actionId + '\'' +
                ", status=" + status +
                ", rollbackExecuted=" + rollbackExecuted +
                '}';
    }
}
