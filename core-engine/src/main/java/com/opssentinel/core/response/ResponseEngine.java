package com.opssentinel.core.response;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ApprovalRequest;
import com.opssentinel.core.model.ExecutionStatus;
import com.opssentinel.core.model.ImpactAssessment;
import com.opssentinel.core.model.ResponseAction;
import com.opssentinel.core.model.ResponseExecution;
import com.opssentinel.core.model.Severity;
import com.opssentinel.core.spi.NotificationSink;
import com.opssentinel.core.spi.PersistenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects, validates, executes and tracks response actions for anomalies.
 *
 * <h3>Execution state machine</h3>
 * <ul>
 * <li>{@code PENDING -> FAILED} when validation rejects the action</li>
 * <li>{@code PENDING -> REQUIRES_APPROVAL} when the action is gated; an
 * {@link ApprovalRequest} is registered with the {@link ApprovalGateway}</li>
 * <li>{@code PENDING|REQUIRES_APPROVAL -> EXECUTING -> SUCCESS|FAILED}</li>
 * <li>{@code REQUIRES_APPROVAL -> FAILED} when approval is denied</li>
 * <li>{@code SUCCESS -> ROLLED_BACK} through {@link #rollbackExecution}</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The execution map is guarded by one coarse lock. Each execution is driven
 * by a single thread at a time: the caller of {@link #processAnomaly}, then
 * the one caller that wins the approval claim, then a rollback caller, which
 * synchronizes on the tracked execution.
 * </p>
 *
 * @since 1.0.0
 */
public class ResponseEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseEngine.class);

    static final List<String> SIDE_EFFECTS = List.of("temporary performance impact", "increased monitoring needed");
    static final double SUCCESS_PROBABILITY = 0.85;
    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    private final List<ResponseHandler> handlers;
    private final ApprovalGateway approvals;
    private final PersistenceStore persistence;
    private final NotificationSink notifications;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Tracked> executions = new LinkedHashMap<>();
    private final Deque<ResponseExecution> history = new ArrayDeque<>();
    private final int historyCapacity;

    private ResponseEngine(Builder builder) {
        if (builder.handlers.isEmpty()) {
            throw new IllegalArgumentException("At least one response handler is required");
        }
        this.handlers = List.copyOf(builder.handlers);
        this.approvals = builder.approvals != null ? builder.approvals : new ApprovalGateway();
        this.persistence = builder.persistence != null ? builder.persistence : PersistenceStore.noop();
        this.notifications = builder.notifications;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.historyCapacity < 0) {
            throw new IllegalArgumentException("historyCapacity must be >= 0, got: " + builder.historyCapacity);
        }
        this.historyCapacity = builder.historyCapacity;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-loaded with the performance, cost and error-recovery
     * handlers acting on {@code controlPlane}.
     */
    public static Builder withDefaultHandlers(ControlPlane controlPlane, Severity approvalSeverity) {
        return builder()
                .handler(new PerformanceResponseHandler(controlPlane, approvalSeverity))
                .handler(new CostResponseHandler(controlPlane, approvalSeverity))
                .handler(new ErrorRecoveryResponseHandler(controlPlane, approvalSeverity));
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    /**
     * Run every applicable action for {@code alert}.
     *
     * <p>
     * Actions from all claiming handlers are collected; approval-gated ones
     * are processed last. A failure in one action never prevents the others.
     * When at least one execution is created the alert is marked as
     * auto-responded.
     * </p>
     *
     * @return the executions created, in processing order
     */
    public List<ResponseExecution> processAnomaly(AnomalyAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");

        List<Proposal> proposals = new ArrayList<>();
        for (ResponseHandler handler : handlers) {
            try {
                if (handler.canHandle(alert)) {
                    for (ResponseAction action : handler.getResponseActions(alert)) {
                        proposals.add(new Proposal(handler, action));
                    }
                }
            } catch (RuntimeException e) {
                LOG.error("Handler {} failed to propose actions for anomaly {}", handler.handlerId(), alert.getId(), e);
            }
        }

        if (proposals.isEmpty()) {
            LOG.info("No response actions for anomaly {} ({})", alert.getId(), alert.getMetricName());
            return List.of();
        }

        proposals.sort(Comparator.comparing(p -> p.action.isRequiresApproval()));

        List<ResponseExecution> created = new ArrayList<>();
        for (Proposal proposal : proposals) {
            ResponseExecution execution = new ResponseExecution(alert, proposal.action, clock.instant());
            Tracked tracked = new Tracked(proposal.handler, proposal.action, alert, execution);
            synchronized (lock) {
                executions.put(execution.getId(), tracked);
            }
            created.add(execution);
            dispatch(tracked);
        }

        alert.markAutoResponse(created.stream().map(ResponseExecution::getId).toList());
        LOG.info("Anomaly {} produced {} execution(s)", alert.getId(), created.size());
        return created;
    }

    private void dispatch(Tracked tracked) {
        ResponseExecution execution = tracked.execution;
        ValidationResult validation;
        try {
            validation = tracked.handler.validateAction(tracked.action, tracked.alert);
        } catch (RuntimeException e) {
            LOG.error("Validation of {} raised an exception", tracked.action.getId(), e);
            validation = ValidationResult.invalid("Validation error: " + e.getMessage());
        }

        if (!validation.isValid()) {
            LOG.warn("Action {} failed validation: {}", tracked.action.getActionType(), validation.getReason());
            execution.fail("Validation failed: " + validation.getReason(), clock.instant());
            record(execution);
            return;
        }

        if (tracked.action.isRequiresApproval()) {
            execution.transitionTo(ExecutionStatus.REQUIRES_APPROVAL, clock.instant());
            approvals.register(new ApprovalRequest(execution, tracked.action, tracked.alert, clock.instant()));
            record(execution);
            return;
        }

        run(tracked);
    }

    private void run(Tracked tracked) {
        ResponseExecution execution = tracked.execution;
        execution.transitionTo(ExecutionStatus.EXECUTING, clock.instant());
        record(execution);

        Instant start = clock.instant();
        ActionResult result;
        try {
            result = tracked.handler.executeAction(tracked.action, tracked.alert);
        } catch (RuntimeException e) {
            LOG.error("Action {} raised an exception", tracked.action.getId(), e);
            result = ActionResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        Instant end = clock.instant();
        execution.setExecutionDuration(Duration.between(start, end));

        if (result.isSuccess()) {
            execution.putAllResults(result.getData());
            execution.setImpactAssessment(assessImpact(tracked, result, end));
            execution.transitionTo(ExecutionStatus.SUCCESS, end);
            LOG.info("Action {} succeeded for anomaly {}", tracked.action.getActionType(), tracked.alert.getId());
        } else {
            execution.fail(result.getError(), end);
            LOG.error("Action {} failed for anomaly {}: {}", tracked.action.getActionType(), tracked.alert.getId(),
                    result.getError());
        }
        record(execution);
    }

    private static ImpactAssessment assessImpact(Tracked tracked, ActionResult result, Instant at) {
        String improvement = tracked.alert.getSeverity().isAtLeast(Severity.HIGH) ? "high" : "medium";
        Object duration = result.getData().getOrDefault(AbstractResponseHandler.DURATION_MINUTES, 30);
        int minutes = duration instanceof Number n ? n.intValue() : 30;
        return new ImpactAssessment(improvement, minutes, SIDE_EFFECTS, SUCCESS_PROBABILITY, at);
    }

    // ---------------------------------------------------------------
    // Approvals
    // ---------------------------------------------------------------

    /**
     * Resolve a pending approval exactly once.
     *
     * @return {@code true} if the action was approved and executed;
     *         {@code false} if it was denied, or nothing was pending for the id
     */
    public boolean approvePendingAction(String executionId, boolean approved, String approver) {
        Optional<ApprovalRequest> claimed = approvals.claim(executionId);
        if (claimed.isEmpty()) {
            LOG.warn("No pending approval for execution {}", executionId);
            return false;
        }
        Tracked tracked;
        synchronized (lock) {
            tracked = executions.get(executionId);
        }
        if (tracked == null) {
            LOG.warn("Approval for execution {} claimed but the execution is no longer tracked", executionId);
            return false;
        }

        if (!approved) {
            tracked.execution.putResult("rejected_by", approver);
            tracked.execution.fail("Action not approved by " + approver, clock.instant());
            record(tracked.execution);
            LOG.info("Execution {} rejected by {}", executionId, approver);
            return false;
        }

        tracked.execution.setApprovedBy(approver);
        tracked.execution.putResult("approver", approver);
        LOG.info("Execution {} approved by {}", executionId, approver);
        run(tracked);
        return true;
    }

    public List<ApprovalRequest> getPendingApprovals() {
        return approvals.pending();
    }

    // ---------------------------------------------------------------
    // Rollback
    // ---------------------------------------------------------------

    /**
     * Reverse a successful execution through its owning handler. Any other
     * state is refused without touching the execution.
     */
    public RollbackResult rollbackExecution(String executionId) {
        Tracked tracked;
        synchronized (lock) {
            tracked = executions.get(executionId);
        }
        if (tracked == null) {
            return RollbackResult.failed("Execution not found: " + executionId);
        }

        synchronized (tracked) {
            ResponseExecution execution = tracked.execution;
            ExecutionStatus status = execution.getStatus();
            if (status != ExecutionStatus.SUCCESS) {
                LOG.warn("Cannot roll back execution {} in state {}", executionId, status);
                return RollbackResult.failed("Rollback is only possible from success, execution is " + status.label());
            }
            if (!tracked.handler.supportsRollback(tracked.action)) {
                return RollbackResult.failed("Handler " + tracked.handler.handlerId()
                        + " cannot roll back " + tracked.action.getActionType());
            }

            ActionResult result;
            try {
                result = tracked.handler.rollbackAction(tracked.action, execution);
            } catch (RuntimeException e) {
                LOG.error("Rollback of execution {} raised an exception", executionId, e);
                return RollbackResult.failed("Rollback error: " + e.getMessage());
            }
            if (!result.isSuccess()) {
                LOG.error("Rollback of execution {} failed: {}", executionId, result.getError());
                return RollbackResult.failed(result.getError());
            }

            execution.putResult("rollback", result.getData());
            execution.transitionTo(ExecutionStatus.ROLLED_BACK, clock.instant());
            record(execution);
            LOG.info("Execution {} rolled back", executionId);
            return RollbackResult.success();
        }
    }

    // ---------------------------------------------------------------
    // Queries / housekeeping
    // ---------------------------------------------------------------

    /**
     * Look up a tracked execution, falling back to the history of cleaned up
     * ones.
     */
    public Optional<ResponseExecution> getExecution(String executionId) {
        synchronized (lock) {
            Tracked tracked = executions.get(executionId);
            if (tracked != null) {
                return Optional.of(tracked.execution);
            }
            return history.stream().filter(e -> e.getId().equals(executionId)).findFirst();
        }
    }

    /**
     * @return executions moved out by {@link #cleanupCompletedExecutions},
     *         oldest first, at most {@code historyCapacity} of them
     */
    public List<ResponseExecution> getExecutionHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    /**
     * @return all tracked executions, oldest first
     */
    public List<ResponseExecution> getExecutions() {
        synchronized (lock) {
            return executions.values().stream().map(t -> t.execution).toList();
        }
    }

    public ResponseStatistics getResponseStatistics() {
        Map<ExecutionStatus, Integer> counts = new EnumMap<>(ExecutionStatus.class);
        long totalNanos = 0;
        int timed = 0;
        synchronized (lock) {
            for (Tracked tracked : executions.values()) {
                counts.merge(tracked.execution.getStatus(), 1, Integer::sum);
                Duration duration = tracked.execution.getExecutionDuration();
                if (duration != null) {
                    totalNanos += duration.toNanos();
                    timed++;
                }
            }
        }
        Duration average = timed == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / timed);
        return new ResponseStatistics(counts, average, approvals.size());
    }

    /**
     * Move completed executions that finished more than {@code olderThan} ago
     * into the bounded history. They stay queryable through
     * {@link #getExecution} but can no longer be rolled back, and the oldest
     * history entries are dropped once it is full.
     *
     * @return number of executions removed from tracking
     */
    public int cleanupCompletedExecutions(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        synchronized (lock) {
            Iterator<Tracked> it = executions.values().iterator();
            while (it.hasNext()) {
                ResponseExecution execution = it.next().execution;
                Instant finished = execution.getCompletedAt() != null
                        ? execution.getCompletedAt()
                        : execution.getStartedAt();
                if (execution.getStatus().isCompleted() && finished.isBefore(cutoff)) {
                    it.remove();
                    archive(execution);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            LOG.info("Cleaned up {} completed execution(s) older than {}", removed, olderThan);
        }
        return removed;
    }

    public List<ResponseHandler> getHandlers() {
        return handlers;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void archive(ResponseExecution execution) {
        if (historyCapacity == 0) {
            return;
        }
        if (history.size() == historyCapacity) {
            history.removeFirst();
        }
        history.addLast(execution);
    }

    private void record(ResponseExecution execution) {
        try {
            persistence.persistExecution(execution);
        } catch (RuntimeException e) {
            LOG.warn("Failed to persist execution {}: {}", execution.getId(), e.getMessage());
        }
        if (notifications != null) {
            try {
                notifications.notifyExecution(execution);
            } catch (RuntimeException e) {
                LOG.warn("Failed to notify execution {}: {}", execution.getId(), e.getMessage());
            }
        }
    }

    private static final class Proposal {
        final ResponseHandler handler;
        final ResponseAction action;

        Proposal(ResponseHandler handler, ResponseAction action) {
            this.handler = handler;
            this.action = action;
        }
    }

    private static final class Tracked {
        final ResponseHandler handler;
        final ResponseAction action;
        final AnomalyAlert alert;
        final ResponseExecution execution;

        Tracked(ResponseHandler handler, ResponseAction action, AnomalyAlert alert, ResponseExecution execution) {
            this.handler = handler;
            this.action = action;
            this.alert = alert;
            this.execution = execution;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link ResponseEngine}. At least one handler is required;
     * the remaining collaborators have defaults.
     */
    public static final class Builder {
        private final List<ResponseHandler> handlers = new ArrayList<>();
        private ApprovalGateway approvals;
        private PersistenceStore persistence;
        private NotificationSink notifications;
        private Clock clock;
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;

        private Builder() {
        }

        public Builder handler(ResponseHandler handler) {
            this.handlers.add(Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        public Builder approvalGateway(ApprovalGateway approvals) {
            this.approvals = approvals;
            return this;
        }

        public Builder persistence(PersistenceStore persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder notifications(NotificationSink notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Maximum number of cleaned up executions kept for lookup; {@code 0}
         * disables the history.
         */
        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public ResponseEngine build() {
            return new ResponseEngine(this);
        }
    }
}
