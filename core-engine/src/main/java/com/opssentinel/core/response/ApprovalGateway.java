package com.opssentinel.core.response;

import com.opssentinel.core.model.ApprovalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory set of actions awaiting human sign-off, in request order.
 *
 * <p>
 * {@link #claim(String)} removes a request atomically, so of any number of
 * concurrent callers for the same execution exactly one receives it.
 * </p>
 *
 * @since 1.0.0
 */
public class ApprovalGateway {

    private static final Logger LOG = LoggerFactory.getLogger(ApprovalGateway.class);

    private final Map<String, ApprovalRequest> pending = new LinkedHashMap<>();

    public synchronized void register(ApprovalRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (pending.putIfAbsent(request.getExecutionId(), request) != null) {
            throw new IllegalStateException("Approval already pending for execution " + request.getExecutionId());
        }
        LOG.info("Approval requested for execution {} ({}, severity {})", request.getExecutionId(),
                request.getActionName(), request.getAnomalySeverity().label());
    }

    /**
     * Remove and return the pending request for {@code executionId}.
     *
     * @return the request, or empty if none is pending (never registered or
     *         already claimed)
     */
    public synchronized Optional<ApprovalRequest> claim(String executionId) {
        return Optional.ofNullable(pending.remove(executionId));
    }

    public synchronized boolean isPending(String executionId) {
        return pending.containsKey(executionId);
    }

    /**
     * @return snapshot of pending requests, oldest first
     */
    public synchronized List<ApprovalRequest> pending() {
        return List.copyOf(pending.values());
    }

    public synchronized int size() {
        return pending.size();
    }
}
