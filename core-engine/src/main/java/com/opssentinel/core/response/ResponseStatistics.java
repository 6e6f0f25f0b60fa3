package com.opssentinel.core.response;

import com.opssentinel.core.model.ExecutionStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time statistics derived from the tracked executions.
 *
 * @since 1.0.0
 */
public final class ResponseStatistics {

    private final int totalExecutions;
    private final Map<ExecutionStatus, Integer> countsByStatus;
    private final double successRate;
    private final Duration averageExecutionDuration;
    private final int pendingApprovals;

    ResponseStatistics(Map<ExecutionStatus, Integer> countsByStatus, Duration averageExecutionDuration,
            int pendingApprovals) {
        Map<ExecutionStatus, Integer> counts = new EnumMap<>(ExecutionStatus.class);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            counts.put(status, countsByStatus.getOrDefault(status, 0));
        }
        this.countsByStatus = Collections.unmodifiableMap(counts);
        this.totalExecutions = counts.values().stream().mapToInt(Integer::intValue).sum();
        this.averageExecutionDuration = averageExecutionDuration;
        this.pendingApprovals = pendingApprovals;

        int succeeded = counts.get(ExecutionStatus.SUCCESS) + counts.get(ExecutionStatus.ROLLED_BACK);
        int finished = succeeded + counts.get(ExecutionStatus.FAILED);
        this.successRate = finished == 0 ? 0.0 : succeeded * 100.0 / finished;
    }

    public int getTotalExecutions() {
        return totalExecutions;
    }

    public Map<ExecutionStatus, Integer> getCountsByStatus() {
        return countsByStatus;
    }

    public int count(ExecutionStatus status) {
        return countsByStatus.get(status);
    }

    /**
     * @return percentage of finished executions that succeeded, counting
     *         rolled-back ones as successes; 0 when nothing has finished
     */
    public double getSuccessRate() {
        return successRate;
    }

    public Duration getAverageExecutionDuration() {
        return averageExecutionDuration;
    }

    public int getPendingApprovals() {
        return pendingApprovals;
    }

    @Override
    public String toString() {
        return "ResponseStatistics{" +
                "totalExecutions=" + totalExecutions +
                ", countsByStatus=" + countsByStatus +
                ", successRate=" + successRate +
                ", averageExecutionDuration=" + averageExecutionDuration +
                ", pendingApprovals=" + pendingApprovals +
                '}';
    }
}
