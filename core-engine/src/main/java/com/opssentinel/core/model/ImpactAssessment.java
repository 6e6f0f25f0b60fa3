package com.opssentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Expected effect of a successfully executed response action.
 *
 * @since 1.0.0
 */
public final class ImpactAssessment {

    private final String expectedImprovement;
    private final int estimatedResolutionMinutes;
    private final List<String> potentialSideEffects;
    private final double successProbability;
    private final Instant assessedAt;

    public ImpactAssessment(String expectedImprovement, int estimatedResolutionMinutes,
            List<String> potentialSideEffects, double successProbability, Instant assessedAt) {
        this.expectedImprovement = Objects.requireNonNull(expectedImprovement,
                "expectedImprovement must not be null");
        this.estimatedResolutionMinutes = estimatedResolutionMinutes;
        this.potentialSideEffects = List.copyOf(potentialSideEffects);
        this.successProbability = successProbability;
        this.assessedAt = Objects.requireNonNull(assessedAt, "assessedAt must not be null");
    }

    public String getExpectedImprovement() {
        return expectedImprovement;
    }

    public int getEstimatedResolutionMinutes() {
        return estimatedResolutionMinutes;
    }

    public List<String> getPotentialSideEffects() {
        return potentialSideEffects;
    }

    public double getSuccessProbability() {
        return successProbability;
    }

    public Instant getAssessedAt() {
        return assessedAt;
    }

    @Override
    public String toString() {
        return "ImpactAssessment{" +
                "expectedImprovement='" + expectedImprovement + '\'' +
                ", estimatedResolutionMinutes=" + estimatedResolutionMinutes +
                ", successProbability=" + successProbability +
                '}';
    }
}
