package com.phillippitts.voicerelay.service.routing;

import com.phillippitts.voicerelay.domain.ComplexityScore;

/**
 * Inputs to one routing decision.
 */
public record RoutingRequest(
        ComplexityScore score,
        long latencyBudgetMs,
        boolean costSensitive,
        boolean needsTools,
        String preferredRegion
) {

    public double complexity() {
        return score == null ? 0.0 : score.value();
    }
}
