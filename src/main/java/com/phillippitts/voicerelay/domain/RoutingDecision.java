package com.phillippitts.voicerelay.domain;

import java.util.Objects;

/**
 * Model and region chosen for one turn. Computed fresh per turn and never persisted.
 *
 * @param modelId         selected model identifier
 * @param region          serving region (the preferred region when {@code degraded})
 * @param reasoningBudget reasoning token allowance; 0 when unused
 * @param rule            name of the routing rule that fired
 * @param regionFallback  true when the model is served from a non-preferred region
 * @param degraded        true when no region has the model; callers must queue, reroute or reject
 */
public record RoutingDecision(
        String modelId,
        String region,
        int reasoningBudget,
        String rule,
        boolean regionFallback,
        boolean degraded
) {

    public RoutingDecision {
        Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(region, "region must not be null");
        if (reasoningBudget < 0) {
            throw new IllegalArgumentException("reasoningBudget must not be negative, got: " + reasoningBudget);
        }
    }

    public boolean usesReasoning() {
        return reasoningBudget > 0;
    }

    /**
     * Decision for a fallback model chosen by the resilience layer after the original route failed.
     */
    public static RoutingDecision fallback(String modelId, String region, int reasoningBudget, boolean regionFallback) {
        return new RoutingDecision(modelId, region, reasoningBudget, "fallback", regionFallback, false);
    }
}
