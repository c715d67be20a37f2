package com.phillippitts.voicerelay.domain;

import java.util.List;

/**
 * Per-turn knobs supplied by the call-session owner.
 *
 * @param latencyBudgetMs time-to-first-token budget for routing
 * @param costSensitive   prefer cheaper models where the routing rule allows it
 * @param tools           tools the agent exposes for this turn (empty when none)
 * @param maxTokens       requested output cap; 0 uses the configured default
 * @param temperature     requested temperature; null uses the configured default
 */
public record TurnOptions(
        long latencyBudgetMs,
        boolean costSensitive,
        List<ToolSpec> tools,
        int maxTokens,
        Double temperature
) {

    public TurnOptions {
        if (latencyBudgetMs < 0) {
            throw new IllegalArgumentException("latencyBudgetMs must not be negative, got: " + latencyBudgetMs);
        }
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must not be negative, got: " + maxTokens);
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static TurnOptions withLatencyBudget(long latencyBudgetMs) {
        return new TurnOptions(latencyBudgetMs, false, List.of(), 0, null);
    }

    public boolean needsTools() {
        return !tools.isEmpty();
    }
}
