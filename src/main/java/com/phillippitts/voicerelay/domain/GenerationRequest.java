package com.phillippitts.voicerelay.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outbound generation request for one turn.
 *
 * @param modelId         model identifier
 * @param region          serving region
 * @param systemPrompt    agent prompt with voice-delivery guidelines appended
 * @param messages        prior turns followed by the current utterance
 * @param maxTokens       output cap, already clamped to the model ceiling
 * @param temperature     sampling temperature
 * @param tools           tool specifications (empty when the model does not support tools)
 * @param reasoningBudget reasoning token allowance; 0 when not requested
 */
public record GenerationRequest(
        String modelId,
        String region,
        String systemPrompt,
        List<GenerationMessage> messages,
        int maxTokens,
        double temperature,
        List<ToolSpec> tools,
        int reasoningBudget
) {

    public GenerationRequest {
        Objects.requireNonNull(modelId, "modelId must not be null");
        Objects.requireNonNull(region, "region must not be null");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public boolean hasReasoningBudget() {
        return reasoningBudget > 0;
    }
}
