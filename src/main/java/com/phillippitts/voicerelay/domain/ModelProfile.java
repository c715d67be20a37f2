package com.phillippitts.voicerelay.domain;

import java.util.Objects;

/**
 * Static descriptor of a generation model, loaded from configuration at startup.
 *
 * <p>Ranks are relative within the catalog: a higher {@code intelligenceRank} is more capable,
 * a higher {@code speedRank} is faster, a higher {@code costRank} is more expensive.
 *
 * @param id                         model identifier sent to the generation service
 * @param tier                       capability band
 * @param intelligenceRank           relative capability
 * @param speedRank                  relative speed
 * @param costRank                   relative cost
 * @param maxOutputTokens            documented output ceiling
 * @param supportsTools              accepts tool specifications
 * @param supportsExtendedReasoning  accepts a reasoning budget
 * @param supportsVision             accepts image input
 * @param maxReasoningBudget         largest reasoning budget the model accepts (0 if unsupported)
 * @param inputPricePerMillion       price per million input tokens, for cost telemetry
 * @param outputPricePerMillion      price per million output tokens, for cost telemetry
 */
public record ModelProfile(
        String id,
        ModelTier tier,
        int intelligenceRank,
        int speedRank,
        int costRank,
        int maxOutputTokens,
        boolean supportsTools,
        boolean supportsExtendedReasoning,
        boolean supportsVision,
        int maxReasoningBudget,
        double inputPricePerMillion,
        double outputPricePerMillion
) {

    public ModelProfile {
        Objects.requireNonNull(id, "Model id must not be null");
        Objects.requireNonNull(tier, "Model tier must not be null");
        if (maxOutputTokens <= 0) {
            throw new IllegalArgumentException("maxOutputTokens must be positive for model " + id);
        }
        if (maxReasoningBudget < 0) {
            throw new IllegalArgumentException("maxReasoningBudget must not be negative for model " + id);
        }
    }

    /**
     * Estimated cost of a call in the catalog's currency unit.
     */
    public double estimateCost(long inputTokens, long outputTokens) {
        return (inputTokens * inputPricePerMillion + outputTokens * outputPricePerMillion) / 1_000_000d;
    }
}
