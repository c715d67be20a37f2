package com.phillippitts.voicerelay.domain;

/** Token counts reported by the generation service for one call. */
public record TokenUsage(long inputTokens, long outputTokens) {

    public static final TokenUsage NONE = new TokenUsage(0, 0);
}
