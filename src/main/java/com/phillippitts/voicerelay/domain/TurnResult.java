package com.phillippitts.voicerelay.domain;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one finished turn, handed back to the call-session owner.
 *
 * @param callId            call the turn belongs to
 * @param turnNumber        1-based turn index within the call
 * @param outcome           how the turn ended
 * @param modelId           model that produced the answer (null when none did)
 * @param region            region that served the answer (null when none did)
 * @param spokenText        text that reached the synthesis stage, in playback order
 * @param segmentsReleased  audio segments delivered to the sink
 * @param failedSegments    sequence numbers whose synthesis failed
 * @param firstTokenMillis  request start to first generated token, -1 if none arrived
 * @param firstAudioMillis  turn start to first audio released, -1 if none was released
 * @param durationMillis    total turn duration
 * @param failure           the failure behind an APOLOGIZED or FAILED outcome (nullable)
 */
public record TurnResult(
        String callId,
        int turnNumber,
        TurnOutcome outcome,
        String modelId,
        String region,
        String spokenText,
        int segmentsReleased,
        List<Integer> failedSegments,
        long firstTokenMillis,
        long firstAudioMillis,
        long durationMillis,
        Throwable failure
) {

    public TurnResult {
        Objects.requireNonNull(callId, "callId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        spokenText = spokenText == null ? "" : spokenText;
        failedSegments = failedSegments == null ? List.of() : List.copyOf(failedSegments);
    }
}
