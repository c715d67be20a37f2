package com.phillippitts.voicerelay.service.synthesis.event;

import com.phillippitts.voicerelay.exception.FailureKind;

import java.time.Instant;

/**
 * Published when one segment of a turn could not be synthesized.
 *
 * @param callId   call identifier
 * @param sequence segment sequence number
 * @param kind     classified failure
 * @param reason   short failure description
 * @param at       when the failure was observed
 */
public record SegmentSynthesisFailedEvent(
        String callId,
        int sequence,
        FailureKind kind,
        String reason,
        Instant at
) {
}
