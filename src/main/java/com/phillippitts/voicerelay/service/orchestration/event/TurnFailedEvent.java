package com.phillippitts.voicerelay.service.orchestration.event;

import com.phillippitts.voicerelay.domain.TurnResult;

import java.time.Instant;

/**
 * Emitted to the call-session owner when nothing could be played for a turn, not even the
 * apology.
 *
 * @param result    the FAILED turn result, carrying the failure
 * @param timestamp when the turn failed
 */
public record TurnFailedEvent(
        TurnResult result,
        Instant timestamp
) {}
