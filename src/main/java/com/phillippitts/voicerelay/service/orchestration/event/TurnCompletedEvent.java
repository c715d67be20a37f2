package com.phillippitts.voicerelay.service.orchestration.event;

import com.phillippitts.voicerelay.domain.TurnResult;

import java.time.Instant;

/**
 * Emitted when a turn finished with something played to the caller (COMPLETED, DEGRADED or
 * APOLOGIZED).
 *
 * @param result    the turn result
 * @param timestamp when the turn finished
 */
public record TurnCompletedEvent(
        TurnResult result,
        Instant timestamp
) {}
