package com.phillippitts.voicerelay.service.resilience.event;

import com.phillippitts.voicerelay.exception.FailureKind;

import java.time.Instant;

/**
 * Published when a generation attempt fails and another model or region is tried.
 *
 * <p>PII note: carries no transcript text.
 *
 * @param fromModel  model that failed
 * @param fromRegion region that failed
 * @param toModel    next model to try
 * @param toRegion   next region to try
 * @param kind       failure that caused the move
 * @param attempt    1-based number of the failed attempt
 * @param at         when the move was decided
 */
public record GenerationFallbackEvent(
        String fromModel,
        String fromRegion,
        String toModel,
        String toRegion,
        FailureKind kind,
        int attempt,
        Instant at
) {
}
