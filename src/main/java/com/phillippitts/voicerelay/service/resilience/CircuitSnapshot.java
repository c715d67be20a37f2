package com.phillippitts.voicerelay.service.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one breaker.
 *
 * @param target          breaker target (model id or {@code synthesis:<voice>})
 * @param state           current state
 * @param failedCalls     failures in the breaker's current window
 * @param successfulCalls successes in the breaker's current window
 * @param lastFailureAt   time of the last recorded failure (nullable)
 */
public record CircuitSnapshot(
        String target,
        CircuitState state,
        int failedCalls,
        int successfulCalls,
        Instant lastFailureAt
) {
}
