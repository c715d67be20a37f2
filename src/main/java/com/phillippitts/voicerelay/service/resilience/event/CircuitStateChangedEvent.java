package com.phillippitts.voicerelay.service.resilience.event;

import com.phillippitts.voicerelay.service.resilience.CircuitState;

import java.time.Instant;

/**
 * Published after a breaker changes state. {@code failedCalls} counts the failures in the
 * window that led to the transition.
 */
public record CircuitStateChangedEvent(String target, CircuitState from, CircuitState to,
                                       int failedCalls, Instant at) {
}
