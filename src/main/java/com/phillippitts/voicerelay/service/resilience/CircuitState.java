package com.phillippitts.voicerelay.service.resilience;

/** Circuit breaker states. */
public enum CircuitState {
    /** Calls pass through. */
    CLOSED,
    /** Calls fail immediately without a network attempt. */
    OPEN,
    /** One trial call is allowed. */
    HALF_OPEN
}
