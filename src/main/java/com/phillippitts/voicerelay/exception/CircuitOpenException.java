package com.phillippitts.voicerelay.exception;

/**
 * Local, synthetic failure: the circuit breaker for the target is open (or its half-open
 * trial is already taken), so no network attempt was made.
 */
public class CircuitOpenException extends ExternalServiceException {

    public CircuitOpenException(String target) {
        super("Circuit open", target);
    }

    public CircuitOpenException(String target, Throwable cause) {
        super("Circuit open", target, cause);
    }
}
